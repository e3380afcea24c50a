/*
 * 
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 * 
 *     http://www.apache.org/licenses/LICENSE-2.0
 * 
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package be.ugent.lbd;

import be.ugent.lbd.geometry.GeometryDependencyResolver;
import be.ugent.lbd.geometry.GeometryProcessor;
import be.ugent.lbd.geometry.GeometrySubgraphExtractor;
import be.ugent.lbd.geometry.InMemoryEntityModel;
import be.ugent.lbd.geometry.PrecomputedGeometryKernel;
import be.ugent.lbd.schema.SchemaIdentifiers;
import be.ugent.lbd.schema.SchemaRegistry;
import be.ugent.lbd.stream.EntitySource;
import be.ugent.lbd.stream.JsonLinesEntitySource;
import be.ugent.lbd.stream.ListEntitySource;
import be.ugent.lbd.writer.ConversionMetrics;
import be.ugent.lbd.writer.ConversionOptions;
import be.ugent.lbd.writer.ConverterType;
import be.ugent.lbd.writer.FloatFormat;
import be.ugent.lbd.writer.Namespaces;
import be.ugent.lbd.writer.TurtleStreamWriter;
import org.apache.commons.lang3.time.StopWatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeUnit;

/**
 * Command line entry point. Converts JSON-lines entity streams to Turtle, one
 * file or a whole directory at a time. Run it without arguments for the
 * usage.
 */
public class IfcToLbdConverter {

    private static final Logger LOG = LoggerFactory.getLogger(IfcToLbdConverter.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    private static final String USAGE = "Usage:\n"
                    + "    IfcToLbdConverter [options] <input_file> <output_file>\n"
                    + "    IfcToLbdConverter [options] --dir <directory>\n"
                    + "Options:\n"
                    + "    --baseURI <uri>            base IRI of the instances\n"
                    + "    --converter <name>         mini_ifcowl_complete (default) or mini_ifcowl_complete2\n"
                    + "    --buffer-size <n>          entities per write (default 100000)\n"
                    + "    --float-format <mode>      scientific (default) or plain\n"
                    + "    --plain-floats             same as --float-format plain\n"
                    + "    --geometry <file.ttl>      geometry buffer to merge per product\n"
                    + "    --prune-geometry           leave out entities that only describe geometry\n"
                    + "    --benchmark                print counts and timings\n";

    private String baseUri = ConversionOptions.DEFAULT_BASE_URI;
    private ConverterType converter = ConverterType.MINI_IFCOWL_COMPLETE;
    private FloatFormat floatFormat = FloatFormat.SCIENTIFIC;
    private int bufferSize = ConversionOptions.DEFAULT_BUFFER_SIZE;
    private Path geometryFile;
    private boolean pruneGeometry = false;
    private boolean benchmark = false;

    public static void main(String[] args) {
        System.exit(new IfcToLbdConverter().run(args));
    }

    /**
     * @return the process exit code
     */
    public int run(String[] args) {
        List<String> positional = new ArrayList<>();
        String directory = null;
        try {
            for (int i = 0; i < args.length; i++) {
                switch (args[i]) {
                    case "--baseURI":
                        baseUri = value(args, ++i);
                        break;
                    case "--dir":
                        directory = value(args, ++i);
                        break;
                    case "--converter":
                        converter = ConverterType.fromName(value(args, ++i));
                        break;
                    case "--buffer-size":
                        bufferSize = parseBufferSize(value(args, ++i));
                        break;
                    case "--float-format":
                        floatFormat = FloatFormat.fromName(value(args, ++i));
                        break;
                    case "--plain-floats":
                        floatFormat = FloatFormat.PLAIN;
                        break;
                    case "--geometry":
                        geometryFile = Paths.get(value(args, ++i));
                        break;
                    case "--prune-geometry":
                        pruneGeometry = true;
                        break;
                    case "--benchmark":
                        benchmark = true;
                        break;
                    default:
                        if (args[i].startsWith("--")) {
                            throw new ConfigurationException("Unknown option " + args[i]);
                        }
                        positional.add(args[i]);
                }
            }
        } catch (ConfigurationException e) {
            LOG.error(e.getMessage());
            LOG.info(USAGE);
            return EXIT_USAGE;
        }

        final List<String> inputFiles = new ArrayList<>();
        final List<String> outputFiles = new ArrayList<>();
        if (directory != null && positional.isEmpty()) {
            for (String file : showFiles(directory)) {
                if (isEntityStream(file)) {
                    inputFiles.add(file);
                    outputFiles.add(Utils.turtleFileName(file));
                }
            }
            if (inputFiles.isEmpty()) {
                LOG.warn("No .jsonl or .ndjson files found in {}", directory);
            }
        } else if (directory == null && positional.size() == 2) {
            inputFiles.add(positional.get(0));
            outputFiles.add(positional.get(1));
        } else {
            LOG.info(USAGE);
            return EXIT_USAGE;
        }

        for (int i = 0; i < inputFiles.size(); ++i) {
            String inputFile = inputFiles.get(i);
            String outputFile = outputFiles.get(i);
            LOG.info("Converting file: {}", inputFile);
            try {
                ConversionMetrics metrics = convert(Paths.get(inputFile), Paths.get(outputFile));
                LOG.info("Wrote {} ({})", outputFile, Utils.humanReadableByteCountSI(new File(outputFile).length()));
                if (benchmark) {
                    printBenchmark(inputFile, metrics);
                }
            } catch (EncodingFailureException e) {
                LOG.error("Conversion of {} failed at entity #{}: {}", inputFile, e.getEntityId(),
                                e.getCause() == null ? e.getMessage() : e.getCause().toString());
                return EXIT_FAILURE;
            } catch (ConfigurationException e) {
                LOG.error("Cannot convert {}: {}", inputFile, e.getMessage());
                return EXIT_FAILURE;
            } catch (IOException | UncheckedIOException e) {
                LOG.error("I/O error converting {}: {}", inputFile, e.getMessage());
                return EXIT_FAILURE;
            }
        }
        return EXIT_OK;
    }

    /**
     * Converts one entity stream. With geometry pruning the whole stream is
     * loaded first; otherwise it is converted while it is read.
     */
    public ConversionMetrics convert(Path input, Path output) throws IOException {
        StopWatch total = StopWatch.createStarted();
        StopWatch load = StopWatch.createStarted();
        ConversionOptions.Builder options = ConversionOptions.builder()
                        .converter(converter)
                        .floatFormat(floatFormat)
                        .bufferSize(bufferSize)
                        .baseUri(baseUri);

        try (InputStream in = Files.newInputStream(input);
                        EntitySource stream = new JsonLinesEntitySource(in)) {
            String schemaName = stream.getSchemaName().orElse(SchemaIdentifiers.DEFAULT_SCHEMA);
            SchemaRegistry registry = SchemaRegistry.forSchema(schemaName);
            options.registry(registry);

            EntitySource source = stream;
            GeometrySubgraphExtractor extractor = null;
            if (pruneGeometry) {
                InMemoryEntityModel model = InMemoryEntityModel.load(registry, stream);
                LOG.info("Loaded {} entities from {}", model.size(), input);
                if (geometryFile != null) {
                    GeometryProcessor processor = new GeometryProcessor(model,
                                    new PrecomputedGeometryKernel(geometryFile));
                    extractor = processor.process(baseUri);
                    processor.removeObsoleteInstances();
                } else {
                    GeometryDependencyResolver resolver = new GeometryDependencyResolver(model);
                    resolver.prune(resolver.resolve());
                }
                source = new ListEntitySource(schemaName, model.entities());
            } else if (geometryFile != null) {
                extractor = GeometrySubgraphExtractor.fromTurtle(
                                new String(Files.readAllBytes(geometryFile), StandardCharsets.UTF_8));
            }
            if (extractor != null) {
                Namespaces namespaces = Namespaces.forSchema(schemaName, baseUri).toBuilder()
                                .prefix(Namespaces.GEO, Namespaces.GEO_URI)
                                .build();
                options.namespaces(namespaces).geometryLookup(extractor.asLookup(namespaces.prefixes()));
            }
            load.stop();

            ConversionMetrics metrics;
            try (OutputStream out = Files.newOutputStream(output)) {
                metrics = new TurtleStreamWriter(options.build()).write(source, out);
            }
            total.stop();
            return metrics.withTimings(seconds(load), seconds(total));
        }
    }

    private static double seconds(StopWatch stopWatch) {
        return stopWatch.getTime(TimeUnit.NANOSECONDS) / 1e9;
    }

    private static void printBenchmark(String inputFile, ConversionMetrics metrics) {
        LOG.info(String.format(Locale.ROOT,
                        "%s%n  entities processed: %d%n  triples written:    %d%n  load:  %.3fs%n  write: %.3fs%n"
                                        + "  total: %.3fs%n  throughput: %.0f triples/s",
                        inputFile, metrics.getEntitiesProcessed(), metrics.getTriplesWritten(),
                        metrics.getLoadSeconds(), metrics.getWriteSeconds(), metrics.getTotalSeconds(),
                        metrics.getThroughput()));
    }

    private static String value(String[] args, int i) {
        if (i >= args.length) {
            throw new ConfigurationException("Missing value for " + args[i - 1]);
        }
        return args[i];
    }

    private static int parseBufferSize(String value) {
        try {
            int size = Integer.parseInt(value);
            if (size < 1) {
                throw new ConfigurationException("Buffer size must be positive, got " + value);
            }
            return size;
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Buffer size is not a number: " + value, e);
        }
    }

    static boolean isEntityStream(String file) {
        return file.endsWith(".jsonl") || file.endsWith(".ndjson");
    }

    /**
     * List all files in a particular directory, recursively.
     *
     * @param dir the input directory
     * @return absolute paths of the files
     */
    public static List<String> showFiles(String dir) {
        List<String> goodFiles = new ArrayList<>();
        File[] listOfFiles = new File(dir).listFiles();
        if (listOfFiles == null) {
            LOG.warn("{} is not a readable directory", dir);
            return goodFiles;
        }
        Arrays.sort(listOfFiles);
        for (File file : listOfFiles) {
            if (file.isFile()) {
                goodFiles.add(file.getAbsolutePath());
            } else if (file.isDirectory()) {
                goodFiles.addAll(showFiles(file.getAbsolutePath()));
            }
        }
        return goodFiles;
    }
}
