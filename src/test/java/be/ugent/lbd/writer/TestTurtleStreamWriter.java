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
package be.ugent.lbd.writer;

import be.ugent.lbd.ConfigurationException;
import be.ugent.lbd.EncodingFailureException;
import be.ugent.lbd.geometry.GeometryLookup;
import be.ugent.lbd.geometry.SubgraphTriple;
import be.ugent.lbd.model.AttributeValue;
import be.ugent.lbd.model.CollectionKind;
import be.ugent.lbd.model.Entity;
import be.ugent.lbd.schema.SchemaRegistry;
import be.ugent.lbd.stream.ListEntitySource;
import org.apache.jena.graph.Graph;
import org.apache.jena.riot.Lang;
import org.apache.jena.riot.RDFDataMgr;
import org.apache.jena.sparql.graph.GraphFactory;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

public class TestTurtleStreamWriter {

    private static final String HEADER = "# Turtle TTL output generated by ifc2lbd.\n"
                    + "# Generated on: 2024-01-02T03:04:05\n"
                    + "# baseURI: http://linkedbuildingdata.net/ifc/resources/\n"
                    + "# imports: https://standards.buildingsmart.org/IFC/DEV/IFC4_3/ADD2/OWL#\n"
                    + "\n"
                    + "BASE <http://linkedbuildingdata.net/ifc/resources/>\n"
                    + "PREFIX ifc: <https://standards.buildingsmart.org/IFC/DEV/IFC4_3/ADD2/OWL#>\n"
                    + "PREFIX inst: <http://linkedbuildingdata.net/ifc/resources/>\n"
                    + "PREFIX rdf: <http://www.w3.org/1999/02/22-rdf-syntax-ns#>\n"
                    + "PREFIX xsd: <http://www.w3.org/2001/XMLSchema#>\n"
                    + "PREFIX owl: <http://www.w3.org/2002/07/owl#>\n"
                    + "\n"
                    + "inst:\ta\towl:Ontology ;\n"
                    + "\towl:imports\tifc: .\n\n";

    private SchemaRegistry registry;
    private Clock clock;

    @BeforeEach
    public void setUp() {
        registry = SchemaRegistry.builder("IFC4X3_ADD2")
                        .collection("Wall", "tags", CollectionKind.LIST)
                        .collection("Wall", "members", CollectionKind.SET)
                        .build();
        clock = Clock.fixed(Instant.parse("2024-01-02T03:04:05Z"), ZoneOffset.UTC);
    }

    private ConversionOptions.Builder options() {
        return ConversionOptions.builder().registry(registry).clock(clock);
    }

    private static Entity wall() {
        return Entity.builder(42, "Wall")
                        .attribute("name", AttributeValue.reference(7))
                        .attribute("tags", AttributeValue.collection(
                                        Arrays.asList(AttributeValue.string("A"), AttributeValue.string("B"))))
                        .build();
    }

    private static Entity door() {
        return Entity.builder(9, "Door")
                        .attribute("material", AttributeValue.typed("Label", AttributeValue.string("Oak")))
                        .build();
    }

    private static String write(ConversionOptions options, List<Entity> entities, ConversionMetrics[] metrics)
                    throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ConversionMetrics result = new TurtleStreamWriter(options).write(new ListEntitySource(null, entities), out);
        if (metrics != null) {
            metrics[0] = result;
        }
        return new String(out.toByteArray(), StandardCharsets.UTF_8);
    }

    private static Graph parse(String turtle) {
        Graph graph = GraphFactory.createGraphMem();
        RDFDataMgr.read(graph, new StringReader(turtle), null, Lang.TURTLE);
        return graph;
    }

    @Test
    public void headerOnlyForEmptyStream() throws IOException {
        ConversionMetrics[] metrics = new ConversionMetrics[1];
        String output = write(options().build(), Collections.emptyList(), metrics);
        Assertions.assertEquals(HEADER, output);
        Assertions.assertEquals(0, metrics[0].getEntitiesProcessed());
        Assertions.assertEquals(2, metrics[0].getTriplesWritten());
    }

    @Test
    public void entityBlock() throws IOException {
        ConversionMetrics[] metrics = new ConversionMetrics[1];
        String output = write(options().build(), Collections.singletonList(wall()), metrics);
        Assertions.assertEquals(HEADER
                        + "inst:ref_42 a ifc:Wall ;\n\tifc:name inst:ref_7 ;\n\tifc:tags ( \"A\" \"B\" ) .\n\n", output);
        Assertions.assertEquals(1, metrics[0].getEntitiesProcessed());
        // header 2, type 1, name 1, list 1 + 2 * 2
        Assertions.assertEquals(2 + 7, metrics[0].getTriplesWritten());
    }

    @Test
    public void typedValueStatementFollowsEntity() throws IOException {
        ConversionMetrics[] metrics = new ConversionMetrics[1];
        String output = write(options().build(), Collections.singletonList(door()), metrics);
        Assertions.assertEquals(HEADER
                        + "inst:ref_9 a ifc:Door ;\n\tifc:material inst:ref_9_t1 .\n\n"
                        + "inst:ref_9_t1 ifc:Label \"Oak\" .\n", output);
        Assertions.assertEquals(2 + 3, metrics[0].getTriplesWritten());
    }

    @Test
    public void malformedRecordsAreDroppedUncounted() throws IOException {
        ConversionMetrics[] metrics = new ConversionMetrics[1];
        List<Entity> entities = Arrays.asList(
                        new Entity(0, "Wall", Collections.emptyMap()),
                        new Entity(5, null, Collections.emptyMap()),
                        new Entity(6, "", Collections.emptyMap()),
                        Entity.builder(3, "Slab").build());
        String output = write(options().build(), entities, metrics);
        Assertions.assertEquals(HEADER + "inst:ref_3 a ifc:Slab .\n\n", output);
        Assertions.assertEquals(1, metrics[0].getEntitiesProcessed());
        Assertions.assertEquals(3, metrics[0].getTriplesWritten());
    }

    @Test
    public void outputDoesNotDependOnBufferSize() throws IOException {
        List<Entity> entities = new ArrayList<>();
        for (int i = 1; i <= 25; i++) {
            entities.add(Entity.builder(i, "Wall")
                            .attribute("members", AttributeValue.collection(
                                            Arrays.asList(AttributeValue.reference(i + 100), AttributeValue.reference(i + 200))))
                            .attribute("material", AttributeValue.typed("IfcLabel", AttributeValue.string("m" + i)))
                            .build());
        }
        ConversionMetrics[] small = new ConversionMetrics[1];
        ConversionMetrics[] large = new ConversionMetrics[1];
        String flushedOften = write(options().bufferSize(1).build(), entities, small);
        String flushedOnce = write(options().bufferSize(100000).build(), entities, large);
        Assertions.assertEquals(flushedOnce, flushedOften);
        Assertions.assertEquals(large[0].getTriplesWritten(), small[0].getTriplesWritten());
        Assertions.assertEquals(25, small[0].getEntitiesProcessed());
    }

    @Test
    public void tripleCountMatchesParsedGraph() throws IOException {
        List<Entity> entities = Arrays.asList(
                        wall(),
                        door(),
                        Entity.builder(11, "Wall")
                                        .attribute("GlobalId", AttributeValue.string("2O2Fr$t4X7Zf8NOew3FLOH"))
                                        .attribute("Height", AttributeValue.real(0.584))
                                        .attribute("Count", AttributeValue.integer(3))
                                        .attribute("Flag", AttributeValue.bool(false))
                                        .attribute("Note", AttributeValue.string("say \"hi\"\n"))
                                        .attribute("members", AttributeValue.collection(Collections.emptyList()))
                                        .attribute("related", AttributeValue.collection(Arrays.asList(
                                                        AttributeValue.reference(1), AttributeValue.reference(2))))
                                        .attribute("coords", AttributeValue.collection(Arrays.asList(
                                                        AttributeValue.collection(Arrays.asList(
                                                                        AttributeValue.real(1.0), AttributeValue.real(2.0))),
                                                        AttributeValue.collection(Collections.emptyList()))))
                                        .attribute("values", AttributeValue.typed("IfcMeasureList",
                                                        AttributeValue.collection(Arrays.asList(
                                                                        AttributeValue.typed("IfcLengthMeasure",
                                                                                        AttributeValue.real(1.5)),
                                                                        AttributeValue.integer(2)))))
                                        .build());
        ConversionMetrics[] metrics = new ConversionMetrics[1];
        String output = write(options().build(), entities, metrics);
        Graph graph = parse(output);
        Assertions.assertEquals(graph.size(), metrics[0].getTriplesWritten());
        Assertions.assertEquals(3, metrics[0].getEntitiesProcessed());
    }

    @Test
    public void geometryBlockIsAppendedForRootedEntities() throws IOException {
        GeometryLookup lookup = (entity, label) -> Arrays.asList(
                        new SubgraphTriple(label, "a", "geo:Feature"),
                        new SubgraphTriple(label, "geo:hasGeometry", "inst:geometry_" + entity.getId()),
                        new SubgraphTriple("inst:geometry_" + entity.getId(), "geo:asWKT",
                                        "\"POINT Z(1 2 3)\"^^geo:wktLiteral")).iterator();
        List<Entity> entities = Arrays.asList(
                        Entity.builder(5, "Wall").attribute("GlobalId", AttributeValue.string("0hZ9vA7orCEuf_RLnBEYaO"))
                                        .build(),
                        Entity.builder(6, "CartesianPoint").build());
        ConversionMetrics[] metrics = new ConversionMetrics[1];
        String output = write(options().geometryLookup(lookup).build(), entities, metrics);

        Assertions.assertTrue(output.contains("PREFIX geo: <http://www.opengis.net/ont/geosparql#>\n"));
        Assertions.assertTrue(output.endsWith("inst:ref_5 a ifc:Wall ;\n\tifc:GlobalId \"0hZ9vA7orCEuf_RLnBEYaO\" .\n\n"
                        + "inst:ref_5 a geo:Feature .\n"
                        + "inst:ref_5 geo:hasGeometry inst:geometry_5 .\n"
                        + "inst:geometry_5 geo:asWKT \"POINT Z(1 2 3)\"^^geo:wktLiteral .\n\n"
                        + "inst:ref_6 a ifc:CartesianPoint .\n\n"), output);
        // header 2, wall 2, geometry 3, point 1
        Assertions.assertEquals(8, metrics[0].getTriplesWritten());
        Assertions.assertEquals(8, parse(output).size());
    }

    @Test
    public void failureNamesEntityAndKeepsEarlierOutput() {
        GeometryLookup failing = (entity, label) -> {
            throw new IllegalStateException("kernel exploded");
        };
        List<Entity> entities = Arrays.asList(
                        Entity.builder(1, "Slab").build(),
                        Entity.builder(2, "Wall").attribute("GlobalId", AttributeValue.string("0hZ9vA7orCEuf_RLnBEYaO"))
                                        .build(),
                        Entity.builder(3, "Slab").build());
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        TurtleStreamWriter writer = new TurtleStreamWriter(options().geometryLookup(failing).bufferSize(1).build());
        EncodingFailureException e = Assertions.assertThrows(EncodingFailureException.class,
                        () -> writer.write(new ListEntitySource(null, entities), out));
        Assertions.assertEquals(2, e.getEntityId());
        Assertions.assertTrue(e.getMessage().contains("#2"));
        Assertions.assertTrue(e.getCause() instanceof IllegalStateException);

        String output = new String(out.toByteArray(), StandardCharsets.UTF_8);
        Assertions.assertTrue(output.contains("inst:ref_1 a ifc:Slab"));
        Assertions.assertFalse(output.contains("inst:ref_2 a"));
        Assertions.assertFalse(output.contains("inst:ref_3 a"));
        Assertions.assertEquals(TurtleStreamWriter.State.DONE, writer.getState());
    }

    @Test
    public void unsupportedSchemaFailsBeforeWriting() {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        TurtleStreamWriter writer = new TurtleStreamWriter(ConversionOptions.builder().clock(clock).build());
        Assertions.assertThrows(ConfigurationException.class,
                        () -> writer.write(new ListEntitySource("IFC9", Collections.singletonList(wall())), out));
        Assertions.assertEquals(0, out.size());
    }

    @Test
    public void declaredSchemaSelectsOntology() throws IOException {
        String output = write(ConversionOptions.builder().clock(clock).build(), Collections.emptyList(), null);
        Assertions.assertTrue(output.contains("PREFIX ifc: <https://standards.buildingsmart.org/IFC/DEV/IFC4_3/ADD2/OWL#>"));

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        new TurtleStreamWriter(ConversionOptions.builder().clock(clock).build())
                        .write(new ListEntitySource("IFC2X3", Collections.emptyList()), out);
        String ifc2x3 = new String(out.toByteArray(), StandardCharsets.UTF_8);
        Assertions.assertTrue(ifc2x3.contains("PREFIX ifc: <https://standards.buildingsmart.org/IFC/DEV/IFC2x3/TC1/OWL#>"),
                        ifc2x3);
    }

    @Test
    public void writerConvertsOneStreamOnly() throws IOException {
        TurtleStreamWriter writer = new TurtleStreamWriter(options().build());
        Assertions.assertEquals(TurtleStreamWriter.State.HEADER_PENDING, writer.getState());
        writer.write(new ListEntitySource(null, Collections.emptyList()), new ByteArrayOutputStream());
        Assertions.assertEquals(TurtleStreamWriter.State.DONE, writer.getState());
        Assertions.assertThrows(IllegalStateException.class,
                        () -> writer.write(new ListEntitySource(null, Collections.emptyList()), new ByteArrayOutputStream()));
    }
}
