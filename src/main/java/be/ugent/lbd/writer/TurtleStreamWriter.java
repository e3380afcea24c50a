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

import be.ugent.lbd.EncodingFailureException;
import be.ugent.lbd.geometry.GeometryLookup;
import be.ugent.lbd.geometry.SubgraphTriple;
import be.ugent.lbd.model.AttributeValue;
import be.ugent.lbd.model.Entity;
import be.ugent.lbd.schema.SchemaRegistry;
import be.ugent.lbd.stream.EntitySource;
import org.apache.commons.lang3.time.StopWatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.util.Iterator;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Writes an entity stream as Turtle in a single pass, without building an RDF
 * model. Every entity becomes one subject block followed by the statements of
 * its typed values and, when a geometry lookup is configured, by its geometry
 * subgraph.
 * <p>
 * Blocks are collected in memory and written out every
 * {@link ConversionOptions#getBufferSize()} entities. The bytes written do not
 * depend on the buffer size.
 * <p>
 * A writer converts one stream only.
 */
public class TurtleStreamWriter {

  private static final Logger LOG = LoggerFactory.getLogger(TurtleStreamWriter.class);

  private static final String MODEL_PREFIX = "ifc:";
  private static final String INSTANCE_PREFIX = "inst:";

  enum State {
    HEADER_PENDING, STREAMING, DONE
  }

  private final ConversionOptions options;
  private State state = State.HEADER_PENDING;

  public TurtleStreamWriter(ConversionOptions options) {
    this.options = options;
  }

  State getState() {
    return state;
  }

  /**
   * Converts the whole source. The output stream is flushed, not closed.
   *
   * @throws be.ugent.lbd.ConfigurationException if the declared schema is not
   *           supported, before anything is written
   * @throws EncodingFailureException if an entity cannot be encoded; the
   *           entities before it have been written
   */
  public ConversionMetrics write(EntitySource source, OutputStream out) throws IOException {
    if (state != State.HEADER_PENDING) {
      throw new IllegalStateException("This writer has already been used");
    }
    String schemaName = source.getSchemaName().orElse(options.getDefaultSchema());
    SchemaRegistry registry = options.getRegistry().orElseGet(() -> SchemaRegistry.forSchema(schemaName));
    Namespaces namespaces = resolveNamespaces(schemaName);
    ValueEncoder encoder = new ValueEncoder(registry, MODEL_PREFIX, INSTANCE_PREFIX, options.getFloatFormat(),
                    options.getConverter());
    GeometryLookup geometry = options.getGeometryLookup().orElse(null);

    LOG.info("Writing {} with converter {} ({} floats)", schemaName, options.getConverter().getName(),
                    options.getFloatFormat());
    StopWatch stopWatch = StopWatch.createStarted();

    Writer writer = new BufferedWriter(new OutputStreamWriter(out, StandardCharsets.UTF_8));
    writer.write(TurtleHeader.render(namespaces, LocalDateTime.now(options.getClock())));
    long triples = TurtleHeader.TRIPLES;
    long entities = 0;
    state = State.STREAMING;

    StringBuilder buffer = new StringBuilder();
    int buffered = 0;
    try {
      while (source.hasNext()) {
        Entity entity = source.next();
        if (!entity.isWellFormed()) {
          LOG.debug("Dropping malformed record {}", entity);
          continue;
        }
        StringBuilder block = new StringBuilder();
        try {
          triples += encodeEntity(entity, encoder, geometry, block);
        } catch (RuntimeException e) {
          writer.write(buffer.toString());
          writer.flush();
          state = State.DONE;
          LOG.error("Error encoding entity #{} ({})", entity.getId(), entity.getType(), e);
          throw new EncodingFailureException(entity.getId(), e);
        }
        buffer.append(block);
        entities++;
        if (++buffered >= options.getBufferSize()) {
          writer.write(buffer.toString());
          buffer.setLength(0);
          buffered = 0;
          if (LOG.isDebugEnabled()) {
            LOG.debug("flushed: {} entities, {} triples", entities, triples);
          }
        }
      }
      writer.write(buffer.toString());
      writer.flush();
    } finally {
      state = State.DONE;
    }

    stopWatch.stop();
    double seconds = stopWatch.getTime(TimeUnit.NANOSECONDS) / 1e9;
    LOG.info("Done writing {} entities, {} triples in {}", entities, triples, stopWatch);
    return new ConversionMetrics(entities, triples, seconds);
  }

  private Namespaces resolveNamespaces(String schemaName) {
    Namespaces namespaces = options.getNamespaces()
                    .orElseGet(() -> Namespaces.forSchema(schemaName, options.getBaseUri()));
    if (options.getGeometryLookup().isPresent() && !namespaces.contains(Namespaces.GEO)) {
      namespaces = namespaces.toBuilder().prefix(Namespaces.GEO, Namespaces.GEO_URI).build();
    }
    return namespaces;
  }

  /**
   * @return the number of triples appended to the block
   */
  private long encodeEntity(Entity entity, ValueEncoder encoder, GeometryLookup geometry, StringBuilder block) {
    String subject = encoder.referenceIri(entity.getId());
    EntityEncodingContext context = new EntityEncodingContext(entity.getId(), INSTANCE_PREFIX);

    block.append(subject).append(" a ").append(MODEL_PREFIX).append(entity.getType());
    long triples = 1;
    for (Map.Entry<String, AttributeValue> attribute : entity.getAttributes().entrySet()) {
      EncodedValue value = encoder.encodeAttribute(context, entity.getType(), attribute.getKey(),
                      attribute.getValue());
      block.append(" ;\n\t").append(MODEL_PREFIX).append(attribute.getKey()).append(' ').append(value.getText());
      triples += value.getTriples();
    }
    block.append(" .\n\n");

    context.appendStatements(block);
    triples += context.getTriples();

    if (geometry != null && entity.getGlobalId().isPresent()) {
      long geometryTriples = 0;
      Iterator<SubgraphTriple> it = geometry.lookup(entity, subject);
      while (it.hasNext()) {
        block.append(it.next().toTurtle());
        geometryTriples++;
      }
      if (geometryTriples > 0) {
        block.append('\n');
        if (LOG.isTraceEnabled()) {
          LOG.trace("{} geometry triples for {}", geometryTriples, subject);
        }
      }
      triples += geometryTriples;
    }
    return triples;
  }
}
