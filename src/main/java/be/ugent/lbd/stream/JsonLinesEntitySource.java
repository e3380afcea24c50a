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
package be.ugent.lbd.stream;

import be.ugent.lbd.model.Entity;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.NoSuchElementException;
import java.util.Optional;

/**
 * Reads one entity record per line, e.g.
 * <pre>
 * {"schema": "IFC4X3_ADD2"}
 * {"id": 42, "type": "IfcWall", "Name": "Wall-001", "OwnerHistory": {"ref": 7}}
 * </pre>
 * An optional first line holding only a {@code schema} member declares the
 * schema of the stream. Records are parsed lazily, one line at a time. Lines
 * that are not valid JSON objects are skipped.
 */
public class JsonLinesEntitySource implements EntitySource {

    private static final Logger LOG = LoggerFactory.getLogger(JsonLinesEntitySource.class);

    static final String SCHEMA = "schema";

    private final BufferedReader reader;
    private final ObjectMapper mapper = new ObjectMapper();
    private final AttributeValueParser parser = new AttributeValueParser();
    private String schemaName;
    private Entity next;
    private long lineCount = 0;
    private boolean headerChecked = false;
    private boolean exhausted = false;

    public JsonLinesEntitySource(InputStream in) {
        this.reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
    }

    @Override
    public Optional<String> getSchemaName() {
        if (!headerChecked) {
            advance();
        }
        return Optional.ofNullable(schemaName);
    }

    @Override
    public boolean hasNext() {
        if (next == null && !exhausted) {
            advance();
        }
        return next != null;
    }

    @Override
    public Entity next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        Entity result = next;
        next = null;
        return result;
    }

    private void advance() {
        try {
            String line;
            while ((line = reader.readLine()) != null) {
                lineCount++;
                if (lineCount % 10000 == 0) {
                    LOG.debug("read: {} lines", lineCount);
                }
                if (line.trim().isEmpty()) {
                    continue;
                }
                JsonNode record;
                try {
                    record = mapper.readTree(line);
                } catch (JsonProcessingException e) {
                    LOG.warn("Skipping line {}: not a JSON record ({})", lineCount, e.getOriginalMessage());
                    continue;
                }
                if (record == null || !record.isObject()) {
                    LOG.warn("Skipping line {}: not a JSON object", lineCount);
                    continue;
                }
                if (!headerChecked) {
                    headerChecked = true;
                    if (record.has(SCHEMA) && !record.has(AttributeValueParser.ID)) {
                        schemaName = record.get(SCHEMA).asText();
                        LOG.info("Stream declares schema {}", schemaName);
                        continue;
                    }
                }
                next = parser.parseRecord(record);
                return;
            }
            headerChecked = true;
            exhausted = true;
            LOG.debug("done reading after {} lines", lineCount);
        } catch (IOException e) {
            throw new UncheckedIOException("Error reading entity stream at line " + lineCount, e);
        }
    }

    @Override
    public void close() throws IOException {
        reader.close();
    }
}
