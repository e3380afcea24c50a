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

import be.ugent.lbd.model.AttributeValue;
import be.ugent.lbd.model.Entity;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns the JSON shape of a stream record into an {@link Entity}. Values are
 * classified once here: {@code {"ref": id}} is a reference,
 * {@code {"type": name, "value": v}} a typed value, arrays are collections of
 * unknown kind and scalars are literals. Anything else is unsupported and is
 * left out of the entity.
 */
public class AttributeValueParser {

    private static final Logger LOG = LoggerFactory.getLogger(AttributeValueParser.class);

    static final String ID = "id";
    static final String TYPE = "type";
    static final String REF = "ref";
    static final String VALUE = "value";

    public Entity parseRecord(JsonNode record) {
        long id = record.path(ID).isIntegralNumber() ? record.path(ID).asLong() : 0L;
        JsonNode typeNode = record.path(TYPE);
        String type = typeNode.isTextual() ? typeNode.asText() : null;

        Map<String, AttributeValue> attributes = new LinkedHashMap<>();
        for (Iterator<Map.Entry<String, JsonNode>> it = record.fields(); it.hasNext();) {
            Map.Entry<String, JsonNode> field = it.next();
            String name = field.getKey();
            if (ID.equals(name) || TYPE.equals(name)) {
                continue;
            }
            AttributeValue value = parseValue(field.getValue());
            if (value != null) {
                attributes.put(name, value);
            } else if (LOG.isDebugEnabled() && !field.getValue().isNull()) {
                LOG.debug("Skipping attribute {} of #{} with unsupported shape: {}", name, id, field.getValue());
            }
        }
        return new Entity(id, type, attributes);
    }

    /**
     * @return the parsed value, or null for JSON null and unsupported shapes
     */
    public AttributeValue parseValue(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isTextual()) {
            return AttributeValue.string(node.asText());
        }
        if (node.isBoolean()) {
            return AttributeValue.bool(node.asBoolean());
        }
        if (node.isIntegralNumber()) {
            if (!node.canConvertToLong()) {
                LOG.warn("Integer value {} does not fit in 64 bits, keeping it as a string", node);
                return AttributeValue.string(node.asText());
            }
            return AttributeValue.integer(node.asLong());
        }
        if (node.isNumber()) {
            return AttributeValue.real(node.asDouble());
        }
        if (node.isArray()) {
            List<AttributeValue> items = new ArrayList<>(node.size());
            for (JsonNode item : node) {
                AttributeValue parsed = parseValue(item);
                if (parsed != null) {
                    items.add(parsed);
                } else if (LOG.isDebugEnabled()) {
                    LOG.debug("Dropping collection member with unsupported shape: {}", item);
                }
            }
            return AttributeValue.collection(items);
        }
        if (node.isObject()) {
            JsonNode ref = node.get(REF);
            if (ref != null && ref.isIntegralNumber() && ref.asLong() > 0) {
                return AttributeValue.reference(ref.asLong());
            }
            JsonNode type = node.get(TYPE);
            if (type != null && type.isTextual() && node.has(VALUE)) {
                AttributeValue inner = parseValue(node.get(VALUE));
                return inner == null ? null : AttributeValue.typed(type.asText(), inner);
            }
        }
        return null;
    }
}
