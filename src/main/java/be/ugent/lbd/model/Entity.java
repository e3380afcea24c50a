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
package be.ugent.lbd.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * One model instance as delivered by an entity stream: the STEP id, the
 * entity type name and the attributes in delivery order. Attributes with a
 * null value are never stored.
 */
public final class Entity {

    public static final String GLOBAL_ID = "GlobalId";

    private final long id;
    private final String type;
    private final Map<String, AttributeValue> attributes;

    public Entity(long id, String type, Map<String, AttributeValue> attributes) {
        this.id = id;
        this.type = type;
        Map<String, AttributeValue> copy = new LinkedHashMap<>();
        if (attributes != null) {
            for (Map.Entry<String, AttributeValue> entry : attributes.entrySet()) {
                if (entry.getValue() != null) {
                    copy.put(entry.getKey(), entry.getValue());
                }
            }
        }
        this.attributes = Collections.unmodifiableMap(copy);
    }

    public static Builder builder(long id, String type) {
        return new Builder(id, type);
    }

    public long getId() {
        return id;
    }

    public String getType() {
        return type;
    }

    public Map<String, AttributeValue> getAttributes() {
        return attributes;
    }

    public AttributeValue getAttribute(String name) {
        return attributes.get(name);
    }

    /**
     * A stream record is only usable with a positive id and a type name.
     */
    public boolean isWellFormed() {
        return id > 0 && type != null && !type.isEmpty();
    }

    /**
     * @return the compressed GUID of rooted entities, empty for everything else
     */
    public Optional<String> getGlobalId() {
        AttributeValue value = attributes.get(GLOBAL_ID);
        if (value instanceof AttributeValue.Literal
                        && ((AttributeValue.Literal) value).getKind() == AttributeValue.LiteralKind.STRING) {
            return Optional.of(((AttributeValue.Literal) value).stringValue());
        }
        return Optional.empty();
    }

    public Entity withoutAttribute(String name) {
        if (!attributes.containsKey(name)) {
            return this;
        }
        Map<String, AttributeValue> copy = new LinkedHashMap<>(attributes);
        copy.remove(name);
        return new Entity(id, type, copy);
    }

    @Override
    public String toString() {
        return "#" + id + "=" + type + attributes;
    }

    public static final class Builder {
        private final long id;
        private final String type;
        private final Map<String, AttributeValue> attributes = new LinkedHashMap<>();

        private Builder(long id, String type) {
            this.id = id;
            this.type = type;
        }

        public Builder attribute(String name, AttributeValue value) {
            attributes.put(name, value);
            return this;
        }

        public Entity build() {
            return new Entity(id, type, attributes);
        }
    }
}
