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
package be.ugent.lbd.schema;

import be.ugent.lbd.ConfigurationException;
import be.ugent.lbd.model.CollectionKind;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Read-only schema metadata: which attributes are aggregates (LIST, SET,
 * ARRAY), which hold SELECT values, and the supertype chain of every entity.
 * <p>
 * Inherited attributes are flattened once at construction time, a subtype
 * overriding whatever its ancestors declare, so every lookup is a pair of hash
 * probes. Unknown entity types and attributes resolve to
 * {@link CollectionKind#NONE}.
 */
public final class SchemaRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(SchemaRegistry.class);

    private final String schemaName;
    private final Map<String, String> supertypes;
    private final Map<String, Map<String, CollectionKind>> collections;
    private final Map<String, Map<String, String>> selects;

    private SchemaRegistry(String schemaName, Map<String, String> supertypes,
                    Map<String, Map<String, CollectionKind>> directCollections,
                    Map<String, Map<String, String>> directSelects) {
        this.schemaName = schemaName;
        this.supertypes = Collections.unmodifiableMap(new HashMap<>(supertypes));
        this.collections = flatten(directCollections);
        this.selects = flatten(directSelects);
    }

    public static Builder builder(String schemaName) {
        return new Builder(schemaName);
    }

    /**
     * Loads the bundled map for the given schema identifier.
     *
     * @throws ConfigurationException if no map is bundled for the schema
     */
    public static SchemaRegistry forSchema(String schemaName) {
        String resource = SchemaIdentifiers.registryResource(schemaName);
        try (InputStream in = SchemaRegistry.class.getResourceAsStream(resource)) {
            if (in == null) {
                throw new ConfigurationException("Schema resource " + resource + " not found on the classpath");
            }
            SchemaRegistry registry = load(schemaName, in);
            LOG.info("Loaded schema registry {} from {} ({} entity types)", schemaName, resource,
                            registry.collections.size());
            return registry;
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read schema resource " + resource, e);
        }
    }

    /**
     * Reads a map of the form
     * <pre>
     * { "supertypes":  { "IfcWall": "IfcBuiltElement", ... },
     *   "collections": { "IfcPolyline": { "Points": "LIST" }, ... },
     *   "selects":     { "IfcPropertySingleValue": { "NominalValue": "IfcValue" }, ... } }
     * </pre>
     */
    public static SchemaRegistry load(String schemaName, InputStream in) throws IOException {
        JsonNode root = new ObjectMapper().readTree(in);
        Builder builder = builder(schemaName);
        for (Iterator<Map.Entry<String, JsonNode>> it = root.path("supertypes").fields(); it.hasNext();) {
            Map.Entry<String, JsonNode> entry = it.next();
            builder.supertype(entry.getKey(), entry.getValue().asText());
        }
        for (Iterator<Map.Entry<String, JsonNode>> it = root.path("collections").fields(); it.hasNext();) {
            Map.Entry<String, JsonNode> entry = it.next();
            for (Iterator<Map.Entry<String, JsonNode>> attrs = entry.getValue().fields(); attrs.hasNext();) {
                Map.Entry<String, JsonNode> attr = attrs.next();
                CollectionKind kind = CollectionKind.fromKeyword(attr.getValue().asText());
                if (kind == CollectionKind.NONE) {
                    LOG.warn("Ignoring unknown aggregate kind {} for {}.{}", attr.getValue().asText(), entry.getKey(),
                                    attr.getKey());
                    continue;
                }
                builder.collection(entry.getKey(), attr.getKey(), kind);
            }
        }
        for (Iterator<Map.Entry<String, JsonNode>> it = root.path("selects").fields(); it.hasNext();) {
            Map.Entry<String, JsonNode> entry = it.next();
            for (Iterator<Map.Entry<String, JsonNode>> attrs = entry.getValue().fields(); attrs.hasNext();) {
                Map.Entry<String, JsonNode> attr = attrs.next();
                builder.select(entry.getKey(), attr.getKey(), attr.getValue().asText());
            }
        }
        return builder.build();
    }

    public String getSchemaName() {
        return schemaName;
    }

    public CollectionKind collectionKind(String entityType, String attribute) {
        if (entityType == null || attribute == null) {
            return CollectionKind.NONE;
        }
        Map<String, CollectionKind> attrs = collections.get(key(entityType));
        if (attrs == null) {
            return CollectionKind.NONE;
        }
        return attrs.getOrDefault(attribute, CollectionKind.NONE);
    }

    /**
     * @return the SELECT type name of the attribute, or null if it is not a
     *         SELECT attribute
     */
    public String selectType(String entityType, String attribute) {
        if (entityType == null || attribute == null) {
            return null;
        }
        Map<String, String> attrs = selects.get(key(entityType));
        return attrs == null ? null : attrs.get(attribute);
    }

    public boolean isSelectAttribute(String entityType, String attribute) {
        return selectType(entityType, attribute) != null;
    }

    /**
     * @return true if {@code entityType} equals {@code ancestor} or inherits
     *         from it (case insensitive, as EXPRESS names are)
     */
    public boolean isSubtypeOf(String entityType, String ancestor) {
        if (entityType == null || ancestor == null) {
            return false;
        }
        String target = key(ancestor);
        Set<String> seen = new HashSet<>();
        String current = key(entityType);
        while (current != null && seen.add(current)) {
            if (current.equals(target)) {
                return true;
            }
            current = supertypes.get(current);
        }
        return false;
    }

    private <V> Map<String, Map<String, V>> flatten(Map<String, Map<String, V>> direct) {
        Set<String> types = new HashSet<>(direct.keySet());
        types.addAll(supertypes.keySet());
        Map<String, Map<String, V>> result = new HashMap<>();
        for (String type : types) {
            Map<String, V> attrs = new LinkedHashMap<>();
            Set<String> seen = new HashSet<>();
            String current = type;
            while (current != null && seen.add(current)) {
                Map<String, V> own = direct.get(current);
                if (own != null) {
                    for (Map.Entry<String, V> entry : own.entrySet()) {
                        attrs.putIfAbsent(entry.getKey(), entry.getValue());
                    }
                }
                current = supertypes.get(current);
            }
            if (current != null) {
                LOG.warn("Circular supertype chain for {} in schema {}", type, schemaName);
            }
            if (!attrs.isEmpty()) {
                result.put(type, Collections.unmodifiableMap(attrs));
            }
        }
        return Collections.unmodifiableMap(result);
    }

    private static String key(String typeName) {
        return typeName.toLowerCase(Locale.ROOT);
    }

    public static final class Builder {
        private final String schemaName;
        private final Map<String, String> supertypes = new HashMap<>();
        private final Map<String, Map<String, CollectionKind>> collections = new HashMap<>();
        private final Map<String, Map<String, String>> selects = new HashMap<>();

        private Builder(String schemaName) {
            this.schemaName = schemaName;
        }

        public Builder supertype(String entityType, String supertype) {
            supertypes.put(key(entityType), key(supertype));
            return this;
        }

        public Builder collection(String entityType, String attribute, CollectionKind kind) {
            collections.computeIfAbsent(key(entityType), k -> new LinkedHashMap<>()).put(attribute, kind);
            return this;
        }

        public Builder select(String entityType, String attribute, String selectType) {
            selects.computeIfAbsent(key(entityType), k -> new LinkedHashMap<>()).put(attribute, selectType);
            return this;
        }

        public SchemaRegistry build() {
            return new SchemaRegistry(schemaName, supertypes, collections, selects);
        }
    }
}
