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

import java.util.Locale;

/**
 * Maps the schema identifier found in a model (FILE_SCHEMA) to the bundled
 * collection-type resource and to the ontology namespace used for the
 * {@code ifc:} prefix.
 */
public final class SchemaIdentifiers {

    public static final String DEFAULT_SCHEMA = "IFC4X3_ADD2";

    private static final String ONTOLOGY_BASE = "https://standards.buildingsmart.org/IFC/DEV/";

    private SchemaIdentifiers() {
    }

    /**
     * @return the classpath location of the collection-type map for the schema
     * @throws ConfigurationException for schemas without a bundled map
     */
    public static String registryResource(String schemaName) {
        String s = normalize(schemaName);
        if (s.contains("4x3")) {
            return "/schemas/ifc4x3_add2.json";
        }
        if (s.contains("ifc4")) {
            return "/schemas/ifc4.json";
        }
        if (s.contains("2x3")) {
            return "/schemas/ifc2x3.json";
        }
        throw new ConfigurationException("Unknown schema: " + schemaName
                        + ". Model should be in IFC4X3_ADD2, IFC4 or IFC2X3 schema.");
    }

    public static String ontologyUri(String schemaName) {
        String s = normalize(schemaName);
        String path;
        if (s.contains("4x3_rc1")) {
            path = "IFC4_3/RC1/";
        } else if (s.contains("4x3")) {
            path = "IFC4_3/ADD2/";
        } else if (s.contains("4x1")) {
            path = "IFC4_1/";
        } else if (s.contains("ifc4_add1")) {
            path = "IFC4/ADD1/";
        } else if (s.contains("ifc4")) {
            path = "IFC4/ADD2_TC1/";
        } else if (s.contains("2x3_final")) {
            path = "IFC2x3/FINAL/";
        } else if (s.contains("2x3")) {
            path = "IFC2x3/TC1/";
        } else {
            throw new ConfigurationException("Unknown schema: " + schemaName);
        }
        return ONTOLOGY_BASE + path + "OWL";
    }

    private static String normalize(String schemaName) {
        if (schemaName == null || schemaName.trim().isEmpty()) {
            throw new ConfigurationException("No schema identifier given");
        }
        return schemaName.trim().toLowerCase(Locale.ROOT);
    }
}
