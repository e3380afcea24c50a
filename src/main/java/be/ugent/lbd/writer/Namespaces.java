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
import be.ugent.lbd.schema.SchemaIdentifiers;
import org.apache.jena.riot.system.PrefixMap;
import org.apache.jena.riot.system.PrefixMapFactory;
import org.apache.jena.vocabulary.OWL;
import org.apache.jena.vocabulary.RDF;
import org.apache.jena.vocabulary.XSD;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Insertion-ordered prefix table of an output file. The {@value #BASE} entry
 * holds the base IRI and is written as a BASE directive instead of a prefix.
 */
public final class Namespaces {

  public static final String BASE = "BASE";
  public static final String IFC = "ifc";
  public static final String INST = "inst";
  public static final String GEO = "geo";
  public static final String GEO_URI = "http://www.opengis.net/ont/geosparql#";

  private static final String[] REQUIRED = {INST, IFC, "xsd", "owl"};

  private final Map<String, String> table;

  private Namespaces(Map<String, String> table) {
    this.table = Collections.unmodifiableMap(new LinkedHashMap<>(table));
  }

  /**
   * The default table: BASE, ifc (schema dependent), inst, rdf, xsd, owl.
   */
  public static Namespaces forSchema(String schemaName, String baseUri) {
    return builder()
                    .base(baseUri)
                    .prefix(IFC, SchemaIdentifiers.ontologyUri(schemaName) + "#")
                    .prefix(INST, baseUri)
                    .prefix("rdf", RDF.getURI())
                    .prefix("xsd", XSD.getURI())
                    .prefix("owl", OWL.getURI())
                    .build();
  }

  public static Builder builder() {
    return new Builder();
  }

  public Builder toBuilder() {
    Builder builder = new Builder();
    builder.table.putAll(table);
    return builder;
  }

  public String getBase() {
    return table.get(BASE);
  }

  public String get(String prefix) {
    return table.get(prefix);
  }

  public boolean contains(String prefix) {
    return table.containsKey(prefix);
  }

  /**
   * @return all entries including BASE, in insertion order
   */
  public Map<String, String> asMap() {
    return table;
  }

  /**
   * @return the prefixes without BASE, in insertion order
   */
  public Map<String, String> prefixes() {
    Map<String, String> prefixes = new LinkedHashMap<>(table);
    prefixes.remove(BASE);
    return prefixes;
  }

  /**
   * @return the prefixes without BASE, as a Jena prefix map
   */
  public PrefixMap toPrefixMap() {
    return PrefixMapFactory.create(prefixes());
  }

  @Override
  public String toString() {
    return table.toString();
  }

  public static final class Builder {
    private final Map<String, String> table = new LinkedHashMap<>();

    private Builder() {
    }

    public Builder base(String baseUri) {
      table.put(BASE, baseUri);
      return this;
    }

    public Builder prefix(String prefix, String uri) {
      table.put(prefix, uri);
      return this;
    }

    public Namespaces build() {
      if (!table.containsKey(BASE)) {
        throw new ConfigurationException("Namespace table has no BASE entry");
      }
      for (String prefix : REQUIRED) {
        if (!table.containsKey(prefix)) {
          throw new ConfigurationException("Namespace table has no '" + prefix + "' prefix");
        }
      }
      return new Namespaces(table);
    }
  }
}
