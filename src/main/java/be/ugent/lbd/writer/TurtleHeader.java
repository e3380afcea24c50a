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

import java.time.LocalDateTime;
import java.util.Map;

/**
 * Header of every output file: comments, BASE and PREFIX directives and the
 * ontology declaration of the instance namespace.
 */
public final class TurtleHeader {

  /** inst: a owl:Ontology and inst: owl:imports ifc: */
  public static final long TRIPLES = 2;

  private TurtleHeader() {
  }

  public static String render(Namespaces namespaces, LocalDateTime generatedOn) {
    StringBuilder sb = new StringBuilder();
    sb.append("# Turtle TTL output generated by ifc2lbd.\n");
    sb.append("# Generated on: ").append(generatedOn).append('\n');
    sb.append("# baseURI: ").append(namespaces.getBase()).append('\n');
    sb.append("# imports: ").append(namespaces.get(Namespaces.IFC)).append('\n');
    sb.append('\n');
    sb.append("BASE <").append(namespaces.getBase()).append(">\n");
    for (Map.Entry<String, String> entry : namespaces.asMap().entrySet()) {
      if (!Namespaces.BASE.equals(entry.getKey())) {
        sb.append("PREFIX ").append(entry.getKey()).append(": <").append(entry.getValue()).append(">\n");
      }
    }
    sb.append('\n');
    sb.append("inst:\ta\towl:Ontology ;\n");
    sb.append("\towl:imports\tifc: .\n\n");
    return sb.toString();
  }
}
