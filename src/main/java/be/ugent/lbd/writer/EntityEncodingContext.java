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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Per-entity state of the encoder: the typed-value counter and the auxiliary
 * statements for typed values, which are written right after the entity's own
 * block. A context lives for one entity only.
 */
public final class EntityEncodingContext {

  private final long entityId;
  private final String instancePrefix;
  private final List<String> statements = new ArrayList<>();
  private long triples = 0;

  public EntityEncodingContext(long entityId, String instancePrefix) {
    this.entityId = entityId;
    this.instancePrefix = instancePrefix;
  }

  public long getEntityId() {
    return entityId;
  }

  /**
   * Reserves the next typed-value slot. Slots are numbered from 1 in the
   * order they are reserved, so an outer typed value keeps a lower number than
   * the typed values nested in it.
   */
  int reserve() {
    statements.add(null);
    return statements.size();
  }

  String typedValueIri(int slot) {
    return instancePrefix + "ref_" + entityId + "_t" + slot;
  }

  void complete(int slot, String statement, long statementTriples) {
    statements.set(slot - 1, statement);
    triples += statementTriples;
  }

  public int getTypedValueCount() {
    return statements.size();
  }

  public List<String> getStatements() {
    return Collections.unmodifiableList(statements);
  }

  /**
   * @return triples in the auxiliary statements
   */
  public long getTriples() {
    return triples;
  }

  void appendStatements(StringBuilder out) {
    for (String statement : statements) {
      out.append(statement);
    }
  }
}
