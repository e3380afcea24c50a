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

/**
 * Turtle object text plus the number of triples it stands for.
 */
public final class EncodedValue {

  private final String text;
  private final long triples;

  public EncodedValue(String text, long triples) {
    this.text = text;
    this.triples = triples;
  }

  public String getText() {
    return text;
  }

  public long getTriples() {
    return triples;
  }

  @Override
  public String toString() {
    return text + " [" + triples + "]";
  }
}
