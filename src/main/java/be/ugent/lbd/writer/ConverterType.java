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

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * The streaming converters that can be selected on the command line. They
 * share the encoding rules and differ only in how an aggregate is written when
 * the schema does not say whether it is a SET or a LIST.
 */
public enum ConverterType {
  /** unresolved aggregates holding only references are written as sets */
  MINI_IFCOWL_COMPLETE("mini_ifcowl_complete", true),
  /** unresolved aggregates are always written as ordered lists */
  MINI_IFCOWL_COMPLETE2("mini_ifcowl_complete2", false);

  private final String name;
  private final boolean referenceSetHeuristic;

  ConverterType(String name, boolean referenceSetHeuristic) {
    this.name = name;
    this.referenceSetHeuristic = referenceSetHeuristic;
  }

  public String getName() {
    return name;
  }

  public boolean usesReferenceSetHeuristic() {
    return referenceSetHeuristic;
  }

  public static ConverterType fromName(String name) {
    for (ConverterType type : values()) {
      if (type.name.equalsIgnoreCase(name)) {
        return type;
      }
    }
    throw new ConfigurationException("Unknown converter '" + name + "'. Available: "
                    + Arrays.stream(values()).map(ConverterType::getName).collect(Collectors.joining(", ")));
  }
}
