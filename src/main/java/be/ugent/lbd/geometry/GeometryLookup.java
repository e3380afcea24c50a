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
package be.ugent.lbd.geometry;

import be.ugent.lbd.model.Entity;

import java.util.Iterator;

/**
 * Source of per-instance geometry for the serializer.
 */
@FunctionalInterface
public interface GeometryLookup {

    /**
     * @param entity a rooted entity (one that carries a GlobalId)
     * @param label  Turtle term that replaces the root of the geometry subgraph
     * @return the rendered triples, empty when the entity has no geometry
     */
    Iterator<SubgraphTriple> lookup(Entity entity, String label);
}
