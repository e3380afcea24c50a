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

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Random-access view of a loaded model, as needed by the geometry pass.
 * References are depth-1: the ids an entity points at directly, through any
 * attribute, aggregate member or typed value.
 */
public interface EntityModel {

    Optional<Entity> get(long id);

    boolean contains(long id);

    /**
     * @return all entities, in model order
     */
    Collection<Entity> entities();

    /**
     * @return the entities of the given type or one of its subtypes
     */
    List<Entity> byType(String type);

    /**
     * @return ids of the existing entities the given entity references
     */
    Set<Long> references(long id);

    /**
     * @return ids of the existing entities referenced through one attribute
     */
    Set<Long> attributeReferences(long id, String attribute);

    /**
     * @return ids of the entities that reference the given entity
     */
    Set<Long> referencedBy(long id);

    /**
     * Unsets one attribute of an entity.
     */
    void clearAttribute(long id, String attribute);

    /**
     * Removes an entity. References to it held by other entities are unset,
     * or dropped from the aggregates that contain them.
     */
    void remove(long id);
}
