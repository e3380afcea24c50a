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

import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * Outcome of {@link GeometryDependencyResolver#resolve()}: the geometry-only
 * entities, their dependencies-first order, the entities that can be removed
 * and the anchor attributes that have to be unset before they are.
 */
public final class GeometryResolution {

    private final Set<Long> geometry;
    private final List<Long> order;
    private final List<Long> obsolete;
    private final List<AnchorLink> anchors;
    private final List<List<Long>> cycles;

    GeometryResolution(Set<Long> geometry, List<Long> order, List<Long> obsolete, List<AnchorLink> anchors,
                    List<List<Long>> cycles) {
        this.geometry = Collections.unmodifiableSet(geometry);
        this.order = Collections.unmodifiableList(order);
        this.obsolete = Collections.unmodifiableList(obsolete);
        this.anchors = Collections.unmodifiableList(anchors);
        this.cycles = Collections.unmodifiableList(cycles);
    }

    public Set<Long> getGeometry() {
        return geometry;
    }

    /**
     * Every geometry entity, each one after the entities it references
     * (except inside a reference cycle).
     */
    public List<Long> getOrder() {
        return order;
    }

    public List<Long> getObsolete() {
        return obsolete;
    }

    public List<AnchorLink> getAnchors() {
        return anchors;
    }

    /**
     * @return the reference cycles met while ordering, members sorted by id
     */
    public List<List<Long>> getCycles() {
        return cycles;
    }

    @Override
    public String toString() {
        return "GeometryResolution{geometry=" + geometry.size() + ", obsolete=" + obsolete.size() + ", anchors="
                        + anchors.size() + ", cycles=" + cycles.size() + "}";
    }

    /**
     * An attribute that ties a non-geometry entity to the geometry: a type's
     * RepresentationMaps or a product's Representation.
     */
    public static final class AnchorLink {
        private final long entityId;
        private final String attribute;

        public AnchorLink(long entityId, String attribute) {
            this.entityId = entityId;
            this.attribute = attribute;
        }

        public long getEntityId() {
            return entityId;
        }

        public String getAttribute() {
            return attribute;
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof AnchorLink)) {
                return false;
            }
            AnchorLink other = (AnchorLink) o;
            return entityId == other.entityId && attribute.equals(other.attribute);
        }

        @Override
        public int hashCode() {
            return Long.hashCode(entityId) * 31 + attribute.hashCode();
        }

        @Override
        public String toString() {
            return "#" + entityId + "." + attribute;
        }
    }
}
