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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Finds the entities that only exist to describe shape geometry and that can
 * be removed once the geometry has been exported separately.
 * <p>
 * The geometry set is everything reachable from the representation maps of
 * type products and from every product definition shape. The links from the
 * types and products into that set are anchors: they are ignored while
 * resolving and unset by {@link #prune(GeometryResolution)}. An entity is
 * obsolete when all its referrers are in the geometry set. Members of a
 * reference cycle are obsolete only together.
 */
public class GeometryDependencyResolver {

    private static final Logger LOG = LoggerFactory.getLogger(GeometryDependencyResolver.class);

    public static final String TYPE_PRODUCT = "IfcTypeProduct";
    public static final String REPRESENTATION_MAPS = "RepresentationMaps";
    public static final String PRODUCT_DEFINITION_SHAPE = "IfcProductDefinitionShape";
    public static final String REPRESENTATION = "Representation";

    public static final int DEFAULT_NODE_CEILING = 50_000_000;

    private final EntityModel model;
    private final int nodeCeiling;

    public GeometryDependencyResolver(EntityModel model) {
        this(model, DEFAULT_NODE_CEILING);
    }

    public GeometryDependencyResolver(EntityModel model, int nodeCeiling) {
        this.model = model;
        this.nodeCeiling = nodeCeiling;
    }

    /**
     * Computes the geometry set and the obsolete entities. The model is not
     * changed.
     *
     * @throws IllegalStateException if the geometry set grows beyond the node
     *           ceiling
     */
    public GeometryResolution resolve() {
        List<GeometryResolution.AnchorLink> anchors = new ArrayList<>();
        List<Long> roots = new ArrayList<>();

        for (Entity type : model.byType(TYPE_PRODUCT)) {
            Set<Long> maps = model.attributeReferences(type.getId(), REPRESENTATION_MAPS);
            if (!maps.isEmpty()) {
                anchors.add(new GeometryResolution.AnchorLink(type.getId(), REPRESENTATION_MAPS));
                roots.addAll(maps);
            }
        }
        for (Entity shape : model.byType(PRODUCT_DEFINITION_SHAPE)) {
            roots.add(shape.getId());
            for (long product : model.referencedBy(shape.getId())) {
                if (model.attributeReferences(product, REPRESENTATION).contains(shape.getId())) {
                    anchors.add(new GeometryResolution.AnchorLink(product, REPRESENTATION));
                }
            }
        }

        Set<Long> geometry = closure(roots);
        LOG.info("Geometry set: {} entities from {} roots, {} anchors", geometry.size(), roots.size(),
                        anchors.size());

        Map<Long, List<Long>> edges = new HashMap<>();
        for (long id : geometry) {
            List<Long> targets = new ArrayList<>();
            for (long target : model.references(id)) {
                if (geometry.contains(target)) {
                    targets.add(target);
                }
            }
            edges.put(id, targets);
        }

        List<List<Long>> components = stronglyConnectedComponents(geometry, edges);
        List<Long> order = new ArrayList<>(geometry.size());
        List<Long> obsolete = new ArrayList<>();
        List<List<Long>> cycles = new ArrayList<>();
        for (List<Long> component : components) {
            order.addAll(component);
            boolean cycle = component.size() > 1 || edges.get(component.get(0)).contains(component.get(0));
            if (cycle) {
                LOG.warn("Reference cycle among geometry entities {}", component);
                cycles.add(component);
            }
            boolean allObsolete = true;
            for (long id : component) {
                if (!onlyReferencedFrom(id, geometry, anchors)) {
                    allObsolete = false;
                    break;
                }
            }
            if (allObsolete) {
                obsolete.addAll(component);
            }
        }
        LOG.info("{} of {} geometry entities are obsolete", obsolete.size(), geometry.size());
        return new GeometryResolution(geometry, order, obsolete, anchors, cycles);
    }

    /**
     * Unsets the anchor attributes and removes the obsolete entities, in
     * dependencies-first order.
     *
     * @return the number of entities removed
     */
    public int prune(GeometryResolution resolution) {
        for (GeometryResolution.AnchorLink anchor : resolution.getAnchors()) {
            model.clearAttribute(anchor.getEntityId(), anchor.getAttribute());
        }
        int removed = 0;
        for (long id : resolution.getObsolete()) {
            if (model.contains(id)) {
                model.remove(id);
                removed++;
            }
        }
        LOG.info("Pruned {} geometry entities, unset {} anchors", removed, resolution.getAnchors().size());
        return removed;
    }

    private Set<Long> closure(List<Long> roots) {
        Set<Long> seen = new TreeSet<>();
        Deque<Long> work = new ArrayDeque<>();
        for (long root : roots) {
            if (model.contains(root) && seen.add(root)) {
                work.add(root);
            }
        }
        while (!work.isEmpty()) {
            long id = work.poll();
            for (long target : model.references(id)) {
                if (seen.add(target)) {
                    if (seen.size() > nodeCeiling) {
                        throw new IllegalStateException("Geometry set exceeds " + nodeCeiling + " entities");
                    }
                    work.add(target);
                }
            }
        }
        return seen;
    }

    private boolean onlyReferencedFrom(long id, Set<Long> geometry, List<GeometryResolution.AnchorLink> anchors) {
        for (long referrer : model.referencedBy(id)) {
            if (geometry.contains(referrer)) {
                continue;
            }
            if (!referencesOnlyThroughAnchor(referrer, id, anchors)) {
                return false;
            }
        }
        return true;
    }

    private boolean referencesOnlyThroughAnchor(long referrer, long target,
                    List<GeometryResolution.AnchorLink> anchors) {
        Entity entity = model.get(referrer).orElse(null);
        if (entity == null) {
            return true;
        }
        boolean anchored = false;
        for (String attribute : entity.getAttributes().keySet()) {
            if (!model.attributeReferences(referrer, attribute).contains(target)) {
                continue;
            }
            if (!anchors.contains(new GeometryResolution.AnchorLink(referrer, attribute))) {
                return false;
            }
            anchored = true;
        }
        return anchored;
    }

    /**
     * Iterative Tarjan over the ids in ascending order. Components come out
     * after every component they reference, members sorted by id.
     */
    private static List<List<Long>> stronglyConnectedComponents(Set<Long> nodes, Map<Long, List<Long>> edges) {
        Map<Long, Integer> index = new HashMap<>();
        Map<Long, Integer> lowLink = new HashMap<>();
        Set<Long> onStack = new LinkedHashSet<>();
        Deque<Long> stack = new ArrayDeque<>();
        List<List<Long>> components = new ArrayList<>();
        int counter = 0;

        for (long start : nodes) {
            if (index.containsKey(start)) {
                continue;
            }
            Deque<Long> callStack = new ArrayDeque<>();
            Deque<Iterator<Long>> edgeIterators = new ArrayDeque<>();
            index.put(start, counter);
            lowLink.put(start, counter);
            counter++;
            stack.push(start);
            onStack.add(start);
            callStack.push(start);
            edgeIterators.push(edges.get(start).iterator());

            while (!callStack.isEmpty()) {
                long node = callStack.peek();
                Iterator<Long> it = edgeIterators.peek();
                if (it.hasNext()) {
                    long next = it.next();
                    if (!index.containsKey(next)) {
                        index.put(next, counter);
                        lowLink.put(next, counter);
                        counter++;
                        stack.push(next);
                        onStack.add(next);
                        callStack.push(next);
                        edgeIterators.push(edges.get(next).iterator());
                    } else if (onStack.contains(next)) {
                        lowLink.put(node, Math.min(lowLink.get(node), index.get(next)));
                    }
                    continue;
                }
                callStack.pop();
                edgeIterators.pop();
                if (!callStack.isEmpty()) {
                    long parent = callStack.peek();
                    lowLink.put(parent, Math.min(lowLink.get(parent), lowLink.get(node)));
                }
                if (lowLink.get(node).equals(index.get(node))) {
                    List<Long> component = new ArrayList<>();
                    long member;
                    do {
                        member = stack.pop();
                        onStack.remove(member);
                        component.add(member);
                    } while (member != node);
                    Collections.sort(component);
                    components.add(component);
                }
            }
        }
        return components;
    }
}
