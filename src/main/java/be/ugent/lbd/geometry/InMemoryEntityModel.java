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

import be.ugent.lbd.model.AttributeValue;
import be.ugent.lbd.model.Entity;
import be.ugent.lbd.schema.SchemaRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * {@link EntityModel} over entities held in memory, e.g. everything read from
 * an entity stream. Inverse references are indexed once at construction and
 * kept current by {@link #clearAttribute} and {@link #remove}, so concurrent
 * readers are safe while nothing modifies the model.
 */
public class InMemoryEntityModel implements EntityModel {

    private static final Logger LOG = LoggerFactory.getLogger(InMemoryEntityModel.class);

    private final SchemaRegistry registry;
    private final Map<Long, Entity> entities = new LinkedHashMap<>();
    private final Map<Long, Set<Long>> inverses = new HashMap<>();

    public InMemoryEntityModel(SchemaRegistry registry, Iterable<Entity> source) {
        this.registry = registry;
        long dropped = 0;
        for (Entity entity : source) {
            if (!entity.isWellFormed()) {
                dropped++;
                continue;
            }
            if (entities.put(entity.getId(), entity) != null) {
                LOG.warn("Duplicate entity #{}, keeping the last one", entity.getId());
            }
        }
        if (dropped > 0) {
            LOG.debug("Dropped {} malformed records", dropped);
        }
        for (Entity entity : entities.values()) {
            index(entity.getId(), references(entity.getId()));
        }
    }

    /**
     * Reads a source to its end.
     */
    public static InMemoryEntityModel load(SchemaRegistry registry, Iterator<Entity> source) {
        List<Entity> all = new ArrayList<>();
        source.forEachRemaining(all::add);
        return new InMemoryEntityModel(registry, all);
    }

    @Override
    public Optional<Entity> get(long id) {
        return Optional.ofNullable(entities.get(id));
    }

    @Override
    public boolean contains(long id) {
        return entities.containsKey(id);
    }

    @Override
    public Collection<Entity> entities() {
        return Collections.unmodifiableCollection(entities.values());
    }

    public int size() {
        return entities.size();
    }

    @Override
    public List<Entity> byType(String type) {
        List<Entity> result = new ArrayList<>();
        for (Entity entity : entities.values()) {
            if (registry.isSubtypeOf(entity.getType(), type)) {
                result.add(entity);
            }
        }
        return result;
    }

    @Override
    public Set<Long> references(long id) {
        Entity entity = entities.get(id);
        if (entity == null) {
            return Collections.emptySet();
        }
        Set<Long> result = new LinkedHashSet<>();
        for (AttributeValue value : entity.getAttributes().values()) {
            collectReferences(value, result);
        }
        return result;
    }

    @Override
    public Set<Long> attributeReferences(long id, String attribute) {
        Entity entity = entities.get(id);
        if (entity == null || entity.getAttribute(attribute) == null) {
            return Collections.emptySet();
        }
        Set<Long> result = new LinkedHashSet<>();
        collectReferences(entity.getAttribute(attribute), result);
        return result;
    }

    @Override
    public Set<Long> referencedBy(long id) {
        Set<Long> result = inverses.get(id);
        return result == null ? Collections.emptySet() : Collections.unmodifiableSet(result);
    }

    @Override
    public void clearAttribute(long id, String attribute) {
        Entity entity = entities.get(id);
        if (entity != null && entity.getAttribute(attribute) != null) {
            Set<Long> before = references(id);
            entities.put(id, entity.withoutAttribute(attribute));
            before.removeAll(references(id));
            unindex(id, before);
        }
    }

    @Override
    public void remove(long id) {
        if (!entities.containsKey(id)) {
            return;
        }
        unindex(id, references(id));
        for (long referrer : new ArrayList<>(referencedBy(id))) {
            Entity entity = entities.get(referrer);
            if (entity == null || referrer == id) {
                continue;
            }
            Map<String, AttributeValue> attributes = new LinkedHashMap<>();
            for (Map.Entry<String, AttributeValue> attribute : entity.getAttributes().entrySet()) {
                attributes.put(attribute.getKey(), attribute.getValue().accept(new ReferenceRemover(id)));
            }
            entities.put(referrer, new Entity(entity.getId(), entity.getType(), attributes));
        }
        entities.remove(id);
        inverses.remove(id);
    }

    private void index(long referrer, Set<Long> targets) {
        for (long target : targets) {
            inverses.computeIfAbsent(target, k -> new LinkedHashSet<>()).add(referrer);
        }
    }

    private void unindex(long referrer, Set<Long> targets) {
        for (long target : targets) {
            Set<Long> referrers = inverses.get(target);
            if (referrers != null) {
                referrers.remove(referrer);
                if (referrers.isEmpty()) {
                    inverses.remove(target);
                }
            }
        }
    }

    private void collectReferences(AttributeValue value, Set<Long> result) {
        if (value instanceof AttributeValue.Reference) {
            long target = ((AttributeValue.Reference) value).getTargetId();
            if (entities.containsKey(target)) {
                result.add(target);
            }
        } else if (value instanceof AttributeValue.TypedValue) {
            collectReferences(((AttributeValue.TypedValue) value).getInner(), result);
        } else if (value instanceof AttributeValue.Collection) {
            for (AttributeValue item : ((AttributeValue.Collection) value).getItems()) {
                collectReferences(item, result);
            }
        }
    }

    /**
     * Rewrites a value without the references to one entity; null when
     * nothing is left of it.
     */
    private static final class ReferenceRemover implements AttributeValue.Visitor<AttributeValue> {
        private final long removed;

        private ReferenceRemover(long removed) {
            this.removed = removed;
        }

        @Override
        public AttributeValue visitLiteral(AttributeValue.Literal literal) {
            return literal;
        }

        @Override
        public AttributeValue visitReference(AttributeValue.Reference reference) {
            return reference.getTargetId() == removed ? null : reference;
        }

        @Override
        public AttributeValue visitTypedValue(AttributeValue.TypedValue typedValue) {
            AttributeValue inner = typedValue.getInner().accept(this);
            if (inner == null) {
                return null;
            }
            return inner == typedValue.getInner() ? typedValue
                            : AttributeValue.typed(typedValue.getDeclaredType(), inner);
        }

        @Override
        public AttributeValue visitCollection(AttributeValue.Collection collection) {
            List<AttributeValue> items = new ArrayList<>(collection.size());
            for (AttributeValue item : collection.getItems()) {
                AttributeValue kept = item.accept(this);
                if (kept != null) {
                    items.add(kept);
                }
            }
            return AttributeValue.collection(collection.getKind(), items);
        }
    }
}
