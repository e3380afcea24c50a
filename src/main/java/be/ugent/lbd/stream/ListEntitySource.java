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
package be.ugent.lbd.stream;

import be.ugent.lbd.model.Entity;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;

/**
 * Entity source over entities that are already in memory, e.g. what is left
 * of a model after geometry pruning.
 */
public class ListEntitySource implements EntitySource {

    private final String schemaName;
    private final Iterator<Entity> iterator;

    public ListEntitySource(String schemaName, Iterable<Entity> entities) {
        this.schemaName = schemaName;
        List<Entity> copy = new ArrayList<>();
        entities.forEach(copy::add);
        this.iterator = copy.iterator();
    }

    @Override
    public Optional<String> getSchemaName() {
        return Optional.ofNullable(schemaName);
    }

    @Override
    public boolean hasNext() {
        return iterator.hasNext();
    }

    @Override
    public Entity next() {
        return iterator.next();
    }

    @Override
    public void close() {
        // nothing to release
    }
}
