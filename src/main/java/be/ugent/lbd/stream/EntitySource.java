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

import java.io.Closeable;
import java.util.Iterator;
import java.util.Optional;

/**
 * A single-pass stream of model entities. Every entity is handed out exactly
 * once; consumers must not expect to see it again.
 */
public interface EntitySource extends Iterator<Entity>, Closeable {

    /**
     * @return the schema identifier the source declares (e.g. IFC4X3_ADD2), if
     *         it declares one
     */
    Optional<String> getSchemaName();
}
