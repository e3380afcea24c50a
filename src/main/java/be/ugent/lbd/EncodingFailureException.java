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
package be.ugent.lbd;

/**
 * An entity could not be turned into Turtle. The output written so far ends
 * somewhere before this entity and cannot be repaired, so the run stops.
 */
public class EncodingFailureException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final long entityId;

    public EncodingFailureException(long entityId, Throwable cause) {
        super("Error encoding entity #" + entityId + ": " + cause.getMessage(), cause);
        this.entityId = entityId;
    }

    public long getEntityId() {
        return entityId;
    }
}
