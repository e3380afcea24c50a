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
package be.ugent.lbd.model;

import java.util.Locale;

/**
 * Aggregation kind of an EXPRESS attribute. {@link #NONE} marks a scalar or
 * reference attribute, {@link #UNKNOWN} a collection whose kind the schema
 * could not tell.
 */
public enum CollectionKind {
    LIST,
    SET,
    ARRAY,
    UNKNOWN,
    NONE;

    public boolean isOrdered() {
        return this == LIST || this == ARRAY;
    }

    /**
     * Parses the aggregation keyword as it appears in an EXPRESS schema
     * ({@code LIST}, {@code SET}, {@code ARRAY}). Anything else maps to
     * {@link #NONE}.
     */
    public static CollectionKind fromKeyword(String keyword) {
        if (keyword == null) {
            return NONE;
        }
        switch (keyword.trim().toUpperCase(Locale.ROOT)) {
            case "LIST":
                return LIST;
            case "SET":
                return SET;
            case "ARRAY":
                return ARRAY;
            default:
                return NONE;
        }
    }
}
