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

import java.io.IOException;
import java.util.List;

/**
 * Binding to an external geometry library that triangulates shapes and
 * serializes them as GeoSPARQL Turtle.
 */
public interface GeometryKernel {

    /**
     * @param requests the shapes to serialize, in order
     * @param baseUri  base IRI of the feature resources, null for the kernel's
     *                 default
     * @return a Turtle document with one {@code geo:Feature} per shape
     */
    String serializeShapes(List<ShapeRequest> requests, String baseUri) throws IOException;
}
