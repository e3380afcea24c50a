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

/**
 * One shape to triangulate: a product together with one of the
 * representations of its product definition shape.
 */
public final class ShapeRequest {

    private final Entity product;
    private final Entity representation;

    public ShapeRequest(Entity product, Entity representation) {
        this.product = product;
        this.representation = representation;
    }

    public Entity getProduct() {
        return product;
    }

    public Entity getRepresentation() {
        return representation;
    }

    @Override
    public String toString() {
        return "#" + product.getId() + "/#" + representation.getId();
    }
}
