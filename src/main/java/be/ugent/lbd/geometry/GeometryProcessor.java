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

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Side-channel geometry pass over a loaded model: every product shape is sent
 * to the kernel, the returned Turtle is indexed by GUID and the entities that
 * only served the geometry are worked out so they can be left out of the
 * attribute output.
 */
public class GeometryProcessor {

    private static final Logger LOG = LoggerFactory.getLogger(GeometryProcessor.class);

    static final String REPRESENTATIONS = "Representations";

    private final EntityModel model;
    private final GeometryKernel kernel;
    private final GeometryDependencyResolver resolver;

    private GeometryResolution resolution;
    private GeometrySubgraphExtractor extractor;

    public GeometryProcessor(EntityModel model, GeometryKernel kernel) {
        this.model = model;
        this.kernel = kernel;
        this.resolver = new GeometryDependencyResolver(model);
    }

    public GeometrySubgraphExtractor process(String baseUri) throws IOException {
        List<ShapeRequest> requests = shapeRequests();
        LOG.info("Requesting {} shapes from the geometry kernel", requests.size());
        resolution = resolver.resolve();
        String turtle = kernel.serializeShapes(requests, baseUri);
        extractor = GeometrySubgraphExtractor.fromTurtle(turtle);
        return extractor;
    }

    /**
     * Products paired with every representation of their shape, products
     * first.
     */
    List<ShapeRequest> shapeRequests() {
        List<ShapeRequest> requests = new ArrayList<>();
        for (Entity shape : model.byType(GeometryDependencyResolver.PRODUCT_DEFINITION_SHAPE)) {
            List<Entity> products = new ArrayList<>();
            for (long referrer : model.referencedBy(shape.getId())) {
                if (model.attributeReferences(referrer, GeometryDependencyResolver.REPRESENTATION)
                                .contains(shape.getId())) {
                    model.get(referrer).ifPresent(products::add);
                }
            }
            for (Entity product : products) {
                for (long representation : model.attributeReferences(shape.getId(), REPRESENTATIONS)) {
                    model.get(representation).ifPresent(r -> requests.add(new ShapeRequest(product, r)));
                }
            }
        }
        return requests;
    }

    /**
     * Unsets the anchor attributes and removes the obsolete entities from the
     * model.
     *
     * @return the number of entities removed
     */
    public int removeObsoleteInstances() {
        if (resolution == null) {
            throw new IllegalStateException("process() has not run");
        }
        return resolver.prune(resolution);
    }

    public GeometryResolution getResolution() {
        return resolution;
    }

    public GeometrySubgraphExtractor getExtractor() {
        return extractor;
    }
}
