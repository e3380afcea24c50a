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

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

public class TestGeometryProcessor {

    @Test
    public void requestsEveryProductRepresentationPair() {
        InMemoryEntityModel model = GeometryFixtures.model(GeometryFixtures.wallModel());
        List<ShapeRequest> requests = new GeometryProcessor(model, (r, b) -> "").shapeRequests();
        Assertions.assertEquals(1, requests.size());
        Assertions.assertEquals(2, requests.get(0).getProduct().getId());
        Assertions.assertEquals(21, requests.get(0).getRepresentation().getId());
    }

    @Test
    public void processIndexesKernelOutputAndPrunes() throws IOException {
        InMemoryEntityModel model = GeometryFixtures.model(GeometryFixtures.wallModel());
        List<ShapeRequest> seen = new ArrayList<>();
        List<String> bases = new ArrayList<>();
        GeometryKernel kernel = (requests, baseUri) -> {
            seen.addAll(requests);
            bases.add(baseUri);
            return GeometryFixtures.GEOMETRY_TTL;
        };
        GeometryProcessor processor = new GeometryProcessor(model, kernel);

        GeometrySubgraphExtractor extractor = processor.process("http://example.org/base/");
        Assertions.assertEquals(1, seen.size());
        Assertions.assertEquals("http://example.org/base/", bases.get(0));
        Assertions.assertTrue(extractor.getGuids().contains(GeometryFixtures.WALL_GUID));
        Assertions.assertSame(extractor, processor.getExtractor());
        Assertions.assertEquals(13, model.size());

        Assertions.assertEquals(8, processor.removeObsoleteInstances());
        Assertions.assertEquals(5, model.size());
        Assertions.assertEquals(8, processor.getResolution().getObsolete().size());
    }

    @Test
    public void pruningRequiresProcessing() {
        InMemoryEntityModel model = GeometryFixtures.model(GeometryFixtures.wallModel());
        GeometryProcessor processor = new GeometryProcessor(model, (r, b) -> "");
        Assertions.assertThrows(IllegalStateException.class, processor::removeObsoleteInstances);
    }
}
