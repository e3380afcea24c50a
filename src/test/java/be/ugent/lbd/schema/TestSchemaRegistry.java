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
package be.ugent.lbd.schema;

import be.ugent.lbd.ConfigurationException;
import be.ugent.lbd.model.CollectionKind;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

public class TestSchemaRegistry {

    private static SchemaRegistry sample() {
        return SchemaRegistry.builder("TEST")
                        .supertype("IfcWall", "IfcElement")
                        .supertype("IfcElement", "IfcProduct")
                        .collection("IfcProduct", "Tags", CollectionKind.SET)
                        .collection("IfcProduct", "Points", CollectionKind.LIST)
                        .collection("IfcWall", "Tags", CollectionKind.ARRAY)
                        .select("IfcProduct", "Value", "IfcValue")
                        .build();
    }

    @Test
    public void attributesAreInherited() {
        SchemaRegistry registry = sample();
        Assertions.assertEquals(CollectionKind.LIST, registry.collectionKind("IfcWall", "Points"));
        Assertions.assertEquals(CollectionKind.LIST, registry.collectionKind("IfcElement", "Points"));
        Assertions.assertEquals("IfcValue", registry.selectType("IfcWall", "Value"));
        Assertions.assertTrue(registry.isSelectAttribute("IfcElement", "Value"));
    }

    @Test
    public void subtypeOverridesAncestor() {
        SchemaRegistry registry = sample();
        Assertions.assertEquals(CollectionKind.ARRAY, registry.collectionKind("IfcWall", "Tags"));
        Assertions.assertEquals(CollectionKind.SET, registry.collectionKind("IfcElement", "Tags"));
    }

    @Test
    public void unknownsResolveToNone() {
        SchemaRegistry registry = sample();
        Assertions.assertEquals(CollectionKind.NONE, registry.collectionKind("IfcWall", "Name"));
        Assertions.assertEquals(CollectionKind.NONE, registry.collectionKind("IfcDoesNotExist", "Tags"));
        Assertions.assertEquals(CollectionKind.NONE, registry.collectionKind(null, "Tags"));
        Assertions.assertNull(registry.selectType("IfcWall", "Name"));
        Assertions.assertFalse(registry.isSelectAttribute("IfcWall", "Tags"));
    }

    @Test
    public void typeNamesAreCaseInsensitive() {
        SchemaRegistry registry = sample();
        Assertions.assertEquals(CollectionKind.LIST, registry.collectionKind("IFCWALL", "Points"));
        Assertions.assertTrue(registry.isSubtypeOf("ifcwall", "IFCPRODUCT"));
        Assertions.assertTrue(registry.isSubtypeOf("IfcWall", "IfcWall"));
        Assertions.assertFalse(registry.isSubtypeOf("IfcProduct", "IfcWall"));
    }

    @Test
    public void circularSupertypesDoNotLoop() {
        SchemaRegistry registry = SchemaRegistry.builder("TEST")
                        .supertype("A", "B")
                        .supertype("B", "A")
                        .collection("B", "Items", CollectionKind.SET)
                        .build();
        Assertions.assertEquals(CollectionKind.SET, registry.collectionKind("A", "Items"));
        Assertions.assertFalse(registry.isSubtypeOf("A", "C"));
    }

    @Test
    public void loadsJsonMap() throws IOException {
        String json = "{\"supertypes\": {\"IfcPolyline\": \"IfcCurve\"},"
                        + " \"collections\": {\"IfcCurve\": {\"Points\": \"LIST\", \"Odd\": \"BAG\"}},"
                        + " \"selects\": {\"IfcCurve\": {\"Colour\": \"IfcColour\"}}}";
        SchemaRegistry registry = SchemaRegistry.load("TEST",
                        new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)));
        Assertions.assertEquals(CollectionKind.LIST, registry.collectionKind("IfcPolyline", "Points"));
        Assertions.assertEquals(CollectionKind.NONE, registry.collectionKind("IfcPolyline", "Odd"));
        Assertions.assertEquals("IfcColour", registry.selectType("IfcPolyline", "Colour"));
    }

    @Test
    public void bundledSchemas() {
        for (String schema : new String[] {"IFC4X3_ADD2", "IFC4", "IFC2X3"}) {
            SchemaRegistry registry = SchemaRegistry.forSchema(schema);
            Assertions.assertEquals(schema, registry.getSchemaName());
            Assertions.assertEquals(CollectionKind.LIST, registry.collectionKind("IfcWallType", "RepresentationMaps"),
                            schema);
            Assertions.assertEquals(CollectionKind.LIST,
                            registry.collectionKind("IfcProductDefinitionShape", "Representations"), schema);
            Assertions.assertEquals(CollectionKind.SET, registry.collectionKind("IfcRelAggregates", "RelatedObjects"),
                            schema);
            Assertions.assertTrue(registry.isSubtypeOf("IfcWallType", "IfcTypeProduct"), schema);
            Assertions.assertTrue(registry.isSubtypeOf("IfcProductDefinitionShape", "IfcProductRepresentation"),
                            schema);
            Assertions.assertEquals("IfcValue", registry.selectType("IfcPropertySingleValue", "NominalValue"), schema);
        }
    }

    @ParameterizedTest
    @ValueSource(strings = {"IFC4X3_ADD2", "IFC4", "IFC2X3"})
    public void bundledSchemasCoverTopologyAndGeometry(String schema) {
        SchemaRegistry registry = SchemaRegistry.forSchema(schema);
        Assertions.assertEquals(CollectionKind.LIST, registry.collectionKind("IfcEdgeLoop", "EdgeList"));
        Assertions.assertEquals(CollectionKind.LIST, registry.collectionKind("IfcPolyLoop", "Polygon"));
        Assertions.assertEquals(CollectionKind.LIST, registry.collectionKind("IfcCompositeCurve", "Segments"));
        Assertions.assertEquals(CollectionKind.LIST, registry.collectionKind("IfcMaterialLayerSet", "MaterialLayers"));
        Assertions.assertEquals(CollectionKind.SET, registry.collectionKind("IfcClosedShell", "CfsFaces"));
        Assertions.assertEquals(CollectionKind.LIST, registry.collectionKind("IfcBSplineCurve", "ControlPointsList"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"IFC4X3_ADD2", "IFC4", "IFC2X3"})
    public void bundledSchemasCoverElementTypes(String schema) {
        SchemaRegistry registry = SchemaRegistry.forSchema(schema);
        for (String type : new String[] {"IfcBeamType", "IfcColumnType", "IfcSlabType", "IfcPumpType",
                        "IfcLightFixtureType", "IfcPipeSegmentType"}) {
            Assertions.assertTrue(registry.isSubtypeOf(type, "IfcTypeProduct"), type);
            Assertions.assertEquals(CollectionKind.LIST, registry.collectionKind(type, "RepresentationMaps"), type);
        }
        Assertions.assertTrue(registry.isSubtypeOf("IfcBeam", "IfcProduct"));
        Assertions.assertTrue(registry.isSubtypeOf("IfcFlowSegment", "IfcElement"));
        Assertions.assertFalse(registry.isSubtypeOf("IfcBeamType", "IfcProduct"));
    }

    @Test
    public void nestingIsOrderedSinceIfc4() {
        Assertions.assertEquals(CollectionKind.LIST,
                        SchemaRegistry.forSchema("IFC4X3_ADD2").collectionKind("IfcRelNests", "RelatedObjects"));
        Assertions.assertEquals(CollectionKind.LIST,
                        SchemaRegistry.forSchema("IFC4").collectionKind("IfcRelNests", "RelatedObjects"));
        Assertions.assertEquals(CollectionKind.SET,
                        SchemaRegistry.forSchema("IFC2X3").collectionKind("IfcRelNests", "RelatedObjects"));
    }

    @Test
    public void schemaReleasesDiffer() {
        Assertions.assertTrue(SchemaRegistry.forSchema("IFC4X3_ADD2").isSubtypeOf("IfcWall", "IfcBuiltElement"));
        Assertions.assertTrue(SchemaRegistry.forSchema("IFC4").isSubtypeOf("IfcWall", "IfcBuildingElement"));
        Assertions.assertTrue(SchemaRegistry.forSchema("IFC4").isSubtypeOf("IfcProject", "IfcContext"));
        Assertions.assertFalse(SchemaRegistry.forSchema("IFC2X3").isSubtypeOf("IfcProject", "IfcContext"));
        Assertions.assertTrue(SchemaRegistry.forSchema("IFC4X3_ADD2").isSubtypeOf("IfcAlignment", "IfcProduct"));
    }

    @Test
    public void unsupportedSchema() {
        Assertions.assertThrows(ConfigurationException.class, () -> SchemaRegistry.forSchema("IFC5"));
        Assertions.assertThrows(ConfigurationException.class, () -> SchemaRegistry.forSchema(""));
    }

    @Test
    public void ontologyNamespaces() {
        Assertions.assertEquals("https://standards.buildingsmart.org/IFC/DEV/IFC4_3/ADD2/OWL",
                        SchemaIdentifiers.ontologyUri("IFC4X3_ADD2"));
        Assertions.assertEquals("https://standards.buildingsmart.org/IFC/DEV/IFC4_3/RC1/OWL",
                        SchemaIdentifiers.ontologyUri("IFC4x3_RC1"));
        Assertions.assertEquals("https://standards.buildingsmart.org/IFC/DEV/IFC4/ADD2_TC1/OWL",
                        SchemaIdentifiers.ontologyUri("IFC4"));
        Assertions.assertEquals("https://standards.buildingsmart.org/IFC/DEV/IFC2x3/TC1/OWL",
                        SchemaIdentifiers.ontologyUri("IFC2X3"));
    }
}
