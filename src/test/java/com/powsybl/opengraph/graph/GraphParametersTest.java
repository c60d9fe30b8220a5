/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.opengraph.graph;

import com.google.common.jimfs.Configuration;
import com.google.common.jimfs.Jimfs;
import com.powsybl.commons.config.InMemoryPlatformConfig;
import com.powsybl.commons.config.MapModuleConfig;
import com.powsybl.opengraph.util.GraphFunctions;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.FileSystem;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author PowSyBl Open Graph team
 */
class GraphParametersTest {

    private InMemoryPlatformConfig platformConfig;

    private FileSystem fileSystem;

    @BeforeEach
    void setUp() {
        fileSystem = Jimfs.newFileSystem(Configuration.unix());
        platformConfig = new InMemoryPlatformConfig(fileSystem);
    }

    @AfterEach
    void tearDown() throws IOException {
        fileSystem.close();
    }

    @Test
    void testDefaultParameters() {
        GraphParameters parameters = GraphParameters.load(platformConfig);
        assertEquals(GraphParameters.WEIGHT_ATTRIBUTE_DEFAULT_VALUE, parameters.getWeightAttribute());
        assertEquals(GraphParameters.DEFAULT_WEIGHT_DEFAULT_VALUE, parameters.getDefaultWeight());
        assertEquals(EdgeKeyPolicy.SMALLEST_UNUSED, parameters.getEdgeKeyPolicy());
        assertEquals("GraphParameters(weightAttribute=weight, defaultWeight=1.0, edgeKeyPolicy=SMALLEST_UNUSED)", parameters.toString());
    }

    @Test
    void testConfigLoading() {
        MapModuleConfig moduleConfig = platformConfig.createModuleConfig(GraphParameters.MODULE_NAME);
        moduleConfig.setStringProperty("weightAttribute", "length");
        moduleConfig.setStringProperty("defaultWeight", "2.5");
        moduleConfig.setStringProperty("edgeKeyPolicy", "EDGE_COUNT");

        GraphParameters parameters = GraphParameters.load(platformConfig);
        assertEquals("length", parameters.getWeightAttribute());
        assertEquals(2.5, parameters.getDefaultWeight());
        assertEquals(EdgeKeyPolicy.EDGE_COUNT, parameters.getEdgeKeyPolicy());

        MultiGraph<String> mg = new MultiGraph<>(parameters);
        mg.addEdge("a", "b", 1, Map.of());
        assertEquals(2, mg.addEdge("a", "b", null, Map.of()));
        mg.addEdge("b", "c");
        assertEquals(7.5, mg.degree("b", "length"));
    }

    @Test
    void testConfiguredWeightAttribute() {
        Graph<String> byWeight = new Graph<>();
        byWeight.addEdge("a", "b", Map.of("weight", 2.0, "length", 10.0));
        byWeight.addEdge("b", "c", Map.of("weight", 3.0));
        assertEquals(5.0, byWeight.weightedSize());
        assertEquals(5.0, byWeight.weightedDegrees().get("b"));
        assertTrue(GraphFunctions.isWeighted(byWeight));

        Graph<String> byLength = new Graph<>(GraphParameters.load(Map.of(GraphParameters.WEIGHT_ATTRIBUTE_PARAM_NAME, "length")));
        byLength.addEdge("a", "b", Map.of("weight", 2.0, "length", 10.0));
        byLength.addEdge("b", "c", Map.of("weight", 3.0));
        assertEquals("length", byLength.weightedDegrees().getWeight());
        assertEquals(11.0, byLength.weightedSize());
        assertEquals(11.0, byLength.weightedDegrees().get("b"));
        assertEquals(10.0, byLength.weightedDegrees().get("a"));
        assertFalse(GraphFunctions.isWeighted(byLength));
        assertFalse(GraphFunctions.isNegativelyWeighted(byLength));

        byLength.edges().get("c", "b").put("length", -1.0);
        assertTrue(GraphFunctions.isWeighted(byLength));
        assertTrue(GraphFunctions.isNegativelyWeighted(byLength));
        assertFalse(GraphFunctions.isNegativelyWeighted(byWeight));
    }

    @Test
    void testPartialConfigLoading() {
        MapModuleConfig moduleConfig = platformConfig.createModuleConfig(GraphParameters.MODULE_NAME);
        moduleConfig.setStringProperty("defaultWeight", "0");
        GraphParameters parameters = GraphParameters.load(platformConfig);
        assertEquals("weight", parameters.getWeightAttribute());
        assertEquals(0, parameters.getDefaultWeight());
        assertEquals(EdgeKeyPolicy.SMALLEST_UNUSED, parameters.getEdgeKeyPolicy());
    }

    @Test
    void testMapLoading() {
        GraphParameters parameters = GraphParameters.load(Map.of(GraphParameters.DEFAULT_WEIGHT_PARAM_NAME, "3",
                                                                 GraphParameters.EDGE_KEY_POLICY_PARAM_NAME, "EDGE_COUNT"));
        assertEquals("weight", parameters.getWeightAttribute());
        assertEquals(3, parameters.getDefaultWeight());
        assertEquals(EdgeKeyPolicy.EDGE_COUNT, parameters.getEdgeKeyPolicy());
        assertEquals(3, GraphParameters.PARAMETERS_NAMES.size());

        assertThrows(IllegalArgumentException.class, () -> GraphParameters.load(Map.of(GraphParameters.EDGE_KEY_POLICY_PARAM_NAME, "RANDOM")));
    }

    @Test
    void testCopyAndValidation() {
        GraphParameters parameters = new GraphParameters()
                .setWeightAttribute("cost")
                .setDefaultWeight(-1);
        GraphParameters copy = parameters.copy();
        assertNotSame(parameters, copy);
        assertEquals(parameters.toString(), copy.toString());
        assertThrows(IllegalArgumentException.class, () -> parameters.setDefaultWeight(Double.NaN));
        assertThrows(NullPointerException.class, () -> parameters.setEdgeKeyPolicy(null));
    }

    @Test
    void testEdgeKeyPolicies() {
        Map<Object, String> keys = Map.of(0, "a", 2, "b", "x", "c");
        assertEquals(1, EdgeKeyPolicy.SMALLEST_UNUSED.nextKey(keys));
        assertEquals(3, EdgeKeyPolicy.EDGE_COUNT.nextKey(keys));
        assertEquals(0, EdgeKeyPolicy.SMALLEST_UNUSED.nextKey(Map.of()));
        assertEquals(0, EdgeKeyPolicy.EDGE_COUNT.nextKey(Map.of()));
    }
}
