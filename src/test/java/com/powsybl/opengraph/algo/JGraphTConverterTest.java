/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.opengraph.algo;

import com.powsybl.opengraph.graph.DiGraph;
import com.powsybl.opengraph.graph.Edge;
import com.powsybl.opengraph.graph.MultiGraph;
import org.jgrapht.Graph;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author PowSyBl Open Graph team
 */
class JGraphTConverterTest {

    @Test
    void multigraphTest() {
        MultiGraph<Integer> mg = new MultiGraph<>();
        mg.addEdge(1, 2, Map.of("weight", 3.0));
        mg.addEdge(1, 2);
        mg.addEdge(2, 2);
        mg.addNode(3);

        Graph<Integer, Edge<Integer>> jGraph = JGraphTConverter.toJGraphT(mg);
        assertFalse(jGraph.getType().isDirected());
        assertEquals(Set.of(1, 2, 3), jGraph.vertexSet());
        assertEquals(3, jGraph.edgeSet().size());
        assertEquals(2, jGraph.getAllEdges(2, 1).size());
        assertEquals(0, jGraph.degreeOf(3));
        assertTrue(jGraph.containsEdge(Edge.of(1, 2, 0, Map.of())));
        Edge<Integer> weighted = jGraph.edgeSet().stream().filter(e -> e.getAttributes().containsKey("weight")).findFirst().orElseThrow();
        assertSame(mg.getEdgeData(1, 2, 0), weighted.getAttributes());
    }

    @Test
    void directedTest() {
        DiGraph<String> d = new DiGraph<>();
        d.addEdge("a", "b");
        d.addEdge("b", "a");
        d.addEdge("b", "c");

        Graph<String, Edge<String>> jGraph = JGraphTConverter.toJGraphT(d);
        assertTrue(jGraph.getType().isDirected());
        assertEquals(3, jGraph.edgeSet().size());
        assertTrue(jGraph.containsEdge("b", "c"));
        assertFalse(jGraph.containsEdge("c", "b"));
        assertEquals(1, jGraph.inDegreeOf("c"));
        assertEquals(2, jGraph.outDegreeOf("b"));

        d.addEdge("c", "a");
        assertEquals(3, jGraph.edgeSet().size());
    }
}
