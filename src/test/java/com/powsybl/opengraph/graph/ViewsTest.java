/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.opengraph.graph;

import com.google.common.collect.ImmutableList;
import org.apache.commons.lang3.tuple.Pair;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author PowSyBl Open Graph team
 */
class ViewsTest {

    private Graph<String> g;

    @BeforeEach
    void setUp() {
        g = new Graph<>();
        g.addNode("a", Map.of("color", "red"));
        g.addNode("b");
        g.addEdge("a", "b", Map.of("weight", 2.0));
        g.addEdge("b", "c");
    }

    @Test
    void nodeViewTest() {
        NodeView<String> nodes = g.nodes();
        assertEquals(3, nodes.size());
        assertEquals(List.of("a", "b", "c"), List.copyOf(nodes));
        assertTrue(nodes.contains("a"));
        assertFalse(nodes.contains("z"));
        assertFalse(nodes.contains(null));
        assertEquals("red", nodes.get("a").get("color"));
        assertEquals(Map.of("a", "red", "b", "none", "c", "none"), nodes.data("color", "none"));
        assertEquals(Set.of("a", "b", "c"), nodes.data().keySet());
        assertThrows(UnsupportedOperationException.class, () -> nodes.remove("a"));
        assertThrows(UnsupportedOperationException.class, () -> nodes.data().remove("a"));

        nodes.get("b").put("color", "blue");
        g.addNode("d");
        assertEquals(4, nodes.size());
        assertEquals("blue", nodes.data("color", null).get("b"));
    }

    @Test
    void edgeViewTest() {
        EdgeView<String> edges = g.edges();
        assertEquals(2, edges.size());
        assertFalse(edges.isEmpty());
        assertTrue(edges.contains("b", "a"));
        assertFalse(edges.contains("a", "c"));
        assertTrue(edges.contains(Edge.of("c", "b")));
        assertEquals(2.0, edges.get("b", "a").get("weight"));
        assertThrows(EdgeNotFoundException.class, () -> edges.get("a", "c"));
        assertThrows(GraphCapabilityException.class, () -> edges.get("a", "b", 0));
        assertEquals(Map.of(Edge.of("a", "b"), 2.0, Edge.of("b", "c"), 1.0), edges.data("weight", 1.0));
        assertThrows(UnsupportedOperationException.class, () -> edges.add(Edge.of("a", "c")));

        g.addEdge("c", "d");
        assertEquals(3, edges.size());
        assertEquals(List.of(Edge.of("a", "b"), Edge.of("b", "c"), Edge.of("c", "d")), edges.stream().toList());
    }

    @Test
    void edgeViewBunchTest() {
        EdgeView<String> edges = g.edges(List.of("a", "z"));
        assertEquals(List.of(Edge.of("a", "b")), List.copyOf(edges));
        assertTrue(edges.contains("b", "a"));
        assertFalse(edges.contains("b", "c"));
        assertThrows(EdgeNotFoundException.class, () -> edges.get("b", "c"));

        EdgeView<String> edgesOfB = g.edgesOf("b");
        assertEquals(List.of(Edge.of("b", "a"), Edge.of("b", "c")), List.copyOf(edgesOfB));
        assertEquals(edgesOfB.get("a", "b"), edgesOfB.get("b", "a"));

        EdgeView<String> bunch = g.edges(List.of("a", "b", "c"));
        assertEquals(2, bunch.size());
    }

    @Test
    void adjacencyViewTest() {
        AdjacencyView<String, AttributeMap> adj = g.adj();
        assertEquals(3, adj.size());
        assertTrue(adj.contains("a"));
        assertFalse(adj.contains("z"));
        assertEquals(List.of("a", "b", "c"), ImmutableList.copyOf(adj));
        assertEquals(Set.of("a", "c"), adj.get("b").keySet());
        assertSame(g.edges().get("a", "b"), adj.get("b").get("a"));
        assertEquals(adj.get("b"), g.get("b"));
        assertEquals(adj.asMap(), g.adjacency());
        assertEquals(Set.of("a", "b", "c"), adj.asMap().keySet());
        assertThrows(UnsupportedOperationException.class, () -> adj.get("a").remove("b"));
        assertThrows(UnsupportedOperationException.class, () -> adj.asMap().clear());

        // rows are read only but edge attributes can be modified
        adj.get("c").get("b").put("color", "green");
        assertEquals("green", g.edges().get("b", "c").get("color"));

        g.addEdge("c", "a");
        assertEquals(Set.of("b", "a"), adj.get("c").keySet());
    }

    @Test
    void degreeViewTest() {
        g.addEdge("c", "c");
        DegreeView<String> degrees = g.degrees();
        assertNull(degrees.getWeight());
        assertEquals(3, degrees.size());
        assertEquals(3.0, degrees.get("c"));
        assertEquals(List.of(Pair.of("a", 1.0), Pair.of("b", 2.0), Pair.of("c", 3.0)), ImmutableList.copyOf(degrees));
        assertEquals(Map.of("a", 1.0, "b", 2.0, "c", 3.0), degrees.toMap());
        assertEquals(6.0, degrees.sum());

        DegreeView<String> weighted = g.degrees("weight");
        assertEquals("weight", weighted.getWeight());
        assertEquals(Map.of("a", 2.0, "b", 3.0, "c", 3.0), weighted.toMap());

        g.removeEdge("c", "c");
        assertEquals(1.0, degrees.get("c"));
    }

    @Test
    void degreeViewBunchTest() {
        DegreeView<String> degrees = g.degrees(List.of("a", "z"), null);
        assertEquals(1, degrees.size());
        assertEquals(Map.of("a", 1.0), degrees.toMap());
        assertEquals(1.0, degrees.get("a"));
        NodeNotFoundException e = assertThrows(NodeNotFoundException.class, () -> degrees.get("c"));
        assertEquals("c", e.getNode());
        assertThrows(NodeNotFoundException.class, () -> degrees.get("z"));

        g.addEdge("a", "c");
        assertEquals(2.0, degrees.get("a"));
        assertEquals(2.0, degrees.sum());
    }

    @Test
    void directedViewsTest() {
        DiGraph<String> d = g.toDirected();
        d.removeEdge("b", "a");
        assertEquals(Map.of("a", 0.0, "b", 2.0, "c", 1.0), d.inDegrees(null, null).toMap());
        assertEquals(Map.of("b", 1.0), d.outDegrees(List.of("b"), null).toMap());
        assertEquals(Set.of("a", "c"), d.pred().get("b").keySet());
        assertEquals(Set.of("c"), d.succ().get("b").keySet());
        assertEquals(Set.of("a", "b", "c"), d.pred().asMap().keySet());
        assertEquals(List.of(Edge.of("a", "b"), Edge.of("c", "b")), List.copyOf(d.inEdges(List.of("b"))));
        assertEquals(List.of(Edge.of("b", "c")), List.copyOf(d.outEdges(List.of("b"))));
    }
}
