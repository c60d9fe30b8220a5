/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.opengraph.graph;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Behaviour shared by all graph variants.
 *
 * @author PowSyBl Open Graph team
 */
class GraphModelTest {

    private static Stream<Arguments> provideGraphs() {
        return Stream.of(
                Arguments.of(new Graph<Integer>()),
                Arguments.of(new DiGraph<Integer>()),
                Arguments.of(new MultiGraph<Integer>()),
                Arguments.of(new MultiDiGraph<Integer>()));
    }

    private static void addTriangle(GraphModel<Integer> g) {
        g.addEdge(1, 2);
        g.addEdge(2, 3);
        g.addEdge(3, 1);
    }

    private static AttributeMap attributesOf(GraphModel<Integer> g, int u, int v) {
        return g.edges().stream()
                .filter(edge -> (edge.getU() == u && edge.getV() == v)
                        || (!g.isDirected() && edge.getU() == v && edge.getV() == u))
                .findFirst()
                .orElseThrow()
                .getAttributes();
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("provideGraphs")
    void cascadeDeleteTest(GraphModel<Integer> g) {
        addTriangle(g);
        g.addEdge(2, 2);
        g.addEdge(2, 4);
        g.removeNode(2);
        assertFalse(g.hasNode(2));
        assertEquals(Set.of(1, 3, 4), g.nodes());
        for (Integer n : g) {
            assertFalse(g.adj().get(n).containsKey(2));
            if (g instanceof DirectedGraphModel) {
                assertFalse(((DirectedGraphModel<Integer>) g).pred().get(n).containsKey(2));
            }
        }
        assertEquals(1, g.numberOfEdges());
        assertTrue(g.hasEdge(3, 1));
        assertEquals(0, g.degree(4));
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("provideGraphs")
    void degreeSumTest(GraphModel<Integer> g) {
        addTriangle(g);
        g.addEdge(1, 1);
        g.addEdge(3, 4);
        g.addNode(5);
        assertEquals(2 * g.numberOfEdges(), g.degrees().sum());
        assertEquals(4, g.degree(1));
        assertEquals(0, g.degree(5));
        assertEquals(5, g.degrees().size());
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("provideGraphs")
    void selfLoopTest(GraphModel<Integer> g) {
        g.addEdge(1, 1);
        assertTrue(g.hasEdge(1, 1));
        assertEquals(1, g.numberOfEdges());
        assertEquals(2, g.degree(1));
        assertEquals(List.of(1), List.copyOf(g.neighbors(1)));
        g.removeNode(1);
        assertEquals(0, g.numberOfNodes());
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("provideGraphs")
    void nodeBunchTest(GraphModel<Integer> g) {
        addTriangle(g);
        assertEquals(Map.of(1, 2.0), g.degrees(List.of(1, 42), null).toMap());
        assertTrue(g.edges(List.of(42)).isEmpty());
        assertEquals(3, g.edges(null).size());
        assertThrows(NodeNotFoundException.class, () -> g.edgesOf(42));
        assertThrows(NodeNotFoundException.class, () -> g.degree(42));
        assertThrows(NodeNotFoundException.class, () -> g.degrees().get(42));
        assertThrows(NodeNotFoundException.class, () -> g.neighbors(42));
        assertThrows(NodeNotFoundException.class, () -> g.nodes().get(42));
        assertThrows(NodeNotFoundException.class, () -> g.adj().get(42));
        assertThrows(NodeNotFoundException.class, () -> g.get(42));
        assertThrows(NodeNotFoundException.class, () -> g.removeNode(42));
        assertThrows(NodeNotFoundException.class, () -> NodeBunches.nodesOrFail(g, null));
        assertEquals(List.of(1), NodeBunches.nodesOrFail(g, 1));
        assertEquals(List.of(3, 1), List.copyOf(g.degrees(List.of(3, 42, 1), null).toMap().keySet()));
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("provideGraphs")
    void addEdgesTest(GraphModel<Integer> g) {
        g.addEdges(List.of(Edge.of(1, 2, Map.of("weight", 5)), Edge.of(2, 3)), Map.of("weight", 1, "color", "red"));
        assertEquals(Map.of("weight", 5, "color", "red"), attributesOf(g, 1, 2));
        assertEquals(Map.of("weight", 1, "color", "red"), attributesOf(g, 2, 3));
        assertEquals(6, g.size("weight"));
        assertEquals(2, g.size());
        assertEquals(3, g.order());
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("provideGraphs")
    void frozenSubgraphTest(GraphModel<Integer> g) {
        addTriangle(g);
        g.addEdge(3, 4);
        g.addNode(1, Map.of("color", "red"));
        GraphModel<Integer> sub = g.subgraph(List.of(1, 2, 3, 42));
        assertTrue(sub.isFrozen());
        assertEquals(g.getClass(), sub.getClass());
        assertEquals(Set.of(1, 2, 3), sub.nodes());
        assertEquals(3, sub.numberOfEdges());
        assertEquals("red", sub.nodes().get(1).get("color"));
        assertThrows(GraphCapabilityException.class, () -> sub.addNode(5));
        assertThrows(GraphCapabilityException.class, () -> sub.addEdge(1, 5));
        assertThrows(GraphCapabilityException.class, () -> sub.removeNode(1));
        assertThrows(GraphCapabilityException.class, () -> sub.removeNodes(List.of(1)));
        assertThrows(GraphCapabilityException.class, () -> sub.removeEdges(List.of(Edge.of(1, 2))));
        assertThrows(GraphCapabilityException.class, sub::clearEdges);

        sub.nodes().get(2).put("color", "blue");
        assertEquals("blue", g.nodes().get(2).get("color"));
        g.removeEdge(1, 2);
        assertEquals(2, sub.numberOfEdges());
        g.removeNode(3);
        assertEquals(Set.of(1, 2), sub.nodes());
        assertEquals(0, sub.numberOfEdges());
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("provideGraphs")
    void copyTest(GraphModel<Integer> g) {
        addTriangle(g);
        g.addNode(1, Map.of("color", "red"));
        g.getGraphAttributes().put("name", "triangle");

        GraphModel<Integer> fresh = g.freshCopy();
        assertEquals(g.getClass(), fresh.getClass());
        assertSame(g.getParameters(), fresh.getParameters());
        assertEquals(0, fresh.numberOfNodes());
        assertTrue(fresh.getGraphAttributes().isEmpty());

        GraphModel<Integer> copy = g.copy();
        assertEquals(g.getClass(), copy.getClass());
        assertEquals("triangle", copy.getGraphAttributes().get("name"));
        assertEquals(List.copyOf(g.edges()), List.copyOf(copy.edges()));
        copy.nodes().get(1).put("color", "blue");
        copy.edges().forEach(edge -> edge.getAttributes().put("weight", 2));
        copy.removeNode(3);
        assertEquals("red", g.nodes().get(1).get("color"));
        assertTrue(g.edges().stream().noneMatch(edge -> edge.getAttributes().containsKey("weight")));
        assertEquals(3, g.numberOfEdges());
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("provideGraphs")
    void updateTest(GraphModel<Integer> g) {
        Graph<Integer> other = new Graph<>();
        other.addEdge(1, 2, Map.of("weight", 3));
        other.addNode(5, Map.of("color", "red"));
        g.addEdge(2, 3);
        g.update(other);
        assertEquals(Set.of(2, 3, 1, 5), g.nodes());
        assertEquals("red", g.nodes().get(5).get("color"));
        assertNotSame(other.nodes().get(5), g.nodes().get(5));
        assertTrue(g.hasEdge(1, 2));
        assertEquals(3, attributesOf(g, 1, 2).get("weight"));
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("provideGraphs")
    void conversionTest(GraphModel<Integer> g) {
        g.addEdge(1, 2);
        GraphModel<Integer> directed = g.toDirected();
        GraphModel<Integer> undirected = g.toUndirected();
        assertTrue(directed.isDirected());
        assertFalse(undirected.isDirected());
        assertEquals(g.isMultigraph(), directed.isMultigraph());
        assertEquals(g.isMultigraph(), undirected.isMultigraph());
        assertTrue(directed.hasEdge(1, 2));
        assertTrue(undirected.hasEdge(2, 1));
        assertEquals(g.isDirected() ? 1 : 2, directed.numberOfEdges());
        assertEquals(1, undirected.numberOfEdges());
        assertNotSame(g, directed);
        assertNotSame(g, undirected);
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("provideGraphs")
    void clearTest(GraphModel<Integer> g) {
        addTriangle(g);
        g.clearEdges();
        assertEquals(3, g.numberOfNodes());
        assertEquals(0, g.numberOfEdges());
        assertEquals(0, g.degree(1));
        g.clear();
        assertEquals(0, g.numberOfNodes());
        g.addEdge(1, 2);
        assertEquals(1, g.numberOfEdges());
    }
}
