/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.opengraph.algo;

import com.powsybl.opengraph.graph.Edge;
import com.powsybl.opengraph.graph.Graph;
import com.powsybl.opengraph.graph.GraphModel;
import com.powsybl.opengraph.graph.MultiGraph;
import org.apache.commons.lang3.tuple.Pair;
import org.jgrapht.alg.connectivity.BiconnectivityInspector;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * @author PowSyBl Open Graph team
 */
class BridgesTest {

    private static <N> Set<Set<N>> toUnorderedPairs(List<Pair<N, N>> bridges) {
        return bridges.stream().map(p -> Set.of(p.getLeft(), p.getRight())).collect(Collectors.toSet());
    }

    private static <N> Set<Set<N>> getBridgesReference(GraphModel<N> graph) {
        return new BiconnectivityInspector<>(JGraphTConverter.toJGraphT(graph)).getBridges().stream()
                .map(e -> Set.of(e.getU(), e.getV()))
                .collect(Collectors.toSet());
    }

    @Test
    void triangleWithTailTest() {
        Graph<Integer> g = new Graph<>();
        g.addEdges(List.of(Edge.of(1, 2), Edge.of(2, 3), Edge.of(3, 1), Edge.of(3, 4), Edge.of(4, 5)));
        Set<Set<Integer>> bridges = toUnorderedPairs(Connectivity.bridges(g));
        assertEquals(Set.of(Set.of(3, 4), Set.of(4, 5)), bridges);
        assertEquals(getBridgesReference(g), bridges);
    }

    @Test
    void disconnectedTest() {
        Graph<String> g = new Graph<>();
        g.addEdge("a", "b");
        g.addEdge("c", "d");
        g.addEdge("d", "e");
        g.addEdge("e", "c");
        g.addNode("f");
        Set<Set<String>> bridges = toUnorderedPairs(Connectivity.bridges(g));
        assertEquals(Set.of(Set.of("a", "b")), bridges);
        assertEquals(getBridgesReference(g), bridges);
    }

    @Test
    void parallelEdgesTest() {
        MultiGraph<Integer> mg = new MultiGraph<>();
        mg.addEdge(1, 2);
        mg.addEdge(1, 2);
        mg.addEdge(2, 3);
        assertEquals(Set.of(Set.of(2, 3)), toUnorderedPairs(Connectivity.bridges(mg)));
    }

    @Test
    void selfLoopTest() {
        Graph<Integer> g = new Graph<>();
        g.addEdge(1, 1);
        g.addEdge(1, 2);
        assertEquals(Set.of(Set.of(1, 2)), toUnorderedPairs(Connectivity.bridges(g)));

        Graph<Integer> loopOnly = new Graph<>();
        loopOnly.addEdge(1, 1);
        assertTrue(Connectivity.bridges(loopOnly).isEmpty());
        assertTrue(Connectivity.bridges(new Graph<Integer>()).isEmpty());
    }
}
