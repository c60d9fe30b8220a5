/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.opengraph.algo;

import com.powsybl.opengraph.graph.GraphModel;
import org.apache.commons.lang3.tuple.Pair;

import java.util.*;

/**
 * Bridges of an undirected graph, with a recursive depth-first search. Parallel edges and self-loops are never
 * bridges.
 *
 * @author PowSyBl Open Graph team
 */
class BridgesFinder<N> {

    private static class NeighbourList extends ArrayList<Integer> {
    }

    private final GraphModel<N> graph;

    private final List<N> nodes;

    private List<Pair<N, N>> bridges;
    private final NeighbourList[] neighbours;
    private final boolean[] visited;

    /**
     * Depth-first search number
     */
    private final int[] dfsn;

    /**
     * Depth-first search number counter
     */
    private int dfsnCount;

    BridgesFinder(GraphModel<N> graph) {
        this.graph = Objects.requireNonNull(graph);
        this.nodes = new ArrayList<>(graph.nodes());
        int nbNodes = nodes.size();
        this.visited = new boolean[nbNodes];
        this.dfsn = new int[nbNodes];
        this.neighbours = new NeighbourList[nbNodes];
        Map<N, Integer> nums = new HashMap<>();
        for (int i = 0; i < nbNodes; ++i) {
            neighbours[i] = new NeighbourList();
            nums.put(nodes.get(i), i);
        }
        for (int i = 0; i < nbNodes; ++i) {
            for (N neighbour : graph.neighbors(nodes.get(i))) {
                int num = nums.get(neighbour);
                if (num != i) {
                    neighbours[i].add(num);
                }
            }
        }
    }

    /**
     * Finds bridges in a connected component, recursively
     *
     * @param start  node to be visited
     * @param parent parent node of the node to be visited
     * @return the lowest reachable node from given node
     */
    private int findBridgesFromNode(int start, int parent) {

        visited[start] = true;
        dfsnCount++;
        dfsn[start] = dfsnCount;
        int lowestReachableNode = dfsnCount;

        for (int neighbour : neighbours[start]) {
            if (!visited[neighbour]) {
                int lowestN = findBridgesFromNode(neighbour, start);

                // neighbour connected to an ancestor of start
                if (lowestReachableNode > lowestN) {
                    lowestReachableNode = lowestN;
                }

                if (lowestN > dfsn[start] && !doubledEdge(start, neighbour)) {
                    bridges.add(Pair.of(nodes.get(start), nodes.get(neighbour)));
                }
            } else if (neighbour != parent && lowestReachableNode > dfsn[neighbour]) {
                lowestReachableNode = dfsn[neighbour];
            }
        }

        return lowestReachableNode;
    }

    private boolean doubledEdge(int u, int v) {
        return graph.numberOfEdges(nodes.get(u), nodes.get(v)) > 1;
    }

    /**
     * @return the list of bridges, as pairs of nodes ordered by discovery
     */
    List<Pair<N, N>> getBridges() {
        lazySearch();
        return bridges;
    }

    private void lazySearch() {
        if (bridges == null) {
            dfsnCount = 0;
            bridges = new ArrayList<>();
            Arrays.fill(visited, false);
            for (int i = 0; i < nodes.size(); i++) {
                if (!visited[i]) {
                    findBridgesFromNode(i, i);
                }
            }
        }
    }
}
