/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.opengraph.algo;

import com.google.common.base.Stopwatch;
import com.powsybl.opengraph.graph.*;
import org.apache.commons.lang3.tuple.Pair;
import org.jgrapht.alg.connectivity.ConnectivityInspector;
import org.jgrapht.alg.connectivity.KosarajuStrongConnectivityInspector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static com.powsybl.opengraph.util.Markers.PERFORMANCE_MARKER;

/**
 * Connected components of undirected graphs, weakly and strongly connected components of directed graphs.
 * Components are sorted by decreasing size.
 *
 * @author PowSyBl Open Graph team
 */
public final class Connectivity {

    private static final Logger LOGGER = LoggerFactory.getLogger(Connectivity.class);

    private Connectivity() {
    }

    private static void checkUndirected(GraphModel<?> graph) {
        if (graph.isDirected()) {
            throw new GraphCapabilityException("Not implemented for directed graphs");
        }
    }

    private static void checkDirected(GraphModel<?> graph) {
        if (!graph.isDirected()) {
            throw new GraphCapabilityException("Not implemented for undirected graphs");
        }
    }

    private static void checkNotNullGraph(GraphModel<?> graph) {
        if (graph.numberOfNodes() == 0) {
            throw new DegenerateGraphException("Connectivity is undefined for the null graph");
        }
    }

    private static <N> List<Set<N>> sortBySizeDescending(List<Set<N>> components) {
        return components.stream()
                .sorted(Comparator.comparing(Set<N>::size).reversed())
                .collect(Collectors.toList());
    }

    /**
     * @throws DegenerateGraphException if the graph has no node
     */
    public static boolean isConnected(GraphModel<?> graph) {
        checkUndirected(graph);
        checkNotNullGraph(graph);
        return new ConnectivityInspector<>(JGraphTConverter.toJGraphT(graph)).isConnected();
    }

    public static int numberConnectedComponents(GraphModel<?> graph) {
        return connectedComponents(graph).size();
    }

    public static <N> List<Set<N>> connectedComponents(GraphModel<N> graph) {
        checkUndirected(graph);
        Stopwatch stopwatch = Stopwatch.createStarted();
        List<Set<N>> components = sortBySizeDescending(new ConnectivityInspector<>(JGraphTConverter.toJGraphT(graph)).connectedSets());
        stopwatch.stop();
        LOGGER.debug(PERFORMANCE_MARKER, "{} connected components of {} found in {} ms", components.size(), graph,
                stopwatch.elapsed(TimeUnit.MILLISECONDS));
        return components;
    }

    /**
     * @throws NodeNotFoundException if the node is not in the graph
     */
    public static <N> Set<N> nodeConnectedComponent(GraphModel<N> graph, N n) {
        checkUndirected(graph);
        NodeBunches.nodesOrFail(graph, n);
        return new ConnectivityInspector<>(JGraphTConverter.toJGraphT(graph)).connectedSetOf(n);
    }

    /**
     * @throws DegenerateGraphException if the graph has no node
     */
    public static boolean isWeaklyConnected(GraphModel<?> graph) {
        checkDirected(graph);
        checkNotNullGraph(graph);
        return new ConnectivityInspector<>(JGraphTConverter.toJGraphT(graph)).isConnected();
    }

    public static <N> List<Set<N>> weaklyConnectedComponents(GraphModel<N> graph) {
        checkDirected(graph);
        return sortBySizeDescending(new ConnectivityInspector<>(JGraphTConverter.toJGraphT(graph)).connectedSets());
    }

    /**
     * @throws DegenerateGraphException if the graph has no node
     */
    public static boolean isStronglyConnected(GraphModel<?> graph) {
        checkDirected(graph);
        checkNotNullGraph(graph);
        return new KosarajuStrongConnectivityInspector<>(JGraphTConverter.toJGraphT(graph)).isStronglyConnected();
    }

    public static <N> List<Set<N>> stronglyConnectedComponents(GraphModel<N> graph) {
        checkDirected(graph);
        Stopwatch stopwatch = Stopwatch.createStarted();
        List<Set<N>> components = sortBySizeDescending(new KosarajuStrongConnectivityInspector<>(JGraphTConverter.toJGraphT(graph)).stronglyConnectedSets());
        stopwatch.stop();
        LOGGER.debug(PERFORMANCE_MARKER, "{} strongly connected components of {} found in {} ms", components.size(), graph,
                stopwatch.elapsed(TimeUnit.MILLISECONDS));
        return components;
    }

    /**
     * Edges whose removal increases the number of connected components.
     */
    public static <N> List<Pair<N, N>> bridges(GraphModel<N> graph) {
        checkUndirected(graph);
        return new BridgesFinder<>(graph).getBridges();
    }
}
