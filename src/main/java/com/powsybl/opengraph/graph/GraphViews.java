/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.opengraph.graph;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Read only live views of a graph. They share the attribute maps of the viewed graph and reflect its later
 * changes, but reject structural changes themselves; use {@link GraphModel#copy()} to get an independent graph.
 *
 * @author PowSyBl Open Graph team
 */
public final class GraphViews {

    private GraphViews() {
    }

    private static <N> AbstractGraph<N, ?> check(GraphModel<N> graph) {
        Objects.requireNonNull(graph);
        if (!(graph instanceof AbstractGraph)) {
            throw new GraphCapabilityException("Views are not supported for graph class " + graph.getClass().getName());
        }
        return (AbstractGraph<N, ?>) graph;
    }

    /**
     * View restricted to the nodes and edges accepted by the filters. An edge is only visible if both its ends are.
     */
    public static <N> GraphModel<N> subgraphView(GraphModel<N> graph, Predicate<N> nodeFilter, EdgeFilter<N> edgeFilter) {
        Objects.requireNonNull(nodeFilter);
        Objects.requireNonNull(edgeFilter);
        return check(graph).createView(nodeFilter, edgeFilter);
    }

    /**
     * View of the given nodes and of all the edges between them.
     */
    public static <N> GraphModel<N> inducedSubgraph(GraphModel<N> graph, Iterable<? extends N> nodes) {
        return check(graph).subgraph(nodes);
    }

    /**
     * View of the given edges and of their end nodes. For multigraphs, edges without key select all the parallel
     * edges between their ends.
     */
    public static <N> GraphModel<N> edgeSubgraph(GraphModel<N> graph, Iterable<Edge<N>> edges) {
        Objects.requireNonNull(edges);
        Set<N> nodes = new LinkedHashSet<>();
        for (Edge<N> edge : edges) {
            nodes.add(edge.getU());
            nodes.add(edge.getV());
        }
        EdgeFilter<N> edgeFilter = Filters.showEdges(graph, edges);
        if (graph.isMultigraph()) {
            EdgeFilter<N> keyedFilter = edgeFilter;
            EdgeFilter<N> unkeyedFilter = graph.isDirected() ? Filters.showDiEdges(edgesWithoutKey(edges))
                                                             : Filters.showEdges(edgesWithoutKey(edges));
            edgeFilter = (u, v, key) -> keyedFilter.test(u, v, key) || unkeyedFilter.test(u, v, key);
        }
        return subgraphView(graph, nodes::contains, edgeFilter);
    }

    private static <N> Iterable<Edge<N>> edgesWithoutKey(Iterable<Edge<N>> edges) {
        Set<Edge<N>> withoutKey = new LinkedHashSet<>();
        for (Edge<N> edge : edges) {
            if (edge.getKey() == null) {
                withoutKey.add(edge);
            }
        }
        return withoutKey;
    }

    /**
     * View hiding the given nodes and edges.
     */
    public static <N> GraphModel<N> restrictedView(GraphModel<N> graph, Iterable<? extends N> nodes, Iterable<Edge<N>> edges) {
        return subgraphView(graph, Filters.hideNodes(nodes), Filters.hideEdges(graph, edges));
    }

    /**
     * View with all edges reversed, built in constant time.
     */
    public static <N> DirectedGraphModel<N> reverseView(GraphModel<N> graph) {
        if (!(graph instanceof DirectedGraphModel)) {
            throw new GraphCapabilityException("Reverse view is only defined for directed graphs");
        }
        return ((DirectedGraphModel<N>) graph).reverse(false);
    }

    /**
     * Directed view of a graph, built in constant time. Each undirected edge is seen as two opposite directed
     * edges sharing the same attributes. A directed graph is only frozen.
     */
    public static <N> DirectedGraphModel<N> toDirectedView(GraphModel<N> graph) {
        Objects.requireNonNull(graph);
        if (graph.isDirected()) {
            return (DirectedGraphModel<N>) freeze(graph);
        }
        if (graph instanceof Graph) {
            Graph<N> undirected = (Graph<N>) graph;
            return new DiGraph<>(Collections.unmodifiableMap(undirected.nodeTable), undirected.getGraphAttributes(),
                    undirected.getParameters(), undirected.adjacency, undirected.adjacency);
        }
        if (graph instanceof MultiGraph) {
            MultiGraph<N> undirected = (MultiGraph<N>) graph;
            return new MultiDiGraph<>(Collections.unmodifiableMap(undirected.nodeTable), undirected.getGraphAttributes(),
                    undirected.getParameters(), undirected.adjacency, undirected.adjacency);
        }
        throw new GraphCapabilityException("Directed view is not supported for graph class " + graph.getClass().getName());
    }

    /**
     * Undirected view of a graph, built in constant time. u and v are adjacent if u -> v or v -> u exists; when
     * both exist, the edge is seen from each end with the attributes of the edge leaving that end. For
     * multigraphs, the parallel edges of both directions are merged by key the same way. An undirected graph is
     * only frozen.
     */
    public static <N> GraphModel<N> toUndirectedView(GraphModel<N> graph) {
        Objects.requireNonNull(graph);
        if (!graph.isDirected()) {
            return freeze(graph);
        }
        if (graph instanceof DiGraph) {
            DiGraph<N> directed = (DiGraph<N>) graph;
            return new Graph<>(Collections.unmodifiableMap(directed.nodeTable), directed.getGraphAttributes(),
                    directed.getParameters(),
                    AdjacencyStore.union(directed.getSuccessorStore(), directed.getPredecessorStore(), (out, in) -> out));
        }
        if (graph instanceof MultiDiGraph) {
            MultiDiGraph<N> directed = (MultiDiGraph<N>) graph;
            return new MultiGraph<>(Collections.unmodifiableMap(directed.nodeTable), directed.getGraphAttributes(),
                    directed.getParameters(),
                    AdjacencyStore.union(directed.getSuccessorStore(), directed.getPredecessorStore(), GraphViews::unionKeys));
        }
        throw new GraphCapabilityException("Undirected view is not supported for graph class " + graph.getClass().getName());
    }

    private static Map<Object, AttributeMap> unionKeys(Map<Object, AttributeMap> outKeys, Map<Object, AttributeMap> inKeys) {
        return AdjacencyStore.unionRow(outKeys, inKeys, (outData, inData) -> outData);
    }

    /**
     * Frozen view of the whole graph.
     */
    public static <N> GraphModel<N> freeze(GraphModel<N> graph) {
        if (graph.isFrozen()) {
            return graph;
        }
        return subgraphView(graph, Filters.noFilter(), Filters.noEdgeFilter());
    }
}
