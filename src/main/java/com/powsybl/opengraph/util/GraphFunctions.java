/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.opengraph.util;

import com.google.common.collect.Iterables;
import com.google.common.collect.Lists;
import com.powsybl.opengraph.graph.*;
import org.apache.commons.lang3.tuple.Pair;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Graph level helpers working with any graph variant.
 *
 * @author PowSyBl Open Graph team
 */
public final class GraphFunctions {

    private GraphFunctions() {
    }

    /**
     * Number of edges divided by the number of possible edges without self-loops, 0 for graphs with less than 2
     * nodes. Multigraphs and graphs with self-loops may have a density greater than 1.
     */
    public static double density(GraphModel<?> graph) {
        long n = graph.numberOfNodes();
        long m = graph.numberOfEdges();
        if (m == 0 || n <= 1) {
            return 0;
        }
        double d = (double) m / (n * (n - 1));
        return graph.isDirected() ? d : 2 * d;
    }

    /**
     * Frequency of each degree value, indexed by degree.
     */
    public static <N> List<Integer> degreeHistogram(GraphModel<N> graph) {
        Map<Integer, Integer> counts = new HashMap<>();
        int maxDegree = -1;
        for (N n : graph) {
            int degree = graph.degree(n);
            counts.merge(degree, 1, Integer::sum);
            maxDegree = Math.max(maxDegree, degree);
        }
        List<Integer> histogram = new ArrayList<>(maxDegree + 1);
        for (int degree = 0; degree <= maxDegree; degree++) {
            histogram.add(counts.getOrDefault(degree, 0));
        }
        return histogram;
    }

    /**
     * True if the graph has no edge, whatever its number of nodes.
     */
    public static boolean isEmpty(GraphModel<?> graph) {
        for (Map<?, ?> row : graph.adjacency().values()) {
            if (!row.isEmpty()) {
                return false;
            }
        }
        return true;
    }

    /**
     * Adds edges from the first node to each of the other ones.
     */
    public static <N> void addStar(GraphModel<N> graph, List<N> nodes, Map<String, ?> attributes) {
        if (nodes.isEmpty()) {
            return;
        }
        N center = nodes.get(0);
        graph.addNode(center);
        for (N n : nodes.subList(1, nodes.size())) {
            graph.addEdge(center, n, attributes);
        }
    }

    /**
     * Adds edges between consecutive nodes.
     */
    public static <N> void addPath(GraphModel<N> graph, List<N> nodes, Map<String, ?> attributes) {
        if (nodes.isEmpty()) {
            return;
        }
        graph.addNode(nodes.get(0));
        for (int i = 1; i < nodes.size(); i++) {
            graph.addEdge(nodes.get(i - 1), nodes.get(i), attributes);
        }
    }

    /**
     * Adds a path closed by an edge from the last node to the first one.
     */
    public static <N> void addCycle(GraphModel<N> graph, List<N> nodes, Map<String, ?> attributes) {
        if (nodes.isEmpty()) {
            return;
        }
        addPath(graph, nodes, attributes);
        graph.addEdge(Iterables.getLast(nodes), nodes.get(0), attributes);
    }

    /**
     * Graph of the same variant with the same nodes and no edge.
     */
    public static <N> GraphModel<N> createEmptyCopy(GraphModel<N> graph, boolean withData) {
        GraphModel<N> copy = graph.freshCopy();
        if (withData) {
            copy.getGraphAttributes().putAll(graph.getGraphAttributes());
            for (Map.Entry<N, AttributeMap> e : graph.nodes().data().entrySet()) {
                copy.addNode(e.getKey(), e.getValue());
            }
        } else {
            copy.addNodes(graph.nodes());
        }
        return copy;
    }

    /**
     * Sets the attribute of each node of the map, nodes which are not in the graph being ignored.
     */
    public static <N> void setNodeAttributes(GraphModel<N> graph, Map<N, ?> values, String name) {
        Objects.requireNonNull(name);
        for (Map.Entry<N, ?> e : values.entrySet()) {
            if (graph.hasNode(e.getKey())) {
                graph.nodes().get(e.getKey()).put(name, e.getValue());
            }
        }
    }

    /**
     * Node attributes of the given name, for the nodes having it.
     */
    public static <N> Map<N, Object> getNodeAttributes(GraphModel<N> graph, String name) {
        Objects.requireNonNull(name);
        Map<N, Object> values = new LinkedHashMap<>();
        for (Map.Entry<N, AttributeMap> e : graph.nodes().data().entrySet()) {
            if (e.getValue().containsKey(name)) {
                values.put(e.getKey(), e.getValue().get(name));
            }
        }
        return values;
    }

    /**
     * Sets the attribute of each edge of the map, edges which are not in the graph being ignored. Edges of a
     * multigraph are identified by their key, a missing key selecting all the parallel edges.
     */
    public static <N> void setEdgeAttributes(GraphModel<N> graph, Map<Edge<N>, ?> values, String name) {
        Objects.requireNonNull(name);
        EdgeView<N> edges = graph.edges();
        for (Map.Entry<Edge<N>, ?> e : values.entrySet()) {
            Edge<N> edge = e.getKey();
            if (!edges.contains(edge)) {
                continue;
            }
            if (graph.isMultigraph() && edge.getKey() == null) {
                for (Edge<N> parallelEdge : parallelEdges(graph, edge.getU(), edge.getV())) {
                    parallelEdge.getAttributes().put(name, e.getValue());
                }
            } else {
                edges.get(edge.getU(), edge.getV(), edge.getKey()).put(name, e.getValue());
            }
        }
    }

    private static <N> List<Edge<N>> parallelEdges(GraphModel<N> graph, N u, N v) {
        return graph.edgesOf(u).stream()
                .filter(edge -> (edge.getU().equals(u) && edge.getV().equals(v))
                        || (!graph.isDirected() && edge.getU().equals(v) && edge.getV().equals(u)))
                .collect(Collectors.toList());
    }

    /**
     * Edge attributes of the given name, for the edges having it.
     */
    public static <N> Map<Edge<N>, Object> getEdgeAttributes(GraphModel<N> graph, String name) {
        Objects.requireNonNull(name);
        Map<Edge<N>, Object> values = new LinkedHashMap<>();
        for (Edge<N> edge : graph.edges()) {
            if (edge.getAttributes().containsKey(name)) {
                values.put(edge, edge.getAttributes().get(name));
            }
        }
        return values;
    }

    /**
     * Successors and predecessors of a directed graph node, neighbors of an undirected graph node.
     *
     * @throws NodeNotFoundException if the node is not in the graph
     */
    public static <N> Set<N> allNeighbors(GraphModel<N> graph, N n) {
        if (graph instanceof DirectedGraphModel) {
            DirectedGraphModel<N> directedGraph = (DirectedGraphModel<N>) graph;
            Set<N> neighbors = new LinkedHashSet<>(directedGraph.predecessors(n));
            neighbors.addAll(directedGraph.successors(n));
            return neighbors;
        }
        return new LinkedHashSet<>(graph.neighbors(n));
    }

    /**
     * Nodes which are neither the given node nor one of its neighbors (successors for directed graphs).
     */
    public static <N> Set<N> nonNeighbors(GraphModel<N> graph, N n) {
        Set<N> neighbors = graph.neighbors(n);
        Set<N> nonNeighbors = new LinkedHashSet<>();
        for (N other : graph) {
            if (!other.equals(n) && !neighbors.contains(other)) {
                nonNeighbors.add(other);
            }
        }
        return nonNeighbors;
    }

    /**
     * Pairs of distinct nodes not linked by an edge, each pair being reported once for undirected graphs.
     */
    public static <N> List<Pair<N, N>> nonEdges(GraphModel<N> graph) {
        List<Pair<N, N>> nonEdges = new ArrayList<>();
        if (graph.isDirected()) {
            for (N u : graph) {
                for (N v : nonNeighbors(graph, u)) {
                    nonEdges.add(Pair.of(u, v));
                }
            }
        } else {
            List<N> nodes = Lists.newArrayList(graph);
            for (int i = 0; i < nodes.size(); i++) {
                N u = nodes.get(i);
                Set<N> neighbors = graph.neighbors(u);
                for (N v : nodes.subList(i + 1, nodes.size())) {
                    if (!neighbors.contains(v)) {
                        nonEdges.add(Pair.of(u, v));
                    }
                }
            }
        }
        return nonEdges;
    }

    /**
     * Neighbors shared by u and v, except u and v themselves.
     *
     * @throws GraphCapabilityException if the graph is directed
     * @throws NodeNotFoundException if u or v is not in the graph
     */
    public static <N> Set<N> commonNeighbors(GraphModel<N> graph, N u, N v) {
        if (graph.isDirected()) {
            throw new GraphCapabilityException("Common neighbors are not defined for directed graphs");
        }
        Set<N> neighborsOfV = graph.neighbors(v);
        Set<N> common = new LinkedHashSet<>();
        for (N w : graph.neighbors(u)) {
            if (neighborsOfV.contains(w) && !w.equals(u) && !w.equals(v)) {
                common.add(w);
            }
        }
        return common;
    }

    /**
     * True if all the edges have the weight attribute, false for a graph without edges.
     */
    public static boolean isWeighted(GraphModel<?> graph, String weight) {
        Objects.requireNonNull(weight);
        return !isEmpty(graph) && graph.edges().stream().allMatch(edge -> edge.getAttributes().containsKey(weight));
    }

    /**
     * Same as {@link #isWeighted(GraphModel, String)} with the weight attribute of the graph parameters.
     */
    public static boolean isWeighted(GraphModel<?> graph) {
        return isWeighted(graph, graph.getParameters().getWeightAttribute());
    }

    /**
     * True if the given edge has the weight attribute.
     *
     * @throws EdgeNotFoundException if there is no such edge
     */
    public static <N> boolean isWeighted(GraphModel<N> graph, Edge<N> edge, String weight) {
        Objects.requireNonNull(weight);
        return getEdgeAttributes(graph, edge).containsKey(weight);
    }

    /**
     * True if at least one edge has a negative weight.
     */
    public static boolean isNegativelyWeighted(GraphModel<?> graph, String weight) {
        Objects.requireNonNull(weight);
        return graph.edges().stream().anyMatch(edge -> isNegative(edge.getAttributes(), weight));
    }

    /**
     * Same as {@link #isNegativelyWeighted(GraphModel, String)} with the weight attribute of the graph parameters.
     */
    public static boolean isNegativelyWeighted(GraphModel<?> graph) {
        return isNegativelyWeighted(graph, graph.getParameters().getWeightAttribute());
    }

    /**
     * True if the given edge has a negative weight.
     *
     * @throws EdgeNotFoundException if there is no such edge
     */
    public static <N> boolean isNegativelyWeighted(GraphModel<N> graph, Edge<N> edge, String weight) {
        Objects.requireNonNull(weight);
        return isNegative(getEdgeAttributes(graph, edge), weight);
    }

    private static boolean isNegative(AttributeMap attributes, String weight) {
        return attributes.containsKey(weight) && attributes.getDouble(weight, 0) < 0;
    }

    private static <N> AttributeMap getEdgeAttributes(GraphModel<N> graph, Edge<N> edge) {
        if (graph.isMultigraph() && edge.getKey() == null) {
            List<Edge<N>> parallelEdges = parallelEdges(graph, edge.getU(), edge.getV());
            if (parallelEdges.isEmpty()) {
                throw new EdgeNotFoundException(edge.getU(), edge.getV());
            }
            return parallelEdges.get(0).getAttributes();
        }
        return graph.edges().get(edge.getU(), edge.getV(), edge.getKey());
    }

    public static <N> Set<N> nodesWithSelfloops(GraphModel<N> graph) {
        Set<N> nodes = new LinkedHashSet<>();
        for (N n : graph) {
            if (graph.hasEdge(n, n)) {
                nodes.add(n);
            }
        }
        return nodes;
    }

    /**
     * Self-loops, parallel self-loops of a multigraph being reported separately.
     */
    public static <N> List<Edge<N>> selfloopEdges(GraphModel<N> graph) {
        return graph.edges(nodesWithSelfloops(graph)).stream()
                .filter(Edge::isSelfLoop)
                .collect(Collectors.toList());
    }

    public static int numberOfSelfloops(GraphModel<?> graph) {
        return selfloopEdges(graph).size();
    }

    /**
     * Read only live view of the whole graph.
     */
    public static <N> GraphModel<N> freeze(GraphModel<N> graph) {
        return GraphViews.freeze(graph);
    }

    public static boolean isFrozen(GraphModel<?> graph) {
        return graph.isFrozen();
    }

    /**
     * Short textual summary of the graph.
     */
    public static String info(GraphModel<?> graph) {
        StringBuilder info = new StringBuilder();
        info.append("Name: ").append(graph.getGraphAttributes().getString("name", "")).append('\n')
                .append("Type: ").append(graph.getClass().getSimpleName()).append('\n')
                .append("Number of nodes: ").append(graph.numberOfNodes()).append('\n')
                .append("Number of edges: ").append(graph.numberOfEdges());
        int n = graph.numberOfNodes();
        if (n > 0) {
            if (graph instanceof DirectedGraphModel) {
                DirectedGraphModel<?> directedGraph = (DirectedGraphModel<?>) graph;
                info.append('\n').append(String.format(Locale.US, "Average in degree: %8.4f", directedGraph.inDegrees(null, null).sum() / n))
                        .append('\n').append(String.format(Locale.US, "Average out degree: %8.4f", directedGraph.outDegrees(null, null).sum() / n));
            } else {
                info.append('\n').append(String.format(Locale.US, "Average degree: %8.4f", graph.degrees().sum() / n));
            }
        }
        return info.toString();
    }

    /**
     * Short textual summary of a node.
     *
     * @throws NodeNotFoundException if the node is not in the graph
     */
    public static <N> String info(GraphModel<N> graph, N n) {
        NodeBunches.nodesOrFail(graph, n);
        return "Node " + n + " has the following properties:\n"
                + "Degree: " + graph.degree(n) + '\n'
                + "Neighbors: " + graph.neighbors(n).stream().map(String::valueOf).collect(Collectors.joining(" "));
    }
}
