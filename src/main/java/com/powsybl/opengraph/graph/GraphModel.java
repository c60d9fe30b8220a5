/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.opengraph.graph;

import java.util.Map;
import java.util.Set;

/**
 * Capabilities shared by the four graph variants ({@link Graph}, {@link DiGraph}, {@link MultiGraph} and
 * {@link MultiDiGraph}). Algorithms only rely on this contract and branch on {@link #isDirected()} and
 * {@link #isMultigraph()} instead of on the concrete class.
 * <p>
 * Nodes are any non null objects with consistent equals and hashCode. Iteration order is always the insertion
 * order. Views returned by queries are live: they reflect later changes of the graph, but structural changes
 * while iterating one of them are not supported. Reversing a directed graph in place is the exception, see
 * {@link DirectedGraphModel#reverseInPlace()}.
 *
 * @author PowSyBl Open Graph team
 * @param <N> node type
 */
public interface GraphModel<N> extends Iterable<N> {

    boolean isDirected();

    boolean isMultigraph();

    /**
     * A frozen graph (typically a subgraph or a reverse view) rejects structural changes.
     */
    boolean isFrozen();

    AttributeMap getGraphAttributes();

    GraphParameters getParameters();

    void addNode(N n);

    /**
     * Adds the node if missing and updates its attributes.
     */
    void addNode(N n, Map<String, ?> attributes);

    void addNodes(Iterable<? extends N> nodes);

    void addNodes(Iterable<? extends N> nodes, Map<String, ?> attributes);

    /**
     * Removes the node and all its incident edges.
     *
     * @throws NodeNotFoundException if the node is not in the graph
     */
    void removeNode(N n);

    /**
     * Removes the nodes and all their incident edges, silently ignoring the nodes which are not in the graph.
     */
    void removeNodes(Iterable<? extends N> nodes);

    boolean hasNode(N n);

    int numberOfNodes();

    /**
     * Same as {@link #numberOfNodes()}.
     */
    int order();

    NodeView<N> nodes();

    /**
     * Adds an edge, creating the missing end nodes. On a simple graph, adding an existing edge only updates its
     * attributes, on a multigraph it adds a parallel edge.
     */
    void addEdge(N u, N v);

    void addEdge(N u, N v, Map<String, ?> attributes);

    /**
     * Adds all the given edges, the keys of the given edges being only used by multigraphs.
     */
    void addEdges(Iterable<Edge<N>> edges);

    /**
     * Adds all the given edges with common attributes, the own attributes of each edge taking precedence.
     */
    void addEdges(Iterable<Edge<N>> edges, Map<String, ?> attributes);

    /**
     * Removes the edge between u and v (for multigraphs, the last added one).
     *
     * @throws EdgeNotFoundException if there is no such edge
     */
    void removeEdge(N u, N v);

    /**
     * Removes the given edges, silently ignoring the ones which are not in the graph.
     */
    void removeEdges(Iterable<Edge<N>> edges);

    boolean hasEdge(N u, N v);

    int numberOfEdges();

    int numberOfEdges(N u, N v);

    /**
     * Same as {@link #numberOfEdges()}.
     */
    int size();

    /**
     * Sum of all the edge weights, a null weight attribute meaning unweighted.
     */
    double size(String weight);

    EdgeView<N> edges();

    /**
     * Edges incident to the nodes of the bunch, silently ignoring the nodes which are not in the graph.
     */
    EdgeView<N> edges(Iterable<? extends N> nbunch);

    /**
     * Edges incident to the given node.
     *
     * @throws NodeNotFoundException if the node is not in the graph
     */
    EdgeView<N> edgesOf(N n);

    /**
     * Live read only set of the neighbors (successors for directed graphs).
     *
     * @throws NodeNotFoundException if the node is not in the graph
     */
    Set<N> neighbors(N n);

    AdjacencyView<N, ?> adj();

    /**
     * Live read only map of node to adjacency row, same as {@code adj().asMap()}.
     */
    Map<N, ? extends Map<N, ?>> adjacency();

    /**
     * Adjacency row shorthand, same as {@code adj().get(n)}.
     */
    Map<N, ?> get(N n);

    /**
     * Number of edges incident to the node, a self-loop counting twice.
     */
    int degree(N n);

    double degree(N n, String weight);

    DegreeView<N> degrees();

    DegreeView<N> degrees(String weight);

    DegreeView<N> degrees(Iterable<? extends N> nbunch, String weight);

    /**
     * Degrees weighted by the edge attribute named by {@link GraphParameters#getWeightAttribute()}.
     */
    DegreeView<N> weightedDegrees();

    /**
     * Total weight of the edges, read from the edge attribute named by {@link GraphParameters#getWeightAttribute()}.
     */
    double weightedSize();

    /**
     * Independent copy, with new attribute maps.
     */
    GraphModel<N> copy();

    /**
     * Empty graph of the same concrete class and with the same parameters.
     */
    GraphModel<N> freshCopy();

    /**
     * Read only live view induced by the given nodes, sharing the attribute maps of this graph.
     */
    GraphModel<N> subgraph(Iterable<? extends N> nodes);

    GraphModel<N> toDirected();

    GraphModel<N> toUndirected();

    /**
     * Adds the nodes and edges of another graph, copying their attributes.
     */
    void update(GraphModel<N> other);

    void clear();

    void clearEdges();
}
