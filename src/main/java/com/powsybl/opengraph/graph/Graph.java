/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.opengraph.graph;

import com.google.common.collect.Maps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;
import java.util.stream.Stream;

/**
 * Undirected graph without parallel edges. Self-loops are allowed.
 * <pre>
 *     Graph&lt;Integer&gt; g = new Graph&lt;&gt;();
 *     g.addEdge(1, 2);
 *     g.addEdge(2, 3, Map.of("weight", 4.7));
 *     g.edges().get(3, 2).put("color", "red"); // same attributes as edge 2-3
 * </pre>
 *
 * @author PowSyBl Open Graph team
 * @param <N> node type
 */
public class Graph<N> extends AbstractUndirectedGraph<N, AttributeMap> {

    private static final Logger LOGGER = LoggerFactory.getLogger(Graph.class);

    public Graph() {
        this(new GraphParameters());
    }

    public Graph(GraphParameters parameters) {
        super(parameters);
    }

    /**
     * Frozen view constructor.
     */
    Graph(Map<N, AttributeMap> nodeTable, AttributeMap graphAttributes, GraphParameters parameters,
          AdjacencyStore<N, AttributeMap> adjacency) {
        super(nodeTable, graphAttributes, parameters, adjacency);
    }

    /**
     * Copy of any graph as an undirected simple graph. Parallel edges and opposite directed edges are merged,
     * attributes of the edges coming later in iteration order overwriting the previous ones.
     */
    public static <N> Graph<N> from(GraphModel<N> other) {
        Objects.requireNonNull(other);
        Graph<N> graph = new Graph<>(other.getParameters().copy());
        graph.getGraphAttributes().putAll(other.getGraphAttributes());
        graph.update(other);
        if (other.isMultigraph() || other.isDirected()) {
            LOGGER.debug("{} edges of {} merged into {} edges", other.numberOfEdges(), other, graph.numberOfEdges());
        }
        return graph;
    }

    public static <N> Graph<N> fromEdges(Iterable<Edge<N>> edges) {
        Graph<N> graph = new Graph<>();
        graph.addEdges(edges);
        return graph;
    }

    @Override
    public boolean isMultigraph() {
        return false;
    }

    @Override
    public void addEdge(N u, N v, Map<String, ?> attributes) {
        Objects.requireNonNull(u);
        Objects.requireNonNull(v);
        Objects.requireNonNull(attributes);
        checkNotFrozen();
        ensureNode(u);
        ensureNode(v);
        AttributeMap data = adjacency.get(u, v);
        if (data == null) {
            data = new AttributeMap();
            adjacency.add(u, v, data);
        }
        data.putAll(attributes);
    }

    @Override
    public void removeEdge(N u, N v) {
        checkNotFrozen();
        adjacency.remove(u, v);
    }

    public Optional<AttributeMap> getEdgeData(N u, N v) {
        return Optional.ofNullable(adjacency.get(u, v));
    }

    @Override
    protected AttributeMap getEdgeAttributes(N u, N v, Object key) {
        if (key != null) {
            throw new GraphCapabilityException("Edges of a simple graph have no key");
        }
        AttributeMap data = adjacency.get(u, v);
        if (data == null) {
            throw new EdgeNotFoundException(u, v);
        }
        return data;
    }

    @Override
    protected int countEdges(AttributeMap data) {
        return 1;
    }

    @Override
    protected double sumWeights(AttributeMap data, String weight) {
        return getEdgeWeight(data, weight);
    }

    @Override
    protected Stream<Edge<N>> streamEdges(N u, N v, AttributeMap data) {
        return Stream.of(Edge.live(u, v, null, data));
    }

    @Override
    protected UnaryOperator<AttributeMap> getDataProtector() {
        return UnaryOperator.identity();
    }

    @Override
    protected Graph<N> createView(Predicate<N> nodeFilter, EdgeFilter<N> edgeFilter) {
        return new Graph<>(Maps.filterKeys(nodeTable, nodeFilter::test), getGraphAttributes(), parameters,
                AdjacencyStore.filterSimple(adjacency, nodeFilter, edgeFilter, false));
    }

    @Override
    public Graph<N> freshCopy() {
        return new Graph<>(parameters);
    }

    @Override
    public Graph<N> copy() {
        return (Graph<N>) super.copy();
    }

    @Override
    public Graph<N> subgraph(Iterable<? extends N> nodes) {
        return (Graph<N>) super.subgraph(nodes);
    }

    @Override
    public Graph<N> toUndirected() {
        return copy();
    }

    /**
     * Directed copy where each edge is replaced by two opposite directed edges, each one with its own copy of
     * the attributes.
     */
    @Override
    public DiGraph<N> toDirected() {
        DiGraph<N> directed = copyNodesInto(new DiGraph<>(parameters));
        streamAdjacencyEntries().forEach(edge -> directed.addEdge(edge.getU(), edge.getV(), edge.getAttributes()));
        return directed;
    }
}
