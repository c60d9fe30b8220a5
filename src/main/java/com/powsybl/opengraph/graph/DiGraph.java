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
 * Directed graph without parallel edges. Self-loops are allowed.
 *
 * @author PowSyBl Open Graph team
 * @param <N> node type
 */
public class DiGraph<N> extends AbstractDirectedGraph<N, AttributeMap> {

    private static final Logger LOGGER = LoggerFactory.getLogger(DiGraph.class);

    public DiGraph() {
        this(new GraphParameters());
    }

    public DiGraph(GraphParameters parameters) {
        super(parameters);
    }

    /**
     * Frozen view constructor.
     */
    DiGraph(Map<N, AttributeMap> nodeTable, AttributeMap graphAttributes, GraphParameters parameters,
            AdjacencyStore<N, AttributeMap> successorStore, AdjacencyStore<N, AttributeMap> predecessorStore) {
        super(nodeTable, graphAttributes, parameters, successorStore, predecessorStore);
    }

    /**
     * Copy of any graph as a directed simple graph. Undirected edges become two opposite directed edges, parallel
     * edges are merged, attributes of the edges coming later in iteration order overwriting the previous ones.
     */
    public static <N> DiGraph<N> from(GraphModel<N> other) {
        Objects.requireNonNull(other);
        if (!other.isDirected()) {
            return Graph.from(other).toDirected();
        }
        DiGraph<N> graph = new DiGraph<>(other.getParameters().copy());
        graph.getGraphAttributes().putAll(other.getGraphAttributes());
        graph.update(other);
        if (other.isMultigraph()) {
            LOGGER.debug("{} edges of {} merged into {} edges", other.numberOfEdges(), other, graph.numberOfEdges());
        }
        return graph;
    }

    public static <N> DiGraph<N> fromEdges(Iterable<Edge<N>> edges) {
        DiGraph<N> graph = new DiGraph<>();
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
        AttributeMap data = getSuccessorStore().get(u, v);
        if (data == null) {
            data = new AttributeMap();
            link(u, v, data);
        }
        data.putAll(attributes);
    }

    @Override
    public void removeEdge(N u, N v) {
        checkNotFrozen();
        unlink(u, v);
    }

    public Optional<AttributeMap> getEdgeData(N u, N v) {
        return Optional.ofNullable(getSuccessorStore().get(u, v));
    }

    @Override
    protected AttributeMap getEdgeAttributes(N u, N v, Object key) {
        if (key != null) {
            throw new GraphCapabilityException("Edges of a simple graph have no key");
        }
        AttributeMap data = getSuccessorStore().get(u, v);
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
    protected DiGraph<N> createView(Predicate<N> nodeFilter, EdgeFilter<N> edgeFilter) {
        return new DiGraph<>(Maps.filterKeys(nodeTable, nodeFilter::test), getGraphAttributes(), parameters,
                AdjacencyStore.filterSimple(getSuccessorStore(), nodeFilter, edgeFilter, false),
                AdjacencyStore.filterSimple(getPredecessorStore(), nodeFilter, edgeFilter, true));
    }

    @Override
    public DiGraph<N> freshCopy() {
        return new DiGraph<>(parameters);
    }

    @Override
    public DiGraph<N> copy() {
        return (DiGraph<N>) super.copy();
    }

    @Override
    public DiGraph<N> subgraph(Iterable<? extends N> nodes) {
        return (DiGraph<N>) super.subgraph(nodes);
    }

    @Override
    public DiGraph<N> toDirected() {
        return copy();
    }

    @Override
    public DiGraph<N> reverse(boolean copy) {
        if (copy) {
            return reverseInto(new DiGraph<>(parameters));
        }
        return new DiGraph<>(nodeTable, getGraphAttributes(), parameters, getPredecessorStore(), getSuccessorStore());
    }

    @Override
    public Graph<N> toUndirected() {
        return toUndirected(false);
    }

    /**
     * Undirected copy. When both u -> v and v -> u exist, they are merged into a single edge, the attributes of
     * the one coming later in iteration order overwriting the other ones.
     */
    @Override
    public Graph<N> toUndirected(boolean reciprocal) {
        Graph<N> undirected = copyNodesInto(new Graph<>(parameters));
        int conflicts = 0;
        for (Edge<N> edge : edges()) {
            if (!reciprocal || hasEdge(edge.getV(), edge.getU())) {
                if (undirected.hasEdge(edge.getU(), edge.getV())
                        && !undirected.edges().get(edge.getU(), edge.getV()).equals(edge.getAttributes())) {
                    conflicts++;
                }
                undirected.addEdge(edge.getU(), edge.getV(), edge.getAttributes());
            }
        }
        if (conflicts > 0) {
            LOGGER.warn("{} opposite edges of {} with different attributes merged", conflicts, this);
        }
        return undirected;
    }
}
