/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.opengraph.graph;

import com.google.common.collect.Iterables;
import com.google.common.collect.Maps;

import java.util.*;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;
import java.util.stream.Stream;

/**
 * Undirected graph allowing parallel edges, told apart by a key unique between a pair of nodes.
 * <pre>
 *     MultiGraph&lt;String&gt; g = new MultiGraph&lt;&gt;();
 *     Object k0 = g.addEdge("a", "b", null, Map.of("route", 28)); // 0
 *     Object k1 = g.addEdge("a", "b", null, Map.of("route", 37)); // 1
 *     g.edges().get("b", "a", k1).get("route"); // 37
 * </pre>
 *
 * @author PowSyBl Open Graph team
 * @param <N> node type
 */
public class MultiGraph<N> extends AbstractUndirectedGraph<N, Map<Object, AttributeMap>> implements MultiGraphModel<N> {

    public MultiGraph() {
        this(new GraphParameters());
    }

    public MultiGraph(GraphParameters parameters) {
        super(parameters);
    }

    /**
     * Frozen view constructor.
     */
    MultiGraph(Map<N, AttributeMap> nodeTable, AttributeMap graphAttributes, GraphParameters parameters,
               AdjacencyStore<N, Map<Object, AttributeMap>> adjacency) {
        super(nodeTable, graphAttributes, parameters, adjacency);
    }

    /**
     * Copy of any graph as an undirected multigraph, keeping the edge keys of the other graph if any.
     */
    public static <N> MultiGraph<N> from(GraphModel<N> other) {
        Objects.requireNonNull(other);
        MultiGraph<N> graph = new MultiGraph<>(other.getParameters().copy());
        graph.getGraphAttributes().putAll(other.getGraphAttributes());
        graph.update(other);
        return graph;
    }

    public static <N> MultiGraph<N> fromEdges(Iterable<Edge<N>> edges) {
        MultiGraph<N> graph = new MultiGraph<>();
        graph.addEdges(edges);
        return graph;
    }

    @Override
    public boolean isMultigraph() {
        return true;
    }

    @Override
    public Object newEdgeKey(N u, N v) {
        Map<Object, AttributeMap> keys = adjacency.get(u, v);
        return parameters.getEdgeKeyPolicy().nextKey(keys != null ? keys : Collections.emptyMap());
    }

    @Override
    public void addEdge(N u, N v, Map<String, ?> attributes) {
        addEdge(u, v, null, attributes);
    }

    @Override
    public Object addEdge(N u, N v, Object key, Map<String, ?> attributes) {
        Objects.requireNonNull(u);
        Objects.requireNonNull(v);
        Objects.requireNonNull(attributes);
        checkNotFrozen();
        ensureNode(u);
        ensureNode(v);
        Map<Object, AttributeMap> keys = adjacency.get(u, v);
        if (keys == null) {
            keys = new LinkedHashMap<>();
            adjacency.add(u, v, keys);
        }
        Object edgeKey = key != null ? key : parameters.getEdgeKeyPolicy().nextKey(keys);
        keys.computeIfAbsent(edgeKey, k -> new AttributeMap()).putAll(attributes);
        return edgeKey;
    }

    @Override
    protected void addEdge(Edge<N> edge, Map<String, ?> attributes) {
        addEdge(edge.getU(), edge.getV(), edge.getKey(), attributes);
    }

    /**
     * Removes the last added edge between u and v.
     */
    @Override
    public void removeEdge(N u, N v) {
        checkNotFrozen();
        Map<Object, AttributeMap> keys = adjacency.get(u, v);
        if (keys == null || keys.isEmpty()) {
            throw new EdgeNotFoundException(u, v);
        }
        removeEdge(u, v, Iterables.getLast(keys.keySet()));
    }

    @Override
    public void removeEdge(N u, N v, Object key) {
        checkNotFrozen();
        Map<Object, AttributeMap> keys = adjacency.get(u, v);
        if (keys == null || !keys.containsKey(key)) {
            throw new EdgeNotFoundException(u, v, key);
        }
        keys.remove(key);
        if (keys.isEmpty()) {
            adjacency.remove(u, v);
        }
    }

    @Override
    protected void removeEdge(Edge<N> edge) {
        if (edge.getKey() != null) {
            removeEdge(edge.getU(), edge.getV(), edge.getKey());
        } else {
            removeEdge(edge.getU(), edge.getV());
        }
    }

    @Override
    public boolean hasEdge(N u, N v, Object key) {
        Map<Object, AttributeMap> keys = adjacency.get(u, v);
        return keys != null && keys.containsKey(key);
    }

    @Override
    protected boolean containsEdge(N u, N v, Object key) {
        return key == null ? hasEdge(u, v) : hasEdge(u, v, key);
    }

    @Override
    public AttributeMap getEdgeData(N u, N v, Object key) {
        return getEdgeAttributes(u, v, key);
    }

    /**
     * Live read only map of key to attributes of the edges between u and v.
     */
    public Optional<Map<Object, AttributeMap>> getEdgeData(N u, N v) {
        return Optional.ofNullable(adjacency.get(u, v)).map(Collections::unmodifiableMap);
    }

    @Override
    protected AttributeMap getEdgeAttributes(N u, N v, Object key) {
        if (key == null) {
            throw new GraphCapabilityException("A key is needed to identify an edge of a multigraph");
        }
        Map<Object, AttributeMap> keys = adjacency.get(u, v);
        AttributeMap data = keys != null ? keys.get(key) : null;
        if (data == null) {
            throw new EdgeNotFoundException(u, v, key);
        }
        return data;
    }

    @Override
    protected int countEdges(Map<Object, AttributeMap> data) {
        return data.size();
    }

    @Override
    protected double sumWeights(Map<Object, AttributeMap> data, String weight) {
        double sum = 0;
        for (AttributeMap attributes : data.values()) {
            sum += getEdgeWeight(attributes, weight);
        }
        return sum;
    }

    @Override
    protected Stream<Edge<N>> streamEdges(N u, N v, Map<Object, AttributeMap> data) {
        return data.entrySet().stream().map(e -> Edge.live(u, v, e.getKey(), e.getValue()));
    }

    @Override
    protected UnaryOperator<Map<Object, AttributeMap>> getDataProtector() {
        return Collections::unmodifiableMap;
    }

    @Override
    protected MultiGraph<N> createView(Predicate<N> nodeFilter, EdgeFilter<N> edgeFilter) {
        return new MultiGraph<>(Maps.filterKeys(nodeTable, nodeFilter::test), getGraphAttributes(), parameters,
                AdjacencyStore.filterMulti(adjacency, nodeFilter, edgeFilter, false));
    }

    @Override
    public MultiGraph<N> freshCopy() {
        return new MultiGraph<>(parameters);
    }

    @Override
    public MultiGraph<N> copy() {
        return (MultiGraph<N>) super.copy();
    }

    @Override
    public MultiGraph<N> subgraph(Iterable<? extends N> nodes) {
        return (MultiGraph<N>) super.subgraph(nodes);
    }

    @Override
    public MultiGraph<N> toUndirected() {
        return copy();
    }

    /**
     * Directed copy where each edge is replaced by two opposite directed edges with the same key, each one with
     * its own copy of the attributes.
     */
    @Override
    public MultiDiGraph<N> toDirected() {
        MultiDiGraph<N> directed = copyNodesInto(new MultiDiGraph<>(parameters));
        streamAdjacencyEntries().forEach(edge -> directed.addEdge(edge.getU(), edge.getV(), edge.getKey(), edge.getAttributes()));
        return directed;
    }
}
