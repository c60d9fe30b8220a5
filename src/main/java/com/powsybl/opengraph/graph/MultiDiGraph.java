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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;
import java.util.stream.Stream;

/**
 * Directed graph allowing parallel edges, told apart by a key unique between an ordered pair of nodes.
 *
 * @author PowSyBl Open Graph team
 * @param <N> node type
 */
public class MultiDiGraph<N> extends AbstractDirectedGraph<N, Map<Object, AttributeMap>> implements MultiGraphModel<N> {

    private static final Logger LOGGER = LoggerFactory.getLogger(MultiDiGraph.class);

    public MultiDiGraph() {
        this(new GraphParameters());
    }

    public MultiDiGraph(GraphParameters parameters) {
        super(parameters);
    }

    /**
     * Frozen view constructor.
     */
    MultiDiGraph(Map<N, AttributeMap> nodeTable, AttributeMap graphAttributes, GraphParameters parameters,
                 AdjacencyStore<N, Map<Object, AttributeMap>> successorStore,
                 AdjacencyStore<N, Map<Object, AttributeMap>> predecessorStore) {
        super(nodeTable, graphAttributes, parameters, successorStore, predecessorStore);
    }

    /**
     * Copy of any graph as a directed multigraph, keeping the edge keys of the other graph if any. Undirected
     * edges become two opposite directed edges.
     */
    public static <N> MultiDiGraph<N> from(GraphModel<N> other) {
        Objects.requireNonNull(other);
        if (!other.isDirected()) {
            return MultiGraph.from(other).toDirected();
        }
        MultiDiGraph<N> graph = new MultiDiGraph<>(other.getParameters().copy());
        graph.getGraphAttributes().putAll(other.getGraphAttributes());
        graph.update(other);
        return graph;
    }

    public static <N> MultiDiGraph<N> fromEdges(Iterable<Edge<N>> edges) {
        MultiDiGraph<N> graph = new MultiDiGraph<>();
        graph.addEdges(edges);
        return graph;
    }

    @Override
    public boolean isMultigraph() {
        return true;
    }

    @Override
    public Object newEdgeKey(N u, N v) {
        Map<Object, AttributeMap> keys = getSuccessorStore().get(u, v);
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
        Map<Object, AttributeMap> keys = getSuccessorStore().get(u, v);
        if (keys == null) {
            keys = new LinkedHashMap<>();
            link(u, v, keys);
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
     * Removes the last added edge from u to v.
     */
    @Override
    public void removeEdge(N u, N v) {
        checkNotFrozen();
        Map<Object, AttributeMap> keys = getSuccessorStore().get(u, v);
        if (keys == null || keys.isEmpty()) {
            throw new EdgeNotFoundException(u, v);
        }
        removeEdge(u, v, Iterables.getLast(keys.keySet()));
    }

    @Override
    public void removeEdge(N u, N v, Object key) {
        checkNotFrozen();
        Map<Object, AttributeMap> keys = getSuccessorStore().get(u, v);
        if (keys == null || !keys.containsKey(key)) {
            throw new EdgeNotFoundException(u, v, key);
        }
        keys.remove(key);
        if (keys.isEmpty()) {
            unlink(u, v);
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
        Map<Object, AttributeMap> keys = getSuccessorStore().get(u, v);
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
     * Live read only map of key to attributes of the edges from u to v.
     */
    public Optional<Map<Object, AttributeMap>> getEdgeData(N u, N v) {
        return Optional.ofNullable(getSuccessorStore().get(u, v)).map(Collections::unmodifiableMap);
    }

    @Override
    protected AttributeMap getEdgeAttributes(N u, N v, Object key) {
        if (key == null) {
            throw new GraphCapabilityException("A key is needed to identify an edge of a multigraph");
        }
        Map<Object, AttributeMap> keys = getSuccessorStore().get(u, v);
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
    protected MultiDiGraph<N> createView(Predicate<N> nodeFilter, EdgeFilter<N> edgeFilter) {
        return new MultiDiGraph<>(Maps.filterKeys(nodeTable, nodeFilter::test), getGraphAttributes(), parameters,
                AdjacencyStore.filterMulti(getSuccessorStore(), nodeFilter, edgeFilter, false),
                AdjacencyStore.filterMulti(getPredecessorStore(), nodeFilter, edgeFilter, true));
    }

    @Override
    public MultiDiGraph<N> freshCopy() {
        return new MultiDiGraph<>(parameters);
    }

    @Override
    public MultiDiGraph<N> copy() {
        return (MultiDiGraph<N>) super.copy();
    }

    @Override
    public MultiDiGraph<N> subgraph(Iterable<? extends N> nodes) {
        return (MultiDiGraph<N>) super.subgraph(nodes);
    }

    @Override
    public MultiDiGraph<N> toDirected() {
        return copy();
    }

    @Override
    public MultiDiGraph<N> reverse(boolean copy) {
        if (copy) {
            return reverseInto(new MultiDiGraph<>(parameters));
        }
        return new MultiDiGraph<>(nodeTable, getGraphAttributes(), parameters, getPredecessorStore(), getSuccessorStore());
    }

    @Override
    public MultiGraph<N> toUndirected() {
        return toUndirected(false);
    }

    /**
     * Undirected copy keeping the edge keys. Edges u -> v and v -> u with the same key are merged, the
     * attributes of the one coming later in iteration order overwriting the other ones. With {@code reciprocal},
     * an edge is only kept if the opposite edge with the same key exists.
     */
    @Override
    public MultiGraph<N> toUndirected(boolean reciprocal) {
        MultiGraph<N> undirected = copyNodesInto(new MultiGraph<>(parameters));
        int conflicts = 0;
        for (Edge<N> edge : edges()) {
            if (!reciprocal || hasEdge(edge.getV(), edge.getU(), edge.getKey())) {
                if (undirected.hasEdge(edge.getU(), edge.getV(), edge.getKey())
                        && !undirected.getEdgeData(edge.getU(), edge.getV(), edge.getKey()).equals(edge.getAttributes())) {
                    conflicts++;
                }
                undirected.addEdge(edge.getU(), edge.getV(), edge.getKey(), edge.getAttributes());
            }
        }
        if (conflicts > 0) {
            LOGGER.warn("{} opposite edges of {} with different attributes merged", conflicts, this);
        }
        return undirected;
    }
}
