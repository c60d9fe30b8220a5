/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.opengraph.graph;

import com.google.common.collect.Iterables;
import com.google.common.collect.Lists;
import com.google.common.collect.Streams;

import java.util.*;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;
import java.util.stream.Stream;

/**
 * Node table, graph attributes and frozen state shared by all graph variants. Subclasses provide the adjacency
 * stores and the handling of the edge data, which is an {@link AttributeMap} for simple graphs and a map of edge
 * key to {@link AttributeMap} for multigraphs.
 *
 * @author PowSyBl Open Graph team
 * @param <N> node type
 * @param <D> edge data type
 */
public abstract class AbstractGraph<N, D> implements GraphModel<N> {

    protected final Map<N, AttributeMap> nodeTable;

    private final AttributeMap graphAttributes;

    protected final GraphParameters parameters;

    private final boolean frozen;

    protected AbstractGraph(GraphParameters parameters) {
        this(new LinkedHashMap<>(), new AttributeMap(), parameters, false);
    }

    protected AbstractGraph(Map<N, AttributeMap> nodeTable, AttributeMap graphAttributes, GraphParameters parameters, boolean frozen) {
        this.nodeTable = Objects.requireNonNull(nodeTable);
        this.graphAttributes = Objects.requireNonNull(graphAttributes);
        this.parameters = Objects.requireNonNull(parameters);
        this.frozen = frozen;
    }

    protected abstract AdjacencyStore<N, D> getSuccessorStore();

    protected abstract AdjacencyStore<N, D> getPredecessorStore();

    /**
     * Removes all the adjacency entries of the node, in all stores.
     */
    protected abstract void removeAdjacency(N n);

    protected abstract int countEdges(D data);

    protected abstract double sumWeights(D data, String weight);

    protected abstract Stream<Edge<N>> streamEdges(N u, N v, D data);

    /**
     * @throws EdgeNotFoundException if there is no such edge
     */
    protected abstract AttributeMap getEdgeAttributes(N u, N v, Object key);

    protected abstract UnaryOperator<D> getDataProtector();

    /**
     * Frozen live view restricted to the nodes and edges accepted by the filters.
     */
    protected abstract AbstractGraph<N, D> createView(Predicate<N> nodeFilter, EdgeFilter<N> edgeFilter);

    @Override
    public abstract AbstractGraph<N, D> freshCopy();

    @Override
    public boolean isFrozen() {
        return frozen;
    }

    protected void checkNotFrozen() {
        if (frozen) {
            throw new GraphCapabilityException("Frozen graph can't be modified");
        }
    }

    @Override
    public AttributeMap getGraphAttributes() {
        return graphAttributes;
    }

    @Override
    public GraphParameters getParameters() {
        return parameters;
    }

    protected double getEdgeWeight(AttributeMap attributes, String weight) {
        return attributes.getWeight(weight, parameters.getDefaultWeight());
    }

    /**
     * Adds the node with empty attributes if missing.
     */
    protected void ensureNode(N n) {
        if (!nodeTable.containsKey(n)) {
            nodeTable.put(n, new AttributeMap());
            getSuccessorStore().addNode(n);
            getPredecessorStore().addNode(n);
        }
    }

    @Override
    public void addNode(N n) {
        addNode(n, Collections.emptyMap());
    }

    @Override
    public void addNode(N n, Map<String, ?> attributes) {
        Objects.requireNonNull(n);
        Objects.requireNonNull(attributes);
        checkNotFrozen();
        ensureNode(n);
        nodeTable.get(n).putAll(attributes);
    }

    @Override
    public void addNodes(Iterable<? extends N> nodes) {
        addNodes(nodes, Collections.emptyMap());
    }

    @Override
    public void addNodes(Iterable<? extends N> nodes, Map<String, ?> attributes) {
        Objects.requireNonNull(nodes);
        for (N n : nodes) {
            addNode(n, attributes);
        }
    }

    @Override
    public void removeNode(N n) {
        checkNotFrozen();
        if (!hasNode(n)) {
            throw new NodeNotFoundException(n);
        }
        removeAdjacency(n);
        nodeTable.remove(n);
    }

    @Override
    public void removeNodes(Iterable<? extends N> nodes) {
        Objects.requireNonNull(nodes);
        checkNotFrozen();
        // the bunch may be a view of this graph
        for (N n : Lists.newArrayList(nodes)) {
            if (hasNode(n)) {
                removeNode(n);
            }
        }
    }

    @Override
    public boolean hasNode(N n) {
        return n != null && nodeTable.containsKey(n);
    }

    @Override
    public int numberOfNodes() {
        return nodeTable.size();
    }

    @Override
    public int order() {
        return numberOfNodes();
    }

    @Override
    public Iterator<N> iterator() {
        return nodes().iterator();
    }

    @Override
    public NodeView<N> nodes() {
        return new NodeView<>(nodeTable);
    }

    @Override
    public void addEdge(N u, N v) {
        addEdge(u, v, Collections.emptyMap());
    }

    @Override
    public void addEdges(Iterable<Edge<N>> edges) {
        addEdges(edges, Collections.emptyMap());
    }

    @Override
    public void addEdges(Iterable<Edge<N>> edges, Map<String, ?> attributes) {
        Objects.requireNonNull(edges);
        Objects.requireNonNull(attributes);
        // the edges may be a view of this graph
        for (Edge<N> edge : Lists.newArrayList(edges)) {
            AttributeMap edgeAttributes = new AttributeMap(attributes);
            edgeAttributes.putAll(edge.getAttributes());
            addEdge(edge, edgeAttributes);
        }
    }

    /**
     * Adds a bulk edge, simple graphs ignoring its key.
     */
    protected void addEdge(Edge<N> edge, Map<String, ?> attributes) {
        addEdge(edge.getU(), edge.getV(), attributes);
    }

    @Override
    public void removeEdges(Iterable<Edge<N>> edges) {
        Objects.requireNonNull(edges);
        checkNotFrozen();
        for (Edge<N> edge : Lists.newArrayList(edges)) {
            if (containsEdge(edge.getU(), edge.getV(), edge.getKey())) {
                removeEdge(edge);
            }
        }
    }

    protected void removeEdge(Edge<N> edge) {
        removeEdge(edge.getU(), edge.getV());
    }

    @Override
    public boolean hasEdge(N u, N v) {
        return getSuccessorStore().contains(u, v);
    }

    /**
     * Edge lookup with an optional key, the key being only meaningful for multigraphs.
     */
    protected boolean containsEdge(N u, N v, Object key) {
        return key == null && hasEdge(u, v);
    }

    @Override
    public int numberOfEdges() {
        return (int) streamEdges(nodes(), false).count();
    }

    @Override
    public int numberOfEdges(N u, N v) {
        D data = getSuccessorStore().get(u, v);
        return data != null ? countEdges(data) : 0;
    }

    @Override
    public int size() {
        return numberOfEdges();
    }

    @Override
    public double size(String weight) {
        return streamEdges(nodes(), false)
                .mapToDouble(edge -> getEdgeWeight(edge.getAttributes(), weight))
                .sum();
    }

    /**
     * Edges reported once each, starting from the given nodes (which must be in the graph). For directed graphs,
     * out edges or, if {@code incoming} is true, in edges.
     */
    Stream<Edge<N>> streamEdges(Iterable<N> nodes, boolean incoming) {
        if (isDirected()) {
            AdjacencyStore<N, D> store = incoming ? getPredecessorStore() : getSuccessorStore();
            return Streams.stream(nodes)
                    .flatMap(n -> store.getRow(n).entrySet().stream()
                            .flatMap(e -> incoming ? streamEdges(e.getKey(), n, e.getValue()) : streamEdges(n, e.getKey(), e.getValue())));
        }
        AdjacencyStore<N, D> store = getSuccessorStore();
        Set<N> seen = new HashSet<>();
        return Streams.stream(nodes)
                .flatMap(u -> {
                    seen.add(u);
                    return store.getRow(u).entrySet().stream()
                            .filter(e -> u.equals(e.getKey()) || !seen.contains(e.getKey()))
                            .flatMap(e -> streamEdges(u, e.getKey(), e.getValue()));
                });
    }

    /**
     * Every entry of the successor store, so both orientations of each undirected edge.
     */
    protected Stream<Edge<N>> streamAdjacencyEntries() {
        AdjacencyStore<N, D> store = getSuccessorStore();
        return nodeTable.keySet().stream()
                .flatMap(u -> store.getRow(u).entrySet().stream()
                        .flatMap(e -> streamEdges(u, e.getKey(), e.getValue())));
    }

    @Override
    public EdgeView<N> edges() {
        return new EdgeView<>(this, null, false);
    }

    @Override
    public EdgeView<N> edges(Iterable<? extends N> nbunch) {
        return new EdgeView<>(this, nbunch != null ? Iterables.unmodifiableIterable(nbunch) : null, false);
    }

    @Override
    public EdgeView<N> edgesOf(N n) {
        return new EdgeView<>(this, NodeBunches.nodesOrFail(this, n), false);
    }

    @Override
    public Set<N> neighbors(N n) {
        return getSuccessorStore().neighbors(n);
    }

    @Override
    public AdjacencyView<N, D> adj() {
        return new AdjacencyView<>(getSuccessorStore(), getDataProtector());
    }

    @Override
    public Map<N, Map<N, D>> adjacency() {
        return adj().asMap();
    }

    @Override
    public Map<N, D> get(N n) {
        return adj().get(n);
    }

    protected double rowDegree(Map<N, D> row, String weight) {
        double degree = 0;
        for (D data : row.values()) {
            degree += weight == null ? countEdges(data) : sumWeights(data, weight);
        }
        return degree;
    }

    @Override
    public int degree(N n) {
        return (int) degree(n, null);
    }

    @Override
    public DegreeView<N> degrees() {
        return degrees(null, null);
    }

    @Override
    public DegreeView<N> degrees(String weight) {
        return degrees(null, weight);
    }

    @Override
    public DegreeView<N> degrees(Iterable<? extends N> nbunch, String weight) {
        return new DegreeView<>(this, nbunch, weight, this::degree);
    }

    @Override
    public DegreeView<N> weightedDegrees() {
        return degrees(null, parameters.getWeightAttribute());
    }

    @Override
    public double weightedSize() {
        return size(parameters.getWeightAttribute());
    }

    @Override
    public AbstractGraph<N, D> copy() {
        AbstractGraph<N, D> copy = freshCopy();
        copy.getGraphAttributes().putAll(graphAttributes);
        copy.update(this);
        return copy;
    }

    @Override
    public AbstractGraph<N, D> subgraph(Iterable<? extends N> nodes) {
        Objects.requireNonNull(nodes);
        Set<N> induced = new HashSet<>();
        NodeBunches.nodesFiltering(this, nodes).forEach(induced::add);
        return createView(induced::contains, Filters.noEdgeFilter());
    }

    /**
     * Copies graph attributes, nodes and node attributes into the target, edges being left to the caller.
     */
    protected <G extends GraphModel<N>> G copyNodesInto(G target) {
        target.getGraphAttributes().putAll(graphAttributes);
        for (Map.Entry<N, AttributeMap> e : nodeTable.entrySet()) {
            target.addNode(e.getKey(), e.getValue());
        }
        return target;
    }

    @Override
    public void update(GraphModel<N> other) {
        Objects.requireNonNull(other);
        checkNotFrozen();
        for (Map.Entry<N, AttributeMap> e : other.nodes().data().entrySet()) {
            addNode(e.getKey(), e.getValue());
        }
        addEdges(other.edges());
    }

    @Override
    public void clear() {
        checkNotFrozen();
        nodeTable.clear();
        getSuccessorStore().clear();
        getPredecessorStore().clear();
        graphAttributes.clear();
    }

    @Override
    public void clearEdges() {
        checkNotFrozen();
        getSuccessorStore().clearEdges();
        getPredecessorStore().clearEdges();
    }

    @Override
    public String toString() {
        Object name = graphAttributes.get("name");
        return getClass().getSimpleName() + (name != null ? " named '" + name + "'" : "")
                + " with " + numberOfNodes() + " nodes and " + numberOfEdges() + " edges";
    }
}
