/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.opengraph.graph;

import com.google.common.collect.Iterables;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Directed graphs: a successor store and a predecessor store sharing the same edge data objects, so that
 * {@code v} is a successor of {@code u} if and only if {@code u} is a predecessor of {@code v}.
 * <p>
 * The two stores are held in swappable slots, which allows reversing a graph, or building a reverse view, in
 * constant time.
 *
 * @author PowSyBl Open Graph team
 * @param <N> node type
 * @param <D> edge data type
 */
public abstract class AbstractDirectedGraph<N, D> extends AbstractGraph<N, D> implements DirectedGraphModel<N> {

    private static final Logger LOGGER = LoggerFactory.getLogger(AbstractDirectedGraph.class);

    private AdjacencyStore<N, D> successorStore;

    private AdjacencyStore<N, D> predecessorStore;

    protected AbstractDirectedGraph(GraphParameters parameters) {
        super(parameters);
        this.successorStore = new AdjacencyStore<>();
        this.predecessorStore = new AdjacencyStore<>();
    }

    /**
     * Frozen view constructor.
     */
    protected AbstractDirectedGraph(Map<N, AttributeMap> nodeTable, AttributeMap graphAttributes, GraphParameters parameters,
                                    AdjacencyStore<N, D> successorStore, AdjacencyStore<N, D> predecessorStore) {
        super(nodeTable, graphAttributes, parameters, true);
        this.successorStore = Objects.requireNonNull(successorStore);
        this.predecessorStore = Objects.requireNonNull(predecessorStore);
    }

    @Override
    public boolean isDirected() {
        return true;
    }

    @Override
    protected AdjacencyStore<N, D> getSuccessorStore() {
        return successorStore;
    }

    @Override
    protected AdjacencyStore<N, D> getPredecessorStore() {
        return predecessorStore;
    }

    protected void link(N u, N v, D data) {
        successorStore.add(u, v, data);
        predecessorStore.add(v, u, data);
    }

    protected void unlink(N u, N v) {
        successorStore.remove(u, v);
        predecessorStore.remove(v, u);
    }

    @Override
    protected void removeAdjacency(N n) {
        Map<N, D> outRow = successorStore.removeNode(n);
        for (N successor : outRow.keySet()) {
            if (!successor.equals(n)) {
                predecessorStore.getRow(successor).remove(n);
            }
        }
        Map<N, D> inRow = predecessorStore.removeNode(n);
        for (N predecessor : inRow.keySet()) {
            if (!predecessor.equals(n)) {
                successorStore.getRow(predecessor).remove(n);
            }
        }
    }

    @Override
    public Set<N> successors(N n) {
        return successorStore.neighbors(n);
    }

    @Override
    public Set<N> predecessors(N n) {
        return predecessorStore.neighbors(n);
    }

    @Override
    public boolean hasSuccessor(N u, N v) {
        return successorStore.contains(u, v);
    }

    @Override
    public boolean hasPredecessor(N u, N v) {
        return predecessorStore.contains(u, v);
    }

    @Override
    public int inDegree(N n) {
        return (int) inDegree(n, null);
    }

    @Override
    public double inDegree(N n, String weight) {
        return rowDegree(predecessorStore.getRow(n), weight);
    }

    @Override
    public int outDegree(N n) {
        return (int) outDegree(n, null);
    }

    @Override
    public double outDegree(N n, String weight) {
        return rowDegree(successorStore.getRow(n), weight);
    }

    @Override
    public double degree(N n, String weight) {
        return inDegree(n, weight) + outDegree(n, weight);
    }

    @Override
    public DegreeView<N> inDegrees(Iterable<? extends N> nbunch, String weight) {
        return new DegreeView<>(this, nbunch, weight, this::inDegree);
    }

    @Override
    public DegreeView<N> outDegrees(Iterable<? extends N> nbunch, String weight) {
        return new DegreeView<>(this, nbunch, weight, this::outDegree);
    }

    @Override
    public EdgeView<N> inEdges(Iterable<? extends N> nbunch) {
        return new EdgeView<>(this, nbunch != null ? Iterables.unmodifiableIterable(nbunch) : null, true);
    }

    @Override
    public EdgeView<N> outEdges(Iterable<? extends N> nbunch) {
        return edges(nbunch);
    }

    @Override
    public AdjacencyView<N, D> succ() {
        return adj();
    }

    @Override
    public AdjacencyView<N, D> pred() {
        return new AdjacencyView<>(predecessorStore, getDataProtector());
    }

    @Override
    public void reverseInPlace() {
        checkNotFrozen();
        AdjacencyStore<N, D> tmp = successorStore;
        successorStore = predecessorStore;
        predecessorStore = tmp;
        LOGGER.debug("{} reversed in place", this);
    }

    /**
     * Copies graph attributes, nodes and all edges reversed (with new attribute maps) into the target.
     */
    protected <G extends AbstractDirectedGraph<N, D>> G reverseInto(G target) {
        copyNodesInto(target);
        for (Edge<N> edge : edges()) {
            target.addEdge(edge.reversed(), edge.getAttributes().copy());
        }
        return target;
    }

    @Override
    public AbstractDirectedGraph<N, D> toDirected() {
        return (AbstractDirectedGraph<N, D>) copy();
    }

    @Override
    public GraphModel<N> toUndirected() {
        return toUndirected(false);
    }
}
