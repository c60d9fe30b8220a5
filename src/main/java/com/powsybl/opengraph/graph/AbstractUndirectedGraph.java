/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.opengraph.graph;

import java.util.Map;
import java.util.Objects;

/**
 * Undirected graphs: a single symmetric adjacency store plays both the successor and the predecessor roles.
 *
 * @author PowSyBl Open Graph team
 * @param <N> node type
 * @param <D> edge data type
 */
public abstract class AbstractUndirectedGraph<N, D> extends AbstractGraph<N, D> {

    protected final AdjacencyStore<N, D> adjacency;

    protected AbstractUndirectedGraph(GraphParameters parameters) {
        super(parameters);
        this.adjacency = new SymmetricAdjacencyStore<>();
    }

    /**
     * Frozen view constructor.
     */
    protected AbstractUndirectedGraph(Map<N, AttributeMap> nodeTable, AttributeMap graphAttributes, GraphParameters parameters,
                                      AdjacencyStore<N, D> adjacency) {
        super(nodeTable, graphAttributes, parameters, true);
        this.adjacency = Objects.requireNonNull(adjacency);
    }

    @Override
    public boolean isDirected() {
        return false;
    }

    @Override
    protected AdjacencyStore<N, D> getSuccessorStore() {
        return adjacency;
    }

    @Override
    protected AdjacencyStore<N, D> getPredecessorStore() {
        return adjacency;
    }

    @Override
    protected void removeAdjacency(N n) {
        adjacency.removeNode(n);
    }

    /**
     * A self-loop is seen from both of its ends so it counts twice.
     */
    @Override
    public double degree(N n, String weight) {
        Map<N, D> row = adjacency.getRow(n);
        double degree = rowDegree(row, weight);
        D selfLoopData = row.get(n);
        if (selfLoopData != null) {
            degree += weight == null ? countEdges(selfLoopData) : sumWeights(selfLoopData, weight);
        }
        return degree;
    }

    @Override
    public AbstractUndirectedGraph<N, D> toUndirected() {
        return (AbstractUndirectedGraph<N, D>) copy();
    }
}
