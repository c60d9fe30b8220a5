/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.opengraph.graph;

import java.util.Set;

/**
 * Capabilities of directed graphs, on top of the common ones. The degree of a node is the sum of its in and out
 * degrees, the neighbors of a node are its successors.
 *
 * @author PowSyBl Open Graph team
 * @param <N> node type
 */
public interface DirectedGraphModel<N> extends GraphModel<N> {

    Set<N> successors(N n);

    Set<N> predecessors(N n);

    boolean hasSuccessor(N u, N v);

    boolean hasPredecessor(N u, N v);

    int inDegree(N n);

    double inDegree(N n, String weight);

    int outDegree(N n);

    double outDegree(N n, String weight);

    DegreeView<N> inDegrees(Iterable<? extends N> nbunch, String weight);

    DegreeView<N> outDegrees(Iterable<? extends N> nbunch, String weight);

    /**
     * Edges entering the nodes of the bunch, all of them if the bunch is null.
     */
    EdgeView<N> inEdges(Iterable<? extends N> nbunch);

    /**
     * Same as {@link #edges(Iterable)}.
     */
    EdgeView<N> outEdges(Iterable<? extends N> nbunch);

    AdjacencyView<N, ?> succ();

    AdjacencyView<N, ?> pred();

    /**
     * Graph with all edges reversed: an independent copy if {@code copy} is true, otherwise a read only view
     * built in constant time by swapping the successor and predecessor stores.
     */
    DirectedGraphModel<N> reverse(boolean copy);

    /**
     * Reverses all edges of this graph in constant time, by swapping the successor and predecessor stores.
     * <p>
     * Views created before the call (reverse views, subgraph views, adjacency views) keep the stores they were
     * built on, so they show the orientation the graph had when they were created. Create them again after
     * reversing.
     */
    void reverseInPlace();

    /**
     * Undirected copy; with {@code reciprocal} only the edges existing in both directions are kept.
     */
    GraphModel<N> toUndirected(boolean reciprocal);
}
