/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.opengraph.algo;

import com.powsybl.opengraph.graph.Edge;
import com.powsybl.opengraph.graph.GraphModel;
import org.jgrapht.Graph;
import org.jgrapht.graph.DirectedPseudograph;
import org.jgrapht.graph.Pseudograph;

import java.util.Objects;

/**
 * Conversion to JGraphT graphs, to run JGraphT algorithms on our graphs.
 *
 * @author PowSyBl Open Graph team
 */
public final class JGraphTConverter {

    private JGraphTConverter() {
    }

    /**
     * JGraphT pseudograph, directed if the given graph is, with the same nodes and whose edges are the edges of
     * the given graph. Later changes of the given graph are not reflected.
     */
    public static <N> Graph<N, Edge<N>> toJGraphT(GraphModel<N> graph) {
        Objects.requireNonNull(graph);
        Graph<N, Edge<N>> jGraph = graph.isDirected() ? new DirectedPseudograph<>(null, null, false)
                                                      : new Pseudograph<>(null, null, false);
        for (N n : graph) {
            jGraph.addVertex(n);
        }
        for (Edge<N> edge : graph.edges()) {
            jGraph.addEdge(edge.getU(), edge.getV(), edge);
        }
        return jGraph;
    }
}
