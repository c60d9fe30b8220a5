/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.opengraph.graph;

import com.google.common.collect.Iterables;

import java.util.List;
import java.util.Objects;

/**
 * Normalization of node bunches, which follows two different policies depending on how nodes are given:
 * <ul>
 *     <li>a single node must be in the graph, otherwise a {@link NodeNotFoundException} is raised,</li>
 *     <li>nodes of an iterable which are not in the graph are silently skipped.</li>
 * </ul>
 *
 * @author PowSyBl Open Graph team
 */
public final class NodeBunches {

    private NodeBunches() {
    }

    public static <N> List<N> nodesOrFail(GraphModel<N> graph, N node) {
        Objects.requireNonNull(graph);
        if (node == null || !graph.hasNode(node)) {
            throw new NodeNotFoundException(node);
        }
        return List.of(node);
    }

    /**
     * Lazily filters the bunch to the nodes of the graph, a null bunch meaning all the nodes of the graph.
     */
    public static <N> Iterable<N> nodesFiltering(GraphModel<N> graph, Iterable<? extends N> nbunch) {
        Objects.requireNonNull(graph);
        if (nbunch == null) {
            return graph.nodes();
        }
        return Iterables.filter(Iterables.unmodifiableIterable(nbunch), n -> n != null && graph.hasNode(n));
    }
}
