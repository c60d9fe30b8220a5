/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.opengraph.graph;

import java.util.Map;

/**
 * Capabilities of multigraphs, on top of the common ones. Parallel edges between two nodes are told apart by
 * a key unique for this pair of nodes.
 *
 * @author PowSyBl Open Graph team
 * @param <N> node type
 */
public interface MultiGraphModel<N> extends GraphModel<N> {

    /**
     * Adds an edge and returns its key, a new one chosen with {@link #newEdgeKey} if the given key is null.
     * Adding an edge with an existing key updates the attributes of this edge.
     */
    Object addEdge(N u, N v, Object key, Map<String, ?> attributes);

    Object newEdgeKey(N u, N v);

    /**
     * @throws EdgeNotFoundException if there is no edge with this key between u and v
     */
    void removeEdge(N u, N v, Object key);

    boolean hasEdge(N u, N v, Object key);

    /**
     * @throws EdgeNotFoundException if there is no edge with this key between u and v
     */
    AttributeMap getEdgeData(N u, N v, Object key);
}
