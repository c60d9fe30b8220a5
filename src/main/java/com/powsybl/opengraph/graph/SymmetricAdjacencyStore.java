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
 * Adjacency store of undirected graphs: every (u, v) entry is mirrored by a (v, u) entry holding the same data
 * object, so that edge data changed from one end is seen from the other one.
 *
 * @author PowSyBl Open Graph team
 * @param <N> node type
 * @param <D> edge data type
 */
public class SymmetricAdjacencyStore<N, D> extends AdjacencyStore<N, D> {

    @Override
    public void add(N u, N v, D data) {
        super.add(u, v, data);
        if (!u.equals(v)) {
            rows.get(v).put(u, data);
        }
    }

    @Override
    public D remove(N u, N v) {
        D data = super.remove(u, v);
        if (!u.equals(v)) {
            rows.get(v).remove(u);
        }
        return data;
    }

    /**
     * Removes the row of the given node and the mirror entries of all its neighbors.
     */
    @Override
    public Map<N, D> removeNode(N n) {
        Map<N, D> row = super.removeNode(n);
        for (N neighbor : row.keySet()) {
            if (!neighbor.equals(n)) {
                rows.get(neighbor).remove(n);
            }
        }
        return row;
    }
}
