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
 * How a multigraph chooses the key of a new edge when none is given. Keys are only unique between a given pair
 * of nodes.
 *
 * @author PowSyBl Open Graph team
 */
public enum EdgeKeyPolicy {
    /**
     * Smallest non negative integer not used between the two nodes.
     */
    SMALLEST_UNUSED {
        @Override
        public Object nextKey(Map<Object, ?> keys) {
            return firstUnused(keys, 0);
        }
    },
    /**
     * Number of existing parallel edges, incremented until unused.
     */
    EDGE_COUNT {
        @Override
        public Object nextKey(Map<Object, ?> keys) {
            return firstUnused(keys, keys.size());
        }
    };

    public abstract Object nextKey(Map<Object, ?> keys);

    private static int firstUnused(Map<Object, ?> keys, int start) {
        int key = start;
        while (keys.containsKey(key)) {
            key++;
        }
        return key;
    }
}
