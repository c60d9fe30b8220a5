/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.opengraph.graph;

/**
 * Predicate on edges used to build restricted graph views. The key is null for simple graphs.
 *
 * @author PowSyBl Open Graph team
 * @param <N> node type
 */
@FunctionalInterface
public interface EdgeFilter<N> {

    boolean test(N u, N v, Object key);

    default EdgeFilter<N> and(EdgeFilter<N> other) {
        return (u, v, key) -> test(u, v, key) && other.test(u, v, key);
    }
}
