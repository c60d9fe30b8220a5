/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.opengraph.graph;

import com.google.common.collect.Iterators;
import com.google.common.collect.Maps;

import java.util.Collections;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Live read only view of an adjacency store. Rows are keyed by neighbor; the edge attribute maps reached through
 * them stay modifiable.
 *
 * @author PowSyBl Open Graph team
 * @param <N> node type
 * @param <D> edge data type
 */
public class AdjacencyView<N, D> implements Iterable<N> {

    private final Map<N, Map<N, D>> rows;

    private final UnaryOperator<D> dataProtector;

    AdjacencyView(AdjacencyStore<N, D> store, UnaryOperator<D> dataProtector) {
        this.rows = Objects.requireNonNull(store).getRows();
        this.dataProtector = Objects.requireNonNull(dataProtector);
    }

    /**
     * @throws NodeNotFoundException if the node is not in the graph
     */
    public Map<N, D> get(N n) {
        Map<N, D> row = n != null ? rows.get(n) : null;
        if (row == null) {
            throw new NodeNotFoundException(n);
        }
        return protect(row);
    }

    public boolean contains(N n) {
        return n != null && rows.containsKey(n);
    }

    public int size() {
        return rows.size();
    }

    @Override
    public Iterator<N> iterator() {
        return Iterators.unmodifiableIterator(rows.keySet().iterator());
    }

    public Map<N, Map<N, D>> asMap() {
        return Collections.unmodifiableMap(Maps.transformValues(rows, this::protect));
    }

    private Map<N, D> protect(Map<N, D> row) {
        return Collections.unmodifiableMap(Maps.transformValues(row, dataProtector::apply));
    }

    @Override
    public String toString() {
        return asMap().toString();
    }
}
