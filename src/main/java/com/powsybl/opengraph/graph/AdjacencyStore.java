/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.opengraph.graph;

import com.google.common.collect.Maps;
import com.google.common.collect.Sets;

import java.util.*;
import java.util.function.BinaryOperator;
import java.util.function.Predicate;

/**
 * Map of maps holding, per node, its neighbors and the data of the edges leading to them. The data is an edge
 * attribute map for simple graphs, and a map of edge key to edge attribute map for multigraphs.
 * <p>
 * This store only records one direction: directed graphs use two of them (successors and predecessors) sharing
 * the same data objects, undirected graphs use a {@link SymmetricAdjacencyStore}.
 *
 * @author PowSyBl Open Graph team
 * @param <N> node type
 * @param <D> edge data type
 */
public class AdjacencyStore<N, D> {

    protected final Map<N, Map<N, D>> rows;

    public AdjacencyStore() {
        this(new LinkedHashMap<>());
    }

    AdjacencyStore(Map<N, Map<N, D>> rows) {
        this.rows = Objects.requireNonNull(rows);
    }

    public boolean containsNode(N n) {
        return rows.containsKey(n);
    }

    public boolean contains(N u, N v) {
        Map<N, D> row = rows.get(u);
        return row != null && row.containsKey(v);
    }

    /**
     * Ensures the node has a row, possibly empty.
     */
    public Map<N, D> addNode(N n) {
        return rows.computeIfAbsent(n, k -> new LinkedHashMap<>());
    }

    /**
     * Records the (u, v) entry, creating the missing rows.
     */
    public void add(N u, N v, D data) {
        Objects.requireNonNull(data);
        addNode(v);
        addNode(u).put(v, data);
    }

    /**
     * Get the data of the (u, v) entry or null if there is no such entry.
     */
    public D get(N u, N v) {
        Map<N, D> row = rows.get(u);
        return row != null ? row.get(v) : null;
    }

    public D remove(N u, N v) {
        Map<N, D> row = rows.get(u);
        if (row == null || !row.containsKey(v)) {
            throw new EdgeNotFoundException(u, v);
        }
        return row.remove(v);
    }

    /**
     * Removes the row of the given node and returns it. Entries of other rows pointing to this node are left to
     * the caller (they belong to the other direction store for directed graphs).
     */
    public Map<N, D> removeNode(N n) {
        Map<N, D> row = rows.remove(n);
        if (row == null) {
            throw new NodeNotFoundException(n);
        }
        return row;
    }

    /**
     * Live and modifiable row of the given node.
     */
    Map<N, D> getRow(N n) {
        Map<N, D> row = rows.get(n);
        if (row == null) {
            throw new NodeNotFoundException(n);
        }
        return row;
    }

    public Set<N> neighbors(N n) {
        return Collections.unmodifiableSet(getRow(n).keySet());
    }

    public int size() {
        return rows.size();
    }

    Map<N, Map<N, D>> getRows() {
        return rows;
    }

    public void clear() {
        rows.clear();
    }

    public void clearEdges() {
        rows.values().forEach(Map::clear);
    }

    /**
     * Live read only restriction of a simple graph store to the nodes and edges accepted by the filters.
     *
     * @param reversed true if the store records predecessors, the edge filter being then called with swapped nodes
     */
    static <N> AdjacencyStore<N, AttributeMap> filterSimple(AdjacencyStore<N, AttributeMap> store, Predicate<N> nodeFilter,
                                                             EdgeFilter<N> edgeFilter, boolean reversed) {
        Map<N, Map<N, AttributeMap>> filteredRows = Maps.transformEntries(Maps.filterKeys(store.rows, nodeFilter::test),
            (u, row) -> Maps.filterKeys(row, v -> nodeFilter.test(v) && acceptEdge(edgeFilter, u, v, null, reversed)));
        return new AdjacencyStore<>(filteredRows);
    }

    /**
     * Live read only restriction of a multigraph store to the nodes and edges accepted by the filters. A neighbor
     * only stays visible if at least one of the parallel edges leading to it does.
     */
    static <N> AdjacencyStore<N, Map<Object, AttributeMap>> filterMulti(AdjacencyStore<N, Map<Object, AttributeMap>> store, Predicate<N> nodeFilter,
                                                                        EdgeFilter<N> edgeFilter, boolean reversed) {
        Map<N, Map<N, Map<Object, AttributeMap>>> filteredRows = Maps.transformEntries(Maps.filterKeys(store.rows, nodeFilter::test),
            (u, row) -> {
                Map<N, Map<Object, AttributeMap>> keyFiltered = Maps.transformEntries(Maps.filterKeys(row, nodeFilter::test),
                    (v, keys) -> Maps.filterKeys(keys, key -> acceptEdge(edgeFilter, u, v, key, reversed)));
                return Maps.filterValues(keyFiltered, keys -> !keys.isEmpty());
            });
        return new AdjacencyStore<>(filteredRows);
    }

    /**
     * Live read only union of two stores having the same nodes, typically the successor and predecessor stores of
     * a directed graph. When both rows of a node hold an entry for the same neighbor, the data are combined by the
     * merger, first store data first.
     */
    static <N, D> AdjacencyStore<N, D> union(AdjacencyStore<N, D> first, AdjacencyStore<N, D> second, BinaryOperator<D> merger) {
        Map<N, Map<N, D>> unionRows = Maps.transformEntries(first.rows,
            (n, firstRow) -> unionRow(firstRow, second.rows.getOrDefault(n, Collections.emptyMap()), merger));
        return new AdjacencyStore<>(unionRows);
    }

    /**
     * Live read only union of two maps, values found in both being combined by the merger.
     */
    static <K, V> Map<K, V> unionRow(Map<K, V> first, Map<K, V> second, BinaryOperator<V> merger) {
        return Collections.unmodifiableMap(Maps.asMap(Sets.union(first.keySet(), second.keySet()), key -> {
            V firstValue = first.get(key);
            V secondValue = second.get(key);
            if (firstValue == null) {
                return secondValue;
            }
            return secondValue == null ? firstValue : merger.apply(firstValue, secondValue);
        }));
    }

    private static <N> boolean acceptEdge(EdgeFilter<N> edgeFilter, N u, N v, Object key, boolean reversed) {
        return reversed ? edgeFilter.test(v, u, key) : edgeFilter.test(u, v, key);
    }
}
