/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.opengraph.graph;

import com.google.common.collect.ImmutableSet;
import org.apache.commons.lang3.tuple.Pair;
import org.apache.commons.lang3.tuple.Triple;

import java.util.HashSet;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Node and edge filters to build restricted views with {@link GraphViews}.
 * <p>
 * Undirected edge filters ignore the orientation of the given edges, directed ones do not. Multigraph edge
 * filters also check the edge key.
 *
 * @author PowSyBl Open Graph team
 */
public final class Filters {

    private Filters() {
    }

    public static <N> Predicate<N> noFilter() {
        return n -> true;
    }

    public static <N> EdgeFilter<N> noEdgeFilter() {
        return (u, v, key) -> true;
    }

    public static <N> Predicate<N> hideNodes(Iterable<? extends N> nodes) {
        Set<N> hidden = toSet(nodes);
        return n -> !hidden.contains(n);
    }

    public static <N> Predicate<N> showNodes(Iterable<? extends N> nodes) {
        Set<N> shown = toSet(nodes);
        return shown::contains;
    }

    public static <N> EdgeFilter<N> hideEdges(Iterable<Edge<N>> edges) {
        Set<Set<N>> hidden = undirectedPairs(edges);
        return (u, v, key) -> !hidden.contains(ImmutableSet.of(u, v));
    }

    public static <N> EdgeFilter<N> showEdges(Iterable<Edge<N>> edges) {
        Set<Set<N>> shown = undirectedPairs(edges);
        return (u, v, key) -> shown.contains(ImmutableSet.of(u, v));
    }

    public static <N> EdgeFilter<N> hideDiEdges(Iterable<Edge<N>> edges) {
        Set<Pair<N, N>> hidden = directedPairs(edges);
        return (u, v, key) -> !hidden.contains(Pair.of(u, v));
    }

    public static <N> EdgeFilter<N> showDiEdges(Iterable<Edge<N>> edges) {
        Set<Pair<N, N>> shown = directedPairs(edges);
        return (u, v, key) -> shown.contains(Pair.of(u, v));
    }

    public static <N> EdgeFilter<N> hideMultiEdges(Iterable<Edge<N>> edges) {
        Set<Pair<Set<N>, Object>> hidden = undirectedKeyedPairs(edges);
        return (u, v, key) -> !hidden.contains(Pair.of(ImmutableSet.of(u, v), key));
    }

    public static <N> EdgeFilter<N> showMultiEdges(Iterable<Edge<N>> edges) {
        Set<Pair<Set<N>, Object>> shown = undirectedKeyedPairs(edges);
        return (u, v, key) -> shown.contains(Pair.of(ImmutableSet.of(u, v), key));
    }

    public static <N> EdgeFilter<N> hideMultiDiEdges(Iterable<Edge<N>> edges) {
        Set<Triple<N, N, Object>> hidden = directedKeyedPairs(edges);
        return (u, v, key) -> !hidden.contains(Triple.of(u, v, key));
    }

    public static <N> EdgeFilter<N> showMultiDiEdges(Iterable<Edge<N>> edges) {
        Set<Triple<N, N, Object>> shown = directedKeyedPairs(edges);
        return (u, v, key) -> shown.contains(Triple.of(u, v, key));
    }

    /**
     * Edge filter hiding the given edges, picking the flavour matching the graph.
     */
    public static <N> EdgeFilter<N> hideEdges(GraphModel<N> graph, Iterable<Edge<N>> edges) {
        if (graph.isMultigraph()) {
            return graph.isDirected() ? hideMultiDiEdges(edges) : hideMultiEdges(edges);
        }
        return graph.isDirected() ? hideDiEdges(edges) : hideEdges(edges);
    }

    /**
     * Edge filter showing only the given edges, picking the flavour matching the graph.
     */
    public static <N> EdgeFilter<N> showEdges(GraphModel<N> graph, Iterable<Edge<N>> edges) {
        if (graph.isMultigraph()) {
            return graph.isDirected() ? showMultiDiEdges(edges) : showMultiEdges(edges);
        }
        return graph.isDirected() ? showDiEdges(edges) : showEdges(edges);
    }

    private static <N> Set<N> toSet(Iterable<? extends N> nodes) {
        Objects.requireNonNull(nodes);
        Set<N> set = new HashSet<>();
        nodes.forEach(set::add);
        return set;
    }

    private static <N> Set<Set<N>> undirectedPairs(Iterable<Edge<N>> edges) {
        Set<Set<N>> pairs = new HashSet<>();
        edges.forEach(e -> pairs.add(ImmutableSet.of(e.getU(), e.getV())));
        return pairs;
    }

    private static <N> Set<Pair<N, N>> directedPairs(Iterable<Edge<N>> edges) {
        Set<Pair<N, N>> pairs = new HashSet<>();
        edges.forEach(e -> pairs.add(Pair.of(e.getU(), e.getV())));
        return pairs;
    }

    private static <N> Set<Pair<Set<N>, Object>> undirectedKeyedPairs(Iterable<Edge<N>> edges) {
        Set<Pair<Set<N>, Object>> pairs = new HashSet<>();
        edges.forEach(e -> pairs.add(Pair.of(ImmutableSet.of(e.getU(), e.getV()), e.getKey())));
        return pairs;
    }

    private static <N> Set<Triple<N, N, Object>> directedKeyedPairs(Iterable<Edge<N>> edges) {
        Set<Triple<N, N, Object>> triples = new HashSet<>();
        edges.forEach(e -> triples.add(Triple.of(e.getU(), e.getV(), e.getKey())));
        return triples;
    }
}
