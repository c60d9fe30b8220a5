/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.opengraph.graph;

import com.google.common.collect.Iterables;

import java.util.AbstractCollection;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Live read only collection of the edges of a graph, possibly restricted to the edges incident to a bunch of
 * nodes. Each undirected edge is reported once. For directed graphs, the view reports either the out edges or the
 * in edges of the nodes.
 *
 * @author PowSyBl Open Graph team
 * @param <N> node type
 */
public class EdgeView<N> extends AbstractCollection<Edge<N>> {

    private final AbstractGraph<N, ?> graph;

    private final Iterable<N> nbunch;

    private final boolean incoming;

    EdgeView(AbstractGraph<N, ?> graph, Iterable<N> nbunch, boolean incoming) {
        this.graph = Objects.requireNonNull(graph);
        this.nbunch = nbunch;
        this.incoming = incoming;
    }

    private Iterable<N> getNodes() {
        return NodeBunches.nodesFiltering(graph, nbunch);
    }

    @Override
    public Stream<Edge<N>> stream() {
        return graph.streamEdges(getNodes(), incoming);
    }

    @Override
    public Iterator<Edge<N>> iterator() {
        return stream().iterator();
    }

    @Override
    public int size() {
        return (int) stream().count();
    }

    @Override
    public boolean isEmpty() {
        return stream().findAny().isEmpty();
    }

    @Override
    @SuppressWarnings("unchecked")
    public boolean contains(Object o) {
        if (!(o instanceof Edge)) {
            return false;
        }
        Edge<N> edge = (Edge<N>) o;
        return contains(edge.getU(), edge.getV(), edge.getKey());
    }

    public boolean contains(N u, N v) {
        return contains(u, v, null);
    }

    /**
     * Edge lookup with a key, which must be null for simple graphs. A null key on a multigraph matches any of the
     * parallel edges.
     */
    public boolean contains(N u, N v, Object key) {
        return inBunch(u, v) && graph.containsEdge(u, v, key);
    }

    private boolean inBunch(N u, N v) {
        if (nbunch == null) {
            return true;
        }
        Iterable<N> nodes = getNodes();
        if (graph.isDirected()) {
            return Iterables.contains(nodes, incoming ? v : u);
        }
        return Iterables.contains(nodes, u) || Iterables.contains(nodes, v);
    }

    /**
     * Attributes of the edge between u and v, which can be modified.
     *
     * @throws EdgeNotFoundException if there is no such edge
     * @throws GraphCapabilityException if the graph is a multigraph, a key being then needed
     */
    public AttributeMap get(N u, N v) {
        return get(u, v, null);
    }

    /**
     * Attributes of the edge between u and v with the given key, which can be modified.
     *
     * @throws EdgeNotFoundException if there is no such edge
     */
    public AttributeMap get(N u, N v, Object key) {
        if (!inBunch(u, v)) {
            throw key != null ? new EdgeNotFoundException(u, v, key) : new EdgeNotFoundException(u, v);
        }
        return graph.getEdgeAttributes(u, v, key);
    }

    /**
     * Value of one attribute for each edge of the view.
     */
    public Map<Edge<N>, Object> data(String name, Object defaultValue) {
        Objects.requireNonNull(name);
        Map<Edge<N>, Object> data = new LinkedHashMap<>();
        stream().forEach(edge -> data.put(edge, edge.getAttributes().getOrDefault(name, defaultValue)));
        return data;
    }
}
