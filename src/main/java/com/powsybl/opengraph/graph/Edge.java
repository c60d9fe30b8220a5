/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.opengraph.graph;

import java.util.Map;
import java.util.Objects;

/**
 * An edge as reported by edge views, or as given to bulk edge insertion.
 * Equality only relies on the end nodes and on the key, so that edges can be compared between graphs
 * whatever their attributes.
 *
 * @author PowSyBl Open Graph team
 * @param <N> node type
 */
public final class Edge<N> {

    private final N u;

    private final N v;

    private final Object key;

    private final AttributeMap attributes;

    private Edge(N u, N v, Object key, AttributeMap attributes) {
        this.u = Objects.requireNonNull(u);
        this.v = Objects.requireNonNull(v);
        this.key = key;
        this.attributes = Objects.requireNonNull(attributes);
    }

    public static <N> Edge<N> of(N u, N v) {
        return new Edge<>(u, v, null, new AttributeMap());
    }

    public static <N> Edge<N> of(N u, N v, Map<String, ?> attributes) {
        return new Edge<>(u, v, null, new AttributeMap(attributes));
    }

    public static <N> Edge<N> of(N u, N v, Object key, Map<String, ?> attributes) {
        return new Edge<>(u, v, key, new AttributeMap(attributes));
    }

    /**
     * Edge reported by a view: the attribute map is the live one stored in the graph.
     */
    static <N> Edge<N> live(N u, N v, Object key, AttributeMap attributes) {
        return new Edge<>(u, v, key, attributes);
    }

    public N getU() {
        return u;
    }

    public N getV() {
        return v;
    }

    public Object getKey() {
        return key;
    }

    public AttributeMap getAttributes() {
        return attributes;
    }

    public boolean isSelfLoop() {
        return u.equals(v);
    }

    public Edge<N> reversed() {
        return new Edge<>(v, u, key, attributes);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Edge<?> other = (Edge<?>) o;
        return u.equals(other.u) && v.equals(other.v) && Objects.equals(key, other.key);
    }

    @Override
    public int hashCode() {
        return Objects.hash(u, v, key);
    }

    @Override
    public String toString() {
        return key == null ? "(" + u + ", " + v + ")" : "(" + u + ", " + v + ", " + key + ")";
    }
}
