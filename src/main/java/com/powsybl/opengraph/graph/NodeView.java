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

import java.util.AbstractSet;
import java.util.Collections;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;

/**
 * Live read only set of the nodes of a graph, in insertion order, also giving access to node attributes.
 *
 * @author PowSyBl Open Graph team
 * @param <N> node type
 */
public class NodeView<N> extends AbstractSet<N> {

    private final Map<N, AttributeMap> nodeTable;

    NodeView(Map<N, AttributeMap> nodeTable) {
        this.nodeTable = Objects.requireNonNull(nodeTable);
    }

    @Override
    public Iterator<N> iterator() {
        return Iterators.unmodifiableIterator(nodeTable.keySet().iterator());
    }

    @Override
    public int size() {
        return nodeTable.size();
    }

    @Override
    public boolean contains(Object o) {
        return o != null && nodeTable.containsKey(o);
    }

    /**
     * Attributes of the given node, which can be modified.
     *
     * @throws NodeNotFoundException if the node is not in the graph
     */
    public AttributeMap get(N n) {
        AttributeMap attributes = n != null ? nodeTable.get(n) : null;
        if (attributes == null) {
            throw new NodeNotFoundException(n);
        }
        return attributes;
    }

    /**
     * Live read only map of all node attributes.
     */
    public Map<N, AttributeMap> data() {
        return Collections.unmodifiableMap(nodeTable);
    }

    /**
     * Live read only map of the value of one attribute for all nodes.
     */
    public Map<N, Object> data(String name, Object defaultValue) {
        Objects.requireNonNull(name);
        return Collections.unmodifiableMap(Maps.transformValues(nodeTable, attributes -> attributes.getOrDefault(name, defaultValue)));
    }
}
