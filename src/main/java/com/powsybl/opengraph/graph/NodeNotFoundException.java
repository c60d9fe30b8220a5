/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.opengraph.graph;

/**
 * Raised when a query or a mutation names a node which is not in the graph.
 *
 * @author PowSyBl Open Graph team
 */
public class NodeNotFoundException extends GraphException {

    private final transient Object node;

    public NodeNotFoundException(Object node) {
        super("The node " + node + " is not in the graph");
        this.node = node;
    }

    public Object getNode() {
        return node;
    }
}
