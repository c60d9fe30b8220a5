/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.opengraph.graph;

/**
 * Raised when an edge lookup or removal names a pair of nodes (and possibly a key) with no recorded edge.
 *
 * @author PowSyBl Open Graph team
 */
public class EdgeNotFoundException extends GraphException {

    private final transient Object u;

    private final transient Object v;

    private final transient Object key;

    public EdgeNotFoundException(Object u, Object v) {
        super("The edge " + u + "-" + v + " is not in the graph");
        this.u = u;
        this.v = v;
        this.key = null;
    }

    public EdgeNotFoundException(Object u, Object v, Object key) {
        super("The edge " + u + "-" + v + " with key " + key + " is not in the graph");
        this.u = u;
        this.v = v;
        this.key = key;
    }

    public Object getU() {
        return u;
    }

    public Object getV() {
        return v;
    }

    public Object getKey() {
        return key;
    }
}
