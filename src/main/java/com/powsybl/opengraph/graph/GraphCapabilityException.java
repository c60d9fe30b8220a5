/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.opengraph.graph;

/**
 * Raised when an operation is not supported by the graph it is applied to: a directed only operation on an
 * undirected graph (or the opposite), a structural change on a frozen graph, a non numeric weight...
 *
 * @author PowSyBl Open Graph team
 */
public class GraphCapabilityException extends GraphException {

    public GraphCapabilityException(String msg) {
        super(msg);
    }
}
