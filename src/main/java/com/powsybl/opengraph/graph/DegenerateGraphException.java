/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.opengraph.graph;

/**
 * Raised when a computation makes no sense on the given input, like the connectivity of the null graph.
 *
 * @author PowSyBl Open Graph team
 */
public class DegenerateGraphException extends GraphException {

    public DegenerateGraphException(String msg) {
        super(msg);
    }
}
