/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.opengraph.graph;

import com.powsybl.commons.PowsyblException;

/**
 * Base class of all the errors raised by graph structures and graph algorithms.
 *
 * @author PowSyBl Open Graph team
 */
public class GraphException extends PowsyblException {

    public GraphException(String msg) {
        super(msg);
    }

    public GraphException(String msg, Throwable throwable) {
        super(msg, throwable);
    }
}
