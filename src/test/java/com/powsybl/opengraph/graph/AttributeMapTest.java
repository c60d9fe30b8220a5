/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.opengraph.graph;

import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author PowSyBl Open Graph team
 */
class AttributeMapTest {

    @Test
    void test() {
        AttributeMap attributes = new AttributeMap(Map.of("weight", 2))
                .with("color", "red")
                .with("length", 1.5);
        assertEquals(2.0, attributes.getDouble("weight", 0));
        assertEquals(1.5, attributes.getDouble("length", 0));
        assertEquals(3.0, attributes.getDouble("capacity", 3.0));
        assertEquals("red", attributes.getString("color", null));
        assertEquals("2", attributes.getString("weight", null));
        assertEquals("none", attributes.getString("style", "none"));
        GraphCapabilityException e = assertThrows(GraphCapabilityException.class, () -> attributes.getDouble("color", 0));
        assertEquals("Attribute 'color' is not numeric: red", e.getMessage());
        assertThrows(NullPointerException.class, () -> attributes.put(null, 1));
        assertThrows(NullPointerException.class, () -> attributes.putAll(Collections.singletonMap(null, 1)));
    }

    @Test
    void weightTest() {
        AttributeMap attributes = new AttributeMap().with("weight", -2);
        assertEquals(-2.0, attributes.getWeight("weight", 1));
        assertEquals(1.0, attributes.getWeight(null, 5));
        assertEquals(5.0, attributes.getWeight("cost", 5));
    }

    @Test
    void copyTest() {
        AttributeMap attributes = new AttributeMap().with("a", 1).with("b", 2);
        AttributeMap copy = attributes.copy();
        assertEquals(attributes, copy);
        assertNotSame(attributes, copy);
        copy.put("a", 3);
        copy.remove("b");
        assertEquals(Map.of("a", 1, "b", 2), attributes);
        assertEquals("[a, b]", attributes.keySet().toString());

        // last write wins
        attributes.put("a", 4);
        assertEquals(4, attributes.get("a"));
        assertEquals("[a, b]", attributes.keySet().toString());
    }
}
