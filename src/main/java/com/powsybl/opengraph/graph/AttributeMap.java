/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.opengraph.graph;

import com.google.common.collect.ForwardingMap;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Insertion ordered attribute storage used for graph, node and edge attributes.
 * Values are not validated, the last write wins. Typed getters with a default value are provided for algorithms
 * which need, for instance, a numeric weight.
 *
 * @author PowSyBl Open Graph team
 */
public class AttributeMap extends ForwardingMap<String, Object> {

    private final Map<String, Object> delegate = new LinkedHashMap<>();

    public AttributeMap() {
    }

    public AttributeMap(Map<String, ?> attributes) {
        putAll(attributes);
    }

    @Override
    protected Map<String, Object> delegate() {
        return delegate;
    }

    @Override
    public Object put(String key, Object value) {
        return super.put(Objects.requireNonNull(key), value);
    }

    @Override
    public void putAll(Map<? extends String, ?> map) {
        standardPutAll(map);
    }

    public AttributeMap with(String key, Object value) {
        put(key, value);
        return this;
    }

    public double getDouble(String key, double defaultValue) {
        Object value = get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        throw new GraphCapabilityException("Attribute '" + key + "' is not numeric: " + value);
    }

    /**
     * Weight of the element holding these attributes, a null attribute name meaning unweighted (weight of 1).
     */
    public double getWeight(String key, double defaultValue) {
        if (key == null) {
            return 1;
        }
        return getDouble(key, defaultValue);
    }

    public String getString(String key, String defaultValue) {
        Object value = get(key);
        return value != null ? value.toString() : defaultValue;
    }

    public AttributeMap copy() {
        return new AttributeMap(this);
    }
}
