/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.opengraph.graph;

import com.powsybl.commons.config.PlatformConfig;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Parameters shared by graph structures and graph algorithms.
 *
 * @author PowSyBl Open Graph team
 */
public class GraphParameters {

    public static final String MODULE_NAME = "open-graph-default-parameters";

    public static final String WEIGHT_ATTRIBUTE_PARAM_NAME = "weightAttribute";
    public static final String WEIGHT_ATTRIBUTE_DEFAULT_VALUE = "weight";
    public static final String DEFAULT_WEIGHT_PARAM_NAME = "defaultWeight";
    public static final double DEFAULT_WEIGHT_DEFAULT_VALUE = 1;
    public static final String EDGE_KEY_POLICY_PARAM_NAME = "edgeKeyPolicy";
    public static final EdgeKeyPolicy EDGE_KEY_POLICY_DEFAULT_VALUE = EdgeKeyPolicy.SMALLEST_UNUSED;

    public static final List<String> PARAMETERS_NAMES = List.of(WEIGHT_ATTRIBUTE_PARAM_NAME, DEFAULT_WEIGHT_PARAM_NAME, EDGE_KEY_POLICY_PARAM_NAME);

    private String weightAttribute = WEIGHT_ATTRIBUTE_DEFAULT_VALUE;
    private double defaultWeight = DEFAULT_WEIGHT_DEFAULT_VALUE;
    private EdgeKeyPolicy edgeKeyPolicy = EDGE_KEY_POLICY_DEFAULT_VALUE;

    /**
     * Name of the edge attribute holding the weight when an algorithm is not given one explicitly.
     */
    public String getWeightAttribute() {
        return weightAttribute;
    }

    public GraphParameters setWeightAttribute(String weightAttribute) {
        this.weightAttribute = Objects.requireNonNull(weightAttribute);
        return this;
    }

    /**
     * Weight of an edge which does not have the requested weight attribute.
     */
    public double getDefaultWeight() {
        return defaultWeight;
    }

    public GraphParameters setDefaultWeight(double defaultWeight) {
        if (Double.isNaN(defaultWeight)) {
            throw new IllegalArgumentException("Invalid default weight: " + defaultWeight);
        }
        this.defaultWeight = defaultWeight;
        return this;
    }

    public EdgeKeyPolicy getEdgeKeyPolicy() {
        return edgeKeyPolicy;
    }

    public GraphParameters setEdgeKeyPolicy(EdgeKeyPolicy edgeKeyPolicy) {
        this.edgeKeyPolicy = Objects.requireNonNull(edgeKeyPolicy);
        return this;
    }

    public static GraphParameters load() {
        return load(PlatformConfig.defaultConfig());
    }

    public static GraphParameters load(PlatformConfig platformConfig) {
        GraphParameters parameters = new GraphParameters();
        platformConfig.getOptionalModuleConfig(MODULE_NAME)
                .ifPresent(config -> parameters
                        .setWeightAttribute(config.getStringProperty(WEIGHT_ATTRIBUTE_PARAM_NAME, WEIGHT_ATTRIBUTE_DEFAULT_VALUE))
                        .setDefaultWeight(config.getDoubleProperty(DEFAULT_WEIGHT_PARAM_NAME, DEFAULT_WEIGHT_DEFAULT_VALUE))
                        .setEdgeKeyPolicy(config.getEnumProperty(EDGE_KEY_POLICY_PARAM_NAME, EdgeKeyPolicy.class, EDGE_KEY_POLICY_DEFAULT_VALUE)));
        return parameters;
    }

    public static GraphParameters load(Map<String, String> properties) {
        GraphParameters parameters = new GraphParameters();
        Optional.ofNullable(properties.get(WEIGHT_ATTRIBUTE_PARAM_NAME)).ifPresent(parameters::setWeightAttribute);
        Optional.ofNullable(properties.get(DEFAULT_WEIGHT_PARAM_NAME))
                .ifPresent(value -> parameters.setDefaultWeight(Double.parseDouble(value)));
        Optional.ofNullable(properties.get(EDGE_KEY_POLICY_PARAM_NAME))
                .ifPresent(value -> parameters.setEdgeKeyPolicy(EdgeKeyPolicy.valueOf(value)));
        return parameters;
    }

    public GraphParameters copy() {
        return new GraphParameters()
                .setWeightAttribute(weightAttribute)
                .setDefaultWeight(defaultWeight)
                .setEdgeKeyPolicy(edgeKeyPolicy);
    }

    @Override
    public String toString() {
        return "GraphParameters("
                + "weightAttribute=" + weightAttribute
                + ", defaultWeight=" + defaultWeight
                + ", edgeKeyPolicy=" + edgeKeyPolicy
                + ")";
    }
}
