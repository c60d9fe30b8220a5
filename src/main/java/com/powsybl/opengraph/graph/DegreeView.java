/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.opengraph.graph;

import com.google.common.collect.Iterables;
import com.google.common.collect.Iterators;
import org.apache.commons.lang3.tuple.Pair;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.ToDoubleBiFunction;

/**
 * Live read only view of (node, degree) pairs, possibly restricted to a bunch of nodes and possibly weighted.
 * Also used for in and out degrees of directed graphs.
 * <p>
 * Degrees are reported as doubles so that weighted and unweighted views share one type; unweighted degrees are
 * edge counts, see {@link GraphModel#degree(Object)} for an integer value.
 *
 * @author PowSyBl Open Graph team
 * @param <N> node type
 */
public class DegreeView<N> implements Iterable<Pair<N, Double>> {

    private final GraphModel<N> graph;

    private final Iterable<? extends N> nbunch;

    private final String weight;

    private final ToDoubleBiFunction<N, String> degreeFunction;

    DegreeView(GraphModel<N> graph, Iterable<? extends N> nbunch, String weight, ToDoubleBiFunction<N, String> degreeFunction) {
        this.graph = Objects.requireNonNull(graph);
        this.nbunch = nbunch;
        this.weight = weight;
        this.degreeFunction = Objects.requireNonNull(degreeFunction);
    }

    /**
     * Name of the weight attribute, null if unweighted.
     */
    public String getWeight() {
        return weight;
    }

    /**
     * @throws NodeNotFoundException if the node is not in the graph, or not in the bunch the view is restricted to
     */
    public double get(N n) {
        NodeBunches.nodesOrFail(graph, n);
        if (nbunch != null && !Iterables.contains(nbunch, n)) {
            throw new NodeNotFoundException(n);
        }
        return degreeFunction.applyAsDouble(n, weight);
    }

    public int size() {
        return Iterables.size(NodeBunches.nodesFiltering(graph, nbunch));
    }

    @Override
    public Iterator<Pair<N, Double>> iterator() {
        return Iterators.transform(NodeBunches.nodesFiltering(graph, nbunch).iterator(),
            n -> Pair.of(n, degreeFunction.applyAsDouble(n, weight)));
    }

    public Map<N, Double> toMap() {
        Map<N, Double> degrees = new LinkedHashMap<>();
        for (Pair<N, Double> degree : this) {
            degrees.put(degree.getKey(), degree.getValue());
        }
        return degrees;
    }

    public double sum() {
        double sum = 0;
        for (N n : NodeBunches.nodesFiltering(graph, nbunch)) {
            sum += degreeFunction.applyAsDouble(n, weight);
        }
        return sum;
    }

    @Override
    public String toString() {
        return toMap().toString();
    }
}
