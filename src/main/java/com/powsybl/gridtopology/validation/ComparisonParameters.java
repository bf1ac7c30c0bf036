/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridtopology.validation;

import com.powsybl.gridtopology.GridTopologyParameters;
import com.powsybl.gridtopology.network.ElementType;

import java.util.Collection;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * @author powsybl-grid-topology contributors
 */
public class ComparisonParameters {

    public static final double TOLERANCE_DEFAULT_VALUE = 0.0;

    public static final boolean CHECK_RESULTS_DEFAULT_VALUE = true;

    private final Set<ElementType> excludedTypes = EnumSet.noneOf(ElementType.class);

    private double tolerance = TOLERANCE_DEFAULT_VALUE;

    private boolean checkResults = CHECK_RESULTS_DEFAULT_VALUE;

    public static ComparisonParameters load(GridTopologyParameters parameters) {
        return new ComparisonParameters().setTolerance(parameters.getComparisonTolerance());
    }

    public Set<ElementType> getExcludedTypes() {
        return excludedTypes;
    }

    /**
     * Element types whose input and result tables are not compared.
     */
    public ComparisonParameters setExcludedTypes(Collection<ElementType> excludedTypes) {
        this.excludedTypes.clear();
        this.excludedTypes.addAll(Objects.requireNonNull(excludedTypes));
        return this;
    }

    public double getTolerance() {
        return tolerance;
    }

    /**
     * Absolute tolerance of numeric comparisons.
     */
    public ComparisonParameters setTolerance(double tolerance) {
        if (tolerance < 0 || Double.isNaN(tolerance)) {
            throw new IllegalArgumentException("Invalid comparison tolerance: " + tolerance);
        }
        this.tolerance = tolerance;
        return this;
    }

    public boolean isCheckResults() {
        return checkResults;
    }

    public ComparisonParameters setCheckResults(boolean checkResults) {
        this.checkResults = checkResults;
        return this;
    }

    @Override
    public String toString() {
        return "ComparisonParameters(" +
                "excludedTypes=" + excludedTypes +
                ", tolerance=" + tolerance +
                ", checkResults=" + checkResults +
                ')';
    }
}
