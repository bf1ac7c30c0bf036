/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridtopology.modification;

import com.powsybl.gridtopology.GridTopologyParameters;
import com.powsybl.gridtopology.network.ElementType;

import java.util.List;
import java.util.Objects;

/**
 * @author powsybl-grid-topology contributors
 */
public class GenerationPlantMergeParameters {

    public static final LimitMergePolicy LIMIT_MERGE_POLICY_DEFAULT_VALUE = GridTopologyParameters.LIMIT_MERGE_POLICY_DEFAULT_VALUE;

    public static final boolean ADD_INFO_DEFAULT_VALUE = true;

    public static final boolean FAIL_ON_VOLTAGE_MISMATCH_DEFAULT_VALUE = true;

    public static final double VOLTAGE_TOLERANCE_DEFAULT_VALUE = 1e-9;

    private LimitMergePolicy limitMergePolicy = LIMIT_MERGE_POLICY_DEFAULT_VALUE;

    private boolean addInfo = ADD_INFO_DEFAULT_VALUE;

    private boolean failOnVoltageMismatch = FAIL_ON_VOLTAGE_MISMATCH_DEFAULT_VALUE;

    private double voltageTolerance = VOLTAGE_TOLERANCE_DEFAULT_VALUE;

    private List<ElementType> elementTypes = ElementType.generationTypes();

    public static GenerationPlantMergeParameters load(GridTopologyParameters parameters) {
        return new GenerationPlantMergeParameters().setLimitMergePolicy(parameters.getLimitMergePolicy());
    }

    public LimitMergePolicy getLimitMergePolicy() {
        return limitMergePolicy;
    }

    public GenerationPlantMergeParameters setLimitMergePolicy(LimitMergePolicy limitMergePolicy) {
        this.limitMergePolicy = Objects.requireNonNull(limitMergePolicy);
        return this;
    }

    public boolean isAddInfo() {
        return addInfo;
    }

    /**
     * Flag the kept plants in an {@code includes_other_plants} column.
     */
    public GenerationPlantMergeParameters setAddInfo(boolean addInfo) {
        this.addInfo = addInfo;
        return this;
    }

    public boolean isFailOnVoltageMismatch() {
        return failOnVoltageMismatch;
    }

    /**
     * Fail if plants of a same bus have different voltage set points, instead of logging a warning.
     */
    public GenerationPlantMergeParameters setFailOnVoltageMismatch(boolean failOnVoltageMismatch) {
        this.failOnVoltageMismatch = failOnVoltageMismatch;
        return this;
    }

    public double getVoltageTolerance() {
        return voltageTolerance;
    }

    public GenerationPlantMergeParameters setVoltageTolerance(double voltageTolerance) {
        this.voltageTolerance = voltageTolerance;
        return this;
    }

    public List<ElementType> getElementTypes() {
        return elementTypes;
    }

    /**
     * Plant types to merge, in priority order: the kept plant of a bus is the first one of the first type.
     */
    public GenerationPlantMergeParameters setElementTypes(List<ElementType> elementTypes) {
        for (ElementType type : elementTypes) {
            if (!ElementType.generationTypes().contains(type)) {
                throw new IllegalArgumentException("Element type '" + type + "' is not a generation plant type");
            }
        }
        this.elementTypes = List.copyOf(elementTypes);
        return this;
    }

    @Override
    public String toString() {
        return "GenerationPlantMergeParameters(" +
                "limitMergePolicy=" + limitMergePolicy +
                ", addInfo=" + addInfo +
                ", failOnVoltageMismatch=" + failOnVoltageMismatch +
                ", voltageTolerance=" + voltageTolerance +
                ", elementTypes=" + elementTypes +
                ')';
    }
}
