/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridtopology;

import com.powsybl.commons.config.PlatformConfig;
import com.powsybl.gridtopology.modification.LimitMergePolicy;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Default values of the topology operations, read from the platform configuration.
 *
 * @author powsybl-grid-topology contributors
 */
public class GridTopologyParameters {

    public static final String MODULE_NAME = "grid-topology-default-parameters";

    public static final boolean RESPECT_SWITCHES_DEFAULT_VALUE = true;

    public static final boolean RESPECT_IN_SERVICE_DEFAULT_VALUE = false;

    public static final double COMPARISON_TOLERANCE_DEFAULT_VALUE = 0.0;

    public static final boolean VALIDATE_MERGE_DEFAULT_VALUE = false;

    public static final LimitMergePolicy LIMIT_MERGE_POLICY_DEFAULT_VALUE = LimitMergePolicy.SUM_AVAILABLE;

    public static final String REPLACEMENT_SWITCH_NAME_PREFIX_DEFAULT_VALUE = "REPLACEMENT";

    public static final String RESPECT_SWITCHES_PARAM_NAME = "respectSwitches";

    public static final String RESPECT_IN_SERVICE_PARAM_NAME = "respectInService";

    public static final String COMPARISON_TOLERANCE_PARAM_NAME = "comparisonTolerance";

    public static final String VALIDATE_MERGE_PARAM_NAME = "validateMerge";

    public static final String LIMIT_MERGE_POLICY_PARAM_NAME = "limitMergePolicy";

    public static final String REPLACEMENT_SWITCH_NAME_PREFIX_PARAM_NAME = "replacementSwitchNamePrefix";

    public static final List<String> SPECIFIC_PARAMETERS_NAMES = List.of(RESPECT_SWITCHES_PARAM_NAME,
                                                                         RESPECT_IN_SERVICE_PARAM_NAME,
                                                                         COMPARISON_TOLERANCE_PARAM_NAME,
                                                                         VALIDATE_MERGE_PARAM_NAME,
                                                                         LIMIT_MERGE_POLICY_PARAM_NAME,
                                                                         REPLACEMENT_SWITCH_NAME_PREFIX_PARAM_NAME);

    private boolean respectSwitches = RESPECT_SWITCHES_DEFAULT_VALUE;

    private boolean respectInService = RESPECT_IN_SERVICE_DEFAULT_VALUE;

    private double comparisonTolerance = COMPARISON_TOLERANCE_DEFAULT_VALUE;

    private boolean validateMerge = VALIDATE_MERGE_DEFAULT_VALUE;

    private LimitMergePolicy limitMergePolicy = LIMIT_MERGE_POLICY_DEFAULT_VALUE;

    private String replacementSwitchNamePrefix = REPLACEMENT_SWITCH_NAME_PREFIX_DEFAULT_VALUE;

    public boolean isRespectSwitches() {
        return respectSwitches;
    }

    public GridTopologyParameters setRespectSwitches(boolean respectSwitches) {
        this.respectSwitches = respectSwitches;
        return this;
    }

    public boolean isRespectInService() {
        return respectInService;
    }

    public GridTopologyParameters setRespectInService(boolean respectInService) {
        this.respectInService = respectInService;
        return this;
    }

    public double getComparisonTolerance() {
        return comparisonTolerance;
    }

    public GridTopologyParameters setComparisonTolerance(double comparisonTolerance) {
        if (comparisonTolerance < 0 || Double.isNaN(comparisonTolerance)) {
            throw new IllegalArgumentException("Invalid comparison tolerance: " + comparisonTolerance);
        }
        this.comparisonTolerance = comparisonTolerance;
        return this;
    }

    public boolean isValidateMerge() {
        return validateMerge;
    }

    public GridTopologyParameters setValidateMerge(boolean validateMerge) {
        this.validateMerge = validateMerge;
        return this;
    }

    public LimitMergePolicy getLimitMergePolicy() {
        return limitMergePolicy;
    }

    public GridTopologyParameters setLimitMergePolicy(LimitMergePolicy limitMergePolicy) {
        this.limitMergePolicy = Objects.requireNonNull(limitMergePolicy);
        return this;
    }

    public String getReplacementSwitchNamePrefix() {
        return replacementSwitchNamePrefix;
    }

    public GridTopologyParameters setReplacementSwitchNamePrefix(String replacementSwitchNamePrefix) {
        this.replacementSwitchNamePrefix = Objects.requireNonNull(replacementSwitchNamePrefix);
        return this;
    }

    public static GridTopologyParameters load() {
        return load(PlatformConfig.defaultConfig());
    }

    public static GridTopologyParameters load(PlatformConfig platformConfig) {
        GridTopologyParameters parameters = new GridTopologyParameters();
        platformConfig.getOptionalModuleConfig(MODULE_NAME)
            .ifPresent(config -> parameters
                .setRespectSwitches(config.getBooleanProperty(RESPECT_SWITCHES_PARAM_NAME, RESPECT_SWITCHES_DEFAULT_VALUE))
                .setRespectInService(config.getBooleanProperty(RESPECT_IN_SERVICE_PARAM_NAME, RESPECT_IN_SERVICE_DEFAULT_VALUE))
                .setComparisonTolerance(config.getDoubleProperty(COMPARISON_TOLERANCE_PARAM_NAME, COMPARISON_TOLERANCE_DEFAULT_VALUE))
                .setValidateMerge(config.getBooleanProperty(VALIDATE_MERGE_PARAM_NAME, VALIDATE_MERGE_DEFAULT_VALUE))
                .setLimitMergePolicy(config.getEnumProperty(LIMIT_MERGE_POLICY_PARAM_NAME, LimitMergePolicy.class, LIMIT_MERGE_POLICY_DEFAULT_VALUE))
                .setReplacementSwitchNamePrefix(config.getStringProperty(REPLACEMENT_SWITCH_NAME_PREFIX_PARAM_NAME, REPLACEMENT_SWITCH_NAME_PREFIX_DEFAULT_VALUE)));
        return parameters;
    }

    public static GridTopologyParameters load(Map<String, String> properties) {
        return new GridTopologyParameters().update(properties);
    }

    public GridTopologyParameters update(Map<String, String> properties) {
        Optional.ofNullable(properties.get(RESPECT_SWITCHES_PARAM_NAME))
                .ifPresent(prop -> this.setRespectSwitches(Boolean.parseBoolean(prop)));
        Optional.ofNullable(properties.get(RESPECT_IN_SERVICE_PARAM_NAME))
                .ifPresent(prop -> this.setRespectInService(Boolean.parseBoolean(prop)));
        Optional.ofNullable(properties.get(COMPARISON_TOLERANCE_PARAM_NAME))
                .ifPresent(prop -> this.setComparisonTolerance(Double.parseDouble(prop)));
        Optional.ofNullable(properties.get(VALIDATE_MERGE_PARAM_NAME))
                .ifPresent(prop -> this.setValidateMerge(Boolean.parseBoolean(prop)));
        Optional.ofNullable(properties.get(LIMIT_MERGE_POLICY_PARAM_NAME))
                .ifPresent(prop -> this.setLimitMergePolicy(LimitMergePolicy.valueOf(prop)));
        Optional.ofNullable(properties.get(REPLACEMENT_SWITCH_NAME_PREFIX_PARAM_NAME))
                .ifPresent(this::setReplacementSwitchNamePrefix);
        return this;
    }

    @Override
    public String toString() {
        return "GridTopologyParameters(" +
                "respectSwitches=" + respectSwitches +
                ", respectInService=" + respectInService +
                ", comparisonTolerance=" + comparisonTolerance +
                ", validateMerge=" + validateMerge +
                ", limitMergePolicy=" + limitMergePolicy +
                ", replacementSwitchNamePrefix=" + replacementSwitchNamePrefix +
                ')';
    }
}
