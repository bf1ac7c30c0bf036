/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridtopology.modification;

/**
 * @author powsybl-grid-topology contributors
 */
public class SelectSubnetParameters {

    public static final boolean INCLUDE_SWITCH_BUSES_DEFAULT_VALUE = false;

    public static final boolean INCLUDE_RESULTS_DEFAULT_VALUE = false;

    public static final boolean KEEP_EVERYTHING_ELSE_DEFAULT_VALUE = false;

    private boolean includeSwitchBuses = INCLUDE_SWITCH_BUSES_DEFAULT_VALUE;

    private boolean includeResults = INCLUDE_RESULTS_DEFAULT_VALUE;

    private boolean keepEverythingElse = KEEP_EVERYTHING_ELSE_DEFAULT_VALUE;

    public boolean isIncludeSwitchBuses() {
        return includeSwitchBuses;
    }

    /**
     * Widen the bus selection, before extraction, with the buses of the switches gating selected branches.
     */
    public SelectSubnetParameters setIncludeSwitchBuses(boolean includeSwitchBuses) {
        this.includeSwitchBuses = includeSwitchBuses;
        return this;
    }

    public boolean isIncludeResults() {
        return includeResults;
    }

    public SelectSubnetParameters setIncludeResults(boolean includeResults) {
        this.includeResults = includeResults;
        return this;
    }

    public boolean isKeepEverythingElse() {
        return keepEverythingElse;
    }

    /**
     * Keep the controllers, which are not attached to buses.
     */
    public SelectSubnetParameters setKeepEverythingElse(boolean keepEverythingElse) {
        this.keepEverythingElse = keepEverythingElse;
        return this;
    }

    @Override
    public String toString() {
        return "SelectSubnetParameters(" +
                "includeSwitchBuses=" + includeSwitchBuses +
                ", includeResults=" + includeResults +
                ", keepEverythingElse=" + keepEverythingElse +
                ')';
    }
}
