/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridtopology.modification;

import com.powsybl.gridtopology.GridTopologyParameters;

/**
 * @author powsybl-grid-topology contributors
 */
public class MergeParameters {

    public static final boolean VALIDATE_DEFAULT_VALUE = GridTopologyParameters.VALIDATE_MERGE_DEFAULT_VALUE;

    public static final boolean MERGE_RESULTS_DEFAULT_VALUE = true;

    private boolean validate = VALIDATE_DEFAULT_VALUE;

    private boolean mergeResults = MERGE_RESULTS_DEFAULT_VALUE;

    public static MergeParameters load(GridTopologyParameters parameters) {
        return new MergeParameters().setValidate(parameters.isValidateMerge());
    }

    public boolean isValidate() {
        return validate;
    }

    /**
     * Fail if the merged network holds references to missing rows.
     */
    public MergeParameters setValidate(boolean validate) {
        this.validate = validate;
        return this;
    }

    public boolean isMergeResults() {
        return mergeResults;
    }

    public MergeParameters setMergeResults(boolean mergeResults) {
        this.mergeResults = mergeResults;
        return this;
    }

    @Override
    public String toString() {
        return "MergeParameters(" +
                "validate=" + validate +
                ", mergeResults=" + mergeResults +
                ')';
    }
}
