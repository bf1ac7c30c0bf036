/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridtopology.modification;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * @author powsybl-grid-topology contributors
 */
public class ElementReplacementParameters {

    public static final boolean SLACK_DEFAULT_VALUE = false;

    public static final boolean ONLY_VALID_REPLACE_DEFAULT_VALUE = true;

    public static final double SN_MVA_DEFAULT_VALUE = 1.0;

    private List<Integer> oldIndices;

    private List<Integer> newIndices;

    private List<String> colsToKeep;

    private List<String> addColsToKeep = Collections.emptyList();

    private boolean slack = SLACK_DEFAULT_VALUE;

    private boolean onlyValidReplace = ONLY_VALID_REPLACE_DEFAULT_VALUE;

    private double snMva = SN_MVA_DEFAULT_VALUE;

    /**
     * @return the elements to replace, or null for all elements of the table
     */
    public List<Integer> getOldIndices() {
        return oldIndices;
    }

    public ElementReplacementParameters setOldIndices(List<Integer> oldIndices) {
        this.oldIndices = oldIndices != null ? List.copyOf(oldIndices) : null;
        return this;
    }

    /**
     * @return the indices of the created elements, in the order of the replaced ones, or null to append them after
     * the highest existing index
     */
    public List<Integer> getNewIndices() {
        return newIndices;
    }

    public ElementReplacementParameters setNewIndices(List<Integer> newIndices) {
        this.newIndices = newIndices != null ? List.copyOf(newIndices) : null;
        return this;
    }

    /**
     * @return the columns carried over in addition to the mandatory ones, or null for the power limits
     */
    public List<String> getColsToKeep() {
        return colsToKeep;
    }

    public ElementReplacementParameters setColsToKeep(List<String> colsToKeep) {
        this.colsToKeep = colsToKeep != null ? List.copyOf(colsToKeep) : null;
        return this;
    }

    public List<String> getAddColsToKeep() {
        return addColsToKeep;
    }

    /**
     * Columns carried over on top of the mandatory columns and {@link #getColsToKeep()}.
     */
    public ElementReplacementParameters setAddColsToKeep(List<String> addColsToKeep) {
        this.addColsToKeep = List.copyOf(Objects.requireNonNull(addColsToKeep));
        return this;
    }

    public boolean isSlack() {
        return slack;
    }

    /**
     * Whether generators replacing external grids are slack generators.
     */
    public ElementReplacementParameters setSlack(boolean slack) {
        this.slack = slack;
        return this;
    }

    public boolean isOnlyValidReplace() {
        return onlyValidReplace;
    }

    /**
     * Whether branches that the other branch type cannot represent exactly are skipped: asymmetric impedances, lines
     * with shunt admittance or gated by switches.
     */
    public ElementReplacementParameters setOnlyValidReplace(boolean onlyValidReplace) {
        this.onlyValidReplace = onlyValidReplace;
        return this;
    }

    public double getSnMva() {
        return snMva;
    }

    /**
     * Base power of the per unit impedances created from lines and extended wards.
     */
    public ElementReplacementParameters setSnMva(double snMva) {
        if (snMva <= 0 || Double.isNaN(snMva)) {
            throw new IllegalArgumentException("Invalid base power: " + snMva);
        }
        this.snMva = snMva;
        return this;
    }

    public ElementReplacementParameters copy() {
        ElementReplacementParameters copy = new ElementReplacementParameters()
                .setOldIndices(oldIndices)
                .setNewIndices(newIndices)
                .setColsToKeep(colsToKeep)
                .setAddColsToKeep(addColsToKeep)
                .setSlack(slack)
                .setOnlyValidReplace(onlyValidReplace);
        copy.snMva = snMva;
        return copy;
    }

    @Override
    public String toString() {
        return "ElementReplacementParameters(" +
                "oldIndices=" + oldIndices +
                ", newIndices=" + newIndices +
                ", colsToKeep=" + colsToKeep +
                ", addColsToKeep=" + addColsToKeep +
                ", slack=" + slack +
                ", onlyValidReplace=" + onlyValidReplace +
                ", snMva=" + snMva +
                ')';
    }
}
