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

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Selection criteria of the branches replaced by switches. A branch is selected when it has a zero length (lines
 * only) or when all its impedance parameters are below the given minimums.
 *
 * @author powsybl-grid-topology contributors
 */
public class ZeroBranchReplacementParameters {

    public static final Set<ElementType> ELEMENT_TYPES_DEFAULT_VALUE = EnumSet.of(ElementType.LINE, ElementType.IMPEDANCE);

    public static final boolean ZERO_LENGTH_DEFAULT_VALUE = true;

    public static final boolean ZERO_IMPEDANCE_DEFAULT_VALUE = true;

    public static final boolean IN_SERVICE_ONLY_DEFAULT_VALUE = true;

    public static final double MIN_LENGTH_KM_DEFAULT_VALUE = 0;

    public static final double MIN_R_OHM_PER_KM_DEFAULT_VALUE = 0;

    public static final double MIN_X_OHM_PER_KM_DEFAULT_VALUE = 0;

    public static final double MIN_C_NF_PER_KM_DEFAULT_VALUE = 0;

    public static final double MIN_RFT_PU_DEFAULT_VALUE = 0;

    public static final double MIN_XFT_PU_DEFAULT_VALUE = 0;

    public static final double MIN_RTF_PU_DEFAULT_VALUE = 0;

    public static final double MIN_XTF_PU_DEFAULT_VALUE = 0;

    public static final boolean DROP_AFFECTED_DEFAULT_VALUE = false;

    private Set<ElementType> elementTypes = EnumSet.copyOf(ELEMENT_TYPES_DEFAULT_VALUE);

    private boolean zeroLength = ZERO_LENGTH_DEFAULT_VALUE;

    private boolean zeroImpedance = ZERO_IMPEDANCE_DEFAULT_VALUE;

    private boolean inServiceOnly = IN_SERVICE_ONLY_DEFAULT_VALUE;

    private double minLengthKm = MIN_LENGTH_KM_DEFAULT_VALUE;

    private double minROhmPerKm = MIN_R_OHM_PER_KM_DEFAULT_VALUE;

    private double minXOhmPerKm = MIN_X_OHM_PER_KM_DEFAULT_VALUE;

    private double minCNfPerKm = MIN_C_NF_PER_KM_DEFAULT_VALUE;

    private double minRftPu = MIN_RFT_PU_DEFAULT_VALUE;

    private double minXftPu = MIN_XFT_PU_DEFAULT_VALUE;

    private double minRtfPu = MIN_RTF_PU_DEFAULT_VALUE;

    private double minXtfPu = MIN_XTF_PU_DEFAULT_VALUE;

    private boolean dropAffected = DROP_AFFECTED_DEFAULT_VALUE;

    private String namePrefix = GridTopologyParameters.REPLACEMENT_SWITCH_NAME_PREFIX_DEFAULT_VALUE;

    public static ZeroBranchReplacementParameters load(GridTopologyParameters parameters) {
        return new ZeroBranchReplacementParameters()
                .setNamePrefix(parameters.getReplacementSwitchNamePrefix());
    }

    public Set<ElementType> getElementTypes() {
        return elementTypes;
    }

    public ZeroBranchReplacementParameters setElementTypes(Set<ElementType> elementTypes) {
        Objects.requireNonNull(elementTypes);
        for (ElementType type : elementTypes) {
            if (type != ElementType.LINE && type != ElementType.IMPEDANCE) {
                throw new IllegalArgumentException("Only lines and impedances can be replaced by switches, not '" + type + "'");
            }
        }
        this.elementTypes = elementTypes.isEmpty() ? EnumSet.noneOf(ElementType.class) : EnumSet.copyOf(elementTypes);
        return this;
    }

    public boolean isZeroLength() {
        return zeroLength;
    }

    public ZeroBranchReplacementParameters setZeroLength(boolean zeroLength) {
        this.zeroLength = zeroLength;
        return this;
    }

    public boolean isZeroImpedance() {
        return zeroImpedance;
    }

    public ZeroBranchReplacementParameters setZeroImpedance(boolean zeroImpedance) {
        this.zeroImpedance = zeroImpedance;
        return this;
    }

    public boolean isInServiceOnly() {
        return inServiceOnly;
    }

    public ZeroBranchReplacementParameters setInServiceOnly(boolean inServiceOnly) {
        this.inServiceOnly = inServiceOnly;
        return this;
    }

    public double getMinLengthKm() {
        return minLengthKm;
    }

    public ZeroBranchReplacementParameters setMinLengthKm(double minLengthKm) {
        this.minLengthKm = minLengthKm;
        return this;
    }

    public double getMinROhmPerKm() {
        return minROhmPerKm;
    }

    public ZeroBranchReplacementParameters setMinROhmPerKm(double minROhmPerKm) {
        this.minROhmPerKm = minROhmPerKm;
        return this;
    }

    public double getMinXOhmPerKm() {
        return minXOhmPerKm;
    }

    public ZeroBranchReplacementParameters setMinXOhmPerKm(double minXOhmPerKm) {
        this.minXOhmPerKm = minXOhmPerKm;
        return this;
    }

    public double getMinCNfPerKm() {
        return minCNfPerKm;
    }

    public ZeroBranchReplacementParameters setMinCNfPerKm(double minCNfPerKm) {
        this.minCNfPerKm = minCNfPerKm;
        return this;
    }

    public double getMinRftPu() {
        return minRftPu;
    }

    public ZeroBranchReplacementParameters setMinRftPu(double minRftPu) {
        this.minRftPu = minRftPu;
        return this;
    }

    public double getMinXftPu() {
        return minXftPu;
    }

    public ZeroBranchReplacementParameters setMinXftPu(double minXftPu) {
        this.minXftPu = minXftPu;
        return this;
    }

    public double getMinRtfPu() {
        return minRtfPu;
    }

    public ZeroBranchReplacementParameters setMinRtfPu(double minRtfPu) {
        this.minRtfPu = minRtfPu;
        return this;
    }

    public double getMinXtfPu() {
        return minXtfPu;
    }

    public ZeroBranchReplacementParameters setMinXtfPu(double minXtfPu) {
        this.minXtfPu = minXtfPu;
        return this;
    }

    public boolean isDropAffected() {
        return dropAffected;
    }

    /**
     * Drop the replaced branches instead of setting them out of service.
     */
    public ZeroBranchReplacementParameters setDropAffected(boolean dropAffected) {
        this.dropAffected = dropAffected;
        return this;
    }

    public String getNamePrefix() {
        return namePrefix;
    }

    public ZeroBranchReplacementParameters setNamePrefix(String namePrefix) {
        this.namePrefix = Objects.requireNonNull(namePrefix);
        return this;
    }

    @Override
    public String toString() {
        return "ZeroBranchReplacementParameters(" +
                "elementTypes=" + elementTypes +
                ", zeroLength=" + zeroLength +
                ", zeroImpedance=" + zeroImpedance +
                ", inServiceOnly=" + inServiceOnly +
                ", minLengthKm=" + minLengthKm +
                ", minROhmPerKm=" + minROhmPerKm +
                ", minXOhmPerKm=" + minXOhmPerKm +
                ", minCNfPerKm=" + minCNfPerKm +
                ", minRftPu=" + minRftPu +
                ", minXftPu=" + minXftPu +
                ", minRtfPu=" + minRtfPu +
                ", minXtfPu=" + minXtfPu +
                ", dropAffected=" + dropAffected +
                ", namePrefix=" + namePrefix +
                ')';
    }
}
