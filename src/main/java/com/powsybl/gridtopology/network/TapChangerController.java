/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridtopology.network;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.IntUnaryOperator;

/**
 * Continuous tap changer control of a transformer, holding a voltage set point at one of its sides.
 *
 * @author powsybl-grid-topology contributors
 */
public class TapChangerController implements Controller {

    public enum Side {
        HV,
        LV
    }

    public static final double DEFAULT_TOLERANCE = 1e-3;

    private final int trafoIndex;

    private Side side;

    private double vmSetPu;

    private double tolerance;

    public TapChangerController(int trafoIndex, Side side, double vmSetPu) {
        this(trafoIndex, side, vmSetPu, DEFAULT_TOLERANCE);
    }

    public TapChangerController(int trafoIndex, Side side, double vmSetPu, double tolerance) {
        this.trafoIndex = trafoIndex;
        this.side = Objects.requireNonNull(side);
        this.vmSetPu = vmSetPu;
        this.tolerance = tolerance;
    }

    public int getTrafoIndex() {
        return trafoIndex;
    }

    public Side getSide() {
        return side;
    }

    public TapChangerController setSide(Side side) {
        this.side = Objects.requireNonNull(side);
        return this;
    }

    public double getVmSetPu() {
        return vmSetPu;
    }

    public TapChangerController setVmSetPu(double vmSetPu) {
        this.vmSetPu = vmSetPu;
        return this;
    }

    public double getTolerance() {
        return tolerance;
    }

    public TapChangerController setTolerance(double tolerance) {
        this.tolerance = tolerance;
        return this;
    }

    @Override
    public Map<ElementType, List<Integer>> getReferences() {
        return Map.of(ElementType.TRAFO, List.of(trafoIndex));
    }

    @Override
    public TapChangerController remap(ElementType type, IntUnaryOperator mapper) {
        if (type != ElementType.TRAFO) {
            return this;
        }
        int newTrafoIndex = mapper.applyAsInt(trafoIndex);
        return newTrafoIndex == trafoIndex ? this : new TapChangerController(newTrafoIndex, side, vmSetPu, tolerance);
    }

    @Override
    public TapChangerController copy() {
        return new TapChangerController(trafoIndex, side, vmSetPu, tolerance);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        TapChangerController that = (TapChangerController) o;
        return trafoIndex == that.trafoIndex
                && Double.compare(vmSetPu, that.vmSetPu) == 0
                && Double.compare(tolerance, that.tolerance) == 0
                && side == that.side;
    }

    @Override
    public int hashCode() {
        return Objects.hash(trafoIndex, side, vmSetPu, tolerance);
    }

    @Override
    public String toString() {
        return "TapChangerController(trafo=" + trafoIndex + ", side=" + side + ", vmSetPu=" + vmSetPu + ")";
    }
}
