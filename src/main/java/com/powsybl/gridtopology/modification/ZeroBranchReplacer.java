/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridtopology.modification;

import com.powsybl.gridtopology.GridTopologyParameters;
import com.powsybl.gridtopology.network.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Replacement of negligible branches by bus-bus switches, in place.
 *
 * @author powsybl-grid-topology contributors
 */
public final class ZeroBranchReplacer {

    private static final Logger LOGGER = LoggerFactory.getLogger(ZeroBranchReplacer.class);

    private ZeroBranchReplacer() {
    }

    /**
     * Create a bus-bus switch between the two terminals of a line or an impedance, closed if and only if the branch
     * is in service. The branch itself is left untouched.
     *
     * @return the index of the created switch
     */
    public static int createReplacementSwitchForBranch(Network network, ElementType type, int index, String namePrefix) {
        Objects.requireNonNull(network);
        Objects.requireNonNull(namePrefix);
        if (type != ElementType.LINE && type != ElementType.IMPEDANCE) {
            throw new InvalidTopologyException(type, index, "Only lines and impedances can be replaced by a switch");
        }
        ElementTable branches = network.getTable(type);
        ElementDropper.checkIndices(network, type, List.of(index));
        Integer fromBus = branches.getInteger(index, Columns.FROM_BUS);
        Integer toBus = branches.getInteger(index, Columns.TO_BUS);
        if (fromBus == null || toBus == null) {
            throw new InvalidTopologyException(type, index, "Branch is not connected at both sides");
        }
        boolean closed = branches.isInService(index);
        int sw = network.getTable(ElementType.SWITCH).newRow()
                .setValue(Columns.NAME, namePrefix + "_" + type + "_" + index)
                .setValue(Columns.BUS, fromBus)
                .setValue(Columns.ELEMENT, toBus)
                .setValue(Columns.ET, SwitchElementType.BUS)
                .setValue(Columns.CLOSED, closed)
                .add();
        LOGGER.debug("Switch {} created between buses {} and {} in replacement of {} {}", sw, fromBus, toBus, type, index);
        return sw;
    }

    public static int createReplacementSwitchForBranch(Network network, ElementType type, int index) {
        return createReplacementSwitchForBranch(network, type, index, GridTopologyParameters.REPLACEMENT_SWITCH_NAME_PREFIX_DEFAULT_VALUE);
    }

    /**
     * Replace the selected branches by switches. Replaced branches are set out of service, or dropped.
     *
     * @return the replaced branches by element type
     */
    public static Map<ElementType, List<Integer>> replaceZeroBranchesWithSwitches(Network network,
                                                                                  ZeroBranchReplacementParameters parameters) {
        Objects.requireNonNull(network);
        Objects.requireNonNull(parameters);
        Map<ElementType, List<Integer>> affected = new EnumMap<>(ElementType.class);
        for (ElementType type : parameters.getElementTypes()) {
            ElementTable branches = network.getTable(type);
            List<Integer> selected = branches.getIndices().stream()
                    .filter(index -> !parameters.isInServiceOnly() || branches.isInService(index))
                    .filter(index -> isZeroBranch(branches, index, parameters))
                    .toList();
            if (selected.isEmpty()) {
                continue;
            }
            for (int index : selected) {
                createReplacementSwitchForBranch(network, type, index, parameters.getNamePrefix());
            }
            if (parameters.isDropAffected()) {
                ElementDropper.dropElements(network, type, selected);
            } else {
                for (int index : selected) {
                    branches.setValue(index, Columns.IN_SERVICE, false);
                }
            }
            affected.put(type, selected);
        }
        LOGGER.info("{} branches replaced by switches", affected.values().stream().mapToInt(List::size).sum());
        return affected;
    }

    private static boolean isZeroBranch(ElementTable branches, int index, ZeroBranchReplacementParameters parameters) {
        if (branches.getElementType() == ElementType.LINE) {
            if (parameters.isZeroLength() && isBelow(branches, index, Columns.LENGTH_KM, parameters.getMinLengthKm())) {
                return true;
            }
            return parameters.isZeroImpedance()
                    && isBelow(branches, index, Columns.R_OHM_PER_KM, parameters.getMinROhmPerKm())
                    && isBelow(branches, index, Columns.X_OHM_PER_KM, parameters.getMinXOhmPerKm())
                    && isBelow(branches, index, Columns.C_NF_PER_KM, parameters.getMinCNfPerKm());
        }
        return parameters.isZeroImpedance()
                && isBelow(branches, index, Columns.RFT_PU, parameters.getMinRftPu())
                && isBelow(branches, index, Columns.XFT_PU, parameters.getMinXftPu())
                && isBelow(branches, index, Columns.RTF_PU, parameters.getMinRtfPu())
                && isBelow(branches, index, Columns.XTF_PU, parameters.getMinXtfPu());
    }

    private static boolean isBelow(ElementTable branches, int index, String column, double min) {
        return branches.hasColumn(column) && branches.getDouble(index, column) <= min;
    }
}
