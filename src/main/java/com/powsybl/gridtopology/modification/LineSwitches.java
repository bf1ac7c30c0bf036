/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridtopology.modification;

import com.powsybl.gridtopology.network.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Switch state fixes on lines.
 *
 * @author powsybl-grid-topology contributors
 */
public final class LineSwitches {

    private static final Logger LOGGER = LoggerFactory.getLogger(LineSwitches.class);

    private LineSwitches() {
    }

    /**
     * Close one open switch of each line opened by at least two switches, the one with the lowest index. The line
     * stays open at its other end but is no longer floating.
     *
     * @return the closed switches
     */
    public static List<Integer> closeSwitchAtLineWithTwoOpenSwitches(Network network) {
        Objects.requireNonNull(network);
        ElementTable switches = network.getTable(ElementType.SWITCH);
        Map<Integer, SortedSet<Integer>> openSwitchesByLine = new TreeMap<>();
        References.forEachReference(network, ElementType.LINE, (table, row, column, line) -> {
            if (table.getElementType() == ElementType.SWITCH && !switches.getBoolean(row, Columns.CLOSED, true)) {
                openSwitchesByLine.computeIfAbsent(line, k -> new TreeSet<>()).add(row);
            }
        });
        List<Integer> closed = new ArrayList<>();
        openSwitchesByLine.values().forEach(openSwitches -> {
            if (openSwitches.size() > 1) {
                closed.add(openSwitches.first());
            }
        });
        for (int sw : closed) {
            switches.setValue(sw, Columns.CLOSED, true);
        }
        LOGGER.info("{} switches closed at lines with at least two open switches", closed.size());
        return closed;
    }
}
