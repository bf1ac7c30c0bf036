/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridtopology.modification;

import com.powsybl.gridtopology.graph.NetworkTopology;
import com.powsybl.gridtopology.network.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Pruning of the out of service and unsupplied parts of a network, in place.
 *
 * @author powsybl-grid-topology contributors
 */
public final class InactiveElements {

    private static final Logger LOGGER = LoggerFactory.getLogger(InactiveElements.class);

    private InactiveElements() {
    }

    /**
     * Set out of service the in service buses not connected to an external grid or a slack generator, together with
     * the elements connected to them.
     *
     * @return the buses set out of service
     */
    public static List<Integer> setIsolatedAreasOutOfService(Network network, boolean respectSwitches) {
        List<Integer> unsupplied = NetworkTopology.unsuppliedBuses(network, respectSwitches);
        ElementTable buses = network.getTable(ElementType.BUS);
        Set<Integer> switchedOff = new TreeSet<>();
        for (int bus : unsupplied) {
            if (buses.isInService(bus)) {
                buses.setValue(bus, Columns.IN_SERVICE, false);
                switchedOff.add(bus);
            }
        }
        if (!switchedOff.isEmpty()) {
            for (ElementType type : ElementType.values()) {
                if (type.isBranch() || type.isBusElement()) {
                    ElementTable table = network.getTable(type);
                    for (int index : ElementDropper.getElementsAtBuses(table, switchedOff, false)) {
                        table.setValue(index, Columns.IN_SERVICE, false);
                    }
                }
            }
        }
        LOGGER.info("{} of {} unsupplied buses set out of service", switchedOff.size(), unsupplied.size());
        return new ArrayList<>(switchedOff);
    }

    /**
     * Set isolated areas out of service, then drop every out of service row and everything connected to out of
     * service buses. In service external grids and their buses are always kept.
     */
    public static void dropInactiveElements(Network network, boolean respectSwitches) {
        Objects.requireNonNull(network);
        setIsolatedAreasOutOfService(network, respectSwitches);

        Set<Integer> slackBuses = new HashSet<>();
        ElementTable extGrids = network.getTable(ElementType.EXT_GRID);
        for (int extGrid : extGrids.getIndices()) {
            Integer bus = extGrids.getInteger(extGrid, Columns.BUS);
            if (bus != null && extGrids.isInService(extGrid)) {
                slackBuses.add(bus);
            }
        }

        ElementTable buses = network.getTable(ElementType.BUS);
        List<Integer> inactiveBuses = buses.getIndices().stream()
                .filter(bus -> !buses.isInService(bus) && !slackBuses.contains(bus))
                .toList();
        if (!inactiveBuses.isEmpty()) {
            ElementDropper.dropBuses(network, inactiveBuses);
        }

        int dropped = inactiveBuses.size();
        for (ElementType type : ElementType.values()) {
            if (type == ElementType.BUS) {
                continue;
            }
            ElementTable table = network.getTable(type);
            if (!table.hasColumn(Columns.IN_SERVICE)) {
                continue;
            }
            List<Integer> inactive = table.getIndices().stream()
                    .filter(index -> !table.isInService(index))
                    .toList();
            if (!inactive.isEmpty()) {
                ElementDropper.dropElements(network, type, inactive);
                dropped += inactive.size();
            }
        }
        LOGGER.info("{} inactive elements dropped", dropped);
    }

    public static void dropInactiveElements(Network network) {
        dropInactiveElements(network, true);
    }
}
