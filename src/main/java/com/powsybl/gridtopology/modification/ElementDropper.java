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
 * Cascading removal of network elements, in place.
 * <p>
 * Removing a row also removes its result row, the switches gating it, the measurements and costs targeting it, the
 * controllers acting on it and its group memberships (groups left empty are removed). Removing a bus removes every
 * element connected to it.
 *
 * @author powsybl-grid-topology contributors
 */
public final class ElementDropper {

    private static final Logger LOGGER = LoggerFactory.getLogger(ElementDropper.class);

    private ElementDropper() {
    }

    public static void dropElements(Network network, ElementType type, Collection<Integer> indices) {
        Objects.requireNonNull(network);
        Objects.requireNonNull(type);
        Objects.requireNonNull(indices);
        checkIndices(network, type, indices);
        if (type == ElementType.BUS) {
            dropBuses(network, indices);
        } else {
            doDrop(network, type, new TreeSet<>(indices));
        }
    }

    public static void dropLines(Network network, Collection<Integer> lines) {
        dropElements(network, ElementType.LINE, lines);
    }

    public static void dropTrafos(Network network, Collection<Integer> trafos) {
        dropElements(network, ElementType.TRAFO, trafos);
    }

    /**
     * Drop the buses and every element connected to them.
     */
    public static void dropBuses(Network network, Collection<Integer> buses) {
        checkIndices(network, ElementType.BUS, buses);
        dropElementsAtBuses(network, buses, true, true);
        doDrop(network, ElementType.BUS, new TreeSet<>(buses));
    }

    /**
     * Drop the elements having a terminal on one of the given buses, and the switches connected to them. Buses are
     * kept.
     */
    public static void dropElementsAtBuses(Network network, Collection<Integer> buses, boolean branchElements,
                                           boolean busElements) {
        Objects.requireNonNull(network);
        Set<Integer> busSet = new HashSet<>(buses);
        for (ElementType type : ElementType.values()) {
            if (type.isBranch() && branchElements || type.isBusElement() && busElements) {
                Set<Integer> connected = getElementsAtBuses(network.getTable(type), busSet, false);
                if (!connected.isEmpty()) {
                    doDrop(network, type, connected);
                }
            }
        }
        ElementTable switches = network.getTable(ElementType.SWITCH);
        Set<Integer> connectedSwitches = new TreeSet<>();
        for (int sw : switches.getIndices()) {
            Integer bus = switches.getInteger(sw, Columns.BUS);
            if (bus != null && busSet.contains(bus)) {
                connectedSwitches.add(sw);
            } else if (isBusBusSwitch(switches, sw)) {
                Integer otherBus = switches.getInteger(sw, Columns.ELEMENT);
                if (otherBus != null && busSet.contains(otherBus)) {
                    connectedSwitches.add(sw);
                }
            }
        }
        if (!connectedSwitches.isEmpty()) {
            doDrop(network, ElementType.SWITCH, connectedSwitches);
        }
    }

    public static void dropElementsAtBuses(Network network, Collection<Integer> buses) {
        dropElementsAtBuses(network, buses, true, true);
    }

    /**
     * Drop the branches of the given types whose terminals all lie on the given buses. {@link ElementType#SWITCH}
     * stands for bus-bus switches.
     */
    public static void dropInnerBranches(Network network, Collection<Integer> buses, Collection<ElementType> branchTypes) {
        Objects.requireNonNull(network);
        Set<Integer> busSet = new HashSet<>(buses);
        for (ElementType type : branchTypes) {
            Set<Integer> inner;
            if (type == ElementType.SWITCH) {
                ElementTable switches = network.getTable(type);
                inner = new TreeSet<>();
                for (int sw : switches.getIndices()) {
                    if (isBusBusSwitch(switches, sw)
                            && busSet.contains(switches.getInteger(sw, Columns.BUS))
                            && busSet.contains(switches.getInteger(sw, Columns.ELEMENT))) {
                        inner.add(sw);
                    }
                }
            } else if (type.isBranch()) {
                inner = getElementsAtBuses(network.getTable(type), busSet, true);
            } else {
                throw new IllegalArgumentException("Element type '" + type + "' is not a branch type");
            }
            if (!inner.isEmpty()) {
                doDrop(network, type, inner);
            }
        }
    }

    public static void dropInnerBranches(Network network, Collection<Integer> buses) {
        List<ElementType> branchTypes = new ArrayList<>(ElementType.branchTypes());
        branchTypes.add(ElementType.SWITCH);
        dropInnerBranches(network, buses, branchTypes);
    }

    /**
     * Drop the measurements targeting the given elements.
     */
    public static void dropMeasurementsAt(Network network, ElementType type, Collection<Integer> indices) {
        Set<Integer> measurements = References.findTaggedReferences(network, type, indices)
                .getOrDefault(ElementType.MEASUREMENT, Collections.emptySet());
        if (!measurements.isEmpty()) {
            doDrop(network, ElementType.MEASUREMENT, measurements);
        }
    }

    static boolean isBusBusSwitch(ElementTable switches, int sw) {
        return switches.hasColumn(Columns.ET)
                && ReferenceColumn.toElementType(switches.getValue(sw, Columns.ET)) == ElementType.BUS;
    }

    /**
     * @param all if true, elements must have all their terminals on the buses, at least one otherwise
     */
    static Set<Integer> getElementsAtBuses(ElementTable table, Set<Integer> buses, boolean all) {
        Set<Integer> elements = new TreeSet<>();
        List<String> busColumns = table.getElementType().getBusColumns();
        if (busColumns.isEmpty()) {
            return elements;
        }
        for (int index : table.getIndices()) {
            boolean allAtBuses = true;
            boolean anyAtBuses = false;
            for (String busColumn : busColumns) {
                Integer bus = table.hasColumn(busColumn) ? table.getInteger(index, busColumn) : null;
                boolean atBuses = bus != null && buses.contains(bus);
                allAtBuses &= atBuses;
                anyAtBuses |= atBuses;
            }
            if (all ? allAtBuses : anyAtBuses) {
                elements.add(index);
            }
        }
        return elements;
    }

    static void checkIndices(Network network, ElementType type, Collection<Integer> indices) {
        ElementTable table = network.getTable(type);
        List<Integer> missing = indices.stream().filter(index -> !table.contains(index)).toList();
        if (!missing.isEmpty()) {
            throw StructuralException.missingIndices(type, missing);
        }
    }

    private static void doDrop(Network network, ElementType type, Set<Integer> indices) {
        // dependent rows first so that the cascade still sees the references
        Map<ElementType, Set<Integer>> dependents = References.findTaggedReferences(network, type, indices);
        for (Map.Entry<ElementType, Set<Integer>> e : dependents.entrySet()) {
            Set<Integer> remaining = new TreeSet<>(e.getValue());
            remaining.removeIf(index -> !network.getTable(e.getKey()).contains(index));
            if (!remaining.isEmpty()) {
                doDrop(network, e.getKey(), remaining);
            }
        }
        Set<Integer> controllers = References.findControllers(network, type, indices);
        if (!controllers.isEmpty()) {
            doDrop(network, ElementType.CONTROLLER, controllers);
        }
        network.removeRows(type, indices);
        References.removeGroupMembers(network, type, indices);
        LOGGER.debug("{} rows dropped from table '{}'", indices.size(), type);
    }
}
