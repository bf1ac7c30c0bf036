/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridtopology.modification;

import com.google.common.base.Stopwatch;
import com.powsybl.gridtopology.network.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.TimeUnit;

/**
 * Extraction of the subnetwork induced by a set of buses.
 * <p>
 * An element is kept if all its terminals are on selected buses. A switch gating a branch is kept if its bus is
 * selected and the branch is kept. Measurements and costs are kept with the element they target, groups keep their
 * surviving members and disappear when none survives. The source network is left untouched.
 *
 * @author powsybl-grid-topology contributors
 */
public final class SubnetSelector {

    private static final Logger LOGGER = LoggerFactory.getLogger(SubnetSelector.class);

    private SubnetSelector() {
    }

    public static Network selectSubnet(Network network, Collection<Integer> buses) {
        return selectSubnet(network, buses, new SelectSubnetParameters());
    }

    public static Network selectSubnet(Network network, Collection<Integer> buses, SelectSubnetParameters parameters) {
        Objects.requireNonNull(network);
        Objects.requireNonNull(parameters);
        ElementDropper.checkIndices(network, ElementType.BUS, buses);
        Stopwatch stopwatch = Stopwatch.createStarted();

        Set<Integer> selectedBuses = parameters.isIncludeSwitchBuses()
                ? widenBySwitchBuses(network, buses)
                : new HashSet<>(buses);

        Map<ElementType, Set<Integer>> kept = new EnumMap<>(ElementType.class);
        kept.put(ElementType.BUS, selectedBuses);
        for (ElementType type : ElementType.values()) {
            if (type.isBranch() || type.isBusElement()) {
                kept.put(type, ElementDropper.getElementsAtBuses(network.getTable(type), selectedBuses, true));
            }
        }
        kept.put(ElementType.SWITCH, selectSwitches(network.getTable(ElementType.SWITCH), selectedBuses, kept));
        for (ElementType type : List.of(ElementType.MEASUREMENT, ElementType.POLY_COST, ElementType.PWL_COST)) {
            kept.put(type, selectTargetingKept(network.getTable(type), kept));
        }

        Network subnet = new Network(network.getName());
        kept.forEach((type, indices) -> {
            subnet.setTable(network.getTable(type).select(indices));
            if (parameters.isIncludeResults()) {
                network.getOptionalResultTable(type).ifPresent(t -> subnet.setTable(t.select(indices)));
            }
        });
        subnet.setTable(selectGroups(network.getTable(ElementType.GROUP), kept));
        if (parameters.isKeepEverythingElse()) {
            subnet.setTable(network.getTable(ElementType.CONTROLLER).select(selectControllers(network, kept)));
        }

        stopwatch.stop();
        LOGGER.debug("Subnetwork of {} buses selected from network '{}' in {} ms", selectedBuses.size(),
                network.getName(), stopwatch.elapsed(TimeUnit.MILLISECONDS));
        return subnet;
    }

    /**
     * Add to the buses the bus of every switch gating a branch whose other terminal is one of the buses.
     */
    public static Set<Integer> widenBySwitchBuses(Network network, Collection<Integer> buses) {
        Set<Integer> widened = new TreeSet<>(buses);
        ElementTable switches = network.getTable(ElementType.SWITCH);
        for (int sw : switches.getIndices()) {
            ElementType target = switches.hasColumn(Columns.ET) ? ReferenceColumn.toElementType(switches.getValue(sw, Columns.ET)) : null;
            Integer bus = switches.getInteger(sw, Columns.BUS);
            Integer element = switches.getInteger(sw, Columns.ELEMENT);
            if (target == null || target == ElementType.BUS || bus == null || element == null
                    || !network.getTable(target).contains(element)) {
                continue;
            }
            ElementTable branches = network.getTable(target);
            for (String busColumn : target.getBusColumns()) {
                Integer terminal = branches.hasColumn(busColumn) ? branches.getInteger(element, busColumn) : null;
                if (terminal != null && !terminal.equals(bus) && buses.contains(terminal)) {
                    widened.add(bus);
                    break;
                }
            }
        }
        return widened;
    }

    private static Set<Integer> selectSwitches(ElementTable switches, Set<Integer> buses, Map<ElementType, Set<Integer>> kept) {
        Set<Integer> selected = new TreeSet<>();
        for (int sw : switches.getIndices()) {
            Integer bus = switches.getInteger(sw, Columns.BUS);
            Integer element = switches.getInteger(sw, Columns.ELEMENT);
            ElementType target = switches.hasColumn(Columns.ET) ? ReferenceColumn.toElementType(switches.getValue(sw, Columns.ET)) : null;
            if (bus == null || element == null || target == null || !buses.contains(bus)) {
                continue;
            }
            if (kept.getOrDefault(target, Collections.emptySet()).contains(element)) {
                selected.add(sw);
            }
        }
        return selected;
    }

    /**
     * Controllers acting on kept elements only.
     */
    private static Set<Integer> selectControllers(Network network, Map<ElementType, Set<Integer>> kept) {
        ElementTable controllers = network.getTable(ElementType.CONTROLLER);
        Set<Integer> selected = new TreeSet<>();
        for (int row : controllers.getIndices()) {
            Controller controller = References.getController(controllers, row);
            boolean allKept = controller == null || controller.getReferences().entrySet().stream()
                    .allMatch(e -> kept.getOrDefault(e.getKey(), Collections.emptySet()).containsAll(e.getValue()));
            if (allKept) {
                selected.add(row);
            }
        }
        return selected;
    }

    private static Set<Integer> selectTargetingKept(ElementTable table, Map<ElementType, Set<Integer>> kept) {
        Set<Integer> selected = new TreeSet<>();
        for (ReferenceColumn column : ReferenceColumn.ownedBy(table.getElementType())) {
            for (int index : table.getIndices()) {
                ElementType target = column.getTarget(table, index);
                Integer element = column.getReferencedIndex(table, index);
                if (target != null && element != null && kept.getOrDefault(target, Collections.emptySet()).contains(element)) {
                    selected.add(index);
                }
            }
        }
        return selected;
    }

    private static ElementTable selectGroups(ElementTable groups, Map<ElementType, Set<Integer>> kept) {
        Map<Integer, GroupMembers> filteredMembers = new HashMap<>();
        for (int group : groups.getIndices()) {
            GroupMembers members = References.getMembers(groups, group);
            for (ElementType type : members.getElementTypes()) {
                Set<Integer> keptOfType = kept.getOrDefault(type, Collections.emptySet());
                members = members.filter(type, keptOfType::contains);
            }
            if (!members.isEmpty()) {
                filteredMembers.put(group, members);
            }
        }
        ElementTable selected = groups.select(filteredMembers.keySet());
        filteredMembers.forEach((group, members) -> selected.setValue(group, Columns.MEMBERS, members));
        return selected;
    }
}
