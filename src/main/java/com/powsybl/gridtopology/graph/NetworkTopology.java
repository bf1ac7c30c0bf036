/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridtopology.graph;

import com.powsybl.gridtopology.GridTopologyParameters;
import com.powsybl.gridtopology.network.*;
import org.apache.commons.lang3.tuple.Pair;

import java.util.*;

/**
 * Connectivity queries on the buses of a network.
 * <p>
 * Every query returns indices deduplicated and sorted in ascending order. Queries never modify the network.
 *
 * @author powsybl-grid-topology contributors
 */
public final class NetworkTopology {

    private NetworkTopology() {
    }

    /**
     * Buses reachable from the seed buses through any number of hops, seeds excluded.
     */
    public static List<Integer> connectedBuses(Network network, Collection<Integer> seeds, boolean respectSwitches,
                                               boolean respectInService) {
        checkBuses(network, seeds);
        BusGraph graph = new BusGraph(network, respectSwitches, respectInService);
        Set<Integer> connected = new TreeSet<>();
        for (int seed : seeds) {
            connected.addAll(graph.getConnectedSet(seed));
        }
        connected.removeAll(seeds);
        return new ArrayList<>(connected);
    }

    public static List<Integer> connectedBuses(Network network, Collection<Integer> seeds, GridTopologyParameters parameters) {
        return connectedBuses(network, seeds, parameters.isRespectSwitches(), parameters.isRespectInService());
    }

    /**
     * Buses linked to one of the seed buses by a single branch or bus-bus switch, seeds excluded.
     */
    public static List<Integer> adjacentBuses(Network network, Collection<Integer> seeds, boolean respectSwitches,
                                              boolean respectInService) {
        checkBuses(network, seeds);
        return adjacentBuses(new BusGraph(network, respectSwitches, respectInService), seeds);
    }

    private static List<Integer> adjacentBuses(BusGraph graph, Collection<Integer> seeds) {
        Set<Integer> adjacent = new TreeSet<>();
        for (int seed : seeds) {
            adjacent.addAll(graph.getAdjacentBuses(seed));
        }
        adjacent.removeAll(seeds);
        return new ArrayList<>(adjacent);
    }

    /**
     * Elements of the given type having a terminal on one of the seed buses. When switches are respected, a branch
     * gated by an open switch at that terminal is not connected. Switches are connected when their bus, or the other
     * bus of a bus-bus switch, is a seed.
     */
    public static List<Integer> connectedElements(Network network, ElementType type, Collection<Integer> seeds,
                                                  boolean respectSwitches, boolean respectInService) {
        Objects.requireNonNull(type);
        checkBuses(network, seeds);
        if (!type.hasBusColumns()) {
            throw new IllegalArgumentException("Element type '" + type + "' is not connected to buses");
        }
        return type == ElementType.SWITCH
                ? connectedSwitches(network, seeds, respectInService)
                : connectedTerminalElements(network, type, new HashSet<>(seeds), respectSwitches, respectInService);
    }

    private static List<Integer> connectedSwitches(Network network, Collection<Integer> seeds, boolean respectInService) {
        Set<Integer> seedSet = new HashSet<>(seeds);
        ElementTable switches = network.getTable(ElementType.SWITCH);
        List<Integer> connected = new ArrayList<>();
        for (int sw : switches.getIndices()) {
            if (respectInService && !switches.isInService(sw)) {
                continue;
            }
            Integer bus = switches.hasColumn(Columns.BUS) ? switches.getInteger(sw, Columns.BUS) : null;
            boolean atSeed = bus != null && seedSet.contains(bus);
            if (!atSeed && BusGraph.getSwitchTarget(switches, sw) == ElementType.BUS) {
                Integer otherBus = switches.getInteger(sw, Columns.ELEMENT);
                atSeed = otherBus != null && seedSet.contains(otherBus);
            }
            if (atSeed) {
                connected.add(sw);
            }
        }
        Collections.sort(connected);
        return connected;
    }

    private static List<Integer> connectedTerminalElements(Network network, ElementType type, Set<Integer> seeds,
                                                           boolean respectSwitches, boolean respectInService) {
        Set<Pair<Integer, Integer>> openGates = respectSwitches && type.isBranch()
                ? getOpenGates(network, type, seeds)
                : Collections.emptySet();
        ElementTable table = network.getTable(type);
        List<Integer> connected = new ArrayList<>();
        for (int index : table.getIndices()) {
            if (respectInService && !table.isInService(index)) {
                continue;
            }
            for (String busColumn : type.getBusColumns()) {
                Integer bus = table.hasColumn(busColumn) ? table.getInteger(index, busColumn) : null;
                if (bus != null && seeds.contains(bus) && !openGates.contains(Pair.of(index, bus))) {
                    connected.add(index);
                    break;
                }
            }
        }
        Collections.sort(connected);
        return connected;
    }

    /**
     * (element, bus) pairs of the open switches gating elements of the given type at one of the given buses.
     */
    private static Set<Pair<Integer, Integer>> getOpenGates(Network network, ElementType type, Set<Integer> buses) {
        ElementTable switches = network.getTable(ElementType.SWITCH);
        Set<Pair<Integer, Integer>> openGates = new HashSet<>();
        for (int sw : switches.getIndices()) {
            if (BusGraph.getSwitchTarget(switches, sw) == type && !switches.getBoolean(sw, Columns.CLOSED, true)) {
                Integer bus = switches.getInteger(sw, Columns.BUS);
                Integer element = switches.getInteger(sw, Columns.ELEMENT);
                if (bus != null && element != null && buses.contains(bus)) {
                    openGates.add(Pair.of(element, bus));
                }
            }
        }
        return openGates;
    }

    /**
     * Connected elements of every element type connected to buses, keyed by type, only non empty entries being
     * present. The bus entry, when requested, holds the adjacent buses of the seeds.
     */
    public static Map<ElementType, List<Integer>> connectedElementsDict(Network network, Collection<Integer> seeds,
                                                                        boolean respectSwitches, boolean respectInService,
                                                                        boolean includeBuses) {
        checkBuses(network, seeds);
        Map<ElementType, List<Integer>> connected = new EnumMap<>(ElementType.class);
        for (ElementType type : ElementType.values()) {
            List<Integer> indices;
            if (type == ElementType.BUS) {
                if (!includeBuses) {
                    continue;
                }
                indices = adjacentBuses(new BusGraph(network, respectSwitches, respectInService), seeds);
            } else if (type.hasBusColumns()) {
                indices = connectedElements(network, type, seeds, respectSwitches, respectInService);
            } else {
                continue;
            }
            if (!indices.isEmpty()) {
                connected.put(type, indices);
            }
        }
        return connected;
    }

    public static Map<ElementType, List<Integer>> connectedElementsDict(Network network, Collection<Integer> seeds,
                                                                        boolean respectSwitches, boolean respectInService) {
        return connectedElementsDict(network, seeds, respectSwitches, respectInService, true);
    }

    public static Map<ElementType, List<Integer>> connectedElementsDict(Network network, Collection<Integer> seeds,
                                                                        GridTopologyParameters parameters) {
        return connectedElementsDict(network, seeds, parameters.isRespectSwitches(), parameters.isRespectInService());
    }

    /**
     * Other terminal of a two terminal element.
     *
     * @throws InvalidTopologyException if the element is not a two terminal element or if the bus is not one of its
     * terminals
     */
    public static int nextBus(Network network, int fromBus, int elementIndex, ElementType type) {
        Objects.requireNonNull(network);
        Objects.requireNonNull(type);
        ElementTable table = network.getTable(type);
        if (!table.contains(elementIndex)) {
            throw StructuralException.missingIndices(type, List.of(elementIndex));
        }
        String column1;
        String column2;
        switch (type) {
            case LINE, IMPEDANCE, DCLINE -> {
                column1 = Columns.FROM_BUS;
                column2 = Columns.TO_BUS;
            }
            case TRAFO -> {
                column1 = Columns.HV_BUS;
                column2 = Columns.LV_BUS;
            }
            case SWITCH -> {
                if (BusGraph.getSwitchTarget(table, elementIndex) != ElementType.BUS) {
                    throw new InvalidTopologyException(type, elementIndex, "Switch " + elementIndex + " is not a bus-bus switch");
                }
                column1 = Columns.BUS;
                column2 = Columns.ELEMENT;
            }
            default -> throw new InvalidTopologyException(type, elementIndex, "Element type '" + type + "' is not a two terminal element");
        }
        Integer bus1 = table.getInteger(elementIndex, column1);
        Integer bus2 = table.getInteger(elementIndex, column2);
        if (bus1 != null && bus1 == fromBus) {
            if (bus2 == null) {
                throw new InvalidTopologyException(type, elementIndex, type + " " + elementIndex + " has no " + column2);
            }
            return bus2;
        }
        if (bus2 != null && bus2 == fromBus) {
            if (bus1 == null) {
                throw new InvalidTopologyException(type, elementIndex, type + " " + elementIndex + " has no " + column1);
            }
            return bus1;
        }
        throw new InvalidTopologyException(type, elementIndex, "Bus " + fromBus + " is not a terminal of " + type + " " + elementIndex);
    }

    /**
     * Connected components of the bus graph, each sorted, ordered by lowest bus index.
     */
    public static List<Set<Integer>> connectedComponents(Network network, boolean respectSwitches, boolean respectInService) {
        return new BusGraph(network, respectSwitches, respectInService).getConnectedComponents();
    }

    public static List<Set<Integer>> connectedComponents(Network network, GridTopologyParameters parameters) {
        return connectedComponents(network, parameters.isRespectSwitches(), parameters.isRespectInService());
    }

    /**
     * Buses not connected, through in service elements, to an in service external grid or slack generator. Out of
     * service buses are unsupplied.
     */
    public static List<Integer> unsuppliedBuses(Network network, boolean respectSwitches) {
        BusGraph graph = new BusGraph(network, respectSwitches, true);
        Set<Integer> supplied = new HashSet<>();
        for (int slackBus : getSlackBuses(network)) {
            supplied.addAll(graph.getConnectedSet(slackBus));
        }
        List<Integer> unsupplied = new ArrayList<>();
        for (int bus : network.getTable(ElementType.BUS).getIndices()) {
            if (!supplied.contains(bus)) {
                unsupplied.add(bus);
            }
        }
        Collections.sort(unsupplied);
        return unsupplied;
    }

    /**
     * Buses of the in service external grids and slack generators.
     */
    public static Set<Integer> getSlackBuses(Network network) {
        Set<Integer> slackBuses = new TreeSet<>();
        ElementTable extGrids = network.getTable(ElementType.EXT_GRID);
        for (int extGrid : extGrids.getIndices()) {
            Integer bus = extGrids.hasColumn(Columns.BUS) ? extGrids.getInteger(extGrid, Columns.BUS) : null;
            if (bus != null && extGrids.isInService(extGrid)) {
                slackBuses.add(bus);
            }
        }
        ElementTable gens = network.getTable(ElementType.GEN);
        for (int gen : gens.getIndices()) {
            Integer bus = gens.hasColumn(Columns.BUS) ? gens.getInteger(gen, Columns.BUS) : null;
            if (bus != null && gens.isInService(gen) && gens.hasColumn(Columns.SLACK) && gens.getBoolean(gen, Columns.SLACK, false)) {
                slackBuses.add(bus);
            }
        }
        return slackBuses;
    }

    private static void checkBuses(Network network, Collection<Integer> buses) {
        Objects.requireNonNull(network);
        Objects.requireNonNull(buses);
        ElementTable busTable = network.getTable(ElementType.BUS);
        List<Integer> missing = buses.stream().filter(bus -> !busTable.contains(bus)).toList();
        if (!missing.isEmpty()) {
            throw StructuralException.missingIndices(ElementType.BUS, missing);
        }
    }
}
