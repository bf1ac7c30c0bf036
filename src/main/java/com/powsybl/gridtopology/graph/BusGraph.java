/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridtopology.graph;

import com.powsybl.gridtopology.network.*;
import org.apache.commons.lang3.tuple.Pair;
import org.apache.commons.lang3.tuple.Triple;
import org.jgrapht.Graph;
import org.jgrapht.Graphs;
import org.jgrapht.alg.connectivity.ConnectivityInspector;
import org.jgrapht.graph.AsUnmodifiableGraph;
import org.jgrapht.graph.Pseudograph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Undirected multigraph of the buses of a network, built once for a given switch and service filter.
 * <p>
 * Two buses are linked by a bus-bus switch (closed, when switches are respected) or by a branch element. A branch
 * element links two of its terminals only if, when switches are respected, no open switch gates it at either of these
 * terminals. When the service state is respected, out of service buses and elements are left out.
 *
 * @author powsybl-grid-topology contributors
 */
public class BusGraph {

    private static final Logger LOGGER = LoggerFactory.getLogger(BusGraph.class);

    private final Graph<Integer, BranchEdge> graph = new Pseudograph<>(BranchEdge.class);

    private final boolean respectSwitches;

    private final boolean respectInService;

    private ConnectivityInspector<Integer, BranchEdge> connectivityInspector;

    public BusGraph(Network network, boolean respectSwitches, boolean respectInService) {
        Objects.requireNonNull(network);
        this.respectSwitches = respectSwitches;
        this.respectInService = respectInService;
        build(network);
    }

    private void build(Network network) {
        ElementTable buses = network.getTable(ElementType.BUS);
        for (int bus : buses.getIndices()) {
            if (!respectInService || buses.isInService(bus)) {
                graph.addVertex(bus);
            }
        }

        ElementTable switches = network.getTable(ElementType.SWITCH);
        Set<Triple<ElementType, Integer, Integer>> openGates = new HashSet<>();
        for (int sw : switches.getIndices()) {
            ElementType target = getSwitchTarget(switches, sw);
            Integer bus = switches.getInteger(sw, Columns.BUS);
            Integer element = switches.getInteger(sw, Columns.ELEMENT);
            if (target == null || bus == null || element == null) {
                continue;
            }
            boolean closed = switches.getBoolean(sw, Columns.CLOSED, true);
            if (target == ElementType.BUS) {
                if ((!respectSwitches || closed) && (!respectInService || switches.isInService(sw))) {
                    addEdge(new BranchEdge(ElementType.SWITCH, sw, Columns.BUS, Columns.ELEMENT), bus, element);
                }
            } else if (respectSwitches && !closed) {
                openGates.add(Triple.of(target, element, bus));
            }
        }

        for (ElementType type : ElementType.branchTypes()) {
            ElementTable branches = network.getTable(type);
            List<Pair<String, String>> terminalPairs = getTerminalPairs(type);
            for (int branch : branches.getIndices()) {
                if (respectInService && !branches.isInService(branch)) {
                    continue;
                }
                for (Pair<String, String> terminals : terminalPairs) {
                    Integer bus1 = getBus(branches, branch, terminals.getLeft());
                    Integer bus2 = getBus(branches, branch, terminals.getRight());
                    if (bus1 == null || bus2 == null
                            || openGates.contains(Triple.of(type, branch, bus1))
                            || openGates.contains(Triple.of(type, branch, bus2))) {
                        continue;
                    }
                    addEdge(new BranchEdge(type, branch, terminals.getLeft(), terminals.getRight()), bus1, bus2);
                }
            }
        }

        LOGGER.trace("Bus graph built: {} buses, {} edges (respectSwitches={}, respectInService={})",
                graph.vertexSet().size(), graph.edgeSet().size(), respectSwitches, respectInService);
    }

    private static Integer getBus(ElementTable table, int index, String column) {
        return table.hasColumn(column) ? table.getInteger(index, column) : null;
    }

    private void addEdge(BranchEdge edge, int bus1, int bus2) {
        // terminals on filtered out or unknown buses do not link anything
        if (graph.containsVertex(bus1) && graph.containsVertex(bus2)) {
            graph.addEdge(bus1, bus2, edge);
        }
    }

    /**
     * Pairs of bus columns of a branch type linked by an edge: one pair for two terminal branches, every pair of
     * terminals for three winding transformers.
     */
    static List<Pair<String, String>> getTerminalPairs(ElementType type) {
        List<String> busColumns = type.getBusColumns();
        List<Pair<String, String>> pairs = new ArrayList<>();
        for (int i = 0; i < busColumns.size(); i++) {
            for (int j = i + 1; j < busColumns.size(); j++) {
                pairs.add(Pair.of(busColumns.get(i), busColumns.get(j)));
            }
        }
        return pairs;
    }

    /**
     * @return the element type targeted by a switch, or null if not set
     */
    static ElementType getSwitchTarget(ElementTable switches, int sw) {
        return switches.hasColumn(Columns.ET) ? ReferenceColumn.toElementType(switches.getValue(sw, Columns.ET)) : null;
    }

    public Graph<Integer, BranchEdge> getGraph() {
        return new AsUnmodifiableGraph<>(graph);
    }

    public boolean isRespectSwitches() {
        return respectSwitches;
    }

    public boolean isRespectInService() {
        return respectInService;
    }

    public boolean containsBus(int bus) {
        return graph.containsVertex(bus);
    }

    /**
     * Buses linked to the given one by at least one edge, the bus itself excluded.
     */
    public Set<Integer> getAdjacentBuses(int bus) {
        if (!graph.containsVertex(bus)) {
            return Collections.emptySet();
        }
        Set<Integer> adjacent = new TreeSet<>(Graphs.neighborSetOf(graph, bus));
        adjacent.remove(bus);
        return adjacent;
    }

    private ConnectivityInspector<Integer, BranchEdge> getConnectivityInspector() {
        if (connectivityInspector == null) {
            connectivityInspector = new ConnectivityInspector<>(graph);
        }
        return connectivityInspector;
    }

    /**
     * Buses of the connected component of the given bus, the bus itself included.
     */
    public Set<Integer> getConnectedSet(int bus) {
        if (!graph.containsVertex(bus)) {
            return Collections.emptySet();
        }
        return getConnectivityInspector().connectedSetOf(bus);
    }

    /**
     * Connected components, sorted by lowest bus index.
     */
    public List<Set<Integer>> getConnectedComponents() {
        List<TreeSet<Integer>> components = new ArrayList<>();
        for (Set<Integer> component : getConnectivityInspector().connectedSets()) {
            components.add(new TreeSet<>(component));
        }
        components.sort((c1, c2) -> Integer.compare(c1.first(), c2.first()));
        return new ArrayList<>(components);
    }
}
