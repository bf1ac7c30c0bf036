/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridtopology.modification;

import com.powsybl.gridtopology.network.*;
import com.powsybl.gridtopology.validation.ComparisonParameters;
import com.powsybl.gridtopology.validation.ElementLinksValidator;
import com.powsybl.gridtopology.validation.NetworkComparator;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.powsybl.gridtopology.network.AbstractNetworkFactory.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * @author powsybl-grid-topology contributors
 */
class ElementTypeReplacerTest {

    private static final double EPSILON = 1e-12;

    private static final String SCALING = "scaling";

    private static final String SN_MVA = "sn_mva";

    private static final String UUID = "uuid";

    private static final List<String> NAMES = List.of("load 1", "load 2");

    private static final List<String> TYPES = List.of("house", "commercial");

    private static Network createLoadNetwork() {
        Network network = new Network();
        for (int i = 0; i < 3; i++) {
            createBus(network, 20);
        }
        createExtGrid(network, 0);
        createLine(network, 0, 1, 0.6);
        createLine(network, 0, 2, 0.6);
        ElementTable loads = network.getTable(ElementType.LOAD);
        List<Double> scalings = List.of(0.8, 1.0);
        for (int i = 0; i < 2; i++) {
            loads.newRow()
                    .setValue(Columns.NAME, NAMES.get(i))
                    .setValue(Columns.BUS, i + 1)
                    .setValue(Columns.P_MW, 0.8)
                    .setValue(Columns.Q_MVAR, 0.1)
                    .setValue(SN_MVA, 1.0)
                    .setValue(Columns.MIN_P_MW, 0.5)
                    .setValue(Columns.MAX_P_MW, 1.0)
                    .setValue(Columns.CONTROLLABLE, true)
                    .setValue(Columns.IN_SERVICE, true)
                    .setValue(SCALING, scalings.get(i))
                    .setValue(Columns.TYPE, TYPES.get(i))
                    .add();
            network.getResultTable(ElementType.LOAD).putRow(i, Map.of(Columns.P_MW, 0.64, Columns.Q_MVAR, 0.08));
        }
        createPolyCost(network, ElementType.LOAD, 0);
        createPolyCost(network, ElementType.LOAD, 1);
        createMeasurement(network, ElementType.LOAD, 1, "p", 0.64);
        return network;
    }

    @Test
    void testReplaceLoadsBySgens() {
        Network network = createLoadNetwork();
        ElementReplacementParameters parameters = new ElementReplacementParameters()
                .setNewIndices(List.of(2, 7))
                .setColsToKeep(List.of(Columns.TYPE))
                .setAddColsToKeep(List.of(SCALING));

        Map<Integer, Integer> oldToNew = ElementTypeReplacer.replacePqElementType(network, ElementType.LOAD, ElementType.SGEN, parameters);

        assertEquals(Map.of(0, 2, 1, 7), oldToNew);
        assertTrue(network.getTable(ElementType.LOAD).isEmpty());
        assertTrue(network.getResultTable(ElementType.LOAD).isEmpty());
        ElementTable sgens = network.getTable(ElementType.SGEN);
        assertEquals(List.of(2, 7), sgens.getIndices());
        assertEquals(NAMES, sgens.getIndices().stream().map(sgen -> sgens.getString(sgen, Columns.NAME)).toList());
        assertEquals(TYPES, sgens.getIndices().stream().map(sgen -> sgens.getString(sgen, Columns.TYPE)).toList());
        assertEquals(0.8, sgens.getDouble(2, SCALING), EPSILON);
        assertTrue(sgens.getBoolean(7, Columns.CONTROLLABLE, false));
        // limits are not in the kept columns
        assertFalse(sgens.hasColumn(Columns.MIN_P_MW));
        assertFalse(sgens.hasColumn(SN_MVA));
        // producer signing system
        assertEquals(-0.8, sgens.getDouble(2, Columns.P_MW), EPSILON);
        assertEquals(-0.1, sgens.getDouble(7, Columns.Q_MVAR), EPSILON);
        assertEquals(-0.64, network.getResultTable(ElementType.SGEN).getDouble(7, Columns.P_MW), EPSILON);

        ElementTable costs = network.getTable(ElementType.POLY_COST);
        assertEquals(ElementType.SGEN, ReferenceColumn.toElementType(costs.getValue(0, Columns.ET)));
        assertEquals(2, costs.getInteger(0, Columns.ELEMENT));
        assertEquals(7, costs.getInteger(1, Columns.ELEMENT));
        ElementTable measurements = network.getTable(ElementType.MEASUREMENT);
        assertEquals(ElementType.SGEN, ReferenceColumn.toElementType(measurements.getValue(0, Columns.ELEMENT_TYPE)));
        assertEquals(7, measurements.getInteger(0, Columns.ELEMENT));
    }

    @Test
    void testReplacePqRoundTrip() {
        Network original = createLoadNetwork();
        Network network = original.copy();
        List<String> addColsToKeep = List.of(SCALING, Columns.TYPE, SN_MVA);

        ElementTypeReplacer.replacePqElementType(network, ElementType.LOAD, ElementType.SGEN,
                new ElementReplacementParameters().setOldIndices(List.of(1)).setAddColsToKeep(addColsToKeep));
        assertEquals(List.of(0), network.getTable(ElementType.LOAD).getIndices());
        ElementTable sgens = network.getTable(ElementType.SGEN);
        assertEquals(List.of(0), sgens.getIndices());
        // limits are negated and swapped
        assertEquals(-0.5, sgens.getDouble(0, Columns.MAX_P_MW), EPSILON);
        assertEquals(-1.0, sgens.getDouble(0, Columns.MIN_P_MW), EPSILON);
        assertEquals("commercial", sgens.getString(0, Columns.TYPE));

        ElementTypeReplacer.replacePqElementType(network, ElementType.SGEN, ElementType.STORAGE,
                new ElementReplacementParameters().setOldIndices(List.of(0)).setAddColsToKeep(addColsToKeep));
        assertTrue(network.getTable(ElementType.SGEN).isEmpty());
        ElementTable storages = network.getTable(ElementType.STORAGE);
        assertEquals(0.8, storages.getDouble(0, Columns.P_MW), EPSILON);
        assertEquals(0.5, storages.getDouble(0, Columns.MIN_P_MW), EPSILON);

        ElementTypeReplacer.replacePqElementType(network, ElementType.STORAGE, ElementType.LOAD,
                new ElementReplacementParameters().setAddColsToKeep(addColsToKeep));
        assertTrue(network.getTable(ElementType.STORAGE).isEmpty());
        assertEquals(List.of(0, 1), network.getTable(ElementType.LOAD).getIndices());

        assertTrue(NetworkComparator.netsEqual(original, network,
                new ComparisonParameters().setExcludedTypes(List.of(ElementType.SGEN, ElementType.STORAGE))));
    }

    @Test
    void testReplaceExtGridByGenAndBack() {
        Network network = ExampleSimpleNetworkFactory.create();
        network.getTable(ElementType.EXT_GRID).setValue(0, UUID, "test");
        ElementTable busResults = network.getResultTable(ElementType.BUS);
        for (int bus : network.getTable(ElementType.BUS).getIndices()) {
            busResults.putRow(bus, Map.of(Columns.VM_PU, 1.0 + bus / 100.0, Columns.VA_DEGREE, bus + 0.5));
        }
        network.getResultTable(ElementType.EXT_GRID).putRow(0, Map.of(Columns.P_MW, -5.0, Columns.Q_MVAR, 1.0));
        network.getResultTable(ElementType.GEN).putRow(0, Map.of(Columns.P_MW, 6.0, Columns.Q_MVAR, 0.5));

        ElementTypeReplacer.replaceExtGridByGen(network, new ElementReplacementParameters()
                .setNewIndices(List.of(4))
                .setAddColsToKeep(List.of(UUID)));

        assertTrue(network.getTable(ElementType.EXT_GRID).isEmpty());
        assertTrue(network.getResultTable(ElementType.EXT_GRID).isEmpty());
        ElementTable gens = network.getTable(ElementType.GEN);
        assertEquals(List.of(0, 4), gens.getIndices());
        assertEquals(1.03, gens.getDouble(0, Columns.VM_PU), EPSILON);
        assertEquals(1.02, gens.getDouble(4, Columns.VM_PU), EPSILON);
        assertEquals(-5.0, gens.getDouble(4, Columns.P_MW), EPSILON);
        assertEquals("test", gens.getString(4, UUID));
        assertEquals(Boolean.FALSE, gens.getValue(4, Columns.SLACK));
        ElementTable genResults = network.getResultTable(ElementType.GEN);
        assertEquals(List.of(0, 4), genResults.getIndices());
        assertEquals(1.0, genResults.getDouble(4, Columns.VM_PU), EPSILON);
        assertEquals(0.5, genResults.getDouble(4, Columns.VA_DEGREE), EPSILON);

        ElementTypeReplacer.replaceGenByExtGrid(network, new ElementReplacementParameters()
                .setOldIndices(List.of(0, 4))
                .setNewIndices(List.of(2, 3)));

        assertTrue(network.getTable(ElementType.GEN).isEmpty());
        assertTrue(network.getResultTable(ElementType.GEN).isEmpty());
        ElementTable extGrids = network.getTable(ElementType.EXT_GRID);
        assertEquals(List.of(2, 3), extGrids.getIndices());
        assertEquals(1.03, extGrids.getDouble(2, Columns.VM_PU), EPSILON);
        // no computed angle for the former generator
        assertEquals(0.0, extGrids.getDouble(2, Columns.VA_DEGREE), EPSILON);
        assertEquals(0.5, extGrids.getDouble(3, Columns.VA_DEGREE), EPSILON);
        ElementTable extGridResults = network.getResultTable(ElementType.EXT_GRID);
        assertEquals(List.of(2, 3), extGridResults.getIndices());
        assertEquals(6.0, extGridResults.getDouble(2, Columns.P_MW), EPSILON);
        assertFalse(extGridResults.getRow(3).containsKey(Columns.VM_PU));
    }

    @Test
    void testReplaceExtGridBySlackGen() {
        Network network = ExampleSimpleNetworkFactory.create();
        Map<Integer, Integer> oldToNew = ElementTypeReplacer.replaceExtGridByGen(network, new ElementReplacementParameters().setSlack(true));
        assertEquals(Map.of(0, 1), oldToNew);
        ElementTable gens = network.getTable(ElementType.GEN);
        assertEquals(Boolean.TRUE, gens.getValue(1, Columns.SLACK));
        // no result to take the active power from
        assertEquals(0.0, gens.getDouble(1, Columns.P_MW), EPSILON);
        assertEquals(0, gens.getInteger(1, Columns.BUS));
    }

    @Test
    void testReplaceGenBySgenAndBack() {
        Network network = ExampleSimpleNetworkFactory.create();
        network.getResultTable(ElementType.GEN).putRow(0, Map.of(Columns.P_MW, -6.0, Columns.Q_MVAR, 2.5,
                Columns.VM_PU, 1.03, Columns.VA_DEGREE, -1.0));

        Map<Integer, Integer> oldToNew = ElementTypeReplacer.replaceGenBySgen(network, new ElementReplacementParameters());

        assertEquals(Map.of(0, 1), oldToNew);
        ElementTable sgens = network.getTable(ElementType.SGEN);
        assertEquals(List.of(0, 1), sgens.getIndices());
        assertEquals(6.0, sgens.getDouble(1, Columns.P_MW), EPSILON);
        assertEquals(2.5, sgens.getDouble(1, Columns.Q_MVAR), EPSILON);
        assertEquals(5, sgens.getInteger(1, Columns.BUS));
        ElementTable sgenResults = network.getResultTable(ElementType.SGEN);
        assertEquals(List.of(1), sgenResults.getIndices());
        assertFalse(sgenResults.hasColumn(Columns.VM_PU));

        network.getResultTable(ElementType.BUS).putRow(5, Map.of(Columns.VM_PU, 1.025, Columns.VA_DEGREE, -1.0));
        ElementTypeReplacer.replaceSgenByGen(network, new ElementReplacementParameters().setOldIndices(List.of(1, 0)));

        assertTrue(network.getTable(ElementType.SGEN).isEmpty());
        ElementTable gens = network.getTable(ElementType.GEN);
        assertEquals(List.of(0, 1), gens.getIndices());
        // voltage computed at the bus, or 1 pu without result
        assertEquals(1.025, gens.getDouble(0, Columns.VM_PU), EPSILON);
        assertEquals(5, gens.getInteger(0, Columns.BUS));
        assertEquals(1.0, gens.getDouble(1, Columns.VM_PU), EPSILON);
        assertEquals(6, gens.getInteger(1, Columns.BUS));
        ElementTable genResults = network.getResultTable(ElementType.GEN);
        assertEquals(List.of(0), genResults.getIndices());
        assertEquals(1.025, genResults.getDouble(0, Columns.VM_PU), EPSILON);
    }

    @Test
    void testReplaceGenBySgenWithoutResults() {
        Network network = ExampleSimpleNetworkFactory.create();
        ElementTypeReplacer.replaceGenBySgen(network, new ElementReplacementParameters().setNewIndices(List.of(5)));
        assertEquals(0.0, network.getTable(ElementType.SGEN).getDouble(5, Columns.Q_MVAR), EPSILON);
    }

    @Test
    void testInvalidReplacements() {
        Network network = createLoadNetwork();
        ElementReplacementParameters defaults = new ElementReplacementParameters();

        assertThrows(IllegalArgumentException.class,
                () -> ElementTypeReplacer.replacePqElementType(network, ElementType.LOAD, ElementType.GEN, defaults));
        assertThrows(IllegalArgumentException.class,
                () -> ElementTypeReplacer.replacePqElementType(network, ElementType.LOAD, ElementType.LOAD, defaults));
        assertThrows(IllegalArgumentException.class,
                () -> ElementTypeReplacer.replacePqElementType(network, ElementType.LOAD, ElementType.SGEN,
                        new ElementReplacementParameters().setNewIndices(List.of(3))));
        assertThrows(IllegalArgumentException.class,
                () -> ElementTypeReplacer.replacePqElementType(network, ElementType.LOAD, ElementType.SGEN,
                        new ElementReplacementParameters().setOldIndices(List.of(0, 0))));
        assertThrows(StructuralException.class,
                () -> ElementTypeReplacer.replacePqElementType(network, ElementType.LOAD, ElementType.SGEN,
                        new ElementReplacementParameters().setOldIndices(List.of(5))));

        createSgen(network, 1, 1.0);
        Network copy = network.copy();
        IndexConflictException e = assertThrows(IndexConflictException.class,
                () -> ElementTypeReplacer.replacePqElementType(network, ElementType.LOAD, ElementType.SGEN,
                        new ElementReplacementParameters().setNewIndices(List.of(0, 4))));
        assertEquals(List.of(0), e.getConflictingIndices());
        e = assertThrows(IndexConflictException.class,
                () -> ElementTypeReplacer.replacePqElementType(network, ElementType.LOAD, ElementType.SGEN,
                        new ElementReplacementParameters().setNewIndices(List.of(4, 4))));
        assertEquals(List.of(4), e.getConflictingIndices());
        assertTrue(NetworkComparator.netsEqual(copy, network));
    }

    /**
     * A line without shunt admittance, a line with capacitance and a line gated by a switch, all at 20 kV.
     */
    private static Network createLineNetwork() {
        Network network = new Network();
        for (int i = 0; i < 4; i++) {
            createBus(network, 20);
        }
        createExtGrid(network, 0);
        createLineFromParameters(network, 0, 1, 2.0, 0.1, 0.2, 0.0, true);
        createLine(network, 1, 2, 1.0);
        createLineFromParameters(network, 1, 3, 1.0, 0.1, 0.2, 0.0, true);
        createSwitch(network, 3, 2, SwitchElementType.LINE);
        network.getResultTable(ElementType.LINE).putRow(0, Map.of(Columns.P_FROM_MW, 1.0, Columns.PL_MW, 0.01, "loading_percent", 50.0));
        createMeasurement(network, ElementType.LINE, 0, "p", 1.0);
        return network;
    }

    @Test
    void testReplaceLineByImpedance() {
        Network network = createLineNetwork();

        Map<Integer, Integer> oldToNew = ElementTypeReplacer.replaceLineByImpedance(network, new ElementReplacementParameters());

        // the line with capacitance and the gated line are kept
        assertEquals(Map.of(0, 0), oldToNew);
        assertEquals(List.of(1, 2), network.getTable(ElementType.LINE).getIndices());
        ElementTable impedances = network.getTable(ElementType.IMPEDANCE);
        assertEquals(List.of(0), impedances.getIndices());
        assertEquals(0, impedances.getInteger(0, Columns.FROM_BUS));
        assertEquals(1, impedances.getInteger(0, Columns.TO_BUS));
        assertEquals(5e-4, impedances.getDouble(0, Columns.RFT_PU), EPSILON);
        assertEquals(5e-4, impedances.getDouble(0, Columns.RTF_PU), EPSILON);
        assertEquals(1e-3, impedances.getDouble(0, Columns.XFT_PU), EPSILON);
        assertEquals(1e-3, impedances.getDouble(0, Columns.XTF_PU), EPSILON);
        assertEquals(1.0, impedances.getDouble(0, Columns.SN_MVA), EPSILON);
        assertFalse(impedances.hasColumn(Columns.C_NF_PER_KM));

        assertTrue(network.getResultTable(ElementType.LINE).isEmpty());
        ElementTable impedanceResults = network.getResultTable(ElementType.IMPEDANCE);
        assertEquals(Set.of(Columns.P_FROM_MW, Columns.PL_MW), impedanceResults.getRow(0).keySet());
        assertEquals(1.0, impedanceResults.getDouble(0, Columns.P_FROM_MW), EPSILON);

        ElementTable measurements = network.getTable(ElementType.MEASUREMENT);
        assertEquals(ElementType.IMPEDANCE, ReferenceColumn.toElementType(measurements.getValue(0, Columns.ELEMENT_TYPE)));
        assertEquals(0, measurements.getInteger(0, Columns.ELEMENT));
        assertTrue(ElementLinksValidator.falseElementLinksLoop(network).isEmpty());
    }

    @Test
    void testReplaceLineByImpedanceWithoutValidityCheck() {
        Network network = createLineNetwork();
        ElementReplacementParameters parameters = new ElementReplacementParameters()
                .setOnlyValidReplace(false)
                .setSnMva(10)
                .setOldIndices(List.of(1))
                .setNewIndices(List.of(5));

        // capacitance is lost
        assertEquals(Map.of(1, 5), ElementTypeReplacer.replaceLineByImpedance(network, parameters));
        ElementTable impedances = network.getTable(ElementType.IMPEDANCE);
        assertEquals(0.642 / 40, impedances.getDouble(5, Columns.RFT_PU), EPSILON);
        assertEquals(10.0, impedances.getDouble(5, Columns.SN_MVA), EPSILON);

        // a switch cannot be moved to an impedance
        Network copy = network.copy();
        StructuralException e = assertThrows(StructuralException.class, () -> ElementTypeReplacer.replaceLineByImpedance(network,
                new ElementReplacementParameters().setOnlyValidReplace(false).setOldIndices(List.of(0, 2))));
        assertEquals(ElementType.SWITCH, e.getElementType());
        assertEquals(List.of(0), e.getIndices());
        assertTrue(NetworkComparator.netsEqual(copy, network));
    }

    @Test
    void testReplaceImpedanceByLine() {
        Network network = new Network();
        createBus(network, 20);
        createBus(network, 20);
        createExtGrid(network, 0);
        int symmetric = createImpedance(network, 0, 1, 0.01, 0.02, 0.01, 0.02);
        int asymmetric = createImpedance(network, 0, 1, 0.01, 0.02, 0.03, 0.02);
        ElementTable impedances = network.getTable(ElementType.IMPEDANCE);
        impedances.setValue(symmetric, Columns.SN_MVA, 10.0);
        impedances.setValue(asymmetric, Columns.SN_MVA, 10.0);
        network.getResultTable(ElementType.IMPEDANCE).putRow(symmetric, Map.of(Columns.P_FROM_MW, 2.0));
        createMeasurement(network, ElementType.IMPEDANCE, asymmetric, "p", 1.0);

        Map<Integer, Integer> oldToNew = ElementTypeReplacer.replaceImpedanceByLine(network, new ElementReplacementParameters());

        assertEquals(Map.of(symmetric, 0), oldToNew);
        assertEquals(List.of(asymmetric), impedances.getIndices());
        ElementTable lines = network.getTable(ElementType.LINE);
        assertEquals(1.0, lines.getDouble(0, Columns.LENGTH_KM), EPSILON);
        // base impedance of 20 kV at 10 MVA
        assertEquals(0.4, lines.getDouble(0, Columns.R_OHM_PER_KM), EPSILON);
        assertEquals(0.8, lines.getDouble(0, Columns.X_OHM_PER_KM), EPSILON);
        assertEquals(0.0, lines.getDouble(0, Columns.C_NF_PER_KM), EPSILON);
        assertTrue(Double.isNaN(lines.getDouble(0, Columns.MAX_I_KA)));
        assertEquals(1, lines.getInteger(0, Columns.PARALLEL));
        assertEquals(2.0, network.getResultTable(ElementType.LINE).getDouble(0, Columns.P_FROM_MW), EPSILON);
        assertEquals(asymmetric, network.getTable(ElementType.MEASUREMENT).getInteger(0, Columns.ELEMENT));

        // and back with the same base power
        ElementTypeReplacer.replaceLineByImpedance(network, new ElementReplacementParameters().setSnMva(10));
        assertTrue(lines.isEmpty());
        assertEquals(0.01, impedances.getDouble(2, Columns.RFT_PU), EPSILON);
        assertEquals(0.02, impedances.getDouble(2, Columns.XTF_PU), EPSILON);
        assertTrue(ElementLinksValidator.falseElementLinksLoop(network).isEmpty());
    }

    private static Network createWardNetwork(ElementType type) {
        Network network = new Network();
        createBus(network, 20);
        createBus(network, 20);
        createExtGrid(network, 0);
        createLine(network, 0, 1, 1.0);
        ElementTable wards = network.getTable(type);
        wards.newRow()
                .setValue(Columns.NAME, "equivalent")
                .setValue(Columns.BUS, 1)
                .setValue(Columns.PS_MW, 1.0)
                .setValue(Columns.QS_MVAR, 0.5)
                .setValue(Columns.PZ_MW, 2.0)
                .setValue(Columns.QZ_MVAR, -1.0)
                .setValue(Columns.IN_SERVICE, true)
                .add();
        createMeasurement(network, type, 0, "p", 3.0);
        return network;
    }

    @Test
    void testReplaceWardByInternalElements() {
        Network network = createWardNetwork(ElementType.WARD);
        network.getResultTable(ElementType.WARD).putRow(0, Map.of(Columns.P_MW, 2.9, Columns.Q_MVAR, -0.4, Columns.VM_PU, 0.9));

        Map<ElementType, List<Integer>> created = ElementTypeReplacer.replaceWardByInternalElements(network);

        assertEquals(Map.of(ElementType.LOAD, List.of(0), ElementType.SHUNT, List.of(0)), created);
        assertTrue(network.getTable(ElementType.WARD).isEmpty());
        assertTrue(network.getResultTable(ElementType.WARD).isEmpty());
        ElementTable loads = network.getTable(ElementType.LOAD);
        assertEquals("equivalent", loads.getString(0, Columns.NAME));
        assertEquals(1, loads.getInteger(0, Columns.BUS));
        assertEquals(1.0, loads.getDouble(0, Columns.P_MW), EPSILON);
        assertEquals(0.5, loads.getDouble(0, Columns.Q_MVAR), EPSILON);
        ElementTable shunts = network.getTable(ElementType.SHUNT);
        assertEquals(2.0, shunts.getDouble(0, Columns.P_MW), EPSILON);
        assertEquals(-1.0, shunts.getDouble(0, Columns.Q_MVAR), EPSILON);
        assertEquals(20.0, shunts.getDouble(0, Columns.VN_KV), EPSILON);

        assertEquals(1.0, network.getResultTable(ElementType.LOAD).getDouble(0, Columns.P_MW), EPSILON);
        ElementTable shuntResults = network.getResultTable(ElementType.SHUNT);
        assertEquals(2.0 * 0.81, shuntResults.getDouble(0, Columns.P_MW), EPSILON);
        assertEquals(-0.81, shuntResults.getDouble(0, Columns.Q_MVAR), EPSILON);
        assertEquals(0.9, shuntResults.getDouble(0, Columns.VM_PU), EPSILON);

        ElementTable measurements = network.getTable(ElementType.MEASUREMENT);
        assertEquals(ElementType.LOAD, ReferenceColumn.toElementType(measurements.getValue(0, Columns.ELEMENT_TYPE)));
        assertEquals(0, measurements.getInteger(0, Columns.ELEMENT));
        assertTrue(ElementLinksValidator.falseElementLinksLoop(network).isEmpty());
    }

    @Test
    void testReplaceDisconnectedWard() {
        Network network = createWardNetwork(ElementType.WARD);
        network.getTable(ElementType.WARD).setValue(0, Columns.IN_SERVICE, false);
        network.getResultTable(ElementType.WARD).putRow(0, Map.of(Columns.P_MW, 0.0, Columns.VM_PU, 0.0));

        ElementTypeReplacer.replaceWardByInternalElements(network, List.of(0));

        assertFalse(network.getTable(ElementType.LOAD).isInService(0));
        assertFalse(network.getTable(ElementType.SHUNT).isInService(0));
        assertEquals(0.0, network.getResultTable(ElementType.LOAD).getDouble(0, Columns.P_MW), EPSILON);
        assertEquals(0.0, network.getResultTable(ElementType.SHUNT).getDouble(0, Columns.Q_MVAR), EPSILON);
        assertThrows(StructuralException.class, () -> ElementTypeReplacer.replaceWardByInternalElements(network, List.of(0)));
    }

    @Test
    void testReplaceXwardByInternalElements() {
        Network network = createWardNetwork(ElementType.XWARD);
        ElementTable xwards = network.getTable(ElementType.XWARD);
        xwards.setValue(0, Columns.R_OHM, 4.0);
        xwards.setValue(0, Columns.X_OHM, 40.0);
        xwards.setValue(0, Columns.VM_PU, 1.02);
        network.getResultTable(ElementType.XWARD).putRow(0, Map.of(Columns.VM_PU, 1.0, Columns.VM_INTERNAL_PU, 1.01));

        Map<ElementType, List<Integer>> created = ElementTypeReplacer.replaceXwardByInternalElements(network);

        assertEquals(Map.of(ElementType.BUS, List.of(2), ElementType.LOAD, List.of(0), ElementType.SHUNT, List.of(0),
                ElementType.GEN, List.of(0), ElementType.IMPEDANCE, List.of(0)), created);
        assertTrue(xwards.isEmpty());
        assertEquals(20.0, network.getTable(ElementType.BUS).getDouble(2, Columns.VN_KV), EPSILON);
        ElementTable gens = network.getTable(ElementType.GEN);
        assertEquals(2, gens.getInteger(0, Columns.BUS));
        assertEquals(0.0, gens.getDouble(0, Columns.P_MW), EPSILON);
        assertEquals(1.02, gens.getDouble(0, Columns.VM_PU), EPSILON);
        ElementTable impedances = network.getTable(ElementType.IMPEDANCE);
        assertEquals(1, impedances.getInteger(0, Columns.FROM_BUS));
        assertEquals(2, impedances.getInteger(0, Columns.TO_BUS));
        // base impedance of 20 kV at 1 MVA
        assertEquals(0.01, impedances.getDouble(0, Columns.RFT_PU), EPSILON);
        assertEquals(0.1, impedances.getDouble(0, Columns.XTF_PU), EPSILON);
        assertEquals(1.01, network.getResultTable(ElementType.BUS).getDouble(2, Columns.VM_PU), EPSILON);
        assertEquals(2.0, network.getResultTable(ElementType.SHUNT).getDouble(0, Columns.P_MW), EPSILON);
        assertEquals(ElementType.LOAD, ReferenceColumn.toElementType(network.getTable(ElementType.MEASUREMENT).getValue(0, Columns.ELEMENT_TYPE)));
        assertTrue(ElementLinksValidator.falseElementLinksLoop(network).isEmpty());

        assertThrows(IllegalArgumentException.class, () -> ElementTypeReplacer.replaceXwardByInternalElements(network, null, 0));
    }
}
