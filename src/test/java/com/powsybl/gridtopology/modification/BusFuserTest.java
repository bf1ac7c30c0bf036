/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridtopology.modification;

import com.powsybl.gridtopology.network.*;
import com.powsybl.gridtopology.validation.ElementLinksValidator;
import com.powsybl.gridtopology.validation.NetworkComparator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.powsybl.gridtopology.network.AbstractNetworkFactory.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * @author powsybl-grid-topology contributors
 */
class BusFuserTest {

    private Network network;

    private int b1;

    private int b2;

    private int b3;

    private int line1;

    private int line2;

    @BeforeEach
    void setUp() {
        network = new Network();
        b1 = createBus(network, 1);
        b2 = createBus(network, 1.5);
        b3 = createBus(network, 2);
        line1 = createLine(network, b2, b1, 1);
        line2 = createLine(network, b2, b3, 1);
        createSwitch(network, b2, line1, SwitchElementType.LINE);
        createSwitch(network, b1, b2, SwitchElementType.BUS);
        createLoad(network, b1, 0.006);
        createLoad(network, b2, 0.005);
        createLoad(network, b3, 0.005);
        createMeasurement(network, ElementType.BUS, b2, "v", 1.2);
    }

    private List<Integer> getLoadBuses() {
        ElementTable loads = network.getTable(ElementType.LOAD);
        return loads.getIndices().stream().map(load -> loads.getInteger(load, Columns.BUS)).toList();
    }

    @Test
    void testFuseAndDrop() {
        BusFuser.fuseBuses(network, b1, b2, true);

        assertFalse(network.getTable(ElementType.LINE).contains(line1));
        assertTrue(network.getTable(ElementType.LINE).contains(line2));
        assertEquals(b1, network.getTable(ElementType.LINE).getInteger(line2, Columns.FROM_BUS));
        assertTrue(network.getTable(ElementType.SWITCH).isEmpty());
        assertEquals(List.of(b1, b1, b3), getLoadBuses());
        assertEquals(b1, network.getTable(ElementType.MEASUREMENT).getInteger(0, Columns.ELEMENT));
        assertEquals(List.of(b1, b3), network.getTable(ElementType.BUS).getIndices());
        assertTrue(ElementLinksValidator.falseElementLinksLoop(network).isEmpty());
    }

    @Test
    void testFuseWithoutDrop() {
        BusFuser.fuseBuses(network, b1, b2, false);

        ElementTable lines = network.getTable(ElementType.LINE);
        assertEquals(b1, lines.getInteger(line1, Columns.FROM_BUS));
        assertEquals(b1, lines.getInteger(line2, Columns.FROM_BUS));
        ElementTable switches = network.getTable(ElementType.SWITCH);
        assertEquals(List.of(0), switches.getIndices());
        assertEquals(b1, switches.getInteger(0, Columns.BUS));
        assertEquals(List.of(b1, b1, b3), getLoadBuses());
        assertEquals(b1, network.getTable(ElementType.MEASUREMENT).getInteger(0, Columns.ELEMENT));
        assertEquals(List.of(b1, b2, b3), network.getTable(ElementType.BUS).getIndices());
    }

    @Test
    void testSuccessiveFusions() {
        Network successive = ExampleSimpleNetworkFactory.create();
        BusFuser.fuseBuses(successive, 1, 2, true);
        BusFuser.fuseBuses(successive, 0, 1, true);

        Network atOnce = ExampleSimpleNetworkFactory.create();
        BusFuser.fuseBuses(atOnce, 0, List.of(1, 2), true);

        assertTrue(NetworkComparator.netsEqual(successive, atOnce));
        assertTrue(ElementLinksValidator.falseElementLinksLoop(atOnce).isEmpty());
        assertEquals(List.of(0, 3, 4, 5, 6), atOnce.getTable(ElementType.BUS).getIndices());
        assertEquals(List.of(1, 2, 3), atOnce.getTable(ElementType.LINE).getIndices());
        assertEquals(0, atOnce.getTable(ElementType.TRAFO).getInteger(0, Columns.HV_BUS));
        assertEquals(0, atOnce.getTable(ElementType.SHUNT).getInteger(0, Columns.BUS));
        assertFalse(atOnce.getTable(ElementType.SWITCH).contains(0));
    }

    @Test
    void testKeptBusAmongMergedBuses() {
        BusFuser.fuseBuses(network, b1, List.of(b1, b2), true);
        assertEquals(List.of(b1, b3), network.getTable(ElementType.BUS).getIndices());

        Network copy = network.copy();
        BusFuser.fuseBuses(network, b1, List.of(b1), true);
        assertTrue(NetworkComparator.netsEqual(copy, network));
    }

    @Test
    void testMissingBus() {
        Network copy = network.copy();
        StructuralException e = assertThrows(StructuralException.class, () -> BusFuser.fuseBuses(network, b1, 42, true));
        assertEquals(List.of(42), e.getIndices());
        assertTrue(NetworkComparator.netsEqual(copy, network));
    }
}
