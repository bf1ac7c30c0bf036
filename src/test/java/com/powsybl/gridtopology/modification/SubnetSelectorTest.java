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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.powsybl.gridtopology.network.AbstractNetworkFactory.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * @author powsybl-grid-topology contributors
 */
class SubnetSelectorTest {

    private Network network;

    @BeforeEach
    void setUp() {
        network = ExampleSimpleNetworkFactory.create();
        ElementTable busResults = network.getResultTable(ElementType.BUS);
        for (int bus : network.getTable(ElementType.BUS).getIndices()) {
            busResults.putRow(bus, Map.of(Columns.VM_PU, 1.0, Columns.VA_DEGREE, -bus * 0.5));
        }
    }

    @Test
    void testAllBuses() {
        Network subnet = SubnetSelector.selectSubnet(network, network.getTable(ElementType.BUS).getIndices(),
                new SelectSubnetParameters().setIncludeResults(true).setKeepEverythingElse(true));
        assertTrue(NetworkComparator.netsEqual(network, subnet, new ComparisonParameters().setCheckResults(true)));
    }

    @Test
    void testResultsExcludedByDefault() {
        Network subnet = SubnetSelector.selectSubnet(network, network.getTable(ElementType.BUS).getIndices());
        assertFalse(subnet.hasResults());
        assertTrue(NetworkComparator.netsEqual(network, subnet, new ComparisonParameters().setCheckResults(false)));
    }

    @Test
    void testNoBus() {
        Network subnet = SubnetSelector.selectSubnet(network, List.of());
        assertTrue(subnet.getNonEmptyElementTypes().isEmpty());
        assertTrue(network.getTable(ElementType.LINE).size() > 0);
    }

    @Test
    void testSelection() {
        createMeasurement(network, ElementType.LINE, 0, "i", 0.2);
        createMeasurement(network, ElementType.LINE, 1, "i", 0.3);
        createPolyCost(network, ElementType.GEN, 0);
        createPolyCost(network, ElementType.EXT_GRID, 0);

        Network subnet = SubnetSelector.selectSubnet(network, List.of(4, 5, 6));

        assertEquals(List.of(4, 5, 6), subnet.getTable(ElementType.BUS).getIndices());
        assertEquals(List.of(1, 2, 3), subnet.getTable(ElementType.LINE).getIndices());
        // switch 1 links bus 3 which is not selected
        assertEquals(List.of(2, 3, 4, 5, 6, 7), subnet.getTable(ElementType.SWITCH).getIndices());
        assertEquals(List.of(0), subnet.getTable(ElementType.LOAD).getIndices());
        assertEquals(List.of(0), subnet.getTable(ElementType.SGEN).getIndices());
        assertEquals(List.of(0), subnet.getTable(ElementType.GEN).getIndices());
        assertTrue(subnet.getTable(ElementType.TRAFO).isEmpty());
        assertTrue(subnet.getTable(ElementType.EXT_GRID).isEmpty());
        assertTrue(subnet.getTable(ElementType.SHUNT).isEmpty());
        assertEquals(List.of(1), subnet.getTable(ElementType.MEASUREMENT).getIndices());
        assertEquals(List.of(0), subnet.getTable(ElementType.POLY_COST).getIndices());
        assertFalse(subnet.getTable(ElementType.SWITCH).getBoolean(5, Columns.CLOSED, true));
        assertTrue(ElementLinksValidator.falseElementLinksLoop(subnet).isEmpty());

        // source network untouched
        assertEquals(7, network.getTable(ElementType.BUS).size());
        assertEquals(8, network.getTable(ElementType.SWITCH).size());
    }

    @Test
    void testTrafoAndBusBusSwitches() {
        Network subnet = SubnetSelector.selectSubnet(network, List.of(1, 2, 3));
        assertEquals(List.of(0), subnet.getTable(ElementType.TRAFO).getIndices());
        assertEquals(List.of(0), subnet.getTable(ElementType.SWITCH).getIndices());
        assertEquals(List.of(0), subnet.getTable(ElementType.SHUNT).getIndices());
        assertTrue(subnet.getTable(ElementType.LINE).isEmpty());
    }

    @Test
    void testIncludeSwitchBuses() {
        assertEquals(Set.of(4, 5, 6), SubnetSelector.widenBySwitchBuses(network, List.of(5)));

        Network subnet = SubnetSelector.selectSubnet(network, List.of(5),
                new SelectSubnetParameters().setIncludeSwitchBuses(true));
        assertEquals(List.of(4, 5, 6), subnet.getTable(ElementType.BUS).getIndices());
        assertEquals(List.of(1, 2, 3), subnet.getTable(ElementType.LINE).getIndices());

        Network narrow = SubnetSelector.selectSubnet(network, List.of(5));
        assertEquals(List.of(5), narrow.getTable(ElementType.BUS).getIndices());
        assertTrue(narrow.getTable(ElementType.LINE).isEmpty());
        assertTrue(narrow.getTable(ElementType.SWITCH).isEmpty());
        assertEquals(List.of(0), narrow.getTable(ElementType.GEN).getIndices());
    }

    @Test
    void testGroups() {
        createGroup(network, "kept", GroupMembers.of(Map.of(ElementType.LOAD, List.of(0), ElementType.LINE, List.of(0, 1))));
        createGroup(network, "dropped", GroupMembers.of(ElementType.LINE, List.of(0)));

        Network subnet = SubnetSelector.selectSubnet(network, List.of(4, 5, 6));

        ElementTable groups = subnet.getTable(ElementType.GROUP);
        assertEquals(List.of(0), groups.getIndices());
        assertEquals(GroupMembers.of(Map.of(ElementType.LOAD, List.of(0), ElementType.LINE, List.of(1))),
                References.getMembers(groups, 0));
        // source group untouched
        assertEquals(List.of(0, 1), References.getMembers(network.getTable(ElementType.GROUP), 0).getIndices(ElementType.LINE));
    }

    @Test
    void testMissingBus() {
        StructuralException e = assertThrows(StructuralException.class, () -> SubnetSelector.selectSubnet(network, List.of(4, 42)));
        assertEquals(List.of(42), e.getIndices());
    }

    @Test
    void testControllers() {
        createTapChangerController(network, 0);
        SelectSubnetParameters parameters = new SelectSubnetParameters().setKeepEverythingElse(true);

        Network withTrafo = SubnetSelector.selectSubnet(network, List.of(1, 2, 3), parameters);
        assertEquals(List.of(0), withTrafo.getTable(ElementType.CONTROLLER).getIndices());
        assertTrue(ElementLinksValidator.falseElementLinksLoop(withTrafo).isEmpty());

        // the controller of a trafo left out is left out too
        Network withoutTrafo = SubnetSelector.selectSubnet(network, List.of(4, 5, 6), parameters);
        assertTrue(withoutTrafo.getTable(ElementType.CONTROLLER).isEmpty());
        assertTrue(ElementLinksValidator.falseElementLinksLoop(withoutTrafo).isEmpty());
    }
}
