/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridtopology;

import com.google.common.jimfs.Configuration;
import com.google.common.jimfs.Jimfs;
import com.powsybl.commons.config.InMemoryPlatformConfig;
import com.powsybl.commons.config.MapModuleConfig;
import com.powsybl.gridtopology.modification.*;
import com.powsybl.gridtopology.validation.ComparisonParameters;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.FileSystem;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author powsybl-grid-topology contributors
 */
class GridTopologyParametersTest {

    private InMemoryPlatformConfig platformConfig;

    private FileSystem fileSystem;

    @BeforeEach
    public void setUp() {
        fileSystem = Jimfs.newFileSystem(Configuration.unix());
        platformConfig = new InMemoryPlatformConfig(fileSystem);
    }

    @AfterEach
    public void tearDown() throws IOException {
        fileSystem.close();
    }

    @Test
    void testDefaultValues() {
        GridTopologyParameters parameters = GridTopologyParameters.load(platformConfig);
        assertTrue(parameters.isRespectSwitches());
        assertFalse(parameters.isRespectInService());
        assertEquals(0.0, parameters.getComparisonTolerance());
        assertFalse(parameters.isValidateMerge());
        assertEquals(LimitMergePolicy.SUM_AVAILABLE, parameters.getLimitMergePolicy());
        assertEquals("REPLACEMENT", parameters.getReplacementSwitchNamePrefix());
    }

    @Test
    void testConfig() {
        MapModuleConfig moduleConfig = platformConfig.createModuleConfig(GridTopologyParameters.MODULE_NAME);
        moduleConfig.setStringProperty("respectSwitches", "false");
        moduleConfig.setStringProperty("respectInService", "true");
        moduleConfig.setStringProperty("comparisonTolerance", "1e-6");
        moduleConfig.setStringProperty("validateMerge", "true");
        moduleConfig.setStringProperty("limitMergePolicy", "DROP_IF_ANY_MISSING");
        moduleConfig.setStringProperty("replacementSwitchNamePrefix", "BYPASS");

        GridTopologyParameters parameters = GridTopologyParameters.load(platformConfig);

        assertFalse(parameters.isRespectSwitches());
        assertTrue(parameters.isRespectInService());
        assertEquals(1e-6, parameters.getComparisonTolerance());
        assertTrue(parameters.isValidateMerge());
        assertEquals(LimitMergePolicy.DROP_IF_ANY_MISSING, parameters.getLimitMergePolicy());
        assertEquals("BYPASS", parameters.getReplacementSwitchNamePrefix());

        assertEquals(1e-6, ComparisonParameters.load(parameters).getTolerance());
        assertTrue(MergeParameters.load(parameters).isValidate());
        assertEquals(LimitMergePolicy.DROP_IF_ANY_MISSING, GenerationPlantMergeParameters.load(parameters).getLimitMergePolicy());
        assertEquals("BYPASS", ZeroBranchReplacementParameters.load(parameters).getNamePrefix());
    }

    @Test
    void testInvalidConfig() {
        MapModuleConfig moduleConfig = platformConfig.createModuleConfig(GridTopologyParameters.MODULE_NAME);
        moduleConfig.setStringProperty("limitMergePolicy", "MAX");
        assertThrows(IllegalArgumentException.class, () -> GridTopologyParameters.load(platformConfig));

        moduleConfig.setStringProperty("limitMergePolicy", "SUM_AVAILABLE");
        moduleConfig.setStringProperty("comparisonTolerance", "-1");
        assertThrows(IllegalArgumentException.class, () -> GridTopologyParameters.load(platformConfig));
    }

    @Test
    void testLoadFromMap() {
        GridTopologyParameters parameters = GridTopologyParameters.load(Map.of(
                "respectInService", "true",
                "limitMergePolicy", "DROP_IF_ANY_MISSING"));
        assertTrue(parameters.isRespectSwitches());
        assertTrue(parameters.isRespectInService());
        assertEquals(LimitMergePolicy.DROP_IF_ANY_MISSING, parameters.getLimitMergePolicy());

        parameters.update(Map.of("respectSwitches", "false", "comparisonTolerance", "0.01"));
        assertFalse(parameters.isRespectSwitches());
        assertTrue(parameters.isRespectInService());
        assertEquals(0.01, parameters.getComparisonTolerance());

        assertThrows(IllegalArgumentException.class, () -> GridTopologyParameters.load(Map.of("limitMergePolicy", "MAX")));
        assertEquals(6, GridTopologyParameters.SPECIFIC_PARAMETERS_NAMES.size());
    }

    @Test
    void testSetters() {
        GridTopologyParameters parameters = new GridTopologyParameters();
        assertThrows(IllegalArgumentException.class, () -> parameters.setComparisonTolerance(-1));
        assertThrows(IllegalArgumentException.class, () -> parameters.setComparisonTolerance(Double.NaN));
        assertThrows(NullPointerException.class, () -> parameters.setLimitMergePolicy(null));
    }

    @Test
    void testToString() {
        GridTopologyParameters parameters = new GridTopologyParameters().setValidateMerge(true);
        assertEquals("GridTopologyParameters(respectSwitches=true, respectInService=false, comparisonTolerance=0.0, " +
                "validateMerge=true, limitMergePolicy=SUM_AVAILABLE, replacementSwitchNamePrefix=REPLACEMENT)", parameters.toString());
    }
}
