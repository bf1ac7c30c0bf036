/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridtopology.network;

import java.util.*;

/**
 * The element types of a network, each one backed by a table.
 * <p>
 * An element type knows which of its columns are bus references (in terminal order) and whether the power flow
 * produces a result table {@code res_<type>} for it.
 *
 * @author powsybl-grid-topology contributors
 */
public enum ElementType {
    BUS("bus", Category.BUS, List.of(), true),
    LINE("line", Category.BRANCH, List.of(Columns.FROM_BUS, Columns.TO_BUS), true),
    TRAFO("trafo", Category.BRANCH, List.of(Columns.HV_BUS, Columns.LV_BUS), true),
    TRAFO3W("trafo3w", Category.BRANCH, List.of(Columns.HV_BUS, Columns.MV_BUS, Columns.LV_BUS), true),
    IMPEDANCE("impedance", Category.BRANCH, List.of(Columns.FROM_BUS, Columns.TO_BUS), true),
    DCLINE("dcline", Category.BRANCH, List.of(Columns.FROM_BUS, Columns.TO_BUS), true),
    SWITCH("switch", Category.SWITCH, List.of(Columns.BUS), true),
    LOAD("load", Category.BUS_ELEMENT, List.of(Columns.BUS), true),
    SGEN("sgen", Category.BUS_ELEMENT, List.of(Columns.BUS), true),
    GEN("gen", Category.BUS_ELEMENT, List.of(Columns.BUS), true),
    EXT_GRID("ext_grid", Category.BUS_ELEMENT, List.of(Columns.BUS), true),
    STORAGE("storage", Category.BUS_ELEMENT, List.of(Columns.BUS), true),
    SHUNT("shunt", Category.BUS_ELEMENT, List.of(Columns.BUS), true),
    WARD("ward", Category.BUS_ELEMENT, List.of(Columns.BUS), true),
    XWARD("xward", Category.BUS_ELEMENT, List.of(Columns.BUS), true),
    MOTOR("motor", Category.BUS_ELEMENT, List.of(Columns.BUS), true),
    ASYMMETRIC_LOAD("asymmetric_load", Category.BUS_ELEMENT, List.of(Columns.BUS), true),
    ASYMMETRIC_SGEN("asymmetric_sgen", Category.BUS_ELEMENT, List.of(Columns.BUS), true),
    MEASUREMENT("measurement", Category.AUXILIARY, List.of(), false),
    POLY_COST("poly_cost", Category.AUXILIARY, List.of(), false),
    PWL_COST("pwl_cost", Category.AUXILIARY, List.of(), false),
    GROUP("group", Category.AUXILIARY, List.of(), false),
    CONTROLLER("controller", Category.AUXILIARY, List.of(), false);

    public enum Category {
        BUS,
        BRANCH,
        SWITCH,
        BUS_ELEMENT,
        AUXILIARY
    }

    private static final String RESULT_PREFIX = "res_";

    private static final Map<String, ElementType> BY_TABLE_NAME = new HashMap<>();

    static {
        for (ElementType type : values()) {
            BY_TABLE_NAME.put(type.tableName, type);
        }
    }

    private final String tableName;

    private final Category category;

    private final List<String> busColumns;

    private final boolean withResults;

    ElementType(String tableName, Category category, List<String> busColumns, boolean withResults) {
        this.tableName = tableName;
        this.category = category;
        this.busColumns = busColumns;
        this.withResults = withResults;
    }

    public String getTableName() {
        return tableName;
    }

    public String getResultTableName() {
        if (!withResults) {
            throw new IllegalStateException("Element type '" + tableName + "' has no result table");
        }
        return RESULT_PREFIX + tableName;
    }

    public Category getCategory() {
        return category;
    }

    /**
     * Bus reference columns, in terminal order (from/to, hv/mv/lv).
     */
    public List<String> getBusColumns() {
        return busColumns;
    }

    public boolean hasBusColumns() {
        return !busColumns.isEmpty();
    }

    public boolean hasResults() {
        return withResults;
    }

    public boolean isBranch() {
        return category == Category.BRANCH;
    }

    public boolean isBusElement() {
        return category == Category.BUS_ELEMENT;
    }

    /**
     * Sign of the active power of the element in the load (consumer) convention: 1 for consumers, -1 for producers.
     */
    public int getSigningSystemValue() {
        return switch (this) {
            case LOAD, STORAGE, SHUNT, WARD, XWARD, MOTOR, ASYMMETRIC_LOAD -> 1;
            case SGEN, GEN, EXT_GRID, ASYMMETRIC_SGEN -> -1;
            default -> throw new IllegalArgumentException("Element type '" + tableName + "' has no signing system");
        };
    }

    public static ElementType fromTableName(String tableName) {
        Objects.requireNonNull(tableName);
        ElementType type = BY_TABLE_NAME.get(tableName);
        if (type == null) {
            throw new IllegalArgumentException("Unknown element type '" + tableName + "'");
        }
        return type;
    }

    public static Set<ElementType> branchTypes() {
        return EnumSet.of(LINE, TRAFO, TRAFO3W, IMPEDANCE, DCLINE);
    }

    /**
     * Plant types of the generation side, in merge priority order.
     */
    public static List<ElementType> generationTypes() {
        return List.of(EXT_GRID, GEN, SGEN);
    }

    @Override
    public String toString() {
        return tableName;
    }
}
