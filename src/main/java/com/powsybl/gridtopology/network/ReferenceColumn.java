/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridtopology.network;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A column of an element table holding indices of another element table.
 * <p>
 * When {@code tagColumn} is null the column always references buses. Otherwise the referenced table is given, row by
 * row, by the tag held in {@code tagColumn} ({@code switch.et}, {@code measurement.element_type}, {@code
 * poly_cost.et}...).
 *
 * @param owner element type owning the column
 * @param column name of the column holding the referenced index
 * @param tagColumn name of the column holding the referenced element type, or null for bus columns
 *
 * @author powsybl-grid-topology contributors
 */
public record ReferenceColumn(ElementType owner, String column, String tagColumn) {

    private static final List<ReferenceColumn> ALL;

    static {
        List<ReferenceColumn> all = new ArrayList<>();
        for (ElementType type : ElementType.values()) {
            for (String busColumn : type.getBusColumns()) {
                all.add(new ReferenceColumn(type, busColumn, null));
            }
        }
        all.add(new ReferenceColumn(ElementType.SWITCH, Columns.ELEMENT, Columns.ET));
        all.add(new ReferenceColumn(ElementType.MEASUREMENT, Columns.ELEMENT, Columns.ELEMENT_TYPE));
        all.add(new ReferenceColumn(ElementType.POLY_COST, Columns.ELEMENT, Columns.ET));
        all.add(new ReferenceColumn(ElementType.PWL_COST, Columns.ELEMENT, Columns.ET));
        ALL = Collections.unmodifiableList(all);
    }

    public ReferenceColumn {
        Objects.requireNonNull(owner);
        Objects.requireNonNull(column);
    }

    /**
     * Every reference column of the model, bus columns first.
     */
    public static List<ReferenceColumn> all() {
        return ALL;
    }

    public static List<ReferenceColumn> ownedBy(ElementType owner) {
        return ALL.stream().filter(c -> c.owner == owner).toList();
    }

    public boolean isTagged() {
        return tagColumn != null;
    }

    /**
     * @return the element type referenced by the given row, or null if the row tag is not set
     */
    public ElementType getTarget(ElementTable table, int index) {
        if (tagColumn == null) {
            return ElementType.BUS;
        }
        if (!table.hasColumn(tagColumn)) {
            return null;
        }
        return toElementType(table.getValue(index, tagColumn));
    }

    /**
     * @return the referenced index of the given row, or null if not set
     */
    public Integer getReferencedIndex(ElementTable table, int index) {
        if (!table.hasColumn(column)) {
            return null;
        }
        return table.getInteger(index, column);
    }

    /**
     * Decode an element type tag, either an {@link ElementType}, a {@link SwitchElementType} or their string code.
     */
    public static ElementType toElementType(Object tag) {
        if (tag == null) {
            return null;
        }
        if (tag instanceof ElementType elementType) {
            return elementType;
        }
        if (tag instanceof SwitchElementType switchElementType) {
            return switchElementType.getElementType();
        }
        String code = tag.toString();
        for (SwitchElementType type : SwitchElementType.values()) {
            if (type.getCode().equals(code)) {
                return type.getElementType();
            }
        }
        return ElementType.fromTableName(code);
    }

    @Override
    public String toString() {
        return owner + "." + column;
    }
}
