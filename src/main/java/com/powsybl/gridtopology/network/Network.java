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
 * An electrical network as a set of element tables, one per {@link ElementType}, plus one result table per element
 * type having results.
 * <p>
 * Every table always exists, possibly empty. Result tables share the index space of their element table.
 *
 * @author powsybl-grid-topology contributors
 */
public class Network {

    public static final String DEFAULT_NAME = "";

    private String name;

    private final EnumMap<ElementType, ElementTable> tables = new EnumMap<>(ElementType.class);

    private final EnumMap<ElementType, ElementTable> resultTables = new EnumMap<>(ElementType.class);

    public Network() {
        this(DEFAULT_NAME);
    }

    public Network(String name) {
        this.name = Objects.requireNonNull(name);
        for (ElementType type : ElementType.values()) {
            tables.put(type, new ElementTable(type));
            if (type.hasResults()) {
                resultTables.put(type, new ElementTable(type, true));
            }
        }
    }

    public String getName() {
        return name;
    }

    public Network setName(String name) {
        this.name = Objects.requireNonNull(name);
        return this;
    }

    public ElementTable getTable(ElementType type) {
        return tables.get(Objects.requireNonNull(type));
    }

    /**
     * @return the result table of the given type, or an empty optional for types without results
     */
    public Optional<ElementTable> getOptionalResultTable(ElementType type) {
        return Optional.ofNullable(resultTables.get(Objects.requireNonNull(type)));
    }

    public ElementTable getResultTable(ElementType type) {
        return getOptionalResultTable(type)
                .orElseThrow(() -> new StructuralException(type, List.of(), "Element type '" + type + "' has no result table"));
    }

    /**
     * Look up a table by its name, {@code res_<type>} names designating result tables.
     */
    public ElementTable getTable(String tableName) {
        Objects.requireNonNull(tableName);
        if (tableName.startsWith("res_")) {
            return getResultTable(ElementType.fromTableName(tableName.substring(4)));
        }
        return getTable(ElementType.fromTableName(tableName));
    }

    public Collection<ElementTable> getTables() {
        return Collections.unmodifiableCollection(tables.values());
    }

    public Collection<ElementTable> getResultTables() {
        return Collections.unmodifiableCollection(resultTables.values());
    }

    public boolean hasResults() {
        return resultTables.values().stream().anyMatch(t -> !t.isEmpty());
    }

    /**
     * Element types having at least one row.
     */
    public Set<ElementType> getNonEmptyElementTypes() {
        EnumSet<ElementType> types = EnumSet.noneOf(ElementType.class);
        tables.forEach((type, table) -> {
            if (!table.isEmpty()) {
                types.add(type);
            }
        });
        return types;
    }

    /**
     * Remove the given rows from an element table and, in lockstep, from its result table. No reference is updated.
     */
    public void removeRows(ElementType type, Collection<Integer> indices) {
        getTable(type).removeRows(indices);
        getOptionalResultTable(type).ifPresent(t -> t.removeRows(indices));
    }

    public void clearResults() {
        resultTables.values().forEach(ElementTable::clear);
    }

    public Network copy() {
        Network copy = new Network(name);
        tables.forEach((type, table) -> copy.tables.put(type, table.copy()));
        resultTables.forEach((type, table) -> copy.resultTables.put(type, table.copy()));
        return copy;
    }

    public Network copyWithoutResults() {
        Network copy = new Network(name);
        tables.forEach((type, table) -> copy.tables.put(type, table.copy()));
        resultTables.forEach((type, table) -> {
            ElementTable empty = table.select(List.of());
            copy.resultTables.put(type, empty);
        });
        return copy;
    }

    /**
     * Replace the element (or result) table of the table's element type.
     */
    public void setTable(ElementTable table) {
        Objects.requireNonNull(table);
        if (table.isResultTable()) {
            if (!table.getElementType().hasResults()) {
                throw new IllegalArgumentException("Element type '" + table.getElementType() + "' has no result table");
            }
            resultTables.put(table.getElementType(), table);
        } else {
            tables.put(table.getElementType(), table);
        }
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder("Network(").append(name).append(")");
        tables.forEach((type, table) -> {
            if (!table.isEmpty()) {
                builder.append(' ').append(type).append('=').append(table.size());
            }
        });
        return builder.toString();
    }
}
