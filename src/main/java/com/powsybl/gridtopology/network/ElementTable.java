/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridtopology.network;

import net.jafama.FastMath;

import java.util.*;

/**
 * Rows of one element type, keyed by a unique non-negative index.
 * <p>
 * Rows keep their insertion order, indices do not need to be sorted nor contiguous. Every row has a value (possibly
 * null) for every column of the table. Numeric reads of a null value return NaN.
 *
 * @author powsybl-grid-topology contributors
 */
public class ElementTable {

    private final ElementType elementType;

    private final boolean resultTable;

    private final LinkedHashSet<String> columns = new LinkedHashSet<>();

    private final LinkedHashMap<Integer, Map<String, Object>> rows = new LinkedHashMap<>();

    public ElementTable(ElementType elementType) {
        this(elementType, false);
    }

    public ElementTable(ElementType elementType, boolean resultTable) {
        this.elementType = Objects.requireNonNull(elementType);
        this.resultTable = resultTable;
    }

    public ElementType getElementType() {
        return elementType;
    }

    public boolean isResultTable() {
        return resultTable;
    }

    public String getName() {
        return resultTable ? elementType.getResultTableName() : elementType.getTableName();
    }

    public int size() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    /**
     * @return the row indices, in row order
     */
    public List<Integer> getIndices() {
        return new ArrayList<>(rows.keySet());
    }

    public boolean contains(int index) {
        return rows.containsKey(index);
    }

    public int getMaxIndex() {
        int max = -1;
        for (int index : rows.keySet()) {
            max = FastMath.max(max, index);
        }
        return max;
    }

    /**
     * First free index, above every existing one.
     */
    public int nextIndex() {
        return getMaxIndex() + 1;
    }

    public Set<String> getColumns() {
        return Collections.unmodifiableSet(columns);
    }

    public boolean hasColumn(String column) {
        return columns.contains(column);
    }

    public ElementTable addColumn(String column) {
        Objects.requireNonNull(column);
        if (columns.add(column)) {
            for (Map<String, Object> row : rows.values()) {
                row.put(column, null);
            }
        }
        return this;
    }

    public ElementTable removeColumn(String column) {
        if (columns.remove(column)) {
            for (Map<String, Object> row : rows.values()) {
                row.remove(column);
            }
        }
        return this;
    }

    private Map<String, Object> getRowValues(int index) {
        Map<String, Object> row = rows.get(index);
        if (row == null) {
            throw StructuralException.missingIndices(elementType, List.of(index));
        }
        return row;
    }

    /**
     * @return an unmodifiable view of the row
     */
    public Map<String, Object> getRow(int index) {
        return Collections.unmodifiableMap(getRowValues(index));
    }

    public Object getValue(int index, String column) {
        return getRowValues(index).get(column);
    }

    public <T> T getValue(int index, String column, Class<T> clazz) {
        return clazz.cast(getValue(index, column));
    }

    /**
     * @return the value as an integer, or null if not set
     */
    public Integer getInteger(int index, String column) {
        Object value = getValue(index, column);
        return value == null ? null : ((Number) value).intValue();
    }

    public double getDouble(int index, String column) {
        Object value = getValue(index, column);
        return value == null ? Double.NaN : ((Number) value).doubleValue();
    }

    public boolean getBoolean(int index, String column, boolean defaultValue) {
        Object value = getValue(index, column);
        return value == null ? defaultValue : (Boolean) value;
    }

    public String getString(int index, String column) {
        Object value = getValue(index, column);
        return value == null ? null : value.toString();
    }

    /**
     * An element without {@code in_service} column, or with an unset flag, is in service.
     */
    public boolean isInService(int index) {
        return getBoolean(index, Columns.IN_SERVICE, true);
    }

    public ElementTable setValue(int index, String column, Object value) {
        Map<String, Object> row = getRowValues(index);
        addColumn(column);
        row.put(column, value);
        return this;
    }

    /**
     * Add a row (or replace an existing one) at the given index, creating missing columns.
     */
    public ElementTable putRow(int index, Map<String, Object> values) {
        checkIndex(index);
        for (String column : values.keySet()) {
            addColumn(column);
        }
        Map<String, Object> row = new LinkedHashMap<>();
        for (String column : columns) {
            row.put(column, copyValue(values.get(column)));
        }
        rows.put(index, row);
        return this;
    }

    public ElementTable removeRows(Collection<Integer> indices) {
        for (int index : indices) {
            rows.remove(index);
        }
        return this;
    }

    public ElementTable removeRow(int index) {
        return removeRows(List.of(index));
    }

    public ElementTable clear() {
        rows.clear();
        return this;
    }

    /**
     * Renumber the rows, keeping their order. Indices missing from the mapping keep their value. The caller is
     * responsible for the mapping to be injective over the table.
     */
    public ElementTable reindex(Map<Integer, Integer> oldToNew) {
        LinkedHashMap<Integer, Map<String, Object>> renumbered = new LinkedHashMap<>();
        for (Map.Entry<Integer, Map<String, Object>> e : rows.entrySet()) {
            renumbered.put(oldToNew.getOrDefault(e.getKey(), e.getKey()), e.getValue());
        }
        rows.clear();
        rows.putAll(renumbered);
        return this;
    }

    /**
     * @return a deep copy restricted to the given indices, in table row order
     */
    public ElementTable select(Collection<Integer> indices) {
        Set<Integer> selected = new HashSet<>(indices);
        ElementTable copy = new ElementTable(elementType, resultTable);
        copy.columns.addAll(columns);
        for (Map.Entry<Integer, Map<String, Object>> e : rows.entrySet()) {
            if (selected.contains(e.getKey())) {
                copy.rows.put(e.getKey(), copyRow(e.getValue()));
            }
        }
        return copy;
    }

    public ElementTable copy() {
        return select(rows.keySet());
    }

    /**
     * Append the rows of another table of the same type, indices must not overlap.
     */
    public ElementTable append(ElementTable other) {
        Objects.requireNonNull(other);
        if (other.elementType != elementType) {
            throw new IllegalArgumentException("Cannot append table '" + other.getName() + "' to table '" + getName() + "'");
        }
        List<Integer> overlapping = other.rows.keySet().stream().filter(rows::containsKey).toList();
        if (!overlapping.isEmpty()) {
            throw new IndexConflictException(elementType, overlapping);
        }
        for (Map.Entry<Integer, Map<String, Object>> e : other.rows.entrySet()) {
            putRow(e.getKey(), e.getValue());
        }
        for (String column : other.columns) {
            addColumn(column);
        }
        return this;
    }

    public RowAdder newRow() {
        return new RowAdder();
    }

    private void checkIndex(int index) {
        if (index < 0) {
            throw new IllegalArgumentException("Negative index " + index + " in table '" + getName() + "'");
        }
    }

    private static Map<String, Object> copyRow(Map<String, Object> row) {
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<String, Object> e : row.entrySet()) {
            copy.put(e.getKey(), copyValue(e.getValue()));
        }
        return copy;
    }

    private static Object copyValue(Object value) {
        return value instanceof Controller controller ? controller.copy() : value;
    }

    @Override
    public String toString() {
        return getName() + "(" + rows.size() + " rows)";
    }

    /**
     * Fluent creation of a row.
     */
    public final class RowAdder {

        private Integer index;

        private final Map<String, Object> values = new LinkedHashMap<>();

        private RowAdder() {
        }

        public RowAdder setIndex(int index) {
            this.index = index;
            return this;
        }

        public RowAdder setValue(String column, Object value) {
            values.put(Objects.requireNonNull(column), value);
            return this;
        }

        /**
         * @return the index of the created row
         */
        public int add() {
            int newIndex = index != null ? index : nextIndex();
            if (rows.containsKey(newIndex)) {
                throw new IndexConflictException(elementType, List.of(newIndex));
            }
            putRow(newIndex, values);
            return newIndex;
        }
    }
}
