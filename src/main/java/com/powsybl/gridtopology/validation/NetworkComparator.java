/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridtopology.validation;

import com.powsybl.gridtopology.network.ElementTable;
import com.powsybl.gridtopology.network.ElementType;
import com.powsybl.gridtopology.network.Network;
import com.powsybl.gridtopology.network.SwitchElementType;
import net.jafama.FastMath;

import java.util.*;

/**
 * Deep comparison of two networks.
 * <p>
 * Tables are compared by index set (row order is ignored), then by column set, then value by value. Two empty tables
 * are equal whatever their columns. Null and NaN are equal to each other, numbers are compared within the tolerance,
 * element type tags are compared by code and any other value, controllers included, with {@link Object#equals}. The
 * comparison is symmetric.
 *
 * @author powsybl-grid-topology contributors
 */
public final class NetworkComparator {

    private NetworkComparator() {
    }

    public static boolean netsEqual(Network network1, Network network2, ComparisonParameters parameters) {
        return compare(network1, network2, parameters).isEmpty();
    }

    public static boolean netsEqual(Network network1, Network network2) {
        return netsEqual(network1, network2, new ComparisonParameters());
    }

    public static List<NetworkDifference> compare(Network network1, Network network2, ComparisonParameters parameters) {
        Objects.requireNonNull(network1);
        Objects.requireNonNull(network2);
        Objects.requireNonNull(parameters);
        List<NetworkDifference> differences = new ArrayList<>();
        for (ElementType type : ElementType.values()) {
            if (parameters.getExcludedTypes().contains(type)) {
                continue;
            }
            compareTables(network1.getTable(type), network2.getTable(type), parameters.getTolerance(), differences);
            if (parameters.isCheckResults() && type.hasResults()) {
                compareTables(network1.getResultTable(type), network2.getResultTable(type), parameters.getTolerance(), differences);
            }
        }
        return differences;
    }

    private static void compareTables(ElementTable table1, ElementTable table2, double tolerance, List<NetworkDifference> differences) {
        if (table1.isEmpty() && table2.isEmpty()) {
            return;
        }
        Set<Integer> indices1 = new TreeSet<>(table1.getIndices());
        Set<Integer> indices2 = new TreeSet<>(table2.getIndices());
        if (!indices1.equals(indices2)) {
            differences.add(new NetworkDifference(NetworkDifference.Type.INDEX_MISMATCH, table1.getName(), null, null, indices1, indices2));
            return;
        }
        if (!table1.getColumns().equals(table2.getColumns())) {
            differences.add(new NetworkDifference(NetworkDifference.Type.COLUMN_MISMATCH, table1.getName(), null, null,
                    new TreeSet<>(table1.getColumns()), new TreeSet<>(table2.getColumns())));
            return;
        }
        for (int index : indices1) {
            for (String column : table1.getColumns()) {
                Object value1 = table1.getValue(index, column);
                Object value2 = table2.getValue(index, column);
                if (!valuesEqual(value1, value2, tolerance)) {
                    differences.add(new NetworkDifference(NetworkDifference.Type.VALUE_MISMATCH, table1.getName(), index, column, value1, value2));
                }
            }
        }
    }

    static boolean valuesEqual(Object value1, Object value2, double tolerance) {
        boolean missing1 = isMissing(value1);
        boolean missing2 = isMissing(value2);
        if (missing1 || missing2) {
            return missing1 && missing2;
        }
        if (value1 instanceof Number number1 && value2 instanceof Number number2) {
            double x1 = number1.doubleValue();
            double x2 = number2.doubleValue();
            return x1 == x2 || FastMath.abs(x1 - x2) <= tolerance;
        }
        if (isTag(value1) || isTag(value2)) {
            return value1.toString().equals(value2.toString());
        }
        return value1.equals(value2);
    }

    private static boolean isMissing(Object value) {
        return value == null || value instanceof Double d && d.isNaN() || value instanceof Float f && f.isNaN();
    }

    private static boolean isTag(Object value) {
        return value instanceof ElementType || value instanceof SwitchElementType;
    }
}
