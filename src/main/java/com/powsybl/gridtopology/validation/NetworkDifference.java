/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridtopology.validation;

import java.util.Objects;

/**
 * A difference found between two networks.
 *
 * @param type kind of difference
 * @param tableName name of the table, {@code res_<type>} for result tables
 * @param index row index, null for table level differences
 * @param column column name, null for row or table level differences
 * @param value1 value in the first network (row indices or column names for table level differences)
 * @param value2 value in the second network
 *
 * @author powsybl-grid-topology contributors
 */
public record NetworkDifference(Type type, String tableName, Integer index, String column, Object value1, Object value2) {

    public enum Type {
        INDEX_MISMATCH,
        COLUMN_MISMATCH,
        VALUE_MISMATCH
    }

    public NetworkDifference {
        Objects.requireNonNull(type);
        Objects.requireNonNull(tableName);
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder().append(type).append(' ').append(tableName);
        if (index != null) {
            builder.append('[').append(index).append(']');
        }
        if (column != null) {
            builder.append('.').append(column);
        }
        return builder.append(": ").append(value1).append(" != ").append(value2).toString();
    }
}
