/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridtopology.reindex;

import com.powsybl.gridtopology.network.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Renumbering of the rows of one element type, cascaded into every table referencing that type.
 * <p>
 * All checks are done before the first mutation: a reindexing either fully applies or throws and leaves the network
 * untouched.
 *
 * @author powsybl-grid-topology contributors
 */
public final class Reindexer {

    private static final Logger LOGGER = LoggerFactory.getLogger(Reindexer.class);

    private Reindexer() {
    }

    /**
     * Renumber rows of the given element type. Indices absent from the mapping keep their value. References to
     * indices of the mapping are rewritten even when the referenced row does not exist.
     *
     * @throws IndexConflictException if two rows would end up with the same index
     */
    public static void reindex(Network network, ElementType type, Map<Integer, Integer> oldToNew) {
        Objects.requireNonNull(network);
        Objects.requireNonNull(type);
        Objects.requireNonNull(oldToNew);
        checkMapping(network.getTable(type), oldToNew);

        Map<Integer, Integer> effective = new HashMap<>();
        oldToNew.forEach((oldIndex, newIndex) -> {
            if (!oldIndex.equals(newIndex)) {
                effective.put(oldIndex, newIndex);
            }
        });
        if (effective.isEmpty()) {
            return;
        }

        // references are resolved before the first mutation, and rewritten while rows still have their old index
        References.prepareRewrite(network, type, index -> effective.getOrDefault(index, index)).run();
        network.getTable(type).reindex(effective);
        network.getOptionalResultTable(type).ifPresent(t -> t.reindex(effective));

        LOGGER.debug("{} indices of table '{}' renumbered", effective.size(), type);
    }

    /**
     * Give the rows of the table, in row order, the given new indices.
     */
    public static void reindex(Network network, ElementType type, List<Integer> newIndices) {
        reindex(network, type, newIndices, network.getTable(type).getIndices());
    }

    /**
     * Give the rows at {@code oldIndices} the indices at the same position in {@code newIndices}.
     */
    public static void reindex(Network network, ElementType type, List<Integer> newIndices, List<Integer> oldIndices) {
        Objects.requireNonNull(newIndices);
        Objects.requireNonNull(oldIndices);
        if (newIndices.size() != oldIndices.size()) {
            throw new IllegalArgumentException("Cannot reindex table '" + type + "': " + oldIndices.size()
                    + " old indices but " + newIndices.size() + " new indices");
        }
        Map<Integer, Integer> oldToNew = new LinkedHashMap<>();
        for (int i = 0; i < oldIndices.size(); i++) {
            Integer previous = oldToNew.put(oldIndices.get(i), newIndices.get(i));
            if (previous != null) {
                throw new IllegalArgumentException("Index " + oldIndices.get(i) + " of table '" + type + "' listed twice");
            }
        }
        reindex(network, type, oldToNew);
    }

    /**
     * Renumber the rows of one table to {@code start, start + 1, ...} keeping their order.
     *
     * @return the applied mapping
     */
    public static Map<Integer, Integer> renumberToContiguous(Network network, ElementType type, int start) {
        if (start < 0) {
            throw new IllegalArgumentException("Negative start index: " + start);
        }
        Map<Integer, Integer> oldToNew = new LinkedHashMap<>();
        int next = start;
        for (int index : network.getTable(type).getIndices()) {
            oldToNew.put(index, next++);
        }
        reindex(network, type, oldToNew);
        return oldToNew;
    }

    public static Map<Integer, Integer> renumberToContiguous(Network network, ElementType type) {
        return renumberToContiguous(network, type, 0);
    }

    /**
     * Renumber every table from 0, buses first.
     */
    public static void renumberAllToContiguous(Network network) {
        Objects.requireNonNull(network);
        // bus is the first constant of the enum
        for (ElementType type : ElementType.values()) {
            renumberToContiguous(network, type, 0);
        }
    }

    /**
     * Replace the references to some indices of the given type by references to other indices, leaving the target
     * table untouched. The mapping does not need to be injective.
     */
    public static void substituteReferences(Network network, ElementType type, Map<Integer, Integer> oldToNew) {
        Objects.requireNonNull(oldToNew);
        References.rewrite(network, type, index -> oldToNew.getOrDefault(index, index));
    }

    public static Map<Integer, Integer> inverse(Map<Integer, Integer> mapping) {
        Map<Integer, Integer> inverse = new LinkedHashMap<>();
        mapping.forEach((k, v) -> {
            if (inverse.put(v, k) != null) {
                throw new IllegalArgumentException("Mapping is not injective on value " + v);
            }
        });
        return inverse;
    }

    private static void checkMapping(ElementTable table, Map<Integer, Integer> oldToNew) {
        Set<Integer> conflicts = new TreeSet<>();

        Map<Integer, Integer> sources = new HashMap<>();
        oldToNew.forEach((oldIndex, newIndex) -> {
            Objects.requireNonNull(oldIndex);
            Objects.requireNonNull(newIndex);
            if (newIndex < 0) {
                throw new IllegalArgumentException("Negative new index " + newIndex + " for index " + oldIndex
                        + " of table '" + table.getElementType() + "'");
            }
            if (sources.put(newIndex, oldIndex) != null) {
                conflicts.add(newIndex);
            }
        });

        // un-remapped rows keep their index and may collide with a new one
        Set<Integer> finalIndices = new HashSet<>();
        for (int index : table.getIndices()) {
            int newIndex = oldToNew.getOrDefault(index, index);
            if (!finalIndices.add(newIndex)) {
                conflicts.add(newIndex);
            }
        }

        if (!conflicts.isEmpty()) {
            throw new IndexConflictException(table.getElementType(), conflicts);
        }
    }
}
