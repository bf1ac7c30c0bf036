/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridtopology.network;

import java.util.*;
import java.util.function.IntPredicate;
import java.util.function.IntUnaryOperator;

/**
 * Members of a group: for each element type, the ordered list of member indices.
 * <p>
 * Instances are immutable. Transformations return a new instance and drop the element types which end up without
 * members.
 *
 * @author powsybl-grid-topology contributors
 */
public final class GroupMembers {

    private static final GroupMembers EMPTY = new GroupMembers(new EnumMap<>(ElementType.class));

    private final Map<ElementType, List<Integer>> indicesByType;

    private GroupMembers(EnumMap<ElementType, List<Integer>> indicesByType) {
        this.indicesByType = Collections.unmodifiableMap(indicesByType);
    }

    public static GroupMembers empty() {
        return EMPTY;
    }

    public static GroupMembers of(ElementType type, List<Integer> indices) {
        return empty().with(type, indices);
    }

    public static GroupMembers of(Map<ElementType, List<Integer>> indicesByType) {
        GroupMembers members = empty();
        for (Map.Entry<ElementType, List<Integer>> e : indicesByType.entrySet()) {
            members = members.with(e.getKey(), e.getValue());
        }
        return members;
    }

    /**
     * @return a copy where the members of the given type are replaced by the given indices
     */
    public GroupMembers with(ElementType type, List<Integer> indices) {
        Objects.requireNonNull(type);
        Objects.requireNonNull(indices);
        EnumMap<ElementType, List<Integer>> copy = new EnumMap<>(ElementType.class);
        copy.putAll(indicesByType);
        if (indices.isEmpty()) {
            copy.remove(type);
        } else {
            copy.put(type, List.copyOf(indices));
        }
        return new GroupMembers(copy);
    }

    public Set<ElementType> getElementTypes() {
        return indicesByType.keySet();
    }

    public List<Integer> getIndices(ElementType type) {
        return indicesByType.getOrDefault(type, Collections.emptyList());
    }

    public boolean isEmpty() {
        return indicesByType.isEmpty();
    }

    public GroupMembers map(ElementType type, IntUnaryOperator mapper) {
        List<Integer> indices = getIndices(type);
        if (indices.isEmpty()) {
            return this;
        }
        List<Integer> mapped = new ArrayList<>(indices.size());
        for (int index : indices) {
            mapped.add(mapper.applyAsInt(index));
        }
        return with(type, mapped);
    }

    public GroupMembers filter(ElementType type, IntPredicate keep) {
        List<Integer> indices = getIndices(type);
        if (indices.isEmpty()) {
            return this;
        }
        List<Integer> kept = new ArrayList<>(indices.size());
        for (int index : indices) {
            if (keep.test(index)) {
                kept.add(index);
            }
        }
        return kept.size() == indices.size() ? this : with(type, kept);
    }

    /**
     * Move the given members of one element type to another one, under new indices.
     */
    public GroupMembers move(ElementType oldType, ElementType newType, Map<Integer, Integer> oldToNew) {
        List<Integer> oldIndices = getIndices(oldType);
        List<Integer> remaining = new ArrayList<>();
        List<Integer> moved = new ArrayList<>(getIndices(newType));
        for (int index : oldIndices) {
            Integer newIndex = oldToNew.get(index);
            if (newIndex != null) {
                moved.add(newIndex);
            } else {
                remaining.add(index);
            }
        }
        if (remaining.size() == oldIndices.size()) {
            return this;
        }
        return with(oldType, remaining).with(newType, moved);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return indicesByType.equals(((GroupMembers) o).indicesByType);
    }

    @Override
    public int hashCode() {
        return indicesByType.hashCode();
    }

    @Override
    public String toString() {
        return indicesByType.toString();
    }
}
