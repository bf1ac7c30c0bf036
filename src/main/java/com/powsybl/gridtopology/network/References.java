/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridtopology.network;

import java.util.*;
import java.util.function.IntUnaryOperator;

/**
 * Navigation and rewriting of every reference of a network to a given element type: reference columns (see {@link
 * ReferenceColumn}) and group members.
 *
 * @author powsybl-grid-topology contributors
 */
public final class References {

    /**
     * Called for each row referencing the target element type through a reference column.
     */
    @FunctionalInterface
    public interface ReferenceVisitor {

        void visit(ElementTable table, int row, ReferenceColumn column, int referencedIndex);
    }

    private References() {
    }

    public static void forEachReference(Network network, ElementType target, ReferenceVisitor visitor) {
        Objects.requireNonNull(network);
        Objects.requireNonNull(target);
        Objects.requireNonNull(visitor);
        for (ReferenceColumn column : ReferenceColumn.all()) {
            if (!column.isTagged() && target != ElementType.BUS) {
                continue;
            }
            ElementTable table = network.getTable(column.owner());
            if (!table.hasColumn(column.column())) {
                continue;
            }
            for (int row : table.getIndices()) {
                if (column.getTarget(table, row) == target) {
                    Integer referencedIndex = column.getReferencedIndex(table, row);
                    if (referencedIndex != null) {
                        visitor.visit(table, row, column, referencedIndex);
                    }
                }
            }
        }
    }

    /**
     * Replace every reference to the target element type by its image through the mapper, group members and
     * controllers included. The target table itself is left untouched.
     */
    public static void rewrite(Network network, ElementType target, IntUnaryOperator mapper) {
        prepareRewrite(network, target, mapper).run();
    }

    /**
     * Compute every reference rewrite of {@link #rewrite} without modifying the network. Tags are decoded at this
     * step, so a failure leaves the network untouched.
     *
     * @return the action applying the rewrites
     */
    public static Runnable prepareRewrite(Network network, ElementType target, IntUnaryOperator mapper) {
        Objects.requireNonNull(mapper);
        List<Runnable> updates = new ArrayList<>();
        forEachReference(network, target, (table, row, column, referencedIndex) -> {
            int newIndex = mapper.applyAsInt(referencedIndex);
            if (newIndex != referencedIndex) {
                updates.add(() -> table.setValue(row, column.column(), newIndex));
            }
        });
        ElementTable groups = network.getTable(ElementType.GROUP);
        for (int group : groups.getIndices()) {
            GroupMembers members = getMembers(groups, group);
            GroupMembers mapped = members.map(target, mapper);
            if (mapped != members) {
                updates.add(() -> groups.setValue(group, Columns.MEMBERS, mapped));
            }
        }
        ElementTable controllers = network.getTable(ElementType.CONTROLLER);
        for (int row : controllers.getIndices()) {
            Controller controller = getController(controllers, row);
            if (controller != null) {
                Controller mapped = controller.remap(target, mapper);
                if (mapped != controller) {
                    updates.add(() -> controllers.setValue(row, Columns.OBJECT, mapped));
                }
            }
        }
        return () -> updates.forEach(Runnable::run);
    }

    /**
     * Rows of the tagged tables (switches, measurements, costs) referencing one of the given indices of the target
     * element type.
     */
    public static Map<ElementType, Set<Integer>> findTaggedReferences(Network network, ElementType target, Collection<Integer> indices) {
        Set<Integer> indexSet = new HashSet<>(indices);
        Map<ElementType, Set<Integer>> referencing = new EnumMap<>(ElementType.class);
        forEachReference(network, target, (table, row, column, referencedIndex) -> {
            if (column.isTagged() && indexSet.contains(referencedIndex)) {
                referencing.computeIfAbsent(table.getElementType(), k -> new TreeSet<>()).add(row);
            }
        });
        return referencing;
    }

    /**
     * Move the references of measurements, costs, groups and controllers from some elements of one type to elements
     * of another type, for instance after a load has been replaced by a static generator. Controllers unable to act
     * on the new element type are dropped.
     */
    public static void retarget(Network network, ElementType oldType, ElementType newType, Map<Integer, Integer> oldToNew) {
        Objects.requireNonNull(newType);
        Objects.requireNonNull(oldToNew);
        List<Runnable> updates = new ArrayList<>();
        forEachReference(network, oldType, (table, row, column, referencedIndex) -> {
            Integer newIndex = oldToNew.get(referencedIndex);
            if (newIndex != null && column.isTagged()) {
                Object tag = table.getElementType() == ElementType.SWITCH ? SwitchElementType.fromElementType(newType) : newType;
                if (tag == null) {
                    throw new StructuralException(ElementType.SWITCH, List.of(row), "Switch " + row + " cannot target element type '" + newType + "'");
                }
                updates.add(() -> {
                    table.setValue(row, column.tagColumn(), tag);
                    table.setValue(row, column.column(), newIndex);
                });
            }
        });
        ElementTable groups = network.getTable(ElementType.GROUP);
        for (int group : groups.getIndices()) {
            GroupMembers members = getMembers(groups, group);
            GroupMembers moved = members.move(oldType, newType, oldToNew);
            if (moved != members) {
                updates.add(() -> groups.setValue(group, Columns.MEMBERS, moved));
            }
        }
        ElementTable controllers = network.getTable(ElementType.CONTROLLER);
        List<Integer> droppedControllers = new ArrayList<>();
        for (int row : findControllers(network, oldType, oldToNew.keySet())) {
            Controller controller = getController(controllers, row);
            Controller moved = controller.retarget(oldType, newType, oldToNew);
            if (moved == null) {
                droppedControllers.add(row);
            } else if (moved != controller) {
                updates.add(() -> controllers.setValue(row, Columns.OBJECT, moved));
            }
        }
        updates.forEach(Runnable::run);
        if (!droppedControllers.isEmpty()) {
            network.removeRows(ElementType.CONTROLLER, droppedControllers);
            removeGroupMembers(network, ElementType.CONTROLLER, droppedControllers);
        }
    }

    /**
     * Rows of the controller table whose controller refers to one of the given indices of the target element type.
     */
    public static Set<Integer> findControllers(Network network, ElementType target, Collection<Integer> indices) {
        Set<Integer> indexSet = new HashSet<>(indices);
        ElementTable controllers = network.getTable(ElementType.CONTROLLER);
        Set<Integer> found = new TreeSet<>();
        for (int row : controllers.getIndices()) {
            Controller controller = getController(controllers, row);
            if (controller != null && controller.getReferences().getOrDefault(target, List.of()).stream().anyMatch(indexSet::contains)) {
                found.add(row);
            }
        }
        return found;
    }

    public static Controller getController(ElementTable controllers, int row) {
        if (!controllers.hasColumn(Columns.OBJECT)) {
            return null;
        }
        return controllers.getValue(row, Columns.OBJECT) instanceof Controller controller ? controller : null;
    }

    /**
     * Remove the given indices of an element type from every group, dropping the groups left without members.
     *
     * @return the dropped groups
     */
    public static List<Integer> removeGroupMembers(Network network, ElementType type, Collection<Integer> indices) {
        Set<Integer> removed = new HashSet<>(indices);
        ElementTable groups = network.getTable(ElementType.GROUP);
        List<Integer> emptyGroups = new ArrayList<>();
        for (int group : groups.getIndices()) {
            GroupMembers members = getMembers(groups, group);
            GroupMembers filtered = members.filter(type, index -> !removed.contains(index));
            if (filtered != members) {
                groups.setValue(group, Columns.MEMBERS, filtered);
                if (filtered.isEmpty()) {
                    emptyGroups.add(group);
                }
            }
        }
        groups.removeRows(emptyGroups);
        return emptyGroups;
    }

    public static GroupMembers getMembers(ElementTable groups, int group) {
        if (!groups.hasColumn(Columns.MEMBERS)) {
            return GroupMembers.empty();
        }
        GroupMembers members = groups.getValue(group, Columns.MEMBERS, GroupMembers.class);
        return members != null ? members : GroupMembers.empty();
    }
}
