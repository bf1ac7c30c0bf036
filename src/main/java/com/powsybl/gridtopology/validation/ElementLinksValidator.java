/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridtopology.validation;

import com.powsybl.gridtopology.network.*;

import java.util.*;

/**
 * Scan of the references of a network pointing to missing rows. Problems are returned, never thrown, so that the
 * validator can be used on inconsistent networks.
 *
 * @author powsybl-grid-topology contributors
 */
public final class ElementLinksValidator {

    private ElementLinksValidator() {
    }

    public static List<DanglingReference> findDanglingReferences(Network network) {
        Objects.requireNonNull(network);
        List<DanglingReference> dangling = new ArrayList<>();
        for (ReferenceColumn column : ReferenceColumn.all()) {
            findDanglingReferences(network, column, dangling);
        }
        findDanglingGroupMembers(network, dangling);
        findDanglingControllerReferences(network, dangling);
        return dangling;
    }

    private static void findDanglingReferences(Network network, ReferenceColumn column, List<DanglingReference> dangling) {
        ElementTable table = network.getTable(column.owner());
        if (!table.hasColumn(column.column())) {
            return;
        }
        for (int index : table.getIndices()) {
            Integer referencedIndex = column.getReferencedIndex(table, index);
            if (referencedIndex == null) {
                continue;
            }
            Object tag = column.isTagged() && table.hasColumn(column.tagColumn()) ? table.getValue(index, column.tagColumn()) : null;
            if (column.isTagged() && tag == null) {
                continue;
            }
            ElementType target = column.isTagged() ? decodeTag(tag) : ElementType.BUS;
            if (target == null || !network.getTable(target).contains(referencedIndex)) {
                dangling.add(new DanglingReference(column.owner(), index, column.column(), target, referencedIndex));
            }
        }
    }

    private static ElementType decodeTag(Object tag) {
        try {
            return ReferenceColumn.toElementType(tag);
        } catch (IllegalArgumentException e) {
            // reported as a reference to an unknown type
            return null;
        }
    }

    private static void findDanglingGroupMembers(Network network, List<DanglingReference> dangling) {
        ElementTable groups = network.getTable(ElementType.GROUP);
        for (int group : groups.getIndices()) {
            GroupMembers members = References.getMembers(groups, group);
            for (ElementType type : members.getElementTypes()) {
                ElementTable table = network.getTable(type);
                for (int member : members.getIndices(type)) {
                    if (!table.contains(member)) {
                        dangling.add(new DanglingReference(ElementType.GROUP, group, Columns.MEMBERS, type, member));
                    }
                }
            }
        }
    }

    private static void findDanglingControllerReferences(Network network, List<DanglingReference> dangling) {
        ElementTable controllers = network.getTable(ElementType.CONTROLLER);
        for (int row : controllers.getIndices()) {
            Controller controller = References.getController(controllers, row);
            if (controller == null) {
                continue;
            }
            controller.getReferences().forEach((type, indices) -> {
                ElementTable table = network.getTable(type);
                for (int index : indices) {
                    if (!table.contains(index)) {
                        dangling.add(new DanglingReference(ElementType.CONTROLLER, row, Columns.OBJECT, type, index));
                    }
                }
            });
        }
    }

    /**
     * Rows of the given element type holding at least one reference to a missing row.
     */
    public static Set<Integer> falseElementLinks(Network network, ElementType type) {
        Objects.requireNonNull(type);
        Set<Integer> falseLinks = new TreeSet<>();
        for (DanglingReference reference : findDanglingReferences(network)) {
            if (reference.owner() == type) {
                falseLinks.add(reference.index());
            }
        }
        return falseLinks;
    }

    /**
     * Rows holding at least one reference to a missing row, by element type. Types without such rows are omitted.
     */
    public static Map<ElementType, Set<Integer>> falseElementLinksLoop(Network network) {
        Map<ElementType, Set<Integer>> falseLinks = new EnumMap<>(ElementType.class);
        for (DanglingReference reference : findDanglingReferences(network)) {
            falseLinks.computeIfAbsent(reference.owner(), k -> new TreeSet<>()).add(reference.index());
        }
        return falseLinks;
    }
}
