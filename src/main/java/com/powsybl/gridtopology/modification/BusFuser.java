/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridtopology.modification;

import com.powsybl.gridtopology.network.*;
import com.powsybl.gridtopology.reindex.Reindexer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Contraction of buses into a single one, in place.
 *
 * @author powsybl-grid-topology contributors
 */
public final class BusFuser {

    private static final Logger LOGGER = LoggerFactory.getLogger(BusFuser.class);

    private BusFuser() {
    }

    /**
     * Redirect every reference to the merged buses to the kept bus and remove the bus-bus switches linking the fused
     * buses together. With {@code drop}, the merged buses are removed, as well as the branches whose terminals were
     * all on fused buses; otherwise they stay in the network, referenced by nothing.
     */
    public static void fuseBuses(Network network, int busToKeep, Collection<Integer> busesToMerge, boolean drop) {
        Objects.requireNonNull(network);
        Objects.requireNonNull(busesToMerge);
        List<Integer> allBuses = new ArrayList<>(busesToMerge);
        allBuses.add(busToKeep);
        ElementDropper.checkIndices(network, ElementType.BUS, allBuses);

        Set<Integer> merged = new TreeSet<>(busesToMerge);
        merged.remove(busToKeep);
        if (merged.isEmpty()) {
            return;
        }
        Set<Integer> fused = new HashSet<>(merged);
        fused.add(busToKeep);

        Map<ElementType, Set<Integer>> loops = new EnumMap<>(ElementType.class);
        if (drop) {
            for (ElementType type : ElementType.branchTypes()) {
                Set<Integer> inner = ElementDropper.getElementsAtBuses(network.getTable(type), fused, true);
                if (!inner.isEmpty()) {
                    loops.put(type, inner);
                }
            }
        }

        ElementDropper.dropInnerBranches(network, fused, List.of(ElementType.SWITCH));

        Map<Integer, Integer> mapping = new HashMap<>();
        for (int bus : merged) {
            mapping.put(bus, busToKeep);
        }
        Reindexer.substituteReferences(network, ElementType.BUS, mapping);

        if (drop) {
            loops.forEach((type, indices) -> ElementDropper.dropElements(network, type, indices));
            ElementDropper.dropElements(network, ElementType.BUS, merged);
        }
        LOGGER.info("Buses {} fused into bus {}", merged, busToKeep);
    }

    public static void fuseBuses(Network network, int busToKeep, int busToMerge, boolean drop) {
        fuseBuses(network, busToKeep, List.of(busToMerge), drop);
    }
}
