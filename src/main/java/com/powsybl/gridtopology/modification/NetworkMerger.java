/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridtopology.modification;

import com.google.common.base.Stopwatch;
import com.powsybl.gridtopology.network.*;
import com.powsybl.gridtopology.reindex.Reindexer;
import com.powsybl.gridtopology.validation.DanglingReference;
import com.powsybl.gridtopology.validation.ElementLinksValidator;
import net.jafama.FastMath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.TimeUnit;

/**
 * Disjoint union of two networks.
 * <p>
 * Rows of the second network whose index is already used in the first one are renumbered, keeping their relative
 * order, to the first indices above the highest index of both tables. Other rows keep their index. Every reference of
 * the second network follows the renumbering. Input networks are left untouched.
 *
 * @author powsybl-grid-topology contributors
 */
public final class NetworkMerger {

    private static final Logger LOGGER = LoggerFactory.getLogger(NetworkMerger.class);

    private NetworkMerger() {
    }

    public static Network merge(Network network1, Network network2) {
        return merge(network1, network2, new MergeParameters());
    }

    public static Network merge(Network network1, Network network2, MergeParameters parameters) {
        Objects.requireNonNull(network1);
        Objects.requireNonNull(network2);
        Objects.requireNonNull(parameters);
        Stopwatch stopwatch = Stopwatch.createStarted();

        Network merged = parameters.isMergeResults() ? network1.copy() : network1.copyWithoutResults();
        Network other = parameters.isMergeResults() ? network2.copy() : network2.copyWithoutResults();

        for (ElementType type : ElementType.values()) {
            Map<Integer, Integer> oldToNew = getCollisionMapping(merged.getTable(type), other.getTable(type));
            if (!oldToNew.isEmpty()) {
                Reindexer.reindex(other, type, oldToNew);
                LOGGER.debug("{} rows of table '{}' of network '{}' renumbered to avoid index collisions",
                        oldToNew.size(), type, network2.getName());
            }
        }

        for (ElementType type : ElementType.values()) {
            merged.getTable(type).append(other.getTable(type));
            merged.getOptionalResultTable(type).ifPresent(t -> t.append(other.getResultTable(type)));
        }

        List<DanglingReference> dangling = ElementLinksValidator.findDanglingReferences(merged);
        if (!dangling.isEmpty()) {
            if (parameters.isValidate()) {
                DanglingReference first = dangling.get(0);
                List<Integer> indices = dangling.stream()
                        .filter(reference -> reference.owner() == first.owner())
                        .map(DanglingReference::index)
                        .toList();
                throw new StructuralException(first.owner(), indices, "Merged network has " + dangling.size()
                        + " references to missing rows, first one: " + first);
            }
            LOGGER.warn("Merged network has {} references to missing rows, first one: {}", dangling.size(), dangling.get(0));
        }

        stopwatch.stop();
        LOGGER.debug("Networks '{}' and '{}' merged in {} ms", network1.getName(), network2.getName(),
                stopwatch.elapsed(TimeUnit.MILLISECONDS));
        return merged;
    }

    /**
     * Renumbering of the colliding rows of the second table.
     */
    private static Map<Integer, Integer> getCollisionMapping(ElementTable table1, ElementTable table2) {
        Map<Integer, Integer> oldToNew = new LinkedHashMap<>();
        int next = FastMath.max(table1.getMaxIndex(), table2.getMaxIndex()) + 1;
        for (int index : table2.getIndices()) {
            if (table1.contains(index)) {
                oldToNew.put(index, next++);
            }
        }
        return oldToNew;
    }
}
