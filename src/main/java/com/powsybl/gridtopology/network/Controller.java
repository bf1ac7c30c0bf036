/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridtopology.network;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.function.IntUnaryOperator;

/**
 * A stateful object attached to a row of the {@code controller} table.
 * <p>
 * Two networks are only equal if their controllers are equal, so implementations must define {@link #equals} and
 * {@link #hashCode} on their state (value equality) and never rely on identity. {@link #copy} must return an equal
 * but distinct instance, so that copying a network does not share mutable controllers.
 * <p>
 * A controller acting on network elements exposes their indices through {@link #getReferences} and follows their
 * renumbering through {@link #remap}, so that the network operations keep it consistent like any reference column.
 *
 * @author powsybl-grid-topology contributors
 */
public interface Controller {

    Controller copy();

    /**
     * Indices of the elements the controller refers to, by element type.
     */
    default Map<ElementType, List<Integer>> getReferences() {
        return Collections.emptyMap();
    }

    /**
     * @return a controller whose references to the given element type are mapped, or this controller if none changes
     */
    default Controller remap(ElementType type, IntUnaryOperator mapper) {
        return this;
    }

    /**
     * Follow elements moved to another element type.
     *
     * @return a controller referring to the new elements, or null if the controller cannot act on the new element
     * type, in which case it is dropped
     */
    default Controller retarget(ElementType oldType, ElementType newType, Map<Integer, Integer> oldToNew) {
        return null;
    }

    @Override
    boolean equals(Object other);

    @Override
    int hashCode();
}
