/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridtopology.graph;

import com.powsybl.gridtopology.network.ElementType;

import java.util.Objects;

/**
 * Edge of the bus graph: a branch element, or a bus-bus switch, between two of its terminals. A three winding
 * transformer gives three edges, one per pair of terminals.
 *
 * @param elementType type of the element, a branch type or {@link ElementType#SWITCH}
 * @param elementIndex index of the element
 * @param terminal1 bus column of the first terminal
 * @param terminal2 bus column of the second terminal
 *
 * @author powsybl-grid-topology contributors
 */
public record BranchEdge(ElementType elementType, int elementIndex, String terminal1, String terminal2) {

    public BranchEdge {
        Objects.requireNonNull(elementType);
        Objects.requireNonNull(terminal1);
        Objects.requireNonNull(terminal2);
    }

    @Override
    public String toString() {
        return elementType + "[" + elementIndex + "](" + terminal1 + "-" + terminal2 + ")";
    }
}
