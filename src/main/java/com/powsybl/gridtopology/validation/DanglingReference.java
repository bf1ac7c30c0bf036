/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridtopology.validation;

import com.powsybl.gridtopology.network.ElementType;

import java.util.Objects;

/**
 * A reference to a row which does not exist.
 *
 * @param owner element type of the referencing row
 * @param index index of the referencing row
 * @param column column holding the reference
 * @param target referenced element type, null if the row tag is not a known element type
 * @param referencedIndex referenced index
 *
 * @author powsybl-grid-topology contributors
 */
public record DanglingReference(ElementType owner, int index, String column, ElementType target, int referencedIndex) {

    public DanglingReference {
        Objects.requireNonNull(owner);
        Objects.requireNonNull(column);
    }

    @Override
    public String toString() {
        return owner + "[" + index + "]." + column + " -> " + (target != null ? target : "?") + "[" + referencedIndex + "]";
    }
}
