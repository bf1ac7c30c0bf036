/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridtopology.network;

import com.powsybl.commons.PowsyblException;

import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Raised when an index mapping would give the same index to two rows of a table.
 *
 * @author powsybl-grid-topology contributors
 */
public class IndexConflictException extends PowsyblException {

    private final ElementType elementType;

    private final transient List<Integer> conflictingIndices;

    public IndexConflictException(ElementType elementType, Collection<Integer> conflictingIndices) {
        super("Index mapping of table '" + elementType + "' would alias rows at indices " + conflictingIndices);
        this.elementType = Objects.requireNonNull(elementType);
        this.conflictingIndices = List.copyOf(conflictingIndices);
    }

    public ElementType getElementType() {
        return elementType;
    }

    /**
     * New indices which would be held by more than one row.
     */
    public List<Integer> getConflictingIndices() {
        return conflictingIndices;
    }
}
