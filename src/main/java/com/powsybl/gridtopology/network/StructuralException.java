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
 * Raised when an operation targets an element index or an element type which is absent from the network, or when a
 * structural post-condition does not hold.
 *
 * @author powsybl-grid-topology contributors
 */
public class StructuralException extends PowsyblException {

    private final ElementType elementType;

    private final transient List<Integer> indices;

    public StructuralException(ElementType elementType, Collection<Integer> indices, String message) {
        super(message);
        this.elementType = Objects.requireNonNull(elementType);
        this.indices = List.copyOf(indices);
    }

    public static StructuralException missingIndices(ElementType elementType, Collection<Integer> indices) {
        return new StructuralException(elementType, indices, "Indices " + indices + " not found in table '" + elementType + "'");
    }

    public ElementType getElementType() {
        return elementType;
    }

    public List<Integer> getIndices() {
        return indices;
    }
}
