/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridtopology.network;

import com.powsybl.commons.PowsyblException;

import java.util.Objects;

/**
 * Raised when the premise of a topology query is false, for instance a bus which is not a terminal of the given
 * element.
 *
 * @author powsybl-grid-topology contributors
 */
public class InvalidTopologyException extends PowsyblException {

    private final ElementType elementType;

    private final int index;

    public InvalidTopologyException(ElementType elementType, int index, String message) {
        super(message);
        this.elementType = Objects.requireNonNull(elementType);
        this.index = index;
    }

    public ElementType getElementType() {
        return elementType;
    }

    public int getIndex() {
        return index;
    }
}
