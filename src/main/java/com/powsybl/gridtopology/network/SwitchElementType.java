/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridtopology.network;

import java.util.Objects;

/**
 * Target of the {@code element} column of a switch. A {@link #BUS} switch is an edge between two buses, the other
 * ones gate the connection of a bus to one terminal of a branch.
 *
 * @author powsybl-grid-topology contributors
 */
public enum SwitchElementType {
    BUS("b", ElementType.BUS),
    LINE("l", ElementType.LINE),
    TRAFO("t", ElementType.TRAFO),
    TRAFO3W("t3", ElementType.TRAFO3W);

    private final String code;

    private final ElementType elementType;

    SwitchElementType(String code, ElementType elementType) {
        this.code = code;
        this.elementType = elementType;
    }

    public String getCode() {
        return code;
    }

    public ElementType getElementType() {
        return elementType;
    }

    public boolean isBusBus() {
        return this == BUS;
    }

    public static SwitchElementType fromCode(String code) {
        Objects.requireNonNull(code);
        for (SwitchElementType type : values()) {
            if (type.code.equals(code)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown switch element type '" + code + "'");
    }

    /**
     * @return the switch type gating the given element type, or null if switches cannot target it
     */
    public static SwitchElementType fromElementType(ElementType elementType) {
        for (SwitchElementType type : values()) {
            if (type.elementType == elementType) {
                return type;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return code;
    }
}
