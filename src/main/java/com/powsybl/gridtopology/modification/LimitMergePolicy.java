/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridtopology.modification;

/**
 * How power limits of merged generation plants are combined when some plants have no value for a limit.
 *
 * @author powsybl-grid-topology contributors
 */
public enum LimitMergePolicy {
    /**
     * Missing values count as zero. The limit is left unset only if no plant has a value.
     */
    SUM_AVAILABLE,
    /**
     * The limit is left unset as soon as one plant has no value.
     */
    DROP_IF_ANY_MISSING
}
