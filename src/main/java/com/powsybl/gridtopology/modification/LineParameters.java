/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridtopology.modification;

/**
 * Per km electrical parameters of a line.
 *
 * @param rOhmPerKm series resistance
 * @param xOhmPerKm series reactance
 * @param cNfPerKm shunt capacitance
 * @param gUsPerKm shunt conductance
 * @param maxIKa rated current
 *
 * @author powsybl-grid-topology contributors
 */
public record LineParameters(double rOhmPerKm, double xOhmPerKm, double cNfPerKm, double gUsPerKm, double maxIKa) {
}
