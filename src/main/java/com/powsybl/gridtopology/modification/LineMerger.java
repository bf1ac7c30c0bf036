/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridtopology.modification;

import com.powsybl.gridtopology.network.*;
import org.apache.commons.math3.complex.Complex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Contraction of parallel lines, in place.
 *
 * @author powsybl-grid-topology contributors
 */
public final class LineMerger {

    private static final Logger LOGGER = LoggerFactory.getLogger(LineMerger.class);

    private static final List<String> COMPARED_COLUMNS = List.of(Columns.LENGTH_KM, Columns.R_OHM_PER_KM, Columns.X_OHM_PER_KM,
            Columns.C_NF_PER_KM, Columns.G_US_PER_KM, Columns.MAX_I_KA);

    private LineMerger() {
    }

    /**
     * Fold the {@code parallel} multiplicity of a line into its per km parameters, leaving an equivalent line with a
     * multiplicity of 1.
     */
    public static void mergeParallelLine(Network network, int lineIndex) {
        ElementTable lines = network.getTable(ElementType.LINE);
        if (!lines.contains(lineIndex)) {
            throw StructuralException.missingIndices(ElementType.LINE, List.of(lineIndex));
        }
        double parallel = getParallel(lines, lineIndex);
        if (parallel <= 0) {
            throw new InvalidTopologyException(ElementType.LINE, lineIndex, "Invalid parallel count " + parallel + " of line " + lineIndex);
        }
        scale(lines, lineIndex, Columns.R_OHM_PER_KM, 1 / parallel);
        scale(lines, lineIndex, Columns.X_OHM_PER_KM, 1 / parallel);
        scale(lines, lineIndex, Columns.C_NF_PER_KM, parallel);
        scale(lines, lineIndex, Columns.G_US_PER_KM, parallel);
        scale(lines, lineIndex, Columns.MAX_I_KA, parallel);
        lines.setValue(lineIndex, Columns.PARALLEL, 1);
        LOGGER.debug("Parallel count {} of line {} merged into its parameters", parallel, lineIndex);
    }

    /**
     * Drop the lines identical to the given one (same terminals, length and per km parameters), adding their
     * multiplicity to it, then fold the multiplicity into the line parameters.
     *
     * @return the dropped lines
     */
    public static List<Integer> mergeParallelLines(Network network, int lineIndex) {
        ElementTable lines = network.getTable(ElementType.LINE);
        if (!lines.contains(lineIndex)) {
            throw StructuralException.missingIndices(ElementType.LINE, List.of(lineIndex));
        }
        List<Integer> identical = new ArrayList<>();
        double parallel = getParallel(lines, lineIndex);
        for (int other : lines.getIndices()) {
            if (other != lineIndex && areParallel(lines, lineIndex, other)) {
                identical.add(other);
                parallel += getParallel(lines, other);
            }
        }
        if (!identical.isEmpty()) {
            lines.setValue(lineIndex, Columns.PARALLEL, parallel);
            ElementDropper.dropLines(network, identical);
            LOGGER.info("Lines {} merged into parallel line {}", identical, lineIndex);
        }
        mergeParallelLine(network, lineIndex);
        return identical;
    }

    private static boolean areParallel(ElementTable lines, int line1, int line2) {
        if (lines.isInService(line1) != lines.isInService(line2)
                || !Objects.equals(lines.getInteger(line1, Columns.FROM_BUS), lines.getInteger(line2, Columns.FROM_BUS))
                || !Objects.equals(lines.getInteger(line1, Columns.TO_BUS), lines.getInteger(line2, Columns.TO_BUS))) {
            return false;
        }
        for (String column : COMPARED_COLUMNS) {
            if (lines.hasColumn(column) && Double.compare(lines.getDouble(line1, column), lines.getDouble(line2, column)) != 0) {
                return false;
            }
        }
        return true;
    }

    /**
     * Create the line which, in parallel with the given one, is equivalent to a line having the target parameters.
     * The existing line is left unchanged.
     *
     * @return index of the created line
     */
    public static int replToLine(Network network, int lineIndex, LineParameters target, String name, boolean inService) {
        Objects.requireNonNull(target);
        ElementTable lines = network.getTable(ElementType.LINE);
        if (!lines.contains(lineIndex)) {
            throw StructuralException.missingIndices(ElementType.LINE, List.of(lineIndex));
        }
        double parallel = getParallel(lines, lineIndex);
        Complex y0 = new Complex(lines.getDouble(lineIndex, Columns.R_OHM_PER_KM), lines.getDouble(lineIndex, Columns.X_OHM_PER_KM))
                .reciprocal()
                .multiply(parallel);
        Complex y1 = new Complex(target.rOhmPerKm(), target.xOhmPerKm()).reciprocal();
        Complex zNew = y1.subtract(y0).reciprocal();

        int newIndex = lines.newRow()
                .setValue(Columns.NAME, name != null ? name : "repl_" + lineIndex)
                .setValue(Columns.FROM_BUS, lines.getInteger(lineIndex, Columns.FROM_BUS))
                .setValue(Columns.TO_BUS, lines.getInteger(lineIndex, Columns.TO_BUS))
                .setValue(Columns.LENGTH_KM, lines.getDouble(lineIndex, Columns.LENGTH_KM))
                .setValue(Columns.R_OHM_PER_KM, zNew.getReal())
                .setValue(Columns.X_OHM_PER_KM, zNew.getImaginary())
                .setValue(Columns.C_NF_PER_KM, target.cNfPerKm() - getValueOrZero(lines, lineIndex, Columns.C_NF_PER_KM) * parallel)
                .setValue(Columns.G_US_PER_KM, target.gUsPerKm() - getValueOrZero(lines, lineIndex, Columns.G_US_PER_KM) * parallel)
                .setValue(Columns.MAX_I_KA, target.maxIKa() - getValueOrZero(lines, lineIndex, Columns.MAX_I_KA) * parallel)
                .setValue(Columns.PARALLEL, 1)
                .setValue(Columns.IN_SERVICE, inService)
                .add();
        LOGGER.debug("Line {} created in parallel to line {}", newIndex, lineIndex);
        return newIndex;
    }

    public static int replToLine(Network network, int lineIndex, LineParameters target) {
        return replToLine(network, lineIndex, target, null, false);
    }

    private static double getParallel(ElementTable lines, int line) {
        double parallel = lines.hasColumn(Columns.PARALLEL) ? lines.getDouble(line, Columns.PARALLEL) : Double.NaN;
        return Double.isNaN(parallel) ? 1 : parallel;
    }

    private static double getValueOrZero(ElementTable lines, int line, String column) {
        double value = lines.hasColumn(column) ? lines.getDouble(line, column) : Double.NaN;
        return Double.isNaN(value) ? 0 : value;
    }

    private static void scale(ElementTable lines, int line, String column, double factor) {
        if (lines.hasColumn(column)) {
            double value = lines.getDouble(line, column);
            if (!Double.isNaN(value)) {
                lines.setValue(line, column, value * factor);
            }
        }
    }
}
