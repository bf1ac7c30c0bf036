/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridtopology.modification;

import com.powsybl.gridtopology.network.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.function.IntPredicate;

/**
 * Move of elements from one table to another, in place: loads, static generators and storages between each other,
 * generators to and from static generators or external grids, lines to and from impedances. Wards and extended wards
 * can also be broken down into the elements they are equivalent to.
 * <p>
 * Replaced rows are removed, created rows carry the mandatory columns of the new type plus the columns to keep. When
 * the two types have different signing systems, powers are negated and their limits swapped. Result rows follow the
 * elements, and the costs, measurements and groups targeting a replaced element are retargeted to its replacement.
 *
 * @author powsybl-grid-topology contributors
 */
public final class ElementTypeReplacer {

    private static final Logger LOGGER = LoggerFactory.getLogger(ElementTypeReplacer.class);

    private static final Set<ElementType> PQ_TYPES = EnumSet.of(ElementType.LOAD, ElementType.SGEN, ElementType.STORAGE);

    private static final List<String> PQ_MANDATORY_COLUMNS = List.of(Columns.NAME, Columns.BUS, Columns.P_MW, Columns.Q_MVAR,
            Columns.IN_SERVICE, Columns.CONTROLLABLE);

    @FunctionalInterface
    private interface RowCompleter {

        void complete(int oldIndex, Map<String, Object> values);
    }

    private static final List<String> BRANCH_MANDATORY_COLUMNS = List.of(Columns.NAME, Columns.FROM_BUS, Columns.TO_BUS,
            Columns.IN_SERVICE);

    private ElementTypeReplacer() {
    }

    /**
     * Replace loads, static generators or storages by elements of another of these types.
     *
     * @return the mapping from replaced to created indices
     */
    public static Map<Integer, Integer> replacePqElementType(Network network, ElementType oldType, ElementType newType,
                                                             ElementReplacementParameters parameters) {
        if (!PQ_TYPES.contains(oldType) || !PQ_TYPES.contains(newType)) {
            throw new IllegalArgumentException("Only loads, static generators and storages can be replaced, not '"
                    + oldType + "' by '" + newType + "'");
        }
        if (oldType == newType) {
            throw new IllegalArgumentException("Cannot replace element type '" + oldType + "' by itself");
        }
        return replace(network, oldType, newType, parameters, PQ_MANDATORY_COLUMNS, null, null);
    }

    /**
     * Replace external grids by generators holding the voltage set point of the external grid. The active power of
     * the generator is the one computed for the external grid, if any, 0 otherwise.
     */
    public static Map<Integer, Integer> replaceExtGridByGen(Network network, ElementReplacementParameters parameters) {
        ElementTable extGrids = network.getTable(ElementType.EXT_GRID);
        Optional<ElementTable> extGridResults = network.getOptionalResultTable(ElementType.EXT_GRID);
        RowCompleter completer = (extGrid, values) -> {
            values.put(Columns.VM_PU, extGrids.getValue(extGrid, Columns.VM_PU));
            double p = getResult(extGridResults, extGrid, Columns.P_MW);
            values.put(Columns.P_MW, Double.isNaN(p) ? 0.0 : p);
            values.put(Columns.SLACK, parameters.isSlack());
            values.put(Columns.CONTROLLABLE, true);
        };
        return replace(network, ElementType.EXT_GRID, ElementType.GEN, parameters,
                List.of(Columns.NAME, Columns.BUS, Columns.IN_SERVICE), completer, busResultsCompleter(network, extGrids));
    }

    /**
     * Replace generators by external grids. The voltage angle of the external grid is the one computed for the
     * generator, if any, 0 otherwise.
     */
    public static Map<Integer, Integer> replaceGenByExtGrid(Network network, ElementReplacementParameters parameters) {
        Optional<ElementTable> genResults = network.getOptionalResultTable(ElementType.GEN);
        RowCompleter completer = (gen, values) -> {
            double va = getResult(genResults, gen, Columns.VA_DEGREE);
            values.put(Columns.VA_DEGREE, Double.isNaN(va) ? 0.0 : va);
        };
        RowCompleter resultCompleter = (gen, values) -> {
            values.remove(Columns.VM_PU);
            values.remove(Columns.VA_DEGREE);
        };
        return replace(network, ElementType.GEN, ElementType.EXT_GRID, parameters,
                List.of(Columns.NAME, Columns.BUS, Columns.VM_PU, Columns.IN_SERVICE), completer, resultCompleter);
    }

    /**
     * Replace generators by static generators. The reactive power of the static generator is the one computed for the
     * generator, if any, 0 otherwise.
     */
    public static Map<Integer, Integer> replaceGenBySgen(Network network, ElementReplacementParameters parameters) {
        Optional<ElementTable> genResults = network.getOptionalResultTable(ElementType.GEN);
        RowCompleter completer = (gen, values) -> {
            double q = getResult(genResults, gen, Columns.Q_MVAR);
            values.put(Columns.Q_MVAR, Double.isNaN(q) ? 0.0 : q);
        };
        RowCompleter resultCompleter = (gen, values) -> {
            values.remove(Columns.VM_PU);
            values.remove(Columns.VA_DEGREE);
        };
        return replace(network, ElementType.GEN, ElementType.SGEN, parameters,
                List.of(Columns.NAME, Columns.BUS, Columns.P_MW, Columns.IN_SERVICE, Columns.CONTROLLABLE), completer, resultCompleter);
    }

    /**
     * Replace static generators by generators. The voltage set point of the generator is the voltage computed at its
     * bus, if any, 1 pu otherwise.
     */
    public static Map<Integer, Integer> replaceSgenByGen(Network network, ElementReplacementParameters parameters) {
        ElementTable sgens = network.getTable(ElementType.SGEN);
        Optional<ElementTable> busResults = network.getOptionalResultTable(ElementType.BUS);
        RowCompleter completer = (sgen, values) -> {
            Integer bus = sgens.getInteger(sgen, Columns.BUS);
            double vm = bus != null ? getResult(busResults, bus, Columns.VM_PU) : Double.NaN;
            values.put(Columns.VM_PU, Double.isNaN(vm) ? 1.0 : vm);
        };
        return replace(network, ElementType.SGEN, ElementType.GEN, parameters,
                List.of(Columns.NAME, Columns.BUS, Columns.P_MW, Columns.IN_SERVICE, Columns.CONTROLLABLE), completer,
                busResultsCompleter(network, sgens));
    }

    /**
     * Replace impedances by lines of 1 km with the same series impedance. The per unit values of an impedance are
     * based on its own base power if any, on {@link ElementReplacementParameters#getSnMva()} otherwise, and on the
     * nominal voltage of its from bus.
     * <p>
     * A line cannot represent an asymmetric impedance: unless {@link ElementReplacementParameters#isOnlyValidReplace()}
     * is disabled, such impedances are kept.
     */
    public static Map<Integer, Integer> replaceImpedanceByLine(Network network, ElementReplacementParameters parameters) {
        Objects.requireNonNull(network);
        ElementTable impedances = network.getTable(ElementType.IMPEDANCE);
        ElementTable buses = network.getTable(ElementType.BUS);
        ElementReplacementParameters validParameters = filterOldIndices(network, ElementType.IMPEDANCE, parameters,
            impedance -> Double.compare(impedances.getDouble(impedance, Columns.RFT_PU), impedances.getDouble(impedance, Columns.RTF_PU)) == 0
                    && Double.compare(impedances.getDouble(impedance, Columns.XFT_PU), impedances.getDouble(impedance, Columns.XTF_PU)) == 0);
        RowCompleter completer = (impedance, values) -> {
            double snMva = impedances.hasColumn(Columns.SN_MVA) ? impedances.getDouble(impedance, Columns.SN_MVA) : Double.NaN;
            double zBase = getBaseImpedance(buses, impedances.getInteger(impedance, Columns.FROM_BUS),
                    Double.isNaN(snMva) ? parameters.getSnMva() : snMva);
            values.put(Columns.LENGTH_KM, 1.0);
            values.put(Columns.R_OHM_PER_KM, impedances.getDouble(impedance, Columns.RFT_PU) * zBase);
            values.put(Columns.X_OHM_PER_KM, impedances.getDouble(impedance, Columns.XFT_PU) * zBase);
            values.put(Columns.C_NF_PER_KM, 0.0);
            values.put(Columns.G_US_PER_KM, 0.0);
            values.put(Columns.MAX_I_KA, Double.NaN);
            values.put(Columns.PARALLEL, 1);
        };
        return replace(network, ElementType.IMPEDANCE, ElementType.LINE, validParameters, BRANCH_MANDATORY_COLUMNS, completer, null);
    }

    /**
     * Replace lines by symmetric impedances, in per unit of {@link ElementReplacementParameters#getSnMva()} and of
     * the nominal voltage of the from bus. Only the power flows of the line results are kept.
     * <p>
     * An impedance has no shunt admittance and cannot be gated by a switch: unless
     * {@link ElementReplacementParameters#isOnlyValidReplace()} is disabled, such lines are kept. Otherwise a switch at
     * one of the replaced lines fails the replacement.
     */
    public static Map<Integer, Integer> replaceLineByImpedance(Network network, ElementReplacementParameters parameters) {
        Objects.requireNonNull(network);
        ElementTable lines = network.getTable(ElementType.LINE);
        ElementTable buses = network.getTable(ElementType.BUS);
        Set<Integer> gatedLines = new HashSet<>();
        References.forEachReference(network, ElementType.LINE, (table, row, column, line) -> {
            if (table.getElementType() == ElementType.SWITCH) {
                gatedLines.add(line);
            }
        });
        ElementReplacementParameters validParameters = filterOldIndices(network, ElementType.LINE, parameters,
            line -> isZeroOrMissing(lines, line, Columns.C_NF_PER_KM) && isZeroOrMissing(lines, line, Columns.G_US_PER_KM)
                    && !gatedLines.contains(line));
        RowCompleter completer = (line, values) -> {
            double zBase = getBaseImpedance(buses, lines.getInteger(line, Columns.FROM_BUS), parameters.getSnMva());
            Integer parallel = lines.hasColumn(Columns.PARALLEL) ? lines.getInteger(line, Columns.PARALLEL) : null;
            double factor = lines.getDouble(line, Columns.LENGTH_KM) / (parallel != null ? parallel : 1) / zBase;
            double r = lines.getDouble(line, Columns.R_OHM_PER_KM) * factor;
            double x = lines.getDouble(line, Columns.X_OHM_PER_KM) * factor;
            values.put(Columns.RFT_PU, r);
            values.put(Columns.XFT_PU, x);
            values.put(Columns.RTF_PU, r);
            values.put(Columns.XTF_PU, x);
            values.put(Columns.SN_MVA, parameters.getSnMva());
        };
        RowCompleter resultCompleter = (line, values) -> values.keySet().retainAll(Columns.BRANCH_FLOW_RESULTS);
        return replace(network, ElementType.LINE, ElementType.IMPEDANCE, validParameters, BRANCH_MANDATORY_COLUMNS, completer,
                resultCompleter);
    }

    public static Map<ElementType, List<Integer>> replaceWardByInternalElements(Network network) {
        return replaceWardByInternalElements(network, null);
    }

    /**
     * Replace wards by a load consuming their constant power and a shunt holding their constant impedance, both at
     * the ward bus. References to a ward are moved to its load.
     *
     * @param wards the wards to replace, or null for all of them
     * @return the created loads and shunts
     */
    public static Map<ElementType, List<Integer>> replaceWardByInternalElements(Network network, Collection<Integer> wards) {
        Objects.requireNonNull(network);
        ElementTable wardTable = network.getTable(ElementType.WARD);
        List<Integer> indices = wards != null ? List.copyOf(wards) : wardTable.getIndices();
        ElementDropper.checkIndices(network, ElementType.WARD, indices);
        Map<ElementType, List<Integer>> created = new EnumMap<>(ElementType.class);
        Map<Integer, Integer> wardToLoad = addLoadsAndShunts(network, ElementType.WARD, indices, created);
        removeEquivalents(network, ElementType.WARD, wardToLoad);
        return created;
    }

    public static Map<ElementType, List<Integer>> replaceXwardByInternalElements(Network network) {
        return replaceXwardByInternalElements(network, null, ElementReplacementParameters.SN_MVA_DEFAULT_VALUE);
    }

    /**
     * Replace extended wards by a load, a shunt and, behind an impedance, an internal bus holding a voltage regulating
     * generator without active power. The impedance is in per unit of the given base power and of the nominal voltage
     * of the extended ward bus. References to an extended ward are moved to its load.
     *
     * @param xwards the extended wards to replace, or null for all of them
     * @return the created buses, loads, shunts, generators and impedances
     */
    public static Map<ElementType, List<Integer>> replaceXwardByInternalElements(Network network, Collection<Integer> xwards, double snMva) {
        Objects.requireNonNull(network);
        if (snMva <= 0 || Double.isNaN(snMva)) {
            throw new IllegalArgumentException("Invalid base power: " + snMva);
        }
        ElementTable xwardTable = network.getTable(ElementType.XWARD);
        List<Integer> indices = xwards != null ? List.copyOf(xwards) : xwardTable.getIndices();
        ElementDropper.checkIndices(network, ElementType.XWARD, indices);
        Map<ElementType, List<Integer>> created = new EnumMap<>(ElementType.class);
        Map<Integer, Integer> xwardToLoad = addLoadsAndShunts(network, ElementType.XWARD, indices, created);

        ElementTable buses = network.getTable(ElementType.BUS);
        ElementTable gens = network.getTable(ElementType.GEN);
        ElementTable impedances = network.getTable(ElementType.IMPEDANCE);
        Optional<ElementTable> xwardResults = network.getOptionalResultTable(ElementType.XWARD);
        for (int xward : indices) {
            Integer bus = xwardTable.getInteger(xward, Columns.BUS);
            Object name = xwardTable.getValue(xward, Columns.NAME);
            boolean inService = xwardTable.isInService(xward);
            double vnKv = getNominalVoltage(buses, bus);

            int internalBus = buses.nextIndex();
            buses.putRow(internalBus, rowOf(Columns.NAME, name, Columns.VN_KV, vnKv, Columns.IN_SERVICE, inService));
            int gen = gens.nextIndex();
            gens.putRow(gen, rowOf(Columns.NAME, name, Columns.BUS, internalBus, Columns.P_MW, 0.0,
                    Columns.VM_PU, xwardTable.getDouble(xward, Columns.VM_PU), Columns.SLACK, false, Columns.IN_SERVICE, inService));
            double zBase = vnKv * vnKv / snMva;
            double r = xwardTable.getDouble(xward, Columns.R_OHM) / zBase;
            double x = xwardTable.getDouble(xward, Columns.X_OHM) / zBase;
            int impedance = impedances.nextIndex();
            impedances.putRow(impedance, rowOf(Columns.NAME, name, Columns.FROM_BUS, bus, Columns.TO_BUS, internalBus,
                    Columns.RFT_PU, r, Columns.XFT_PU, x, Columns.RTF_PU, r, Columns.XTF_PU, x, Columns.SN_MVA, snMva,
                    Columns.IN_SERVICE, inService));
            created.computeIfAbsent(ElementType.BUS, k -> new ArrayList<>()).add(internalBus);
            created.computeIfAbsent(ElementType.GEN, k -> new ArrayList<>()).add(gen);
            created.computeIfAbsent(ElementType.IMPEDANCE, k -> new ArrayList<>()).add(impedance);

            double vmInternal = getResult(xwardResults, xward, Columns.VM_INTERNAL_PU);
            if (!Double.isNaN(vmInternal)) {
                network.getResultTable(ElementType.BUS).putRow(internalBus, rowOf(Columns.VM_PU, vmInternal));
            }
        }
        removeEquivalents(network, ElementType.XWARD, xwardToLoad);
        return created;
    }

    /**
     * Create the load and the shunt equivalent to the constant power and constant impedance parts of each ward or
     * extended ward, with their results when the equivalent has some.
     *
     * @return the mapping from the equivalents to their loads
     */
    private static Map<Integer, Integer> addLoadsAndShunts(Network network, ElementType type, List<Integer> indices,
                                                           Map<ElementType, List<Integer>> created) {
        ElementTable equivalents = network.getTable(type);
        ElementTable buses = network.getTable(ElementType.BUS);
        ElementTable loads = network.getTable(ElementType.LOAD);
        ElementTable shunts = network.getTable(ElementType.SHUNT);
        Optional<ElementTable> results = network.getOptionalResultTable(type);
        Map<Integer, Integer> toLoad = new LinkedHashMap<>();
        for (int index : indices) {
            Integer bus = equivalents.getInteger(index, Columns.BUS);
            Object name = equivalents.getValue(index, Columns.NAME);
            boolean inService = equivalents.isInService(index);
            double ps = equivalents.getDouble(index, Columns.PS_MW);
            double qs = equivalents.getDouble(index, Columns.QS_MVAR);
            double pz = equivalents.getDouble(index, Columns.PZ_MW);
            double qz = equivalents.getDouble(index, Columns.QZ_MVAR);

            int load = loads.nextIndex();
            loads.putRow(load, rowOf(Columns.NAME, name, Columns.BUS, bus, Columns.P_MW, ps, Columns.Q_MVAR, qs,
                    Columns.IN_SERVICE, inService));
            int shunt = shunts.nextIndex();
            shunts.putRow(shunt, rowOf(Columns.NAME, name, Columns.BUS, bus, Columns.P_MW, pz, Columns.Q_MVAR, qz,
                    Columns.VN_KV, getNominalVoltage(buses, bus), Columns.IN_SERVICE, inService));
            toLoad.put(index, load);
            created.computeIfAbsent(ElementType.LOAD, k -> new ArrayList<>()).add(load);
            created.computeIfAbsent(ElementType.SHUNT, k -> new ArrayList<>()).add(shunt);

            if (results.filter(t -> t.contains(index)).isPresent()) {
                double vm = getResult(results, index, Columns.VM_PU);
                // a disconnected equivalent has a zero voltage and consumes nothing
                double factor = inService && vm != 0 ? 1 : 0;
                network.getResultTable(ElementType.LOAD).putRow(load, rowOf(Columns.P_MW, ps * factor, Columns.Q_MVAR, qs * factor));
                network.getResultTable(ElementType.SHUNT).putRow(shunt, rowOf(Columns.P_MW, pz * vm * vm * factor,
                        Columns.Q_MVAR, qz * vm * vm * factor, Columns.VM_PU, vm));
            }
        }
        return toLoad;
    }

    private static void removeEquivalents(Network network, ElementType type, Map<Integer, Integer> toLoad) {
        if (toLoad.isEmpty()) {
            return;
        }
        References.retarget(network, type, ElementType.LOAD, toLoad);
        network.removeRows(type, toLoad.keySet());
        LOGGER.info("{} elements of type '{}' replaced by their internal elements", toLoad.size(), type);
    }

    private static Map<String, Object> rowOf(Object... columnsAndValues) {
        Map<String, Object> row = new LinkedHashMap<>();
        for (int i = 0; i < columnsAndValues.length; i += 2) {
            row.put((String) columnsAndValues[i], columnsAndValues[i + 1]);
        }
        return row;
    }

    private static double getNominalVoltage(ElementTable buses, Integer bus) {
        return bus != null && buses.contains(bus) ? buses.getDouble(bus, Columns.VN_KV) : Double.NaN;
    }

    private static double getBaseImpedance(ElementTable buses, Integer bus, double snMva) {
        double vnKv = getNominalVoltage(buses, bus);
        return vnKv * vnKv / snMva;
    }

    private static boolean isZeroOrMissing(ElementTable table, int index, String column) {
        if (!table.hasColumn(column)) {
            return true;
        }
        double value = table.getDouble(index, column);
        return Double.isNaN(value) || value == 0;
    }

    /**
     * Drop from the elements to replace the ones failing the validity check, with their new index if any, when only
     * valid replacements are requested.
     */
    private static ElementReplacementParameters filterOldIndices(Network network, ElementType oldType,
                                                                 ElementReplacementParameters parameters, IntPredicate valid) {
        Objects.requireNonNull(parameters);
        List<Integer> oldIndices = parameters.getOldIndices() != null ? parameters.getOldIndices() : network.getTable(oldType).getIndices();
        ElementDropper.checkIndices(network, oldType, oldIndices);
        List<Integer> newIndices = parameters.getNewIndices();
        if (newIndices != null && newIndices.size() != oldIndices.size()) {
            throw new IllegalArgumentException(oldIndices.size() + " elements to replace but " + newIndices.size() + " new indices");
        }
        if (!parameters.isOnlyValidReplace()) {
            return parameters;
        }
        List<Integer> validOldIndices = new ArrayList<>();
        List<Integer> validNewIndices = new ArrayList<>();
        List<Integer> skipped = new ArrayList<>();
        for (int i = 0; i < oldIndices.size(); i++) {
            int oldIndex = oldIndices.get(i);
            if (valid.test(oldIndex)) {
                validOldIndices.add(oldIndex);
                if (newIndices != null) {
                    validNewIndices.add(newIndices.get(i));
                }
            } else {
                skipped.add(oldIndex);
            }
        }
        if (skipped.isEmpty()) {
            return parameters;
        }
        LOGGER.warn("{} elements of type '{}' cannot be replaced exactly and are kept: {}", skipped.size(), oldType, skipped);
        return parameters.copy()
                .setOldIndices(validOldIndices)
                .setNewIndices(newIndices != null ? validNewIndices : null);
    }

    /**
     * Complete the results of a generator with the voltage computed at its bus.
     */
    private static RowCompleter busResultsCompleter(Network network, ElementTable oldTable) {
        Optional<ElementTable> busResults = network.getOptionalResultTable(ElementType.BUS);
        return (oldIndex, values) -> {
            Integer bus = oldTable.getInteger(oldIndex, Columns.BUS);
            if (bus != null) {
                values.put(Columns.VM_PU, getResult(busResults, bus, Columns.VM_PU));
                values.put(Columns.VA_DEGREE, getResult(busResults, bus, Columns.VA_DEGREE));
            }
        };
    }

    private static double getResult(Optional<ElementTable> results, int index, String column) {
        return results.filter(t -> t.contains(index) && t.hasColumn(column))
                .map(t -> t.getDouble(index, column))
                .orElse(Double.NaN);
    }

    private static Map<Integer, Integer> replace(Network network, ElementType oldType, ElementType newType,
                                                 ElementReplacementParameters parameters, List<String> mandatoryColumns,
                                                 RowCompleter completer, RowCompleter resultCompleter) {
        Objects.requireNonNull(network);
        Objects.requireNonNull(parameters);
        ElementTable oldTable = network.getTable(oldType);
        ElementTable newTable = network.getTable(newType);

        List<Integer> oldIndices = parameters.getOldIndices() != null ? parameters.getOldIndices() : oldTable.getIndices();
        ElementDropper.checkIndices(network, oldType, oldIndices);
        if (new HashSet<>(oldIndices).size() != oldIndices.size()) {
            throw new IllegalArgumentException("Duplicated indices in " + oldIndices);
        }
        Map<Integer, Integer> oldToNew = getNewIndices(newTable, oldIndices, parameters.getNewIndices());
        if (oldToNew.isEmpty()) {
            return oldToNew;
        }

        Set<String> columns = new LinkedHashSet<>(mandatoryColumns);
        columns.addAll(parameters.getColsToKeep() != null ? parameters.getColsToKeep() : Columns.LIMITS);
        columns.addAll(parameters.getAddColsToKeep());
        boolean flipSign = oldType.isBusElement() && newType.isBusElement()
                && oldType.getSigningSystemValue() != newType.getSigningSystemValue();
        checkSwitches(network, oldType, newType, oldToNew.keySet());

        Optional<ElementTable> oldResults = network.getOptionalResultTable(oldType);
        ElementTable newResults = network.getResultTable(newType);
        oldToNew.forEach((oldIndex, newIndex) -> {
            Map<String, Object> values = new LinkedHashMap<>();
            for (String column : columns) {
                if (oldTable.hasColumn(column)) {
                    values.put(column, oldTable.getValue(oldIndex, column));
                }
            }
            if (flipSign) {
                flipSign(values);
            }
            if (completer != null) {
                completer.complete(oldIndex, values);
            }
            newTable.putRow(newIndex, values);

            oldResults.filter(t -> t.contains(oldIndex)).ifPresent(t -> {
                Map<String, Object> resultValues = new LinkedHashMap<>(t.getRow(oldIndex));
                if (flipSign) {
                    flipSign(resultValues);
                }
                if (resultCompleter != null) {
                    resultCompleter.complete(oldIndex, resultValues);
                }
                newResults.putRow(newIndex, resultValues);
            });
        });

        References.retarget(network, oldType, newType, oldToNew);
        network.removeRows(oldType, oldToNew.keySet());

        LOGGER.info("{} elements of type '{}' replaced by elements of type '{}'", oldToNew.size(), oldType, newType);
        return oldToNew;
    }

    /**
     * Fail before any change when a switch at a replaced element could not be moved to its replacement.
     */
    private static void checkSwitches(Network network, ElementType oldType, ElementType newType, Set<Integer> oldIndices) {
        if (SwitchElementType.fromElementType(newType) != null) {
            return;
        }
        Set<Integer> switches = new TreeSet<>();
        References.forEachReference(network, oldType, (table, row, column, referencedIndex) -> {
            if (table.getElementType() == ElementType.SWITCH && oldIndices.contains(referencedIndex)) {
                switches.add(row);
            }
        });
        if (!switches.isEmpty()) {
            throw new StructuralException(ElementType.SWITCH, switches, "Switches " + switches
                    + " cannot be moved to element type '" + newType + "'");
        }
    }

    private static Map<Integer, Integer> getNewIndices(ElementTable newTable, List<Integer> oldIndices, List<Integer> newIndices) {
        Map<Integer, Integer> oldToNew = new LinkedHashMap<>();
        if (newIndices == null) {
            int next = newTable.nextIndex();
            for (int oldIndex : oldIndices) {
                oldToNew.put(oldIndex, next++);
            }
            return oldToNew;
        }
        if (newIndices.size() != oldIndices.size()) {
            throw new IllegalArgumentException(oldIndices.size() + " elements to replace but " + newIndices.size() + " new indices");
        }
        Set<Integer> conflicts = new TreeSet<>();
        Set<Integer> used = new HashSet<>();
        for (int i = 0; i < oldIndices.size(); i++) {
            int newIndex = newIndices.get(i);
            if (newIndex < 0) {
                throw new IllegalArgumentException("Negative index " + newIndex);
            }
            if (newTable.contains(newIndex) || !used.add(newIndex)) {
                conflicts.add(newIndex);
            }
            oldToNew.put(oldIndices.get(i), newIndex);
        }
        if (!conflicts.isEmpty()) {
            throw new IndexConflictException(newTable.getElementType(), conflicts);
        }
        return oldToNew;
    }

    private static void flipSign(Map<String, Object> values) {
        negate(values, Columns.P_MW);
        negate(values, Columns.Q_MVAR);
        swapAndNegate(values, Columns.MIN_P_MW, Columns.MAX_P_MW);
        swapAndNegate(values, Columns.MIN_Q_MVAR, Columns.MAX_Q_MVAR);
    }

    private static Object negate(Object value) {
        return value instanceof Number number ? -number.doubleValue() : value;
    }

    private static void negate(Map<String, Object> values, String column) {
        if (values.containsKey(column)) {
            values.put(column, negate(values.get(column)));
        }
    }

    private static void swapAndNegate(Map<String, Object> values, String minColumn, String maxColumn) {
        boolean hasMin = values.containsKey(minColumn);
        boolean hasMax = values.containsKey(maxColumn);
        Object min = values.remove(minColumn);
        Object max = values.remove(maxColumn);
        if (hasMax) {
            values.put(minColumn, negate(max));
        }
        if (hasMin) {
            values.put(maxColumn, negate(min));
        }
    }
}
