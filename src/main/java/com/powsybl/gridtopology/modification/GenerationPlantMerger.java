/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridtopology.modification;

import com.powsybl.commons.PowsyblException;
import com.powsybl.gridtopology.network.*;
import net.jafama.FastMath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Contraction of the generation plants (external grids, generators, static generators) connected to a same bus into a
 * single plant, in place.
 * <p>
 * The kept plant of a bus is the first one, external grids first, then generators, then static generators. Active
 * powers are summed, as well as reactive powers when the kept plant has a reactive power. Power limits are combined
 * according to the {@link LimitMergePolicy}. The other plants are dropped with their results, costs and measurements.
 *
 * @author powsybl-grid-topology contributors
 */
public final class GenerationPlantMerger {

    private static final Logger LOGGER = LoggerFactory.getLogger(GenerationPlantMerger.class);

    private record Plant(ElementType type, int index) {
    }

    private GenerationPlantMerger() {
    }

    public static boolean mergeSameBusGenerationPlants(Network network) {
        return mergeSameBusGenerationPlants(network, new GenerationPlantMergeParameters());
    }

    /**
     * @return true if at least two plants have been merged
     */
    public static boolean mergeSameBusGenerationPlants(Network network, GenerationPlantMergeParameters parameters) {
        Objects.requireNonNull(network);
        Objects.requireNonNull(parameters);

        Map<Integer, List<Plant>> plantsByBus = new TreeMap<>();
        for (ElementType type : parameters.getElementTypes()) {
            ElementTable table = network.getTable(type);
            if (!table.hasColumn(Columns.BUS)) {
                continue;
            }
            for (int index : table.getIndices()) {
                Integer bus = table.getInteger(index, Columns.BUS);
                if (bus != null) {
                    plantsByBus.computeIfAbsent(bus, k -> new ArrayList<>()).add(new Plant(type, index));
                }
            }
        }
        plantsByBus.values().removeIf(plants -> plants.size() < 2);
        if (plantsByBus.isEmpty()) {
            return false;
        }

        plantsByBus.forEach((bus, plants) -> checkVoltageSetPoints(network, bus, plants, parameters));

        Map<ElementType, List<Integer>> dropped = new EnumMap<>(ElementType.class);
        plantsByBus.forEach((bus, plants) -> {
            mergePlants(network, plants, parameters);
            for (Plant plant : plants.subList(1, plants.size())) {
                dropped.computeIfAbsent(plant.type(), k -> new ArrayList<>()).add(plant.index());
            }
        });

        if (parameters.isAddInfo()) {
            for (ElementType type : parameters.getElementTypes()) {
                ElementTable table = network.getTable(type);
                if (table.hasColumn(Columns.INCLUDES_OTHER_PLANTS)) {
                    for (int index : table.getIndices()) {
                        if (table.getValue(index, Columns.INCLUDES_OTHER_PLANTS) == null) {
                            table.setValue(index, Columns.INCLUDES_OTHER_PLANTS, false);
                        }
                    }
                }
            }
        }

        dropped.forEach((type, indices) -> ElementDropper.dropElements(network, type, indices));

        LOGGER.info("Generation plants of {} buses merged, {} plants dropped", plantsByBus.size(),
                dropped.values().stream().mapToInt(List::size).sum());
        return true;
    }

    private static void checkVoltageSetPoints(Network network, int bus, List<Plant> plants, GenerationPlantMergeParameters parameters) {
        double min = Double.NaN;
        double max = Double.NaN;
        for (Plant plant : plants) {
            ElementTable table = network.getTable(plant.type());
            double vm = table.hasColumn(Columns.VM_PU) ? table.getDouble(plant.index(), Columns.VM_PU) : Double.NaN;
            if (!Double.isNaN(vm)) {
                min = Double.isNaN(min) ? vm : FastMath.min(min, vm);
                max = Double.isNaN(max) ? vm : FastMath.max(max, vm);
            }
        }
        if (!Double.isNaN(min) && max - min > parameters.getVoltageTolerance()) {
            String message = "Generation plants " + plants + " of bus " + bus + " have different voltage set points, between "
                    + min + " and " + max + " pu";
            if (parameters.isFailOnVoltageMismatch()) {
                throw new PowsyblException(message);
            }
            LOGGER.warn(message);
        }
    }

    private static void mergePlants(Network network, List<Plant> plants, GenerationPlantMergeParameters parameters) {
        Plant kept = plants.get(0);
        ElementTable keptTable = network.getTable(kept.type());

        double p = 0;
        for (Plant plant : plants) {
            p += getValueOrZero(network, plant, getActivePowerColumn(plant.type()));
        }
        keptTable.setValue(kept.index(), getActivePowerColumn(kept.type()), p);

        if (keptTable.hasColumn(Columns.Q_MVAR)) {
            double q = 0;
            for (Plant plant : plants) {
                q += getValueOrZero(network, plant, Columns.Q_MVAR);
            }
            keptTable.setValue(kept.index(), Columns.Q_MVAR, q);
        }

        for (String limit : Columns.LIMITS) {
            mergeLimit(network, plants, limit, parameters.getLimitMergePolicy());
        }

        if (parameters.isAddInfo()) {
            keptTable.setValue(kept.index(), Columns.INCLUDES_OTHER_PLANTS, true);
        }
    }

    private static void mergeLimit(Network network, List<Plant> plants, String limit, LimitMergePolicy policy) {
        Plant kept = plants.get(0);
        ElementTable keptTable = network.getTable(kept.type());
        double sum = 0;
        int available = 0;
        for (Plant plant : plants) {
            double value = getValue(network, plant, limit);
            if (!Double.isNaN(value)) {
                sum += value;
                available++;
            }
        }
        if (available == 0) {
            return;
        }
        if (policy == LimitMergePolicy.DROP_IF_ANY_MISSING && available < plants.size()) {
            if (keptTable.hasColumn(limit)) {
                keptTable.setValue(kept.index(), limit, null);
            }
        } else {
            keptTable.setValue(kept.index(), limit, sum);
        }
    }

    private static String getActivePowerColumn(ElementType type) {
        return type == ElementType.EXT_GRID ? Columns.P_DISP_MW : Columns.P_MW;
    }

    private static double getValue(Network network, Plant plant, String column) {
        ElementTable table = network.getTable(plant.type());
        return table.hasColumn(column) ? table.getDouble(plant.index(), column) : Double.NaN;
    }

    private static double getValueOrZero(Network network, Plant plant, String column) {
        double value = getValue(network, plant, column);
        return Double.isNaN(value) ? 0 : value;
    }
}
