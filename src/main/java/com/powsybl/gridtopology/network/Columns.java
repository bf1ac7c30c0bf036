/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridtopology.network;

import java.util.List;

/**
 * Column names shared by several element tables.
 *
 * @author powsybl-grid-topology contributors
 */
public final class Columns {

    public static final String NAME = "name";
    public static final String IN_SERVICE = "in_service";

    public static final String BUS = "bus";
    public static final String FROM_BUS = "from_bus";
    public static final String TO_BUS = "to_bus";
    public static final String HV_BUS = "hv_bus";
    public static final String MV_BUS = "mv_bus";
    public static final String LV_BUS = "lv_bus";

    // switch
    public static final String ELEMENT = "element";
    public static final String ET = "et";
    public static final String CLOSED = "closed";
    public static final String TYPE = "type";

    // measurement
    public static final String ELEMENT_TYPE = "element_type";
    public static final String MEASUREMENT_TYPE = "measurement_type";
    public static final String VALUE = "value";
    public static final String STD_DEV = "std_dev";
    public static final String SIDE = "side";

    // group
    public static final String MEMBERS = "members";

    // controller
    public static final String OBJECT = "object";

    // bus
    public static final String VN_KV = "vn_kv";

    // injections
    public static final String P_MW = "p_mw";
    public static final String Q_MVAR = "q_mvar";
    public static final String P_DISP_MW = "p_disp_mw";
    public static final String VM_PU = "vm_pu";
    public static final String VA_DEGREE = "va_degree";
    public static final String MIN_P_MW = "min_p_mw";
    public static final String MAX_P_MW = "max_p_mw";
    public static final String MIN_Q_MVAR = "min_q_mvar";
    public static final String MAX_Q_MVAR = "max_q_mvar";
    public static final String CONTROLLABLE = "controllable";
    public static final String SLACK = "slack";
    public static final String INCLUDES_OTHER_PLANTS = "includes_other_plants";

    // line
    public static final String LENGTH_KM = "length_km";
    public static final String R_OHM_PER_KM = "r_ohm_per_km";
    public static final String X_OHM_PER_KM = "x_ohm_per_km";
    public static final String C_NF_PER_KM = "c_nf_per_km";
    public static final String G_US_PER_KM = "g_us_per_km";
    public static final String MAX_I_KA = "max_i_ka";
    public static final String PARALLEL = "parallel";

    // impedance
    public static final String RFT_PU = "rft_pu";
    public static final String XFT_PU = "xft_pu";
    public static final String RTF_PU = "rtf_pu";
    public static final String XTF_PU = "xtf_pu";
    public static final String SN_MVA = "sn_mva";

    // ward, xward
    public static final String PS_MW = "ps_mw";
    public static final String QS_MVAR = "qs_mvar";
    public static final String PZ_MW = "pz_mw";
    public static final String QZ_MVAR = "qz_mvar";
    public static final String R_OHM = "r_ohm";
    public static final String X_OHM = "x_ohm";
    public static final String VM_INTERNAL_PU = "vm_internal_pu";

    // branch results
    public static final String P_FROM_MW = "p_from_mw";
    public static final String Q_FROM_MVAR = "q_from_mvar";
    public static final String P_TO_MW = "p_to_mw";
    public static final String Q_TO_MVAR = "q_to_mvar";
    public static final String PL_MW = "pl_mw";
    public static final String QL_MVAR = "ql_mvar";
    public static final String I_FROM_KA = "i_from_ka";
    public static final String I_TO_KA = "i_to_ka";

    public static final List<String> BRANCH_FLOW_RESULTS = List.of(P_FROM_MW, Q_FROM_MVAR, P_TO_MW, Q_TO_MVAR, PL_MW,
            QL_MVAR, I_FROM_KA, I_TO_KA);

    public static final List<String> LIMITS = List.of(MIN_P_MW, MAX_P_MW, MIN_Q_MVAR, MAX_Q_MVAR);

    private Columns() {
    }
}
