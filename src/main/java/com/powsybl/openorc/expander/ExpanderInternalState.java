/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openorc.expander;

import java.util.List;

/**
 * Internal states and flows of the semi-empirical expander model, from the supply nozzle to the exhaust:
 * supply pressure drop (su1), supply heat transfer (su2), leakage throat (thr), end of internal expansion (in),
 * end of constant volume expansion (ex2), leakage mixing (ex1) and exhaust heat transfer (ex).
 *
 * @author Open ORC developers
 */
public record ExpanderInternalState(ThermodynamicState supply1,
                                    ThermodynamicState supply2,
                                    ThermodynamicState throat,
                                    ThermodynamicState internal,
                                    ThermodynamicState exhaust2,
                                    ThermodynamicState exhaust1,
                                    ThermodynamicState exhaust,
                                    double gamma,
                                    double leakageMassFlow,
                                    double internalMassFlow,
                                    double supplyHeat,
                                    double exhaustHeat,
                                    double ambientHeat,
                                    double internalPower,
                                    double lossPower) {

    public List<ThermodynamicState> getStates() {
        return List.of(supply1, supply2, throat, internal, exhaust2, exhaust1, exhaust);
    }
}
