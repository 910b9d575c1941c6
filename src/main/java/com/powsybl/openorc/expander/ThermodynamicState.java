/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openorc.expander;

import com.powsybl.openorc.fluid.FluidStates;

/**
 * @author Open ORC developers
 */
public record ThermodynamicState(double enthalpy, double pressure, double entropy, double density) {

    static ThermodynamicState of(FluidStates states, double pressure, double enthalpy) {
        return new ThermodynamicState(enthalpy, pressure, states.entropy(pressure, enthalpy), states.density(pressure, enthalpy));
    }
}
