/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openorc.fluid;

import static com.powsybl.openorc.fluid.FluidProperty.*;

/**
 * Incompressible liquid with constant properties, enthalpy and entropy being zero at 273.15 K.
 *
 * @author Open ORC developers
 */
public class IncompressibleFluid implements TestFluid {

    private static final double REFERENCE_TEMPERATURE = 273.15;

    private final double specificHeat;

    private final double density;

    private final double viscosity;

    private final double conductivity;

    public IncompressibleFluid(double specificHeat, double density, double viscosity, double conductivity) {
        this.specificHeat = specificHeat;
        this.density = density;
        this.viscosity = viscosity;
        this.conductivity = conductivity;
    }

    public static IncompressibleFluid oil() {
        return new IncompressibleFluid(2100, 850, 0.004, 0.12);
    }

    public double enthalpy(double temperature) {
        return specificHeat * (temperature - REFERENCE_TEMPERATURE);
    }

    public double temperature(double enthalpy) {
        return REFERENCE_TEMPERATURE + enthalpy / specificHeat;
    }

    @Override
    public double state(FluidProperty output, FluidProperty input1, double value1, FluidProperty input2, double value2) {
        double temperature;
        if (TestFluid.isPair(input1, input2, PRESSURE, ENTHALPY)) {
            temperature = temperature(TestFluid.valueOf(ENTHALPY, input1, value1, value2));
        } else if (TestFluid.isPair(input1, input2, PRESSURE, TEMPERATURE)) {
            temperature = TestFluid.valueOf(TEMPERATURE, input1, value1, value2);
        } else {
            throw TestFluid.undefined(output, input1, value1, input2, value2);
        }
        return switch (output) {
            case TEMPERATURE -> temperature;
            case ENTHALPY -> enthalpy(temperature);
            case ENTROPY -> specificHeat * Math.log(temperature / REFERENCE_TEMPERATURE);
            case DENSITY -> density;
            case SPECIFIC_HEAT -> specificHeat;
            case VISCOSITY -> viscosity;
            case CONDUCTIVITY -> conductivity;
            default -> throw TestFluid.undefined(output, input1, value1, input2, value2);
        };
    }
}
