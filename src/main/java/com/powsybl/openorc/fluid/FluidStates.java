/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openorc.fluid;

import java.util.Objects;

import static com.powsybl.openorc.fluid.FluidProperty.*;

/**
 * Property queries of a single fluid, bound to a {@link FluidPropertyOracle}.
 *
 * @author Open ORC developers
 */
public final class FluidStates {

    private final FluidPropertyOracle oracle;

    private final String fluid;

    public FluidStates(FluidPropertyOracle oracle, String fluid) {
        this.oracle = Objects.requireNonNull(oracle);
        this.fluid = Objects.requireNonNull(fluid);
    }

    public String getFluid() {
        return fluid;
    }

    public double get(FluidProperty output, FluidProperty input1, double value1, FluidProperty input2, double value2) {
        return oracle.state(fluid, output, input1, value1, input2, value2);
    }

    public double atPressureEnthalpy(FluidProperty output, double pressure, double enthalpy) {
        return get(output, PRESSURE, pressure, ENTHALPY, enthalpy);
    }

    public double temperature(double pressure, double enthalpy) {
        return atPressureEnthalpy(TEMPERATURE, pressure, enthalpy);
    }

    public double entropy(double pressure, double enthalpy) {
        return atPressureEnthalpy(ENTROPY, pressure, enthalpy);
    }

    public double density(double pressure, double enthalpy) {
        return atPressureEnthalpy(DENSITY, pressure, enthalpy);
    }

    /**
     * @return the vapour quality, or -1 in a single-phase region
     * @throws PropertyUndefinedException above the critical pressure
     */
    public double quality(double pressure, double enthalpy) {
        return atPressureEnthalpy(QUALITY, pressure, enthalpy);
    }

    public double specificHeat(double pressure, double enthalpy) {
        return atPressureEnthalpy(SPECIFIC_HEAT, pressure, enthalpy);
    }

    public double viscosity(double pressure, double enthalpy) {
        return atPressureEnthalpy(VISCOSITY, pressure, enthalpy);
    }

    public double conductivity(double pressure, double enthalpy) {
        return atPressureEnthalpy(CONDUCTIVITY, pressure, enthalpy);
    }

    public double surfaceTension(double pressure, double enthalpy) {
        return atPressureEnthalpy(SURFACE_TENSION, pressure, enthalpy);
    }

    public double enthalpyAtTemperature(double pressure, double temperature) {
        return get(ENTHALPY, PRESSURE, pressure, TEMPERATURE, temperature);
    }

    public double enthalpyAtEntropy(double pressure, double entropy) {
        return get(ENTHALPY, PRESSURE, pressure, ENTROPY, entropy);
    }

    public double densityAtEntropy(double pressure, double entropy) {
        return get(DENSITY, PRESSURE, pressure, ENTROPY, entropy);
    }

    public double pressureAtEntropyEnthalpy(double entropy, double enthalpy) {
        return get(PRESSURE, ENTROPY, entropy, ENTHALPY, enthalpy);
    }

    public double pressureAtDensityEntropy(double density, double entropy) {
        return get(PRESSURE, DENSITY, density, ENTROPY, entropy);
    }

    public double enthalpyAtDensityPressure(double density, double pressure) {
        return get(ENTHALPY, DENSITY, density, PRESSURE, pressure);
    }

    /**
     * Saturated property at the given pressure, 0 being the bubble point and 1 the dew point.
     */
    public double saturated(FluidProperty output, double pressure, double quality) {
        return get(output, PRESSURE, pressure, QUALITY, quality);
    }

    public double criticalPressure(double pressure) {
        return get(CRITICAL_PRESSURE, PRESSURE, pressure, QUALITY, 0.1);
    }

    public double molarMass(double pressure) {
        return get(MOLAR_MASS, PRESSURE, pressure, QUALITY, 1);
    }
}
