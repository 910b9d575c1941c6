/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openorc.fluid;

import java.util.Objects;

/**
 * Supply conditions of a fluid stream entering a component.
 * <p>
 * A stream given by its temperature, or whose fluid name starts with {@link #INCOMPRESSIBLE_PREFIX}, is handled as an
 * incompressible single-phase stream by the heat exchanger solver.
 *
 * @author Open ORC developers
 */
public final class Stream {

    public static final String INCOMPRESSIBLE_PREFIX = "INCOMP:";

    private final String fluid;

    private final double pressure;

    private final double supplyValue;

    private final SupplyStateType supplyStateType;

    private final double massFlow;

    private Stream(String fluid, double pressure, double supplyValue, SupplyStateType supplyStateType, double massFlow) {
        this.fluid = Objects.requireNonNull(fluid);
        this.pressure = checkFinite(pressure, "pressure");
        this.supplyValue = checkFinite(supplyValue, "supply value");
        this.supplyStateType = Objects.requireNonNull(supplyStateType);
        this.massFlow = checkFinite(massFlow, "mass flow");
    }

    private static double checkFinite(double value, String name) {
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException("Invalid " + name + " value: " + value);
        }
        return value;
    }

    public static Stream ofEnthalpy(String fluid, double pressure, double enthalpy, double massFlow) {
        return new Stream(fluid, pressure, enthalpy, SupplyStateType.ENTHALPY, massFlow);
    }

    public static Stream ofTemperature(String fluid, double pressure, double temperature, double massFlow) {
        return new Stream(fluid, pressure, temperature, SupplyStateType.TEMPERATURE, massFlow);
    }

    public String getFluid() {
        return fluid;
    }

    public double getPressure() {
        return pressure;
    }

    public double getSupplyValue() {
        return supplyValue;
    }

    public SupplyStateType getSupplyStateType() {
        return supplyStateType;
    }

    public double getMassFlow() {
        return massFlow;
    }

    public boolean isIncompressible() {
        return supplyStateType == SupplyStateType.TEMPERATURE || fluid.startsWith(INCOMPRESSIBLE_PREFIX);
    }

    /**
     * Supply enthalpy, converted once from the supply temperature when needed.
     */
    public double getSupplyEnthalpy(FluidStates states) {
        return supplyStateType == SupplyStateType.ENTHALPY ? supplyValue : states.enthalpyAtTemperature(pressure, supplyValue);
    }

    @Override
    public String toString() {
        return "Stream(fluid=" + fluid
                + ", pressure=" + pressure
                + ", " + supplyStateType + "=" + supplyValue
                + ", massFlow=" + massFlow
                + ")";
    }
}
