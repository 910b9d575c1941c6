/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openorc.expander;

import com.powsybl.openorc.OpenOrcParameters;
import com.powsybl.openorc.fluid.FluidStates;
import com.powsybl.openorc.solver.RootFinder;

import java.util.Objects;

/**
 * Supply and exhaust conditions of an expander solve, resolved once by the {@link ExpanderSolver}.
 *
 * @author Open ORC developers
 */
public class ExpanderSolvingContext {

    private final FluidStates states;

    private final double supplyPressure;

    private final double supplyEnthalpy;

    private final double supplyTemperature;

    private final double supplyEntropy;

    private final double supplyDensity;

    private final double exhaustPressure;

    private final double massFlow;

    private final double ambientTemperature;

    private final double isentropicExhaustEnthalpy;

    private final double minExhaustEnthalpy;

    private final double maxExhaustEnthalpy;

    private final RootFinder rootFinder;

    private final OpenOrcParameters parameters;

    public ExpanderSolvingContext(FluidStates states, double supplyPressure, double supplyEnthalpy, double exhaustPressure,
                                  double massFlow, double ambientTemperature, double minExhaustEnthalpy,
                                  double maxExhaustEnthalpy, RootFinder rootFinder, OpenOrcParameters parameters) {
        this.states = Objects.requireNonNull(states);
        this.supplyPressure = supplyPressure;
        this.supplyEnthalpy = supplyEnthalpy;
        this.exhaustPressure = exhaustPressure;
        this.massFlow = massFlow;
        this.ambientTemperature = ambientTemperature;
        this.minExhaustEnthalpy = minExhaustEnthalpy;
        this.maxExhaustEnthalpy = maxExhaustEnthalpy;
        this.rootFinder = Objects.requireNonNull(rootFinder);
        this.parameters = Objects.requireNonNull(parameters);
        supplyTemperature = states.temperature(supplyPressure, supplyEnthalpy);
        supplyEntropy = states.entropy(supplyPressure, supplyEnthalpy);
        supplyDensity = states.density(supplyPressure, supplyEnthalpy);
        isentropicExhaustEnthalpy = states.enthalpyAtEntropy(exhaustPressure, supplyEntropy);
    }

    public FluidStates getStates() {
        return states;
    }

    public double getSupplyPressure() {
        return supplyPressure;
    }

    public double getSupplyEnthalpy() {
        return supplyEnthalpy;
    }

    public double getSupplyTemperature() {
        return supplyTemperature;
    }

    public double getSupplyEntropy() {
        return supplyEntropy;
    }

    public double getSupplyDensity() {
        return supplyDensity;
    }

    public double getExhaustPressure() {
        return exhaustPressure;
    }

    public double getPressureRatio() {
        return supplyPressure / exhaustPressure;
    }

    public double getMassFlow() {
        return massFlow;
    }

    public double getAmbientTemperature() {
        return ambientTemperature;
    }

    public double getIsentropicExhaustEnthalpy() {
        return isentropicExhaustEnthalpy;
    }

    public double getIsentropicPower() {
        return massFlow * (supplyEnthalpy - isentropicExhaustEnthalpy);
    }

    public double getMinExhaustEnthalpy() {
        return minExhaustEnthalpy;
    }

    public double getMaxExhaustEnthalpy() {
        return maxExhaustEnthalpy;
    }

    public boolean isValidExhaustEnthalpy(double exhaustEnthalpy) {
        return exhaustEnthalpy > minExhaustEnthalpy && exhaustEnthalpy < maxExhaustEnthalpy;
    }

    public RootFinder getRootFinder() {
        return rootFinder;
    }

    public OpenOrcParameters getParameters() {
        return parameters;
    }
}
