/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openorc.expander;

import com.powsybl.openorc.solver.RootFinderResult;

/**
 * @author Open ORC developers
 */
public abstract class AbstractExpanderModel implements ExpanderModel {

    private static final double SECONDS_PER_MINUTE = 60;

    protected final double volume;

    protected final double sweptVolume;

    protected final double ambientConductance;

    protected final double minExhaustEnthalpy;

    protected final double maxExhaustEnthalpy;

    protected AbstractExpanderModel(AbstractBuilder<?> builder) {
        this.volume = checkNonNegative(builder.volume, "volume");
        this.sweptVolume = checkPositive(builder.sweptVolume, "swept volume");
        this.ambientConductance = checkNonNegative(builder.ambientConductance, "ambient heat transfer conductance");
        this.minExhaustEnthalpy = builder.minExhaustEnthalpy;
        this.maxExhaustEnthalpy = builder.maxExhaustEnthalpy;
        if (minExhaustEnthalpy >= maxExhaustEnthalpy) {
            throw new IllegalArgumentException("Invalid exhaust enthalpy range: [" + minExhaustEnthalpy + ", " + maxExhaustEnthalpy + "]");
        }
    }

    static double checkPositive(double value, String name) {
        if (!(value > 0) || Double.isInfinite(value)) {
            throw new IllegalArgumentException("Invalid " + name + " value: " + value);
        }
        return value;
    }

    static double checkNonNegative(double value, String name) {
        if (!(value >= 0) || Double.isInfinite(value)) {
            throw new IllegalArgumentException("Invalid " + name + " value: " + value);
        }
        return value;
    }

    @Override
    public double getVolume() {
        return volume;
    }

    @Override
    public double getSweptVolume() {
        return sweptVolume;
    }

    public double getAmbientConductance() {
        return ambientConductance;
    }

    @Override
    public double getMinExhaustEnthalpy() {
        return minExhaustEnthalpy;
    }

    @Override
    public double getMaxExhaustEnthalpy() {
        return maxExhaustEnthalpy;
    }

    /**
     * Rotational speed in rpm swallowing the mass flow at the given density.
     */
    protected double speed(double massFlow, double fillingFactor, double density) {
        return SECONDS_PER_MINUTE * massFlow / (sweptVolume * fillingFactor * density);
    }

    /**
     * Operating point of the efficiency based models: shaft power from the isentropic efficiency, ambient losses
     * from the supply temperature.
     */
    protected ExpanderSolution efficiencySolution(ExpanderSolvingContext context, double isentropicEfficiency,
                                                  double fillingFactor, double speed, RootFinderResult speedResult) {
        double massFlow = context.getMassFlow();
        double power = context.getIsentropicPower() * isentropicEfficiency;
        double ambientHeat = Math.max(0, ambientConductance * (context.getSupplyTemperature() - context.getAmbientTemperature()));
        double exhaustEnthalpy = context.getSupplyEnthalpy() - (power + ambientHeat) / massFlow;
        double residual = speedResult != null ? speedResult.getResidual() : 0;
        boolean converged = speedResult == null
                || speedResult.isConverged() && Math.abs(residual) < context.getParameters().getSpeedResidualThreshold();
        ExpanderSolverStatus status = converged && context.isValidExhaustEnthalpy(exhaustEnthalpy)
                ? ExpanderSolverStatus.CONVERGED : ExpanderSolverStatus.NOT_CONVERGED;
        return new ExpanderSolution(status, exhaustEnthalpy, speed, power, ambientHeat, isentropicEfficiency,
                fillingFactor, Double.NaN, residual, null);
    }

    public abstract static class AbstractBuilder<B extends AbstractBuilder<B>> {

        private double volume = 0;

        private double sweptVolume = Double.NaN;

        private double ambientConductance = 0;

        private double minExhaustEnthalpy = Double.NaN;

        private double maxExhaustEnthalpy = Double.NaN;

        protected abstract B self();

        public B setVolume(double volume) {
            this.volume = volume;
            return self();
        }

        public B setSweptVolume(double sweptVolume) {
            this.sweptVolume = sweptVolume;
            return self();
        }

        public B setAmbientConductance(double ambientConductance) {
            this.ambientConductance = ambientConductance;
            return self();
        }

        public B setExhaustEnthalpyRange(double minExhaustEnthalpy, double maxExhaustEnthalpy) {
            this.minExhaustEnthalpy = minExhaustEnthalpy;
            this.maxExhaustEnthalpy = maxExhaustEnthalpy;
            return self();
        }
    }
}
