/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openorc.expander;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Result of an expander solve. Unavailable outputs are NaN.
 *
 * @author Open ORC developers
 */
public class ExpanderResult {

    private final ExpanderSolverStatus status;

    private final double wallTemperature;

    private final double exhaustEnthalpy;

    private final double exhaustTemperature;

    private final double speed;

    private final double power;

    private final double isentropicPower;

    private final double ambientHeat;

    private final double isentropicEfficiency;

    private final double fillingFactor;

    private final double mass;

    private final double residual;

    private final List<TsPoint> tsPoints;

    private final ExpanderInternalState internalState;

    private ExpanderResult(Builder builder) {
        this.status = Objects.requireNonNull(builder.status);
        this.wallTemperature = builder.wallTemperature;
        this.exhaustEnthalpy = builder.exhaustEnthalpy;
        this.exhaustTemperature = builder.exhaustTemperature;
        this.speed = builder.speed;
        this.power = builder.power;
        this.isentropicPower = builder.isentropicPower;
        this.ambientHeat = builder.ambientHeat;
        this.isentropicEfficiency = builder.isentropicEfficiency;
        this.fillingFactor = builder.fillingFactor;
        this.mass = builder.mass;
        this.residual = builder.residual;
        this.tsPoints = List.copyOf(builder.tsPoints);
        this.internalState = builder.internalState;
    }

    static Builder builder(ExpanderSolverStatus status) {
        return new Builder(status);
    }

    static ExpanderResult failed(ExpanderSolverStatus status) {
        return builder(status).build();
    }

    public ExpanderSolverStatus getStatus() {
        return status;
    }

    public int getFlag() {
        return status.getFlag();
    }

    /**
     * Wall temperature of the semi-empirical model, NaN for the other models.
     */
    public double getWallTemperature() {
        return wallTemperature;
    }

    public double getExhaustEnthalpy() {
        return exhaustEnthalpy;
    }

    public double getExhaustTemperature() {
        return exhaustTemperature;
    }

    /**
     * Rotational speed in rpm.
     */
    public double getSpeed() {
        return speed;
    }

    /**
     * Shaft power in W.
     */
    public double getPower() {
        return power;
    }

    public double getIsentropicPower() {
        return isentropicPower;
    }

    /**
     * Heat lost to the ambient, positive when leaving the machine.
     */
    public double getAmbientHeat() {
        return ambientHeat;
    }

    public double getIsentropicEfficiency() {
        return isentropicEfficiency;
    }

    public double getFillingFactor() {
        return fillingFactor;
    }

    /**
     * Fluid mass in the internal volume, from the mean of supply and exhaust densities.
     */
    public double getMass() {
        return mass;
    }

    public double getResidual() {
        return residual;
    }

    /**
     * Supply and exhaust points of the temperature-entropy diagram.
     */
    public List<TsPoint> getTsPoints() {
        return tsPoints;
    }

    public Optional<ExpanderInternalState> getInternalState() {
        return Optional.ofNullable(internalState);
    }

    @Override
    public String toString() {
        return "ExpanderResult(status=" + status
                + ", speed=" + speed
                + ", power=" + power
                + ", exhaustEnthalpy=" + exhaustEnthalpy
                + ", exhaustTemperature=" + exhaustTemperature
                + ", wallTemperature=" + wallTemperature
                + ", residual=" + residual
                + ")";
    }

    static final class Builder {

        private final ExpanderSolverStatus status;

        private double wallTemperature = Double.NaN;

        private double exhaustEnthalpy = Double.NaN;

        private double exhaustTemperature = Double.NaN;

        private double speed = Double.NaN;

        private double power = Double.NaN;

        private double isentropicPower = Double.NaN;

        private double ambientHeat = Double.NaN;

        private double isentropicEfficiency = Double.NaN;

        private double fillingFactor = Double.NaN;

        private double mass = Double.NaN;

        private double residual = Double.NaN;

        private List<TsPoint> tsPoints = List.of();

        private ExpanderInternalState internalState;

        private Builder(ExpanderSolverStatus status) {
            this.status = status;
        }

        Builder setSolution(ExpanderSolution solution) {
            this.wallTemperature = solution.wallTemperature();
            this.exhaustEnthalpy = solution.exhaustEnthalpy();
            this.speed = solution.speed();
            this.power = solution.power();
            this.ambientHeat = solution.ambientHeat();
            this.isentropicEfficiency = solution.isentropicEfficiency();
            this.fillingFactor = solution.fillingFactor();
            this.residual = solution.residual();
            this.internalState = solution.internalState();
            return this;
        }

        Builder setExhaust(double enthalpy, double temperature) {
            this.exhaustEnthalpy = enthalpy;
            this.exhaustTemperature = temperature;
            return this;
        }

        Builder setIsentropicPower(double isentropicPower) {
            this.isentropicPower = isentropicPower;
            return this;
        }

        Builder setMass(double mass) {
            this.mass = mass;
            return this;
        }

        Builder setTsPoints(List<TsPoint> tsPoints) {
            this.tsPoints = Objects.requireNonNull(tsPoints);
            return this;
        }

        ExpanderResult build() {
            return new ExpanderResult(this);
        }
    }
}
