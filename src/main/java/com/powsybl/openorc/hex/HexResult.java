/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openorc.hex;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Result of a heat exchanger solve. Profile points and zones are ordered from the hot outlet to the hot inlet.
 * <p>
 * When the solver swapped the stream roles because the declared hot stream was the colder one, every output is
 * given back in the declared roles and {@link #isReversed()} is true.
 *
 * @author Open ORC developers
 */
public class HexResult {

    private final HexSolverStatus status;

    private final boolean reversed;

    private final double duty;

    private final double maxDuty;

    private final double residual;

    private final double hotExitEnthalpy;

    private final double hotExitTemperature;

    private final double coldExitEnthalpy;

    private final double coldExitTemperature;

    private final double pinch;

    private final List<HexProfilePoint> points;

    private final List<HexZoneResult> zones;

    private final Map<Phase, Double> hotMeanCoefficients;

    private final Map<Phase, Double> coldMeanCoefficients;

    private HexResult(Builder builder) {
        this.status = Objects.requireNonNull(builder.status);
        this.reversed = builder.reversed;
        this.duty = builder.duty;
        this.maxDuty = builder.maxDuty;
        this.residual = builder.residual;
        this.hotExitEnthalpy = builder.hotExitEnthalpy;
        this.hotExitTemperature = builder.hotExitTemperature;
        this.coldExitEnthalpy = builder.coldExitEnthalpy;
        this.coldExitTemperature = builder.coldExitTemperature;
        this.points = List.copyOf(builder.points);
        this.zones = List.copyOf(builder.zones);
        this.pinch = builder.pinch;
        this.hotMeanCoefficients = meanCoefficients(zones, Side.HOT);
        this.coldMeanCoefficients = meanCoefficients(zones, Side.COLD);
    }

    private static Map<Phase, Double> meanCoefficients(List<HexZoneResult> zones, Side side) {
        Map<Phase, Double> means = new EnumMap<>(Phase.class);
        for (Phase phase : Phase.values()) {
            means.put(phase, zones.stream()
                    .filter(zone -> zone.phase(side) == phase)
                    .mapToDouble(zone -> zone.coefficient(side))
                    .average()
                    .orElse(Double.NaN));
        }
        return Collections.unmodifiableMap(means);
    }

    static Builder builder(HexSolverStatus status) {
        return new Builder(status);
    }

    /**
     * Result without any valid output.
     */
    static HexResult failed(HexSolverStatus status, boolean reversed) {
        return builder(status).setReversed(reversed).build();
    }

    public HexSolverStatus getStatus() {
        return status;
    }

    public int getFlag() {
        return status.getFlag();
    }

    public boolean isReversed() {
        return reversed;
    }

    public double getDuty() {
        return duty;
    }

    public double getMaxDuty() {
        return maxDuty;
    }

    /**
     * Duty over maximum duty.
     */
    public double getThermalEfficiency() {
        return duty / maxDuty;
    }

    /**
     * Residual of the equation solved by the model: relative area mismatch for area matching models, relative pinch
     * mismatch for the fixed pinch model, 0 for closed form models.
     */
    public double getResidual() {
        return residual;
    }

    public double getHotExitEnthalpy() {
        return hotExitEnthalpy;
    }

    public double getHotExitTemperature() {
        return hotExitTemperature;
    }

    public double getColdExitEnthalpy() {
        return coldExitEnthalpy;
    }

    public double getColdExitTemperature() {
        return coldExitTemperature;
    }

    /**
     * Smallest temperature difference between the warmer and the colder stream.
     */
    public double getPinch() {
        return pinch;
    }

    public List<HexProfilePoint> getPoints() {
        return points;
    }

    public List<HexZoneResult> getZones() {
        return zones;
    }

    public double getMass(Side side) {
        return zones.stream().mapToDouble(zone -> zone.mass(side)).sum();
    }

    public double getHotMass() {
        return getMass(Side.HOT);
    }

    public double getColdMass() {
        return getMass(Side.COLD);
    }

    /**
     * Arithmetic mean of the zone convective coefficients of a side in a regime, NaN if no zone is in this regime.
     */
    public double getMeanCoefficient(Side side, Phase phase) {
        return (side == Side.HOT ? hotMeanCoefficients : coldMeanCoefficients).get(phase);
    }

    HexResult reversed() {
        List<HexProfilePoint> reversedPoints = new ArrayList<>(points.size());
        for (int i = points.size() - 1; i >= 0; i--) {
            reversedPoints.add(points.get(i).reversed());
        }
        List<HexZoneResult> reversedZones = new ArrayList<>(zones.size());
        for (int i = zones.size() - 1; i >= 0; i--) {
            reversedZones.add(zones.get(i).reversed(zones.size() - 1 - i));
        }
        return builder(status)
                .setReversed(!reversed)
                .setDuty(duty)
                .setMaxDuty(maxDuty)
                .setResidual(residual)
                .setPinch(pinch)
                .setHotExit(coldExitEnthalpy, coldExitTemperature)
                .setColdExit(hotExitEnthalpy, hotExitTemperature)
                .setPoints(reversedPoints)
                .setZones(reversedZones)
                .build();
    }

    @Override
    public String toString() {
        return "HexResult(status=" + status
                + ", reversed=" + reversed
                + ", duty=" + duty
                + ", maxDuty=" + maxDuty
                + ", residual=" + residual
                + ", pinch=" + pinch
                + ")";
    }

    static final class Builder {

        private final HexSolverStatus status;

        private boolean reversed;

        private double duty = Double.NaN;

        private double maxDuty = Double.NaN;

        private double residual = Double.NaN;

        private double pinch = Double.NaN;

        private double hotExitEnthalpy = Double.NaN;

        private double hotExitTemperature = Double.NaN;

        private double coldExitEnthalpy = Double.NaN;

        private double coldExitTemperature = Double.NaN;

        private List<HexProfilePoint> points = Collections.emptyList();

        private List<HexZoneResult> zones = Collections.emptyList();

        private Builder(HexSolverStatus status) {
            this.status = status;
        }

        Builder setReversed(boolean reversed) {
            this.reversed = reversed;
            return this;
        }

        Builder setDuty(double duty) {
            this.duty = duty;
            return this;
        }

        Builder setMaxDuty(double maxDuty) {
            this.maxDuty = maxDuty;
            return this;
        }

        Builder setResidual(double residual) {
            this.residual = residual;
            return this;
        }

        Builder setPinch(double pinch) {
            this.pinch = pinch;
            return this;
        }

        Builder setHotExit(double enthalpy, double temperature) {
            this.hotExitEnthalpy = enthalpy;
            this.hotExitTemperature = temperature;
            return this;
        }

        Builder setColdExit(double enthalpy, double temperature) {
            this.coldExitEnthalpy = enthalpy;
            this.coldExitTemperature = temperature;
            return this;
        }

        Builder setPoints(List<HexProfilePoint> points) {
            this.points = Objects.requireNonNull(points);
            return this;
        }

        Builder setZones(List<HexZoneResult> zones) {
            this.zones = Objects.requireNonNull(zones);
            return this;
        }

        HexResult build() {
            return new HexResult(this);
        }
    }
}
