/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openorc.hex.htc;

/**
 * Flow channel geometry of one side of an exchanger, used by the heat transfer correlations and by the void fraction
 * models. Plate exchanger data (chevron angle, corrugation pitch, enlargement factor, plate length) and finned tube
 * bank data are optional: a correlation needing a missing value throws an {@link IllegalArgumentException}.
 *
 * @author Open ORC developers
 */
public final class ChannelGeometry {

    private final double hydraulicDiameter;

    private final double crossSection;

    private final int channelCount;

    private final double chevronAngle;

    private final double corrugationPitch;

    private final double enlargementFactor;

    private final double plateLength;

    private final double tubeLength;

    private final double finAreaRatio;

    private final int tubeRowCount;

    private final double finPitch;

    private final double longitudinalTubePitch;

    private final double finnedHydraulicDiameter;

    private ChannelGeometry(Builder builder) {
        this.hydraulicDiameter = builder.hydraulicDiameter;
        this.crossSection = builder.crossSection;
        this.channelCount = builder.channelCount;
        this.chevronAngle = builder.chevronAngle;
        this.corrugationPitch = builder.corrugationPitch;
        this.enlargementFactor = builder.enlargementFactor;
        this.plateLength = builder.plateLength;
        this.tubeLength = builder.tubeLength;
        this.finAreaRatio = builder.finAreaRatio;
        this.tubeRowCount = builder.tubeRowCount;
        this.finPitch = builder.finPitch;
        this.longitudinalTubePitch = builder.longitudinalTubePitch;
        this.finnedHydraulicDiameter = builder.finnedHydraulicDiameter;
    }

    public static Builder builder() {
        return new Builder();
    }

    private static double require(double value, String name) {
        if (!(value > 0) || Double.isInfinite(value)) {
            throw new IllegalArgumentException("Invalid or missing channel geometry " + name + " value: " + value);
        }
        return value;
    }

    /**
     * Hydraulic diameter, or outer tube diameter for finned tube banks.
     */
    public double getHydraulicDiameter() {
        return require(hydraulicDiameter, "hydraulicDiameter");
    }

    public double getCrossSection() {
        return require(crossSection, "crossSection");
    }

    public int getChannelCount() {
        return channelCount;
    }

    /**
     * Mass flux per channel.
     */
    public double massFlux(double massFlow) {
        return massFlow / channelCount / getCrossSection();
    }

    /**
     * Chevron angle in radians.
     */
    public double getChevronAngle() {
        return require(chevronAngle, "chevronAngle");
    }

    public double getCorrugationPitch() {
        return require(corrugationPitch, "corrugationPitch");
    }

    public double getEnlargementFactor() {
        return require(enlargementFactor, "enlargementFactor");
    }

    public double getPlateLength() {
        return require(plateLength, "plateLength");
    }

    public double getTubeLength() {
        return require(tubeLength, "tubeLength");
    }

    /**
     * Ratio of the finned surface to the bare tube surface.
     */
    public double getFinAreaRatio() {
        return require(finAreaRatio, "finAreaRatio");
    }

    public int getTubeRowCount() {
        return (int) require(tubeRowCount, "tubeRowCount");
    }

    public double getFinPitch() {
        return require(finPitch, "finPitch");
    }

    public double getLongitudinalTubePitch() {
        return require(longitudinalTubePitch, "longitudinalTubePitch");
    }

    /**
     * Actual hydraulic diameter of a finned tube bank, the outer tube diameter being {@link #getHydraulicDiameter()}.
     */
    public double getFinnedHydraulicDiameter() {
        return require(finnedHydraulicDiameter, "finnedHydraulicDiameter");
    }

    public static final class Builder {

        private double hydraulicDiameter = Double.NaN;

        private double crossSection = Double.NaN;

        private int channelCount = 1;

        private double chevronAngle = Double.NaN;

        private double corrugationPitch = Double.NaN;

        private double enlargementFactor = Double.NaN;

        private double plateLength = Double.NaN;

        private double tubeLength = Double.NaN;

        private double finAreaRatio = Double.NaN;

        private int tubeRowCount = 0;

        private double finPitch = Double.NaN;

        private double longitudinalTubePitch = Double.NaN;

        private double finnedHydraulicDiameter = Double.NaN;

        private Builder() {
        }

        public Builder setHydraulicDiameter(double hydraulicDiameter) {
            this.hydraulicDiameter = hydraulicDiameter;
            return this;
        }

        public Builder setCrossSection(double crossSection) {
            this.crossSection = crossSection;
            return this;
        }

        public Builder setChannelCount(int channelCount) {
            if (channelCount < 1) {
                throw new IllegalArgumentException("Invalid channel count value: " + channelCount);
            }
            this.channelCount = channelCount;
            return this;
        }

        public Builder setChevronAngle(double chevronAngle) {
            this.chevronAngle = chevronAngle;
            return this;
        }

        public Builder setCorrugationPitch(double corrugationPitch) {
            this.corrugationPitch = corrugationPitch;
            return this;
        }

        public Builder setEnlargementFactor(double enlargementFactor) {
            this.enlargementFactor = enlargementFactor;
            return this;
        }

        public Builder setPlateLength(double plateLength) {
            this.plateLength = plateLength;
            return this;
        }

        public Builder setTubeLength(double tubeLength) {
            this.tubeLength = tubeLength;
            return this;
        }

        public Builder setFinAreaRatio(double finAreaRatio) {
            this.finAreaRatio = finAreaRatio;
            return this;
        }

        public Builder setTubeRowCount(int tubeRowCount) {
            this.tubeRowCount = tubeRowCount;
            return this;
        }

        public Builder setFinPitch(double finPitch) {
            this.finPitch = finPitch;
            return this;
        }

        public Builder setLongitudinalTubePitch(double longitudinalTubePitch) {
            this.longitudinalTubePitch = longitudinalTubePitch;
            return this;
        }

        public Builder setFinnedHydraulicDiameter(double finnedHydraulicDiameter) {
            this.finnedHydraulicDiameter = finnedHydraulicDiameter;
            return this;
        }

        public ChannelGeometry build() {
            return new ChannelGeometry(this);
        }
    }
}
