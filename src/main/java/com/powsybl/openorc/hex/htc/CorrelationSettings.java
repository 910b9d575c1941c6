/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openorc.hex.htc;

import java.util.Objects;

/**
 * Heat transfer correlations of one exchanger side, with their scaling factors. Each correlation is multiplied by
 * a factor and its Reynolds exponent by an exponent factor, both equal to 1 by default.
 *
 * @author Open ORC developers
 */
public final class CorrelationSettings {

    public static final double DEFAULT_FACTOR = 1;

    private final ChannelGeometry geometry;

    private final SinglePhaseCorrelation singlePhaseCorrelation;

    private final TwoPhaseCorrelation twoPhaseCorrelation;

    private final double singlePhaseFactor;

    private final double singlePhaseExponentFactor;

    private final double twoPhaseFactor;

    private final double twoPhaseExponentFactor;

    private final double singlePhaseManualCoefficient;

    private final double twoPhaseManualCoefficient;

    private CorrelationSettings(Builder builder) {
        this.geometry = builder.geometry;
        this.singlePhaseCorrelation = Objects.requireNonNull(builder.singlePhaseCorrelation);
        this.twoPhaseCorrelation = Objects.requireNonNull(builder.twoPhaseCorrelation);
        this.singlePhaseFactor = checkFactor(builder.singlePhaseFactor);
        this.singlePhaseExponentFactor = checkFactor(builder.singlePhaseExponentFactor);
        this.twoPhaseFactor = checkFactor(builder.twoPhaseFactor);
        this.twoPhaseExponentFactor = checkFactor(builder.twoPhaseExponentFactor);
        this.singlePhaseManualCoefficient = builder.singlePhaseManualCoefficient;
        this.twoPhaseManualCoefficient = builder.twoPhaseManualCoefficient;
        if (singlePhaseCorrelation == SinglePhaseCorrelation.MANUAL && !(singlePhaseManualCoefficient > 0)) {
            throw new IllegalArgumentException("Invalid single-phase manual coefficient value: " + singlePhaseManualCoefficient);
        }
        if (twoPhaseCorrelation == TwoPhaseCorrelation.MANUAL && !(twoPhaseManualCoefficient > 0)) {
            throw new IllegalArgumentException("Invalid two-phase manual coefficient value: " + twoPhaseManualCoefficient);
        }
    }

    private static double checkFactor(double factor) {
        if (!(factor > 0) || Double.isInfinite(factor)) {
            throw new IllegalArgumentException("Invalid correlation factor value: " + factor);
        }
        return factor;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @throws NullPointerException if no geometry is configured, which is only allowed with manual coefficients
     */
    public ChannelGeometry getGeometry() {
        return Objects.requireNonNull(geometry, "Channel geometry is missing");
    }

    public SinglePhaseCorrelation getSinglePhaseCorrelation() {
        return singlePhaseCorrelation;
    }

    public TwoPhaseCorrelation getTwoPhaseCorrelation() {
        return twoPhaseCorrelation;
    }

    public double getSinglePhaseFactor() {
        return singlePhaseFactor;
    }

    public double getSinglePhaseExponentFactor() {
        return singlePhaseExponentFactor;
    }

    public double getTwoPhaseFactor() {
        return twoPhaseFactor;
    }

    public double getTwoPhaseExponentFactor() {
        return twoPhaseExponentFactor;
    }

    public double getSinglePhaseManualCoefficient() {
        return singlePhaseManualCoefficient;
    }

    public double getTwoPhaseManualCoefficient() {
        return twoPhaseManualCoefficient;
    }

    public static final class Builder {

        private ChannelGeometry geometry;

        private SinglePhaseCorrelation singlePhaseCorrelation = SinglePhaseCorrelation.MARTIN;

        private TwoPhaseCorrelation twoPhaseCorrelation = TwoPhaseCorrelation.MANUAL;

        private double singlePhaseFactor = DEFAULT_FACTOR;

        private double singlePhaseExponentFactor = DEFAULT_FACTOR;

        private double twoPhaseFactor = DEFAULT_FACTOR;

        private double twoPhaseExponentFactor = DEFAULT_FACTOR;

        private double singlePhaseManualCoefficient = Double.NaN;

        private double twoPhaseManualCoefficient = Double.NaN;

        private Builder() {
        }

        public Builder setGeometry(ChannelGeometry geometry) {
            this.geometry = geometry;
            return this;
        }

        public Builder setSinglePhaseCorrelation(SinglePhaseCorrelation singlePhaseCorrelation) {
            this.singlePhaseCorrelation = singlePhaseCorrelation;
            return this;
        }

        public Builder setTwoPhaseCorrelation(TwoPhaseCorrelation twoPhaseCorrelation) {
            this.twoPhaseCorrelation = twoPhaseCorrelation;
            return this;
        }

        public Builder setSinglePhaseFactor(double singlePhaseFactor) {
            this.singlePhaseFactor = singlePhaseFactor;
            return this;
        }

        public Builder setSinglePhaseExponentFactor(double singlePhaseExponentFactor) {
            this.singlePhaseExponentFactor = singlePhaseExponentFactor;
            return this;
        }

        public Builder setTwoPhaseFactor(double twoPhaseFactor) {
            this.twoPhaseFactor = twoPhaseFactor;
            return this;
        }

        public Builder setTwoPhaseExponentFactor(double twoPhaseExponentFactor) {
            this.twoPhaseExponentFactor = twoPhaseExponentFactor;
            return this;
        }

        public Builder setSinglePhaseManualCoefficient(double singlePhaseManualCoefficient) {
            this.singlePhaseManualCoefficient = singlePhaseManualCoefficient;
            return this;
        }

        public Builder setTwoPhaseManualCoefficient(double twoPhaseManualCoefficient) {
            this.twoPhaseManualCoefficient = twoPhaseManualCoefficient;
            return this;
        }

        public CorrelationSettings build() {
            return new CorrelationSettings(this);
        }
    }
}
