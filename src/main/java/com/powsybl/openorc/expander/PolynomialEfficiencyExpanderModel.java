/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openorc.expander;

import com.powsybl.openorc.solver.RootFinderResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Expander whose filling factor and isentropic efficiency are polynomials of the pressure ratio, the supply density
 * and possibly the speed. When the filling factor depends on the speed, the speed is the root of
 * 1 - N / N'(N), N' being the speed swallowing the mass flow with the filling factor at N.
 *
 * @author Open ORC developers
 */
public class PolynomialEfficiencyExpanderModel extends AbstractExpanderModel {

    private static final Logger LOGGER = LoggerFactory.getLogger(PolynomialEfficiencyExpanderModel.class);

    public static final double MIN_FILLING_FACTOR = 0.2;

    public static final double MAX_FILLING_FACTOR = 5;

    public static final double MAX_REPORTED_FILLING_FACTOR = 10;

    public static final double MIN_ISENTROPIC_EFFICIENCY = 0.01;

    private final EfficiencyPolynomial isentropicEfficiency;

    private final EfficiencyPolynomial fillingFactor;

    private PolynomialEfficiencyExpanderModel(Builder builder) {
        super(builder);
        this.isentropicEfficiency = Objects.requireNonNull(builder.isentropicEfficiency, "Isentropic efficiency polynomial is missing");
        this.fillingFactor = Objects.requireNonNull(builder.fillingFactor, "Filling factor polynomial is missing");
    }

    public static Builder builder() {
        return new Builder();
    }

    public EfficiencyPolynomial getIsentropicEfficiency() {
        return isentropicEfficiency;
    }

    public EfficiencyPolynomial getFillingFactor() {
        return fillingFactor;
    }

    @Override
    public ExpanderModelType getType() {
        return ExpanderModelType.POLYNOMIAL_EFFICIENCY;
    }

    public double fillingFactor(double pressureRatio, double density, double speed) {
        return Math.max(MIN_FILLING_FACTOR, Math.min(MAX_FILLING_FACTOR, fillingFactor.value(pressureRatio, density, speed)));
    }

    /**
     * Filling factor reported at the solved speed, with a wider upper clamp than the one bounding the speed search.
     */
    public double reportedFillingFactor(double pressureRatio, double density, double speed) {
        return Math.max(MIN_FILLING_FACTOR, Math.min(MAX_REPORTED_FILLING_FACTOR, fillingFactor.value(pressureRatio, density, speed)));
    }

    public double isentropicEfficiency(double pressureRatio, double density, double speed) {
        return Math.max(MIN_ISENTROPIC_EFFICIENCY, Math.min(1, isentropicEfficiency.value(pressureRatio, density, speed)));
    }

    @Override
    public ExpanderSolution solve(ExpanderSolvingContext context) {
        double massFlow = context.getMassFlow();
        double density = context.getSupplyDensity();
        double pressureRatio = context.getPressureRatio();

        double minSpeed = speed(massFlow, MAX_FILLING_FACTOR, density);
        double maxSpeed = speed(massFlow, MIN_FILLING_FACTOR, density);
        RootFinderResult result = context.getRootFinder().solve(
            n -> 1 - n / speed(massFlow, fillingFactor(pressureRatio, density, n), density),
            minSpeed, maxSpeed, minSpeed * context.getParameters().getSpeedResidualThreshold(),
            context.getParameters().getSpeedResidualThreshold());
        double speed = result.getRoot();
        if (!result.isConverged()) {
            LOGGER.warn("Expander speed not found: {}", result);
        }
        LOGGER.debug("Expander speed {} rpm in [{}, {}] after {} evaluations", speed, minSpeed, maxSpeed, result.getEvaluations());

        return efficiencySolution(context, isentropicEfficiency(pressureRatio, density, speed),
                reportedFillingFactor(pressureRatio, density, speed), speed, result);
    }

    @Override
    public String toString() {
        return "PolynomialEfficiencyExpanderModel(isentropicEfficiency=" + isentropicEfficiency
                + ", fillingFactor=" + fillingFactor
                + ", sweptVolume=" + sweptVolume
                + ")";
    }

    public static final class Builder extends AbstractBuilder<Builder> {

        private EfficiencyPolynomial isentropicEfficiency;

        private EfficiencyPolynomial fillingFactor;

        private Builder() {
        }

        @Override
        protected Builder self() {
            return this;
        }

        public Builder setIsentropicEfficiency(EfficiencyPolynomial isentropicEfficiency) {
            this.isentropicEfficiency = isentropicEfficiency;
            return this;
        }

        public Builder setFillingFactor(EfficiencyPolynomial fillingFactor) {
            this.fillingFactor = fillingFactor;
            return this;
        }

        public PolynomialEfficiencyExpanderModel build() {
            return new PolynomialEfficiencyExpanderModel(this);
        }
    }
}
