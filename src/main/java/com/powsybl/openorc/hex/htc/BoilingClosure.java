/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openorc.hex.htc;

import com.powsybl.openorc.OpenOrcParameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.DoubleUnaryOperator;

/**
 * Fixed-point iteration of heat flux dependent boiling correlations. Starting from an initial guess of the heat flux
 * dependent variable (boiling number or heat flux), the zone area is computed from the resulting coefficient and the
 * coefficient of the other side, giving a new heat flux and a new guess.
 * <p>
 * The loop is lenient: when the relative change is still above the tolerance after the maximum number of
 * iterations, a warning is logged and the last coefficient is kept.
 *
 * @author Open ORC developers
 */
final class BoilingClosure {

    private static final Logger LOGGER = LoggerFactory.getLogger(BoilingClosure.class);

    private BoilingClosure() {
    }

    /**
     * @param name correlation name, for logging
     * @param initialGuess initial value of the iterated variable
     * @param coefficientAtGuess convective coefficient for a value of the iterated variable
     * @param guessFromHeatFlux iterated variable for a heat flux
     */
    static double solve(String name, ZoneSide zoneSide, double initialGuess, DoubleUnaryOperator coefficientAtGuess,
                        DoubleUnaryOperator guessFromHeatFlux, OpenOrcParameters parameters) {
        double zoneDuty = zoneSide.zoneDuty();
        double lmtd = zoneSide.lmtd();
        if (zoneDuty <= 0 || lmtd <= 0) {
            return coefficientAtGuess.applyAsDouble(initialGuess);
        }
        double otherCoefficient = zoneSide.otherSideCoefficient();
        if (Double.isNaN(otherCoefficient)) {
            throw new IllegalArgumentException("Boiling correlation " + name + " requires the coefficient of the other side");
        }

        double guess = initialGuess;
        double coefficient = Double.NaN;
        double error = Double.POSITIVE_INFINITY;
        int iteration = 0;
        while (iteration < parameters.getBoilingClosureMaxIterations() && error > parameters.getBoilingClosureTolerance()) {
            coefficient = coefficientAtGuess.applyAsDouble(guess);
            double u = 1 / (1 / coefficient + 1 / otherCoefficient);
            double area = zoneDuty / lmtd / u;
            double next = guessFromHeatFlux.applyAsDouble(zoneDuty / area);
            error = Math.abs(next - guess) / guess;
            guess = next;
            iteration++;
        }

        if (error > parameters.getBoilingClosureTolerance()) {
            LOGGER.warn("{} correlation not converged after {} iterations (relative change {}), last coefficient {} kept",
                    name, iteration, error, coefficient);
        } else {
            LOGGER.trace("{} correlation converged in {} iterations", name, iteration);
        }
        return coefficient;
    }
}
