/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openorc.expander;

/**
 * Heat capacity ratio of the working fluid at the supply of the leakage throat.
 *
 * @author Open ORC developers
 */
public interface GammaCorrelation {

    /**
     * @param pressure pressure in Pa
     * @param temperature temperature in K
     */
    double singlePhase(double pressure, double temperature);

    /**
     * @param pressure pressure in Pa
     * @param quality vapour quality
     */
    double twoPhase(double pressure, double quality);

    static GammaCorrelation constant(double gamma) {
        if (!(gamma > 1) || Double.isInfinite(gamma)) {
            throw new IllegalArgumentException("Invalid heat capacity ratio value: " + gamma);
        }
        return new GammaCorrelation() {
            @Override
            public double singlePhase(double pressure, double temperature) {
                return gamma;
            }

            @Override
            public double twoPhase(double pressure, double quality) {
                return gamma;
            }

            @Override
            public String toString() {
                return "ConstantGamma(" + gamma + ")";
            }
        };
    }

    /**
     * Fitted correlation: single phase polynomial of (P [bar], T [hK]), two-phase polynomial of (P [bar], q).
     */
    static GammaCorrelation polynomial(BivariatePolynomial pressureTemperature, BivariatePolynomial pressureQuality) {
        return new PolynomialGammaCorrelation(pressureTemperature, pressureQuality);
    }
}
