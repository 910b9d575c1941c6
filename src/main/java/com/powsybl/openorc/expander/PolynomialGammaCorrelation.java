/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openorc.expander;

import java.util.Objects;

/**
 * @author Open ORC developers
 */
class PolynomialGammaCorrelation implements GammaCorrelation {

    private static final double PRESSURE_SCALE = 1e5;

    private static final double TEMPERATURE_SCALE = 1e2;

    private final BivariatePolynomial pressureTemperature;

    private final BivariatePolynomial pressureQuality;

    PolynomialGammaCorrelation(BivariatePolynomial pressureTemperature, BivariatePolynomial pressureQuality) {
        this.pressureTemperature = Objects.requireNonNull(pressureTemperature);
        this.pressureQuality = Objects.requireNonNull(pressureQuality);
    }

    @Override
    public double singlePhase(double pressure, double temperature) {
        return pressureTemperature.value(pressure / PRESSURE_SCALE, temperature / TEMPERATURE_SCALE);
    }

    @Override
    public double twoPhase(double pressure, double quality) {
        return pressureQuality.value(pressure / PRESSURE_SCALE, quality);
    }

    @Override
    public String toString() {
        return "PolynomialGammaCorrelation(pt=" + pressureTemperature + ", pq=" + pressureQuality + ")";
    }
}
