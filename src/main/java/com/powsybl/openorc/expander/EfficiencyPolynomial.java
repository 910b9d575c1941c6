/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openorc.expander;

import java.util.Arrays;
import java.util.Objects;

/**
 * Second order polynomial of the pressure ratio Rp and the supply density rho, optionally extended with the speed N.
 * Terms are ordered as 1, Rp, rho, Rp^2, Rp rho, rho^2, then N, N^2, N Rp, N rho.
 *
 * @author Open ORC developers
 */
public final class EfficiencyPolynomial {

    public static final int PRESSURE_DENSITY_TERM_COUNT = 6;

    public static final int SPEED_TERM_COUNT = 10;

    private final double[] coefficients;

    public EfficiencyPolynomial(double... coefficients) {
        Objects.requireNonNull(coefficients);
        if (coefficients.length != PRESSURE_DENSITY_TERM_COUNT && coefficients.length != SPEED_TERM_COUNT) {
            throw new IllegalArgumentException("Invalid polynomial coefficient count: " + coefficients.length);
        }
        this.coefficients = coefficients.clone();
    }

    public boolean dependsOnSpeed() {
        return coefficients.length == SPEED_TERM_COUNT;
    }

    public double value(double pressureRatio, double density, double speed) {
        double rp = pressureRatio;
        double rho = density;
        double value = coefficients[0] + coefficients[1] * rp + coefficients[2] * rho
                + coefficients[3] * rp * rp + coefficients[4] * rp * rho + coefficients[5] * rho * rho;
        if (dependsOnSpeed()) {
            value += coefficients[6] * speed + coefficients[7] * speed * speed
                    + coefficients[8] * speed * rp + coefficients[9] * speed * rho;
        }
        return value;
    }

    public double[] getCoefficients() {
        return coefficients.clone();
    }

    @Override
    public String toString() {
        return "EfficiencyPolynomial(" + Arrays.toString(coefficients) + ")";
    }
}
