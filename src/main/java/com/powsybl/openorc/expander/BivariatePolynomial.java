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
 * Polynomial in two variables: sum of c[i][j] x^i y^j.
 *
 * @author Open ORC developers
 */
public final class BivariatePolynomial {

    private final double[][] coefficients;

    public BivariatePolynomial(double[][] coefficients) {
        Objects.requireNonNull(coefficients);
        if (coefficients.length == 0) {
            throw new IllegalArgumentException("Empty polynomial coefficients");
        }
        this.coefficients = new double[coefficients.length][];
        for (int i = 0; i < coefficients.length; i++) {
            this.coefficients[i] = Objects.requireNonNull(coefficients[i]).clone();
        }
    }

    public double value(double x, double y) {
        // Horner on x, then on y
        double result = 0;
        for (int i = coefficients.length - 1; i >= 0; i--) {
            double[] row = coefficients[i];
            double rowValue = 0;
            for (int j = row.length - 1; j >= 0; j--) {
                rowValue = rowValue * y + row[j];
            }
            result = result * x + rowValue;
        }
        return result;
    }

    @Override
    public String toString() {
        return "BivariatePolynomial(" + Arrays.deepToString(coefficients) + ")";
    }
}
