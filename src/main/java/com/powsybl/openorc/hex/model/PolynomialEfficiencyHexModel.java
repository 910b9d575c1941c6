/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openorc.hex.model;

import java.util.Arrays;
import java.util.Objects;

/**
 * Duty equal to a fraction of the maximum duty given by a second order polynomial of the mass flow rates
 * normalized by their nominal values:
 * c1 + c2 x + c3 y + c4 x^2 + c5 x y + c6 y^2, x being the hot flow ratio and y the cold one.
 * The fraction is clamped to [1e-5, 1].
 *
 * @author Open ORC developers
 */
public class PolynomialEfficiencyHexModel extends AbstractHexModel {

    public static final int COEFFICIENT_COUNT = 6;

    private static final double MIN_FRACTION = 1e-5;

    private final double[] coefficients;

    private final double nominalHotMassFlow;

    private final double nominalColdMassFlow;

    public PolynomialEfficiencyHexModel(double[] coefficients, double nominalHotMassFlow, double nominalColdMassFlow,
                                        HexVolumes volumes) {
        super(volumes);
        Objects.requireNonNull(coefficients);
        if (coefficients.length != COEFFICIENT_COUNT) {
            throw new IllegalArgumentException("Invalid polynomial coefficient count: " + coefficients.length);
        }
        this.coefficients = coefficients.clone();
        this.nominalHotMassFlow = checkNominalMassFlow(nominalHotMassFlow);
        this.nominalColdMassFlow = checkNominalMassFlow(nominalColdMassFlow);
    }

    private static double checkNominalMassFlow(double massFlow) {
        if (!(massFlow > 0) || Double.isInfinite(massFlow)) {
            throw new IllegalArgumentException("Invalid nominal mass flow value: " + massFlow);
        }
        return massFlow;
    }

    public double[] getCoefficients() {
        return coefficients.clone();
    }

    public double getNominalHotMassFlow() {
        return nominalHotMassFlow;
    }

    public double getNominalColdMassFlow() {
        return nominalColdMassFlow;
    }

    @Override
    public HexModelType getType() {
        return HexModelType.POLYNOMIAL_EFFICIENCY;
    }

    public double fraction(double hotMassFlow, double coldMassFlow) {
        double x = hotMassFlow / nominalHotMassFlow;
        double y = coldMassFlow / nominalColdMassFlow;
        double c = coefficients[0] + coefficients[1] * x + coefficients[2] * y
                + coefficients[3] * x * x + coefficients[4] * x * y + coefficients[5] * y * y;
        return Math.max(MIN_FRACTION, Math.min(1, c));
    }

    @Override
    public PolynomialEfficiencyHexModel withSwappedSides() {
        double[] swapped = {coefficients[0], coefficients[2], coefficients[1], coefficients[5], coefficients[4], coefficients[3]};
        return new PolynomialEfficiencyHexModel(swapped, nominalColdMassFlow, nominalHotMassFlow, volumes.swapped());
    }

    @Override
    public DutySolution solveDuty(HexSolvingContext context) {
        double fraction = fraction(context.getHot().getMassFlow(), context.getCold().getMassFlow());
        return FixedEfficiencyHexModel.solveFraction(context, fraction);
    }

    @Override
    public String toString() {
        return "PolynomialEfficiencyHexModel(coefficients=" + Arrays.toString(coefficients)
                + ", nominalHotMassFlow=" + nominalHotMassFlow
                + ", nominalColdMassFlow=" + nominalColdMassFlow
                + ")";
    }
}
