/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openorc.hex.htc;

import com.powsybl.openorc.solver.BrentRootFinder;
import com.powsybl.openorc.solver.RootFinderResult;
import net.jafama.FastMath;
import org.apache.commons.math3.analysis.integration.IterativeLegendreGaussIntegrator;
import org.apache.commons.math3.exception.MaxCountExceededException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Void fraction models, used to compute the liquid weight of two-phase zones, that is the mean liquid volume
 * fraction over a vapour quality interval.
 *
 * @author Open ORC developers
 */
public enum VoidFractionModel {
    HOMOGENEOUS {
        @Override
        public double voidFraction(double quality, TwoPhaseMixture mixture, VoidFractionSettings settings) {
            return slipVoidFraction(quality, mixture, 1);
        }
    },
    ZIVI {
        @Override
        public double voidFraction(double quality, TwoPhaseMixture mixture, VoidFractionSettings settings) {
            return slipVoidFraction(quality, mixture, ziviSlipRatio(mixture));
        }
    },
    /**
     * Hughmark model, implicit in the void fraction.
     */
    HUGHMARK {
        @Override
        public double voidFraction(double quality, TwoPhaseMixture mixture, VoidFractionSettings settings) {
            double beta = slipVoidFraction(quality, mixture, 1);
            double d = mixture.hydraulicDiameter();
            double g = mixture.massFlux();
            double mul = mixture.liquidViscosity();
            double muv = mixture.vaporViscosity();
            double gravityTerm = FastMath.pow(FastMath.pow(g * quality / (mixture.vaporDensity() * beta * (1 - beta)), 2) / (GRAVITY * d), 1. / 8);
            RootFinderResult result = HUGHMARK_ROOT_FINDER.solve(alpha -> {
                double z = FastMath.pow(d * g / (mul + alpha * (muv - mul)), 1. / 6) * gravityTerm;
                double lnZ = FastMath.log(z);
                double lnKh = (((HUGHMARK_COEFFICIENTS[0] * lnZ + HUGHMARK_COEFFICIENTS[1]) * lnZ + HUGHMARK_COEFFICIENTS[2]) * lnZ
                        + HUGHMARK_COEFFICIENTS[3]) * lnZ + HUGHMARK_COEFFICIENTS[4];
                return alpha - FastMath.exp(lnKh) * beta;
            }, 0, 1, HUGHMARK_TOLERANCE, HUGHMARK_TOLERANCE);
            if (Math.abs(result.getResidual()) > 1e-3) {
                LOGGER.warn("Hughmark void fraction not converged at quality {}: residual {}", quality, result.getResidual());
            }
            return result.getRoot();
        }
    },
    LOCKHART_MARTINELLI {
        @Override
        public double voidFraction(double quality, TwoPhaseMixture mixture, VoidFractionSettings settings) {
            double xtt = FastMath.pow((1 - quality) / quality, 0.9)
                    * FastMath.sqrt(FastMath.pow(mixture.liquidViscosity() / mixture.vaporViscosity(), 0.1) * mixture.densityRatio());
            if (xtt <= 10) {
                return FastMath.pow(1 + FastMath.pow(xtt, 0.8), -0.378);
            }
            return 0.823 - 0.157 * FastMath.log(xtt);
        }
    },
    PREMOLI {
        @Override
        public double voidFraction(double quality, TwoPhaseMixture mixture, VoidFractionSettings settings) {
            double g = mixture.massFlux();
            double d = mixture.hydraulicDiameter();
            double rhoRatio = mixture.liquidDensity() / mixture.vaporDensity();
            double re = g * d / mixture.liquidViscosity();
            double we = g * g * d / mixture.surfaceTension() / mixture.liquidDensity();
            double y = rhoRatio * quality / (1 - quality);
            double f1 = 1.578 * FastMath.pow(re, -0.19) * FastMath.pow(rhoRatio, 0.22);
            double f2 = 0.0273 * we * FastMath.pow(re, -0.51) * FastMath.pow(rhoRatio, -0.08);
            double slipRatio = 1 + f1 * FastMath.sqrt(Math.max(0, y / (1 + y * f2) - y * f2));
            return slipVoidFraction(quality, mixture, slipRatio);
        }
    },
    SLIP_RATIO {
        @Override
        public double voidFraction(double quality, TwoPhaseMixture mixture, VoidFractionSettings settings) {
            return slipVoidFraction(quality, mixture, settings.slipRatio());
        }
    },
    /**
     * Zivi model, with the liquid weight integrated in closed form.
     */
    ZIVI_INTEGRATED {
        @Override
        public double voidFraction(double quality, TwoPhaseMixture mixture, VoidFractionSettings settings) {
            return ZIVI.voidFraction(quality, mixture, settings);
        }

        @Override
        public double liquidWeight(double quality1, double quality2, TwoPhaseMixture mixture, VoidFractionSettings settings) {
            if (quality2 - quality1 < MIN_QUALITY_INTERVAL) {
                return 1 - voidFraction(0.5 * (quality1 + quality2), mixture, settings);
            }
            double k = mixture.densityRatio() * ziviSlipRatio(mixture);
            double x1 = quality1;
            double x2 = quality2;
            double massVoidFraction = -(k * (FastMath.log(((x2 - 1) * k - x2) / ((x1 - 1) * k - x1)) + x2 - x1) + (x1 - x2))
                    / ((x2 - x1) * k * k + 2 * k * (x1 - x2) + (x2 - x1));
            return 1 - massVoidFraction;
        }
    },
    /**
     * Constant mass void fraction given by the user.
     */
    USER_DEFINED {
        @Override
        public double voidFraction(double quality, TwoPhaseMixture mixture, VoidFractionSettings settings) {
            return settings.massVoidFraction();
        }

        @Override
        public double liquidWeight(double quality1, double quality2, TwoPhaseMixture mixture, VoidFractionSettings settings) {
            return 1 - settings.massVoidFraction();
        }
    };

    private static final Logger LOGGER = LoggerFactory.getLogger(VoidFractionModel.class);

    private static final double GRAVITY = 9.81;

    private static final double[] HUGHMARK_COEFFICIENTS = {
        -0.010060658854755, 0.155594796014726, -0.870912508715887, 2.167004115373165, -2.224608445535130
    };

    private static final double HUGHMARK_TOLERANCE = 1e-8;

    private static final BrentRootFinder HUGHMARK_ROOT_FINDER = new BrentRootFinder();

    private static final double MIN_QUALITY_INTERVAL = 1e-9;

    private static final int INTEGRATION_POINTS = 5;

    private static final int MAX_INTEGRATION_EVALUATIONS = 10000;

    static double slipVoidFraction(double quality, TwoPhaseMixture mixture, double slipRatio) {
        return 1 / (1 + (1 - quality) / quality * mixture.densityRatio() * slipRatio);
    }

    static double ziviSlipRatio(TwoPhaseMixture mixture) {
        return FastMath.pow(mixture.densityRatio(), -1. / 3);
    }

    /**
     * Whether the model needs viscosities, or flow data, on top of the saturated densities.
     */
    public boolean requiresFlowProperties() {
        return this == HUGHMARK || this == LOCKHART_MARTINELLI || this == PREMOLI;
    }

    /**
     * Local void fraction at a vapour quality.
     */
    public abstract double voidFraction(double quality, TwoPhaseMixture mixture, VoidFractionSettings settings);

    /**
     * Mean liquid volume fraction, 1 - alpha, over the quality interval [quality1, quality2].
     */
    public double liquidWeight(double quality1, double quality2, TwoPhaseMixture mixture, VoidFractionSettings settings) {
        if (quality2 - quality1 < MIN_QUALITY_INTERVAL) {
            return 1 - voidFraction(0.5 * (quality1 + quality2), mixture, settings);
        }
        IterativeLegendreGaussIntegrator integrator = new IterativeLegendreGaussIntegrator(INTEGRATION_POINTS,
                IterativeLegendreGaussIntegrator.DEFAULT_RELATIVE_ACCURACY, IterativeLegendreGaussIntegrator.DEFAULT_ABSOLUTE_ACCURACY);
        try {
            double integral = integrator.integrate(MAX_INTEGRATION_EVALUATIONS, q -> 1 - voidFraction(q, mixture, settings), quality1, quality2);
            return integral / (quality2 - quality1);
        } catch (MaxCountExceededException e) {
            LOGGER.warn("{} liquid weight integration over [{}, {}] did not converge, midpoint value used", this, quality1, quality2);
            return 1 - voidFraction(0.5 * (quality1 + quality2), mixture, settings);
        }
    }
}
