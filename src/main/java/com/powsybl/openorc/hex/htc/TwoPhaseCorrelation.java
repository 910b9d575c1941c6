/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openorc.hex.htc;

import com.powsybl.openorc.OpenOrcParameters;
import com.powsybl.openorc.fluid.FluidStates;
import net.jafama.FastMath;

/**
 * Two-phase convective heat transfer correlations, for condensation and boiling. Boiling correlations depending on
 * the zone heat flux are closed with {@link BoilingClosure}.
 *
 * @author Open ORC developers
 */
public enum TwoPhaseCorrelation {
    /**
     * Condensation in chevron plates, Han.
     */
    HAN_CONDENSATION {
        @Override
        public double coefficient(ZoneSide zoneSide, CorrelationSettings settings, OpenOrcParameters parameters) {
            ChannelGeometry geometry = settings.getGeometry();
            TwoPhaseFlow flow = TwoPhaseFlow.of(zoneSide, geometry);
            double theta = geometry.getChevronAngle();
            double pitchRatio = geometry.getCorrugationPitch() / flow.hydraulicDiameter();
            double ge1 = 11.22 * FastMath.pow(pitchRatio, -2.83) * FastMath.pow(theta, -4.5);
            double ge2 = 0.35 * FastMath.pow(pitchRatio, 0.23) * FastMath.pow(theta, 1.48);
            double nu = settings.getTwoPhaseFactor() * ge1
                    * FastMath.pow(flow.equivalentReynolds(), settings.getTwoPhaseExponentFactor() * ge2)
                    * FastMath.cbrt(flow.liquidPrandtl());
            return flow.coefficient(nu);
        }
    },
    /**
     * Condensation in chevron plates, Longo. Gravity controlled below an equivalent Reynolds number of 1600, forced
     * convection above.
     */
    LONGO_CONDENSATION {
        @Override
        public double coefficient(ZoneSide zoneSide, CorrelationSettings settings, OpenOrcParameters parameters) {
            ChannelGeometry geometry = settings.getGeometry();
            TwoPhaseFlow flow = TwoPhaseFlow.of(zoneSide, geometry);
            double phi = geometry.getEnlargementFactor();
            double fact = settings.getTwoPhaseFactor();
            if (flow.equivalentReynolds() < 1600) {
                double kl = flow.liquidConductivity();
                double rhol = flow.liquidDensity();
                double wallSuperheat = Math.abs(zoneSide.meanTemperature() - zoneSide.wallTemperature());
                return fact * phi * 0.943 * FastMath.pow(kl * kl * kl * rhol * rhol * GRAVITY * flow.latentHeat()
                        / (flow.liquidViscosity() * wallSuperheat * geometry.getPlateLength()), 0.25);
            }
            return fact * 1.875 * phi * flow.liquidConductivity() / flow.hydraulicDiameter()
                    * FastMath.pow(flow.equivalentReynolds(), settings.getTwoPhaseExponentFactor() * 0.445)
                    * FastMath.cbrt(flow.liquidPrandtl());
        }
    },
    /**
     * Condensation in tubes, Cavallini, with a temperature difference dependent stratified regime.
     */
    CAVALLINI_CONDENSATION {
        @Override
        public double coefficient(ZoneSide zoneSide, CorrelationSettings settings, OpenOrcParameters parameters) {
            TwoPhaseFlow flow = TwoPhaseFlow.of(zoneSide, settings.getGeometry());
            double x = flow.quality();
            double d = flow.hydraulicDiameter();
            double rhol = flow.liquidDensity();
            double rhov = flow.vaporDensity();
            double mul = flow.liquidViscosity();
            double muv = flow.vaporViscosity();
            double kl = flow.liquidConductivity();
            double prl = flow.liquidPrandtl();
            double ct = 2.6;
            double xtt = FastMath.pow(mul / muv, 0.1) * FastMath.sqrt(rhov / rhol) * FastMath.pow((1 - x) / x, 0.9);
            double jv = x * flow.massFlux() / FastMath.sqrt(GRAVITY * d * rhov * (rhol - rhov));
            double jvt = FastMath.pow(FastMath.pow(7.5 / (4.3 * FastMath.pow(xtt, 1.111) + 1), -3) + FastMath.pow(ct, -3), -1. / 3);
            double hlo = 0.023 * FastMath.pow(flow.liquidReynolds(), settings.getTwoPhaseExponentFactor() * 0.8)
                    * FastMath.pow(prl, 0.4) * kl / d;
            double ha = hlo * (1 + 1.128 * FastMath.pow(x, 0.817) * FastMath.pow(rhol / rhov, 0.3685)
                    * FastMath.pow(mul / muv, 0.2363) * FastMath.pow(1 - muv / mul, 2.144) * FastMath.pow(prl, -0.1));
            if (jv > jvt) {
                return settings.getTwoPhaseFactor() * ha;
            }
            double wallSuperheat = Math.abs(zoneSide.meanTemperature() - zoneSide.wallTemperature());
            double hStrat = 0.725 / (1 + 0.741 * FastMath.pow((1 - x) / x, 0.3321))
                    * FastMath.pow(kl * kl * kl * rhol * (rhol - rhov) * GRAVITY * flow.latentHeat() / (mul * d * wallSuperheat), 0.25)
                    + (1 - FastMath.pow(x, 0.087)) * hlo;
            double hd = jv / jvt * (ha * FastMath.pow(jvt / jv, 0.8) - hStrat) + hStrat;
            return settings.getTwoPhaseFactor() * hd;
        }
    },
    /**
     * Condensation in tubes, Shah.
     */
    SHAH_CONDENSATION {
        @Override
        public double coefficient(ZoneSide zoneSide, CorrelationSettings settings, OpenOrcParameters parameters) {
            TwoPhaseFlow flow = TwoPhaseFlow.of(zoneSide, settings.getGeometry());
            double pressure = zoneSide.pressure();
            double reducedPressure = pressure / zoneSide.stream().getStates().criticalPressure(pressure);
            double x = flow.quality();
            return settings.getTwoPhaseFactor() * 0.023 * flow.liquidConductivity() / flow.hydraulicDiameter()
                    * FastMath.pow(flow.liquidReynolds(), settings.getTwoPhaseExponentFactor() * 0.8)
                    * FastMath.pow(flow.liquidPrandtl(), 0.4)
                    * (FastMath.pow(1 - x, 0.8) + 3.8 * FastMath.pow(x, 0.76) * FastMath.pow(1 - x, 0.04) / FastMath.pow(reducedPressure, 0.38));
        }
    },
    /**
     * Boiling in chevron plates, Han. Depends on the boiling number.
     */
    HAN_BOILING {
        @Override
        public double coefficient(ZoneSide zoneSide, CorrelationSettings settings, OpenOrcParameters parameters) {
            ChannelGeometry geometry = settings.getGeometry();
            TwoPhaseFlow flow = TwoPhaseFlow.of(zoneSide, geometry);
            double theta = geometry.getChevronAngle();
            double pitchRatio = geometry.getCorrugationPitch() / flow.hydraulicDiameter();
            double ge1 = 2.81 * FastMath.pow(pitchRatio, -0.041) * FastMath.pow(theta, -2.83);
            double ge2 = 0.746 * FastMath.pow(pitchRatio, -0.082) * FastMath.pow(theta, 0.61);
            double base = settings.getTwoPhaseFactor() * ge1
                    * FastMath.pow(flow.equivalentReynolds(), settings.getTwoPhaseExponentFactor() * ge2)
                    * FastMath.pow(flow.liquidPrandtl(), 0.4);
            return BoilingClosure.solve(name(), zoneSide, 1,
                bo -> flow.coefficient(base * FastMath.pow(bo, 0.3)),
                q -> q / (flow.equivalentMassFlux() * flow.latentHeat()),
                parameters);
        }
    },
    /**
     * Boiling in chevron plates, Amalfi. Depends on the boiling number, with a Bond number dependent form.
     */
    AMALFI_BOILING {
        @Override
        public double coefficient(ZoneSide zoneSide, CorrelationSettings settings, OpenOrcParameters parameters) {
            ChannelGeometry geometry = settings.getGeometry();
            TwoPhaseFlow flow = TwoPhaseFlow.of(zoneSide, geometry);
            FluidStates states = zoneSide.stream().getStates();
            double pressure = zoneSide.pressure();
            double meanEnthalpy = zoneSide.meanEnthalpy();
            double d = flow.hydraulicDiameter();
            double g = flow.massFlux();
            double fact = settings.getTwoPhaseFactor();
            double fact2 = settings.getTwoPhaseExponentFactor();
            double surfaceTension = states.surfaceTension(pressure, meanEnthalpy);
            double bond = (flow.liquidDensity() - flow.vaporDensity()) * GRAVITY * d * d / surfaceTension;
            double betaStar = geometry.getChevronAngle() / FastMath.toRadians(70);
            double rhoStar = flow.liquidDensity() / flow.vaporDensity();
            double base;
            double boilingExponent;
            if (bond < 4) {
                double weber = g * g * d / (states.density(pressure, meanEnthalpy) * surfaceTension);
                base = fact * 982 * FastMath.pow(betaStar, 1.101) * FastMath.pow(weber, fact2 * 0.315) * FastMath.pow(rhoStar, -0.224);
                boilingExponent = 0.32;
            } else {
                double vaporReynolds = g * flow.quality() * d / flow.vaporViscosity();
                base = fact * 18.495 * FastMath.pow(betaStar, 0.248) * FastMath.pow(vaporReynolds, fact2 * 0.135)
                        * FastMath.pow(flow.liquidReynolds(), fact2 * 0.351) * FastMath.pow(bond, 0.235)
                        * FastMath.pow(rhoStar, -0.223);
                boilingExponent = 0.198;
            }
            return BoilingClosure.solve(name(), zoneSide, 1,
                bo -> flow.coefficient(base * FastMath.pow(bo, boilingExponent)),
                q -> q / (flow.equivalentMassFlux() * flow.latentHeat()),
                parameters);
        }
    },
    /**
     * Nucleate pool boiling, Cooper. Depends on the heat flux, initialized with the zone duty over the side area.
     */
    COOPER_BOILING {
        @Override
        public double coefficient(ZoneSide zoneSide, CorrelationSettings settings, OpenOrcParameters parameters) {
            FluidStates states = zoneSide.stream().getStates();
            double pressure = zoneSide.pressure();
            double reducedPressure = pressure / states.criticalPressure(pressure);
            double molarMass = 1e3 * states.molarMass(pressure);
            double fact2 = settings.getTwoPhaseExponentFactor();
            double base = settings.getTwoPhaseFactor() * 55
                    * FastMath.pow(reducedPressure, 0.12 - 0.2 * FastMath.log10(ROUGHNESS))
                    * FastMath.pow(-FastMath.log10(reducedPressure), -0.55 * fact2)
                    / FastMath.sqrt(molarMass);
            return BoilingClosure.solve(name(), zoneSide, zoneSide.zoneDuty() / zoneSide.sideArea(),
                q -> base * FastMath.pow(q, fact2 * 0.67),
                q -> q,
                parameters);
        }
    },
    /**
     * User given coefficient.
     */
    MANUAL {
        @Override
        public double coefficient(ZoneSide zoneSide, CorrelationSettings settings, OpenOrcParameters parameters) {
            return settings.getTwoPhaseManualCoefficient();
        }
    };

    private static final double GRAVITY = 9.81;

    /**
     * Surface roughness in micrometers.
     */
    private static final double ROUGHNESS = 0.4;

    public abstract double coefficient(ZoneSide zoneSide, CorrelationSettings settings, OpenOrcParameters parameters);

    public boolean requiresHeatFluxClosure() {
        return this == HAN_BOILING || this == AMALFI_BOILING || this == COOPER_BOILING;
    }
}
