/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openorc.fluid;

import org.apache.commons.math3.analysis.UnivariateFunction;
import org.apache.commons.math3.analysis.solvers.BrentSolver;

import static com.powsybl.openorc.fluid.FluidProperty.*;

/**
 * Thermodynamically consistent two-phase fluid: incompressible liquid with constant specific heat, ideal gas vapour
 * with constant specific heat, saturation pressure from the equality of the phase Gibbs energies. Enthalpy and
 * entropy of the liquid are zero at 273.15 K. The critical point is an arbitrary temperature cut of the saturation
 * curve.
 *
 * @author Open ORC developers
 */
public class IdealTwoPhaseFluid implements TestFluid {

    private static final double GAS_CONSTANT = 8.314462618;

    private static final double REFERENCE_PRESSURE = 101325;

    private static final double REFERENCE_TEMPERATURE = 273.15;

    private static final double MIN_PRESSURE = 1e3;

    private static final int MAX_EVALUATIONS = 500;

    private final double molarMass;

    private final double specificGasConstant;

    private final double boilingTemperature;

    private final double liquidSpecificHeat;

    private final double vaporSpecificHeat;

    private final double liquidDensity;

    private final double criticalTemperature;

    private final double criticalPressure;

    private final double liquidViscosity;

    private final double vaporViscosity;

    private final double liquidConductivity;

    private final double vaporConductivity;

    private final double surfaceTension;

    private final double referenceVaporEnthalpy;

    private final double referenceVaporEntropy;

    /**
     * Saturation state at one pressure.
     */
    record Saturation(double temperature, double liquidEnthalpy, double vaporEnthalpy, double liquidEntropy,
                      double vaporEntropy, double vaporDensity) {
    }

    public IdealTwoPhaseFluid(double molarMass, double boilingTemperature, double latentHeat, double liquidSpecificHeat,
                              double vaporSpecificHeat, double liquidDensity, double criticalTemperature,
                              double liquidViscosity, double vaporViscosity, double liquidConductivity,
                              double vaporConductivity, double surfaceTension) {
        this.molarMass = molarMass;
        this.specificGasConstant = GAS_CONSTANT / molarMass;
        this.boilingTemperature = boilingTemperature;
        this.liquidSpecificHeat = liquidSpecificHeat;
        this.vaporSpecificHeat = vaporSpecificHeat;
        this.liquidDensity = liquidDensity;
        this.criticalTemperature = criticalTemperature;
        this.liquidViscosity = liquidViscosity;
        this.vaporViscosity = vaporViscosity;
        this.liquidConductivity = liquidConductivity;
        this.vaporConductivity = vaporConductivity;
        this.surfaceTension = surfaceTension;
        this.referenceVaporEnthalpy = liquidEnthalpy(boilingTemperature) + latentHeat;
        this.referenceVaporEntropy = liquidEntropy(boilingTemperature) + latentHeat / boilingTemperature;
        this.criticalPressure = saturationPressure(criticalTemperature);
    }

    public static IdealTwoPhaseFluid r134a() {
        return new IdealTwoPhaseFluid(0.102, 247.0, 217000, 1400, 1000, 1300, 400, 2.0e-4, 1.2e-5, 0.08, 0.014, 0.012);
    }

    public static IdealTwoPhaseFluid r245fa() {
        return new IdealTwoPhaseFluid(0.134, 288.3, 196000, 1320, 1000, 1340, 440, 4.0e-4, 1.0e-5, 0.085, 0.013, 0.014);
    }

    public double getCriticalPressure() {
        return criticalPressure;
    }

    double liquidEnthalpy(double temperature) {
        return liquidSpecificHeat * (temperature - REFERENCE_TEMPERATURE);
    }

    double liquidEntropy(double temperature) {
        return liquidSpecificHeat * Math.log(temperature / REFERENCE_TEMPERATURE);
    }

    double vaporEnthalpy(double temperature) {
        return referenceVaporEnthalpy + vaporSpecificHeat * (temperature - boilingTemperature);
    }

    double vaporEntropy(double temperature, double pressure) {
        return referenceVaporEntropy + vaporSpecificHeat * Math.log(temperature / boilingTemperature)
                - specificGasConstant * Math.log(pressure / REFERENCE_PRESSURE);
    }

    double saturationPressure(double temperature) {
        double latentHeat = vaporEnthalpy(temperature) - liquidEnthalpy(temperature);
        double entropyGap = referenceVaporEntropy + vaporSpecificHeat * Math.log(temperature / boilingTemperature)
                - liquidEntropy(temperature);
        return REFERENCE_PRESSURE * Math.exp((-latentHeat + temperature * entropyGap) / (specificGasConstant * temperature));
    }

    private static double solve(UnivariateFunction function, double min, double max, double absoluteAccuracy) {
        return new BrentSolver(1e-14, absoluteAccuracy).solve(MAX_EVALUATIONS, function, min, max);
    }

    Saturation saturation(double pressure) {
        double temperature = solve(t -> Math.log(saturationPressure(t) / pressure), 100, 1.5 * criticalTemperature, 1e-10);
        return new Saturation(temperature, liquidEnthalpy(temperature), vaporEnthalpy(temperature),
                liquidEntropy(temperature), vaporEntropy(temperature, pressure),
                pressure / (specificGasConstant * temperature));
    }

    private double liquidTemperature(double enthalpy) {
        return REFERENCE_TEMPERATURE + enthalpy / liquidSpecificHeat;
    }

    private double vaporTemperature(double enthalpy) {
        return boilingTemperature + (enthalpy - referenceVaporEnthalpy) / vaporSpecificHeat;
    }

    private double mixtureQuality(Saturation sat, double enthalpy) {
        return (enthalpy - sat.liquidEnthalpy()) / (sat.vaporEnthalpy() - sat.liquidEnthalpy());
    }

    private double entropy(double pressure, double enthalpy) {
        Saturation sat = saturation(pressure);
        if (enthalpy < sat.liquidEnthalpy()) {
            return liquidEntropy(liquidTemperature(enthalpy));
        } else if (enthalpy > sat.vaporEnthalpy()) {
            return vaporEntropy(vaporTemperature(enthalpy), pressure);
        }
        double x = mixtureQuality(sat, enthalpy);
        return sat.liquidEntropy() + x * (sat.vaporEntropy() - sat.liquidEntropy());
    }

    private double density(double pressure, double enthalpy) {
        Saturation sat = saturation(pressure);
        if (enthalpy < sat.liquidEnthalpy()) {
            return liquidDensity;
        } else if (enthalpy > sat.vaporEnthalpy()) {
            return pressure / (specificGasConstant * vaporTemperature(enthalpy));
        }
        double x = mixtureQuality(sat, enthalpy);
        return 1 / ((1 - x) / liquidDensity + x / sat.vaporDensity());
    }

    private double enthalpyAtEntropy(double pressure, double entropy) {
        Saturation sat = saturation(pressure);
        if (entropy <= sat.liquidEntropy()) {
            return liquidEnthalpy(REFERENCE_TEMPERATURE * Math.exp(entropy / liquidSpecificHeat));
        } else if (entropy >= sat.vaporEntropy()) {
            double lnPressure = Math.log(pressure / REFERENCE_PRESSURE);
            return vaporEnthalpy(boilingTemperature
                    * Math.exp((entropy - referenceVaporEntropy + specificGasConstant * lnPressure) / vaporSpecificHeat));
        }
        double x = (entropy - sat.liquidEntropy()) / (sat.vaporEntropy() - sat.liquidEntropy());
        return sat.liquidEnthalpy() + x * (sat.vaporEnthalpy() - sat.liquidEnthalpy());
    }

    private double pressureSolving(UnivariateFunction residualAtLogPressure) {
        return Math.exp(solve(residualAtLogPressure, Math.log(MIN_PRESSURE), Math.log(2 * criticalPressure), 1e-12));
    }

    private double enthalpyAtDensity(double density, double pressure) {
        Saturation sat = saturation(pressure);
        if (density <= sat.vaporDensity()) {
            return vaporEnthalpy(pressure / (specificGasConstant * density));
        }
        double x = (1 / density - 1 / liquidDensity) / (1 / sat.vaporDensity() - 1 / liquidDensity);
        return sat.liquidEnthalpy() + x * (sat.vaporEnthalpy() - sat.liquidEnthalpy());
    }

    private double atPressureEnthalpy(FluidProperty output, double pressure, double enthalpy) {
        Saturation sat = saturation(pressure);
        boolean liquid = enthalpy < sat.liquidEnthalpy();
        boolean vapor = enthalpy > sat.vaporEnthalpy();
        double x = mixtureQuality(sat, enthalpy);
        return switch (output) {
            case TEMPERATURE -> liquid ? liquidTemperature(enthalpy) : vapor ? vaporTemperature(enthalpy) : sat.temperature();
            case ENTHALPY -> enthalpy;
            case ENTROPY -> entropy(pressure, enthalpy);
            case DENSITY -> density(pressure, enthalpy);
            case QUALITY -> {
                if (pressure >= criticalPressure) {
                    throw TestFluid.undefined(output, PRESSURE, pressure, ENTHALPY, enthalpy);
                }
                yield liquid || vapor ? -1 : x;
            }
            case SPECIFIC_HEAT -> {
                if (!liquid && !vapor) {
                    throw TestFluid.undefined(output, PRESSURE, pressure, ENTHALPY, enthalpy);
                }
                yield liquid ? liquidSpecificHeat : vaporSpecificHeat;
            }
            case VISCOSITY -> liquid ? liquidViscosity : vapor ? vaporViscosity : liquidViscosity + x * (vaporViscosity - liquidViscosity);
            case CONDUCTIVITY -> liquid ? liquidConductivity : vapor ? vaporConductivity : liquidConductivity + x * (vaporConductivity - liquidConductivity);
            case SURFACE_TENSION -> surfaceTension;
            default -> throw TestFluid.undefined(output, PRESSURE, pressure, ENTHALPY, enthalpy);
        };
    }

    private double saturated(FluidProperty output, double pressure, double quality) {
        if (pressure >= criticalPressure || quality < 0 || quality > 1) {
            throw TestFluid.undefined(output, PRESSURE, pressure, QUALITY, quality);
        }
        Saturation sat = saturation(pressure);
        double enthalpy = sat.liquidEnthalpy() + quality * (sat.vaporEnthalpy() - sat.liquidEnthalpy());
        return switch (output) {
            case TEMPERATURE -> sat.temperature();
            case ENTHALPY -> enthalpy;
            case ENTROPY -> sat.liquidEntropy() + quality * (sat.vaporEntropy() - sat.liquidEntropy());
            case DENSITY -> 1 / ((1 - quality) / liquidDensity + quality / sat.vaporDensity());
            case SPECIFIC_HEAT -> {
                if (quality != 0 && quality != 1) {
                    throw TestFluid.undefined(output, PRESSURE, pressure, QUALITY, quality);
                }
                yield quality == 0 ? liquidSpecificHeat : vaporSpecificHeat;
            }
            case VISCOSITY -> liquidViscosity + quality * (vaporViscosity - liquidViscosity);
            case CONDUCTIVITY -> liquidConductivity + quality * (vaporConductivity - liquidConductivity);
            case SURFACE_TENSION -> surfaceTension;
            default -> throw TestFluid.undefined(output, PRESSURE, pressure, QUALITY, quality);
        };
    }

    @Override
    public double state(FluidProperty output, FluidProperty input1, double value1, FluidProperty input2, double value2) {
        if (output == CRITICAL_PRESSURE) {
            return criticalPressure;
        } else if (output == MOLAR_MASS) {
            return molarMass;
        }
        if (TestFluid.isPair(input1, input2, PRESSURE, ENTHALPY)) {
            return atPressureEnthalpy(output, TestFluid.valueOf(PRESSURE, input1, value1, value2),
                    TestFluid.valueOf(ENTHALPY, input1, value1, value2));
        } else if (TestFluid.isPair(input1, input2, PRESSURE, QUALITY)) {
            return saturated(output, TestFluid.valueOf(PRESSURE, input1, value1, value2),
                    TestFluid.valueOf(QUALITY, input1, value1, value2));
        } else if (TestFluid.isPair(input1, input2, PRESSURE, TEMPERATURE)) {
            double pressure = TestFluid.valueOf(PRESSURE, input1, value1, value2);
            double temperature = TestFluid.valueOf(TEMPERATURE, input1, value1, value2);
            double enthalpy = temperature <= saturation(pressure).temperature()
                    ? liquidEnthalpy(temperature) : vaporEnthalpy(temperature);
            return atPressureEnthalpy(output, pressure, enthalpy);
        } else if (TestFluid.isPair(input1, input2, PRESSURE, ENTROPY)) {
            double pressure = TestFluid.valueOf(PRESSURE, input1, value1, value2);
            double enthalpy = enthalpyAtEntropy(pressure, TestFluid.valueOf(ENTROPY, input1, value1, value2));
            return atPressureEnthalpy(output, pressure, enthalpy);
        } else if (output == PRESSURE && TestFluid.isPair(input1, input2, ENTROPY, ENTHALPY)) {
            double entropy = TestFluid.valueOf(ENTROPY, input1, value1, value2);
            double enthalpy = TestFluid.valueOf(ENTHALPY, input1, value1, value2);
            return pressureSolving(lnP -> entropy(Math.exp(lnP), enthalpy) - entropy);
        } else if (output == PRESSURE && TestFluid.isPair(input1, input2, DENSITY, ENTROPY)) {
            double density = TestFluid.valueOf(DENSITY, input1, value1, value2);
            double entropy = TestFluid.valueOf(ENTROPY, input1, value1, value2);
            return pressureSolving(lnP -> {
                double pressure = Math.exp(lnP);
                return density(pressure, enthalpyAtEntropy(pressure, entropy)) - density;
            });
        } else if (output == ENTHALPY && TestFluid.isPair(input1, input2, DENSITY, PRESSURE)) {
            return enthalpyAtDensity(TestFluid.valueOf(DENSITY, input1, value1, value2),
                    TestFluid.valueOf(PRESSURE, input1, value1, value2));
        }
        throw TestFluid.undefined(output, input1, value1, input2, value2);
    }
}
