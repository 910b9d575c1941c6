/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openorc.expander;

import com.powsybl.openorc.fluid.FluidProperty;
import com.powsybl.openorc.fluid.FluidStates;
import com.powsybl.openorc.fluid.PropertyUndefinedException;
import net.jafama.FastMath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Chain of internal transformations of the semi-empirical expander model for a given wall temperature: supply
 * pressure drop, supply heat transfer, leakage through a nozzle, internal isentropic and constant volume expansions,
 * mechanical losses, mixing with the leakage and exhaust heat transfer. The wall temperature is the one balancing
 * the heat received by the wall with the heat it loses.
 *
 * @author Open ORC developers
 */
class SemiEmpiricalInternalModel {

    private static final Logger LOGGER = LoggerFactory.getLogger(SemiEmpiricalInternalModel.class);

    private static final double CONDUCTANCE_FLOW_EXPONENT = 0.8;

    private static final double MIN_SUPPLY_QUALITY = 0.1;

    private static final double MIN_PRESSURE_DROP = 1;

    private static final double DENSITY_PERTURBATION = 1e-3;

    private static final double MIN_HEAT_BALANCE_SCALE = 1e-9;

    private static final double SECONDS_PER_MINUTE = 60;

    /**
     * Result of the model at one wall temperature.
     */
    record Evaluation(double wallTemperature,
                      double supply1Pressure,
                      double supply2Enthalpy,
                      double supply2Entropy,
                      double supply2Density,
                      double gamma,
                      double throatPressure,
                      double throatEnthalpy,
                      double throatDensity,
                      double leakageMassFlow,
                      double internalMassFlow,
                      double speed,
                      double internalDensity,
                      double internalPressure,
                      double internalEnthalpy,
                      double exhaust2Enthalpy,
                      double exhaust1Enthalpy,
                      double exhaustEnthalpy,
                      double supplyHeat,
                      double exhaustHeat,
                      double ambientHeat,
                      double internalPower,
                      double lossPower,
                      double residual) {

        double power() {
            return internalPower - lossPower;
        }
    }

    private final SemiEmpiricalExpanderModel model;

    private final ExpanderSolvingContext context;

    private final FluidStates states;

    private final double supply1Pressure;

    private final double supply1Temperature;

    private final double supplyEffectiveness;

    private final double supplySpecificHeat;

    private final double exhaustConductance;

    private final double minSupply2Enthalpy;

    SemiEmpiricalInternalModel(SemiEmpiricalExpanderModel model, ExpanderSolvingContext context) {
        this.model = model;
        this.context = context;
        this.states = context.getStates();
        double massFlow = context.getMassFlow();
        double supplyEnthalpy = context.getSupplyEnthalpy();

        // supply nozzle pressure drop
        double area = Math.PI * model.getSupplyDiameter() * model.getSupplyDiameter() / 4;
        double velocity = massFlow / (context.getSupplyDensity() * area);
        double nozzleEnthalpy = Math.max(supplyEnthalpy - velocity * velocity / 2, context.getIsentropicExhaustEnthalpy());
        supply1Pressure = Math.max(states.pressureAtEntropyEnthalpy(context.getSupplyEntropy(), nozzleEnthalpy),
                context.getExhaustPressure() + MIN_PRESSURE_DROP);
        supply1Temperature = states.temperature(supply1Pressure, supplyEnthalpy);

        supplySpecificHeat = specificHeat(supply1Pressure, supplyEnthalpy);
        double supplyConductance = scaledConductance(model.getNominalSupplyConductance());
        supplyEffectiveness = effectiveness(supplyConductance, supplySpecificHeat);
        exhaustConductance = scaledConductance(model.getNominalExhaustConductance());

        minSupply2Enthalpy = supply1Pressure < states.criticalPressure(supply1Pressure)
                ? states.saturated(FluidProperty.ENTHALPY, supply1Pressure, MIN_SUPPLY_QUALITY)
                : Double.NaN;
    }

    private double scaledConductance(double nominalConductance) {
        if (nominalConductance == 0) {
            return 0;
        }
        return nominalConductance * FastMath.pow(context.getMassFlow() / model.getNominalMassFlow(), CONDUCTANCE_FLOW_EXPONENT);
    }

    private double effectiveness(double conductance, double specificHeat) {
        return Math.max(0, 1 - FastMath.exp(-conductance / (context.getMassFlow() * specificHeat)));
    }

    /**
     * Supply specific heat: the one of a single phase state, or of the saturated liquid for a two-phase state.
     */
    private double specificHeat(double pressure, double enthalpy) {
        double quality;
        try {
            quality = states.quality(pressure, enthalpy);
        } catch (PropertyUndefinedException e) {
            // supercritical
            return states.specificHeat(pressure, enthalpy);
        }
        if (quality == -1) {
            return states.specificHeat(pressure, enthalpy);
        }
        return states.saturated(FluidProperty.SPECIFIC_HEAT, pressure, 0);
    }

    private double gamma(double pressure, double enthalpy) {
        GammaCorrelation correlation = model.getGammaCorrelation();
        double quality;
        try {
            quality = states.quality(pressure, enthalpy);
        } catch (PropertyUndefinedException e) {
            quality = -1;
        }
        if (quality < 0) {
            return correlation.singlePhase(pressure, states.temperature(pressure, enthalpy));
        }
        return correlation.twoPhase(pressure, quality);
    }

    private double internalPressure(double density, double entropy) {
        try {
            return states.pressureAtDensityEntropy(density, entropy);
        } catch (PropertyUndefinedException e) {
            LOGGER.debug("Pressure undefined at density {} and entropy {}, averaged over neighbour densities", density, entropy);
            return (states.pressureAtDensityEntropy(density * (1 + DENSITY_PERTURBATION), entropy)
                    + states.pressureAtDensityEntropy(density * (1 - DENSITY_PERTURBATION), entropy)) / 2;
        }
    }

    Evaluation evaluate(double wallTemperature) {
        double massFlow = context.getMassFlow();
        double supplyEnthalpy = context.getSupplyEnthalpy();
        double exhaustPressure = context.getExhaustPressure();
        double maxEnthalpy = context.getMaxExhaustEnthalpy();

        // supply heat transfer
        double supplyHeat = Math.max(0, supplyEffectiveness * massFlow * supplySpecificHeat * (supply1Temperature - wallTemperature));
        double supply2Enthalpy = Math.max(context.getIsentropicExhaustEnthalpy(), supplyEnthalpy - supplyHeat / massFlow);
        if (!Double.isNaN(minSupply2Enthalpy)) {
            supply2Enthalpy = Math.max(supply2Enthalpy, minSupply2Enthalpy);
        }
        supply2Enthalpy = Math.min(maxEnthalpy, supply2Enthalpy);
        double supply2Entropy = states.entropy(supply1Pressure, supply2Enthalpy);
        double supply2Density = states.density(supply1Pressure, supply2Enthalpy);

        // leakage through a converging nozzle, choked below the critical pressure
        double gamma = gamma(supply1Pressure, supply2Enthalpy);
        double criticalPressure = supply1Pressure * FastMath.pow(2 / (gamma + 1), gamma / (gamma - 1));
        double throatPressure = Math.max(exhaustPressure, criticalPressure);
        double throatDensity = states.densityAtEntropy(throatPressure, supply2Entropy);
        double throatEnthalpy = states.enthalpyAtEntropy(throatPressure, supply2Entropy);
        double throatVelocity = Math.sqrt(2 * Math.max(0, supply2Enthalpy - throatEnthalpy));
        double leakageMassFlow = Math.min(massFlow, model.getLeakageArea() * throatVelocity * throatDensity);

        // internal expansion: isentropic down to the built-in volume ratio, then at constant volume
        double internalMassFlow = massFlow - leakageMassFlow;
        double speed = SECONDS_PER_MINUTE * internalMassFlow / (model.getSweptVolume() * supply2Density);
        double internalDensity = supply2Density / model.getBuiltInVolumeRatio();
        double internalPressure = internalPressure(internalDensity, supply2Entropy);
        double internalEnthalpy = states.enthalpyAtDensityPressure(internalDensity, internalPressure);
        double isentropicWork = supply2Enthalpy - internalEnthalpy;
        double constantVolumeWork = (internalPressure - exhaustPressure) / internalDensity;
        double exhaust2Enthalpy = internalEnthalpy - constantVolumeWork;

        double internalPower = internalMassFlow * (isentropicWork + constantVolumeWork);
        double lossPower = model.getProportionalLoss() * internalPower + model.getConstantLoss()
                + model.getSpeedLossCoefficient() * 2 * Math.PI * speed / SECONDS_PER_MINUTE;

        // mixing with the leakage
        double exhaust1Enthalpy = Math.max(Math.min((internalMassFlow * exhaust2Enthalpy + leakageMassFlow * supply2Enthalpy) / massFlow,
                supply2Enthalpy), exhaust2Enthalpy);

        // exhaust heat transfer
        double exhaust1Temperature = states.temperature(exhaustPressure, exhaust1Enthalpy);
        double exhaustSpecificHeat = states.specificHeat(exhaustPressure, exhaust1Enthalpy);
        double exhaustHeat = Math.max(0, effectiveness(exhaustConductance, exhaustSpecificHeat) * massFlow * exhaustSpecificHeat
                * (wallTemperature - exhaust1Temperature));
        double exhaustEnthalpy = Math.min(exhaust1Enthalpy + exhaustHeat / massFlow, maxEnthalpy);

        double ambientHeat = model.getAmbientConductance() * (wallTemperature - context.getAmbientTemperature());

        double wallGain = supplyHeat + lossPower;
        double residual = (wallGain - exhaustHeat - ambientHeat) / Math.max(wallGain, MIN_HEAT_BALANCE_SCALE);

        return new Evaluation(wallTemperature, supply1Pressure, supply2Enthalpy, supply2Entropy, supply2Density, gamma,
                throatPressure, throatEnthalpy, throatDensity, leakageMassFlow, internalMassFlow, speed, internalDensity,
                internalPressure, internalEnthalpy, exhaust2Enthalpy, exhaust1Enthalpy, exhaustEnthalpy, supplyHeat,
                exhaustHeat, ambientHeat, internalPower, lossPower, residual);
    }

    ExpanderInternalState describe(Evaluation evaluation) {
        double exhaustPressure = context.getExhaustPressure();
        return new ExpanderInternalState(
                ThermodynamicState.of(states, supply1Pressure, context.getSupplyEnthalpy()),
                new ThermodynamicState(evaluation.supply2Enthalpy(), supply1Pressure, evaluation.supply2Entropy(), evaluation.supply2Density()),
                new ThermodynamicState(evaluation.throatEnthalpy(), evaluation.throatPressure(), evaluation.supply2Entropy(), evaluation.throatDensity()),
                new ThermodynamicState(evaluation.internalEnthalpy(), evaluation.internalPressure(), evaluation.supply2Entropy(), evaluation.internalDensity()),
                ThermodynamicState.of(states, exhaustPressure, evaluation.exhaust2Enthalpy()),
                ThermodynamicState.of(states, exhaustPressure, evaluation.exhaust1Enthalpy()),
                ThermodynamicState.of(states, exhaustPressure, evaluation.exhaustEnthalpy()),
                evaluation.gamma(),
                evaluation.leakageMassFlow(),
                evaluation.internalMassFlow(),
                evaluation.supplyHeat(),
                evaluation.exhaustHeat(),
                evaluation.ambientHeat(),
                evaluation.internalPower(),
                evaluation.lossPower());
    }
}
