/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openorc.expander;

import com.powsybl.openorc.fluid.PropertyUndefinedException;
import com.powsybl.openorc.solver.RootFinderResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Semi-empirical volumetric expander: the operating point follows from the wall temperature closing the wall heat
 * balance, see {@link SemiEmpiricalInternalModel}.
 *
 * @author Open ORC developers
 */
public class SemiEmpiricalExpanderModel extends AbstractExpanderModel {

    private static final Logger LOGGER = LoggerFactory.getLogger(SemiEmpiricalExpanderModel.class);

    private static final double SUPPLY_TEMPERATURE_WEIGHT = 0.85;

    private static final double MIN_WALL_TEMPERATURE_RATIO = 1e-3;

    private static final double MAX_WALL_TEMPERATURE_RATIO = 2;

    private final double builtInVolumeRatio;

    private final double leakageArea;

    private final double supplyDiameter;

    private final double proportionalLoss;

    private final double constantLoss;

    private final double speedLossCoefficient;

    private final double nominalSupplyConductance;

    private final double nominalExhaustConductance;

    private final double nominalMassFlow;

    private final GammaCorrelation gammaCorrelation;

    private SemiEmpiricalExpanderModel(Builder builder) {
        super(builder);
        this.builtInVolumeRatio = checkPositive(builder.builtInVolumeRatio, "built-in volume ratio");
        this.leakageArea = checkNonNegative(builder.leakageArea, "leakage area");
        this.supplyDiameter = checkPositive(builder.supplyDiameter, "supply diameter");
        this.proportionalLoss = checkNonNegative(builder.proportionalLoss, "proportional loss");
        this.constantLoss = checkNonNegative(builder.constantLoss, "constant loss");
        this.speedLossCoefficient = checkNonNegative(builder.speedLossCoefficient, "speed loss coefficient");
        this.nominalSupplyConductance = checkNonNegative(builder.nominalSupplyConductance, "nominal supply conductance");
        this.nominalExhaustConductance = checkNonNegative(builder.nominalExhaustConductance, "nominal exhaust conductance");
        if (nominalSupplyConductance > 0 || nominalExhaustConductance > 0) {
            checkPositive(builder.nominalMassFlow, "nominal mass flow");
        }
        this.nominalMassFlow = builder.nominalMassFlow;
        this.gammaCorrelation = Objects.requireNonNull(builder.gammaCorrelation, "Heat capacity ratio correlation is missing");
    }

    public static Builder builder() {
        return new Builder();
    }

    public double getBuiltInVolumeRatio() {
        return builtInVolumeRatio;
    }

    public double getLeakageArea() {
        return leakageArea;
    }

    public double getSupplyDiameter() {
        return supplyDiameter;
    }

    public double getProportionalLoss() {
        return proportionalLoss;
    }

    public double getConstantLoss() {
        return constantLoss;
    }

    public double getSpeedLossCoefficient() {
        return speedLossCoefficient;
    }

    public double getNominalSupplyConductance() {
        return nominalSupplyConductance;
    }

    public double getNominalExhaustConductance() {
        return nominalExhaustConductance;
    }

    public double getNominalMassFlow() {
        return nominalMassFlow;
    }

    public GammaCorrelation getGammaCorrelation() {
        return gammaCorrelation;
    }

    @Override
    public ExpanderModelType getType() {
        return ExpanderModelType.SEMI_EMPIRICAL;
    }

    @Override
    public ExpanderSolution solve(ExpanderSolvingContext context) {
        SemiEmpiricalInternalModel internalModel = new SemiEmpiricalInternalModel(this, context);
        double tolerance = context.getParameters().getWallTemperatureTolerance();

        double initialGuess = SUPPLY_TEMPERATURE_WEIGHT * context.getSupplyTemperature()
                + (1 - SUPPLY_TEMPERATURE_WEIGHT) * context.getAmbientTemperature();
        double lowerBound = MIN_WALL_TEMPERATURE_RATIO * initialGuess;
        double upperBound = MAX_WALL_TEMPERATURE_RATIO * initialGuess;
        AtomicReference<SemiEmpiricalInternalModel.Evaluation> lastEvaluation = new AtomicReference<>();
        RootFinderResult result;
        SemiEmpiricalInternalModel.Evaluation evaluation;
        try {
            result = context.getRootFinder().solve(t -> {
                SemiEmpiricalInternalModel.Evaluation tried = internalModel.evaluate(t);
                lastEvaluation.set(tried);
                return tried.residual();
            }, lowerBound, upperBound, tolerance, tolerance);
            LOGGER.debug("Wall temperature {} K in [{}, {}] after {} evaluations", result.getRoot(), lowerBound, upperBound,
                    result.getEvaluations());
            evaluation = internalModel.evaluate(result.getRoot());
        } catch (PropertyUndefinedException e) {
            SemiEmpiricalInternalModel.Evaluation last = lastEvaluation.get();
            if (last == null) {
                throw e;
            }
            LOGGER.warn("Expander wall temperature search stopped on an undefined fluid state at {} K: {}",
                    last.wallTemperature(), e.getMessage());
            return solution(context, internalModel, last, ExpanderSolverStatus.NOT_CONVERGED);
        }

        boolean converged = result.isConverged() && Math.abs(evaluation.residual()) < tolerance;
        if (!converged) {
            LOGGER.warn("Expander wall temperature not found: {}", result);
        }
        ExpanderSolverStatus status = converged && context.isValidExhaustEnthalpy(evaluation.exhaustEnthalpy())
                ? ExpanderSolverStatus.CONVERGED : ExpanderSolverStatus.NOT_CONVERGED;
        return solution(context, internalModel, evaluation, status);
    }

    private ExpanderSolution solution(ExpanderSolvingContext context, SemiEmpiricalInternalModel internalModel,
                                      SemiEmpiricalInternalModel.Evaluation evaluation, ExpanderSolverStatus status) {
        double power = evaluation.power();
        // no swept flow when the leakage takes all of it
        double fillingFactor = evaluation.speed() > 0
                ? context.getMassFlow() / (sweptVolume * evaluation.speed() / 60 * context.getSupplyDensity())
                : Double.NaN;
        return new ExpanderSolution(status, evaluation.exhaustEnthalpy(), evaluation.speed(), power,
                evaluation.ambientHeat(), power / context.getIsentropicPower(), fillingFactor,
                evaluation.wallTemperature(), evaluation.residual(), internalModel.describe(evaluation));
    }

    @Override
    public String toString() {
        return "SemiEmpiricalExpanderModel(builtInVolumeRatio=" + builtInVolumeRatio
                + ", leakageArea=" + leakageArea
                + ", supplyDiameter=" + supplyDiameter
                + ", proportionalLoss=" + proportionalLoss
                + ", constantLoss=" + constantLoss
                + ", speedLossCoefficient=" + speedLossCoefficient
                + ", nominalSupplyConductance=" + nominalSupplyConductance
                + ", nominalExhaustConductance=" + nominalExhaustConductance
                + ", nominalMassFlow=" + nominalMassFlow
                + ", ambientConductance=" + ambientConductance
                + ", gammaCorrelation=" + gammaCorrelation
                + ")";
    }

    public static final class Builder extends AbstractBuilder<Builder> {

        private double builtInVolumeRatio = Double.NaN;

        private double leakageArea = 0;

        private double supplyDiameter = 1e2;

        private double proportionalLoss = 0;

        private double constantLoss = 0;

        private double speedLossCoefficient = 0;

        private double nominalSupplyConductance = 0;

        private double nominalExhaustConductance = 0;

        private double nominalMassFlow = Double.NaN;

        private GammaCorrelation gammaCorrelation;

        private Builder() {
        }

        @Override
        protected Builder self() {
            return this;
        }

        public Builder setBuiltInVolumeRatio(double builtInVolumeRatio) {
            this.builtInVolumeRatio = builtInVolumeRatio;
            return this;
        }

        public Builder setLeakageArea(double leakageArea) {
            this.leakageArea = leakageArea;
            return this;
        }

        public Builder setSupplyDiameter(double supplyDiameter) {
            this.supplyDiameter = supplyDiameter;
            return this;
        }

        /**
         * Fraction of the internal power lost, alpha.
         */
        public Builder setProportionalLoss(double proportionalLoss) {
            this.proportionalLoss = proportionalLoss;
            return this;
        }

        public Builder setConstantLoss(double constantLoss) {
            this.constantLoss = constantLoss;
            return this;
        }

        /**
         * Mechanical loss torque in N.m.
         */
        public Builder setSpeedLossCoefficient(double speedLossCoefficient) {
            this.speedLossCoefficient = speedLossCoefficient;
            return this;
        }

        public Builder setNominalSupplyConductance(double nominalSupplyConductance) {
            this.nominalSupplyConductance = nominalSupplyConductance;
            return this;
        }

        public Builder setNominalExhaustConductance(double nominalExhaustConductance) {
            this.nominalExhaustConductance = nominalExhaustConductance;
            return this;
        }

        public Builder setNominalMassFlow(double nominalMassFlow) {
            this.nominalMassFlow = nominalMassFlow;
            return this;
        }

        public Builder setGammaCorrelation(GammaCorrelation gammaCorrelation) {
            this.gammaCorrelation = gammaCorrelation;
            return this;
        }

        public SemiEmpiricalExpanderModel build() {
            return new SemiEmpiricalExpanderModel(this);
        }
    }
}
