/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openorc.expander;

import com.powsybl.openorc.OpenOrcParameters;
import com.powsybl.openorc.fluid.FluidPropertyOracle;
import com.powsybl.openorc.fluid.FluidStates;
import com.powsybl.openorc.fluid.PropertyUndefinedException;
import com.powsybl.openorc.fluid.Stream;
import com.powsybl.openorc.solver.BrentRootFinder;
import com.powsybl.openorc.solver.RootFinder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Volumetric expander solver.
 * <p>
 * Without a positive pressure ratio or flow, the expansion is taken as isentropic and nothing is solved. Otherwise
 * the model gives the operating point, from which exhaust temperature, fluid mass and diagram points follow. A fluid
 * state undefined while solving also falls back to the isentropic expansion, flagged as not converged.
 * <p>
 * A solver instance holds no state between calls.
 *
 * @author Open ORC developers
 */
public class ExpanderSolver {

    private static final Logger LOGGER = LoggerFactory.getLogger(ExpanderSolver.class);

    static final double MIN_ENTHALPY_PRESSURE = 5e4;

    static final double MIN_ENTHALPY_TEMPERATURE = 253.15;

    static final double MAX_ENTHALPY_PRESSURE = 4e6;

    static final double MAX_ENTHALPY_TEMPERATURE = 500;

    private static final double SECONDS_PER_MINUTE = 60;

    private final FluidPropertyOracle oracle;

    private final OpenOrcParameters parameters;

    private final RootFinder rootFinder;

    public ExpanderSolver(FluidPropertyOracle oracle, OpenOrcParameters parameters) {
        this(oracle, parameters, new BrentRootFinder(parameters.getRootFinderMaxEvaluations()));
    }

    public ExpanderSolver(FluidPropertyOracle oracle, OpenOrcParameters parameters, RootFinder rootFinder) {
        this.oracle = Objects.requireNonNull(oracle);
        this.parameters = Objects.requireNonNull(parameters);
        this.rootFinder = Objects.requireNonNull(rootFinder);
    }

    /**
     * @param supply supply stream, whose pressure is the supply pressure
     * @param exhaustPressure exhaust pressure in Pa
     * @param ambientTemperature ambient temperature in K
     */
    public ExpanderResult solve(Stream supply, double exhaustPressure, double ambientTemperature, ExpanderModel model) {
        Objects.requireNonNull(supply);
        Objects.requireNonNull(model);
        FluidStates states = new FluidStates(oracle, supply.getFluid());
        double supplyPressure = supply.getPressure();
        double massFlow = supply.getMassFlow();

        if (supplyPressure <= 0 || exhaustPressure <= 0) {
            LOGGER.warn("Non positive pressure (supply {} Pa, exhaust {} Pa)", supplyPressure, exhaustPressure);
            return ExpanderResult.failed(ExpanderSolverStatus.NON_POSITIVE_PRESSURE_RATIO);
        }
        ExpanderSolvingContext context;
        try {
            double supplyEnthalpy = supply.getSupplyEnthalpy(states);
            double minExhaustEnthalpy = Double.isNaN(model.getMinExhaustEnthalpy())
                    ? states.enthalpyAtTemperature(MIN_ENTHALPY_PRESSURE, MIN_ENTHALPY_TEMPERATURE)
                    : model.getMinExhaustEnthalpy();
            double maxExhaustEnthalpy = Double.isNaN(model.getMaxExhaustEnthalpy())
                    ? states.enthalpyAtTemperature(MAX_ENTHALPY_PRESSURE, MAX_ENTHALPY_TEMPERATURE)
                    : model.getMaxExhaustEnthalpy();
            context = new ExpanderSolvingContext(states, supplyPressure, supplyEnthalpy, exhaustPressure, massFlow,
                    ambientTemperature, minExhaustEnthalpy, maxExhaustEnthalpy, rootFinder, parameters);
        } catch (PropertyUndefinedException e) {
            LOGGER.warn("Expander supply or exhaust state undefined: {}", e.getMessage());
            return ExpanderResult.failed(ExpanderSolverStatus.NOT_CONVERGED);
        }

        try {
            if (supplyPressure <= exhaustPressure || massFlow <= 0) {
                LOGGER.warn("No expansion (supply {} Pa, exhaust {} Pa, mass flow {} kg/s): isentropic fallback",
                        supplyPressure, exhaustPressure, massFlow);
                return isentropicFallback(context, model, ExpanderSolverStatus.NON_POSITIVE_PRESSURE_RATIO);
            }
            LOGGER.debug("Solving {} expander from {} to {} Pa", model.getType(), supply, exhaustPressure);
            ExpanderSolution solution = model.solve(context);
            LOGGER.debug("Expander solved: {} W at {} rpm, {} (residual {})", solution.power(), solution.speed(),
                    solution.status(), solution.residual());
            return createResult(context, model, ExpanderResult.builder(solution.status()).setSolution(solution),
                    solution.exhaustEnthalpy());
        } catch (PropertyUndefinedException e) {
            LOGGER.warn("Expander solve failed on an undefined fluid state, isentropic expansion reported: {}", e.getMessage());
            return notConverged(context, model);
        }
    }

    private static ExpanderResult notConverged(ExpanderSolvingContext context, ExpanderModel model) {
        try {
            return isentropicFallback(context, model, ExpanderSolverStatus.NOT_CONVERGED);
        } catch (PropertyUndefinedException e) {
            LOGGER.warn("Isentropic exhaust state undefined: {}", e.getMessage());
            return ExpanderResult.failed(ExpanderSolverStatus.NOT_CONVERGED);
        }
    }

    private static ExpanderResult isentropicFallback(ExpanderSolvingContext context, ExpanderModel model,
                                                     ExpanderSolverStatus status) {
        double massFlow = context.getMassFlow();
        ExpanderSolution solution = new ExpanderSolution(status,
                context.getIsentropicExhaustEnthalpy(),
                SECONDS_PER_MINUTE * massFlow / (model.getSweptVolume() * context.getSupplyDensity()),
                context.getIsentropicPower(), 0, 1, 1, Double.NaN, Double.NaN, null);
        return createResult(context, model, ExpanderResult.builder(solution.status()).setSolution(solution),
                solution.exhaustEnthalpy());
    }

    private static ExpanderResult createResult(ExpanderSolvingContext context, ExpanderModel model,
                                               ExpanderResult.Builder builder, double exhaustEnthalpy) {
        FluidStates states = context.getStates();
        double exhaustPressure = context.getExhaustPressure();
        double exhaustTemperature = states.temperature(exhaustPressure, exhaustEnthalpy);
        double exhaustDensity = states.density(exhaustPressure, exhaustEnthalpy);
        double exhaustEntropy = states.entropy(exhaustPressure, exhaustEnthalpy);
        return builder.setExhaust(exhaustEnthalpy, exhaustTemperature)
                .setIsentropicPower(context.getIsentropicPower())
                .setMass(model.getVolume() * (context.getSupplyDensity() + exhaustDensity) / 2)
                .setTsPoints(List.of(new TsPoint(context.getSupplyTemperature(), context.getSupplyEntropy()),
                        new TsPoint(exhaustTemperature, exhaustEntropy)))
                .build();
    }
}
