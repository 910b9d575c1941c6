/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openorc.expander;

import com.powsybl.openorc.OpenOrcParameters;
import com.powsybl.openorc.fluid.FluidProperty;
import com.powsybl.openorc.fluid.FluidPropertyOracle;
import com.powsybl.openorc.fluid.FluidStates;
import com.powsybl.openorc.fluid.PropertyUndefinedException;
import com.powsybl.openorc.fluid.Stream;
import com.powsybl.openorc.fluid.TestFluidOracle;
import com.powsybl.openorc.solver.BrentRootFinder;
import com.powsybl.openorc.solver.RootFinder;
import com.powsybl.openorc.solver.RootFinderResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.DoubleUnaryOperator;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author Open ORC developers
 */
class ExpanderSolverTest {

    private static final double SUPPLY_PRESSURE = 50.753498330038136e5;

    private static final double SUPPLY_TEMPERATURE = 473.15;

    private static final double EXHAUST_PRESSURE = 2.471310061849047e5;

    private static final double MASS_FLOW = 0.15982;

    private static final double AMBIENT_TEMPERATURE = 298.15;

    private static final double SWEPT_VOLUME = 1.279908675799087e-05;

    private TestFluidOracle oracle;

    private OpenOrcParameters parameters;

    private ExpanderSolver solver;

    @BeforeEach
    void setUp() {
        oracle = new TestFluidOracle();
        parameters = new OpenOrcParameters();
        solver = new ExpanderSolver(oracle, parameters);
    }

    private static Stream supply() {
        return Stream.ofTemperature(TestFluidOracle.R134A, SUPPLY_PRESSURE, SUPPLY_TEMPERATURE, MASS_FLOW);
    }

    private double supplyDensity() {
        FluidStates states = new FluidStates(oracle, TestFluidOracle.R134A);
        return states.density(SUPPLY_PRESSURE, states.enthalpyAtTemperature(SUPPLY_PRESSURE, SUPPLY_TEMPERATURE));
    }

    private static SemiEmpiricalExpanderModel.Builder scrollExpander() {
        return SemiEmpiricalExpanderModel.builder()
                .setVolume(1.492257e-3)
                .setSweptVolume(SWEPT_VOLUME)
                .setBuiltInVolumeRatio(2.19)
                .setLeakageArea(1.344675598144531e-06)
                .setSupplyDiameter(0.003227564086914)
                .setProportionalLoss(1.253662109374984e-05)
                .setConstantLoss(0)
                .setSpeedLossCoefficient(7.952880859375330e-07)
                .setNominalSupplyConductance(50.0335693359375)
                .setNominalExhaustConductance(94.01702880859375)
                .setNominalMassFlow(0.068378356905196)
                .setAmbientConductance(0.674005126953125)
                .setGammaCorrelation(GammaCorrelation.constant(1.1));
    }

    @Test
    void testSemiEmpirical() {
        ExpanderResult result = solver.solve(supply(), EXHAUST_PRESSURE, AMBIENT_TEMPERATURE, scrollExpander().build());

        assertEquals(ExpanderSolverStatus.CONVERGED, result.getStatus());
        assertEquals(1, result.getFlag());
        assertEquals(428.40, result.getWallTemperature(), 0.5);
        assertEquals(6512.4, result.getSpeed(), 65);
        assertEquals(8527.9, result.getPower(), 85);
        assertEquals(16511.8, result.getIsentropicPower(), 10);
        assertTrue(result.getPower() < result.getIsentropicPower());
        assertEquals(result.getPower() / result.getIsentropicPower(), result.getIsentropicEfficiency(), 1e-12);
        assertEquals(352631, result.getExhaustEnthalpy(), 1800);
        assertEquals(87.8, result.getAmbientHeat(), 1);
        assertTrue(Math.abs(result.getResidual()) < parameters.getWallTemperatureTolerance());
        assertTrue(result.getFillingFactor() > 0);
        assertTrue(result.getMass() > 0);

        ExpanderInternalState state = result.getInternalState().orElseThrow();
        assertEquals(0.01666, state.leakageMassFlow(), 5e-4);
        assertEquals(MASS_FLOW, state.leakageMassFlow() + state.internalMassFlow(), 1e-12);
        assertEquals(3294.7, state.supplyHeat(), 35);
        assertEquals(3207.0, state.exhaustHeat(), 35);
        assertEquals(result.getPower(), state.internalPower() - state.lossPower(), 1e-6);
        assertTrue(state.supply1().pressure() < SUPPLY_PRESSURE);
        assertEquals(1.1, state.gamma(), 0);
        assertEquals(7, state.getStates().size());

        List<TsPoint> points = result.getTsPoints();
        assertEquals(2, points.size());
        assertEquals(SUPPLY_TEMPERATURE, points.get(0).temperature(), 1e-4);
        assertEquals(result.getExhaustTemperature(), points.get(1).temperature(), 0);
    }

    @Test
    void testNoLeakage() {
        ExpanderResult result = solver.solve(supply(), EXHAUST_PRESSURE, AMBIENT_TEMPERATURE,
                scrollExpander().setLeakageArea(0).build());
        ExpanderInternalState state = result.getInternalState().orElseThrow();
        assertEquals(0, state.leakageMassFlow());
        assertEquals(MASS_FLOW, state.internalMassFlow(), 0);
    }

    @Test
    void testNoExpansion() {
        AtomicInteger calls = new AtomicInteger();
        RootFinder countingRootFinder = new RootFinder() {
            private final RootFinder delegate = new BrentRootFinder();

            @Override
            public RootFinderResult solve(DoubleUnaryOperator function, double lowerBound, double upperBound,
                                          double absoluteAccuracy, double functionValueAccuracy) {
                calls.incrementAndGet();
                return delegate.solve(function, lowerBound, upperBound, absoluteAccuracy, functionValueAccuracy);
            }
        };
        ExpanderSolver countingSolver = new ExpanderSolver(oracle, parameters, countingRootFinder);

        ExpanderResult result = countingSolver.solve(supply(), SUPPLY_PRESSURE * 1.1, AMBIENT_TEMPERATURE, scrollExpander().build());
        assertEquals(ExpanderSolverStatus.NON_POSITIVE_PRESSURE_RATIO, result.getStatus());
        assertEquals(-2, result.getFlag());
        assertEquals(0, calls.get());
        assertEquals(60 * MASS_FLOW / (SWEPT_VOLUME * supplyDensity()), result.getSpeed(), 1e-6);
        assertEquals(1, result.getIsentropicEfficiency());
        assertEquals(result.getIsentropicPower(), result.getPower(), 0);
        assertTrue(result.getInternalState().isEmpty());

        ExpanderResult negative = countingSolver.solve(supply(), -1, AMBIENT_TEMPERATURE, scrollExpander().build());
        assertEquals(-2, negative.getFlag());
        assertTrue(Double.isNaN(negative.getPower()));
        assertTrue(Double.isNaN(negative.getExhaustEnthalpy()));
        assertEquals(0, calls.get());
    }

    @Test
    void testConstantEfficiency() {
        ExpanderModel model = ConstantEfficiencyExpanderModel.builder()
                .setSweptVolume(SWEPT_VOLUME)
                .setIsentropicEfficiency(0.7)
                .setFillingFactor(1.2)
                .build();
        ExpanderResult result = solver.solve(supply(), EXHAUST_PRESSURE, AMBIENT_TEMPERATURE, model);

        assertEquals(1, result.getFlag());
        assertEquals(60 * MASS_FLOW / (SWEPT_VOLUME * 1.2 * supplyDensity()), result.getSpeed(), 1e-6);
        assertEquals(0.7 * result.getIsentropicPower(), result.getPower(), 1e-6);
        assertEquals(0, result.getAmbientHeat());
        assertEquals(1.2, result.getFillingFactor());
        assertEquals(0, result.getMass());
        FluidStates states = new FluidStates(oracle, TestFluidOracle.R134A);
        double supplyEnthalpy = states.enthalpyAtTemperature(SUPPLY_PRESSURE, SUPPLY_TEMPERATURE);
        assertEquals(supplyEnthalpy - result.getPower() / MASS_FLOW, result.getExhaustEnthalpy(), 1e-6);
        assertTrue(result.getInternalState().isEmpty());
        assertTrue(Double.isNaN(result.getWallTemperature()));
    }

    @Test
    void testConstantEfficiencyAmbientLosses() {
        ExpanderModel model = ConstantEfficiencyExpanderModel.builder()
                .setSweptVolume(SWEPT_VOLUME)
                .setIsentropicEfficiency(0.7)
                .setAmbientConductance(2)
                .build();
        ExpanderResult result = solver.solve(supply(), EXHAUST_PRESSURE, AMBIENT_TEMPERATURE, model);
        assertEquals(2 * (SUPPLY_TEMPERATURE - AMBIENT_TEMPERATURE), result.getAmbientHeat(), 1e-6);
        assertEquals(1, result.getFillingFactor());
    }

    @Test
    void testExhaustEnthalpyRange() {
        ExpanderModel model = ConstantEfficiencyExpanderModel.builder()
                .setSweptVolume(SWEPT_VOLUME)
                .setIsentropicEfficiency(0.7)
                .setExhaustEnthalpyRange(4e5, 5e5)
                .build();
        ExpanderResult result = solver.solve(supply(), EXHAUST_PRESSURE, AMBIENT_TEMPERATURE, model);
        assertEquals(ExpanderSolverStatus.NOT_CONVERGED, result.getStatus());
        assertFalse(Double.isNaN(result.getPower()));
    }

    @Test
    void testPolynomialEfficiency() {
        double pressureRatio = SUPPLY_PRESSURE / EXHAUST_PRESSURE;
        ExpanderModel model = PolynomialEfficiencyExpanderModel.builder()
                .setSweptVolume(SWEPT_VOLUME)
                .setIsentropicEfficiency(new EfficiencyPolynomial(0.5, 0.01, 0, 0, 0, 0))
                .setFillingFactor(new EfficiencyPolynomial(1, 0, 0, 0, 0, 0, 1e-4, 0, 0, 0))
                .build();
        ExpanderResult result = solver.solve(supply(), EXHAUST_PRESSURE, AMBIENT_TEMPERATURE, model);

        assertEquals(1, result.getFlag());
        assertEquals(0.5 + 0.01 * pressureRatio, result.getIsentropicEfficiency(), 1e-12);
        double speed = result.getSpeed();
        assertEquals(1 + 1e-4 * speed, result.getFillingFactor(), 1e-12);
        // swallowed mass flow
        assertEquals(MASS_FLOW, SWEPT_VOLUME * result.getFillingFactor() * speed / 60 * supplyDensity(), MASS_FLOW * 1e-4);
        assertTrue(Math.abs(result.getResidual()) < parameters.getSpeedResidualThreshold());
    }

    @Test
    void testPolynomialEfficiencyClamping() {
        ExpanderModel model = PolynomialEfficiencyExpanderModel.builder()
                .setSweptVolume(SWEPT_VOLUME)
                .setIsentropicEfficiency(new EfficiencyPolynomial(2, 0, 0, 0, 0, 0))
                .setFillingFactor(new EfficiencyPolynomial(10, 0, 0, 0, 0, 0))
                .build();
        ExpanderResult result = solver.solve(supply(), EXHAUST_PRESSURE, AMBIENT_TEMPERATURE, model);

        assertEquals(1, result.getFlag());
        assertEquals(10, result.getFillingFactor());
        assertEquals(1, result.getIsentropicEfficiency());
        // the speed search stays bounded by the narrower clamp
        assertEquals(60 * MASS_FLOW / (SWEPT_VOLUME * PolynomialEfficiencyExpanderModel.MAX_FILLING_FACTOR * supplyDensity()),
                result.getSpeed(), 1e-6);

        ExpanderModel oversized = PolynomialEfficiencyExpanderModel.builder()
                .setSweptVolume(SWEPT_VOLUME)
                .setIsentropicEfficiency(new EfficiencyPolynomial(0.7, 0, 0, 0, 0, 0))
                .setFillingFactor(new EfficiencyPolynomial(20, 0, 0, 0, 0, 0))
                .build();
        assertEquals(PolynomialEfficiencyExpanderModel.MAX_REPORTED_FILLING_FACTOR,
                solver.solve(supply(), EXHAUST_PRESSURE, AMBIENT_TEMPERATURE, oversized).getFillingFactor());

        ExpanderModel undersized = PolynomialEfficiencyExpanderModel.builder()
                .setSweptVolume(SWEPT_VOLUME)
                .setIsentropicEfficiency(new EfficiencyPolynomial(0.7, 0, 0, 0, 0, 0))
                .setFillingFactor(new EfficiencyPolynomial(0.05, 0, 0, 0, 0, 0))
                .build();
        assertEquals(PolynomialEfficiencyExpanderModel.MIN_FILLING_FACTOR,
                solver.solve(supply(), EXHAUST_PRESSURE, AMBIENT_TEMPERATURE, undersized).getFillingFactor());
    }

    @Test
    void testFullLeakage() {
        ExpanderResult result = solver.solve(supply(), EXHAUST_PRESSURE, AMBIENT_TEMPERATURE,
                scrollExpander().setLeakageArea(1).build());

        ExpanderInternalState state = result.getInternalState().orElseThrow();
        assertEquals(MASS_FLOW, state.leakageMassFlow(), 0);
        assertEquals(0, state.internalMassFlow(), 0);
        assertEquals(0, result.getSpeed(), 0);
        assertTrue(Double.isNaN(result.getFillingFactor()));
        assertFalse(Double.isNaN(result.getExhaustEnthalpy()));
    }

    @Test
    void testTwoPhaseExhaustSpecificHeat() {
        double supplyPressure = 10e5;
        double exhaustPressure = 2e5;
        double twoPhaseSpecificHeat = 2500;
        List<double[]> specificHeatStates = new ArrayList<>();
        // the test fluid has no specific heat inside the dome, a constant one is given there
        FluidPropertyOracle recordingOracle = (fluid, output, input1, value1, input2, value2) -> {
            if (output == FluidProperty.SPECIFIC_HEAT && input1 == FluidProperty.PRESSURE && input2 == FluidProperty.ENTHALPY) {
                specificHeatStates.add(new double[] {value1, value2});
                if (oracle.state(fluid, FluidProperty.QUALITY, input1, value1, input2, value2) >= 0) {
                    return twoPhaseSpecificHeat;
                }
            }
            return oracle.state(fluid, output, input1, value1, input2, value2);
        };
        FluidStates states = new FluidStates(oracle, TestFluidOracle.R134A);
        Stream wetSupply = Stream.ofEnthalpy(TestFluidOracle.R134A, supplyPressure,
                states.saturated(FluidProperty.ENTHALPY, supplyPressure, 0.5), MASS_FLOW);

        ExpanderResult result = new ExpanderSolver(recordingOracle, parameters)
                .solve(wetSupply, exhaustPressure, AMBIENT_TEMPERATURE, scrollExpander().build());

        assertFalse(Double.isNaN(result.getPower()));
        ExpanderInternalState state = result.getInternalState().orElseThrow();
        double exhaustQuality = states.quality(exhaustPressure, state.exhaust1().enthalpy());
        assertTrue(exhaustQuality > 0 && exhaustQuality < 1);
        // the wet exhaust state is queried as it is, without the saturated liquid substitute of the supply
        List<double[]> exhaustStates = specificHeatStates.stream().filter(ph -> ph[0] == exhaustPressure).toList();
        assertFalse(exhaustStates.isEmpty());
        for (double[] ph : exhaustStates) {
            double quality = states.quality(ph[0], ph[1]);
            assertTrue(quality >= 0 && quality <= 1);
        }
        assertTrue(specificHeatStates.stream().noneMatch(ph -> ph[0] != exhaustPressure));
    }

    @Test
    void testUndefinedStateDuringSolve() {
        FluidPropertyOracle failingOracle = (fluid, output, input1, value1, input2, value2) -> {
            if (output == FluidProperty.PRESSURE && input1 == FluidProperty.DENSITY) {
                throw new PropertyUndefinedException("No pressure at density " + value1);
            }
            return oracle.state(fluid, output, input1, value1, input2, value2);
        };
        ExpanderResult result = new ExpanderSolver(failingOracle, parameters)
                .solve(supply(), EXHAUST_PRESSURE, AMBIENT_TEMPERATURE, scrollExpander().build());

        assertEquals(ExpanderSolverStatus.NOT_CONVERGED, result.getStatus());
        assertEquals(-1, result.getFlag());
        assertEquals(result.getIsentropicPower(), result.getPower(), 0);
        assertEquals(60 * MASS_FLOW / (SWEPT_VOLUME * supplyDensity()), result.getSpeed(), 1e-6);
        assertFalse(Double.isNaN(result.getExhaustEnthalpy()));
        assertFalse(Double.isNaN(result.getExhaustTemperature()));
        assertTrue(result.getExhaustTemperature() < SUPPLY_TEMPERATURE);
        assertEquals(2, result.getTsPoints().size());
    }

    @Test
    void testUndefinedStateKeepsLastWallTemperature() {
        AtomicInteger internalPressureQueries = new AtomicInteger();
        FluidPropertyOracle failingOracle = (fluid, output, input1, value1, input2, value2) -> {
            if (output == FluidProperty.PRESSURE && input1 == FluidProperty.DENSITY
                    && internalPressureQueries.incrementAndGet() > 2) {
                throw new PropertyUndefinedException("No pressure at density " + value1);
            }
            return oracle.state(fluid, output, input1, value1, input2, value2);
        };
        ExpanderResult result = new ExpanderSolver(failingOracle, parameters)
                .solve(supply(), EXHAUST_PRESSURE, AMBIENT_TEMPERATURE, scrollExpander().build());

        assertEquals(-1, result.getFlag());
        assertFalse(Double.isNaN(result.getWallTemperature()));
        assertFalse(Double.isNaN(result.getPower()));
        assertFalse(Double.isNaN(result.getExhaustTemperature()));
        assertTrue(result.getInternalState().isPresent());
    }

    @Test
    void testUndefinedState() {
        Stream unknown = Stream.ofTemperature("UNKNOWN", SUPPLY_PRESSURE, SUPPLY_TEMPERATURE, MASS_FLOW);
        ExpanderResult result = solver.solve(unknown, EXHAUST_PRESSURE, AMBIENT_TEMPERATURE, scrollExpander().build());
        assertEquals(ExpanderSolverStatus.NOT_CONVERGED, result.getStatus());
        assertTrue(Double.isNaN(result.getPower()));
    }

    @Test
    void testInvalidModels() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> scrollExpander().setSweptVolume(0).build());
        assertEquals("Invalid swept volume value: 0.0", e.getMessage());
        assertThrows(IllegalArgumentException.class, () -> scrollExpander().setNominalMassFlow(Double.NaN).build());
        assertThrows(NullPointerException.class, () -> scrollExpander().setGammaCorrelation(null).build());
        assertThrows(IllegalArgumentException.class, () -> scrollExpander().setExhaustEnthalpyRange(5e5, 4e5).build());
        assertThrows(IllegalArgumentException.class, () -> ConstantEfficiencyExpanderModel.builder()
                .setSweptVolume(SWEPT_VOLUME).setIsentropicEfficiency(1.5).build());
        assertThrows(NullPointerException.class, () -> PolynomialEfficiencyExpanderModel.builder()
                .setSweptVolume(SWEPT_VOLUME).setIsentropicEfficiency(new EfficiencyPolynomial(1, 0, 0, 0, 0, 0)).build());
    }
}
