/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openorc.hex;

import com.powsybl.openorc.OpenOrcParameters;
import com.powsybl.openorc.fluid.FluidStates;
import com.powsybl.openorc.fluid.Stream;
import com.powsybl.openorc.fluid.TestFluidOracle;
import com.powsybl.openorc.solver.BrentRootFinder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author Open ORC developers
 */
class MaxDutyCalculatorTest {

    private TestFluidOracle oracle;

    private OpenOrcParameters parameters;

    private ResolvedStream oil;

    @BeforeEach
    void setUp() {
        oracle = new TestFluidOracle();
        parameters = new OpenOrcParameters();
        oil = ResolvedStream.resolve(Stream.ofTemperature(TestFluidOracle.OIL, 2e5, 363.15, 0.09), oracle);
    }

    private MaxDuty calculate(ResolvedStream hot, ResolvedStream cold) {
        return new MaxDutyCalculator(new ZoneProfileBuilder(hot, cold, parameters), new BrentRootFinder(), parameters).calculate();
    }

    @Test
    void testInternalPinch() {
        double pressure = 4.188e5;
        double enthalpy = new FluidStates(oracle, TestFluidOracle.R245FA).enthalpyAtTemperature(pressure, 293.15);
        ResolvedStream refrigerant = ResolvedStream.resolve(Stream.ofEnthalpy(TestFluidOracle.R245FA, pressure, enthalpy, 0.0252), oracle);

        MaxDuty maxDuty = calculate(oil, refrigerant);
        assertEquals(6664.09, maxDuty.getDuty(), 1);
        assertTrue(maxDuty.getDuty() < maxDuty.getEnthalpyLimit());
        assertEquals(0, maxDuty.getPinch(), 1e-3);
        assertEquals(maxDuty.getDuty(), maxDuty.getProfile().getDuty(), 0);
    }

    @Test
    void testEnthalpyLimit() {
        // lower capacity rate on the cold side
        ResolvedStream cold = ResolvedStream.resolve(Stream.ofTemperature(TestFluidOracle.OIL, 2e5, 293.15, 0.05), oracle);
        MaxDuty maxDuty = calculate(oil, cold);
        assertEquals(0.05 * 2100 * 70, maxDuty.getDuty(), 1e-6);
        assertEquals(maxDuty.getEnthalpyLimit(), maxDuty.getDuty(), 0);
        assertEquals(0, maxDuty.getPinch(), 1e-6);
    }

    @Test
    void testNoTemperatureDifference() {
        ResolvedStream cold = ResolvedStream.resolve(Stream.ofTemperature(TestFluidOracle.OIL, 2e5, 363.15, 0.09), oracle);
        MaxDuty maxDuty = calculate(oil, cold);
        assertEquals(0, maxDuty.getDuty());
    }
}
