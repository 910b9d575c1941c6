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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author Open ORC developers
 */
class ZoneProfileBuilderTest {

    private TestFluidOracle oracle;

    private ResolvedStream oil;

    private ResolvedStream refrigerant;

    @BeforeEach
    void setUp() {
        oracle = new TestFluidOracle();
        oil = ResolvedStream.resolve(Stream.ofTemperature(TestFluidOracle.OIL, 2e5, 363.15, 0.09), oracle);
        double pressure = 4.188e5;
        double enthalpy = new FluidStates(oracle, TestFluidOracle.R245FA).enthalpyAtTemperature(pressure, 293.15);
        refrigerant = ResolvedStream.resolve(Stream.ofEnthalpy(TestFluidOracle.R245FA, pressure, enthalpy, 0.0252), oracle);
    }

    @Test
    void testEvaporatorZones() {
        ZoneProfileBuilder builder = new ZoneProfileBuilder(oil, refrigerant, new OpenOrcParameters());
        Profile profile = builder.build(4267.675);

        List<ZoneBoundary> boundaries = profile.getBoundaries();
        assertEquals(4, boundaries.size());
        assertEquals(0, boundaries.get(0).cumulativeDuty());
        assertEquals(4267.675, boundaries.get(3).cumulativeDuty(), 1e-9);
        assertEquals(refrigerant.getBubbleEnthalpy(), boundaries.get(1).coldEnthalpy(), 1e-6);
        assertEquals(0.5 * (refrigerant.getBubbleEnthalpy() + refrigerant.getDewEnthalpy()), boundaries.get(2).coldEnthalpy(), 1e-6);
        for (int i = 1; i < boundaries.size(); i++) {
            assertTrue(boundaries.get(i).cumulativeDuty() > boundaries.get(i - 1).cumulativeDuty());
        }

        List<Zone> zones = profile.getZones();
        assertEquals(Phase.LIQUID, zones.get(0).coldPhase());
        assertEquals(Phase.TWO_PHASE, zones.get(1).coldPhase());
        assertEquals(Phase.TWO_PHASE, zones.get(2).coldPhase());
        assertTrue(zones.stream().allMatch(zone -> zone.hotPhase() == Phase.LIQUID));
        assertEquals(4267.675, zones.stream().mapToDouble(Zone::duty).sum(), 1e-9);

        assertEquals(363.15 - 4267.675 / (0.09 * 2100), profile.getHotExitTemperature(), 1e-6);
        assertEquals(14.6, profile.getPinch(), 0.5);
        assertEquals(boundaries.stream().mapToDouble(ZoneBoundary::temperatureDifference).min().orElseThrow(), profile.getPinch(), 1e-12);
    }

    @Test
    void testSubZoneCount() {
        Profile profile = new ZoneProfileBuilder(oil, refrigerant, 4, 1e-2).build(4267.675);
        assertTrue(profile.getZones().size() > 3);
        assertEquals(Phase.LIQUID, profile.getZones().get(0).coldPhase());
    }

    @Test
    void testZeroDuty() {
        Profile profile = new ZoneProfileBuilder(oil, refrigerant, new OpenOrcParameters()).build(0);
        assertEquals(1, profile.getZones().size());
        Zone zone = profile.getZones().get(0);
        assertEquals(0, zone.duty());
        assertEquals(oil.getSupplyEnthalpy(), profile.getHotExitEnthalpy(), 0);
        assertEquals(refrigerant.getSupplyEnthalpy(), profile.getColdExitEnthalpy(), 0);
        assertEquals(70, profile.getPinch(), 1e-4);
    }

    @Test
    void testInvalidDuty() {
        ZoneProfileBuilder builder = new ZoneProfileBuilder(oil, refrigerant, new OpenOrcParameters());
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> builder.build(-1));
        assertEquals("Invalid duty value: -1.0", e.getMessage());
        assertThrows(IllegalArgumentException.class, () -> builder.build(Double.NaN));
        assertThrows(IllegalArgumentException.class, () -> new ZoneProfileBuilder(oil, refrigerant, 0, 1e-2));
    }

    @Test
    void testLmtd() {
        assertEquals(10, ZoneProfileBuilder.lmtd(10, 10, 1e-2), 0);
        assertEquals((20 - 10) / Math.log(2), ZoneProfileBuilder.lmtd(20, 10, 1e-2), 1e-12);
        assertEquals(ZoneProfileBuilder.lmtd(10, 20, 1e-2), ZoneProfileBuilder.lmtd(20, 10, 1e-2), 1e-12);
        // crossing temperatures are floored
        assertEquals((5 - 1e-2) / Math.log(5 / 1e-2), ZoneProfileBuilder.lmtd(5, -3, 1e-2), 1e-12);
    }
}
