/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openorc.hex;

import com.powsybl.openorc.OpenOrcParameters;
import com.powsybl.openorc.fluid.Stream;
import com.powsybl.openorc.fluid.TestFluidOracle;
import com.powsybl.openorc.hex.htc.ChannelGeometry;
import com.powsybl.openorc.hex.htc.ConvectiveCoefficientModel;
import com.powsybl.openorc.hex.htc.CorrelationCoefficients;
import com.powsybl.openorc.hex.htc.CorrelationSettings;
import com.powsybl.openorc.hex.htc.FinGeometry;
import com.powsybl.openorc.hex.htc.SinglePhaseCorrelation;
import com.powsybl.openorc.hex.htc.ZoneSide;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author Open ORC developers
 */
class HeatTransferZoneEvaluatorTest {

    private static final double AREA = 9.8;

    private OpenOrcParameters parameters;

    private ResolvedStream hot;

    private ResolvedStream cold;

    private Profile profile;

    @BeforeEach
    void setUp() {
        TestFluidOracle oracle = new TestFluidOracle();
        parameters = new OpenOrcParameters();
        hot = ResolvedStream.resolve(Stream.ofTemperature(TestFluidOracle.OIL, 2e5, 363.15, 0.09), oracle);
        cold = ResolvedStream.resolve(Stream.ofTemperature(TestFluidOracle.OIL, 2e5, 293.15, 0.09), oracle);
        profile = new ZoneProfileBuilder(hot, cold, parameters).build(1000);
    }

    private static CorrelationCoefficients martinVersusManual() {
        double gap = 0.0018;
        double width = 0.191;
        double length = 0.459;
        double enlargementFactor = (AREA / 98) / (width * length);
        ChannelGeometry geometry = ChannelGeometry.builder()
                .setChevronAngle(Math.toRadians(30))
                .setCrossSection(width * gap)
                .setEnlargementFactor(enlargementFactor)
                .setHydraulicDiameter(2 * gap / enlargementFactor)
                .setChannelCount(49)
                .setPlateLength(length)
                .build();
        CorrelationSettings hotSettings = CorrelationSettings.builder()
                .setGeometry(geometry)
                .setSinglePhaseCorrelation(SinglePhaseCorrelation.MARTIN)
                .setSinglePhaseFactor(0.268088007690337)
                .setTwoPhaseManualCoefficient(1000)
                .build();
        CorrelationSettings coldSettings = CorrelationSettings.builder()
                .setSinglePhaseCorrelation(SinglePhaseCorrelation.MANUAL)
                .setSinglePhaseManualCoefficient(500)
                .setTwoPhaseManualCoefficient(1000)
                .build();
        return new CorrelationCoefficients(hotSettings, coldSettings);
    }

    @Test
    void testSinglePhaseZone() {
        assertEquals(1, profile.getZones().size());
        AreaEvaluation evaluation = new HeatTransferZoneEvaluator(martinVersusManual(), AREA, AREA, null, null, parameters)
                .evaluate(profile, hot, cold);

        ZoneHeatTransfer transfer = evaluation.getZones().get(0);
        assertEquals(28.1332, transfer.hotCoefficient(), 1e-3);
        assertEquals(500, transfer.coldCoefficient(), 1e-12);
        double u = 1 / (1 / transfer.hotCoefficient() + 1 / 500.);
        assertEquals(u, transfer.overallCoefficient(), 1e-9);
        Zone zone = profile.getZones().get(0);
        assertEquals(1000 / zone.lmtd() / u, evaluation.getRequiredHotArea(), 1e-9);
        assertEquals(1 - evaluation.getRequiredHotArea() / AREA, evaluation.getResidual(), 1e-12);
        assertEquals(transfer.hotArea(), transfer.coldArea(), 1e-12);
    }

    @Test
    void testAreaRatioAndFins() {
        ConvectiveCoefficientModel model = martinVersusManual();
        AreaEvaluation bare = new HeatTransferZoneEvaluator(model, AREA, 2 * AREA, null, null, parameters).evaluate(profile, hot, cold);
        ZoneHeatTransfer transfer = bare.getZones().get(0);
        assertEquals(1 / (1 / transfer.hotCoefficient() + 1 / 1000.), transfer.overallCoefficient(), 1e-9);
        assertEquals(2 * transfer.hotArea(), transfer.coldArea(), 1e-12);

        FinGeometry fins = new FinGeometry(200, 2e-4, 0.01, 0.02, 0.04, 0.9);
        AreaEvaluation finned = new HeatTransferZoneEvaluator(model, AREA, 2 * AREA, null, fins, parameters).evaluate(profile, hot, cold);
        ZoneHeatTransfer finnedTransfer = finned.getZones().get(0);
        assertEquals(1, finnedTransfer.hotSurfaceEfficiency());
        assertTrue(finnedTransfer.coldSurfaceEfficiency() < 1);
        assertTrue(finned.getRequiredHotArea() > bare.getRequiredHotArea());
    }

    @Test
    void testZeroDutyZone() {
        Profile empty = new ZoneProfileBuilder(hot, cold, parameters).build(0);
        AreaEvaluation evaluation = new HeatTransferZoneEvaluator(martinVersusManual(), AREA, AREA, null, null, parameters)
                .evaluate(empty, hot, cold);
        assertEquals(0, evaluation.getRequiredHotArea());
        assertEquals(1, evaluation.getResidual());
    }

    @Test
    void testHeatFluxClosureOnBothSides() {
        ConvectiveCoefficientModel model = new ConvectiveCoefficientModel() {
            @Override
            public double coefficient(ZoneSide zoneSide, OpenOrcParameters parameters) {
                return 100;
            }

            @Override
            public boolean requiresHeatFluxClosure(Side side, Phase phase) {
                return true;
            }

            @Override
            public ConvectiveCoefficientModel withSwappedSides() {
                return this;
            }
        };
        HeatTransferZoneEvaluator evaluator = new HeatTransferZoneEvaluator(model, AREA, AREA, null, null, parameters);
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> evaluator.evaluate(profile, hot, cold));
        assertEquals("Heat flux dependent correlations on both sides of zone 0", e.getMessage());
    }

    @Test
    void testInvalidArea() {
        ConvectiveCoefficientModel model = martinVersusManual();
        assertThrows(IllegalArgumentException.class, () -> new HeatTransferZoneEvaluator(model, 0, AREA, null, null, parameters));
        assertThrows(IllegalArgumentException.class, () -> new HeatTransferZoneEvaluator(model, AREA, Double.NaN, null, null, parameters));
    }
}
