/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openorc.hex.htc;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author Open ORC developers
 */
class VoidFractionModelTest {

    private static final TwoPhaseMixture MIXTURE = new TwoPhaseMixture(1300, 20, 2e-4, 1.2e-5, 0.012, 1e-3, 300);

    @Test
    void testHomogeneous() {
        VoidFractionSettings settings = VoidFractionSettings.of(VoidFractionModel.HOMOGENEOUS);
        // equal phase volumes when the mass ratio compensates the density ratio
        double quality = 20. / 1320;
        assertEquals(0.5, VoidFractionModel.HOMOGENEOUS.voidFraction(quality, MIXTURE, settings), 1e-12);
        assertEquals(1, VoidFractionModel.HOMOGENEOUS.voidFraction(1, MIXTURE, settings), 1e-12);
    }

    @Test
    void testSlipReducesVoidFraction() {
        double homogeneous = VoidFractionModel.HOMOGENEOUS.voidFraction(0.2, MIXTURE, VoidFractionSettings.of(VoidFractionModel.HOMOGENEOUS));
        double zivi = VoidFractionModel.ZIVI.voidFraction(0.2, MIXTURE, VoidFractionSettings.of(VoidFractionModel.ZIVI));
        double slip = VoidFractionModel.SLIP_RATIO.voidFraction(0.2, MIXTURE, VoidFractionSettings.slipRatio(1));
        assertTrue(zivi < homogeneous);
        assertEquals(homogeneous, slip, 1e-12);
    }

    @Test
    void testZiviClosedForm() {
        VoidFractionSettings zivi = VoidFractionSettings.of(VoidFractionModel.ZIVI);
        VoidFractionSettings integrated = VoidFractionSettings.of(VoidFractionModel.ZIVI_INTEGRATED);
        assertEquals(0.09995408895, integrated.liquidWeight(0.1, 0.8, MIXTURE), 1e-9);
        assertEquals(zivi.liquidWeight(0.1, 0.8, MIXTURE), integrated.liquidWeight(0.1, 0.8, MIXTURE), 1e-6);
        assertEquals(zivi.liquidWeight(0.3, 0.5, MIXTURE), integrated.liquidWeight(0.3, 0.5, MIXTURE), 1e-6);
    }

    @Test
    void testUserDefined() {
        VoidFractionSettings settings = VoidFractionSettings.userDefined(0.7);
        assertEquals(0.3, settings.liquidWeight(0, 0.9999, MIXTURE), 1e-12);
        assertThrows(IllegalArgumentException.class, () -> VoidFractionSettings.userDefined(1.5));
    }

    @Test
    void testDegenerateInterval() {
        VoidFractionSettings settings = VoidFractionSettings.of(VoidFractionModel.HOMOGENEOUS);
        double weight = settings.liquidWeight(0.4, 0.4, MIXTURE);
        assertEquals(1 - VoidFractionModel.HOMOGENEOUS.voidFraction(0.4, MIXTURE, settings), weight, 1e-12);
    }

    @Test
    void testFlowDependentModels() {
        for (VoidFractionModel model : new VoidFractionModel[] {VoidFractionModel.HUGHMARK, VoidFractionModel.LOCKHART_MARTINELLI, VoidFractionModel.PREMOLI}) {
            assertTrue(model.requiresFlowProperties());
        }
        assertFalse(VoidFractionModel.ZIVI.requiresFlowProperties());
        assertThrows(IllegalArgumentException.class, () -> VoidFractionSettings.of(VoidFractionModel.HUGHMARK));

        ChannelGeometry geometry = ChannelGeometry.builder().setHydraulicDiameter(1e-3).setCrossSection(1e-4).build();
        VoidFractionSettings hughmark = VoidFractionSettings.of(VoidFractionModel.HUGHMARK, geometry);
        double homogeneous = VoidFractionModel.HOMOGENEOUS.voidFraction(0.3, MIXTURE, hughmark);
        double alpha = VoidFractionModel.HUGHMARK.voidFraction(0.3, MIXTURE, hughmark);
        assertTrue(alpha > 0 && alpha <= homogeneous);

        double lockhartMartinelli = VoidFractionModel.LOCKHART_MARTINELLI.voidFraction(0.3, MIXTURE, VoidFractionSettings.of(VoidFractionModel.LOCKHART_MARTINELLI));
        assertTrue(lockhartMartinelli > 0 && lockhartMartinelli < 1);
    }
}
