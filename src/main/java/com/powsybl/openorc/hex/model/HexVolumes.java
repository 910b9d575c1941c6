/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openorc.hex.model;

import com.powsybl.openorc.hex.Side;
import com.powsybl.openorc.hex.htc.VoidFractionSettings;

/**
 * Internal volumes of both exchanger sides, with the void fraction models used for the mass of two-phase zones.
 * Without void fraction model, a two-phase zone mass is computed like a single-phase one from the mean of the zone
 * end densities.
 *
 * @param hotVoidFraction null if none
 * @param coldVoidFraction null if none
 *
 * @author Open ORC developers
 */
public record HexVolumes(double hot, double cold, VoidFractionSettings hotVoidFraction, VoidFractionSettings coldVoidFraction) {

    public HexVolumes {
        checkVolume(hot);
        checkVolume(cold);
    }

    private static void checkVolume(double volume) {
        if (!(volume >= 0) || Double.isInfinite(volume)) {
            throw new IllegalArgumentException("Invalid volume value: " + volume);
        }
    }

    public static HexVolumes of(double hot, double cold) {
        return new HexVolumes(hot, cold, null, null);
    }

    public static HexVolumes none() {
        return of(0, 0);
    }

    public HexVolumes withVoidFractions(VoidFractionSettings hotVoidFraction, VoidFractionSettings coldVoidFraction) {
        return new HexVolumes(hot, cold, hotVoidFraction, coldVoidFraction);
    }

    public double get(Side side) {
        return side == Side.HOT ? hot : cold;
    }

    public VoidFractionSettings getVoidFraction(Side side) {
        return side == Side.HOT ? hotVoidFraction : coldVoidFraction;
    }

    public HexVolumes swapped() {
        return new HexVolumes(cold, hot, coldVoidFraction, hotVoidFraction);
    }
}
