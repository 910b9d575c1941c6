/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openorc.hex;

/**
 * Result of one exchanger zone. Heat transfer values are NaN for models not computing areas, liquid weights are NaN
 * for zones without void fraction model.
 *
 * @author Open ORC developers
 */
public record HexZoneResult(int index,
                            Phase hotPhase,
                            Phase coldPhase,
                            double duty,
                            double lmtd,
                            double hotCoefficient,
                            double coldCoefficient,
                            double hotSurfaceEfficiency,
                            double coldSurfaceEfficiency,
                            double overallCoefficient,
                            double hotArea,
                            double coldArea,
                            double hotVolume,
                            double coldVolume,
                            double hotMass,
                            double coldMass,
                            double hotLiquidWeight,
                            double coldLiquidWeight) {

    public Phase phase(Side side) {
        return side == Side.HOT ? hotPhase : coldPhase;
    }

    public double coefficient(Side side) {
        return side == Side.HOT ? hotCoefficient : coldCoefficient;
    }

    public double mass(Side side) {
        return side == Side.HOT ? hotMass : coldMass;
    }

    HexZoneResult reversed(int newIndex) {
        // overall coefficient is referred to the hot side area
        double reversedOverallCoefficient = coldArea > 0 ? overallCoefficient * hotArea / coldArea : overallCoefficient;
        return new HexZoneResult(newIndex, coldPhase, hotPhase, duty, lmtd, coldCoefficient, hotCoefficient,
                coldSurfaceEfficiency, hotSurfaceEfficiency, reversedOverallCoefficient, coldArea, hotArea, coldVolume, hotVolume,
                coldMass, hotMass, coldLiquidWeight, hotLiquidWeight);
    }
}
