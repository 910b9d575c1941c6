/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openorc.hex;

/**
 * Heat transfer of one zone: convective coefficients, surface efficiencies, overall coefficient referred to the hot
 * side area, and the area each side needs to transfer the zone duty.
 *
 * @author Open ORC developers
 */
public record ZoneHeatTransfer(Zone zone,
                               double hotCoefficient,
                               double coldCoefficient,
                               double hotSurfaceEfficiency,
                               double coldSurfaceEfficiency,
                               double overallCoefficient,
                               double hotArea,
                               double coldArea) {

    public double coefficient(Side side) {
        return side == Side.HOT ? hotCoefficient : coldCoefficient;
    }
}
