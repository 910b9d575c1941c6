/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openorc.hex.model;

import com.powsybl.openorc.hex.htc.FinGeometry;

/**
 * Total heat transfer areas of both exchanger sides, with optional fins.
 *
 * @param hotFins null if none
 * @param coldFins null if none
 *
 * @author Open ORC developers
 */
public record HexAreas(double hot, double cold, FinGeometry hotFins, FinGeometry coldFins) {

    public HexAreas {
        checkArea(hot);
        checkArea(cold);
    }

    private static void checkArea(double area) {
        if (!(area > 0) || Double.isInfinite(area)) {
            throw new IllegalArgumentException("Invalid area value: " + area);
        }
    }

    /**
     * Same area on both sides, as in plate exchangers.
     */
    public static HexAreas of(double area) {
        return of(area, area);
    }

    public static HexAreas of(double hot, double cold) {
        return new HexAreas(hot, cold, null, null);
    }

    public HexAreas withFins(FinGeometry hotFins, FinGeometry coldFins) {
        return new HexAreas(hot, cold, hotFins, coldFins);
    }

    public HexAreas swapped() {
        return new HexAreas(cold, hot, coldFins, hotFins);
    }
}
