/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openorc.hex.htc;

import com.powsybl.openorc.hex.Phase;
import com.powsybl.openorc.hex.ResolvedStream;
import com.powsybl.openorc.hex.Side;
import com.powsybl.openorc.hex.Zone;

import java.util.Objects;

/**
 * One side of a zone, as seen by a convective coefficient model.
 *
 * @param sideArea total heat transfer area of this side of the exchanger
 * @param otherSideCoefficient convective coefficient of the other side of the zone, NaN when not known yet
 *
 * @author Open ORC developers
 */
public record ZoneSide(Side side, ResolvedStream stream, Zone zone, double sideArea, double otherSideCoefficient) {

    public ZoneSide {
        Objects.requireNonNull(side);
        Objects.requireNonNull(stream);
        Objects.requireNonNull(zone);
    }

    public Phase phase() {
        return zone.phase(side);
    }

    public double pressure() {
        return stream.getPressure();
    }

    public double startEnthalpy() {
        return zone.startEnthalpy(side);
    }

    public double endEnthalpy() {
        return zone.endEnthalpy(side);
    }

    public double meanEnthalpy() {
        return zone.meanEnthalpy(side);
    }

    public double meanTemperature() {
        return 0.5 * (zone.startTemperature(side) + zone.endTemperature(side));
    }

    public double wallTemperature() {
        return zone.wallTemperature();
    }

    public double zoneDuty() {
        return zone.duty();
    }

    public double lmtd() {
        return zone.lmtd();
    }
}
