/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openorc.hex;

import java.util.Objects;

/**
 * Portion of the exchanger between two consecutive boundaries, homogeneous in phase on each side.
 *
 * @author Open ORC developers
 */
public record Zone(int index, ZoneBoundary start, ZoneBoundary end, Phase hotPhase, Phase coldPhase, double lmtd) {

    public Zone {
        Objects.requireNonNull(start);
        Objects.requireNonNull(end);
        Objects.requireNonNull(hotPhase);
        Objects.requireNonNull(coldPhase);
    }

    public double duty() {
        return end.cumulativeDuty() - start.cumulativeDuty();
    }

    public Phase phase(Side side) {
        return side == Side.HOT ? hotPhase : coldPhase;
    }

    public double startEnthalpy(Side side) {
        return side == Side.HOT ? start.hotEnthalpy() : start.coldEnthalpy();
    }

    public double endEnthalpy(Side side) {
        return side == Side.HOT ? end.hotEnthalpy() : end.coldEnthalpy();
    }

    public double startTemperature(Side side) {
        return side == Side.HOT ? start.hotTemperature() : start.coldTemperature();
    }

    public double endTemperature(Side side) {
        return side == Side.HOT ? end.hotTemperature() : end.coldTemperature();
    }

    public double meanEnthalpy(Side side) {
        return 0.5 * (startEnthalpy(side) + endEnthalpy(side));
    }

    /**
     * Mean of the four boundary temperatures.
     */
    public double wallTemperature() {
        return 0.25 * (start.hotTemperature() + end.hotTemperature() + start.coldTemperature() + end.coldTemperature());
    }
}
