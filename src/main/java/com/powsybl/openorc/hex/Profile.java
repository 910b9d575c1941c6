/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openorc.hex;

import java.util.List;
import java.util.Objects;

/**
 * Temperature profile of the exchanger for a given duty. Boundaries are ordered from the cold inlet to the cold
 * outlet.
 *
 * @author Open ORC developers
 */
public class Profile {

    private final double duty;

    private final List<ZoneBoundary> boundaries;

    private final List<Zone> zones;

    private final double pinch;

    public Profile(double duty, List<ZoneBoundary> boundaries, List<Zone> zones) {
        this.duty = duty;
        this.boundaries = List.copyOf(Objects.requireNonNull(boundaries));
        this.zones = List.copyOf(Objects.requireNonNull(zones));
        if (this.boundaries.size() < 2 || this.zones.size() != this.boundaries.size() - 1) {
            throw new IllegalArgumentException("Invalid profile: " + this.boundaries.size() + " boundaries, "
                    + this.zones.size() + " zones");
        }
        this.pinch = this.boundaries.stream().mapToDouble(ZoneBoundary::temperatureDifference).min().orElseThrow();
    }

    public double getDuty() {
        return duty;
    }

    public List<ZoneBoundary> getBoundaries() {
        return boundaries;
    }

    public List<Zone> getZones() {
        return zones;
    }

    /**
     * Smallest hot minus cold temperature difference over all boundaries.
     */
    public double getPinch() {
        return pinch;
    }

    public double getHotExitEnthalpy() {
        return boundaries.get(0).hotEnthalpy();
    }

    public double getHotExitTemperature() {
        return boundaries.get(0).hotTemperature();
    }

    public double getColdExitEnthalpy() {
        return boundaries.get(boundaries.size() - 1).coldEnthalpy();
    }

    public double getColdExitTemperature() {
        return boundaries.get(boundaries.size() - 1).coldTemperature();
    }
}
