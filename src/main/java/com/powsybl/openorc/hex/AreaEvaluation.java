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
 * Heat transfer areas needed by a profile, compared with the available hot side area.
 *
 * @author Open ORC developers
 */
public class AreaEvaluation {

    private final Profile profile;

    private final List<ZoneHeatTransfer> zones;

    private final double requiredHotArea;

    private final double residual;

    public AreaEvaluation(Profile profile, List<ZoneHeatTransfer> zones, double availableHotArea) {
        this.profile = Objects.requireNonNull(profile);
        this.zones = List.copyOf(Objects.requireNonNull(zones));
        this.requiredHotArea = this.zones.stream().mapToDouble(ZoneHeatTransfer::hotArea).sum();
        this.residual = 1 - requiredHotArea / availableHotArea;
    }

    public Profile getProfile() {
        return profile;
    }

    public List<ZoneHeatTransfer> getZones() {
        return zones;
    }

    public double getRequiredHotArea() {
        return requiredHotArea;
    }

    /**
     * Positive when the available area is larger than the required one.
     */
    public double getResidual() {
        return residual;
    }
}
