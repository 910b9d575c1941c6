/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openorc.hex.model;

import com.powsybl.openorc.OpenOrcParameters;
import com.powsybl.openorc.hex.MaxDuty;
import com.powsybl.openorc.hex.ResolvedStream;
import com.powsybl.openorc.hex.ZoneProfileBuilder;
import com.powsybl.openorc.solver.RootFinder;

import java.util.Objects;

/**
 * What a {@link HexModel} needs to find its duty: the ordered streams, a profile builder, the maximum duty and the
 * numerical settings.
 *
 * @author Open ORC developers
 */
public class HexSolvingContext {

    private final ZoneProfileBuilder profileBuilder;

    private final MaxDuty maxDuty;

    private final RootFinder rootFinder;

    private final OpenOrcParameters parameters;

    public HexSolvingContext(ZoneProfileBuilder profileBuilder, MaxDuty maxDuty, RootFinder rootFinder, OpenOrcParameters parameters) {
        this.profileBuilder = Objects.requireNonNull(profileBuilder);
        this.maxDuty = Objects.requireNonNull(maxDuty);
        this.rootFinder = Objects.requireNonNull(rootFinder);
        this.parameters = Objects.requireNonNull(parameters);
    }

    public ZoneProfileBuilder getProfileBuilder() {
        return profileBuilder;
    }

    public ResolvedStream getHot() {
        return profileBuilder.getHot();
    }

    public ResolvedStream getCold() {
        return profileBuilder.getCold();
    }

    public MaxDuty getMaxDuty() {
        return maxDuty;
    }

    public RootFinder getRootFinder() {
        return rootFinder;
    }

    public OpenOrcParameters getParameters() {
        return parameters;
    }

    public double getSupplyTemperatureDifference() {
        return getHot().getSupplyTemperature() - getCold().getSupplyTemperature();
    }

    /**
     * Whether the maximum duty is set by a vanishing pinch, which is required for the duty to be meaningful.
     */
    public boolean isMaxDutyPinchClosed() {
        return Math.abs(maxDuty.getPinch()) < parameters.getMaxDutyPinchThreshold();
    }
}
