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
 * Largest duty the two streams can exchange without temperature cross.
 *
 * @author Open ORC developers
 */
public class MaxDuty {

    private final double enthalpyLimit;

    private final double duty;

    private final Profile profile;

    public MaxDuty(double enthalpyLimit, double duty, Profile profile) {
        this.enthalpyLimit = enthalpyLimit;
        this.duty = duty;
        this.profile = Objects.requireNonNull(profile);
    }

    /**
     * Duty bringing one stream to the supply temperature of the other one.
     */
    public double getEnthalpyLimit() {
        return enthalpyLimit;
    }

    public double getDuty() {
        return duty;
    }

    public Profile getProfile() {
        return profile;
    }

    public double getPinch() {
        return profile.getPinch();
    }

    @Override
    public String toString() {
        return "MaxDuty(enthalpyLimit=" + enthalpyLimit + ", duty=" + duty + ", pinch=" + getPinch() + ")";
    }
}
