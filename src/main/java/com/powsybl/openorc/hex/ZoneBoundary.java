/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openorc.hex;

/**
 * State of both streams at one point of the duty axis. The cumulative duty is counted from the cold inlet, which is
 * also the hot outlet.
 *
 * @author Open ORC developers
 */
public record ZoneBoundary(double cumulativeDuty, double hotEnthalpy, double coldEnthalpy,
                           double hotTemperature, double coldTemperature) {

    public double temperatureDifference() {
        return hotTemperature - coldTemperature;
    }
}
