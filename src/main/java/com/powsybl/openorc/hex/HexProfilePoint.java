/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openorc.hex;

/**
 * State of both streams at a zone boundary. Entropies are NaN for streams given by temperature and qualities are
 * NaN for incompressible streams.
 *
 * @param dutyFraction cumulative duty from the hot outlet over the total duty
 *
 * @author Open ORC developers
 */
public record HexProfilePoint(double dutyFraction,
                              double hotEnthalpy,
                              double coldEnthalpy,
                              double hotTemperature,
                              double coldTemperature,
                              double hotEntropy,
                              double coldEntropy,
                              double hotQuality,
                              double coldQuality) {

    public double temperatureDifference() {
        return hotTemperature - coldTemperature;
    }

    HexProfilePoint reversed() {
        return new HexProfilePoint(1 - dutyFraction, coldEnthalpy, hotEnthalpy, coldTemperature, hotTemperature,
                coldEntropy, hotEntropy, coldQuality, hotQuality);
    }
}
