/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openorc.hex.htc;

import com.powsybl.openorc.hex.Phase;

/**
 * A value per regime: liquid, two-phase and vapour.
 *
 * @author Open ORC developers
 */
public record RegimeValues(double liquid, double twoPhase, double vapor) {

    public RegimeValues {
        checkFinite(liquid);
        checkFinite(twoPhase);
        checkFinite(vapor);
    }

    private static void checkFinite(double value) {
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException("Invalid regime value: " + value);
        }
    }

    public static RegimeValues uniform(double value) {
        return new RegimeValues(value, value, value);
    }

    public double get(Phase phase) {
        return switch (phase) {
            case LIQUID -> liquid;
            case TWO_PHASE -> twoPhase;
            case VAPOR -> vapor;
        };
    }
}
