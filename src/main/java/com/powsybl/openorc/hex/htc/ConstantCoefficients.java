/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openorc.hex.htc;

import com.powsybl.openorc.OpenOrcParameters;
import com.powsybl.openorc.hex.Side;

import java.util.Objects;

/**
 * Constant convective coefficients per side and regime.
 *
 * @author Open ORC developers
 */
public class ConstantCoefficients implements ConvectiveCoefficientModel {

    private final RegimeValues hot;

    private final RegimeValues cold;

    public ConstantCoefficients(RegimeValues hot, RegimeValues cold) {
        this.hot = checkPositive(Objects.requireNonNull(hot));
        this.cold = checkPositive(Objects.requireNonNull(cold));
    }

    static RegimeValues checkPositive(RegimeValues values) {
        if (values.liquid() <= 0 || values.twoPhase() <= 0 || values.vapor() <= 0) {
            throw new IllegalArgumentException("Invalid convective coefficient value: " + values);
        }
        return values;
    }

    public RegimeValues get(Side side) {
        return side == Side.HOT ? hot : cold;
    }

    @Override
    public double coefficient(ZoneSide zoneSide, OpenOrcParameters parameters) {
        return get(zoneSide.side()).get(zoneSide.phase());
    }

    @Override
    public ConstantCoefficients withSwappedSides() {
        return new ConstantCoefficients(cold, hot);
    }
}
