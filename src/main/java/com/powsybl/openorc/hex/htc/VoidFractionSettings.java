/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openorc.hex.htc;

import java.util.Objects;

/**
 * Void fraction model of one exchanger side, with its parameters.
 *
 * @param slipRatio slip ratio of {@link VoidFractionModel#SLIP_RATIO}
 * @param massVoidFraction mass void fraction of {@link VoidFractionModel#USER_DEFINED}
 * @param geometry channel geometry, required by Hughmark and Premoli models
 *
 * @author Open ORC developers
 */
public record VoidFractionSettings(VoidFractionModel model, double slipRatio, double massVoidFraction, ChannelGeometry geometry) {

    public VoidFractionSettings {
        Objects.requireNonNull(model);
        if (model == VoidFractionModel.SLIP_RATIO && !(slipRatio > 0)) {
            throw new IllegalArgumentException("Invalid slip ratio value: " + slipRatio);
        }
        if (model == VoidFractionModel.USER_DEFINED && !(massVoidFraction >= 0 && massVoidFraction <= 1)) {
            throw new IllegalArgumentException("Invalid mass void fraction value: " + massVoidFraction);
        }
        if ((model == VoidFractionModel.HUGHMARK || model == VoidFractionModel.PREMOLI) && geometry == null) {
            throw new IllegalArgumentException("Void fraction model " + model + " requires a channel geometry");
        }
    }

    public static VoidFractionSettings of(VoidFractionModel model) {
        return new VoidFractionSettings(model, Double.NaN, Double.NaN, null);
    }

    public static VoidFractionSettings of(VoidFractionModel model, ChannelGeometry geometry) {
        return new VoidFractionSettings(model, Double.NaN, Double.NaN, Objects.requireNonNull(geometry));
    }

    public static VoidFractionSettings slipRatio(double slipRatio) {
        return new VoidFractionSettings(VoidFractionModel.SLIP_RATIO, slipRatio, Double.NaN, null);
    }

    public static VoidFractionSettings userDefined(double massVoidFraction) {
        return new VoidFractionSettings(VoidFractionModel.USER_DEFINED, Double.NaN, massVoidFraction, null);
    }

    public double liquidWeight(double quality1, double quality2, TwoPhaseMixture mixture) {
        return model.liquidWeight(quality1, quality2, mixture, this);
    }
}
