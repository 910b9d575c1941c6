/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openorc.hex.htc;

import com.powsybl.openorc.OpenOrcParameters;
import com.powsybl.openorc.hex.Phase;
import com.powsybl.openorc.hex.Side;

/**
 * Strategy giving the convective heat transfer coefficient of one side of a zone, in W/m2/K.
 *
 * @author Open ORC developers
 */
public interface ConvectiveCoefficientModel {

    double coefficient(ZoneSide zoneSide, OpenOrcParameters parameters);

    /**
     * Whether the coefficient of this side and regime depends on the zone heat flux, in which case it needs the
     * coefficient of the other side, see {@link ZoneSide#otherSideCoefficient()}.
     */
    default boolean requiresHeatFluxClosure(Side side, Phase phase) {
        return false;
    }

    /**
     * Same model with hot and cold side settings exchanged.
     */
    ConvectiveCoefficientModel withSwappedSides();
}
