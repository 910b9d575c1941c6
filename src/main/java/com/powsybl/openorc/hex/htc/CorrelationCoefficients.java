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

import java.util.Objects;

/**
 * Convective coefficients given by empirical correlations, chosen per side and regime.
 *
 * @author Open ORC developers
 */
public class CorrelationCoefficients implements ConvectiveCoefficientModel {

    private final CorrelationSettings hot;

    private final CorrelationSettings cold;

    public CorrelationCoefficients(CorrelationSettings hot, CorrelationSettings cold) {
        this.hot = Objects.requireNonNull(hot);
        this.cold = Objects.requireNonNull(cold);
    }

    public CorrelationSettings get(Side side) {
        return side == Side.HOT ? hot : cold;
    }

    @Override
    public double coefficient(ZoneSide zoneSide, OpenOrcParameters parameters) {
        CorrelationSettings settings = get(zoneSide.side());
        if (zoneSide.phase() == Phase.TWO_PHASE) {
            return settings.getTwoPhaseCorrelation().coefficient(zoneSide, settings, parameters);
        }
        return settings.getSinglePhaseCorrelation().coefficient(zoneSide, settings);
    }

    @Override
    public boolean requiresHeatFluxClosure(Side side, Phase phase) {
        return phase == Phase.TWO_PHASE && get(side).getTwoPhaseCorrelation().requiresHeatFluxClosure();
    }

    @Override
    public CorrelationCoefficients withSwappedSides() {
        return new CorrelationCoefficients(cold, hot);
    }
}
