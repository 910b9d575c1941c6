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
import net.jafama.FastMath;

import java.util.Objects;

/**
 * Convective coefficients scaled from nominal values with a power law of the mass flow rate:
 * h = h_n (m / m_n)^n.
 *
 * @author Open ORC developers
 */
public class MassFlowScaledCoefficients implements ConvectiveCoefficientModel {

    public static final double DEFAULT_EXPONENT = 0.8;

    private final SideScaling hot;

    private final SideScaling cold;

    /**
     * @param nominalCoefficients coefficients at the nominal mass flow rate
     * @param exponents mass flow exponents
     */
    public record SideScaling(RegimeValues nominalCoefficients, RegimeValues exponents, double nominalMassFlow) {

        public SideScaling {
            ConstantCoefficients.checkPositive(Objects.requireNonNull(nominalCoefficients));
            Objects.requireNonNull(exponents);
            if (!(nominalMassFlow > 0) || Double.isInfinite(nominalMassFlow)) {
                throw new IllegalArgumentException("Invalid nominal mass flow value: " + nominalMassFlow);
            }
        }

        public SideScaling(RegimeValues nominalCoefficients, double nominalMassFlow) {
            this(nominalCoefficients, RegimeValues.uniform(DEFAULT_EXPONENT), nominalMassFlow);
        }

        double coefficient(Phase phase, double massFlow) {
            return nominalCoefficients.get(phase) * FastMath.pow(massFlow / nominalMassFlow, exponents.get(phase));
        }
    }

    public MassFlowScaledCoefficients(SideScaling hot, SideScaling cold) {
        this.hot = Objects.requireNonNull(hot);
        this.cold = Objects.requireNonNull(cold);
    }

    public SideScaling get(Side side) {
        return side == Side.HOT ? hot : cold;
    }

    @Override
    public double coefficient(ZoneSide zoneSide, OpenOrcParameters parameters) {
        return get(zoneSide.side()).coefficient(zoneSide.phase(), zoneSide.stream().getMassFlow());
    }

    @Override
    public MassFlowScaledCoefficients withSwappedSides() {
        return new MassFlowScaledCoefficients(cold, hot);
    }
}
