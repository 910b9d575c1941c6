/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openorc.hex.htc;

import net.jafama.FastMath;

/**
 * Fins of one exchanger side, for the Schmidt fin efficiency of rectangular fins on tubes.
 *
 * @param conductivity fin material thermal conductivity
 * @param thickness fin thickness
 * @param tubeRadius tube outer radius
 * @param transversePitch half transverse tube pitch
 * @param longitudinalPitch tube pitch in the flow direction
 * @param finAreaFraction fraction of the side area made of fins
 *
 * @author Open ORC developers
 */
public record FinGeometry(double conductivity, double thickness, double tubeRadius, double transversePitch,
                          double longitudinalPitch, double finAreaFraction) {

    public FinGeometry {
        checkPositive(conductivity, "conductivity");
        checkPositive(thickness, "thickness");
        checkPositive(tubeRadius, "tube radius");
        checkPositive(transversePitch, "transverse pitch");
        checkPositive(longitudinalPitch, "longitudinal pitch");
        if (finAreaFraction < 0 || finAreaFraction > 1) {
            throw new IllegalArgumentException("Invalid fin area fraction value: " + finAreaFraction);
        }
    }

    private static void checkPositive(double value, String name) {
        if (!(value > 0) || Double.isInfinite(value)) {
            throw new IllegalArgumentException("Invalid fin " + name + " value: " + value);
        }
    }

    /**
     * Efficiency of a single fin.
     */
    public double finEfficiency(double convectiveCoefficient) {
        if (convectiveCoefficient <= 0) {
            return 1;
        }
        double m = FastMath.sqrt(2 * convectiveCoefficient / conductivity / thickness);
        double phiF = transversePitch / tubeRadius;
        double betaF = longitudinalPitch / transversePitch;
        double equivalentRadius = tubeRadius * 1.27 * phiF * FastMath.sqrt(betaF - 0.3);
        double phi = (equivalentRadius / tubeRadius - 1) * (1 + 0.35 * FastMath.log(equivalentRadius / tubeRadius));
        double x = m * equivalentRadius * phi;
        return FastMath.tanh(x) / x;
    }

    /**
     * Efficiency of the finned surface, fins and base together.
     */
    public double surfaceEfficiency(double convectiveCoefficient) {
        return 1 - finAreaFraction * (1 - finEfficiency(convectiveCoefficient));
    }
}
