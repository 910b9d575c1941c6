/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openorc.hex.htc;

/**
 * Saturated properties and flow data used by the void fraction models. Viscosities, surface tension, hydraulic
 * diameter and mass flux are only needed by some models and may be NaN otherwise.
 *
 * @author Open ORC developers
 */
public record TwoPhaseMixture(double liquidDensity, double vaporDensity, double liquidViscosity, double vaporViscosity,
                              double surfaceTension, double hydraulicDiameter, double massFlux) {

    public TwoPhaseMixture(double liquidDensity, double vaporDensity) {
        this(liquidDensity, vaporDensity, Double.NaN, Double.NaN, Double.NaN, Double.NaN, Double.NaN);
    }

    public double densityRatio() {
        return vaporDensity / liquidDensity;
    }
}
