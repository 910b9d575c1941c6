/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openorc.hex.htc;

import com.powsybl.openorc.fluid.FluidProperty;
import com.powsybl.openorc.fluid.FluidStates;
import net.jafama.FastMath;

/**
 * Saturated properties and equivalent flow numbers of a two-phase zone side. Liquid and vapour properties are
 * taken on the saturation curve at the side pressure, the vapour quality at the mean zone enthalpy.
 *
 * @author Open ORC developers
 */
public record TwoPhaseFlow(double quality,
                           double liquidDensity,
                           double vaporDensity,
                           double liquidViscosity,
                           double vaporViscosity,
                           double liquidConductivity,
                           double liquidPrandtl,
                           double latentHeat,
                           double massFlux,
                           double equivalentMassFlux,
                           double equivalentReynolds,
                           double hydraulicDiameter) {

    static final double MIN_QUALITY = 1e-6;

    static final double MAX_QUALITY = 0.9999;

    public static TwoPhaseFlow of(ZoneSide zoneSide, ChannelGeometry geometry) {
        FluidStates states = zoneSide.stream().getStates();
        double pressure = zoneSide.pressure();
        double quality = zoneSide.stream().clampedQuality(zoneSide.meanEnthalpy(), MIN_QUALITY, MAX_QUALITY);
        double liquidDensity = states.saturated(FluidProperty.DENSITY, pressure, 0);
        double vaporDensity = states.saturated(FluidProperty.DENSITY, pressure, 1);
        double liquidViscosity = states.saturated(FluidProperty.VISCOSITY, pressure, 0);
        double vaporViscosity = states.saturated(FluidProperty.VISCOSITY, pressure, 1);
        double liquidConductivity = states.saturated(FluidProperty.CONDUCTIVITY, pressure, 0);
        double liquidSpecificHeat = states.saturated(FluidProperty.SPECIFIC_HEAT, pressure, 0);
        double massFlux = geometry.massFlux(zoneSide.stream().getMassFlow());
        double equivalentMassFlux = massFlux * ((1 - quality) + quality * FastMath.sqrt(liquidDensity / vaporDensity));
        double hydraulicDiameter = geometry.getHydraulicDiameter();
        return new TwoPhaseFlow(quality,
                                liquidDensity,
                                vaporDensity,
                                liquidViscosity,
                                vaporViscosity,
                                liquidConductivity,
                                liquidSpecificHeat * liquidViscosity / liquidConductivity,
                                zoneSide.stream().getLatentHeat(),
                                massFlux,
                                equivalentMassFlux,
                                equivalentMassFlux * hydraulicDiameter / liquidViscosity,
                                hydraulicDiameter);
    }

    /**
     * Liquid-only Reynolds number.
     */
    public double liquidReynolds() {
        return massFlux * hydraulicDiameter / liquidViscosity;
    }

    public double coefficient(double nusselt) {
        return nusselt * liquidConductivity / hydraulicDiameter;
    }
}
