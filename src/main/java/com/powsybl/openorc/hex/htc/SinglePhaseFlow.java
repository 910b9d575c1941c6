/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openorc.hex.htc;

import com.powsybl.openorc.fluid.FluidStates;

/**
 * Transport properties and dimensionless numbers of a single-phase zone side.
 *
 * @param massFlux mass flux per channel
 * @param reynolds Reynolds number based on the hydraulic diameter
 * @param prandtl Prandtl number
 * @param conductivity thermal conductivity
 * @param hydraulicDiameter hydraulic diameter
 *
 * @author Open ORC developers
 */
public record SinglePhaseFlow(double massFlux, double reynolds, double prandtl, double conductivity,
                              double hydraulicDiameter) {

    /**
     * Properties are taken at the mean zone enthalpy, or averaged over the zone ends for incompressible streams.
     */
    public static SinglePhaseFlow of(ZoneSide zoneSide, ChannelGeometry geometry) {
        FluidStates states = zoneSide.stream().getStates();
        double pressure = zoneSide.pressure();
        double viscosity;
        double conductivity;
        double specificHeat;
        if (zoneSide.stream().isIncompressible()) {
            double h1 = zoneSide.startEnthalpy();
            double h2 = zoneSide.endEnthalpy();
            viscosity = 0.5 * (states.viscosity(pressure, h1) + states.viscosity(pressure, h2));
            conductivity = 0.5 * (states.conductivity(pressure, h1) + states.conductivity(pressure, h2));
            specificHeat = 0.5 * (states.specificHeat(pressure, h1) + states.specificHeat(pressure, h2));
        } else {
            double h = zoneSide.meanEnthalpy();
            viscosity = states.viscosity(pressure, h);
            conductivity = states.conductivity(pressure, h);
            specificHeat = states.specificHeat(pressure, h);
        }
        double massFlux = geometry.massFlux(zoneSide.stream().getMassFlow());
        double hydraulicDiameter = geometry.getHydraulicDiameter();
        return new SinglePhaseFlow(massFlux,
                                   massFlux * hydraulicDiameter / viscosity,
                                   specificHeat * viscosity / conductivity,
                                   conductivity,
                                   hydraulicDiameter);
    }

    /**
     * Convective coefficient of a Nusselt number based on the hydraulic diameter.
     */
    public double coefficient(double nusselt) {
        return nusselt * conductivity / hydraulicDiameter;
    }
}
