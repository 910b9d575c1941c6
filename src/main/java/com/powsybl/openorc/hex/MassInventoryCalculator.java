/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openorc.hex;

import com.powsybl.openorc.fluid.FluidProperty;
import com.powsybl.openorc.fluid.FluidStates;
import com.powsybl.openorc.hex.htc.ChannelGeometry;
import com.powsybl.openorc.hex.htc.TwoPhaseMixture;
import com.powsybl.openorc.hex.htc.VoidFractionModel;
import com.powsybl.openorc.hex.htc.VoidFractionSettings;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Fluid mass retained in each zone of one exchanger side.
 * <p>
 * Single-phase zones, and two-phase zones without void fraction model, hold the side volume share times the mean of
 * the zone end densities. Two-phase zones with a void fraction model hold V (rho_l w + rho_v (1 - w)), w being the
 * mean liquid volume fraction over the zone quality interval.
 *
 * @author Open ORC developers
 */
public final class MassInventoryCalculator {

    private static final double MIN_QUALITY = 1e-6;

    private static final double MAX_QUALITY = 0.9999;

    /**
     * @param liquidWeight mean liquid volume fraction, NaN when not computed
     */
    public record ZoneInventory(double volume, double mass, double liquidWeight) {
    }

    private MassInventoryCalculator() {
    }

    /**
     * Share of the side volume of each zone: area-proportional when areas are known, duty-proportional otherwise.
     * A profile without duty keeps the whole volume in its first zone.
     */
    public static double[] volumeFractions(Profile profile, AreaEvaluation areaEvaluation) {
        List<Zone> zones = profile.getZones();
        double[] fractions = new double[zones.size()];
        if (areaEvaluation != null && areaEvaluation.getRequiredHotArea() > 0) {
            for (int i = 0; i < fractions.length; i++) {
                fractions[i] = areaEvaluation.getZones().get(i).hotArea() / areaEvaluation.getRequiredHotArea();
            }
        } else if (profile.getDuty() > 0) {
            for (int i = 0; i < fractions.length; i++) {
                fractions[i] = zones.get(i).duty() / profile.getDuty();
            }
        } else {
            fractions[0] = 1;
        }
        return fractions;
    }

    /**
     * @param voidFraction void fraction settings of the side, null if none
     */
    public static List<ZoneInventory> calculate(Side side, ResolvedStream stream, Profile profile, double[] volumeFractions,
                                                double sideVolume, VoidFractionSettings voidFraction) {
        Objects.requireNonNull(side);
        Objects.requireNonNull(stream);
        List<Zone> zones = profile.getZones();
        if (volumeFractions.length != zones.size()) {
            throw new IllegalArgumentException("Invalid volume fraction count: " + volumeFractions.length);
        }
        List<ZoneInventory> inventories = new ArrayList<>(zones.size());
        for (int i = 0; i < zones.size(); i++) {
            Zone zone = zones.get(i);
            double volume = sideVolume * volumeFractions[i];
            if (zone.phase(side) == Phase.TWO_PHASE && voidFraction != null) {
                inventories.add(twoPhaseInventory(side, stream, zone, volume, voidFraction));
            } else {
                double density = 0.5 * (stream.density(zone.startEnthalpy(side)) + stream.density(zone.endEnthalpy(side)));
                inventories.add(new ZoneInventory(volume, volume * density, Double.NaN));
            }
        }
        return inventories;
    }

    private static ZoneInventory twoPhaseInventory(Side side, ResolvedStream stream, Zone zone, double volume,
                                                   VoidFractionSettings voidFraction) {
        TwoPhaseMixture mixture = mixture(side, stream, zone, voidFraction);
        double quality1 = stream.clampedQuality(zone.startEnthalpy(side), MIN_QUALITY, MAX_QUALITY);
        double quality2 = stream.clampedQuality(zone.endEnthalpy(side), MIN_QUALITY, MAX_QUALITY);
        double liquidWeight = voidFraction.liquidWeight(Math.min(quality1, quality2), Math.max(quality1, quality2), mixture);
        double mass = volume * (mixture.liquidDensity() * liquidWeight + mixture.vaporDensity() * (1 - liquidWeight));
        return new ZoneInventory(volume, mass, liquidWeight);
    }

    private static TwoPhaseMixture mixture(Side side, ResolvedStream stream, Zone zone, VoidFractionSettings voidFraction) {
        FluidStates states = stream.getStates();
        double pressure = stream.getPressure();
        double liquidDensity = states.saturated(FluidProperty.DENSITY, pressure, 0);
        double vaporDensity = states.saturated(FluidProperty.DENSITY, pressure, 1);
        VoidFractionModel model = voidFraction.model();
        if (!model.requiresFlowProperties()) {
            return new TwoPhaseMixture(liquidDensity, vaporDensity);
        }
        double liquidViscosity = states.saturated(FluidProperty.VISCOSITY, pressure, 0);
        double vaporViscosity = states.saturated(FluidProperty.VISCOSITY, pressure, 1);
        double surfaceTension = model == VoidFractionModel.PREMOLI
                ? states.surfaceTension(pressure, zone.meanEnthalpy(side))
                : Double.NaN;
        ChannelGeometry geometry = voidFraction.geometry();
        double hydraulicDiameter = geometry != null ? geometry.getHydraulicDiameter() : Double.NaN;
        double massFlux = geometry != null ? geometry.massFlux(stream.getMassFlow()) : Double.NaN;
        return new TwoPhaseMixture(liquidDensity, vaporDensity, liquidViscosity, vaporViscosity, surfaceTension,
                hydraulicDiameter, massFlux);
    }
}
