/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openorc.hex;

import com.powsybl.openorc.OpenOrcParameters;
import com.powsybl.openorc.hex.htc.ConvectiveCoefficientModel;
import com.powsybl.openorc.hex.htc.FinGeometry;
import com.powsybl.openorc.hex.htc.ZoneSide;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Computes, zone by zone, the heat transfer area a profile needs with a given convective coefficient model.
 * <p>
 * When the coefficient of one side depends on the zone heat flux, the coefficient of the other side is computed
 * first. Both sides of a zone cannot depend on the heat flux.
 *
 * @author Open ORC developers
 */
public class HeatTransferZoneEvaluator {

    private final ConvectiveCoefficientModel coefficientModel;

    private final double hotArea;

    private final double coldArea;

    private final FinGeometry hotFins;

    private final FinGeometry coldFins;

    private final OpenOrcParameters parameters;

    /**
     * @param hotFins hot side fins, null if none
     * @param coldFins cold side fins, null if none
     */
    public HeatTransferZoneEvaluator(ConvectiveCoefficientModel coefficientModel, double hotArea, double coldArea,
                                     FinGeometry hotFins, FinGeometry coldFins, OpenOrcParameters parameters) {
        this.coefficientModel = Objects.requireNonNull(coefficientModel);
        this.hotArea = checkArea(hotArea);
        this.coldArea = checkArea(coldArea);
        this.hotFins = hotFins;
        this.coldFins = coldFins;
        this.parameters = Objects.requireNonNull(parameters);
    }

    static double checkArea(double area) {
        if (!(area > 0) || Double.isInfinite(area)) {
            throw new IllegalArgumentException("Invalid area value: " + area);
        }
        return area;
    }

    public AreaEvaluation evaluate(Profile profile, ResolvedStream hot, ResolvedStream cold) {
        List<ZoneHeatTransfer> transfers = new ArrayList<>(profile.getZones().size());
        for (Zone zone : profile.getZones()) {
            transfers.add(evaluate(zone, hot, cold));
        }
        return new AreaEvaluation(profile, transfers, hotArea);
    }

    private ZoneHeatTransfer evaluate(Zone zone, ResolvedStream hot, ResolvedStream cold) {
        boolean hotClosure = coefficientModel.requiresHeatFluxClosure(Side.HOT, zone.hotPhase());
        boolean coldClosure = coefficientModel.requiresHeatFluxClosure(Side.COLD, zone.coldPhase());
        if (hotClosure && coldClosure) {
            throw new IllegalArgumentException("Heat flux dependent correlations on both sides of zone " + zone.index());
        }

        double hotCoefficient;
        double coldCoefficient;
        if (hotClosure) {
            coldCoefficient = coefficientModel.coefficient(new ZoneSide(Side.COLD, cold, zone, coldArea, Double.NaN), parameters);
            hotCoefficient = coefficientModel.coefficient(new ZoneSide(Side.HOT, hot, zone, hotArea, coldCoefficient), parameters);
        } else {
            hotCoefficient = coefficientModel.coefficient(new ZoneSide(Side.HOT, hot, zone, hotArea, Double.NaN), parameters);
            coldCoefficient = coefficientModel.coefficient(new ZoneSide(Side.COLD, cold, zone, coldArea, hotCoefficient), parameters);
        }

        double hotEfficiency = hotFins != null ? hotFins.surfaceEfficiency(hotCoefficient) : 1;
        double coldEfficiency = coldFins != null ? coldFins.surfaceEfficiency(coldCoefficient) : 1;
        double u = 1 / (1 / (hotCoefficient * hotEfficiency) + 1 / (coldCoefficient * coldEfficiency * (coldArea / hotArea)));
        double zoneHotArea = zone.duty() > 0 ? zone.duty() / zone.lmtd() / u : 0;
        return new ZoneHeatTransfer(zone, hotCoefficient, coldCoefficient, hotEfficiency, coldEfficiency, u,
                zoneHotArea, zoneHotArea * coldArea / hotArea);
    }
}
