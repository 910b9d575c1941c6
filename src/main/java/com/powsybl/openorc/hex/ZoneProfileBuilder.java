/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openorc.hex;

import com.powsybl.openorc.OpenOrcParameters;
import net.jafama.FastMath;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Splits a counter-flow exchanger into phase-homogeneous zones for a candidate duty.
 * <p>
 * Zone boundaries are placed at the saturated enthalpies of each side, plus equidistant enthalpies splitting the
 * two-phase region in {@code twoPhaseZoneCount} sub-zones, as long as they lie strictly inside the enthalpy range
 * covered by the side.
 *
 * @author Open ORC developers
 */
public class ZoneProfileBuilder {

    private final ResolvedStream hot;

    private final ResolvedStream cold;

    private final int twoPhaseZoneCount;

    private final double temperatureDifferenceFloor;

    public ZoneProfileBuilder(ResolvedStream hot, ResolvedStream cold, OpenOrcParameters parameters) {
        this(hot, cold, parameters.getTwoPhaseZoneCount(), parameters.getTemperatureDifferenceFloor());
    }

    public ZoneProfileBuilder(ResolvedStream hot, ResolvedStream cold, int twoPhaseZoneCount, double temperatureDifferenceFloor) {
        this.hot = Objects.requireNonNull(hot);
        this.cold = Objects.requireNonNull(cold);
        if (twoPhaseZoneCount < 1) {
            throw new IllegalArgumentException("Invalid two-phase zone count value: " + twoPhaseZoneCount);
        }
        this.twoPhaseZoneCount = twoPhaseZoneCount;
        this.temperatureDifferenceFloor = temperatureDifferenceFloor;
    }

    public ResolvedStream getHot() {
        return hot;
    }

    public ResolvedStream getCold() {
        return cold;
    }

    public double getTemperatureDifferenceFloor() {
        return temperatureDifferenceFloor;
    }

    public Profile build(double duty) {
        if (!(duty >= 0) || Double.isInfinite(duty)) {
            throw new IllegalArgumentException("Invalid duty value: " + duty);
        }
        double hotExitEnthalpy = duty == 0 ? hot.getSupplyEnthalpy() : hot.getSupplyEnthalpy() - duty / hot.getMassFlow();
        double coldExitEnthalpy = duty == 0 ? cold.getSupplyEnthalpy() : cold.getSupplyEnthalpy() + duty / cold.getMassFlow();

        double[] duties = breakpoints(duty, hotExitEnthalpy, coldExitEnthalpy);
        int last = duties.length - 1;
        List<ZoneBoundary> boundaries = new ArrayList<>(duties.length);
        for (int i = 0; i <= last; i++) {
            double hotEnthalpy;
            double coldEnthalpy;
            if (i == 0) {
                hotEnthalpy = hotExitEnthalpy;
                coldEnthalpy = cold.getSupplyEnthalpy();
            } else if (i == last) {
                hotEnthalpy = hot.getSupplyEnthalpy();
                coldEnthalpy = coldExitEnthalpy;
            } else {
                hotEnthalpy = hotExitEnthalpy + duties[i] / hot.getMassFlow();
                coldEnthalpy = cold.getSupplyEnthalpy() + duties[i] / cold.getMassFlow();
            }
            boundaries.add(new ZoneBoundary(duties[i], hotEnthalpy, coldEnthalpy,
                    hot.temperature(hotEnthalpy), cold.temperature(coldEnthalpy)));
        }

        List<Zone> zones = new ArrayList<>(last);
        for (int j = 0; j < last; j++) {
            ZoneBoundary start = boundaries.get(j);
            ZoneBoundary end = boundaries.get(j + 1);
            Phase hotPhase = hot.phaseOf(0.5 * (start.hotEnthalpy() + end.hotEnthalpy()));
            Phase coldPhase = cold.phaseOf(0.5 * (start.coldEnthalpy() + end.coldEnthalpy()));
            double lmtd = lmtd(end.temperatureDifference(), start.temperatureDifference(), temperatureDifferenceFloor);
            zones.add(new Zone(j, start, end, hotPhase, coldPhase, lmtd));
        }
        return new Profile(duty, boundaries, zones);
    }

    private double[] breakpoints(double duty, double hotExitEnthalpy, double coldExitEnthalpy) {
        if (duty == 0) {
            // single degenerate zone
            return new double[] {0, 0};
        }
        List<Double> duties = new ArrayList<>();
        duties.add(0.0);
        addTwoPhaseBreakpoints(hot, hotExitEnthalpy, hot.getSupplyEnthalpy(), duty, duties);
        addTwoPhaseBreakpoints(cold, cold.getSupplyEnthalpy(), coldExitEnthalpy, duty, duties);
        duties.add(duty);
        return duties.stream().mapToDouble(Double::doubleValue).sorted().distinct().toArray();
    }

    /**
     * Enthalpy {@code lowerEnthalpy} is located at duty 0 for both sides: hot outlet and cold inlet.
     */
    private void addTwoPhaseBreakpoints(ResolvedStream stream, double lowerEnthalpy, double upperEnthalpy, double duty,
                                        List<Double> duties) {
        if (!stream.hasTwoPhaseDome()) {
            return;
        }
        double bubble = stream.getBubbleEnthalpy();
        double dew = stream.getDewEnthalpy();
        for (int k = 0; k <= twoPhaseZoneCount; k++) {
            double enthalpy = bubble + (dew - bubble) * k / twoPhaseZoneCount;
            if (enthalpy > lowerEnthalpy && enthalpy < upperEnthalpy) {
                duties.add(Math.min(duty, stream.getMassFlow() * (enthalpy - lowerEnthalpy)));
            }
        }
    }

    /**
     * Log mean temperature difference, each end difference being floored.
     */
    public static double lmtd(double dt1, double dt2, double floor) {
        double a = Math.max(dt1, floor);
        double b = Math.max(dt2, floor);
        if (a == b) {
            return a;
        }
        return (a - b) / FastMath.log(a / b);
    }
}
