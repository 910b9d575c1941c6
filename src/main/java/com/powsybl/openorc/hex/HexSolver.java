/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openorc.hex;

import com.powsybl.openorc.OpenOrcParameters;
import com.powsybl.openorc.fluid.FluidPropertyOracle;
import com.powsybl.openorc.fluid.PropertyUndefinedException;
import com.powsybl.openorc.fluid.Stream;
import com.powsybl.openorc.hex.model.DutySolution;
import com.powsybl.openorc.hex.model.HexModel;
import com.powsybl.openorc.hex.model.HexSolvingContext;
import com.powsybl.openorc.hex.model.HexVolumes;
import com.powsybl.openorc.solver.BrentRootFinder;
import com.powsybl.openorc.solver.RootFinder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Counter-flow heat exchanger solver.
 * <p>
 * The streams are first ordered so that the hot one is the warmer at supply, swapping roles and model settings if
 * needed. Streams at nearly equal temperatures, or without flow, pass through without exchange. Otherwise the
 * maximum duty is computed and the model finds the duty, from which exit states, zone areas and masses follow.
 * When no duty can be found on an undefined fluid state, the streams pass through and the result is flagged as not
 * converged.
 * <p>
 * A solver instance holds no state between calls.
 *
 * @author Open ORC developers
 */
public class HexSolver {

    private static final Logger LOGGER = LoggerFactory.getLogger(HexSolver.class);

    private final FluidPropertyOracle oracle;

    private final OpenOrcParameters parameters;

    private final RootFinder rootFinder;

    public HexSolver(FluidPropertyOracle oracle, OpenOrcParameters parameters) {
        this(oracle, parameters, new BrentRootFinder(parameters.getRootFinderMaxEvaluations()));
    }

    public HexSolver(FluidPropertyOracle oracle, OpenOrcParameters parameters, RootFinder rootFinder) {
        this.oracle = Objects.requireNonNull(oracle);
        this.parameters = Objects.requireNonNull(parameters);
        this.rootFinder = Objects.requireNonNull(rootFinder);
    }

    public HexResult solve(Stream hot, Stream cold, HexModel model) {
        Objects.requireNonNull(hot);
        Objects.requireNonNull(cold);
        Objects.requireNonNull(model);
        if (hot.getPressure() <= 0 || cold.getPressure() <= 0) {
            LOGGER.warn("Non positive supply pressure (hot {} Pa, cold {} Pa)", hot.getPressure(), cold.getPressure());
            return HexResult.failed(HexSolverStatus.INFEASIBLE, false);
        }

        boolean reversed = false;
        try {
            ResolvedStream resolvedHot = ResolvedStream.resolve(hot, oracle);
            ResolvedStream resolvedCold = ResolvedStream.resolve(cold, oracle);
            HexModel orderedModel = model;
            if (resolvedHot.getSupplyTemperature() < resolvedCold.getSupplyTemperature()) {
                if (!parameters.isStreamRoleNormalization()) {
                    LOGGER.warn("Hot stream colder than cold stream at supply ({} K < {} K)",
                            resolvedHot.getSupplyTemperature(), resolvedCold.getSupplyTemperature());
                    return passThrough(HexSolverStatus.INFEASIBLE_MAX_DUTY_PINCH, resolvedHot, resolvedCold, model.getVolumes());
                }
                LOGGER.debug("Hot stream colder than cold stream at supply: roles swapped");
                ResolvedStream tmp = resolvedHot;
                resolvedHot = resolvedCold;
                resolvedCold = tmp;
                orderedModel = model.withSwappedSides();
                reversed = true;
            }
            HexResult result = solveOrdered(resolvedHot, resolvedCold, orderedModel);
            return reversed ? result.reversed() : result;
        } catch (PropertyUndefinedException e) {
            LOGGER.warn("Heat exchanger solve failed on an undefined fluid state: {}", e.getMessage());
            return HexResult.failed(HexSolverStatus.NOT_CONVERGED, reversed);
        }
    }

    private HexResult solveOrdered(ResolvedStream hot, ResolvedStream cold, HexModel model) {
        double supplyTemperatureDifference = hot.getSupplyTemperature() - cold.getSupplyTemperature();
        if (hot.getMassFlow() <= 0 || cold.getMassFlow() <= 0) {
            LOGGER.warn("Non positive mass flow (hot {} kg/s, cold {} kg/s)", hot.getMassFlow(), cold.getMassFlow());
            return passThrough(HexSolverStatus.INFEASIBLE, hot, cold, model.getVolumes());
        }
        if (supplyTemperatureDifference <= parameters.getTemperatureDifferenceFloor()) {
            LOGGER.debug("Supply temperature difference {} K too small: no exchange", supplyTemperatureDifference);
            HexSolverStatus status = supplyTemperatureDifference > 0
                    ? HexSolverStatus.EQUAL_TEMPERATURE_PASSTHROUGH
                    : HexSolverStatus.INFEASIBLE;
            return passThrough(status, hot, cold, model.getVolumes());
        }

        ZoneProfileBuilder profileBuilder = new ZoneProfileBuilder(hot, cold, parameters);
        MaxDuty maxDuty;
        DutySolution solution;
        try {
            maxDuty = new MaxDutyCalculator(profileBuilder, rootFinder, parameters).calculate();
            LOGGER.debug("Solving {} between {} and {}: {}", model.getType(), hot, cold, maxDuty);
            solution = model.solveDuty(new HexSolvingContext(profileBuilder, maxDuty, rootFinder, parameters));
        } catch (PropertyUndefinedException e) {
            LOGGER.warn("Heat exchanger duty not found on an undefined fluid state, streams passed through: {}", e.getMessage());
            return passThrough(HexSolverStatus.NOT_CONVERGED, hot, cold, model.getVolumes());
        }
        LOGGER.debug("Heat exchanger solved: {} W, {} (residual {})", solution.getDuty(), solution.getStatus(), solution.getResidual());
        return createResult(solution.getStatus(), solution.getProfile(), solution.getAreaEvaluation().orElse(null), hot, cold,
                model.getVolumes())
                .setMaxDuty(maxDuty.getDuty())
                .setResidual(solution.getResidual())
                .build();
    }

    private HexResult passThrough(HexSolverStatus status, ResolvedStream hot, ResolvedStream cold, HexVolumes volumes) {
        ZoneProfileBuilder profileBuilder = new ZoneProfileBuilder(hot, cold, parameters);
        return createResult(status, profileBuilder.build(0), null, hot, cold, volumes).build();
    }

    private static HexResult.Builder createResult(HexSolverStatus status, Profile profile, AreaEvaluation areaEvaluation,
                                                  ResolvedStream hot, ResolvedStream cold, HexVolumes volumes) {
        double duty = profile.getDuty();
        List<HexProfilePoint> points = new ArrayList<>(profile.getBoundaries().size());
        for (ZoneBoundary boundary : profile.getBoundaries()) {
            points.add(new HexProfilePoint(duty > 0 ? boundary.cumulativeDuty() / duty : 0,
                    boundary.hotEnthalpy(), boundary.coldEnthalpy(),
                    boundary.hotTemperature(), boundary.coldTemperature(),
                    hot.entropy(boundary.hotEnthalpy()), cold.entropy(boundary.coldEnthalpy()),
                    hot.quality(boundary.hotEnthalpy()), cold.quality(boundary.coldEnthalpy())));
        }

        double[] volumeFractions = MassInventoryCalculator.volumeFractions(profile, areaEvaluation);
        List<MassInventoryCalculator.ZoneInventory> hotInventories = MassInventoryCalculator.calculate(Side.HOT, hot, profile,
                volumeFractions, volumes.hot(), volumes.hotVoidFraction());
        List<MassInventoryCalculator.ZoneInventory> coldInventories = MassInventoryCalculator.calculate(Side.COLD, cold, profile,
                volumeFractions, volumes.cold(), volumes.coldVoidFraction());

        List<HexZoneResult> zones = new ArrayList<>(profile.getZones().size());
        for (Zone zone : profile.getZones()) {
            int i = zone.index();
            ZoneHeatTransfer transfer = areaEvaluation != null ? areaEvaluation.getZones().get(i) : null;
            MassInventoryCalculator.ZoneInventory hotInventory = hotInventories.get(i);
            MassInventoryCalculator.ZoneInventory coldInventory = coldInventories.get(i);
            zones.add(new HexZoneResult(i, zone.hotPhase(), zone.coldPhase(), zone.duty(), zone.lmtd(),
                    transfer != null ? transfer.hotCoefficient() : Double.NaN,
                    transfer != null ? transfer.coldCoefficient() : Double.NaN,
                    transfer != null ? transfer.hotSurfaceEfficiency() : Double.NaN,
                    transfer != null ? transfer.coldSurfaceEfficiency() : Double.NaN,
                    transfer != null ? transfer.overallCoefficient() : Double.NaN,
                    transfer != null ? transfer.hotArea() : Double.NaN,
                    transfer != null ? transfer.coldArea() : Double.NaN,
                    hotInventory.volume(), coldInventory.volume(),
                    hotInventory.mass(), coldInventory.mass(),
                    hotInventory.liquidWeight(), coldInventory.liquidWeight()));
        }

        return HexResult.builder(status)
                .setDuty(duty)
                .setPinch(profile.getPinch())
                .setHotExit(profile.getHotExitEnthalpy(), profile.getHotExitTemperature())
                .setColdExit(profile.getColdExitEnthalpy(), profile.getColdExitTemperature())
                .setPoints(points)
                .setZones(zones);
    }
}
