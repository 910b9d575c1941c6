/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openorc.hex.model;

import com.powsybl.openorc.OpenOrcParameters;
import com.powsybl.openorc.hex.HexSolverStatus;
import com.powsybl.openorc.hex.Profile;
import com.powsybl.openorc.hex.ZoneProfileBuilder;
import com.powsybl.openorc.solver.RootFinderResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Duty giving an imposed pinch. Nothing is exchanged when the supply temperature difference does not exceed the
 * pinch.
 *
 * @author Open ORC developers
 */
public class FixedPinchHexModel extends AbstractHexModel {

    private static final Logger LOGGER = LoggerFactory.getLogger(FixedPinchHexModel.class);

    private final double pinch;

    public FixedPinchHexModel(double pinch, HexVolumes volumes) {
        super(volumes);
        if (!(pinch > 0) || Double.isInfinite(pinch)) {
            throw new IllegalArgumentException("Invalid pinch value: " + pinch);
        }
        this.pinch = pinch;
    }

    public double getPinch() {
        return pinch;
    }

    @Override
    public HexModelType getType() {
        return HexModelType.FIXED_PINCH;
    }

    @Override
    public FixedPinchHexModel withSwappedSides() {
        return new FixedPinchHexModel(pinch, volumes.swapped());
    }

    @Override
    public DutySolution solveDuty(HexSolvingContext context) {
        ZoneProfileBuilder profileBuilder = context.getProfileBuilder();
        if (context.getSupplyTemperatureDifference() <= pinch) {
            LOGGER.debug("Supply temperature difference {} K not above pinch {} K: no duty",
                    context.getSupplyTemperatureDifference(), pinch);
            return new DutySolution(HexSolverStatus.DUTY_LIMITED, profileBuilder.build(0), 0);
        }
        OpenOrcParameters parameters = context.getParameters();
        RootFinderResult result = context.getRootFinder().solve(q -> profileBuilder.build(q).getPinch() - pinch,
                0, context.getMaxDuty().getDuty(), parameters.getDutyAbsoluteTolerance(), parameters.getResidualTolerance());
        Profile profile = profileBuilder.build(result.getRoot());
        double residual = 1 - profile.getPinch() / pinch;
        HexSolverStatus status = Math.abs(residual) < parameters.getPinchConvergenceThreshold()
                ? HexSolverStatus.CONVERGED
                : HexSolverStatus.NOT_CONVERGED;
        LOGGER.debug("Fixed pinch duty {} W, pinch {} K ({})", profile.getDuty(), profile.getPinch(), result.getStatus());
        return new DutySolution(status, profile, residual);
    }
}
