/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openorc.hex.model;

import com.powsybl.openorc.hex.HexSolverStatus;
import com.powsybl.openorc.hex.MaxDuty;

/**
 * Duty equal to a constant fraction of the maximum duty.
 *
 * @author Open ORC developers
 */
public class FixedEfficiencyHexModel extends AbstractHexModel {

    private final double efficiency;

    public FixedEfficiencyHexModel(double efficiency, HexVolumes volumes) {
        super(volumes);
        if (!(efficiency > 0 && efficiency <= 1)) {
            throw new IllegalArgumentException("Invalid thermal efficiency value: " + efficiency);
        }
        this.efficiency = efficiency;
    }

    public double getEfficiency() {
        return efficiency;
    }

    @Override
    public HexModelType getType() {
        return HexModelType.FIXED_EFFICIENCY;
    }

    @Override
    public FixedEfficiencyHexModel withSwappedSides() {
        return new FixedEfficiencyHexModel(efficiency, volumes.swapped());
    }

    @Override
    public DutySolution solveDuty(HexSolvingContext context) {
        return solveFraction(context, efficiency);
    }

    static DutySolution solveFraction(HexSolvingContext context, double fraction) {
        MaxDuty maxDuty = context.getMaxDuty();
        HexSolverStatus status = context.isMaxDutyPinchClosed() ? HexSolverStatus.CONVERGED : HexSolverStatus.INFEASIBLE_MAX_DUTY_PINCH;
        return new DutySolution(status, context.getProfileBuilder().build(fraction * maxDuty.getDuty()), 0);
    }
}
