/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openorc.hex.model;

import com.powsybl.openorc.hex.AreaEvaluation;
import com.powsybl.openorc.hex.HexSolverStatus;
import com.powsybl.openorc.hex.Profile;

import java.util.Objects;
import java.util.Optional;

/**
 * Duty found by a {@link HexModel}, with its profile, its status and the residual of the equation it solves.
 *
 * @author Open ORC developers
 */
public class DutySolution {

    private final HexSolverStatus status;

    private final Profile profile;

    private final double residual;

    private final AreaEvaluation areaEvaluation;

    public DutySolution(HexSolverStatus status, Profile profile, double residual) {
        this(status, profile, residual, null);
    }

    /**
     * @param areaEvaluation heat transfer areas of the profile, null for models not computing areas
     */
    public DutySolution(HexSolverStatus status, Profile profile, double residual, AreaEvaluation areaEvaluation) {
        this.status = Objects.requireNonNull(status);
        this.profile = Objects.requireNonNull(profile);
        this.residual = residual;
        this.areaEvaluation = areaEvaluation;
    }

    public HexSolverStatus getStatus() {
        return status;
    }

    public Profile getProfile() {
        return profile;
    }

    public double getDuty() {
        return profile.getDuty();
    }

    public double getResidual() {
        return residual;
    }

    public Optional<AreaEvaluation> getAreaEvaluation() {
        return Optional.ofNullable(areaEvaluation);
    }
}
