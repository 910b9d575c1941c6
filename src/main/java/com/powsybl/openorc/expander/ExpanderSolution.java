/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openorc.expander;

import java.util.Objects;
import java.util.Optional;

/**
 * Operating point found by an {@link ExpanderModel}.
 *
 * @param wallTemperature NaN for models without a wall
 * @param internalState null for models without internal states
 *
 * @author Open ORC developers
 */
public record ExpanderSolution(ExpanderSolverStatus status,
                               double exhaustEnthalpy,
                               double speed,
                               double power,
                               double ambientHeat,
                               double isentropicEfficiency,
                               double fillingFactor,
                               double wallTemperature,
                               double residual,
                               ExpanderInternalState internalState) {

    public ExpanderSolution {
        Objects.requireNonNull(status);
    }

    public Optional<ExpanderInternalState> getInternalState() {
        return Optional.ofNullable(internalState);
    }
}
