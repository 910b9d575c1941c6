/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openorc.expander;

/**
 * Outcome of an expander solve, with its integer flag.
 *
 * @author Open ORC developers
 */
public enum ExpanderSolverStatus {
    CONVERGED(1),
    /**
     * No solution found, or exhaust enthalpy outside the validity range. Outputs are the best attempt.
     */
    NOT_CONVERGED(-1),
    /**
     * Supply pressure not above exhaust pressure, or no flow: isentropic fallback outputs.
     */
    NON_POSITIVE_PRESSURE_RATIO(-2);

    private final int flag;

    ExpanderSolverStatus(int flag) {
        this.flag = flag;
    }

    public int getFlag() {
        return flag;
    }
}
