/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openorc.hex;

/**
 * Outcome of a heat exchanger solve, with its integer flag.
 *
 * @author Open ORC developers
 */
public enum HexSolverStatus {
    CONVERGED(1),
    /**
     * The duty is limited: maximum duty reached with oversized area, or zero duty with a pinch target larger than
     * the supply temperature difference.
     */
    DUTY_LIMITED(2),
    /**
     * Supply temperatures too close: nothing is exchanged.
     */
    EQUAL_TEMPERATURE_PASSTHROUGH(3),
    NOT_CONVERGED(-1),
    /**
     * The pinch at maximum duty is not zero, or the streams are not ordered while stream role normalization is
     * disabled.
     */
    INFEASIBLE_MAX_DUTY_PINCH(-2),
    INFEASIBLE(-3);

    private final int flag;

    HexSolverStatus(int flag) {
        this.flag = flag;
    }

    public int getFlag() {
        return flag;
    }

    public boolean isOk() {
        return flag > 0;
    }
}
