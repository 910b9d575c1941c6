/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openorc.hex.model;

/**
 * @author Open ORC developers
 */
public enum HexModelType {
    FIXED_PINCH,
    FIXED_EFFICIENCY,
    POLYNOMIAL_EFFICIENCY,
    CONSTANT_COEFFICIENT,
    VARIABLE_COEFFICIENT,
    CORRELATED_COEFFICIENT;

    /**
     * Whether the duty is found by matching the required area with the available one.
     */
    public boolean isAreaMatching() {
        return this == CONSTANT_COEFFICIENT || this == VARIABLE_COEFFICIENT || this == CORRELATED_COEFFICIENT;
    }
}
