/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openorc.expander;

/**
 * Volumetric expander modelling strategy.
 *
 * @author Open ORC developers
 */
public interface ExpanderModel {

    ExpanderModelType getType();

    /**
     * Internal volume, used for the fluid mass.
     */
    double getVolume();

    /**
     * Swept volume per revolution.
     */
    double getSweptVolume();

    /**
     * Lower bound of the valid exhaust enthalpy, NaN to use the fluid default.
     */
    double getMinExhaustEnthalpy();

    /**
     * Upper bound of the valid exhaust enthalpy, NaN to use the fluid default.
     */
    double getMaxExhaustEnthalpy();

    ExpanderSolution solve(ExpanderSolvingContext context);
}
