/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openorc.fluid;

/**
 * Thermophysical properties that can be queried from, or given as inputs to, a {@link FluidPropertyOracle}.
 * All values are in SI units.
 *
 * @author Open ORC developers
 */
public enum FluidProperty {
    TEMPERATURE,
    PRESSURE,
    ENTHALPY,
    ENTROPY,
    DENSITY,
    QUALITY,
    SPECIFIC_HEAT,
    VISCOSITY,
    CONDUCTIVITY,
    SURFACE_TENSION,
    CRITICAL_PRESSURE,
    MOLAR_MASS
}
