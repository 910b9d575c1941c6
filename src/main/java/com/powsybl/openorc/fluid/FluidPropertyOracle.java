/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openorc.fluid;

/**
 * Stateless fluid property backend.
 * <p>
 * A state is fixed by two independent properties. Implementations must be pure and reentrant so that independent
 * solves can share them across threads. In a single-phase region, a {@link FluidProperty#QUALITY} query returns -1.
 * Any state pair outside the valid region of the fluid, like a quality query above the critical pressure, raises a
 * {@link PropertyUndefinedException}.
 *
 * @author Open ORC developers
 */
public interface FluidPropertyOracle {

    double state(String fluid, FluidProperty output, FluidProperty input1, double value1, FluidProperty input2, double value2);
}
