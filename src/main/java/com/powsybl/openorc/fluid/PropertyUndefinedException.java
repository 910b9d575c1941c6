/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openorc.fluid;

import com.powsybl.commons.PowsyblException;

/**
 * Thrown by a {@link FluidPropertyOracle} when the requested property is not defined for the given state pair,
 * for instance a quality query above the critical pressure.
 *
 * @author Open ORC developers
 */
public class PropertyUndefinedException extends PowsyblException {

    public PropertyUndefinedException(String message) {
        super(message);
    }

    public PropertyUndefinedException(String message, Throwable cause) {
        super(message, cause);
    }
}
