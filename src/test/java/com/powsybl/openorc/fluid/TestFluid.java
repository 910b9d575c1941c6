/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openorc.fluid;

/**
 * Analytic fluid of the test oracle.
 *
 * @author Open ORC developers
 */
public interface TestFluid {

    double state(FluidProperty output, FluidProperty input1, double value1, FluidProperty input2, double value2);

    static boolean isPair(FluidProperty input1, FluidProperty input2, FluidProperty a, FluidProperty b) {
        return input1 == a && input2 == b || input1 == b && input2 == a;
    }

    static double valueOf(FluidProperty property, FluidProperty input1, double value1, double value2) {
        return input1 == property ? value1 : value2;
    }

    static PropertyUndefinedException undefined(FluidProperty output, FluidProperty input1, double value1,
                                                FluidProperty input2, double value2) {
        return new PropertyUndefinedException("Undefined " + output + " at " + input1 + "=" + value1 + ", " + input2 + "=" + value2);
    }
}
