/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openorc.fluid;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Catalog oracle over analytic test fluids: "R134A", "R245FA" and "INCOMP:OIL".
 *
 * @author Open ORC developers
 */
public class TestFluidOracle implements FluidPropertyOracle {

    public static final String R134A = "R134A";

    public static final String R245FA = "R245FA";

    public static final String OIL = Stream.INCOMPRESSIBLE_PREFIX + "OIL";

    private final Map<String, TestFluid> fluids = new HashMap<>();

    private int queryCount;

    public TestFluidOracle() {
        fluids.put(R134A, IdealTwoPhaseFluid.r134a());
        fluids.put(R245FA, IdealTwoPhaseFluid.r245fa());
        fluids.put(OIL, IncompressibleFluid.oil());
    }

    public int getQueryCount() {
        return queryCount;
    }

    @Override
    public double state(String fluid, FluidProperty output, FluidProperty input1, double value1, FluidProperty input2, double value2) {
        Objects.requireNonNull(fluid);
        TestFluid testFluid = fluids.get(fluid);
        if (testFluid == null) {
            throw new PropertyUndefinedException("Unknown fluid: " + fluid);
        }
        queryCount++;
        return testFluid.state(output, input1, value1, input2, value2);
    }
}
