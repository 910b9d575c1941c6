/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openorc.solver;

import java.util.function.DoubleUnaryOperator;

/**
 * Bracketing one-dimensional root finder.
 * <p>
 * Implementations never loop indefinitely: they stop after a bounded number of function evaluations and report it
 * through the result status. When the function does not change sign over the interval, no search is done and the
 * endpoint with the smallest absolute function value is returned with {@link RootFinderStatus#NO_BRACKETING}.
 *
 * @author Open ORC developers
 */
public interface RootFinder {

    RootFinderResult solve(DoubleUnaryOperator function, double lowerBound, double upperBound,
                           double absoluteAccuracy, double functionValueAccuracy);
}
