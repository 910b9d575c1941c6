/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openorc.hex;

import com.powsybl.openorc.OpenOrcParameters;
import com.powsybl.openorc.solver.RootFinder;
import com.powsybl.openorc.solver.RootFinderResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Computes the maximum duty: the enthalpy limit when its profile has no temperature cross, otherwise the duty
 * at which the pinch vanishes.
 *
 * @author Open ORC developers
 */
public class MaxDutyCalculator {

    private static final Logger LOGGER = LoggerFactory.getLogger(MaxDutyCalculator.class);

    private final ZoneProfileBuilder profileBuilder;

    private final RootFinder rootFinder;

    private final OpenOrcParameters parameters;

    public MaxDutyCalculator(ZoneProfileBuilder profileBuilder, RootFinder rootFinder, OpenOrcParameters parameters) {
        this.profileBuilder = Objects.requireNonNull(profileBuilder);
        this.rootFinder = Objects.requireNonNull(rootFinder);
        this.parameters = Objects.requireNonNull(parameters);
    }

    public MaxDuty calculate() {
        ResolvedStream hot = profileBuilder.getHot();
        ResolvedStream cold = profileBuilder.getCold();
        double hotLimit = hot.getMassFlow() * (hot.getSupplyEnthalpy() - hot.enthalpyAtTemperature(cold.getSupplyTemperature()));
        double coldLimit = cold.getMassFlow() * (cold.enthalpyAtTemperature(hot.getSupplyTemperature()) - cold.getSupplyEnthalpy());
        double enthalpyLimit = Math.max(0, Math.min(hotLimit, coldLimit));

        Profile limitProfile = profileBuilder.build(enthalpyLimit);
        if (limitProfile.getPinch() >= 0 || enthalpyLimit == 0) {
            LOGGER.debug("Maximum duty {} W set by enthalpy limit (pinch {} K)", enthalpyLimit, limitProfile.getPinch());
            return new MaxDuty(enthalpyLimit, enthalpyLimit, limitProfile);
        }

        RootFinderResult result = rootFinder.solve(q -> profileBuilder.build(q).getPinch(), 0, enthalpyLimit,
                parameters.getDutyAbsoluteTolerance(), parameters.getResidualTolerance());
        if (!result.isConverged()) {
            LOGGER.warn("Maximum duty search did not converge: {}", result);
        }
        double duty = result.getRoot();
        LOGGER.debug("Maximum duty {} W set by internal pinch (enthalpy limit {} W)", duty, enthalpyLimit);
        return new MaxDuty(enthalpyLimit, duty, profileBuilder.build(duty));
    }
}
