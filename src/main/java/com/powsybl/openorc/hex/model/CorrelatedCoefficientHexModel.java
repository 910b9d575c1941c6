/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openorc.hex.model;

import com.powsybl.openorc.hex.htc.CorrelationCoefficients;

/**
 * Area matching model with convective coefficients given by empirical correlations.
 *
 * @author Open ORC developers
 */
public class CorrelatedCoefficientHexModel extends AbstractAreaMatchingHexModel<CorrelationCoefficients> {

    public CorrelatedCoefficientHexModel(CorrelationCoefficients coefficients, HexAreas areas, HexVolumes volumes) {
        super(coefficients, areas, volumes);
    }

    @Override
    public HexModelType getType() {
        return HexModelType.CORRELATED_COEFFICIENT;
    }

    @Override
    public CorrelatedCoefficientHexModel withSwappedSides() {
        return new CorrelatedCoefficientHexModel(coefficients.withSwappedSides(), areas.swapped(), volumes.swapped());
    }
}
