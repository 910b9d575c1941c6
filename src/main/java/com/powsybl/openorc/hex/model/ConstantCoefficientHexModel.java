/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openorc.hex.model;

import com.powsybl.openorc.hex.htc.ConstantCoefficients;

/**
 * Area matching model with constant convective coefficients per side and regime.
 *
 * @author Open ORC developers
 */
public class ConstantCoefficientHexModel extends AbstractAreaMatchingHexModel<ConstantCoefficients> {

    public ConstantCoefficientHexModel(ConstantCoefficients coefficients, HexAreas areas, HexVolumes volumes) {
        super(coefficients, areas, volumes);
    }

    @Override
    public HexModelType getType() {
        return HexModelType.CONSTANT_COEFFICIENT;
    }

    @Override
    public ConstantCoefficientHexModel withSwappedSides() {
        return new ConstantCoefficientHexModel(coefficients.withSwappedSides(), areas.swapped(), volumes.swapped());
    }
}
