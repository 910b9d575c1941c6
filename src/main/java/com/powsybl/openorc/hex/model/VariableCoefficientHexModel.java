/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openorc.hex.model;

import com.powsybl.openorc.hex.htc.MassFlowScaledCoefficients;

/**
 * Area matching model with convective coefficients scaled with the mass flow rates.
 *
 * @author Open ORC developers
 */
public class VariableCoefficientHexModel extends AbstractAreaMatchingHexModel<MassFlowScaledCoefficients> {

    public VariableCoefficientHexModel(MassFlowScaledCoefficients coefficients, HexAreas areas, HexVolumes volumes) {
        super(coefficients, areas, volumes);
    }

    @Override
    public HexModelType getType() {
        return HexModelType.VARIABLE_COEFFICIENT;
    }

    @Override
    public VariableCoefficientHexModel withSwappedSides() {
        return new VariableCoefficientHexModel(coefficients.withSwappedSides(), areas.swapped(), volumes.swapped());
    }
}
