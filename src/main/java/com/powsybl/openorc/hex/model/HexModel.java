/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openorc.hex.model;

/**
 * Heat exchanger modelling strategy: finds the duty exchanged between an ordered pair of streams, the hot one being
 * warmer than the cold one at supply.
 *
 * @author Open ORC developers
 */
public interface HexModel {

    HexModelType getType();

    HexVolumes getVolumes();

    /**
     * Same model with every side-specific setting exchanged between hot and cold sides.
     */
    HexModel withSwappedSides();

    DutySolution solveDuty(HexSolvingContext context);
}
