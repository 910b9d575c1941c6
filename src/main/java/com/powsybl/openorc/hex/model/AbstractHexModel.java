/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openorc.hex.model;

import java.util.Objects;

/**
 * @author Open ORC developers
 */
public abstract class AbstractHexModel implements HexModel {

    protected final HexVolumes volumes;

    protected AbstractHexModel(HexVolumes volumes) {
        this.volumes = Objects.requireNonNull(volumes);
    }

    @Override
    public HexVolumes getVolumes() {
        return volumes;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(volumes=" + volumes + ")";
    }
}
