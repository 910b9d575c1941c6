/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openorc.solver;

import java.util.Objects;

/**
 * @author Open ORC developers
 */
public class RootFinderResult {

    private final RootFinderStatus status;

    private final double root;

    private final double residual;

    private final int evaluations;

    public RootFinderResult(RootFinderStatus status, double root, double residual, int evaluations) {
        if (evaluations < 0) {
            throw new IllegalArgumentException("Invalid evaluation count value: " + evaluations);
        }
        this.status = Objects.requireNonNull(status);
        this.root = root;
        this.residual = residual;
        this.evaluations = evaluations;
    }

    public RootFinderStatus getStatus() {
        return status;
    }

    public boolean isConverged() {
        return status == RootFinderStatus.CONVERGED;
    }

    public double getRoot() {
        return root;
    }

    /**
     * Function value at {@link #getRoot()}.
     */
    public double getResidual() {
        return residual;
    }

    public int getEvaluations() {
        return evaluations;
    }

    @Override
    public String toString() {
        return "RootFinderResult(status=" + status
                + ", root=" + root
                + ", residual=" + residual
                + ", evaluations=" + evaluations
                + ")";
    }
}
