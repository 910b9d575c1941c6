/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openorc.solver;

import org.apache.commons.lang3.mutable.MutableInt;
import org.apache.commons.math3.analysis.UnivariateFunction;
import org.apache.commons.math3.analysis.solvers.BrentSolver;
import org.apache.commons.math3.exception.TooManyEvaluationsException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.function.DoubleUnaryOperator;

/**
 * {@link RootFinder} based on the Brent solver of Apache Commons Math.
 *
 * @author Open ORC developers
 */
public class BrentRootFinder implements RootFinder {

    private static final Logger LOGGER = LoggerFactory.getLogger(BrentRootFinder.class);

    public static final int DEFAULT_MAX_EVALUATIONS = 200;

    private static final double RELATIVE_ACCURACY = 1e-14;

    private final int maxEvaluations;

    public BrentRootFinder() {
        this(DEFAULT_MAX_EVALUATIONS);
    }

    public BrentRootFinder(int maxEvaluations) {
        if (maxEvaluations < 3) {
            throw new IllegalArgumentException("Invalid max evaluations value: " + maxEvaluations);
        }
        this.maxEvaluations = maxEvaluations;
    }

    public int getMaxEvaluations() {
        return maxEvaluations;
    }

    /**
     * Keeps track of the evaluated point with the smallest absolute function value.
     */
    private static final class TrackedFunction implements UnivariateFunction {

        private final DoubleUnaryOperator function;

        private final MutableInt evaluations = new MutableInt();

        private double bestX = Double.NaN;

        private double bestY = Double.NaN;

        private TrackedFunction(DoubleUnaryOperator function) {
            this.function = function;
        }

        @Override
        public double value(double x) {
            double y = function.applyAsDouble(x);
            evaluations.increment();
            if (Double.isNaN(bestY) || Math.abs(y) < Math.abs(bestY)) {
                bestX = x;
                bestY = y;
            }
            return y;
        }
    }

    @Override
    public RootFinderResult solve(DoubleUnaryOperator function, double lowerBound, double upperBound,
                                  double absoluteAccuracy, double functionValueAccuracy) {
        Objects.requireNonNull(function);
        if (!(lowerBound < upperBound)) {
            throw new IllegalArgumentException("Invalid bounds: [" + lowerBound + ", " + upperBound + "]");
        }
        TrackedFunction tracked = new TrackedFunction(function);

        double lowerValue = tracked.value(lowerBound);
        if (Math.abs(lowerValue) <= functionValueAccuracy) {
            return new RootFinderResult(RootFinderStatus.CONVERGED, lowerBound, lowerValue, tracked.evaluations.intValue());
        }
        double upperValue = tracked.value(upperBound);
        if (Math.abs(upperValue) <= functionValueAccuracy) {
            return new RootFinderResult(RootFinderStatus.CONVERGED, upperBound, upperValue, tracked.evaluations.intValue());
        }
        if (!(lowerValue * upperValue < 0)) {
            LOGGER.debug("No sign change over [{}, {}] (f={}, {})", lowerBound, upperBound, lowerValue, upperValue);
            return new RootFinderResult(RootFinderStatus.NO_BRACKETING, tracked.bestX, tracked.bestY, tracked.evaluations.intValue());
        }

        BrentSolver solver = new BrentSolver(RELATIVE_ACCURACY, absoluteAccuracy, functionValueAccuracy);
        try {
            double root = solver.solve(maxEvaluations - tracked.evaluations.intValue(), tracked, lowerBound, upperBound);
            double residual = tracked.value(root);
            return new RootFinderResult(RootFinderStatus.CONVERGED, root, residual, tracked.evaluations.intValue());
        } catch (TooManyEvaluationsException e) {
            LOGGER.debug("Root finder stopped after {} evaluations, best point {} (f={})",
                    tracked.evaluations.intValue(), tracked.bestX, tracked.bestY);
            return new RootFinderResult(RootFinderStatus.MAX_EVALUATIONS_REACHED, tracked.bestX, tracked.bestY, tracked.evaluations.intValue());
        }
    }
}
