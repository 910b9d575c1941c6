/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openorc.hex.model;

import com.powsybl.openorc.OpenOrcParameters;
import com.powsybl.openorc.fluid.PropertyUndefinedException;
import com.powsybl.openorc.hex.AreaEvaluation;
import com.powsybl.openorc.hex.HeatTransferZoneEvaluator;
import com.powsybl.openorc.hex.HexSolverStatus;
import com.powsybl.openorc.hex.MaxDuty;
import com.powsybl.openorc.hex.ResolvedStream;
import com.powsybl.openorc.hex.ZoneProfileBuilder;
import com.powsybl.openorc.hex.htc.ConvectiveCoefficientModel;
import com.powsybl.openorc.solver.RootFinderResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Moving boundary model finding the duty for which the area required by the zones equals the available area.
 * The duty is capped by the maximum duty when the exchanger is oversized. A fluid state undefined during the search
 * leaves the last evaluated duty, flagged as not converged.
 *
 * @author Open ORC developers
 */
public abstract class AbstractAreaMatchingHexModel<C extends ConvectiveCoefficientModel> extends AbstractHexModel {

    private static final Logger LOGGER = LoggerFactory.getLogger(AbstractAreaMatchingHexModel.class);

    private static final double MIN_LOWER_DUTY = 1;

    private static final double LOWER_DUTY_RATIO = 1e-3;

    protected final C coefficients;

    protected final HexAreas areas;

    protected AbstractAreaMatchingHexModel(C coefficients, HexAreas areas, HexVolumes volumes) {
        super(volumes);
        this.coefficients = Objects.requireNonNull(coefficients);
        this.areas = Objects.requireNonNull(areas);
    }

    public C getCoefficients() {
        return coefficients;
    }

    public HexAreas getAreas() {
        return areas;
    }

    public HeatTransferZoneEvaluator createEvaluator(OpenOrcParameters parameters) {
        return new HeatTransferZoneEvaluator(coefficients, areas.hot(), areas.cold(), areas.hotFins(), areas.coldFins(), parameters);
    }

    @Override
    public DutySolution solveDuty(HexSolvingContext context) {
        OpenOrcParameters parameters = context.getParameters();
        ZoneProfileBuilder profileBuilder = context.getProfileBuilder();
        ResolvedStream hot = context.getHot();
        ResolvedStream cold = context.getCold();
        HeatTransferZoneEvaluator evaluator = createEvaluator(parameters);

        MaxDuty maxDuty = context.getMaxDuty();
        AreaEvaluation atMaxDuty = evaluator.evaluate(maxDuty.getProfile(), hot, cold);
        if (atMaxDuty.getResidual() > 0) {
            LOGGER.debug("Area larger than needed at maximum duty {} W (residual {})", maxDuty.getDuty(), atMaxDuty.getResidual());
            HexSolverStatus status = atMaxDuty.getResidual() < parameters.getAreaResidualConvergenceThreshold()
                    ? HexSolverStatus.CONVERGED
                    : maxDutyStatus(context, HexSolverStatus.DUTY_LIMITED);
            return new DutySolution(status, maxDuty.getProfile(), atMaxDuty.getResidual(), atMaxDuty);
        }

        AtomicReference<AreaEvaluation> lastEvaluation = new AtomicReference<>(atMaxDuty);
        double lowerDuty = Math.min(MIN_LOWER_DUTY, LOWER_DUTY_RATIO * maxDuty.getDuty());
        RootFinderResult result;
        AreaEvaluation evaluation;
        try {
            result = context.getRootFinder().solve(q -> {
                AreaEvaluation tried = evaluator.evaluate(profileBuilder.build(q), hot, cold);
                lastEvaluation.set(tried);
                return tried.getResidual();
            }, lowerDuty, maxDuty.getDuty(), parameters.getDutyAbsoluteTolerance(), parameters.getResidualTolerance());
            evaluation = evaluator.evaluate(profileBuilder.build(result.getRoot()), hot, cold);
        } catch (PropertyUndefinedException e) {
            AreaEvaluation last = lastEvaluation.get();
            LOGGER.warn("Area matching stopped on an undefined fluid state at duty {} W: {}", last.getProfile().getDuty(),
                    e.getMessage());
            return new DutySolution(HexSolverStatus.NOT_CONVERGED, last.getProfile(), last.getResidual(), last);
        }
        double residual = evaluation.getResidual();
        HexSolverStatus status = Math.abs(residual) < parameters.getAreaResidualConvergenceThreshold()
                ? HexSolverStatus.CONVERGED
                : maxDutyStatus(context, HexSolverStatus.NOT_CONVERGED);
        LOGGER.debug("Area matching duty {} W, residual {} ({} after {} evaluations)", result.getRoot(), residual,
                result.getStatus(), result.getEvaluations());
        return new DutySolution(status, evaluation.getProfile(), residual, evaluation);
    }

    /**
     * Status of an unmatched area, which is only meaningful when the maximum duty closes the pinch.
     */
    private static HexSolverStatus maxDutyStatus(HexSolvingContext context, HexSolverStatus status) {
        return context.isMaxDutyPinchClosed() ? status : HexSolverStatus.INFEASIBLE_MAX_DUTY_PINCH;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(coefficients=" + coefficients + ", areas=" + areas + ", volumes=" + volumes + ")";
    }
}
