/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openorc;

import com.powsybl.commons.config.PlatformConfig;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Numerical settings shared by the heat exchanger and expander solvers.
 * <p>
 * Defaults can be overridden from the platform configuration, module {@value #MODULE_NAME}, or from a property map.
 *
 * @author Open ORC developers
 */
public class OpenOrcParameters {

    public static final String MODULE_NAME = "open-orc-default-parameters";

    public static final String ROOT_FINDER_MAX_EVALUATIONS_PARAM_NAME = "rootFinderMaxEvaluations";
    public static final String DUTY_ABSOLUTE_TOLERANCE_PARAM_NAME = "dutyAbsoluteTolerance";
    public static final String RESIDUAL_TOLERANCE_PARAM_NAME = "residualTolerance";
    public static final String AREA_RESIDUAL_CONVERGENCE_THRESHOLD_PARAM_NAME = "areaResidualConvergenceThreshold";
    public static final String PINCH_CONVERGENCE_THRESHOLD_PARAM_NAME = "pinchConvergenceThreshold";
    public static final String MAX_DUTY_PINCH_THRESHOLD_PARAM_NAME = "maxDutyPinchThreshold";
    public static final String TEMPERATURE_DIFFERENCE_FLOOR_PARAM_NAME = "temperatureDifferenceFloor";
    public static final String TWO_PHASE_ZONE_COUNT_PARAM_NAME = "twoPhaseZoneCount";
    public static final String BOILING_CLOSURE_TOLERANCE_PARAM_NAME = "boilingClosureTolerance";
    public static final String BOILING_CLOSURE_MAX_ITERATIONS_PARAM_NAME = "boilingClosureMaxIterations";
    public static final String STREAM_ROLE_NORMALIZATION_PARAM_NAME = "streamRoleNormalization";
    public static final String WALL_TEMPERATURE_TOLERANCE_PARAM_NAME = "wallTemperatureTolerance";
    public static final String SPEED_RESIDUAL_THRESHOLD_PARAM_NAME = "speedResidualThreshold";

    public static final int ROOT_FINDER_MAX_EVALUATIONS_DEFAULT_VALUE = 200;
    public static final double DUTY_ABSOLUTE_TOLERANCE_DEFAULT_VALUE = 1e-6;
    public static final double RESIDUAL_TOLERANCE_DEFAULT_VALUE = 1e-6;
    public static final double AREA_RESIDUAL_CONVERGENCE_THRESHOLD_DEFAULT_VALUE = 1e-4;
    public static final double PINCH_CONVERGENCE_THRESHOLD_DEFAULT_VALUE = 1e-4;
    public static final double MAX_DUTY_PINCH_THRESHOLD_DEFAULT_VALUE = 1e-2;
    public static final double TEMPERATURE_DIFFERENCE_FLOOR_DEFAULT_VALUE = 1e-2;
    public static final int TWO_PHASE_ZONE_COUNT_DEFAULT_VALUE = 2;
    public static final double BOILING_CLOSURE_TOLERANCE_DEFAULT_VALUE = 5e-2;
    public static final int BOILING_CLOSURE_MAX_ITERATIONS_DEFAULT_VALUE = 10;
    public static final boolean STREAM_ROLE_NORMALIZATION_DEFAULT_VALUE = true;
    public static final double WALL_TEMPERATURE_TOLERANCE_DEFAULT_VALUE = 1e-4;
    public static final double SPEED_RESIDUAL_THRESHOLD_DEFAULT_VALUE = 1e-5;

    private int rootFinderMaxEvaluations = ROOT_FINDER_MAX_EVALUATIONS_DEFAULT_VALUE;

    private double dutyAbsoluteTolerance = DUTY_ABSOLUTE_TOLERANCE_DEFAULT_VALUE;

    private double residualTolerance = RESIDUAL_TOLERANCE_DEFAULT_VALUE;

    private double areaResidualConvergenceThreshold = AREA_RESIDUAL_CONVERGENCE_THRESHOLD_DEFAULT_VALUE;

    private double pinchConvergenceThreshold = PINCH_CONVERGENCE_THRESHOLD_DEFAULT_VALUE;

    private double maxDutyPinchThreshold = MAX_DUTY_PINCH_THRESHOLD_DEFAULT_VALUE;

    private double temperatureDifferenceFloor = TEMPERATURE_DIFFERENCE_FLOOR_DEFAULT_VALUE;

    private int twoPhaseZoneCount = TWO_PHASE_ZONE_COUNT_DEFAULT_VALUE;

    private double boilingClosureTolerance = BOILING_CLOSURE_TOLERANCE_DEFAULT_VALUE;

    private int boilingClosureMaxIterations = BOILING_CLOSURE_MAX_ITERATIONS_DEFAULT_VALUE;

    private boolean streamRoleNormalization = STREAM_ROLE_NORMALIZATION_DEFAULT_VALUE;

    private double wallTemperatureTolerance = WALL_TEMPERATURE_TOLERANCE_DEFAULT_VALUE;

    private double speedResidualThreshold = SPEED_RESIDUAL_THRESHOLD_DEFAULT_VALUE;

    public static double checkParameterValue(double parameterValue, boolean condition, String parameterName) {
        if (!condition) {
            throw new IllegalArgumentException("Invalid value for parameter " + parameterName + ": " + parameterValue);
        }
        return parameterValue;
    }

    public static int checkParameterValue(int parameterValue, boolean condition, String parameterName) {
        if (!condition) {
            throw new IllegalArgumentException("Invalid value for parameter " + parameterName + ": " + parameterValue);
        }
        return parameterValue;
    }

    public int getRootFinderMaxEvaluations() {
        return rootFinderMaxEvaluations;
    }

    public OpenOrcParameters setRootFinderMaxEvaluations(int rootFinderMaxEvaluations) {
        this.rootFinderMaxEvaluations = checkParameterValue(rootFinderMaxEvaluations,
                rootFinderMaxEvaluations >= 3,
                ROOT_FINDER_MAX_EVALUATIONS_PARAM_NAME);
        return this;
    }

    public double getDutyAbsoluteTolerance() {
        return dutyAbsoluteTolerance;
    }

    public OpenOrcParameters setDutyAbsoluteTolerance(double dutyAbsoluteTolerance) {
        this.dutyAbsoluteTolerance = checkParameterValue(dutyAbsoluteTolerance,
                dutyAbsoluteTolerance > 0,
                DUTY_ABSOLUTE_TOLERANCE_PARAM_NAME);
        return this;
    }

    public double getResidualTolerance() {
        return residualTolerance;
    }

    public OpenOrcParameters setResidualTolerance(double residualTolerance) {
        this.residualTolerance = checkParameterValue(residualTolerance,
                residualTolerance > 0,
                RESIDUAL_TOLERANCE_PARAM_NAME);
        return this;
    }

    public double getAreaResidualConvergenceThreshold() {
        return areaResidualConvergenceThreshold;
    }

    public OpenOrcParameters setAreaResidualConvergenceThreshold(double areaResidualConvergenceThreshold) {
        this.areaResidualConvergenceThreshold = checkParameterValue(areaResidualConvergenceThreshold,
                areaResidualConvergenceThreshold > 0,
                AREA_RESIDUAL_CONVERGENCE_THRESHOLD_PARAM_NAME);
        return this;
    }

    public double getPinchConvergenceThreshold() {
        return pinchConvergenceThreshold;
    }

    public OpenOrcParameters setPinchConvergenceThreshold(double pinchConvergenceThreshold) {
        this.pinchConvergenceThreshold = checkParameterValue(pinchConvergenceThreshold,
                pinchConvergenceThreshold > 0,
                PINCH_CONVERGENCE_THRESHOLD_PARAM_NAME);
        return this;
    }

    public double getMaxDutyPinchThreshold() {
        return maxDutyPinchThreshold;
    }

    public OpenOrcParameters setMaxDutyPinchThreshold(double maxDutyPinchThreshold) {
        this.maxDutyPinchThreshold = checkParameterValue(maxDutyPinchThreshold,
                maxDutyPinchThreshold > 0,
                MAX_DUTY_PINCH_THRESHOLD_PARAM_NAME);
        return this;
    }

    public double getTemperatureDifferenceFloor() {
        return temperatureDifferenceFloor;
    }

    public OpenOrcParameters setTemperatureDifferenceFloor(double temperatureDifferenceFloor) {
        this.temperatureDifferenceFloor = checkParameterValue(temperatureDifferenceFloor,
                temperatureDifferenceFloor > 0,
                TEMPERATURE_DIFFERENCE_FLOOR_PARAM_NAME);
        return this;
    }

    public int getTwoPhaseZoneCount() {
        return twoPhaseZoneCount;
    }

    public OpenOrcParameters setTwoPhaseZoneCount(int twoPhaseZoneCount) {
        this.twoPhaseZoneCount = checkParameterValue(twoPhaseZoneCount,
                twoPhaseZoneCount >= 1,
                TWO_PHASE_ZONE_COUNT_PARAM_NAME);
        return this;
    }

    public double getBoilingClosureTolerance() {
        return boilingClosureTolerance;
    }

    public OpenOrcParameters setBoilingClosureTolerance(double boilingClosureTolerance) {
        this.boilingClosureTolerance = checkParameterValue(boilingClosureTolerance,
                boilingClosureTolerance > 0,
                BOILING_CLOSURE_TOLERANCE_PARAM_NAME);
        return this;
    }

    public int getBoilingClosureMaxIterations() {
        return boilingClosureMaxIterations;
    }

    public OpenOrcParameters setBoilingClosureMaxIterations(int boilingClosureMaxIterations) {
        this.boilingClosureMaxIterations = checkParameterValue(boilingClosureMaxIterations,
                boilingClosureMaxIterations >= 1,
                BOILING_CLOSURE_MAX_ITERATIONS_PARAM_NAME);
        return this;
    }

    public boolean isStreamRoleNormalization() {
        return streamRoleNormalization;
    }

    public OpenOrcParameters setStreamRoleNormalization(boolean streamRoleNormalization) {
        this.streamRoleNormalization = streamRoleNormalization;
        return this;
    }

    public double getWallTemperatureTolerance() {
        return wallTemperatureTolerance;
    }

    public OpenOrcParameters setWallTemperatureTolerance(double wallTemperatureTolerance) {
        this.wallTemperatureTolerance = checkParameterValue(wallTemperatureTolerance,
                wallTemperatureTolerance > 0,
                WALL_TEMPERATURE_TOLERANCE_PARAM_NAME);
        return this;
    }

    public double getSpeedResidualThreshold() {
        return speedResidualThreshold;
    }

    public OpenOrcParameters setSpeedResidualThreshold(double speedResidualThreshold) {
        this.speedResidualThreshold = checkParameterValue(speedResidualThreshold,
                speedResidualThreshold > 0,
                SPEED_RESIDUAL_THRESHOLD_PARAM_NAME);
        return this;
    }

    public static OpenOrcParameters load() {
        return load(PlatformConfig.defaultConfig());
    }

    public static OpenOrcParameters load(PlatformConfig platformConfig) {
        OpenOrcParameters parameters = new OpenOrcParameters();
        platformConfig.getOptionalModuleConfig(MODULE_NAME)
            .ifPresent(config -> parameters
                .setRootFinderMaxEvaluations(config.getIntProperty(ROOT_FINDER_MAX_EVALUATIONS_PARAM_NAME, ROOT_FINDER_MAX_EVALUATIONS_DEFAULT_VALUE))
                .setDutyAbsoluteTolerance(config.getDoubleProperty(DUTY_ABSOLUTE_TOLERANCE_PARAM_NAME, DUTY_ABSOLUTE_TOLERANCE_DEFAULT_VALUE))
                .setResidualTolerance(config.getDoubleProperty(RESIDUAL_TOLERANCE_PARAM_NAME, RESIDUAL_TOLERANCE_DEFAULT_VALUE))
                .setAreaResidualConvergenceThreshold(config.getDoubleProperty(AREA_RESIDUAL_CONVERGENCE_THRESHOLD_PARAM_NAME, AREA_RESIDUAL_CONVERGENCE_THRESHOLD_DEFAULT_VALUE))
                .setPinchConvergenceThreshold(config.getDoubleProperty(PINCH_CONVERGENCE_THRESHOLD_PARAM_NAME, PINCH_CONVERGENCE_THRESHOLD_DEFAULT_VALUE))
                .setMaxDutyPinchThreshold(config.getDoubleProperty(MAX_DUTY_PINCH_THRESHOLD_PARAM_NAME, MAX_DUTY_PINCH_THRESHOLD_DEFAULT_VALUE))
                .setTemperatureDifferenceFloor(config.getDoubleProperty(TEMPERATURE_DIFFERENCE_FLOOR_PARAM_NAME, TEMPERATURE_DIFFERENCE_FLOOR_DEFAULT_VALUE))
                .setTwoPhaseZoneCount(config.getIntProperty(TWO_PHASE_ZONE_COUNT_PARAM_NAME, TWO_PHASE_ZONE_COUNT_DEFAULT_VALUE))
                .setBoilingClosureTolerance(config.getDoubleProperty(BOILING_CLOSURE_TOLERANCE_PARAM_NAME, BOILING_CLOSURE_TOLERANCE_DEFAULT_VALUE))
                .setBoilingClosureMaxIterations(config.getIntProperty(BOILING_CLOSURE_MAX_ITERATIONS_PARAM_NAME, BOILING_CLOSURE_MAX_ITERATIONS_DEFAULT_VALUE))
                .setStreamRoleNormalization(config.getBooleanProperty(STREAM_ROLE_NORMALIZATION_PARAM_NAME, STREAM_ROLE_NORMALIZATION_DEFAULT_VALUE))
                .setWallTemperatureTolerance(config.getDoubleProperty(WALL_TEMPERATURE_TOLERANCE_PARAM_NAME, WALL_TEMPERATURE_TOLERANCE_DEFAULT_VALUE))
                .setSpeedResidualThreshold(config.getDoubleProperty(SPEED_RESIDUAL_THRESHOLD_PARAM_NAME, SPEED_RESIDUAL_THRESHOLD_DEFAULT_VALUE)));
        return parameters;
    }

    public static OpenOrcParameters load(Map<String, String> properties) {
        return new OpenOrcParameters().update(properties);
    }

    public OpenOrcParameters update(Map<String, String> properties) {
        Optional.ofNullable(properties.get(ROOT_FINDER_MAX_EVALUATIONS_PARAM_NAME))
                .ifPresent(prop -> this.setRootFinderMaxEvaluations(Integer.parseInt(prop)));
        Optional.ofNullable(properties.get(DUTY_ABSOLUTE_TOLERANCE_PARAM_NAME))
                .ifPresent(prop -> this.setDutyAbsoluteTolerance(Double.parseDouble(prop)));
        Optional.ofNullable(properties.get(RESIDUAL_TOLERANCE_PARAM_NAME))
                .ifPresent(prop -> this.setResidualTolerance(Double.parseDouble(prop)));
        Optional.ofNullable(properties.get(AREA_RESIDUAL_CONVERGENCE_THRESHOLD_PARAM_NAME))
                .ifPresent(prop -> this.setAreaResidualConvergenceThreshold(Double.parseDouble(prop)));
        Optional.ofNullable(properties.get(PINCH_CONVERGENCE_THRESHOLD_PARAM_NAME))
                .ifPresent(prop -> this.setPinchConvergenceThreshold(Double.parseDouble(prop)));
        Optional.ofNullable(properties.get(MAX_DUTY_PINCH_THRESHOLD_PARAM_NAME))
                .ifPresent(prop -> this.setMaxDutyPinchThreshold(Double.parseDouble(prop)));
        Optional.ofNullable(properties.get(TEMPERATURE_DIFFERENCE_FLOOR_PARAM_NAME))
                .ifPresent(prop -> this.setTemperatureDifferenceFloor(Double.parseDouble(prop)));
        Optional.ofNullable(properties.get(TWO_PHASE_ZONE_COUNT_PARAM_NAME))
                .ifPresent(prop -> this.setTwoPhaseZoneCount(Integer.parseInt(prop)));
        Optional.ofNullable(properties.get(BOILING_CLOSURE_TOLERANCE_PARAM_NAME))
                .ifPresent(prop -> this.setBoilingClosureTolerance(Double.parseDouble(prop)));
        Optional.ofNullable(properties.get(BOILING_CLOSURE_MAX_ITERATIONS_PARAM_NAME))
                .ifPresent(prop -> this.setBoilingClosureMaxIterations(Integer.parseInt(prop)));
        Optional.ofNullable(properties.get(STREAM_ROLE_NORMALIZATION_PARAM_NAME))
                .ifPresent(prop -> this.setStreamRoleNormalization(Boolean.parseBoolean(prop)));
        Optional.ofNullable(properties.get(WALL_TEMPERATURE_TOLERANCE_PARAM_NAME))
                .ifPresent(prop -> this.setWallTemperatureTolerance(Double.parseDouble(prop)));
        Optional.ofNullable(properties.get(SPEED_RESIDUAL_THRESHOLD_PARAM_NAME))
                .ifPresent(prop -> this.setSpeedResidualThreshold(Double.parseDouble(prop)));
        return this;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>(13);
        map.put(ROOT_FINDER_MAX_EVALUATIONS_PARAM_NAME, rootFinderMaxEvaluations);
        map.put(DUTY_ABSOLUTE_TOLERANCE_PARAM_NAME, dutyAbsoluteTolerance);
        map.put(RESIDUAL_TOLERANCE_PARAM_NAME, residualTolerance);
        map.put(AREA_RESIDUAL_CONVERGENCE_THRESHOLD_PARAM_NAME, areaResidualConvergenceThreshold);
        map.put(PINCH_CONVERGENCE_THRESHOLD_PARAM_NAME, pinchConvergenceThreshold);
        map.put(MAX_DUTY_PINCH_THRESHOLD_PARAM_NAME, maxDutyPinchThreshold);
        map.put(TEMPERATURE_DIFFERENCE_FLOOR_PARAM_NAME, temperatureDifferenceFloor);
        map.put(TWO_PHASE_ZONE_COUNT_PARAM_NAME, twoPhaseZoneCount);
        map.put(BOILING_CLOSURE_TOLERANCE_PARAM_NAME, boilingClosureTolerance);
        map.put(BOILING_CLOSURE_MAX_ITERATIONS_PARAM_NAME, boilingClosureMaxIterations);
        map.put(STREAM_ROLE_NORMALIZATION_PARAM_NAME, streamRoleNormalization);
        map.put(WALL_TEMPERATURE_TOLERANCE_PARAM_NAME, wallTemperatureTolerance);
        map.put(SPEED_RESIDUAL_THRESHOLD_PARAM_NAME, speedResidualThreshold);
        return map;
    }

    @Override
    public String toString() {
        return "OpenOrcParameters(" + toMap().entrySet().stream().map(e -> e.getKey() + "=" + e.getValue()).collect(Collectors.joining(", ")) + ")";
    }
}
