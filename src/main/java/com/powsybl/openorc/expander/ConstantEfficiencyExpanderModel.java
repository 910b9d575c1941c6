/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openorc.expander;

/**
 * Expander with constant isentropic efficiency and filling factor.
 *
 * @author Open ORC developers
 */
public class ConstantEfficiencyExpanderModel extends AbstractExpanderModel {

    private final double isentropicEfficiency;

    private final double fillingFactor;

    private ConstantEfficiencyExpanderModel(Builder builder) {
        super(builder);
        if (!(builder.isentropicEfficiency > 0 && builder.isentropicEfficiency <= 1)) {
            throw new IllegalArgumentException("Invalid isentropic efficiency value: " + builder.isentropicEfficiency);
        }
        this.isentropicEfficiency = builder.isentropicEfficiency;
        this.fillingFactor = checkPositive(builder.fillingFactor, "filling factor");
    }

    public static Builder builder() {
        return new Builder();
    }

    public double getIsentropicEfficiency() {
        return isentropicEfficiency;
    }

    public double getFillingFactor() {
        return fillingFactor;
    }

    @Override
    public ExpanderModelType getType() {
        return ExpanderModelType.CONSTANT_EFFICIENCY;
    }

    @Override
    public ExpanderSolution solve(ExpanderSolvingContext context) {
        double speed = speed(context.getMassFlow(), fillingFactor, context.getSupplyDensity());
        return efficiencySolution(context, isentropicEfficiency, fillingFactor, speed, null);
    }

    @Override
    public String toString() {
        return "ConstantEfficiencyExpanderModel(isentropicEfficiency=" + isentropicEfficiency
                + ", fillingFactor=" + fillingFactor
                + ", sweptVolume=" + sweptVolume
                + ")";
    }

    public static final class Builder extends AbstractBuilder<Builder> {

        private double isentropicEfficiency = Double.NaN;

        private double fillingFactor = 1;

        private Builder() {
        }

        @Override
        protected Builder self() {
            return this;
        }

        public Builder setIsentropicEfficiency(double isentropicEfficiency) {
            this.isentropicEfficiency = isentropicEfficiency;
            return this;
        }

        public Builder setFillingFactor(double fillingFactor) {
            this.fillingFactor = fillingFactor;
            return this;
        }

        public ConstantEfficiencyExpanderModel build() {
            return new ConstantEfficiencyExpanderModel(this);
        }
    }
}
