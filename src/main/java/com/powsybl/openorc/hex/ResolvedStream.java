/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openorc.hex;

import com.powsybl.openorc.fluid.FluidProperty;
import com.powsybl.openorc.fluid.FluidPropertyOracle;
import com.powsybl.openorc.fluid.FluidStates;
import com.powsybl.openorc.fluid.PropertyUndefinedException;
import com.powsybl.openorc.fluid.Stream;
import com.powsybl.openorc.fluid.SupplyStateType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * A {@link Stream} whose supply state has been resolved against a fluid property oracle: supply enthalpy and
 * temperature, and saturated enthalpies when the stream can change phase at its pressure.
 *
 * @author Open ORC developers
 */
public final class ResolvedStream {

    private static final Logger LOGGER = LoggerFactory.getLogger(ResolvedStream.class);

    private final Stream stream;

    private final FluidStates states;

    private final double supplyEnthalpy;

    private final double supplyTemperature;

    private final double bubbleEnthalpy;

    private final double dewEnthalpy;

    private ResolvedStream(Stream stream, FluidStates states, double supplyEnthalpy, double supplyTemperature,
                           double bubbleEnthalpy, double dewEnthalpy) {
        this.stream = stream;
        this.states = states;
        this.supplyEnthalpy = supplyEnthalpy;
        this.supplyTemperature = supplyTemperature;
        this.bubbleEnthalpy = bubbleEnthalpy;
        this.dewEnthalpy = dewEnthalpy;
    }

    public static ResolvedStream resolve(Stream stream, FluidPropertyOracle oracle) {
        Objects.requireNonNull(stream);
        FluidStates states = new FluidStates(Objects.requireNonNull(oracle), stream.getFluid());
        double pressure = stream.getPressure();
        double supplyEnthalpy = stream.getSupplyEnthalpy(states);
        double supplyTemperature = stream.getSupplyStateType() == SupplyStateType.TEMPERATURE
                ? stream.getSupplyValue()
                : states.temperature(pressure, supplyEnthalpy);
        double bubbleEnthalpy = Double.NaN;
        double dewEnthalpy = Double.NaN;
        if (!stream.isIncompressible()) {
            try {
                if (pressure < states.criticalPressure(pressure)) {
                    bubbleEnthalpy = states.saturated(FluidProperty.ENTHALPY, pressure, 0);
                    dewEnthalpy = states.saturated(FluidProperty.ENTHALPY, pressure, 1);
                }
            } catch (PropertyUndefinedException e) {
                LOGGER.debug("No saturation dome for {} at {} Pa: {}", stream.getFluid(), pressure, e.getMessage());
            }
        }
        return new ResolvedStream(stream, states, supplyEnthalpy, supplyTemperature, bubbleEnthalpy, dewEnthalpy);
    }

    public Stream getStream() {
        return stream;
    }

    public FluidStates getStates() {
        return states;
    }

    public String getFluid() {
        return stream.getFluid();
    }

    public double getPressure() {
        return stream.getPressure();
    }

    public double getMassFlow() {
        return stream.getMassFlow();
    }

    public boolean isIncompressible() {
        return stream.isIncompressible();
    }

    public double getSupplyEnthalpy() {
        return supplyEnthalpy;
    }

    public double getSupplyTemperature() {
        return supplyTemperature;
    }

    /**
     * Saturated liquid enthalpy, NaN when the stream has no two-phase dome.
     */
    public double getBubbleEnthalpy() {
        return bubbleEnthalpy;
    }

    /**
     * Saturated vapour enthalpy, NaN when the stream has no two-phase dome.
     */
    public double getDewEnthalpy() {
        return dewEnthalpy;
    }

    public boolean hasTwoPhaseDome() {
        return !Double.isNaN(bubbleEnthalpy) && !Double.isNaN(dewEnthalpy);
    }

    public double getLatentHeat() {
        return dewEnthalpy - bubbleEnthalpy;
    }

    /**
     * Regime at the given enthalpy. Incompressible streams are always liquid and supercritical streams are
     * considered as vapour.
     */
    public Phase phaseOf(double enthalpy) {
        if (isIncompressible()) {
            return Phase.LIQUID;
        }
        if (!hasTwoPhaseDome()) {
            return Phase.VAPOR;
        }
        if (enthalpy < bubbleEnthalpy) {
            return Phase.LIQUID;
        } else if (enthalpy > dewEnthalpy) {
            return Phase.VAPOR;
        }
        return Phase.TWO_PHASE;
    }

    /**
     * Vapour quality computed from the saturated enthalpies, clamped to [min, max].
     */
    public double clampedQuality(double enthalpy, double min, double max) {
        double quality = (enthalpy - bubbleEnthalpy) / (dewEnthalpy - bubbleEnthalpy);
        return Math.max(min, Math.min(max, quality));
    }

    public double temperature(double enthalpy) {
        return states.temperature(getPressure(), enthalpy);
    }

    public double density(double enthalpy) {
        return states.density(getPressure(), enthalpy);
    }

    public double enthalpyAtTemperature(double temperature) {
        return states.enthalpyAtTemperature(getPressure(), temperature);
    }

    /**
     * Entropy at the given enthalpy, NaN for streams given by their temperature.
     */
    public double entropy(double enthalpy) {
        if (stream.getSupplyStateType() != SupplyStateType.ENTHALPY) {
            return Double.NaN;
        }
        return states.entropy(getPressure(), enthalpy);
    }

    /**
     * Vapour quality reported by the oracle, NaN for incompressible streams or when it is undefined.
     */
    public double quality(double enthalpy) {
        if (isIncompressible()) {
            return Double.NaN;
        }
        try {
            return states.quality(getPressure(), enthalpy);
        } catch (PropertyUndefinedException e) {
            LOGGER.trace("Undefined quality for {} at {} Pa", getFluid(), getPressure());
            return Double.NaN;
        }
    }

    @Override
    public String toString() {
        return "ResolvedStream(" + stream
                + ", supplyEnthalpy=" + supplyEnthalpy
                + ", supplyTemperature=" + supplyTemperature
                + ")";
    }
}
