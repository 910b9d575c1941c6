/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openorc.hex.htc;

import net.jafama.FastMath;

/**
 * Single-phase convective heat transfer correlations.
 *
 * @author Open ORC developers
 */
public enum SinglePhaseCorrelation {
    /**
     * Chevron plates, Martin (VDI Heat Atlas).
     */
    MARTIN {
        @Override
        public double coefficient(ZoneSide zoneSide, CorrelationSettings settings) {
            ChannelGeometry geometry = settings.getGeometry();
            SinglePhaseFlow flow = SinglePhaseFlow.of(zoneSide, geometry);
            double theta = geometry.getChevronAngle();
            double re = flow.reynolds();
            double f0;
            double f90;
            if (re < 2000) {
                f0 = 16 / re;
                f90 = 149.25 / re + 0.9625;
            } else {
                f0 = FastMath.pow(1.56 * FastMath.log(re) - 3, -2);
                f90 = 9.75 / FastMath.pow(re, 0.289);
            }
            double cos = FastMath.cos(theta);
            double f = FastMath.pow(cos / FastMath.sqrt(0.045 * FastMath.tan(theta) + 0.09 * FastMath.sin(theta) + f0 / cos)
                    + (1 - cos) / FastMath.sqrt(3.8 * f90), -0.5);
            double nu = settings.getSinglePhaseFactor() * 0.205 * FastMath.cbrt(flow.prandtl())
                    * FastMath.pow(f * re * re * FastMath.sin(2 * theta), settings.getSinglePhaseExponentFactor() * 0.374);
            return flow.coefficient(nu);
        }
    },
    /**
     * Chevron plates, Wanniarachchi.
     */
    WANNIARACHCHI {
        @Override
        public double coefficient(ZoneSide zoneSide, CorrelationSettings settings) {
            ChannelGeometry geometry = settings.getGeometry();
            SinglePhaseFlow flow = SinglePhaseFlow.of(zoneSide, geometry);
            double angle = 90 - FastMath.toDegrees(geometry.getChevronAngle());
            double re = flow.reynolds();
            double fact2 = settings.getSinglePhaseExponentFactor();
            double jt = 12.6 * FastMath.pow(angle, -1.142) * FastMath.pow(re, fact2 * (0.646 + 0.00111 * angle));
            double jl = 3.65 * FastMath.pow(angle, -0.455) * FastMath.pow(re, fact2 * -0.339);
            double nu = settings.getSinglePhaseFactor() * FastMath.cbrt(jl * jl * jl + jt * jt * jt) * FastMath.cbrt(flow.prandtl());
            return flow.coefficient(nu);
        }
    },
    /**
     * Chevron plates, Thonon. Defined for chevron angles up to 60 degrees.
     */
    THONON {
        @Override
        public double coefficient(ZoneSide zoneSide, CorrelationSettings settings) {
            ChannelGeometry geometry = settings.getGeometry();
            double theta = FastMath.toDegrees(geometry.getChevronAngle());
            double c;
            double m;
            if (theta <= 15) {
                c = 0.1;
                m = 0.687;
            } else if (theta <= 30) {
                c = 0.2267;
                m = 0.631;
            } else if (theta <= 45) {
                c = 0.2998;
                m = 0.645;
            } else if (theta <= 60) {
                c = 0.2946;
                m = 0.7;
            } else {
                throw new IllegalArgumentException("Invalid chevron angle for Thonon correlation: " + theta + " deg");
            }
            SinglePhaseFlow flow = SinglePhaseFlow.of(zoneSide, geometry);
            double nu = settings.getSinglePhaseFactor() * c * FastMath.pow(flow.reynolds(), settings.getSinglePhaseExponentFactor() * m)
                    * FastMath.cbrt(flow.prandtl());
            return flow.coefficient(nu);
        }
    },
    /**
     * Smooth tubes, Gnielinski with Konakov friction factor, constant laminar Nusselt number.
     */
    GNIELINSKI {
        @Override
        public double coefficient(ZoneSide zoneSide, CorrelationSettings settings) {
            SinglePhaseFlow flow = SinglePhaseFlow.of(zoneSide, settings.getGeometry());
            double nu = flow.reynolds() > TRANSITION_REYNOLDS ? turbulentNusselt(flow) : 3.66;
            return settings.getSinglePhaseFactor() * flow.coefficient(nu);
        }
    },
    /**
     * Smooth tubes, Gnielinski in turbulent flow and Sha developing laminar flow.
     */
    GNIELINSKI_AND_SHA {
        @Override
        public double coefficient(ZoneSide zoneSide, CorrelationSettings settings) {
            ChannelGeometry geometry = settings.getGeometry();
            SinglePhaseFlow flow = SinglePhaseFlow.of(zoneSide, geometry);
            double nu;
            if (flow.reynolds() > TRANSITION_REYNOLDS) {
                nu = turbulentNusselt(flow);
            } else {
                double nu1 = 4.364;
                double nu2 = 1.953 * FastMath.cbrt(flow.reynolds() * flow.prandtl() * flow.hydraulicDiameter() / geometry.getTubeLength());
                nu = FastMath.cbrt(nu1 * nu1 * nu1 + 0.6 * 0.6 * 0.6 + FastMath.pow(nu2 - 0.6, 3));
            }
            return settings.getSinglePhaseFactor() * flow.coefficient(nu);
        }
    },
    /**
     * Staggered finned tube banks (VDI Heat Atlas). The hydraulic diameter is the outer tube diameter.
     */
    VDI_FINNED_TUBES_STAGGERED {
        @Override
        public double coefficient(ZoneSide zoneSide, CorrelationSettings settings) {
            ChannelGeometry geometry = settings.getGeometry();
            SinglePhaseFlow flow = SinglePhaseFlow.of(zoneSide, geometry);
            double nu = settings.getSinglePhaseFactor() * 0.38 * FastMath.pow(flow.reynolds(), settings.getSinglePhaseExponentFactor() * 0.6)
                    * FastMath.cbrt(flow.prandtl()) * FastMath.pow(geometry.getFinAreaRatio(), -0.15);
            return flow.coefficient(nu);
        }
    },
    /**
     * Staggered plain finned tube banks, Wang. The hydraulic diameter is the collar diameter.
     */
    WANG_FINNED_TUBES_STAGGERED {
        @Override
        public double coefficient(ZoneSide zoneSide, CorrelationSettings settings) {
            ChannelGeometry geometry = settings.getGeometry();
            SinglePhaseFlow flow = SinglePhaseFlow.of(zoneSide, geometry);
            double n = geometry.getTubeRowCount();
            double fp = geometry.getFinPitch();
            double dc = geometry.getHydraulicDiameter();
            double pl = geometry.getLongitudinalTubePitch();
            double dh = geometry.getFinnedHydraulicDiameter();
            double re = flow.reynolds();
            double lnRe = FastMath.log(re);
            double p1 = -0.361 - 0.042 * n / lnRe + 0.158 * FastMath.log(n * FastMath.pow(fp / dc, 0.41));
            double p2 = -1.224 - 0.076 * FastMath.pow(pl / dh, 1.42) / lnRe;
            double p3 = -0.083 + 0.058 * n / lnRe;
            double p4 = -5.735 + 1.21 * FastMath.log(re / n);
            double p5 = -0.93;
            double j = 0.086 * FastMath.pow(re, p1) * FastMath.pow(n, p2) * FastMath.pow(fp / dc, p3)
                    * FastMath.pow(fp / dh, p4) * FastMath.pow(fp / pl, p5);
            double nu = settings.getSinglePhaseFactor() * FastMath.pow(j * re, settings.getSinglePhaseExponentFactor())
                    * FastMath.cbrt(flow.prandtl());
            return flow.coefficient(nu);
        }
    },
    /**
     * User given coefficient.
     */
    MANUAL {
        @Override
        public double coefficient(ZoneSide zoneSide, CorrelationSettings settings) {
            return settings.getSinglePhaseManualCoefficient();
        }
    };

    private static final double TRANSITION_REYNOLDS = 2300;

    private static double turbulentNusselt(SinglePhaseFlow flow) {
        double re = flow.reynolds();
        double pr = flow.prandtl();
        double f = FastMath.pow(1.8 * FastMath.log10(re) - 1.5, -2);
        return f / 8 * (re - 1000) * pr / (1 + 12.7 * FastMath.sqrt(f / 8) * (FastMath.pow(pr, 2. / 3) - 1));
    }

    public abstract double coefficient(ZoneSide zoneSide, CorrelationSettings settings);
}
