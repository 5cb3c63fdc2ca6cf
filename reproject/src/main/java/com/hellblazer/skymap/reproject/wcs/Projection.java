/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.skymap.reproject.wcs;

import com.hellblazer.skymap.common.ConfigurationException;

import java.util.Locale;

import static java.lang.Math.*;

/**
 * Planar sky projections, mapping native spherical coordinates (phi, theta) to intermediate world coordinates (x, y),
 * all in degrees, following Calabretta &amp; Greisen 2002, "Representations of celestial coordinates in FITS".
 * <p>
 * Both directions return {@code null} for points outside the projection's domain.
 *
 * @author hal.hildebrand
 */
public enum Projection {
    /** Plate carree, cylindrical */
    CAR(0.0) {
        @Override
        double[] fromNative(double phi, double theta) {
            return new double[] { wrap(phi), theta };
        }

        @Override
        double[] toNative(double x, double y) {
            if (abs(x) > 180.0 || abs(y) > 90.0) {
                return null;
            }
            return new double[] { x, y };
        }
    },
    /** Hammer-Aitoff, equal area all-sky */
    AIT(0.0) {
        @Override
        double[] fromNative(double phi, double theta) {
            var halfPhi = toRadians(wrap(phi)) / 2.0;
            var t = toRadians(theta);
            var gamma = R0 * sqrt(2.0 / (1.0 + cos(t) * cos(halfPhi)));
            return new double[] { 2.0 * gamma * cos(t) * sin(halfPhi), gamma * sin(t) };
        }

        @Override
        double[] toNative(double x, double y) {
            var u = x / (4.0 * R0);
            var v = y / (2.0 * R0);
            var zz = 1.0 - u * u - v * v;
            if (zz < 0.5) {
                return null;
            }
            var z = sqrt(zz);
            var phi = 2.0 * toDegrees(atan2(x * z / (2.0 * R0), 2.0 * zz - 1.0));
            var theta = toDegrees(asin(max(-1.0, min(1.0, y * z / R0))));
            return new double[] { phi, theta };
        }
    },
    /** Gnomonic, zenithal */
    TAN(90.0) {
        @Override
        double[] fromNative(double phi, double theta) {
            if (theta <= 0.0) {
                return null;
            }
            var t = toRadians(theta);
            return zenithal(phi, R0 * cos(t) / sin(t));
        }

        @Override
        double[] toNative(double x, double y) {
            var r = hypot(x, y);
            return new double[] { zenithalPhi(x, y, r), toDegrees(atan2(R0, r)) };
        }
    },
    /** Zenithal equal area */
    ZEA(90.0) {
        @Override
        double[] fromNative(double phi, double theta) {
            return zenithal(phi, 2.0 * R0 * sin(toRadians(90.0 - theta) / 2.0));
        }

        @Override
        double[] toNative(double x, double y) {
            var r = hypot(x, y);
            if (r > 2.0 * R0) {
                return null;
            }
            var theta = 90.0 - 2.0 * toDegrees(asin(min(1.0, r / (2.0 * R0))));
            return new double[] { zenithalPhi(x, y, r), theta };
        }
    };

    /** Radius of the generating sphere, in degrees per radian */
    static final double R0 = 180.0 / PI;

    private final double theta0;

    Projection(double theta0) {
        this.theta0 = theta0;
    }

    /**
     * Resolve a three letter projection code.
     *
     * @throws ConfigurationException for an unsupported code
     */
    public static Projection fromCode(String code) {
        if (code != null) {
            var normalized = code.trim().toUpperCase(Locale.ROOT);
            for (var projection : values()) {
                if (projection.name().equals(normalized)) {
                    return projection;
                }
            }
        }
        throw new ConfigurationException("Unsupported projection code: " + code);
    }

    private static double wrap(double phi) {
        var p = phi % 360.0;
        if (p > 180.0) {
            p -= 360.0;
        } else if (p <= -180.0) {
            p += 360.0;
        }
        return p;
    }

    private static double[] zenithal(double phi, double r) {
        var p = toRadians(phi);
        return new double[] { r * sin(p), -r * cos(p) };
    }

    private static double zenithalPhi(double x, double y, double r) {
        return r == 0.0 ? 0.0 : toDegrees(atan2(x, -y));
    }

    /**
     * Native latitude of the projection's reference point.
     */
    public double theta0() {
        return theta0;
    }

    /**
     * @return {x, y} or null when the point cannot be projected
     */
    abstract double[] fromNative(double phi, double theta);

    /**
     * @return {phi, theta} or null when (x, y) lies outside the projection
     */
    abstract double[] toNative(double x, double y);
}
