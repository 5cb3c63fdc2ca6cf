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
package com.hellblazer.skymap.geometry;

import javax.vecmath.Tuple3d;
import javax.vecmath.Vector3d;

import static java.lang.Math.*;

/**
 * A direction on the sky as longitude/latitude in degrees. The frame is carried by the owner of the direction, not the
 * direction itself.
 *
 * @param lon longitude in degrees, normalized to [0, 360)
 * @param lat latitude in degrees, in [-90, 90]
 * @author hal.hildebrand
 */
public record SkyDirection(double lon, double lat) {

    public SkyDirection {
        if (Double.isNaN(lon) || Double.isNaN(lat)) {
            throw new IllegalArgumentException("Sky direction cannot be NaN: (" + lon + ", " + lat + ")");
        }
        if (lat < -90.0 || lat > 90.0) {
            throw new IllegalArgumentException("Latitude out of range: " + lat);
        }
        lon = normalizeLongitude(lon);
    }

    /**
     * Direction from HEALPix-style angles.
     *
     * @param theta colatitude in radians, 0 at the north pole
     * @param phi   azimuth in radians
     */
    public static SkyDirection fromColatitude(double theta, double phi) {
        return new SkyDirection(toDegrees(phi), clampLatitude(90.0 - toDegrees(theta)));
    }

    /**
     * Direction of a (not necessarily normalized) Cartesian vector.
     */
    public static SkyDirection fromVector(Tuple3d v) {
        var lon = toDegrees(atan2(v.y, v.x));
        var lat = toDegrees(atan2(v.z, sqrt(v.x * v.x + v.y * v.y)));
        return new SkyDirection(lon, clampLatitude(lat));
    }

    public static double normalizeLongitude(double lon) {
        var l = lon % 360.0;
        if (l < 0.0) {
            l += 360.0;
        }
        return l == 360.0 ? 0.0 : l;
    }

    private static double clampLatitude(double lat) {
        return max(-90.0, min(90.0, lat));
    }

    /**
     * Great-circle separation in degrees.
     */
    public double angularDistance(SkyDirection other) {
        var a = toVector();
        var b = other.toVector();
        var cross = new Vector3d();
        cross.cross(a, b);
        return toDegrees(atan2(cross.length(), a.dot(b)));
    }

    /**
     * @return colatitude in radians
     */
    public double theta() {
        return toRadians(90.0 - lat);
    }

    /**
     * @return azimuth in radians
     */
    public double phi() {
        return toRadians(lon);
    }

    /**
     * Unit vector, with colatitude = 90 - lat.
     */
    public Vector3d toVector() {
        var theta = theta();
        var phi = phi();
        var sinTheta = sin(theta);
        return new Vector3d(sinTheta * cos(phi), sinTheta * sin(phi), cos(theta));
    }
}
