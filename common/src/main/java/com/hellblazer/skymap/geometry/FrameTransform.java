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

import javax.vecmath.Matrix3d;
import javax.vecmath.Vector3d;

/**
 * Rotation between two coordinate frames, applied to unit direction vectors.
 *
 * @author hal.hildebrand
 */
public final class FrameTransform {

    /** J2000 equatorial to galactic rotation (Hipparcos, ESA 1997 vol. 1 sec. 1.5.3) */
    private static final Matrix3d EQUATORIAL_TO_GALACTIC = new Matrix3d(-0.0548755604162154, -0.8734370902348850,
                                                                        -0.4838350155487132, 0.4941094278755837,
                                                                        -0.4448296299600112, 0.7469822444972189,
                                                                        -0.8676661490190047, -0.1980763734312015,
                                                                        0.4559837761750669);

    private static final FrameTransform IDENTITY = new FrameTransform(CoordinateFrame.CELESTIAL,
                                                                      CoordinateFrame.CELESTIAL, null);

    private final CoordinateFrame from;
    private final CoordinateFrame to;
    private final Matrix3d        rotation;

    private FrameTransform(CoordinateFrame from, CoordinateFrame to, Matrix3d rotation) {
        this.from = from;
        this.to = to;
        this.rotation = rotation;
    }

    public static FrameTransform between(CoordinateFrame from, CoordinateFrame to) {
        if (from == to) {
            return from == CoordinateFrame.CELESTIAL ? IDENTITY : new FrameTransform(from, to, null);
        }
        var m = new Matrix3d(EQUATORIAL_TO_GALACTIC);
        if (from == CoordinateFrame.GALACTIC) {
            m.transpose();
        }
        return new FrameTransform(from, to, m);
    }

    public SkyDirection apply(SkyDirection direction) {
        if (isIdentity()) {
            return direction;
        }
        return SkyDirection.fromVector(apply(direction.toVector()));
    }

    /**
     * Rotate a vector. The argument is not modified.
     */
    public Vector3d apply(Vector3d v) {
        var result = new Vector3d(v);
        if (rotation != null) {
            rotation.transform(result);
        }
        return result;
    }

    public CoordinateFrame from() {
        return from;
    }

    public boolean isIdentity() {
        return rotation == null;
    }

    public CoordinateFrame to() {
        return to;
    }

    @Override
    public String toString() {
        return "FrameTransform[" + from + " -> " + to + "]";
    }
}
