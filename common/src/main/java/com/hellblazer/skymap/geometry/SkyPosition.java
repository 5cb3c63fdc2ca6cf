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

import java.util.Objects;

/**
 * A sky direction bound to the frame it is expressed in.
 *
 * @author hal.hildebrand
 */
public record SkyPosition(SkyDirection direction, CoordinateFrame frame) {

    public SkyPosition {
        Objects.requireNonNull(direction, "direction");
        Objects.requireNonNull(frame, "frame");
    }

    public static SkyPosition of(double lon, double lat, CoordinateFrame frame) {
        return new SkyPosition(new SkyDirection(lon, lat), frame);
    }

    public double lat() {
        return direction.lat();
    }

    public double lon() {
        return direction.lon();
    }

    /**
     * The same position expressed in another frame.
     */
    public SkyPosition transformTo(CoordinateFrame target) {
        if (target == frame) {
            return this;
        }
        return new SkyPosition(FrameTransform.between(frame, target).apply(direction), target);
    }
}
