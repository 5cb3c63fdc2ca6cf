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
package com.hellblazer.skymap.healpix;

import com.hellblazer.skymap.common.OutOfRangeException;

/**
 * Approximate HEALPix pixel edge length, in degrees, per resolution order. The values are round engineering numbers
 * used to size planar grids, not exact pixel dimensions.
 *
 * @author hal.hildebrand
 */
public final class PixelSizeTable {

    public static final int MAX_ORDER = 13;

    private static final double[] ORDER_TO_PIXSIZE = { 32.0, 16.0, 8.0, 4.0, 2.0, 1.0, 0.50, 0.25, 0.1, 0.05, 0.025,
                                                       0.01, 0.005, 0.002 };

    private PixelSizeTable() {
    }

    /**
     * @throws OutOfRangeException if the order has no table entry
     */
    public static double forOrder(int order) {
        if (order < 0 || order > MAX_ORDER) {
            throw new OutOfRangeException("HEALPix order must be between 0 and " + MAX_ORDER + ": " + order);
        }
        return ORDER_TO_PIXSIZE[order];
    }

    /**
     * @throws OutOfRangeException if nside is not a power of two within the table
     */
    public static double forNside(long nside) {
        if (nside <= 0 || Long.bitCount(nside) != 1) {
            throw new OutOfRangeException("HEALPix nside has no pixel size entry: " + nside);
        }
        return forOrder(Long.numberOfTrailingZeros(nside));
    }
}
