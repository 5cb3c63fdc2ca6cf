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
package com.hellblazer.skymap.reproject;

import com.hellblazer.skymap.common.GeometryMismatchException;
import com.hellblazer.skymap.reproject.wcs.WcsGeometry;

import java.util.Arrays;

/**
 * Planar raster produced by resampling a spherical map: one or more planes of {@code width * height} values, each
 * row-major with x fastest.
 *
 * @author hal.hildebrand
 */
public final class GridRaster {

    private final WcsGeometry geometry;
    private final double[][]  planes;

    GridRaster(WcsGeometry geometry, double[][] planes) {
        for (var plane : planes) {
            if (plane.length != geometry.cellCount()) {
                throw new GeometryMismatchException("Plane has " + plane.length + " cells, grid has "
                                                    + geometry.cellCount());
            }
        }
        this.geometry = geometry;
        this.planes = planes;
    }

    public double get(int plane, int i, int j) {
        return planes[plane][j * geometry.getWidth() + i];
    }

    public double get(int i, int j) {
        return get(0, i, j);
    }

    public WcsGeometry getGeometry() {
        return geometry;
    }

    public int getHeight() {
        return geometry.getHeight();
    }

    public int getWidth() {
        return geometry.getWidth();
    }

    public boolean isStacked() {
        return planes.length > 1;
    }

    /**
     * Copy of one plane.
     */
    public double[] plane(int plane) {
        return planes[plane].clone();
    }

    public int planeCount() {
        return planes.length;
    }

    /**
     * Sum of every cell of one plane.
     */
    public double sum(int plane) {
        return Arrays.stream(planes[plane]).sum();
    }

    @Override
    public String toString() {
        return "GridRaster[" + planes.length + " x " + getWidth() + "x" + getHeight() + "]";
    }
}
