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
import com.hellblazer.skymap.geometry.FrameTransform;
import com.hellblazer.skymap.healpix.SphericalPixelization;
import com.hellblazer.skymap.reproject.wcs.WcsGeometry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.stream.IntStream;

import static com.hellblazer.skymap.healpix.SphericalPixelization.SENTINEL;

/**
 * The cached correspondence between every cell of a planar grid and the spherical pixel sampled at its center.
 * <p>
 * Cells are numbered row-major with x fastest: {@code cell = j * width + i}. Each cell carries the global index of its
 * spherical pixel, the local index within the pixelization ({@link SphericalPixelization#SENTINEL} when the cell falls
 * outside the region or outside the projection) and a weight of {@code 1 / n}, where n is the number of valid cells
 * sampling the same spherical pixel. Weights of the cells sampling one spherical pixel therefore sum to one.
 * <p>
 * A mapping is immutable and is never rebuilt implicitly; build it once per (pixelization, grid) pair and reuse it.
 *
 * @author hal.hildebrand
 */
public final class PixelMapping {

    private static final Logger log = LoggerFactory.getLogger(PixelMapping.class);

    private final SphericalPixelization pixelization;
    private final WcsGeometry           grid;
    private final long[]                globalIndex;
    private final int[]                 localIndex;
    private final double[]              weight;
    private final int                   validCells;
    private final int                   distinctPixels;

    private PixelMapping(SphericalPixelization pixelization, WcsGeometry grid, long[] globalIndex, int[] localIndex,
                         double[] weight, int validCells, int distinctPixels) {
        this.pixelization = pixelization;
        this.grid = grid;
        this.globalIndex = globalIndex;
        this.localIndex = localIndex;
        this.weight = weight;
        this.validCells = validCells;
        this.distinctPixels = distinctPixels;
    }

    /**
     * Build sequentially.
     */
    public static PixelMapping build(SphericalPixelization pixelization, WcsGeometry grid) {
        return build(pixelization, grid, ReprojectionConfig.defaults());
    }

    /**
     * Classify every grid cell, count the valid cells per spherical pixel and derive the weights. The classification
     * pass runs in parallel when the configuration asks for it and the grid is large enough.
     */
    public static PixelMapping build(SphericalPixelization pixelization, WcsGeometry grid,
                                     ReprojectionConfig config) {
        var start = System.nanoTime();
        var cells = grid.cellCount();
        var width = grid.getWidth();
        var base = pixelization.getBase();
        var transform = FrameTransform.between(grid.getFrame(), pixelization.getFrame());

        var global = new long[cells];
        var local = new int[cells];
        var stream = IntStream.range(0, cells);
        if (config.useParallel(cells)) {
            stream = stream.parallel();
        }
        stream.forEach(cell -> {
            var direction = grid.cellCenter(cell % width, cell / width);
            if (direction == null) {
                global[cell] = SENTINEL;
                local[cell] = SENTINEL;
                return;
            }
            var pixel = base.vec2pix(transform.apply(direction.toVector()));
            global[cell] = pixel;
            local[cell] = pixelization.globalToLocal(pixel);
        });

        // cells outside the region do not count toward a pixel's coverage
        Map<Long, Integer> hits = new HashMap<>();
        var valid = 0;
        for (int cell = 0; cell < cells; cell++) {
            if (local[cell] >= 0) {
                hits.merge(global[cell], 1, Integer::sum);
                valid++;
            }
        }
        var weight = new double[cells];
        for (int cell = 0; cell < cells; cell++) {
            if (local[cell] >= 0) {
                weight[cell] = 1.0 / hits.get(global[cell]);
            }
        }

        var mapping = new PixelMapping(pixelization, grid, global, local, weight, valid, hits.size());
        if (log.isDebugEnabled()) {
            log.debug("Mapped {} cells ({} valid) onto {} pixels of {} in {} ms", cells, valid, hits.size(),
                      pixelization, (System.nanoTime() - start) / 1_000_000);
        }
        return mapping;
    }

    /**
     * Resample one plane of spherical data into a planar raster. Cells with a valid local index receive
     * {@code data[local]}, scaled by the cell's weight when normalizing; all other cells of {@code out} are left
     * untouched, so callers zero-initialize it.
     *
     * @param data      values indexed by local spherical pixel index
     * @param out       values indexed by grid cell
     * @param normalize true for flux preserving, false for intensity preserving resampling
     * @throws GeometryMismatchException if either array does not match the mapping's shape
     */
    public void apply(double[] data, double[] out, boolean normalize) {
        if (data.length != pixelization.getPixelCount()) {
            throw new GeometryMismatchException("Data has " + data.length + " pixels, pixelization has "
                                                + pixelization.getPixelCount());
        }
        if (out.length != localIndex.length) {
            throw new GeometryMismatchException("Output has " + out.length + " cells, grid has "
                                                + localIndex.length);
        }
        for (int cell = 0; cell < localIndex.length; cell++) {
            var local = localIndex[cell];
            if (local >= 0) {
                out[cell] = normalize ? data[local] * weight[cell] : data[local];
            }
        }
    }

    /**
     * @throws GeometryMismatchException unless this mapping was built for the given pixelization geometry
     */
    public void checkPixelization(SphericalPixelization other) {
        if (!pixelization.sameGeometry(other)) {
            throw new GeometryMismatchException("Mapping built for " + pixelization + ", applied to " + other);
        }
    }

    /**
     * @throws GeometryMismatchException unless this mapping was built for a grid of the same shape
     */
    public void checkGrid(WcsGeometry other) {
        if (!grid.sameShape(other)) {
            throw new GeometryMismatchException("Mapping built for a " + grid.getWidth() + "x" + grid.getHeight()
                                                + " grid, applied to " + other.getWidth() + "x"
                                                + other.getHeight());
        }
    }

    public int getCellCount() {
        return localIndex.length;
    }

    /**
     * Number of distinct spherical pixels sampled by valid cells.
     */
    public int getDistinctPixelCount() {
        return distinctPixels;
    }

    /**
     * Global spherical pixel index of a cell, or the sentinel when the cell lies outside the projection.
     */
    public long getGlobalIndex(int cell) {
        return globalIndex[cell];
    }

    public WcsGeometry getGrid() {
        return grid;
    }

    public int getLocalIndex(int cell) {
        return localIndex[cell];
    }

    public int[] getLocalIndices() {
        return localIndex.clone();
    }

    public SphericalPixelization getPixelization() {
        return pixelization;
    }

    public int getValidCellCount() {
        return validCells;
    }

    public double getWeight(int cell) {
        return weight[cell];
    }

    public double[] getWeights() {
        return weight.clone();
    }

    public boolean isValid(int cell) {
        return localIndex[cell] >= 0;
    }

    @Override
    public String toString() {
        return "PixelMapping[" + grid.getWidth() + "x" + grid.getHeight() + " -> " + pixelization + ", valid="
        + validCells + ", pixels=" + distinctPixels + "]";
    }

    /**
     * Sum of the weights of every valid cell, keyed by local index. Each value is one for a complete mapping.
     */
    public Map<Integer, Double> weightSums() {
        Map<Integer, Double> sums = new HashMap<>();
        for (int cell = 0; cell < localIndex.length; cell++) {
            if (localIndex[cell] >= 0) {
                sums.merge(localIndex[cell], weight[cell], Double::sum);
            }
        }
        return sums;
    }
}
