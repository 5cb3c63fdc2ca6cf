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

import com.hellblazer.skymap.common.ConfigurationException;
import com.hellblazer.skymap.common.GeometryMismatchException;
import com.hellblazer.skymap.common.HeaderCards;
import com.hellblazer.skymap.healpix.EnergyBins;
import com.hellblazer.skymap.healpix.SphericalPixelization;
import com.hellblazer.skymap.reproject.wcs.WcsGeometry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Objects;
import java.util.stream.IntStream;

/**
 * Spherical map data: one or more planes, each indexed by local pixel index of its {@link SphericalPixelization}.
 * Multi-plane maps usually hold one plane per energy bin.
 *
 * @author hal.hildebrand
 */
public final class RasterMap {

    private static final Logger log = LoggerFactory.getLogger(RasterMap.class);

    private final SphericalPixelization pixelization;
    private final double[][]            planes;

    /**
     * @throws GeometryMismatchException if a plane's length differs from the pixel count, or the plane count differs
     *                                   from the number of energy bins of a multi-plane map
     */
    public RasterMap(SphericalPixelization pixelization, double[][] planes) {
        this.pixelization = Objects.requireNonNull(pixelization, "pixelization");
        if (planes.length == 0) {
            throw new GeometryMismatchException("Map needs at least one plane");
        }
        for (int p = 0; p < planes.length; p++) {
            if (planes[p].length != pixelization.getPixelCount()) {
                throw new GeometryMismatchException("Plane " + p + " has " + planes[p].length
                                                    + " pixels, pixelization has " + pixelization.getPixelCount());
            }
        }
        var bins = pixelization.getEnergyBins();
        if (planes.length > 1 && bins.isPresent() && bins.get().size() != planes.length) {
            throw new GeometryMismatchException(planes.length + " planes for " + bins.get().size()
                                                + " energy bins");
        }
        this.planes = planes;
    }

    /**
     * Reload a map from its table, using the table's own header and energy bounds.
     */
    public static RasterMap fromTable(SkyMapTable table) {
        var bounds = table.getEnergyChannels();
        return fromTable(table, table.getHeader(), bounds.isEmpty() ? null : EnergyBins.fromChannels(bounds));
    }

    /**
     * Reload a map from table columns. The number of planes is the number of CHANNELn columns; a PIX column, when
     * present, must list the pixelization's pixels in local index order.
     *
     * @throws ConfigurationException    for an invalid header or a table without channel columns
     * @throws GeometryMismatchException if the rows do not match the pixelization
     */
    public static RasterMap fromTable(SkyMapTable table, HeaderCards cards, EnergyBins energyBins) {
        var pixelization = SphericalPixelization.fromHeader(cards, energyBins);
        var count = table.channelCount();
        if (count == 0) {
            throw new ConfigurationException("No " + SkyMapTable.CHANNEL_PREFIX + " columns in " + table);
        }
        if (table.rowCount() != pixelization.getPixelCount()) {
            throw new GeometryMismatchException("Table has " + table.rowCount() + " rows, pixelization has "
                                                + pixelization.getPixelCount());
        }
        table.getPixelColumn().ifPresent(pix -> {
            var expected = pixelization.getRegionPixels()
                                       .orElseGet(() -> IntStream.range(0, pixelization.getPixelCount()).toArray());
            if (!Arrays.equals(pix, expected)) {
                throw new GeometryMismatchException("Column " + SkyMapTable.PIXEL_COLUMN
                                                    + " does not match the pixels of " + pixelization);
            }
        });
        var planes = new double[count][];
        for (int p = 0; p < count; p++) {
            planes[p] = table.column(SkyMapTable.channelName(p));
        }
        return new RasterMap(pixelization, planes);
    }

    public static RasterMap of(SphericalPixelization pixelization, double[] data) {
        return new RasterMap(pixelization, new double[][] { data });
    }

    public SphericalPixelization getPixelization() {
        return pixelization;
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
     * Build the grid and the mapping for this map's pixelization and resample with them.
     */
    public Reprojection reproject(ReprojectionConfig config) {
        var grid = GridGeometryBuilder.build(pixelization, config);
        var mapping = PixelMapping.build(pixelization, grid, config);
        return new Reprojection(grid, mapping, toGrid(mapping, config));
    }

    public Reprojection reproject() {
        return reproject(ReprojectionConfig.defaults());
    }

    /**
     * Per pixel sum over all planes.
     */
    public double[] sumPlanes() {
        if (planes.length == 1) {
            return planes[0].clone();
        }
        var sum = new double[pixelization.getPixelCount()];
        for (var plane : planes) {
            for (int i = 0; i < sum.length; i++) {
                sum[i] += plane[i];
            }
        }
        return sum;
    }

    public SkyMapTable toTable() {
        return SkyMapTable.of(pixelization, planes);
    }

    /**
     * Resample onto the mapping's grid, sequentially.
     *
     * @see #toGrid(PixelMapping, ReprojectionConfig)
     */
    public GridRaster toGrid(PixelMapping mapping, boolean sumPlanes, boolean normalize) {
        return toGrid(mapping, ReprojectionConfig.defaults().withSumPlanes(sumPlanes).withNormalize(normalize));
    }

    /**
     * Resample onto the mapping's grid. A single plane, or planes summed first, yield one raster; otherwise every plane
     * is resampled against the same mapping into a stacked raster whose geometry carries the energy axis.
     *
     * @throws GeometryMismatchException if the mapping was built for a different pixelization
     */
    public GridRaster toGrid(PixelMapping mapping, ReprojectionConfig config) {
        mapping.checkPixelization(pixelization);
        var grid = mapping.getGrid();
        var cells = grid.cellCount();
        if (planes.length == 1 || config.isSumPlanes()) {
            var out = new double[cells];
            mapping.apply(sumPlanes(), out, config.isNormalize());
            return new GridRaster(grid.withEnergyAxis(null), new double[][] { out });
        }

        var start = System.nanoTime();
        var out = new double[planes.length][cells];
        var stream = IntStream.range(0, planes.length);
        if (config.useParallel(cells)) {
            stream = stream.parallel();
        }
        stream.forEach(p -> mapping.apply(planes[p], out[p], config.isNormalize()));
        var geometry = pixelization.getEnergyBins()
                                   .map(bins -> grid.withEnergyAxis(GridGeometryBuilder.energyAxis(bins)))
                                   .orElse(grid);
        log.debug("Resampled {} planes onto {} in {} ms", planes.length, grid,
                  (System.nanoTime() - start) / 1_000_000);
        return new GridRaster(geometry, out);
    }

    /**
     * Resample onto an explicitly named grid.
     *
     * @throws GeometryMismatchException if the mapping was built for a grid of a different shape
     */
    public GridRaster toGrid(WcsGeometry grid, PixelMapping mapping, ReprojectionConfig config) {
        mapping.checkGrid(grid);
        return toGrid(mapping, config);
    }

    @Override
    public String toString() {
        return "RasterMap[" + planes.length + " x " + pixelization + "]";
    }
}
