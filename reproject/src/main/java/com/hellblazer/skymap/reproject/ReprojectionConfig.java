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
import com.hellblazer.skymap.geometry.CoordinateFrame;
import com.hellblazer.skymap.reproject.wcs.Projection;

import java.util.Optional;

/**
 * Configuration for converting a spherical map onto a planar grid. Controls the target projection, the grid
 * resolution relative to the spherical pixels, the resampling mode and whether the per-cell passes run in parallel.
 *
 * @author hal.hildebrand
 */
public class ReprojectionConfig {

    private Projection      projection        = Projection.CAR;
    private int             oversample        = 2;
    private boolean         normalize         = true;
    private boolean         sumPlanes         = false;
    private boolean         parallel          = false;
    private int             parallelThreshold = 65_536;
    private CoordinateFrame targetFrame;

    /**
     * CAR projection, oversample 2, flux preserving, sequential.
     */
    public static ReprojectionConfig defaults() {
        return new ReprojectionConfig();
    }

    /**
     * Parallel classification and resampling for large grids.
     */
    public static ReprojectionConfig highThroughput() {
        return new ReprojectionConfig().withParallelProcessing(true).withParallelThreshold(16_384);
    }

    /**
     * Every covering cell receives the full value of its spherical pixel.
     */
    public static ReprojectionConfig intensityPreserving() {
        return new ReprojectionConfig().withNormalize(false);
    }

    /**
     * Number of grid cells per spherical pixel edge.
     */
    public int getOversample() {
        return oversample;
    }

    /**
     * Minimum number of grid cells required to run the per-cell passes in parallel.
     */
    public int getParallelThreshold() {
        return parallelThreshold;
    }

    public Projection getProjection() {
        return projection;
    }

    /**
     * Frame of the planar grid, when it differs from the pixelization's own frame.
     */
    public Optional<CoordinateFrame> getTargetFrame() {
        return Optional.ofNullable(targetFrame);
    }

    /**
     * Whether each cell's value is scaled by its weight so the cells covering a spherical pixel sum to its value.
     */
    public boolean isNormalize() {
        return normalize;
    }

    public boolean isParallel() {
        return parallel;
    }

    /**
     * Whether multi-plane maps are summed over planes before resampling.
     */
    public boolean isSumPlanes() {
        return sumPlanes;
    }

    /**
     * True when a grid of the given cell count should be processed in parallel.
     */
    public boolean useParallel(int cells) {
        return parallel && cells >= parallelThreshold;
    }

    public ReprojectionConfig withNormalize(boolean normalize) {
        this.normalize = normalize;
        return this;
    }

    public ReprojectionConfig withOversample(int oversample) {
        if (oversample <= 0) {
            throw new ConfigurationException("Oversample must be positive: " + oversample);
        }
        this.oversample = oversample;
        return this;
    }

    public ReprojectionConfig withParallelProcessing(boolean parallel) {
        this.parallel = parallel;
        return this;
    }

    public ReprojectionConfig withParallelThreshold(int threshold) {
        if (threshold <= 0) {
            throw new ConfigurationException("Parallel threshold must be positive: " + threshold);
        }
        this.parallelThreshold = threshold;
        return this;
    }

    public ReprojectionConfig withProjection(Projection projection) {
        if (projection == null) {
            throw new ConfigurationException("Projection cannot be null");
        }
        this.projection = projection;
        return this;
    }

    /**
     * @throws ConfigurationException for an unsupported projection code
     */
    public ReprojectionConfig withProjection(String code) {
        return withProjection(Projection.fromCode(code));
    }

    public ReprojectionConfig withSumPlanes(boolean sumPlanes) {
        this.sumPlanes = sumPlanes;
        return this;
    }

    /**
     * Build the grid in the given frame; null keeps the pixelization's frame.
     */
    public ReprojectionConfig withTargetFrame(CoordinateFrame frame) {
        this.targetFrame = frame;
        return this;
    }

    @Override
    public String toString() {
        return "ReprojectionConfig[" + projection + ", oversample=" + oversample + ", normalize=" + normalize
        + ", sumPlanes=" + sumPlanes + ", parallel=" + parallel + "/" + parallelThreshold
        + (targetFrame == null ? "" : ", frame=" + targetFrame.code()) + "]";
    }
}
