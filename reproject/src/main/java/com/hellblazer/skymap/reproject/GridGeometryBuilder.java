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
import com.hellblazer.skymap.healpix.EnergyBins;
import com.hellblazer.skymap.healpix.SphericalPixelization;
import com.hellblazer.skymap.reproject.wcs.Projection;
import com.hellblazer.skymap.reproject.wcs.WcsGeometry;
import com.hellblazer.skymap.reproject.wcs.WcsGeometry.EnergyAxis;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Derives a square planar grid that covers a spherical pixelization's region.
 * <p>
 * The grid cell size is the spherical pixel size divided by the oversampling factor, the grid spans twice the
 * region's angular size (at most 180 degrees) and the reference point sits at the grid's geometric center. The
 * longitude axis runs with negative scale, the latitude axis with positive scale.
 *
 * @author hal.hildebrand
 */
public final class GridGeometryBuilder {

    /** Largest coverage radius of a generated grid, in degrees */
    public static final double MAX_COVERAGE_RADIUS = 90.0;

    private static final Logger log = LoggerFactory.getLogger(GridGeometryBuilder.class);

    private GridGeometryBuilder() {
    }

    /**
     * Grid in the pixelization's own frame.
     *
     * @param pixelization   source spherical pixelization
     * @param projectionCode CAR, AIT, TAN or ZEA
     * @param oversample     grid cells per spherical pixel edge
     * @param energyBins     energy binning for a third axis, or null for a 2D grid
     * @throws ConfigurationException for an unsupported projection or a non-positive oversample
     */
    public static WcsGeometry build(SphericalPixelization pixelization, String projectionCode, int oversample,
                                    EnergyBins energyBins) {
        return build(pixelization, Projection.fromCode(projectionCode), oversample, pixelization.getFrame(),
                     energyBins);
    }

    /**
     * Grid for the given configuration, with an energy axis when the pixelization carries energy bins.
     */
    public static WcsGeometry build(SphericalPixelization pixelization, ReprojectionConfig config) {
        return build(pixelization, config.getProjection(), config.getOversample(),
                     config.getTargetFrame().orElse(pixelization.getFrame()),
                     pixelization.getEnergyBins().orElse(null));
    }

    /**
     * Grid in an arbitrary frame. The reference direction of the region is rotated into that frame.
     */
    public static WcsGeometry build(SphericalPixelization pixelization, Projection projection, int oversample,
                                    CoordinateFrame frame, EnergyBins energyBins) {
        if (oversample <= 0) {
            throw new ConfigurationException("Oversample must be positive: " + oversample);
        }
        if (frame == null) {
            throw new ConfigurationException("Grid frame must be CELESTIAL or GALACTIC");
        }
        var pixelSize = pixelization.pixelAngularSize();
        var scale = pixelSize / oversample;
        var coverage = Math.min(pixelization.regionAngularSize(), MAX_COVERAGE_RADIUS);
        var side = Math.max(1, (int) Math.floor(2.0 * coverage / pixelSize)) * oversample;
        var reference = pixelization.referenceDirection().transformTo(frame).direction();

        var builder = WcsGeometry.builder()
                                 .withFrame(frame)
                                 .withProjection(projection)
                                 .withReference(reference)
                                 .withScale(-scale, scale)
                                 .withSize(side, side);
        if (energyBins != null) {
            builder.withEnergyAxis(energyAxis(energyBins));
        }
        var grid = builder.build();
        log.debug("Grid for {}: {}", pixelization, grid);
        return grid;
    }

    /**
     * Linear energy axis sampled at the first bin: reference value is the first linear edge, step is the width of
     * the first bin.
     */
    public static EnergyAxis energyAxis(EnergyBins bins) {
        var e0 = bins.linearEdge(0);
        var e1 = bins.linearEdge(1);
        return new EnergyAxis(e0, e1 - e0, 1.0, bins.size());
    }
}
