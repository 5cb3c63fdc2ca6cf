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
import com.hellblazer.skymap.geometry.SkyDirection;
import com.hellblazer.skymap.healpix.EnergyBins;
import com.hellblazer.skymap.healpix.SphericalPixelization;
import com.hellblazer.skymap.reproject.wcs.Projection;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class GridGeometryBuilderTest {

    @Test
    void testDiskGridSide() {
        var hpx = SphericalPixelization.create(-1, 6, false, CoordinateFrame.CELESTIAL, "DISK(0,0,5)", null);
        var grid = GridGeometryBuilder.build(hpx, "CAR", 2, null);
        // pixel size 0.5 at order 6: floor(2 * 5 / 0.5) * 2
        assertEquals(40, grid.getWidth());
        assertEquals(40, grid.getHeight());
        assertEquals(-0.25, grid.getCdelt1());
        assertEquals(0.25, grid.getCdelt2());
        assertEquals(20.5, grid.getCrpix1());
        assertEquals(20.5, grid.getCrpix2());
        assertEquals(new SkyDirection(0.0, 0.0), grid.getReference());
        assertEquals("RA---CAR", grid.toHeader().getString("CTYPE1"));
        assertEquals("DEC--CAR", grid.toHeader().getString("CTYPE2"));
        assertTrue(grid.getEnergyAxis().isEmpty());
    }

    @Test
    void testFullSkyCoverageIsCapped() {
        var hpx = SphericalPixelization.create(-1, 2, true, CoordinateFrame.GALACTIC, null, null);
        var grid = GridGeometryBuilder.build(hpx, "AIT", 1, null);
        // coverage radius capped at 90 degrees with 8 degree pixels
        assertEquals(22, grid.getWidth());
        assertEquals(Projection.AIT, grid.getProjection());
        assertEquals(CoordinateFrame.GALACTIC, grid.getFrame());
        assertEquals("GLON-AIT", grid.toHeader().getString("CTYPE1"));
    }

    @Test
    void testTinyRegionKeepsOnePixel() {
        var hpx = SphericalPixelization.create(-1, 2, false, CoordinateFrame.CELESTIAL, "DISK(10,10,1)", null);
        assertEquals(3, GridGeometryBuilder.build(hpx, "TAN", 3, null).getWidth());
    }

    @Test
    void testEnergyAxis() {
        var bins = EnergyBins.logSpaced(2.0, 3.0, 4);
        var hpx = SphericalPixelization.create(-1, 5, false, CoordinateFrame.CELESTIAL, "DISK(40,-20,3)", bins);
        var grid = GridGeometryBuilder.build(hpx, "ZEA", 2, bins);
        var axis = grid.getEnergyAxis().orElseThrow();
        assertEquals(100.0, axis.crval(), 1e-9);
        assertEquals(Math.pow(10.0, 2.25) - 100.0, axis.cdelt(), 1e-9);
        assertEquals(1.0, axis.crpix());
        assertEquals(4, axis.size());
        assertEquals(3, grid.toHeader().getInt("NAXIS"));

        var fromConfig = GridGeometryBuilder.build(hpx, ReprojectionConfig.defaults().withProjection("ZEA"));
        assertEquals(grid, fromConfig);
    }

    @Test
    void testParentPixelRegion() {
        var hpx = SphericalPixelization.create(-1, 4, true, CoordinateFrame.CELESTIAL, "HPX_PIXEL(NESTED,2,5)",
                                               null);
        var grid = GridGeometryBuilder.build(hpx, "CAR", 1, null);
        var parentCenter = hpx.referenceDirection().direction();
        assertEquals(0.0, grid.getReference().angularDistance(parentCenter), 1e-9);
        // twice the 16 degree parent pixel size, spanned by 2 degree pixels
        assertEquals(32, grid.getWidth());
    }

    @Test
    void testTargetFrame() {
        var hpx = SphericalPixelization.create(-1, 6, false, CoordinateFrame.CELESTIAL,
                                               "DISK(266.40499,-28.93617,5)", null);
        var grid = GridGeometryBuilder.build(hpx, ReprojectionConfig.defaults()
                                                                    .withTargetFrame(CoordinateFrame.GALACTIC));
        assertEquals(CoordinateFrame.GALACTIC, grid.getFrame());
        assertTrue(grid.getReference().angularDistance(new SkyDirection(0.0, 0.0)) < 0.1, grid.toString());
    }

    @Test
    void testValidation() {
        var hpx = SphericalPixelization.create(-1, 3, false, CoordinateFrame.CELESTIAL, null, null);
        assertThrows(ConfigurationException.class, () -> GridGeometryBuilder.build(hpx, "MOL", 2, null));
        assertThrows(ConfigurationException.class, () -> GridGeometryBuilder.build(hpx, "CAR", 0, null));
        assertThrows(ConfigurationException.class,
                     () -> GridGeometryBuilder.build(hpx, Projection.CAR, 2, null, null));
    }
}
