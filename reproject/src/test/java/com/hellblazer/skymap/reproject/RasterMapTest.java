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
import com.hellblazer.skymap.geometry.CoordinateFrame;
import com.hellblazer.skymap.healpix.EnergyBins;
import com.hellblazer.skymap.healpix.SphericalPixelization;
import com.hellblazer.skymap.reproject.wcs.WcsGeometry;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class RasterMapTest {

    private static final EnergyBins BINS = EnergyBins.logSpaced(2.0, 3.5, 3);

    private static double[][] planes(int count, int size, long seed) {
        var random = new Random(seed);
        var planes = new double[count][size];
        for (var plane : planes) {
            for (int i = 0; i < size; i++) {
                plane[i] = random.nextDouble() * 50.0;
            }
        }
        return planes;
    }

    private static SphericalPixelization region(EnergyBins bins) {
        return SphericalPixelization.create(-1, 4, true, CoordinateFrame.CELESTIAL, "DISK(83.6,22.0,8)", bins);
    }

    @Test
    void testSinglePlaneConservesFlux() {
        var hpx = region(null);
        var map = RasterMap.of(hpx, planes(1, hpx.getPixelCount(), 1)[0]);
        var grid = GridGeometryBuilder.build(hpx, "CAR", 2, null);
        var mapping = PixelMapping.build(hpx, grid);
        var raster = map.toGrid(mapping, false, true);

        assertEquals(1, raster.planeCount());
        assertFalse(raster.isStacked());
        assertEquals(grid.getWidth(), raster.getWidth());
        assertTrue(raster.getGeometry().getEnergyAxis().isEmpty());

        var touched = new HashSet<Integer>();
        for (int cell = 0; cell < mapping.getCellCount(); cell++) {
            if (mapping.isValid(cell)) {
                touched.add(mapping.getLocalIndex(cell));
            }
        }
        var data = map.plane(0);
        var expected = touched.stream().mapToDouble(local -> data[local]).sum();
        assertEquals(expected, raster.sum(0), 1e-9 * expected);
    }

    @Test
    void testStackedPlanes() {
        var hpx = region(BINS);
        var map = new RasterMap(hpx, planes(3, hpx.getPixelCount(), 2));
        var grid = GridGeometryBuilder.build(hpx, "TAN", 2, null);
        var mapping = PixelMapping.build(hpx, grid);
        var raster = map.toGrid(mapping, false, true);

        assertEquals(3, raster.planeCount());
        assertTrue(raster.isStacked());
        var axis = raster.getGeometry().getEnergyAxis().orElseThrow();
        assertEquals(3, axis.size());
        assertEquals(100.0, axis.crval(), 1e-9);
        for (int p = 0; p < 3; p++) {
            var expected = new double[grid.cellCount()];
            mapping.apply(map.plane(p), expected, true);
            assertArrayEquals(expected, raster.plane(p));
        }

        var parallel = map.toGrid(mapping, ReprojectionConfig.highThroughput().withParallelThreshold(1));
        for (int p = 0; p < 3; p++) {
            assertArrayEquals(raster.plane(p), parallel.plane(p));
        }
    }

    @Test
    void testSummedPlanes() {
        var hpx = region(BINS);
        var map = new RasterMap(hpx, planes(3, hpx.getPixelCount(), 3));
        var mapping = PixelMapping.build(hpx, GridGeometryBuilder.build(hpx, "ZEA", 1, BINS));
        var raster = map.toGrid(mapping, true, false);

        assertEquals(1, raster.planeCount());
        assertTrue(raster.getGeometry().getEnergyAxis().isEmpty());
        var summed = map.sumPlanes();
        for (int cell = 0; cell < mapping.getCellCount(); cell++) {
            if (mapping.isValid(cell)) {
                assertEquals(summed[mapping.getLocalIndex(cell)], raster.plane(0)[cell]);
            } else {
                assertEquals(0.0, raster.plane(0)[cell]);
            }
        }
        var total = Arrays.stream(map.plane(0)).sum() + Arrays.stream(map.plane(1)).sum() + Arrays.stream(
        map.plane(2)).sum();
        assertEquals(total, Arrays.stream(summed).sum(), 1e-9 * total);
    }

    @Test
    void testIntensityPreservingConstantMap() {
        var hpx = region(null);
        var ones = new double[hpx.getPixelCount()];
        Arrays.fill(ones, 1.0);
        var result = RasterMap.of(hpx, ones).reproject(ReprojectionConfig.intensityPreserving());
        var plane = result.raster().plane(0);
        for (int cell = 0; cell < plane.length; cell++) {
            assertEquals(result.mapping().isValid(cell) ? 1.0 : 0.0, plane[cell]);
        }
    }

    @Test
    void testReprojectReusesMapping() {
        var hpx = region(BINS);
        var map = new RasterMap(hpx, planes(3, hpx.getPixelCount(), 4));
        var result = map.reproject(ReprojectionConfig.defaults().withProjection("AIT"));

        assertEquals(3, result.geometry().getEnergyAxis().orElseThrow().size());
        assertSame(result.geometry(), result.mapping().getGrid());
        assertEquals(3, result.raster().planeCount());

        var other = new RasterMap(hpx, planes(3, hpx.getPixelCount(), 5));
        var again = other.toGrid(result.geometry(), result.mapping(), ReprojectionConfig.defaults());
        assertEquals(3, again.planeCount());
        assertEquals(result.raster().getWidth(), again.getWidth());
    }

    @Test
    void testMismatches() {
        var hpx = region(BINS);
        var map = new RasterMap(hpx, planes(3, hpx.getPixelCount(), 6));
        var otherRegion = SphericalPixelization.create(-1, 4, true, CoordinateFrame.CELESTIAL, "DISK(83.6,22.0,9)",
                                                       null);
        var foreign = PixelMapping.build(otherRegion, GridGeometryBuilder.build(otherRegion, "CAR", 1, null));
        assertThrows(GeometryMismatchException.class, () -> map.toGrid(foreign, false, true));

        var mapping = PixelMapping.build(hpx, GridGeometryBuilder.build(hpx, "CAR", 1, null));
        var smaller = WcsGeometry.builder().withSize(3, 3).build();
        assertThrows(GeometryMismatchException.class,
                     () -> map.toGrid(smaller, mapping, ReprojectionConfig.defaults()));

        assertThrows(GeometryMismatchException.class,
                     () -> new RasterMap(hpx, planes(2, hpx.getPixelCount(), 7)));
        assertThrows(GeometryMismatchException.class,
                     () -> new RasterMap(hpx, planes(3, hpx.getPixelCount() - 1, 7)));
        assertThrows(GeometryMismatchException.class, () -> new RasterMap(hpx, new double[0][]));
    }
}
