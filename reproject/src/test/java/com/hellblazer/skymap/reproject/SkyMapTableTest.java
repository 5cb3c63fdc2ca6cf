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
import com.hellblazer.skymap.geometry.CoordinateFrame;
import com.hellblazer.skymap.healpix.EnergyBins;
import com.hellblazer.skymap.healpix.SphericalPixelization;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class SkyMapTableTest {

    private static double[][] ramp(int planes, int size) {
        var data = new double[planes][size];
        for (int p = 0; p < planes; p++) {
            for (int i = 0; i < size; i++) {
                data[p][i] = p * 1000.0 + i;
            }
        }
        return data;
    }

    @Test
    void testRegionLayout() {
        var bins = EnergyBins.logSpaced(3.0, 4.0, 2);
        var hpx = SphericalPixelization.create(-1, 5, false, CoordinateFrame.GALACTIC, "DISK(0,0,4)", bins);
        var table = new RasterMap(hpx, ramp(2, hpx.getPixelCount())).toTable();

        assertEquals(List.of("PIX", "CHANNEL1", "CHANNEL2"), table.columnNames());
        assertEquals(2, table.channelCount());
        assertEquals(hpx.getPixelCount(), table.rowCount());
        assertArrayEquals(hpx.getRegionPixels().orElseThrow(), table.getPixelColumn().orElseThrow());
        assertEquals("SKYMAP", table.getHeader().getString("EXTNAME"));
        assertEquals("DISK(0,0,4)", table.getHeader().getString("HPX_REG"));
        assertEquals(2, table.getEnergyChannels().size());
        assertEquals(1000.0 * 1000.0, table.getEnergyChannels().get(0).eMinKeV(), 1e-6);
        assertEquals(1001.0, table.column("channel2")[1]);
        assertThrows(ConfigurationException.class, () -> table.column("CHANNEL3"));
    }

    @Test
    void testColumnLookupIgnoresDefaultLocale() {
        var hpx = SphericalPixelization.create(-1, 1, false, CoordinateFrame.CELESTIAL, null, null);
        var table = RasterMap.of(hpx, ramp(1, hpx.getPixelCount())[0]).toTable();
        var saved = Locale.getDefault();
        try {
            Locale.setDefault(Locale.forLanguageTag("tr-TR"));
            assertEquals(47.0, table.column("channel1")[47]);
        } finally {
            Locale.setDefault(saved);
        }
    }

    @Test
    void testRoundTrip() {
        var bins = EnergyBins.logSpaced(2.0, 3.0, 3);
        var hpx = SphericalPixelization.create(-1, 4, true, CoordinateFrame.CELESTIAL, "DISK_INC(45,60,6,4)", bins);
        var map = new RasterMap(hpx, ramp(3, hpx.getPixelCount()));

        var reloaded = RasterMap.fromTable(map.toTable());
        assertTrue(hpx.sameGeometry(reloaded.getPixelization()));
        assertEquals(3, reloaded.planeCount());
        for (int p = 0; p < 3; p++) {
            assertArrayEquals(map.plane(p), reloaded.plane(p));
        }
        var reloadedBins = reloaded.getPixelization().getEnergyBins().orElseThrow();
        assertEquals(3, reloadedBins.size());
        assertArrayEquals(bins.logEdges(), reloadedBins.logEdges(), 1e-12);
    }

    @Test
    void testFullSkyHasNoPixelColumn() {
        var hpx = SphericalPixelization.create(-1, 1, false, CoordinateFrame.CELESTIAL, null, null);
        var table = RasterMap.of(hpx, ramp(1, hpx.getPixelCount())[0]).toTable();
        assertEquals(List.of("CHANNEL1"), table.columnNames());
        assertTrue(table.getPixelColumn().isEmpty());
        assertTrue(table.getEnergyChannels().isEmpty());

        var reloaded = RasterMap.fromTable(table, table.getHeader(), null);
        assertEquals(hpx, reloaded.getPixelization());
        assertArrayEquals(ramp(1, 48)[0], reloaded.plane(0));
    }

    @Test
    void testMismatchedTables() {
        var hpx = SphericalPixelization.create(-1, 4, false, CoordinateFrame.CELESTIAL, "DISK(10,10,5)", null);
        var header = new HeaderCards().putAll(hpx.toHeader());
        var rows = hpx.getPixelCount();

        Map<String, double[]> columns = new LinkedHashMap<>();
        columns.put("CHANNEL1", new double[rows]);
        var wrongPixels = hpx.getRegionPixels().orElseThrow();
        wrongPixels[0] = wrongPixels[0] + 1 == wrongPixels[1] ? wrongPixels[0] - 1 : wrongPixels[0] + 1;
        var tampered = new SkyMapTable(header, columns, wrongPixels, List.of());
        assertThrows(GeometryMismatchException.class, () -> RasterMap.fromTable(tampered));

        Map<String, double[]> shortColumns = new LinkedHashMap<>();
        shortColumns.put("CHANNEL1", new double[rows - 1]);
        assertThrows(GeometryMismatchException.class,
                     () -> RasterMap.fromTable(new SkyMapTable(header, shortColumns, null, List.of())));

        Map<String, double[]> ragged = new LinkedHashMap<>();
        ragged.put("CHANNEL1", new double[rows]);
        ragged.put("CHANNEL2", new double[rows + 1]);
        assertThrows(GeometryMismatchException.class, () -> new SkyMapTable(header, ragged, null, List.of()));

        Map<String, double[]> misnamed = new LinkedHashMap<>();
        misnamed.put("FLUX", new double[rows]);
        assertThrows(ConfigurationException.class,
                     () -> RasterMap.fromTable(new SkyMapTable(header, misnamed, null, List.of())));

        assertThrows(GeometryMismatchException.class, () -> SkyMapTable.of(hpx, new double[][] { new double[3] }));
    }
}
