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
import com.hellblazer.skymap.healpix.EnergyBins.EnergyChannel;
import com.hellblazer.skymap.healpix.SphericalPixelization;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Column layout of a persisted spherical map: one {@code CHANNELn} column per plane, numbered from 1, and for region
 * maps a {@code PIX} column holding each row's global pixel index. The header cards describe the pixelization and an
 * optional channel table carries the energy bounds.
 * <p>
 * Reading and writing the records themselves is left to the caller's I/O layer.
 *
 * @author hal.hildebrand
 */
public final class SkyMapTable {

    public static final String CHANNEL_PREFIX  = "CHANNEL";
    public static final String EBOUNDS_EXTNAME = "EBOUNDS";
    public static final String EXTNAME         = "SKYMAP";
    public static final String PIXEL_COLUMN    = "PIX";

    private final HeaderCards           header;
    private final Map<String, double[]> channels;
    private final int[]                 pixels;
    private final List<EnergyChannel>   energyChannels;
    private final int                   rows;

    /**
     * @param header         pixelization header cards
     * @param channels       CHANNELn columns in order
     * @param pixels         PIX column, or null
     * @param energyChannels energy bounds rows, or an empty list
     * @throws GeometryMismatchException if the columns differ in length
     */
    public SkyMapTable(HeaderCards header, Map<String, double[]> channels, int[] pixels,
                       List<EnergyChannel> energyChannels) {
        if (channels.isEmpty()) {
            throw new ConfigurationException("Sky map table needs at least one channel column");
        }
        var first = channels.values().iterator().next().length;
        channels.forEach((name, column) -> {
            if (column.length != first) {
                throw new GeometryMismatchException("Column " + name + " has " + column.length + " rows, expected "
                                                    + first);
            }
        });
        if (pixels != null && pixels.length != first) {
            throw new GeometryMismatchException("Column " + PIXEL_COLUMN + " has " + pixels.length
                                                + " rows, expected " + first);
        }
        this.header = header;
        this.channels = new LinkedHashMap<>(channels);
        this.pixels = pixels;
        this.energyChannels = List.copyOf(energyChannels);
        this.rows = first;
    }

    public static String channelName(int plane) {
        return CHANNEL_PREFIX + (plane + 1);
    }

    /**
     * Lay out planes of data, each indexed by local pixel index.
     *
     * @throws GeometryMismatchException if a plane's length differs from the pixelization's pixel count
     */
    public static SkyMapTable of(SphericalPixelization pixelization, double[][] planes) {
        Map<String, double[]> columns = new LinkedHashMap<>();
        for (int p = 0; p < planes.length; p++) {
            if (planes[p].length != pixelization.getPixelCount()) {
                throw new GeometryMismatchException("Plane " + p + " has " + planes[p].length
                                                    + " pixels, pixelization has " + pixelization.getPixelCount());
            }
            columns.put(channelName(p), planes[p].clone());
        }
        var header = new HeaderCards().put("EXTNAME", EXTNAME).putAll(pixelization.toHeader());
        List<EnergyChannel> bounds = pixelization.getEnergyBins().map(b -> b.channels()).orElse(List.of());
        return new SkyMapTable(header, columns, pixelization.getRegionPixels().orElse(null), bounds);
    }

    /**
     * Number of consecutive CHANNELn columns starting at CHANNEL1.
     */
    public int channelCount() {
        var count = 0;
        while (channels.containsKey(channelName(count))) {
            count++;
        }
        return count;
    }

    /**
     * @throws ConfigurationException if no such column exists
     */
    public double[] column(String name) {
        var column = channels.get(name.toUpperCase(Locale.ROOT));
        if (column == null) {
            throw new ConfigurationException("No column " + name + " in " + columnNames());
        }
        return column.clone();
    }

    public List<String> columnNames() {
        var names = new ArrayList<String>();
        if (pixels != null) {
            names.add(PIXEL_COLUMN);
        }
        names.addAll(channels.keySet());
        return Collections.unmodifiableList(names);
    }

    public List<EnergyChannel> getEnergyChannels() {
        return energyChannels;
    }

    public HeaderCards getHeader() {
        return header;
    }

    public Optional<int[]> getPixelColumn() {
        return Optional.ofNullable(pixels).map(int[]::clone);
    }

    public int rowCount() {
        return rows;
    }

    @Override
    public String toString() {
        return "SkyMapTable" + columnNames() + "[" + rows + " rows]";
    }
}
