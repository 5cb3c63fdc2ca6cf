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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Energy binning of a multi-plane map. Edges are held as log10(E / MeV) and must be strictly increasing.
 *
 * @author hal.hildebrand
 */
public final class EnergyBins {

    private final double[] logEdges;

    private EnergyBins(double[] logEdges) {
        if (logEdges.length < 2) {
            throw new OutOfRangeException("Energy binning needs at least two edges: " + Arrays.toString(logEdges));
        }
        for (int i = 1; i < logEdges.length; i++) {
            if (!(logEdges[i] > logEdges[i - 1])) {
                throw new OutOfRangeException("Energy bin " + (i - 1) + " has max <= min: " + logEdges[i - 1] + ", "
                                              + logEdges[i]);
            }
        }
        this.logEdges = logEdges;
    }

    /**
     * Rebuild a binning from an EBOUNDS style channel table with edges in keV.
     */
    public static EnergyBins fromChannels(List<EnergyChannel> channels) {
        if (channels.isEmpty()) {
            throw new OutOfRangeException("Energy channel table is empty");
        }
        var edges = new double[channels.size() + 1];
        for (int i = 0; i < channels.size(); i++) {
            edges[i] = Math.log10(channels.get(i).eMinKeV() / 1000.0);
        }
        edges[channels.size()] = Math.log10(channels.get(channels.size() - 1).eMaxKeV() / 1000.0);
        return new EnergyBins(edges);
    }

    /**
     * @param logEdges bin edges as log10(E / MeV)
     */
    public static EnergyBins ofLogEdges(double... logEdges) {
        return new EnergyBins(logEdges.clone());
    }

    /**
     * Evenly spaced bins in log energy.
     */
    public static EnergyBins logSpaced(double logMin, double logMax, int bins) {
        if (bins <= 0) {
            throw new OutOfRangeException("Number of energy bins must be positive: " + bins);
        }
        var edges = new double[bins + 1];
        for (int i = 0; i <= bins; i++) {
            edges[i] = logMin + (logMax - logMin) * i / bins;
        }
        return new EnergyBins(edges);
    }

    /**
     * EBOUNDS table rows: channels numbered from 1, edges in keV.
     */
    public List<EnergyChannel> channels() {
        var channels = new ArrayList<EnergyChannel>(size());
        for (int i = 0; i < size(); i++) {
            channels.add(new EnergyChannel(i + 1, 1000.0 * linearEdge(i), 1000.0 * linearEdge(i + 1)));
        }
        return Collections.unmodifiableList(channels);
    }

    /**
     * Geometric mean of a bin's linear edges, in MeV.
     */
    public double center(int bin) {
        return Math.sqrt(linearEdge(bin) * linearEdge(bin + 1));
    }

    public double[] centers() {
        var centers = new double[size()];
        for (int i = 0; i < centers.length; i++) {
            centers[i] = center(i);
        }
        return centers;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof EnergyBins other && Arrays.equals(logEdges, other.logEdges);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(logEdges);
    }

    /**
     * Linear energy of an edge, in MeV.
     */
    public double linearEdge(int edge) {
        return Math.pow(10.0, logEdges[edge]);
    }

    public double[] logEdges() {
        return logEdges.clone();
    }

    /**
     * @return number of bins, one less than the number of edges
     */
    public int size() {
        return logEdges.length - 1;
    }

    @Override
    public String toString() {
        return "EnergyBins" + Arrays.toString(logEdges);
    }

    /**
     * One row of an energy bounds table.
     */
    public record EnergyChannel(int channel, double eMinKeV, double eMaxKeV) {
        public EnergyChannel {
            if (!(eMaxKeV > eMinKeV)) {
                throw new OutOfRangeException("Energy channel " + channel + " has max <= min: " + eMinKeV + ", "
                                              + eMaxKeV);
            }
        }
    }
}
