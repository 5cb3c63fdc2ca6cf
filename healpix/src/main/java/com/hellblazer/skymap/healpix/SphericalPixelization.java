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

import com.hellblazer.skymap.common.ConfigurationException;
import com.hellblazer.skymap.common.HeaderCards;
import com.hellblazer.skymap.geometry.CoordinateFrame;
import com.hellblazer.skymap.geometry.SkyPosition;
import com.hellblazer.skymap.healpix.region.RegionDescriptor;
import com.hellblazer.skymap.healpix.region.RegionSelector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable description of a HEALPix map geometry: resolution, numbering scheme, coordinate frame, an optional region
 * restricting the map to part of the sky, and optional energy binning.
 * <p>
 * A region-restricted pixelization addresses its pixels by <em>local</em> index, the position of the pixel in the
 * ascending list of the region's global indices. Deriving the region twice from the same inputs yields the same
 * local indices, so mappings built against one instance stay valid for an equal instance.
 *
 * @author hal.hildebrand
 */
public final class SphericalPixelization {

    /** Local index of a global pixel outside the region */
    public static final int SENTINEL = -1;

    private static final Logger log = LoggerFactory.getLogger(SphericalPixelization.class);

    private final HealpixBase           base;
    private final int                   order;
    private final CoordinateFrame       frame;
    private final String                region;
    private final RegionDescriptor      descriptor;
    private final EnergyBins            energyBins;
    private final int[]                 regionPixels;
    private final Map<Integer, Integer> localIndex;

    private SphericalPixelization(long nside, int order, Scheme scheme, CoordinateFrame frame, String region,
                                  EnergyBins energyBins) {
        if (nside >= 0 && order >= 0) {
            throw new ConfigurationException("Specify either nside or order, not both: nside=" + nside + ", order="
                                             + order);
        }
        if (nside < 0 && order < 0) {
            throw new ConfigurationException("Specify either nside or order");
        }
        if (order >= 0 && order > PixelSizeTable.MAX_ORDER) {
            throw new ConfigurationException("HEALPix order must be in [0, " + PixelSizeTable.MAX_ORDER + "]: "
                                             + order);
        }
        var resolvedNside = order >= 0 ? 1L << order : nside;
        if (HealpixBase.orderOf(resolvedNside) > PixelSizeTable.MAX_ORDER) {
            throw new ConfigurationException("HEALPix nside above 2^" + PixelSizeTable.MAX_ORDER + ": " + nside);
        }
        this.base = HealpixBase.forNside(resolvedNside, Objects.requireNonNull(scheme, "scheme"));
        this.order = order;
        this.frame = Objects.requireNonNull(frame, "frame");
        this.region = region == null || region.isBlank() ? null : region.trim();
        this.energyBins = energyBins;

        if (this.region != null) {
            descriptor = RegionDescriptor.parse(this.region);
            regionPixels = RegionSelector.indices(base, descriptor);
            localIndex = new HashMap<>(Math.max(16, (int) (regionPixels.length / 0.75f) + 1));
            for (int i = 0; i < regionPixels.length; i++) {
                localIndex.put(regionPixels[i], i);
            }
            log.debug("Region {} at nside {} holds {} of {} pixels", this.region, resolvedNside,
                      regionPixels.length, base.getNpix());
        } else {
            descriptor = null;
            regionPixels = null;
            localIndex = null;
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Construct from explicit parameters. Exactly one of nside and order must be non-negative.
     *
     * @param nside      pixels per base-face side, or negative when order is given
     * @param order      log2(nside) in [0, 13], or negative when nside is given
     * @param nested     NESTED numbering when true, RING otherwise
     * @param frame      coordinate frame
     * @param region     region descriptor, or null for the full sky
     * @param energyBins energy binning, or null
     */
    public static SphericalPixelization create(long nside, int order, boolean nested, CoordinateFrame frame,
                                               String region, EnergyBins energyBins) {
        return new SphericalPixelization(nside, order, Scheme.of(nested), frame, region, energyBins);
    }

    /**
     * Reconstruct from persisted header cards.
     *
     * @throws ConfigurationException if PIXTYPE is not HEALPIX, ORDERING is not RING or NESTED, COORDSYS is not CEL
     *                                or GAL, or a mandatory card is missing
     */
    public static SphericalPixelization fromHeader(HeaderCards header, EnergyBins energyBins) {
        var pixtype = header.getString("PIXTYPE");
        if (!"HEALPIX".equalsIgnoreCase(pixtype)) {
            throw new ConfigurationException("PIXTYPE != HEALPIX: " + pixtype);
        }
        var scheme = Scheme.parse(header.getString("ORDERING"));
        var order = header.getInt("ORDER");
        long nside = order < 0 ? header.getInt("NSIDE") : -1;
        var frame = CoordinateFrame.fromCode(header.getString("COORDSYS"));
        var region = header.optionalString("HPX_REG").or(() -> header.optionalString("HPXREGION")).orElse(null);
        return new SphericalPixelization(nside, order < 0 ? -1 : order, scheme, frame, region, energyBins);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof final SphericalPixelization other)) {
            return false;
        }
        return base.getNside() == other.base.getNside() && order == other.order
        && base.getScheme() == other.base.getScheme() && frame == other.frame && Objects.equals(region, other.region)
        && Objects.equals(energyBins, other.energyBins);
    }

    /**
     * True when both describe the same pixels in the same order, ignoring energy binning.
     */
    public boolean sameGeometry(SphericalPixelization other) {
        return base.getNside() == other.base.getNside() && base.getScheme() == other.base.getScheme()
        && frame == other.frame && Objects.equals(region, other.region);
    }

    public HealpixBase getBase() {
        return base;
    }

    public Optional<EnergyBins> getEnergyBins() {
        return Optional.ofNullable(energyBins);
    }

    public CoordinateFrame getFrame() {
        return frame;
    }

    /**
     * @return total pixel count of the full sky, 12 * nside^2
     */
    public int getMaxPixels() {
        return (int) base.getNpix();
    }

    public long getNside() {
        return base.getNside();
    }

    /**
     * @return the order as specified, or -1 when nside was given directly
     */
    public int getOrder() {
        return order;
    }

    /**
     * @return the number of pixels addressed by local index
     */
    public int getPixelCount() {
        return regionPixels == null ? getMaxPixels() : regionPixels.length;
    }

    public Optional<String> getRegion() {
        return Optional.ofNullable(region);
    }

    public Optional<RegionDescriptor> getRegionDescriptor() {
        return Optional.ofNullable(descriptor);
    }

    /**
     * Global indices of the region's pixels in local index order, or empty for the full sky.
     */
    public Optional<int[]> getRegionPixels() {
        return Optional.ofNullable(regionPixels).map(int[]::clone);
    }

    public Scheme getScheme() {
        return base.getScheme();
    }

    /**
     * Local index of a global pixel. Identity for the full sky; for a region, the pixel's position in the region's
     * index list or {@link #SENTINEL} when the pixel is outside the region. Indices outside [0, 12 nside^2) map to
     * the sentinel in both cases.
     */
    public int globalToLocal(long global) {
        if (global < 0 || global >= base.getNpix()) {
            return SENTINEL;
        }
        if (localIndex == null) {
            return (int) global;
        }
        var local = localIndex.get((int) global);
        return local == null ? SENTINEL : local;
    }

    public int[] globalToLocal(int[] globals) {
        var locals = new int[globals.length];
        for (int i = 0; i < globals.length; i++) {
            locals[i] = globalToLocal(globals[i]);
        }
        return locals;
    }

    @Override
    public int hashCode() {
        return Objects.hash(base.getNside(), order, base.getScheme(), frame, region, energyBins);
    }

    public boolean isNested() {
        return base.getScheme().isNested();
    }

    public boolean isRegion() {
        return regionPixels != null;
    }

    public int localToGlobal(int local) {
        if (local < 0 || local >= getPixelCount()) {
            throw new IndexOutOfBoundsException("Local index " + local + " outside [0, " + getPixelCount() + ")");
        }
        return regionPixels == null ? local : regionPixels[local];
    }

    /**
     * Approximate pixel edge length in degrees, from {@link PixelSizeTable}.
     */
    public double pixelAngularSize() {
        return PixelSizeTable.forNside(base.getNside());
    }

    /**
     * Angular size of the region in degrees, or 180 for the full sky.
     */
    public double regionAngularSize() {
        return RegionSelector.angularSize(descriptor);
    }

    /**
     * Re-derive the region's member pixels, ascending by global index.
     *
     * @throws IllegalStateException for a full-sky pixelization
     */
    public int[] regionPixelIndices() {
        if (descriptor == null) {
            throw new IllegalStateException("Full-sky pixelization has no region");
        }
        return RegionSelector.indices(base, descriptor);
    }

    /**
     * Reference direction of the region, or (0, 0) for the full sky, in this pixelization's frame.
     */
    public SkyPosition referenceDirection() {
        return RegionSelector.referenceDirection(descriptor, frame);
    }

    /**
     * Header cards describing this geometry.
     */
    public HeaderCards toHeader() {
        var cards = new HeaderCards().put("TELESCOP", "GLAST")
                                     .put("INSTRUME", "LAT")
                                     .put("COORDSYS", frame.code())
                                     .put("PIXTYPE", "HEALPIX")
                                     .put("ORDERING", base.getScheme().name())
                                     .put("ORDER", order)
                                     .put("NSIDE", base.getNside())
                                     .put("FIRSTPIX", 0)
                                     .put("LASTPIX", base.getNpix() - 1);
        if (frame == CoordinateFrame.CELESTIAL) {
            cards.put("EQUINOX", 2000.0);
        }
        if (region != null) {
            cards.put("HPX_REG", region);
        }
        return cards;
    }

    @Override
    public String toString() {
        return "SphericalPixelization[nside=" + base.getNside() + ", " + base.getScheme() + ", " + frame.code()
        + (region == null ? "" : ", " + region) + ", pixels=" + getPixelCount() + "]";
    }

    /**
     * The same geometry with different energy binning.
     */
    public SphericalPixelization withEnergyBins(EnergyBins bins) {
        return new SphericalPixelization(order >= 0 ? -1 : base.getNside(), order, base.getScheme(), frame, region,
                                         bins);
    }

    public static class Builder {
        private long            nside      = -1;
        private int             order      = -1;
        private Scheme          scheme     = Scheme.RING;
        private CoordinateFrame frame      = CoordinateFrame.CELESTIAL;
        private String          region;
        private EnergyBins      energyBins;

        public SphericalPixelization build() {
            return new SphericalPixelization(nside, order, scheme, frame, region, energyBins);
        }

        public Builder withEnergyBins(EnergyBins energyBins) {
            this.energyBins = energyBins;
            return this;
        }

        public Builder withFrame(CoordinateFrame frame) {
            this.frame = frame;
            return this;
        }

        public Builder withNside(long nside) {
            this.nside = nside;
            return this;
        }

        public Builder withOrder(int order) {
            this.order = order;
            return this;
        }

        public Builder withRegion(String region) {
            this.region = region;
            return this;
        }

        public Builder withScheme(Scheme scheme) {
            this.scheme = scheme;
            return this;
        }
    }
}
