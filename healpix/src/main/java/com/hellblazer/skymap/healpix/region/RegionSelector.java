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
package com.hellblazer.skymap.healpix.region;

import com.hellblazer.skymap.geometry.CoordinateFrame;
import com.hellblazer.skymap.geometry.SkyPosition;
import com.hellblazer.skymap.healpix.HealpixBase;
import com.hellblazer.skymap.healpix.Scheme;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Evaluates region descriptors against a HEALPix resolution. A {@code null} descriptor stands for the full sky.
 *
 * @author hal.hildebrand
 */
public final class RegionSelector {

    /** Angular size reported for the full sky */
    public static final double FULL_SKY_SIZE = 180.0;

    private static final Logger log = LoggerFactory.getLogger(RegionSelector.class);

    /** Parent pixel enumeration above this order is slow enough to warn about */
    private static final int BRUTE_FORCE_WARN_ORDER = 10;

    private RegionSelector() {
    }

    public static double angularSize(RegionDescriptor descriptor) {
        return descriptor == null ? FULL_SKY_SIZE : descriptor.angularSize();
    }

    public static double angularSize(String descriptor) {
        return angularSize(descriptor == null ? null : RegionDescriptor.parse(descriptor));
    }

    /**
     * Member pixels of a region, ascending by global index. Repeated calls with the same inputs return identical
     * lists.
     */
    public static int[] indices(HealpixBase base, RegionDescriptor descriptor) {
        Objects.requireNonNull(base, "base");
        Objects.requireNonNull(descriptor, "descriptor");
        if (descriptor instanceof RegionDescriptor.ParentPixel && base.getOrder() > BRUTE_FORCE_WARN_ORDER) {
            log.warn("Enumerating all {} pixels at order {} to select {}", base.getNpix(), base.getOrder(),
                     descriptor.toDescriptor());
        }
        var start = System.nanoTime();
        var selected = descriptor.select(base);
        if (log.isDebugEnabled()) {
            log.debug("Selected {} pixels for {} at {} in {} ms", selected.length, descriptor.toDescriptor(), base,
                      (System.nanoTime() - start) / 1_000_000);
        }
        return selected;
    }

    /**
     * @param nside     native resolution
     * @param nested    native numbering scheme
     * @param descriptor region descriptor text
     */
    public static int[] indices(long nside, boolean nested, String descriptor) {
        return indices(HealpixBase.forNside(nside, Scheme.of(nested)), RegionDescriptor.parse(descriptor));
    }

    /**
     * Reference direction of a region: the disc center, or the center of the named parent pixel, interpreted in the
     * given frame. The full sky is referenced at (0, 0).
     */
    public static SkyPosition referenceDirection(RegionDescriptor descriptor, CoordinateFrame frame) {
        Objects.requireNonNull(frame, "frame");
        if (descriptor == null) {
            return SkyPosition.of(0.0, 0.0, frame);
        }
        return new SkyPosition(descriptor.center(), frame);
    }

    public static SkyPosition referenceDirection(String descriptor, CoordinateFrame frame) {
        return referenceDirection(descriptor == null ? null : RegionDescriptor.parse(descriptor), frame);
    }
}
