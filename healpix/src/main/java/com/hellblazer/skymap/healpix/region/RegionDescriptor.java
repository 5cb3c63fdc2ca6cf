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

import com.hellblazer.skymap.common.IntArrayList;
import com.hellblazer.skymap.common.RegionParseException;
import com.hellblazer.skymap.geometry.SkyDirection;
import com.hellblazer.skymap.healpix.HealpixBase;
import com.hellblazer.skymap.healpix.PixelSizeTable;
import com.hellblazer.skymap.healpix.Scheme;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

import static java.lang.Math.toRadians;

/**
 * A parsed HEALPix region descriptor. Descriptors are resolution independent text of the form {@code KIND(args...)}:
 * <ul>
 * <li>{@code DISK(lon,lat,radius)}: pixels whose centers lie within radius degrees of (lon, lat)</li>
 * <li>{@code DISK_INC(lon,lat,radius,fact)}: pixels overlapping that disc, tested at nside * fact</li>
 * <li>{@code HPX_PIXEL(ORDERING,nside,ipix)}: pixels whose centers fall inside one coarser pixel</li>
 * </ul>
 *
 * @author hal.hildebrand
 */
public sealed interface RegionDescriptor
permits RegionDescriptor.Disk, RegionDescriptor.DiskInclusive, RegionDescriptor.ParentPixel {

    Pattern FORM = Pattern.compile("^\\s*([A-Za-z_]+)\\s*\\((.*)\\)\\s*$");

    /**
     * Parse descriptor text.
     *
     * @throws RegionParseException on an unknown kind, wrong argument count or malformed argument
     */
    static RegionDescriptor parse(String text) {
        if (text == null || text.isBlank()) {
            throw new RegionParseException(String.valueOf(text), "empty descriptor");
        }
        var matcher = FORM.matcher(text);
        if (!matcher.matches()) {
            throw new RegionParseException(text, "expected KIND(args...)");
        }
        var kind = matcher.group(1).toUpperCase(Locale.ROOT);
        var args = splitArguments(matcher.group(2));
        return switch (kind) {
            case "DISK" -> {
                expectArguments(text, args, 3);
                yield new Disk(parseDouble(text, args.get(0)), parseLatitude(text, args.get(1)),
                               parseRadius(text, args.get(2)));
            }
            case "DISK_INC" -> {
                expectArguments(text, args, 4);
                var fact = parseLong(text, args.get(3));
                if (fact <= 0 || fact > (1 << 16) || Long.bitCount(fact) != 1) {
                    throw new RegionParseException(text, "oversampling factor must be a power of two: " + fact);
                }
                yield new DiskInclusive(parseDouble(text, args.get(0)), parseLatitude(text, args.get(1)),
                                        parseRadius(text, args.get(2)), (int) fact);
            }
            case "HPX_PIXEL" -> {
                expectArguments(text, args, 3);
                var ordering = args.get(0).toUpperCase(Locale.ROOT);
                Scheme scheme;
                if (ordering.equals("RING")) {
                    scheme = Scheme.RING;
                } else if (ordering.equals("NESTED")) {
                    scheme = Scheme.NESTED;
                } else {
                    throw new RegionParseException(text, "unrecognized ordering scheme " + args.get(0));
                }
                var nside = parseLong(text, args.get(1));
                if (nside <= 0 || Long.bitCount(nside) != 1
                || Long.numberOfTrailingZeros(nside) > PixelSizeTable.MAX_ORDER) {
                    throw new RegionParseException(text, "parent nside must be a power of two up to 2^"
                                                         + PixelSizeTable.MAX_ORDER + ": " + nside);
                }
                var pixel = parseLong(text, args.get(2));
                if (pixel < 0 || pixel >= 12 * nside * nside) {
                    throw new RegionParseException(text, "parent pixel out of range: " + pixel);
                }
                yield new ParentPixel(scheme, nside, pixel);
            }
            default -> throw new RegionParseException(text, "unrecognized region type " + matcher.group(1));
        };
    }

    private static void expectArguments(String text, List<String> args, int count) {
        if (args.size() != count) {
            throw new RegionParseException(text, "expected " + count + " arguments, found " + args.size());
        }
    }

    private static double parseDouble(String text, String token) {
        try {
            var value = Double.parseDouble(token);
            if (!Double.isFinite(value)) {
                throw new RegionParseException(text, "non-finite argument " + token);
            }
            return value;
        } catch (NumberFormatException e) {
            throw new RegionParseException(text, "malformed number " + token, e);
        }
    }

    private static double parseLatitude(String text, String token) {
        var lat = parseDouble(text, token);
        if (lat < -90.0 || lat > 90.0) {
            throw new RegionParseException(text, "latitude out of range " + token);
        }
        return lat;
    }

    private static long parseLong(String text, String token) {
        try {
            return Long.parseLong(token);
        } catch (NumberFormatException e) {
            throw new RegionParseException(text, "malformed integer " + token, e);
        }
    }

    private static double parseRadius(String text, String token) {
        var radius = parseDouble(text, token);
        if (radius < 0.0) {
            throw new RegionParseException(text, "negative radius " + token);
        }
        return radius;
    }

    private static List<String> splitArguments(String body) {
        var args = new ArrayList<String>();
        if (body.isBlank()) {
            return args;
        }
        for (var token : body.split(",", -1)) {
            args.add(token.trim());
        }
        return args;
    }

    /**
     * Approximate angular radius of the region in degrees.
     */
    double angularSize();

    /**
     * Center of the region, in the frame of the pixelization it is applied to.
     */
    SkyDirection center();

    /**
     * Global indices of the member pixels at the base's resolution and scheme, ascending.
     */
    int[] select(HealpixBase base);

    /**
     * Canonical descriptor text.
     */
    String toDescriptor();

    record Disk(double lon, double lat, double radius) implements RegionDescriptor {

        @Override
        public double angularSize() {
            return radius;
        }

        @Override
        public SkyDirection center() {
            return new SkyDirection(lon, lat);
        }

        @Override
        public int[] select(HealpixBase base) {
            return base.queryDisc(center().toVector(), toRadians(radius), false, 1);
        }

        @Override
        public String toDescriptor() {
            return "DISK(" + lon + "," + lat + "," + radius + ")";
        }
    }

    record DiskInclusive(double lon, double lat, double radius, int fact) implements RegionDescriptor {

        @Override
        public double angularSize() {
            return radius;
        }

        @Override
        public SkyDirection center() {
            return new SkyDirection(lon, lat);
        }

        @Override
        public int[] select(HealpixBase base) {
            return base.queryDisc(center().toVector(), toRadians(radius), true, fact);
        }

        @Override
        public String toDescriptor() {
            return "DISK_INC(" + lon + "," + lat + "," + radius + "," + fact + ")";
        }
    }

    /**
     * All native pixels whose centers classify into one pixel of a coarser grid. Selection enumerates every native
     * pixel, so its cost is proportional to the full native pixel count; a direct index downgrade by resolution ratio
     * would avoid that but is not implemented.
     */
    record ParentPixel(Scheme scheme, long nside, long pixel) implements RegionDescriptor {

        /**
         * Twice the approximate parent pixel size, a coverage margin rather than an exact bound.
         */
        @Override
        public double angularSize() {
            return 2.0 * PixelSizeTable.forNside(nside);
        }

        @Override
        public SkyDirection center() {
            return parent().pix2dir(pixel);
        }

        public HealpixBase parent() {
            return HealpixBase.forNside(nside, scheme);
        }

        @Override
        public int[] select(HealpixBase base) {
            var parent = parent();
            var matches = new IntArrayList();
            var npix = base.getNpix();
            for (long p = 0; p < npix; p++) {
                if (parent.vec2pix(base.pix2vec(p)) == pixel) {
                    matches.add((int) p);
                }
            }
            return matches.toArray();
        }

        @Override
        public String toDescriptor() {
            return "HPX_PIXEL(" + scheme + "," + nside + "," + pixel + ")";
        }
    }
}
