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
import com.hellblazer.skymap.common.IntArrayList;
import com.hellblazer.skymap.geometry.Morton2D;
import com.hellblazer.skymap.geometry.SkyDirection;

import javax.vecmath.Tuple3d;
import javax.vecmath.Vector3d;

import static java.lang.Math.*;

/**
 * Pixel classification primitives of the HEALPix equal-area sphere partition at one resolution and numbering scheme.
 * <p>
 * The sphere is divided into 12 base faces, each subdivided into nside x nside pixels. NESTED numbering is a Morton
 * order within each face, RING numbering runs along iso-latitude rings from north to south. Only power-of-two nside
 * values are supported.
 * <p>
 * Algorithms follow Gorski et al. 2005, "HEALPix: a Framework for High Resolution Discretization and Fast Analysis of
 * Data Distributed on the Sphere", ApJ 622, 759.
 *
 * @author hal.hildebrand
 */
public final class HealpixBase {

    public static final int MAX_ORDER = 29;

    private static final double HALF_PI   = PI / 2.0;
    private static final double TWO_THIRD = 2.0 / 3.0;
    private static final double TWO_PI    = 2.0 * PI;

    /** ring number of the southern corner of each base face, in units of nside */
    private static final int[] JRLL = { 2, 2, 2, 2, 3, 3, 3, 3, 4, 4, 4, 4 };
    /** longitude of the southern corner of each base face, in units of pi/4 */
    private static final int[] JPLL = { 1, 3, 5, 7, 0, 2, 4, 6, 1, 3, 5, 7 };

    private final int    order;
    private final long   nside;
    private final long   npface;
    private final long   ncap;
    private final long   npix;
    private final double fact1;
    private final double fact2;
    private final Scheme scheme;

    private HealpixBase(int order, Scheme scheme) {
        if (order < 0 || order > MAX_ORDER) {
            throw new ConfigurationException("HEALPix order must be in [0, " + MAX_ORDER + "]: " + order);
        }
        this.order = order;
        this.scheme = scheme;
        nside = 1L << order;
        npface = nside * nside;
        ncap = 2 * nside * (nside - 1);
        npix = 12 * npface;
        fact2 = 4.0 / npix;
        fact1 = (nside << 1) * fact2;
    }

    public static HealpixBase forNside(long nside, Scheme scheme) {
        return new HealpixBase(orderOf(nside), scheme);
    }

    public static HealpixBase forOrder(int order, Scheme scheme) {
        return new HealpixBase(order, scheme);
    }

    /**
     * @return log2(nside)
     * @throws ConfigurationException if nside is not a positive power of two
     */
    public static int orderOf(long nside) {
        if (nside <= 0 || Long.bitCount(nside) != 1) {
            throw new ConfigurationException("HEALPix nside must be a positive power of two: " + nside);
        }
        return Long.numberOfTrailingZeros(nside);
    }

    private static double fmodulo(double v1, double v2) {
        if (v1 >= 0) {
            return v1 < v2 ? v1 : v1 % v2;
        }
        var tmp = v1 % v2 + v2;
        return tmp == v2 ? 0.0 : tmp;
    }

    private static long isqrt(long x) {
        var r = (long) sqrt(x + 0.5);
        while (r * r > x) {
            r--;
        }
        while ((r + 1) * (r + 1) <= x) {
            r++;
        }
        return r;
    }

    /**
     * Classify a direction given as colatitude/azimuth in radians.
     */
    public long ang2pix(double theta, double phi) {
        if (!(theta >= 0.0 && theta <= PI)) {
            throw new IllegalArgumentException("Colatitude out of range [0, pi]: " + theta);
        }
        return zphi2pix(cos(theta), phi);
    }

    /**
     * Classify a sky direction.
     */
    public long dir2pix(SkyDirection direction) {
        return zphi2pix(sin(toRadians(direction.lat())), toRadians(direction.lon()));
    }

    public int getOrder() {
        return order;
    }

    public long getNpix() {
        return npix;
    }

    public long getNside() {
        return nside;
    }

    public Scheme getScheme() {
        return scheme;
    }

    /**
     * Largest angular distance, in radians, between a pixel center and any point of that pixel. A conservative
     * bound, not the exact maximum.
     */
    public double maxPixelRadius() {
        return HALF_PI / nside;
    }

    public long nest2ring(long pix) {
        checkPixel(pix);
        return nestToRing(pix);
    }

    /**
     * Center of a pixel as colatitude/azimuth in radians.
     *
     * @return {theta, phi}
     */
    public double[] pix2ang(long pix) {
        var zphi = pix2zphi(pix);
        return new double[] { atan2(zphi[2], zphi[0]), zphi[1] };
    }

    public SkyDirection pix2dir(long pix) {
        var zphi = pix2zphi(pix);
        return new SkyDirection(toDegrees(zphi[1]), toDegrees(atan2(zphi[0], zphi[2])));
    }

    /**
     * Unit vector of a pixel center.
     */
    public Vector3d pix2vec(long pix) {
        var zphi = pix2zphi(pix);
        var sth = zphi[2];
        return new Vector3d(sth * cos(zphi[1]), sth * sin(zphi[1]), zphi[0]);
    }

    /**
     * All pixels of this resolution whose centers lie within the given angular radius of a direction, or, when
     * inclusive, that overlap the disc. Overlap is approximated by testing the centers of the sub-pixels at
     * resolution nside * fact; fact must be a power of two.
     *
     * @param center    disc center, need not be normalized
     * @param radius    disc radius in radians
     * @param inclusive include partially overlapping pixels
     * @param fact      oversampling factor of the overlap test, ignored when not inclusive
     * @return pixel indices in this base's scheme, ascending
     */
    public int[] queryDisc(Tuple3d center, double radius, boolean inclusive, int fact) {
        if (npix > Integer.MAX_VALUE) {
            throw new ConfigurationException("Disc queries are limited to orders with int addressable pixels: " + order);
        }
        if (radius < 0.0) {
            throw new IllegalArgumentException("Disc radius cannot be negative: " + radius);
        }
        HealpixBase fine = null;
        if (inclusive) {
            if (fact <= 0 || Integer.bitCount(fact) != 1) {
                throw new ConfigurationException("Inclusive oversampling factor must be a power of two: " + fact);
            }
            var fineOrder = order + Integer.numberOfTrailingZeros(fact);
            if (fineOrder > MAX_ORDER) {
                throw new ConfigurationException("Oversampling factor " + fact + " exceeds maximum order at order "
                                                 + order);
            }
            fine = new HealpixBase(fineOrder, Scheme.NESTED);
        }

        var c = new Vector3d(center);
        c.normalize();
        var cosRadius = cos(min(radius, PI));
        var margin = inclusive ? maxPixelRadius() : 0.0;
        var cosOuter = cos(min(radius + margin, PI));

        var theta0 = acos(max(-1.0, min(1.0, c.z)));
        var thetaLo = theta0 - radius - margin;
        var thetaHi = theta0 + radius + margin;
        var zMax = thetaLo <= 0.0 ? 1.0 : cos(thetaLo);
        var zMin = thetaHi >= PI ? -1.0 : cos(thetaHi);
        var slack = fact2;

        var result = new IntArrayList();
        for (long ring = 1; ring < 4 * nside; ring++) {
            var z = ringZ(ring);
            if (z > zMax + slack) {
                continue;
            }
            if (z < zMin - slack) {
                break;
            }
            var start = ringStart(ring);
            var count = ringPixels(ring);
            for (long p = start; p < start + count; p++) {
                var v = ringToVec(p);
                var dot = v.dot(c);
                if (dot >= cosRadius) {
                    result.add((int) toScheme(p));
                } else if (inclusive && dot >= cosOuter && overlaps(fine, fact, ringToNest(p), c, cosRadius)) {
                    result.add((int) toScheme(p));
                }
            }
        }
        result.sort();
        return result.toArray();
    }

    public long ring2nest(long pix) {
        checkPixel(pix);
        return ringToNest(pix);
    }

    @Override
    public String toString() {
        return "HealpixBase[order=" + order + ", nside=" + nside + ", scheme=" + scheme + "]";
    }

    /**
     * Classify a direction vector; the vector need not be normalized.
     */
    public long vec2pix(Tuple3d v) {
        var length = sqrt(v.x * v.x + v.y * v.y + v.z * v.z);
        if (length == 0.0) {
            throw new IllegalArgumentException("Cannot classify a zero vector");
        }
        return zphi2pix(v.z / length, atan2(v.y, v.x));
    }

    private void checkPixel(long pix) {
        if (pix < 0 || pix >= npix) {
            throw new IllegalArgumentException("Pixel index out of range [0, " + npix + "): " + pix);
        }
    }

    private long nestToRing(long pix) {
        var face = (int) (pix >>> (2 * order));
        var p = pix & (npface - 1);
        return xyf2ring(Morton2D.decodeX(p), Morton2D.decodeY(p), face);
    }

    private boolean overlaps(HealpixBase fine, int fact, long nestPix, Vector3d c, double cosRadius) {
        var subPixels = (long) fact * fact;
        var first = nestPix * subPixels;
        for (long s = first; s < first + subPixels; s++) {
            if (fine.nestToVec(s).dot(c) >= cosRadius) {
                return true;
            }
        }
        return false;
    }

    /**
     * @return {z, phi, sin(theta)} of the pixel center
     */
    private double[] pix2zphi(long pix) {
        checkPixel(pix);
        return scheme == Scheme.RING ? ringZphi(pix) : nestZphi(pix);
    }

    private double[] nestZphi(long pix) {
        var face = (int) (pix >>> (2 * order));
        var p = pix & (npface - 1);
        var ix = Morton2D.decodeX(p);
        var iy = Morton2D.decodeY(p);
        var nl4 = 4 * nside;
        var jr = ((long) JRLL[face] << order) - ix - iy - 1;

        long nr;
        long kshift;
        double z;
        double sth;
        if (jr < nside) {
            nr = jr;
            var tmp = (double) nr * nr * fact2;
            z = 1.0 - tmp;
            sth = sqrt(tmp * (2.0 - tmp));
            kshift = 0;
        } else if (jr > 3 * nside) {
            nr = nl4 - jr;
            var tmp = (double) nr * nr * fact2;
            z = tmp - 1.0;
            sth = sqrt(tmp * (2.0 - tmp));
            kshift = 0;
        } else {
            nr = nside;
            z = (2 * nside - jr) * fact1;
            sth = sqrt((1.0 - z) * (1.0 + z));
            kshift = (jr - nside) & 1;
        }

        var jp = (JPLL[face] * nr + ix - iy + 1 + kshift) / 2;
        if (jp > nl4) {
            jp -= nl4;
        }
        if (jp < 1) {
            jp += nl4;
        }
        var phi = (jp - (kshift + 1) * 0.5) * (HALF_PI / nr);
        return new double[] { z, phi, sth };
    }

    private Vector3d nestToVec(long pix) {
        var zphi = nestZphi(pix);
        return new Vector3d(zphi[2] * cos(zphi[1]), zphi[2] * sin(zphi[1]), zphi[0]);
    }

    private double[] ringZphi(long pix) {
        double z;
        double sth;
        double phi;
        if (pix < ncap) {
            var iring = (1 + isqrt(1 + 2 * pix)) >> 1;
            var iphi = pix + 1 - 2 * iring * (iring - 1);
            var tmp = (double) iring * iring * fact2;
            z = 1.0 - tmp;
            sth = sqrt(tmp * (2.0 - tmp));
            phi = (iphi - 0.5) * HALF_PI / iring;
        } else if (pix < npix - ncap) {
            var nl4 = 4 * nside;
            var ip = pix - ncap;
            var tmp = ip / nl4;
            var iring = tmp + nside;
            var iphi = ip - nl4 * tmp + 1;
            var fodd = ((iring + nside) & 1) != 0 ? 1.0 : 0.5;
            z = (2 * nside - iring) * fact1;
            sth = sqrt((1.0 - z) * (1.0 + z));
            phi = (iphi - fodd) * HALF_PI / nside;
        } else {
            var ip = npix - pix;
            var iring = (1 + isqrt(2 * ip - 1)) >> 1;
            var iphi = 4 * iring + 1 - (ip - 2 * iring * (iring - 1));
            var tmp = (double) iring * iring * fact2;
            z = tmp - 1.0;
            sth = sqrt(tmp * (2.0 - tmp));
            phi = (iphi - 0.5) * HALF_PI / iring;
        }
        return new double[] { z, phi, sth };
    }

    private long ringPixels(long ring) {
        if (ring < nside) {
            return 4 * ring;
        }
        if (ring <= 3 * nside) {
            return 4 * nside;
        }
        return 4 * (4 * nside - ring);
    }

    private long ringStart(long ring) {
        if (ring < nside) {
            return 2 * ring * (ring - 1);
        }
        if (ring <= 3 * nside) {
            return ncap + (ring - nside) * 4 * nside;
        }
        var nr = 4 * nside - ring;
        return npix - 2 * nr * (nr + 1);
    }

    private long ringToNest(long pix) {
        long iring;
        long iphi;
        long kshift;
        long nr;
        int face;
        var nl2 = 2 * nside;

        if (pix < ncap) {
            iring = (1 + isqrt(1 + 2 * pix)) >> 1;
            iphi = pix + 1 - 2 * iring * (iring - 1);
            kshift = 0;
            nr = iring;
            face = (int) ((iphi - 1) / nr);
        } else if (pix < npix - ncap) {
            var ip = pix - ncap;
            var tmp = ip >> (order + 2);
            iring = tmp + nside;
            iphi = ip - tmp * 4 * nside + 1;
            kshift = (iring + nside) & 1;
            nr = nside;
            var ire = tmp + 1;
            var irm = nl2 + 2 - ire;
            var ifm = (iphi - ire / 2 + nside - 1) >> order;
            var ifp = (iphi - irm / 2 + nside - 1) >> order;
            face = (int) (ifp == ifm ? (ifp | 4) : (ifp < ifm ? ifp : ifm + 8));
        } else {
            var ip = npix - pix;
            iring = (1 + isqrt(2 * ip - 1)) >> 1;
            iphi = 4 * iring + 1 - (ip - 2 * iring * (iring - 1));
            kshift = 0;
            nr = iring;
            iring = 2 * nl2 - iring;
            face = 8 + (int) ((iphi - 1) / nr);
        }

        var irt = iring - ((long) JRLL[face] * nside) + 1;
        var ipt = 2 * iphi - JPLL[face] * nr - kshift - 1;
        if (ipt >= nl2) {
            ipt -= 8 * nside;
        }
        return xyf2nest((ipt - irt) >> 1, (-ipt - irt) >> 1, face);
    }

    private Vector3d ringToVec(long pix) {
        var zphi = ringZphi(pix);
        return new Vector3d(zphi[2] * cos(zphi[1]), zphi[2] * sin(zphi[1]), zphi[0]);
    }

    private double ringZ(long ring) {
        if (ring < nside) {
            return 1.0 - (double) ring * ring * fact2;
        }
        if (ring <= 3 * nside) {
            return (2 * nside - ring) * fact1;
        }
        var nr = 4 * nside - ring;
        return (double) nr * nr * fact2 - 1.0;
    }

    private long toScheme(long ringPix) {
        return scheme == Scheme.RING ? ringPix : ringToNest(ringPix);
    }

    private long xyf2nest(long ix, long iy, int face) {
        return ((long) face << (2 * order)) + Morton2D.encode(ix, iy);
    }

    private long xyf2ring(long ix, long iy, int face) {
        var nl4 = 4 * nside;
        var jr = ((long) JRLL[face] * nside) - ix - iy - 1;

        long nr;
        long nBefore;
        long kshift;
        if (jr < nside) {
            nr = jr;
            nBefore = 2 * nr * (nr - 1);
            kshift = 0;
        } else if (jr > 3 * nside) {
            nr = nl4 - jr;
            nBefore = npix - 2 * (nr + 1) * nr;
            kshift = 0;
        } else {
            nr = nside;
            nBefore = ncap + (jr - nside) * nl4;
            kshift = (jr - nside) & 1;
        }

        var jp = (JPLL[face] * nr + ix - iy + 1 + kshift) / 2;
        if (jp > nl4) {
            jp -= nl4;
        } else if (jp < 1) {
            jp += nl4;
        }
        return nBefore + jp - 1;
    }

    private long zphi2pix(double z, double phi) {
        var za = abs(z);
        var tt = fmodulo(phi, TWO_PI) / HALF_PI;
        if (tt >= 4.0) {
            tt = 0.0;
        }

        if (scheme == Scheme.RING) {
            if (za <= TWO_THIRD) {
                var nl4 = 4 * nside;
                var temp1 = nside * (0.5 + tt);
                var temp2 = nside * z * 0.75;
                var jp = (long) (temp1 - temp2);
                var jm = (long) (temp1 + temp2);
                var ir = nside + 1 + jp - jm;
                var kshift = 1 - (ir & 1);
                var t1 = jp + jm - nside + kshift + 1 + nl4 + nl4;
                var ip = (t1 >> 1) & (nl4 - 1);
                return ncap + (ir - 1) * nl4 + ip;
            }
            var tp = tt - (long) tt;
            var tmp = nside * sqrt(3.0 * (1.0 - za));
            var jp = (long) (tp * tmp);
            var jm = (long) ((1.0 - tp) * tmp);
            var ir = jp + jm + 1;
            var ip = min((long) (tt * ir), 4 * ir - 1);
            return z > 0 ? 2 * ir * (ir - 1) + ip : npix - 2 * ir * (ir + 1) + ip;
        }

        if (za <= TWO_THIRD) {
            var temp1 = nside * (0.5 + tt);
            var temp2 = nside * (z * 0.75);
            var jp = (long) (temp1 - temp2);
            var jm = (long) (temp1 + temp2);
            var ifp = jp >> order;
            var ifm = jm >> order;
            var face = (int) (ifp == ifm ? (ifp | 4) : (ifp < ifm ? ifp : ifm + 8));
            var ix = jm & (nside - 1);
            var iy = nside - (jp & (nside - 1)) - 1;
            return xyf2nest(ix, iy, face);
        }
        var ntt = min(3, (int) tt);
        var tp = tt - ntt;
        var tmp = nside * sqrt(3.0 * (1.0 - za));
        var jp = min((long) (tp * tmp), nside - 1);
        var jm = min((long) ((1.0 - tp) * tmp), nside - 1);
        return z >= 0 ? xyf2nest(nside - jm - 1, nside - jp - 1, ntt) : xyf2nest(jp, jm, ntt + 8);
    }
}
