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
package com.hellblazer.skymap.reproject.wcs;

import com.hellblazer.skymap.common.ConfigurationException;
import com.hellblazer.skymap.common.HeaderCards;
import com.hellblazer.skymap.geometry.CoordinateFrame;
import com.hellblazer.skymap.geometry.SkyDirection;

import java.util.Objects;
import java.util.Optional;

import static java.lang.Math.*;

/**
 * A rectangular planar grid with an invertible mapping between pixel coordinates and sky directions, in the manner of
 * a FITS WCS header. Pixel coordinates are 1-based: the center of the first cell is (1, 1).
 * <p>
 * Celestial axes use the native spherical rotation of FITS WCS Paper II with the default LONPOLE. The optional third
 * axis is a linear energy axis in MeV.
 *
 * @author hal.hildebrand
 */
public final class WcsGeometry {

    public static final String ENERGY_AXIS_TYPE = "Energy";

    private final CoordinateFrame frame;
    private final Projection      projection;
    private final SkyDirection    reference;
    private final double          crpix1;
    private final double          crpix2;
    private final double          cdelt1;
    private final double          cdelt2;
    private final int             width;
    private final int             height;
    private final EnergyAxis      energyAxis;

    // celestial coordinates of the native pole and native longitude of the celestial pole, radians
    private final double alphaP;
    private final double deltaP;
    private final double phiP;

    private WcsGeometry(CoordinateFrame frame, Projection projection, SkyDirection reference, double crpix1,
                        double crpix2, double cdelt1, double cdelt2, int width, int height, EnergyAxis energyAxis) {
        if (width <= 0 || height <= 0) {
            throw new ConfigurationException("Grid dimensions must be positive: " + width + "x" + height);
        }
        if (cdelt1 == 0.0 || cdelt2 == 0.0 || Double.isNaN(cdelt1) || Double.isNaN(cdelt2)) {
            throw new ConfigurationException("Grid pixel scale must be non-zero: " + cdelt1 + ", " + cdelt2);
        }
        this.frame = Objects.requireNonNull(frame, "frame");
        this.projection = Objects.requireNonNull(projection, "projection");
        this.reference = Objects.requireNonNull(reference, "reference");
        this.crpix1 = crpix1;
        this.crpix2 = crpix2;
        this.cdelt1 = cdelt1;
        this.cdelt2 = cdelt2;
        this.width = width;
        this.height = height;
        this.energyAxis = energyAxis;

        var alpha0 = reference.lon();
        var delta0 = reference.lat();
        if (projection.theta0() == 90.0) {
            alphaP = toRadians(alpha0);
            deltaP = toRadians(delta0);
            phiP = toRadians(delta0 >= 90.0 ? 0.0 : 180.0);
        } else if (delta0 >= 0.0) {
            alphaP = toRadians(alpha0 - 180.0);
            deltaP = toRadians(90.0 - delta0);
            phiP = 0.0;
        } else {
            alphaP = toRadians(alpha0);
            deltaP = toRadians(90.0 + delta0);
            phiP = PI;
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Reconstruct a geometry from header cards written by {@link #toHeader()}.
     *
     * @throws ConfigurationException for a missing card, an unsupported frame or an unsupported projection
     */
    public static WcsGeometry fromHeader(HeaderCards header) {
        var ctype1 = header.getString("CTYPE1");
        if (ctype1.length() < 8) {
            throw new ConfigurationException("Malformed celestial axis type: " + ctype1);
        }
        var frame = CoordinateFrame.fromAxisType(ctype1);
        var ctype2 = header.getString("CTYPE2");
        if (CoordinateFrame.fromAxisType(ctype2) != frame) {
            throw new ConfigurationException("Celestial axes disagree on frame: " + ctype1 + ", " + ctype2);
        }
        var projection = Projection.fromCode(ctype1.substring(5));
        var builder = builder().withFrame(frame)
                               .withProjection(projection)
                               .withReference(new SkyDirection(header.getDouble("CRVAL1"),
                                                               header.getDouble("CRVAL2")))
                               .withReferencePixel(header.getDouble("CRPIX1"), header.getDouble("CRPIX2"))
                               .withScale(header.getDouble("CDELT1"), header.getDouble("CDELT2"))
                               .withSize(header.getInt("NAXIS1"), header.getInt("NAXIS2"));
        if (header.getInt("NAXIS") > 2) {
            var ctype3 = header.getString("CTYPE3");
            if (!ENERGY_AXIS_TYPE.equalsIgnoreCase(ctype3)) {
                throw new ConfigurationException("Unsupported third axis type: " + ctype3);
            }
            builder.withEnergyAxis(new EnergyAxis(header.getDouble("CRVAL3"), header.getDouble("CDELT3"),
                                                  header.getDouble("CRPIX3"), header.getInt("NAXIS3")));
        }
        return builder.build();
    }

    public int cellCount() {
        return width * height;
    }

    /**
     * Sky direction at the center of the 0-based cell (i, j), or null when the cell lies outside the projection.
     */
    public SkyDirection cellCenter(int i, int j) {
        return pixelToSky(i + 1, j + 1);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof WcsGeometry other)) {
            return false;
        }
        return frame == other.frame && projection == other.projection && reference.equals(other.reference)
        && Double.compare(crpix1, other.crpix1) == 0 && Double.compare(crpix2, other.crpix2) == 0
        && Double.compare(cdelt1, other.cdelt1) == 0 && Double.compare(cdelt2, other.cdelt2) == 0
        && width == other.width && height == other.height && Objects.equals(energyAxis, other.energyAxis);
    }

    public double getCdelt1() {
        return cdelt1;
    }

    public double getCdelt2() {
        return cdelt2;
    }

    public double getCrpix1() {
        return crpix1;
    }

    public double getCrpix2() {
        return crpix2;
    }

    public Optional<EnergyAxis> getEnergyAxis() {
        return Optional.ofNullable(energyAxis);
    }

    public CoordinateFrame getFrame() {
        return frame;
    }

    public int getHeight() {
        return height;
    }

    public Projection getProjection() {
        return projection;
    }

    public SkyDirection getReference() {
        return reference;
    }

    public int getWidth() {
        return width;
    }

    @Override
    public int hashCode() {
        return Objects.hash(frame, projection, reference, crpix1, crpix2, cdelt1, cdelt2, width, height, energyAxis);
    }

    /**
     * Sky direction of the 1-based pixel coordinate (x, y), or null when the point lies outside the projection.
     */
    public SkyDirection pixelToSky(double x, double y) {
        var nat = projection.toNative(cdelt1 * (x - crpix1), cdelt2 * (y - crpix2));
        if (nat == null) {
            return null;
        }
        var phi = toRadians(nat[0]);
        var theta = toRadians(nat[1]);
        var sinTheta = sin(theta);
        var cosTheta = cos(theta);
        var dphi = phi - phiP;
        var sinDelta = sinTheta * sin(deltaP) + cosTheta * cos(deltaP) * cos(dphi);
        // cos(delta) * (cos(alpha - alphaP), sin(alpha - alphaP))
        var u = sinTheta * cos(deltaP) - cosTheta * sin(deltaP) * cos(dphi);
        var v = -cosTheta * sin(dphi);
        var alpha = alphaP + atan2(v, u);
        return new SkyDirection(toDegrees(alpha), toDegrees(atan2(sinDelta, hypot(u, v))));
    }

    /**
     * True when the other geometry has the same celestial grid dimensions.
     */
    public boolean sameShape(WcsGeometry other) {
        return width == other.width && height == other.height;
    }

    /**
     * 1-based pixel coordinate {x, y} of a sky direction, or null when it cannot be projected.
     */
    public double[] skyToPixel(SkyDirection direction) {
        var alpha = toRadians(direction.lon());
        var delta = toRadians(direction.lat());
        var sinDelta = sin(delta);
        var cosDelta = cos(delta);
        var dalpha = alpha - alphaP;
        // cos(theta) * (cos(phi - phiP), sin(phi - phiP))
        var u = sinDelta * cos(deltaP) - cosDelta * sin(deltaP) * cos(dalpha);
        var v = -cosDelta * sin(dalpha);
        var phi = phiP + atan2(v, u);
        var sinTheta = sinDelta * sin(deltaP) + cosDelta * cos(deltaP) * cos(dalpha);
        var xy = projection.fromNative(toDegrees(phi), toDegrees(atan2(sinTheta, hypot(u, v))));
        if (xy == null) {
            return null;
        }
        return new double[] { xy[0] / cdelt1 + crpix1, xy[1] / cdelt2 + crpix2 };
    }

    /**
     * Header cards describing this grid.
     */
    public HeaderCards toHeader() {
        var cards = new HeaderCards().put("NAXIS", energyAxis == null ? 2 : 3)
                                     .put("NAXIS1", width)
                                     .put("NAXIS2", height);
        if (energyAxis != null) {
            cards.put("NAXIS3", energyAxis.size());
        }
        cards.put("CTYPE1", frame.longitudeAxisType(projection.name()))
             .put("CTYPE2", frame.latitudeAxisType(projection.name()))
             .put("CRVAL1", reference.lon())
             .put("CRVAL2", reference.lat())
             .put("CRPIX1", crpix1)
             .put("CRPIX2", crpix2)
             .put("CDELT1", cdelt1)
             .put("CDELT2", cdelt2);
        if (energyAxis != null) {
            cards.put("CTYPE3", ENERGY_AXIS_TYPE)
                 .put("CUNIT3", "MeV")
                 .put("CRVAL3", energyAxis.crval())
                 .put("CDELT3", energyAxis.cdelt())
                 .put("CRPIX3", energyAxis.crpix());
        }
        return cards;
    }

    @Override
    public String toString() {
        return "WcsGeometry[" + frame.longitudeAxisType(projection.name()) + ", " + width + "x" + height + " @ "
        + reference + ", cdelt=(" + cdelt1 + ", " + cdelt2 + ")" + (energyAxis == null ? "" : ", " + energyAxis)
        + "]";
    }

    /**
     * The same celestial grid with a different (or no) energy axis.
     */
    public WcsGeometry withEnergyAxis(EnergyAxis axis) {
        return new WcsGeometry(frame, projection, reference, crpix1, crpix2, cdelt1, cdelt2, width, height, axis);
    }

    /**
     * Linear third axis. Values are {@code crval + (p - crpix) * cdelt} for the 1-based plane coordinate p.
     */
    public record EnergyAxis(double crval, double cdelt, double crpix, int size) {
        public EnergyAxis {
            if (size <= 0) {
                throw new ConfigurationException("Energy axis needs at least one plane: " + size);
            }
        }

        public double valueAt(double p) {
            return crval + (p - crpix) * cdelt;
        }
    }

    public static class Builder {
        private CoordinateFrame frame      = CoordinateFrame.CELESTIAL;
        private Projection      projection = Projection.CAR;
        private SkyDirection    reference  = new SkyDirection(0.0, 0.0);
        private double          crpix1     = Double.NaN;
        private double          crpix2     = Double.NaN;
        private double          cdelt1     = -1.0;
        private double          cdelt2     = 1.0;
        private int             width      = 1;
        private int             height     = 1;
        private EnergyAxis      energyAxis;

        /**
         * Unless set explicitly, the reference pixel is the geometric center of the grid.
         */
        public WcsGeometry build() {
            var x = Double.isNaN(crpix1) ? (width + 1) / 2.0 : crpix1;
            var y = Double.isNaN(crpix2) ? (height + 1) / 2.0 : crpix2;
            return new WcsGeometry(frame, projection, reference, x, y, cdelt1, cdelt2, width, height, energyAxis);
        }

        public Builder withEnergyAxis(EnergyAxis energyAxis) {
            this.energyAxis = energyAxis;
            return this;
        }

        public Builder withFrame(CoordinateFrame frame) {
            this.frame = frame;
            return this;
        }

        public Builder withProjection(Projection projection) {
            this.projection = projection;
            return this;
        }

        public Builder withReference(SkyDirection reference) {
            this.reference = reference;
            return this;
        }

        public Builder withReferencePixel(double crpix1, double crpix2) {
            this.crpix1 = crpix1;
            this.crpix2 = crpix2;
            return this;
        }

        public Builder withScale(double cdelt1, double cdelt2) {
            this.cdelt1 = cdelt1;
            this.cdelt2 = cdelt2;
            return this;
        }

        public Builder withSize(int width, int height) {
            this.width = width;
            this.height = height;
            return this;
        }
    }
}
