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
package com.hellblazer.skymap.geometry;

import com.hellblazer.skymap.common.ConfigurationException;

/**
 * The sky coordinate systems a map may be defined in.
 *
 * @author hal.hildebrand
 */
public enum CoordinateFrame {
    CELESTIAL("CEL", "RA--", "DEC-"), GALACTIC("GAL", "GLON", "GLAT");

    private final String code;
    private final String lonAxis;
    private final String latAxis;

    CoordinateFrame(String code, String lonAxis, String latAxis) {
        this.code = code;
        this.lonAxis = lonAxis;
        this.latAxis = latAxis;
    }

    /**
     * Resolve a header COORDSYS code.
     *
     * @throws ConfigurationException if the code is neither CEL nor GAL
     */
    public static CoordinateFrame fromCode(String code) {
        if (code != null) {
            for (var frame : values()) {
                if (frame.code.equalsIgnoreCase(code.trim())) {
                    return frame;
                }
            }
        }
        throw new ConfigurationException("Unsupported coordinate system: " + code);
    }

    /**
     * Resolve the frame from a WCS axis type such as {@code GLON-CAR} or {@code RA---TAN}.
     */
    public static CoordinateFrame fromAxisType(String ctype) {
        if (ctype != null) {
            for (var frame : values()) {
                if (ctype.startsWith(frame.lonAxis) || ctype.startsWith(frame.latAxis)) {
                    return frame;
                }
            }
        }
        throw new ConfigurationException("Unsupported celestial axis type: " + ctype);
    }

    public String code() {
        return code;
    }

    /**
     * Eight character WCS axis type for the given projection, e.g. {@code RA---CAR}.
     */
    public String latitudeAxisType(String projection) {
        return pad(latAxis, projection);
    }

    public String longitudeAxisType(String projection) {
        return pad(lonAxis, projection);
    }

    private static String pad(String axis, String projection) {
        var sb = new StringBuilder(axis);
        while (sb.length() < 5) {
            sb.append('-');
        }
        return sb.append(projection).toString();
    }
}
