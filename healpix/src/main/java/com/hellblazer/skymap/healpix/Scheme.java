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

import java.util.Locale;

/**
 * HEALPix pixel numbering schemes.
 *
 * @author hal.hildebrand
 */
public enum Scheme {
    RING, NESTED;

    /**
     * Parse a header ORDERING value.
     *
     * @throws ConfigurationException if the value is neither RING nor NESTED
     */
    public static Scheme parse(String ordering) {
        if (ordering != null) {
            var value = ordering.trim().toUpperCase(Locale.ROOT);
            if (value.equals("RING")) {
                return RING;
            }
            if (value.equals("NESTED") || value.equals("NEST")) {
                return NESTED;
            }
        }
        throw new ConfigurationException("ORDERING must be RING or NESTED: " + ordering);
    }

    public static Scheme of(boolean nested) {
        return nested ? NESTED : RING;
    }

    public boolean isNested() {
        return this == NESTED;
    }
}
