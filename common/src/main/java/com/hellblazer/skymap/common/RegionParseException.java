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
package com.hellblazer.skymap.common;

/**
 * A region descriptor that could not be parsed. The offending descriptor text is carried with the exception.
 *
 * @author hal.hildebrand
 */
public class RegionParseException extends SkyMapException {

    private final String descriptor;

    public RegionParseException(String descriptor, String reason) {
        super("Malformed region descriptor '" + descriptor + "': " + reason);
        this.descriptor = descriptor;
    }

    public RegionParseException(String descriptor, String reason, Throwable cause) {
        super("Malformed region descriptor '" + descriptor + "': " + reason, cause);
        this.descriptor = descriptor;
    }

    public String getDescriptor() {
        return descriptor;
    }
}
