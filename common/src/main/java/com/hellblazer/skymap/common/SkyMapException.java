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
 * Root of the failures raised by sky-map geometry operations. All subclasses are raised synchronously by the call
 * that detects the violation and are never retried internally.
 *
 * @author hal.hildebrand
 */
public class SkyMapException extends RuntimeException {

    public SkyMapException(String message) {
        super(message);
    }

    public SkyMapException(String message, Throwable cause) {
        super(message, cause);
    }
}
