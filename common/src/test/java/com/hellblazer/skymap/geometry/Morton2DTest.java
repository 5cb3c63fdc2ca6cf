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

import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.constraints.LongRange;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class Morton2DTest {

    @Test
    void testBitLayout() {
        assertEquals(0L, Morton2D.encode(0, 0));
        assertEquals(1L, Morton2D.encode(1, 0));
        assertEquals(2L, Morton2D.encode(0, 1));
        assertEquals(3L, Morton2D.encode(1, 1));
        assertEquals(0b1100L, Morton2D.encode(2, 2));
        assertEquals(0b11011L, Morton2D.encode(5, 3));
    }

    @Test
    void testDeepestLevel() {
        long max = (1L << 29) - 1;
        var code = Morton2D.encode(max, 0);
        assertEquals(max, Morton2D.decodeX(code));
        assertEquals(0L, Morton2D.decodeY(code));
        code = Morton2D.encode(max, max);
        assertEquals((1L << 58) - 1, code);
        assertEquals(max, Morton2D.decodeY(code));
    }

    @Property
    void roundTrip(@ForAll @LongRange(min = 0, max = (1L << 29) - 1) long x,
                   @ForAll @LongRange(min = 0, max = (1L << 29) - 1) long y) {
        var code = Morton2D.encode(x, y);
        assertEquals(x, Morton2D.decodeX(code));
        assertEquals(y, Morton2D.decodeY(code));
    }

    @Property
    void preservesQuadrantOrder(@ForAll @LongRange(min = 0, max = (1L << 20) - 1) long x,
                                @ForAll @LongRange(min = 0, max = (1L << 20) - 1) long y) {
        // children of a cell occupy four consecutive codes
        var parent = Morton2D.encode(x, y);
        for (int q = 0; q < 4; q++) {
            assertEquals(4 * parent + q, Morton2D.encode(2 * x + (q & 1), 2 * y + (q >> 1)));
        }
    }
}
