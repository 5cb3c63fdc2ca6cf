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

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class IntArrayListTest {

    @Test
    void testGrowAndSort() {
        var list = new IntArrayList();
        for (int i = 100; i > 0; i--) {
            list.add(i);
        }
        list.sort();
        var array = list.toArray();
        assertEquals(100, array.length);
        for (int i = 0; i < array.length; i++) {
            assertEquals(i + 1, array[i]);
        }
    }

    @Test
    void testEmpty() {
        var list = new IntArrayList();
        list.sort();
        assertArrayEquals(new int[0], list.toArray());
    }

    @Test
    void testToArrayIsACopy() {
        var list = new IntArrayList();
        list.add(3);
        var first = list.toArray();
        first[0] = 9;
        list.add(1);
        list.sort();
        assertArrayEquals(new int[] { 1, 3 }, list.toArray());
    }
}
