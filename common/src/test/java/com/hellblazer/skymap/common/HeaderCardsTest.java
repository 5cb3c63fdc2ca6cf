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

import java.util.List;
import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class HeaderCardsTest {

    @Test
    void testTypedAccess() {
        var cards = new HeaderCards().put("nside", 64).put("ORDERING", " RING ").put("CRVAL1", "12.5");
        assertEquals(64, cards.getInt("NSIDE"));
        assertEquals("RING", cards.getString("ordering"));
        assertEquals(12.5, cards.getDouble("CRVAL1"));
        assertTrue(cards.optionalString("HPX_REG").isEmpty());
    }

    @Test
    void testKeysIgnoreDefaultLocale() {
        var saved = Locale.getDefault();
        try {
            Locale.setDefault(Locale.forLanguageTag("tr-TR"));
            var cards = new HeaderCards().put("ordering", "RING").put("pixtype", "HEALPIX");
            assertTrue(cards.asMap().containsKey("ORDERING"));
            assertEquals("HEALPIX", cards.getString("PIXTYPE"));
        } finally {
            Locale.setDefault(saved);
        }
    }

    @Test
    void testMissingAndMalformed() {
        var cards = new HeaderCards().put("ORDER", "six");
        assertThrows(ConfigurationException.class, () -> cards.getInt("ORDER"));
        var e = assertThrows(ConfigurationException.class, () -> cards.getString("NSIDE"));
        assertTrue(e.getMessage().contains("NSIDE"));
    }

    @Test
    void testInsertionOrderPreserved() {
        var cards = new HeaderCards().put("B", 1).put("A", 2).put("C", 3);
        assertEquals(List.of("B", "A", "C"), List.copyOf(cards.asMap().keySet()));
    }
}
