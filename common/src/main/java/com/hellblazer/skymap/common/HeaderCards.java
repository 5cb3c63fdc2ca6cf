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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Ordered set of FITS-style header cards. Only the handful of keywords needed to reconstruct geometry are ever read;
 * the card set itself places no restriction on keys. Keys are upper-cased on insertion, as FITS keywords are
 * case-insensitive.
 *
 * @author hal.hildebrand
 */
public final class HeaderCards {

    private final Map<String, Object> cards = new LinkedHashMap<>();

    public HeaderCards() {
    }

    public HeaderCards(Map<String, ?> initial) {
        initial.forEach(this::put);
    }

    public Map<String, Object> asMap() {
        return Collections.unmodifiableMap(cards);
    }

    public boolean contains(String key) {
        return cards.containsKey(normalize(key));
    }

    public double getDouble(String key) {
        var value = require(key);
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        try {
            return Double.parseDouble(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Header card " + key + " is not numeric: " + value, e);
        }
    }

    public int getInt(String key) {
        var value = require(key);
        if (value instanceof Number n) {
            return n.intValue();
        }
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Header card " + key + " is not an integer: " + value, e);
        }
    }

    public String getString(String key) {
        return require(key).toString().trim();
    }

    public Optional<String> optionalString(String key) {
        return Optional.ofNullable(cards.get(normalize(key))).map(v -> v.toString().trim());
    }

    public HeaderCards put(String key, Object value) {
        Objects.requireNonNull(value, "Header card value cannot be null: " + key);
        cards.put(normalize(key), value);
        return this;
    }

    public HeaderCards putAll(HeaderCards other) {
        cards.putAll(other.cards);
        return this;
    }

    public int size() {
        return cards.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof HeaderCards other && cards.equals(other.cards);
    }

    @Override
    public int hashCode() {
        return cards.hashCode();
    }

    @Override
    public String toString() {
        var sb = new StringBuilder();
        cards.forEach((k, v) -> sb.append(String.format("%-8s= %s%n", k, v)));
        return sb.toString();
    }

    private static String normalize(String key) {
        Objects.requireNonNull(key, "Header card key cannot be null");
        return key.trim().toUpperCase(Locale.ROOT);
    }

    private Object require(String key) {
        var value = cards.get(normalize(key));
        if (value == null) {
            throw new ConfigurationException("Missing header card: " + normalize(key));
        }
        return value;
    }
}
