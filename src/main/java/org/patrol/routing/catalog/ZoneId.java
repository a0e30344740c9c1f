package org.patrol.routing.catalog;

import java.util.Objects;

/**
 * Administrative zone identifier.
 */
public record ZoneId(String value) {

    public ZoneId {
        Objects.requireNonNull(value, "value");
        value = value.trim();
        if (value.isEmpty()) {
            throw new IllegalArgumentException("zone id must be non-blank");
        }
    }

    public static ZoneId of(String value) {
        return new ZoneId(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
