package com.di.samplenova.grouping;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One metadata row: the strain identifier plus its column values. Absent columns are missing keys;
 * a present key may still map to null when the source cell was empty.
 */
public record SampleRecord(String strain, Map<String, String> attributes) {

    public SampleRecord {
        Objects.requireNonNull(strain, "strain cannot be null");
        attributes = attributes == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public static SampleRecord of(String strain, Map<String, String> attributes) {
        return new SampleRecord(strain, attributes);
    }

    public String attribute(String column) {
        return attributes.get(column);
    }

    public boolean hasColumn(String column) {
        return attributes.containsKey(column);
    }
}
