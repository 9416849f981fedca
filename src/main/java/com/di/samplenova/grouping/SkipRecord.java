package com.di.samplenova.grouping;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * A record excluded from grouping, in the shape of a filtering report row.
 * {@code kwargs} is always empty here; other report rows use it for filter arguments.
 */
@JsonPropertyOrder({"strain", "filter", "kwargs"})
public record SkipRecord(
        @JsonProperty("strain") String strain,
        @JsonProperty("filter") SkipReason reason,
        @JsonProperty("kwargs") String kwargs
) {
    public static SkipRecord of(String strain, SkipReason reason) {
        return new SkipRecord(strain, reason, "");
    }
}
