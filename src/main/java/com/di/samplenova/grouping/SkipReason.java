package com.di.samplenova.grouping;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Why a record was left out of grouping. The filter name is what the filtering report prints.
 */
public enum SkipReason {

    AMBIGUOUS_YEAR("skip_group_by_with_ambiguous_year"),
    AMBIGUOUS_MONTH("skip_group_by_with_ambiguous_month"),
    AMBIGUOUS_DAY("skip_group_by_with_ambiguous_day");

    private final String filterName;

    SkipReason(String filterName) {
        this.filterName = filterName;
    }

    @JsonValue
    public String getFilterName() {
        return filterName;
    }

    @Override
    public String toString() {
        return filterName;
    }
}
