package com.di.samplenova.grouping;

import java.util.Comparator;

/**
 * Generated 'week' group value: ISO week-based year paired with the ISO week number.
 * The ISO year differs from the calendar year around new year, e.g. 2020-12-31 is (2020, 53)
 * and 2021-01-03 is still (2020, 53).
 */
public record IsoWeekGroup(int isoYear, int week) implements Comparable<IsoWeekGroup> {

    private static final Comparator<IsoWeekGroup> ORDER = Comparator
            .comparingInt(IsoWeekGroup::isoYear)
            .thenComparingInt(IsoWeekGroup::week);

    @Override
    public int compareTo(IsoWeekGroup other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return "(" + isoYear + ", " + week + ")";
    }
}
