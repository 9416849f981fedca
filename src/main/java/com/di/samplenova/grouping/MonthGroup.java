package com.di.samplenova.grouping;

import java.util.Comparator;

/**
 * Generated 'month' group value: the calendar year paired with the month number.
 */
public record MonthGroup(int year, int month) implements Comparable<MonthGroup> {

    private static final Comparator<MonthGroup> ORDER = Comparator
            .comparingInt(MonthGroup::year)
            .thenComparingInt(MonthGroup::month);

    @Override
    public int compareTo(MonthGroup other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return "(" + year + ", " + month + ")";
    }
}
