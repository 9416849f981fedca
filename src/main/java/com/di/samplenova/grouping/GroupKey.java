package com.di.samplenova.grouping;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Ordered tuple of group values, one per group-by column. Values are strings for metadata columns,
 * {@link Integer} for 'year', {@link MonthGroup} for 'month' and {@link IsoWeekGroup} for 'week'.
 * Metadata values may be null when a record has an empty cell.
 *
 * <p>Keys sort element by element so that groups can be visited in a fixed order.
 */
public final class GroupKey implements Comparable<GroupKey> {

    public static final String DUMMY_VALUE = "_dummy";

    /** Single group used when no group-by columns are configured. */
    public static final GroupKey DUMMY = GroupKey.of(DUMMY_VALUE);

    private final List<Object> values;

    private GroupKey(List<Object> values) {
        this.values = Collections.unmodifiableList(new ArrayList<>(values));
    }

    public static GroupKey of(Object... values) {
        List<Object> list = new ArrayList<>(values.length);
        Collections.addAll(list, values);
        return new GroupKey(list);
    }

    public static GroupKey of(List<?> values) {
        return new GroupKey(new ArrayList<>(values));
    }

    public List<Object> values() {
        return values;
    }

    public int size() {
        return values.size();
    }

    public Object get(int index) {
        return values.get(index);
    }

    @Override
    public int compareTo(GroupKey other) {
        int common = Math.min(values.size(), other.values.size());
        for (int i = 0; i < common; i++) {
            int cmp = compareValues(values.get(i), other.values.get(i));
            if (cmp != 0) {
                return cmp;
            }
        }
        return Integer.compare(values.size(), other.values.size());
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    private static int compareValues(Object left, Object right) {
        if (left == right) {
            return 0;
        }
        if (left == null) {
            return -1;
        }
        if (right == null) {
            return 1;
        }
        if (left.getClass() == right.getClass() && left instanceof Comparable) {
            return ((Comparable) left).compareTo(right);
        }
        // Mixed types only occur for "unknown" placeholders; order by type name, then text.
        int byType = left.getClass().getName().compareTo(right.getClass().getName());
        return byType != 0 ? byType : left.toString().compareTo(right.toString());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof GroupKey)) return false;
        return values.equals(((GroupKey) o).values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(values);
    }

    @Override
    public String toString() {
        return values.stream()
                .map(String::valueOf)
                .collect(Collectors.joining(", ", "(", ")"));
    }
}
