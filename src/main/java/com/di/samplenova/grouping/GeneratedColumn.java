package com.di.samplenova.grouping;

import java.util.Arrays;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Group-by categories computed from the 'date' column instead of being read from metadata.
 */
public enum GeneratedColumn {

    YEAR("year"),
    MONTH("month"),
    WEEK("week");

    /** Column names of all generated categories, sorted. */
    public static final Set<String> NAMES = Arrays.stream(values())
            .map(GeneratedColumn::columnName)
            .collect(Collectors.toCollection(TreeSet::new));

    private final String columnName;

    GeneratedColumn(String columnName) {
        this.columnName = columnName;
    }

    public String columnName() {
        return columnName;
    }

    public static boolean isGenerated(String column) {
        return NAMES.contains(column);
    }

    public static GeneratedColumn fromColumnName(String column) {
        for (GeneratedColumn generated : values()) {
            if (generated.columnName.equals(column)) {
                return generated;
            }
        }
        throw new IllegalArgumentException("Not a generated group-by column: " + column);
    }

    /**
     * Generated categories among the requested columns.
     */
    public static EnumSet<GeneratedColumn> requestedIn(Collection<String> columns) {
        EnumSet<GeneratedColumn> requested = EnumSet.noneOf(GeneratedColumn.class);
        for (String column : columns) {
            if (isGenerated(column)) {
                requested.add(fromColumnName(column));
            }
        }
        return requested;
    }

    /**
     * The given categories ordered by column name.
     */
    public static List<GeneratedColumn> sortedByName(Collection<GeneratedColumn> columns) {
        return columns.stream()
                .sorted(Comparator.comparing(GeneratedColumn::columnName))
                .collect(Collectors.toList());
    }
}
