package com.di.samplenova.grouping;

import com.di.samplenova.exception.GroupByException;
import com.di.samplenova.util.DateParts;
import com.di.samplenova.util.DiagnosticSink;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Assigns every record to a group for subsampling.
 *
 * <p>Group-by columns are either metadata columns, read verbatim, or one of the generated
 * categories 'year', 'month' and 'week', derived from the record's 'date'. Records whose date is
 * too coarse for a requested generated category are skipped and reported instead of grouped.
 *
 * <p>Invalid configurations throw {@link GroupByException}. Recoverable ones (unknown columns,
 * 'year' together with 'week', a metadata column shadowed by a generated one, no 'date' column)
 * are reported to the {@link DiagnosticSink} and grouping continues.
 */
@Slf4j
public class GroupKeyResolver {

    public static final String DATE_COLUMN = "date";
    public static final String UNKNOWN_VALUE = "unknown";

    private final DiagnosticSink diagnostics;

    public GroupKeyResolver() {
        this(DiagnosticSink.logging(log));
    }

    public GroupKeyResolver(DiagnosticSink diagnostics) {
        this.diagnostics = diagnostics;
    }

    /**
     * Resolves the group of each record.
     *
     * @param records records to group, in input order
     * @param groupBy group-by columns in key order; null or empty groups everything together
     * @return group per grouped strain plus the skipped strains
     * @throws GroupByException when the requested columns cannot be resolved
     */
    public GroupingResult resolve(Collection<SampleRecord> records, List<String> groupBy) {
        if (records == null) {
            throw new IllegalArgumentException("records cannot be null");
        }
        Map<String, GroupKey> groupByStrain = new LinkedHashMap<>();
        List<SkipRecord> skippedStrains = new ArrayList<>();

        if (records.isEmpty()) {
            return new GroupingResult(groupByStrain, skippedStrains);
        }

        if (groupBy == null || groupBy.isEmpty() || groupBy.equals(List.of(GroupKey.DUMMY_VALUE))) {
            for (SampleRecord record : records) {
                groupByStrain.put(record.strain(), GroupKey.DUMMY);
            }
            return new GroupingResult(groupByStrain, skippedStrains);
        }

        List<String> groupColumns = new ArrayList<>(groupBy);
        Set<String> groupBySet = new LinkedHashSet<>(groupColumns);
        EnumSet<GeneratedColumn> generatedRequested = GeneratedColumn.requestedIn(groupBySet);
        Set<String> columns = collectColumns(records);

        if (!columns.contains(DATE_COLUMN) && GeneratedColumn.NAMES.containsAll(groupBySet)) {
            throw new GroupByException("The specified group-by categories (" + groupBy + ") were not found. "
                    + "Note that using any of " + GeneratedColumn.NAMES + " requires a column called 'date'.");
        }
        if (groupBySet.stream().noneMatch(c -> columns.contains(c) || GeneratedColumn.isGenerated(c))) {
            throw new GroupByException("The specified group-by categories (" + groupBy + ") were not found.");
        }

        if (generatedRequested.contains(GeneratedColumn.WEEK)) {
            if (generatedRequested.contains(GeneratedColumn.YEAR)) {
                diagnostics.warn("'year' grouping will be ignored since 'week' includes ISO year.");
                groupColumns.remove(GeneratedColumn.YEAR.columnName());
                groupBySet.remove(GeneratedColumn.YEAR.columnName());
                generatedRequested.remove(GeneratedColumn.YEAR);
            }
            if (generatedRequested.contains(GeneratedColumn.MONTH)) {
                throw new GroupByException("'month' and 'week' grouping cannot be used together.");
            }
        }

        Set<String> availableColumns = new HashSet<>(columns);
        Map<String, DateParts> datesByStrain = null;

        if (!generatedRequested.isEmpty()) {
            for (GeneratedColumn generated : GeneratedColumn.sortedByName(generatedRequested)) {
                String name = generated.columnName();
                if (columns.contains(name)) {
                    diagnostics.warn("`--group-by " + name + "` uses a generated " + name + " value from the 'date' column. "
                            + "The custom '" + name + "' column in the metadata is ignored for grouping purposes.");
                }
            }

            if (!columns.contains(DATE_COLUMN)) {
                diagnostics.warn("A 'date' column could not be found to group-by "
                        + GeneratedColumn.sortedByName(generatedRequested).stream()
                                .map(GeneratedColumn::columnName)
                                .collect(Collectors.toList())
                        + ". Filtering by group may behave differently than expected!");
                availableColumns.addAll(GeneratedColumn.NAMES);
            } else {
                // The date only feeds the generated columns; it is not a group value itself.
                availableColumns.remove(DATE_COLUMN);
                availableColumns.addAll(generatedRequested.stream()
                        .map(GeneratedColumn::columnName)
                        .collect(Collectors.toList()));

                datesByStrain = new LinkedHashMap<>();
                for (SampleRecord record : records) {
                    datesByStrain.put(record.strain(), DateParts.parse(record.attribute(DATE_COLUMN)));
                }

                List<SkipRecord> ambiguous = findAmbiguousDates(datesByStrain, generatedRequested);
                skippedStrains.addAll(ambiguous);
                for (SkipRecord skip : ambiguous) {
                    datesByStrain.remove(skip.strain());
                }
                if (datesByStrain.isEmpty()) {
                    return new GroupingResult(groupByStrain, skippedStrains);
                }
            }
        }

        Set<String> unknownGroups = new LinkedHashSet<>(groupBySet);
        unknownGroups.removeAll(availableColumns);
        if (!unknownGroups.isEmpty()) {
            diagnostics.warn("Some of the specified group-by categories couldn't be found: "
                    + String.join(", ", unknownGroups)
                    + ". Filtering by group may behave differently than expected!");
        }

        for (SampleRecord record : records) {
            DateParts date = null;
            if (datesByStrain != null) {
                date = datesByStrain.get(record.strain());
                if (date == null) {
                    continue;
                }
            }
            List<Object> values = new ArrayList<>(groupColumns.size());
            for (String column : groupColumns) {
                values.add(resolveValue(record, column, date, generatedRequested, unknownGroups));
            }
            groupByStrain.put(record.strain(), GroupKey.of(values));
        }

        log.debug("Resolved {} groups for {} strains ({} skipped) using group-by {}",
                groupByStrain.values().stream().distinct().count(), groupByStrain.size(),
                skippedStrains.size(), groupColumns);
        return new GroupingResult(groupByStrain, skippedStrains);
    }

    private static Object resolveValue(SampleRecord record, String column, DateParts date,
                                       Set<GeneratedColumn> generatedRequested, Set<String> unknownGroups) {
        if (GeneratedColumn.isGenerated(column) && generatedRequested.contains(GeneratedColumn.fromColumnName(column))) {
            if (date == null) {
                return UNKNOWN_VALUE;
            }
            switch (GeneratedColumn.fromColumnName(column)) {
                case YEAR:
                    return date.year();
                case MONTH:
                    return new MonthGroup(date.year(), date.month());
                case WEEK:
                    return new IsoWeekGroup(date.isoWeekYear(), date.isoWeek());
                default:
                    throw new IllegalStateException("Unhandled generated column: " + column);
            }
        }
        if (unknownGroups.contains(column)) {
            return UNKNOWN_VALUE;
        }
        return record.attribute(column);
    }

    /**
     * Finds records whose date cannot produce the requested generated columns, checking years,
     * then months, then days. Each pass lists its records in input order.
     */
    private static List<SkipRecord> findAmbiguousDates(Map<String, DateParts> datesByStrain,
                                                       Set<GeneratedColumn> generatedRequested) {
        List<SkipRecord> skipped = new ArrayList<>();
        Set<String> alreadySkipped = new HashSet<>();

        if (!generatedRequested.isEmpty()) {
            for (Map.Entry<String, DateParts> entry : datesByStrain.entrySet()) {
                if (entry.getValue().year() == null) {
                    skipped.add(SkipRecord.of(entry.getKey(), SkipReason.AMBIGUOUS_YEAR));
                    alreadySkipped.add(entry.getKey());
                }
            }
        }
        if (generatedRequested.contains(GeneratedColumn.MONTH) || generatedRequested.contains(GeneratedColumn.WEEK)) {
            for (Map.Entry<String, DateParts> entry : datesByStrain.entrySet()) {
                if (entry.getValue().month() == null && alreadySkipped.add(entry.getKey())) {
                    skipped.add(SkipRecord.of(entry.getKey(), SkipReason.AMBIGUOUS_MONTH));
                }
            }
        }
        if (generatedRequested.contains(GeneratedColumn.WEEK)) {
            for (Map.Entry<String, DateParts> entry : datesByStrain.entrySet()) {
                if (entry.getValue().toLocalDate() == null && !alreadySkipped.contains(entry.getKey())) {
                    skipped.add(SkipRecord.of(entry.getKey(), SkipReason.AMBIGUOUS_DAY));
                }
            }
            // Day skips are not added to alreadySkipped; a later check would report them again.
        }
        return skipped;
    }

    private static Set<String> collectColumns(Collection<SampleRecord> records) {
        Set<String> columns = new HashSet<>();
        for (SampleRecord record : records) {
            columns.addAll(record.attributes().keySet());
        }
        return columns;
    }
}
