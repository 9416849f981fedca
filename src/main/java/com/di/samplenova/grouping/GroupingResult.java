package com.di.samplenova.grouping;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Output of {@link GroupKeyResolver#resolve}: the group of every grouped strain (in input order)
 * and the strains skipped for ambiguous dates.
 */
public record GroupingResult(Map<String, GroupKey> groupByStrain, List<SkipRecord> skippedStrains) {

    public GroupingResult {
        groupByStrain = Collections.unmodifiableMap(groupByStrain);
        skippedStrains = List.copyOf(skippedStrains);
    }

    /**
     * Number of grouped strains per group, iterated in sorted group order.
     */
    public Map<GroupKey, Integer> countsPerGroup() {
        Map<GroupKey, Integer> counts = new TreeMap<>();
        for (GroupKey key : groupByStrain.values()) {
            counts.merge(key, 1, Integer::sum);
        }
        return counts;
    }
}
