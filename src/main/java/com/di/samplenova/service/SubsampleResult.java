package com.di.samplenova.service;

import com.di.samplenova.allocation.GroupCap;
import com.di.samplenova.grouping.GroupKey;
import com.di.samplenova.grouping.SkipRecord;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Outcome of a subsampling run.
 */
@Value
@Builder
public class SubsampleResult {
    /** Group of every grouped strain. */
    Map<String, GroupKey> groupByStrain;
    /** Strains kept per group, groups in sorted order. */
    Map<GroupKey, List<String>> retainedByGroup;
    /** Union of all kept strains, in input order. */
    Set<String> retainedStrains;
    List<SkipRecord> skippedStrains;
    GroupCap groupCap;
    /** Realized queue size per group (differs between groups only for probabilistic caps). */
    Map<GroupKey, Integer> queueSizes;

    public boolean isProbabilisticUsed() {
        return groupCap != null && groupCap.probabilistic();
    }
}
