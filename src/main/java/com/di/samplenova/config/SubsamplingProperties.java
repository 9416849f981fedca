package com.di.samplenova.config;

import com.di.samplenova.selection.GroupQueueFactory;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Defaults for subsampling runs. A request overrides any value it sets.
 *
 * <pre>
 * samplenova:
 *   subsampling:
 *     group-by: region,year
 *     max-sequences: 500
 *     probabilistic-sampling: true
 *     random-seed: 314159
 *     max-queue-attempts: 100
 * </pre>
 */
@Data
@ConfigurationProperties(prefix = "samplenova.subsampling")
public class SubsamplingProperties {

    /** Group-by columns, in key order. Empty = a single group. */
    private List<String> groupBy = new ArrayList<>();

    /** Total budget across all groups. Mutually exclusive with {@link #sequencesPerGroup}. */
    private Integer maxSequences;

    /** Fixed cap for every group. Mutually exclusive with {@link #maxSequences}. */
    private Integer sequencesPerGroup;

    /** Allow a fractional Poisson cap when there are more groups than {@link #maxSequences}. */
    private boolean probabilisticSampling = true;

    /** Seed for queue-size draws and default priorities. Null = not reproducible. */
    private Long randomSeed;

    /** Attempts at drawing probabilistic queue sizes that are not all zero. */
    private int maxQueueAttempts = GroupQueueFactory.DEFAULT_MAX_ATTEMPTS;
}
