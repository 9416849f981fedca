package com.di.samplenova.service;

import com.di.samplenova.allocation.GroupCap;
import com.di.samplenova.allocation.GroupSizeAllocator;
import com.di.samplenova.config.SubsamplingProperties;
import com.di.samplenova.exception.InvalidSchemeException;
import com.di.samplenova.grouping.GroupKey;
import com.di.samplenova.grouping.GroupKeyResolver;
import com.di.samplenova.grouping.GroupingResult;
import com.di.samplenova.grouping.SampleRecord;
import com.di.samplenova.scheme.SampleDefinition;
import com.di.samplenova.scheme.SubsamplingScheme;
import com.di.samplenova.selection.BoundedPrioritySelector;
import com.di.samplenova.selection.GroupQueueFactory;
import com.di.samplenova.util.DiagnosticSink;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

/**
 * Subsamples an in-memory record set: groups the records, caps each group, and keeps the
 * highest-priority records of every group.
 */
@Slf4j
@Service
public class SubsampleService {

    private final SubsamplingProperties properties;
    private final DiagnosticSink diagnostics;
    private final GroupKeyResolver groupKeyResolver;

    @Autowired
    public SubsampleService(SubsamplingProperties properties) {
        this(properties, DiagnosticSink.logging(log));
    }

    public SubsampleService(SubsamplingProperties properties, DiagnosticSink diagnostics) {
        this.properties = properties;
        this.diagnostics = diagnostics;
        this.groupKeyResolver = new GroupKeyResolver(diagnostics);
    }

    /**
     * Runs one subsampling.
     *
     * @throws InvalidSchemeException when both or neither of sequences-per-group and max-sequences are set
     * @throws com.di.samplenova.exception.GroupByException when the group-by columns cannot be resolved
     * @throws com.di.samplenova.exception.TooManyGroupsException when the budget cannot cover the groups
     *         and probabilistic sampling is disabled
     */
    public SubsampleResult subsample(SubsampleRequest request) {
        if (request == null || request.getRecords() == null) {
            throw new IllegalArgumentException("A request with records is required");
        }
        long startTime = System.currentTimeMillis();
        try {
            List<String> groupBy = request.getGroupBy() != null ? request.getGroupBy() : properties.getGroupBy();
            boolean requestSetsSize = request.getSequencesPerGroup() != null || request.getMaxSequences() != null;
            Integer sequencesPerGroup = requestSetsSize ? request.getSequencesPerGroup() : properties.getSequencesPerGroup();
            Integer maxSequences = requestSetsSize ? request.getMaxSequences() : properties.getMaxSequences();
            boolean allowProbabilistic = request.getProbabilisticSampling() != null
                    ? request.getProbabilisticSampling() : properties.isProbabilisticSampling();
            Long randomSeed = request.getRandomSeed() != null ? request.getRandomSeed() : properties.getRandomSeed();
            validateSizing(sequencesPerGroup, maxSequences);

            GroupingResult grouping = groupKeyResolver.resolve(request.getRecords(), groupBy);
            Map<GroupKey, Integer> countsPerGroup = grouping.countsPerGroup();

            GroupCap cap = sequencesPerGroup != null
                    ? GroupCap.exact(sequencesPerGroup)
                    : GroupSizeAllocator.calculateSequencesPerGroup(
                            maxSequences, countsPerGroup.values(), allowProbabilistic, diagnostics);

            Map<GroupKey, BoundedPrioritySelector<String>> queuesByGroup = GroupQueueFactory.createQueuesByGroup(
                    countsPerGroup.keySet(), cap, properties.getMaxQueueAttempts(), randomSeed);

            Map<String, Double> priorities = request.getPriorities() != null ? request.getPriorities() : Map.of();
            Random priorityRandom = randomSeed != null ? new Random(randomSeed) : new Random();
            for (SampleRecord record : request.getRecords()) {
                GroupKey group = grouping.groupByStrain().get(record.strain());
                if (group == null) {
                    continue;
                }
                Double priority = priorities.get(record.strain());
                queuesByGroup.get(group).offer(record.strain(),
                        priority != null ? priority : priorityRandom.nextDouble());
            }

            Map<GroupKey, List<String>> retainedByGroup = new LinkedHashMap<>();
            Map<GroupKey, Integer> queueSizes = new LinkedHashMap<>();
            Set<String> retained = new HashSet<>();
            queuesByGroup.forEach((group, queue) -> {
                List<String> items = List.copyOf(queue.items());
                retainedByGroup.put(group, items);
                queueSizes.put(group, queue.maxSize());
                retained.addAll(items);
            });
            Set<String> retainedStrains = new LinkedHashSet<>();
            for (SampleRecord record : request.getRecords()) {
                if (retained.contains(record.strain())) {
                    retainedStrains.add(record.strain());
                }
            }

            log.info("Subsampled {} of {} strains across {} groups (cap {}{}, {} skipped) in {} ms",
                    retainedStrains.size(), request.getRecords().size(), countsPerGroup.size(),
                    cap.sequencesPerGroup(), cap.probabilistic() ? ", probabilistic" : "",
                    grouping.skippedStrains().size(), System.currentTimeMillis() - startTime);

            return SubsampleResult.builder()
                    .groupByStrain(grouping.groupByStrain())
                    .retainedByGroup(retainedByGroup)
                    .retainedStrains(retainedStrains)
                    .skippedStrains(grouping.skippedStrains())
                    .groupCap(cap)
                    .queueSizes(queueSizes)
                    .build();
        } catch (RuntimeException e) {
            log.error("Subsampling failed: {}", e.getMessage());
            throw e;
        }
    }

    /**
     * Runs every sample of a weighted scheme against the same records and combines what they keep.
     *
     * @param records    records shared by all samples
     * @param scheme     the scheme; each sample's maximum is (re)computed from the weights
     * @param priorities priority per strain, may be null
     * @param randomSeed run-level seed overriding the samples' own seeds, may be null
     */
    public SchemeResult subsampleScheme(List<SampleRecord> records, SubsamplingScheme scheme,
                                        Map<String, Double> priorities, Long randomSeed) {
        if (scheme == null) {
            throw new IllegalArgumentException("scheme cannot be null");
        }
        List<SampleDefinition> samples = scheme.computeMaxSequences();
        Map<String, SubsampleResult> resultsBySample = new LinkedHashMap<>();
        Set<String> retained = new HashSet<>();

        for (SampleDefinition sample : samples) {
            log.info("Sampling for '{}' (group-by {}, max {} sequences)",
                    sample.getName(), sample.getGroupBy(), sample.getMaxSequences());
            SubsampleResult result = subsample(SubsampleRequest.builder()
                    .records(records)
                    .groupBy(sample.getGroupBy() != null ? sample.getGroupBy() : List.of())
                    .maxSequences(sample.getMaxSequences())
                    .priorities(priorities)
                    .probabilisticSampling(!sample.isDisableProbabilisticSampling())
                    .randomSeed(randomSeed != null ? randomSeed : sample.getRandomSeed())
                    .build());
            resultsBySample.put(sample.getName(), result);
            retained.addAll(result.getRetainedStrains());
        }

        Set<String> retainedStrains = new LinkedHashSet<>();
        for (SampleRecord record : records) {
            if (retained.contains(record.strain())) {
                retainedStrains.add(record.strain());
            }
        }
        log.info("Scheme kept {} of {} strains across {} samples (size {})",
                retainedStrains.size(), records.size(), samples.size(), scheme.getSize());
        return SchemeResult.builder()
                .resultsBySample(resultsBySample)
                .retainedStrains(retainedStrains)
                .build();
    }

    private static void validateSizing(Integer sequencesPerGroup, Integer maxSequences) {
        if (sequencesPerGroup != null && maxSequences != null) {
            throw new InvalidSchemeException("Specify either sequences per group or maximum sequences, not both.");
        }
        if (sequencesPerGroup == null && maxSequences == null) {
            throw new InvalidSchemeException("You must specify a number of sequences per group or maximum sequences to subsample.");
        }
        if (sequencesPerGroup != null && sequencesPerGroup < 0) {
            throw new InvalidSchemeException("Sequences per group cannot be negative, got " + sequencesPerGroup);
        }
        if (maxSequences != null && maxSequences < 0) {
            throw new InvalidSchemeException("Maximum sequences cannot be negative, got " + maxSequences);
        }
    }
}
