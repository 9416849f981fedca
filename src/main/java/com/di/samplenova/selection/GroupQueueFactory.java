package com.di.samplenova.selection;

import com.di.samplenova.allocation.GroupCap;
import com.di.samplenova.grouping.GroupKey;
import com.di.samplenova.util.PoissonSampler;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Random;
import java.util.TreeSet;

/**
 * Creates one {@link BoundedPrioritySelector} per group, sized by the group cap.
 */
@Slf4j
public final class GroupQueueFactory {

    public static final int DEFAULT_MAX_ATTEMPTS = 100;

    private GroupQueueFactory() {}

    /**
     * Creates queues for the given groups, iterated in sorted group order.
     *
     * <p>An exact cap sizes every queue identically. A probabilistic cap draws each queue's size
     * from Poisson(cap); draws follow sorted group order so a fixed seed reproduces the sizes for
     * the same groups. Small means can make every draw zero, in which case all groups are drawn
     * again, up to {@code maxAttempts} times. If every attempt comes up empty the all-zero queues
     * are returned and nothing will be retained.
     *
     * @param groups      observed groups
     * @param cap         per-group cap
     * @param maxAttempts attempts at drawing a non-zero total size
     * @param randomSeed  seed for the Poisson draws, or null for a non-reproducible draw
     * @param <T>         the retained item type
     * @return queues by group, in sorted group order
     */
    public static <T> Map<GroupKey, BoundedPrioritySelector<T>> createQueuesByGroup(
            Collection<GroupKey> groups, GroupCap cap, int maxAttempts, Long randomSeed) {
        if (groups == null || cap == null) {
            throw new IllegalArgumentException("groups and cap are required");
        }
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1, got " + maxAttempts);
        }
        TreeSet<GroupKey> sortedGroups = new TreeSet<>(groups);
        Map<GroupKey, BoundedPrioritySelector<T>> queuesByGroup = new LinkedHashMap<>();

        if (!cap.probabilistic()) {
            int maxSize = cap.exactValue();
            for (GroupKey group : sortedGroups) {
                queuesByGroup.put(group, new BoundedPrioritySelector<>(maxSize));
            }
            return queuesByGroup;
        }

        Random random = randomSeed != null ? new Random(randomSeed) : new Random();
        long totalMaxSize = 0;
        int attempts = 0;
        while (totalMaxSize == 0 && attempts < maxAttempts) {
            totalMaxSize = 0;
            for (GroupKey group : sortedGroups) {
                int maxSize = PoissonSampler.sample(random, cap.sequencesPerGroup());
                queuesByGroup.put(group, new BoundedPrioritySelector<>(maxSize));
                totalMaxSize += maxSize;
            }
            attempts++;
        }
        if (totalMaxSize == 0 && !sortedGroups.isEmpty()) {
            log.warn("All {} groups drew a queue size of zero after {} attempts (mean {}); no sequences will be kept",
                    sortedGroups.size(), attempts, cap.sequencesPerGroup());
        } else {
            log.debug("Drew queue sizes for {} groups in {} attempt(s): total {}", sortedGroups.size(), attempts, totalMaxSize);
        }
        return queuesByGroup;
    }

    public static <T> Map<GroupKey, BoundedPrioritySelector<T>> createQueuesByGroup(
            Collection<GroupKey> groups, GroupCap cap, Long randomSeed) {
        return createQueuesByGroup(groups, cap, DEFAULT_MAX_ATTEMPTS, randomSeed);
    }
}
