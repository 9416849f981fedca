package com.di.samplenova.allocation;

import com.di.samplenova.exception.TooManyGroupsException;
import com.di.samplenova.util.DiagnosticSink;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;

/**
 * Splits a total sequence budget into a per-group cap.
 *
 * <p>The cap S is the largest value for which sum(min(S, groupSize)) over all groups stays within
 * the budget. The sum is non-decreasing in S, so S is found by bisection.
 */
@Slf4j
public final class GroupSizeAllocator {

    private static final double FRACTIONAL_LOWER_BOUND = 1e-5;
    private static final double FRACTIONAL_RATIO_TOLERANCE = 1.1;

    private GroupSizeAllocator() {}

    /**
     * Calculates sequences per group, falling back to a fractional Poisson mean when there are more
     * groups than the budget and probabilistic sampling is allowed.
     *
     * @param targetMaxValue      maximum number of sequences to keep across all groups
     * @param countsPerGroup      number of candidate sequences in each group
     * @param allowProbabilistic  whether a fractional cap may be returned
     * @param diagnostics         receives the warning when the fallback is used
     * @return the cap and whether it is probabilistic
     * @throws TooManyGroupsException when there are more groups than the budget and the fallback is not allowed
     */
    public static GroupCap calculateSequencesPerGroup(long targetMaxValue, Collection<Integer> countsPerGroup,
                                                      boolean allowProbabilistic, DiagnosticSink diagnostics) {
        validate(targetMaxValue, countsPerGroup);
        try {
            return GroupCap.exact(calculateExactSequencesPerGroup(targetMaxValue, countsPerGroup));
        } catch (TooManyGroupsException e) {
            if (!allowProbabilistic) {
                throw e;
            }
            diagnostics.warn(e.getMessage());
            double fractional = calculateFractionalSequencesPerGroup(targetMaxValue, countsPerGroup);
            log.info("Using probabilistic sampling: {} groups share {} sequences at a mean of {} per group",
                    countsPerGroup.size(), targetMaxValue, fractional);
            return GroupCap.probabilistic(fractional);
        }
    }

    public static GroupCap calculateSequencesPerGroup(long targetMaxValue, Collection<Integer> countsPerGroup,
                                                      boolean allowProbabilistic) {
        return calculateSequencesPerGroup(targetMaxValue, countsPerGroup, allowProbabilistic,
                DiagnosticSink.logging(log));
    }

    /**
     * Largest whole S such that sum(min(S, groupSize)) does not exceed the budget.
     *
     * @throws TooManyGroupsException when there are more groups than the budget
     */
    public static int calculateExactSequencesPerGroup(long targetMaxValue, Collection<Integer> countsPerGroup) {
        validate(targetMaxValue, countsPerGroup);
        if (countsPerGroup.size() > targetMaxValue) {
            throw new TooManyGroupsException(targetMaxValue, countsPerGroup.size());
        }

        // S = 1 always fits once groups <= budget.
        long lo = 1;
        long hi = targetMaxValue;
        while (hi - lo > 1) {
            long mid = lo + (hi - lo) / 2;
            if (totalSequences(mid, countsPerGroup) <= targetMaxValue) {
                lo = mid;
            } else {
                hi = mid;
            }
        }
        long result = totalSequences(hi, countsPerGroup) <= targetMaxValue ? hi : lo;
        return (int) Math.min(result, Integer.MAX_VALUE);
    }

    /**
     * Fractional S such that sum(min(S, groupSize)) does not exceed the budget. Unlike the exact
     * version this accepts more groups than the budget. The search stops once the bracketing
     * interval is within 10% and returns its midpoint.
     */
    public static double calculateFractionalSequencesPerGroup(long targetMaxValue, Collection<Integer> countsPerGroup) {
        validate(targetMaxValue, countsPerGroup);
        double lo = FRACTIONAL_LOWER_BOUND;
        double hi = targetMaxValue;
        while (hi / lo > FRACTIONAL_RATIO_TOLERANCE) {
            double mid = (lo + hi) / 2;
            if (totalSequences(mid, countsPerGroup) <= targetMaxValue) {
                lo = mid;
            } else {
                hi = mid;
            }
        }
        return (lo + hi) / 2;
    }

    static double totalSequences(double sequencesPerGroup, Collection<Integer> countsPerGroup) {
        double total = 0;
        for (int count : countsPerGroup) {
            total += Math.min(sequencesPerGroup, count);
        }
        return total;
    }

    static long totalSequences(long sequencesPerGroup, Collection<Integer> countsPerGroup) {
        long total = 0;
        for (int count : countsPerGroup) {
            total += Math.min(sequencesPerGroup, count);
        }
        return total;
    }

    private static void validate(long targetMaxValue, Collection<Integer> countsPerGroup) {
        if (targetMaxValue < 0) {
            throw new IllegalArgumentException("targetMaxValue cannot be negative: " + targetMaxValue);
        }
        if (countsPerGroup == null) {
            throw new IllegalArgumentException("countsPerGroup cannot be null");
        }
        for (Integer count : countsPerGroup) {
            if (count == null || count < 0) {
                throw new IllegalArgumentException("Group sizes must be non-negative, got " + count);
            }
        }
    }
}
