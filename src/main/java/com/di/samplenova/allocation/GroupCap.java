package com.di.samplenova.allocation;

/**
 * Per-group cap on retained records ("sequences per group").
 *
 * <p>An exact cap is a whole number applied to every group. A probabilistic cap is fractional and
 * is used as the mean of a Poisson draw that sizes each group separately.
 */
public record GroupCap(
        double sequencesPerGroup, // whole number when exact, Poisson mean when probabilistic
        boolean probabilistic     // true when the exact allocation did not fit the budget
) {
    public GroupCap {
        if (sequencesPerGroup < 0 || Double.isNaN(sequencesPerGroup)) {
            throw new IllegalArgumentException("sequencesPerGroup must be non-negative, got " + sequencesPerGroup);
        }
        if (!probabilistic && sequencesPerGroup != Math.floor(sequencesPerGroup)) {
            throw new IllegalArgumentException("An exact cap must be a whole number, got " + sequencesPerGroup);
        }
    }

    /**
     * Creates an exact cap shared by all groups.
     */
    public static GroupCap exact(int sequencesPerGroup) {
        return new GroupCap(sequencesPerGroup, false);
    }

    /**
     * Creates a fractional cap used as a Poisson mean.
     */
    public static GroupCap probabilistic(double meanSequencesPerGroup) {
        return new GroupCap(meanSequencesPerGroup, true);
    }

    /**
     * The exact cap as an integer.
     *
     * @throws IllegalStateException for a probabilistic cap
     */
    public int exactValue() {
        if (probabilistic) {
            throw new IllegalStateException("A probabilistic cap has no exact value: " + sequencesPerGroup);
        }
        return (int) sequencesPerGroup;
    }
}
