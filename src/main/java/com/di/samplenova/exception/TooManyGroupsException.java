package com.di.samplenova.exception;

import lombok.Getter;

/**
 * Thrown when an exact per-group cap is requested for more groups than the total budget allows.
 * {@link com.di.samplenova.allocation.GroupSizeAllocator} catches it to fall back to probabilistic
 * allocation when that is permitted.
 */
@Getter
public class TooManyGroupsException extends SubsamplingException {

    private final long targetMaxValue;
    private final int groupCount;

    public TooManyGroupsException(long targetMaxValue, int groupCount) {
        super("Asked to provide at most " + targetMaxValue + " sequences, but there are " + groupCount + " groups.");
        this.targetMaxValue = targetMaxValue;
        this.groupCount = groupCount;
    }
}
