package com.di.samplenova.exception;

/**
 * Thrown by {@link com.di.samplenova.grouping.GroupKeyResolver} when the requested group-by
 * categories cannot be resolved at all, or are contradictory ('month' with 'week').
 */
public class GroupByException extends SubsamplingException {

    public GroupByException(String message) {
        super(message);
    }
}
