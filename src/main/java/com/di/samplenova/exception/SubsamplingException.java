package com.di.samplenova.exception;

/**
 * Base type for errors that abort a subsampling run. Never retried.
 */
public class SubsamplingException extends RuntimeException {

    public SubsamplingException(String message) {
        super(message);
    }
}
