package com.di.samplenova.exception;

/**
 * Thrown when a subsampling request or a weighted sample scheme is not usable as configured.
 */
public class InvalidSchemeException extends SubsamplingException {

    public InvalidSchemeException(String message) {
        super(message);
    }
}
