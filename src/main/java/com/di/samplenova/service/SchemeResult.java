package com.di.samplenova.service;

import lombok.Builder;
import lombok.Value;

import java.util.Map;
import java.util.Set;

/**
 * Outcome of a weighted scheme: each sample's result and the combined output.
 */
@Value
@Builder
public class SchemeResult {
    Map<String, SubsampleResult> resultsBySample;
    /** Union of the strains kept by any sample, in input order. */
    Set<String> retainedStrains;
}
