package com.di.samplenova.scheme;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * One named sample of a weighted subsampling scheme. {@code maxSequences} is null until the
 * scheme assigns each sample its share of the total size.
 */
@Value
@Builder(toBuilder = true)
public class SampleDefinition {
    String name;
    List<String> groupBy;
    /** Relative share of the scheme size; must be positive. */
    Integer weight;
    Integer maxSequences;
    boolean disableProbabilisticSampling;
    /** Seed for this sample's random draws; a run-level seed overrides it. */
    Long randomSeed;
}
