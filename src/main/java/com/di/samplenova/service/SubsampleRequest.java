package com.di.samplenova.service;

import com.di.samplenova.grouping.SampleRecord;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * One subsampling run. Null settings fall back to {@link com.di.samplenova.config.SubsamplingProperties}.
 * Give either {@code sequencesPerGroup} or {@code maxSequences}, not both.
 */
@Value
@Builder
public class SubsampleRequest {
    List<SampleRecord> records;
    List<String> groupBy;
    Integer sequencesPerGroup;
    Integer maxSequences;
    /** Priority per strain; higher is kept first. Strains without one get a random priority. */
    Map<String, Double> priorities;
    Boolean probabilisticSampling;
    Long randomSeed;
}
