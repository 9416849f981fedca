package com.di.samplenova.scheme;

import com.di.samplenova.exception.InvalidSchemeException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A total sequence budget split between named samples by weight. Each sample is subsampled on its
 * own; the output is the union of what the samples keep.
 */
@Slf4j
public class SubsamplingScheme {

    private final int size;
    private final List<SampleDefinition> samples = new ArrayList<>();

    public SubsamplingScheme(int size) {
        if (size <= 0) {
            throw new InvalidSchemeException("Scheme size must be positive, got " + size);
        }
        this.size = size;
    }

    public int getSize() {
        return size;
    }

    public List<SampleDefinition> getSamples() {
        return Collections.unmodifiableList(samples);
    }

    /**
     * Adds a sample.
     *
     * @throws InvalidSchemeException when a sample with the same name already exists
     */
    public SubsamplingScheme add(SampleDefinition sample) {
        if (sample == null || sample.getName() == null || sample.getName().isBlank()) {
            throw new InvalidSchemeException("A sample must have a name");
        }
        if (samples.stream().anyMatch(existing -> existing.getName().equals(sample.getName()))) {
            throw new InvalidSchemeException("A sample with the name " + sample.getName() + " already exists.");
        }
        samples.add(sample);
        return this;
    }

    /**
     * Assigns every sample floor(size * weight / totalWeight) as its maximum number of sequences.
     *
     * @return the samples with {@code maxSequences} set, in insertion order
     * @throws InvalidSchemeException when there are no samples or a weight is missing or not positive
     */
    public List<SampleDefinition> computeMaxSequences() {
        if (samples.isEmpty()) {
            throw new InvalidSchemeException("Scheme must define at least one sample");
        }
        long totalWeight = 0;
        for (SampleDefinition sample : samples) {
            if (sample.getWeight() == null || sample.getWeight() <= 0) {
                throw new InvalidSchemeException("Sample " + sample.getName() + " must have a positive weight, got "
                        + sample.getWeight());
            }
            totalWeight += sample.getWeight();
        }
        for (int i = 0; i < samples.size(); i++) {
            SampleDefinition sample = samples.get(i);
            int maxSequences = (int) ((long) size * sample.getWeight() / totalWeight);
            samples.set(i, sample.toBuilder().maxSequences(maxSequences).build());
            log.debug("Sample '{}' gets {} of {} sequences (weight {}/{})",
                    sample.getName(), maxSequences, size, sample.getWeight(), totalWeight);
        }
        return getSamples();
    }
}
