package com.di.samplenova.config;

import com.di.samplenova.exception.InvalidSchemeException;
import com.di.samplenova.scheme.SampleDefinition;
import com.di.samplenova.scheme.SubsamplingScheme;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Binding for a weighted multi-sample scheme.
 *
 * <pre>
 * samplenova:
 *   scheme:
 *     size: 1000
 *     samples:
 *       focal:
 *         group-by: division,month
 *         weight: 3
 *       context:
 *         group-by: region
 *         weight: 1
 *         disable-probabilistic-sampling: true
 * </pre>
 */
@Data
@ConfigurationProperties(prefix = "samplenova.scheme")
public class SubsamplingSchemeProperties {

    private Integer size;

    /** Samples by name, in declaration order. */
    private Map<String, Sample> samples = new LinkedHashMap<>();

    @Data
    public static class Sample {
        private List<String> groupBy = new ArrayList<>();
        private Integer weight;
        private boolean disableProbabilisticSampling;
        private Long randomSeed;
    }

    public boolean isConfigured() {
        return size != null && !samples.isEmpty();
    }

    /** Builds the scheme described by these properties. */
    public SubsamplingScheme toScheme() {
        if (size == null) {
            throw new InvalidSchemeException("Scheme must define a size");
        }
        if (samples.isEmpty()) {
            throw new InvalidSchemeException("Scheme must define a \"samples\" key");
        }
        SubsamplingScheme scheme = new SubsamplingScheme(size);
        samples.forEach((name, sample) -> scheme.add(SampleDefinition.builder()
                .name(name)
                .groupBy(List.copyOf(sample.getGroupBy()))
                .weight(sample.getWeight())
                .disableProbabilisticSampling(sample.isDisableProbabilisticSampling())
                .randomSeed(sample.getRandomSeed())
                .build()));
        return scheme;
    }
}
