package com.di.samplenova.config;

import com.di.samplenova.exception.InvalidSchemeException;
import com.di.samplenova.scheme.SampleDefinition;
import com.di.samplenova.scheme.SubsamplingScheme;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.MapConfigurationPropertySource;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test cases for binding the subsampling properties.
 */
@DisplayName("Subsampling Properties Tests")
class SubsamplingPropertiesTest {

    private static Binder binder(Map<String, String> properties) {
        return new Binder(new MapConfigurationPropertySource(properties));
    }

    @Test
    @DisplayName("Should use defaults when nothing is configured")
    void testDefaults() {
        SubsamplingProperties properties = new SubsamplingProperties();

        assertTrue(properties.getGroupBy().isEmpty());
        assertNull(properties.getMaxSequences());
        assertNull(properties.getSequencesPerGroup());
        assertTrue(properties.isProbabilisticSampling());
        assertNull(properties.getRandomSeed());
        assertEquals(100, properties.getMaxQueueAttempts());
    }

    @Test
    @DisplayName("Should bind subsampling defaults")
    void testBindSubsampling() {
        SubsamplingProperties properties = binder(Map.of(
                "samplenova.subsampling.group-by", "region,year",
                "samplenova.subsampling.max-sequences", "500",
                "samplenova.subsampling.probabilistic-sampling", "false",
                "samplenova.subsampling.random-seed", "314159",
                "samplenova.subsampling.max-queue-attempts", "10"))
                .bind("samplenova.subsampling", SubsamplingProperties.class)
                .get();

        assertEquals(List.of("region", "year"), properties.getGroupBy());
        assertEquals(500, properties.getMaxSequences());
        assertFalse(properties.isProbabilisticSampling());
        assertEquals(314159L, properties.getRandomSeed());
        assertEquals(10, properties.getMaxQueueAttempts());
    }

    @Test
    @DisplayName("Should bind a scheme and keep sample order")
    void testBindScheme() {
        SubsamplingSchemeProperties properties = binder(Map.of(
                "samplenova.scheme.size", "40",
                "samplenova.scheme.samples.focal.group-by", "division,month",
                "samplenova.scheme.samples.focal.weight", "3",
                "samplenova.scheme.samples.context.group-by", "region",
                "samplenova.scheme.samples.context.weight", "1",
                "samplenova.scheme.samples.context.disable-probabilistic-sampling", "true"))
                .bind("samplenova.scheme", SubsamplingSchemeProperties.class)
                .get();

        assertTrue(properties.isConfigured());
        SubsamplingScheme scheme = properties.toScheme();
        assertEquals(40, scheme.getSize());

        Map<String, SampleDefinition> byName = new HashMap<>();
        scheme.computeMaxSequences().forEach(sample -> byName.put(sample.getName(), sample));
        assertEquals(30, byName.get("focal").getMaxSequences());
        assertEquals(List.of("division", "month"), byName.get("focal").getGroupBy());
        assertEquals(10, byName.get("context").getMaxSequences());
        assertTrue(byName.get("context").isDisableProbabilisticSampling());
    }

    @Test
    @DisplayName("Should reject an incomplete scheme")
    void testToScheme_Incomplete() {
        SubsamplingSchemeProperties noSize = new SubsamplingSchemeProperties();
        noSize.getSamples().put("a", new SubsamplingSchemeProperties.Sample());
        assertFalse(noSize.isConfigured());
        assertThrows(InvalidSchemeException.class, noSize::toScheme);

        SubsamplingSchemeProperties noSamples = new SubsamplingSchemeProperties();
        noSamples.setSize(10);
        assertFalse(noSamples.isConfigured());
        InvalidSchemeException ex = assertThrows(InvalidSchemeException.class, noSamples::toScheme);
        assertTrue(ex.getMessage().contains("samples"));
    }
}
