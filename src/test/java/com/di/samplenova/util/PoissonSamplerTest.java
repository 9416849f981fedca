package com.di.samplenova.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test cases for PoissonSampler.
 */
@DisplayName("PoissonSampler Tests")
class PoissonSamplerTest {

    @Test
    @DisplayName("Should always draw zero for a zero mean")
    void testSample_ZeroMean() {
        Random random = new Random(1);
        for (int i = 0; i < 100; i++) {
            assertEquals(0, PoissonSampler.sample(random, 0.0));
        }
    }

    @ParameterizedTest
    @ValueSource(doubles = {0.1, 0.5, 2.0, 30.0, 1200.0})
    @DisplayName("Should match the mean over many draws")
    void testSample_Mean(double mean) {
        Random random = new Random(314159);
        int draws = 20_000;
        long total = 0;
        for (int i = 0; i < draws; i++) {
            int value = PoissonSampler.sample(random, mean);
            assertTrue(value >= 0);
            total += value;
        }
        double observed = (double) total / draws;
        // Five standard errors of the sample mean.
        assertEquals(mean, observed, 5 * Math.sqrt(mean / draws));
    }

    @Test
    @DisplayName("Should repeat draws for the same seed")
    void testSample_Reproducible() {
        Random first = new Random(99);
        Random second = new Random(99);
        for (int i = 0; i < 50; i++) {
            assertEquals(PoissonSampler.sample(first, 0.8), PoissonSampler.sample(second, 0.8));
        }
    }

    @Test
    @DisplayName("Should reject invalid means")
    void testSample_InvalidMean() {
        Random random = new Random();
        assertThrows(IllegalArgumentException.class, () -> PoissonSampler.sample(random, -1.0));
        assertThrows(IllegalArgumentException.class, () -> PoissonSampler.sample(random, Double.NaN));
        assertThrows(IllegalArgumentException.class, () -> PoissonSampler.sample(random, Double.POSITIVE_INFINITY));
    }
}
