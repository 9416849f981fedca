package com.di.samplenova.util;

import java.util.Random;

/**
 * Draws Poisson-distributed integers from a caller-owned {@link Random}.
 */
public final class PoissonSampler {

    // Knuth's product method loses precision once exp(-mean) underflows; larger means are split.
    private static final double MAX_CHUNK_MEAN = 500.0;

    private PoissonSampler() {}

    /**
     * Draws one value from Poisson(mean). Consumes the generator deterministically, so a seeded
     * generator yields a reproducible sequence of draws.
     *
     * @param random generator to draw from
     * @param mean   non-negative mean
     * @return a non-negative integer
     */
    public static int sample(Random random, double mean) {
        if (mean < 0 || Double.isNaN(mean) || Double.isInfinite(mean)) {
            throw new IllegalArgumentException("Poisson mean must be a finite non-negative number, got " + mean);
        }
        int total = 0;
        double remaining = mean;
        while (remaining > MAX_CHUNK_MEAN) {
            total += sampleSmall(random, MAX_CHUNK_MEAN);
            remaining -= MAX_CHUNK_MEAN;
        }
        return total + sampleSmall(random, remaining);
    }

    private static int sampleSmall(Random random, double mean) {
        if (mean == 0.0) {
            return 0;
        }
        double limit = Math.exp(-mean);
        double product = random.nextDouble();
        int count = 0;
        while (product > limit) {
            count++;
            product *= random.nextDouble();
        }
        return count;
    }
}
