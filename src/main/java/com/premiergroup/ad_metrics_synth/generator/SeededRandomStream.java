package com.premiergroup.ad_metrics_synth.generator;

import org.apache.commons.math3.random.MersenneTwister;
import org.apache.commons.math3.random.RandomGenerator;

/**
 * Seeded source of uniform draws for one generation run.
 * <p>
 * Draw order is part of the reproducibility contract: the same seed consumed in the same order yields the
 * same values. Instances are not thread-safe and must not be shared between campaigns generated concurrently.
 */
public class SeededRandomStream {

    private final long seed;
    private final RandomGenerator random;

    public SeededRandomStream(long seed) {
        this.seed = seed;
        this.random = new MersenneTwister(seed);
    }

    public long seed() {
        return seed;
    }

    /**
     * Uniform double in {@code [min, max)}.
     */
    public double uniform(double min, double max) {
        return min + (max - min) * random.nextDouble();
    }

    /**
     * Uniform integer in {@code [min, max]}, both ends inclusive.
     */
    public int uniformInt(int min, int max) {
        return min + random.nextInt(max - min + 1);
    }
}
