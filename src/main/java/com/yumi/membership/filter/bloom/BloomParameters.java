package com.yumi.membership.filter.bloom;

import com.yumi.membership.filter.InvalidParameterException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Theoretical sizing for a Bloom filter.
 */
public final class BloomParameters {
    private static final Logger LOGGER = LoggerFactory.getLogger(BloomParameters.class);
    private static final double LN2 = Math.log(2);

    // bit数
    private final int m;
    // hash轮数
    private final int k;

    private BloomParameters(int m, int k) {
        this.m = m;
        this.k = k;
    }

    /**
     * Smallest {@code m} and matching {@code k} for {@code n} items at false-positive rate {@code p}.
     *
     * <p>m = ceil(-n * ln(p) / ln(2)^2), k = ceil(ln(2) * m / n)
     *
     * @throws InvalidParameterException if {@code n < 1}, {@code p} is not in (0, 1),
     *                                   or the resulting {@code m} does not fit in an int
     */
    public static BloomParameters estimate(long n, double p) {
        if (n < 1) {
            throw new InvalidParameterException("n must be at least 1, got " + n);
        }
        if (!(p > 0 && p < 1)) {
            throw new InvalidParameterException("p must be in (0, 1), got " + p);
        }
        double bits = Math.ceil(-1 * n * Math.log(p) / (LN2 * LN2));
        if (bits > Integer.MAX_VALUE) {
            throw new InvalidParameterException(
                    String.format("n=%d at p=%s needs %.0f bits, more than a filter can hold", n, p, bits));
        }
        int m = Math.max(1, (int) bits);
        int k = Math.max(1, (int) Math.ceil(LN2 * m / n));
        LOGGER.debug("estimated m={} k={} for n={} p={}", m, k, n, p);
        return new BloomParameters(m, k);
    }

    /**
     * Expected false-positive rate after {@code n} distinct insertions: (1 - e^(-k*n/m))^k.
     */
    public static double falsePositiveRate(int m, int k, long n) {
        if (m < 1) {
            throw new InvalidParameterException("m must be at least 1, got " + m);
        }
        if (k < 1) {
            throw new InvalidParameterException("k must be at least 1, got " + k);
        }
        if (n < 0) {
            throw new InvalidParameterException("n must not be negative, got " + n);
        }
        return Math.pow(1 - Math.exp(-1.0 * k * n / m), k);
    }

    public int getM() {
        return m;
    }

    public int getK() {
        return k;
    }

    @Override
    public String toString() {
        return String.format("m: %d, k: %d", m, k);
    }
}
