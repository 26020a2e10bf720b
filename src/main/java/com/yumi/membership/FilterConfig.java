package com.yumi.membership;

import com.yumi.membership.filter.InvalidParameterException;
import com.yumi.membership.filter.LockedFilter;
import com.yumi.membership.filter.bloom.BloomFilter;
import com.yumi.membership.filter.bloom.BloomParameters;

import java.util.function.Consumer;

public class FilterConfig {
    //bit数
    private int m = 1024;
    //hash轮数
    private int k = 3;

    private FilterConfig() {}

    public static FilterConfig newConfig(ConfigOption... options) {
        FilterConfig config = new FilterConfig();
        for (ConfigOption option : options) {
            option.accept(config);
        }
        return config;
    }

    public static ConfigOption withBits(int m) {
        return config -> config.setM(m);
    }

    public static ConfigOption withHashFunctions(int k) {
        return config -> config.setK(k);
    }

    /**
     * Overwrites both m and k with the estimate for {@code n} items at false-positive rate {@code p}.
     */
    public static ConfigOption withExpected(long n, double p) {
        return config -> {
            BloomParameters parameters = BloomParameters.estimate(n, p);
            config.setM(parameters.getM());
            config.setK(parameters.getK());
        };
    }

    public BloomFilter newBloomFilter() {
        return BloomFilter.create(this.m, this.k);
    }

    public LockedFilter newLockedFilter() {
        return new LockedFilter(newBloomFilter());
    }

    public int getM() {
        return m;
    }

    public int getK() {
        return k;
    }

    public void setM(int m) {
        if (m < 1) {
            throw new InvalidParameterException("m must be at least 1, got " + m);
        }
        this.m = m;
    }

    public void setK(int k) {
        if (k < 1) {
            throw new InvalidParameterException("k must be at least 1, got " + k);
        }
        this.k = k;
    }

    @FunctionalInterface
    public interface ConfigOption extends Consumer<FilterConfig> {}
}
