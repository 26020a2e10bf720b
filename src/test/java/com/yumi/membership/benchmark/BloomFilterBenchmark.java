package com.yumi.membership.benchmark;

import com.yumi.membership.filter.bloom.BloomFilter;
import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.runner.Runner;
import org.openjdk.jmh.runner.RunnerException;
import org.openjdk.jmh.runner.options.Options;
import org.openjdk.jmh.runner.options.OptionsBuilder;

import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;

@State(Scope.Thread)
public class BloomFilterBenchmark {

    private BloomFilter filter;
    static final String keyPrefix = "preFix";

    @Setup
    public void setup() {
        filter = BloomFilter.createByEstimate(1000000, 0.01);
    }

    @Benchmark
    @BenchmarkMode({Mode.Throughput})
    @OutputTimeUnit(TimeUnit.SECONDS)
    public boolean testAndAdd() {
        String key = keyPrefix + ThreadLocalRandom.current().nextInt(1000000);
        return filter.testAndAddString(key);
    }

    @Benchmark
    @BenchmarkMode({Mode.Throughput})
    @OutputTimeUnit(TimeUnit.SECONDS)
    public boolean test() {
        String key = keyPrefix + ThreadLocalRandom.current().nextInt(1000000);
        return filter.testString(key);
    }

    public static void main(String[] args) throws RunnerException {
        Options opt = new OptionsBuilder()
                .include(BloomFilterBenchmark.class.getSimpleName())
                .forks(1)
                .measurementIterations(10)
                .build();
        new Runner(opt).run();
    }
}
