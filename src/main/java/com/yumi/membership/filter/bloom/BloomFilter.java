package com.yumi.membership.filter.bloom;

import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;
import com.yumi.membership.filter.BitsArray;
import com.yumi.membership.filter.Filter;
import com.yumi.membership.filter.InvalidParameterException;
import com.yumi.membership.util.ByteUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Bloom filter over a fixed array of {@code m} bits using {@code k} hash rounds.
 *
 * <p>Every round hashes the item bytes followed by the round index (4 bytes, little-endian)
 * with 64-bit MurmurHash3 and reduces the unsigned result modulo {@code m}.
 *
 * <p>Not thread-safe. Wrap in {@link com.yumi.membership.filter.LockedFilter} or synchronize externally.
 */
public class BloomFilter implements Filter {
    private static final Logger LOGGER = LoggerFactory.getLogger(BloomFilter.class);
    private static final HashFunction MURMUR3 = Hashing.murmur3_128();

    //bit数
    private final int m;
    //hash轮数
    private final int k;
    private final BitsArray bits;

    public static BloomFilter create(int m, int k) {
        if (m < 1) {
            throw new InvalidParameterException("m must be at least 1, got " + m);
        }
        if (k < 1) {
            throw new InvalidParameterException("k must be at least 1, got " + k);
        }
        LOGGER.debug("create bloom filter m={} k={}", m, k);
        return new BloomFilter(m, k, BitsArray.create(m));
    }

    /**
     * Sized for {@code n} items at false-positive rate {@code p}, see {@link BloomParameters#estimate}.
     */
    public static BloomFilter createByEstimate(long n, double p) {
        BloomParameters parameters = BloomParameters.estimate(n, p);
        return create(parameters.getM(), parameters.getK());
    }

    private BloomFilter(int m, int k, BitsArray bits) {
        this.m = m;
        this.k = k;
        this.bits = bits;
    }

    int location(byte[] key, int round) {
        byte[] salted = ByteUtils.concat(key, ByteUtils.intToLittleEndian(round));
        long hash64 = MURMUR3.hashBytes(salted).asLong();
        return (int) Long.remainderUnsigned(hash64, this.m);
    }

    /**
     * The {@code k} positions this filter derives for {@code key}. Passing them to
     * {@link #testLocations(long[])} gives the same answer as {@link #test(byte[])}.
     */
    public long[] locations(byte[] key) {
        Objects.requireNonNull(key, "key");
        long[] locations = new long[this.k];
        for (int i = 0; i < this.k; i++) {
            locations[i] = location(key, i);
        }
        return locations;
    }

    @Override
    public void add(byte[] key) {
        Objects.requireNonNull(key, "key");
        for (int i = 0; i < this.k; i++) {
            this.bits.setBit(location(key, i), true);
        }
    }

    @Override
    public boolean test(byte[] key) {
        Objects.requireNonNull(key, "key");
        for (int i = 0; i < this.k; i++) {
            if (!this.bits.getBit(location(key, i))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public boolean testAndAdd(byte[] key) {
        Objects.requireNonNull(key, "key");
        boolean present = true;
        for (int i = 0; i < this.k; i++) {
            if (!this.bits.getAndSetBit(location(key, i))) {
                present = false;
            }
        }
        return present;
    }

    /**
     * Checks caller-supplied positions, each reduced as an unsigned value modulo {@code m}.
     *
     * <p>Positions not produced by {@link #locations(byte[])} carry no false-positive guarantee
     * tied to this filter's {@code m} and {@code k}.
     */
    @Override
    public boolean testLocations(long[] locations) {
        Objects.requireNonNull(locations, "locations");
        for (long location : locations) {
            if (!this.bits.getBit((int) Long.remainderUnsigned(location, this.m))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public void clearAll() {
        this.bits.clearAll();
    }

    /**
     * ORs the bits of {@code other} into this filter. Both must have the same {@code m} and {@code k}.
     */
    public void merge(BloomFilter other) {
        Objects.requireNonNull(other, "other");
        if (other.m != this.m || other.k != this.k) {
            throw new InvalidParameterException(String.format(
                    "cannot merge m=%d k=%d into m=%d k=%d", other.m, other.k, this.m, this.k));
        }
        this.bits.or(other.bits);
        LOGGER.debug("merged filter, {} of {} bits set", this.bits.cardinality(), this.m);
    }

    public BloomFilter copy() {
        return new BloomFilter(this.m, this.k, this.bits.clone());
    }

    @Override
    public int cap() {
        return m;
    }

    @Override
    public int hashFunctionNum() {
        return k;
    }

    BitsArray bits() {
        return bits;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof BloomFilter))
            return false;

        BloomFilter that = (BloomFilter) o;

        if (k != that.k)
            return false;
        if (m != that.m)
            return false;

        return bits.equals(that.bits);
    }

    @Override
    public int hashCode() {
        int result = m;
        result = 31 * result + k;
        result = 31 * result + bits.hashCode();
        return result;
    }

    @Override
    public String toString() {
        return String.format("m: %d, k: %d, set: %d", m, k, bits.cardinality());
    }
}
