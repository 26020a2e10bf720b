package com.yumi.membership;

import com.yumi.membership.filter.InvalidParameterException;
import com.yumi.membership.filter.LockedFilter;
import com.yumi.membership.filter.bloom.BloomFilter;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import static com.yumi.membership.FilterConfig.withBits;
import static com.yumi.membership.FilterConfig.withExpected;
import static com.yumi.membership.FilterConfig.withHashFunctions;

public class FilterConfigTest {

    @Test
    public void testDefaults() {
        FilterConfig config = FilterConfig.newConfig();
        Assertions.assertEquals(1024, config.getM());
        Assertions.assertEquals(3, config.getK());
    }

    @Test
    public void testOptions() {
        BloomFilter filter = FilterConfig.newConfig(withBits(100), withHashFunctions(4)).newBloomFilter();
        Assertions.assertEquals(100, filter.cap());
        Assertions.assertEquals(4, filter.hashFunctionNum());
    }

    @Test
    public void testExpected() {
        FilterConfig config = FilterConfig.newConfig(withExpected(50, 0.01));
        Assertions.assertEquals(480, config.getM());
        Assertions.assertEquals(7, config.getK());

        FilterConfig overridden = FilterConfig.newConfig(withExpected(50, 0.01), withHashFunctions(2));
        Assertions.assertEquals(480, overridden.getM());
        Assertions.assertEquals(2, overridden.getK());
    }

    @Test
    public void testInvalid() {
        Assertions.assertThrows(InvalidParameterException.class, () -> FilterConfig.newConfig(withBits(0)));
        Assertions.assertThrows(InvalidParameterException.class, () -> FilterConfig.newConfig(withHashFunctions(0)));
        Assertions.assertThrows(InvalidParameterException.class, () -> FilterConfig.newConfig(withExpected(0, 0.1)));
    }

    @Test
    public void testNewLockedFilter() {
        LockedFilter filter = FilterConfig.newConfig(withBits(64), withHashFunctions(2)).newLockedFilter();
        filter.addString("alpha");
        Assertions.assertTrue(filter.testString("alpha"));
        Assertions.assertEquals(64, filter.cap());
    }
}
