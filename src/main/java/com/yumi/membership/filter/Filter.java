package com.yumi.membership.filter;

import java.nio.charset.StandardCharsets;

public interface Filter {
    //把key的k个位置全部置1
    void add(byte[] key);
    //k个位置全部为1时返回true, 可能误判, 不会漏判
    boolean test(byte[] key);
    //等价于先test再add, 返回test的结果
    boolean testAndAdd(byte[] key);
    //直接判断给定的位置(对m取模)是否全部为1
    boolean testLocations(long[] locations);
    //清空所有bit, m和k不变
    void clearAll();
    //bit数 m
    int cap();
    //hash轮数 k
    int hashFunctionNum();

    default void addString(String key) {
        add(key.getBytes(StandardCharsets.UTF_8));
    }

    default boolean testString(String key) {
        return test(key.getBytes(StandardCharsets.UTF_8));
    }

    default boolean testAndAddString(String key) {
        return testAndAdd(key.getBytes(StandardCharsets.UTF_8));
    }
}
