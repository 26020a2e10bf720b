package com.yumi.membership.util;

public class ByteUtils {
    private ByteUtils() {}

    /**
     * Low 32 bits of {@code value}, little-endian.
     */
    public static byte[] intToLittleEndian(int value) {
        byte[] b = new byte[4];
        b[0] = (byte) value;
        b[1] = (byte) (value >>> 8);
        b[2] = (byte) (value >>> 16);
        b[3] = (byte) (value >>> 24);
        return b;
    }

    public static byte[] concat(byte[] first, byte[] second) {
        byte[] joined = new byte[first.length + second.length];
        System.arraycopy(first, 0, joined, 0, first.length);
        System.arraycopy(second, 0, joined, first.length, second.length);
        return joined;
    }
}
