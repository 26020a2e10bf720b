package com.yumi.membership.filter;

import java.util.Arrays;

/**
 * Fixed-length array of bits packed into a single {@code byte[]}.
 * The length never changes after creation.
 */
public class BitsArray implements Cloneable {
    private final byte[] bytes;
    private final int bitLength;

    public static BitsArray create(int bitLength) {
        return new BitsArray(bitLength);
    }

    public static BitsArray create(byte[] bytes, int bitLength) {
        return new BitsArray(bytes, bitLength);
    }

    private BitsArray(int bitLength) {
        if (bitLength < 1) {
            throw new IllegalArgumentException("BitLength is less than 1.");
        }
        this.bitLength = bitLength;
        this.bytes = new byte[byteCount(bitLength)];
    }

    private BitsArray(byte[] bytes, int bitLength) {
        if (bytes == null || bytes.length < 1) {
            throw new IllegalArgumentException("Bytes is empty!");
        }
        if (bitLength < 1) {
            throw new IllegalArgumentException("BitLength is less than 1.");
        }
        if (bytes.length != byteCount(bitLength)) {
            throw new IllegalArgumentException(
                    String.format("Bytes length(%d) does not hold exactly %d bits", bytes.length, bitLength));
        }
        this.bytes = new byte[bytes.length];
        System.arraycopy(bytes, 0, this.bytes, 0, this.bytes.length);
        this.bitLength = bitLength;
    }

    private static int byteCount(int bitLength) {
        int temp = bitLength / Byte.SIZE;
        if (bitLength % Byte.SIZE > 0) {
            temp++;
        }
        return temp;
    }

    public int bitLength() {
        return this.bitLength;
    }

    public int byteLength() {
        return this.bytes.length;
    }

    public byte[] bytes() {
        return this.bytes;
    }

    public boolean getBit(int bitPos) {
        checkBitPosition(bitPos);
        return (this.bytes[subscript(bitPos)] & position(bitPos)) != 0;
    }

    public void setBit(int bitPos, boolean set) {
        checkBitPosition(bitPos);
        int sub = subscript(bitPos);
        int pos = position(bitPos);
        if (set) {
            this.bytes[sub] = (byte) (this.bytes[sub] | pos);
        } else {
            this.bytes[sub] = (byte) (this.bytes[sub] & ~pos);
        }
    }

    /**
     * Sets the bit and reports whether it was already set.
     */
    public boolean getAndSetBit(int bitPos) {
        checkBitPosition(bitPos);
        int sub = subscript(bitPos);
        int pos = position(bitPos);
        boolean old = (this.bytes[sub] & pos) != 0;
        this.bytes[sub] = (byte) (this.bytes[sub] | pos);
        return old;
    }

    public void or(final BitsArray other) {
        if (other.bitLength() != this.bitLength) {
            throw new IllegalArgumentException(
                    String.format("BitLength(%d) is not equal to %d", other.bitLength(), this.bitLength));
        }
        for (int i = 0; i < this.bytes.length; i++) {
            this.bytes[i] = (byte) (this.bytes[i] | other.getByte(i));
        }
    }

    public void clearAll() {
        Arrays.fill(this.bytes, (byte) 0x00);
    }

    public int cardinality() {
        int count = 0;
        for (byte b : this.bytes) {
            count += Integer.bitCount(b & 0xFF);
        }
        return count;
    }

    public byte getByte(int bytePos) {
        if (bytePos >= this.bytes.length) {
            throw new IllegalArgumentException("BytePos is greater than " + (this.bytes.length - 1));
        }
        if (bytePos < 0) {
            throw new IllegalArgumentException("BytePos is less than 0");
        }
        return this.bytes[bytePos];
    }

    protected int subscript(int bitPos) {
        return bitPos / Byte.SIZE;
    }

    protected int position(int bitPos) {
        return 1 << bitPos % Byte.SIZE;
    }

    protected void checkBitPosition(int bitPos) {
        if (bitPos >= this.bitLength) {
            throw new IllegalArgumentException("BitPos is greater than " + (this.bitLength - 1));
        }
        if (bitPos < 0) {
            throw new IllegalArgumentException("BitPos is less than 0");
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof BitsArray))
            return false;

        BitsArray that = (BitsArray) o;
        return bitLength == that.bitLength && Arrays.equals(bytes, that.bytes);
    }

    @Override
    public int hashCode() {
        return 31 * bitLength + Arrays.hashCode(bytes);
    }

    @Override
    public BitsArray clone() {
        return create(this.bytes, this.bitLength);
    }
}
