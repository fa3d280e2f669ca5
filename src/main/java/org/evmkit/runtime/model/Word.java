package org.evmkit.runtime.model;

import java.math.BigInteger;
import java.util.Arrays;

import org.bouncycastle.util.encoders.Hex;

/**
 * An immutable 256-bit machine word, stored as 32 big-endian bytes.
 * <p>
 * The same bits can be read as an unsigned integer in {@code [0, 2^256)} or as a two's
 * complement signed integer in {@code [-2^255, 2^255)}.
 */
public final class Word {

    /** Size of a word in bytes. */
    public static final int SIZE = 32;

    public static final BigInteger TWO_POW_256 = BigInteger.ONE.shiftLeft(256);
    public static final BigInteger MAX_UNSIGNED = TWO_POW_256.subtract(BigInteger.ONE);
    public static final BigInteger MIN_SIGNED = BigInteger.ONE.shiftLeft(255).negate();
    public static final BigInteger MAX_SIGNED = BigInteger.ONE.shiftLeft(255).subtract(BigInteger.ONE);

    public static final Word ZERO = new Word(new byte[SIZE]);
    public static final Word ONE = of(1);

    private final byte[] bytes;

    private Word(byte[] bytes) {
        this.bytes = bytes;
    }

    /**
     * Creates a word from up to 32 big-endian bytes, left-padding with zeros.
     *
     * @param value The bytes.
     * @return The word.
     * @throws IllegalArgumentException if {@code value} is longer than 32 bytes.
     */
    public static Word fromBytes(byte[] value) {
        if (value.length > SIZE) {
            throw new IllegalArgumentException("Value of " + value.length + " bytes does not fit in a word");
        }
        byte[] padded = new byte[SIZE];
        System.arraycopy(value, 0, padded, SIZE - value.length, value.length);
        return new Word(padded);
    }

    /**
     * Creates a word from an unsigned integer.
     *
     * @throws IllegalArgumentException if {@code value} is negative or needs more than 256 bits.
     */
    public static Word fromUnsigned(BigInteger value) {
        if (value.signum() < 0 || value.bitLength() > 256) {
            throw new IllegalArgumentException("Unsigned value out of range: " + value);
        }
        return fromTwosComplement(value);
    }

    /**
     * Creates a word from a signed integer in two's complement.
     *
     * @throws IllegalArgumentException if {@code value} is outside {@code [-2^255, 2^255)}.
     */
    public static Word fromSigned(BigInteger value) {
        if (value.compareTo(MIN_SIGNED) < 0 || value.compareTo(MAX_SIGNED) > 0) {
            throw new IllegalArgumentException("Signed value out of range: " + value);
        }
        return fromTwosComplement(value.mod(TWO_POW_256));
    }

    /**
     * Creates a word from any integer, reduced modulo {@code 2^256}.
     */
    public static Word wrap(BigInteger value) {
        return fromTwosComplement(value.mod(TWO_POW_256));
    }

    public static Word of(long value) {
        if (value < 0) {
            throw new IllegalArgumentException("Unsigned value out of range: " + value);
        }
        return fromTwosComplement(BigInteger.valueOf(value));
    }

    private static Word fromTwosComplement(BigInteger nonNegative) {
        byte[] raw = nonNegative.toByteArray();
        byte[] padded = new byte[SIZE];
        int copy = Math.min(raw.length, SIZE);
        System.arraycopy(raw, raw.length - copy, padded, SIZE - copy, copy);
        return new Word(padded);
    }

    public BigInteger toUnsigned() {
        return new BigInteger(1, bytes);
    }

    public BigInteger toSigned() {
        return new BigInteger(bytes);
    }

    public boolean isZero() {
        for (byte b : bytes) {
            if (b != 0) return false;
        }
        return true;
    }

    /**
     * Returns byte {@code i} of the word, where byte 0 is the most significant.
     */
    public int byteAt(int i) {
        return bytes[i] & 0xFF;
    }

    public byte[] toByteArray() {
        return bytes.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        return o instanceof Word other && Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return "0x" + Hex.toHexString(bytes);
    }
}
