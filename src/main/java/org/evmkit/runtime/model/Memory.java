package org.evmkit.runtime.model;

import java.math.BigInteger;
import java.util.Arrays;

import org.evmkit.runtime.VmError;
import org.evmkit.runtime.VmException;

/**
 * Byte-addressed scratch memory of one execution.
 * <p>
 * Memory only ever grows, and every access grows it to exactly {@code offset + size} bytes,
 * filling with zeros, even when {@code size} is zero. Growth past the configured limit fails
 * with {@link VmError.Kind#OUT_OF_MEMORY}.
 */
public final class Memory {

    private final long maxBytes;
    private byte[] data = new byte[0];
    private int size = 0;

    /**
     * @param maxBytes The largest size memory may grow to.
     */
    public Memory(long maxBytes) {
        this.maxBytes = maxBytes;
    }

    public int size() {
        return size;
    }

    /**
     * Reads {@code length} bytes at {@code offset}, growing memory first.
     */
    public byte[] read(BigInteger offset, BigInteger length) throws VmException {
        int end = expand(offset.add(length));
        int start = end - length.intValueExact();
        return Arrays.copyOfRange(data, start, end);
    }

    /**
     * Writes {@code value} at {@code offset}, growing memory first.
     */
    public void write(BigInteger offset, byte[] value) throws VmException {
        int end = expand(offset.add(BigInteger.valueOf(value.length)));
        System.arraycopy(value, 0, data, end - value.length, value.length);
    }

    /**
     * Grows memory to at least {@code totalSize} bytes.
     *
     * @return {@code totalSize} as an int.
     */
    public int expand(BigInteger totalSize) throws VmException {
        int total = checkedSize(totalSize, maxBytes);
        if (total > size) {
            if (total > data.length) {
                int capacity = (int) Math.min(maxBytes, Math.max((long) total, 2L * data.length));
                data = Arrays.copyOf(data, capacity);
            }
            size = total;
        }
        return total;
    }

    /**
     * Returns a copy of the used part of memory.
     */
    public byte[] toByteArray() {
        return Arrays.copyOf(data, size);
    }

    /**
     * Reads a slice of a read-only buffer as if it were memory: bytes beyond its end read as
     * zero. The same growth limit applies.
     *
     * @param source The buffer, e.g. calldata or code.
     * @param offset The start of the slice.
     * @param length The slice length.
     * @param maxBytes The largest {@code offset + length} allowed.
     * @return The slice, exactly {@code length} bytes.
     */
    public static byte[] readZeroPadded(byte[] source, BigInteger offset, BigInteger length, long maxBytes)
            throws VmException {
        int end = checkedSize(offset.add(length), maxBytes);
        int start = end - length.intValueExact();
        byte[] out = new byte[end - start];
        if (start < source.length) {
            System.arraycopy(source, start, out, 0, Math.min(source.length, end) - start);
        }
        return out;
    }

    private static int checkedSize(BigInteger totalSize, long maxBytes) throws VmException {
        if (totalSize.compareTo(BigInteger.valueOf(maxBytes)) > 0) {
            throw new VmException(VmError.of(VmError.Kind.OUT_OF_MEMORY, "requested " + totalSize + " bytes"));
        }
        return totalSize.intValueExact();
    }
}
