package org.evmkit.runtime.spi;

/**
 * The hash primitive behind {@code SHA3}.
 * <p>
 * A single instance may be shared by concurrent executions, so implementations must be
 * reentrant.
 */
@FunctionalInterface
public interface IHashFunction {

    /**
     * Hashes the given bytes.
     *
     * @param data The input, never {@code null}.
     * @return A 32-byte digest.
     */
    byte[] hash(byte[] data);
}
