package org.evmkit.runtime.internal.services;

import org.bouncycastle.jcajce.provider.digest.Keccak;
import org.evmkit.runtime.spi.IHashFunction;

/**
 * Keccak-256 as used by {@code SHA3}, backed by BouncyCastle.
 * <p>
 * A new digest is created per call, so one instance can be shared between threads.
 */
public final class Keccak256HashFunction implements IHashFunction {

    @Override
    public byte[] hash(byte[] data) {
        return new Keccak.Digest256().digest(data);
    }
}
