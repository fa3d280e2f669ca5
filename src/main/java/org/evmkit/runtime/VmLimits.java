package org.evmkit.runtime;

import com.typesafe.config.Config;

/**
 * Resource limits of the interpreter.
 *
 * @param maxStackDepth The number of words the stack can hold, at most 1024.
 * @param maxMemoryBytes The size memory may grow to.
 */
public record VmLimits(int maxStackDepth, long maxMemoryBytes) {

    /** Stack depth limit of the instruction set. */
    public static final int DEFAULT_MAX_STACK_DEPTH = 1024;

    /** Memory limit of 10 MB. */
    public static final long DEFAULT_MAX_MEMORY_BYTES = 10_000_000L;

    public static final VmLimits DEFAULTS = new VmLimits(DEFAULT_MAX_STACK_DEPTH, DEFAULT_MAX_MEMORY_BYTES);

    public VmLimits {
        if (maxStackDepth < 1 || maxStackDepth > DEFAULT_MAX_STACK_DEPTH) {
            throw new IllegalArgumentException(
                    "maxStackDepth must be between 1 and " + DEFAULT_MAX_STACK_DEPTH + ", got: " + maxStackDepth);
        }
        if (maxMemoryBytes < 0 || maxMemoryBytes > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("maxMemoryBytes must be between 0 and " + Integer.MAX_VALUE + ", got: " + maxMemoryBytes);
        }
    }

    /**
     * Reads the limits from the {@code vm} block of the given configuration. Missing keys fall
     * back to the defaults.
     *
     * @param config The root configuration.
     * @return The limits.
     */
    public static VmLimits fromConfig(Config config) {
        int depth = config.hasPath("vm.max-stack-depth") ? config.getInt("vm.max-stack-depth") : DEFAULT_MAX_STACK_DEPTH;
        long memory = config.hasPath("vm.max-memory-bytes") ? config.getLong("vm.max-memory-bytes") : DEFAULT_MAX_MEMORY_BYTES;
        return new VmLimits(depth, memory);
    }
}
