package org.losp.runtime;

import com.typesafe.config.Config;

/**
 * Resource limits of a {@link VirtualMachine}.
 *
 * @param maxFrames The maximum depth of the call-frame stack.
 * @param maxStack The capacity of the operand stack, in values.
 */
public record VmSettings(int maxFrames, int maxStack) {

    /** Default call depth, matching {@code losp.vm.max-frames} in reference.conf. */
    public static final int DEFAULT_MAX_FRAMES = 1024;
    /** Default operand stack capacity, matching {@code losp.vm.max-stack} in reference.conf. */
    public static final int DEFAULT_MAX_STACK = 65536;

    public VmSettings {
        if (maxFrames < 1) {
            throw new IllegalArgumentException("max-frames must be positive, was " + maxFrames);
        }
        if (maxStack < 1) {
            throw new IllegalArgumentException("max-stack must be positive, was " + maxStack);
        }
    }

    /**
     * @return The built-in defaults.
     */
    public static VmSettings defaults() {
        return new VmSettings(DEFAULT_MAX_FRAMES, DEFAULT_MAX_STACK);
    }

    /**
     * Reads the {@code losp.vm} block of the application configuration. Missing
     * keys fall back to the defaults.
     *
     * @param config The resolved application configuration.
     * @return The settings.
     */
    public static VmSettings fromConfig(Config config) {
        final String path = "losp.vm";
        if (!config.hasPath(path)) {
            return defaults();
        }
        Config vm = config.getConfig(path);
        int maxFrames = vm.hasPath("max-frames") ? vm.getInt("max-frames") : DEFAULT_MAX_FRAMES;
        int maxStack = vm.hasPath("max-stack") ? vm.getInt("max-stack") : DEFAULT_MAX_STACK;
        return new VmSettings(maxFrames, maxStack);
    }
}
