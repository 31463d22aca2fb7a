package com.ryuqq.kindstore.core.spi;

/**
 * Holder of the process-wide default {@link Adapter}.
 *
 * <p>Models without an adapter of their own use the adapter configured here. This is
 * process-wide state: configure it once during application startup and {@link #clear()}
 * it on shutdown (or after each test).</p>
 *
 * @author Kindstore Team
 * @since 1.0.0
 */
public final class Adapters {

    private static volatile Adapter current;

    private Adapters() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * Sets the default adapter.
     *
     * @param adapter the adapter, or null to unset it
     * @return the given adapter
     */
    public static <A extends Adapter> A set(A adapter) {
        current = adapter;
        return adapter;
    }

    /**
     * Gets the default adapter.
     *
     * @return the configured adapter
     * @throws IllegalStateException if no adapter has been configured
     */
    public static Adapter get() {
        Adapter adapter = current;
        if (adapter == null) {
            throw new IllegalStateException("No default adapter configured. Call Adapters.set(adapter) first.");
        }
        return adapter;
    }

    /**
     * Whether a default adapter is configured.
     *
     * @return true if {@link #get()} would succeed
     */
    public static boolean isConfigured() {
        return current != null;
    }

    /**
     * Removes the default adapter.
     */
    public static void clear() {
        current = null;
    }
}
