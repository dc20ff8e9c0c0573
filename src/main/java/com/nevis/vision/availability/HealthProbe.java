package com.nevis.vision.availability;

/**
 * Health check for one backend. Implementations may throw; any exception counts as unhealthy.
 */
public interface HealthProbe {

    String backendId();

    boolean check();

    /**
     * A backend without the credentials it needs is never probed over the network.
     */
    default boolean isConfigured() {
        return true;
    }
}
