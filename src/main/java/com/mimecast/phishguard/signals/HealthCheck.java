package com.mimecast.phishguard.signals;

/**
 * Self test of an analyzer.
 */
public interface HealthCheck {

    /**
     * Runs the analyzer on a trivial synthetic input and checks the shape of the result.
     * <p>Must not throw.
     *
     * @return True if the analyzer produced a well formed result.
     */
    boolean isHealthy();
}
