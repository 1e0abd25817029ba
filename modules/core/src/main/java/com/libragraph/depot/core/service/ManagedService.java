package com.libragraph.depot.core.service;

import io.smallrye.mutiny.Uni;

/**
 * Contract for services with a managed lifecycle.
 */
public interface ManagedService {

    enum State { STOPPED, STARTING, RUNNING, STOPPING, FAILED }

    String serviceId();

    State state();

    void start() throws Exception;

    void stop() throws Exception;

    void fail(Throwable cause);

    /**
     * Completes once the service is running, starting it on first call.
     * Concurrent first callers share a single start attempt.
     */
    Uni<Void> ready();

    default boolean isRunning() {
        return state() == State.RUNNING;
    }
}
