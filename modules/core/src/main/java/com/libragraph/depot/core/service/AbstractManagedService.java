package com.libragraph.depot.core.service;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Base class for {@link ManagedService} implementations.
 *
 * <p>State lives in an {@link AtomicReference}; {@link #start()} and {@link #stop()}
 * are serialized on the instance. {@link #ready()} memoizes one start attempt in a
 * gate shared by all concurrent callers. The gate is cleared when the start fails,
 * when the service is stopped and when it is marked failed, so the next
 * {@code ready()} starts it again.
 * <p>
 * Subclasses implement {@link #doStart()} and {@link #doStop()}.
 */
public abstract class AbstractManagedService implements ManagedService {

    @FunctionalInterface
    protected interface Step {
        void run() throws Exception;
    }

    private final AtomicReference<State> state = new AtomicReference<>(State.STOPPED);
    private final AtomicReference<CompletableFuture<Void>> startGate = new AtomicReference<>();

    protected final Logger log = Logger.getLogger(getClass());

    protected abstract void doStart() throws Exception;

    protected abstract void doStop() throws Exception;

    @Override
    public State state() {
        return state.get();
    }

    @Override
    public Uni<Void> ready() {
        while (true) {
            CompletableFuture<Void> gate = startGate.get();
            if (gate != null) {
                return Uni.createFrom().completionStage(gate);
            }
            CompletableFuture<Void> mine = new CompletableFuture<>();
            if (startGate.compareAndSet(null, mine)) {
                openGate(mine);
                return Uni.createFrom().completionStage(mine);
            }
        }
    }

    @Override
    public synchronized void start() throws Exception {
        if (state.get() != State.RUNNING) {
            advance(State.STARTING, State.RUNNING, this::doStart);
        }
    }

    @Override
    public synchronized void stop() throws Exception {
        if (state.get() != State.STOPPED) {
            startGate.set(null);
            advance(State.STOPPING, State.STOPPED, this::doStop);
        }
    }

    @Override
    public void fail(Throwable cause) {
        State previous = state.get();
        if (previous != State.FAILED) {
            log.errorf("Service '%s' failed (was %s): %s", serviceId(), previous, cause.getMessage());
            startGate.set(null);
            moveTo(State.FAILED);
        }
    }

    private void advance(State during, State after, Step step) throws Exception {
        moveTo(during);
        try {
            step.run();
        } catch (Exception e) {
            fail(e);
            throw e;
        }
        moveTo(after);
    }

    private void openGate(CompletableFuture<Void> gate) {
        try {
            start();
            gate.complete(null);
        } catch (Exception e) {
            startGate.compareAndSet(gate, null);
            gate.completeExceptionally(e);
        }
    }

    private void moveTo(State next) {
        State previous = state.getAndSet(next);
        log.infof("Service '%s': %s -> %s", serviceId(), previous, next);
    }
}
