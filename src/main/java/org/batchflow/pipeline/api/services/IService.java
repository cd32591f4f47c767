package org.batchflow.pipeline.api.services;

import org.batchflow.pipeline.api.resources.OperationalError;

import java.time.Duration;
import java.util.List;

/**
 * The core interface for the running stages of the pipeline.
 * <p>
 * Each stage owns one dedicated thread and has a small lifecycle: it is started once,
 * may be asked to stop without blocking ({@link #requestStop()}), and can be stopped and
 * waited for ({@link #stop()}). A stopped stage cannot be restarted.
 */
public interface IService {

    /**
     * The operational state of a service.
     */
    enum State {
        /**
         * The service has not been started yet.
         */
        CREATED,
        /**
         * The service thread is running.
         */
        RUNNING,
        /**
         * The service thread has terminated normally.
         */
        STOPPED,
        /**
         * The service has encountered a fatal error and cannot continue.
         */
        ERROR
    }

    /**
     * Starts the service thread, transitioning it to the RUNNING state.
     *
     * @throws IllegalStateException if the service was already started
     */
    void start();

    /**
     * Signals the service to stop and returns immediately. Subsequent calls have no effect.
     */
    void requestStop();

    /**
     * Signals the service to stop and waits for its thread to terminate.
     * Calling this on a service that is not running is a no-op.
     */
    void stop();

    /**
     * Waits up to the given time for the service thread to terminate.
     *
     * @param timeout maximum time to wait
     * @return {@code true} if the thread has terminated (or was never started)
     * @throws InterruptedException if interrupted while waiting
     */
    boolean awaitTermination(Duration timeout) throws InterruptedException;

    /**
     * Returns the current state of the service.
     *
     * @return The current {@link State}.
     */
    State getCurrentState();

    /**
     * Returns a list of operational errors that have occurred in the service.
     * @return A list of {@link OperationalError}s.
     */
    List<OperationalError> getErrors();

    /**
     * Clears the list of operational errors for the service.
     */
    void clearErrors();
}
