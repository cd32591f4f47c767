package org.batchflow.pipeline.services;

import org.batchflow.pipeline.api.resources.IMonitorable;
import org.batchflow.pipeline.api.resources.OperationalError;
import org.batchflow.pipeline.api.services.IService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * An abstract base class for the pipeline stages, providing lifecycle management,
 * thread handling and error tracking. Subclasses implement {@link #run()} and react to
 * {@link #onStopRequested()}.
 * <p>
 * Stopping is cooperative. {@link #requestStop()} only sets a flag and invokes the hook,
 * which typically closes the stage's input queue so that the run loop drains what is left
 * and returns. {@link #stop()} additionally waits for the thread; if it does not finish within
 * the stop timeout it is interrupted, and if it still does not finish the service moves to
 * {@link State#ERROR}.
 */
public abstract class AbstractService implements IService, IMonitorable {

    protected final Logger log = LoggerFactory.getLogger(this.getClass());
    protected final String serviceName;
    private final Duration stopTimeout;
    private final AtomicReference<State> currentState = new AtomicReference<>(State.CREATED);
    private final AtomicBoolean stopRequested = new AtomicBoolean(false);
    private volatile Thread serviceThread;

    /**
     * Operational errors that occurred during service execution. Bounded by {@link #getMaxErrors()}.
     * Private to enforce use of {@link #recordError(String, String, String)}.
     */
    private final ConcurrentLinkedDeque<OperationalError> errors = new ConcurrentLinkedDeque<>();

    /**
     * Maximum number of errors to keep in memory. When exceeded, oldest errors are removed.
     */
    protected int getMaxErrors() {
        return 10000;
    }

    /**
     * @param name        The name of the service instance, also used as thread name.
     * @param stopTimeout How long {@link #stop()} waits for the thread before interrupting it.
     */
    protected AbstractService(String name, Duration stopTimeout) {
        this.serviceName = Objects.requireNonNull(name, "Service name cannot be null");
        this.stopTimeout = Objects.requireNonNull(stopTimeout, "stopTimeout cannot be null");
    }

    @Override
    public final void start() {
        if (!currentState.compareAndSet(State.CREATED, State.RUNNING)) {
            throw new IllegalStateException(String.format("Cannot start service '%s' as it is in state %s", serviceName, getCurrentState()));
        }
        Thread thread = new Thread(this::runService);
        thread.setName(serviceName);
        serviceThread = thread;
        thread.start();
        logStarted();
    }

    /**
     * Template method for logging service startup. Default implementation logs a simple message.
     */
    protected void logStarted() {
        log.info("{} started", serviceName);
    }

    @Override
    public final void requestStop() {
        if (stopRequested.compareAndSet(false, true)) {
            log.debug("{} stop requested", serviceName);
            onStopRequested();
        }
    }

    /**
     * Hook invoked exactly once, on the thread calling {@link #requestStop()}. Must not block.
     */
    protected abstract void onStopRequested();

    protected final boolean isStopRequested() {
        return stopRequested.get();
    }

    @Override
    public final void stop() {
        requestStop();
        if (currentState.compareAndSet(State.CREATED, State.STOPPED)) {
            return;
        }
        Thread thread = serviceThread;
        if (thread == null || thread == Thread.currentThread()) {
            return;
        }
        try {
            thread.join(stopTimeout.toMillis());
            if (thread.isAlive()) {
                log.warn("{} did not stop within {} ms, interrupting", serviceName, stopTimeout.toMillis());
                thread.interrupt();
                thread.join(stopTimeout.toMillis());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("{} interrupted while waiting for service thread to stop", serviceName);
            return;
        }

        if (thread.isAlive()) {
            log.error("{} thread did not stop after interrupt! Forcing ERROR state.", serviceName);
            currentState.set(State.ERROR);
            return;
        }
        log.debug("{} stopped", serviceName);
    }

    @Override
    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        Thread thread = serviceThread;
        if (thread == null) {
            return getCurrentState() != State.RUNNING;
        }
        thread.join(Math.max(1, timeout.toMillis()));
        return !thread.isAlive();
    }

    @Override
    public State getCurrentState() {
        return currentState.get();
    }

    /**
     * Wraps {@link #run()} with error handling and state management.
     * <ul>
     *   <li>Transient errors: the subclass catches, logs, records and continues</li>
     *   <li>Fatal errors: the exception escapes {@code run()} and the service moves to ERROR</li>
     *   <li>InterruptedException: treated as a forced but clean shutdown</li>
     * </ul>
     */
    private void runService() {
        try {
            run();
        } catch (InterruptedException e) {
            log.debug("Service thread interrupted, shutting down.");
            Thread.currentThread().interrupt();
        } catch (Exception e) {
            log.error("{} stopped with ERROR due to {}: {}", serviceName, e.getClass().getSimpleName(), e.getMessage());
            log.debug("Exception details:", e);
            currentState.set(State.ERROR);
        } finally {
            if (getCurrentState() != State.ERROR) {
                currentState.set(State.STOPPED);
            }
            onTerminated();
            log.debug("Service thread for {} has terminated.", serviceName);
        }
    }

    /**
     * The main loop of the service, executed in a dedicated thread. It should return once
     * its input is exhausted after a stop request.
     * <p>
     * Error handling conventions:
     * <ul>
     *   <li>Transient errors: {@code log.warn(...)} without the exception, plus
     *       {@link #recordError(String, String, String)}. Do not throw.</li>
     *   <li>Fatal errors and invariant violations: throw; the base class logs and sets ERROR.</li>
     *   <li>Normal shutdown: return from the loop, or rethrow InterruptedException.</li>
     * </ul>
     *
     * @throws InterruptedException if the service thread is interrupted.
     */
    protected abstract void run() throws InterruptedException;

    /**
     * Hook invoked on the service thread after {@link #run()} has returned or failed.
     */
    protected void onTerminated() {
        // Default: nothing to release
    }

    /**
     * Records an operational error for tracking and monitoring.
     * <p>
     * Use this method ONLY for transient errors where the service continues running.
     *
     * @param code    Error code for categorization (e.g., "ITEM_DROPPED")
     * @param message Human-readable error message
     * @param details Additional context about the error
     */
    protected void recordError(String code, String message, String details) {
        errors.add(new OperationalError(Instant.now(), code, message, details));

        int maxErrors = getMaxErrors();
        while (errors.size() > maxErrors) {
            errors.pollFirst();
        }
    }

    @Override
    public List<OperationalError> getErrors() {
        return new ArrayList<>(errors);
    }

    @Override
    public void clearErrors() {
        errors.clear();
    }

    /**
     * ERROR state is always unhealthy; otherwise the service is healthy while no errors are recorded.
     */
    @Override
    public boolean isHealthy() {
        if (getCurrentState() == State.ERROR) return false;
        return errors.isEmpty();
    }

    @Override
    public final Map<String, Number> getMetrics() {
        Map<String, Number> metrics = new LinkedHashMap<>();
        metrics.put("error_count", errors.size());
        addCustomMetrics(metrics);
        return metrics;
    }

    /**
     * Hook method for subclasses to add service-specific metrics.
     * Always call {@code super.addCustomMetrics(metrics)} first.
     *
     * @param metrics Mutable map to add custom metrics to (already contains base metrics)
     */
    protected void addCustomMetrics(Map<String, Number> metrics) {
        // Default: no custom metrics
    }
}
