package org.batchflow.pipeline.resources;

import com.typesafe.config.Config;
import org.batchflow.pipeline.api.resources.IMonitorable;
import org.batchflow.pipeline.api.resources.IResource;
import org.batchflow.pipeline.api.resources.OperationalError;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentLinkedDeque;

/**
 * Abstract base class for all IResource implementations, providing common
 * functionality for name and configuration handling, and monitoring infrastructure.
 * <p>
 * Follows the same error and metrics conventions as
 * {@link org.batchflow.pipeline.services.AbstractService}.
 */
public abstract class AbstractResource implements IResource, IMonitorable {
    protected final String resourceName;
    protected final Config options;

    /**
     * Transient errors recorded by the resource. Bounded by {@link #getMaxErrors()}.
     */
    private final ConcurrentLinkedDeque<OperationalError> errors = new ConcurrentLinkedDeque<>();

    /**
     * Maximum number of errors to keep in memory. When exceeded, oldest errors are removed.
     */
    protected int getMaxErrors() {
        return 10000;
    }

    /**
     * Constructor for AbstractResource.
     *
     * @param name    The name of the resource instance.
     * @param options The configuration object for this resource instance.
     */
    protected AbstractResource(String name, Config options) {
        this.resourceName = Objects.requireNonNull(name, "Resource name cannot be null");
        this.options = Objects.requireNonNull(options, "Resource options cannot be null");
    }

    @Override
    public String getResourceName() {
        return resourceName;
    }

    public Config getOptions() {
        return options;
    }

    /**
     * Records an operational error for tracking and monitoring.
     * <p>
     * Use this method ONLY for transient errors where the resource keeps functioning.
     * For fatal errors, log at error level and throw instead.
     *
     * @param code    Error code for categorization (e.g., "OFFER_REJECTED")
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

    @Override
    public boolean isHealthy() {
        return errors.isEmpty();
    }

    /**
     * Returns the base metrics ({@code error_count}) followed by the metrics added in
     * {@link #addCustomMetrics(Map)}.
     *
     * @return Map of metric names to their current values
     */
    @Override
    public final Map<String, Number> getMetrics() {
        Map<String, Number> metrics = new LinkedHashMap<>();
        metrics.put("error_count", errors.size());
        addCustomMetrics(metrics);
        return metrics;
    }

    /**
     * Hook method for subclasses to add resource-specific metrics.
     * Always call {@code super.addCustomMetrics(metrics)} first.
     *
     * @param metrics Mutable map to add custom metrics to (already contains base metrics)
     */
    protected void addCustomMetrics(Map<String, Number> metrics) {
        // Default: no custom metrics
    }
}
