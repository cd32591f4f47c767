package org.batchflow.pipeline.api.resources;

import java.time.Instant;

/**
 * Represents an operational error that occurred within a pipeline stage or resource.
 * <p>
 * Used for transient conditions such as a dropped item or a batch that could not be
 * handed to the distributor. The stage keeps running; the error only affects its health.
 *
 * @param timestamp The timestamp of when the error occurred.
 * @param errorType A category for the error (e.g., "ITEM_DROPPED", "BATCH_DROPPED").
 * @param message   A human-readable description of the error.
 * @param details   Optional additional context, such as the affected ids.
 */
public record OperationalError(
    Instant timestamp,
    String errorType,
    String message,
    String details
) {
}
