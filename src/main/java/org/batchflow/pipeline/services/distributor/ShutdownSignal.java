package org.batchflow.pipeline.services.distributor;

/**
 * How a {@link BatchDistributor} is asked to shut down.
 */
public enum ShutdownSignal {
    /**
     * Cooperative cancellation: stop accepting batches, deliver everything already accepted, then exit.
     */
    CANCEL,
    /**
     * Quit: stop routing at once. Batches not yet routed to the workers are reported as dropped; the
     * workers deliver what is already in their queue, then exit.
     */
    QUIT
}
