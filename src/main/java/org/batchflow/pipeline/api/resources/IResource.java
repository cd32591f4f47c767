package org.batchflow.pipeline.api.resources;

/**
 * Base interface for all resources in the pipeline.
 * <p>
 * Resources are the passive components the stages communicate through, such as the
 * bounded queues between ingestion, assembler and distributor.
 */
public interface IResource {

    /**
     * Returns the name of this resource instance, used in logs and metrics.
     *
     * @return The resource name.
     */
    String getResourceName();
}
