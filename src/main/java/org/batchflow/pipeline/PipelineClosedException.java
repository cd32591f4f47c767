package org.batchflow.pipeline;

/**
 * Thrown by {@code submit} once the pipeline has started closing or has been stopped.
 */
public class PipelineClosedException extends IllegalStateException {

    public PipelineClosedException(String pipelineName, PipelineState state) {
        super("Pipeline '" + pipelineName + "' is closed (state " + state + ")");
    }
}
