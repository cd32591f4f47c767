package org.batchflow.pipeline;

/**
 * Thrown at construction time when the pipeline configuration is invalid.
 * The pipeline is never started with such a configuration.
 */
public class PipelineConfigurationException extends IllegalArgumentException {

    public PipelineConfigurationException(String message) {
        super(message);
    }

    public PipelineConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
