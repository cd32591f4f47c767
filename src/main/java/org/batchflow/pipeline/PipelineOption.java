package org.batchflow.pipeline;

/**
 * A configuration mutator passed to {@link BatchPipeline#create(PipelineOption...)}.
 * The common ones are provided by {@link PipelineOptions}.
 */
@FunctionalInterface
public interface PipelineOption {

    void apply(PipelineConfig.Builder builder);
}
