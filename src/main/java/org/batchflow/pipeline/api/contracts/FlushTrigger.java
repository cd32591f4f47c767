package org.batchflow.pipeline.api.contracts;

/**
 * The reason a batch was sealed.
 */
public enum FlushTrigger {
    /**
     * The window reached the configured maximum item count.
     */
    COUNT,
    /**
     * The maximum wait elapsed since the first item of the window arrived.
     */
    TIME,
    /**
     * The partial window was force-flushed because the assembler was stopping.
     */
    DRAIN
}
