package org.batchflow.pipeline.services.assembler;

import org.batchflow.pipeline.api.contracts.Batch;

/**
 * Receives every batch sealed by a {@link BatchAssembler}, on the assembler thread and in flush order.
 * <p>
 * The handler may block, for example while the downstream inbox is full; the assembler does not
 * accumulate new items until it returns.
 *
 * @param <T> The payload type.
 */
@FunctionalInterface
public interface FlushHandler<T> {

    void onFlush(Batch<T> batch) throws InterruptedException;
}
