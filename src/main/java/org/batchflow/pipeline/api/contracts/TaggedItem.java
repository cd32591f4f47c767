package org.batchflow.pipeline.api.contracts;

import java.util.Objects;

/**
 * A submitted payload together with the id the pipeline assigned to it.
 *
 * @param id      Pipeline-unique id, starting at 1 and strictly increasing in ingestion order.
 * @param payload The caller's payload, never null.
 * @param <T>     The payload type.
 */
public record TaggedItem<T>(long id, T payload) {

    public TaggedItem {
        if (id < 1) {
            throw new IllegalArgumentException("id must be positive, was " + id);
        }
        Objects.requireNonNull(payload, "payload must not be null");
    }
}
