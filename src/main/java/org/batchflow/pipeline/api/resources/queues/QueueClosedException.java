package org.batchflow.pipeline.api.resources.queues;

/**
 * Thrown when an element is written to a closed queue, or when a reader waits on a queue
 * that is closed and has no elements left. For readers this is the normal end-of-input signal.
 */
public class QueueClosedException extends IllegalStateException {

    public QueueClosedException(String queueName) {
        super("Queue '" + queueName + "' is closed");
    }
}
