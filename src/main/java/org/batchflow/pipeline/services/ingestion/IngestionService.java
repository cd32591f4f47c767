package org.batchflow.pipeline.services.ingestion;

import org.batchflow.pipeline.PipelineConfig;
import org.batchflow.pipeline.PipelineCounters;
import org.batchflow.pipeline.api.contracts.TaggedItem;
import org.batchflow.pipeline.api.observation.IObservationSink;
import org.batchflow.pipeline.api.resources.queues.QueueClosedException;
import org.batchflow.pipeline.resources.queues.InMemoryBlockingQueue;
import org.batchflow.pipeline.services.AbstractService;
import org.batchflow.pipeline.services.assembler.BatchAssembler;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static org.batchflow.pipeline.api.observation.IObservationSink.fields;

/**
 * Single consumer of the bounded ingestion queue. Tags every payload with the next id and forwards
 * it to the {@link BatchAssembler}.
 * <p>
 * Because exactly one thread assigns ids, the ids reaching the assembler are strictly increasing.
 * A non-increasing id is an invariant violation and stops the service with ERROR.
 * Items the assembler refuses because it is already stopping are reported as dropped.
 *
 * @param <T> The payload type.
 */
public class IngestionService<T> extends AbstractService {

    private final InMemoryBlockingQueue<T> queue;
    private final BatchAssembler<T> assembler;
    private final PipelineCounters counters;
    private final IObservationSink sink;

    private volatile long lastId;

    private final AtomicLong itemsIngested = new AtomicLong();
    private final AtomicLong itemsDropped = new AtomicLong();

    public IngestionService(String name, PipelineConfig config, BatchAssembler<T> assembler,
                            PipelineCounters counters, IObservationSink sink) {
        super(name, config.stopTimeout());
        this.queue = new InMemoryBlockingQueue<>(name + "-queue", config.ingestionCapacity());
        this.assembler = Objects.requireNonNull(assembler, "assembler must not be null");
        this.counters = Objects.requireNonNull(counters, "counters must not be null");
        this.sink = Objects.requireNonNull(sink, "sink must not be null");
    }

    /**
     * Puts a payload on the ingestion queue, blocking while it is full.
     *
     * @throws QueueClosedException if the service is stopping
     */
    public void enqueue(T payload) throws InterruptedException {
        queue.put(payload);
    }

    /**
     * Puts a payload on the ingestion queue, waiting at most {@code timeout} for space.
     *
     * @return {@code false} if the queue stayed full
     * @throws QueueClosedException if the service is stopping
     */
    public boolean tryEnqueue(T payload, long timeout, TimeUnit unit) throws InterruptedException {
        return queue.offer(payload, timeout, unit);
    }

    @Override
    protected void onStopRequested() {
        queue.close();
    }

    @Override
    protected void run() throws InterruptedException {
        while (true) {
            T payload;
            try {
                payload = queue.take();
            } catch (QueueClosedException e) {
                break;
            }
            long id = counters.nextItemId();
            if (id <= lastId) {
                throw new IllegalStateException(String.format("Item id %d is not greater than previous id %d", id, lastId));
            }
            lastId = id;
            itemsIngested.incrementAndGet();

            TaggedItem<T> item = new TaggedItem<>(id, payload);
            if (!assembler.submit(item)) {
                counters.recordDroppedItem();
                itemsDropped.incrementAndGet();
                log.warn("{} dropped item {}: assembler is stopping", serviceName, id);
                recordError("ITEM_DROPPED", "Item dropped", "id=" + id);
                sink.warn("ingestion.dropped", fields("id", id, "reason", "assembler stopping"));
            }
        }
        log.debug("{} drained ingestion queue, last id {}", serviceName, lastId);
    }

    /**
     * @return number of payloads waiting to be tagged
     */
    public int getQueueSize() {
        return queue.size();
    }

    @Override
    protected void addCustomMetrics(Map<String, Number> metrics) {
        super.addCustomMetrics(metrics);
        metrics.put("items_ingested", itemsIngested.get());
        metrics.put("items_dropped", itemsDropped.get());
        metrics.put("queue_size", queue.size());
        metrics.put("last_id", lastId);
    }
}
