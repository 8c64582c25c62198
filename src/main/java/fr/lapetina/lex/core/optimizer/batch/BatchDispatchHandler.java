package fr.lapetina.lex.core.optimizer.batch;

import com.lmax.disruptor.EventHandler;
import com.lmax.disruptor.LifecycleAware;
import com.lmax.disruptor.TimeoutHandler;
import fr.lapetina.lex.core.optimizer.DownstreamModel;
import fr.lapetina.lex.core.optimizer.GenerationRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.LongAdder;

/**
 * Single consumer that buffers deferred generations and sends them downstream together.
 *
 * <p>A buffer is flushed when any of these holds:
 * <ul>
 *   <li>it reached the batch size</li>
 *   <li>its oldest item has waited the maximum batch wait</li>
 *   <li>an item's deadline is within the safety margin</li>
 * </ul>
 * The wait strategy wakes this handler through {@link #onTimeout(long)} while the
 * ring is idle, so time-based flushes happen without new events.
 *
 * <p>Runs on the single Disruptor consumer thread; the buffer needs no locking.
 */
final class BatchDispatchHandler implements EventHandler<BatchEvent>, TimeoutHandler, LifecycleAware {

    private static final Logger log = LoggerFactory.getLogger(BatchDispatchHandler.class);

    private final DownstreamModel downstream;
    private final int batchSize;
    private final Duration maxWait;
    private final Duration deadlineMargin;
    private final Clock clock;
    private final List<PendingItem> buffer = new ArrayList<>();

    private final LongAdder batchesDispatched = new LongAdder();
    private final LongAdder itemsDispatched = new LongAdder();

    BatchDispatchHandler(DownstreamModel downstream, int batchSize, Duration maxWait,
                         Duration deadlineMargin, Clock clock) {
        this.downstream = downstream;
        this.batchSize = batchSize;
        this.maxWait = maxWait;
        this.deadlineMargin = deadlineMargin;
        this.clock = clock;
    }

    @Override
    public void onEvent(BatchEvent event, long sequence, boolean endOfBatch) {
        buffer.add(new PendingItem(event.getRequest(), event.getEnqueuedAt(), event.getDeadline(), event.getFuture()));
        event.clear();

        if (buffer.size() >= batchSize || isDue(clock.instant())) {
            flush();
        }
    }

    @Override
    public void onTimeout(long sequence) {
        if (!buffer.isEmpty() && isDue(clock.instant())) {
            flush();
        }
    }

    @Override
    public void onStart() {
        log.debug("Batch dispatcher consumer started");
    }

    @Override
    public void onShutdown() {
        if (!buffer.isEmpty()) {
            log.info("Flushing pending batch on shutdown: size={}", buffer.size());
            flush();
        }
    }

    boolean isDue(Instant now) {
        if (buffer.isEmpty()) {
            return false;
        }
        Instant oldest = buffer.get(0).enqueuedAt();
        if (!now.isBefore(oldest.plus(maxWait))) {
            return true;
        }
        for (PendingItem item : buffer) {
            if (item.deadline() != null && !now.isBefore(item.deadline().minus(deadlineMargin))) {
                return true;
            }
        }
        return false;
    }

    private void flush() {
        List<PendingItem> items = new ArrayList<>(buffer);
        buffer.clear();

        List<GenerationRequest> requests = new ArrayList<>(items.size());
        for (PendingItem item : items) {
            requests.add(item.request());
        }

        try {
            List<String> results = downstream.generateBatch(requests);
            if (results.size() != items.size()) {
                throw new IllegalStateException(
                        "Batch result count mismatch: expected=" + items.size() + ", got=" + results.size());
            }
            for (int i = 0; i < items.size(); i++) {
                items.get(i).future().complete(results.get(i));
            }
            batchesDispatched.increment();
            itemsDispatched.add(items.size());
            log.debug("Batch dispatched: size={}", items.size());
        } catch (RuntimeException e) {
            log.warn("Batch dispatch failed: size={}, error={}", items.size(), e.getMessage());
            for (PendingItem item : items) {
                item.future().completeExceptionally(e);
            }
        }
    }

    long getBatchesDispatched() {
        return batchesDispatched.sum();
    }

    long getItemsDispatched() {
        return itemsDispatched.sum();
    }

    private record PendingItem(
            GenerationRequest request,
            Instant enqueuedAt,
            Instant deadline,
            CompletableFuture<String> future
    ) {
    }
}
