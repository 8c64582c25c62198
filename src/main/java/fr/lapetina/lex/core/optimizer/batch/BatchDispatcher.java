package fr.lapetina.lex.core.optimizer.batch;

import com.lmax.disruptor.InsufficientCapacityException;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.TimeoutBlockingWaitStrategy;
import com.lmax.disruptor.TimeoutException;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import fr.lapetina.lex.core.optimizer.DownstreamModel;
import fr.lapetina.lex.core.optimizer.GenerationRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Buffers low-priority cache misses and sends them downstream in batches.
 *
 * <p>Scheduler workers publish into a multi-producer ring buffer; a single
 * consumer ({@link BatchDispatchHandler}) groups them. A
 * {@link TimeoutBlockingWaitStrategy} wakes the consumer at the flush check
 * interval so time-based flushes happen while the ring is idle.
 *
 * <p>Publishing never blocks: when the ring is full, {@link #submit} returns
 * empty and the caller generates directly.
 */
public final class BatchDispatcher implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(BatchDispatcher.class);

    private final Disruptor<BatchEvent> disruptor;
    private final RingBuffer<BatchEvent> ringBuffer;
    private final BatchDispatchHandler handler;
    private final Clock clock;
    private final AtomicBoolean running = new AtomicBoolean(false);

    private BatchDispatcher(Builder builder) {
        this.clock = builder.clock;
        this.handler = new BatchDispatchHandler(
                builder.downstream,
                builder.batchSize,
                builder.maxWait,
                builder.deadlineMargin,
                builder.clock
        );

        this.disruptor = new Disruptor<>(
                new BatchEventFactory(),
                builder.ringBufferSize,
                new BatchThreadFactory("batch-dispatcher"),
                ProducerType.MULTI, // Every scheduler worker publishes
                new TimeoutBlockingWaitStrategy(builder.flushCheckInterval.toMillis(), TimeUnit.MILLISECONDS)
        );
        disruptor.handleEventsWith(handler);
        disruptor.setDefaultExceptionHandler(new BatchExceptionHandler());
        this.ringBuffer = disruptor.getRingBuffer();

        log.info("BatchDispatcher created: ringBufferSize={}, batchSize={}, maxWaitMs={}",
                builder.ringBufferSize, builder.batchSize, builder.maxWait.toMillis());
    }

    public static Builder builder() {
        return new Builder();
    }

    public void start() {
        if (running.compareAndSet(false, true)) {
            disruptor.start();
            log.info("BatchDispatcher started");
        }
    }

    /**
     * Queues a generation for the next batch.
     *
     * @param deadline the caller's deadline; the batch is flushed before it
     * @return the pending result, or empty if the dispatcher is stopped or full
     */
    public Optional<CompletableFuture<String>> submit(GenerationRequest request, Instant deadline) {
        if (!running.get()) {
            return Optional.empty();
        }

        long sequence;
        try {
            sequence = ringBuffer.tryNext();
        } catch (InsufficientCapacityException e) {
            log.warn("Batch ring buffer full, caller will generate directly: remaining={}",
                    ringBuffer.remainingCapacity());
            return Optional.empty();
        }

        CompletableFuture<String> future = new CompletableFuture<>();
        try {
            ringBuffer.get(sequence).initialize(request, clock.instant(), deadline, future);
        } finally {
            ringBuffer.publish(sequence);
        }
        return Optional.of(future);
    }

    public long getBatchesDispatched() {
        return handler.getBatchesDispatched();
    }

    public long getItemsDispatched() {
        return handler.getItemsDispatched();
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Drains the ring and flushes the last partial batch.
     */
    @Override
    public void close() {
        if (running.compareAndSet(true, false)) {
            log.info("Shutting down BatchDispatcher...");
            try {
                disruptor.shutdown(10, TimeUnit.SECONDS);
                log.info("BatchDispatcher shut down gracefully");
            } catch (TimeoutException e) {
                log.warn("BatchDispatcher shutdown timed out, halting...");
                disruptor.halt();
            }
        }
    }

    private static final class BatchThreadFactory implements ThreadFactory {
        private final String namePrefix;
        private final AtomicInteger counter = new AtomicInteger(0);

        BatchThreadFactory(String namePrefix) {
            this.namePrefix = namePrefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, namePrefix + "-" + counter.getAndIncrement());
            t.setDaemon(false);
            return t;
        }
    }

    private static final class BatchExceptionHandler implements com.lmax.disruptor.ExceptionHandler<BatchEvent> {

        @Override
        public void handleEventException(Throwable ex, long sequence, BatchEvent event) {
            log.error("Exception in batch handler: sequence={}, event={}", sequence, event, ex);
            if (event.getFuture() != null && !event.getFuture().isDone()) {
                event.getFuture().completeExceptionally(ex);
            }
        }

        @Override
        public void handleOnStartException(Throwable ex) {
            log.error("Exception during batch dispatcher start", ex);
        }

        @Override
        public void handleOnShutdownException(Throwable ex) {
            log.error("Exception during batch dispatcher shutdown", ex);
        }
    }

    public static final class Builder {
        private DownstreamModel downstream;
        private int ringBufferSize = 1024;
        private int batchSize = 10;
        private Duration maxWait = Duration.ofSeconds(2);
        private Duration deadlineMargin = Duration.ofMillis(500);
        private Duration flushCheckInterval = Duration.ofMillis(50);
        private Clock clock = Clock.systemUTC();

        public Builder downstream(DownstreamModel downstream) {
            this.downstream = downstream;
            return this;
        }

        public Builder ringBufferSize(int ringBufferSize) {
            this.ringBufferSize = ringBufferSize;
            return this;
        }

        public Builder batchSize(int batchSize) {
            this.batchSize = batchSize;
            return this;
        }

        public Builder maxWait(Duration maxWait) {
            this.maxWait = maxWait;
            return this;
        }

        public Builder deadlineMargin(Duration deadlineMargin) {
            this.deadlineMargin = deadlineMargin;
            return this;
        }

        public Builder flushCheckInterval(Duration flushCheckInterval) {
            this.flushCheckInterval = flushCheckInterval;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public BatchDispatcher build() {
            Objects.requireNonNull(downstream, "Downstream model is required");
            if (Integer.bitCount(ringBufferSize) != 1) {
                throw new IllegalArgumentException("ringBufferSize must be a power of 2");
            }
            if (batchSize < 1) {
                throw new IllegalArgumentException("batchSize must be >= 1");
            }
            return new BatchDispatcher(this);
        }
    }
}
