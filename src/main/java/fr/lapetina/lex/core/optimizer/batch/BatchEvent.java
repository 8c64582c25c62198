package fr.lapetina.lex.core.optimizer.batch;

import fr.lapetina.lex.core.optimizer.GenerationRequest;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;

/**
 * Ring buffer slot carrying one deferred generation.
 *
 * Slots are reused by the Disruptor: the handler copies what it needs out of
 * the event and never keeps a reference to it.
 */
public final class BatchEvent {

    private GenerationRequest request;
    private Instant enqueuedAt;
    private Instant deadline;
    private CompletableFuture<String> future;

    void initialize(GenerationRequest request, Instant enqueuedAt, Instant deadline,
                    CompletableFuture<String> future) {
        this.request = request;
        this.enqueuedAt = enqueuedAt;
        this.deadline = deadline;
        this.future = future;
    }

    void clear() {
        this.request = null;
        this.enqueuedAt = null;
        this.deadline = null;
        this.future = null;
    }

    GenerationRequest getRequest() { return request; }
    Instant getEnqueuedAt() { return enqueuedAt; }
    Instant getDeadline() { return deadline; }
    CompletableFuture<String> getFuture() { return future; }

    @Override
    public String toString() {
        return "BatchEvent{tier=" + (request != null ? request.tier() : null) + ", deadline=" + deadline + '}';
    }
}
