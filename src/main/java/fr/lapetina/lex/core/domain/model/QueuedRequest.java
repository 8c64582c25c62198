package fr.lapetina.lex.core.domain.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * A request admitted into the scheduler.
 *
 * <p>Identity, payload and deadline are immutable. Status, retry count and
 * outcome change under the instance monitor, and no transition leaves a
 * terminal status. Every {@code try*} method returns whether the caller won
 * the transition, so exactly one thread finalizes a request.
 */
public final class QueuedRequest {

    private final String id;
    private final String userId;
    private final String requestType;
    private final RequestPriority priority;
    private final Map<String, Object> payload;
    private final Instant createdAt;
    private final Duration timeout;
    private final int maxRetries;
    private final long sequence;
    private final String fingerprint;

    private RequestStatus status = RequestStatus.QUEUED;
    private int retryCount;
    private boolean probe;
    private Object result;
    private ErrorType errorType;
    private String error;
    private Instant startedAt;
    private Instant completedAt;
    private String workerId;

    private QueuedRequest(Builder builder) {
        this.id = builder.id != null ? builder.id : UUID.randomUUID().toString();
        this.userId = Objects.requireNonNull(builder.userId, "User id is required");
        this.requestType = Objects.requireNonNull(builder.requestType, "Request type is required");
        this.priority = builder.priority != null ? builder.priority : RequestPriority.NORMAL;
        this.payload = builder.payload != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(builder.payload))
                : Map.of();
        this.createdAt = builder.createdAt != null ? builder.createdAt : Instant.now();
        this.timeout = Objects.requireNonNull(builder.timeout, "Timeout is required");
        if (builder.maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0");
        }
        this.maxRetries = builder.maxRetries;
        this.sequence = builder.sequence;
        this.fingerprint = builder.fingerprint;
        this.probe = builder.probe;
    }

    public static Builder builder() {
        return new Builder();
    }

    // ==================== TRANSITIONS ====================

    /**
     * QUEUED to PROCESSING, taken by the worker that dispatches the request.
     */
    public synchronized boolean tryStartProcessing(String workerId, Instant now) {
        if (status != RequestStatus.QUEUED) {
            return false;
        }
        status = RequestStatus.PROCESSING;
        this.workerId = workerId;
        if (startedAt == null) {
            startedAt = now;
        }
        return true;
    }

    /**
     * PROCESSING back to QUEUED for another attempt, consuming one retry.
     */
    public synchronized boolean tryRequeueForRetry(ErrorType lastErrorType, String lastError) {
        if (status != RequestStatus.PROCESSING || retryCount >= maxRetries) {
            return false;
        }
        retryCount++;
        status = RequestStatus.QUEUED;
        errorType = lastErrorType;
        error = lastError;
        return true;
    }

    public synchronized boolean tryComplete(Object value, Instant now) {
        if (status != RequestStatus.PROCESSING) {
            return false;
        }
        status = RequestStatus.COMPLETED;
        result = value;
        errorType = null;
        error = null;
        completedAt = now;
        return true;
    }

    public synchronized boolean tryFail(ErrorType type, String message, Instant now) {
        if (status.isTerminal()) {
            return false;
        }
        status = RequestStatus.FAILED;
        errorType = type;
        error = message;
        completedAt = now;
        return true;
    }

    public synchronized boolean tryTimeOut(String message, Instant now) {
        if (status.isTerminal()) {
            return false;
        }
        status = RequestStatus.TIMED_OUT;
        errorType = ErrorType.TIMEOUT;
        error = message;
        completedAt = now;
        return true;
    }

    public synchronized boolean tryCancel(String message, Instant now) {
        if (status.isTerminal()) {
            return false;
        }
        status = RequestStatus.CANCELLED;
        errorType = ErrorType.CANCELLED;
        error = message;
        completedAt = now;
        return true;
    }

    /**
     * Marks this request as the half-open probe of its request type.
     */
    public synchronized void markProbe() {
        probe = true;
    }

    /**
     * Clears the probe flag.
     *
     * @return true if this request was holding the probe
     */
    public synchronized boolean releaseProbe() {
        boolean held = probe;
        probe = false;
        return held;
    }

    // ==================== QUERIES ====================

    public Instant deadline() {
        return createdAt.plus(timeout);
    }

    public boolean isExpired(Instant now) {
        return now.isAfter(deadline());
    }

    public Duration remaining(Instant now) {
        Duration remaining = Duration.between(now, deadline());
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }

    public synchronized RequestSnapshot snapshot() {
        return new RequestSnapshot(
                id, userId, requestType, priority, status, createdAt, startedAt, completedAt,
                timeout, retryCount, maxRetries, workerId, result, errorType, error
        );
    }

    public String id() { return id; }
    public String userId() { return userId; }
    public String requestType() { return requestType; }
    public RequestPriority priority() { return priority; }
    public Map<String, Object> payload() { return payload; }
    public Instant createdAt() { return createdAt; }
    public Duration timeout() { return timeout; }
    public int maxRetries() { return maxRetries; }
    public long sequence() { return sequence; }
    public String fingerprint() { return fingerprint; }

    public synchronized RequestStatus status() { return status; }
    public synchronized int retryCount() { return retryCount; }
    public synchronized boolean isProbe() { return probe; }
    public synchronized Object result() { return result; }
    public synchronized ErrorType errorType() { return errorType; }
    public synchronized String error() { return error; }

    @Override
    public String toString() {
        return "QueuedRequest{" +
                "id='" + id + '\'' +
                ", type='" + requestType + '\'' +
                ", priority=" + priority +
                ", status=" + status() +
                ", retries=" + retryCount() +
                '}';
    }

    public static final class Builder {
        private String id;
        private String userId;
        private String requestType;
        private RequestPriority priority;
        private Map<String, Object> payload;
        private Instant createdAt;
        private Duration timeout = Duration.ofSeconds(30);
        private int maxRetries = 3;
        private long sequence;
        private String fingerprint;
        private boolean probe;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder userId(String userId) {
            this.userId = userId;
            return this;
        }

        public Builder requestType(String requestType) {
            this.requestType = requestType;
            return this;
        }

        public Builder priority(RequestPriority priority) {
            this.priority = priority;
            return this;
        }

        public Builder payload(Map<String, Object> payload) {
            this.payload = payload;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder sequence(long sequence) {
            this.sequence = sequence;
            return this;
        }

        public Builder fingerprint(String fingerprint) {
            this.fingerprint = fingerprint;
            return this;
        }

        public Builder probe(boolean probe) {
            this.probe = probe;
            return this;
        }

        public QueuedRequest build() {
            return new QueuedRequest(this);
        }
    }
}
