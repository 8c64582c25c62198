package fr.lapetina.lex.core.scheduler;

import fr.lapetina.lex.core.domain.model.ErrorType;
import fr.lapetina.lex.core.domain.model.HandlerResult;
import fr.lapetina.lex.core.domain.model.QueuedRequest;
import fr.lapetina.lex.core.domain.model.RequestPriority;
import fr.lapetina.lex.core.domain.model.RequestSnapshot;
import fr.lapetina.lex.core.domain.model.RequestStatus;
import fr.lapetina.lex.core.infrastructure.cache.CacheKeyGenerator;
import fr.lapetina.lex.core.infrastructure.http.CircuitBreaker;
import fr.lapetina.lex.core.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.lex.core.scheduler.admission.CircuitBreakerRegistry;
import fr.lapetina.lex.core.scheduler.admission.RateLimiter;
import fr.lapetina.lex.core.scheduler.exception.AdmissionException;
import org.apache.commons.codec.digest.DigestUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Admission control and priority scheduling for downstream work.
 *
 * <p>Admission ({@link #submit}) runs these checks in order and throws
 * {@link AdmissionException} on the first failure:
 * <ol>
 *   <li>pending queue capacity</li>
 *   <li>per-user sliding-window rate limit</li>
 *   <li>per-type circuit breaker; a half-open breaker admits a single probe</li>
 *   <li>deduplication on (type, payload) against queued and in-flight requests</li>
 * </ol>
 *
 * <p>A fixed set of worker threads pops requests in (priority, arrival) order.
 * Each attempt runs on a handler thread bounded by the request's remaining
 * deadline; queue wait and execution share that single deadline. Handler
 * results drive the breaker and the retry loop: only retryable results are
 * retried, with exponential backoff.
 *
 * <p>Every accepted request reaches a terminal status retrievable through
 * {@link #getStatus}, including on shutdown, where unfinished requests are cancelled.
 */
public final class RequestScheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RequestScheduler.class);

    private static final Comparator<QueuedRequest> DISPATCH_ORDER = Comparator
            .comparingInt((QueuedRequest r) -> r.priority().level())
            .thenComparing(QueuedRequest::createdAt)
            .thenComparingLong(QueuedRequest::sequence);

    private static final Duration DEADLINE_PADDING = Duration.ofMillis(1);

    private final int workerCount;
    private final int maxQueueSize;
    private final int maxRetries;
    private final int completedHistorySize;
    private final Duration defaultTimeout;
    private final Duration initialBackoff;
    private final Duration maxBackoff;
    private final Duration shutdownTimeout;
    private final RateLimiter rateLimiter;
    private final CircuitBreakerRegistry breakers;
    private final MetricsRegistry metricsRegistry;
    private final RequestHandler defaultHandler;
    private final Map<String, RequestHandler> handlers;
    private final Clock clock;

    // Queue state, guarded by queueLock
    private final PriorityQueue<QueuedRequest> queue = new PriorityQueue<>(DISPATCH_ORDER);
    private final Map<String, String> fingerprints = new HashMap<>();
    private final ReentrantLock queueLock = new ReentrantLock();
    private final Condition notEmpty = queueLock.newCondition();

    private final Map<String, QueuedRequest> active = new ConcurrentHashMap<>();
    private final Map<String, Future<HandlerResult>> inFlight = new ConcurrentHashMap<>();
    private final Map<String, QueuedRequest> history;
    private final AtomicLong sequence = new AtomicLong();

    private final List<Worker> workers = new ArrayList<>();
    private final ExecutorService workerExecutor;
    private final ExecutorService handlerExecutor;
    private final ScheduledExecutorService retryExecutor;
    private final AtomicBoolean running = new AtomicBoolean(false);

    // Counters
    private final LongAdder submitted = new LongAdder();
    private final LongAdder deduplicated = new LongAdder();
    private final LongAdder completed = new LongAdder();
    private final LongAdder failed = new LongAdder();
    private final LongAdder timedOut = new LongAdder();
    private final LongAdder cancelled = new LongAdder();
    private final LongAdder retries = new LongAdder();
    private final LongAdder processedAttempts = new LongAdder();
    private final LongAdder processingNanos = new LongAdder();
    private final Map<AdmissionException.Reason, LongAdder> rejections = new EnumMap<>(AdmissionException.Reason.class);

    private RequestScheduler(Builder builder) {
        this.workerCount = builder.workers;
        this.maxQueueSize = builder.maxQueueSize;
        this.maxRetries = builder.maxRetries;
        this.completedHistorySize = builder.completedHistorySize;
        this.defaultTimeout = builder.defaultTimeout;
        this.initialBackoff = builder.initialBackoff;
        this.maxBackoff = builder.maxBackoff;
        this.shutdownTimeout = builder.shutdownTimeout;
        this.rateLimiter = builder.rateLimiter;
        this.breakers = builder.breakerRegistry;
        this.metricsRegistry = builder.metricsRegistry;
        this.defaultHandler = builder.defaultHandler;
        this.handlers = Map.copyOf(builder.handlers);
        this.clock = builder.clock;

        for (AdmissionException.Reason reason : AdmissionException.Reason.values()) {
            rejections.put(reason, new LongAdder());
        }

        int historyLimit = completedHistorySize;
        this.history = new LinkedHashMap<>() {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, QueuedRequest> eldest) {
                return size() > historyLimit;
            }
        };

        this.workerExecutor = Executors.newFixedThreadPool(workerCount, new NamedThreadFactory("scheduler-worker"));
        this.handlerExecutor = Executors.newCachedThreadPool(new NamedThreadFactory("scheduler-handler"));
        this.retryExecutor = Executors.newSingleThreadScheduledExecutor(new NamedThreadFactory("scheduler-retry"));

        if (metricsRegistry != null) {
            metricsRegistry.registerGauge("queue_depth", "Requests waiting for a worker", this::queueDepth);
            metricsRegistry.registerGauge("active_requests", "Requests not yet terminal", active::size);
            metricsRegistry.registerGauge("open_circuit_breakers", "Circuit breakers not closed", breakers::openCount);
        }

        log.info("RequestScheduler created: workers={}, maxQueueSize={}, maxRetries={}, defaultTimeoutMs={}",
                workerCount, maxQueueSize, maxRetries, defaultTimeout.toMillis());
    }

    public static Builder builder() {
        return new Builder();
    }

    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        for (int i = 0; i < workerCount; i++) {
            Worker worker = new Worker("worker-" + i);
            workers.add(worker);
            workerExecutor.execute(() -> runWorker(worker));
        }
        log.info("RequestScheduler started with {} workers", workerCount);
    }

    // ==================== ADMISSION ====================

    public String submit(String requestType, Map<String, Object> payload, String userId) {
        return submit(requestType, payload, userId, RequestPriority.NORMAL, defaultTimeout, true);
    }

    public String submit(String requestType, Map<String, Object> payload, String userId, RequestPriority priority) {
        return submit(requestType, payload, userId, priority, defaultTimeout, true);
    }

    /**
     * Admits a request and returns its id. Execution outcomes are read back with
     * {@link #getStatus}; only admission failures are thrown.
     *
     * @param timeout     deadline measured from now, covering queue wait and execution
     * @param deduplicate return the id of an identical queued or in-flight request instead of queueing
     * @throws AdmissionException if the request is rejected
     */
    public String submit(String requestType, Map<String, Object> payload, String userId,
                         RequestPriority priority, Duration timeout, boolean deduplicate) {
        Objects.requireNonNull(requestType, "Request type is required");
        Objects.requireNonNull(userId, "User id is required");
        Map<String, Object> safePayload = payload != null ? payload : Map.of();
        RequestPriority safePriority = priority != null ? priority : RequestPriority.NORMAL;
        Duration safeTimeout = timeout != null ? timeout : defaultTimeout;

        if (!running.get()) {
            throw reject(AdmissionException.Reason.NOT_RUNNING, requestType, "type=" + requestType);
        }

        // 1. Capacity
        int depth = queueDepth();
        if (depth >= maxQueueSize) {
            throw reject(AdmissionException.Reason.QUEUE_FULL, requestType, "depth=" + depth);
        }

        // 2. Rate limit
        if (rateLimiter != null && !rateLimiter.tryAcquire(userId)) {
            throw reject(AdmissionException.Reason.RATE_LIMITED, requestType, "userId=" + userId);
        }

        // 3. Circuit breaker
        CircuitBreaker breaker = breakers.forType(requestType);
        CircuitBreaker.Permit permit = breaker.tryAcquire();
        if (permit == CircuitBreaker.Permit.REJECTED) {
            throw reject(AdmissionException.Reason.CIRCUIT_OPEN, requestType,
                    "type=" + requestType + ", retryInMs=" + breaker.timeUntilRetry().toMillis());
        }
        boolean probe = permit == CircuitBreaker.Permit.PROBE;

        // 4-5. Deduplication and enqueue
        String fingerprint = deduplicate ? fingerprint(requestType, safePayload) : null;
        QueuedRequest request;
        queueLock.lock();
        try {
            if (fingerprint != null) {
                String existingId = fingerprints.get(fingerprint);
                if (existingId != null) {
                    if (probe) {
                        breaker.releaseProbe();
                    }
                    deduplicated.increment();
                    recordAdmission(requestType, "deduplicated");
                    log.debug("Request deduplicated: requestId={}, type={}, userId={}",
                            existingId, requestType, userId);
                    return existingId;
                }
            }

            if (queue.size() >= maxQueueSize) {
                if (probe) {
                    breaker.releaseProbe();
                }
                throw reject(AdmissionException.Reason.QUEUE_FULL, requestType, "depth=" + queue.size());
            }

            request = QueuedRequest.builder()
                    .id(UUID.randomUUID().toString())
                    .userId(userId)
                    .requestType(requestType)
                    .priority(safePriority)
                    .payload(safePayload)
                    .createdAt(clock.instant())
                    .timeout(safeTimeout)
                    .maxRetries(maxRetries)
                    .sequence(sequence.getAndIncrement())
                    .fingerprint(fingerprint)
                    .probe(probe)
                    .build();

            active.put(request.id(), request);
            if (fingerprint != null) {
                fingerprints.put(fingerprint, request.id());
            }
            queue.offer(request);
            notEmpty.signal();
        } finally {
            queueLock.unlock();
        }

        submitted.increment();
        recordAdmission(requestType, "admitted");
        log.info("Request queued: requestId={}, type={}, priority={}, userId={}, probe={}",
                request.id(), requestType, safePriority, userId, probe);
        return request.id();
    }

    /**
     * Snapshot of an active or recently finished request.
     */
    public Optional<RequestSnapshot> getStatus(String requestId) {
        QueuedRequest request = active.get(requestId);
        if (request == null) {
            synchronized (history) {
                request = history.get(requestId);
            }
        }
        return request != null ? Optional.of(request.snapshot()) : Optional.empty();
    }

    /**
     * Cancels a queued or in-flight request. An in-flight handler is interrupted.
     *
     * @return false if the request is unknown or already terminal
     */
    public boolean cancel(String requestId) {
        QueuedRequest request = active.get(requestId);
        if (request == null) {
            return false;
        }

        queueLock.lock();
        try {
            queue.remove(request);
        } finally {
            queueLock.unlock();
        }

        if (!request.tryCancel("Cancelled by caller", clock.instant())) {
            return false;
        }

        Future<HandlerResult> future = inFlight.get(requestId);
        if (future != null) {
            future.cancel(true);
        }
        releaseProbe(request);
        finish(request);
        return true;
    }

    // ==================== WORKERS ====================

    private void runWorker(Worker worker) {
        log.debug("Worker started: workerId={}", worker.id);
        while (running.get()) {
            QueuedRequest request;
            try {
                request = take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            if (request == null) {
                continue;
            }

            MDC.put("requestId", request.id());
            MDC.put("requestType", request.requestType());
            MDC.put("userId", request.userId());
            MDC.put("workerId", worker.id);
            try {
                process(worker, request);
            } catch (RuntimeException e) {
                log.error("Unexpected error while processing: requestId={}", request.id(), e);
                if (request.tryFail(ErrorType.INTERNAL_ERROR, e.getMessage(), clock.instant())) {
                    releaseProbe(request);
                    finish(request);
                }
            } finally {
                worker.idle();
                MDC.clear();
            }
        }
        log.debug("Worker stopped: workerId={}", worker.id);
    }

    private QueuedRequest take() throws InterruptedException {
        queueLock.lock();
        try {
            while (queue.isEmpty() && running.get()) {
                notEmpty.await();
            }
            return running.get() ? queue.poll() : null;
        } finally {
            queueLock.unlock();
        }
    }

    private void process(Worker worker, QueuedRequest request) {
        Instant now = clock.instant();
        if (request.status() != RequestStatus.QUEUED) {
            return;
        }

        if (request.isExpired(now)) {
            if (request.tryTimeOut("Deadline passed while queued", now)) {
                releaseProbe(request);
                finish(request);
            }
            return;
        }

        CircuitBreaker breaker = breakers.forType(request.requestType());
        if (!request.isProbe()) {
            CircuitBreaker.Permit permit = breaker.tryAcquire();
            if (permit == CircuitBreaker.Permit.REJECTED) {
                Duration delay = breaker.timeUntilRetry();
                log.debug("Dispatch deferred, circuit open: requestId={}, delayMs={}", request.id(), delay.toMillis());
                requeueLater(request, capToDeadline(request, delay, now));
                return;
            }
            if (permit == CircuitBreaker.Permit.PROBE) {
                request.markProbe();
            }
        }

        if (!request.tryStartProcessing(worker.id, now)) {
            releaseProbe(request);
            return;
        }

        worker.busy(now);
        long startNanos = System.nanoTime();
        HandlerResult result = invoke(request);
        long elapsedNanos = System.nanoTime() - startNanos;

        worker.record(elapsedNanos);
        processedAttempts.increment();
        processingNanos.add(elapsedNanos);
        if (metricsRegistry != null) {
            metricsRegistry.recordDispatchLatency(request.requestType(), Duration.ofNanos(elapsedNanos));
        }

        applyResult(request, breaker, result);
    }

    private HandlerResult invoke(QueuedRequest request) {
        RequestHandler handler = handlers.getOrDefault(request.requestType(), defaultHandler);
        if (handler == null) {
            return HandlerResult.fatal(ErrorType.VALIDATION_ERROR,
                    "No handler registered for request type " + request.requestType());
        }

        Instant deadline = request.deadline();
        Map<String, String> context = MDC.getCopyOfContextMap();
        Future<HandlerResult> future;
        try {
            future = handlerExecutor.submit(() -> {
                if (context != null) {
                    MDC.setContextMap(context);
                }
                try {
                    return handler.handle(request, deadline);
                } finally {
                    MDC.clear();
                }
            });
        } catch (RejectedExecutionException e) {
            return HandlerResult.fatal(ErrorType.CANCELLED, "Scheduler is shutting down");
        }

        inFlight.put(request.id(), future);
        try {
            // Cancelled between start and registration
            if (request.status() == RequestStatus.CANCELLED) {
                future.cancel(true);
            }
            long remainingNanos = request.remaining(clock.instant()).toNanos();
            HandlerResult result = future.get(remainingNanos, TimeUnit.NANOSECONDS);
            return result != null
                    ? result
                    : HandlerResult.fatal(ErrorType.INTERNAL_ERROR, "Handler returned no result");
        } catch (TimeoutException e) {
            future.cancel(true);
            return HandlerResult.fatal(ErrorType.TIMEOUT,
                    "Deadline exceeded after " + request.timeout().toMillis() + "ms");
        } catch (CancellationException e) {
            return HandlerResult.fatal(ErrorType.CANCELLED, "Handler cancelled");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            log.warn("Handler threw: requestId={}, error={}", request.id(), cause.toString());
            return HandlerResult.retryable(ErrorType.DOWNSTREAM_ERROR, cause.getMessage());
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return HandlerResult.fatal(ErrorType.CANCELLED, "Worker interrupted");
        } finally {
            inFlight.remove(request.id());
        }
    }

    private void applyResult(QueuedRequest request, CircuitBreaker breaker, HandlerResult result) {
        boolean heldProbe = request.releaseProbe();
        Instant now = clock.instant();

        if (request.status() == RequestStatus.CANCELLED || result.errorType() == ErrorType.CANCELLED) {
            if (heldProbe) {
                breaker.releaseProbe();
            }
            if (request.tryCancel(result.message(), now)) {
                finish(request);
            }
            return;
        }

        if (result.errorType() == ErrorType.TIMEOUT) {
            breaker.recordFailure();
            if (request.tryTimeOut(result.message(), now)) {
                finish(request);
            }
            return;
        }

        switch (result.kind()) {
            case OK -> {
                breaker.recordSuccess();
                if (request.tryComplete(result.value(), now)) {
                    finish(request);
                }
            }
            case RETRYABLE -> {
                breaker.recordFailure();
                retryOrFail(request, result, now);
            }
            case FATAL -> {
                // Bad input says nothing about downstream health
                if (result.errorType() == ErrorType.VALIDATION_ERROR) {
                    if (heldProbe) {
                        breaker.releaseProbe();
                    }
                } else {
                    breaker.recordFailure();
                }
                if (request.tryFail(result.errorType(), result.message(), now)) {
                    finish(request);
                }
            }
        }
    }

    private void retryOrFail(QueuedRequest request, HandlerResult result, Instant now) {
        int attempt = request.retryCount();
        if (!request.tryRequeueForRetry(result.errorType(), result.message())) {
            String message = "Retries exhausted after " + (attempt + 1) + " attempts: " + result.message();
            if (request.tryFail(result.errorType(), message, now)) {
                finish(request);
            }
            return;
        }

        retries.increment();
        if (metricsRegistry != null) {
            metricsRegistry.incrementRetries(request.requestType(), result.errorType());
        }
        Duration backoff = backoff(attempt);
        log.warn("Retrying request: requestId={}, attempt={}, maxRetries={}, backoffMs={}, error={}",
                request.id(), attempt + 1, request.maxRetries(), backoff.toMillis(), result.message());
        requeueLater(request, capToDeadline(request, backoff, now));
    }

    /**
     * min(initialBackoff * 2^attempt, maxBackoff).
     */
    Duration backoff(int attempt) {
        if (attempt >= 30) {
            return maxBackoff;
        }
        Duration delay = initialBackoff.multipliedBy(1L << attempt);
        return delay.compareTo(maxBackoff) > 0 ? maxBackoff : delay;
    }

    private static Duration capToDeadline(QueuedRequest request, Duration delay, Instant now) {
        // Wake just past the deadline so the worker times the request out
        Duration untilExpiry = request.remaining(now).plus(DEADLINE_PADDING);
        return delay.compareTo(untilExpiry) > 0 ? untilExpiry : delay;
    }

    private void requeueLater(QueuedRequest request, Duration delay) {
        try {
            retryExecutor.schedule(() -> requeue(request), delay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            if (request.tryCancel("Scheduler is shutting down", clock.instant())) {
                releaseProbe(request);
                finish(request);
            }
        }
    }

    private void requeue(QueuedRequest request) {
        queueLock.lock();
        try {
            if (running.get() && request.status() == RequestStatus.QUEUED) {
                queue.offer(request);
                notEmpty.signal();
            }
        } finally {
            queueLock.unlock();
        }
    }

    // ==================== BOOKKEEPING ====================

    private void finish(QueuedRequest request) {
        synchronized (history) {
            history.put(request.id(), request);
        }
        active.remove(request.id());
        if (request.fingerprint() != null) {
            queueLock.lock();
            try {
                fingerprints.remove(request.fingerprint(), request.id());
            } finally {
                queueLock.unlock();
            }
        }

        RequestStatus status = request.status();
        switch (status) {
            case COMPLETED -> completed.increment();
            case FAILED -> failed.increment();
            case TIMED_OUT -> timedOut.increment();
            case CANCELLED -> cancelled.increment();
            default -> {
                // not terminal
            }
        }
        if (metricsRegistry != null) {
            metricsRegistry.incrementTerminal(request.requestType(), status);
        }

        if (status == RequestStatus.COMPLETED) {
            log.info("Request completed: requestId={}, type={}, retries={}",
                    request.id(), request.requestType(), request.retryCount());
        } else {
            log.warn("Request finished: requestId={}, type={}, status={}, errorType={}, error={}",
                    request.id(), request.requestType(), status, request.errorType(), request.error());
        }
    }

    private void releaseProbe(QueuedRequest request) {
        if (request.releaseProbe()) {
            breakers.forType(request.requestType()).releaseProbe();
        }
    }

    private AdmissionException reject(AdmissionException.Reason reason, String requestType, String details) {
        rejections.get(reason).increment();
        recordAdmission(requestType, reason.name().toLowerCase(Locale.ROOT));
        log.warn("Request rejected: type={}, reason={}, {}", requestType, reason, details);
        return new AdmissionException(reason, details);
    }

    private void recordAdmission(String requestType, String outcome) {
        if (metricsRegistry != null) {
            metricsRegistry.incrementAdmission(requestType, outcome);
        }
    }

    static String fingerprint(String requestType, Map<String, Object> payload) {
        return DigestUtils.sha256Hex(requestType + ":" + CacheKeyGenerator.canonicalJson(payload));
    }

    // ==================== STATISTICS ====================

    public int queueDepth() {
        queueLock.lock();
        try {
            return queue.size();
        } finally {
            queueLock.unlock();
        }
    }

    public int activeCount() {
        return active.size();
    }

    public boolean isRunning() {
        return running.get();
    }

    public SchedulerStatistics statistics() {
        Map<String, Long> rejected = new TreeMap<>();
        rejections.forEach((reason, count) -> rejected.put(reason.name(), count.sum()));

        List<WorkerStats> workerStats = new ArrayList<>();
        for (Worker worker : workers) {
            workerStats.add(worker.snapshot());
        }

        long attempts = processedAttempts.sum();
        return new SchedulerStatistics(
                queueDepth(),
                active.size(),
                submitted.sum(),
                deduplicated.sum(),
                completed.sum(),
                failed.sum(),
                timedOut.sum(),
                cancelled.sum(),
                retries.sum(),
                rejected,
                attempts == 0 ? 0.0 : processingNanos.sum() / 1_000_000.0 / attempts,
                workerStats,
                rateLimiter != null ? rateLimiter.activeUsers() : 0,
                breakers.openCount(),
                breakers.states()
        );
    }

    // ==================== LIFECYCLE ====================

    /**
     * Stops the workers and cancels every request that has not finished.
     */
    @Override
    public void close() {
        if (!running.compareAndSet(true, false)) {
            workerExecutor.shutdownNow();
            retryExecutor.shutdownNow();
            handlerExecutor.shutdownNow();
            return;
        }
        log.info("Shutting down RequestScheduler...");

        queueLock.lock();
        try {
            queue.clear();
            notEmpty.signalAll();
        } finally {
            queueLock.unlock();
        }

        workerExecutor.shutdown();
        try {
            if (!workerExecutor.awaitTermination(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Workers did not stop in time, interrupting");
                workerExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            workerExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }

        retryExecutor.shutdownNow();
        handlerExecutor.shutdownNow();

        Instant now = clock.instant();
        int abandoned = 0;
        for (QueuedRequest request : new ArrayList<>(active.values())) {
            if (request.tryCancel("Scheduler shut down", now)) {
                releaseProbe(request);
                finish(request);
                abandoned++;
            }
        }
        log.info("RequestScheduler shut down: cancelled={}", abandoned);
    }

    // ==================== INTERNALS ====================

    private static final class Worker {
        private final String id;
        private final AtomicLong processed = new AtomicLong();
        private final AtomicLong totalNanos = new AtomicLong();
        private volatile Instant lastRequestAt;
        private volatile boolean processing;

        Worker(String id) {
            this.id = id;
        }

        void busy(Instant now) {
            lastRequestAt = now;
            processing = true;
        }

        void record(long nanos) {
            processed.incrementAndGet();
            totalNanos.addAndGet(nanos);
        }

        void idle() {
            processing = false;
        }

        WorkerStats snapshot() {
            return new WorkerStats(id, processed.get(), Duration.ofNanos(totalNanos.get()), lastRequestAt,
                    processing ? WorkerStats.State.PROCESSING : WorkerStats.State.IDLE);
        }
    }

    private static final class NamedThreadFactory implements ThreadFactory {
        private final String namePrefix;
        private final AtomicInteger counter = new AtomicInteger(0);

        NamedThreadFactory(String namePrefix) {
            this.namePrefix = namePrefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, namePrefix + "-" + counter.getAndIncrement());
            t.setDaemon(false);
            return t;
        }
    }

    public static final class Builder {
        private int workers = 4;
        private int maxQueueSize = 1000;
        private int maxRetries = 3;
        private int completedHistorySize = 1000;
        private Duration defaultTimeout = Duration.ofSeconds(30);
        private Duration initialBackoff = Duration.ofSeconds(1);
        private Duration maxBackoff = Duration.ofSeconds(60);
        private Duration shutdownTimeout = Duration.ofSeconds(10);
        private RateLimiter rateLimiter;
        private CircuitBreakerRegistry breakerRegistry;
        private MetricsRegistry metricsRegistry;
        private RequestHandler defaultHandler;
        private final Map<String, RequestHandler> handlers = new HashMap<>();
        private Clock clock = Clock.systemUTC();

        public Builder workers(int workers) {
            this.workers = workers;
            return this;
        }

        public Builder maxQueueSize(int maxQueueSize) {
            this.maxQueueSize = maxQueueSize;
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder completedHistorySize(int completedHistorySize) {
            this.completedHistorySize = completedHistorySize;
            return this;
        }

        public Builder defaultTimeout(Duration defaultTimeout) {
            this.defaultTimeout = defaultTimeout;
            return this;
        }

        public Builder initialBackoff(Duration initialBackoff) {
            this.initialBackoff = initialBackoff;
            return this;
        }

        public Builder maxBackoff(Duration maxBackoff) {
            this.maxBackoff = maxBackoff;
            return this;
        }

        public Builder shutdownTimeout(Duration shutdownTimeout) {
            this.shutdownTimeout = shutdownTimeout;
            return this;
        }

        public Builder rateLimiter(RateLimiter rateLimiter) {
            this.rateLimiter = rateLimiter;
            return this;
        }

        public Builder breakerRegistry(CircuitBreakerRegistry breakerRegistry) {
            this.breakerRegistry = breakerRegistry;
            return this;
        }

        public Builder metricsRegistry(MetricsRegistry metricsRegistry) {
            this.metricsRegistry = metricsRegistry;
            return this;
        }

        public Builder defaultHandler(RequestHandler defaultHandler) {
            this.defaultHandler = defaultHandler;
            return this;
        }

        public Builder handler(String requestType, RequestHandler handler) {
            this.handlers.put(requestType, handler);
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public RequestScheduler build() {
            if (workers < 1) {
                throw new IllegalArgumentException("workers must be >= 1");
            }
            if (maxQueueSize < 1) {
                throw new IllegalArgumentException("maxQueueSize must be >= 1");
            }
            if (maxRetries < 0) {
                throw new IllegalArgumentException("maxRetries must be >= 0");
            }
            if (breakerRegistry == null) {
                breakerRegistry = new CircuitBreakerRegistry(5, Duration.ofSeconds(60), clock);
            }
            return new RequestScheduler(this);
        }
    }
}
