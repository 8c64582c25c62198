package fr.lapetina.lex.core.scheduler.admission;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Per-user sliding-window rate limiter with a minute and an hour window.
 *
 * Each user keeps the timestamps of admitted requests from the trailing hour.
 * A request is admitted only if it fits both windows, and only admitted
 * requests are recorded.
 */
public final class RateLimiter {

    private static final Logger log = LoggerFactory.getLogger(RateLimiter.class);

    private static final long MINUTE_MS = 60_000L;
    private static final long HOUR_MS = 3_600_000L;

    private final int limitPerMinute;
    private final int limitPerHour;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, Deque<Long>> windows = new HashMap<>();
    private long lastSweepMillis;

    public RateLimiter(int limitPerMinute, int limitPerHour, Clock clock) {
        if (limitPerMinute < 1 || limitPerHour < 1) {
            throw new IllegalArgumentException("Rate limits must be >= 1");
        }
        this.limitPerMinute = limitPerMinute;
        this.limitPerHour = limitPerHour;
        this.clock = clock;
        this.lastSweepMillis = clock.millis();
    }

    public RateLimiter(int limitPerMinute, int limitPerHour) {
        this(limitPerMinute, limitPerHour, Clock.systemUTC());
    }

    /**
     * Records a request for the user if both windows have room.
     *
     * @return true if admitted, false if the user is over a limit
     */
    public boolean tryAcquire(String userId) {
        long now = clock.millis();
        lock.lock();
        try {
            if (now - lastSweepMillis >= MINUTE_MS) {
                sweep(now - HOUR_MS);
                lastSweepMillis = now;
            }
            Deque<Long> timestamps = windows.computeIfAbsent(userId, k -> new ArrayDeque<>());
            evictOlderThan(timestamps, now - HOUR_MS);

            if (timestamps.size() >= limitPerHour) {
                log.debug("Hourly limit reached: userId={}, count={}", userId, timestamps.size());
                return false;
            }
            int lastMinute = countSince(timestamps, now - MINUTE_MS);
            if (lastMinute >= limitPerMinute) {
                log.debug("Minute limit reached: userId={}, count={}", userId, lastMinute);
                return false;
            }

            timestamps.addLast(now);
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Number of users with at least one timestamp in the trailing hour.
     */
    public int activeUsers() {
        long cutoff = clock.millis() - HOUR_MS;
        lock.lock();
        try {
            sweep(cutoff);
            return windows.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Users currently holding a window, without pruning.
     */
    int trackedUsers() {
        lock.lock();
        try {
            return windows.size();
        } finally {
            lock.unlock();
        }
    }

    // Caller holds the lock
    private void sweep(long cutoff) {
        Iterator<Map.Entry<String, Deque<Long>>> it = windows.entrySet().iterator();
        while (it.hasNext()) {
            Deque<Long> timestamps = it.next().getValue();
            evictOlderThan(timestamps, cutoff);
            if (timestamps.isEmpty()) {
                it.remove();
            }
        }
    }

    public int getLimitPerMinute() {
        return limitPerMinute;
    }

    public int getLimitPerHour() {
        return limitPerHour;
    }

    private static void evictOlderThan(Deque<Long> timestamps, long cutoff) {
        while (!timestamps.isEmpty() && timestamps.peekFirst() <= cutoff) {
            timestamps.pollFirst();
        }
    }

    private static int countSince(Deque<Long> timestamps, long cutoff) {
        int count = 0;
        Iterator<Long> it = timestamps.descendingIterator();
        while (it.hasNext() && it.next() > cutoff) {
            count++;
        }
        return count;
    }
}
