package fr.lapetina.lex.core.infrastructure.pool;

import java.util.concurrent.atomic.LongAdder;

/**
 * Lock-free counters shared by a pool and its connections.
 */
final class PoolCounters {

    final LongAdder created = new LongAdder();
    final LongAdder destroyed = new LongAdder();
    final LongAdder checkouts = new LongAdder();
    final LongAdder successfulQueries = new LongAdder();
    final LongAdder failedQueries = new LongAdder();
    final LongAdder queryNanos = new LongAdder();
    final LongAdder longWaits = new LongAdder();
    final LongAdder exhausted = new LongAdder();

    void recordQuery(boolean success, long nanos) {
        if (success) {
            successfulQueries.increment();
        } else {
            failedQueries.increment();
        }
        queryNanos.add(nanos);
    }
}
