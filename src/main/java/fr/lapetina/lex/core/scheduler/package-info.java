/**
 * Admission control and the priority scheduler.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.lex.core.scheduler.RequestScheduler} - Entry point: admission, priority queue, workers, retries</li>
 *   <li>{@link fr.lapetina.lex.core.scheduler.RequestHandler} - One attempt of a request, returning a {@code HandlerResult}</li>
 *   <li>{@link fr.lapetina.lex.core.scheduler.admission.RateLimiter} - Per-user sliding windows</li>
 *   <li>{@link fr.lapetina.lex.core.scheduler.admission.CircuitBreakerRegistry} - One breaker per request type</li>
 * </ul>
 *
 * <h2>Ordering</h2>
 * <p>Lower priority ordinals dispatch first; within a level, earlier arrivals win.
 * A dispatched request is never preempted.
 *
 * <h2>Deadlines</h2>
 * <p>Queue wait, execution and retry backoff all count against one per-request
 * deadline. Passing it at any stage yields {@code TIMED_OUT}.
 */
package fr.lapetina.lex.core.scheduler;
