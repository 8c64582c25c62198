/**
 * Value types shared by the scheduler, optimizer and infrastructure layers.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.lex.core.domain.model.QueuedRequest} - Admitted request with monotonic status transitions</li>
 *   <li>{@link fr.lapetina.lex.core.domain.model.RequestSnapshot} - Immutable copy returned by status lookups</li>
 *   <li>{@link fr.lapetina.lex.core.domain.model.HandlerResult} - Ok, retryable or fatal outcome of a handler call</li>
 *   <li>{@link fr.lapetina.lex.core.domain.model.OptimizedResponse} - Optimizer output with tier, source and cache flag</li>
 *   <li>{@link fr.lapetina.lex.core.domain.model.ErrorType} - Error taxonomy used on snapshots and metrics</li>
 * </ul>
 *
 * <h2>Thread Safety</h2>
 * <p>Records are immutable. {@code QueuedRequest} guards its mutable state with its own
 * monitor; a terminal status is never left once reached.
 */
package fr.lapetina.lex.core.domain.model;
