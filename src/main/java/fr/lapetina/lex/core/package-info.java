/**
 * Request core - admission control, scheduling, caching and pooling in front of
 * expensive downstream model calls and a transactional store.
 *
 * <p>Requests enter through the scheduler, which rate-limits, deduplicates and
 * circuit-breaks them before dispatching to a fixed worker pool. Workers call the
 * optimizer, which answers from canned templates or the response cache when it can
 * and otherwise generates through the selected tier.
 *
 * <h2>Key Components</h2>
 * <ul>
 *   <li>{@link fr.lapetina.lex.core.CoreFactory} - Builds every component from YAML
 *       configuration and owns their lifecycle</li>
 *   <li>{@link fr.lapetina.lex.core.LexCoreApplication} - Standalone process with the
 *       statistics and metrics endpoints</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * try (CoreFactory factory = CoreFactory.create("lex-core.yaml").start()) {
 *     RequestScheduler scheduler = factory.getScheduler();
 *
 *     String id = scheduler.submit("chat", Map.of("prompt", "Explain TCP slow start"), "user-1");
 *     Optional<RequestSnapshot> status = scheduler.getStatus(id);
 * }
 * }</pre>
 *
 * @see fr.lapetina.lex.core.CoreFactory
 * @see fr.lapetina.lex.core.scheduler.RequestScheduler
 */
package fr.lapetina.lex.core;
