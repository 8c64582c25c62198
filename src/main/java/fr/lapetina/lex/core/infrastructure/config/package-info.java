/**
 * Configuration loading.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.lex.core.infrastructure.config.CoreConfig} - Configuration model</li>
 *   <li>{@link fr.lapetina.lex.core.infrastructure.config.ConfigLoader} - YAML loading and {@code LEX_*} overrides</li>
 * </ul>
 *
 * <h2>Configuration Sections</h2>
 * <ul>
 *   <li>{@code server} - Statistics/metrics HTTP server</li>
 *   <li>{@code scheduler} - Workers, queue size, retries, default timeout</li>
 *   <li>{@code retry} - Exponential backoff bounds</li>
 *   <li>{@code rateLimit} - Per-user minute and hour limits</li>
 *   <li>{@code circuitBreaker} - Failure threshold and recovery timeout</li>
 *   <li>{@code cache} - Redis address, namespace, per-category TTL and size caps</li>
 *   <li>{@code pool} - JDBC URL, sizes and timeouts</li>
 *   <li>{@code optimizer} - Templates, profiles, batching, tier models and costs</li>
 *   <li>{@code downstream} - Model server address and timeouts</li>
 *   <li>{@code metrics} - Prometheus prefix</li>
 * </ul>
 */
package fr.lapetina.lex.core.infrastructure.config;
