/**
 * Response cache with a Redis primary and an in-process fallback.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.lex.core.infrastructure.cache.ResponseCache} - Typed get/set per category, statistics</li>
 *   <li>{@link fr.lapetina.lex.core.infrastructure.cache.CacheKeyGenerator} - {@code namespace:category:digest} keys</li>
 *   <li>{@link fr.lapetina.lex.core.infrastructure.cache.RedisCacheStore} - Lettuce-backed primary store</li>
 * </ul>
 *
 * <p>The fallback evicts the oldest inserted key of a category when it is full (FIFO, not LRU).
 */
package fr.lapetina.lex.core.infrastructure.cache;
