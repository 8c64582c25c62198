package fr.lapetina.lex.core.infrastructure.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;
import java.util.regex.Pattern;

/**
 * In-process cache used when the primary cache service is absent or failing.
 *
 * Each category is bounded by its own entry cap. When the cap is reached the
 * oldest inserted key is evicted (FIFO, reads do not refresh position).
 * Expired entries are removed lazily on read.
 */
final class FallbackCache {

    private static final Logger log = LoggerFactory.getLogger(FallbackCache.class);

    private final Map<CacheCategory, CategorySettings> settings;
    private final Map<CacheCategory, LinkedHashMap<String, CacheEntry>> entries = new EnumMap<>(CacheCategory.class);
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();

    FallbackCache(Map<CacheCategory, CategorySettings> settings, Clock clock) {
        this.settings = settings;
        this.clock = clock;
        for (CacheCategory category : CacheCategory.values()) {
            entries.put(category, new LinkedHashMap<>());
        }
    }

    String get(CacheCategory category, String key) {
        Instant now = clock.instant();
        lock.lock();
        try {
            Map<String, CacheEntry> map = entries.get(category);
            CacheEntry entry = map.get(key);
            if (entry == null) {
                return null;
            }
            if (entry.isExpired(now)) {
                map.remove(key);
                log.debug("Fallback entry expired: key={}", key);
                return null;
            }
            entry.recordAccess();
            return entry.json();
        } finally {
            lock.unlock();
        }
    }

    void put(CacheCategory category, String key, String json) {
        Instant now = clock.instant();
        CategorySettings categorySettings = settings.get(category);
        CacheEntry entry = new CacheEntry(key, json, category, now, now.plus(categorySettings.ttl()));

        lock.lock();
        try {
            LinkedHashMap<String, CacheEntry> map = entries.get(category);
            // A rewrite moves the key to the back of the insertion order
            map.remove(key);
            if (map.size() >= categorySettings.maxEntries()) {
                Iterator<String> oldest = map.keySet().iterator();
                String evicted = oldest.next();
                oldest.remove();
                log.debug("Fallback cache full, evicted oldest: category={}, key={}", category, evicted);
            }
            map.put(key, entry);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes every key matching the regex.
     */
    int invalidate(Pattern keyPattern) {
        int removed = 0;
        lock.lock();
        try {
            for (LinkedHashMap<String, CacheEntry> map : entries.values()) {
                Iterator<String> it = map.keySet().iterator();
                while (it.hasNext()) {
                    if (keyPattern.matcher(it.next()).matches()) {
                        it.remove();
                        removed++;
                    }
                }
            }
        } finally {
            lock.unlock();
        }
        return removed;
    }

    int clear() {
        lock.lock();
        try {
            int removed = size();
            entries.values().forEach(Map::clear);
            return removed;
        } finally {
            lock.unlock();
        }
    }

    int size() {
        lock.lock();
        try {
            int total = 0;
            for (Map<String, CacheEntry> map : entries.values()) {
                total += map.size();
            }
            return total;
        } finally {
            lock.unlock();
        }
    }

    int size(CacheCategory category) {
        lock.lock();
        try {
            return entries.get(category).size();
        } finally {
            lock.unlock();
        }
    }
}
