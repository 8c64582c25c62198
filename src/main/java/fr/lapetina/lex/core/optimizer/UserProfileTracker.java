package fr.lapetina.lex.core.optimizer;

import fr.lapetina.lex.core.domain.model.PriorityHint;
import fr.lapetina.lex.core.domain.model.QueryComplexity;
import fr.lapetina.lex.core.domain.model.UserProfile;
import fr.lapetina.lex.core.infrastructure.persistence.InteractionStore;
import fr.lapetina.lex.core.infrastructure.pool.PoolExhaustedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Rolling per-user profile over the most recent interactions.
 *
 * On first access a user's history is seeded from the interaction store, if one
 * is configured. A seed that fails is retried on later accesses; once the store
 * answers, its history replaces what was recorded in memory meanwhile. Preference rules: more than 60% simple prompts means SPEED,
 * more than 30% creative prompts means QUALITY, otherwise BALANCED.
 */
public final class UserProfileTracker {

    private static final Logger log = LoggerFactory.getLogger(UserProfileTracker.class);

    static final double SPEED_SIMPLE_SHARE = 0.6;
    static final double QUALITY_CREATIVE_SHARE = 0.3;

    private final int historySize;
    private final InteractionStore store;
    private final Map<String, Deque<QueryComplexity>> histories = new ConcurrentHashMap<>();
    private final Set<String> unseeded = ConcurrentHashMap.newKeySet();

    public UserProfileTracker(int historySize, InteractionStore store) {
        if (historySize < 1) {
            throw new IllegalArgumentException("historySize must be >= 1");
        }
        this.historySize = historySize;
        this.store = store;
    }

    public void record(String userId, QueryComplexity complexity) {
        Deque<QueryComplexity> history = history(userId);
        synchronized (history) {
            history.addLast(complexity);
            while (history.size() > historySize) {
                history.pollFirst();
            }
        }
    }

    public UserProfile profile(String userId) {
        Deque<QueryComplexity> history = history(userId);
        Map<QueryComplexity, Integer> counts = new EnumMap<>(QueryComplexity.class);
        int total;
        synchronized (history) {
            total = history.size();
            for (QueryComplexity complexity : history) {
                counts.merge(complexity, 1, Integer::sum);
            }
        }
        if (total == 0) {
            return UserProfile.empty(userId);
        }

        QueryComplexity dominant = QueryComplexity.SIMPLE;
        int dominantCount = -1;
        for (Map.Entry<QueryComplexity, Integer> entry : counts.entrySet()) {
            if (entry.getValue() > dominantCount) {
                dominant = entry.getKey();
                dominantCount = entry.getValue();
            }
        }

        double simpleShare = counts.getOrDefault(QueryComplexity.SIMPLE, 0) / (double) total;
        double creativeShare = counts.getOrDefault(QueryComplexity.CREATIVE, 0) / (double) total;
        PriorityHint preference;
        if (simpleShare > SPEED_SIMPLE_SHARE) {
            preference = PriorityHint.SPEED;
        } else if (creativeShare > QUALITY_CREATIVE_SHARE) {
            preference = PriorityHint.QUALITY;
        } else {
            preference = PriorityHint.BALANCED;
        }
        return new UserProfile(userId, dominant, preference, total, counts);
    }

    public int trackedUsers() {
        return histories.size();
    }

    private Deque<QueryComplexity> history(String userId) {
        Deque<QueryComplexity> history = histories.get(userId);
        if (history != null) {
            if (unseeded.contains(userId)) {
                reseed(userId, history);
            }
            return history;
        }
        // Seed outside the map so the store query holds no map lock
        List<QueryComplexity> recent = load(userId);
        Deque<QueryComplexity> seeded = new ArrayDeque<>();
        if (recent != null) {
            seeded.addAll(recent);
        }
        Deque<QueryComplexity> existing = histories.putIfAbsent(userId, seeded);
        if (existing != null) {
            return existing;
        }
        if (recent == null) {
            unseeded.add(userId);
        }
        return seeded;
    }

    private void reseed(String userId, Deque<QueryComplexity> history) {
        List<QueryComplexity> recent = load(userId);
        if (recent == null || !unseeded.remove(userId)) {
            return;
        }
        synchronized (history) {
            history.clear();
            history.addAll(recent);
        }
    }

    /**
     * Recent complexities oldest first, empty without a store, or null if the store failed.
     */
    private List<QueryComplexity> load(String userId) {
        if (store == null) {
            return List.of();
        }
        try {
            List<QueryComplexity> recent = store.recentComplexities(userId, historySize);
            // Stored newest first, history is oldest first
            Collections.reverse(recent);
            log.debug("Seeded user profile from store: userId={}, entries={}", userId, recent.size());
            return recent;
        } catch (SQLException | PoolExhaustedException e) {
            log.warn("Could not seed user profile, will retry: userId={}, error={}", userId, e.getMessage());
            return null;
        }
    }
}
