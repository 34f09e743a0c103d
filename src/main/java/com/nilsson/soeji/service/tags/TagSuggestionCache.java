package com.nilsson.soeji.service.tags;

import com.nilsson.soeji.data.TagRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 <h2>TagSuggestionCache</h2>
 <p>
 In-memory snapshot of the search-worthy tags, sorted by display count, for type-ahead
 suggestions without a round trip to the index.
 </p>
 <p>
 The snapshot is rebuilt lazily: {@link #suggest} refreshes it when it is older than the
 configured staleness window, and tag mutations call {@link #markStale()} so the next lookup
 sees them. A failed refresh keeps serving the previous snapshot.
 </p>
 <p>
 Every {@link #markStale()} bumps a generation counter. A snapshot only counts as fresh for the
 generation it started loading under, so an invalidation that lands while a refresh is reading
 the database leaves the cache stale. Refreshes are serialized; a caller that finds one running
 waits for it instead of reading the previous snapshot.
 </p>
 */
public class TagSuggestionCache {

    private static final Logger logger = LoggerFactory.getLogger(TagSuggestionCache.class);

    private final TagRepository tagRepository;
    private final Clock clock;
    private final Duration staleAfter;
    private final ReentrantLock refreshLock = new ReentrantLock();
    private final AtomicLong generation = new AtomicLong();

    private volatile List<CachedTag> tags = List.of();
    private volatile Freshness freshness;

    public TagSuggestionCache(TagRepository tagRepository, Clock clock, Duration staleAfter) {
        this.tagRepository = tagRepository;
        this.clock = clock;
        this.staleAfter = staleAfter;
    }

    public boolean isStale() {
        Freshness current = freshness;
        return current == null
                || current.generation != generation.get()
                || !clock.instant().isBefore(current.refreshedAt.plus(staleAfter));
    }

    public void markStale() {
        generation.incrementAndGet();
    }

    public void refreshIfStale() {
        if (!isStale()) return;
        refreshLock.lock();
        try {
            if (!isStale()) return;
            refresh();
        } catch (SQLException e) {
            logger.error("Failed to refresh tag suggestion cache, keeping {} cached tags", tags.size(), e);
        } finally {
            refreshLock.unlock();
        }
    }

    /**
     Rebuilds the snapshot now, waiting for a refresh that is already running on another thread.
     */
    public void refresh() throws SQLException {
        refreshLock.lock();
        try {
            long startGeneration = generation.get();
            List<CachedTag> snapshot = new ArrayList<>();
            tagRepository.forEachTagStats(stats -> {
                TagEvaluation evaluation = TagPopularityEvaluator.evaluate(stats);
                if (evaluation.shouldIndex()) {
                    snapshot.add(new CachedTag(stats.tag.id, stats.tag.name, stats.tag.category, evaluation.getDisplayCount()));
                }
            });
            snapshot.sort(Comparator.comparingInt((CachedTag t) -> t.imageCount).reversed());

            tags = List.copyOf(snapshot);
            freshness = new Freshness(clock.instant(), startGeneration);
            if (startGeneration != generation.get()) {
                logger.debug("Tags changed during refresh, snapshot stays stale");
            }
            logger.info("Tag cache refreshed: {} tags", snapshot.size());
        } finally {
            refreshLock.unlock();
        }
    }

    /**
     Case-insensitive substring match, most used first.
     */
    public List<CachedTag> suggest(String query, int limit) {
        if (query == null || query.isEmpty() || limit <= 0) {
            return List.of();
        }
        refreshIfStale();

        String queryLower = query.toLowerCase(Locale.ROOT);
        List<CachedTag> matches = new ArrayList<>();
        for (CachedTag tag : tags) {
            if (tag.nameLower.contains(queryLower)) {
                matches.add(tag);
                if (matches.size() >= limit) break;
            }
        }
        return matches;
    }

    public CacheStats stats() {
        Freshness current = freshness;
        Instant lastRefresh = current != null && current.generation == generation.get() ? current.refreshedAt : null;
        return new CacheStats(tags.size(), lastRefresh, refreshLock.isLocked());
    }

    // --- Value types ---

    private static final class Freshness {
        final Instant refreshedAt;
        final long generation;

        Freshness(Instant refreshedAt, long generation) {
            this.refreshedAt = refreshedAt;
            this.generation = generation;
        }
    }

    public static final class CachedTag {
        public final long id;
        public final String name;
        public final String category;
        public final int imageCount;
        final String nameLower;

        public CachedTag(long id, String name, String category, int imageCount) {
            this.id = id;
            this.name = name;
            this.category = category;
            this.imageCount = imageCount;
            this.nameLower = name.toLowerCase(Locale.ROOT);
        }

        @Override
        public String toString() {
            return name + " (" + imageCount + ")";
        }
    }

    public static final class CacheStats {
        public final int tagCount;
        public final Instant lastRefresh;
        public final boolean refreshing;

        public CacheStats(int tagCount, Instant lastRefresh, boolean refreshing) {
            this.tagCount = tagCount;
            this.lastRefresh = lastRefresh;
            this.refreshing = refreshing;
        }
    }
}
