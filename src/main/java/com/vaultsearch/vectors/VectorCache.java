package com.vaultsearch.vectors;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.vaultsearch.similarity.NoteVector;
import com.vaultsearch.similarity.ScoredResult;
import com.vaultsearch.similarity.SimilarityRanker;
import com.vaultsearch.vault.NotePaths;

/**
 * TTL cache over a {@link NoteVectorSource}. Snapshots are built off to the
 * side and published with a single reference swap; while one thread reloads,
 * other readers keep the previous snapshot.
 */
public class VectorCache {
    private static final Logger log = LoggerFactory.getLogger(VectorCache.class);

    private final NoteVectorSource source;
    private final Duration ttl;
    private final int maxItems;
    private final Clock clock;
    private final AtomicReference<CacheSnapshot> snapshot = new AtomicReference<>();
    private final AtomicLong generation = new AtomicLong();
    private final ReentrantLock reloadLock = new ReentrantLock();

    public VectorCache(NoteVectorSource source, Duration ttl, int maxItems) {
        this(source, ttl, maxItems, Clock.systemUTC());
    }

    public VectorCache(NoteVectorSource source, Duration ttl, int maxItems, Clock clock) {
        this.source = source;
        this.ttl = ttl;
        this.maxItems = maxItems;
        this.clock = clock;
    }

    public List<ScoredResult> query(float[] anchor, int k) {
        return SimilarityRanker.topK(anchor, SimilarityRanker.norm(anchor), vectors(), k);
    }

    public List<NoteVector> vectors() {
        CacheSnapshot current = snapshot.get();
        if (current != null && current.isFresh(clock.instant())) {
            return current.vectors();
        }
        if (current != null) {
            if (!reloadLock.tryLock()) {
                return current.vectors();
            }
        } else {
            reloadLock.lock();
        }
        try {
            CacheSnapshot latest = snapshot.get();
            if (latest != null && latest != current && latest.isFresh(clock.instant())) {
                return latest.vectors();
            }
            CacheSnapshot rebuilt = rebuild();
            snapshot.set(rebuilt);
            return rebuilt.vectors();
        } finally {
            reloadLock.unlock();
        }
    }

    public void invalidate() {
        generation.incrementAndGet();
        snapshot.set(null);
        log.debug("Vector cache invalidated");
    }

    public Optional<CacheSnapshot> currentSnapshot() {
        return Optional.ofNullable(snapshot.get());
    }

    public String label() {
        return source.label();
    }

    public Optional<NoteVector> findByPath(String anchorPath) {
        return NotePaths.find(vectors(), NoteVector::path, anchorPath);
    }

    private CacheSnapshot rebuild() {
        long startedGeneration = generation.get();
        Instant started = clock.instant();
        List<NoteVector> loaded = source.loadAll();
        List<NoteVector> capped = maxItems > 0 && loaded.size() > maxItems
                ? new ArrayList<>(loaded.subList(0, maxItems))
                : loaded;
        if (capped.size() < loaded.size()) {
            log.info("Vector pool capped at {} of {} records", capped.size(), loaded.size());
        }
        // invalidated mid-load: publish already expired so the next read reloads
        boolean invalidated = generation.get() != startedGeneration;
        Instant expiresAt = invalidated || ttl.isNegative() || ttl.isZero() ? started : started.plus(ttl);
        return new CacheSnapshot(expiresAt, capped);
    }
}
