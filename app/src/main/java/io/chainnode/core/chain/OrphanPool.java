package io.chainnode.core.chain;

import io.chainnode.core.protocol.Block;
import io.chainnode.core.protocol.Hash;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Blocks whose parent is not known yet, indexed by the missing parent.
 * Bounded in count (oldest evicted first) and in age.
 */
public final class OrphanPool {
    private static final Logger LOG = Logger.getLogger(OrphanPool.class.getName());

    private record Entry(Block block, long addedAt) {}

    private final int maxOrphans;
    private final long ttlMillis;
    private final Clock clock;

    // insertion order doubles as age order
    private final LinkedHashMap<Hash, Entry> byHash = new LinkedHashMap<>();
    private final Map<Hash, List<Hash>> byParent = new HashMap<>();

    public OrphanPool(int maxOrphans, Duration ttl, Clock clock) {
        if (maxOrphans <= 0) throw new IllegalArgumentException("maxOrphans must be > 0");
        this.maxOrphans = maxOrphans;
        this.ttlMillis = ttl.toMillis();
        this.clock = clock;
    }

    /** Returns false if the block was already held. */
    public synchronized boolean add(Block block) {
        Hash hash = block.hash();
        if (byHash.containsKey(hash)) return false;
        while (byHash.size() >= maxOrphans) {
            Hash oldest = byHash.keySet().iterator().next();
            LOG.fine(() -> "Orphan pool full, evicting " + oldest.shortHex());
            remove(oldest);
        }
        byHash.put(hash, new Entry(block, clock.millis()));
        byParent.computeIfAbsent(block.header().parent(), k -> new ArrayList<>()).add(hash);
        return true;
    }

    /** Removes and returns every orphan waiting on {@code parent}. */
    public synchronized List<Block> takeChildren(Hash parent) {
        List<Hash> children = byParent.remove(parent);
        if (children == null) return Collections.emptyList();
        List<Block> out = new ArrayList<>(children.size());
        for (Hash child : children) {
            Entry e = byHash.remove(child);
            if (e != null) out.add(e.block());
        }
        return out;
    }

    public synchronized boolean contains(Hash hash) {
        return byHash.containsKey(hash);
    }

    public synchronized int size() {
        return byHash.size();
    }

    /** Drops orphans older than the TTL; returns how many went. */
    public synchronized int pruneExpired() {
        long cutoff = clock.millis() - ttlMillis;
        int removed = 0;
        Iterator<Map.Entry<Hash, Entry>> it = byHash.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<Hash, Entry> e = it.next();
            if (e.getValue().addedAt() > cutoff) break;
            it.remove();
            unlinkParent(e.getValue().block(), e.getKey());
            removed++;
        }
        return removed;
    }

    private void remove(Hash hash) {
        Entry e = byHash.remove(hash);
        if (e != null) unlinkParent(e.block(), hash);
    }

    private void unlinkParent(Block block, Hash hash) {
        Hash parent = block.header().parent();
        List<Hash> siblings = byParent.get(parent);
        if (siblings == null) return;
        siblings.remove(hash);
        if (siblings.isEmpty()) byParent.remove(parent);
    }
}
