package io.chainnode.core.mempool;

import io.chainnode.core.chain.ChainListener;
import io.chainnode.core.chain.ChainManager;
import io.chainnode.core.chain.ChainUpdate;
import io.chainnode.core.consensus.Validator;
import io.chainnode.core.metrics.NodeMetrics;
import io.chainnode.core.protocol.Block;
import io.chainnode.core.protocol.Hash;
import io.chainnode.core.protocol.ProtocolError;
import io.chainnode.core.protocol.Transaction;
import io.chainnode.core.protocol.ValidationResult;
import io.chainnode.core.state.StateView;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Validated, unconfirmed transactions:
 * - keyed by ID (never two entries with the same ID) and by (sender, nonce)
 * - one entry per (sender, nonce); a newcomer replaces it only with strictly higher priority
 * - bounded; when full the lowest-priority entry makes room for a strictly better one
 *
 * Lock order is chain read lock first, then this pool's monitor.
 */
public final class Mempool implements ChainListener {
    private static final Logger LOG = Logger.getLogger(Mempool.class.getName());

    private final Validator validator;
    private final ChainManager chain;
    private final PriorityPolicy policy;
    private final int maxSize;
    private final long maxAgeMillis;
    private final Clock clock;

    private final Map<Hash, MempoolEntry> byId = new HashMap<>();
    private final Map<String, NavigableMap<Long, MempoolEntry>> bySender = new HashMap<>();
    // worst first, for eviction
    private final TreeSet<MempoolEntry> byPriority = new TreeSet<>(MempoolEntry.BEST_FIRST.reversed());
    private final List<Consumer<Transaction>> admitListeners = new CopyOnWriteArrayList<>();
    private long nextSequence;

    public Mempool(Validator validator, ChainManager chain, PriorityPolicy policy,
                   int maxSize, Duration maxAge, Clock clock) {
        if (maxSize <= 0) throw new IllegalArgumentException("maxSize must be > 0");
        this.validator = validator;
        this.chain = chain;
        this.policy = policy;
        this.maxSize = maxSize;
        this.maxAgeMillis = maxAge.toMillis();
        this.clock = clock;
    }

    /** Notified (outside any lock) for every newly admitted transaction. */
    public void addAdmitListener(Consumer<Transaction> listener) {
        admitListeners.add(listener);
    }

    public ValidationResult admit(Transaction tx) {
        Hash id = tx.txId();
        if (contains(id) || chain.getTxLocation(id).isPresent()) {
            return ValidationResult.error(ProtocolError.DUPLICATE, "already known " + id.shortHex());
        }

        ValidationResult result = chain.readState(state -> {
            ValidationResult r = validator.validateTransaction(tx, state);
            if (!r.ok) return r;
            synchronized (this) {
                return insert(tx);
            }
        });

        if (result.ok) {
            NodeMetrics.incrementTxAdmitted();
            LOG.fine(() -> "Admitted " + tx);
            for (Consumer<Transaction> l : admitListeners) {
                try {
                    l.accept(tx);
                } catch (RuntimeException e) {
                    LOG.log(Level.WARNING, "Mempool listener failed", e);
                }
            }
        } else {
            NodeMetrics.incrementTxRejected();
            LOG.fine(() -> "Rejected " + id.shortHex() + ": " + result);
        }
        return result;
    }

    private ValidationResult insert(Transaction tx) {
        Hash id = tx.txId();
        if (byId.containsKey(id)) {
            return ValidationResult.error(ProtocolError.DUPLICATE, "already pooled " + id.shortHex());
        }
        long priority = policy.priority(tx);

        NavigableMap<Long, MempoolEntry> pending = bySender.get(tx.from());
        MempoolEntry sameNonce = pending == null ? null : pending.get(tx.nonce());
        if (sameNonce != null) {
            if (priority <= sameNonce.priority()) {
                return ValidationResult.error(ProtocolError.NONCE_CONFLICT,
                        "nonce " + tx.nonce() + " already pooled with priority " + sameNonce.priority());
            }
            remove(sameNonce);
            LOG.fine(() -> "Replaced " + sameNonce.txId().shortHex() + " by " + id.shortHex());
        } else if (byId.size() >= maxSize) {
            MempoolEntry worst = byPriority.first();
            if (priority <= worst.priority()) {
                return ValidationResult.error(ProtocolError.INSUFFICIENT_RESOURCE, "mempool full");
            }
            remove(worst);
            LOG.fine(() -> "Evicted " + worst.txId().shortHex() + " for capacity");
        }

        MempoolEntry entry = new MempoolEntry(tx, clock.millis(), priority, nextSequence++);
        byId.put(id, entry);
        senderQueue(tx.from()).put(tx.nonce(), entry);
        byPriority.add(entry);
        return ValidationResult.ok();
    }

    /**
     * Up to {@code maxCount} transactions, best first, honoring each sender's nonce order:
     * only the consecutive run starting right after the sender's applied nonce is eligible.
     * Same pool and chain state give the same list.
     */
    public List<Transaction> selectForBlock(int maxCount) {
        return chain.readState(state -> {
            synchronized (this) {
                PriorityQueue<Cursor> heads = new PriorityQueue<>((a, b) -> MempoolEntry.BEST_FIRST.compare(a.current, b.current));
                for (Map.Entry<String, NavigableMap<Long, MempoolEntry>> e : bySender.entrySet()) {
                    Cursor c = new Cursor(e.getValue(), state.getNonce(e.getKey()) + 1);
                    if (c.current != null) heads.add(c);
                }
                List<Transaction> out = new ArrayList<>(Math.min(maxCount, byId.size()));
                while (out.size() < maxCount && !heads.isEmpty()) {
                    Cursor c = heads.poll();
                    out.add(c.current.tx());
                    if (c.advance()) heads.add(c);
                }
                return out;
            }
        });
    }

    /** Walks one sender's consecutive nonce run. */
    private static final class Cursor {
        private final NavigableMap<Long, MempoolEntry> queue;
        private long nonce;
        private MempoolEntry current;

        Cursor(NavigableMap<Long, MempoolEntry> queue, long firstNonce) {
            this.queue = queue;
            this.nonce = firstNonce;
            this.current = queue.get(firstNonce);
        }

        boolean advance() {
            nonce++;
            current = queue.get(nonce);
            return current != null;
        }
    }

    public synchronized int evictIncluded(Collection<Hash> txIds) {
        int removed = 0;
        for (Hash id : txIds) {
            MempoolEntry e = byId.get(id);
            if (e != null) {
                remove(e);
                removed++;
            }
        }
        return removed;
    }

    /** Drops entries whose nonce the chain has already consumed. */
    public int pruneApplied() {
        return chain.readState(state -> {
            synchronized (this) {
                return pruneAppliedLocked(state);
            }
        });
    }

    private int pruneAppliedLocked(StateView state) {
        List<MempoolEntry> stale = new ArrayList<>();
        for (Map.Entry<String, NavigableMap<Long, MempoolEntry>> e : bySender.entrySet()) {
            long applied = state.getNonce(e.getKey());
            stale.addAll(e.getValue().headMap(applied, true).values());
        }
        stale.forEach(this::remove);
        return stale.size();
    }

    /** Drops entries older than the retention limit. */
    public synchronized int pruneExpired() {
        long cutoff = clock.millis() - maxAgeMillis;
        List<MempoolEntry> expired = new ArrayList<>();
        for (MempoolEntry e : byId.values()) {
            if (e.admittedAt() < cutoff) expired.add(e);
        }
        expired.forEach(this::remove);
        if (!expired.isEmpty()) {
            LOG.fine(() -> "Expired " + expired.size() + " mempool entries");
        }
        return expired.size();
    }

    public synchronized int size() { return byId.size(); }

    public synchronized boolean contains(Hash txId) { return byId.containsKey(txId); }

    public synchronized Optional<Transaction> get(Hash txId) {
        MempoolEntry e = byId.get(txId);
        return e == null ? Optional.empty() : Optional.of(e.tx());
    }

    /**
     * Included transactions leave the pool; transactions from disconnected blocks come back
     * when still valid on the new chain.
     */
    @Override
    public void onChainUpdate(ChainUpdate update) {
        Set<Hash> included = new HashSet<>();
        for (Block b : update.connected()) {
            for (Transaction tx : b.transactions()) included.add(tx.txId());
        }
        evictIncluded(included);

        int readmitted = 0;
        for (Block b : update.disconnected()) {
            for (Transaction tx : b.transactions()) {
                if (included.contains(tx.txId())) continue;
                if (admit(tx).ok) readmitted++;
            }
        }
        int pruned = pruneApplied();
        if (update.isReorg()) {
            int back = readmitted;
            LOG.info(() -> "Mempool after reorg: re-admitted " + back + ", pruned " + pruned + ", size " + size());
        }
    }

    // -------------------- helpers --------------------

    private NavigableMap<Long, MempoolEntry> senderQueue(String sender) {
        return bySender.computeIfAbsent(sender, k -> new TreeMap<>());
    }

    private void remove(MempoolEntry e) {
        byId.remove(e.txId());
        byPriority.remove(e);
        NavigableMap<Long, MempoolEntry> seq = bySender.get(e.tx().from());
        if (seq != null) {
            seq.remove(e.tx().nonce());
            if (seq.isEmpty()) bySender.remove(e.tx().from());
        }
    }
}
