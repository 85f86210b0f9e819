package io.chainnode.core.mempool;

import io.chainnode.core.protocol.Hash;
import io.chainnode.core.protocol.Transaction;

import java.util.Comparator;

/** A validated, unconfirmed transaction plus what the pool needs to order it. */
public final class MempoolEntry {

    /** Best first: priority desc, then earliest admission, then admission sequence. */
    static final Comparator<MempoolEntry> BEST_FIRST = Comparator
            .comparingLong(MempoolEntry::priority).reversed()
            .thenComparingLong(MempoolEntry::admittedAt)
            .thenComparingLong(MempoolEntry::sequence);

    private final Transaction tx;
    private final Hash txId;
    private final long admittedAt;
    private final long priority;
    private final long sequence;

    MempoolEntry(Transaction tx, long admittedAt, long priority, long sequence) {
        this.tx = tx;
        this.txId = tx.txId();
        this.admittedAt = admittedAt;
        this.priority = priority;
        this.sequence = sequence;
    }

    public Transaction tx() { return tx; }
    public Hash txId() { return txId; }
    public long admittedAt() { return admittedAt; }
    public long priority() { return priority; }
    public long sequence() { return sequence; }

    @Override public String toString() {
        return "MempoolEntry{" + txId.shortHex() + ", prio=" + priority + ", seq=" + sequence + "}";
    }
}
