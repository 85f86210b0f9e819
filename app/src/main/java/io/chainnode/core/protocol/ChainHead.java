package io.chainnode.core.protocol;

import java.math.BigInteger;

/** Tip of the canonical chain. */
public record ChainHead(Hash hash, long height, BigInteger totalWork) {
    public ChainHead {
        if (hash == null) throw new IllegalArgumentException("hash required");
        if (totalWork == null) throw new IllegalArgumentException("totalWork required");
    }

    /**
     * Fork-choice: more cumulative work wins; equal work is broken by the
     * lexicographically smaller hash so every node picks the same tip.
     */
    public boolean isBetterThan(ChainHead other) {
        int cmp = totalWork.compareTo(other.totalWork);
        if (cmp != 0) return cmp > 0;
        return hash.compareTo(other.hash) < 0;
    }

    @Override public String toString() {
        return "ChainHead{height=" + height + ", hash=" + hash.shortHex() + ", work=" + totalWork + "}";
    }
}
