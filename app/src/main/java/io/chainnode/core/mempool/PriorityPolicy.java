package io.chainnode.core.mempool;

import io.chainnode.core.protocol.Transaction;

/** Orders mempool entries for replacement, eviction and block selection. Higher wins. */
@FunctionalInterface
public interface PriorityPolicy {

    long priority(Transaction tx);

    /** Absolute fee. */
    PriorityPolicy FEE = Transaction::feeMinor;

    /** Fee per started KiB of signed encoding. */
    PriorityPolicy FEE_PER_KIB = tx -> tx.feeMinor() / (tx.serialize().length / 1024 + 1);
}
