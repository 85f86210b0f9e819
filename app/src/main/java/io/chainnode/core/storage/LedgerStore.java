package io.chainnode.core.storage;

import io.chainnode.core.protocol.AccountState;
import io.chainnode.core.protocol.Block;
import io.chainnode.core.protocol.BlockMeta;
import io.chainnode.core.protocol.ChainHead;
import io.chainnode.core.protocol.Hash;
import io.chainnode.core.protocol.TxLocation;

import java.util.Optional;

/**
 * Chain persistence API.
 *
 * Blocks are stored by header hash whether canonical or not; the height index,
 * tx index and accounts always describe the canonical chain ending at {@link #getHead()}.
 * All mutation goes through {@link #write(LedgerBatch)} so a block application or a
 * reorganization is visible entirely or not at all.
 *
 * Every method may throw {@link StorageException}.
 */
public interface LedgerStore extends AutoCloseable {

    Optional<Block> getBlock(Hash hash);

    /** Height and cumulative work for any stored block. */
    Optional<BlockMeta> getBlockMeta(Hash hash);

    /** Canonical block hash at a height. */
    Optional<Hash> getHashAtHeight(long height);

    Optional<TxLocation> getTxLocation(Hash txId);

    /** Never null; untouched addresses read as {@link AccountState#EMPTY}. */
    AccountState getAccount(String address);

    Optional<ChainHead> getHead();

    /** Apply every operation of the batch atomically; deletes before puts. */
    void write(LedgerBatch batch);

    /** Number of blocks stored (debug/metrics). */
    long blockCount();

    @Override
    void close();
}
