package io.chainnode.core.storage;

import io.chainnode.core.protocol.AccountState;
import io.chainnode.core.protocol.Block;
import io.chainnode.core.protocol.BlockMeta;
import io.chainnode.core.protocol.ChainHead;
import io.chainnode.core.protocol.Hash;
import io.chainnode.core.protocol.TxLocation;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Simple, fast in-memory ledger store.
 * Good for tests and local nodes; not persistent, resets every process run.
 */
public final class InMemoryLedgerStore implements LedgerStore {

    private final Map<Hash, Block> blocks = new HashMap<>();
    private final Map<Hash, BlockMeta> metas = new HashMap<>();
    private final Map<Long, Hash> heights = new HashMap<>();
    private final Map<Hash, TxLocation> txIndex = new HashMap<>();
    private final Map<String, AccountState> accounts = new HashMap<>();

    /** Current head (best tip), null until genesis is written. */
    private ChainHead head;
    private boolean closed;

    @Override
    public synchronized Optional<Block> getBlock(Hash hash) {
        ensureOpen();
        return Optional.ofNullable(blocks.get(hash));
    }

    @Override
    public synchronized Optional<BlockMeta> getBlockMeta(Hash hash) {
        ensureOpen();
        return Optional.ofNullable(metas.get(hash));
    }

    @Override
    public synchronized Optional<Hash> getHashAtHeight(long height) {
        ensureOpen();
        return Optional.ofNullable(heights.get(height));
    }

    @Override
    public synchronized Optional<TxLocation> getTxLocation(Hash txId) {
        ensureOpen();
        return Optional.ofNullable(txIndex.get(txId));
    }

    @Override
    public synchronized AccountState getAccount(String address) {
        ensureOpen();
        return accounts.getOrDefault(address, AccountState.EMPTY);
    }

    @Override
    public synchronized Optional<ChainHead> getHead() {
        ensureOpen();
        return Optional.ofNullable(head);
    }

    @Override
    public synchronized void write(LedgerBatch batch) {
        ensureOpen();
        for (Long h : batch.heightDeletes()) heights.remove(h);
        for (Hash id : batch.txDeletes()) txIndex.remove(id);

        blocks.putAll(batch.blocks());
        metas.putAll(batch.metas());
        heights.putAll(batch.heightPuts());
        txIndex.putAll(batch.txPuts());
        for (Map.Entry<String, AccountState> e : batch.accounts().entrySet()) {
            if (e.getValue().isEmpty()) {
                accounts.remove(e.getKey());
            } else {
                accounts.put(e.getKey(), e.getValue());
            }
        }
        if (batch.head() != null) {
            head = batch.head();
        }
    }

    @Override
    public synchronized long blockCount() {
        return blocks.size();
    }

    /** Number of non-empty account records; lets tests check that reverted accounts vanish. */
    public synchronized int accountCount() {
        return accounts.size();
    }

    @Override
    public synchronized void close() {
        closed = true;
    }

    private void ensureOpen() {
        if (closed) throw new StorageException("store is closed");
    }
}
