package io.chainnode.core.storage;

import io.chainnode.core.protocol.AccountState;
import io.chainnode.core.protocol.Block;
import io.chainnode.core.protocol.BlockMeta;
import io.chainnode.core.protocol.ChainHead;
import io.chainnode.core.protocol.Hash;
import io.chainnode.core.protocol.TxLocation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Buffered set of ledger mutations. Stores apply deletes first, then puts, so a key that
 * is deleted and re-put in one batch (tx index during a reorg) ends up present.
 */
public final class LedgerBatch {

    private final Map<Hash, Block> blocks = new LinkedHashMap<>();
    private final Map<Hash, BlockMeta> metas = new LinkedHashMap<>();
    private final Map<Long, Hash> heightPuts = new LinkedHashMap<>();
    private final Set<Long> heightDeletes = new LinkedHashSet<>();
    private final Map<Hash, TxLocation> txPuts = new LinkedHashMap<>();
    private final Set<Hash> txDeletes = new LinkedHashSet<>();
    private final Map<String, AccountState> accounts = new LinkedHashMap<>();
    private ChainHead head;

    public LedgerBatch putBlock(Block block, BlockMeta meta) {
        blocks.put(block.hash(), block);
        metas.put(block.hash(), meta);
        return this;
    }

    public LedgerBatch putHeight(long height, Hash hash) {
        heightPuts.put(height, hash);
        return this;
    }

    public LedgerBatch deleteHeight(long height) {
        heightDeletes.add(height);
        return this;
    }

    public LedgerBatch putTxLocation(Hash txId, TxLocation location) {
        txPuts.put(txId, location);
        return this;
    }

    public LedgerBatch deleteTxLocation(Hash txId) {
        txDeletes.add(txId);
        return this;
    }

    /** {@link AccountState#EMPTY} deletes the record. */
    public LedgerBatch putAccount(String address, AccountState state) {
        accounts.put(address, state);
        return this;
    }

    public LedgerBatch putAccounts(Map<String, AccountState> states) {
        accounts.putAll(states);
        return this;
    }

    public LedgerBatch setHead(ChainHead newHead) {
        this.head = newHead;
        return this;
    }

    public Map<Hash, Block> blocks() { return Collections.unmodifiableMap(blocks); }
    public Map<Hash, BlockMeta> metas() { return Collections.unmodifiableMap(metas); }
    public Map<Long, Hash> heightPuts() { return Collections.unmodifiableMap(heightPuts); }
    public Set<Long> heightDeletes() { return Collections.unmodifiableSet(heightDeletes); }
    public Map<Hash, TxLocation> txPuts() { return Collections.unmodifiableMap(txPuts); }
    public Set<Hash> txDeletes() { return Collections.unmodifiableSet(txDeletes); }
    public Map<String, AccountState> accounts() { return Collections.unmodifiableMap(accounts); }
    public ChainHead head() { return head; }

    public boolean isEmpty() {
        return blocks.isEmpty() && heightPuts.isEmpty() && heightDeletes.isEmpty()
                && txPuts.isEmpty() && txDeletes.isEmpty() && accounts.isEmpty() && head == null;
    }
}
