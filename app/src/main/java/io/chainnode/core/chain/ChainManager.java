package io.chainnode.core.chain;

import io.chainnode.core.consensus.ConsensusEngine;
import io.chainnode.core.consensus.Validator;
import io.chainnode.core.metrics.NodeMetrics;
import io.chainnode.core.protocol.AccountState;
import io.chainnode.core.protocol.Block;
import io.chainnode.core.protocol.BlockHeader;
import io.chainnode.core.protocol.BlockMeta;
import io.chainnode.core.protocol.ChainHead;
import io.chainnode.core.protocol.Hash;
import io.chainnode.core.protocol.ProtocolError;
import io.chainnode.core.protocol.Transaction;
import io.chainnode.core.protocol.TxLocation;
import io.chainnode.core.protocol.ValidationResult;
import io.chainnode.core.state.StateOverlay;
import io.chainnode.core.state.StateView;
import io.chainnode.core.storage.LedgerBatch;
import io.chainnode.core.storage.LedgerStore;
import io.chainnode.core.storage.StorageException;

import java.math.BigInteger;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Owns the canonical chain: head selection, block application, reorganizations and orphans.
 *
 * All mutation happens under the write half of a fair read/write lock, so blocks are
 * applied one at a time in arrival order. Every head change is committed to the
 * {@link LedgerStore} as a single batch. Listeners run after the lock is released.
 */
public final class ChainManager {
    private static final Logger LOG = Logger.getLogger(ChainManager.class.getName());

    private final LedgerStore store;
    private final Validator validator;
    private final ConsensusEngine engine;
    private final OrphanPool orphans;

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock(true);
    private final List<ChainListener> listeners = new CopyOnWriteArrayList<>();

    public static final int DEFAULT_MAX_INVALID_TRACKED = 4096;

    // guarded by the write lock; oldest entries fall out once full
    private final Set<Hash> invalid;

    private volatile ChainHead head;
    private volatile Hash genesisHash;
    private volatile boolean halted;
    private volatile Consumer<Throwable> fatalHandler = t -> { };

    public ChainManager(LedgerStore store, Validator validator, OrphanPool orphans) {
        this(store, validator, orphans, DEFAULT_MAX_INVALID_TRACKED);
    }

    public ChainManager(LedgerStore store, Validator validator, OrphanPool orphans, int maxInvalidTracked) {
        if (maxInvalidTracked < 1) {
            throw new IllegalArgumentException("maxInvalidTracked must be >= 1");
        }
        this.store = store;
        this.validator = validator;
        this.engine = validator.engine();
        this.orphans = orphans;
        this.invalid = Collections.newSetFromMap(new LinkedHashMap<Hash, Boolean>(16, 0.75f, false) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<Hash, Boolean> eldest) {
                return size() > maxInvalidTracked;
            }
        });
    }

    public void addListener(ChainListener listener) {
        listeners.add(listener);
    }

    /** Called once when a commit fails; the manager is halted by then. */
    public void setFatalHandler(Consumer<Throwable> handler) {
        this.fatalHandler = handler != null ? handler : t -> { };
    }

    /**
     * Load the head from storage, or commit genesis and its allocations when the store is empty.
     * Refuses a store that was created with a different genesis block.
     */
    public void initialize(Block genesis, Map<String, Long> allocations) {
        lock.writeLock().lock();
        try {
            Optional<ChainHead> stored = store.getHead();
            if (stored.isPresent()) {
                Hash storedGenesis = store.getHashAtHeight(0)
                        .orElseThrow(() -> new StorageException("head present but genesis missing"));
                if (!storedGenesis.equals(genesis.hash())) {
                    throw new IllegalStateException("Ledger belongs to a different genesis: " + storedGenesis.hex());
                }
                head = stored.get();
                genesisHash = storedGenesis;
                LOG.info(() -> "Loaded chain " + head);
                return;
            }

            if (genesis.height() != 0 || !genesis.header().parent().isZero()) {
                throw new IllegalArgumentException("genesis must be height 0 with zero parent");
            }
            StateOverlay overlay = new StateOverlay(accountView());
            for (Map.Entry<String, Long> alloc : allocations.entrySet()) {
                overlay.credit(alloc.getKey(), alloc.getValue());
            }
            overlay.applyBlock(genesis);

            ChainHead genesisHead = new ChainHead(genesis.hash(), 0, engine.blockWork(genesis.header()));
            LedgerBatch batch = new LedgerBatch()
                    .putBlock(genesis, new BlockMeta(0, genesisHead.totalWork()))
                    .putHeight(0, genesis.hash())
                    .putAccounts(overlay.dirty())
                    .setHead(genesisHead);
            indexTransactions(batch, genesis);
            commit(batch);
            head = genesisHead;
            genesisHash = genesis.hash();
            LOG.info(() -> "Committed genesis " + genesis.hash().hex() + " with " + allocations.size() + " allocations");
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Validate and connect a block, then any orphans that were waiting on it.
     * Never throws for invalid input; throws {@link StorageException} when the commit fails.
     */
    public ApplyResult applyBlock(Block block) {
        Hash hash = block.hash();
        if (halted) {
            return ApplyResult.rejected(hash, ProtocolError.STORAGE_IO_FAILURE, "chain manager halted");
        }
        if (hasBlock(hash) || orphans.contains(hash)) {
            return ApplyResult.of(ApplyResult.Status.DUPLICATE, hash);
        }

        // state-free part runs outside the lock
        ValidationResult structure = validator.checkStructure(block);
        if (!structure.ok) {
            if (structure.error == ProtocolError.CONSENSUS_PROOF_INVALID) {
                markInvalid(List.of(hash));
            }
            NodeMetrics.incrementRejected();
            LOG.fine(() -> "Rejected block " + hash.shortHex() + ": " + structure);
            return ApplyResult.rejected(hash, structure.error, structure.message);
        }

        List<ChainUpdate> updates = new ArrayList<>();
        ApplyResult result;
        lock.writeLock().lock();
        try {
            result = NodeMetrics.recordApply(() -> connect(block, updates));
            if (result.isConnected()) {
                connectOrphans(hash, updates);
            } else if (result.status() == ApplyResult.Status.REJECTED) {
                dropOrphansOf(hash);
            }
        } finally {
            lock.writeLock().unlock();
        }

        for (ChainUpdate update : updates) {
            notifyListeners(update);
        }
        return result;
    }

    // ---------------- reads ----------------

    public ChainHead head() {
        ChainHead h = head;
        if (h == null) throw new IllegalStateException("chain not initialized");
        return h;
    }

    public Hash genesisHash() {
        return genesisHash;
    }

    public boolean isHalted() {
        return halted;
    }

    public boolean hasBlock(Hash hash) {
        return store.getBlockMeta(hash).isPresent();
    }

    public boolean isOrphan(Hash hash) {
        return orphans.contains(hash);
    }

    public int orphanCount() {
        return orphans.size();
    }

    /** Number of block hashes currently remembered as invalid. */
    public int invalidCount() {
        return readLocked(invalid::size);
    }

    public int pruneOrphans() {
        return orphans.pruneExpired();
    }

    public Optional<Block> getBlock(Hash hash) {
        return store.getBlock(hash);
    }

    public Optional<Block> getBlockAtHeight(long height) {
        return readLocked(() -> store.getHashAtHeight(height).flatMap(store::getBlock));
    }

    public Optional<Hash> getHashAtHeight(long height) {
        return store.getHashAtHeight(height);
    }

    public AccountState getAccount(String address) {
        return readLocked(() -> store.getAccount(address));
    }

    public Optional<TxLocation> getTxLocation(Hash txId) {
        return store.getTxLocation(txId);
    }

    /** Canonical transaction by ID, resolved through the tx index. */
    public Optional<Transaction> getTransaction(Hash txId) {
        return readLocked(() -> store.getTxLocation(txId)
                .flatMap(loc -> store.getBlock(loc.blockHash())
                        .map(b -> b.transactions().get(loc.offset()))));
    }

    /** Run {@code fn} against a state snapshot that no apply or reorg can change midway. */
    public <T> T readState(Function<StateView, T> fn) {
        return readLocked(() -> fn.apply(accountView()));
    }

    /**
     * Canonical blocks following {@code locator}, in ascending height. A locator on a side
     * chain is walked back to its fork point first. Empty when the locator is unknown.
     * At least one block is returned when one exists, even if it alone exceeds {@code maxBytes}.
     */
    public Optional<List<Block>> blocksAfter(Hash locator, int count, long maxBytes) {
        return readLocked(() -> {
            if (store.getBlockMeta(locator).isEmpty()) return Optional.empty();
            Hash cursor = locator;
            while (!isCanonical(cursor)) {
                Hash c = cursor;
                cursor = store.getBlock(cursor)
                        .orElseThrow(() -> new StorageException("missing stored block " + c.hex()))
                        .header().parent();
            }
            long start = store.getBlockMeta(cursor).orElseThrow().height() + 1;
            List<Block> out = new ArrayList<>();
            long bytes = 0;
            for (long h = start; out.size() < count; h++) {
                Optional<Block> next = store.getHashAtHeight(h).flatMap(store::getBlock);
                if (next.isEmpty()) break;
                bytes += next.get().serialize().length;
                if (!out.isEmpty() && bytes > maxBytes) break;
                out.add(next.get());
            }
            return Optional.of(out);
        });
    }

    public Optional<List<Block>> blocksAfter(Hash locator, int count) {
        return blocksAfter(locator, count, Long.MAX_VALUE);
    }

    // ---------------- connection logic (write lock held) ----------------

    private ApplyResult connect(Block block, List<ChainUpdate> updates) {
        Hash hash = block.hash();
        if (hasBlock(hash)) {
            return ApplyResult.of(ApplyResult.Status.DUPLICATE, hash);
        }
        if (invalid.contains(hash)) {
            return ApplyResult.rejected(hash, ProtocolError.INVALID_HEADER, "block previously found invalid");
        }
        Hash parentHash = block.header().parent();
        if (invalid.contains(parentHash)) {
            invalid.add(hash);
            NodeMetrics.incrementRejected();
            return ApplyResult.rejected(hash, ProtocolError.INVALID_HEADER, "descends from invalid block " + parentHash.shortHex());
        }
        if (parentHash.isZero()) {
            return ApplyResult.rejected(hash, ProtocolError.UNKNOWN_PARENT, "foreign genesis block");
        }

        Optional<BlockMeta> parentMeta = store.getBlockMeta(parentHash);
        if (parentMeta.isEmpty()) {
            if (orphans.add(block)) {
                NodeMetrics.incrementOrphans();
                LOG.fine(() -> "Holding orphan " + hash.shortHex() + " waiting for " + parentHash.shortHex());
            }
            return ApplyResult.orphan(hash, parentHash);
        }
        BlockHeader parentHeader = store.getBlock(parentHash)
                .orElseThrow(() -> new StorageException("meta without block " + parentHash.hex()))
                .header();

        ChainHead current = head;
        BigInteger totalWork = parentMeta.get().totalWork().add(engine.blockWork(block.header()));
        ChainHead candidate = new ChainHead(hash, block.height(), totalWork);

        if (parentHash.equals(current.hash())) {
            return extendHead(block, parentHeader, candidate, updates);
        }

        ValidationResult headerCheck = validator.checkHeaderContext(block.header(), parentHeader);
        if (!headerCheck.ok) {
            return reject(List.of(hash), headerCheck);
        }
        if (!candidate.isBetterThan(current)) {
            commit(new LedgerBatch().putBlock(block, new BlockMeta(block.height(), totalWork)));
            LOG.fine(() -> "Stored side-chain block " + hash.shortHex() + " at height " + block.height());
            return ApplyResult.of(ApplyResult.Status.SIDE_CHAIN, hash);
        }
        return reorganize(block, candidate, updates);
    }

    private ApplyResult extendHead(Block block, BlockHeader parentHeader, ChainHead candidate, List<ChainUpdate> updates) {
        StateView state = accountView();
        ValidationResult r = validator.checkContext(block, parentHeader, state);
        if (!r.ok) {
            return reject(List.of(block.hash()), r);
        }
        StateOverlay overlay = new StateOverlay(state);
        overlay.applyBlock(block);

        LedgerBatch batch = new LedgerBatch()
                .putBlock(block, new BlockMeta(candidate.height(), candidate.totalWork()))
                .putHeight(candidate.height(), block.hash())
                .putAccounts(overlay.dirty())
                .setHead(candidate);
        indexTransactions(batch, block);
        commit(batch);

        head = candidate;
        NodeMetrics.incrementApplied(1);
        LOG.fine(() -> "Applied block " + candidate);
        updates.add(new ChainUpdate(List.of(block), List.of(), candidate));
        return ApplyResult.of(ApplyResult.Status.APPLIED, block.hash());
    }

    /**
     * Switch the canonical chain to the branch ending at {@code tip}. Everything is computed on
     * an overlay first; nothing reaches the store unless every new-branch block validates.
     */
    private ApplyResult reorganize(Block tip, ChainHead candidate, List<ChainUpdate> updates) {
        ChainHead oldHead = head;

        // new branch: fork point (exclusive) -> tip
        List<Block> newBranch = new ArrayList<>();
        newBranch.add(tip);
        Hash cursor = tip.header().parent();
        while (!isCanonical(cursor)) {
            Block b = requireBlock(cursor);
            newBranch.add(b);
            cursor = b.header().parent();
        }
        Collections.reverse(newBranch);
        Block ancestor = requireBlock(cursor);
        long ancestorHeight = ancestor.height();

        // old branch: old tip -> fork point (exclusive)
        List<Block> oldBranch = new ArrayList<>();
        for (long h = oldHead.height(); h > ancestorHeight; h--) {
            long height = h;
            Hash canonical = store.getHashAtHeight(h)
                    .orElseThrow(() -> new StorageException("height index gap at " + height));
            oldBranch.add(requireBlock(canonical));
        }

        StateOverlay overlay = new StateOverlay(accountView());
        for (Block b : oldBranch) {
            overlay.revertBlock(b);
        }
        BlockHeader parentHeader = ancestor.header();
        for (int i = 0; i < newBranch.size(); i++) {
            Block b = newBranch.get(i);
            ValidationResult r = validator.checkContext(b, parentHeader, overlay);
            if (!r.ok) {
                List<Hash> bad = new ArrayList<>();
                for (Block d : newBranch.subList(i, newBranch.size())) bad.add(d.hash());
                LOG.warning(() -> "Reorganization to " + candidate + " aborted at " + b.hash().shortHex() + ": " + r);
                return reject(bad, r);
            }
            overlay.applyBlock(b);
            parentHeader = b.header();
        }

        LedgerBatch batch = new LedgerBatch()
                .putBlock(tip, new BlockMeta(candidate.height(), candidate.totalWork()));
        for (Block b : oldBranch) {
            if (b.height() > candidate.height()) batch.deleteHeight(b.height());
            for (Transaction tx : b.transactions()) batch.deleteTxLocation(tx.txId());
        }
        for (Block b : newBranch) {
            batch.putHeight(b.height(), b.hash());
            indexTransactions(batch, b);
        }
        batch.putAccounts(overlay.dirty()).setHead(candidate);
        commit(batch);

        head = candidate;
        NodeMetrics.incrementReorgs();
        NodeMetrics.incrementApplied(newBranch.size());
        LOG.info(() -> "Reorganized from " + oldHead + " to " + candidate + " (fork at height " + ancestorHeight
                + ", -" + oldBranch.size() + "/+" + newBranch.size() + ")");
        updates.add(new ChainUpdate(newBranch, oldBranch, candidate));
        return ApplyResult.of(ApplyResult.Status.REORGANIZED, tip.hash());
    }

    private void connectOrphans(Hash parent, List<ChainUpdate> updates) {
        Deque<Hash> ready = new ArrayDeque<>();
        ready.add(parent);
        while (!ready.isEmpty()) {
            Hash next = ready.poll();
            for (Block child : orphans.takeChildren(next)) {
                ValidationResult structure = validator.checkStructure(child);
                ApplyResult r = structure.ok
                        ? connect(child, updates)
                        : ApplyResult.rejected(child.hash(), structure.error, structure.message);
                LOG.fine(() -> "Connected orphan " + child.hash().shortHex() + ": " + r);
                if (r.isConnected()) {
                    ready.add(child.hash());
                } else if (r.status() == ApplyResult.Status.REJECTED) {
                    dropOrphansOf(child.hash());
                }
            }
        }
    }

    private void dropOrphansOf(Hash rejected) {
        Deque<Hash> queue = new ArrayDeque<>();
        queue.add(rejected);
        while (!queue.isEmpty()) {
            for (Block child : orphans.takeChildren(queue.poll())) {
                invalid.add(child.hash());
                queue.add(child.hash());
            }
        }
    }

    private ApplyResult reject(List<Hash> hashes, ValidationResult r) {
        invalid.addAll(hashes);
        NodeMetrics.incrementRejected();
        Hash tip = hashes.get(hashes.size() - 1);
        return ApplyResult.rejected(tip, r.error, r.message);
    }

    private void markInvalid(List<Hash> hashes) {
        lock.writeLock().lock();
        try {
            invalid.addAll(hashes);
        } finally {
            lock.writeLock().unlock();
        }
    }

    private void commit(LedgerBatch batch) {
        try {
            store.write(batch);
        } catch (StorageException e) {
            halted = true;
            LOG.log(Level.SEVERE, "Ledger commit failed, chain manager halted", e);
            fatalHandler.accept(e);
            throw e;
        }
    }

    private static void indexTransactions(LedgerBatch batch, Block block) {
        List<Transaction> txs = block.transactions();
        for (int i = 0; i < txs.size(); i++) {
            batch.putTxLocation(txs.get(i).txId(), new TxLocation(block.hash(), i));
        }
    }

    private boolean isCanonical(Hash hash) {
        Optional<BlockMeta> meta = store.getBlockMeta(hash);
        return meta.isPresent() && store.getHashAtHeight(meta.get().height()).map(hash::equals).orElse(false);
    }

    private Block requireBlock(Hash hash) {
        return store.getBlock(hash).orElseThrow(() -> new StorageException("missing stored block " + hash.hex()));
    }

    private StateView accountView() {
        return store::getAccount;
    }

    private <T> T readLocked(Supplier<T> read) {
        lock.readLock().lock();
        try {
            return read.get();
        } finally {
            lock.readLock().unlock();
        }
    }

    private void notifyListeners(ChainUpdate update) {
        for (ChainListener l : listeners) {
            try {
                l.onChainUpdate(update);
            } catch (RuntimeException e) {
                LOG.log(Level.WARNING, "Chain listener failed", e);
            }
        }
    }
}
