package io.chainnode.core.node;

import io.chainnode.core.chain.ApplyResult;
import io.chainnode.core.chain.ChainManager;
import io.chainnode.core.chain.OrphanPool;
import io.chainnode.core.consensus.ProofOfWork;
import io.chainnode.core.consensus.Validator;
import io.chainnode.core.mempool.Mempool;
import io.chainnode.core.p2p.P2pServer;
import io.chainnode.core.protocol.AccountState;
import io.chainnode.core.protocol.Block;
import io.chainnode.core.protocol.ChainHead;
import io.chainnode.core.protocol.Hash;
import io.chainnode.core.protocol.Transaction;
import io.chainnode.core.protocol.ValidationResult;
import io.chainnode.core.storage.InMemoryLedgerStore;
import io.chainnode.core.storage.LedgerStore;
import io.chainnode.core.storage.RocksDBLedgerStore;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Wires storage, validation, chain, mempool and networking.
 * Start once; close releases the network and the store.
 */
public final class Node implements ChainQuery, AutoCloseable {
    private static final Logger LOG = Logger.getLogger(Node.class.getName());

    private final NodeConfig config;
    private final LedgerStore store;
    private final Validator validator;
    private final ChainManager chain;
    private final Mempool mempool;
    private final Block genesis;
    private final P2pServer p2p;

    private ScheduledExecutorService housekeeping;
    private volatile boolean started;
    private volatile boolean closed;

    public Node(NodeConfig config, LedgerStore store, Clock clock) {
        this.config = config;
        this.store = store;
        this.validator = new Validator(new ProofOfWork(config.difficultyBits), config.validatorRules(), clock);
        OrphanPool orphans = new OrphanPool(config.orphanMaxCount, Duration.ofMillis(config.orphanTtlMillis), clock);
        this.chain = new ChainManager(store, validator, orphans, config.maxInvalidTracked);
        this.mempool = new Mempool(validator, chain, config.priorityPolicy,
                config.mempoolMaxSize, Duration.ofMillis(config.mempoolMaxAgeMillis), clock);
        this.genesis = GenesisBuilder.buildGenesis(config);

        // mempool reconciles before peers hear about the new head
        chain.addListener(mempool);
        this.p2p = config.p2p == null ? null : new P2pServer(config.p2p, chain, mempool);
        chain.setFatalHandler(this::onFatal);
    }

    /** Convenience factory for an in-memory local node. */
    public static Node inMemory(NodeConfig config) {
        return new Node(config, new InMemoryLedgerStore(), Clock.systemUTC());
    }

    /** Convenience factory for a RocksDB-backed node. */
    public static Node rocks(NodeConfig config, String dataDir) {
        return new Node(config, RocksDBLedgerStore.open(dataDir), Clock.systemUTC());
    }

    /** Load or create the chain, then open the network. */
    public synchronized void start() {
        if (started) {
            throw new IllegalStateException("node already started");
        }
        chain.initialize(genesis, config.genesisAllocations);
        started = true;
        LOG.info(() -> "Node started at " + chain.head() + " (genesis " + genesis.hash().shortHex() + ")");

        housekeeping = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "chain-node-housekeeping");
            t.setDaemon(true);
            return t;
        });
        housekeeping.scheduleWithFixedDelay(this::runHousekeeping,
                config.housekeepingIntervalMillis, config.housekeepingIntervalMillis, TimeUnit.MILLISECONDS);

        if (p2p != null) {
            p2p.start();
        }
    }

    /** Feed a block from outside the network (tests, imports). */
    public ApplyResult submitBlock(Block block) {
        return chain.applyBlock(block);
    }

    @Override
    public ValidationResult submitTransaction(Transaction tx) {
        return mempool.admit(tx);
    }

    @Override
    public Optional<Block> getBlock(Hash hash) {
        return chain.getBlock(hash);
    }

    @Override
    public Optional<Block> getBlockByHeight(long height) {
        return chain.getBlockAtHeight(height);
    }

    @Override
    public AccountState getAccountState(String address) {
        return chain.getAccount(address);
    }

    @Override
    public ChainHead currentHead() {
        return chain.head();
    }

    private void runHousekeeping() {
        try {
            int expiredTx = mempool.pruneExpired();
            int expiredOrphans = chain.pruneOrphans();
            if (expiredTx > 0 || expiredOrphans > 0) {
                LOG.fine(() -> "Housekeeping dropped " + expiredTx + " txs and " + expiredOrphans + " orphans");
            }
        } catch (RuntimeException e) {
            LOG.log(Level.WARNING, "Housekeeping pass failed", e);
        }
    }

    /** Storage is gone: stop talking to peers, keep serving what is already committed. */
    private void onFatal(Throwable cause) {
        LOG.log(Level.SEVERE, "Chain halted after storage failure; stopping networking", cause);
        if (p2p == null) {
            return;
        }
        // the handler runs on whichever thread hit the failure, often a p2p worker
        Thread stopper = new Thread(p2p::stop, "chain-node-fatal-stop");
        stopper.setDaemon(true);
        stopper.start();
    }

    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        if (housekeeping != null) {
            housekeeping.shutdownNow();
        }
        if (p2p != null && started) {
            p2p.stop();
        }
        store.close();
        LOG.info("Node closed");
    }

    public NodeConfig config() { return config; }
    public Validator validator() { return validator; }
    public ChainManager chain() { return chain; }
    public Mempool mempool() { return mempool; }
    public Block genesis() { return genesis; }
    /** Null when networking is disabled. */
    public P2pServer p2p() { return p2p; }
}
