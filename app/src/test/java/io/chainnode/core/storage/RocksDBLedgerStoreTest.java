package io.chainnode.core.storage;

import io.chainnode.core.ChainFixtures;
import io.chainnode.core.chain.ChainManager;
import io.chainnode.core.chain.OrphanPool;
import io.chainnode.core.protocol.AccountState;
import io.chainnode.core.protocol.Block;
import io.chainnode.core.protocol.BlockMeta;
import io.chainnode.core.protocol.ChainHead;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.rocksdb.RocksDBException;
import org.rocksdb.Status;

import java.math.BigInteger;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class RocksDBLedgerStoreTest extends AbstractLedgerStoreTest {

    @TempDir
    Path dir;

    private RocksDBLedgerStore store;

    @BeforeEach
    void open() {
        store = RocksDBLedgerStore.open(dir.resolve("ledger").toString());
    }

    @AfterEach
    void close() {
        store.close();
    }

    @Override
    protected LedgerStore store() {
        return store;
    }

    @Test
    void survivesReopen() {
        ChainHead head = new ChainHead(genesis.hash(), 0, BigInteger.ONE);
        store.write(new LedgerBatch()
                .putBlock(genesis, new BlockMeta(0, BigInteger.ONE))
                .putHeight(0, genesis.hash())
                .putAccount("alice123456", new AccountState(10, 0))
                .setHead(head));
        store.close();

        store = RocksDBLedgerStore.open(dir.resolve("ledger").toString());
        assertEquals(Optional.of(head), store.getHead());
        assertEquals(Optional.of(genesis), store.getBlock(genesis.hash()));
        assertEquals(new AccountState(10, 0), store.getAccount("alice123456"));
    }

    @Test
    void chainResumesFromDiskAfterRestart() {
        Clock clock = ChainFixtures.fixedClock();
        String alice = ChainFixtures.address(ALICE);
        Map<String, Long> alloc = Map.of(alice, 100L);
        Block gen = ChainFixtures.genesis(alloc);
        ChainManager chain = new ChainManager(store, ChainFixtures.validator(clock),
                new OrphanPool(8, Duration.ofMinutes(1), clock));
        chain.initialize(gen, alloc);
        Block b1 = ChainFixtures.child(gen, List.of(ChainFixtures.transfer(ALICE, "bob654321", 10, 1, 1)));
        chain.applyBlock(b1);
        store.close();

        store = RocksDBLedgerStore.open(dir.resolve("ledger").toString());
        ChainManager reopened = new ChainManager(store, ChainFixtures.validator(clock),
                new OrphanPool(8, Duration.ofMinutes(1), clock));
        reopened.initialize(gen, alloc);

        assertEquals(b1.hash(), reopened.head().hash());
        assertEquals(new AccountState(89, 1), reopened.getAccount(alice));
        assertEquals(new AccountState(10, 0), reopened.getAccount("bob654321"));
    }

    @Test
    void onlyTransientStatusesAreRetried() {
        assertTrue(RocksDBLedgerStore.isTransient(exception(Status.Code.Busy)));
        assertTrue(RocksDBLedgerStore.isTransient(exception(Status.Code.TryAgain)));
        assertFalse(RocksDBLedgerStore.isTransient(exception(Status.Code.Corruption)));
        assertFalse(RocksDBLedgerStore.isTransient(new RocksDBException("no status")));
    }

    private static RocksDBException exception(Status.Code code) {
        return new RocksDBException(code.name(), new Status(code, Status.SubCode.None, code.name()));
    }
}
