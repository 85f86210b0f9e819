package io.chainnode.core.storage;

import io.chainnode.core.ChainFixtures;
import io.chainnode.core.protocol.AccountState;
import io.chainnode.core.protocol.Block;
import io.chainnode.core.protocol.BlockMeta;
import io.chainnode.core.protocol.ChainHead;
import io.chainnode.core.protocol.Hash;
import io.chainnode.core.protocol.TxLocation;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.security.KeyPair;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/** Behavior every {@link LedgerStore} must share. */
abstract class AbstractLedgerStoreTest {

    protected static final KeyPair ALICE = ChainFixtures.newKeyPair();

    protected abstract LedgerStore store();

    protected Block genesis = ChainFixtures.genesis(Map.of("alice123456", 10L));

    @Test
    void emptyStoreHasNoHead() {
        assertTrue(store().getHead().isEmpty());
        assertEquals(AccountState.EMPTY, store().getAccount("nobody123"));
        assertTrue(store().getBlock(Hash.ZERO).isEmpty());
        assertEquals(0, store().blockCount());
    }

    @Test
    void batchWritesEverything() {
        Block b1 = ChainFixtures.child(genesis, List.of(ChainFixtures.transfer(ALICE, "bob654321", 1, 1, 1)));
        Hash txId = b1.transactions().get(0).txId();
        ChainHead head = new ChainHead(b1.hash(), 1, BigInteger.TWO);

        store().write(new LedgerBatch()
                .putBlock(genesis, new BlockMeta(0, BigInteger.ONE))
                .putBlock(b1, new BlockMeta(1, BigInteger.TWO))
                .putHeight(0, genesis.hash())
                .putHeight(1, b1.hash())
                .putTxLocation(txId, new TxLocation(b1.hash(), 0))
                .putAccount("alice123456", new AccountState(8, 1))
                .setHead(head));

        assertEquals(Optional.of(b1), store().getBlock(b1.hash()));
        assertEquals(Optional.of(new BlockMeta(1, BigInteger.TWO)), store().getBlockMeta(b1.hash()));
        assertEquals(Optional.of(b1.hash()), store().getHashAtHeight(1));
        assertEquals(Optional.of(new TxLocation(b1.hash(), 0)), store().getTxLocation(txId));
        assertEquals(new AccountState(8, 1), store().getAccount("alice123456"));
        assertEquals(Optional.of(head), store().getHead());
        assertEquals(2, store().blockCount());
    }

    @Test
    void deletesRunBeforePutsAndEmptyAccountsVanish() {
        Hash other = new Hash(ChainFixtures.child(genesis, List.of(), 5).hash().bytes());
        store().write(new LedgerBatch()
                .putHeight(3, genesis.hash())
                .putAccount("alice123456", new AccountState(5, 0)));

        store().write(new LedgerBatch()
                .deleteHeight(3)
                .putHeight(3, other)
                .putAccount("alice123456", AccountState.EMPTY));

        assertEquals(Optional.of(other), store().getHashAtHeight(3));
        assertEquals(AccountState.EMPTY, store().getAccount("alice123456"));
    }

    @Test
    void closedStoreRefusesWork() {
        store().close();
        assertThrows(StorageException.class, () -> store().getHead());
        assertThrows(StorageException.class, () -> store().write(new LedgerBatch().putHeight(0, Hash.ZERO)));
    }
}
