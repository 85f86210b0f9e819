package io.chainnode.core.protocol;

import io.chainnode.core.ChainFixtures;
import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;
import java.security.KeyPair;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class BlockCodecTest {

    private static final KeyPair ALICE = ChainFixtures.newKeyPair();

    @Test
    void blockRoundTripKeepsHashAndBody() {
        Block genesis = ChainFixtures.genesis(Map.of());
        List<Transaction> txs = List.of(
                ChainFixtures.transfer(ALICE, "bob654321", 10, 1, 1),
                ChainFixtures.transfer(ALICE, "carol12345", 20, 2, 2));
        Block block = ChainFixtures.child(genesis, txs);

        Block decoded = BlockCodec.fromBytes(block.serialize());

        assertEquals(block.hash(), decoded.hash());
        assertEquals(2, decoded.transactions().size());
        assertEquals(txs.get(1).txId(), decoded.transactions().get(1).txId());
        assertArrayEquals(block.serialize(), decoded.serialize());
    }

    @Test
    void headerEncodingIsFixedSize() {
        BlockHeader header = new BlockHeader(new byte[32], new byte[32], 0, ChainFixtures.GENESIS_TS, 0, 7);
        assertEquals(BlockHeader.ENCODED_SIZE, header.serialize().length);
        assertEquals(header, BlockHeaderCodec.fromBytes(header.serialize()));
    }

    @Test
    void corruptedTxCountIsMalformed() {
        Block block = ChainFixtures.child(ChainFixtures.genesis(Map.of()),
                List.of(ChainFixtures.transfer(ALICE, "bob654321", 10, 1, 1)));
        byte[] bytes = block.serialize();
        ByteBuffer.wrap(bytes).putInt(BlockHeader.ENCODED_SIZE, 1_000_000);
        assertThrows(MalformedEncodingException.class, () -> BlockCodec.fromBytes(bytes));
    }

    @Test
    void truncatedBlockIsMalformed() {
        Block block = ChainFixtures.child(ChainFixtures.genesis(Map.of()),
                List.of(ChainFixtures.transfer(ALICE, "bob654321", 10, 1, 1)));
        byte[] bytes = block.serialize();
        assertThrows(MalformedEncodingException.class,
                () -> BlockCodec.fromBytes(Arrays.copyOf(bytes, bytes.length - 5)));
        assertThrows(MalformedEncodingException.class,
                () -> BlockCodec.fromBytes(Arrays.copyOf(bytes, BlockHeader.ENCODED_SIZE - 1)));
    }

    @Test
    void merkleRootOfEmptyListIsZero() {
        assertArrayEquals(new byte[32], Merkle.rootOf(List.of()));
    }

    @Test
    void merkleRootDuplicatesOddLeaf() {
        byte[] a = Hashes.sha256(new byte[]{1});
        byte[] b = Hashes.sha256(new byte[]{2});
        byte[] c = Hashes.sha256(new byte[]{3});
        byte[] expected = Hashes.sha256(Hashes.sha256(a, b), Hashes.sha256(c, c));
        assertArrayEquals(expected, Merkle.rootOf(List.of(a, b, c)));
    }

    @Test
    void accountRecordRoundTrip() {
        AccountState state = new AccountState(42, 7);
        assertEquals(state, RecordCodec.decodeAccount(RecordCodec.encodeAccount(state)));
        assertThrows(MalformedEncodingException.class, () -> RecordCodec.decodeAccount(new byte[3]));
    }
}
