package io.chainnode.core.protocol.messages;

import io.chainnode.core.ChainFixtures;
import io.chainnode.core.protocol.Block;
import io.chainnode.core.protocol.Hash;
import io.chainnode.core.protocol.MalformedEncodingException;
import io.chainnode.core.protocol.ProtocolError;
import io.chainnode.core.protocol.ProtocolLimits;
import org.junit.jupiter.api.Test;

import java.security.KeyPair;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MessageCodecTest {

    private static final KeyPair ALICE = ChainFixtures.newKeyPair();

    @Test
    void everyMessageTypeSurvivesTheWire() {
        Block genesis = ChainFixtures.genesis(Map.of());
        Block child = ChainFixtures.child(genesis, List.of(ChainFixtures.transfer(ALICE, "bob654321", 3, 1, 1)));
        List<Message> messages = List.of(
                new Message.Hello(1, "node-a", genesis.hash(), 0),
                new Message.Ping(42),
                new Message.Pong(-7),
                new Message.InvBlock(child.hash()),
                new Message.InvTx(child.transactions().get(0).txId()),
                new Message.GetBlocks(genesis.hash(), 128),
                new Message.Blocks(List.of(genesis, child)),
                new Message.GetTx(Hash.ZERO),
                new Message.Tx(child.transactions().get(0)),
                new Message.Reject(ProtocolError.NONCE_CONFLICT, "nonce 3 already used"));

        for (Message m : messages) {
            byte[] frame = MessageCodec.encode(m);
            assertEquals(m.tag(), frame[0]);
            assertEquals(m, MessageCodec.decode(frame), m.getClass().getSimpleName());
        }
    }

    @Test
    void unknownTagIsItsOwnError() {
        UnknownMessageTypeException ex = assertThrows(UnknownMessageTypeException.class,
                () -> MessageCodec.decode(new byte[]{(byte) 0x7e, 1, 2}));
        assertEquals(0x7e, ex.tag());
        // still a decoding failure for callers that only care about that
        assertTrue(ex instanceof MalformedEncodingException);
    }

    @Test
    void truncatedPayloadIsMalformed() {
        byte[] frame = MessageCodec.encode(new Message.Hello(1, "node-a", Hash.ZERO, 9));
        assertThrows(MalformedEncodingException.class,
                () -> MessageCodec.decode(Arrays.copyOf(frame, frame.length - 1)));
        assertThrows(MalformedEncodingException.class, () -> MessageCodec.decode(new byte[0]));
    }

    @Test
    void trailingBytesAreMalformed() {
        byte[] frame = MessageCodec.encode(new Message.Ping(1));
        assertThrows(MalformedEncodingException.class,
                () -> MessageCodec.decode(Arrays.copyOf(frame, frame.length + 2)));
    }

    @Test
    void getBlocksCountMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> new Message.GetBlocks(Hash.ZERO, 0));
        byte[] frame = MessageCodec.encode(new Message.GetBlocks(Hash.ZERO, 1));
        frame[frame.length - 1] = 0;
        assertThrows(MalformedEncodingException.class, () -> MessageCodec.decode(frame));
    }

    @Test
    void rejectContextIsTruncated() {
        String longContext = "x".repeat(ProtocolLimits.MAX_CONTEXT_CHARS + 100);
        Message.Reject reject = new Message.Reject(ProtocolError.MALFORMED_ENCODING, longContext);
        assertEquals(ProtocolLimits.MAX_CONTEXT_CHARS, reject.context().length());
        Message.Reject decoded = (Message.Reject) MessageCodec.decode(MessageCodec.encode(reject));
        assertEquals(ProtocolError.MALFORMED_ENCODING, decoded.code());
    }

    @Test
    void errorCodesAreStable() {
        for (ProtocolError e : ProtocolError.values()) {
            assertEquals(e, ProtocolError.fromCode(e.code()));
        }
        assertEquals(1, ProtocolError.MALFORMED_ENCODING.code());
    }
}
