package io.chainnode.core.p2p;

import io.chainnode.core.ChainFixtures;
import io.chainnode.core.chain.ChainManager;
import io.chainnode.core.chain.OrphanPool;
import io.chainnode.core.consensus.Validator;
import io.chainnode.core.mempool.Mempool;
import io.chainnode.core.mempool.PriorityPolicy;
import io.chainnode.core.protocol.Block;
import io.chainnode.core.protocol.Hash;
import io.chainnode.core.protocol.ProtocolError;
import io.chainnode.core.protocol.ProtocolLimits;
import io.chainnode.core.protocol.messages.Message;
import io.chainnode.core.protocol.messages.MessageCodec;
import io.chainnode.core.storage.InMemoryLedgerStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.net.Socket;
import java.net.SocketException;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

import static org.junit.jupiter.api.Assertions.*;

/** Talks to a live server over a plain socket, frame by frame. */
class P2pWireTest {

    private static final Map<String, Long> ALLOC = Map.of("alice123456", 1_000L);
    private static final Block GENESIS = ChainFixtures.genesis(ALLOC);

    private P2pServer server;
    private ChainManager chain;

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.stop();
        }
    }

    @Test
    void serverGreetsWithItsHead() throws Exception {
        startServer(P2pConfig.builder("node-A").port(0).build());
        try (RawPeer raw = RawPeer.connect(server.boundPort())) {
            Message.Hello hello = raw.expect(Message.Hello.class);
            assertEquals(ProtocolLimits.PROTOCOL_VERSION, hello.version());
            assertEquals("node-A", hello.nodeId());
            assertEquals(GENESIS.hash(), hello.headHash());
            assertEquals(0L, hello.height());
        }
    }

    @Test
    void messagesBeforeHelloAreRejected() throws Exception {
        startServer(P2pConfig.builder("node-A").port(0).build());
        try (RawPeer raw = RawPeer.connect(server.boundPort())) {
            raw.expect(Message.Hello.class);
            raw.send(new Message.Ping(1L));

            Message.Reject reject = raw.expect(Message.Reject.class);
            assertEquals(ProtocolError.MALFORMED_ENCODING, reject.code());
            assertEquals("handshake required", reject.context());
        }
    }

    @Test
    void oldProtocolVersionIsRejectedAndClosed() throws Exception {
        startServer(P2pConfig.builder("node-A").port(0).build());
        try (RawPeer raw = RawPeer.connect(server.boundPort())) {
            raw.expect(Message.Hello.class);
            raw.send(new Message.Hello(0, "old-peer", GENESIS.hash(), 0L));

            Message.Reject reject = raw.expect(Message.Reject.class);
            assertEquals(ProtocolError.PROTOCOL_VERSION_MISMATCH, reject.code());
            assertTrue(raw.closedByRemote());
        }
        assertEquals(0, server.peerCount());
    }

    @Test
    void unknownTagIsRejectedButConnectionSurvives() throws Exception {
        startServer(P2pConfig.builder("node-A").port(0).build());
        try (RawPeer raw = RawPeer.connect(server.boundPort())) {
            raw.handshake("raw-peer");
            raw.sendRaw(new byte[]{0x7e, 1, 2, 3});

            Message.Reject reject = raw.expect(Message.Reject.class);
            assertEquals(ProtocolError.MALFORMED_ENCODING, reject.code());

            raw.send(new Message.Ping(77L));
            assertEquals(77L, raw.expect(Message.Pong.class).nonce());
        }
    }

    @Test
    void oversizedFrameIsRejectedAndClosed() throws Exception {
        startServer(P2pConfig.builder("node-A").port(0).maxFrameBytes(1024).build());
        try (RawPeer raw = RawPeer.connect(server.boundPort())) {
            raw.handshake("raw-peer");
            raw.sendLengthOnly(64 * 1024);

            Message.Reject reject = raw.expect(Message.Reject.class);
            assertEquals(ProtocolError.FRAME_TOO_LARGE, reject.code());
            assertTrue(raw.closedByRemote());
        }
    }

    @Test
    void orphanBlockTriggersFetchFromLocalHead() throws Exception {
        startServer(P2pConfig.builder("node-A").port(0).syncBatchSize(16).build());
        List<Block> blocks = ChainFixtures.emptyChain(GENESIS, 2, 0);
        try (RawPeer raw = RawPeer.connect(server.boundPort())) {
            raw.handshake("raw-peer");
            raw.send(new Message.Blocks(List.of(blocks.get(1))));

            Message.GetBlocks request = raw.expect(Message.GetBlocks.class);
            assertEquals(GENESIS.hash(), request.fromHash());
            assertEquals(16, request.count());
            assertTrue(chain.isOrphan(blocks.get(1).hash()));

            raw.send(new Message.Blocks(List.of(blocks.get(0))));
            assertTrue(P2pServerTest.waitFor(() -> chain.head().height() == 2));
            assertEquals(blocks.get(1).hash(), chain.head().hash());
        }
    }

    @Test
    void getBlocksServesCanonicalBlocksAndRejectsUnknownLocator() throws Exception {
        startServer(P2pConfig.builder("node-A").port(0).build());
        List<Block> blocks = ChainFixtures.emptyChain(GENESIS, 3, 0);
        for (Block block : blocks) {
            chain.applyBlock(block);
        }
        try (RawPeer raw = RawPeer.connect(server.boundPort())) {
            raw.handshake("raw-peer");
            raw.send(new Message.GetBlocks(GENESIS.hash(), 2));
            Message.Blocks served = raw.expect(Message.Blocks.class);
            assertEquals(List.of(blocks.get(0).hash(), blocks.get(1).hash()),
                    served.blocks().stream().map(Block::hash).toList());

            raw.send(new Message.GetBlocks(ChainFixtures.child(blocks.get(2), List.of(), 9).hash(), 2));
            assertEquals(ProtocolError.UNKNOWN_PARENT, raw.expect(Message.Reject.class).code());
        }
    }

    @Test
    void unknownLocatorWalksBackThenGivesUpAtGenesis() throws Exception {
        startServer(P2pConfig.builder("node-A").port(0).syncBatchSize(16).build());
        List<Block> blocks = ChainFixtures.emptyChain(GENESIS, 5, 0);
        for (Block block : blocks) {
            chain.applyBlock(block);
        }
        Hash foreignHead = ChainFixtures.child(GENESIS, List.of(), 99).hash();
        try (RawPeer raw = RawPeer.connect(server.boundPort())) {
            raw.expect(Message.Hello.class);
            raw.send(new Message.Hello(ProtocolLimits.PROTOCOL_VERSION, "raw-peer", foreignHead, 1L));

            // heights 5, 3, 1, then genesis: the step doubles each time
            List<Hash> expected = List.of(blocks.get(4).hash(), blocks.get(2).hash(), blocks.get(0).hash(), GENESIS.hash());
            for (Hash locator : expected) {
                Message.GetBlocks request = raw.expect(Message.GetBlocks.class);
                assertEquals(locator, request.fromHash());
                assertEquals(16, request.count());
                raw.send(new Message.Reject(ProtocolError.UNKNOWN_PARENT, "unknown locator"));
            }

            raw.send(new Message.Ping(5L));
            Message next = raw.readUntil(m -> m instanceof Message.GetBlocks || m instanceof Message.Pong);
            assertInstanceOf(Message.Pong.class, next, "no further locator after genesis");
            P2pServer.Peer peer = server.peers().iterator().next();
            assertEquals(PeerState.STEADY, peer.state());
        }
    }

    @Test
    void peerStallingMidSyncTimesOut() throws Exception {
        startServer(P2pConfig.builder("node-A").port(0).syncTimeoutMillis(300).build());
        Hash foreignHead = ChainFixtures.child(GENESIS, List.of(), 99).hash();
        try (RawPeer raw = RawPeer.connect(server.boundPort())) {
            raw.expect(Message.Hello.class);
            raw.send(new Message.Hello(ProtocolLimits.PROTOCOL_VERSION, "raw-peer", foreignHead, 1L));
            assertEquals(GENESIS.hash(), raw.expect(Message.GetBlocks.class).fromHash());

            Message.Reject reject = raw.expect(Message.Reject.class);
            assertEquals(ProtocolError.PEER_TIMEOUT, reject.code());
            assertEquals("sync timeout", reject.context());
            assertTrue(raw.closedByRemote());
        }
        assertTrue(P2pServerTest.waitFor(() -> server.peerCount() == 0));
    }

    @Test
    void silentPeerTimesOut() throws Exception {
        startServer(P2pConfig.builder("node-A").port(0)
                .pingIntervalMillis(100)
                .idleTimeoutMillis(400)
                .build());
        try (RawPeer raw = RawPeer.connect(server.boundPort())) {
            raw.handshake("raw-peer");

            Message.Reject reject = raw.expect(Message.Reject.class);
            assertEquals(ProtocolError.PEER_TIMEOUT, reject.code());
            assertTrue(raw.closedByRemote());
        }
        assertTrue(P2pServerTest.waitFor(() -> server.peerCount() == 0));
    }

    @Test
    void missingHelloTimesOut() throws Exception {
        startServer(P2pConfig.builder("node-A").port(0).handshakeTimeoutMillis(300).build());
        try (RawPeer raw = RawPeer.connect(server.boundPort())) {
            raw.expect(Message.Hello.class);

            Message.Reject reject = raw.expect(Message.Reject.class);
            assertEquals(ProtocolError.PEER_TIMEOUT, reject.code());
            assertTrue(raw.closedByRemote());
        }
    }

    private void startServer(P2pConfig config) {
        Clock clock = ChainFixtures.fixedClock();
        Validator validator = ChainFixtures.validator(clock);
        chain = new ChainManager(new InMemoryLedgerStore(), validator,
                new OrphanPool(16, Duration.ofMinutes(10), clock));
        chain.initialize(GENESIS, ALLOC);
        Mempool mempool = new Mempool(validator, chain, PriorityPolicy.FEE, 100, Duration.ofHours(1), clock);
        chain.addListener(mempool);
        server = new P2pServer(config, chain, mempool);
        server.start();
    }

    /** Blocking client speaking the 4-byte length prefixed framing. */
    private static final class RawPeer implements AutoCloseable {
        private final Socket socket;
        private final DataInputStream in;
        private final DataOutputStream out;

        private RawPeer(Socket socket) throws IOException {
            this.socket = socket;
            this.in = new DataInputStream(socket.getInputStream());
            this.out = new DataOutputStream(socket.getOutputStream());
        }

        static RawPeer connect(int port) throws IOException {
            Socket socket = new Socket("127.0.0.1", port);
            socket.setSoTimeout(5_000);
            return new RawPeer(socket);
        }

        void handshake(String nodeId) throws IOException {
            expect(Message.Hello.class);
            send(new Message.Hello(ProtocolLimits.PROTOCOL_VERSION, nodeId, GENESIS.hash(), 0L));
        }

        void send(Message message) throws IOException {
            sendRaw(MessageCodec.encode(message));
        }

        void sendRaw(byte[] body) throws IOException {
            out.writeInt(body.length);
            out.write(body);
            out.flush();
        }

        void sendLengthOnly(int length) throws IOException {
            out.writeInt(length);
            out.flush();
        }

        Message read() throws IOException {
            int length = in.readInt();
            byte[] body = new byte[length];
            in.readFully(body);
            return MessageCodec.decode(body);
        }

        /** Skips heartbeats and anything else until a message of the given type arrives. */
        <T extends Message> T expect(Class<T> type) throws IOException {
            return type.cast(readUntil(type::isInstance));
        }

        Message readUntil(Predicate<Message> match) throws IOException {
            while (true) {
                Message message = read();
                if (match.test(message)) {
                    return message;
                }
            }
        }

        boolean closedByRemote() throws IOException {
            try {
                while (true) {
                    read();
                }
            } catch (EOFException | SocketException e) {
                return true;
            }
        }

        @Override
        public void close() throws IOException {
            socket.close();
        }
    }
}
