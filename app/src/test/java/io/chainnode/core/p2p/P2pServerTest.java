package io.chainnode.core.p2p;

import io.chainnode.core.ChainFixtures;
import io.chainnode.core.chain.ApplyResult;
import io.chainnode.core.chain.ChainManager;
import io.chainnode.core.chain.OrphanPool;
import io.chainnode.core.consensus.Validator;
import io.chainnode.core.mempool.Mempool;
import io.chainnode.core.mempool.PriorityPolicy;
import io.chainnode.core.protocol.Block;
import io.chainnode.core.protocol.ProtocolLimits;
import io.chainnode.core.protocol.Transaction;
import io.chainnode.core.protocol.messages.Message;
import io.chainnode.core.storage.InMemoryLedgerStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.security.KeyPair;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

class P2pServerTest {

    private static final KeyPair ALICE = ChainFixtures.newKeyPair();
    private static final String ALICE_ADDR = ChainFixtures.address(ALICE);
    private static final Map<String, Long> ALLOC = Map.of(ALICE_ADDR, 1_000_000L);
    private static final Block GENESIS = ChainFixtures.genesis(ALLOC);

    private final List<P2pServer> servers = new CopyOnWriteArrayList<>();

    @AfterEach
    void tearDown() {
        for (P2pServer server : servers) {
            try {
                server.stop();
            } catch (Exception ignored) {
            }
        }
        servers.clear();
    }

    @Test
    void handshakeExchangesNodeIds() throws Exception {
        CountDownLatch latch = new CountDownLatch(2);
        CopyOnWriteArrayList<String> seenByA = new CopyOnWriteArrayList<>();
        CopyOnWriteArrayList<String> seenByB = new CopyOnWriteArrayList<>();

        TestNode a = createNode("node-A", new RecordingListener(seenByA, latch));
        TestNode b = createNode("node-B", new RecordingListener(seenByB, latch));
        a.server().start();
        b.server().start();

        b.server().connect("127.0.0.1", a.server().boundPort());

        assertTrue(latch.await(5, TimeUnit.SECONDS), "Peers should handshake in time");
        assertTrue(seenByA.contains("node-B"));
        assertTrue(seenByB.contains("node-A"));

        assertEquals(1, a.server().peers().size());
        P2pServer.Peer peerFromA = a.server().peers().iterator().next();
        assertEquals("node-B", peerFromA.nodeId());
        assertTrue(peerFromA.state().isReady());
        assertEquals(ProtocolLimits.PROTOCOL_VERSION, peerFromA.version());
        assertFalse(peerFromA.outbound());
        assertTrue(b.server().peers().iterator().next().outbound());
    }

    @Test
    void laggingPeerSyncsInSeveralBatches() throws Exception {
        TestNode a = createNode("node-A", null);
        TestNode b = createNode("node-B", null);
        for (Block block : ChainFixtures.emptyChain(GENESIS, 12, 0)) {
            assertEquals(ApplyResult.Status.APPLIED, a.chain().applyBlock(block).status());
        }
        a.server().start();
        b.server().start();

        b.server().connect("127.0.0.1", a.server().boundPort());

        assertTrue(waitFor(() -> b.chain().head().height() == 12), "B should catch up to A's head");
        assertEquals(a.chain().head().hash(), b.chain().head().hash());
    }

    @Test
    void divergentForksConvergeOnTheHeavierChain() throws Exception {
        TestNode a = createNode("node-A", null);
        TestNode b = createNode("node-B", null);
        List<Block> longer = ChainFixtures.emptyChain(GENESIS, 8, 1);
        for (Block block : longer) {
            assertEquals(ApplyResult.Status.APPLIED, a.chain().applyBlock(block).status());
        }
        for (Block block : ChainFixtures.emptyChain(GENESIS, 3, 2)) {
            assertEquals(ApplyResult.Status.APPLIED, b.chain().applyBlock(block).status());
        }
        a.server().start();
        b.server().start();

        b.server().connect("127.0.0.1", a.server().boundPort());

        Block tip = longer.get(7);
        assertTrue(waitFor(() -> b.chain().head().hash().equals(tip.hash())), "B should reorg onto A's fork");
        assertEquals(tip.hash(), a.chain().head().hash());
        assertEquals(8, b.chain().head().height());
    }

    @Test
    void shorterButHeavierChainWins() throws Exception {
        TestNode a = createNode("node-A", null);
        TestNode b = createNode("node-B", null);
        Block a1 = ChainFixtures.mined(GENESIS, 4, 1);
        Block a2 = ChainFixtures.mined(a1, 4, 1);
        assertEquals(ApplyResult.Status.APPLIED, a.chain().applyBlock(a1).status());
        assertEquals(ApplyResult.Status.APPLIED, a.chain().applyBlock(a2).status());
        for (Block block : ChainFixtures.emptyChain(GENESIS, 5, 2)) {
            assertEquals(ApplyResult.Status.APPLIED, b.chain().applyBlock(block).status());
        }
        a.server().start();
        b.server().start();

        b.server().connect("127.0.0.1", a.server().boundPort());

        assertTrue(waitFor(() -> b.chain().head().hash().equals(a2.hash())), "B should adopt A's heavier chain");
        assertEquals(2, b.chain().head().height());
        assertEquals(a2.hash(), a.chain().head().hash());
    }

    @Test
    void newHeadIsAnnouncedAndFetched() throws Exception {
        CountDownLatch handshake = new CountDownLatch(2);
        TestNode a = createNode("node-A", new RecordingListener(new CopyOnWriteArrayList<>(), handshake));
        TestNode b = createNode("node-B", new RecordingListener(new CopyOnWriteArrayList<>(), handshake));
        a.server().start();
        b.server().start();
        b.server().connect("127.0.0.1", a.server().boundPort());
        assertTrue(handshake.await(5, TimeUnit.SECONDS));

        Transaction tx = ChainFixtures.transfer(ALICE, "bob654321", 250, 5, 1);
        Block block = ChainFixtures.child(GENESIS, List.of(tx));
        assertEquals(ApplyResult.Status.APPLIED, a.chain().applyBlock(block).status());

        assertTrue(waitFor(() -> b.chain().head().hash().equals(block.hash())), "B should fetch the announced block");
        assertEquals(250L, b.chain().getAccount("bob654321").balance());
    }

    @Test
    void admittedTransactionReachesPeerMempool() throws Exception {
        CountDownLatch handshake = new CountDownLatch(2);
        MessageRecorder recorderB = new MessageRecorder(handshake);
        TestNode a = createNode("node-A", new RecordingListener(new CopyOnWriteArrayList<>(), handshake));
        TestNode b = createNode("node-B", recorderB);
        a.server().start();
        b.server().start();
        b.server().connect("127.0.0.1", a.server().boundPort());
        assertTrue(handshake.await(5, TimeUnit.SECONDS));

        Transaction tx = ChainFixtures.transfer(ALICE, "carol12345", 10, 2, 1);
        assertTrue(a.mempool().admit(tx).ok);

        assertTrue(waitFor(() -> b.mempool().contains(tx.txId())), "B should pull the announced tx");
        assertTrue(recorderB.messages.stream().anyMatch(m -> m instanceof Message.InvTx));
        assertTrue(recorderB.messages.stream().anyMatch(m -> m instanceof Message.Tx));
    }

    @Test
    void selfConnectionIsDropped() throws Exception {
        TestNode a = createNode("node-A", null);
        a.server().start();

        a.server().connect("127.0.0.1", a.server().boundPort()).sync();

        Thread.sleep(500);
        assertEquals(0, a.server().peerCount());
    }

    @Test
    void heartbeatSendsPingMessages() throws Exception {
        CountDownLatch handshake = new CountDownLatch(2);
        MessageRecorder recorderB = new MessageRecorder(handshake);
        TestNode a = createNode("node-A", new RecordingListener(new CopyOnWriteArrayList<>(), handshake), 200L, 1_000L);
        TestNode b = createNode("node-B", recorderB, 200L, 1_000L);
        a.server().start();
        b.server().start();
        b.server().connect("127.0.0.1", a.server().boundPort());

        assertTrue(handshake.await(5, TimeUnit.SECONDS));
        assertTrue(waitFor(() -> recorderB.messages.stream().anyMatch(m -> m instanceof Message.Ping)));
        // answered pings keep both sides alive past the idle timeout
        Thread.sleep(1_500);
        assertEquals(1, a.server().peerCount());
        assertEquals(1, b.server().peerCount());
    }

    @Test
    void disconnectIsReported() throws Exception {
        CountDownLatch handshake = new CountDownLatch(2);
        CountDownLatch disconnectLatch = new CountDownLatch(1);
        TestNode a = createNode("node-A", new DisconnectRecorder(handshake, disconnectLatch));
        TestNode b = createNode("node-B", new RecordingListener(new CopyOnWriteArrayList<>(), handshake));
        a.server().start();
        b.server().start();
        b.server().connect("127.0.0.1", a.server().boundPort());
        assertTrue(handshake.await(5, TimeUnit.SECONDS));

        b.server().stop();

        assertTrue(disconnectLatch.await(5, TimeUnit.SECONDS));
        assertTrue(a.server().peers().isEmpty());
    }

    private TestNode createNode(String nodeId, P2pServer.PeerListener listener) {
        return createNode(nodeId, listener, 10_000L, 30_000L);
    }

    private TestNode createNode(String nodeId, P2pServer.PeerListener listener, long pingIntervalMillis, long idleTimeoutMillis) {
        Clock clock = ChainFixtures.fixedClock();
        Validator validator = ChainFixtures.validator(clock);
        ChainManager chain = new ChainManager(new InMemoryLedgerStore(), validator,
                new OrphanPool(64, Duration.ofMinutes(10), clock));
        chain.initialize(GENESIS, ALLOC);
        Mempool mempool = new Mempool(validator, chain, PriorityPolicy.FEE, 1_000, Duration.ofHours(1), clock);
        chain.addListener(mempool);

        P2pConfig config = P2pConfig.builder(nodeId)
                .port(0)
                .pingIntervalMillis(pingIntervalMillis)
                .idleTimeoutMillis(idleTimeoutMillis)
                .syncBatchSize(5)
                .build();
        P2pServer server = new P2pServer(config, chain, mempool, listener);
        servers.add(server);
        return new TestNode(chain, mempool, server);
    }

    static boolean waitFor(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5_000;
        while (System.currentTimeMillis() < deadline) {
            if (condition.getAsBoolean()) {
                return true;
            }
            Thread.sleep(25);
        }
        return condition.getAsBoolean();
    }

    private record TestNode(ChainManager chain, Mempool mempool, P2pServer server) {}

    private static final class RecordingListener implements P2pServer.PeerListener {
        private final List<String> peers;
        private final CountDownLatch latch;

        RecordingListener(List<String> peers, CountDownLatch latch) {
            this.peers = peers;
            this.latch = latch;
        }

        @Override
        public void onPeerConnected(P2pServer.Peer peer) {
            peers.add(peer.nodeId());
            latch.countDown();
        }

        @Override
        public void onPeerDisconnected(P2pServer.Peer peer) {
        }

        @Override
        public void onMessage(P2pServer.Peer peer, Message message) {
        }
    }

    private static final class MessageRecorder implements P2pServer.PeerListener {
        private final CountDownLatch handshakeLatch;
        private final CopyOnWriteArrayList<Message> messages = new CopyOnWriteArrayList<>();

        MessageRecorder(CountDownLatch handshakeLatch) {
            this.handshakeLatch = handshakeLatch;
        }

        @Override
        public void onPeerConnected(P2pServer.Peer peer) {
            handshakeLatch.countDown();
        }

        @Override
        public void onPeerDisconnected(P2pServer.Peer peer) {
        }

        @Override
        public void onMessage(P2pServer.Peer peer, Message message) {
            messages.add(message);
        }
    }

    private static final class DisconnectRecorder implements P2pServer.PeerListener {
        private final CountDownLatch handshakeLatch;
        private final CountDownLatch disconnectLatch;

        DisconnectRecorder(CountDownLatch handshakeLatch, CountDownLatch disconnectLatch) {
            this.handshakeLatch = handshakeLatch;
            this.disconnectLatch = disconnectLatch;
        }

        @Override
        public void onPeerConnected(P2pServer.Peer peer) {
            handshakeLatch.countDown();
        }

        @Override
        public void onPeerDisconnected(P2pServer.Peer peer) {
            disconnectLatch.countDown();
        }

        @Override
        public void onMessage(P2pServer.Peer peer, Message message) {
        }
    }
}
