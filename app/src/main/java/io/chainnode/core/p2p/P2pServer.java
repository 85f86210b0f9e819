package io.chainnode.core.p2p;

import io.chainnode.core.chain.ChainManager;
import io.chainnode.core.chain.ChainUpdate;
import io.chainnode.core.mempool.Mempool;
import io.chainnode.core.metrics.NodeMetrics;
import io.chainnode.core.protocol.Hash;
import io.chainnode.core.protocol.ProtocolError;
import io.chainnode.core.protocol.Transaction;
import io.chainnode.core.protocol.messages.Message;
import io.netty.bootstrap.Bootstrap;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.group.ChannelGroup;
import io.netty.channel.group.DefaultChannelGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.LengthFieldBasedFrameDecoder;
import io.netty.handler.codec.LengthFieldPrepender;
import io.netty.handler.codec.TooLongFrameException;
import io.netty.util.AttributeKey;
import io.netty.util.concurrent.GlobalEventExecutor;

import java.net.InetSocketAddress;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * TCP peer engine: framing, handshake, block sync, gossip and liveness.
 *
 * Pipeline per channel: length-field frame decoder (bounded), length prepender,
 * {@link WireCodec}, then the channel handler, which only queues messages onto the
 * {@link PeerSession}. Protocol logic runs in {@link ProtocolHandler} on a worker pool.
 */
public final class P2pServer {
    public interface PeerListener {
        void onPeerConnected(Peer peer);
        void onPeerDisconnected(Peer peer);
        void onMessage(Peer peer, Message message);
    }

    /** Snapshot of a session; {@code version} is the negotiated protocol version, 0 before Hello. */
    public record Peer(String nodeId, String remoteAddress, PeerState state, long height, int version, boolean outbound) {}

    private static final Logger LOG = Logger.getLogger(P2pServer.class.getName());
    private static final AttributeKey<PeerSession> SESSION_KEY = AttributeKey.valueOf("peer-session");
    private static final AttributeKey<Boolean> OUTBOUND_KEY = AttributeKey.valueOf("peer-outbound");

    private final P2pConfig config;
    private final ChainManager chain;
    private final PeerListener listener;
    private final ProtocolHandler protocol;

    private final NioEventLoopGroup bossGroup = new NioEventLoopGroup(1);
    private final NioEventLoopGroup workerGroup = new NioEventLoopGroup();
    private final NioEventLoopGroup clientGroup = new NioEventLoopGroup();
    private final ExecutorService protocolWorkers;
    private final ChannelGroup channels = new DefaultChannelGroup(GlobalEventExecutor.INSTANCE);
    private final Set<PeerSession> sessions = ConcurrentHashMap.newKeySet();
    private final Map<String, PeerSession> peersById = new ConcurrentHashMap<>();

    private ScheduledExecutorService housekeeping;
    private Channel serverChannel;

    public P2pServer(P2pConfig config, ChainManager chain, Mempool mempool) {
        this(config, chain, mempool, new LoggingPeerListener());
    }

    public P2pServer(P2pConfig config, ChainManager chain, Mempool mempool, PeerListener listener) {
        this.config = config;
        this.chain = chain;
        this.listener = listener == null ? new LoggingPeerListener() : listener;
        this.protocol = new ProtocolHandler(this, config, chain, mempool);
        AtomicInteger threadIds = new AtomicInteger();
        this.protocolWorkers = Executors.newFixedThreadPool(config.workerThreads, r -> {
            Thread t = new Thread(r, "p2p-worker-" + config.nodeId + "-" + threadIds.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        chain.addListener(this::onChainUpdate);
        mempool.addAdmitListener(this::onTransactionAdmitted);
    }

    public void start() {
        try {
            ServerBootstrap bootstrap = new ServerBootstrap();
            bootstrap.group(bossGroup, workerGroup)
                    .channel(NioServerSocketChannel.class)
                    .childHandler(new ChannelInitializer<SocketChannel>() {
                        @Override
                        protected void initChannel(SocketChannel ch) {
                            configurePipeline(ch.pipeline());
                        }
                    });

            serverChannel = bootstrap.bind(config.port).sync().channel();
            channels.add(serverChannel);
            LOG.info(() -> "P2P server listening on port " + boundPort() + " (nodeId=" + config.nodeId + ")");
            startHousekeeping();
            connect(config.bootstrapPeers);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while starting P2P server", e);
        }
    }

    /** Actual listening port; differs from the configured one when that was 0. */
    public int boundPort() {
        if (serverChannel == null) return -1;
        return ((InetSocketAddress) serverChannel.localAddress()).getPort();
    }

    public void connect(String endpoint) {
        if (endpoint == null || endpoint.isBlank()) {
            return;
        }
        String[] parts = endpoint.split(":", 2);
        if (parts.length != 2) {
            LOG.warning(() -> "Invalid peer endpoint: " + endpoint);
            return;
        }
        String host = parts[0].trim();
        int targetPort;
        try {
            targetPort = Integer.parseInt(parts[1].trim());
        } catch (NumberFormatException e) {
            LOG.warning(() -> "Invalid peer port in endpoint: " + endpoint);
            return;
        }
        connect(host, targetPort);
    }

    public void connect(Collection<String> endpoints) {
        if (endpoints == null) {
            return;
        }
        for (String endpoint : endpoints) {
            connect(endpoint);
        }
    }

    public ChannelFuture connect(String host, int targetPort) {
        Bootstrap bootstrap = new Bootstrap();
        bootstrap.group(clientGroup)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) Math.min(Integer.MAX_VALUE, config.handshakeTimeoutMillis))
                .attr(OUTBOUND_KEY, Boolean.TRUE)
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        configurePipeline(ch.pipeline());
                    }
                });

        return bootstrap.connect(host, targetPort).addListener((ChannelFutureListener) future -> {
            if (future.isSuccess()) {
                channels.add(future.channel());
                LOG.info(() -> "Connected to peer " + host + ':' + targetPort);
            } else {
                LOG.log(Level.WARNING, "Failed to connect to peer " + host + ':' + targetPort, future.cause());
            }
        });
    }

    /** Announce a new head to every ready peer; repeated calls before the flush coalesce. */
    public void announceBlock(Hash hash) {
        for (PeerSession session : peersById.values()) {
            session.announceBlock(hash);
        }
    }

    public void announceTx(Hash txId) {
        Message inv = new Message.InvTx(txId);
        for (PeerSession session : peersById.values()) {
            session.announce(inv);
        }
    }

    public Collection<Peer> peers() {
        List<Peer> peers = new ArrayList<>();
        for (PeerSession session : peersById.values()) {
            peers.add(toPeer(session));
        }
        return peers;
    }

    public int peerCount() {
        return peersById.size();
    }

    public void stop() {
        stopHousekeeping();
        try {
            if (serverChannel != null) {
                serverChannel.close().sync();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        channels.close().awaitUninterruptibly();
        bossGroup.shutdownGracefully();
        workerGroup.shutdownGracefully();
        clientGroup.shutdownGracefully();
        protocolWorkers.shutdownNow();
        peersById.clear();
        sessions.clear();
        LOG.info("P2P server stopped");
    }

    // ---------------- hooks for ProtocolHandler ----------------

    /** False when another live session already uses the same node id. */
    boolean registerPeer(PeerSession session) {
        PeerSession existing = peersById.putIfAbsent(session.remoteNodeId(), session);
        if (existing != null && existing != session) {
            return false;
        }
        NodeMetrics.peerConnected();
        listener.onPeerConnected(toPeer(session));
        return true;
    }

    void notifyMessage(PeerSession session, Message message) {
        listener.onMessage(toPeer(session), message);
    }

    // ---------------- chain / mempool events ----------------

    private void onChainUpdate(ChainUpdate update) {
        announceBlock(update.newHead().hash());
    }

    private void onTransactionAdmitted(Transaction tx) {
        announceTx(tx.txId());
    }

    // ---------------- housekeeping ----------------

    private void startHousekeeping() {
        stopHousekeeping();
        housekeeping = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "p2p-heartbeat-" + config.nodeId);
            t.setDaemon(true);
            return t;
        });
        long shortest = Math.min(config.pingIntervalMillis, Math.min(config.handshakeTimeoutMillis, config.syncTimeoutMillis));
        long tick = Math.max(25L, shortest / 2);
        housekeeping.scheduleAtFixedRate(this::runHousekeeping, tick, tick, TimeUnit.MILLISECONDS);
    }

    private void stopHousekeeping() {
        if (housekeeping != null) {
            housekeeping.shutdownNow();
            housekeeping = null;
        }
    }

    private void runHousekeeping() {
        try {
            long now = System.currentTimeMillis();
            for (PeerSession session : sessions) {
                if (!session.isActive()) {
                    continue;
                }
                if (!session.state().isReady()) {
                    if (now - session.connectedAt() > config.handshakeTimeoutMillis) {
                        timeout(session, "handshake timeout");
                    }
                    continue;
                }
                if (now - session.lastSeen() > config.idleTimeoutMillis) {
                    timeout(session, "idle timeout");
                    continue;
                }
                long syncAt = session.syncRequestedAt();
                if (session.isSyncing() && syncAt > 0 && now - syncAt > config.syncTimeoutMillis) {
                    timeout(session, "sync timeout");
                    continue;
                }
                if (now - session.lastPingSent() >= config.pingIntervalMillis) {
                    session.pingSent(now);
                    session.send(new Message.Ping(ThreadLocalRandom.current().nextLong()));
                }
            }
        } catch (RuntimeException e) {
            LOG.log(Level.WARNING, "P2P housekeeping failed", e);
        }
    }

    private void timeout(PeerSession session, String reason) {
        LOG.info(() -> "Closing " + session + ": " + reason);
        session.sendAndClose(new Message.Reject(ProtocolError.PEER_TIMEOUT, reason));
    }

    // ---------------- pipeline ----------------

    private void configurePipeline(ChannelPipeline pipeline) {
        // the decoder's limit counts the 4-byte length field too
        pipeline.addLast(new LengthFieldBasedFrameDecoder(config.maxFrameBytes + 4, 0, 4, 0, 4));
        pipeline.addLast(new LengthFieldPrepender(4));
        pipeline.addLast(new WireCodec());
        pipeline.addLast(new PeerChannelHandler());
    }

    private final class PeerChannelHandler extends SimpleChannelInboundHandler<Message> {
        @Override
        public void channelActive(ChannelHandlerContext ctx) {
            Channel ch = ctx.channel();
            boolean outbound = Boolean.TRUE.equals(ch.attr(OUTBOUND_KEY).get());
            PeerSession session = new PeerSession(ch, outbound, config.inboundQueueLimit,
                    config.outboundPendingLimit, protocolWorkers, protocol::handle);
            ch.attr(SESSION_KEY).set(session);
            channels.add(ch);
            sessions.add(session);
            session.setState(PeerState.HANDSHAKING);
            session.send(protocol.localHello());
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx) {
            PeerSession session = ctx.channel().attr(SESSION_KEY).get();
            channels.remove(ctx.channel());
            if (session == null) {
                return;
            }
            boolean wasReady = session.state().isReady();
            session.markDisconnected();
            sessions.remove(session);
            String id = session.remoteNodeId();
            if (wasReady && id != null && peersById.remove(id, session)) {
                NodeMetrics.peerDisconnected();
                listener.onPeerDisconnected(toPeer(session));
            }
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, Message msg) {
            PeerSession session = ctx.channel().attr(SESSION_KEY).get();
            if (session == null) {
                return;
            }
            session.touch();
            session.enqueue(msg);
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
            PeerSession session = ctx.channel().attr(SESSION_KEY).get();
            if (cause instanceof TooLongFrameException) {
                LOG.warning(() -> "Closing " + (session != null ? session : ctx.channel()) + ": " + cause.getMessage());
                ctx.writeAndFlush(new Message.Reject(ProtocolError.FRAME_TOO_LARGE, "frame exceeds " + config.maxFrameBytes))
                        .addListener(ChannelFutureListener.CLOSE);
                return;
            }
            LOG.log(Level.WARNING, "P2P channel error", cause);
            ctx.close();
        }
    }

    private static Peer toPeer(PeerSession session) {
        return new Peer(session.remoteNodeId(), session.remoteAddress(), session.state(), session.peerHeight(),
                session.version(), session.isOutbound());
    }

    private static final class LoggingPeerListener implements PeerListener {
        @Override
        public void onPeerConnected(Peer peer) {
            LOG.info(() -> "Peer connected: " + peer);
        }

        @Override
        public void onPeerDisconnected(Peer peer) {
            LOG.info(() -> "Peer disconnected: " + peer);
        }

        @Override
        public void onMessage(Peer peer, Message message) {
            LOG.fine(() -> "Received " + message.getClass().getSimpleName() + " from " + peer.nodeId());
        }
    }
}
