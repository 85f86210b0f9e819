package io.chainnode.core.p2p;

import io.chainnode.core.metrics.NodeMetrics;
import io.chainnode.core.protocol.Hash;
import io.chainnode.core.protocol.messages.Message;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;

import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BiConsumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * One connection's record: handshake results, sync progress, liveness stamps and the two
 * bounded queues. Inbound messages are handled one at a time on the worker pool, never on the
 * event loop; when the inbound queue fills up the channel stops reading until it drains.
 */
final class PeerSession {
    private static final Logger LOG = Logger.getLogger(PeerSession.class.getName());

    private final Channel channel;
    private final boolean outbound;
    private final int inboundLimit;
    private final int outboundLimit;
    private final Executor worker;
    private final BiConsumer<PeerSession, Message> handler;

    private final Deque<Message> inbound = new ArrayDeque<>();
    private boolean draining;
    private final AtomicInteger outboundPending = new AtomicInteger();
    private final AtomicReference<Hash> pendingBlockAnnouncement = new AtomicReference<>();

    private volatile PeerState state = PeerState.CONNECTING;
    private volatile String remoteNodeId;
    private volatile int version;
    private volatile Hash peerHead = Hash.ZERO;
    private volatile long peerHeight = -1;
    private final long connectedAt;
    private volatile long lastSeen;
    private volatile long lastPingSent;

    // sync bookkeeping, touched only by the serial drain
    private volatile long syncRequestedAt;
    private Hash syncFrom;
    private int syncRequested;
    private long locatorStep = 1;

    PeerSession(Channel channel, boolean outbound, int inboundLimit, int outboundLimit,
                Executor worker, BiConsumer<PeerSession, Message> handler) {
        this.channel = channel;
        this.outbound = outbound;
        this.inboundLimit = inboundLimit;
        this.outboundLimit = outboundLimit;
        this.worker = worker;
        this.handler = handler;
        this.connectedAt = System.currentTimeMillis();
        this.lastSeen = connectedAt;
    }

    // ---------------- inbound ----------------

    void enqueue(Message message) {
        boolean schedule;
        synchronized (inbound) {
            if (state == PeerState.DISCONNECTED) return;
            inbound.addLast(message);
            if (inbound.size() >= inboundLimit && channel.config().isAutoRead()) {
                LOG.fine(() -> "Inbound queue full for " + this + ", pausing reads");
                channel.config().setAutoRead(false);
            }
            schedule = !draining;
            draining = true;
        }
        if (schedule) {
            try {
                worker.execute(this::drain);
            } catch (RejectedExecutionException e) {
                LOG.log(Level.FINE, "Worker pool shut down, dropping inbound for " + this, e);
                synchronized (inbound) {
                    inbound.clear();
                    draining = false;
                }
            }
        }
    }

    private void drain() {
        while (true) {
            Message next;
            synchronized (inbound) {
                next = inbound.pollFirst();
                if (next == null) {
                    draining = false;
                    return;
                }
                if (!channel.config().isAutoRead() && inbound.size() <= inboundLimit / 2 && isActive()) {
                    channel.config().setAutoRead(true);
                }
            }
            if (!isActive()) continue;
            try {
                handler.accept(this, next);
            } catch (RuntimeException e) {
                LOG.log(Level.WARNING, "Failed handling " + next.getClass().getSimpleName() + " from " + this, e);
            }
        }
    }

    int inboundSize() {
        synchronized (inbound) {
            return inbound.size();
        }
    }

    // ---------------- outbound ----------------

    /** Responses and protocol traffic: always written. */
    ChannelFuture send(Message message) {
        outboundPending.incrementAndGet();
        ChannelFuture f = channel.writeAndFlush(message);
        f.addListener((ChannelFutureListener) done -> outboundPending.decrementAndGet());
        return f;
    }

    /** Write, then close once the write completes. */
    void sendAndClose(Message message) {
        send(message).addListener(ChannelFutureListener.CLOSE);
    }

    /** Gossip: dropped when the peer is not keeping up. Returns false when dropped. */
    boolean announce(Message message) {
        if (!state.isReady()) return false;
        if (!channel.isWritable() || outboundPending.get() >= outboundLimit) {
            NodeMetrics.incrementAnnouncementsDropped();
            LOG.fine(() -> "Dropped " + message.getClass().getSimpleName() + " to slow peer " + this);
            return false;
        }
        send(message);
        return true;
    }

    /** Coalesced head announcement: only the latest head queued before the flush goes out. */
    void announceBlock(Hash hash) {
        if (!state.isReady() || hash.equals(peerHead)) return;
        if (pendingBlockAnnouncement.getAndSet(hash) != null) {
            return;
        }
        channel.eventLoop().execute(() -> {
            Hash latest = pendingBlockAnnouncement.getAndSet(null);
            if (latest != null && !latest.equals(peerHead)) {
                announce(new Message.InvBlock(latest));
            }
        });
    }

    int outboundPending() {
        return outboundPending.get();
    }

    void close() {
        channel.close();
    }

    // ---------------- state ----------------

    boolean isActive() {
        return state != PeerState.DISCONNECTED && channel.isActive();
    }

    void markDisconnected() {
        state = PeerState.DISCONNECTED;
        synchronized (inbound) {
            inbound.clear();
        }
        syncRequestedAt = 0;
    }

    void completeHandshake(String nodeId, int negotiatedVersion, Hash head, long height) {
        this.remoteNodeId = nodeId;
        this.version = negotiatedVersion;
        notePeerHead(head, height);
        this.state = PeerState.STEADY;
    }

    void notePeerHead(Hash head, long height) {
        if (height >= peerHeight) {
            this.peerHead = head;
            this.peerHeight = height;
        }
    }

    void startSync(Hash from, int count) {
        this.state = PeerState.SYNCHRONIZING;
        this.syncFrom = from;
        this.syncRequested = count;
        this.syncRequestedAt = System.currentTimeMillis();
    }

    void finishSync() {
        if (state == PeerState.SYNCHRONIZING) state = PeerState.STEADY;
        this.syncRequestedAt = 0;
        this.syncFrom = null;
        this.syncRequested = 0;
        this.locatorStep = 1;
    }

    /** Doubles the locator step after an unknown-locator reject and returns the new step. */
    long nextLocatorStep() {
        locatorStep = Math.min(locatorStep * 2, Long.MAX_VALUE / 4);
        return locatorStep;
    }

    void touch() {
        lastSeen = System.currentTimeMillis();
    }

    void pingSent(long now) {
        lastPingSent = now;
    }

    void setState(PeerState newState) {
        this.state = newState;
    }

    PeerState state() { return state; }
    String remoteNodeId() { return remoteNodeId; }
    int version() { return version; }
    Hash peerHead() { return peerHead; }
    long peerHeight() { return peerHeight; }
    long connectedAt() { return connectedAt; }
    long lastSeen() { return lastSeen; }
    long lastPingSent() { return lastPingSent; }
    long syncRequestedAt() { return syncRequestedAt; }
    Hash syncFrom() { return syncFrom; }
    int syncRequested() { return syncRequested; }
    boolean isSyncing() { return state == PeerState.SYNCHRONIZING; }
    boolean isOutbound() { return outbound; }
    Channel channel() { return channel; }

    String remoteAddress() {
        SocketAddress raw = channel.remoteAddress();
        if (!(raw instanceof InetSocketAddress)) return String.valueOf(raw);
        InetSocketAddress address = (InetSocketAddress) raw;
        String host = address.getAddress() != null ? address.getAddress().getHostAddress() : address.getHostString();
        return host + ':' + address.getPort();
    }

    @Override public String toString() {
        return "Peer{" + (remoteNodeId != null ? remoteNodeId : "?") + "@" + remoteAddress() + ", " + state + "}";
    }
}
