package io.chainnode.core.p2p;

import io.chainnode.core.protocol.ProtocolLimits;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Objects;

/** Networking knobs for one node. Port 0 binds an ephemeral port. */
public final class P2pConfig {
    public static final long DEFAULT_PING_INTERVAL_MS = 10_000L;
    public static final long DEFAULT_IDLE_TIMEOUT_MS = 30_000L;
    public static final long DEFAULT_HANDSHAKE_TIMEOUT_MS = 10_000L;
    public static final long DEFAULT_SYNC_TIMEOUT_MS = 30_000L;

    public final String nodeId;
    public final int port;
    public final List<String> bootstrapPeers;
    public final int maxFrameBytes;
    public final long pingIntervalMillis;
    public final long idleTimeoutMillis;
    public final long handshakeTimeoutMillis;
    public final long syncTimeoutMillis;
    public final int syncBatchSize;
    public final int inboundQueueLimit;
    public final int outboundPendingLimit;
    public final int workerThreads;

    private P2pConfig(Builder b) {
        this.nodeId = Objects.requireNonNull(b.nodeId, "nodeId");
        if (nodeId.isBlank() || nodeId.getBytes(StandardCharsets.UTF_8).length > 128) {
            throw new IllegalArgumentException("nodeId must be 1..128 bytes");
        }
        if (b.port < 0 || b.port > 65_535) throw new IllegalArgumentException("port out of range: " + b.port);
        if (b.maxFrameBytes < 1024) throw new IllegalArgumentException("maxFrameBytes must be >= 1024");
        if (b.syncBatchSize < 1 || b.syncBatchSize > ProtocolLimits.MAX_BLOCKS_PER_MESSAGE) {
            throw new IllegalArgumentException("syncBatchSize must be within 1.." + ProtocolLimits.MAX_BLOCKS_PER_MESSAGE);
        }
        if (b.inboundQueueLimit < 1 || b.outboundPendingLimit < 1 || b.workerThreads < 1) {
            throw new IllegalArgumentException("queue limits and worker threads must be >= 1");
        }
        this.port = b.port;
        this.bootstrapPeers = List.copyOf(b.bootstrapPeers);
        this.maxFrameBytes = b.maxFrameBytes;
        this.pingIntervalMillis = Math.max(50L, b.pingIntervalMillis);
        this.idleTimeoutMillis = Math.max(this.pingIntervalMillis, b.idleTimeoutMillis);
        this.handshakeTimeoutMillis = Math.max(50L, b.handshakeTimeoutMillis);
        this.syncTimeoutMillis = Math.max(50L, b.syncTimeoutMillis);
        this.syncBatchSize = b.syncBatchSize;
        this.inboundQueueLimit = b.inboundQueueLimit;
        this.outboundPendingLimit = b.outboundPendingLimit;
        this.workerThreads = b.workerThreads;
    }

    public static Builder builder(String nodeId) {
        return new Builder(nodeId);
    }

    public Builder toBuilder() {
        return new Builder(nodeId)
                .port(port)
                .bootstrapPeers(bootstrapPeers)
                .maxFrameBytes(maxFrameBytes)
                .pingIntervalMillis(pingIntervalMillis)
                .idleTimeoutMillis(idleTimeoutMillis)
                .handshakeTimeoutMillis(handshakeTimeoutMillis)
                .syncTimeoutMillis(syncTimeoutMillis)
                .syncBatchSize(syncBatchSize)
                .inboundQueueLimit(inboundQueueLimit)
                .outboundPendingLimit(outboundPendingLimit)
                .workerThreads(workerThreads);
    }

    public static final class Builder {
        private String nodeId;
        private int port = 0;
        private List<String> bootstrapPeers = List.of();
        private int maxFrameBytes = ProtocolLimits.DEFAULT_MAX_FRAME_BYTES;
        private long pingIntervalMillis = DEFAULT_PING_INTERVAL_MS;
        private long idleTimeoutMillis = DEFAULT_IDLE_TIMEOUT_MS;
        private long handshakeTimeoutMillis = DEFAULT_HANDSHAKE_TIMEOUT_MS;
        private long syncTimeoutMillis = DEFAULT_SYNC_TIMEOUT_MS;
        private int syncBatchSize = 128;
        private int inboundQueueLimit = 256;
        private int outboundPendingLimit = 1024;
        private int workerThreads = Math.max(2, Runtime.getRuntime().availableProcessors() / 2);

        private Builder(String nodeId) { this.nodeId = nodeId; }

        public Builder nodeId(String id) { this.nodeId = id; return this; }
        public Builder port(int p) { this.port = p; return this; }
        public Builder bootstrapPeers(List<String> peers) { this.bootstrapPeers = peers == null ? List.of() : peers; return this; }
        public Builder maxFrameBytes(int n) { this.maxFrameBytes = n; return this; }
        public Builder pingIntervalMillis(long ms) { this.pingIntervalMillis = ms; return this; }
        public Builder idleTimeoutMillis(long ms) { this.idleTimeoutMillis = ms; return this; }
        public Builder handshakeTimeoutMillis(long ms) { this.handshakeTimeoutMillis = ms; return this; }
        public Builder syncTimeoutMillis(long ms) { this.syncTimeoutMillis = ms; return this; }
        public Builder syncBatchSize(int n) { this.syncBatchSize = n; return this; }
        public Builder inboundQueueLimit(int n) { this.inboundQueueLimit = n; return this; }
        public Builder outboundPendingLimit(int n) { this.outboundPendingLimit = n; return this; }
        public Builder workerThreads(int n) { this.workerThreads = n; return this; }

        public P2pConfig build() { return new P2pConfig(this); }
    }
}
