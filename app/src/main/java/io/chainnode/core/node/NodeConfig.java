package io.chainnode.core.node;

import io.chainnode.core.chain.ChainManager;
import io.chainnode.core.consensus.Validator;
import io.chainnode.core.mempool.PriorityPolicy;
import io.chainnode.core.p2p.P2pConfig;
import io.chainnode.core.protocol.Address;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** Immutable settings for one node. {@code p2p == null} runs without networking. */
public final class NodeConfig {
    public final int chainId;
    public final long genesisTimestamp;
    public final Map<String, Long> genesisAllocations;
    public final long difficultyBits;
    public final int maxTxPerBlock;
    public final long maxTimestampDriftMillis;
    public final long minFeeMinor;
    public final long maxNonceGap;
    public final int mempoolMaxSize;
    public final long mempoolMaxAgeMillis;
    public final int orphanMaxCount;
    public final long orphanTtlMillis;
    public final int maxInvalidTracked;
    public final long housekeepingIntervalMillis;
    public final PriorityPolicy priorityPolicy;
    public final P2pConfig p2p;

    private NodeConfig(Builder b) {
        if (b.chainId <= 0) throw new IllegalArgumentException("chainId must be > 0");
        if (b.genesisTimestamp <= 0) throw new IllegalArgumentException("genesisTimestamp must be > 0");
        if (b.difficultyBits < 0 || b.difficultyBits > 256) throw new IllegalArgumentException("difficultyBits must be within 0..256");
        for (Map.Entry<String, Long> e : b.genesisAllocations.entrySet()) {
            if (!Address.isValid(e.getKey())) {
                throw new IllegalArgumentException("invalid allocation address '" + e.getKey() + "': " + Address.problem(e.getKey()));
            }
            if (e.getValue() == null || e.getValue() <= 0) {
                throw new IllegalArgumentException("allocation for " + e.getKey() + " must be > 0");
            }
        }
        this.chainId = b.chainId;
        this.genesisTimestamp = b.genesisTimestamp;
        this.genesisAllocations = Collections.unmodifiableMap(new LinkedHashMap<>(b.genesisAllocations));
        this.difficultyBits = b.difficultyBits;
        this.maxTxPerBlock = b.maxTxPerBlock;
        this.maxTimestampDriftMillis = b.maxTimestampDriftMillis;
        this.minFeeMinor = b.minFeeMinor;
        this.maxNonceGap = b.maxNonceGap;
        this.mempoolMaxSize = b.mempoolMaxSize;
        this.mempoolMaxAgeMillis = b.mempoolMaxAgeMillis;
        this.orphanMaxCount = b.orphanMaxCount;
        this.orphanTtlMillis = b.orphanTtlMillis;
        this.maxInvalidTracked = Math.max(1, b.maxInvalidTracked);
        this.housekeepingIntervalMillis = Math.max(10L, b.housekeepingIntervalMillis);
        this.priorityPolicy = b.priorityPolicy == null ? PriorityPolicy.FEE : b.priorityPolicy;
        this.p2p = b.p2p;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static NodeConfig defaultLocal() {
        Map<String, Long> alloc = new LinkedHashMap<>();
        alloc.put("alice123456", 1_000_000L);
        alloc.put("bob654321",     500_000L);
        return builder()
                .genesisAllocations(alloc)
                .difficultyBits(12L)          // easy PoW for local nets
                .build();
    }

    public Validator.Rules validatorRules() {
        return new Validator.Rules(chainId, maxTxPerBlock, maxTimestampDriftMillis, minFeeMinor, maxNonceGap);
    }

    public Builder toBuilder() {
        return new Builder()
                .chainId(chainId)
                .genesisTimestamp(genesisTimestamp)
                .genesisAllocations(genesisAllocations)
                .difficultyBits(difficultyBits)
                .maxTxPerBlock(maxTxPerBlock)
                .maxTimestampDriftMillis(maxTimestampDriftMillis)
                .minFeeMinor(minFeeMinor)
                .maxNonceGap(maxNonceGap)
                .mempoolMaxSize(mempoolMaxSize)
                .mempoolMaxAgeMillis(mempoolMaxAgeMillis)
                .orphanMaxCount(orphanMaxCount)
                .orphanTtlMillis(orphanTtlMillis)
                .maxInvalidTracked(maxInvalidTracked)
                .housekeepingIntervalMillis(housekeepingIntervalMillis)
                .priorityPolicy(priorityPolicy)
                .p2p(p2p);
    }

    public NodeConfig withP2p(P2pConfig p2pConfig) {
        return toBuilder().p2p(p2pConfig).build();
    }

    public static final class Builder {
        private int chainId = 1;
        // 2024-01-01T00:00:00Z; fixed so every node derives the same genesis hash
        private long genesisTimestamp = 1_704_067_200_000L;
        private Map<String, Long> genesisAllocations = new LinkedHashMap<>();
        private long difficultyBits = 0L;
        private int maxTxPerBlock = 1000;
        private long maxTimestampDriftMillis = 60_000L;
        private long minFeeMinor = 1L;
        private long maxNonceGap = 64L;
        private int mempoolMaxSize = 10_000;
        private long mempoolMaxAgeMillis = 3_600_000L;
        private int orphanMaxCount = 512;
        private long orphanTtlMillis = 600_000L;
        private int maxInvalidTracked = ChainManager.DEFAULT_MAX_INVALID_TRACKED;
        private long housekeepingIntervalMillis = 5_000L;
        private PriorityPolicy priorityPolicy = PriorityPolicy.FEE;
        private P2pConfig p2p;

        private Builder() {}

        public Builder chainId(int id) { this.chainId = id; return this; }
        public Builder genesisTimestamp(long ts) { this.genesisTimestamp = ts; return this; }
        public Builder genesisAllocations(Map<String, Long> alloc) {
            this.genesisAllocations = alloc == null ? new LinkedHashMap<>() : new LinkedHashMap<>(alloc);
            return this;
        }
        public Builder difficultyBits(long bits) { this.difficultyBits = bits; return this; }
        public Builder maxTxPerBlock(int n) { this.maxTxPerBlock = n; return this; }
        public Builder maxTimestampDriftMillis(long ms) { this.maxTimestampDriftMillis = ms; return this; }
        public Builder minFeeMinor(long fee) { this.minFeeMinor = fee; return this; }
        public Builder maxNonceGap(long gap) { this.maxNonceGap = gap; return this; }
        public Builder mempoolMaxSize(int n) { this.mempoolMaxSize = n; return this; }
        public Builder mempoolMaxAgeMillis(long ms) { this.mempoolMaxAgeMillis = ms; return this; }
        public Builder orphanMaxCount(int n) { this.orphanMaxCount = n; return this; }
        public Builder orphanTtlMillis(long ms) { this.orphanTtlMillis = ms; return this; }
        public Builder maxInvalidTracked(int n) { this.maxInvalidTracked = n; return this; }
        public Builder housekeepingIntervalMillis(long ms) { this.housekeepingIntervalMillis = ms; return this; }
        public Builder priorityPolicy(PriorityPolicy policy) { this.priorityPolicy = policy; return this; }
        public Builder p2p(P2pConfig config) { this.p2p = config; return this; }

        public NodeConfig build() { return new NodeConfig(this); }
    }
}
