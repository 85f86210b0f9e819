package io.chainnode.core.node;

import io.chainnode.core.protocol.Block;
import io.chainnode.core.protocol.BlockHeader;
import io.chainnode.core.protocol.Encoding;
import io.chainnode.core.protocol.Hashes;
import io.chainnode.core.protocol.Merkle;
import io.chainnode.core.protocol.Transaction;

import java.nio.ByteBuffer;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Creates the genesis block.
 * - Height = 0
 * - parentHash = 32 zero bytes
 * - merkleRoot of empty list (32 zero bytes)
 * - difficulty = 0 (no PoW needed)
 * - timestamp from config, nonce = digest of the allocations
 *
 * Same config, same hash: nodes started with different allocations never share a chain.
 */
public final class GenesisBuilder {
    private GenesisBuilder(){}

    public static Block buildGenesis(NodeConfig config) {
        return buildGenesis(config.genesisTimestamp, config.genesisAllocations);
    }

    public static Block buildGenesis(long timestamp, Map<String, Long> allocations) {
        BlockHeader hdr = new BlockHeader(
                new byte[32],          // parentHash
                Merkle.rootOf(Collections.<byte[]>emptyList()),
                0L,                    // height
                timestamp,
                0L,                    // difficultyOrSlot
                allocationDigest(allocations)
        );
        return new Block(hdr, Collections.<Transaction>emptyList());
    }

    /** First 8 bytes of SHA-256 over the allocations sorted by address. */
    static long allocationDigest(Map<String, Long> allocations) {
        Map<String, Long> sorted = new TreeMap<>(allocations);
        int size = 4;
        for (String address : sorted.keySet()) size += Encoding.sizeOf(address) + 8;
        ByteBuffer buf = ByteBuffer.allocate(size);
        buf.putInt(sorted.size());
        long total = 0;
        for (Map.Entry<String, Long> e : sorted.entrySet()) {
            Encoding.putString(buf, e.getKey());
            buf.putLong(e.getValue());
            total = Math.addExact(total, e.getValue()); // supply must fit a long
        }
        return ByteBuffer.wrap(Hashes.sha256(buf.array())).getLong();
    }
}
