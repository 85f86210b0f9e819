package io.chainnode.core.protocol;

import java.nio.ByteBuffer;
import java.util.Arrays;

/**
 * Minimal header: everything needed to identify/verify a block without tx bodies.
 * - parentHash: link to previous block (32 zero bytes for genesis)
 * - merkleRoot: commitment to all txs in this block
 * - height: block number (genesis = 0)
 * - timestamp: producer clock (drift-checked by the validator)
 * - difficultyOrSlot: PoW leading-zero bits OR slot index, interpreted by the consensus engine
 * - nonce: used by PoW (ignored by slot-based consensus)
 */
public final class BlockHeader {
    public static final int ENCODED_SIZE = Hash.LENGTH * 2 + 8 * 4;

    private final byte[] parentHash;
    private final byte[] merkleRoot;
    private final long height;
    private final long timestamp;
    private final long difficultyOrSlot;
    private final long nonce;

    public BlockHeader(byte[] parentHash,
                       byte[] merkleRoot,
                       long height,
                       long timestamp,
                       long difficultyOrSlot,
                       long nonce) {
        this.parentHash = parentHash != null ? parentHash.clone() : new byte[Hash.LENGTH];
        this.merkleRoot = merkleRoot != null ? merkleRoot.clone() : new byte[Hash.LENGTH];
        this.height = height;
        this.timestamp = timestamp;
        this.difficultyOrSlot = difficultyOrSlot;
        this.nonce = nonce;
        basicValidate();
    }

    public byte[] parentHash() { return parentHash.clone(); }
    public Hash parent() { return new Hash(parentHash); }
    public byte[] merkleRoot() { return merkleRoot.clone(); }
    public long height() { return height; }
    public long timestamp() { return timestamp; }
    public long difficultyOrSlot() { return difficultyOrSlot; }
    public long nonce() { return nonce; }

    public BlockHeader withNonce(long newNonce) {
        return new BlockHeader(parentHash, merkleRoot, height, timestamp, difficultyOrSlot, newNonce);
    }

    /** Fixed-width canonical encoding; the block hash is taken over exactly these bytes. */
    public byte[] serialize() {
        ByteBuffer buf = ByteBuffer.allocate(ENCODED_SIZE);
        write(buf);
        return Encoding.toArray(buf);
    }

    void write(ByteBuffer buf) {
        buf.put(parentHash);
        buf.put(merkleRoot);
        buf.putLong(height);
        buf.putLong(timestamp);
        buf.putLong(difficultyOrSlot);
        buf.putLong(nonce);
    }

    public byte[] hash() {
        return Hashes.sha256(serialize());
    }

    public void basicValidate() {
        if (parentHash.length != Hash.LENGTH) throw new IllegalArgumentException("parentHash must be 32 bytes");
        if (merkleRoot.length != Hash.LENGTH) throw new IllegalArgumentException("merkleRoot must be 32 bytes");
        if (height < 0) throw new IllegalArgumentException("height must be >= 0");
        if (timestamp <= 0) throw new IllegalArgumentException("timestamp must be > 0");
        if (height == 0 && !isZero(parentHash)) throw new IllegalArgumentException("genesis must have zero parent");
    }

    private static boolean isZero(byte[] hash) {
        for (byte b : hash) {
            if (b != 0) return false;
        }
        return true;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BlockHeader)) return false;
        return Arrays.equals(serialize(), ((BlockHeader) o).serialize());
    }

    @Override public int hashCode() { return Arrays.hashCode(serialize()); }

    @Override public String toString() {
        return "BlockHeader{h=" + height + ", ts=" + timestamp + "}";
    }
}
