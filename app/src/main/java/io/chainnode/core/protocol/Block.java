package io.chainnode.core.protocol;

import java.nio.ByteBuffer;
import java.util.Arrays;
import java.util.List;

/**
 * Block = header + list of transactions.
 * Body encoding: header bytes first, then N, then each tx as length-prefixed signed bytes.
 */
public final class Block {
    private final BlockHeader header;
    private final List<Transaction> transactions;
    private final Hash hash;

    public Block(BlockHeader header, List<Transaction> txs) {
        this.header = header;
        this.transactions = txs != null ? List.copyOf(txs) : List.of();
        basicValidate();
        this.hash = new Hash(header.hash());
    }

    public BlockHeader header() { return header; }
    public List<Transaction> transactions() { return transactions; }
    public Hash hash() { return hash; }
    public long height() { return header.height(); }

    /** Deterministic encoding: header || count || (len || tx)* */
    public byte[] serialize() {
        int size = BlockHeader.ENCODED_SIZE + 4;
        byte[][] encoded = new byte[transactions.size()][];
        for (int i = 0; i < encoded.length; i++) {
            encoded[i] = transactions.get(i).serialize();
            size += 4 + encoded[i].length;
        }

        ByteBuffer buf = ByteBuffer.allocate(size);
        header.write(buf);
        buf.putInt(encoded.length);
        for (byte[] b : encoded) {
            Encoding.putBytes(buf, b);
        }
        return Encoding.toArray(buf);
    }

    /** Merkle root over TX IDs, matching the Transaction.id policy. */
    public byte[] computeMerkleRoot() {
        return Merkle.rootOfTransactions(transactions);
    }

    public void basicValidate() {
        if (header == null) throw new IllegalArgumentException("missing header");
        if (transactions.size() > ProtocolLimits.MAX_TXS_PER_BLOCK) throw new IllegalArgumentException("too many txs");
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Block)) return false;
        return Arrays.equals(serialize(), ((Block) o).serialize());
    }

    @Override public int hashCode() { return hash.hashCode(); }

    @Override public String toString() {
        return "Block{height=" + header.height() + ", hash=" + hash.shortHex() + ", txs=" + transactions.size() + "}";
    }
}
