package io.chainnode.core.protocol;

import java.nio.ByteBuffer;
import java.security.PublicKey;
import java.util.Arrays;
import java.util.Objects;

/**
 * Signed value transfer. Immutable; equality is equality of the canonical signed encoding.
 *
 * The transaction ID is SHA-256 over {@link #toUnsignedBytes()}, which covers every field
 * except the signature (the sender public key included).
 */
public final class Transaction {

    private final int version;
    private final int chainId;

    private final String from;
    private final String to;
    private final long amountMinor;
    private final long feeMinor;

    private final long nonce;
    private final long timestamp;

    private final byte[] payload;
    private final byte[] signature;

    private final PublicKey publicKey;
    private final byte[] encodedPublicKey;
    private final byte[] id;

    private Transaction(int version,
                        int chainId,
                        String from,
                        String to,
                        long amountMinor,
                        long feeMinor,
                        long nonce,
                        long timestamp,
                        byte[] payload,
                        byte[] signature,
                        PublicKey publicKey) {
        this.version = version;
        this.chainId = chainId;
        this.from = from;
        this.to = to;
        this.amountMinor = amountMinor;
        this.feeMinor = feeMinor;
        this.nonce = nonce;
        this.timestamp = timestamp;
        this.payload = payload != null ? payload.clone() : new byte[0];
        this.signature = signature != null ? signature.clone() : new byte[0];
        this.publicKey = publicKey;
        this.encodedPublicKey = publicKey != null ? publicKey.getEncoded() : new byte[0];
        basicValidate();
        this.id = Hashes.sha256(toUnsignedBytes());
    }

    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private int version = 1;
        private int chainId = 1;
        private String from;
        private String to;
        private long amountMinor;
        private long feeMinor;
        private long nonce;
        private long timestamp = System.currentTimeMillis();
        private byte[] payload = new byte[0];
        private byte[] signature = new byte[0];
        private PublicKey publicKey;

        public Builder version(int v) { this.version = v; return this; }
        public Builder chainId(int id) { this.chainId = id; return this; }
        public Builder from(String f) { this.from = f; return this; }
        public Builder to(String t) { this.to = t; return this; }
        public Builder amountMinor(long a) { this.amountMinor = a; return this; }
        public Builder feeMinor(long f) { this.feeMinor = f; return this; }
        public Builder nonce(long n) { this.nonce = n; return this; }
        public Builder timestamp(long ts) { this.timestamp = ts; return this; }
        public Builder payload(byte[] p) { this.payload = p != null ? p.clone() : new byte[0]; return this; }
        public Builder signature(byte[] s) { this.signature = s != null ? s.clone() : new byte[0]; return this; }
        public Builder publicKey(PublicKey pk) { this.publicKey = pk; return this; }

        /** Sender defaults to the address derived from the public key. */
        public Transaction build() {
            String sender = from;
            if ((sender == null || sender.isBlank()) && publicKey != null) {
                sender = SignatureUtil.deriveAddress(publicKey);
            }
            return new Transaction(version, chainId, sender, to, amountMinor, feeMinor,
                                   nonce, timestamp, payload, signature, publicKey);
        }
    }

    public Builder toBuilder() {
        return builder()
                .version(version)
                .chainId(chainId)
                .from(from)
                .to(to)
                .amountMinor(amountMinor)
                .feeMinor(feeMinor)
                .nonce(nonce)
                .timestamp(timestamp)
                .payload(payload)
                .signature(signature)
                .publicKey(publicKey);
    }

    // -------------------- getters --------------------
    public int version() { return version; }
    public int chainId() { return chainId; }
    public String from() { return from; }
    public String to() { return to; }
    public long amountMinor() { return amountMinor; }
    public long feeMinor() { return feeMinor; }
    public long nonce() { return nonce; }
    public long timestamp() { return timestamp; }
    public byte[] payload() { return payload.clone(); }
    public int payloadSize() { return payload.length; }
    public byte[] signature() { return signature.clone(); }
    public PublicKey publicKey() { return publicKey; }
    public byte[] id() { return id.clone(); }
    public Hash txId() { return new Hash(id); }

    // -------------------- core methods --------------------

    /** Canonical signed encoding: unsigned fields followed by the signature. */
    public byte[] serialize() {
        ByteBuffer buf = ByteBuffer.allocate(unsignedSize() + Encoding.sizeOf(signature));
        writeUnsigned(buf);
        Encoding.putBytes(buf, signature);
        return Encoding.toArray(buf);
    }

    public byte[] toUnsignedBytes() {
        ByteBuffer buf = ByteBuffer.allocate(unsignedSize());
        writeUnsigned(buf);
        return Encoding.toArray(buf);
    }

    public void basicValidate() {
        if (version != 1) throw new IllegalArgumentException("Unsupported version: " + version);
        if (chainId <= 0) throw new IllegalArgumentException("Invalid chainId");
        if (from == null || from.isBlank()) throw new IllegalArgumentException("Missing from");
        if (to == null || to.isBlank()) throw new IllegalArgumentException("Missing to");
        if (Objects.equals(from, to)) throw new IllegalArgumentException("from == to");
        if (amountMinor <= 0) throw new IllegalArgumentException("amount must be > 0");
        if (feeMinor < 0) throw new IllegalArgumentException("fee must be >= 0");
        if (nonce < 1) throw new IllegalArgumentException("nonce must be >= 1");
        if (timestamp <= 0) throw new IllegalArgumentException("timestamp must be > 0");
    }

    // -------------------- helpers --------------------
    private void writeUnsigned(ByteBuffer buf) {
        buf.putInt(version);
        buf.putInt(chainId);
        Encoding.putString(buf, from);
        Encoding.putString(buf, to);
        buf.putLong(amountMinor);
        buf.putLong(feeMinor);
        buf.putLong(nonce);
        buf.putLong(timestamp);
        Encoding.putBytes(buf, payload);
        Encoding.putBytes(buf, encodedPublicKey);
    }

    private int unsignedSize() {
        return 4 + 4
                + Encoding.sizeOf(from)
                + Encoding.sizeOf(to)
                + 8 * 4
                + Encoding.sizeOf(payload)
                + Encoding.sizeOf(encodedPublicKey);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Transaction)) return false;
        Transaction other = (Transaction) o;
        return Arrays.equals(id, other.id) && Arrays.equals(signature, other.signature);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(id);
    }

    @Override
    public String toString() {
        return "Transaction{id=" + Hash.toHex(id).substring(0, 8) + ", from=" + from + ", to=" + to
                + ", amount=" + amountMinor + ", fee=" + feeMinor + ", nonce=" + nonce + "}";
    }
}
