package io.chainnode.core.protocol;

import java.math.BigInteger;
import java.nio.ByteBuffer;

/**
 * Value encodings for the ledger store's non-block records.
 * All fixed layout except work, which is a length-prefixed unsigned big-endian integer.
 */
public final class RecordCodec {
    private static final int MAX_WORK_BYTES = 64;

    private RecordCodec() {}

    public static byte[] heightKey(long height) {
        return ByteBuffer.allocate(8).putLong(height).array();
    }

    public static long heightFromKey(byte[] key) {
        if (key == null || key.length != 8) throw new MalformedEncodingException("height key must be 8 bytes");
        return ByteBuffer.wrap(key).getLong();
    }

    public static byte[] encodeAccount(AccountState state) {
        return ByteBuffer.allocate(16).putLong(state.balance()).putLong(state.nonce()).array();
    }

    public static AccountState decodeAccount(byte[] bytes) {
        ByteBuffer buf = wrap(bytes, "AccountState");
        try {
            AccountState state = new AccountState(Encoding.readLong(buf), Encoding.readLong(buf));
            Encoding.requireFullyConsumed(buf, "AccountState");
            return state;
        } catch (MalformedEncodingException ex) {
            throw ex;
        } catch (IllegalArgumentException ex) {
            throw new MalformedEncodingException("Malformed AccountState bytes", ex);
        }
    }

    public static byte[] encodeTxLocation(TxLocation loc) {
        return ByteBuffer.allocate(Hash.LENGTH + 4).put(loc.blockHash().bytes()).putInt(loc.offset()).array();
    }

    public static TxLocation decodeTxLocation(byte[] bytes) {
        ByteBuffer buf = wrap(bytes, "TxLocation");
        try {
            TxLocation loc = new TxLocation(new Hash(Encoding.readFixed(buf, Hash.LENGTH)), Encoding.readInt(buf));
            Encoding.requireFullyConsumed(buf, "TxLocation");
            return loc;
        } catch (MalformedEncodingException ex) {
            throw ex;
        } catch (IllegalArgumentException ex) {
            throw new MalformedEncodingException("Malformed TxLocation bytes", ex);
        }
    }

    public static byte[] encodeBlockMeta(BlockMeta meta) {
        byte[] work = meta.totalWork().toByteArray();
        ByteBuffer buf = ByteBuffer.allocate(8 + Encoding.sizeOf(work));
        buf.putLong(meta.height());
        Encoding.putBytes(buf, work);
        return buf.array();
    }

    public static BlockMeta decodeBlockMeta(byte[] bytes) {
        ByteBuffer buf = wrap(bytes, "BlockMeta");
        try {
            long height = Encoding.readLong(buf);
            BigInteger work = readWork(buf);
            Encoding.requireFullyConsumed(buf, "BlockMeta");
            return new BlockMeta(height, work);
        } catch (MalformedEncodingException ex) {
            throw ex;
        } catch (IllegalArgumentException ex) {
            throw new MalformedEncodingException("Malformed BlockMeta bytes", ex);
        }
    }

    public static byte[] encodeHead(ChainHead head) {
        byte[] work = head.totalWork().toByteArray();
        ByteBuffer buf = ByteBuffer.allocate(Hash.LENGTH + 8 + Encoding.sizeOf(work));
        buf.put(head.hash().bytes());
        buf.putLong(head.height());
        Encoding.putBytes(buf, work);
        return buf.array();
    }

    public static ChainHead decodeHead(byte[] bytes) {
        ByteBuffer buf = wrap(bytes, "ChainHead");
        try {
            Hash hash = new Hash(Encoding.readFixed(buf, Hash.LENGTH));
            long height = Encoding.readLong(buf);
            BigInteger work = readWork(buf);
            Encoding.requireFullyConsumed(buf, "ChainHead");
            return new ChainHead(hash, height, work);
        } catch (MalformedEncodingException ex) {
            throw ex;
        } catch (IllegalArgumentException ex) {
            throw new MalformedEncodingException("Malformed ChainHead bytes", ex);
        }
    }

    private static BigInteger readWork(ByteBuffer buf) {
        byte[] raw = Encoding.readBytes(buf, MAX_WORK_BYTES);
        if (raw.length == 0) throw new MalformedEncodingException("empty work value");
        return new BigInteger(raw);
    }

    private static ByteBuffer wrap(byte[] bytes, String what) {
        if (bytes == null) throw new MalformedEncodingException("Malformed " + what + " bytes: null");
        return ByteBuffer.wrap(bytes);
    }
}
