package io.chainnode.core.protocol;

import java.nio.ByteBuffer;

public final class BlockHeaderCodec {
    private BlockHeaderCodec() {}

    public static BlockHeader fromBytes(byte[] bytes) {
        if (bytes == null) throw new MalformedEncodingException("Malformed BlockHeader bytes: null");
        ByteBuffer buf = ByteBuffer.wrap(bytes);
        BlockHeader header = read(buf);
        Encoding.requireFullyConsumed(buf, "BlockHeader");
        return header;
    }

    public static BlockHeader read(ByteBuffer buf) {
        try {
            byte[] parent = Encoding.readFixed(buf, Hash.LENGTH);
            byte[] merkle = Encoding.readFixed(buf, Hash.LENGTH);
            long height = Encoding.readLong(buf);
            long ts = Encoding.readLong(buf);
            long diffOrSlot = Encoding.readLong(buf);
            long nonce = Encoding.readLong(buf);
            return new BlockHeader(parent, merkle, height, ts, diffOrSlot, nonce);
        } catch (MalformedEncodingException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            throw new MalformedEncodingException("Malformed BlockHeader bytes", ex);
        }
    }
}
