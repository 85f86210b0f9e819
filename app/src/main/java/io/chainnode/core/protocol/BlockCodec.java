package io.chainnode.core.protocol;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;

public final class BlockCodec {
    private BlockCodec(){}

    public static Block fromBytes(byte[] bytes) {
        if (bytes == null) throw new MalformedEncodingException("Malformed Block bytes: null");
        ByteBuffer buf = ByteBuffer.wrap(bytes);
        Block block = read(buf);
        Encoding.requireFullyConsumed(buf, "Block");
        return block;
    }

    public static Block read(ByteBuffer buf) {
        try {
            BlockHeader header = BlockHeaderCodec.read(buf);

            int count = Encoding.readInt(buf);
            if (count < 0 || count > ProtocolLimits.MAX_TXS_PER_BLOCK) {
                throw new MalformedEncodingException("bad tx count: " + count);
            }
            // every tx needs at least its length prefix, so an absurd count fails before allocating
            if ((long) count * 4 > buf.remaining()) {
                throw new MalformedEncodingException("tx count " + count + " exceeds remaining input");
            }

            List<Transaction> txs = new ArrayList<>(count);
            for (int i = 0; i < count; i++) {
                byte[] txBytes = Encoding.readBytes(buf, ProtocolLimits.MAX_TX_BYTES);
                txs.add(TransactionCodec.fromBytes(txBytes));
            }
            return new Block(header, txs);
        } catch (MalformedEncodingException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            throw new MalformedEncodingException("Malformed Block bytes", ex);
        }
    }
}
