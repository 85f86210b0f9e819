package io.chainnode.core.protocol.messages;

import io.chainnode.core.protocol.Block;
import io.chainnode.core.protocol.BlockCodec;
import io.chainnode.core.protocol.Encoding;
import io.chainnode.core.protocol.Hash;
import io.chainnode.core.protocol.MalformedEncodingException;
import io.chainnode.core.protocol.ProtocolError;
import io.chainnode.core.protocol.ProtocolLimits;
import io.chainnode.core.protocol.TransactionCodec;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;

/**
 * Frame body codec: tag byte followed by the message payload.
 * The outer int32 length is added and stripped by the Netty pipeline.
 */
public final class MessageCodec {
    private static final int MAX_NODE_ID_BYTES = 128;
    private static final int MAX_BLOCK_BYTES = ProtocolLimits.DEFAULT_MAX_FRAME_BYTES;

    private MessageCodec() {}

    public static byte[] encode(Message message) {
        byte[] payload = message.accept(PAYLOAD_WRITER);
        ByteBuffer buf = ByteBuffer.allocate(1 + payload.length);
        buf.put(message.tag());
        buf.put(payload);
        return buf.array();
    }

    public static Message decode(byte[] frame) {
        if (frame == null || frame.length == 0) throw new MalformedEncodingException("empty frame");
        ByteBuffer buf = ByteBuffer.wrap(frame);
        byte tag = buf.get();
        Message out;
        try {
            out = decodePayload(tag, buf);
        } catch (MalformedEncodingException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            throw new MalformedEncodingException("Malformed payload for tag " + tag, ex);
        }
        Encoding.requireFullyConsumed(buf, "message tag " + tag);
        return out;
    }

    private static Message decodePayload(byte tag, ByteBuffer buf) {
        switch (tag) {
            case Message.TAG_HELLO: {
                int version = Encoding.readInt(buf);
                String nodeId = Encoding.readString(buf, MAX_NODE_ID_BYTES);
                Hash head = readHash(buf);
                long height = Encoding.readLong(buf);
                return new Message.Hello(version, nodeId, head, height);
            }
            case Message.TAG_PING:
                return new Message.Ping(Encoding.readLong(buf));
            case Message.TAG_PONG:
                return new Message.Pong(Encoding.readLong(buf));
            case Message.TAG_INV_BLOCK:
                return new Message.InvBlock(readHash(buf));
            case Message.TAG_INV_TX:
                return new Message.InvTx(readHash(buf));
            case Message.TAG_GET_BLOCKS: {
                Hash from = readHash(buf);
                int count = Encoding.readInt(buf);
                if (count <= 0 || count > ProtocolLimits.MAX_BLOCKS_PER_MESSAGE) {
                    throw new MalformedEncodingException("bad block count: " + count);
                }
                return new Message.GetBlocks(from, count);
            }
            case Message.TAG_BLOCKS: {
                int n = Encoding.readInt(buf);
                if (n < 0 || n > ProtocolLimits.MAX_BLOCKS_PER_MESSAGE) {
                    throw new MalformedEncodingException("bad block count: " + n);
                }
                List<Block> blocks = new ArrayList<>(Math.min(n, 64));
                for (int i = 0; i < n; i++) {
                    blocks.add(BlockCodec.fromBytes(Encoding.readBytes(buf, MAX_BLOCK_BYTES)));
                }
                return new Message.Blocks(blocks);
            }
            case Message.TAG_GET_TX:
                return new Message.GetTx(readHash(buf));
            case Message.TAG_TX:
                return new Message.Tx(TransactionCodec.fromBytes(Encoding.readBytes(buf, ProtocolLimits.MAX_TX_BYTES)));
            case Message.TAG_REJECT: {
                ProtocolError code = ProtocolError.fromCode(Encoding.readInt(buf));
                String context = Encoding.readString(buf, ProtocolLimits.MAX_CONTEXT_CHARS * 4);
                return new Message.Reject(code, context);
            }
            default:
                throw new UnknownMessageTypeException(tag & 0xff);
        }
    }

    private static Hash readHash(ByteBuffer buf) {
        return new Hash(Encoding.readFixed(buf, Hash.LENGTH));
    }

    private static final Message.Visitor<byte[]> PAYLOAD_WRITER = new Message.Visitor<>() {
        @Override public byte[] visitHello(Message.Hello m) {
            ByteBuffer buf = ByteBuffer.allocate(4 + Encoding.sizeOf(m.nodeId()) + Hash.LENGTH + 8);
            buf.putInt(m.version());
            Encoding.putString(buf, m.nodeId());
            buf.put(m.headHash().bytes());
            buf.putLong(m.height());
            return buf.array();
        }

        @Override public byte[] visitPing(Message.Ping m) {
            return ByteBuffer.allocate(8).putLong(m.nonce()).array();
        }

        @Override public byte[] visitPong(Message.Pong m) {
            return ByteBuffer.allocate(8).putLong(m.nonce()).array();
        }

        @Override public byte[] visitInvBlock(Message.InvBlock m) { return m.hash().bytes(); }

        @Override public byte[] visitInvTx(Message.InvTx m) { return m.txId().bytes(); }

        @Override public byte[] visitGetBlocks(Message.GetBlocks m) {
            return ByteBuffer.allocate(Hash.LENGTH + 4).put(m.fromHash().bytes()).putInt(m.count()).array();
        }

        @Override public byte[] visitBlocks(Message.Blocks m) {
            List<byte[]> encoded = new ArrayList<>(m.blocks().size());
            int size = 4;
            for (Block b : m.blocks()) {
                byte[] bytes = b.serialize();
                encoded.add(bytes);
                size += Encoding.sizeOf(bytes);
            }
            ByteBuffer buf = ByteBuffer.allocate(size);
            buf.putInt(encoded.size());
            for (byte[] bytes : encoded) Encoding.putBytes(buf, bytes);
            return buf.array();
        }

        @Override public byte[] visitGetTx(Message.GetTx m) { return m.txId().bytes(); }

        @Override public byte[] visitTx(Message.Tx m) {
            byte[] tx = m.tx().serialize();
            ByteBuffer buf = ByteBuffer.allocate(Encoding.sizeOf(tx));
            Encoding.putBytes(buf, tx);
            return buf.array();
        }

        @Override public byte[] visitReject(Message.Reject m) {
            ByteBuffer buf = ByteBuffer.allocate(4 + Encoding.sizeOf(m.context()));
            buf.putInt(m.code().code());
            Encoding.putString(buf, m.context());
            return buf.array();
        }
    };
}
