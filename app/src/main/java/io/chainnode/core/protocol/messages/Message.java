package io.chainnode.core.protocol.messages;

import io.chainnode.core.protocol.Block;
import io.chainnode.core.protocol.Hash;
import io.chainnode.core.protocol.ProtocolError;
import io.chainnode.core.protocol.ProtocolLimits;
import io.chainnode.core.protocol.Transaction;

import java.util.List;
import java.util.Objects;

/**
 * Every frame exchanged between peers. The tag byte on the wire is {@link #tag()}.
 * Dispatch goes through {@link Visitor} so a new message type fails to compile until handled.
 */
public sealed interface Message {

    byte tag();

    <R> R accept(Visitor<R> visitor);

    interface Visitor<R> {
        R visitHello(Hello m);
        R visitPing(Ping m);
        R visitPong(Pong m);
        R visitInvBlock(InvBlock m);
        R visitInvTx(InvTx m);
        R visitGetBlocks(GetBlocks m);
        R visitBlocks(Blocks m);
        R visitGetTx(GetTx m);
        R visitTx(Tx m);
        R visitReject(Reject m);
    }

    byte TAG_HELLO = 1;
    byte TAG_PING = 2;
    byte TAG_PONG = 3;
    byte TAG_INV_BLOCK = 4;
    byte TAG_INV_TX = 5;
    byte TAG_GET_BLOCKS = 6;
    byte TAG_BLOCKS = 7;
    byte TAG_GET_TX = 8;
    byte TAG_TX = 9;
    byte TAG_REJECT = 10;

    record Hello(int version, String nodeId, Hash headHash, long height) implements Message {
        public Hello {
            Objects.requireNonNull(nodeId, "nodeId");
            Objects.requireNonNull(headHash, "headHash");
        }
        @Override public byte tag() { return TAG_HELLO; }
        @Override public <R> R accept(Visitor<R> v) { return v.visitHello(this); }
    }

    record Ping(long nonce) implements Message {
        @Override public byte tag() { return TAG_PING; }
        @Override public <R> R accept(Visitor<R> v) { return v.visitPing(this); }
    }

    record Pong(long nonce) implements Message {
        @Override public byte tag() { return TAG_PONG; }
        @Override public <R> R accept(Visitor<R> v) { return v.visitPong(this); }
    }

    record InvBlock(Hash hash) implements Message {
        public InvBlock { Objects.requireNonNull(hash, "hash"); }
        @Override public byte tag() { return TAG_INV_BLOCK; }
        @Override public <R> R accept(Visitor<R> v) { return v.visitInvBlock(this); }
    }

    record InvTx(Hash txId) implements Message {
        public InvTx { Objects.requireNonNull(txId, "txId"); }
        @Override public byte tag() { return TAG_INV_TX; }
        @Override public <R> R accept(Visitor<R> v) { return v.visitInvTx(this); }
    }

    /** Asks for up to {@code count} canonical blocks following {@code fromHash}. */
    record GetBlocks(Hash fromHash, int count) implements Message {
        public GetBlocks {
            Objects.requireNonNull(fromHash, "fromHash");
            if (count <= 0) throw new IllegalArgumentException("count must be > 0");
        }
        @Override public byte tag() { return TAG_GET_BLOCKS; }
        @Override public <R> R accept(Visitor<R> v) { return v.visitGetBlocks(this); }
    }

    record Blocks(List<Block> blocks) implements Message {
        public Blocks {
            blocks = blocks == null ? List.of() : List.copyOf(blocks);
            if (blocks.size() > ProtocolLimits.MAX_BLOCKS_PER_MESSAGE) {
                throw new IllegalArgumentException("too many blocks: " + blocks.size());
            }
        }
        @Override public byte tag() { return TAG_BLOCKS; }
        @Override public <R> R accept(Visitor<R> v) { return v.visitBlocks(this); }
    }

    record GetTx(Hash txId) implements Message {
        public GetTx { Objects.requireNonNull(txId, "txId"); }
        @Override public byte tag() { return TAG_GET_TX; }
        @Override public <R> R accept(Visitor<R> v) { return v.visitGetTx(this); }
    }

    record Tx(Transaction tx) implements Message {
        public Tx { Objects.requireNonNull(tx, "tx"); }
        @Override public byte tag() { return TAG_TX; }
        @Override public <R> R accept(Visitor<R> v) { return v.visitTx(this); }
    }

    record Reject(ProtocolError code, String context) implements Message {
        public Reject {
            Objects.requireNonNull(code, "code");
            context = context == null ? "" : context;
            if (context.length() > ProtocolLimits.MAX_CONTEXT_CHARS) {
                context = context.substring(0, ProtocolLimits.MAX_CONTEXT_CHARS);
            }
        }
        @Override public byte tag() { return TAG_REJECT; }
        @Override public <R> R accept(Visitor<R> v) { return v.visitReject(this); }
    }
}
