package io.chainnode.core.p2p;

import io.chainnode.core.protocol.MalformedEncodingException;
import io.chainnode.core.protocol.ProtocolError;
import io.chainnode.core.protocol.messages.Message;
import io.chainnode.core.protocol.messages.MessageCodec;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.MessageToMessageCodec;

import java.util.List;
import java.util.logging.Logger;

/**
 * Frame body <-> {@link Message}. A body that does not decode is answered with
 * Reject(MALFORMED_ENCODING) and dropped; the connection stays open.
 */
final class WireCodec extends MessageToMessageCodec<ByteBuf, Message> {
    private static final Logger LOG = Logger.getLogger(WireCodec.class.getName());

    @Override
    protected void encode(ChannelHandlerContext ctx, Message msg, List<Object> out) {
        out.add(Unpooled.wrappedBuffer(MessageCodec.encode(msg)));
    }

    @Override
    protected void decode(ChannelHandlerContext ctx, ByteBuf frame, List<Object> out) {
        byte[] bytes = ByteBufUtil.getBytes(frame);
        try {
            out.add(MessageCodec.decode(bytes));
        } catch (MalformedEncodingException e) {
            LOG.warning(() -> "Dropping malformed frame from " + ctx.channel().remoteAddress() + ": " + e.getMessage());
            Message reject = new Message.Reject(ProtocolError.MALFORMED_ENCODING, e.getMessage());
            // this handler is the encoder, so write below it
            ctx.writeAndFlush(Unpooled.wrappedBuffer(MessageCodec.encode(reject)));
        }
    }
}
