package io.chainnode.core.protocol;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

/**
 * Primitive helpers shared by every codec: big-endian ints/longs and
 * int32 length-prefixed byte strings. Readers bound-check before allocating.
 */
public final class Encoding {
    private Encoding() {}

    public static int sizeOf(byte[] b) {
        return 4 + (b == null ? 0 : b.length);
    }

    public static int sizeOf(String s) {
        return 4 + (s == null ? 0 : s.getBytes(StandardCharsets.UTF_8).length);
    }

    public static void putBytes(ByteBuffer buf, byte[] b) {
        if (b == null) {
            buf.putInt(0);
            return;
        }
        buf.putInt(b.length);
        buf.put(b);
    }

    public static void putString(ByteBuffer buf, String s) {
        putBytes(buf, s == null ? new byte[0] : s.getBytes(StandardCharsets.UTF_8));
    }

    public static int readInt(ByteBuffer buf) {
        require(buf, 4);
        return buf.getInt();
    }

    public static long readLong(ByteBuffer buf) {
        require(buf, 8);
        return buf.getLong();
    }

    public static byte readByte(ByteBuffer buf) {
        require(buf, 1);
        return buf.get();
    }

    public static byte[] readBytes(ByteBuffer buf, int maxLen) {
        int len = readInt(buf);
        if (len < 0 || len > maxLen) {
            throw new MalformedEncodingException("Bad length: " + len + " (max=" + maxLen + ")");
        }
        return readFixed(buf, len);
    }

    public static byte[] readFixed(ByteBuffer buf, int len) {
        require(buf, len);
        byte[] out = new byte[len];
        buf.get(out);
        return out;
    }

    public static String readString(ByteBuffer buf, int maxLen) {
        return new String(readBytes(buf, maxLen), StandardCharsets.UTF_8);
    }

    public static void requireFullyConsumed(ByteBuffer buf, String what) {
        if (buf.hasRemaining()) {
            throw new MalformedEncodingException(what + " has " + buf.remaining() + " trailing bytes");
        }
    }

    public static byte[] toArray(ByteBuffer buf) {
        buf.flip();
        byte[] out = new byte[buf.remaining()];
        buf.get(out);
        return out;
    }

    private static void require(ByteBuffer buf, int n) {
        if (buf.remaining() < n) {
            throw new MalformedEncodingException("Truncated input: need " + n + " bytes, have " + buf.remaining());
        }
    }
}
