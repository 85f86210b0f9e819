package io.chainnode.core.protocol;

public final class ProtocolLimits {
    private ProtocolLimits(){}

    public static final int PROTOCOL_VERSION = 1;
    public static final int MIN_PROTOCOL_VERSION = 1;

    public static final int MAX_PAYLOAD_BYTES = 8 * 1024;
    public static final int MAX_SIGNATURE_BYTES = 128;     // DER-encoded ECDSA P-256 is at most 72
    public static final int MAX_PUBLIC_KEY_BYTES = 256;
    public static final int MAX_ADDRESS_LEN = 128;         // sanity cap
    public static final int MIN_ADDRESS_LEN = 8;
    public static final int MAX_TXS_PER_BLOCK = 100_000;
    public static final int MAX_TX_BYTES = 16 * 1024;
    public static final int MAX_BLOCKS_PER_MESSAGE = 500;
    public static final int MAX_CONTEXT_CHARS = 512;
    public static final int DEFAULT_MAX_FRAME_BYTES = 4 * 1024 * 1024;
}
