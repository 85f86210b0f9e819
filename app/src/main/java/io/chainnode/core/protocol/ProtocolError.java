package io.chainnode.core.protocol;

/**
 * Error taxonomy shared by validation, storage and the wire protocol.
 * The code is what travels inside a {@code Reject} message and must never be renumbered.
 */
public enum ProtocolError {
    MALFORMED_ENCODING(1),
    SIGNATURE_INVALID(2),
    NONCE_CONFLICT(3),
    INSUFFICIENT_RESOURCE(4),
    UNKNOWN_PARENT(5),
    CONSENSUS_PROOF_INVALID(6),
    COMMITMENT_MISMATCH(7),
    PROTOCOL_VERSION_MISMATCH(8),
    FRAME_TOO_LARGE(9),
    STORAGE_IO_FAILURE(10),
    PEER_TIMEOUT(11),
    INVALID_HEADER(12),
    DUPLICATE(13);

    private final int code;

    ProtocolError(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public static ProtocolError fromCode(int code) {
        for (ProtocolError e : values()) {
            if (e.code == code) return e;
        }
        throw new MalformedEncodingException("Unknown error code: " + code);
    }
}
