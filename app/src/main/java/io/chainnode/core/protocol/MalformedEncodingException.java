package io.chainnode.core.protocol;

/** Thrown by every decoder when input is truncated, oversized or otherwise not canonical. */
public class MalformedEncodingException extends IllegalArgumentException {
    public MalformedEncodingException(String message) {
        super(message);
    }

    public MalformedEncodingException(String message, Throwable cause) {
        super(message, cause);
    }
}
