package io.chainnode.core.protocol.messages;

import io.chainnode.core.protocol.MalformedEncodingException;

public class UnknownMessageTypeException extends MalformedEncodingException {
    private final int tag;

    public UnknownMessageTypeException(int tag) {
        super("Unknown message tag: " + tag);
        this.tag = tag;
    }

    public int tag() { return tag; }
}
