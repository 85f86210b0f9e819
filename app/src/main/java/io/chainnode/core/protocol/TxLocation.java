package io.chainnode.core.protocol;

/** Where a canonical transaction lives: containing block and its index in the body. */
public record TxLocation(Hash blockHash, int offset) {
    public TxLocation {
        if (blockHash == null) throw new IllegalArgumentException("blockHash required");
        if (offset < 0) throw new IllegalArgumentException("offset must be >= 0");
    }
}
