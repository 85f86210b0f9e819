package io.chainnode.core.chain;

import io.chainnode.core.protocol.Hash;
import io.chainnode.core.protocol.ProtocolError;

/** Outcome of {@link ChainManager#applyBlock}. Rejection is a value, not an exception. */
public final class ApplyResult {

    public enum Status {
        /** Extended the canonical head. */
        APPLIED,
        /** Became head through a reorganization. */
        REORGANIZED,
        /** Stored on a lighter branch. */
        SIDE_CHAIN,
        /** Parent unknown; held until it shows up. */
        ORPHAN,
        DUPLICATE,
        REJECTED
    }

    private final Status status;
    private final Hash blockHash;
    private final ProtocolError error;
    private final String message;
    private final Hash missingParent;

    private ApplyResult(Status status, Hash blockHash, ProtocolError error, String message, Hash missingParent) {
        this.status = status;
        this.blockHash = blockHash;
        this.error = error;
        this.message = message;
        this.missingParent = missingParent;
    }

    public static ApplyResult of(Status status, Hash blockHash) {
        return new ApplyResult(status, blockHash, null, null, null);
    }

    public static ApplyResult orphan(Hash blockHash, Hash missingParent) {
        return new ApplyResult(Status.ORPHAN, blockHash, null, null, missingParent);
    }

    public static ApplyResult rejected(Hash blockHash, ProtocolError error, String message) {
        return new ApplyResult(Status.REJECTED, blockHash, error, message, null);
    }

    public Status status() { return status; }
    public Hash blockHash() { return blockHash; }
    public ProtocolError error() { return error; }
    public String message() { return message; }
    public Hash missingParent() { return missingParent; }

    /** True when the block is now stored (on any branch). */
    public boolean isConnected() {
        return status == Status.APPLIED || status == Status.REORGANIZED || status == Status.SIDE_CHAIN;
    }

    public boolean movedHead() {
        return status == Status.APPLIED || status == Status.REORGANIZED;
    }

    @Override public String toString() {
        if (status == Status.REJECTED) {
            return "REJECTED[" + error + "]: " + message + " (" + blockHash.shortHex() + ")";
        }
        return status + "(" + blockHash.shortHex() + ")";
    }
}
