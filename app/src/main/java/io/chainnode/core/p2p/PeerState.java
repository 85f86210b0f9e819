package io.chainnode.core.p2p;

/** CONNECTING -> HANDSHAKING -> SYNCHRONIZING <-> STEADY; DISCONNECTED from anywhere, terminal. */
public enum PeerState {
    CONNECTING,
    HANDSHAKING,
    SYNCHRONIZING,
    STEADY,
    DISCONNECTED;

    public boolean isReady() {
        return this == SYNCHRONIZING || this == STEADY;
    }
}
