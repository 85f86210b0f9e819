package io.chainnode.core.chain;

import io.chainnode.core.protocol.Block;
import io.chainnode.core.protocol.ChainHead;

import java.util.List;

/**
 * Head movement caused by one block connection.
 *
 * @param connected    blocks that became canonical, in ascending height
 * @param disconnected blocks that left the canonical chain, old tip first
 * @param newHead      head after the change
 */
public record ChainUpdate(List<Block> connected, List<Block> disconnected, ChainHead newHead) {
    public ChainUpdate {
        connected = List.copyOf(connected);
        disconnected = List.copyOf(disconnected);
    }

    public boolean isReorg() {
        return !disconnected.isEmpty();
    }
}
