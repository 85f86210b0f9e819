package io.chainnode.core.chain;

/** Invoked after the chain lock is released; implementations must not block for long. */
@FunctionalInterface
public interface ChainListener {
    void onChainUpdate(ChainUpdate update);
}
