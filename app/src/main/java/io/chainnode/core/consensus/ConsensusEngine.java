package io.chainnode.core.consensus;

import io.chainnode.core.protocol.BlockHeader;

import java.math.BigInteger;

/**
 * Consensus-specific parts of block validation and fork-choice.
 * The rest of the node only ever sees proof validity and a work number.
 */
public interface ConsensusEngine {

    /** Does the header carry a valid proof for its own difficulty/slot field? */
    boolean verifyProof(BlockHeader header);

    /** Work contributed by this header; cumulative work decides fork-choice. */
    BigInteger blockWork(BlockHeader header);

    /** Lowest difficulty a non-genesis header may declare. */
    long minDifficulty();
}
