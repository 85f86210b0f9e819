package io.chainnode.core.consensus;

import io.chainnode.core.protocol.Block;
import io.chainnode.core.protocol.BlockHeader;
import io.chainnode.core.protocol.Hashes;

import java.math.BigInteger;
import java.util.Optional;

/**
 * Minimal Proof-of-Work:
 * - Interprets header.difficultyOrSlot as "required leading zero BITS" in the header hash.
 * - Hash = SHA-256(header.serialize()).
 *
 * Example:
 *   difficultyOrSlot = 16  -> hash must start with at least 16 zero bits (two 0x00 bytes).
 */
public final class ProofOfWork implements ConsensusEngine {

    private final long minDifficulty;

    public ProofOfWork() {
        this(0);
    }

    public ProofOfWork(long minDifficulty) {
        if (minDifficulty < 0 || minDifficulty > 256) {
            throw new IllegalArgumentException("minDifficulty must be within 0..256");
        }
        this.minDifficulty = minDifficulty;
    }

    @Override
    public boolean verifyProof(BlockHeader header) {
        return meetsTarget(header);
    }

    @Override
    public BigInteger blockWork(BlockHeader header) {
        return calculateBlockWork(header);
    }

    @Override
    public long minDifficulty() {
        return minDifficulty;
    }

    /** Quick check: does this header meet its difficulty requirement? */
    public boolean meetsTarget(BlockHeader header) {
        if (header.difficultyOrSlot() < 0 || header.difficultyOrSlot() > 256) return false;
        return hasLeadingZeroBits(header.hash(), (int) header.difficultyOrSlot());
    }

    /**
     * Try to mine a block by incrementing the nonce up to maxTries.
     * The returned Block is a NEW instance with a header having the winning nonce.
     */
    public Optional<Block> mine(Block template, long maxTries) {
        if (template == null) return Optional.empty();

        BlockHeader h = template.header();
        long nonce = h.nonce();
        for (long i = 0; i < maxTries; i++, nonce++) {
            BlockHeader candidate = h.withNonce(nonce);
            if (meetsTarget(candidate)) {
                return Optional.of(new Block(candidate, template.transactions()));
            }
        }
        return Optional.empty();
    }

    // ---------- helpers ----------

    /**
     * Expected hashes needed to meet the header's difficulty: 2^bits.
     * Higher difficulty yields exponentially more work.
     */
    public static BigInteger calculateBlockWork(BlockHeader header) {
        if (header == null) {
            return BigInteger.ZERO;
        }
        return BigInteger.ONE.shiftLeft(toRequiredBits(header.difficultyOrSlot()));
    }

    /** Clamp difficulty to a sane non-negative int. */
    private static int toRequiredBits(long difficultyOrSlot) {
        if (difficultyOrSlot < 0) return 0;
        if (difficultyOrSlot > 256) return 256; // SHA-256 cap
        return (int) difficultyOrSlot;
    }

    /**
     * Check for N leading zero bits in the hash.
     * Fast path: count whole zero bytes, then the first non-zero byte's leading zeros.
     */
    static boolean hasLeadingZeroBits(byte[] hash, int requiredBits) {
        if (requiredBits <= 0) return true;
        if (requiredBits > hash.length * 8) return false;

        int fullBytes = requiredBits / 8;
        int remBits = requiredBits % 8;

        for (int i = 0; i < fullBytes; i++) {
            if (hash[i] != 0) return false;
        }
        if (remBits == 0) return true;

        int next = hash[fullBytes] & 0xff;
        return Integer.numberOfLeadingZeros(next) - 24 >= remBits;
    }
}
