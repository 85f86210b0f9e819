package io.chainnode.core.consensus;

import io.chainnode.core.protocol.Address;
import io.chainnode.core.protocol.Block;
import io.chainnode.core.protocol.BlockHeader;
import io.chainnode.core.protocol.Hash;
import io.chainnode.core.protocol.ProtocolError;
import io.chainnode.core.protocol.ProtocolLimits;
import io.chainnode.core.protocol.SignatureUtil;
import io.chainnode.core.protocol.Transaction;
import io.chainnode.core.protocol.ValidationResult;
import io.chainnode.core.state.StateOverlay;
import io.chainnode.core.state.StateView;

import java.time.Clock;
import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;

/**
 * Stateless rule engine for transactions and blocks.
 *
 * Nothing here mutates state or touches storage: contextual checks run on a private
 * {@link StateOverlay} over the caller's view, so the same instance is safe to share
 * between the chain manager, the mempool and peer workers.
 */
public final class Validator {

    /** Tunables; see {@link #defaults(int)}. */
    public record Rules(int chainId,
                        int maxTxPerBlock,
                        long maxTimestampDriftMillis,
                        long minFeeMinor,
                        long maxNonceGap) {
        public Rules {
            if (chainId <= 0) throw new IllegalArgumentException("chainId must be > 0");
            if (maxTxPerBlock <= 0 || maxTxPerBlock > ProtocolLimits.MAX_TXS_PER_BLOCK) {
                throw new IllegalArgumentException("maxTxPerBlock out of range");
            }
            if (maxTimestampDriftMillis < 0) throw new IllegalArgumentException("maxTimestampDriftMillis must be >= 0");
            if (minFeeMinor < 0) throw new IllegalArgumentException("minFeeMinor must be >= 0");
            if (maxNonceGap < 1) throw new IllegalArgumentException("maxNonceGap must be >= 1");
        }
    }

    public static Rules defaults(int chainId) {
        return new Rules(chainId, 5_000, 60_000L, 0L, 64L);
    }

    private enum Mode { ADMISSION, BLOCK }

    private final ConsensusEngine engine;
    private final Rules rules;
    private final Clock clock;

    public Validator(ConsensusEngine engine, Rules rules, Clock clock) {
        this.engine = engine;
        this.rules = rules;
        this.clock = clock;
    }

    public ConsensusEngine engine() { return engine; }
    public Rules rules() { return rules; }

    /** Mempool admission: the nonce may run ahead of the account by up to maxNonceGap. */
    public ValidationResult validateTransaction(Transaction tx, StateView state) {
        ValidationResult stateless = checkTransactionStateless(tx);
        if (!stateless.ok) return stateless;
        return checkTransactionAgainst(tx, state, Mode.ADMISSION);
    }

    public ValidationResult validateBlock(Block block, BlockHeader parentHeader, StateView state) {
        ValidationResult structure = checkStructure(block);
        if (!structure.ok) return structure;
        return checkContext(block, parentHeader, state);
    }

    /** Checks that need neither the parent nor any state; safe to run outside the chain lock. */
    public ValidationResult checkStructure(Block block) {
        BlockHeader hdr = block.header();
        int count = block.transactions().size();
        if (count > rules.maxTxPerBlock()) {
            return ValidationResult.error(ProtocolError.MALFORMED_ENCODING,
                    "block carries " + count + " txs (max " + rules.maxTxPerBlock() + ")");
        }

        Set<Hash> seen = new HashSet<>();
        for (Transaction tx : block.transactions()) {
            if (!seen.add(tx.txId())) {
                return ValidationResult.error(ProtocolError.MALFORMED_ENCODING, "duplicate tx " + tx.txId().shortHex());
            }
        }

        if (hdr.height() > 0 && hdr.difficultyOrSlot() < engine.minDifficulty()) {
            return ValidationResult.error(ProtocolError.CONSENSUS_PROOF_INVALID,
                    "difficulty " + hdr.difficultyOrSlot() + " below minimum " + engine.minDifficulty());
        }
        if (!engine.verifyProof(hdr)) {
            return ValidationResult.error(ProtocolError.CONSENSUS_PROOF_INVALID, "proof does not meet target");
        }

        if (!Arrays.equals(hdr.merkleRoot(), block.computeMerkleRoot())) {
            return ValidationResult.error(ProtocolError.COMMITMENT_MISMATCH, "tx root mismatch");
        }

        long limit = clock.millis() + rules.maxTimestampDriftMillis();
        if (hdr.timestamp() > limit) {
            return ValidationResult.error(ProtocolError.INVALID_HEADER, "timestamp too far in future");
        }

        for (Transaction tx : block.transactions()) {
            ValidationResult r = checkTransactionStateless(tx);
            if (!r.ok) return r;
        }
        return ValidationResult.ok();
    }

    /**
     * Parent linkage plus every transaction in block mode, each against the state left by
     * the ones before it. {@code parentHeader} is null when the parent is not known.
     */
    public ValidationResult checkContext(Block block, BlockHeader parentHeader, StateView state) {
        ValidationResult header = checkHeaderContext(block.header(), parentHeader);
        if (!header.ok) return header;

        StateOverlay overlay = new StateOverlay(state);
        for (Transaction tx : block.transactions()) {
            ValidationResult r = checkTransactionAgainst(tx, overlay, Mode.BLOCK);
            if (!r.ok) return r;
            overlay.applyTx(tx);
        }
        return ValidationResult.ok();
    }

    /** Height and timestamp relative to the parent; used alone for side-chain blocks. */
    public ValidationResult checkHeaderContext(BlockHeader header, BlockHeader parentHeader) {
        if (parentHeader == null) {
            if (header.height() == 0 && new Hash(header.parentHash()).isZero()) {
                return ValidationResult.ok();
            }
            return ValidationResult.error(ProtocolError.UNKNOWN_PARENT,
                    "unknown parent " + new Hash(header.parentHash()).shortHex());
        }
        if (!Arrays.equals(header.parentHash(), parentHeader.hash())) {
            return ValidationResult.error(ProtocolError.UNKNOWN_PARENT, "parent header does not match link");
        }
        long expected = parentHeader.height() + 1;
        if (header.height() != expected) {
            return ValidationResult.error(ProtocolError.INVALID_HEADER,
                    "bad block height: expected " + expected + ", got " + header.height());
        }
        if (header.timestamp() < parentHeader.timestamp()) {
            return ValidationResult.error(ProtocolError.INVALID_HEADER, "timestamp before parent");
        }
        return ValidationResult.ok();
    }

    private ValidationResult checkTransactionStateless(Transaction tx) {
        if (tx == null) {
            return ValidationResult.error(ProtocolError.MALFORMED_ENCODING, "transaction required");
        }
        if (tx.chainId() != rules.chainId()) {
            return ValidationResult.error(ProtocolError.MALFORMED_ENCODING, "wrong chainId " + tx.chainId());
        }
        if (tx.payloadSize() > ProtocolLimits.MAX_PAYLOAD_BYTES) {
            return ValidationResult.error(ProtocolError.MALFORMED_ENCODING, "payload too large");
        }
        String fromProblem = Address.problem(tx.from());
        if (fromProblem != null) {
            return ValidationResult.error(ProtocolError.MALFORMED_ENCODING, "invalid sender address: " + fromProblem);
        }
        String toProblem = Address.problem(tx.to());
        if (toProblem != null) {
            return ValidationResult.error(ProtocolError.MALFORMED_ENCODING, "invalid recipient address: " + toProblem);
        }
        if (tx.publicKey() == null) {
            return ValidationResult.error(ProtocolError.SIGNATURE_INVALID, "missing public key");
        }
        if (!tx.from().equals(SignatureUtil.deriveAddress(tx.publicKey()))) {
            return ValidationResult.error(ProtocolError.SIGNATURE_INVALID, "sender does not match public key");
        }
        if (!SignatureUtil.verify(tx.toUnsignedBytes(), tx.signature(), tx.publicKey())) {
            return ValidationResult.error(ProtocolError.SIGNATURE_INVALID, "bad signature");
        }
        return ValidationResult.ok();
    }

    private ValidationResult checkTransactionAgainst(Transaction tx, StateView state, Mode mode) {
        long last = state.getNonce(tx.from());
        if (mode == Mode.BLOCK) {
            if (tx.nonce() != last + 1) {
                return ValidationResult.error(ProtocolError.NONCE_CONFLICT,
                        "nonce " + tx.nonce() + " does not follow " + last);
            }
        } else {
            if (tx.nonce() <= last) {
                return ValidationResult.error(ProtocolError.NONCE_CONFLICT, "nonce " + tx.nonce() + " already used");
            }
            if (tx.nonce() - last > rules.maxNonceGap()) {
                return ValidationResult.error(ProtocolError.NONCE_CONFLICT,
                        "nonce " + tx.nonce() + " too far ahead of " + last);
            }
        }

        if (tx.feeMinor() < rules.minFeeMinor()) {
            return ValidationResult.error(ProtocolError.INSUFFICIENT_RESOURCE, "fee below minimum");
        }
        long required;
        try {
            required = Math.addExact(tx.amountMinor(), tx.feeMinor());
        } catch (ArithmeticException overflow) {
            return ValidationResult.error(ProtocolError.INSUFFICIENT_RESOURCE, "amount + fee overflows");
        }
        if (state.getBalance(tx.from()) < required) {
            return ValidationResult.error(ProtocolError.INSUFFICIENT_RESOURCE, "insufficient balance");
        }
        return ValidationResult.ok();
    }
}
