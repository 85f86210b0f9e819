package io.chainnode.core.consensus;

import io.chainnode.core.ChainFixtures;
import io.chainnode.core.protocol.AccountState;
import io.chainnode.core.protocol.Block;
import io.chainnode.core.protocol.BlockHeader;
import io.chainnode.core.protocol.Merkle;
import io.chainnode.core.protocol.ProtocolError;
import io.chainnode.core.protocol.Transaction;
import io.chainnode.core.protocol.ValidationResult;
import io.chainnode.core.state.StateView;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.security.KeyPair;
import java.time.Clock;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ValidatorTest {

    private static final KeyPair ALICE = ChainFixtures.newKeyPair();
    private static final String BOB = "bob654321";

    private final Clock clock = ChainFixtures.fixedClock();
    private final Map<String, AccountState> accounts = new HashMap<>();
    private final StateView state = a -> accounts.getOrDefault(a, AccountState.EMPTY);
    private Validator validator;
    private Block genesis;

    @BeforeEach
    void setUp() {
        validator = ChainFixtures.validator(clock);
        genesis = ChainFixtures.genesis(Map.of());
        accounts.put(ChainFixtures.address(ALICE), new AccountState(100, 0));
    }

    @Test
    void acceptsFundedSignedTransaction() {
        assertTrue(validator.validateTransaction(ChainFixtures.transfer(ALICE, BOB, 50, 1, 1), state).ok);
    }

    @Test
    void rejectsInsufficientBalance() {
        ValidationResult r = validator.validateTransaction(ChainFixtures.transfer(ALICE, BOB, 100, 1, 1), state);
        assertFalse(r.ok);
        assertEquals(ProtocolError.INSUFFICIENT_RESOURCE, r.error);
    }

    @Test
    void rejectsTamperedTransaction() {
        Transaction signed = ChainFixtures.transfer(ALICE, BOB, 5, 1, 1);
        Transaction tampered = signed.toBuilder().amountMinor(6).build();
        assertEquals(ProtocolError.SIGNATURE_INVALID, validator.validateTransaction(tampered, state).error);
    }

    @Test
    void rejectsSenderThatDoesNotOwnTheKey() {
        Transaction forged = ChainFixtures.sign(Transaction.builder()
                .chainId(ChainFixtures.CHAIN_ID).from("mallory123").to(BOB)
                .amountMinor(5).feeMinor(1).nonce(1).timestamp(ChainFixtures.GENESIS_TS), ALICE);
        assertEquals(ProtocolError.SIGNATURE_INVALID, validator.validateTransaction(forged, state).error);
    }

    @Test
    void rejectsForeignChainId() {
        Transaction tx = ChainFixtures.sign(Transaction.builder()
                .chainId(ChainFixtures.CHAIN_ID + 1).to(BOB)
                .amountMinor(5).feeMinor(1).nonce(1).timestamp(ChainFixtures.GENESIS_TS), ALICE);
        assertEquals(ProtocolError.MALFORMED_ENCODING, validator.validateTransaction(tx, state).error);
    }

    @Test
    void rejectsMalformedRecipient() {
        ValidationResult shortName = validator.validateTransaction(ChainFixtures.transfer(ALICE, "bob", 5, 1, 1), state);
        assertEquals(ProtocolError.MALFORMED_ENCODING, shortName.error);
        assertTrue(shortName.message.startsWith("invalid recipient address"));

        ValidationResult badChar = validator.validateTransaction(ChainFixtures.transfer(ALICE, "bob#654321", 5, 1, 1), state);
        assertEquals(ProtocolError.MALFORMED_ENCODING, badChar.error);
    }

    @Test
    void admissionAllowsBoundedNonceGap() {
        accounts.put(ChainFixtures.address(ALICE), new AccountState(100, 3));
        assertEquals(ProtocolError.NONCE_CONFLICT, validator.validateTransaction(ChainFixtures.transfer(ALICE, BOB, 1, 1, 3), state).error);
        assertTrue(validator.validateTransaction(ChainFixtures.transfer(ALICE, BOB, 1, 1, 5), state).ok);
        assertEquals(ProtocolError.NONCE_CONFLICT, validator.validateTransaction(ChainFixtures.transfer(ALICE, BOB, 1, 1, 3 + 65), state).error);
    }

    @Test
    void rejectsFeeBelowMinimum() {
        Validator strict = new Validator(new ProofOfWork(), new Validator.Rules(ChainFixtures.CHAIN_ID, 10, 60_000L, 5L, 64L), clock);
        assertEquals(ProtocolError.INSUFFICIENT_RESOURCE, strict.validateTransaction(ChainFixtures.transfer(ALICE, BOB, 1, 4, 1), state).error);
    }

    @Test
    void blockTransactionsMustFollowEachOther() {
        Transaction first = ChainFixtures.transfer(ALICE, BOB, 10, 1, 1);
        Transaction second = ChainFixtures.transfer(ALICE, BOB, 10, 1, 2);

        assertTrue(validator.validateBlock(ChainFixtures.child(genesis, List.of(first, second)), genesis.header(), state).ok);

        ValidationResult swapped = validator.validateBlock(ChainFixtures.child(genesis, List.of(second, first)), genesis.header(), state);
        assertEquals(ProtocolError.NONCE_CONFLICT, swapped.error);
    }

    @Test
    void blockSpendingBeyondBalanceAcrossTransactionsIsRejected() {
        Block block = ChainFixtures.child(genesis, List.of(
                ChainFixtures.transfer(ALICE, BOB, 60, 1, 1),
                ChainFixtures.transfer(ALICE, BOB, 60, 1, 2)));
        assertEquals(ProtocolError.INSUFFICIENT_RESOURCE, validator.validateBlock(block, genesis.header(), state).error);
    }

    @Test
    void merkleRootMustCommitToTransactions() {
        Transaction tx = ChainFixtures.transfer(ALICE, BOB, 10, 1, 1);
        BlockHeader header = new BlockHeader(genesis.hash().bytes(), new byte[32], 1,
                genesis.header().timestamp() + 1000, 0, 0);
        Block block = new Block(header, List.of(tx));
        assertEquals(ProtocolError.COMMITMENT_MISMATCH, validator.checkStructure(block).error);
    }

    @Test
    void headerRulesAgainstParent() {
        byte[] root = Merkle.rootOf(List.of());
        BlockHeader wrongHeight = new BlockHeader(genesis.hash().bytes(), root, 2, genesis.header().timestamp() + 1, 0, 0);
        BlockHeader beforeParent = new BlockHeader(genesis.hash().bytes(), root, 1, genesis.header().timestamp() - 1, 0, 0);

        assertEquals(ProtocolError.INVALID_HEADER, validator.checkHeaderContext(wrongHeight, genesis.header()).error);
        assertEquals(ProtocolError.INVALID_HEADER, validator.checkHeaderContext(beforeParent, genesis.header()).error);
        assertEquals(ProtocolError.UNKNOWN_PARENT, validator.checkHeaderContext(beforeParent, null).error);
    }

    @Test
    void futureTimestampBeyondDriftIsRejected() {
        BlockHeader future = new BlockHeader(genesis.hash().bytes(), new byte[32], 1, clock.millis() + 60_001L, 0, 0);
        assertEquals(ProtocolError.INVALID_HEADER, validator.checkStructure(new Block(future, List.of())).error);

        BlockHeader withinDrift = new BlockHeader(genesis.hash().bytes(), new byte[32], 1, clock.millis() + 60_000L, 0, 0);
        assertTrue(validator.checkStructure(new Block(withinDrift, List.of())).ok);
    }

    @Test
    void proofBelowMinimumDifficultyIsRejected() {
        Validator hard = new Validator(new ProofOfWork(4), Validator.defaults(ChainFixtures.CHAIN_ID), clock);
        Block easy = ChainFixtures.child(genesis, List.of());
        assertEquals(ProtocolError.CONSENSUS_PROOF_INVALID, hard.checkStructure(easy).error);

        BlockHeader unmet = new BlockHeader(genesis.hash().bytes(), new byte[32], 1, genesis.header().timestamp() + 1, 250, 0);
        assertEquals(ProtocolError.CONSENSUS_PROOF_INVALID, validator.checkStructure(new Block(unmet, List.of())).error);
    }

    @Test
    void duplicateTransactionInBlockIsMalformed() {
        Transaction tx = ChainFixtures.transfer(ALICE, BOB, 10, 1, 1);
        Block block = ChainFixtures.child(genesis, List.of(tx, tx));
        assertEquals(ProtocolError.MALFORMED_ENCODING, validator.checkStructure(block).error);
    }
}
