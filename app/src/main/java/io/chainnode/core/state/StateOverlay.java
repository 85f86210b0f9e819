package io.chainnode.core.state;

import io.chainnode.core.protocol.AccountState;
import io.chainnode.core.protocol.Block;
import io.chainnode.core.protocol.Transaction;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Copy-on-write account changes over a base view. The base is never written; callers
 * read {@link #dirty()} to persist the result.
 *
 * Apply/revert are exact inverses, and an account that returns to (0, 0) maps back to
 * {@link AccountState#EMPTY}, which the store treats as a delete.
 */
public final class StateOverlay implements StateView {

    private final StateView base;
    private final Map<String, AccountState> changes = new LinkedHashMap<>();

    public StateOverlay(StateView base) {
        this.base = base;
    }

    @Override
    public AccountState account(String address) {
        AccountState changed = changes.get(address);
        return changed != null ? changed : base.account(address);
    }

    /** Apply a single transaction (checked by caller). Fees are burned. */
    public void applyTx(Transaction tx) {
        AccountState sender = account(tx.from());
        long debit = Math.addExact(tx.amountMinor(), tx.feeMinor());
        if (sender.balance() < debit) {
            throw new IllegalStateException("Insufficient balance applying " + tx);
        }
        if (tx.nonce() != sender.nonce() + 1) {
            throw new IllegalStateException("Nonce gap applying " + tx + " (last=" + sender.nonce() + ")");
        }
        changes.put(tx.from(), new AccountState(sender.balance() - debit, tx.nonce()));

        AccountState recipient = account(tx.to());
        changes.put(tx.to(), new AccountState(Math.addExact(recipient.balance(), tx.amountMinor()), recipient.nonce()));
    }

    /** Revert a single transaction (inverse of applyTx). */
    public void revertTx(Transaction tx) {
        AccountState recipient = account(tx.to());
        if (recipient.balance() < tx.amountMinor()) {
            throw new IllegalStateException("Recipient balance underflow reverting " + tx);
        }
        changes.put(tx.to(), new AccountState(recipient.balance() - tx.amountMinor(), recipient.nonce()));

        AccountState sender = account(tx.from());
        if (sender.nonce() != tx.nonce()) {
            throw new IllegalStateException("Revert out of order for " + tx + " (last=" + sender.nonce() + ")");
        }
        long credit = Math.addExact(tx.amountMinor(), tx.feeMinor());
        changes.put(tx.from(), new AccountState(Math.addExact(sender.balance(), credit), tx.nonce() - 1));
    }

    public void applyBlock(Block block) {
        for (Transaction tx : block.transactions()) {
            applyTx(tx);
        }
    }

    /** Revert all txs in a block (reverse order). */
    public void revertBlock(Block block) {
        List<Transaction> txs = block.transactions();
        for (int i = txs.size() - 1; i >= 0; i--) {
            revertTx(txs.get(i));
        }
    }

    /** Credit an address (genesis funding). */
    public void credit(String address, long amount) {
        AccountState current = account(address);
        changes.put(address, new AccountState(Math.addExact(current.balance(), amount), current.nonce()));
    }

    /** Every address touched so far with its resulting state; EMPTY means delete. */
    public Map<String, AccountState> dirty() {
        return Collections.unmodifiableMap(changes);
    }
}
