package io.chainnode.core.state;

import io.chainnode.core.protocol.AccountState;

/**
 * Read-only account state: balances + nonces.
 * Implementations return {@link AccountState#EMPTY} for unknown addresses, never null.
 */
public interface StateView {
    AccountState account(String address);

    default long getBalance(String address) {
        return account(address).balance();
    }

    /** Last applied nonce of the address, 0 if it never sent anything. */
    default long getNonce(String address) {
        return account(address).nonce();
    }
}
