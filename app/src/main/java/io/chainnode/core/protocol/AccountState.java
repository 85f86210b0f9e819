package io.chainnode.core.protocol;

/**
 * Balance and last applied nonce of one address. Accounts never touched read as {@link #EMPTY}.
 */
public record AccountState(long balance, long nonce) {
    public static final AccountState EMPTY = new AccountState(0L, 0L);

    public AccountState {
        if (balance < 0) throw new IllegalArgumentException("balance must be >= 0");
        if (nonce < 0) throw new IllegalArgumentException("nonce must be >= 0");
    }

    public boolean isEmpty() {
        return balance == 0 && nonce == 0;
    }
}
