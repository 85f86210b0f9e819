package io.chainnode.core.node;

import io.chainnode.core.protocol.AccountState;
import io.chainnode.core.protocol.Block;
import io.chainnode.core.protocol.ChainHead;
import io.chainnode.core.protocol.Hash;
import io.chainnode.core.protocol.Transaction;
import io.chainnode.core.protocol.ValidationResult;

import java.util.Optional;

/** What an API layer may ask of a running node. Transactions arrive already signed. */
public interface ChainQuery {

    ValidationResult submitTransaction(Transaction tx);

    Optional<Block> getBlock(Hash hash);

    Optional<Block> getBlockByHeight(long height);

    AccountState getAccountState(String address);

    ChainHead currentHead();
}
