package io.chainnode.core.protocol;

import java.util.ArrayList;
import java.util.List;

/**
 * Merkle tree over byte[] leaves.
 * - If there are no leaves, root = 32 zero bytes.
 * - If odd count at a level, duplicate the last (Bitcoin-style).
 */
public final class Merkle {
    private Merkle(){}

    public static byte[] rootOf(List<byte[]> leaves) {
        if (leaves == null || leaves.isEmpty()) return new byte[Hash.LENGTH];
        List<byte[]> level = new ArrayList<>(leaves);
        while (level.size() > 1) {
            List<byte[]> next = new ArrayList<>((level.size()+1)/2);
            for (int i=0; i<level.size(); i+=2) {
                byte[] left = level.get(i);
                byte[] right = (i+1 < level.size()) ? level.get(i+1) : left;
                next.add(Hashes.sha256(left, right));
            }
            level = next;
        }
        return level.get(0);
    }

    public static byte[] rootOfTransactions(List<Transaction> txs) {
        List<byte[]> leaves = new ArrayList<>(txs.size());
        for (Transaction tx : txs) leaves.add(tx.id());
        return rootOf(leaves);
    }
}
