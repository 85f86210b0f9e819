package io.chainnode.core.protocol;

import java.math.BigInteger;

/** Stored next to every known block, canonical or not. */
public record BlockMeta(long height, BigInteger totalWork) {
    public BlockMeta {
        if (height < 0) throw new IllegalArgumentException("height must be >= 0");
        if (totalWork == null || totalWork.signum() < 0) throw new IllegalArgumentException("totalWork must be >= 0");
    }
}
