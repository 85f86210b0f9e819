package io.chainnode.core.metrics;

import io.micrometer.core.instrument.*;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

public class NodeMetrics {
    private static final MeterRegistry registry = new SimpleMeterRegistry();
    private static final Counter blocksApplied = registry.counter("chain.blocks.applied");
    private static final Counter blocksRejected = registry.counter("chain.blocks.rejected");
    private static final Counter reorgs = registry.counter("chain.reorgs");
    private static final Counter orphans = registry.counter("chain.orphans");
    private static final Timer applyTime = registry.timer("chain.block.apply.time");
    private static final Counter txAdmitted = registry.counter("mempool.tx.admitted");
    private static final Counter txRejected = registry.counter("mempool.tx.rejected");
    private static final Counter announcementsDropped = registry.counter("p2p.announcements.dropped");
    private static final AtomicInteger peers = registry.gauge("p2p.peers", new AtomicInteger());

    public static <T> T recordApply(Supplier<T> applyLogic) {
        return applyTime.record(applyLogic);
    }

    public static void incrementApplied(int blocks) {
        blocksApplied.increment(blocks);
    }

    public static void incrementRejected() {
        blocksRejected.increment();
    }

    public static void incrementReorgs() {
        reorgs.increment();
    }

    public static void incrementOrphans() {
        orphans.increment();
    }

    public static void incrementTxAdmitted() {
        txAdmitted.increment();
    }

    public static void incrementTxRejected() {
        txRejected.increment();
    }

    public static void incrementAnnouncementsDropped() {
        announcementsDropped.increment();
    }

    public static void peerConnected() {
        peers.incrementAndGet();
    }

    public static void peerDisconnected() {
        peers.decrementAndGet();
    }

    public static String scrapeMetrics() {
        StringBuilder sb = new StringBuilder();
        for (Meter m : registry.getMeters()) {
            for (Measurement meas : m.measure()) {
                sb.append(m.getId().getName())
                  .append("{stat=")
                  .append(meas.getStatistic())
                  .append("} ")
                  .append(meas.getValue())
                  .append("\n");
            }
        }
        return sb.toString();
    }

    public static MeterRegistry registry() {
        return registry;
    }
}
