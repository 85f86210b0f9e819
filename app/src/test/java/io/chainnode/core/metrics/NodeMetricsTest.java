package io.chainnode.core.metrics;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class NodeMetricsTest {

    @Test
    void countersAccumulateAndShowUpInScrape() {
        double before = NodeMetrics.registry().counter("chain.reorgs").count();
        NodeMetrics.incrementReorgs();
        NodeMetrics.incrementReorgs();
        assertEquals(before + 2, NodeMetrics.registry().counter("chain.reorgs").count());

        String scrape = NodeMetrics.scrapeMetrics();
        assertTrue(scrape.contains("chain.reorgs{stat=COUNT}"));
        assertTrue(scrape.contains("p2p.peers{stat=VALUE}"));
    }

    @Test
    void applyTimerRecordsAndReturnsResult() {
        long before = NodeMetrics.registry().timer("chain.block.apply.time").count();
        String result = NodeMetrics.recordApply(() -> "applied");
        assertEquals("applied", result);
        assertEquals(before + 1, NodeMetrics.registry().timer("chain.block.apply.time").count());
    }
}
