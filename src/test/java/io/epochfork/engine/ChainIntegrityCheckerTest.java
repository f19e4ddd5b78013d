package io.epochfork.engine;

import org.junit.jupiter.api.Test;

import java.util.List;

import static io.epochfork.engine.Scenarios.child;
import static io.epochfork.engine.Scenarios.root;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ChainIntegrityCheckerTest {
    private final EpochGraphIndex graph = EpochGraphIndex.build("s", List.of(
            root("r", 1, "h-r", 0),
            child("good", 2, "h-good", "r", "h-r", 10),
            child("forged", 2, "h-forged", "r", "h-other", 11),
            child("unlinked", 2, "h-unlinked", "r", null, 12)
    ));
    private final ChainIntegrityChecker checker = new ChainIntegrityChecker(graph);

    @Test
    void matchingLinkRegistersNothing() {
        SimulationContext context = new SimulationContext();
        assertTrue(checker.check(graph.require("good"), context));
        assertTrue(context.errorNames().isEmpty());
    }

    @Test
    void mismatchedLinkRegistersChainBreakOnce() {
        SimulationContext context = new SimulationContext();
        assertFalse(checker.check(graph.require("forged"), context));
        assertFalse(checker.check(graph.require("forged"), context));
        assertEquals(List.of("HASH_CHAIN_BREAK"), context.errorNames());
    }

    @Test
    void recordsWithoutBothLinksAreNotChecked() {
        SimulationContext context = new SimulationContext();
        assertTrue(checker.check(graph.require("r"), context));
        assertTrue(checker.check(graph.require("unlinked"), context));
        assertTrue(context.errorNames().isEmpty());
    }
}
