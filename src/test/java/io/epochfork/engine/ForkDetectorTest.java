package io.epochfork.engine;

import io.epochfork.model.FaultDirective;
import io.epochfork.model.ScenarioEvent;
import org.junit.jupiter.api.Test;

import java.util.List;

import static io.epochfork.engine.Scenarios.child;
import static io.epochfork.engine.Scenarios.root;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ForkDetectorTest {
    private final EpochGraphIndex graph = EpochGraphIndex.build("s", List.of(
            root("r", 1, "h-r", 0),
            child("x", 2, "h-x", "r", "h-r", 10),
            child("x2", 2, "h-x2", "r", "h-r", 12),
            child("y", 3, "h-y", "r", "h-r", 30),
            child("z", 3, "h-z", "x", "h-x", 40)
    ));
    private final ForkDetector detector = new ForkDetector(graph);

    @Test
    void linearGrowthIsNotAFork() {
        SimulationContext context = new SimulationContext();
        detector.observe(ScenarioEvent.issue(0, "r"), context);
        detector.observe(ScenarioEvent.issue(10, "x"), context);
        detector.observe(ScenarioEvent.issue(40, "z"), context);

        assertFalse(context.detected());
        assertNull(context.forkCreatedTime());
        assertTrue(context.errorNames().isEmpty());
    }

    @Test
    void secondHashForSameEpochIsAFork() {
        SimulationContext context = new SimulationContext();
        detector.observe(ScenarioEvent.issue(0, "r"), context);
        detector.observe(ScenarioEvent.issue(10, "x"), context);
        detector.observe(ScenarioEvent.issue(12, "x2"), context);

        assertTrue(context.detected());
        assertEquals(12L, context.forkCreatedTime());
        assertEquals(12L, context.detectionTime());
        assertEquals(List.of("EPOCH_FORK_DETECTED"), context.errorNames());
    }

    @Test
    void siblingsWithDifferentEpochNumbersFork() {
        SimulationContext context = new SimulationContext();
        detector.observe(ScenarioEvent.issue(0, "r"), context);
        detector.observe(ScenarioEvent.issue(10, "x"), context);
        detector.observe(ScenarioEvent.issue(30, "y"), context);

        assertTrue(context.detected());
        assertEquals(30L, context.forkCreatedTime());
    }

    @Test
    void reissuingTheSameRecordIsNotAFork() {
        SimulationContext context = new SimulationContext();
        detector.observe(ScenarioEvent.issue(0, "r"), context);
        detector.observe(ScenarioEvent.issue(10, "x"), context);
        detector.observe(ScenarioEvent.issue(20, "x"), context);

        assertFalse(context.detected());
        assertEquals(2, context.observedForEpoch(2).size());
        assertEquals(2, context.childrenOf("r").size());
    }

    @Test
    void droppedRecordLeavesIndicesUntouched() {
        SimulationContext context = new SimulationContext();
        detector.observe(ScenarioEvent.issue(0, "r"), context);
        detector.observe(ScenarioEvent.issue(10, "x"), context);
        assertTrue(detector.observe(ScenarioEvent.issue(12, "x2", FaultDirective.DROP), context).isEmpty());

        assertFalse(context.detected());
        assertEquals(1, context.observedForEpoch(2).size());
        assertEquals(1, context.childrenOf("r").size());
    }

    @Test
    void droppedRecordWithUnknownNodeIsSkippedBeforeLookup() {
        SimulationContext context = new SimulationContext();
        assertTrue(detector.observe(ScenarioEvent.issue(0, "ghost", FaultDirective.DROP), context).isEmpty());
        assertTrue(context.allObserved().isEmpty());
    }

    @Test
    void onlyTheFirstForkSetsTimes() {
        SimulationContext context = new SimulationContext();
        detector.observe(ScenarioEvent.issue(0, "r"), context);
        detector.observe(ScenarioEvent.issue(10, "x"), context);
        detector.observe(ScenarioEvent.issue(12, "x2", FaultDirective.delay(100)), context);
        detector.observe(ScenarioEvent.issue(30, "y", FaultDirective.delay(1)), context);

        assertEquals(12L, context.forkCreatedTime());
        assertEquals(112L, context.detectionTime());
        assertEquals(List.of("EPOCH_FORK_DETECTED"), context.errorNames());
    }
}
