package io.epochfork.engine;

import io.epochfork.model.EventType;
import io.epochfork.model.ScenarioEvent;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;

class EventSchedulerTest {
    @Test
    void scheduleShouldOrderByTimeFirst() {
        ScenarioEvent late = ScenarioEvent.merge(50);
        ScenarioEvent early = ScenarioEvent.replay(10, 1);
        ScenarioEvent middle = ScenarioEvent.issue(20, "a");

        List<ScenarioEvent> scheduled = EventScheduler.schedule(List.of(late, early, middle));

        assertEquals(List.of(early, middle, late), scheduled);
    }

    @Test
    void sameTimeDifferentTypesShouldOrderByLabel() {
        ScenarioEvent replay = ScenarioEvent.replay(5, 2);
        ScenarioEvent merge = ScenarioEvent.merge(5);
        ScenarioEvent issue = ScenarioEvent.issue(5, "a");

        List<ScenarioEvent> scheduled = EventScheduler.schedule(List.of(replay, merge, issue));

        assertEquals(EventType.EPOCH_ISSUE, scheduled.get(0).type());
        assertEquals(EventType.MERGE, scheduled.get(1).type());
        assertEquals(EventType.REPLAY_ATTEMPT, scheduled.get(2).type());
    }

    @Test
    void sameTimeSameTypeShouldKeepDeclarationOrder() {
        ScenarioEvent first = ScenarioEvent.issue(7, "b");
        ScenarioEvent second = ScenarioEvent.issue(7, "a");
        ScenarioEvent third = ScenarioEvent.issue(7, "c");

        List<ScenarioEvent> scheduled = EventScheduler.schedule(List.of(first, second, third));

        assertSame(first, scheduled.get(0));
        assertSame(second, scheduled.get(1));
        assertSame(third, scheduled.get(2));
    }

    @Test
    void scheduleShouldNotMutateInput() {
        List<ScenarioEvent> input = List.of(ScenarioEvent.merge(9), ScenarioEvent.issue(1, "a"));
        EventScheduler.schedule(input);
        assertEquals(EventType.MERGE, input.get(0).type());
    }
}
