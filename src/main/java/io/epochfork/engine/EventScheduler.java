package io.epochfork.engine;

import io.epochfork.model.ScenarioEvent;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Orders a scenario's events by {@code (t, event-type label, declaration index)}.
 */
public final class EventScheduler {
    private static final Comparator<Indexed> ORDER = Comparator
            .comparingLong((Indexed wrap) -> wrap.event().t())
            .thenComparing(wrap -> wrap.event().type().label())
            .thenComparingInt(Indexed::index);

    private EventScheduler() {
    }

    public static List<ScenarioEvent> schedule(List<ScenarioEvent> events) {
        List<Indexed> wraps = new ArrayList<>(events.size());
        for (int i = 0; i < events.size(); i++) {
            wraps.add(new Indexed(i, events.get(i)));
        }
        wraps.sort(ORDER);
        List<ScenarioEvent> out = new ArrayList<>(wraps.size());
        for (Indexed wrap : wraps) {
            out.add(wrap.event());
        }
        return List.copyOf(out);
    }

    private record Indexed(int index, ScenarioEvent event) {
    }
}
