package io.epochfork.model;

import java.util.List;
import java.util.Map;

public record Scenario(
        String scenarioId,
        Map<String, Object> groupContext,
        List<EpochNode> nodes,
        List<EpochEdge> edges,
        List<ScenarioEvent> events,
        Expectations expectations,
        List<String> tags
) {
    public static final String STRESS_TAG = "stress";

    public Scenario {
        groupContext = groupContext == null ? Map.of() : groupContext;
        nodes = nodes == null ? List.of() : List.copyOf(nodes);
        edges = edges == null ? List.of() : List.copyOf(edges);
        events = events == null ? List.of() : List.copyOf(events);
        tags = tags == null ? List.of() : List.copyOf(tags);
    }

    public boolean isStress() {
        return tags.contains(STRESS_TAG);
    }
}
