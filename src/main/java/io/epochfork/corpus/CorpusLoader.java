package io.epochfork.corpus;

import com.fasterxml.jackson.databind.JsonNode;
import io.epochfork.model.DetectionReference;
import io.epochfork.model.EpochEdge;
import io.epochfork.model.EpochNode;
import io.epochfork.model.EventType;
import io.epochfork.model.Expectations;
import io.epochfork.model.FaultDirective;
import io.epochfork.model.Scenario;
import io.epochfork.model.ScenarioEvent;
import io.epochfork.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Parses the scenario corpus from its JSON fixture.
 *
 * <p>{@link #readCorpus(Path)} only checks the root shape so that one malformed scenario
 * cannot take down its siblings; {@link #parseScenario(JsonNode)} does the per-scenario
 * structural validation.
 */
public final class CorpusLoader {
    private CorpusLoader() {
    }

    public static List<JsonNode> readCorpus(Path path) {
        if (path == null || !Files.isRegularFile(path)) {
            throw new CorpusException("Corpus file not found: " + path);
        }
        JsonNode root;
        try {
            root = Jsons.mapper().readTree(path.toFile());
        } catch (IOException e) {
            throw new CorpusException(null, "Failed to read corpus " + path + ": " + e.getMessage(), e);
        }
        return rawScenarios(root);
    }

    public static List<JsonNode> readCorpus(String json) {
        JsonNode root;
        try {
            root = Jsons.mapper().readTree(json);
        } catch (IOException e) {
            throw new CorpusException(null, "Failed to parse corpus: " + e.getMessage(), e);
        }
        return rawScenarios(root);
    }

    public static List<Scenario> loadCorpus(Path path) {
        List<Scenario> out = new ArrayList<>();
        for (JsonNode raw : readCorpus(path)) {
            out.add(parseScenario(raw));
        }
        return out;
    }

    private static List<JsonNode> rawScenarios(JsonNode root) {
        if (root == null || !root.isArray()) {
            throw new CorpusException("Corpus root must be a list of scenarios");
        }
        List<JsonNode> out = new ArrayList<>(root.size());
        root.forEach(out::add);
        return out;
    }

    public static String scenarioIdOf(JsonNode raw) {
        return raw == null ? "" : text(raw.get("scenario_id"), "");
    }

    public static List<String> tagsOf(JsonNode raw) {
        List<String> tags = new ArrayList<>();
        if (raw == null) {
            return tags;
        }
        for (JsonNode tag : raw.path("tags")) {
            tags.add(tag.asText());
        }
        return tags;
    }

    public static Scenario parseScenario(JsonNode data) {
        if (data == null || !data.isObject()) {
            throw new CorpusException("Scenario entry must be an object");
        }
        String scenarioId = scenarioIdOf(data);
        if (scenarioId.isBlank()) {
            throw new CorpusException("scenario_id is required");
        }
        JsonNode graph = data.path("graph");
        List<EpochNode> nodes = parseNodes(scenarioId, graph.path("nodes"));
        Set<String> nodeIds = new HashSet<>();
        for (EpochNode node : nodes) {
            nodeIds.add(node.nodeId());
        }
        for (EpochNode node : nodes) {
            if (node.parentId() != null && !nodeIds.contains(node.parentId())) {
                throw new CorpusException(scenarioId,
                        "Node " + node.nodeId() + " references unknown parent " + node.parentId() + " in scenario " + scenarioId);
            }
        }
        List<EpochEdge> edges = parseEdges(scenarioId, graph.path("edges"), nodeIds);
        List<ScenarioEvent> events = parseEvents(scenarioId, data.path("event_stream"));
        Expectations expectations = parseExpectations(scenarioId, data.path("expectations"));
        return new Scenario(
                scenarioId,
                parseGroupContext(data.path("group_context")),
                nodes,
                edges,
                events,
                expectations,
                tagsOf(data)
        );
    }

    private static List<EpochNode> parseNodes(String scenarioId, JsonNode raw) {
        List<EpochNode> nodes = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (JsonNode item : raw) {
            String nodeId = text(item.get("node_id"), "");
            if (nodeId.isBlank()) {
                throw new CorpusException(scenarioId, "Node without node_id in scenario " + scenarioId);
            }
            if (!seen.add(nodeId)) {
                throw new CorpusException(scenarioId, "Duplicate node_id " + nodeId + " in scenario " + scenarioId);
            }
            JsonNode eareHash = item.get("eare_hash");
            if (eareHash == null || eareHash.isNull()) {
                throw new CorpusException(scenarioId, "Node " + nodeId + " has no eare_hash in scenario " + scenarioId);
            }
            nodes.add(new EpochNode(
                    nodeId,
                    integer(scenarioId, item, "epoch_id", true),
                    eareHash.asText(),
                    optionalText(item.get("previous_epoch_hash")),
                    optionalText(item.get("membership_digest")),
                    optionalText(item.get("parent_id")),
                    text(item.get("issued_by"), ""),
                    integer(scenarioId, item, "timestamp_ms", false)
            ));
        }
        return nodes;
    }

    private static List<EpochEdge> parseEdges(String scenarioId, JsonNode raw, Set<String> nodeIds) {
        List<EpochEdge> edges = new ArrayList<>();
        for (JsonNode item : raw) {
            String from = text(item.get("from"), "");
            String to = text(item.get("to"), "");
            if (!nodeIds.contains(from) || !nodeIds.contains(to)) {
                throw new CorpusException(scenarioId, "Edge references unknown node in scenario " + scenarioId);
            }
            edges.add(new EpochEdge(from, to, text(item.get("type"), "linear")));
        }
        return edges;
    }

    private static List<ScenarioEvent> parseEvents(String scenarioId, JsonNode raw) {
        List<ScenarioEvent> events = new ArrayList<>();
        int index = 0;
        for (JsonNode item : raw) {
            EventType type;
            List<FaultDirective> faults = new ArrayList<>();
            try {
                type = EventType.fromLabel(text(item.get("event"), ""));
                for (JsonNode fault : item.path("faults")) {
                    faults.add(FaultDirective.parse(fault.asText()));
                }
            } catch (IllegalArgumentException e) {
                throw new CorpusException(scenarioId,
                        e.getMessage() + " at event_stream[" + index + "] in scenario " + scenarioId, e);
            }
            List<String> participants = new ArrayList<>();
            for (JsonNode participant : item.path("participants")) {
                participants.add(participant.asText());
            }
            JsonNode epochId = item.get("epoch_id");
            ScenarioEvent event = new ScenarioEvent(
                    integer(scenarioId, item, "t", false),
                    type,
                    optionalText(item.get("node_id")),
                    epochId == null || epochId.isNull() ? null : integer(scenarioId, item, "epoch_id", true),
                    integer(scenarioId, item, "count", false),
                    faults,
                    optionalText(item.get("controller")),
                    participants,
                    optionalText(item.get("reconcile_strategy"))
            );
            try {
                Math.addExact(event.t(), event.validationDelayMs());
            } catch (ArithmeticException e) {
                throw new CorpusException(scenarioId,
                        "delay_validation overflows t at event_stream[" + index + "] in scenario " + scenarioId, e);
            }
            events.add(event);
            index++;
        }
        return events;
    }

    private static Expectations parseExpectations(String scenarioId, JsonNode raw) {
        JsonNode reconciled = raw.path("reconciled_epoch");
        JsonNode gap = raw.path("allow_replay_gap");
        List<String> categories = new ArrayList<>();
        for (JsonNode category : raw.path("expected_error_categories")) {
            categories.add(category.asText());
        }
        return new Expectations(
                raw.path("detected").asBoolean(false),
                DetectionReference.fromString(text(raw.get("detection_reference"), null)),
                integer(scenarioId, raw, "max_detection_ms", false),
                integer(scenarioId, raw, "max_reconciliation_ms", false),
                new Expectations.ReconciledEpoch(
                        integer(scenarioId, reconciled, "epoch_id", false),
                        text(reconciled.get("node_id"), ""),
                        text(reconciled.get("eare_hash"), "")
                ),
                new Expectations.ReplayGap(
                        integer(scenarioId, gap, "max_messages", false),
                        integer(scenarioId, gap, "max_ms", false)
                ),
                categories,
                raw.path("healing_required").asBoolean(false)
        );
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> parseGroupContext(JsonNode raw) {
        if (raw == null || !raw.isObject()) {
            return Map.of();
        }
        return Jsons.mapper().convertValue(raw, LinkedHashMap.class);
    }

    private static long integer(String scenarioId, JsonNode item, String field, boolean required) {
        JsonNode value = item.get(field);
        if (value == null || value.isNull()) {
            if (required) {
                throw new CorpusException(scenarioId, "Missing " + field + " in scenario " + scenarioId);
            }
            return 0L;
        }
        if (!value.canConvertToExactIntegral()) {
            throw new CorpusException(scenarioId, field + " must be an integer in scenario " + scenarioId + ": " + value);
        }
        if (!value.canConvertToLong()) {
            throw new CorpusException(scenarioId, field + " is out of range in scenario " + scenarioId + ": " + value);
        }
        return value.asLong();
    }

    private static String text(JsonNode node, String fallback) {
        if (node == null || node.isNull()) {
            return fallback;
        }
        return node.asText();
    }

    private static String optionalText(JsonNode node) {
        String value = text(node, null);
        return value == null || value.isEmpty() ? null : value;
    }
}
