package io.epochfork.observability;

import io.epochfork.model.ResultEnvelope;
import io.epochfork.runtime.EpochForkRunner;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;

/**
 * Renders a corpus run in Prometheus text exposition format for regression dashboards.
 */
public final class PrometheusFormatter {
    private PrometheusFormatter() {
    }

    public static String format(EpochForkRunner.RunOutcome outcome) {
        StringBuilder sb = new StringBuilder();
        Map<String, Long> byStatus = new LinkedHashMap<>();
        byStatus.put(ResultEnvelope.STATUS_PASS, outcome.passed());
        byStatus.put(ResultEnvelope.STATUS_FAIL, outcome.failed());
        byStatus.put(ResultEnvelope.STATUS_ERROR, outcome.corpusErrors());
        appendMapGauge(sb, "epochfork_scenarios_total", "Evaluated scenarios grouped by status", "status", byStatus);

        Map<String, Long> byCategory = new LinkedHashMap<>();
        Map<String, Long> byFailure = new LinkedHashMap<>();
        for (ResultEnvelope env : outcome.envelopes()) {
            for (String category : env.errors()) {
                byCategory.merge(category, 1L, Long::sum);
            }
            for (String failure : env.failures()) {
                byFailure.merge(failure, 1L, Long::sum);
            }
        }
        appendMapGauge(sb, "epochfork_error_category_scenarios", "Scenarios reporting each protocol error category", "category", byCategory);
        appendMapGauge(sb, "epochfork_failure_scenarios", "Scenarios reporting each expectation failure code", "failure", byFailure);

        appendScenarioGauge(sb, "epochfork_scenario_detected", "Fork detected (1=yes,0=no)", outcome,
                env -> env.detection() ? 1L : 0L);
        appendScenarioGauge(sb, "epochfork_scenario_detection_ms", "Detection latency in milliseconds", outcome,
                ResultEnvelope::detectionMs);
        appendScenarioGauge(sb, "epochfork_scenario_reconciliation_ms", "Reconciliation latency in milliseconds", outcome,
                ResultEnvelope::reconciliationMs);
        appendScenarioGauge(sb, "epochfork_scenario_messages_dropped", "Messages dropped by replay attempts", outcome,
                ResultEnvelope::messagesDropped);
        appendScenarioGauge(sb, "epochfork_scenario_failures", "Expectation failures recorded", outcome,
                env -> (long) env.failures().size());
        return sb.toString();
    }

    private static void appendMapGauge(StringBuilder sb, String metric, String help, String label, Map<String, Long> values) {
        sb.append("# HELP ").append(metric).append(" ").append(help).append('\n');
        sb.append("# TYPE ").append(metric).append(" gauge").append('\n');
        for (Map.Entry<String, Long> e : values.entrySet()) {
            sb.append(metric).append('{')
                    .append(label).append("=\"").append(escapeLabel(e.getKey())).append("\"}")
                    .append(' ').append(e.getValue()).append('\n');
        }
    }

    private static void appendScenarioGauge(
            StringBuilder sb,
            String metric,
            String help,
            EpochForkRunner.RunOutcome outcome,
            Function<ResultEnvelope, Long> value
    ) {
        sb.append("# HELP ").append(metric).append(" ").append(help).append('\n');
        sb.append("# TYPE ").append(metric).append(" gauge").append('\n');
        for (ResultEnvelope env : outcome.envelopes()) {
            Long sample = value.apply(env);
            if (sample == null) {
                continue;
            }
            sb.append(metric)
                    .append("{scenario_id=\"").append(escapeLabel(env.scenarioId())).append("\"}")
                    .append(' ').append(sample).append('\n');
        }
    }

    private static String escapeLabel(String v) {
        return v == null ? "" : v.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n");
    }
}
