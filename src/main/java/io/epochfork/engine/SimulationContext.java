package io.epochfork.engine;

import io.epochfork.model.EpochNode;
import io.epochfork.model.ErrorCategory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Mutable state of a single simulation run. Never shared between scenarios.
 */
public final class SimulationContext {
    static final String ROOT_PARENT_KEY = "";

    private final Map<Long, List<ObservedRecord>> observed = new TreeMap<>();
    private final Map<String, List<ChildRecord>> childrenByParent = new LinkedHashMap<>();
    private final Set<ErrorCategory> errors = new LinkedHashSet<>();
    private Long forkCreatedTime;
    private Long detectionTime;
    private Long firstMergeTime;
    private long messagesDropped;

    public List<ObservedRecord> observedForEpoch(long epochId) {
        return List.copyOf(observed.getOrDefault(epochId, List.of()));
    }

    public List<ChildRecord> childrenOf(String parentId) {
        return List.copyOf(childrenByParent.getOrDefault(parentKey(parentId), List.of()));
    }

    void record(EpochNode node) {
        observed.computeIfAbsent(node.epochId(), ignored -> new ArrayList<>())
                .add(new ObservedRecord(node.nodeId(), node.eareHash()));
        childrenByParent.computeIfAbsent(parentKey(node.parentId()), ignored -> new ArrayList<>())
                .add(new ChildRecord(node.epochId(), node.nodeId(), node.eareHash()));
    }

    /**
     * Every observed record, by ascending epoch and then observation order.
     */
    public List<ObservedRecord> allObserved() {
        List<ObservedRecord> out = new ArrayList<>();
        for (List<ObservedRecord> entries : observed.values()) {
            out.addAll(entries);
        }
        return out;
    }

    void markFork(long t, long validationDelayMs) {
        if (forkCreatedTime != null) {
            return;
        }
        long observableAt = Math.addExact(t, validationDelayMs);
        forkCreatedTime = t;
        if (detectionTime == null) {
            detectionTime = observableAt;
        }
        errors.add(ErrorCategory.EPOCH_FORK_DETECTED);
    }

    void registerError(ErrorCategory category) {
        errors.add(category);
    }

    void addDropped(long count) {
        messagesDropped += count;
    }

    void markMerge(long t) {
        if (firstMergeTime == null) {
            firstMergeTime = t;
        }
    }

    public Long forkCreatedTime() {
        return forkCreatedTime;
    }

    public Long detectionTime() {
        return detectionTime;
    }

    public Long firstMergeTime() {
        return firstMergeTime;
    }

    public long messagesDropped() {
        return messagesDropped;
    }

    public boolean detected() {
        return detectionTime != null;
    }

    public List<String> errorNames() {
        List<String> out = new ArrayList<>(errors.size());
        for (ErrorCategory category : errors) {
            out.add(category.name());
        }
        return out;
    }

    private static String parentKey(String parentId) {
        return parentId == null ? ROOT_PARENT_KEY : parentId;
    }

    public record ObservedRecord(String nodeId, String hash) {
    }

    public record ChildRecord(long epochId, String nodeId, String hash) {
        boolean matches(long otherEpochId, String otherHash) {
            return epochId == otherEpochId && hash.equals(otherHash);
        }
    }
}
