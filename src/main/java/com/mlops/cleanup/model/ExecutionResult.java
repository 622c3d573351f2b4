package com.mlops.cleanup.model;

import lombok.NonNull;
import lombok.Value;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Aggregated result of executing a cleanup plan. Items are kept in plan order.
 */
@Value
public class ExecutionResult {

    @NonNull
    ExecutionMode mode;

    @NonNull
    RunOutcome outcome;

    @NonNull
    List<ItemResult> items;

    public ExecutionResult(ExecutionMode mode, RunOutcome outcome, List<ItemResult> items) {
        this.mode = mode;
        this.outcome = outcome;
        this.items = List.copyOf(items);
    }

    public long getFailureCount() {
        return items.stream().filter(i -> i.getOutcome() == ItemOutcome.FAILED).count();
    }

    public boolean hasFailures() {
        return getFailureCount() > 0;
    }

    public Map<ItemOutcome, Integer> getCountsByOutcome() {
        Map<ItemOutcome, Integer> counts = new EnumMap<>(ItemOutcome.class);
        for (ItemResult item : items) {
            counts.merge(item.getOutcome(), 1, Integer::sum);
        }
        return counts;
    }

    public Map<ResourceKind, Map<ItemOutcome, Integer>> getCountsByKind() {
        Map<ResourceKind, Map<ItemOutcome, Integer>> counts = new TreeMap<>();
        for (ItemResult item : items) {
            counts.computeIfAbsent(item.getDeletion().getDescriptor().getKind(),
                            k -> new EnumMap<>(ItemOutcome.class))
                    .merge(item.getOutcome(), 1, Integer::sum);
        }
        return counts;
    }
}
