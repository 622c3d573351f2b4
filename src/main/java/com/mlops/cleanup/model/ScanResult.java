package com.mlops.cleanup.model;

import lombok.NonNull;
import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Everything the inventory scanner saw, plus the kinds it could not list.
 */
@Value
public class ScanResult {

    @NonNull
    List<ResourceDescriptor> descriptors;

    /**
     * Kinds whose listing failed and were treated as empty.
     */
    @NonNull
    List<ResourceKind> failedKinds;

    public ScanResult(List<ResourceDescriptor> descriptors, List<ResourceKind> failedKinds) {
        this.descriptors = List.copyOf(descriptors);
        this.failedKinds = List.copyOf(failedKinds);
    }

    public Map<ResourceKind, Long> getCountsByKind() {
        return descriptors.stream()
                .collect(Collectors.groupingBy(ResourceDescriptor::getKind, TreeMap::new, Collectors.counting()));
    }
}
