package com.mlops.cleanup.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Signals derived during the scan that the classifier uses besides identity.
 * Each field is only populated for the kinds it applies to.
 */
@Value
@Builder(toBuilder = true)
public class OwnerHints {

    public static final OwnerHints NONE = OwnerHints.builder().build();

    /**
     * Number of workload objects inside a namespace; null when not a namespace
     * or when the count could not be determined.
     */
    Integer childResourceCount;

    /**
     * API group of a CustomResourceDefinition (e.g. "kafka.strimzi.io").
     */
    String crdGroup;

    /**
     * Helm release name and chart for package releases.
     */
    String releaseName;
    String chart;

    @Singular
    List<String> finalizers;
}
