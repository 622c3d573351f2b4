package com.mlops.cleanup.kubernetes;

import com.mlops.cleanup.helm.HelmRelease;
import com.mlops.cleanup.model.OwnerHints;
import com.mlops.cleanup.model.ResourceDescriptor;
import com.mlops.cleanup.model.ResourceKind;
import com.mlops.cleanup.model.ResourcePhase;
import io.fabric8.kubernetes.api.model.ConfigMap;
import io.fabric8.kubernetes.api.model.ContainerState;
import io.fabric8.kubernetes.api.model.ContainerStatus;
import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.Namespace;
import io.fabric8.kubernetes.api.model.ObjectMeta;
import io.fabric8.kubernetes.api.model.PersistentVolumeClaim;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.PodStatus;
import io.fabric8.kubernetes.api.model.Secret;
import io.fabric8.kubernetes.api.model.apiextensions.v1.CustomResourceDefinition;
import io.fabric8.kubernetes.api.model.batch.v1.Job;
import io.fabric8.kubernetes.api.model.batch.v1.JobCondition;
import io.fabric8.kubernetes.api.model.batch.v1.JobStatus;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Converts fabric8 model objects and Helm releases into {@link ResourceDescriptor} snapshots.
 */
@Slf4j
public class ResourceDescriptorMapper {

    private final Clock clock;

    public ResourceDescriptorMapper(Clock clock) {
        this.clock = clock;
    }

    public ResourceDescriptor fromNamespace(Namespace namespace) {
        ResourcePhase phase = namespace.getStatus() != null
                ? ResourcePhase.fromApiValue(namespace.getStatus().getPhase())
                : ResourcePhase.ACTIVE;
        return base(namespace, ResourceKind.NAMESPACE, phase).namespace(null).build();
    }

    public ResourceDescriptor fromPod(Pod pod) {
        ResourcePhase phase = pod.getStatus() != null
                ? ResourcePhase.fromApiValue(pod.getStatus().getPhase())
                : ResourcePhase.UNKNOWN;
        return base(pod, ResourceKind.POD, phase).statusReason(podStatusReason(pod.getStatus())).build();
    }

    public ResourceDescriptor fromJob(Job job) {
        return base(job, ResourceKind.JOB, jobPhase(job.getStatus())).build();
    }

    public ResourceDescriptor fromPersistentVolumeClaim(PersistentVolumeClaim claim) {
        ResourcePhase phase = claim.getStatus() != null
                ? ResourcePhase.fromApiValue(claim.getStatus().getPhase())
                : ResourcePhase.PENDING;
        return base(claim, ResourceKind.PERSISTENT_VOLUME_CLAIM, phase).build();
    }

    public ResourceDescriptor fromCustomResourceDefinition(CustomResourceDefinition crd) {
        String group = crd.getSpec() != null ? crd.getSpec().getGroup() : null;
        ResourceDescriptor descriptor =
                base(crd, ResourceKind.CUSTOM_RESOURCE_DEFINITION, ResourcePhase.ACTIVE).namespace(null).build();
        return descriptor.toBuilder()
                .ownerHints(descriptor.getOwnerHints().toBuilder().crdGroup(group).build())
                .build();
    }

    public ResourceDescriptor fromConfigMap(ConfigMap configMap) {
        return base(configMap, ResourceKind.CONFIG_MAP, ResourcePhase.ACTIVE).build();
    }

    public ResourceDescriptor fromSecret(Secret secret) {
        return base(secret, ResourceKind.SECRET, ResourcePhase.ACTIVE).build();
    }

    public ResourceDescriptor fromRelease(HelmRelease release) {
        return ResourceDescriptor.builder()
                .kind(ResourceKind.PACKAGE_RELEASE)
                .namespace(release.getNamespace())
                .name(release.getName())
                .label("chart", release.getChart() != null ? release.getChart() : "")
                .label("status", release.getStatus() != null ? release.getStatus() : "")
                .phase(ResourcePhase.fromApiValue(release.getStatus()))
                .ownerHints(OwnerHints.builder()
                        .releaseName(release.getName())
                        .chart(release.getChart())
                        .build())
                .ageSeconds(ageOf(parseHelmTimestamp(release.getUpdated())))
                .build();
    }

    private ResourceDescriptor.ResourceDescriptorBuilder base(HasMetadata object, ResourceKind kind,
                                                              ResourcePhase observedPhase) {
        ObjectMeta metadata = object.getMetadata();
        ResourceDescriptor.ResourceDescriptorBuilder builder = ResourceDescriptor.builder()
                .kind(kind)
                .namespace(metadata.getNamespace())
                .name(metadata.getName());

        if (metadata.getLabels() != null) {
            builder.labels(metadata.getLabels());
        }

        OwnerHints.OwnerHintsBuilder hints = OwnerHints.builder();
        if (metadata.getFinalizers() != null) {
            hints.finalizers(metadata.getFinalizers());
        }
        builder.ownerHints(hints.build());

        // A pending deletion overrides whatever the status block says
        builder.phase(metadata.getDeletionTimestamp() != null ? ResourcePhase.TERMINATING : observedPhase);
        builder.ageSeconds(ageOf(parseTimestamp(metadata.getCreationTimestamp())));
        return builder;
    }

    /**
     * First waiting reason of an init or regular container, else the pod-level reason (e.g. Evicted).
     */
    static String podStatusReason(PodStatus status) {
        if (status == null) {
            return null;
        }
        List<ContainerStatus> containers = new ArrayList<>();
        if (status.getInitContainerStatuses() != null) {
            containers.addAll(status.getInitContainerStatuses());
        }
        if (status.getContainerStatuses() != null) {
            containers.addAll(status.getContainerStatuses());
        }
        for (ContainerStatus container : containers) {
            ContainerState state = container.getState();
            if (state != null && state.getWaiting() != null && state.getWaiting().getReason() != null) {
                return state.getWaiting().getReason();
            }
        }
        return status.getReason();
    }

    /**
     * A job is terminal once it carries a true Complete or Failed condition.
     */
    static ResourcePhase jobPhase(JobStatus status) {
        if (status == null) {
            return ResourcePhase.PENDING;
        }
        if (status.getConditions() != null) {
            for (JobCondition condition : status.getConditions()) {
                if (!"True".equalsIgnoreCase(condition.getStatus())) {
                    continue;
                }
                if ("Complete".equals(condition.getType())) {
                    return ResourcePhase.SUCCEEDED;
                }
                if ("Failed".equals(condition.getType())) {
                    return ResourcePhase.FAILED;
                }
            }
        }
        int active = status.getActive() != null ? status.getActive() : 0;
        int succeeded = status.getSucceeded() != null ? status.getSucceeded() : 0;
        if (active == 0 && succeeded > 0) {
            return ResourcePhase.SUCCEEDED;
        }
        return ResourcePhase.ACTIVE;
    }

    private long ageOf(Instant createdAt) {
        if (createdAt == null) {
            return 0;
        }
        return Math.max(0, Duration.between(createdAt, clock.instant()).getSeconds());
    }

    private Instant parseTimestamp(String timestamp) {
        if (timestamp == null || timestamp.isEmpty()) {
            return null;
        }
        try {
            return Instant.parse(timestamp);
        } catch (DateTimeParseException e) {
            log.debug("Unparseable creationTimestamp '{}': {}", timestamp, e.getMessage());
            return null;
        }
    }

    static Instant parseHelmTimestamp(String updated) {
        if (updated == null || updated.isEmpty()) {
            return null;
        }
        String[] parts = updated.trim().split("\\s+");
        if (parts.length < 3) {
            return null;
        }
        try {
            LocalDateTime local = LocalDateTime.parse(parts[0] + "T" + parts[1]);
            return local.toInstant(ZoneOffset.of(parts[2]));
        } catch (DateTimeException e) {
            log.debug("Unparseable helm timestamp '{}': {}", updated, e.getMessage());
            return null;
        }
    }
}
