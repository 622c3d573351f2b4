package com.mlops.cleanup.kubernetes;

import com.mlops.cleanup.helm.HelmRelease;
import com.mlops.cleanup.model.ResourceDescriptor;
import com.mlops.cleanup.model.ResourceKind;
import com.mlops.cleanup.model.ResourcePhase;
import io.fabric8.kubernetes.api.model.NamespaceBuilder;
import io.fabric8.kubernetes.api.model.PersistentVolumeClaimBuilder;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.PodBuilder;
import io.fabric8.kubernetes.api.model.apiextensions.v1.CustomResourceDefinitionBuilder;
import io.fabric8.kubernetes.api.model.batch.v1.JobBuilder;
import io.fabric8.kubernetes.api.model.batch.v1.JobStatus;
import io.fabric8.kubernetes.api.model.batch.v1.JobStatusBuilder;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class ResourceDescriptorMapperTest {

    private static final Instant NOW = Instant.parse("2024-05-02T10:00:00Z");

    private final ResourceDescriptorMapper mapper = new ResourceDescriptorMapper(Clock.fixed(NOW, ZoneOffset.UTC));

    @Test
    @DisplayName("Container waiting reason is captured, pod-level reason is the fallback")
    void testPodStatusReason() {
        Pod crashing = new PodBuilder()
                .withNewMetadata().withName("api-0").withNamespace("data-plane").endMetadata()
                .withNewStatus()
                    .withPhase("Running")
                    .addNewContainerStatus()
                        .withName("sidecar")
                        .withNewState().withNewRunning().endRunning().endState()
                    .endContainerStatus()
                    .addNewContainerStatus()
                        .withName("api")
                        .withNewState().withNewWaiting().withReason("CrashLoopBackOff").endWaiting().endState()
                    .endContainerStatus()
                .endStatus()
                .build();
        Pod evicted = new PodBuilder()
                .withNewMetadata().withName("worker-1").withNamespace("data-plane").endMetadata()
                .withNewStatus().withPhase("Failed").withReason("Evicted").endStatus()
                .build();
        Pod healthy = new PodBuilder()
                .withNewMetadata().withName("worker-2").withNamespace("data-plane").endMetadata()
                .withNewStatus().withPhase("Running").endStatus()
                .build();

        assertEquals("CrashLoopBackOff", mapper.fromPod(crashing).getStatusReason());
        assertEquals("Evicted", mapper.fromPod(evicted).getStatusReason());
        assertNull(mapper.fromPod(healthy).getStatusReason());
    }

    @Test
    @DisplayName("Pod phase, labels, finalizers and age are captured")
    void testPod() {
        Pod pod = new PodBuilder()
                .withNewMetadata()
                    .withName("trainer-7")
                    .withNamespace("mlops-demo")
                    .addToLabels("app", "trainer")
                    .addToFinalizers("example.com/cleanup")
                    .withCreationTimestamp("2024-05-02T09:00:00Z")
                .endMetadata()
                .withNewStatus().withPhase("Succeeded").endStatus()
                .build();

        ResourceDescriptor descriptor = mapper.fromPod(pod);

        assertEquals(ResourceKind.POD, descriptor.getKind());
        assertEquals("mlops-demo", descriptor.getNamespace());
        assertEquals(ResourcePhase.SUCCEEDED, descriptor.getPhase());
        assertEquals("trainer", descriptor.getLabels().get("app"));
        assertEquals(1, descriptor.getOwnerHints().getFinalizers().size());
        assertEquals(3600, descriptor.getAgeSeconds());
    }

    @Test
    @DisplayName("Deletion timestamp marks a namespace as terminating")
    void testTerminatingNamespace() {
        ResourceDescriptor descriptor = mapper.fromNamespace(new NamespaceBuilder()
                .withNewMetadata()
                    .withName("leftover-test")
                    .withDeletionTimestamp("2024-05-02T09:59:00Z")
                .endMetadata()
                .withNewStatus().withPhase("Active").endStatus()
                .build());

        assertEquals(ResourcePhase.TERMINATING, descriptor.getPhase());
        assertNull(descriptor.getNamespace());
    }

    @Test
    @DisplayName("Job phase follows its conditions")
    void testJobPhase() {
        JobStatus complete = new JobStatusBuilder()
                .addNewCondition().withType("Complete").withStatus("True").endCondition()
                .withSucceeded(1)
                .build();
        JobStatus failed = new JobStatusBuilder()
                .addNewCondition().withType("Failed").withStatus("True").endCondition()
                .build();
        JobStatus running = new JobStatusBuilder().withActive(1).build();

        assertEquals(ResourcePhase.SUCCEEDED, ResourceDescriptorMapper.jobPhase(complete));
        assertEquals(ResourcePhase.FAILED, ResourceDescriptorMapper.jobPhase(failed));
        assertEquals(ResourcePhase.ACTIVE, ResourceDescriptorMapper.jobPhase(running));
        assertEquals(ResourcePhase.PENDING, ResourceDescriptorMapper.jobPhase(null));

        ResourceDescriptor job = mapper.fromJob(new JobBuilder()
                .withNewMetadata().withName("etl-1").withNamespace("processing-jobs").endMetadata()
                .withStatus(complete)
                .build());
        assertEquals(ResourcePhase.SUCCEEDED, job.getPhase());
    }

    @Test
    @DisplayName("Claim binding phase")
    void testClaim() {
        ResourceDescriptor bound = mapper.fromPersistentVolumeClaim(new PersistentVolumeClaimBuilder()
                .withNewMetadata().withName("minio-0").withNamespace("data-plane").endMetadata()
                .withNewStatus().withPhase("Bound").endStatus()
                .build());
        ResourceDescriptor noStatus = mapper.fromPersistentVolumeClaim(new PersistentVolumeClaimBuilder()
                .withNewMetadata().withName("scratch").withNamespace("data-plane").endMetadata()
                .build());

        assertEquals(ResourcePhase.BOUND, bound.getPhase());
        assertEquals(ResourcePhase.PENDING, noStatus.getPhase());
    }

    @Test
    @DisplayName("CRD is cluster scoped and records its group")
    void testCrd() {
        ResourceDescriptor descriptor = mapper.fromCustomResourceDefinition(new CustomResourceDefinitionBuilder()
                .withNewMetadata().withName("widgets.example.com").endMetadata()
                .withNewSpec().withGroup("example.com").endSpec()
                .build());

        assertNull(descriptor.getNamespace());
        assertEquals("example.com", descriptor.getOwnerHints().getCrdGroup());
    }

    @Test
    @DisplayName("Helm release maps status and age from the updated timestamp")
    void testRelease() {
        ResourceDescriptor descriptor = mapper.fromRelease(HelmRelease.builder()
                .name("mlflow-experiment")
                .namespace("ml-lifecycle")
                .status("deployed")
                .chart("mlflow-0.7.19")
                .updated("2024-05-02 08:00:00.123456789 +0000 UTC")
                .build());

        assertEquals(ResourceKind.PACKAGE_RELEASE, descriptor.getKind());
        assertEquals(ResourcePhase.ACTIVE, descriptor.getPhase());
        assertEquals("mlflow-0.7.19", descriptor.getOwnerHints().getChart());
        assertEquals(7199, descriptor.getAgeSeconds());
    }

    @Test
    @DisplayName("Helm timestamps with offsets and garbage")
    void testParseHelmTimestamp() {
        assertEquals(Instant.parse("2024-05-02T06:00:00Z"),
                ResourceDescriptorMapper.parseHelmTimestamp("2024-05-02 08:00:00 +0200 CEST"));
        assertNull(ResourceDescriptorMapper.parseHelmTimestamp("yesterday"));
        assertNull(ResourceDescriptorMapper.parseHelmTimestamp(null));
    }
}
