package com.mlops.cleanup.kubernetes;

import com.mlops.cleanup.helm.HelmRelease;
import com.mlops.cleanup.helm.ReleaseClient;
import com.mlops.cleanup.model.ResourceDescriptor;
import com.mlops.cleanup.model.ResourceKind;
import com.mlops.cleanup.model.ResourcePhase;
import io.fabric8.kubernetes.api.model.ConfigMap;
import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.KubernetesResourceList;
import io.fabric8.kubernetes.api.model.ListOptions;
import io.fabric8.kubernetes.api.model.ListOptionsBuilder;
import io.fabric8.kubernetes.api.model.Namespace;
import io.fabric8.kubernetes.api.model.PersistentVolumeClaim;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.Secret;
import io.fabric8.kubernetes.api.model.StatusDetails;
import io.fabric8.kubernetes.api.model.apiextensions.v1.CustomResourceDefinition;
import io.fabric8.kubernetes.api.model.batch.v1.Job;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.fabric8.kubernetes.client.KubernetesClientTimeoutException;
import io.fabric8.kubernetes.client.dsl.Resource;
import io.fabric8.kubernetes.client.dsl.base.PatchContext;
import io.fabric8.kubernetes.client.dsl.base.PatchType;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Cluster capabilities on top of the fabric8 client. Package releases are
 * routed to the {@link ReleaseClient}.
 */
@Slf4j
public class Fabric8ClusterGateway implements ResourceLister, ResourceDeleter, FinalizerPatcher {

    static final String CLEAR_FINALIZERS_PATCH = "{\"metadata\":{\"finalizers\":[]}}";

    private static final int HTTP_NOT_FOUND = 404;

    private final KubernetesClient client;
    private final ReleaseClient releaseClient;
    private final ResourceDescriptorMapper mapper;
    private final long pageSize;

    public Fabric8ClusterGateway(KubernetesClient client, ReleaseClient releaseClient,
                                 ResourceDescriptorMapper mapper, int pageSize) {
        this.client = client;
        this.releaseClient = releaseClient;
        this.mapper = mapper;
        this.pageSize = pageSize;
    }

    @Override
    public void verifyConnectivity() {
        try {
            client.namespaces().list(new ListOptionsBuilder().withLimit(1L).build());
            log.info("Connected to Kubernetes cluster at {}", client.getMasterUrl());
        } catch (KubernetesClientException e) {
            throw new ClusterAccessException("Cannot connect to Kubernetes cluster at "
                    + client.getMasterUrl() + ": " + e.getMessage(), e);
        }
    }

    @Override
    public List<ResourceDescriptor> list(ResourceKind kind) {
        switch (kind) {
            case NAMESPACE:
                return paged(kind, options -> client.namespaces().list(options), mapper::fromNamespace);
            case POD:
                return paged(kind, options -> client.pods().inAnyNamespace().list(options), mapper::fromPod);
            case JOB:
                return paged(kind, options -> client.batch().v1().jobs().inAnyNamespace().list(options),
                        mapper::fromJob);
            case PERSISTENT_VOLUME_CLAIM:
                return paged(kind, options -> client.persistentVolumeClaims().inAnyNamespace().list(options),
                        mapper::fromPersistentVolumeClaim);
            case CUSTOM_RESOURCE_DEFINITION:
                return paged(kind, options -> client.apiextensions().v1().customResourceDefinitions().list(options),
                        mapper::fromCustomResourceDefinition);
            case CONFIG_MAP:
                return paged(kind, options -> client.configMaps().inAnyNamespace().list(options),
                        mapper::fromConfigMap);
            case SECRET:
                return paged(kind, options -> client.secrets().inAnyNamespace().list(options), mapper::fromSecret);
            case PACKAGE_RELEASE:
                return releaseClient.listReleases().stream()
                        .map(mapper::fromRelease)
                        .collect(Collectors.toList());
            default:
                throw new IllegalArgumentException("Unsupported resource kind: " + kind);
        }
    }

    /**
     * Follow continue tokens until the server reports the last page.
     */
    private <T extends HasMetadata> List<ResourceDescriptor> paged(
            ResourceKind kind,
            Function<ListOptions, ? extends KubernetesResourceList<T>> lister,
            Function<T, ResourceDescriptor> mapping) {
        List<ResourceDescriptor> descriptors = new ArrayList<>();
        String continueToken = null;
        int pages = 0;
        try {
            do {
                ListOptions options = new ListOptionsBuilder()
                        .withLimit(pageSize)
                        .withContinue(continueToken)
                        .build();
                KubernetesResourceList<T> page = lister.apply(options);
                for (T item : page.getItems()) {
                    descriptors.add(mapping.apply(item));
                }
                continueToken = page.getMetadata() != null ? page.getMetadata().getContinue() : null;
                pages++;
            } while (continueToken != null && !continueToken.isEmpty());
        } catch (KubernetesClientException e) {
            throw new ClusterAccessException("Failed to list " + kind + ": " + e.getMessage(), e);
        }
        log.debug("Listed {} {} objects in {} page(s)", descriptors.size(), kind, pages);
        return descriptors;
    }

    @Override
    public int countNamespaceChildren(String namespace) {
        try {
            int count = 0;
            count += client.pods().inNamespace(namespace).list().getItems().size();
            count += client.services().inNamespace(namespace).list().getItems().size();
            count += client.apps().deployments().inNamespace(namespace).list().getItems().size();
            count += client.apps().replicaSets().inNamespace(namespace).list().getItems().size();
            count += client.apps().statefulSets().inNamespace(namespace).list().getItems().size();
            count += client.apps().daemonSets().inNamespace(namespace).list().getItems().size();
            count += client.batch().v1().jobs().inNamespace(namespace).list().getItems().size();
            count += client.batch().v1().cronjobs().inNamespace(namespace).list().getItems().size();
            count += client.persistentVolumeClaims().inNamespace(namespace).list().getItems().size();
            log.debug("Namespace '{}' contains {} workload objects", namespace, count);
            return count;
        } catch (KubernetesClientException e) {
            throw new ClusterAccessException("Failed to inspect namespace " + namespace + ": " + e.getMessage(), e);
        }
    }

    @Override
    public Optional<ResourcePhase> currentPhase(ResourceDescriptor descriptor) {
        if (descriptor.getKind() == ResourceKind.PACKAGE_RELEASE) {
            return findRelease(descriptor).map(release -> ResourcePhase.fromApiValue(release.getStatus()));
        }
        try {
            HasMetadata current = resource(descriptor).get();
            if (current == null) {
                return Optional.empty();
            }
            return Optional.of(toDescriptor(descriptor.getKind(), current).getPhase());
        } catch (KubernetesClientException e) {
            throw new ClusterAccessException("Failed to read " + descriptor.getDisplayId() + ": " + e.getMessage(), e);
        }
    }

    @Override
    public DeleteOutcome delete(ResourceDescriptor descriptor, Duration timeout) {
        if (descriptor.getKind() == ResourceKind.PACKAGE_RELEASE) {
            return releaseClient.uninstall(descriptor.getName(), descriptor.getNamespace(), timeout);
        }
        try {
            List<StatusDetails> deleted = resource(descriptor).delete();
            if (deleted == null || deleted.isEmpty()) {
                log.debug("{} was already absent", descriptor.getDisplayId());
                return DeleteOutcome.NOT_FOUND;
            }
        } catch (KubernetesClientException e) {
            if (e.getCode() == HTTP_NOT_FOUND) {
                return DeleteOutcome.NOT_FOUND;
            }
            throw new ClusterAccessException("Delete of " + descriptor.getDisplayId() + " rejected: "
                    + e.getMessage(), e);
        }
        return awaitRemoval(descriptor, timeout) ? DeleteOutcome.REMOVED : DeleteOutcome.TIMED_OUT;
    }

    @Override
    public boolean awaitRemoval(ResourceDescriptor descriptor, Duration timeout) {
        if (descriptor.getKind() == ResourceKind.PACKAGE_RELEASE) {
            return findRelease(descriptor).isEmpty();
        }
        try {
            resource(descriptor).waitUntilCondition(Objects::isNull, timeout.toMillis(), TimeUnit.MILLISECONDS);
            return true;
        } catch (KubernetesClientTimeoutException e) {
            log.warn("{} still present after {}s", descriptor.getDisplayId(), timeout.getSeconds());
            return false;
        } catch (KubernetesClientException e) {
            throw new ClusterAccessException("Failed waiting for removal of " + descriptor.getDisplayId()
                    + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void clearFinalizers(ResourceDescriptor descriptor) {
        if (descriptor.getKind() == ResourceKind.PACKAGE_RELEASE) {
            throw new ClusterAccessException("Package releases have no finalizers: " + descriptor.getDisplayId());
        }
        try {
            resource(descriptor).patch(PatchContext.of(PatchType.JSON_MERGE), CLEAR_FINALIZERS_PATCH);
            log.warn("Cleared finalizers on {}", descriptor.getDisplayId());
        } catch (KubernetesClientException e) {
            if (e.getCode() == HTTP_NOT_FOUND) {
                log.info("{} disappeared before its finalizers were cleared", descriptor.getDisplayId());
                return;
            }
            throw new ClusterAccessException("Failed to clear finalizers on " + descriptor.getDisplayId()
                    + ": " + e.getMessage(), e);
        }
    }

    private Optional<HelmRelease> findRelease(ResourceDescriptor descriptor) {
        return releaseClient.listReleases().stream()
                .filter(r -> descriptor.getName().equals(r.getName())
                        && Objects.equals(descriptor.getNamespace(), r.getNamespace()))
                .findFirst();
    }

    private Resource<? extends HasMetadata> resource(ResourceDescriptor descriptor) {
        String namespace = descriptor.getNamespace();
        String name = descriptor.getName();
        switch (descriptor.getKind()) {
            case NAMESPACE:
                return client.namespaces().withName(name);
            case POD:
                return client.pods().inNamespace(namespace).withName(name);
            case JOB:
                return client.batch().v1().jobs().inNamespace(namespace).withName(name);
            case PERSISTENT_VOLUME_CLAIM:
                return client.persistentVolumeClaims().inNamespace(namespace).withName(name);
            case CUSTOM_RESOURCE_DEFINITION:
                return client.apiextensions().v1().customResourceDefinitions().withName(name);
            case CONFIG_MAP:
                return client.configMaps().inNamespace(namespace).withName(name);
            case SECRET:
                return client.secrets().inNamespace(namespace).withName(name);
            default:
                throw new IllegalArgumentException("Unsupported resource kind: " + descriptor.getKind());
        }
    }

    private ResourceDescriptor toDescriptor(ResourceKind kind, HasMetadata object) {
        switch (kind) {
            case NAMESPACE:
                return mapper.fromNamespace((Namespace) object);
            case POD:
                return mapper.fromPod((Pod) object);
            case JOB:
                return mapper.fromJob((Job) object);
            case PERSISTENT_VOLUME_CLAIM:
                return mapper.fromPersistentVolumeClaim((PersistentVolumeClaim) object);
            case CUSTOM_RESOURCE_DEFINITION:
                return mapper.fromCustomResourceDefinition((CustomResourceDefinition) object);
            case CONFIG_MAP:
                return mapper.fromConfigMap((ConfigMap) object);
            case SECRET:
                return mapper.fromSecret((Secret) object);
            default:
                throw new IllegalArgumentException("Unsupported resource kind: " + kind);
        }
    }
}
