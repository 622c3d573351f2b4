package com.mlops.cleanup.scanner;

import com.mlops.cleanup.config.NameMatcher;
import com.mlops.cleanup.kubernetes.ClusterAccessException;
import com.mlops.cleanup.kubernetes.ResourceLister;
import com.mlops.cleanup.model.ResourceDescriptor;
import com.mlops.cleanup.model.ResourceKind;
import com.mlops.cleanup.model.ScanResult;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Builds the inventory of one cluster. Read only.
 */
@Slf4j
public class InventoryScanner {

    public static final List<ResourceKind> ALL_KINDS = List.of(ResourceKind.values());

    private final ResourceLister lister;
    private final int scanWorkers;

    public InventoryScanner(ResourceLister lister, int scanWorkers) {
        this.lister = lister;
        this.scanWorkers = Math.max(1, scanWorkers);
    }

    /**
     * Scan every kind, tolerating failures of individual kinds.
     *
     * @param kinds           kinds to list
     * @param namespaceFilter optional filter restricting the scan to matching namespaces; cluster-scoped
     *                        CRDs are skipped while a filter is active
     * @throws ClusterAccessException if the cluster is unreachable or no kind could be listed
     */
    public ScanResult scan(List<ResourceKind> kinds, NameMatcher namespaceFilter) {
        lister.verifyConnectivity();

        List<ResourceKind> effectiveKinds = new ArrayList<>();
        for (ResourceKind kind : kinds) {
            if (namespaceFilter != null && kind == ResourceKind.CUSTOM_RESOURCE_DEFINITION) {
                log.info("Skipping {} while namespace filter '{}' is active", kind, namespaceFilter);
                continue;
            }
            effectiveKinds.add(kind);
        }
        if (effectiveKinds.isEmpty()) {
            return new ScanResult(List.of(), List.of());
        }

        List<ResourceDescriptor> descriptors = new ArrayList<>();
        List<ResourceKind> failedKinds = new ArrayList<>();

        ExecutorService executor = Executors.newFixedThreadPool(Math.min(scanWorkers, effectiveKinds.size()));
        try {
            Map<ResourceKind, Future<List<ResourceDescriptor>>> futures = new LinkedHashMap<>();
            for (ResourceKind kind : effectiveKinds) {
                futures.put(kind, executor.submit(() -> lister.list(kind)));
            }

            for (Map.Entry<ResourceKind, Future<List<ResourceDescriptor>>> entry : futures.entrySet()) {
                ResourceKind kind = entry.getKey();
                try {
                    List<ResourceDescriptor> listed = entry.getValue().get();
                    int kept = 0;
                    for (ResourceDescriptor descriptor : listed) {
                        if (inScope(descriptor, namespaceFilter)) {
                            descriptors.add(descriptor);
                            kept++;
                        }
                    }
                    log.info("Scanned {} {} objects ({} in scope)", listed.size(), kind, kept);
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause() != null ? e.getCause() : e;
                    log.warn("Could not list {}; treating it as empty: {}", kind, cause.getMessage());
                    log.debug("Listing failure for {}", kind, cause);
                    failedKinds.add(kind);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ClusterAccessException("Inventory scan interrupted", e);
        } finally {
            executor.shutdownNow();
        }

        if (failedKinds.size() == effectiveKinds.size()) {
            throw new ClusterAccessException("Inventory scan failed for every kind: " + failedKinds);
        }

        List<ResourceDescriptor> withHints = new ArrayList<>(descriptors.size());
        for (ResourceDescriptor descriptor : descriptors) {
            withHints.add(descriptor.getKind() == ResourceKind.NAMESPACE ? withChildCount(descriptor) : descriptor);
        }

        log.info("Inventory complete: {} objects, {} kinds failed", withHints.size(), failedKinds.size());
        return new ScanResult(withHints, failedKinds);
    }

    /**
     * Secondary "is this namespace empty" query. A failed count leaves the hint unset,
     * which the classifier treats as unsafe to delete.
     */
    private ResourceDescriptor withChildCount(ResourceDescriptor namespace) {
        try {
            int children = lister.countNamespaceChildren(namespace.getName());
            return namespace.toBuilder()
                    .ownerHints(namespace.getOwnerHints().toBuilder().childResourceCount(children).build())
                    .build();
        } catch (ClusterAccessException e) {
            log.warn("Could not count resources in namespace '{}': {}", namespace.getName(), e.getMessage());
            return namespace;
        }
    }

    private static boolean inScope(ResourceDescriptor descriptor, NameMatcher namespaceFilter) {
        if (namespaceFilter == null) {
            return true;
        }
        if (!descriptor.getKind().isNamespaced()) {
            return descriptor.getKind() == ResourceKind.NAMESPACE && namespaceFilter.matches(descriptor.getName());
        }
        return descriptor.getNamespace() != null && namespaceFilter.matches(descriptor.getNamespace());
    }
}
