package com.mlops.cleanup.kubernetes;

import io.fabric8.kubernetes.api.model.NamedContext;
import io.fabric8.kubernetes.client.Config;
import io.fabric8.kubernetes.client.ConfigBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientBuilder;
import io.fabric8.kubernetes.client.internal.KubeConfigUtils;
import lombok.extern.slf4j.Slf4j;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Creates and owns the Kubernetes client for the one cluster a run operates on.
 */
@Slf4j
public class KubernetesClusterManager implements AutoCloseable {

    private static final int CONNECTION_TIMEOUT_MS = 10000;
    private static final int REQUEST_TIMEOUT_MS = 30000;

    private KubernetesClient client;

    /**
     * Get a client for a kubeconfig context. {@code null} or "current" selects the current context.
     * An unknown context is an error; there is no fallback to another context.
     *
     * @throws ClusterAccessException if the context does not exist or kubeconfig cannot be read
     */
    public synchronized KubernetesClient getClient(String contextName) {
        if (client != null) {
            return client;
        }
        Config config;
        if (contextName == null || contextName.equals("current")) {
            config = new ConfigBuilder()
                    .withConnectionTimeout(CONNECTION_TIMEOUT_MS)
                    .withRequestTimeout(REQUEST_TIMEOUT_MS)
                    .build();
            log.info("Initialized Kubernetes client from current context with {}s connection timeout",
                    CONNECTION_TIMEOUT_MS / 1000);
        } else {
            requireContext(contextName);
            config = Config.autoConfigure(contextName);
            config.setConnectionTimeout(CONNECTION_TIMEOUT_MS);
            config.setRequestTimeout(REQUEST_TIMEOUT_MS);
            log.info("Initialized Kubernetes client for context '{}'", contextName);
        }
        client = new KubernetesClientBuilder().withConfig(config).build();
        return client;
    }

    private void requireContext(String contextName) {
        File kubeConfigFile = getKubeConfigFile();
        io.fabric8.kubernetes.api.model.Config kubeConfig;
        try {
            kubeConfig = KubeConfigUtils.parseConfig(kubeConfigFile);
        } catch (IOException e) {
            throw new ClusterAccessException("Cannot read kubeconfig " + kubeConfigFile + ": " + e.getMessage(), e);
        }
        List<String> availableContexts = new ArrayList<>();
        if (kubeConfig.getContexts() != null) {
            for (NamedContext ctx : kubeConfig.getContexts()) {
                if (ctx.getName().equals(contextName)) {
                    return;
                }
                availableContexts.add(ctx.getName());
            }
        }
        log.error("Context '{}' not found in kubeconfig. Available contexts: {}", contextName, availableContexts);
        throw new ClusterAccessException("Context '" + contextName + "' not found in kubeconfig "
                + kubeConfigFile + " (available: " + availableContexts + ")");
    }

    /**
     * Get the kubeconfig file location
     */
    private File getKubeConfigFile() {
        String kubeConfigPath = System.getenv("KUBECONFIG");
        if (kubeConfigPath == null || kubeConfigPath.isEmpty()) {
            kubeConfigPath = System.getProperty("user.home") + "/.kube/config";
        } else if (kubeConfigPath.contains(File.pathSeparator)) {
            kubeConfigPath = kubeConfigPath.split(File.pathSeparator)[0];
        }
        return new File(kubeConfigPath);
    }

    @Override
    public synchronized void close() {
        if (client == null) {
            return;
        }
        try {
            client.close();
            log.info("Closed Kubernetes client");
        } catch (Exception e) {
            log.warn("Error closing client: {}", e.getMessage());
        }
        client = null;
    }
}
