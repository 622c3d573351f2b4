package com.mlops.cleanup.registry;

import com.mlops.cleanup.config.BaselineConfigException;
import com.mlops.cleanup.config.CleanupConfig;
import com.mlops.cleanup.config.ConfigLoader;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.URISyntaxException;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BaselineRegistryTest {

    private BaselineRegistry registry;

    @BeforeEach
    void setUp() throws BaselineConfigException {
        registry = BaselineRegistry.fromConfig(new ConfigLoader().loadDefault().getBaseline());
    }

    private static String fixture(String name) throws URISyntaxException {
        return Paths.get(BaselineRegistryTest.class.getResource("/config/" + name).toURI()).toString();
    }

    @Test
    @DisplayName("Default baseline recognizes platform namespaces and releases")
    void testDefaultMembership() {
        assertTrue(registry.isSystemNamespace("kube-system"));
        assertFalse(registry.isSystemNamespace("default"));
        assertTrue(registry.isManagedNamespace("data-plane"));
        assertTrue(registry.isManagedNamespace("flux-system"));
        assertFalse(registry.isManagedNamespace("leftover-test"));
        assertTrue(registry.isManagedRelease("strimzi-kafka-operator"));
        assertFalse(registry.isManagedRelease("my-experiment"));
        assertFalse(registry.isManagedNamespace(null));
    }

    @Test
    @DisplayName("Operator CRDs match managed patterns, unknown ones do not")
    void testCrdPatterns() {
        assertTrue(registry.matchesManagedCRDPattern("kafkas.kafka.strimzi.io"));
        assertTrue(registry.matchesManagedCRDPattern("certificates.cert-manager.io"));
        assertTrue(registry.matchesManagedCRDPattern("sparkapplications.sparkoperator.k8s.io"));
        assertTrue(registry.matchesManagedCRDPattern("flinkdeployments.flink.apache.org"));
        assertTrue(registry.matchesManagedCRDPattern("prometheuses.monitoring.coreos.com"));
        assertTrue(registry.matchesManagedCRDPattern("kustomizations.kustomize.toolkit.fluxcd.io"));
        assertTrue(registry.matchesManagedCRDPattern("tenants.minio.min.io"));
        assertFalse(registry.matchesManagedCRDPattern("widgets.example.com"));
    }

    @Test
    @DisplayName("Disposable and protected names")
    void testDisposableNames() {
        assertTrue(registry.isDisposableName("temp-cache-config"));
        assertTrue(registry.isDisposableName("test-fixtures"));
        assertTrue(registry.isDisposableName("ml-demo-data"));
        assertTrue(registry.isDisposableName("demo-scripts"));
        assertFalse(registry.isDisposableName("spark-defaults"));
        assertTrue(registry.isProtectedName("kube-root-ca.crt"));
    }

    @Test
    @DisplayName("Registry sets are read only")
    void testImmutable() {
        assertThrows(UnsupportedOperationException.class, () -> registry.getManagedNamespaces().add("rogue"));
    }

    @Test
    @DisplayName("Duplicate namespace in config aborts construction")
    void testDuplicateIdentifier() throws Exception {
        CleanupConfig config = new ConfigLoader().load(fixture("duplicate-namespace.yaml"));

        BaselineConfigException e = assertThrows(BaselineConfigException.class,
                () -> BaselineRegistry.fromConfig(config.getBaseline()));
        assertTrue(e.getMessage().contains("data-plane"));
    }

    @Test
    @DisplayName("Wildcard-only pattern aborts construction")
    void testWildcardOnlyPattern() throws Exception {
        CleanupConfig config = new ConfigLoader().load(fixture("wildcard-only-pattern.yaml"));

        assertThrows(BaselineConfigException.class, () -> BaselineRegistry.fromConfig(config.getBaseline()));
    }

    @Test
    @DisplayName("Empty identifier aborts construction")
    void testEmptyIdentifier() {
        CleanupConfig.Baseline baseline = new CleanupConfig.Baseline();
        List<String> releases = new ArrayList<>();
        releases.add("cert-manager");
        releases.add(" ");
        baseline.setManagedReleases(releases);

        assertThrows(BaselineConfigException.class, () -> BaselineRegistry.fromConfig(baseline));
    }

    @Test
    @DisplayName("Duplicate pattern aborts construction")
    void testDuplicatePattern() {
        CleanupConfig.Baseline baseline = new CleanupConfig.Baseline();
        baseline.setManagedCrdPatterns(List.of("*spark*", "*spark*"));

        assertThrows(BaselineConfigException.class, () -> BaselineRegistry.fromConfig(baseline));
    }
}
