package com.mlops.cleanup.registry;

import com.mlops.cleanup.config.BaselineConfigException;
import com.mlops.cleanup.config.CleanupConfig;
import com.mlops.cleanup.config.NameMatcher;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Immutable description of what the platform expects to exist.
 * Built once per run; construction fails as a whole on any malformed entry.
 */
@Slf4j
public final class BaselineRegistry {

    private final Set<String> systemNamespaces;
    private final Set<String> managedNamespaces;
    private final Set<String> managedReleases;
    private final List<NameMatcher> managedCrdPatterns;
    private final List<NameMatcher> disposableNamePatterns;
    private final Set<String> protectedNames;

    private BaselineRegistry(Set<String> systemNamespaces,
                             Set<String> managedNamespaces,
                             Set<String> managedReleases,
                             List<NameMatcher> managedCrdPatterns,
                             List<NameMatcher> disposableNamePatterns,
                             Set<String> protectedNames) {
        this.systemNamespaces = systemNamespaces;
        this.managedNamespaces = managedNamespaces;
        this.managedReleases = managedReleases;
        this.managedCrdPatterns = managedCrdPatterns;
        this.disposableNamePatterns = disposableNamePatterns;
        this.protectedNames = protectedNames;
    }

    /**
     * Validate the baseline section and compile its patterns.
     *
     * @throws BaselineConfigException on empty or duplicate identifiers and invalid patterns
     */
    public static BaselineRegistry fromConfig(CleanupConfig.Baseline baseline) throws BaselineConfigException {
        if (baseline == null) {
            throw new BaselineConfigException("Baseline section is missing");
        }
        BaselineRegistry registry = new BaselineRegistry(
                identifiers("systemNamespaces", baseline.getSystemNamespaces()),
                identifiers("managedNamespaces", baseline.getManagedNamespaces()),
                identifiers("managedReleases", baseline.getManagedReleases()),
                patterns("managedCrdPatterns", baseline.getManagedCrdPatterns()),
                patterns("disposableNamePatterns", baseline.getDisposableNamePatterns()),
                identifiers("protectedNames", baseline.getProtectedNames()));

        log.info("Baseline registry loaded: {} system namespaces, {} managed namespaces, {} managed releases, "
                        + "{} CRD patterns, {} disposable patterns",
                registry.systemNamespaces.size(), registry.managedNamespaces.size(),
                registry.managedReleases.size(), registry.managedCrdPatterns.size(),
                registry.disposableNamePatterns.size());
        return registry;
    }

    private static Set<String> identifiers(String field, List<String> values) throws BaselineConfigException {
        Set<String> result = new LinkedHashSet<>();
        if (values == null) {
            return Collections.unmodifiableSet(result);
        }
        for (String value : values) {
            if (value == null || value.isBlank()) {
                throw new BaselineConfigException("Empty identifier in baseline." + field);
            }
            if (!result.add(value.trim())) {
                throw new BaselineConfigException("Duplicate identifier '" + value + "' in baseline." + field);
            }
        }
        return Collections.unmodifiableSet(result);
    }

    private static List<NameMatcher> patterns(String field, List<String> values) throws BaselineConfigException {
        List<NameMatcher> result = new ArrayList<>();
        if (values == null) {
            return Collections.unmodifiableList(result);
        }
        for (String value : values) {
            NameMatcher matcher;
            try {
                matcher = NameMatcher.compile(value);
            } catch (IllegalArgumentException e) {
                throw new BaselineConfigException("baseline." + field + ": " + e.getMessage(), e);
            }
            if (result.contains(matcher)) {
                throw new BaselineConfigException("Duplicate pattern '" + value + "' in baseline." + field);
            }
            result.add(matcher);
        }
        return Collections.unmodifiableList(result);
    }

    public boolean isSystemNamespace(String name) {
        return name != null && systemNamespaces.contains(name);
    }

    public boolean isManagedNamespace(String name) {
        return name != null && managedNamespaces.contains(name);
    }

    public boolean isManagedRelease(String name) {
        return name != null && managedReleases.contains(name);
    }

    public boolean matchesManagedCRDPattern(String name) {
        return matchesAny(managedCrdPatterns, name);
    }

    public boolean isDisposableName(String name) {
        return matchesAny(disposableNamePatterns, name);
    }

    public boolean isProtectedName(String name) {
        return name != null && protectedNames.contains(name);
    }

    private static boolean matchesAny(List<NameMatcher> matchers, String name) {
        for (NameMatcher matcher : matchers) {
            if (matcher.matches(name)) {
                return true;
            }
        }
        return false;
    }

    public Set<String> getSystemNamespaces() {
        return systemNamespaces;
    }

    public Set<String> getManagedNamespaces() {
        return managedNamespaces;
    }

    public Set<String> getManagedReleases() {
        return managedReleases;
    }
}
