package com.mlops.cleanup.helm;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One entry of {@code helm list -o json}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class HelmRelease {

    @JsonProperty("name")
    private String name;

    @JsonProperty("namespace")
    private String namespace;

    @JsonProperty("revision")
    private String revision;

    /**
     * Go time format, e.g. "2024-05-01 10:15:30.123456789 +0000 UTC".
     */
    @JsonProperty("updated")
    private String updated;

    /**
     * deployed, failed, pending-install, uninstalling, ...
     */
    @JsonProperty("status")
    private String status;

    @JsonProperty("chart")
    private String chart;

    @JsonProperty("app_version")
    private String appVersion;
}
