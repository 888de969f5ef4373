package com.project.hatchmark.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Contents of {@code deployments/<network>.json}, written when the registry package is published.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class DeploymentMetadata {

    @JsonProperty("packageId")
    private String packageId;

    @JsonProperty("network")
    private String network;

    @JsonProperty("rpcUrl")
    private String rpcUrl;

    @JsonProperty("publishedAt")
    private String publishedAt;

    public String packageId() {
        return packageId;
    }

    public String network() {
        return network;
    }

    public String rpcUrl() {
        return rpcUrl;
    }

    public String publishedAt() {
        return publishedAt;
    }
}
