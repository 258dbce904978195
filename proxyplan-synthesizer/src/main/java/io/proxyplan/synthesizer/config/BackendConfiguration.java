/*
 * Copyright Proxyplan Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.proxyplan.synthesizer.config;

import java.util.Arrays;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import io.proxyplan.api.policy.ProxyPolicy;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Cluster-wide policy applied to every backend, also known as the cluster configuration.
 * Its checksum is carried by every synthesised {@link io.proxyplan.api.Configuration}.
 *
 * @param allowSnippetAnnotations true to honour free-form snippet annotations
 * @param loadBalancing load balancing algorithm of backends whose resource does not choose one
 * @param annotationValueWordBlocklist comma separated words no annotation value may contain
 * @param globalRateLimitMemcachedHost host of the store backing global rate limiting, absent if unavailable
 * @param proxySslLocationOnly true to apply proxy SSL annotations to locations only, never to servers
 * @param enableAccessLogForDefaultBackend true to log requests served by the default backend
 * @param proxy default proxy connection settings
 */
@JsonPropertyOrder({ "allowSnippetAnnotations", "loadBalancing", "annotationValueWordBlocklist", "globalRateLimitMemcachedHost", "proxySslLocationOnly",
        "enableAccessLogForDefaultBackend", "proxy" })
public record BackendConfiguration(boolean allowSnippetAnnotations,
                                   @Nullable String loadBalancing,
                                   @Nullable String annotationValueWordBlocklist,
                                   @Nullable String globalRateLimitMemcachedHost,
                                   boolean proxySslLocationOnly,
                                   boolean enableAccessLogForDefaultBackend,
                                   @Nullable ProxyPolicy proxy) {

    public static final String DEFAULT_LOAD_BALANCING = "round_robin";

    public static final BackendConfiguration DEFAULT = new BackendConfiguration(false, null, null, null, false, false, null);

    public BackendConfiguration {
        if (loadBalancing == null || loadBalancing.isBlank()) {
            loadBalancing = DEFAULT_LOAD_BALANCING;
        }
        if (proxy == null) {
            proxy = ProxyPolicy.DEFAULTS;
        }
    }

    /**
     * @return the non-empty, trimmed words of {@link #annotationValueWordBlocklist()}
     */
    public List<String> blockedAnnotationWords() {
        if (annotationValueWordBlocklist == null) {
            return List.of();
        }
        return Arrays.stream(annotationValueWordBlocklist.split(","))
                .map(String::trim)
                .filter(word -> !word.isEmpty())
                .toList();
    }

    public boolean hasGlobalRateLimitStore() {
        return globalRateLimitMemcachedHost != null && !globalRateLimitMemcachedHost.isBlank();
    }
}
