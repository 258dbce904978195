/*
 * Copyright Proxyplan Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.proxyplan.synthesizer.config;

import java.util.Set;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import io.proxyplan.api.Names;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Settings of the controller hosting the synthesizer.
 *
 * @param watchNamespace the single namespace whose resources are admitted, absent to watch every namespace
 * @param disableCatchAll true to forbid resources from declaring a default backend
 * @param disableFullValidationTest true to validate a candidate resource on its own rather than with every existing resource
 * @param annotationsPrefix prefix of the annotation keys read from routing resources
 * @param defaultBackendService {@code namespace/name} of the service backing the default upstream
 * @param defaultPathType path type given to paths that declare none
 * @param tcpServicesConfigMap {@code namespace/name} of the config map exposing TCP services
 * @param udpServicesConfigMap {@code namespace/name} of the config map exposing UDP services
 */
@JsonPropertyOrder({ "watchNamespace", "disableCatchAll", "disableFullValidationTest", "annotationsPrefix", "defaultBackendService", "defaultPathType",
        "tcpServicesConfigMap", "udpServicesConfigMap" })
public record ControllerConfig(@Nullable String watchNamespace,
                               boolean disableCatchAll,
                               boolean disableFullValidationTest,
                               @Nullable String annotationsPrefix,
                               @Nullable String defaultBackendService,
                               @Nullable String defaultPathType,
                               @Nullable String tcpServicesConfigMap,
                               @Nullable String udpServicesConfigMap) {

    public static final String DEFAULT_ANNOTATIONS_PREFIX = "nginx.ingress.kubernetes.io";

    private static final Set<String> PATH_TYPES = Set.of(Names.PATH_TYPE_PREFIX, Names.PATH_TYPE_EXACT, Names.PATH_TYPE_IMPLEMENTATION_SPECIFIC);

    public static final ControllerConfig DEFAULT = new ControllerConfig(null, false, false, null, null, null, null, null);

    public ControllerConfig {
        if (annotationsPrefix == null || annotationsPrefix.isBlank()) {
            annotationsPrefix = DEFAULT_ANNOTATIONS_PREFIX;
        }
        if (defaultPathType == null) {
            defaultPathType = Names.PATH_TYPE_PREFIX;
        }
        else if (!PATH_TYPES.contains(defaultPathType)) {
            throw new IllegalConfigurationException("'defaultPathType' must be one of " + PATH_TYPES.stream().sorted().toList() + ", was: " + defaultPathType);
        }
        checkNamespacedName("defaultBackendService", defaultBackendService);
        checkNamespacedName("tcpServicesConfigMap", tcpServicesConfigMap);
        checkNamespacedName("udpServicesConfigMap", udpServicesConfigMap);
    }

    /**
     * @return true if resources outside {@link #watchNamespace()} are ignored
     */
    public boolean watchesSingleNamespace() {
        return watchNamespace != null && !watchNamespace.isEmpty();
    }

    /**
     * @return true if annotation keys use a prefix other than {@value #DEFAULT_ANNOTATIONS_PREFIX}
     */
    public boolean hasCustomAnnotationsPrefix() {
        return !DEFAULT_ANNOTATIONS_PREFIX.equals(annotationsPrefix);
    }

    private static void checkNamespacedName(String property, @Nullable String value) {
        if (value == null || value.isEmpty()) {
            return;
        }
        int separator = value.indexOf('/');
        if (separator <= 0 || separator == value.length() - 1 || value.indexOf('/', separator + 1) >= 0) {
            throw new IllegalConfigurationException("'" + property + "' must be of the form namespace/name, was: " + value);
        }
    }
}
