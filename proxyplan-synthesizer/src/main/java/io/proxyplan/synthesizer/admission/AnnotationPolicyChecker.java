/*
 * Copyright Proxyplan Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.proxyplan.synthesizer.admission;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

import io.fabric8.kubernetes.api.model.networking.v1.Ingress;
import io.fabric8.kubernetes.api.model.networking.v1.IngressSpec;

import io.proxyplan.synthesizer.admission.AdmissionException.Reason;
import io.proxyplan.synthesizer.config.BackendConfiguration;
import io.proxyplan.synthesizer.config.ControllerConfig;

/**
 * Enforces the cluster wide policies on the annotations and catch-all use of a candidate resource.
 */
class AnnotationPolicyChecker {

    private static final String SNIPPET_SUFFIX = "-snippet";
    private static final String GLOBAL_RATE_LIMIT = "global-rate-limit";

    private final ControllerConfig controller;

    AnnotationPolicyChecker(ControllerConfig controller) {
        this.controller = Objects.requireNonNull(controller);
    }

    void check(Ingress candidate, BackendConfiguration cluster) throws AdmissionException {
        if (controller.disableCatchAll() && Optional.ofNullable(candidate.getSpec()).map(IngressSpec::getDefaultBackend).isPresent()) {
            throw new AdmissionException(Reason.REJECTED,
                    "This deployment is trying to create a catch-all resource while catch-all resources are disabled. Remove '.spec.defaultBackend' "
                            + "or allow catch-all resources");
        }
        String prefix = controller.annotationsPrefix() + "/";
        Map<String, String> annotations = new TreeMap<>(Optional.ofNullable(candidate.getMetadata().getAnnotations()).orElse(Map.of()));
        for (Map.Entry<String, String> annotation : annotations.entrySet()) {
            String key = annotation.getKey();
            String value = Objects.requireNonNullElse(annotation.getValue(), "");
            if (controller.hasCustomAnnotationsPrefix() && key.startsWith(ControllerConfig.DEFAULT_ANNOTATIONS_PREFIX + "/")) {
                throw new AdmissionException(Reason.REJECTED, "This deployment has a custom annotation prefix defined. Use '" + controller.annotationsPrefix()
                        + "' instead of '" + ControllerConfig.DEFAULT_ANNOTATIONS_PREFIX + "'");
            }
            if (key.startsWith(prefix)) {
                for (String word : cluster.blockedAnnotationWords()) {
                    if (value.contains(word)) {
                        throw new AdmissionException(Reason.REJECTED, key + " annotation contains invalid word " + word);
                    }
                }
            }
            if (!cluster.allowSnippetAnnotations() && key.endsWith(SNIPPET_SUFFIX)) {
                throw new AdmissionException(Reason.REJECTED, key + " annotation cannot be used. Snippet directives are disabled by the administrator");
            }
            if (!cluster.hasGlobalRateLimitStore() && key.startsWith(prefix + GLOBAL_RATE_LIMIT)) {
                throw new AdmissionException(Reason.REJECTED,
                        "'globalRateLimitMemcachedHost' is not configured, the " + key + " annotation cannot be enforced");
            }
        }
    }
}
