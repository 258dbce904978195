/*
 * Copyright Proxyplan Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.proxyplan.synthesizer.annotations;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.Secret;

import io.proxyplan.api.policy.AuthPolicy;
import io.proxyplan.synthesizer.spi.ResourceStore;

/**
 * Reads the basic/digest authentication annotations. Once {@code auth-type} is set, any problem
 * with the remaining annotations or the referenced secret denies access to the resource's locations.
 */
public class AuthParser implements AnnotationParser<AuthPolicy> {

    static final String AUTH_FILE = "auth-file";
    static final String AUTH_MAP = "auth-map";
    static final String AUTH_FILE_KEY = "auth";

    private static final Set<String> TYPES = Set.of("basic", "digest");

    private final AnnotationReader reader;
    private final ResourceStore store;

    public AuthParser(AnnotationReader reader, ResourceStore store) {
        this.reader = Objects.requireNonNull(reader);
        this.store = Objects.requireNonNull(store);
    }

    @Override
    public AuthPolicy parse(HasMetadata resource) {
        Optional<String> type = reader.string(resource, "auth-type");
        if (type.isEmpty()) {
            return AuthPolicy.NONE;
        }
        if (!TYPES.contains(type.get())) {
            throw new LocationDeniedException("invalid authentication type");
        }
        String secretType = reader.string(resource, "auth-secret-type").orElse(AUTH_FILE);
        String secretName = reader.string(resource, "auth-secret")
                .orElseThrow(() -> new LocationDeniedException("error reading secret name from annotation " + reader.key("auth-secret")));
        String secretKey = ResourceKeys.qualify(secretName, resource);
        Secret secret = store.getSecret(secretKey)
                .orElseThrow(() -> new LocationDeniedException("unexpected error reading secret " + secretKey));

        switch (secretType) {
            case AUTH_FILE -> {
                Map<String, String> data = Optional.ofNullable(secret.getData()).orElse(Map.of());
                if (!data.containsKey(AUTH_FILE_KEY)) {
                    throw new LocationDeniedException("the secret " + secretKey + " does not contain a key with value " + AUTH_FILE_KEY);
                }
            }
            case AUTH_MAP -> {
                // any key/value pair of the secret is a user and its password
            }
            default -> throw new LocationDeniedException("invalid auth-secret-type in annotation, must be '" + AUTH_FILE + "' or '" + AUTH_MAP + "'");
        }
        return new AuthPolicy(type.get(), reader.string(resource, "auth-realm").orElse(null), secretKey, secretType, true);
    }
}
