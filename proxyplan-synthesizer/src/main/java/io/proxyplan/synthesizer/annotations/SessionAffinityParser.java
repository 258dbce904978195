/*
 * Copyright Proxyplan Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.proxyplan.synthesizer.annotations;

import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.fabric8.kubernetes.api.model.HasMetadata;

import io.proxyplan.api.policy.CookiePolicy;
import io.proxyplan.api.policy.SessionAffinityPolicy;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Reads the {@code affinity} annotations and, for cookie affinity, the {@code session-cookie-*} annotations.
 */
public class SessionAffinityParser implements AnnotationParser<SessionAffinityPolicy> {

    private static final Logger LOGGER = LoggerFactory.getLogger(SessionAffinityParser.class);

    static final String DEFAULT_COOKIE_NAME = "INGRESSCOOKIE";
    static final String DEFAULT_MODE = "balanced";
    static final String DEFAULT_CANARY_BEHAVIOR = "sticky";

    private static final Set<String> MODES = Set.of(DEFAULT_MODE, "persistent");
    private static final Set<String> CANARY_BEHAVIORS = Set.of(DEFAULT_CANARY_BEHAVIOR, SessionAffinityPolicy.LEGACY_CANARY_BEHAVIOR);

    private final AnnotationReader reader;

    public SessionAffinityParser(AnnotationReader reader) {
        this.reader = Objects.requireNonNull(reader);
    }

    @Override
    public SessionAffinityPolicy parse(HasMetadata resource) {
        Optional<String> type = reader.string(resource, "affinity");
        if (type.isEmpty()) {
            return SessionAffinityPolicy.NONE;
        }
        String mode = oneOf(resource, "affinity-mode", MODES, DEFAULT_MODE);
        String canaryBehavior = oneOf(resource, "affinity-canary-behavior", CANARY_BEHAVIORS, DEFAULT_CANARY_BEHAVIOR);
        CookiePolicy cookie = CookiePolicy.NONE;
        if (SessionAffinityPolicy.COOKIE.equals(type.get())) {
            cookie = cookie(resource);
        }
        else {
            LOGGER.debug("Affinity type {} is not supported, no affinity cookie is configured", type.get());
        }
        return new SessionAffinityPolicy(type.get(), mode, canaryBehavior, cookie);
    }

    private CookiePolicy cookie(HasMetadata resource) {
        return new CookiePolicy(
                reader.string(resource, "session-cookie-name").orElse(DEFAULT_COOKIE_NAME),
                seconds(resource, "session-cookie-expires"),
                seconds(resource, "session-cookie-max-age"),
                reader.string(resource, "session-cookie-secure").orElse(null),
                reader.string(resource, "session-cookie-path").orElse(null),
                reader.string(resource, "session-cookie-samesite").orElse(null),
                reader.bool(resource, "session-cookie-conditional-samesite-none").orElse(false),
                reader.bool(resource, "session-cookie-change-on-failure").orElse(false));
    }

    private @Nullable String seconds(HasMetadata resource, String name) {
        Optional<String> value = reader.string(resource, name);
        if (value.isPresent() && !value.get().chars().allMatch(Character::isDigit)) {
            LOGGER.warn("{} must be a number of seconds, ignoring '{}'", reader.key(name), value.get());
            return null;
        }
        return value.orElse(null);
    }

    private String oneOf(HasMetadata resource, String name, Set<String> allowed, String defaultValue) {
        Optional<String> value = reader.string(resource, name);
        if (value.isPresent() && !allowed.contains(value.get())) {
            LOGGER.warn("{} must be one of {}, using '{}' instead of '{}'", reader.key(name), allowed.stream().sorted().toList(), defaultValue, value.get());
            return defaultValue;
        }
        return value.orElse(defaultValue);
    }
}
