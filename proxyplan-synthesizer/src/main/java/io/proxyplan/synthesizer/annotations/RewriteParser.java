/*
 * Copyright Proxyplan Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.proxyplan.synthesizer.annotations;

import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.fabric8.kubernetes.api.model.HasMetadata;

import io.proxyplan.api.policy.RewritePolicy;

public class RewriteParser implements AnnotationParser<RewritePolicy> {

    private static final Logger LOGGER = LoggerFactory.getLogger(RewriteParser.class);

    private final AnnotationReader reader;

    public RewriteParser(AnnotationReader reader) {
        this.reader = Objects.requireNonNull(reader);
    }

    @Override
    public RewritePolicy parse(HasMetadata resource) {
        Optional<String> appRoot = reader.string(resource, "app-root");
        if (appRoot.isPresent() && !appRoot.get().startsWith("/")) {
            LOGGER.warn("{} must be an absolute path, ignoring '{}'", reader.key("app-root"), appRoot.get());
            appRoot = Optional.empty();
        }
        return new RewritePolicy(
                reader.string(resource, "rewrite-target").orElse(null),
                reader.bool(resource, "use-regex").orElse(false),
                reader.bool(resource, "ssl-redirect").orElse(RewritePolicy.NONE.sslRedirect()),
                reader.bool(resource, "force-ssl-redirect").orElse(false),
                appRoot.orElse(null));
    }
}
