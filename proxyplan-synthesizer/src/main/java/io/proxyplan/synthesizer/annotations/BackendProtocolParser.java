/*
 * Copyright Proxyplan Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.proxyplan.synthesizer.annotations;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.fabric8.kubernetes.api.model.HasMetadata;

import io.proxyplan.api.policy.AnnotationBundle;

public class BackendProtocolParser implements AnnotationParser<String> {

    private static final Logger LOGGER = LoggerFactory.getLogger(BackendProtocolParser.class);

    private static final Set<String> PROTOCOLS = Set.of("AUTO_HTTP", "HTTP", "HTTPS", "AJP", "GRPC", "GRPCS", "FCGI");

    private final AnnotationReader reader;

    public BackendProtocolParser(AnnotationReader reader) {
        this.reader = Objects.requireNonNull(reader);
    }

    @Override
    public String parse(HasMetadata resource) {
        Optional<String> protocol = reader.string(resource, "backend-protocol").map(value -> value.toUpperCase(Locale.ROOT));
        if (protocol.isEmpty()) {
            return AnnotationBundle.DEFAULT_BACKEND_PROTOCOL;
        }
        if (!PROTOCOLS.contains(protocol.get())) {
            LOGGER.warn("Protocol {} is not a valid value for the backend-protocol annotation. Using {} as protocol", protocol.get(),
                    AnnotationBundle.DEFAULT_BACKEND_PROTOCOL);
            return AnnotationBundle.DEFAULT_BACKEND_PROTOCOL;
        }
        return protocol.get();
    }
}
