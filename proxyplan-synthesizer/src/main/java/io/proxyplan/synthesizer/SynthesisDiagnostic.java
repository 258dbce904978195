/*
 * Copyright Proxyplan Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.proxyplan.synthesizer;

import java.util.Objects;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * A degraded result recorded during a synthesis pass. Synthesis carries on after each of these,
 * substituting an empty or default value.
 *
 * @param kind what degraded
 * @param resource key of the routing resource involved, absent when no single resource is to blame
 * @param message human readable description
 */
public record SynthesisDiagnostic(Kind kind,
                                  @Nullable String resource,
                                  String message) {

    public SynthesisDiagnostic {
        Objects.requireNonNull(kind);
        Objects.requireNonNull(message);
    }

    public enum Kind {
        ENDPOINTS_UNRESOLVED,
        SERVICE_NOT_FOUND,
        CERTIFICATE_FALLBACK,
        CERTIFICATE_EXPIRING,
        FIELD_CONFLICT,
        DUPLICATE_LOCATION,
        SNIPPETS_DROPPED,
        CANARY_SELF_REFERENCE,
        CANARY_ORPHANED,
        SERVER_NOT_FOUND,
        CUSTOM_DEFAULT_BACKEND_INVALID,
        SSL_PASSTHROUGH_IGNORED
    }
}
