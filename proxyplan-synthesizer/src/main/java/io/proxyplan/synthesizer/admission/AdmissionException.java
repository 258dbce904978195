/*
 * Copyright Proxyplan Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.proxyplan.synthesizer.admission;

import java.util.Objects;

/**
 * Thrown when a routing resource is refused admission.
 */
public class AdmissionException extends Exception {

    public enum Reason {
        /** The resource breaks a cluster wide annotation or catch-all policy. */
        REJECTED,
        /** A host and path of the resource is already served by another resource. */
        CONFLICT,
        /** The configuration including the resource could not be rendered. */
        RENDER_FAILURE,
        /** The rendered configuration failed the syntax check. */
        CHECK_FAILURE
    }

    private final Reason reason;

    public AdmissionException(Reason reason, String message) {
        super(message);
        this.reason = Objects.requireNonNull(reason);
    }

    public AdmissionException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = Objects.requireNonNull(reason);
    }

    public Reason getReason() {
        return reason;
    }
}
