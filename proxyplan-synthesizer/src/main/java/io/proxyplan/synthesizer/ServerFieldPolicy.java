/*
 * Copyright Proxyplan Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.proxyplan.synthesizer;

/**
 * How a server level field is resolved when several routing resources for the same host offer a value for it.
 */
public enum ServerFieldPolicy {

    ALIASES(Resolution.FIRST_WINS),
    SERVER_SNIPPET(Resolution.FIRST_WINS),
    SSL_CIPHERS(Resolution.FIRST_WINS),
    SSL_PREFER_SERVER_CIPHERS(Resolution.FIRST_WINS),
    CERTIFICATE(Resolution.FIRST_WINS),
    CERTIFICATE_AUTH(Resolution.FIRST_WINS),
    AUTH_TLS_ERROR(Resolution.FIRST_WINS),
    PROXY_SSL(Resolution.FIRST_WINS);

    public enum Resolution {
        /** The first resource to offer a value keeps it; later values are dropped. */
        FIRST_WINS,
        /** Every resource offering a value replaces the previous one. */
        LAST_WINS
    }

    private final Resolution resolution;

    ServerFieldPolicy(Resolution resolution) {
        this.resolution = resolution;
    }

    public Resolution resolution() {
        return resolution;
    }

    /**
     * @param serverHasValue whether the server already carries a value for this field
     * @return true if an offered value is to be stored on the server
     */
    public boolean accepts(boolean serverHasValue) {
        return resolution == Resolution.LAST_WINS || !serverHasValue;
    }
}
