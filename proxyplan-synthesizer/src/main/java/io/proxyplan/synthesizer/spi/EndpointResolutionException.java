/*
 * Copyright Proxyplan Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.proxyplan.synthesizer.spi;

/**
 * Thrown when the endpoints of a service cannot be determined.
 */
public class EndpointResolutionException extends Exception {
    public EndpointResolutionException(String message) {
        super(message);
    }

    public EndpointResolutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
