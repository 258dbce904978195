/*
 * Copyright Proxyplan Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.proxyplan.synthesizer.annotations;

/**
 * Thrown when an annotation requests a protection that cannot be configured. Rather than
 * serving the resource unprotected, its locations deny every request.
 */
public class LocationDeniedException extends InvalidAnnotationException {
    public LocationDeniedException(String message) {
        super(message);
    }
}
