/*
 * Copyright Proxyplan Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.proxyplan.synthesizer.admission;

/**
 * Thrown when a host and path of a candidate resource is already served by another resource
 * and the two do not form a primary and canary pair.
 */
public class OverlapConflictException extends AdmissionException {

    private final String conflictingResource;

    public OverlapConflictException(String message, String conflictingResource) {
        super(Reason.CONFLICT, message);
        this.conflictingResource = conflictingResource;
    }

    /**
     * @return key, {@code namespace/name}, of the resource already serving the host and path
     */
    public String getConflictingResource() {
        return conflictingResource;
    }
}
