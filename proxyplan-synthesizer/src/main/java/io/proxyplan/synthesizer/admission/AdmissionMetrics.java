/*
 * Copyright Proxyplan Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.proxyplan.synthesizer.admission;

/**
 * Receives the outcome of admission checks.
 */
public interface AdmissionMetrics {

    AdmissionMetrics NOOP = new AdmissionMetrics() {
        @Override
        public void incrementCheckCount(String namespace, String name) {
            // no-op
        }

        @Override
        public void incrementCheckErrorCount(String namespace, String name) {
            // no-op
        }

        @Override
        public void recordAdmission(AdmissionTimings timings) {
            // no-op
        }
    };

    void incrementCheckCount(String namespace, String name);

    void incrementCheckErrorCount(String namespace, String name);

    void recordAdmission(AdmissionTimings timings);
}
