/*
 * Copyright Proxyplan Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.proxyplan.synthesizer.admission;

import java.time.Duration;
import java.util.Objects;

/**
 * Size and timing breakdown of one successful admission.
 *
 * @param testedSize number of routing resources in the configuration that was rendered and checked
 * @param testDuration time spent rendering and checking
 * @param resourceCount number of routing resources the candidate was synthesised with
 * @param renderDuration time spent rendering
 * @param renderedBytes size of the rendered configuration
 * @param totalDuration time spent on the whole admission
 */
public record AdmissionTimings(int testedSize,
                               Duration testDuration,
                               int resourceCount,
                               Duration renderDuration,
                               long renderedBytes,
                               Duration totalDuration) {

    public static final AdmissionTimings NONE = new AdmissionTimings(0, Duration.ZERO, 0, Duration.ZERO, 0, Duration.ZERO);

    public AdmissionTimings {
        Objects.requireNonNull(testDuration);
        Objects.requireNonNull(renderDuration);
        Objects.requireNonNull(totalDuration);
    }
}
