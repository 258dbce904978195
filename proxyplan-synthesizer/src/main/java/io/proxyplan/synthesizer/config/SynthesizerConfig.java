/*
 * Copyright Proxyplan Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.proxyplan.synthesizer.config;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * The root of the synthesizer configuration.
 *
 * @param controller controller settings
 * @param backend cluster-wide backend policy
 */
@JsonPropertyOrder({ "controller", "backend" })
public record SynthesizerConfig(@Nullable ControllerConfig controller,
                                @Nullable BackendConfiguration backend) {

    public SynthesizerConfig {
        if (controller == null) {
            controller = ControllerConfig.DEFAULT;
        }
        if (backend == null) {
            backend = BackendConfiguration.DEFAULT;
        }
    }
}
