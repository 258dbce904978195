/*
 * Copyright Proxyplan Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.proxyplan.api;

import io.proxyplan.api.policy.CanaryPolicy;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Describes which requests a backend receives when it is used as the alternative backend of another.
 */
public record TrafficShapingPolicy(int weight,
                                   int weightTotal,
                                   @Nullable String header,
                                   @Nullable String headerValue,
                                   @Nullable String headerPattern,
                                   @Nullable String cookie) {

    public static final TrafficShapingPolicy NONE = new TrafficShapingPolicy(0, 0, null, null, null, null);

    public static TrafficShapingPolicy from(CanaryPolicy canary) {
        return new TrafficShapingPolicy(canary.weight(), canary.weightTotal(), canary.header(), canary.headerValue(), canary.headerPattern(),
                canary.cookie());
    }
}
