/*
 * Copyright Proxyplan Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.proxyplan.api.policy;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Marks a routing resource as a canary variant of another resource serving the same host and path,
 * and describes how traffic is split towards it.
 *
 * @param enabled true if the resource is a canary
 * @param weight the share of traffic routed to the canary, out of {@code weightTotal}
 * @param weightTotal the total weight that {@code weight} is relative to
 * @param header name of a request header that routes to the canary
 * @param headerValue value the header must carry to route to the canary
 * @param headerPattern pattern the header must match to route to the canary
 * @param cookie name of a cookie that routes to the canary
 */
public record CanaryPolicy(boolean enabled,
                           int weight,
                           int weightTotal,
                           @Nullable String header,
                           @Nullable String headerValue,
                           @Nullable String headerPattern,
                           @Nullable String cookie) {

    public static final int DEFAULT_WEIGHT_TOTAL = 100;

    public static final CanaryPolicy DISABLED = new CanaryPolicy(false, 0, DEFAULT_WEIGHT_TOTAL, null, null, null, null);
}
