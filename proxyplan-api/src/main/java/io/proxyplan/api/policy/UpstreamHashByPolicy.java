/*
 * Copyright Proxyplan Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.proxyplan.api.policy;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Consistent hashing of requests onto the endpoints of a backend.
 *
 * @param hashBy the proxy variable(s) to hash, absent for no consistent hashing
 * @param subset true to hash onto a subset of endpoints
 * @param subsetSize size of the subset
 */
public record UpstreamHashByPolicy(@Nullable String hashBy,
                                   boolean subset,
                                   int subsetSize) {

    public static final int DEFAULT_SUBSET_SIZE = 3;

    public static final UpstreamHashByPolicy NONE = new UpstreamHashByPolicy(null, false, DEFAULT_SUBSET_SIZE);
}
