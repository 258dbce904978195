/*
 * Copyright Proxyplan Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.proxyplan.api.policy;

/**
 * Per location override of the cluster wide opentracing setting.
 * The {@code set} flags distinguish an explicit {@code false} from an absent annotation.
 */
public record OpentracingPolicy(boolean set,
                                boolean enabled,
                                boolean trustSet,
                                boolean trustEnabled) {

    public static final OpentracingPolicy UNSET = new OpentracingPolicy(false, false, false, false);
}
