/*
 * Copyright Proxyplan Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.proxyplan.api.policy;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Attributes of the cookie used for cookie based session affinity.
 */
public record CookiePolicy(@Nullable String name,
                           @Nullable String expires,
                           @Nullable String maxAge,
                           @Nullable String secure,
                           @Nullable String path,
                           @Nullable String sameSite,
                           boolean conditionalSameSiteNone,
                           boolean changeOnFailure) {

    public static final CookiePolicy NONE = new CookiePolicy(null, null, null, null, null, null, false, false);
}
