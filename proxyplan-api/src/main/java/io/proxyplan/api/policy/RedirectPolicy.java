/*
 * Copyright Proxyplan Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.proxyplan.api.policy;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Redirect applied to a location.
 *
 * @param url the redirect target
 * @param code the HTTP status code returned with the redirect
 * @param fromToWww true to redirect between {@code www.<host>} and {@code <host>}
 */
public record RedirectPolicy(@Nullable String url,
                             int code,
                             boolean fromToWww) {

    public static final int DEFAULT_PERMANENT_CODE = 301;
    public static final int DEFAULT_TEMPORAL_CODE = 302;

    public static final RedirectPolicy NONE = new RedirectPolicy(null, 0, false);
}
