/*
 * Copyright Proxyplan Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.proxyplan.api.policy;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * URI rewriting applied to a location.
 *
 * @param target the URI the matched path is rewritten to
 * @param useRegex true if location paths are regular expressions
 * @param sslRedirect true to redirect plain HTTP to HTTPS when the server has a certificate
 * @param forceSslRedirect true to redirect plain HTTP to HTTPS even without a certificate
 * @param appRoot path the root location redirects to
 */
public record RewritePolicy(@Nullable String target,
                            boolean useRegex,
                            boolean sslRedirect,
                            boolean forceSslRedirect,
                            @Nullable String appRoot) {

    public static final RewritePolicy NONE = new RewritePolicy(null, false, true, false, null);
}
