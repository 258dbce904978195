/*
 * Copyright Proxyplan Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.proxyplan.api.policy;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Basic or digest authentication protecting a location.
 *
 * @param type {@code basic} or {@code digest}
 * @param realm realm presented to the client
 * @param secret namespaced key of the secret holding the credentials
 * @param secretType {@code auth-file} or {@code auth-map}
 * @param secured true if authentication is enforced
 */
public record AuthPolicy(@Nullable String type,
                         @Nullable String realm,
                         @Nullable String secret,
                         @Nullable String secretType,
                         boolean secured) {

    public static final AuthPolicy NONE = new AuthPolicy(null, null, null, null, false);
}
