/*
 * Copyright Proxyplan Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.proxyplan.api.policy;

import java.util.Objects;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Session affinity requested by a routing resource.
 *
 * @param type affinity type, only {@value #COOKIE} is currently understood
 * @param mode {@code balanced} or {@code persistent}
 * @param canaryBehavior {@value #LEGACY_CANARY_BEHAVIOR} keeps canary backends from inheriting the primary's affinity
 * @param cookie cookie attributes, used when {@code type} is {@value #COOKIE}
 */
public record SessionAffinityPolicy(@Nullable String type,
                                    @Nullable String mode,
                                    @Nullable String canaryBehavior,
                                    CookiePolicy cookie) {

    public static final String COOKIE = "cookie";
    public static final String LEGACY_CANARY_BEHAVIOR = "legacy";

    public static final SessionAffinityPolicy NONE = new SessionAffinityPolicy(null, null, null, CookiePolicy.NONE);

    public SessionAffinityPolicy {
        Objects.requireNonNull(cookie);
    }

    public boolean isCookieBased() {
        return COOKIE.equals(type);
    }

    public boolean isLegacyCanaryBehavior() {
        return LEGACY_CANARY_BEHAVIOR.equals(canaryBehavior);
    }
}
