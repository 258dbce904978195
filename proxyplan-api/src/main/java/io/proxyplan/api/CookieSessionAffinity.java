/*
 * Copyright Proxyplan Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.proxyplan.api;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import io.proxyplan.api.policy.CookiePolicy;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * The affinity cookie of a backend together with the paths, per host, that the cookie is scoped to.
 */
public class CookieSessionAffinity {

    private @Nullable String name;
    private @Nullable String expires;
    private @Nullable String maxAge;
    private @Nullable String secure;
    private @Nullable String path;
    private @Nullable String sameSite;
    private boolean conditionalSameSiteNone;
    private boolean changeOnFailure;
    private final Map<String, List<String>> locations = new TreeMap<>();

    public void apply(CookiePolicy cookie, @Nullable String cookiePath) {
        this.name = cookie.name();
        this.expires = cookie.expires();
        this.maxAge = cookie.maxAge();
        this.secure = cookie.secure();
        this.path = cookiePath;
        this.sameSite = cookie.sameSite();
        this.conditionalSameSiteNone = cookie.conditionalSameSiteNone();
        this.changeOnFailure = cookie.changeOnFailure();
    }

    /**
     * Records that {@code locationPath} of {@code host} is served with this affinity cookie.
     */
    public void addLocation(String host, String locationPath) {
        locations.computeIfAbsent(host, h -> new ArrayList<>()).add(locationPath);
    }

    public CookieSessionAffinity copy() {
        var copy = new CookieSessionAffinity();
        copy.name = name;
        copy.expires = expires;
        copy.maxAge = maxAge;
        copy.secure = secure;
        copy.path = path;
        copy.sameSite = sameSite;
        copy.conditionalSameSiteNone = conditionalSameSiteNone;
        copy.changeOnFailure = changeOnFailure;
        locations.forEach((host, paths) -> copy.locations.put(host, new ArrayList<>(paths)));
        return copy;
    }

    public @Nullable String getName() {
        return name;
    }

    public @Nullable String getExpires() {
        return expires;
    }

    public @Nullable String getMaxAge() {
        return maxAge;
    }

    public @Nullable String getSecure() {
        return secure;
    }

    public @Nullable String getPath() {
        return path;
    }

    public @Nullable String getSameSite() {
        return sameSite;
    }

    public boolean isConditionalSameSiteNone() {
        return conditionalSameSiteNone;
    }

    public boolean isChangeOnFailure() {
        return changeOnFailure;
    }

    public Map<String, List<String>> getLocations() {
        return locations;
    }
}
