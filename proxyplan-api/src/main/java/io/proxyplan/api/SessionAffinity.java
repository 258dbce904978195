/*
 * Copyright Proxyplan Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.proxyplan.api;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * The session affinity of a backend.
 */
public class SessionAffinity {

    private @Nullable String affinityType;
    private @Nullable String affinityMode;
    private CookieSessionAffinity cookieSessionAffinity = new CookieSessionAffinity();

    public SessionAffinity copy() {
        var copy = new SessionAffinity();
        copy.affinityType = affinityType;
        copy.affinityMode = affinityMode;
        copy.cookieSessionAffinity = cookieSessionAffinity.copy();
        return copy;
    }

    public @Nullable String getAffinityType() {
        return affinityType;
    }

    public void setAffinityType(@Nullable String affinityType) {
        this.affinityType = affinityType;
    }

    public @Nullable String getAffinityMode() {
        return affinityMode;
    }

    public void setAffinityMode(@Nullable String affinityMode) {
        this.affinityMode = affinityMode;
    }

    public CookieSessionAffinity getCookieSessionAffinity() {
        return cookieSessionAffinity;
    }
}
