/*
 * Copyright Proxyplan Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.proxyplan.synthesizer;

import io.proxyplan.api.Location;
import io.proxyplan.api.policy.AnnotationBundle;
import io.proxyplan.api.policy.ProxyPolicy;
import io.proxyplan.api.policy.RedirectPolicy;
import io.proxyplan.api.policy.RewritePolicy;

/**
 * Flattens the policies of a routing resource onto one of its locations.
 */
final class LocationPolicies {

    private LocationPolicies() {
    }

    static void apply(Location location, AnnotationBundle annotations, ProxyPolicy clusterProxy) {
        location.setBasicDigestAuth(annotations.auth());
        location.setConfigurationSnippet(annotations.configurationSnippet());
        location.setHttp2PushPreload(annotations.http2PushPreload());
        location.setOpentracing(annotations.opentracing());
        location.setProxy(annotations.proxy() != null ? annotations.proxy() : clusterProxy);
        location.setProxySsl(annotations.proxySsl());
        location.setRedirect(annotations.redirect());
        location.setRewrite(annotations.rewrite());
        location.setLogs(annotations.logs());
        location.setDefaultBackend(annotations.defaultBackend());
        location.setBackendProtocol(annotations.backendProtocol());
        if (annotations.denied() != null) {
            location.setDenied(annotations.denied());
        }
    }

    /**
     * Applies the policies to the catch-all root location, leaving its redirect and rewrite untouched.
     */
    static void applyToCatchAll(Location location, AnnotationBundle annotations, ProxyPolicy clusterProxy) {
        RedirectPolicy redirect = location.getRedirect();
        RewritePolicy rewrite = location.getRewrite();
        apply(location, annotations, clusterProxy);
        location.setRedirect(redirect);
        location.setRewrite(rewrite);
    }
}
