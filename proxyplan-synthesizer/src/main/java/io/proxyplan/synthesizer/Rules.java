/*
 * Copyright Proxyplan Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.proxyplan.synthesizer;

import java.util.List;

import io.fabric8.kubernetes.api.model.networking.v1.HTTPIngressPath;
import io.fabric8.kubernetes.api.model.networking.v1.IngressBackend;
import io.fabric8.kubernetes.api.model.networking.v1.IngressRule;
import io.fabric8.kubernetes.api.model.networking.v1.IngressServiceBackend;

import io.proxyplan.api.Names;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Null-tolerant reading of routing rules.
 */
final class Rules {

    private Rules() {
    }

    /**
     * @return the host of the rule, the catch-all server name when the rule has none
     */
    static String host(IngressRule rule) {
        String host = rule.getHost();
        return host == null || host.isEmpty() ? Names.CATCH_ALL_SERVER_NAME : host;
    }

    static boolean hasHttp(IngressRule rule) {
        return rule.getHttp() != null;
    }

    static List<HTTPIngressPath> paths(IngressRule rule) {
        if (rule.getHttp() == null || rule.getHttp().getPaths() == null) {
            return List.of();
        }
        return rule.getHttp().getPaths();
    }

    /**
     * @return the path of the path rule, the root location when it has none
     */
    static String path(HTTPIngressPath path) {
        String value = path.getPath();
        return value == null || value.isEmpty() ? Names.ROOT_LOCATION : value;
    }

    @Nullable
    static IngressServiceBackend service(@Nullable IngressBackend backend) {
        return backend == null ? null : backend.getService();
    }
}
