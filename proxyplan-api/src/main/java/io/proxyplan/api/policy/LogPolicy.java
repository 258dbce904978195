/*
 * Copyright Proxyplan Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.proxyplan.api.policy;

/**
 * @param access true if requests to the location are access-logged
 * @param rewrite true if rewrites in the location are logged
 */
public record LogPolicy(boolean access,
                        boolean rewrite) {

    public static final LogPolicy DEFAULT = new LogPolicy(true, false);
}
