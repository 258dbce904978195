/*
 * Copyright Proxyplan Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.proxyplan.api;

/**
 * Reserved names used throughout a synthesised configuration.
 */
public final class Names {

    /**
     * Name of the backend that serves requests matching no other backend.
     * Service derived backend names always contain a namespace, service and port, so cannot collide with it.
     */
    public static final String DEFAULT_UPSTREAM_NAME = "upstream-default-backend";

    /**
     * Host name of the catch-all server.
     */
    public static final String CATCH_ALL_SERVER_NAME = "_";

    /**
     * Path of the root location of every server.
     */
    public static final String ROOT_LOCATION = "/";

    /**
     * Prefix of the names of backends synthesised from a location's custom default backend.
     */
    public static final String CUSTOM_DEFAULT_BACKEND_PREFIX = "custom-default-backend-";

    public static final String PATH_TYPE_PREFIX = "Prefix";
    public static final String PATH_TYPE_EXACT = "Exact";
    public static final String PATH_TYPE_IMPLEMENTATION_SPECIFIC = "ImplementationSpecific";

    private Names() {
    }
}
