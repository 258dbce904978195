/*
 * Copyright Proxyplan Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.proxyplan.api.policy;

/**
 * Settings of the connection from the proxy to a backend.
 *
 * @param bodySize maximum client request body size, in proxy size syntax (e.g. {@code 1m})
 * @param connectTimeout connect timeout, in seconds
 * @param sendTimeout send timeout, in seconds
 * @param readTimeout read timeout, in seconds
 * @param bufferSize size of the buffer used for the first part of the response
 * @param nextUpstream conditions in which a request is passed to the next endpoint
 * @param requestBuffering {@code on} or {@code off}
 */
public record ProxyPolicy(String bodySize,
                          int connectTimeout,
                          int sendTimeout,
                          int readTimeout,
                          String bufferSize,
                          String nextUpstream,
                          String requestBuffering) {

    public static final ProxyPolicy DEFAULTS = new ProxyPolicy("1m", 5, 60, 60, "4k", "error timeout", "on");

    public ProxyPolicy withTimeouts(int connectTimeout, int sendTimeout, int readTimeout) {
        return new ProxyPolicy(bodySize, connectTimeout, sendTimeout, readTimeout, bufferSize, nextUpstream, requestBuffering);
    }
}
