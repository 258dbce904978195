/*
 * Copyright Proxyplan Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.proxyplan.api;

import java.util.Objects;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * A single address a backend routes requests to.
 *
 * @param address IP address or host name
 * @param port port number
 * @param weight relative weight of the endpoint within its backend, absent for equal weighting
 */
public record Endpoint(String address, int port, @Nullable Integer weight) {

    public Endpoint {
        Objects.requireNonNull(address);
        if (port < 1 || port > 65535) {
            throw new IllegalArgumentException("port " + port + " is outside the range 1-65535");
        }
    }

    public Endpoint(String address, int port) {
        this(address, port, null);
    }

    @Override
    public String toString() {
        return address + ":" + port;
    }
}
