/*
 * Copyright Proxyplan Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.proxyplan.synthesizer.spi;

/**
 * Checks that a rendered artifact would be accepted by the proxy.
 */
@FunctionalInterface
public interface SyntaxChecker {

    void check(byte[] artifact) throws SyntaxCheckException;
}
