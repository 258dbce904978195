/*
 * Copyright Proxyplan Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.proxyplan.synthesizer.spi;

/**
 * Thrown when a rendered artifact is rejected by the proxy's syntax check.
 */
public class SyntaxCheckException extends Exception {
    public SyntaxCheckException(String message) {
        super(message);
    }

    public SyntaxCheckException(String message, Throwable cause) {
        super(message, cause);
    }
}
