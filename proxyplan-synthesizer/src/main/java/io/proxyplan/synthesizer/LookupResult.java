/*
 * Copyright Proxyplan Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.proxyplan.synthesizer;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * The outcome of a lookup that may have been degraded: a value (possibly a substitute) plus
 * the problem that forced the substitution, if any.
 *
 * @param value the value found, or its substitute
 * @param problem why the lookup degraded, absent when it did not
 * @param <T> type of the value
 */
record LookupResult<T>(@Nullable T value, @Nullable String problem) {

    static <T> LookupResult<T> found(T value) {
        return new LookupResult<>(value, null);
    }

    static <T> LookupResult<T> degraded(@Nullable T substitute, String problem) {
        return new LookupResult<>(substitute, problem);
    }

    boolean isDegraded() {
        return problem != null;
    }
}
