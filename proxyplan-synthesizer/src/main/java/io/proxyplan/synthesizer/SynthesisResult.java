/*
 * Copyright Proxyplan Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.proxyplan.synthesizer;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

import io.proxyplan.api.Configuration;

/**
 * The outcome of one synthesis pass.
 *
 * @param configuration the synthesised configuration
 * @param hosts every host name served, aliases included, in ascending order
 * @param diagnostics the degraded results met during the pass, in the order they occurred
 */
public record SynthesisResult(Configuration configuration,
                              Set<String> hosts,
                              List<SynthesisDiagnostic> diagnostics) {

    public SynthesisResult {
        Objects.requireNonNull(configuration);
        hosts = Collections.unmodifiableSet(new TreeSet<>(hosts));
        diagnostics = List.copyOf(diagnostics);
    }

    public List<SynthesisDiagnostic> diagnostics(SynthesisDiagnostic.Kind kind) {
        return diagnostics.stream().filter(diagnostic -> diagnostic.kind() == kind).toList();
    }
}
