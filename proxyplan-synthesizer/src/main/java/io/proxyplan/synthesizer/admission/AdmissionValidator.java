/*
 * Copyright Proxyplan Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.proxyplan.synthesizer.admission;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.fabric8.kubernetes.api.model.networking.v1.HTTPIngressPath;
import io.fabric8.kubernetes.api.model.networking.v1.Ingress;
import io.fabric8.kubernetes.api.model.networking.v1.IngressBuilder;
import io.fabric8.kubernetes.api.model.networking.v1.IngressRule;

import io.proxyplan.api.RoutingResource;
import io.proxyplan.synthesizer.ConfigurationSynthesizer;
import io.proxyplan.synthesizer.SynthesisResult;
import io.proxyplan.synthesizer.admission.AdmissionException.Reason;
import io.proxyplan.synthesizer.annotations.AnnotationExtractor;
import io.proxyplan.synthesizer.config.BackendConfiguration;
import io.proxyplan.synthesizer.config.ControllerConfig;
import io.proxyplan.synthesizer.spi.RenderException;
import io.proxyplan.synthesizer.spi.ResourceStore;
import io.proxyplan.synthesizer.spi.SyntaxCheckException;
import io.proxyplan.synthesizer.spi.SyntaxChecker;
import io.proxyplan.synthesizer.spi.TemplateRenderer;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Decides whether a new or changed routing resource may be admitted.
 * <p>
 * The resource must satisfy the cluster wide annotation policies, must not take over a host
 * and path already served by another resource, and the configuration synthesised with it must
 * render and pass the syntax check. The caller's resource is never modified.
 */
public class AdmissionValidator {

    private static final Logger LOGGER = LoggerFactory.getLogger(AdmissionValidator.class);

    private final ControllerConfig controller;
    private final ResourceStore store;
    private final AnnotationExtractor extractor;
    private final ConfigurationSynthesizer synthesizer;
    private final TemplateRenderer renderer;
    private final SyntaxChecker syntaxChecker;
    private final AdmissionMetrics metrics;
    private final Clock clock;
    private final AnnotationPolicyChecker policyChecker;
    private final OverlapChecker overlapChecker = new OverlapChecker();

    @SuppressWarnings("java:S107") // collaborators are injected individually
    public AdmissionValidator(ControllerConfig controller,
                              ResourceStore store,
                              AnnotationExtractor extractor,
                              ConfigurationSynthesizer synthesizer,
                              TemplateRenderer renderer,
                              SyntaxChecker syntaxChecker,
                              AdmissionMetrics metrics,
                              Clock clock) {
        this.controller = Objects.requireNonNull(controller);
        this.store = Objects.requireNonNull(store);
        this.extractor = Objects.requireNonNull(extractor);
        this.synthesizer = Objects.requireNonNull(synthesizer);
        this.renderer = Objects.requireNonNull(renderer);
        this.syntaxChecker = Objects.requireNonNull(syntaxChecker);
        this.metrics = Objects.requireNonNull(metrics);
        this.clock = Objects.requireNonNull(clock);
        this.policyChecker = new AnnotationPolicyChecker(controller);
    }

    /**
     * Validates {@code candidate}, returning normally if it may be admitted.
     *
     * @param candidate the new or changed resource, null is admitted
     * @throws AdmissionException if the resource must be refused
     */
    public void validate(@Nullable Ingress candidate) throws AdmissionException {
        Instant start = clock.instant();
        if (candidate == null) {
            return;
        }
        String namespace = candidate.getMetadata().getNamespace();
        String name = candidate.getMetadata().getName();
        String deletionTimestamp = candidate.getMetadata().getDeletionTimestamp();
        if (deletionTimestamp != null && !deletionTimestamp.isEmpty()) {
            LOGGER.debug("Admitting {}/{} without checks, it is being deleted", namespace, name);
            return;
        }
        if (controller.watchesSingleNamespace() && !controller.watchNamespace().equals(namespace)) {
            LOGGER.atWarn()
                    .addKeyValue("namespace", namespace)
                    .addKeyValue("name", name)
                    .log("Ignoring resource outside of the watched namespace {}", controller.watchNamespace());
            return;
        }

        BackendConfiguration cluster = store.getBackendConfiguration();
        policyChecker.check(candidate, cluster);

        Ingress normalised = withDefaultPathType(candidate);
        var candidateResource = new RoutingResource(normalised, extractor.extract(normalised));
        List<RoutingResource> resources = new ArrayList<>();
        for (RoutingResource existing : store.listRoutingResources()) {
            if (!existing.isSameResourceAs(normalised)) {
                resources.add(existing);
            }
        }
        resources.add(candidateResource);

        SynthesisResult result = synthesizer.synthesize(resources);
        try {
            overlapChecker.check(candidateResource, result.configuration());
        }
        catch (OverlapConflictException e) {
            metrics.incrementCheckErrorCount(namespace, name);
            throw e;
        }

        int testedSize = resources.size();
        if (controller.disableFullValidationTest()) {
            result = synthesizer.synthesize(List.of(candidateResource));
            testedSize = 1;
        }

        Instant testStart = clock.instant();
        byte[] rendered;
        try {
            rendered = renderer.render(cluster, result.configuration());
        }
        catch (RenderException e) {
            metrics.incrementCheckErrorCount(namespace, name);
            throw new AdmissionException(Reason.RENDER_FAILURE, e.getMessage(), e);
        }
        Duration renderDuration = Duration.between(testStart, clock.instant());
        try {
            syntaxChecker.check(rendered);
        }
        catch (SyntaxCheckException e) {
            metrics.incrementCheckErrorCount(namespace, name);
            throw new AdmissionException(Reason.CHECK_FAILURE, e.getMessage(), e);
        }
        Instant end = clock.instant();

        metrics.incrementCheckCount(namespace, name);
        metrics.recordAdmission(new AdmissionTimings(testedSize,
                Duration.between(testStart, end),
                resources.size(),
                renderDuration,
                rendered.length,
                Duration.between(start, end)));
        LOGGER.debug("Admitted {}/{} after testing a configuration of {} resources", namespace, name, testedSize);
    }

    private Ingress withDefaultPathType(Ingress candidate) {
        Ingress copy = new IngressBuilder(candidate).build();
        if (copy.getSpec() == null || copy.getSpec().getRules() == null) {
            return copy;
        }
        for (IngressRule rule : copy.getSpec().getRules()) {
            if (rule.getHttp() == null || rule.getHttp().getPaths() == null) {
                continue;
            }
            for (HTTPIngressPath path : rule.getHttp().getPaths()) {
                if (path.getPathType() == null || path.getPathType().isEmpty()) {
                    path.setPathType(controller.defaultPathType());
                }
            }
        }
        return copy;
    }
}
