/*
 * Copyright Proxyplan Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.proxyplan.synthesizer.admission;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.ToDoubleFunction;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.BaseUnits;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Publishes admission outcomes to a Micrometer registry.
 */
public class MicrometerAdmissionMetrics implements AdmissionMetrics {

    public static final String NAMESPACE_LABEL = "namespace";
    public static final String RESOURCE_LABEL = "resource";

    static final String SECONDS = "seconds";

    static final String CHECKS_METER_NAME = "proxyplan_admission_checks";
    static final String CHECK_ERRORS_METER_NAME = "proxyplan_admission_check_errors";
    static final String TESTED_RESOURCES_METER_NAME = "proxyplan_admission_tested_resources";
    static final String TEST_DURATION_METER_NAME = "proxyplan_admission_test_duration";
    static final String RESOURCES_METER_NAME = "proxyplan_admission_resources";
    static final String RENDER_DURATION_METER_NAME = "proxyplan_admission_render_duration";
    static final String RENDERED_SIZE_METER_NAME = "proxyplan_admission_rendered_size";
    static final String TOTAL_DURATION_METER_NAME = "proxyplan_admission_total_duration";

    private final MeterRegistry registry;
    private final AtomicReference<AdmissionTimings> lastAdmission = new AtomicReference<>(AdmissionTimings.NONE);

    public MicrometerAdmissionMetrics(MeterRegistry registry) {
        this.registry = Objects.requireNonNull(registry);
        registerGauge(TESTED_RESOURCES_METER_NAME, "Number of routing resources in the last configuration tested for admission.", null,
                AdmissionTimings::testedSize);
        registerGauge(TEST_DURATION_METER_NAME, "Time spent rendering and checking the last configuration tested for admission.", SECONDS,
                timings -> seconds(timings.testDuration()));
        registerGauge(RESOURCES_METER_NAME, "Number of routing resources the last admitted resource was synthesised with.", null,
                AdmissionTimings::resourceCount);
        registerGauge(RENDER_DURATION_METER_NAME, "Time spent rendering the last configuration tested for admission.", SECONDS,
                timings -> seconds(timings.renderDuration()));
        registerGauge(RENDERED_SIZE_METER_NAME, "Size of the last configuration tested for admission.", BaseUnits.BYTES,
                AdmissionTimings::renderedBytes);
        registerGauge(TOTAL_DURATION_METER_NAME, "Time spent on the last admission.", SECONDS,
                timings -> seconds(timings.totalDuration()));
    }

    @Override
    public void incrementCheckCount(String namespace, String name) {
        counter(CHECKS_METER_NAME, "Count of routing resources admitted.", namespace, name).increment();
    }

    @Override
    public void incrementCheckErrorCount(String namespace, String name) {
        counter(CHECK_ERRORS_METER_NAME, "Count of routing resources refused admission by a conflict or a failed configuration test.", namespace, name)
                .increment();
    }

    @Override
    public void recordAdmission(AdmissionTimings timings) {
        lastAdmission.set(Objects.requireNonNull(timings));
    }

    private Counter counter(String meterName, String description, String namespace, String name) {
        return Counter.builder(meterName)
                .description(description)
                .tag(NAMESPACE_LABEL, namespace)
                .tag(RESOURCE_LABEL, name)
                .register(registry);
    }

    private void registerGauge(String meterName, String description, @Nullable String baseUnit, ToDoubleFunction<AdmissionTimings> value) {
        Gauge.builder(meterName, lastAdmission, last -> value.applyAsDouble(last.get()))
                .description(description)
                .baseUnit(baseUnit)
                .register(registry);
    }

    private static double seconds(Duration duration) {
        return duration.toNanos() / 1_000_000_000.0;
    }
}
