package io.drcontroller.metrics;

import com.google.common.util.concurrent.AtomicDouble;
import io.drcontroller.enums.ActionOutcome;
import io.drcontroller.enums.DrAction;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import static io.drcontroller.metrics.MetricsConstants.ACTION_DURATION_METRIC_NAME;
import static io.drcontroller.metrics.MetricsConstants.ACTION_RELATIONSHIPS_METRIC_NAME;
import static io.drcontroller.metrics.MetricsConstants.AUDIT_WRITE_FAILURES_METRIC_NAME;
import static io.drcontroller.metrics.MetricsConstants.HOST_NAME_TAG;
import static io.drcontroller.metrics.MetricsConstants.STATUS_UNRESOLVED_VOLUMES_METRIC_NAME;
import static io.drcontroller.metrics.MetricsUtils.buildMetricsTags;
import static io.drcontroller.metrics.MetricsUtils.buildMetricsTagsByOutcome;

/**
 * Publishes the controller's meters to the Micrometer registry. Every meter is tagged with
 * the controller id so several controllers can share one backend.
 */
@Slf4j
@Component
public class MetricsProvider {
    private static final double[] DURATION_PERCENTILES = {0.5, 0.9, 0.99};

    private final MeterRegistry registry;
    private final String controllerId;
    // strong references to gauge state, Micrometer only holds it weakly
    private final Map<Gauge, AtomicDouble> gaugeValues = new ConcurrentHashMap<>();

    @Autowired
    public MetricsProvider(MeterRegistry registry, @Value("${controller.id:dr-controller}") String controllerId) {
        this.registry = registry;
        this.controllerId = controllerId;
        log.info("Publishing DR metrics as controller '{}'", controllerId);
    }

    public void recordRelationshipOutcomes(String application, DrAction action, ActionOutcome outcome, long count) {
        if (count > 0) {
            counter(ACTION_RELATIONSHIPS_METRIC_NAME, buildMetricsTagsByOutcome(application, action, outcome))
                .increment(count);
        }
    }

    public void recordActionDuration(String application, DrAction action, Duration duration) {
        timer(ACTION_DURATION_METRIC_NAME, buildMetricsTags(application, action)).record(duration);
    }

    public void setUnresolvedVolumes(String application, long volumes) {
        gauge(STATUS_UNRESOLVED_VOLUMES_METRIC_NAME, buildMetricsTags(application)).set(volumes);
    }

    public void recordAuditWriteFailure(String application) {
        counter(AUDIT_WRITE_FAILURES_METRIC_NAME, buildMetricsTags(application)).increment();
    }

    public Counter counter(String name, Map<String, String> tags) {
        return Counter.builder(name).tags(withControllerId(tags)).register(registry);
    }

    /**
     * Value holder of the gauge with this name and tags, registered on first use.
     */
    public AtomicDouble gauge(String name, Map<String, String> tags) {
        AtomicDouble candidate = new AtomicDouble();
        Gauge gauge = Gauge.builder(name, candidate, AtomicDouble::get)
            .tags(withControllerId(tags))
            .register(registry);
        return gaugeValues.computeIfAbsent(gauge, g -> candidate);
    }

    public Timer timer(String name, Map<String, String> tags) {
        return Timer.builder(name)
            .tags(withControllerId(tags))
            .publishPercentileHistogram()
            .publishPercentiles(DURATION_PERCENTILES)
            .register(registry);
    }

    private Tags withControllerId(Map<String, String> tags) {
        Tags result = Tags.of(HOST_NAME_TAG, controllerId);
        for (Map.Entry<String, String> tag : tags.entrySet()) {
            result = result.and(tag.getKey(), tag.getValue());
        }
        return result;
    }
}
