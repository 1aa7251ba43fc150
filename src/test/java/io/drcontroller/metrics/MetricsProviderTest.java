package io.drcontroller.metrics;

import com.google.common.util.concurrent.AtomicDouble;
import io.drcontroller.enums.ActionOutcome;
import io.drcontroller.enums.DrAction;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static io.drcontroller.metrics.MetricsConstants.ACTION_DURATION_METRIC_NAME;
import static io.drcontroller.metrics.MetricsConstants.ACTION_RELATIONSHIPS_METRIC_NAME;
import static io.drcontroller.metrics.MetricsConstants.AUDIT_WRITE_FAILURES_METRIC_NAME;
import static io.drcontroller.metrics.MetricsConstants.STATUS_UNRESOLVED_VOLUMES_METRIC_NAME;
import static org.assertj.core.api.Assertions.assertThat;

class MetricsProviderTest {

    private static final String TEST_CONTROLLER_ID = "dr-controller-01";

    private SimpleMeterRegistry registry;
    private MetricsProvider provider;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        provider = new MetricsProvider(registry, TEST_CONTROLLER_ID);
    }

    @Test
    void testRecordRelationshipOutcomes_TaggedPerOutcome() {
        // When
        provider.recordRelationshipOutcomes("APP1", DrAction.RECOVERY, ActionOutcome.FAILED, 1);
        provider.recordRelationshipOutcomes("APP1", DrAction.RECOVERY, ActionOutcome.FAILED, 2);
        provider.recordRelationshipOutcomes("APP1", DrAction.RECOVERY, ActionOutcome.SUCCEEDED, 4);

        // Then
        Counter failed = registry.get(ACTION_RELATIONSHIPS_METRIC_NAME).tag("outcome", "failed").counter();
        assertThat(failed.count()).isEqualTo(3.0);
        assertThat(failed.getId().getTag("application")).isEqualTo("APP1");
        assertThat(failed.getId().getTag("action")).isEqualTo("recovery");
        assertThat(failed.getId().getTag("hostname")).isEqualTo(TEST_CONTROLLER_ID);
        assertThat(registry.get(ACTION_RELATIONSHIPS_METRIC_NAME).tag("outcome", "succeeded").counter().count())
            .isEqualTo(4.0);
    }

    @Test
    void testRecordRelationshipOutcomes_ZeroCountRegistersNothing() {
        // When
        provider.recordRelationshipOutcomes("APP1", DrAction.UPDATE, ActionOutcome.CANCELLED, 0);

        // Then
        assertThat(registry.find(ACTION_RELATIONSHIPS_METRIC_NAME).counter()).isNull();
    }

    @Test
    void testSetUnresolvedVolumes_OverwritesPerApplication() {
        // When
        provider.setUnresolvedVolumes("APP1", 2);
        provider.setUnresolvedVolumes("APP2", 4);
        provider.setUnresolvedVolumes("APP1", 0);

        // Then
        Gauge app1 = registry.get(STATUS_UNRESOLVED_VOLUMES_METRIC_NAME).tag("application", "APP1").gauge();
        assertThat(app1.value()).isEqualTo(0.0);
        assertThat(app1.getId().getTag("hostname")).isEqualTo(TEST_CONTROLLER_ID);
        assertThat(registry.get(STATUS_UNRESOLVED_VOLUMES_METRIC_NAME).tag("application", "APP2").gauge().value())
            .isEqualTo(4.0);
    }

    @Test
    void testGauge_SameNameAndTagsShareOneHolder() {
        // When
        AtomicDouble first = provider.gauge(STATUS_UNRESOLVED_VOLUMES_METRIC_NAME, MetricsUtils.buildMetricsTags("APP3"));
        AtomicDouble second = provider.gauge(STATUS_UNRESOLVED_VOLUMES_METRIC_NAME, MetricsUtils.buildMetricsTags("APP3"));
        second.set(7);

        // Then
        assertThat(second).isSameAs(first);
        assertThat(registry.get(STATUS_UNRESOLVED_VOLUMES_METRIC_NAME).gauge().value()).isEqualTo(7.0);
    }

    @Test
    void testRecordActionDuration_RecordsTimer() {
        // When
        provider.recordActionDuration("APP1", DrAction.QUIESCE, Duration.ofMillis(250));

        // Then
        Timer timer = registry.get(ACTION_DURATION_METRIC_NAME).timer();
        assertThat(timer.getId().getTag("action")).isEqualTo("quiesce");
        assertThat(timer.count()).isEqualTo(1);
        assertThat(timer.totalTime(TimeUnit.MILLISECONDS)).isEqualTo(250);
    }

    @Test
    void testRecordAuditWriteFailure_CountsPerApplication() {
        // When
        provider.recordAuditWriteFailure("APP2");
        provider.recordAuditWriteFailure("APP2");

        // Then
        assertThat(registry.get(AUDIT_WRITE_FAILURES_METRIC_NAME).tag("application", "APP2").counter().count())
            .isEqualTo(2.0);
    }
}
