package io.drcontroller.metrics;

import io.drcontroller.enums.ActionOutcome;
import io.drcontroller.enums.DrAction;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class MetricsUtilsTest {

    @Test
    void testBuildMetricsTags_ApplicationOnly() {
        // When
        Map<String, String> tags = MetricsUtils.buildMetricsTags("APP1");

        // Then
        assertThat(tags).containsExactly(Map.entry(MetricsConstants.APPLICATION_TAG, "APP1"));
    }

    @Test
    void testBuildMetricsTags_UsesActionValue() {
        // When
        Map<String, String> tags = MetricsUtils.buildMetricsTags("APP1", DrAction.RESTORATION_FLIP_FLOP);

        // Then
        assertThat(tags)
            .containsEntry(MetricsConstants.APPLICATION_TAG, "APP1")
            .containsEntry(MetricsConstants.ACTION_TAG, DrAction.RESTORATION_FLIP_FLOP.getValue())
            .hasSize(2);
    }

    @Test
    void testBuildMetricsTagsByOutcome_LowercasesOutcome() {
        // When
        Map<String, String> tags = MetricsUtils.buildMetricsTagsByOutcome("APP2", DrAction.UPDATE,
            ActionOutcome.CANCELLED);

        // Then
        assertThat(tags)
            .containsEntry(MetricsConstants.ACTION_TAG, "update")
            .containsEntry(MetricsConstants.OUTCOME_TAG, "cancelled")
            .hasSize(3);
    }
}
