package io.drcontroller.metrics;

import io.drcontroller.enums.ActionOutcome;
import io.drcontroller.enums.DrAction;

import java.util.HashMap;
import java.util.Map;

import static io.drcontroller.metrics.MetricsConstants.ACTION_TAG;
import static io.drcontroller.metrics.MetricsConstants.APPLICATION_TAG;
import static io.drcontroller.metrics.MetricsConstants.OUTCOME_TAG;

/**
 * Utility class for handling metrics.
 */
public class MetricsUtils {

    private MetricsUtils() {}

    /**
     * Builds a map of metrics tags including application, action and per-relationship outcome.
     *
     * @param application the application name
     * @param action the DR action
     * @param outcome the relationship outcome
     * @return a map of metrics tags
     */
    public static Map<String, String> buildMetricsTagsByOutcome(String application, DrAction action, ActionOutcome outcome) {
        Map<String, String> tags = buildMetricsTags(application, action);
        tags.put(OUTCOME_TAG, outcome.name().toLowerCase());
        return tags;
    }

    /**
     * Builds a map of metrics tags including application and action.
     *
     * @param application the application name
     * @param action the DR action
     * @return a map of metrics tags
     */
    public static Map<String, String> buildMetricsTags(String application, DrAction action) {
        Map<String, String> tags = buildMetricsTags(application);
        tags.put(ACTION_TAG, action.getValue());
        return tags;
    }

    public static Map<String, String> buildMetricsTags(String application) {
        Map<String, String> tags = new HashMap<>();
        tags.put(APPLICATION_TAG, application);
        return tags;
    }
}
