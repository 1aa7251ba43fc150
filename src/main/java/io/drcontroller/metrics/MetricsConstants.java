package io.drcontroller.metrics;

/**
 * Constants for metrics names and tags used in the DR Controller.
 */
public class MetricsConstants {
    public final static String ACTION_RELATIONSHIPS_METRIC_NAME = "dr_action_relationships_total";
    public final static String ACTION_DURATION_METRIC_NAME = "dr_action_duration";
    public final static String STATUS_UNRESOLVED_VOLUMES_METRIC_NAME = "dr_status_unresolved_volumes";
    public final static String STATUS_FAILED_QUERIES_METRIC_NAME = "dr_status_failed_queries";
    public final static String AUDIT_WRITE_FAILURES_METRIC_NAME = "dr_audit_write_failures_total";
    public final static String APPLICATION_TAG = "application";
    public final static String ACTION_TAG = "action";
    public final static String OUTCOME_TAG = "outcome";
    public final static String HOST_NAME_TAG = "hostname";

    private MetricsConstants() {}
}
