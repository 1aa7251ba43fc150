package io.drcontroller.enums;

/**
 * Kind of a planned remote step.
 *
 * COMMAND: run once, fail on error output.
 * AWAIT: poll the relationship until an {@link AwaitCondition} holds.
 * ENSURE_SHARE: run the show command and only send the create command when no share exists.
 * DELETE_SHARE: delete, tolerating a share that does not exist.
 * CREATE_LINK_IF_ABSENT: query the relationship and only send the create command when absent.
 */
public enum StepKind {
    COMMAND,
    AWAIT,
    ENSURE_SHARE,
    DELETE_SHARE,
    CREATE_LINK_IF_ABSENT
}
