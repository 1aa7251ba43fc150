package io.drcontroller.actions;

import io.drcontroller.enums.RelationshipState;
import lombok.Getter;

/**
 * Exception thrown when a relationship is not in a state that permits the requested action.
 */
@Getter
public class PreconditionException extends RuntimeException {

    private final RelationshipState actualState;

    public PreconditionException(String message) {
        this(message, null);
    }

    public PreconditionException(String message, RelationshipState actualState) {
        super(message);
        this.actualState = actualState;
    }
}
