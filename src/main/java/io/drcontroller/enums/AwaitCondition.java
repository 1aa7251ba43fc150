package io.drcontroller.enums;

import io.drcontroller.models.Relationship;

/**
 * Conditions a relationship is polled for during multi-step workflows.
 */
public enum AwaitCondition {
    IDLE {
        @Override
        public boolean isSatisfiedBy(Relationship relationship) {
            return relationship.isPresent() && "Idle".equalsIgnoreCase(relationship.getStatus());
        }
    },
    QUIESCED {
        @Override
        public boolean isSatisfiedBy(Relationship relationship) {
            return relationship.isPresent() && relationship.getState() == RelationshipState.QUIESCED
                && "Quiesced".equalsIgnoreCase(relationship.getStatus());
        }
    },
    MIRRORED {
        @Override
        public boolean isSatisfiedBy(Relationship relationship) {
            return relationship.isPresent() && relationship.getState() == RelationshipState.MIRRORED;
        }
    };

    public abstract boolean isSatisfiedBy(Relationship relationship);
}
