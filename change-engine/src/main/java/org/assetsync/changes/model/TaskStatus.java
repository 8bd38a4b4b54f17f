package org.assetsync.changes.model;

/**
 * Lifecycle of a {@link ChangeTask}. Transitions only move forward; DONE and FAILED are terminal.
 */
public enum TaskStatus {
    UNCOMMITTED,
    SUBMITTED,
    DONE,
    FAILED;

    public boolean isTerminal() {
        return this == DONE || this == FAILED;
    }

    public boolean canTransitionTo(TaskStatus next) {
        switch (this) {
            case UNCOMMITTED:
                return next != UNCOMMITTED;
            case SUBMITTED:
                return next.isTerminal();
            default:
                return false;
        }
    }
}
