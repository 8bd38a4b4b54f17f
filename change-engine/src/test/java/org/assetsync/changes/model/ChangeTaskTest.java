package org.assetsync.changes.model;

import java.util.List;
import java.util.UUID;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ChangeTaskTest {

    private static final MetadataChange CHANGE = MetadataChange.of("/fotoweb/archives/5000/a.jpg.info", 5, "archived");

    @Test
    void newTaskIsUncommittedWithGeneratedId() {
        var task = new ChangeTask(CHANGE);
        assertEquals(TaskStatus.UNCOMMITTED, task.getStatus());
        assertTrue(task.getFailure().isEmpty());
        assertNotEquals(task.getId(), new ChangeTask(CHANGE).getId());
    }

    @Test
    void equalityIsByIdOnly() {
        var id = UUID.randomUUID();
        var first = new ChangeTask(id, CHANGE);
        var second = new ChangeTask(id, MoveChange.of(List.of("/a"), "/dest"));
        assertEquals(first, second);
        assertEquals(first.hashCode(), second.hashCode());
    }

    @Test
    void submittedTaskCanFinish() {
        var task = new ChangeTask(CHANGE);
        task.markSubmitted();
        task.markDone(List.of("/fotoweb/archives/5001/a.jpg.info"));
        assertEquals(TaskStatus.DONE, task.getStatus());
        assertEquals(List.of("/fotoweb/archives/5001/a.jpg.info"), task.getResultRefs());
    }

    @Test
    void failureKeepsItsCause() {
        var task = new ChangeTask(CHANGE);
        var cause = new RuntimeException("boom");
        task.markFailed(cause);
        assertEquals(TaskStatus.FAILED, task.getStatus());
        assertSame(cause, task.getFailure().orElseThrow());
    }

    @Test
    void terminalStatusesAreNeverLeft() {
        var done = new ChangeTask(CHANGE);
        done.markDone(List.of());
        assertThrows(IllegalStateException.class, done::markSubmitted);
        assertThrows(IllegalStateException.class, () -> done.markFailed(new RuntimeException()));
        assertEquals(TaskStatus.DONE, done.getStatus());

        var failed = new ChangeTask(CHANGE);
        failed.markFailed(new RuntimeException());
        assertThrows(IllegalStateException.class, () -> failed.markDone(List.of()));
        assertEquals(TaskStatus.FAILED, failed.getStatus());
    }

    @Test
    void submittedCannotBeSubmittedAgain() {
        var task = new ChangeTask(CHANGE);
        task.markSubmitted();
        assertThrows(IllegalStateException.class, task::markSubmitted);
    }

    @Test
    void transitionTable() {
        assertTrue(TaskStatus.UNCOMMITTED.canTransitionTo(TaskStatus.SUBMITTED));
        assertTrue(TaskStatus.UNCOMMITTED.canTransitionTo(TaskStatus.DONE));
        assertTrue(TaskStatus.UNCOMMITTED.canTransitionTo(TaskStatus.FAILED));
        assertFalse(TaskStatus.UNCOMMITTED.canTransitionTo(TaskStatus.UNCOMMITTED));
        assertFalse(TaskStatus.SUBMITTED.canTransitionTo(TaskStatus.UNCOMMITTED));
        assertFalse(TaskStatus.SUBMITTED.canTransitionTo(TaskStatus.SUBMITTED));
        for (var terminal : List.of(TaskStatus.DONE, TaskStatus.FAILED)) {
            for (var next : TaskStatus.values()) {
                assertFalse(terminal.canTransitionTo(next));
            }
        }
    }
}
