package org.mongomigrations.workload.unit;

import java.time.Duration;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LogicalUnitTest {

    @Test
    void successfulUnit() {
        var unit = new LogicalUnit("idx_email");
        assertEquals(UnitStatus.PENDING, unit.getStatus());

        unit.start();
        assertEquals(UnitStatus.RUNNING, unit.getStatus());
        unit.succeed(Duration.ofMillis(1500));

        var outcome = unit.toOutcome();
        assertEquals(UnitStatus.SUCCESS, outcome.status());
        assertEquals(1.5, outcome.seconds(), 1e-9);
        assertNull(outcome.message());
        assertTrue(outcome.isSuccess());
    }

    @Test
    void failedUnitKeepsMessage() {
        var unit = new LogicalUnit("Find by email");
        unit.start();
        unit.fail("MongoServerError: bad query", Duration.ZERO);

        var outcome = unit.toOutcome();
        assertEquals(UnitStatus.ERROR, outcome.status());
        assertEquals("MongoServerError: bad query", outcome.message());
        assertFalse(outcome.isSuccess());
    }

    @Test
    void fallBackIsAllowedOnce() {
        var unit = new LogicalUnit("Count active");
        unit.start("allPlansExecution");
        unit.fallBack("executionStats");

        assertTrue(unit.hasFallenBack());
        assertEquals("executionStats", unit.getMode());
        assertThrows(IllegalStateException.class, () -> unit.fallBack("queryPlanner"));

        unit.succeed(Duration.ofSeconds(2));
        assertEquals("executionStats", unit.toOutcome().mode());
    }

    @Test
    void cannotFinishBeforeStarting() {
        var unit = new LogicalUnit("idx_email");
        assertThrows(IllegalStateException.class, () -> unit.succeed(Duration.ZERO));
        assertThrows(IllegalStateException.class, () -> unit.fail("x", Duration.ZERO));
        assertThrows(IllegalStateException.class, () -> unit.fallBack("executionStats"));
        assertThrows(IllegalStateException.class, unit::toOutcome);
    }

    @Test
    void terminalStateIsFinal() {
        var unit = new LogicalUnit("idx_email");
        unit.start();
        unit.succeed(Duration.ZERO);

        assertThrows(IllegalStateException.class, unit::start);
        assertThrows(IllegalStateException.class, () -> unit.fail("late", Duration.ZERO));
        assertThrows(IllegalStateException.class, () -> unit.fallBack("executionStats"));
        assertEquals(UnitStatus.SUCCESS, unit.getStatus());
    }

    @Test
    void runningUnitHasNoOutcome() {
        var unit = new LogicalUnit("idx_email");
        unit.start();
        assertThrows(IllegalStateException.class, unit::toOutcome);
    }

    @Test
    void outcomeRejectsNegativeTimeAndOpenStatus() {
        assertThrows(IllegalArgumentException.class,
            () -> new UnitOutcome("q", UnitStatus.SUCCESS, -0.1, null, null));
        assertThrows(IllegalArgumentException.class,
            () -> new UnitOutcome("q", UnitStatus.RUNNING, 0, null, null));
    }
}
