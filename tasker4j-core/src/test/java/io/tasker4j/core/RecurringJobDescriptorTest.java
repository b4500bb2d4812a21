package io.tasker4j.core;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RecurringJobDescriptorTest {

    @Test
    void intervalDescriptorShouldDropCronFields() {
        RecurringJobDescriptor d = new RecurringJobDescriptor("report", ScheduleMode.INTERVAL, 60, "* * * * *", List.of(1L));

        assertTrue(d.usesInterval());
        assertNull(d.cronExpression());
        assertNull(d.upcoming());
        assertFalse(d.needsRefill());
        assertThrows(IllegalStateException.class, () -> d.withUpcoming(List.of(5L)));
    }

    @Test
    void cronDescriptorShouldRequireStrictlyIncreasingUpcoming() {
        assertThrows(IllegalArgumentException.class,
                () -> RecurringJobDescriptor.cron("report", "*/5 * * * *", List.of(10L, 10L)));
        assertThrows(IllegalArgumentException.class,
                () -> RecurringJobDescriptor.cron("report", "*/5 * * * *", List.of(20L, 10L)));
    }

    @Test
    void emptyOrMissingUpcomingShouldNeedRefill() {
        assertTrue(RecurringJobDescriptor.cron("r", "*/5 * * * *", null).needsRefill());
        assertTrue(RecurringJobDescriptor.cron("r", "*/5 * * * *", List.of()).needsRefill());

        RecurringJobDescriptor d = RecurringJobDescriptor.cron("r", "*/5 * * * *", List.of(10L, 20L));
        assertFalse(d.needsRefill());
        assertEquals(10L, d.earliest().getAsLong());
        assertEquals(List.of(20L), d.withUpcoming(List.of(20L)).upcoming());
    }

    @Test
    void invalidIntervalShouldBeRejected() {
        assertThrows(IllegalArgumentException.class, () -> RecurringJobDescriptor.interval("r", 0));
        assertThrows(IllegalArgumentException.class, () -> RecurringJobDescriptor.interval(" ", 10));
    }
}
