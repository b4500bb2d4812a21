package io.tasker4j.core;

public enum ScheduleMode {
    INTERVAL,
    CRON_EXPRESSION
}
