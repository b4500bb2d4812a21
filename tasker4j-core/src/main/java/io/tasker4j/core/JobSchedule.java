package io.tasker4j.core;

/**
 * A discovered recurring job class paired with its raw schedule expression.
 */
public record JobSchedule(String jobClass, String expression) {
}
