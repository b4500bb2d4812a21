package io.tasker4j;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a {@link RecurringJob} and declares when it fires.
 *
 * <p>Accepted values:
 * <ul>
 *   <li>fixed interval: {@code "every 30s"}, {@code "@every 5m"}, {@code "@hourly"}</li>
 *   <li>cron: {@code "*&#47;5 * * * *"} (5 fields) or a 6-field Quartz expression</li>
 *   <li>macros: {@code @daily}, {@code @midnight}, {@code @weekly}, {@code @monthly}, {@code @yearly}</li>
 * </ul>
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE)
public @interface Recurring {

    String value();

    /**
     * Job class identifier. Empty means the fully qualified class name.
     */
    String name() default "";
}
