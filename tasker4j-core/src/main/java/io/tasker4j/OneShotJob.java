package io.tasker4j;

import java.util.Map;

/**
 * A job enqueued once with parameters.
 *
 * <p>{@link #process()} returns {@code true} on success. Returning {@code false} or throwing
 * counts as a failed attempt and is subject to the retry policy carried by the message.
 */
public interface OneShotJob {

    boolean process() throws Exception;

    Map<String, Object> getParams();

    /**
     * JSON rendering of the job, used in log lines.
     */
    String toJson();
}
