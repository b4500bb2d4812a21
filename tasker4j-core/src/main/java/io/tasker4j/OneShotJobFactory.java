package io.tasker4j;

import java.util.Map;

/**
 * Constructs a {@link OneShotJob} from the parameter map of a queued message.
 */
public interface OneShotJobFactory {
    String jobClass();

    OneShotJob create(Map<String, Object> params);
}
