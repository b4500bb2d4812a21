package io.tasker4j.spi;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Contract over the external ordered store that holds one-shot job payloads.
 *
 * <p>Two logical queues per key namespace:
 * <ul>
 *   <li>immediate queue: FIFO list</li>
 *   <li>delayed queue: sorted set, member = payload, score = runAt (epoch seconds)</li>
 * </ul>
 *
 * <p>{@link #rangeByScore} followed by {@link #remove} is not atomic. A payload published into the
 * queried window after the range call is not removed, because removal is by member.
 */
public interface QueueGateway {

    void push(String key, String payload);

    /**
     * Non-blocking FIFO pop.
     */
    Optional<String> popOrEmpty(String key);

    /**
     * Adds (or re-scores) a delayed member.
     */
    void pushDelayed(String key, String payload, long score);

    /**
     * Members with {@code min <= score <= max}, ascending by score.
     */
    List<String> rangeByScore(String key, long min, long max);

    /**
     * Removes the given members.
     *
     * @return number of members actually removed
     */
    long remove(String key, Collection<String> payloads);
}
