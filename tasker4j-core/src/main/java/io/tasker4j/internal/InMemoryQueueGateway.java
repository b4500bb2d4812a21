package io.tasker4j.internal;

import io.tasker4j.spi.QueueGateway;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeSet;

/**
 * Process-local {@link QueueGateway}. Suitable for a single scheduler process and for tests.
 *
 * <p>Delayed members are ordered by score, ties by member, matching a sorted set.
 */
public class InMemoryQueueGateway implements QueueGateway {

    private record Scored(long score, String member) {
    }

    private static final Comparator<Scored> ORDER =
            Comparator.comparingLong(Scored::score).thenComparing(Scored::member);

    private final Map<String, Deque<String>> lists = new HashMap<>();
    private final Map<String, Map<String, Long>> scores = new HashMap<>();
    private final Map<String, TreeSet<Scored>> sortedSets = new HashMap<>();

    @Override
    public synchronized void push(String key, String payload) {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(payload, "payload must not be null");
        lists.computeIfAbsent(key, k -> new ArrayDeque<>()).addLast(payload);
    }

    @Override
    public synchronized Optional<String> popOrEmpty(String key) {
        Deque<String> list = lists.get(key);
        if (list == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(list.pollFirst());
    }

    @Override
    public synchronized void pushDelayed(String key, String payload, long score) {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(payload, "payload must not be null");
        Map<String, Long> byMember = scores.computeIfAbsent(key, k -> new HashMap<>());
        TreeSet<Scored> ordered = sortedSets.computeIfAbsent(key, k -> new TreeSet<>(ORDER));

        Long previous = byMember.put(payload, score);
        if (previous != null) {
            ordered.remove(new Scored(previous, payload));
        }
        ordered.add(new Scored(score, payload));
    }

    @Override
    public synchronized List<String> rangeByScore(String key, long min, long max) {
        TreeSet<Scored> ordered = sortedSets.get(key);
        if (ordered == null || min > max) {
            return List.of();
        }
        List<String> out = new ArrayList<>();
        for (Scored s : ordered.tailSet(new Scored(min, ""), true)) {
            if (s.score() > max) {
                break;
            }
            out.add(s.member());
        }
        return out;
    }

    @Override
    public synchronized long remove(String key, Collection<String> payloads) {
        Map<String, Long> byMember = scores.get(key);
        if (byMember == null || payloads == null || payloads.isEmpty()) {
            return 0;
        }
        TreeSet<Scored> ordered = sortedSets.get(key);
        long removed = 0;
        for (String member : payloads) {
            Long score = byMember.remove(member);
            if (score != null) {
                ordered.remove(new Scored(score, member));
                removed++;
            }
        }
        return removed;
    }

    public synchronized int immediateSize(String key) {
        Deque<String> list = lists.get(key);
        return list == null ? 0 : list.size();
    }

    public synchronized int delayedSize(String key) {
        Map<String, Long> byMember = scores.get(key);
        return byMember == null ? 0 : byMember.size();
    }
}
