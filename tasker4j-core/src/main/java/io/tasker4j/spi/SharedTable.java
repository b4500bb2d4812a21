package io.tasker4j.spi;

import java.util.Optional;

/**
 * Key/value storage visible to every worker of a process group.
 *
 * <p>No compare-and-set: callers doing read-modify-write must tolerate lost updates.
 */
public interface SharedTable {

    Optional<String> get(String key);

    void put(String key, String value);
}
