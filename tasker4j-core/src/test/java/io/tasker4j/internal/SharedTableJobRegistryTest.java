package io.tasker4j.internal;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.tasker4j.core.RecurringJobDescriptor;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SharedTableJobRegistryTest {

    private final InMemorySharedTable table = new InMemorySharedTable();

    @Test
    void workersSharingTheTableShouldSeeEachOthersAdvance() {
        SharedTableJobRegistry workerA = new SharedTableJobRegistry(table, "tasks:recurring", new ObjectMapper());
        SharedTableJobRegistry workerB = new SharedTableJobRegistry(table, "tasks:recurring", new ObjectMapper());

        workerA.replaceAll(List.of(
                RecurringJobDescriptor.interval("heartbeat", 60),
                RecurringJobDescriptor.cron("report", "*/5 * * * *", List.of(100L, 400L, 700L))
        ));

        workerB.advance(1, List.of(400L, 700L));

        List<RecurringJobDescriptor> seen = workerA.list();
        assertThat(seen).hasSize(2);
        assertThat(seen.get(0)).isEqualTo(RecurringJobDescriptor.interval("heartbeat", 60));
        assertThat(seen.get(1).upcoming()).containsExactly(400L, 700L);
        assertThat(seen.get(1).cronExpression()).isEqualTo("*/5 * * * *");
    }

    @Test
    void advanceOutOfRangeShouldBeIgnored() {
        SharedTableJobRegistry registry = new SharedTableJobRegistry(table, "k", new ObjectMapper());
        registry.replaceAll(List.of(RecurringJobDescriptor.cron("report", "*/5 * * * *", List.of(1L))));

        registry.advance(5, List.of());
        registry.advance(-1, List.of());

        assertThat(registry.list().get(0).upcoming()).containsExactly(1L);
    }

    @Test
    void missingOrCorruptBlobShouldReadAsEmpty() {
        SharedTableJobRegistry registry = new SharedTableJobRegistry(table, "k", new ObjectMapper());
        assertThat(registry.list()).isEmpty();

        table.put("k", "{not json");
        assertThat(registry.list()).isEmpty();
    }

    @Test
    void inMemoryRegistryShouldAdvanceTheSameWay() {
        InMemoryJobRegistry registry = new InMemoryJobRegistry();
        registry.replaceAll(List.of(RecurringJobDescriptor.cron("report", "*/5 * * * *", List.of(1L, 2L))));

        registry.advance(0, List.of(2L));

        assertThat(registry.list().get(0).upcoming()).containsExactly(2L);
    }
}
