package io.tasker4j.config;

import io.tasker4j.TaskServer;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class TaskServerLifecycleTest {

    private final TaskServer server = mock(TaskServer.class);
    private final TaskServerLifecycle lifecycle = new TaskServerLifecycle(server);

    @Test
    void runningStateShouldFollowTheServer() {
        when(server.isRunning()).thenReturn(true, false);

        assertThat(lifecycle.isRunning()).isTrue();
        assertThat(lifecycle.isRunning()).isFalse();
    }

    @Test
    void shouldStartAutomaticallyInTheLastPhase() {
        lifecycle.start();

        verify(server).start();
        assertThat(lifecycle.isAutoStartup()).isTrue();
        assertThat(lifecycle.getPhase()).isEqualTo(Integer.MAX_VALUE);
    }

    @Test
    void stopCallbackShouldRunEvenWhenStopFails() {
        doThrow(new IllegalStateException("store down")).when(server).stop();
        AtomicBoolean released = new AtomicBoolean();

        lifecycle.stop(() -> released.set(true));

        verify(server).stop();
        assertThat(released).isTrue();
    }
}
