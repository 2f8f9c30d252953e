package com.punchwheel.app.command;

import com.punchwheel.core.JobSchedulerLifecycle;
import com.punchwheel.core.notify.NotificationDispatcher;
import com.punchwheel.core.spi.notify.NotificationProvider;
import com.punchwheel.model.ProviderResult;
import org.junit.jupiter.api.Test;
import org.springframework.boot.DefaultApplicationArguments;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.support.GenericApplicationContext;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class PunchCommandRunnerTest {

    private final JobSchedulerLifecycle lifecycle = mock(JobSchedulerLifecycle.class);

    private final NotificationDispatcher dispatcher = mock(NotificationDispatcher.class);

    private final ByteArrayOutputStream buf = new ByteArrayOutputStream();

    private final PunchCommandRunner runner = new PunchCommandRunner(lifecycle, dispatcher,
            new PrintStream(buf, true, StandardCharsets.UTF_8));

    private String output() {
        return buf.toString(StandardCharsets.UTF_8);
    }

    @Test
    void allProvidersReachableExitsZero() throws Exception {
        when(dispatcher.enabledProviders()).thenReturn(List.of(mock(NotificationProvider.class)));
        when(dispatcher.testConnections()).thenReturn(List.of(
                ProviderResult.sent("discord-main", 204, 1),
                ProviderResult.sent("console", null, 1)));

        runner.run(new DefaultApplicationArguments("test-notifications"));

        assertThat(runner.getExitCode()).isZero();
        assertThat(output()).contains("[OK]   discord-main", "[OK]   console");
        verify(lifecycle, never()).start();
    }

    @Test
    void anyUnreachableProviderExitsOne() throws Exception {
        when(dispatcher.enabledProviders()).thenReturn(List.of(mock(NotificationProvider.class)));
        when(dispatcher.testConnections()).thenReturn(List.of(
                ProviderResult.sent("console", null, 1),
                ProviderResult.failed("slack", 3, "[slack] NETWORK: HTTP 500")));

        runner.run(new DefaultApplicationArguments("test-notifications"));

        assertThat(runner.getExitCode()).isEqualTo(1);
        assertThat(output()).contains("[FAIL] slack: [slack] NETWORK: HTTP 500");
    }

    @Test
    void noEnabledProviderExitsOne() throws Exception {
        when(dispatcher.enabledProviders()).thenReturn(List.of());

        runner.run(new DefaultApplicationArguments("test-notifications"));

        assertThat(runner.getExitCode()).isEqualTo(1);
        verify(dispatcher, never()).testConnections();
    }

    @Test
    void runBlocksUntilContextClosed() throws Exception {
        when(lifecycle.isRunning()).thenReturn(true);

        CompletableFuture<Void> running = CompletableFuture.runAsync(() -> {
            try {
                runner.run(new DefaultApplicationArguments());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });

        verify(lifecycle, org.mockito.Mockito.timeout(2_000)).start();
        Thread.sleep(100);
        assertThat(running).isNotDone();

        runner.onApplicationEvent(new ContextClosedEvent(new GenericApplicationContext()));
        running.get(2, TimeUnit.SECONDS);
        assertThat(runner.getExitCode()).isZero();
    }

    @Test
    void runReturnsWhenSchedulerDisabled() throws Exception {
        when(lifecycle.isRunning()).thenReturn(false);

        runner.run(new DefaultApplicationArguments("run"));

        verify(lifecycle).start();
    }

    @Test
    void unknownCommandIsRejected() {
        assertThatThrownBy(() -> runner.run(new DefaultApplicationArguments("lunch")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("lunch");
    }
}
