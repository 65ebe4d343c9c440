package com.devmanager.orchestrator.engine;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BackendCallDispatcherTest {

    SimpleMeterRegistry   meters;
    BackendCallDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        meters     = new SimpleMeterRegistry();
        dispatcher = new BackendCallDispatcher(meters);
    }

    @Test
    void dispatch_returnsValueAndRecordsSuccess() {
        String result = dispatcher.dispatch("next_step", () -> "hello", Duration.ofSeconds(2));

        assertThat(result).isEqualTo("hello");
        assertThat(meters.timer("devmanager.backend.calls", "operation", "next_step", "outcome", "success").count())
                .isEqualTo(1);
    }

    @Test
    void dispatch_engineExceptionFromCall_isRethrownUnchanged() {
        EngineException auth = new EngineException(EngineException.Kind.BACKEND_AUTH, "bad key");

        assertThatThrownBy(() -> dispatcher.dispatch("next_step", () -> { throw auth; }, Duration.ofSeconds(2)))
                .isSameAs(auth);
    }

    @Test
    void dispatch_otherExceptionFromCall_isWrappedAsBackendCall() {
        assertThatThrownBy(() -> dispatcher.dispatch("next_step",
                () -> { throw new IllegalStateException("boom"); }, Duration.ofSeconds(2)))
                .isInstanceOf(EngineException.class)
                .hasMessageContaining("boom")
                .extracting(e -> ((EngineException) e).getKind())
                .isEqualTo(EngineException.Kind.BACKEND_CALL);
    }

    @Test
    void dispatch_slowCall_timesOutAndRejectsNextDispatchWhileOrphanRuns() throws Exception {
        CountDownLatch release = new CountDownLatch(1);

        assertThatThrownBy(() -> dispatcher.dispatch("next_step", () -> {
            release.await(5, TimeUnit.SECONDS);
            return "late";
        }, Duration.ofMillis(100)))
                .isInstanceOf(EngineException.class)
                .hasMessageContaining("timed out");
        assertThat(dispatcher.isBusy()).isTrue();

        assertThatThrownBy(() -> dispatcher.dispatch("next_step", () -> "second", Duration.ofSeconds(1)))
                .hasMessageContaining("already in progress");

        release.countDown();
        assertThat(dispatcher.awaitQuiescence(Duration.ofSeconds(2))).isTrue();
        assertThat(dispatcher.dispatch("next_step", () -> "third", Duration.ofSeconds(1))).isEqualTo("third");
    }

    @Test
    void dispatch_backToBack_neverRejectsFinishedCalls() {
        for (int i = 0; i < 50; i++) {
            int n = i;
            assertThat(dispatcher.dispatch("summarize", () -> n, Duration.ofSeconds(1))).isEqualTo(n);
        }
    }
}
