package com.previewstudio.orchestrator.event;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class JobEventBusTest {

    JobEventBus bus = new JobEventBus();

    @Test
    void emit_deliversOnlyToSubscribersOfThatJob() {
        List<String> seen = new ArrayList<>();
        bus.subscribe("a", (id, e) -> seen.add("a:" + e.message()));
        bus.subscribe("b", (id, e) -> seen.add("b:" + e.message()));

        bus.emit("a", JobEvent.log("hello"));

        assertThat(seen).containsExactly("a:hello");
    }

    @Test
    void emit_jobSubscribersBeforeGlobal_inEmissionOrder() {
        List<String> seen = new ArrayList<>();
        bus.subscribeAll((id, e) -> seen.add("global:" + e.message()));
        bus.subscribe("a", (id, e) -> seen.add("job:" + e.message()));

        bus.emit("a", JobEvent.progress(15, "one"));
        bus.emit("a", JobEvent.progress(30, "two"));

        assertThat(seen).containsExactly("job:one", "global:one", "job:two", "global:two");
    }

    @Test
    void emit_throwingHandler_doesNotStopDelivery() {
        List<String> seen = new ArrayList<>();
        bus.subscribe("a", (id, e) -> { throw new IllegalStateException("boom"); });
        bus.subscribe("a", (id, e) -> seen.add(e.message()));

        bus.emit("a", JobEvent.log("still delivered"));

        assertThat(seen).containsExactly("still delivered");
    }

    @Test
    void close_removesExactlyThatHandler() {
        List<String> seen = new ArrayList<>();
        Subscription first = bus.subscribe("a", (id, e) -> seen.add("first"));
        bus.subscribe("a", (id, e) -> seen.add("second"));

        first.close();
        first.close();
        bus.emit("a", JobEvent.log("x"));

        assertThat(seen).containsExactly("second");
        assertThat(bus.subscriberCount("a")).isEqualTo(1);
    }

    @Test
    void close_lastHandler_dropsJobEntry() {
        Subscription sub = bus.subscribe("a", (id, e) -> { });
        sub.close();
        assertThat(bus.subscriberCount("a")).isZero();
    }

    @Test
    void subscribe_racingWithLastUnsubscribe_handlerStaysAttached() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            for (int i = 0; i < 2_000; i++) {
                Subscription leaving = bus.subscribe("a", (id, e) -> { });
                AtomicInteger received = new AtomicInteger();
                CountDownLatch go = new CountDownLatch(1);

                Future<?> close = pool.submit(() -> {
                    go.await();
                    leaving.close();
                    return null;
                });
                Future<Subscription> join = pool.submit(() -> {
                    go.await();
                    return bus.subscribe("a", (id, e) -> received.incrementAndGet());
                });
                go.countDown();
                close.get(5, TimeUnit.SECONDS);
                Subscription joined = join.get(5, TimeUnit.SECONDS);

                bus.emit("a", JobEvent.log("x"));
                assertThat(received).as("iteration %d", i).hasValue(1);
                joined.close();
            }
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void errorEvent_withExitCode_carriesProgressAndExitCode() {
        JobEvent event = JobEvent.error("Render failed with exit code 1", 1);

        assertThat(event.type().isTerminal()).isTrue();
        assertThat(event.exitCode()).isEqualTo(1);
        assertThat(event.progressValue()).isEqualTo(100);
        assertThat(event.data()).containsEntry("error", "Render failed with exit code 1");
    }
}
