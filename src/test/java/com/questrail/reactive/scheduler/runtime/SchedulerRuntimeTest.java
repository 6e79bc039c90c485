package com.questrail.reactive.scheduler.runtime;

import com.questrail.reactive.scheduler.TaskRejectedException;
import com.questrail.reactive.scheduler.backend.local.LocalTaskPool;
import com.questrail.reactive.scheduler.backend.netty.NettyEventLoopScheduler;
import com.questrail.reactive.scheduler.backend.executor.ExecutorServiceScheduler;
import com.questrail.reactive.scheduler.observability.RecordingObservabilitySink;
import com.questrail.reactive.scheduler.observability.TaskLifecycleEvent.Kind;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class SchedulerRuntimeTest {

    private RecordingObservabilitySink sink;
    private SchedulerRuntime runtime;

    @BeforeEach
    void setUp() {
        sink = new RecordingObservabilitySink();
        runtime = SchedulerRuntime.builder()
            .withName("rt")
            .withPoolSize(2)
            .withEventLoopThreads(1)
            .withDrainTimeout(Duration.ofSeconds(2))
            .withObservabilitySink(sink)
            .build();
    }

    @AfterEach
    void tearDown() {
        runtime.stop();
    }

    @Test
    void accessorsRequireRunningRuntime() {
        assertFalse(runtime.isRunning());
        assertThrows(IllegalStateException.class, runtime::threadPool);
        assertThrows(IllegalStateException.class, runtime::eventLoop);
    }

    @Test
    void startExposesNamedBackends() {
        runtime.start();
        runtime.start();

        assertTrue(runtime.isRunning());
        assertEquals("rt-pool", runtime.threadPool().name());
        assertEquals("rt-loop", runtime.eventLoop().name());
    }

    @Test
    void schedulersExistWheneverRuntimeReportsRunning() throws InterruptedException {
        AtomicReference<Throwable> failure = new AtomicReference<>();
        CountDownLatch readerReady = new CountDownLatch(1);
        Thread reader = new Thread(() -> {
            readerReady.countDown();
            long giveUp = System.nanoTime() + TimeUnit.SECONDS.toNanos(2);
            while (System.nanoTime() < giveUp) {
                if (runtime.isRunning()) {
                    try {
                        assertNotNull(runtime.threadPool());
                        assertNotNull(runtime.eventLoop());
                    } catch (Throwable t) {
                        failure.set(t);
                    }
                    return;
                }
            }
        }, "runtime-reader");
        reader.start();
        assertTrue(readerReady.await(1, TimeUnit.SECONDS));

        runtime.start();
        reader.join(3_000);

        assertFalse(reader.isAlive());
        assertNull(failure.get());
        assertTrue(runtime.isRunning());
    }

    @Test
    void stopEndsRunningState() {
        runtime.start();
        runtime.stop();

        assertFalse(runtime.isRunning());
        assertThrows(IllegalStateException.class, runtime::threadPool);
    }

    @Test
    void stopDrainsSubmittedWork() {
        runtime.start();
        AtomicInteger counter = new AtomicInteger();
        ExecutorServiceScheduler pool = runtime.threadPool();
        NettyEventLoopScheduler loop = runtime.eventLoop();

        for (int i = 0; i < 100; i++) {
            pool.schedule((sub, c) -> c.incrementAndGet(), Duration.ofMillis(5), counter);
            loop.schedule((sub, c) -> c.incrementAndGet(), Duration.ofMillis(5), counter);
        }
        runtime.stop();

        assertFalse(runtime.isRunning());
        assertEquals(200, counter.get());
    }

    @Test
    void stoppedRuntimeRejectsWorkAndCannotRestart() {
        runtime.start();
        ExecutorServiceScheduler pool = runtime.threadPool();
        NettyEventLoopScheduler loop = runtime.eventLoop();
        runtime.stop();
        runtime.stop();

        assertThrows(TaskRejectedException.class, () -> pool.schedule((sub, s) -> {}, null));
        assertThrows(TaskRejectedException.class, () -> loop.schedule((sub, s) -> {}, null));
        assertEquals(2, sink.count(Kind.REJECTED));
        assertThrows(IllegalStateException.class, runtime::start);
    }

    @Test
    void localPoolsShareTheRuntimeSink() {
        List<String> log = new ArrayList<>();

        try (LocalTaskPool local = runtime.newLocalPool()) {
            local.spawner().schedule((sub, l) -> l.add("ran"), log);
            local.runDueTasks();
        }

        assertEquals(List.of("ran"), log);
        assertEquals(1, sink.count(Kind.COMPLETED));
        assertEquals("rt-local", sink.taskEvents().get(0).scheduler());
    }

    @Test
    void invalidSettingsAreRejected() {
        assertThrows(IllegalArgumentException.class,
            () -> SchedulerRuntime.builder().withPoolSize(0).build());
        assertThrows(IllegalArgumentException.class,
            () -> SchedulerRuntime.builder().withEventLoopThreads(-1).build());
        assertThrows(IllegalArgumentException.class,
            () -> SchedulerRuntime.builder().withDrainTimeout(Duration.ofSeconds(-1)).build());
    }
}
