package com.questrail.reactive.scheduler.runtime;

import com.questrail.reactive.scheduler.Drainable;
import com.questrail.reactive.scheduler.SharedScheduler;
import com.questrail.reactive.scheduler.backend.executor.ExecutorServiceScheduler;
import com.questrail.reactive.scheduler.backend.local.LocalTaskPool;
import com.questrail.reactive.scheduler.backend.netty.NettyEventLoopScheduler;
import com.questrail.reactive.scheduler.config.SchedulerConfig;
import com.questrail.reactive.scheduler.internal.time.MonotonicClock;
import com.questrail.reactive.scheduler.internal.time.SystemMonotonicClock;
import com.questrail.reactive.scheduler.observability.NullObservabilitySink;
import com.questrail.reactive.scheduler.observability.SchedulerObservabilitySink;

import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.util.concurrent.DefaultThreadFactory;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * SchedulerRuntime
 * =============================================================================
 * Composition root and lifecycle owner for the production backends.
 *
 * <p>Owns one {@link ScheduledThreadPoolExecutor} (thread-pool backend) and one
 * Netty {@link NioEventLoopGroup} (managed async runtime backend) and exposes
 * each as a {@link SharedScheduler}. Local pools are cheap and owned by the
 * caller, see {@link #newLocalPool()}.</p>
 *
 * <h2>Lifecycle</h2>
 * <pre>
 *   runtime.start()  → creates the backends
 *   runtime.stop()   → drains both schedulers, then shuts the backends down
 * </pre>
 * Both calls are idempotent and serialized. A stopped runtime cannot be
 * restarted. {@link #isRunning()} turns true only after both schedulers exist.
 */
public final class SchedulerRuntime {
    private static final Logger log = LoggerFactory.getLogger(SchedulerRuntime.class);

    private final int poolSize;
    private final int eventLoopThreads;
    private final Duration drainTimeout;
    private final SchedulerConfig config;
    private final MonotonicClock clock;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean stopped = new AtomicBoolean(false);
    // Set only once both schedulers are assigned; accessors read this alone.
    private volatile boolean running;

    private volatile ScheduledThreadPoolExecutor poolExecutor;
    private volatile EventLoopGroup eventLoopGroup;
    private volatile ExecutorServiceScheduler threadPool;
    private volatile NettyEventLoopScheduler eventLoop;

    private SchedulerRuntime(int poolSize,
                             int eventLoopThreads,
                             Duration drainTimeout,
                             SchedulerConfig config,
                             MonotonicClock clock) {
        this.poolSize = poolSize;
        this.eventLoopThreads = eventLoopThreads;
        this.drainTimeout = drainTimeout;
        this.config = config;
        this.clock = clock;
    }

    public synchronized void start() {
        if (stopped.get()) {
            throw new IllegalStateException("SchedulerRuntime has been stopped");
        }
        if (!started.compareAndSet(false, true)) {
            return;
        }

        ScheduledThreadPoolExecutor executor =
            new ScheduledThreadPoolExecutor(poolSize, new DefaultThreadFactory(config.name() + "-pool"));
        // Aborted delayed tasks leave the work queue immediately.
        executor.setRemoveOnCancelPolicy(true);
        poolExecutor = executor;
        eventLoopGroup = new NioEventLoopGroup(eventLoopThreads, new DefaultThreadFactory(config.name() + "-loop"));

        threadPool = new ExecutorServiceScheduler(poolExecutor, config.withName(config.name() + "-pool"));
        eventLoop = new NettyEventLoopScheduler(eventLoopGroup, config.withName(config.name() + "-loop"));
        running = true;

        log.info("Scheduler runtime '{}' started (pool threads: {}, event loops: {})",
            config.name(), poolSize, eventLoopThreads == 0 ? "default" : eventLoopThreads);
    }

    public synchronized void stop() {
        if (!started.get() || !stopped.compareAndSet(false, true)) {
            return;
        }
        running = false;

        boolean drained = drain(threadPool) & drain(eventLoop);
        if (!drained) {
            log.warn("Scheduler runtime '{}' stopping with tasks still in flight", config.name());
        }

        eventLoopGroup.shutdownGracefully(0, drainTimeout.toMillis(), TimeUnit.MILLISECONDS)
            .awaitUninterruptibly(drainTimeout.toMillis() + 1000);

        poolExecutor.shutdown();
        try {
            if (!poolExecutor.awaitTermination(drainTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                poolExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            poolExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }

        log.info("Scheduler runtime '{}' stopped", config.name());
    }

    private boolean drain(Drainable scheduler) {
        try {
            return scheduler.awaitIdle(drainTimeout);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * @return the thread-pool backed scheduler
     * @throws IllegalStateException if the runtime is not running
     */
    public ExecutorServiceScheduler threadPool() {
        requireRunning();
        return threadPool;
    }

    /**
     * @return the Netty event-loop backed scheduler
     * @throws IllegalStateException if the runtime is not running
     */
    public NettyEventLoopScheduler eventLoop() {
        requireRunning();
        return eventLoop;
    }

    /**
     * Create a cooperative local pool sharing this runtime's sink and clock.
     * The caller owns it and drives it from its own thread.
     */
    public LocalTaskPool newLocalPool() {
        return new LocalTaskPool(clock, config.withName(config.name() + "-local"));
    }

    private void requireRunning() {
        if (!isRunning()) {
            throw new IllegalStateException("SchedulerRuntime '" + config.name() + "' is not running");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String name = "reactive";
        private int poolSize = Runtime.getRuntime().availableProcessors();
        private int eventLoopThreads = 0;
        private Duration drainTimeout = Duration.ofSeconds(5);
        private boolean interruptOnAbort = false;
        private SchedulerObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;
        private MonotonicClock clock = SystemMonotonicClock.INSTANCE;

        public Builder withName(String name) {
            this.name = name;
            return this;
        }

        public Builder withPoolSize(int poolSize) {
            this.poolSize = poolSize;
            return this;
        }

        /**
         * @param threads event-loop thread count; 0 selects Netty's default
         */
        public Builder withEventLoopThreads(int threads) {
            this.eventLoopThreads = threads;
            return this;
        }

        public Builder withDrainTimeout(Duration timeout) {
            this.drainTimeout = timeout;
            return this;
        }

        public Builder withInterruptOnAbort(boolean interruptOnAbort) {
            this.interruptOnAbort = interruptOnAbort;
            return this;
        }

        public Builder withObservabilitySink(SchedulerObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        public Builder withClock(MonotonicClock clock) {
            this.clock = clock;
            return this;
        }

        public SchedulerRuntime build() {
            Objects.requireNonNull(drainTimeout, "drainTimeout");
            Objects.requireNonNull(clock, "clock");
            if (poolSize < 1) {
                throw new IllegalArgumentException("poolSize must be >= 1");
            }
            if (eventLoopThreads < 0) {
                throw new IllegalArgumentException("eventLoopThreads must be >= 0");
            }
            if (drainTimeout.isNegative()) {
                throw new IllegalArgumentException("drainTimeout must be non-negative");
            }

            SchedulerConfig config = SchedulerConfig.builder()
                .withName(name)
                .withInterruptOnAbort(interruptOnAbort)
                .withObservabilitySink(observabilitySink)
                .build();

            return new SchedulerRuntime(poolSize, eventLoopThreads, drainTimeout, config, clock);
        }
    }
}
