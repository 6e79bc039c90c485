package com.questrail.reactive.scheduler.config;

import com.questrail.reactive.scheduler.internal.time.SystemWallClock;
import com.questrail.reactive.scheduler.internal.time.WallClock;
import com.questrail.reactive.scheduler.observability.NullObservabilitySink;
import com.questrail.reactive.scheduler.observability.SchedulerObservabilitySink;

import java.util.Objects;

/**
 * SchedulerConfig
 * -----------------------------------------------------------------------------
 * Per-adapter configuration shared by every backend adapter.
 *
 * <h2>Configuration Parameters</h2>
 * <ul>
 *   <li><b>name</b>: Label used in events, log lines and rejection messages.</li>
 *   <li><b>interruptOnAbort</b>: Whether aborting a task that is already
 *       running may interrupt its thread. Only backends able to interrupt
 *       honour it (the thread-pool adapter); event loops and the local pool
 *       ignore it.</li>
 *   <li><b>observabilitySink</b>: Receives lifecycle and error events.</li>
 *   <li><b>wallClock</b>: Timestamps those events. Never used for delays.</li>
 * </ul>
 */
public record SchedulerConfig(
    String name,
    boolean interruptOnAbort,
    SchedulerObservabilitySink observabilitySink,
    WallClock wallClock
) {
    public SchedulerConfig {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(observabilitySink, "observabilitySink");
        Objects.requireNonNull(wallClock, "wallClock");
        if (name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
    }

    /**
     * Non-interrupting, silent configuration with the given name.
     */
    public static SchedulerConfig defaults(String name) {
        return builder().withName(name).build();
    }

    /**
     * Same settings under another name.
     */
    public SchedulerConfig withName(String newName) {
        return new SchedulerConfig(newName, interruptOnAbort, observabilitySink, wallClock);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String name = "scheduler";
        private boolean interruptOnAbort = false;
        private SchedulerObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;
        private WallClock wallClock = SystemWallClock.INSTANCE;

        public Builder withName(String name) {
            this.name = name;
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

        public Builder withWallClock(WallClock wallClock) {
            this.wallClock = wallClock;
            return this;
        }

        public SchedulerConfig build() {
            return new SchedulerConfig(name, interruptOnAbort, observabilitySink, wallClock);
        }
    }
}
