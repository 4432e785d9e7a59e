package com.vet.intake.component;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Runs a remote lookup once its input has been stable for a quiet period.
 *
 * <p>Each key ({@code zone:<session>}, {@code search:<session>}) has a generation counter.
 * Submitting bumps it and cancels whatever was pending, so only the lookup for the latest
 * input is issued. A lookup already in flight when a newer one is submitted still
 * completes, but its result is dropped because its generation is stale.
 *
 * <p>A key is forgotten once its latest lookup has finished or it is cancelled.
 */
@Component
public class DebouncedLookup {

    private static final Logger log = LoggerFactory.getLogger(DebouncedLookup.class);

    private final TaskScheduler scheduler;
    private final Clock clock;
    private final Map<String, Slot> slots = new ConcurrentHashMap<>();

    public DebouncedLookup(TaskScheduler scheduler, Clock clock) {
        this.scheduler = scheduler;
        this.clock = clock;
    }

    public <T> long submit(String key, Duration quietPeriod, Supplier<T> fetch, Consumer<T> apply) {
        Map<String, String> callerMdc = MDC.getCopyOfContextMap();
        while (true) {
            Slot slot = slots.computeIfAbsent(key, k -> new Slot());
            synchronized (slot) {
                if (slot.retired) {
                    continue;
                }
                return schedule(key, slot, quietPeriod, callerMdc, fetch, apply);
            }
        }
    }

    private <T> long schedule(String key, Slot slot, Duration quietPeriod, Map<String, String> callerMdc,
                              Supplier<T> fetch, Consumer<T> apply) {
        long token = ++slot.generation;
        if (slot.pending != null) {
            slot.pending.cancel(false);
        }
        slot.pending = scheduler.schedule(
                () -> run(key, slot, token, callerMdc, fetch, apply),
                clock.instant().plus(quietPeriod));
        log.debug("Scheduled lookup {} generation {} in {}", key, token, quietPeriod);
        return token;
    }

    /** Drops any pending lookup for {@code key} and invalidates one in flight. */
    public void cancel(String key) {
        Slot slot = slots.get(key);
        if (slot == null) return;
        synchronized (slot) {
            slot.generation++;
            if (slot.pending != null) {
                slot.pending.cancel(false);
                slot.pending = null;
            }
            retire(key, slot);
        }
    }

    int trackedKeys() {
        return slots.size();
    }

    public long currentGeneration(String key) {
        Slot slot = slots.get(key);
        if (slot == null) return 0;
        synchronized (slot) {
            return slot.generation;
        }
    }

    private <T> void run(String key, Slot slot, long token, Map<String, String> callerMdc,
                         Supplier<T> fetch, Consumer<T> apply) {
        if (callerMdc != null) MDC.setContextMap(callerMdc);
        try {
            if (!isCurrent(slot, token)) {
                log.debug("Lookup {} generation {} superseded before start", key, token);
                return;
            }
            T result;
            try {
                result = fetch.get();
            } catch (RuntimeException e) {
                log.warn("Lookup {} generation {} failed: {}", key, token, e.getMessage());
                synchronized (slot) {
                    if (slot.generation == token) retire(key, slot);
                }
                return;
            }
            synchronized (slot) {
                if (slot.generation != token) {
                    log.debug("Discarding stale result for {} generation {} (current {})", key, token, slot.generation);
                    return;
                }
                slot.pending = null;
                retire(key, slot);
                apply.accept(result);
            }
        } finally {
            MDC.clear();
        }
    }

    /** Caller holds the slot's lock. A submit racing with this picks up a fresh slot. */
    private void retire(String key, Slot slot) {
        slot.retired = true;
        slots.remove(key, slot);
    }

    private boolean isCurrent(Slot slot, long token) {
        synchronized (slot) {
            return slot.generation == token;
        }
    }

    private static final class Slot {
        private long generation;
        private ScheduledFuture<?> pending;
        private boolean retired;
    }
}
