package com.dispatchplatform.bureau.orchestrator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Named periodic tasks of one city, cancellable as a unit.
 *
 * <p>A task never overlaps itself: ticks that arrive while a run is still in flight are dropped.
 * A failing run is logged and the schedule continues.
 */
public class CityTaskScheduler {

    private static final Logger log = LoggerFactory.getLogger(CityTaskScheduler.class);

    private final String city;
    private final Scheduler timer;
    private final Map<String, Disposable> tasks = new LinkedHashMap<>();

    public CityTaskScheduler(String city, Scheduler timer) {
        this.city  = city;
        this.timer = timer;
    }

    /** Registers {@code name}, replacing a task already registered under it. */
    public synchronized void schedule(String name, Duration initialDelay, Duration period, Supplier<Mono<Void>> task) {
        cancel(name);
        Disposable handle = Flux.interval(initialDelay, period, timer)
            .onBackpressureDrop(tick -> log.debug("[Tasks] Tick skipped, previous run still active. city={} task={}",
                                                  city, name))
            .concatMap(tick -> Mono.defer(task)
                .onErrorResume(e -> {
                    log.warn("[Tasks] Run failed. city={} task={} reason={}", city, name, e.getMessage());
                    return Mono.empty();
                }), 1)
            .subscribe();
        tasks.put(name, handle);
        log.info("[Tasks] Scheduled. city={} task={} initialDelay={} period={}", city, name, initialDelay, period);
    }

    public synchronized void cancel(String name) {
        Disposable existing = tasks.remove(name);
        if (existing != null) existing.dispose();
    }

    public synchronized void cancelAll() {
        tasks.values().forEach(Disposable::dispose);
        log.info("[Tasks] Cancelled. city={} tasks={}", city, tasks.keySet());
        tasks.clear();
    }

    public synchronized Set<String> taskNames() {
        return Set.copyOf(tasks.keySet());
    }

    public synchronized boolean isActive(String name) {
        Disposable handle = tasks.get(name);
        return handle != null && !handle.isDisposed();
    }
}
