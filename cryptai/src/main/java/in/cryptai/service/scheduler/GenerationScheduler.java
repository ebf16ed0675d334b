package in.cryptai.service.scheduler;

import in.cryptai.domain.signal.RunResult;
import in.cryptai.service.daily.DayMaterializer;
import in.cryptai.service.signal.HourlySignalGenerator;
import in.cryptai.util.UtcDates;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Fires the hourly run at the top of every UTC hour (plus offset) and the
 * best-of-day pass for yesterday shortly after UTC midnight.
 *
 * Each task reschedules itself from the clock instead of using a fixed rate, so
 * a slow run never drifts the next trigger. The current hour is attempted once
 * on start; a finalized hour costs one slot read.
 */
public final class GenerationScheduler {
    private static final Logger log = LoggerFactory.getLogger(GenerationScheduler.class);

    private final HourlySignalGenerator generator;
    private final DayMaterializer materializer;
    private final Clock clock;
    private final int triggerOffsetMinutes;
    private final int materializeOffsetMinutes;
    private final ScheduledExecutorService scheduler;

    private volatile boolean running = false;

    public GenerationScheduler(HourlySignalGenerator generator,
                               DayMaterializer materializer,
                               Clock clock,
                               int triggerOffsetMinutes,
                               int materializeOffsetMinutes) {
        this.generator = generator;
        this.materializer = materializer;
        this.clock = clock;
        this.triggerOffsetMinutes = triggerOffsetMinutes;
        this.materializeOffsetMinutes = materializeOffsetMinutes;
        ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(1, r -> {
            Thread t = new Thread(r, "generation-scheduler");
            t.setDaemon(true);
            return t;
        });
        // Pending next-tick tasks are dropped on stop; a running tick is allowed to finish
        executor.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
        this.scheduler = executor;
    }

    /**
     * Single use: a stopped scheduler cannot be started again.
     *
     * @throws IllegalStateException if called after {@link #stop()}
     */
    public synchronized void start() {
        if (scheduler.isShutdown()) {
            throw new IllegalStateException("GenerationScheduler is stopped and cannot be restarted");
        }
        if (running) {
            log.warn("[SCHEDULER] Already started");
            return;
        }
        running = true;
        scheduler.schedule(this::hourlyTick, 0, TimeUnit.MILLISECONDS);
        scheduleDaily();
        log.info("[SCHEDULER] Started: hourly offset={}m, daily offset={}m",
            triggerOffsetMinutes, materializeOffsetMinutes);
    }

    public synchronized void stop() {
        running = false;
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(10, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("[SCHEDULER] Stopped");
    }

    /**
     * Run generation for the UTC hour containing now.
     */
    public RunResult triggerHourly() {
        ZonedDateTime now = clock.instant().atZone(ZoneOffset.UTC);
        return generator.runHour(now.toLocalDate(), now.getHour());
    }

    /**
     * Materialize best of day for the UTC day before today.
     */
    public void triggerDaily() {
        LocalDate yesterday = UtcDates.today(clock).minusDays(1);
        materializer.materialize(yesterday);
    }

    private void hourlyTick() {
        try {
            triggerHourly();
        } catch (Exception e) {
            log.error("[SCHEDULER] Hourly run failed", e);
        } finally {
            scheduleHourly();
        }
    }

    private void dailyTick() {
        try {
            triggerDaily();
        } catch (Exception e) {
            log.error("[SCHEDULER] Best-of-day run failed", e);
        } finally {
            scheduleDaily();
        }
    }

    private void scheduleHourly() {
        if (!running) {
            return;
        }
        Duration delay = delayUntilNextHour(clock.instant(), triggerOffsetMinutes);
        if (!submit(this::hourlyTick, delay)) {
            return;
        }
        log.debug("[SCHEDULER] Next hourly run in {}s", delay.toSeconds());
    }

    private void scheduleDaily() {
        if (!running) {
            return;
        }
        Duration delay = delayUntilNextDay(clock.instant(), materializeOffsetMinutes);
        if (!submit(this::dailyTick, delay)) {
            return;
        }
        log.debug("[SCHEDULER] Next best-of-day run in {}s", delay.toSeconds());
    }

    // A tick finishing while stop() shuts the executor down is not an error
    private boolean submit(Runnable task, Duration delay) {
        try {
            scheduler.schedule(task, delay.toMillis(), TimeUnit.MILLISECONDS);
            return true;
        } catch (RejectedExecutionException e) {
            log.debug("[SCHEDULER] Not rescheduled, executor is shut down");
            return false;
        }
    }

    /**
     * Time from now to the next HH:offset boundary, strictly in the future.
     */
    static Duration delayUntilNextHour(Instant now, int offsetMinutes) {
        Instant next = now.truncatedTo(ChronoUnit.HOURS).plus(offsetMinutes, ChronoUnit.MINUTES);
        if (!next.isAfter(now)) {
            next = next.plus(1, ChronoUnit.HOURS);
        }
        return Duration.between(now, next);
    }

    /**
     * Time from now to the next 00:offset UTC, strictly in the future.
     */
    static Duration delayUntilNextDay(Instant now, int offsetMinutes) {
        Instant next = now.truncatedTo(ChronoUnit.DAYS).plus(offsetMinutes, ChronoUnit.MINUTES);
        if (!next.isAfter(now)) {
            next = next.plus(1, ChronoUnit.DAYS);
        }
        return Duration.between(now, next);
    }
}
