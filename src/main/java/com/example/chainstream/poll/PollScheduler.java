package com.example.chainstream.poll;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Runs every {@link PollJob} on its own fixed-delay schedule.
 *
 * The pool has one thread per job, so a stalled job ties up only its own thread. The next tick of a job
 * starts one interval after the previous tick ends: ticks never overlap, and ticks missed during a stall
 * are dropped rather than run back-to-back.
 */
public class PollScheduler {

    private static final Logger log = LoggerFactory.getLogger(PollScheduler.class);

    private final List<PollJob> jobs;
    private final ScheduledExecutorService executorService;
    private final Duration shutdownGrace;
    private boolean started;

    public PollScheduler(List<PollJob> jobs, Duration shutdownGrace) {
        this.jobs = List.copyOf(jobs);
        this.executorService = Executors.newScheduledThreadPool(Math.max(1, jobs.size()),
                new CustomizableThreadFactory("poll-"));
        this.shutdownGrace = shutdownGrace;
    }

    /**
     * Schedule all jobs; the first tick of each runs immediately
     */
    public synchronized void start() {
        if (started) {
            return;
        }
        started = true;
        for (PollJob job : jobs) {
            executorService.scheduleWithFixedDelay(job, 0, job.getInterval().toMillis(), TimeUnit.MILLISECONDS);
            log.info("Polling {} every {}", job.getKind(), job.getInterval());
        }
    }

    public List<PollJob> getJobs() {
        return jobs;
    }

    /**
     * Stop all jobs, interrupting in-flight reads, and wait up to the grace period for them to exit.
     */
    public void shutdown() {
        log.info("Stopping poll jobs");
        executorService.shutdownNow();
        try {
            if (!executorService.awaitTermination(shutdownGrace.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Poll jobs still running after {}", shutdownGrace);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
