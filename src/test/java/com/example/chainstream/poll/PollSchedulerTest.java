package com.example.chainstream.poll;

import com.example.chainstream.message.EnvelopePublisher;
import com.example.chainstream.message.StreamKind;
import com.example.chainstream.rpc.UpstreamClient;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.mockito.Mockito.mock;

class PollSchedulerTest {

    private PollScheduler scheduler;

    @AfterEach
    void tearDown() {
        if (scheduler != null) {
            scheduler.shutdown();
        }
    }

    @Test
    void stalledJob_doesNotDelayOtherJobs() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch stalled = new CountDownLatch(1);
        TestJob stalling = new TestJob(StreamKind.BLOCKS, Duration.ofMillis(10), () -> {
            stalled.countDown();
            awaitQuietly(release);
        });
        TestJob gas = new TestJob(StreamKind.GAS_PRICE, Duration.ofMillis(10), () -> { });

        scheduler = new PollScheduler(List.of(stalling, gas), Duration.ofSeconds(1));
        scheduler.start();

        assertThat(stalled.await(5, TimeUnit.SECONDS)).isTrue();
        await().atMost(Duration.ofSeconds(5)).until(() -> gas.ticks.get() >= 5);
        assertThat(stalling.ticks.get()).isEqualTo(1);
        release.countDown();
    }

    @Test
    void failingJob_keepsItsSchedule() {
        TestJob failing = new TestJob(StreamKind.LOGS, Duration.ofMillis(10), () -> {
            throw new IllegalStateException("boom");
        });

        scheduler = new PollScheduler(List.of(failing), Duration.ofSeconds(1));
        scheduler.start();

        await().atMost(Duration.ofSeconds(5)).until(() -> failing.ticks.get() >= 3);
    }

    @Test
    void slowTicks_neverOverlap() {
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger maxInFlight = new AtomicInteger();
        TestJob slow = new TestJob(StreamKind.PENDING_TRANSACTIONS, Duration.ofMillis(5), () -> {
            maxInFlight.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
            sleepQuietly(30);
            inFlight.decrementAndGet();
        });

        scheduler = new PollScheduler(List.of(slow), Duration.ofSeconds(1));
        scheduler.start();

        await().atMost(Duration.ofSeconds(5)).until(() -> slow.ticks.get() >= 5);
        assertThat(maxInFlight.get()).isEqualTo(1);
    }

    @Test
    void stalledTick_isNotFollowedByBurstOfMissedTicks() {
        long period = 100;
        List<Long> tickStarts = new CopyOnWriteArrayList<>();
        AtomicLong stallEnd = new AtomicLong();
        TestJob blocks = new TestJob(StreamKind.BLOCKS, Duration.ofMillis(period), () -> {
            tickStarts.add(System.nanoTime());
            if (tickStarts.size() == 1) {
                sleepQuietly(1000);
                stallEnd.set(System.nanoTime());
            }
        });

        scheduler = new PollScheduler(List.of(blocks), Duration.ofSeconds(1));
        scheduler.start();

        await().atMost(Duration.ofSeconds(5)).until(() -> blocks.ticks.get() >= 3);
        long burstWindowEnd = stallEnd.get() + TimeUnit.MILLISECONDS.toNanos(period / 2);
        long ticksRightAfterStall = tickStarts.stream()
                .skip(1)
                .filter(start -> start < burstWindowEnd)
                .count();
        assertThat(ticksRightAfterStall).isLessThanOrEqualTo(1);
        assertThat(tickStarts.get(1) - stallEnd.get())
                .isGreaterThanOrEqualTo(TimeUnit.MILLISECONDS.toNanos(period / 2));
    }

    @Test
    void shutdown_stopsAllJobs() throws Exception {
        TestJob network = new TestJob(StreamKind.NETWORK_STATS, Duration.ofMillis(10), () -> { });
        scheduler = new PollScheduler(List.of(network), Duration.ofSeconds(1));
        scheduler.start();
        await().atMost(Duration.ofSeconds(5)).until(() -> network.ticks.get() >= 2);

        scheduler.shutdown();
        int ticksAtShutdown = network.ticks.get();
        Thread.sleep(100);

        assertThat(network.ticks.get()).isEqualTo(ticksAtShutdown);
    }

    private static void awaitQuietly(CountDownLatch latch) {
        try {
            latch.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void sleepQuietly(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static final class TestJob extends PollJob {
        private final AtomicInteger ticks = new AtomicInteger();
        private final Runnable body;

        private TestJob(StreamKind kind, Duration interval, Runnable body) {
            super(kind, interval, mock(UpstreamClient.class), mock(EnvelopePublisher.class), Clock.systemUTC());
            this.body = body;
        }

        @Override
        protected void pollOnce() {
            ticks.incrementAndGet();
            body.run();
        }
    }
}
