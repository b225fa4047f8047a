package com.example.chainstream.poll;

import com.example.chainstream.log.PublishException;
import com.example.chainstream.message.EnvelopePublisher;
import com.example.chainstream.message.MessageEnvelope;
import com.example.chainstream.message.StreamKind;
import com.example.chainstream.rpc.UpstreamClient;
import com.example.chainstream.rpc.UpstreamException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;

/**
 * A periodic read cycle for one {@link StreamKind}.
 *
 * Each tick performs one upstream read and publishes zero or more envelopes. A failed tick is logged and
 * left for the next tick to retry; nothing escapes {@link #run()}, so the schedule survives every failure.
 * Any cursor a job keeps is private to it and only touched from inside a tick.
 */
public abstract class PollJob implements Runnable {

    protected final Logger log = LoggerFactory.getLogger(getClass());

    protected final UpstreamClient upstream;
    private final StreamKind kind;
    private final Duration interval;
    private final EnvelopePublisher publisher;
    private final Clock clock;

    protected PollJob(StreamKind kind, Duration interval, UpstreamClient upstream, EnvelopePublisher publisher,
                      Clock clock) {
        if (interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException(kind + " interval must be positive: " + interval);
        }
        this.kind = kind;
        this.interval = interval;
        this.upstream = upstream;
        this.publisher = publisher;
        this.clock = clock;
    }

    public StreamKind getKind() {
        return kind;
    }

    public Duration getInterval() {
        return interval;
    }

    /**
     * Run one tick. Synchronized so that a tick started by hand never overlaps a scheduled one.
     */
    @Override
    public final synchronized void run() {
        try {
            pollOnce();
        } catch (UpstreamException e) {
            log.warn("[{}] Upstream read failed, retrying next tick: {}", kind.getTag(), e.getMessage());
        } catch (PublishException e) {
            log.error("[{}] Message dropped: {}", kind.getTag(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("[{}] Unexpected error in poll cycle", kind.getTag(), e);
        }
    }

    /**
     * One read cycle. Throw to abandon the tick; cursor state must only advance once the reads it depends
     * on have succeeded.
     */
    protected abstract void pollOnce() throws UpstreamException, PublishException;

    protected void publish(String subject, Object payload) throws PublishException {
        int size = publisher.publish(new MessageEnvelope(kind, subject, payload, clock.instant()));
        log.info("[{}] Published to {} ({} bytes)", kind.getTag(), subject, size);
    }

    /**
     * Unix seconds, as carried in payload {@code timestamp} fields
     */
    protected long epochSeconds() {
        return clock.instant().getEpochSecond();
    }
}
