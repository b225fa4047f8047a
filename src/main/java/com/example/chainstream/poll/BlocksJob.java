package com.example.chainstream.poll;

import com.example.chainstream.log.PublishException;
import com.example.chainstream.message.BlockPayload;
import com.example.chainstream.message.EnvelopePublisher;
import com.example.chainstream.message.SimpleBlockPayload;
import com.example.chainstream.message.StreamKind;
import com.example.chainstream.rpc.BlockSummary;
import com.example.chainstream.rpc.FullBlock;
import com.example.chainstream.rpc.UpstreamClient;
import com.example.chainstream.rpc.UpstreamException;
import com.example.chainstream.stream.Subjects;

import java.time.Clock;
import java.time.Duration;

/**
 * Publishes each new chain head once, with full transaction bodies on {@link Subjects#BLOCKS_FULL} and
 * a reduced summary on {@link Subjects#BLOCKS_SIMPLE}. A head at or below the last published height is
 * skipped.
 */
public class BlocksJob extends PollJob {

    private static final long NONE = -1;

    private long lastPublishedBlock = NONE;

    public BlocksJob(Duration interval, UpstreamClient upstream, EnvelopePublisher publisher, Clock clock) {
        super(StreamKind.BLOCKS, interval, upstream, publisher, clock);
    }

    @Override
    protected void pollOnce() throws UpstreamException, PublishException {
        log.debug("[BLOCKS] Fetching latest block");
        BlockSummary head = upstream.latestHead();
        long number = head.getNumber();
        log.debug("[BLOCKS] Current block number: {}, last published: {}", number, lastPublishedBlock);

        if (number <= lastPublishedBlock) {
            log.debug("[BLOCKS] No new block, skipping");
            return;
        }

        // the head read may be summary-only, so fetch the bodies separately
        FullBlock block = upstream.blockWithTransactions(number);
        log.debug("[BLOCKS] Block #{} {} contains {} transactions", number, head.getHash(),
                block.getTransactions().size());
        BlockPayload payload = BlockPayload.from(block);

        lastPublishedBlock = number;
        publish(Subjects.BLOCKS_FULL, payload);
        publish(Subjects.BLOCKS_SIMPLE, SimpleBlockPayload.from(payload));
    }

    /**
     * Height of the last block handed to the log, or -1 before the first one
     */
    public synchronized long getLastPublishedBlock() {
        return lastPublishedBlock;
    }
}
