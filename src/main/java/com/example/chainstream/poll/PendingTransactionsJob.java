package com.example.chainstream.poll;

import com.example.chainstream.log.PublishException;
import com.example.chainstream.message.EnvelopePublisher;
import com.example.chainstream.message.PendingTransactionsPayload;
import com.example.chainstream.message.StreamKind;
import com.example.chainstream.rpc.UpstreamClient;
import com.example.chainstream.rpc.UpstreamException;
import com.example.chainstream.stream.Subjects;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

/**
 * Publishes a snapshot of the pending pool, truncated to its first {@value #MAX_TRANSACTIONS} entries.
 * An empty pool publishes nothing.
 */
public class PendingTransactionsJob extends PollJob {

    static final int MAX_TRANSACTIONS = 50;

    public PendingTransactionsJob(Duration interval, UpstreamClient upstream, EnvelopePublisher publisher,
                                  Clock clock) {
        super(StreamKind.PENDING_TRANSACTIONS, interval, upstream, publisher, clock);
    }

    @Override
    protected void pollOnce() throws UpstreamException, PublishException {
        log.debug("[PENDING] Fetching pending transactions");
        List<JsonNode> pending = upstream.pendingTransactions();
        if (pending.isEmpty()) {
            log.debug("[PENDING] No pending transactions found");
            return;
        }

        List<JsonNode> limited = pending.subList(0, Math.min(pending.size(), MAX_TRANSACTIONS));
        log.debug("[PENDING] Publishing {} pending transactions (limited from {})", limited.size(), pending.size());
        publish(Subjects.PENDING, new PendingTransactionsPayload(pending.size(), limited, epochSeconds()));
    }
}
