package com.example.chainstream.poll;

import com.example.chainstream.log.PublishException;
import com.example.chainstream.message.EnvelopePublisher;
import com.example.chainstream.message.GasPricePayload;
import com.example.chainstream.message.StreamKind;
import com.example.chainstream.rpc.UpstreamClient;
import com.example.chainstream.rpc.UpstreamException;
import com.example.chainstream.stream.Subjects;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Duration;

/**
 * Publishes the node's suggested gas price every tick.
 */
public class GasPriceJob extends PollJob {

    public GasPriceJob(Duration interval, UpstreamClient upstream, EnvelopePublisher publisher, Clock clock) {
        super(StreamKind.GAS_PRICE, interval, upstream, publisher, clock);
    }

    @Override
    protected void pollOnce() throws UpstreamException, PublishException {
        BigInteger gasPrice = upstream.suggestedGasPrice();
        publish(Subjects.GAS_PRICE, new GasPricePayload(gasPrice, epochSeconds()));
    }
}
