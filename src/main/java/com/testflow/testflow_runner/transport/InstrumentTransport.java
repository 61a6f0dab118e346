package com.testflow.testflow_runner.transport;

import java.util.Set;

/**
 * Talks to one kind of instrument link. Implementations report every failure through
 * {@link TransportReply#failure(String)}.
 */
public interface InstrumentTransport {

    Set<TransportChannel> channels();

    TransportReply send(String address, String text);

    TransportReply query(String address, String text);

    TransportReply queryBinary(String address, String text);

    default boolean isReachable(String address) {
        return query(address, "*IDN?").ok();
    }
}
