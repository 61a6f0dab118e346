package com.testflow.testflow_runner.transport;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Component
public class TransportRegistry {

    private final Map<TransportChannel, InstrumentTransport> transports = new EnumMap<>(TransportChannel.class);

    public TransportRegistry(List<InstrumentTransport> available) {
        for (InstrumentTransport transport : available) {
            for (TransportChannel channel : transport.channels()) {
                InstrumentTransport previous = transports.putIfAbsent(channel, transport);
                if (previous != null) {
                    log.warn("{} already served by {}; ignoring {}", channel,
                            previous.getClass().getSimpleName(), transport.getClass().getSimpleName());
                }
            }
        }
    }

    public InstrumentTransport get(TransportChannel channel) {
        InstrumentTransport transport = transports.get(channel);
        if (transport == null) {
            throw new IllegalArgumentException("No transport registered for channel: " + channel);
        }
        return transport;
    }

    public boolean isSupported(TransportChannel channel) {
        return transports.containsKey(channel);
    }
}
