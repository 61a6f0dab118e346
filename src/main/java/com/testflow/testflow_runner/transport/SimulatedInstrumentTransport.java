package com.testflow.testflow_runner.transport;

import com.testflow.testflow_runner.config.TestflowProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Default binding for both channels: answers from {@code testflow.transport.simulated.replies},
 * {@code *IDN?} with the configured identity, anything else with the default reply.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SimulatedInstrumentTransport implements InstrumentTransport {

    private final TestflowProperties properties;

    @Override
    public Set<TransportChannel> channels() {
        return EnumSet.allOf(TransportChannel.class);
    }

    @Override
    public TransportReply send(String address, String text) {
        if (address == null || address.isBlank()) {
            return TransportReply.failure("No instrument bound (missing INST:: line)");
        }
        log.debug("[{}] << {}", address, text);
        return TransportReply.sent();
    }

    @Override
    public TransportReply query(String address, String text) {
        if (address == null || address.isBlank()) {
            return TransportReply.failure("No instrument bound (missing INST:: line)");
        }
        TestflowProperties.Transport.Simulated simulated = properties.getTransport().getSimulated();
        String reply = lookup(simulated.getReplies(), text);
        if (reply == null) {
            reply = text.trim().equalsIgnoreCase("*IDN?") ? simulated.getIdentity() : simulated.getDefaultReply();
        }
        log.debug("[{}] ?? {} -> {}", address, text, reply);
        return TransportReply.text(reply);
    }

    @Override
    public TransportReply queryBinary(String address, String text) {
        TransportReply reply = query(address, text);
        return reply.ok()
                ? TransportReply.binary(reply.text().getBytes(StandardCharsets.UTF_8))
                : reply;
    }

    private static String lookup(Map<String, String> replies, String text) {
        String reply = replies.get(text);
        return reply != null ? reply : replies.get(text.trim());
    }
}
