package com.testflow.testflow_runner.support;

import com.testflow.testflow_runner.transport.InstrumentTransport;
import com.testflow.testflow_runner.transport.TransportChannel;
import com.testflow.testflow_runner.transport.TransportReply;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * In-memory instrument: records every call as {@code "<address>|<text>"}, answers from a
 * reply table and fails the commands it was told to fail.
 */
public class RecordingTransport implements InstrumentTransport {

    private final List<String> writes = new ArrayList<>();
    private final List<String> queries = new ArrayList<>();
    private final Map<String, String> replies = new HashMap<>();
    private final Map<String, Runnable> hooks = new HashMap<>();
    private final Set<String> failing = new HashSet<>();
    private String defaultReply = "0";

    public RecordingTransport reply(String command, String reply) {
        replies.put(command, reply);
        return this;
    }

    public RecordingTransport defaultReply(String reply) {
        this.defaultReply = reply;
        return this;
    }

    public RecordingTransport fail(String command) {
        failing.add(command);
        return this;
    }

    /** Runs {@code hook} every time {@code command} is queried. */
    public RecordingTransport whenQueried(String command, Runnable hook) {
        hooks.put(command, hook);
        return this;
    }

    @Override
    public Set<TransportChannel> channels() {
        return EnumSet.allOf(TransportChannel.class);
    }

    @Override
    public TransportReply send(String address, String text) {
        writes.add(address + "|" + text);
        return failing.contains(text) ? TransportReply.failure("write refused") : TransportReply.sent();
    }

    @Override
    public TransportReply query(String address, String text) {
        queries.add(address + "|" + text);
        hooks.getOrDefault(text, () -> { }).run();
        if (failing.contains(text)) {
            return TransportReply.failure("timeout");
        }
        return TransportReply.text(replies.getOrDefault(text, defaultReply));
    }

    @Override
    public TransportReply queryBinary(String address, String text) {
        TransportReply reply = query(address, text);
        return reply.ok() ? TransportReply.binary(reply.text().getBytes(StandardCharsets.UTF_8)) : reply;
    }

    public List<String> writes() {
        return writes;
    }

    public List<String> queries() {
        return queries;
    }
}
