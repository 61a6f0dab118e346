package com.testflow.testflow_runner.executor.impl;

import com.testflow.testflow_runner.config.TestflowProperties;
import com.testflow.testflow_runner.control.Sleeper;
import com.testflow.testflow_runner.model.run.RunContext;
import com.testflow.testflow_runner.result.ResultColumns;
import com.testflow.testflow_runner.result.ResultRecorder;
import com.testflow.testflow_runner.transport.InstrumentTransport;
import com.testflow.testflow_runner.transport.TransportChannel;
import com.testflow.testflow_runner.transport.TransportRegistry;
import com.testflow.testflow_runner.transport.TransportReply;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Instrument calls shared by the command, query, serial and capture executors. Transport
 * failures are logged into the run log and leave the result cell empty.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class InstrumentIo {

    private final TransportRegistry transports;
    private final ResultRecorder recorder;
    private final Sleeper sleeper;
    private final TestflowProperties properties;

    public void write(RunContext ctx, TransportChannel channel, String text) {
        TransportReply reply = transport(channel).send(ctx.getInstrumentAddress(), text);
        if (reply.ok()) {
            ctx.log("Sent '{}' to {}", text, ctx.getInstrumentAddress());
        } else {
            ctx.log("Send '{}' to {} failed: {}", text, ctx.getInstrumentAddress(), reply.error());
        }
    }

    public void queryAndRecord(RunContext ctx, TransportChannel channel, String text) {
        TransportReply reply = transport(channel).query(ctx.getInstrumentAddress(), text);
        settle(properties.getEngine().getQuerySettle());
        if (!reply.ok()) {
            ctx.log("Query '{}' to {} failed: {}", text, ctx.getInstrumentAddress(), reply.error());
            recorder.markMeasured(ctx);
            return;
        }
        String value = reply.text() == null ? "" : reply.text().strip();
        ctx.setLastReply(value);
        ctx.log("Query '{}' -> {}", text, value);
        recorder.recordMeasurement(ctx, measurementColumn(ctx), value);
    }

    public TransportReply queryBinary(RunContext ctx, String text) {
        TransportReply reply = transport(TransportChannel.VISA).queryBinary(ctx.getInstrumentAddress(), text);
        settle(properties.getEngine().getQuerySettle());
        if (!reply.ok()) {
            ctx.log("Binary query '{}' to {} failed: {}", text, ctx.getInstrumentAddress(), reply.error());
        }
        return reply;
    }

    public String measurementColumn(RunContext ctx) {
        return ResultColumns.measurement(ctx.getActionTitle(), ctx.currentNodeId(), ctx.getActionIndex());
    }

    /** Logical delay inside a node; an interrupt keeps the flag set so the engine stops. */
    public void settle(Duration duration) {
        try {
            sleeper.sleep(duration);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("Delay interrupted");
        }
    }

    private InstrumentTransport transport(TransportChannel channel) {
        return transports.get(channel);
    }
}
