package com.testflow.testflow_runner.service;

import com.testflow.testflow_runner.config.TestflowProperties;
import com.testflow.testflow_runner.model.run.RunLog;
import com.testflow.testflow_runner.model.script.Instruction;
import com.testflow.testflow_runner.model.script.InstructionType;
import com.testflow.testflow_runner.model.script.ScriptGraph;
import com.testflow.testflow_runner.transport.InstrumentTransport;
import com.testflow.testflow_runner.transport.TransportChannel;
import com.testflow.testflow_runner.transport.TransportRegistry;
import com.testflow.testflow_runner.variable.PlaceholderSubstitutor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Checks every {@code INST::} address of the window before the run touches any instrument.
 * Addresses built from variables are skipped.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class InstrumentValidator {

    private final TransportRegistry transports;
    private final TestflowProperties properties;

    public List<String> validate(ScriptGraph graph, RunLog runLog) {
        Set<String> addresses = new LinkedHashSet<>();
        for (Instruction instruction : graph.windowInstructions()) {
            if (instruction.type() == InstructionType.INSTRUMENT
                    && !instruction.payload().isBlank()
                    && !PlaceholderSubstitutor.hasPlaceholder(instruction.payload())) {
                addresses.add(instruction.payload());
            }
        }

        InstrumentTransport transport = transports.get(TransportChannel.VISA);
        List<String> unreachable = new ArrayList<>();
        for (String address : addresses) {
            if (transport.isReachable(address)) {
                runLog.add("Instrument " + address + " reachable");
            } else {
                unreachable.add(address);
                runLog.add("WARNING: instrument " + address + " is not reachable");
            }
        }
        if (!unreachable.isEmpty() && properties.getTransport().isRequireReachable()) {
            throw new InstrumentUnreachableException(unreachable);
        }
        return unreachable;
    }
}
