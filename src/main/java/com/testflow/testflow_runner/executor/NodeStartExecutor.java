package com.testflow.testflow_runner.executor;

import com.testflow.testflow_runner.engine.StepOutcome;
import com.testflow.testflow_runner.model.run.RunContext;
import com.testflow.testflow_runner.model.script.Instruction;
import com.testflow.testflow_runner.model.script.InstructionType;
import com.testflow.testflow_runner.model.script.NodeDescriptor;
import com.testflow.testflow_runner.model.script.ScriptNode;
import org.springframework.stereotype.Component;

@Component
public class NodeStartExecutor implements InstructionExecutor {

    @Override
    public InstructionType supportedType() {
        return InstructionType.NODE_START;
    }

    @Override
    public StepOutcome execute(Instruction instruction, RunContext ctx) {
        NodeDescriptor descriptor = ctx.getGraph().node(instruction.id())
                .map(ScriptNode::getDescriptor)
                .orElseGet(() -> NodeDescriptor.parse(instruction.id(), instruction.payload()));

        ctx.setStepCount(ctx.getStepCount() + 1);
        ctx.setCurrentNode(descriptor);
        ctx.setActionIndex(0);
        ctx.setActionTitle(null);

        if (descriptor.instrumentName().isEmpty()) {
            ctx.log("Node {} started", descriptor.nodeId());
        } else {
            ctx.log("Node {} started: {} on {} {} {}", descriptor.nodeId(), descriptor.nodeType(),
                    descriptor.instrumentName(), descriptor.manufacturer(), descriptor.model());
        }
        return StepOutcome.next();
    }
}
