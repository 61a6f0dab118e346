package com.testflow.testflow_runner.engine;

import com.testflow.testflow_runner.config.TestflowProperties;
import com.testflow.testflow_runner.control.PauseGate;
import com.testflow.testflow_runner.control.RunSignal;
import com.testflow.testflow_runner.executor.InstructionExecutorRegistry;
import com.testflow.testflow_runner.model.run.RunContext;
import com.testflow.testflow_runner.model.run.RunEnvironment;
import com.testflow.testflow_runner.model.run.RunStatus;
import com.testflow.testflow_runner.model.script.Instruction;
import com.testflow.testflow_runner.model.script.InstructionType;
import com.testflow.testflow_runner.model.script.Reference;
import com.testflow.testflow_runner.model.script.ScriptGraph;
import com.testflow.testflow_runner.model.script.ScriptWindow;
import com.testflow.testflow_runner.model.script.Workflow;
import com.testflow.testflow_runner.parser.ScriptParser;
import com.testflow.testflow_runner.result.ResultRecorder;
import com.testflow.testflow_runner.result.ResultSchemaBuilder;
import com.testflow.testflow_runner.result.ResultSink;
import com.testflow.testflow_runner.result.ResultTable;
import com.testflow.testflow_runner.result.ResultWriteException;
import com.testflow.testflow_runner.variable.VariableTable;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Optional;

/**
 * Walks a parsed script line by line. Every line is dispatched to the executor registered for
 * its type; the returned {@link StepOutcome} moves the cursor.
 *
 * The run state is consulted before a node, conditional or loop starts and after a node ends.
 * In debug mode every node end pauses the run until it is resumed.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ScriptExecutionEngine {

    private final InstructionExecutorRegistry executorRegistry;
    private final PauseGate pauseGate;
    private final ResultRecorder recorder;
    private final ScriptParser parser;
    private final TestflowProperties properties;
    private final Clock clock;

    public RunContext execute(ScriptGraph graph, RunEnvironment environment, ResultSink sink) {
        RunContext ctx = newContext(graph, environment, sink, 0);
        walk(ctx);
        return ctx;
    }

    /**
     * Runs a captured workflow as a child script with its own variables and result table,
     * then splices the child's results into the parent's table.
     */
    public StepOutcome runWorkflow(String name, RunContext parent) {
        Optional<Workflow> workflow = parent.getGraph().getWorkflows().first(name);
        if (workflow.isEmpty()) {
            parent.log("Workflow {} is not defined", name);
            return StepOutcome.abort("Workflow '" + name + "' is not defined");
        }
        int depth = parent.getDepth() + 1;
        if (depth > properties.getEngine().getMaxWorkflowDepth()) {
            return StepOutcome.abort("Workflow '" + name + "' exceeds the maximum nesting depth of "
                    + properties.getEngine().getMaxWorkflowDepth());
        }

        ScriptGraph childGraph;
        try {
            childGraph = parser.parseWorkflow(workflow.get(), parent.getGraph().getWorkflows());
        } catch (RuntimeException e) {
            parent.log("Workflow {} cannot be parsed: {}", name, e.getMessage());
            return StepOutcome.abort("Workflow '" + name + "' cannot be parsed: " + e.getMessage());
        }

        parent.log("Going to workflow {} (lines {}-{})", name, workflow.get().startLine(), workflow.get().endLine());
        RunContext child = newContext(childGraph, parent.getEnvironment(), ResultSink.NONE, depth);
        walk(child);
        recorder.splice(parent, child, name);
        parent.log("Workflow {} ended: {}", name, child.getStatus());

        return switch (child.getStatus()) {
            case STOPPED -> StepOutcome.stop();
            case FAILED -> StepOutcome.abort("Workflow '" + name + "' failed: " + child.getErrorMessage());
            default -> StepOutcome.next();
        };
    }

    private RunContext newContext(ScriptGraph graph, RunEnvironment environment, ResultSink sink, int depth) {
        return RunContext.builder()
                .graph(graph)
                .variables(VariableTable.from(graph))
                .results(new ResultTable(ResultSchemaBuilder.build(graph)))
                .sink(sink)
                .environment(environment)
                .depth(depth)
                .build();
    }

    private void walk(RunContext ctx) {
        ScriptGraph graph = ctx.getGraph();
        ScriptWindow window = graph.getWindow();
        long maxInstructions = properties.getEngine().getMaxInstructions();
        ctx.setStartedAt(clock.instant());

        int line = graph.firstExecutableLine();
        if (line < 0) {
            ctx.log("No node or loop between lines {} and {}", window.startLine(), window.endLine());
        }

        try {
            while (ctx.getStatus() == RunStatus.RUNNING) {
                if (line < 1 || line > window.endLine()) {
                    ctx.setStatus(RunStatus.COMPLETED);
                    break;
                }
                Instruction instruction = graph.instructionAt(line);
                InstructionType type = instruction.type();

                if (ctx.getInstructionCount() >= maxInstructions) {
                    ctx.fail("Instruction limit of " + maxInstructions + " reached at line " + line + "; runaway script?");
                    break;
                }
                ctx.setInstructionCount(ctx.getInstructionCount() + 1);

                if (Thread.currentThread().isInterrupted()) {
                    ctx.setStatus(RunStatus.STOPPED);
                    break;
                }

                if (type.isStructural() && ctx.getPendingEntry() != null) {
                    Reference entry = ctx.getPendingEntry();
                    ctx.setPendingEntry(null);
                    line = apply(ctx, StepOutcome.follow(entry), line);
                    continue;
                }

                if (type.opensBody() && !pauseGate.awaitRunnable(ctx)) {
                    ctx.setStatus(RunStatus.STOPPED);
                    break;
                }

                StepOutcome outcome = dispatch(instruction, ctx);

                if (type == InstructionType.NODE_END && outcome.kind() != StepOutcome.Kind.ABORT) {
                    if (ctx.getEnvironment().debug()) {
                        ctx.getEnvironment().runState().signal(RunSignal.PAUSE);
                        ctx.log("Debug mode: paused after node {}", instruction.id());
                    }
                    if (!pauseGate.awaitRunnable(ctx)) {
                        ctx.setStatus(RunStatus.STOPPED);
                        break;
                    }
                }
                line = apply(ctx, outcome, line);
            }
        } catch (ResultWriteException e) {
            log.error("Run {} cannot write results: {}", ctx.getEnvironment().runId(), e.getMessage(), e);
            ctx.fail(e.getMessage());
        }

        finish(ctx);
    }

    // Returns the next line; sets the final status for terminating outcomes.
    private int apply(RunContext ctx, StepOutcome outcome, int line) {
        switch (outcome.kind()) {
            case NEXT:
                return line + 1;
            case JUMP:
                return outcome.line();
            case TERMINATE:
                ctx.setStatus(RunStatus.COMPLETED);
                return line;
            case STOP:
                ctx.setStatus(RunStatus.STOPPED);
                return line;
            case ABORT:
            default:
                ctx.log("Run aborted: {}", outcome.message());
                ctx.fail(outcome.message());
                return line;
        }
    }

    private StepOutcome dispatch(Instruction instruction, RunContext ctx) {
        if (instruction.type().isInert()) {
            return StepOutcome.next();
        }
        try {
            return executorRegistry.get(instruction.type()).execute(instruction, ctx);
        } catch (ResultWriteException e) {
            throw e;
        } catch (RuntimeException e) {
            String msg = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            log.error("Line {} ({}) of {} threw: {}", instruction.line(), instruction.type(), ctx.getGraph().getName(), msg, e);
            ctx.log("Line {} failed: {}", instruction.line(), msg);
            return StepOutcome.next();
        }
    }

    private void finish(RunContext ctx) {
        try {
            recorder.finalizeRow(ctx);
        } catch (ResultWriteException e) {
            log.error("Run {} cannot write its last row: {}", ctx.getEnvironment().runId(), e.getMessage());
            if (ctx.getStatus() != RunStatus.FAILED) {
                ctx.fail(e.getMessage());
            }
        }
        ctx.setCompletedAt(clock.instant());
        if (ctx.isTopLevel()) {
            ctx.getEnvironment().runState().clear();
        }
        if (ctx.getStatus() == RunStatus.FAILED) {
            ctx.log("{} ended FAILED: {}", ctx.getGraph().getName(), ctx.getErrorMessage());
        } else {
            ctx.log("{} ended {} after {} steps, {} rows", ctx.getGraph().getName(), ctx.getStatus(),
                    ctx.getStepCount(), ctx.getRowsWritten());
        }
    }
}
