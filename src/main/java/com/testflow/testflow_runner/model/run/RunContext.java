package com.testflow.testflow_runner.model.run;

import com.testflow.testflow_runner.model.script.NodeDescriptor;
import com.testflow.testflow_runner.model.script.Reference;
import com.testflow.testflow_runner.model.script.ScriptGraph;
import com.testflow.testflow_runner.model.script.ScriptLoop;
import com.testflow.testflow_runner.result.ResultSink;
import com.testflow.testflow_runner.result.ResultTable;
import com.testflow.testflow_runner.variable.VariableTable;
import lombok.Builder;
import lombok.Data;
import org.slf4j.helpers.MessageFormatter;

import java.time.Instant;
import java.util.Map;
import java.util.TreeMap;

/**
 * Execution state of one script walk. A sub-workflow call gets a fresh context with its own
 * variables and result table; only the {@link RunEnvironment} is shared.
 */
@Data
@Builder
public class RunContext {

    private ScriptGraph graph;
    private VariableTable variables;
    private ResultTable results;
    private ResultSink sink;
    private RunEnvironment environment;

    /** 0 for the top-level script, +1 per nested Work_flow: call. */
    private int depth;

    /** Next data row to fill (1-based) and whether it holds a measurement yet. */
    @Builder.Default
    private int currentRow = 1;
    private boolean rowDirty;
    private int rowsWritten;

    private NodeDescriptor currentNode;
    private String instrumentAddress;
    private String actionTitle;
    private int actionIndex;

    private long stepCount;
    private long instructionCount;
    private String lastReply;

    /** Body entry of the loop that just started, taken at the next structural line. */
    private Reference pendingEntry;

    @Builder.Default
    private Map<Integer, LoopState> loopStates = new TreeMap<>();

    @Builder.Default
    private RunStatus status = RunStatus.RUNNING;
    private String errorMessage;
    private Instant startedAt;
    private Instant completedAt;

    public LoopState loopState(ScriptLoop loop) {
        return loopStates.computeIfAbsent(loop.getId(), id -> new LoopState(id, loop.getIterations()));
    }

    public boolean isTopLevel() {
        return depth == 0;
    }

    public int currentNodeId() {
        return currentNode == null ? -1 : currentNode.nodeId();
    }

    public int progressPercent() {
        long total = graph.getExpectedSteps();
        if (total <= 0) {
            return 0;
        }
        return (int) Math.min(100, stepCount * 100 / total);
    }

    /** Appends to the run log with the progress prefix; SLF4J-style {} placeholders. */
    public void log(String format, Object... args) {
        String message = MessageFormatter.arrayFormat(format, args).getMessage();
        String prefix = String.format("[PROGRESS:%3d%%|%4d/%4d] ", progressPercent(), stepCount, graph.getExpectedSteps());
        String scope = isTopLevel() ? "" : "[" + graph.getName() + "] ";
        environment.runLog().add(prefix + scope + message);
    }

    public void fail(String message) {
        status = RunStatus.FAILED;
        errorMessage = message;
    }
}
