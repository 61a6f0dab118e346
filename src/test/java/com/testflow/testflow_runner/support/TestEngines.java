package com.testflow.testflow_runner.support;

import com.testflow.testflow_runner.config.TestflowProperties;
import com.testflow.testflow_runner.control.InMemoryRunState;
import com.testflow.testflow_runner.control.PauseGate;
import com.testflow.testflow_runner.control.RunState;
import com.testflow.testflow_runner.control.Sleeper;
import com.testflow.testflow_runner.engine.ScriptExecutionEngine;
import com.testflow.testflow_runner.executor.ConditionalExecutor;
import com.testflow.testflow_runner.executor.InstructionExecutor;
import com.testflow.testflow_runner.executor.InstructionExecutorRegistry;
import com.testflow.testflow_runner.executor.LoopEndExecutor;
import com.testflow.testflow_runner.executor.LoopStartExecutor;
import com.testflow.testflow_runner.executor.NodeEndExecutor;
import com.testflow.testflow_runner.executor.NodeStartExecutor;
import com.testflow.testflow_runner.executor.ScriptEndExecutor;
import com.testflow.testflow_runner.executor.VariableExecutor;
import com.testflow.testflow_runner.executor.impl.ActionExecutor;
import com.testflow.testflow_runner.executor.impl.CommandExecutor;
import com.testflow.testflow_runner.executor.impl.DelayExecutor;
import com.testflow.testflow_runner.executor.impl.ImageCaptureExecutor;
import com.testflow.testflow_runner.executor.impl.InstrumentExecutor;
import com.testflow.testflow_runner.executor.impl.InstrumentIo;
import com.testflow.testflow_runner.executor.impl.MessageExecutor;
import com.testflow.testflow_runner.executor.impl.QueryExecutor;
import com.testflow.testflow_runner.executor.impl.SerialExecutor;
import com.testflow.testflow_runner.executor.impl.SetCaptureExecutor;
import com.testflow.testflow_runner.executor.impl.SubWorkflowExecutor;
import com.testflow.testflow_runner.model.run.RunContext;
import com.testflow.testflow_runner.model.run.RunEnvironment;
import com.testflow.testflow_runner.model.run.RunLog;
import com.testflow.testflow_runner.model.script.ScriptGraph;
import com.testflow.testflow_runner.parser.ScriptParser;
import com.testflow.testflow_runner.result.ArtifactStore;
import com.testflow.testflow_runner.result.ResultRecorder;
import com.testflow.testflow_runner.result.ResultTable;
import com.testflow.testflow_runner.transport.InstrumentTransport;
import com.testflow.testflow_runner.transport.TransportRegistry;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

/** Wires the engine by hand, the way the Spring context does, around a fake transport. */
public final class TestEngines {

    public static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-14T09:26:53Z"), ZoneOffset.UTC);

    private TestEngines() {
    }

    public static Fixture create(InstrumentTransport transport) {
        return create(transport, new TestflowProperties(), new RecordingSleeper());
    }

    public static Fixture create(InstrumentTransport transport, TestflowProperties properties, Sleeper sleeper) {
        ResultRecorder recorder = new ResultRecorder(CLOCK);
        InstrumentIo io = new InstrumentIo(new TransportRegistry(List.of(transport)), recorder, sleeper, properties);
        ScriptParser parser = new ScriptParser(properties);

        List<InstructionExecutor> executors = new ArrayList<>();
        InstructionExecutorRegistry registry = new InstructionExecutorRegistry(executors);
        ScriptExecutionEngine engine = new ScriptExecutionEngine(registry, new PauseGate(properties, sleeper),
                recorder, parser, properties, CLOCK);

        LoopEndExecutor loopEnd = new LoopEndExecutor(recorder);
        executors.add(new NodeStartExecutor());
        executors.add(new NodeEndExecutor());
        executors.add(new ConditionalExecutor());
        executors.add(new LoopStartExecutor(loopEnd));
        executors.add(loopEnd);
        executors.add(new ScriptEndExecutor());
        executors.add(new VariableExecutor());
        executors.add(new InstrumentExecutor());
        executors.add(new ActionExecutor());
        executors.add(new CommandExecutor(io));
        executors.add(new QueryExecutor(io));
        executors.add(new SerialExecutor(io));
        executors.add(new DelayExecutor(io));
        executors.add(new MessageExecutor());
        executors.add(new SubWorkflowExecutor(engine));
        executors.add(new ImageCaptureExecutor(io, recorder));
        executors.add(new SetCaptureExecutor(io, recorder));
        registry.init();

        return new Fixture(engine, parser, properties);
    }

    public static final class Fixture {

        private final ScriptExecutionEngine engine;
        private final ScriptParser parser;
        private final TestflowProperties properties;
        private final RunState runState = new InMemoryRunState();
        private final RunLog runLog = new RunLog("test-run", CLOCK);
        private Path artifacts = Path.of("target", "test-artifacts");
        private boolean debug;
        private ResultTable lastWritten;

        Fixture(ScriptExecutionEngine engine, ScriptParser parser, TestflowProperties properties) {
            this.engine = engine;
            this.parser = parser;
            this.properties = properties;
        }

        public Fixture artifacts(Path directory) {
            this.artifacts = directory;
            return this;
        }

        public Fixture debug(boolean debug) {
            this.debug = debug;
            return this;
        }

        public ScriptGraph parse(String script) {
            return parser.parse("test.atoms", script);
        }

        public RunContext run(String script) {
            return run(parse(script));
        }

        public RunContext run(ScriptGraph graph) {
            RunEnvironment environment = new RunEnvironment("test-run", runState,
                    new ArtifactStore(artifacts), runLog, debug);
            return engine.execute(graph, environment, table -> lastWritten = table);
        }

        public ScriptExecutionEngine engine() {
            return engine;
        }

        public ScriptParser parser() {
            return parser;
        }

        public RunState runState() {
            return runState;
        }

        public RunLog runLog() {
            return runLog;
        }

        public TestflowProperties properties() {
            return properties;
        }

        /** Table as last handed to the sink, null when nothing was flushed. */
        public ResultTable lastWritten() {
            return lastWritten;
        }

        public static String lines(String... lines) {
            return String.join("\n", lines);
        }
    }
}
