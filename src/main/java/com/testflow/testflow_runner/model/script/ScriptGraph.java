package com.testflow.testflow_runner.model.script;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable result of parsing one script: the lexed lines, the executable window and the
 * node / loop graph with every jump reference already resolved.
 *
 * Line numbers are 1-based everywhere. {@link #referenceAt(int)} is keyed by the line that
 * carries the reference (node end, loop start, loop end, TRUE / FALSE branch).
 */
@Getter
@Builder
public class ScriptGraph {

    private final String name;
    private final List<Instruction> instructions;
    private final ScriptWindow window;
    private final boolean caseSensitive;

    @Singular("node")        private final Map<Integer, ScriptNode> nodes;
    @Singular("conditional") private final Map<Integer, ScriptNode> conditionalsByLine;
    @Singular("loop")        private final Map<Integer, ScriptLoop> loops;
    @Singular("reference")   private final Map<Integer, Reference> references;
    @Singular("variable")    private final Map<Integer, VariableDeclaration> variables;
    @Singular                private final List<ParseWarning> warnings;

    private final WorkflowCatalog workflows;
    private final long expectedSteps;

    public int lineCount() {
        return instructions.size();
    }

    public Instruction instructionAt(int line) {
        if (line < 1 || line > instructions.size()) {
            throw new IndexOutOfBoundsException("No line " + line + " in script " + name);
        }
        return instructions.get(line - 1);
    }

    public Optional<ScriptNode> node(int id) {
        return Optional.ofNullable(nodes.get(id));
    }

    public Optional<ScriptLoop> loop(int id) {
        return Optional.ofNullable(loops.get(id));
    }

    public Optional<ScriptNode> conditionalAt(int line) {
        return Optional.ofNullable(conditionalsByLine.get(line));
    }

    public Optional<Reference> referenceAt(int line) {
        return Optional.ofNullable(references.get(line));
    }

    public Optional<VariableDeclaration> variableAt(int line) {
        return Optional.ofNullable(variables.get(line));
    }

    /** First node start, conditional start or loop start inside the window, or -1. */
    public int firstExecutableLine() {
        for (int line = window.startLine(); line <= window.endLine(); line++) {
            if (instructionAt(line).type().opensBody()) {
                return line;
            }
        }
        return -1;
    }

    public List<Instruction> windowInstructions() {
        return instructions.subList(window.startLine() - 1, window.endLine());
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
