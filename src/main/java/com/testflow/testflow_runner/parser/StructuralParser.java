package com.testflow.testflow_runner.parser;

import com.testflow.testflow_runner.model.script.Instruction;
import com.testflow.testflow_runner.model.script.InstructionType;
import com.testflow.testflow_runner.model.script.NodeDescriptor;
import com.testflow.testflow_runner.model.script.NodeKind;
import com.testflow.testflow_runner.model.script.ParseWarning;
import com.testflow.testflow_runner.model.script.Reference;
import com.testflow.testflow_runner.model.script.ScriptLoop;
import com.testflow.testflow_runner.model.script.ScriptNode;
import com.testflow.testflow_runner.model.script.ScriptWindow;
import com.testflow.testflow_runner.model.script.VariableDeclaration;
import com.testflow.testflow_runner.variable.RangeExpander;
import com.testflow.testflow_runner.variable.RangeFormatException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Builds the node / loop graph of the executable window.
 *
 * Rules:
 *  - a node or loop starts at its first textual occurrence; later declarations only warn
 *  - loops nest but never overlap; Loop_end must close the innermost open loop
 *  - a conditional block holds exactly one TRUE: and one FALSE: line and ends with #END_IF
 *  - a Variable: line is governed by the innermost loop around it and must expand to
 *    exactly that loop's iteration count
 */
@Slf4j
public class StructuralParser {

    public static ScriptWindow findWindow(List<Instruction> instructions) {
        int start = -1;
        for (Instruction instruction : instructions) {
            if (instruction.type() == InstructionType.SCRIPT_START) {
                start = instruction.line();
                break;
            }
        }
        if (start < 0) {
            throw new StructuralParseException("No #START_SCRIPT marker found");
        }
        for (int i = start; i < instructions.size(); i++) {
            if (instructions.get(i).type() == InstructionType.SCRIPT_END) {
                return new ScriptWindow(start, instructions.get(i).line());
            }
        }
        for (int i = start; i < instructions.size(); i++) {
            if (instructions.get(i).type() == InstructionType.WORKFLOW_START) {
                int end = instructions.get(i).line() - 1;
                log.warn("No #END_SCRIPT after line {}; window closes at line {} before the first workflow", start, end);
                return new ScriptWindow(start, end);
            }
        }
        throw new StructuralParseException(start, "#START_SCRIPT has neither #END_SCRIPT nor a following #START_WORKFLOW");
    }

    public ScriptStructure parse(List<Instruction> instructions) {
        ScriptWindow window = findWindow(instructions);

        Map<Integer, ScriptNode.ScriptNodeBuilder> nodes = new TreeMap<>();
        Map<Integer, Integer> firstNodeLine = new LinkedHashMap<>();
        Map<Integer, ScriptNode> conditionals = new LinkedHashMap<>();
        Map<Integer, LoopDraft> loops = new TreeMap<>();
        Map<Integer, Reference> references = new LinkedHashMap<>();
        Map<Integer, VariableDeclaration> variables = new LinkedHashMap<>();
        List<ParseWarning> warnings = new ArrayList<>();
        Deque<LoopDraft> open = new ArrayDeque<>();

        int line = window.startLine();
        while (line <= window.endLine()) {
            Instruction instruction = instructions.get(line - 1);
            switch (instruction.type()) {
                case NODE_START -> {
                    int id = instruction.id();
                    Integer first = firstNodeLine.putIfAbsent(id, line);
                    if (first != null) {
                        warnings.add(redeclared("Node " + id, line, first));
                    }
                    if (!nodes.containsKey(id)) {
                        nodes.put(id, ScriptNode.builder()
                                .id(id)
                                .kind(NodeKind.STANDARD)
                                .startLine(line)
                                .descriptor(NodeDescriptor.parse(id, instruction.payload())));
                    }
                }
                case NODE_END -> {
                    Reference successor = instruction.hasReference()
                            ? instruction.reference()
                            : fallthrough(line, window);
                    references.put(line, successor);
                    ScriptNode.ScriptNodeBuilder node = nodes.get(instruction.id());
                    if (node == null) {
                        warnings.add(new ParseWarning(line, "#END_NODE" + instruction.id() + " at line " + line + " has no matching #NODE" + instruction.id()));
                    } else if (node.build().getEndLine() == null) {
                        node.endLine(line).successor(successor);
                    }
                }
                case CONDITIONAL_START -> {
                    Integer first = firstNodeLine.putIfAbsent(instruction.id(), line);
                    if (first != null) {
                        warnings.add(redeclared("Node " + instruction.id(), line, first));
                    }
                    line = parseConditional(instructions, window, instruction, conditionals, references);
                }
                case BRANCH_TRUE, BRANCH_FALSE, CONDITIONAL_END -> throw new StructuralParseException(line,
                        instruction.raw().strip() + " outside of a #NODE<id>_IF block");
                case LOOP_START -> {
                    int id = instruction.id();
                    if (instruction.count() < 0) {
                        throw new StructuralParseException(line, "Loop " + id + " has a negative iteration count");
                    }
                    for (LoopDraft draft : open) {
                        if (draft.id == id) {
                            throw new StructuralParseException(line, "Loop_start(" + id + ") re-opened before Loop_end(" + id
                                    + ") of line " + draft.startLine);
                        }
                    }
                    LoopDraft draft = new LoopDraft(id, instruction.count(), line, instruction.reference());
                    open.push(draft);
                    if (instruction.hasReference()) {
                        references.put(line, instruction.reference());
                    }
                    if (loops.containsKey(id)) {
                        warnings.add(redeclared("Loop " + id, line, loops.get(id).startLine));
                    } else {
                        loops.put(id, draft);
                    }
                }
                case LOOP_END -> {
                    int id = instruction.id();
                    LoopDraft innermost = open.peek();
                    if (innermost == null || innermost.id != id) {
                        throw new StructuralParseException(line, innermost == null
                                ? "Loop_end(" + id + ") without an open Loop_start(" + id + ")"
                                : "Loop_end(" + id + ") overlaps Loop " + innermost.id + " opened at line " + innermost.startLine);
                    }
                    open.pop();
                    innermost.endLine = line;
                    innermost.exit = instruction.reference();
                    if (instruction.hasReference()) {
                        references.put(line, instruction.reference());
                    }
                }
                case VARIABLE -> {
                    LoopDraft governing = open.peek();
                    VariableDeclaration declaration = parseVariable(instructions, instruction, governing);
                    variables.put(line, declaration);
                }
                default -> { }
            }
            line++;
        }

        if (!open.isEmpty()) {
            LoopDraft unterminated = open.peek();
            throw new StructuralParseException(unterminated.startLine, "Loop_start(" + unterminated.id + ") is never closed by Loop_end(" + unterminated.id + ")");
        }

        Map<Integer, ScriptNode> builtNodes = new TreeMap<>();
        nodes.forEach((id, builder) -> builtNodes.put(id, builder.build()));
        for (ScriptNode conditional : conditionals.values()) {
            builtNodes.merge(conditional.getId(), conditional,
                    (a, b) -> a.getStartLine() <= b.getStartLine() ? a : b);
        }
        Map<Integer, ScriptLoop> builtLoops = new TreeMap<>();
        loops.forEach((id, draft) -> builtLoops.put(id, draft.build()));

        return new ScriptStructure(window, builtNodes, conditionals, builtLoops, references, variables, warnings);
    }

    // Returns the #END_IF line so the scan resumes after the block.
    private int parseConditional(List<Instruction> instructions, ScriptWindow window, Instruction start,
                                 Map<Integer, ScriptNode> conditionals,
                                 Map<Integer, Reference> references) {
        int id = start.id();
        Reference whenTrue = null;
        Reference whenFalse = null;
        for (int line = start.line() + 1; line <= window.endLine(); line++) {
            Instruction instruction = instructions.get(line - 1);
            switch (instruction.type()) {
                case BRANCH_TRUE -> {
                    if (whenTrue != null) {
                        throw new StructuralParseException(line, "Second TRUE: line in #NODE" + id + "_IF");
                    }
                    whenTrue = instruction.reference();
                    references.put(line, whenTrue);
                }
                case BRANCH_FALSE -> {
                    if (whenFalse != null) {
                        throw new StructuralParseException(line, "Second FALSE: line in #NODE" + id + "_IF");
                    }
                    whenFalse = instruction.reference();
                    references.put(line, whenFalse);
                }
                case CONDITIONAL_END -> {
                    if (whenTrue == null || whenFalse == null) {
                        throw new StructuralParseException(start.line(), "#NODE" + id + "_IF needs one TRUE: and one FALSE: line");
                    }
                    ScriptNode conditional = ScriptNode.builder()
                            .id(id)
                            .kind(NodeKind.CONDITIONAL)
                            .startLine(start.line())
                            .endLine(line)
                            .descriptor(NodeDescriptor.parse(id, ""))
                            .expression(start.payload())
                            .whenTrue(whenTrue)
                            .whenFalse(whenFalse)
                            .build();
                    conditionals.put(start.line(), conditional);
                    return line;
                }
                default -> {
                    if (instruction.type().isStructural() || instruction.type() == InstructionType.CONDITIONAL_START) {
                        throw new StructuralParseException(start.line(), "#NODE" + id + "_IF is not closed by #END_IF before line " + line);
                    }
                }
            }
        }
        throw new StructuralParseException(start.line(), "#NODE" + id + "_IF is not closed by #END_IF");
    }

    private VariableDeclaration parseVariable(List<Instruction> instructions, Instruction declaration, LoopDraft governing) {
        String name = declaration.payload();
        if (name.isEmpty()) {
            throw new RangeFormatException(declaration.line(), "Variable: without a name");
        }
        List<Double> values = new ArrayList<>();
        int line = declaration.line() + 1;
        while (line <= instructions.size() && instructions.get(line - 1).type() == InstructionType.RANGE) {
            values.addAll(RangeExpander.expand(instructions.get(line - 1).payload(), line));
            line++;
        }
        if (values.isEmpty()) {
            throw new RangeFormatException(declaration.line(), "Variable " + name + " has no Range: line");
        }
        if (governing != null && values.size() != governing.iterations) {
            throw new RangeFormatException(declaration.line(), "Variable " + name + " defines " + values.size()
                    + " values but Loop " + governing.id + " runs " + governing.iterations + " iterations");
        }
        return new VariableDeclaration(name, declaration.line(), values, governing == null ? null : governing.id);
    }

    private static Reference fallthrough(int line, ScriptWindow window) {
        return line + 1 > window.endLine()
                ? Reference.terminal(line)
                : Reference.line(line + 1, line);
    }

    private static ParseWarning redeclared(String what, int line, int firstLine) {
        return new ParseWarning(line, what + " re-declared at line " + line + "; start stays at line " + firstLine);
    }

    private static final class LoopDraft {
        final int id;
        final int iterations;
        final int startLine;
        final Reference entry;
        int endLine = -1;
        Reference exit;

        LoopDraft(int id, int iterations, int startLine, Reference entry) {
            this.id = id;
            this.iterations = iterations;
            this.startLine = startLine;
            this.entry = entry;
        }

        ScriptLoop build() {
            return ScriptLoop.builder()
                    .id(id)
                    .iterations(iterations)
                    .startLine(startLine)
                    .endLine(endLine)
                    .entry(entry)
                    .exit(exit)
                    .build();
        }
    }
}
