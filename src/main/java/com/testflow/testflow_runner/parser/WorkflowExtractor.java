package com.testflow.testflow_runner.parser;

import com.testflow.testflow_runner.model.script.Instruction;
import com.testflow.testflow_runner.model.script.InstructionType;
import com.testflow.testflow_runner.model.script.ParseWarning;
import com.testflow.testflow_runner.model.script.Workflow;
import com.testflow.testflow_runner.model.script.WorkflowCatalog;
import lombok.extern.slf4j.Slf4j;

import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Captures {@code #START_WORKFLOW(name)} ... {@code #END_WORKFLOW(name)} blocks from the whole
 * file, window or not. Each start pairs with the next end marker of the same name.
 */
@Slf4j
public class WorkflowExtractor {

    private final boolean caseSensitive;

    public WorkflowExtractor(boolean caseSensitive) {
        this.caseSensitive = caseSensitive;
    }

    public WorkflowCatalog extract(List<String> lines, List<Instruction> instructions, List<ParseWarning> warnings) {
        WorkflowCatalog catalog = new WorkflowCatalog(caseSensitive);
        Set<Integer> consumedEnds = new HashSet<>();

        for (Instruction start : instructions) {
            if (start.type() != InstructionType.WORKFLOW_START) {
                continue;
            }
            String name = start.payload();
            Instruction end = findEnd(instructions, start.line(), name);
            if (end == null) {
                warnings.add(new ParseWarning(start.line(),
                        "Workflow '" + name + "' started at line " + start.line() + " has no #END_WORKFLOW(" + name + ")"));
                continue;
            }
            consumedEnds.add(end.line());
            catalog.add(new Workflow(name, start.line(), end.line(), lines.subList(start.line(), end.line() - 1)));
            log.debug("Captured workflow '{}' lines {}-{}", name, start.line(), end.line());
        }

        for (Instruction instruction : instructions) {
            if (instruction.type() == InstructionType.WORKFLOW_END && !consumedEnds.contains(instruction.line())) {
                warnings.add(new ParseWarning(instruction.line(),
                        "#END_WORKFLOW(" + instruction.payload() + ") at line " + instruction.line() + " has no matching start; ignored"));
            }
        }
        return catalog;
    }

    private Instruction findEnd(List<Instruction> instructions, int startLine, String name) {
        for (int i = startLine; i < instructions.size(); i++) {
            Instruction candidate = instructions.get(i);
            if (candidate.type() == InstructionType.WORKFLOW_END && sameName(candidate.payload(), name)) {
                return candidate;
            }
        }
        return null;
    }

    private boolean sameName(String a, String b) {
        return caseSensitive
                ? a.equals(b)
                : a.toLowerCase(Locale.ROOT).equals(b.toLowerCase(Locale.ROOT));
    }
}
