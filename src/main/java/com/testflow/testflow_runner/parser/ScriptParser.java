package com.testflow.testflow_runner.parser;

import com.testflow.testflow_runner.config.TestflowProperties;
import com.testflow.testflow_runner.model.script.Instruction;
import com.testflow.testflow_runner.model.script.InstructionType;
import com.testflow.testflow_runner.model.script.ParseWarning;
import com.testflow.testflow_runner.model.script.Reference;
import com.testflow.testflow_runner.model.script.ScriptGraph;
import com.testflow.testflow_runner.model.script.Workflow;
import com.testflow.testflow_runner.model.script.WorkflowCatalog;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Entry point of the parsing pipeline:
 * lexer → structural parser → reference resolver → workflow extractor → step counter.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ScriptParser {

    private final TestflowProperties properties;

    public ScriptGraph parse(Path script) {
        try {
            List<String> lines = Files.readAllLines(script, StandardCharsets.UTF_8);
            return parse(script.getFileName().toString(), lines, null);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read script " + script, e);
        }
    }

    public ScriptGraph parse(String name, String content) {
        return parse(name, content.lines().toList(), null);
    }

    /**
     * Parses a captured workflow block as a script of its own. The block is wrapped in window
     * markers; workflows it does not define itself are looked up in the parent's catalog.
     */
    public ScriptGraph parseWorkflow(Workflow workflow, WorkflowCatalog parentCatalog) {
        List<String> lines = new ArrayList<>(workflow.lines().size() + 2);
        lines.add("#START_SCRIPT");
        lines.addAll(workflow.lines());
        lines.add("#END_SCRIPT");
        return parse(workflow.name(), lines, parentCatalog);
    }

    private ScriptGraph parse(String name, List<String> lines, WorkflowCatalog parentCatalog) {
        boolean caseSensitive = properties.getParser().isCaseSensitive();
        List<Instruction> instructions = new ScriptLexer(caseSensitive).lex(lines);

        ScriptStructure structure = new StructuralParser().parse(instructions);
        List<ParseWarning> warnings = new ArrayList<>(structure.warnings());

        List<ParseWarning> referenceWarnings = new ArrayList<>();
        Map<Integer, Reference> references = new ReferenceResolver()
                .resolve(structure.references(), structure.nodes(), structure.loops(), referenceWarnings);
        if (!referenceWarnings.isEmpty() && properties.getParser().isStrictReferences()) {
            throw new StructuralParseException(referenceWarnings.get(0).line(),
                    "Unresolved references: " + referenceWarnings);
        }
        warnings.addAll(referenceWarnings);

        WorkflowCatalog workflows = new WorkflowExtractor(caseSensitive).extract(lines, instructions, warnings);
        if (parentCatalog != null) {
            workflows = workflows.mergedWith(parentCatalog);
        }
        for (int line = structure.window().startLine(); line <= structure.window().endLine(); line++) {
            Instruction instruction = instructions.get(line - 1);
            if (instruction.type() == InstructionType.WORKFLOW_CALL && !workflows.contains(instruction.payload())) {
                warnings.add(new ParseWarning(line, "Workflow '" + instruction.payload() + "' called at line " + line + " is not defined"));
            }
        }

        long expectedSteps = StepCounter.count(
                instructions.subList(structure.window().startLine() - 1, structure.window().endLine()));

        warnings.forEach(warning -> log.warn("[{}] {}", name, warning.message()));
        log.debug("Parsed {}: window {}-{}, {} nodes, {} loops, {} workflows, {} expected steps",
                name, structure.window().startLine(), structure.window().endLine(),
                structure.nodes().size(), structure.loops().size(), workflows.names().size(), expectedSteps);

        return ScriptGraph.builder()
                .name(name)
                .instructions(List.copyOf(instructions))
                .window(structure.window())
                .caseSensitive(caseSensitive)
                .nodes(structure.nodes())
                .conditionalsByLine(structure.conditionalsByLine())
                .loops(structure.loops())
                .references(references)
                .variables(structure.variables())
                .warnings(warnings)
                .workflows(workflows)
                .expectedSteps(expectedSteps)
                .build();
    }
}
