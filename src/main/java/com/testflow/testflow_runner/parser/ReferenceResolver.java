package com.testflow.testflow_runner.parser;

import com.testflow.testflow_runner.model.script.ParseWarning;
import com.testflow.testflow_runner.model.script.Reference;
import com.testflow.testflow_runner.model.script.ScriptLoop;
import com.testflow.testflow_runner.model.script.ScriptNode;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Resolves captured jump references to line numbers.
 * {@code N<k>} targets the start line of node k, {@code LE<k>} the end line of loop k.
 * References that cannot be resolved are kept unresolved and reported as warnings.
 */
public class ReferenceResolver {

    public Map<Integer, Reference> resolve(Map<Integer, Reference> references,
                                           Map<Integer, ScriptNode> nodes,
                                           Map<Integer, ScriptLoop> loops,
                                           List<ParseWarning> warnings) {
        Map<Integer, Reference> resolved = new LinkedHashMap<>();
        references.forEach((line, reference) -> resolved.put(line, resolve(reference, nodes, loops, warnings)));
        return resolved;
    }

    private Reference resolve(Reference reference, Map<Integer, ScriptNode> nodes,
                              Map<Integer, ScriptLoop> loops, List<ParseWarning> warnings) {
        switch (reference.kind()) {
            case NODE: {
                ScriptNode node = nodes.get(reference.targetId());
                if (node != null) {
                    return reference.resolvedTo(node.getStartLine());
                }
                warnings.add(unresolved(reference, "start"));
                return reference;
            }
            case LOOP_END: {
                ScriptLoop loop = loops.get(reference.targetId());
                if (loop != null && loop.getEndLine() > 0) {
                    return reference.resolvedTo(loop.getEndLine());
                }
                warnings.add(unresolved(reference, "end"));
                return reference;
            }
            default:
                return reference;
        }
    }

    private static ParseWarning unresolved(Reference reference, String part) {
        return new ParseWarning(reference.sourceLine(),
                "Ref at line " + reference.sourceLine() + ": " + reference.label() + " not found or has no " + part + ".");
    }
}
