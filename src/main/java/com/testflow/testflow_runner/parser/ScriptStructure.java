package com.testflow.testflow_runner.parser;

import com.testflow.testflow_runner.model.script.ParseWarning;
import com.testflow.testflow_runner.model.script.Reference;
import com.testflow.testflow_runner.model.script.ScriptLoop;
import com.testflow.testflow_runner.model.script.ScriptNode;
import com.testflow.testflow_runner.model.script.ScriptWindow;
import com.testflow.testflow_runner.model.script.VariableDeclaration;

import java.util.List;
import java.util.Map;

/** Output of {@link StructuralParser}, references still unresolved. */
record ScriptStructure(ScriptWindow window,
                       Map<Integer, ScriptNode> nodes,
                       Map<Integer, ScriptNode> conditionalsByLine,
                       Map<Integer, ScriptLoop> loops,
                       Map<Integer, Reference> references,
                       Map<Integer, VariableDeclaration> variables,
                       List<ParseWarning> warnings) {
}
