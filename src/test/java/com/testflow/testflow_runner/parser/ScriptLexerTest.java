package com.testflow.testflow_runner.parser;

import com.testflow.testflow_runner.model.script.Instruction;
import com.testflow.testflow_runner.model.script.InstructionType;
import com.testflow.testflow_runner.model.script.ReferenceKind;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

class ScriptLexerTest {

    private final ScriptLexer lexer = new ScriptLexer(true);

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "#START_SCRIPT                  | SCRIPT_START",
            "#END_SCRIPT                    | SCRIPT_END",
            "#NODE3(Measure, DMM)           | NODE_START",
            "#END_NODE3                     | NODE_END",
            "#NODE4_IF(${x} > 2)            | CONDITIONAL_START",
            "TRUE:N5                        | BRANCH_TRUE",
            "FALSE:LE2                      | BRANCH_FALSE",
            "#END_IF                        | CONDITIONAL_END",
            "Loop_start(1):10               | LOOP_START",
            "Loop_end(1)                    | LOOP_END",
            "Variable:Vin                   | VARIABLE",
            "Range(1/2):(1,3),5             | RANGE",
            "Range(i/n):(1,3),5             | RANGE",
            "Work_flow:(Calibrate)          | WORKFLOW_CALL",
            "#START_WORKFLOW(Calibrate)     | WORKFLOW_START",
            "#END_WORKFLOW(Calibrate)       | WORKFLOW_END",
            "INST::GPIB0::22::INSTR         | INSTRUMENT",
            "#ACTION:(Read voltage)         | ACTION",
            "CMD:MEAS:VOLT?                 | COMMAND",
            "QRY:FETCH?                     | QUERY",
            "PNG:HCOP:DATA?                 | IMAGE_CAPTURE",
            "SET:SYST:SET?                  | SET_CAPTURE",
            "SER:READ?                      | SERIAL",
            "Delay:2,S                      | DELAY",
            "MESSAGE:Connect the probe      | MESSAGE",
            "// calibrate first             | COMMENT",
            "something else                 | TEXT"
    })
    void classifiesEveryLineForm(String raw, InstructionType expected) {
        assertThat(lexer.lexLine(1, raw).type()).isEqualTo(expected);
    }

    @Test
    void blankLineIsBlank() {
        assertThat(lexer.lexLine(1, "   ").type()).isEqualTo(InstructionType.BLANK);
    }

    @Test
    void nodeStartCarriesIdAndDescriptor() {
        Instruction node = lexer.lexLine(7, "#NODE12(Measure, DMM, Keysight, 34461A)");

        assertThat(node.id()).isEqualTo(12);
        assertThat(node.payload()).isEqualTo("Measure, DMM, Keysight, 34461A");
        assertThat(node.line()).isEqualTo(7);
    }

    @Test
    void nodeEndWithInlineReference() {
        Instruction end = lexer.lexLine(9, "#END_NODE2 (N7)");

        assertThat(end.id()).isEqualTo(2);
        assertThat(end.reference().kind()).isEqualTo(ReferenceKind.NODE);
        assertThat(end.reference().targetId()).isEqualTo(7);
        assertThat(end.reference().sourceLine()).isEqualTo(9);
    }

    @Test
    void nodeEndWithoutReference() {
        assertThat(lexer.lexLine(9, "#END_NODE2").hasReference()).isFalse();
    }

    @Test
    void loopStartCarriesCountAndEntry() {
        Instruction loop = lexer.lexLine(4, "Loop_start(3):25(N8)");

        assertThat(loop.id()).isEqualTo(3);
        assertThat(loop.count()).isEqualTo(25);
        assertThat(loop.reference().targetId()).isEqualTo(8);
    }

    @Test
    void loopEndExitReferenceToLoopEnd() {
        Instruction loop = lexer.lexLine(4, "Loop_end(3)(LE1)");

        assertThat(loop.reference().kind()).isEqualTo(ReferenceKind.LOOP_END);
        assertThat(loop.reference().targetId()).isEqualTo(1);
    }

    @Test
    void conditionalKeepsExpression() {
        Instruction conditional = lexer.lexLine(2, "#NODE4_IF(${Vout} >= 3.3 and ${I} < 1)");

        assertThat(conditional.id()).isEqualTo(4);
        assertThat(conditional.payload()).isEqualTo("${Vout} >= 3.3 and ${I} < 1");
    }

    @Test
    void instructionPrefixesIgnoreCase() {
        assertThat(lexer.lexLine(1, "cmd:*RST").type()).isEqualTo(InstructionType.COMMAND);
        assertThat(lexer.lexLine(1, "delay:100").type()).isEqualTo(InstructionType.DELAY);
        assertThat(lexer.lexLine(1, "cmd:*RST").payload()).isEqualTo("*RST");
    }

    @Test
    void structuralMarkersHonourCaseFlag() {
        assertThat(lexer.lexLine(1, "#node1").type()).isEqualTo(InstructionType.TEXT);
        assertThat(new ScriptLexer(false).lexLine(1, "#node1").type()).isEqualTo(InstructionType.NODE_START);
    }

    @Test
    void lexNumbersLinesFromOne() {
        assertThat(lexer.lex(java.util.List.of("#START_SCRIPT", "", "#END_SCRIPT")))
                .extracting(Instruction::line)
                .containsExactly(1, 2, 3);
    }
}
