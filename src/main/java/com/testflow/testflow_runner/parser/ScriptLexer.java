package com.testflow.testflow_runner.parser;

import com.testflow.testflow_runner.model.script.Instruction;
import com.testflow.testflow_runner.model.script.InstructionType;
import com.testflow.testflow_runner.model.script.Reference;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns raw script lines into {@link Instruction}s. Each line is matched against a fixed,
 * ordered prefix grammar; the first matching form wins, anything unrecognised becomes TEXT.
 *
 * Structural markers honour the case flag. Instruction prefixes such as {@code CMD:} or
 * {@code Delay:} are always matched ignoring case.
 */
public class ScriptLexer {

    private static final String REF = "\\(\\s*(N|LE)\\s*(\\d+)\\s*\\)";

    private final Pattern scriptStart;
    private final Pattern scriptEnd;
    private final Pattern conditionalStart;
    private final Pattern nodeStart;
    private final Pattern nodeEnd;
    private final Pattern branchTrue;
    private final Pattern branchFalse;
    private final Pattern conditionalEnd;
    private final Pattern loopStart;
    private final Pattern loopEnd;
    private final Pattern workflowStart;
    private final Pattern workflowEnd;

    private static final Pattern VARIABLE      = Pattern.compile("^Variable\\s*:\\s*(.*)$", Pattern.CASE_INSENSITIVE);
    private static final Pattern RANGE         = Pattern.compile("^Range(?:\\s*\\(\\s*(?:\\d+|i)\\s*/\\s*(?:\\d+|n)\\s*\\))?\\s*:\\s*(.*)$", Pattern.CASE_INSENSITIVE);
    private static final Pattern WORKFLOW_CALL = Pattern.compile("^Work_flow\\s*:\\s*\\(\\s*(.*?)\\s*\\)\\s*$", Pattern.CASE_INSENSITIVE);
    private static final Pattern INSTRUMENT    = Pattern.compile("^INST\\s*::\\s*(.*)$", Pattern.CASE_INSENSITIVE);
    private static final Pattern ACTION        = Pattern.compile("^#ACTION\\s*:\\s*\\((.*)\\)\\s*$", Pattern.CASE_INSENSITIVE);

    private static final Pattern PREFIXED = Pattern.compile("^(CMD|QRY|PNG|SET|SER|Delay|MESSAGE)\\s*:(.*)$", Pattern.CASE_INSENSITIVE);

    public ScriptLexer(boolean caseSensitive) {
        int flags = caseSensitive ? 0 : Pattern.CASE_INSENSITIVE;
        scriptStart      = Pattern.compile("^#START_SCRIPT\\b", flags);
        scriptEnd        = Pattern.compile("^#END_SCRIPT\\b", flags);
        conditionalStart = Pattern.compile("^#NODE\\s*(\\d+)_IF\\s*\\((.*)\\)\\s*$", flags);
        nodeStart        = Pattern.compile("^#NODE\\s*(\\d+)(?!\\d|_IF)\\s*(?:\\((.*)\\))?", flags);
        nodeEnd          = Pattern.compile("^#END_NODE\\s*(\\d+)(?!\\d)(?:.*?" + REF + ")?", flags);
        branchTrue       = Pattern.compile("^TRUE\\s*:\\s*(N|LE)\\s*(\\d+)", flags);
        branchFalse      = Pattern.compile("^FALSE\\s*:\\s*(N|LE)\\s*(\\d+)", flags);
        conditionalEnd   = Pattern.compile("^#END_IF\\b", flags);
        loopStart        = Pattern.compile("^Loop_start\\s*\\(\\s*(\\d+)\\s*\\)\\s*:\\s*(-?\\d+)\\s*(?:" + REF + ")?", flags);
        loopEnd          = Pattern.compile("^Loop_end\\s*\\(\\s*(\\d+)\\s*\\)\\s*(?:" + REF + ")?", flags);
        workflowStart    = Pattern.compile("^#START_WORKFLOW\\s*\\(\\s*(.*?)\\s*\\)", flags);
        workflowEnd      = Pattern.compile("^#END_WORKFLOW\\s*\\(\\s*(.*?)\\s*\\)", flags);
    }

    public List<Instruction> lex(List<String> lines) {
        List<Instruction> instructions = new ArrayList<>(lines.size());
        for (int i = 0; i < lines.size(); i++) {
            instructions.add(lexLine(i + 1, lines.get(i)));
        }
        return instructions;
    }

    public Instruction lexLine(int line, String raw) {
        String text = raw == null ? "" : raw.strip();
        Matcher m;

        if (text.isEmpty())                         return Instruction.of(line, InstructionType.BLANK, raw, "");
        if (text.startsWith("//"))                  return Instruction.of(line, InstructionType.COMMENT, raw, text.substring(2).trim());
        if (scriptStart.matcher(text).find())       return Instruction.of(line, InstructionType.SCRIPT_START, raw, "");
        if (scriptEnd.matcher(text).find())         return Instruction.of(line, InstructionType.SCRIPT_END, raw, "");

        if ((m = workflowStart.matcher(text)).find()) return Instruction.of(line, InstructionType.WORKFLOW_START, raw, m.group(1));
        if ((m = workflowEnd.matcher(text)).find())   return Instruction.of(line, InstructionType.WORKFLOW_END, raw, m.group(1));

        if ((m = conditionalStart.matcher(text)).find()) {
            return Instruction.structural(line, InstructionType.CONDITIONAL_START, raw, m.group(2).trim(),
                    Integer.parseInt(m.group(1)), -1, null);
        }
        if ((m = nodeEnd.matcher(text)).find()) {
            return Instruction.structural(line, InstructionType.NODE_END, raw, "",
                    Integer.parseInt(m.group(1)), -1, reference(m, 2, line));
        }
        if ((m = nodeStart.matcher(text)).find()) {
            return Instruction.structural(line, InstructionType.NODE_START, raw, m.group(2) == null ? "" : m.group(2).trim(),
                    Integer.parseInt(m.group(1)), -1, null);
        }
        if ((m = branchTrue.matcher(text)).find()) {
            return Instruction.structural(line, InstructionType.BRANCH_TRUE, raw, "", -1, -1, reference(m, 1, line));
        }
        if ((m = branchFalse.matcher(text)).find()) {
            return Instruction.structural(line, InstructionType.BRANCH_FALSE, raw, "", -1, -1, reference(m, 1, line));
        }
        if (conditionalEnd.matcher(text).find())     return Instruction.of(line, InstructionType.CONDITIONAL_END, raw, "");

        if ((m = loopStart.matcher(text)).find()) {
            return Instruction.structural(line, InstructionType.LOOP_START, raw, "",
                    Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)), reference(m, 3, line));
        }
        if ((m = loopEnd.matcher(text)).find()) {
            return Instruction.structural(line, InstructionType.LOOP_END, raw, "",
                    Integer.parseInt(m.group(1)), -1, reference(m, 2, line));
        }

        if ((m = VARIABLE.matcher(text)).find())      return Instruction.of(line, InstructionType.VARIABLE, raw, m.group(1).trim());
        if ((m = RANGE.matcher(text)).find())         return Instruction.of(line, InstructionType.RANGE, raw, m.group(1).trim());
        if ((m = WORKFLOW_CALL.matcher(text)).find()) return Instruction.of(line, InstructionType.WORKFLOW_CALL, raw, m.group(1));
        if ((m = INSTRUMENT.matcher(text)).find())    return Instruction.of(line, InstructionType.INSTRUMENT, raw, m.group(1).trim());
        if ((m = ACTION.matcher(text)).find())        return Instruction.of(line, InstructionType.ACTION, raw, m.group(1).trim());

        if ((m = PREFIXED.matcher(text)).find()) {
            return Instruction.of(line, prefixType(m.group(1)), raw, m.group(2).trim());
        }
        return Instruction.of(line, InstructionType.TEXT, raw, text);
    }

    private static Reference reference(Matcher m, int typeGroup, int line) {
        String type = m.group(typeGroup);
        return type == null ? null : Reference.parse(type, m.group(typeGroup + 1), line);
    }

    private static InstructionType prefixType(String prefix) {
        switch (prefix.toUpperCase()) {
            case "CMD":     return InstructionType.COMMAND;
            case "QRY":     return InstructionType.QUERY;
            case "PNG":     return InstructionType.IMAGE_CAPTURE;
            case "SET":     return InstructionType.SET_CAPTURE;
            case "SER":     return InstructionType.SERIAL;
            case "DELAY":   return InstructionType.DELAY;
            case "MESSAGE": return InstructionType.MESSAGE;
            default: throw new IllegalArgumentException("Unknown instruction prefix: " + prefix);
        }
    }
}
