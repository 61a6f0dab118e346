package com.testflow.testflow_runner.result;

/** Column naming shared by the schema builder and the recorder. */
public final class ResultColumns {

    public static final String ROW  = "N";
    public static final String DATE = "Date";
    public static final String TIME = "Time";

    private ResultColumns() {
    }

    public static String loop(int loopId) {
        return "Loop(" + loopId + ")";
    }

    public static String measurement(String actionTitle, int nodeId, int actionIndex) {
        return sanitize(actionTitle) + suffix(nodeId, actionIndex);
    }

    public static String image(String actionTitle, int nodeId, int actionIndex) {
        return sanitize(actionTitle) + "img" + suffix(nodeId, actionIndex);
    }

    public static String settings(String actionTitle, int nodeId, int actionIndex) {
        return sanitize(actionTitle) + "set" + suffix(nodeId, actionIndex);
    }

    /** Whitespace runs become '_', anything but letters, digits, '_' and '-' is dropped. */
    public static String sanitize(String title) {
        if (title == null) {
            return "";
        }
        return title.strip()
                .replaceAll("\\s+", "_")
                .replaceAll("[^\\p{L}\\p{N}_\\-]+", "");
    }

    private static String suffix(int nodeId, int actionIndex) {
        return "(N" + nodeId + "|A" + actionIndex + ")";
    }
}
