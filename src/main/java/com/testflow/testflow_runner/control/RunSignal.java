package com.testflow.testflow_runner.control;

import java.util.Locale;

public enum RunSignal {
    RUNNING,
    PAUSE,
    RESUME,
    STOP;

    /** Unknown or empty text reads as RUNNING. */
    public static RunSignal fromText(String text) {
        if (text == null) {
            return RUNNING;
        }
        switch (text.trim().toLowerCase(Locale.ROOT)) {
            case "pause":
            case "paused":
                return PAUSE;
            case "resume":
                return RESUME;
            case "stop":
            case "stopped":
                return STOP;
            default:
                return RUNNING;
        }
    }

    public String text() {
        return name().toLowerCase(Locale.ROOT);
    }
}
