package com.testflow.testflow_runner.transport;

/**
 * Outcome of one transport call. Failures are values, never exceptions: the engine logs them
 * and leaves the result cell empty.
 */
public record TransportReply(boolean ok, String text, byte[] data, String error) {

    public static TransportReply sent() {
        return new TransportReply(true, "", null, null);
    }

    public static TransportReply text(String text) {
        return new TransportReply(true, text, null, null);
    }

    public static TransportReply binary(byte[] data) {
        return new TransportReply(true, "", data, null);
    }

    public static TransportReply failure(String error) {
        return new TransportReply(false, null, null, error);
    }
}
