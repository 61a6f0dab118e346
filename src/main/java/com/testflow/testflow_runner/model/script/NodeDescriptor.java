package com.testflow.testflow_runner.model.script;

/**
 * Parsed form of {@code #NODE<id>(type, instrument, manufacturer, model)}. Every field
 * after the id is optional and defaults to an empty string.
 */
public record NodeDescriptor(int nodeId, String nodeType, String instrumentName,
                             String manufacturer, String model) {

    public static NodeDescriptor parse(int nodeId, String descriptor) {
        String[] parts = descriptor == null || descriptor.isBlank()
                ? new String[0]
                : descriptor.split(",", -1);
        return new NodeDescriptor(
                nodeId,
                part(parts, 0),
                part(parts, 1),
                part(parts, 2),
                part(parts, 3));
    }

    private static String part(String[] parts, int index) {
        return index < parts.length ? parts[index].trim() : "";
    }
}
