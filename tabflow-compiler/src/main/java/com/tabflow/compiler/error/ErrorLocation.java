package com.tabflow.compiler.error;

/**
 * Where a compilation problem sits, for author-facing diagnostics. All fields are optional;
 * {@code filePath} and {@code line} point into externally referenced content (prompt or tool files).
 */
public record ErrorLocation(
        String nodeId,
        String nodeName,
        String nodeType,
        String regionId,
        String filePath,
        Integer line
) {
    public static final ErrorLocation UNKNOWN = new ErrorLocation(null, null, null, null, null, null);

    public static ErrorLocation ofNode(String nodeId, String regionId) {
        return new ErrorLocation(nodeId, null, null, regionId, null, null);
    }

    public ErrorLocation withFilePath(String filePath) {
        return new ErrorLocation(nodeId, nodeName, nodeType, regionId, filePath, line);
    }

    /** Short form used in messages, e.g. {@code node 'Writer' (a2) in region tab1, file prompts/w.md:12}. */
    public String describe() {
        StringBuilder sb = new StringBuilder();
        if (nodeId != null) {
            sb.append("node ");
            if (nodeName != null && !nodeName.isBlank()) {
                sb.append('\'').append(nodeName).append("' (").append(nodeId).append(')');
            } else {
                sb.append(nodeId);
            }
        }
        if (regionId != null) {
            if (sb.length() > 0) sb.append(' ');
            sb.append("in region ").append(regionId);
        }
        if (filePath != null) {
            if (sb.length() > 0) sb.append(", ");
            sb.append("file ").append(filePath);
            if (line != null) sb.append(':').append(line);
        }
        return sb.length() > 0 ? sb.toString() : "unknown location";
    }
}
