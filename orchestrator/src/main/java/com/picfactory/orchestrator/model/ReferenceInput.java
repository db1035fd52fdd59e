package com.picfactory.orchestrator.model;

/**
 * A reference image as submitted by the caller; {@code fileName} may be null.
 */
public record ReferenceInput(String filePath, String fileName) {

    /** Explicit name if given, else the last path segment, else "image". */
    public String resolvedFileName() {
        if (fileName != null && !fileName.isBlank()) {
            return fileName.trim();
        }
        if (filePath == null) {
            return "image";
        }
        String[] segments = filePath.split("[/\\\\]");
        for (int i = segments.length - 1; i >= 0; i--) {
            if (!segments[i].isBlank()) {
                return segments[i];
            }
        }
        return "image";
    }
}
