package com.maildesk.util;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.regex.Pattern;

/**
 * Attachment file layout utilities
 * Path structure: basePath/ticketId/filename[-n].ext
 */
public final class AttachmentPathUtil {

    private static final Pattern UNSAFE_CHARS = Pattern.compile("[\\\\/*?:\"<>|\\p{Cntrl}]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final int MAX_EXTENSION_LENGTH = 10;

    public static final String DEFAULT_FILENAME = "attachment";

    private AttachmentPathUtil() {}

    /**
     * Remove path-unsafe characters and collapse whitespace.
     * Names longer than maxLength keep their (at most 10 character) extension.
     */
    public static String sanitizeFilename(String name, int maxLength) {
        if (name == null) {
            return DEFAULT_FILENAME;
        }
        String safe = UNSAFE_CHARS.matcher(name).replaceAll("");
        safe = WHITESPACE.matcher(safe).replaceAll(" ").trim();

        // "." and ".." would escape the ticket directory
        if (safe.isEmpty() || safe.chars().allMatch(c -> c == '.')) {
            return DEFAULT_FILENAME;
        }

        if (safe.length() > maxLength) {
            String ext = extensionOf(safe);
            if (ext.length() > MAX_EXTENSION_LENGTH) {
                ext = ext.substring(0, MAX_EXTENSION_LENGTH);
            }
            String root = baseNameOf(safe);
            int rootLength = Math.max(1, maxLength - ext.length());
            safe = root.substring(0, Math.min(root.length(), rootLength)) + ext;
        }
        return safe;
    }

    /**
     * Candidate name for the n-th collision: invoice.pdf -> invoice-1.pdf
     */
    public static String withSuffix(String filename, int n) {
        if (n <= 0) {
            return filename;
        }
        return baseNameOf(filename) + "-" + n + extensionOf(filename);
    }

    /**
     * Ticket directory under the attachment root
     */
    public static Path ticketDirectory(String basePath, String ticketId) {
        return Paths.get(basePath, sanitizeFilename(ticketId, 200));
    }

    /**
     * Path relative to basePath with forward slashes
     */
    public static String relativize(String basePath, Path file) {
        return Paths.get(basePath).relativize(file).toString().replace('\\', '/');
    }

    /**
     * Extension including the dot, empty when there is none
     */
    static String extensionOf(String filename) {
        int dot = filename.lastIndexOf('.');
        return dot > 0 ? filename.substring(dot) : "";
    }

    static String baseNameOf(String filename) {
        int dot = filename.lastIndexOf('.');
        return dot > 0 ? filename.substring(0, dot) : filename;
    }
}
