package com.architecture.migration.impact.model.graph;

import java.util.Locale;

/**
 * Path comparison helpers. Paths are compared with forward slashes, without a trailing
 * separator and ignoring case.
 */
public final class GraphPaths {

    private GraphPaths() {
    }

    public static String normalize(String path) {
        if (path == null) {
            return "";
        }
        String normalized = path.replace('\\', '/');
        while (normalized.length() > 1 && normalized.endsWith("/")) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }
        return normalized;
    }

    public static boolean samePath(String left, String right) {
        return normalize(left).toLowerCase(Locale.ROOT).equals(normalize(right).toLowerCase(Locale.ROOT));
    }

    /**
     * True when {@code path} lies strictly below {@code folder}. The prefix has to end on a
     * separator, so {@code src/app} does not contain {@code src/application/A.java}.
     */
    public static boolean isUnder(String path, String folder) {
        String p = normalize(path).toLowerCase(Locale.ROOT);
        String f = normalize(folder).toLowerCase(Locale.ROOT);
        if (f.isEmpty()) {
            return false;
        }
        return p.startsWith(f.endsWith("/") ? f : f + "/");
    }

    /**
     * Replaces the {@code fromFolder} prefix of {@code path} with {@code toFolder}.
     */
    public static String rebase(String path, String fromFolder, String toFolder) {
        String p = normalize(path);
        String from = normalize(fromFolder);
        String relative = p.length() > from.length() ? p.substring(from.length()) : "";
        if (relative.startsWith("/")) {
            relative = relative.substring(1);
        }
        String target = normalize(toFolder);
        if (relative.isEmpty()) {
            return target;
        }
        return target.endsWith("/") ? target + relative : target + "/" + relative;
    }

    public static String directoryOf(String path) {
        String p = normalize(path);
        int idx = p.lastIndexOf('/');
        return idx > 0 ? p.substring(0, idx) : (idx == 0 ? "/" : "");
    }

    public static String fileNameOf(String path) {
        String p = normalize(path);
        int idx = p.lastIndexOf('/');
        return idx >= 0 ? p.substring(idx + 1) : p;
    }
}
