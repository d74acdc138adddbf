package com.architecture.migration.impact.service.graph;

import java.nio.file.FileSystem;
import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Decides which files of a project are skipped: anything matching an exclude glob, and
 * generated files unless the options include them.
 */
public class FileExclusionFilter {

    private final List<PathMatcher> excludes;
    private final List<PathMatcher> generated;
    private final List<String> generatedSuffixes;
    private final boolean includeGenerated;

    public FileExclusionFilter(GraphBuildOptions options) {
        FileSystem fs = FileSystems.getDefault();
        this.excludes = compile(fs, options.getExcludePatterns());
        this.generated = compile(fs, options.getGeneratedFilePatterns());
        this.generatedSuffixes = options.getGeneratedFileSuffixes().stream()
                .map(s -> s.toLowerCase(Locale.ROOT))
                .collect(Collectors.toList());
        this.includeGenerated = options.isIncludeGeneratedFiles();
    }

    public boolean isExcluded(String filePath) {
        Path path = Path.of(filePath.replace('\\', '/'));
        if (matchesAny(excludes, path)) {
            return true;
        }
        return !includeGenerated && isGenerated(path);
    }

    private boolean isGenerated(Path path) {
        String name = path.getFileName() == null ? "" : path.getFileName().toString().toLowerCase(Locale.ROOT);
        return generatedSuffixes.stream().anyMatch(name::endsWith) || matchesAny(generated, path);
    }

    private static boolean matchesAny(List<PathMatcher> matchers, Path path) {
        return matchers.stream().anyMatch(m -> m.matches(path));
    }

    private static List<PathMatcher> compile(FileSystem fs, List<String> globs) {
        return globs.stream()
                .map(glob -> fs.getPathMatcher("glob:" + glob))
                .collect(Collectors.toList());
    }
}
