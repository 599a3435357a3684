package info.isaksson.erland.recordnames.io;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Deterministic discovery of Java sources that can declare record types.
 *
 * <p>Returns a sorted list of {@code .java} files under a source root. {@code package-info.java}
 * and {@code module-info.java} are never returned since they declare no types.</p>
 */
public final class SourceScanner {

    private static final Set<String> NON_TYPE_SOURCES = Set.of("package-info.java", "module-info.java");

    private static final List<String> BUILD_DIRS = List.of(
            "target/", "build/", "out/", ".git/", ".idea/", ".gradle/", "node_modules/");

    private SourceScanner() {}

    /**
     * Scan for .java files under {@code sourceRoot}.
     *
     * @param sourceRoot   root folder to scan
     * @param excludeGlobs glob patterns matched against the path relative to sourceRoot, using '/' separators.
     *                     A plain directory name without wildcards excludes everything below it.
     * @param includeTests whether to include common test folders (e.g. src/test, test)
     */
    public static List<Path> scan(Path sourceRoot, List<String> excludeGlobs, boolean includeTests) throws IOException {
        Objects.requireNonNull(sourceRoot, "sourceRoot");
        List<PathMatcher> excludes = compileExcludes(excludeGlobs);

        List<Path> out = new ArrayList<>();
        try (Stream<Path> stream = Files.walk(sourceRoot)) {
            stream.filter(Files::isRegularFile)
                    .filter(SourceScanner::isTypeSource)
                    .forEach(p -> {
                        String rel = relative(sourceRoot, p);
                        if (!includeTests && isTestPath(rel)) return;
                        if (isBuildOutput(rel)) return;
                        if (isExcluded(rel, excludes)) return;
                        out.add(p);
                    });
        }
        out.sort(Comparator.comparing(p -> relative(sourceRoot, p)));
        return out;
    }

    static boolean isTypeSource(Path file) {
        String name = file.getFileName().toString();
        return name.endsWith(".java") && !NON_TYPE_SOURCES.contains(name);
    }

    static boolean isTestPath(String rel) {
        return rel.startsWith("src/test/")
                || rel.startsWith("src/integrationTest/")
                || rel.startsWith("src/it/")
                || rel.startsWith("test/")
                || rel.contains("/test/")
                || rel.contains("/tests/");
    }

    static boolean isBuildOutput(String rel) {
        for (String dir : BUILD_DIRS) {
            if (rel.startsWith(dir)) return true;
        }
        return false;
    }

    private static boolean isExcluded(String rel, List<PathMatcher> excludes) {
        if (excludes.isEmpty()) return false;
        Path relPath = Path.of(rel);
        return excludes.stream().anyMatch(m -> m.matches(relPath));
    }

    private static List<PathMatcher> compileExcludes(List<String> excludeGlobs) {
        if (excludeGlobs == null) return List.of();
        return excludeGlobs.stream()
                .filter(Objects::nonNull)
                .map(String::trim)
                .filter(g -> !g.isEmpty())
                .map(g -> g.replace("\\", "/"))
                .map(SourceScanner::directoryToGlob)
                .map(g -> FileSystems.getDefault().getPathMatcher("glob:" + g))
                .collect(Collectors.toList());
    }

    private static String directoryToGlob(String pattern) {
        boolean wildcard = pattern.contains("*") || pattern.contains("?") || pattern.contains("[");
        if (wildcard) return pattern;
        return pattern.endsWith("/") ? pattern + "**" : pattern + "/**";
    }

    private static String relative(Path root, Path p) {
        return root.relativize(p).toString().replace("\\", "/");
    }
}
