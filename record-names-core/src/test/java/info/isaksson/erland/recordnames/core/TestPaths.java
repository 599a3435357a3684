package info.isaksson.erland.recordnames.core;

import java.nio.file.Files;
import java.nio.file.Path;

/** Test helper for resolving paths when running from the module or the repository root. */
final class TestPaths {

    private static final String FIXTURES = "src/test/java/info/isaksson/erland/recordnames/core/fixtures";

    private TestPaths() {}

    /** Source folder holding the compiled fixture classes, so both front ends see the same types. */
    static Path fixtureSources() {
        Path p = Path.of("").toAbsolutePath().normalize();
        for (Path candidate : new Path[] {p, p.resolve("record-names-core")}) {
            if (Files.isDirectory(candidate.resolve(FIXTURES))) {
                return candidate.resolve(FIXTURES);
            }
        }
        throw new IllegalStateException("Could not locate fixture sources. Start dir: " + p);
    }
}
