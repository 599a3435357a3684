package info.isaksson.erland.recordnames.extract;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ast.CompilationUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Parses Java sources into {@link CompilationUnit}s, collecting failures into {@link SourceNamingModel#parseErrors}.
 */
final class JavaCompilationUnitParser {

    private static final Logger log = LoggerFactory.getLogger(JavaCompilationUnitParser.class);

    private JavaCompilationUnitParser() {}

    static List<ParsedUnit> parseAll(JavaParser parser, Path sourceRoot, List<Path> javaFiles, SourceNamingModel model) {
        List<ParsedUnit> units = new ArrayList<>();
        for (Path f : javaFiles) {
            String label = rel(sourceRoot, f);
            try {
                String code = Files.readString(f, StandardCharsets.UTF_8);
                parse(parser, label, code, model).ifPresent(units::add);
            } catch (IOException e) {
                log.warn("Could not read {}: {}", label, e.getMessage());
                model.parseErrors.add(label + ": IO error (" + e.getMessage() + ")");
            }
        }
        return units;
    }

    static List<ParsedUnit> parseAll(JavaParser parser, Map<String, String> sourcesByLabel, SourceNamingModel model) {
        List<ParsedUnit> units = new ArrayList<>();
        sourcesByLabel.forEach((label, code) -> parse(parser, label, code, model).ifPresent(units::add));
        return units;
    }

    private static Optional<ParsedUnit> parse(JavaParser parser, String label, String code, SourceNamingModel model) {
        ParseResult<CompilationUnit> result = parser.parse(code);
        if (!result.isSuccessful() || result.getResult().isEmpty()) {
            log.warn("Skipping {}: {} parse problem(s)", label, result.getProblems().size());
            model.parseErrors.add(label + ": parse error (" + result.getProblems().size() + " problems)");
            return Optional.empty();
        }
        return Optional.of(new ParsedUnit(label, result.getResult().get()));
    }

    static String rel(Path root, Path file) {
        if (root == null) return file.toString().replace('\\', '/');
        try {
            return root.relativize(file).toString().replace('\\', '/');
        } catch (IllegalArgumentException e) {
            return file.toString().replace('\\', '/');
        }
    }
}
