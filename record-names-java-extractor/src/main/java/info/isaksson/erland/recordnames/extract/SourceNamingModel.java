package info.isaksson.erland.recordnames.extract;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/** Result of naming every type found in a set of Java sources. */
public final class SourceNamingModel {
    public final Path sourceRoot;
    public final List<Path> sourceFiles;

    /** Sorted by qualified name. */
    public final List<DeclaredRecordName> declarations = new ArrayList<>();

    /** Sorted by declaring type, then member. */
    public final List<GenericUsage> genericUsages = new ArrayList<>();

    public final List<String> parseErrors = new ArrayList<>();

    public SourceNamingModel(Path sourceRoot, List<Path> sourceFiles) {
        this.sourceRoot = sourceRoot;
        this.sourceFiles = sourceFiles == null ? List.of() : List.copyOf(sourceFiles);
    }

    public Optional<DeclaredRecordName> declaration(String qualifiedName) {
        return declarations.stream().filter(d -> d.qualifiedName.equals(qualifiedName)).findFirst();
    }

    public Optional<GenericUsage> usage(String declaringType, String member) {
        return genericUsages.stream()
                .filter(u -> u.declaringType.equals(declaringType) && u.member.equals(member))
                .findFirst();
    }
}
