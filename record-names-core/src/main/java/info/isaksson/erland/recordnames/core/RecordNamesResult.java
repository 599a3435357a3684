package info.isaksson.erland.recordnames.core;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import info.isaksson.erland.recordnames.extract.DeclaredRecordName;
import info.isaksson.erland.recordnames.extract.GenericUsage;

import java.nio.file.Path;
import java.util.List;

/** Naming result for a source tree; serialized as-is by the CLI. */
@JsonPropertyOrder({"sourceRoot","javaFileCount","declarations","genericUsages","parseErrors"})
public final class RecordNamesResult {

    public final String sourceRoot;

    @JsonIgnore
    public final List<Path> javaFiles;

    public final int javaFileCount;

    public final List<DeclaredRecordName> declarations;
    public final List<GenericUsage> genericUsages;
    public final List<String> parseErrors;

    RecordNamesResult(
            Path sourceRoot,
            List<Path> javaFiles,
            List<DeclaredRecordName> declarations,
            List<GenericUsage> genericUsages,
            List<String> parseErrors
    ) {
        this.sourceRoot = sourceRoot == null ? "" : sourceRoot.toString().replace("\\", "/");
        this.javaFiles = List.copyOf(javaFiles);
        this.javaFileCount = javaFiles.size();
        this.declarations = List.copyOf(declarations);
        this.genericUsages = List.copyOf(genericUsages);
        this.parseErrors = List.copyOf(parseErrors);
    }
}
