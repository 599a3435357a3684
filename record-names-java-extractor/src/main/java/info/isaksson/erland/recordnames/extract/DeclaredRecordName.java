package info.isaksson.erland.recordnames.extract;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import info.isaksson.erland.recordnames.model.OverrideSet;
import info.isaksson.erland.recordnames.model.ResolvedName;
import info.isaksson.erland.recordnames.model.TypeDescriptor;

/** A type declared in source and the record name it resolves to. */
@JsonPropertyOrder({"qualifiedName","sourcePath","local","descriptor","overrides","resolved"})
public final class DeclaredRecordName {
    /** Source file relative to the source root, using '/' separators. */
    public final String sourcePath;

    /** Raw dotted name; local types keep their {@code <local m>} segment so it stays unique. */
    public final String qualifiedName;

    /** True if declared in a method, constructor or initializer body (directly or nested). */
    public final boolean local;

    public final TypeDescriptor descriptor;
    public final OverrideSet overrides;
    public final ResolvedName resolved;

    public DeclaredRecordName(String sourcePath,
                              String qualifiedName,
                              boolean local,
                              TypeDescriptor descriptor,
                              OverrideSet overrides,
                              ResolvedName resolved) {
        this.sourcePath = sourcePath;
        this.qualifiedName = qualifiedName;
        this.local = local;
        this.descriptor = descriptor;
        this.overrides = overrides;
        this.resolved = resolved;
    }
}
