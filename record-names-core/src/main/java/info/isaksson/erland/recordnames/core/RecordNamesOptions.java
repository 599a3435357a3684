package info.isaksson.erland.recordnames.core;

import java.util.ArrayList;
import java.util.List;

/**
 * Options for naming the types of a Java source tree.
 *
 * <p>Mirrors the CLI flags in a structured form.</p>
 */
public final class RecordNamesOptions {

    /** Source scanning controls. */
    public boolean includeTests = false;

    /** Glob patterns relative to the source root; a plain directory name excludes everything below it. */
    public List<String> excludeGlobs = new ArrayList<>();

    /**
     * Whether types declared in method, constructor or initializer bodies are reported.
     * Generic usages declared by such types are dropped with them.
     */
    public boolean includeLocalTypes = true;
}
