package info.isaksson.erland.recordnames.core;

import info.isaksson.erland.recordnames.extract.DeclaredRecordName;
import info.isaksson.erland.recordnames.extract.GenericUsage;
import info.isaksson.erland.recordnames.extract.JavaSourceNamer;
import info.isaksson.erland.recordnames.extract.SourceNamingModel;
import info.isaksson.erland.recordnames.io.SourceScanner;
import info.isaksson.erland.recordnames.model.NameRequest;
import info.isaksson.erland.recordnames.model.NameResolver;
import info.isaksson.erland.recordnames.model.ResolvedName;
import info.isaksson.erland.recordnames.reflect.ReflectiveNamer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.lang.reflect.Type;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Core API for resolving record names.
 *
 * <p>CLI and other wrappers should use this class instead of wiring the front ends themselves.
 * Every entry point shares one {@link NameResolver}.</p>
 */
public final class RecordNamesService {

    private static final Logger log = LoggerFactory.getLogger(RecordNamesService.class);

    private final NameResolver resolver;
    private final JavaSourceNamer sourceNamer;
    private final ReflectiveNamer reflectiveNamer;

    public RecordNamesService() {
        this(NameResolver.standard());
    }

    public RecordNamesService(NameResolver resolver) {
        this.resolver = Objects.requireNonNull(resolver, "resolver");
        this.sourceNamer = new JavaSourceNamer(resolver);
        this.reflectiveNamer = new ReflectiveNamer(resolver);
    }

    /** Name every type declared under a Java source directory. */
    public RecordNamesResult resolveFromSource(Path sourceRoot, RecordNamesOptions options) throws IOException {
        if (sourceRoot == null) throw new IllegalArgumentException("sourceRoot must not be null");
        if (options == null) options = new RecordNamesOptions();

        List<Path> javaFiles = SourceScanner.scan(sourceRoot, options.excludeGlobs == null ? List.of() : options.excludeGlobs, options.includeTests);
        log.debug("Scanned {} Java file(s) under {}", javaFiles.size(), sourceRoot);

        SourceNamingModel model = sourceNamer.extract(sourceRoot, javaFiles);

        List<DeclaredRecordName> declarations = model.declarations;
        List<GenericUsage> usages = model.genericUsages;
        if (!options.includeLocalTypes) {
            Set<String> localTypes = declarations.stream()
                    .filter(d -> d.local)
                    .map(d -> d.qualifiedName)
                    .collect(Collectors.toSet());
            declarations = declarations.stream().filter(d -> !d.local).collect(Collectors.toList());
            usages = usages.stream().filter(u -> !localTypes.contains(u.declaringType)).collect(Collectors.toList());
            log.debug("Dropped {} local type(s)", localTypes.size());
        }

        return new RecordNamesResult(sourceRoot, javaFiles, declarations, usages, model.parseErrors);
    }

    /** Resolve hand-written descriptors, keeping input order. */
    public List<ResolvedName> resolveRequests(List<NameRequest> requests) {
        if (requests == null) throw new IllegalArgumentException("requests must not be null");
        List<ResolvedName> out = new ArrayList<>(requests.size());
        for (NameRequest r : requests) {
            out.add(resolver.resolve(r.descriptor, r.overrides));
        }
        return out;
    }

    /** Resolve loaded classes or generic types, keeping input order. */
    public List<ResolvedName> resolveTypes(List<? extends Type> types) {
        if (types == null) throw new IllegalArgumentException("types must not be null");
        List<ResolvedName> out = new ArrayList<>(types.size());
        for (Type t : types) {
            out.add(reflectiveNamer.resolve(t));
        }
        return out;
    }

    public ReflectiveNamer reflectiveNamer() {
        return reflectiveNamer;
    }
}
