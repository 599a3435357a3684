package info.isaksson.erland.recordnames.extract;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.ast.body.FieldDeclaration;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.body.RecordDeclaration;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.type.ClassOrInterfaceType;
import com.github.javaparser.ast.type.Type;
import info.isaksson.erland.recordnames.model.NameResolver;
import info.isaksson.erland.recordnames.model.OverrideSet;
import info.isaksson.erland.recordnames.model.TypeDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;

/**
 * Compile-time front end: names every type declared in a set of Java sources.
 *
 * <p>Small orchestrator over the helpers in this package:</p>
 * <ul>
 *   <li>{@link JavaCompilationUnitParser}: parse sources, collecting errors</li>
 *   <li>{@link DeclarationWalker}: find top-level, member and local type declarations</li>
 *   <li>{@link AnnotationOverrides}: read the override annotations off each declaration</li>
 *   <li>{@link StringConstants}: evaluate constant annotation values</li>
 *   <li>{@link SourceTypeDescriptors}: turn declarations and usages into descriptors</li>
 * </ul>
 *
 * <p>All naming goes through the shared {@link NameResolver}.</p>
 */
public final class JavaSourceNamer {

    private static final Logger log = LoggerFactory.getLogger(JavaSourceNamer.class);

    private final JavaParser parser;
    private final NameResolver resolver;

    public JavaSourceNamer() {
        this(NameResolver.standard());
    }

    public JavaSourceNamer(NameResolver resolver) {
        this.resolver = Objects.requireNonNull(resolver, "resolver");
        ParserConfiguration cfg = new ParserConfiguration();
        cfg.setCharacterEncoding(StandardCharsets.UTF_8);
        cfg.setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17);
        this.parser = new JavaParser(cfg);
    }

    public SourceNamingModel extract(Path sourceRoot, List<Path> javaFiles) {
        SourceNamingModel model = new SourceNamingModel(sourceRoot, javaFiles);
        List<ParsedUnit> units = JavaCompilationUnitParser.parseAll(parser, sourceRoot, javaFiles, model);
        return name(model, units);
    }

    /**
     * Names types in in-memory sources.
     *
     * @param sourcesByLabel source code keyed by a label used as {@link DeclaredRecordName#sourcePath}
     */
    public SourceNamingModel extractFromStrings(Map<String, String> sourcesByLabel) {
        SourceNamingModel model = new SourceNamingModel(null, List.of());
        List<ParsedUnit> units = JavaCompilationUnitParser.parseAll(parser, new LinkedHashMap<>(sourcesByLabel), model);
        return name(model, units);
    }

    private SourceNamingModel name(SourceNamingModel model, List<ParsedUnit> units) {
        // 1) Discover declarations across all units first so usages and constants can see every project type.
        List<TypeSite> sites = new ArrayList<>();
        for (ParsedUnit u : units) sites.addAll(DeclarationWalker.walk(u));

        Set<String> projectTypes = new HashSet<>();
        for (TypeSite site : sites) projectTypes.add(site.qualifiedName());
        Map<ParsedUnit, ImportContext> contexts = new IdentityHashMap<>();
        Function<ParsedUnit, ImportContext> contextOf = u -> contexts.computeIfAbsent(u, x -> ImportContext.from(x.cu(), projectTypes));
        StringConstants constants = new StringConstants(sites, contextOf);

        Map<String, OverrideSet> overridesByType = new HashMap<>();
        for (TypeSite site : sites) {
            OverrideSet overrides = AnnotationOverrides.from(site, constants, model.parseErrors::add);
            OverrideSet previous = overridesByType.putIfAbsent(site.qualifiedName(), overrides);
            if (previous != null) {
                log.warn("{} is declared more than once (again in {})", site.qualifiedName(), site.unit().sourcePath());
            }
        }

        // 2) Resolve declarations and the parameterized types their fields use.
        for (TypeSite site : sites) {
            TypeDescriptor descriptor = SourceTypeDescriptors.fromDeclaration(site.ownerPath(), site.declaration());
            OverrideSet overrides = overridesByType.get(site.qualifiedName());
            model.declarations.add(new DeclaredRecordName(
                    site.unit().sourcePath(),
                    site.qualifiedName(),
                    site.local(),
                    descriptor,
                    overrides,
                    resolver.resolve(descriptor, overrides)
            ));

            TypeNameQualifier qualifier = contextOf.apply(site.unit()).qualifierFor(site.scopeChain(), site.typeVariables());
            for (Map.Entry<String, Type> member : memberTypes(site).entrySet()) {
                if (!isParameterized(member.getValue())) continue;
                TypeDescriptor used = SourceTypeDescriptors.fromUsage(member.getValue(), qualifier);
                OverrideSet usedOverrides = overridesByType.getOrDefault(SourceTypeDescriptors.qualifiedName(used), OverrideSet.none());
                model.genericUsages.add(new GenericUsage(
                        site.qualifiedName(),
                        member.getKey(),
                        used,
                        usedOverrides,
                        resolver.resolve(used, usedOverrides)
                ));
            }
        }

        // Stable ordering for downstream determinism
        model.declarations.sort(Comparator.comparing(d -> d.qualifiedName));
        model.genericUsages.sort(Comparator.<GenericUsage, String>comparing(u -> u.declaringType).thenComparing(u -> u.member));
        log.debug("Named {} declaration(s) and {} generic usage(s) in {} unit(s)",
                model.declarations.size(), model.genericUsages.size(), units.size());
        return model;
    }

    /** Field and record component types by member name, in declaration order. */
    private static Map<String, Type> memberTypes(TypeSite site) {
        Map<String, Type> out = new LinkedHashMap<>();
        if (site.declaration() instanceof RecordDeclaration) {
            for (Parameter p : ((RecordDeclaration) site.declaration()).getParameters()) {
                out.put(p.getNameAsString(), p.getType());
            }
        }
        for (FieldDeclaration fd : site.declaration().getFields()) {
            if (fd.isStatic()) continue;
            for (VariableDeclarator v : fd.getVariables()) {
                out.put(v.getNameAsString(), v.getType());
            }
        }
        return out;
    }

    private static boolean isParameterized(Type type) {
        if (!(type instanceof ClassOrInterfaceType)) return false;
        return ((ClassOrInterfaceType) type).getTypeArguments().map(args -> !args.isEmpty()).orElse(false);
    }
}
