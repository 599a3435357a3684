package info.isaksson.erland.recordnames.model;

import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Derives the record name and namespace for a type, taking overrides and type arguments into account.
 *
 * <p>The general format for a generic record name is {@code Base__A_B_C}: a double underscore
 * separates the base name from the type arguments, and each argument contributes its own short
 * name, separated by single underscores. Arguments of arguments are not expanded.</p>
 *
 * <p>Precedence:</p>
 * <ul>
 *   <li>name: override, then the erased name when {@code erased} is set, then the generic name</li>
 *   <li>namespace: override (verbatim), then the normalized owner path</li>
 * </ul>
 *
 * <p>Instances are immutable and safe to share between threads.</p>
 */
public final class NameResolver {

    static final String ARGUMENTS_SEPARATOR = "__";
    static final String ARGUMENT_SEPARATOR = "_";

    private static final NameResolver STANDARD = new NameResolver(OwnerPathNormalizer.standard());

    private final OwnerPathNormalizer ownerPathNormalizer;

    public NameResolver(OwnerPathNormalizer ownerPathNormalizer) {
        this.ownerPathNormalizer = Objects.requireNonNull(ownerPathNormalizer, "ownerPathNormalizer");
    }

    /** Resolver using {@link OwnerPathNormalizer#standard()}, shared by the Java front ends. */
    public static NameResolver standard() {
        return STANDARD;
    }

    public ResolvedName resolve(TypeDescriptor descriptor, OverrideSet overrides) {
        Objects.requireNonNull(descriptor, "descriptor");
        OverrideSet o = overrides == null ? OverrideSet.none() : overrides;

        String name = o.name != null ? o.name : (o.erased ? erasedName(descriptor) : genericName(descriptor));
        String namespace = o.namespace != null ? o.namespace : defaultNamespace(descriptor);
        return new ResolvedName(namespace, name);
    }

    public ResolvedName resolve(TypeDescriptor descriptor) {
        return resolve(descriptor, OverrideSet.none());
    }

    /** Usually the package name, or package + outer types for a nested type. */
    public String defaultNamespace(TypeDescriptor descriptor) {
        String normalized = ownerPathNormalizer.normalize(descriptor.ownerPath);
        return normalized == null ? "" : normalized;
    }

    /** The type name without type arguments: {@code List<Integer>} gives {@code List}. */
    public static String erasedName(TypeDescriptor descriptor) {
        return descriptor.shortName;
    }

    /** The type name with arguments encoded: {@code Pair<Integer, String>} gives {@code Pair__Integer_String}. */
    public static String genericName(TypeDescriptor descriptor) {
        if (descriptor.typeArguments.isEmpty()) return erasedName(descriptor);
        String args = descriptor.typeArguments.stream()
                .map(a -> a.shortName)
                .collect(Collectors.joining(ARGUMENT_SEPARATOR));
        return descriptor.shortName + ARGUMENTS_SEPARATOR + args;
    }

    public OwnerPathNormalizer ownerPathNormalizer() {
        return ownerPathNormalizer;
    }
}
