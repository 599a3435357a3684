package info.isaksson.erland.recordnames.reflect;

import info.isaksson.erland.recordnames.model.NameResolver;
import info.isaksson.erland.recordnames.model.OverrideSet;
import info.isaksson.erland.recordnames.model.OwnerPathNormalizer;
import info.isaksson.erland.recordnames.model.ResolvedName;
import info.isaksson.erland.recordnames.model.TypeDescriptor;
import info.isaksson.erland.recordnames.model.annotations.ErasedName;
import info.isaksson.erland.recordnames.model.annotations.RecordName;
import info.isaksson.erland.recordnames.model.annotations.RecordNamespace;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Field;
import java.lang.reflect.GenericArrayType;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.lang.reflect.TypeVariable;
import java.lang.reflect.WildcardType;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Runtime front end: names loaded classes and generic types through reflection.
 *
 * <p>Descriptors have the same shape as those built from source, so a class and its source
 * declaration resolve to the same name. Local classes get a {@code <local m>} owner segment
 * where {@code m} is the enclosing method, {@code new} for a constructor and {@code init}
 * otherwise; a local class declared in a lambda body is attributed to the member holding the lambda
 * (see {@link #memberOfLambda(String)}). Classes declared in or under an anonymous class are rejected.</p>
 *
 * <p>Thread-safe. Class descriptors are cached for the lifetime of the instance.</p>
 */
public final class ReflectiveNamer {

    public static final String ARRAY_NAME = "Array";

    private static final Logger log = LoggerFactory.getLogger(ReflectiveNamer.class);

    private static final String CONSTRUCTOR_SCOPE = "new";
    private static final String INITIALIZER_SCOPE = "init";
    private static final String LAMBDA_PREFIX = "lambda$";

    private static final TypeDescriptor OBJECT = TypeDescriptor.of("java.lang", "Object");

    private final NameResolver resolver;
    private final Map<Class<?>, TypeDescriptor> classDescriptors = new ConcurrentHashMap<>();

    public ReflectiveNamer() {
        this(NameResolver.standard());
    }

    public ReflectiveNamer(NameResolver resolver) {
        this.resolver = Objects.requireNonNull(resolver, "resolver");
    }

    /**
     * Descriptor of a class or generic type.
     *
     * @throws IllegalArgumentException for anonymous or hidden classes and classes declared inside them,
     *                                  which have no stable name
     */
    public TypeDescriptor descriptorOf(Type type) {
        Objects.requireNonNull(type, "type");
        if (type instanceof Class) {
            Class<?> c = (Class<?>) type;
            if (c.isArray()) {
                return arrayOf(descriptorOf(c.getComponentType()));
            }
            return classDescriptors.computeIfAbsent(c, ReflectiveNamer::describeClass);
        }
        if (type instanceof ParameterizedType) {
            ParameterizedType pt = (ParameterizedType) type;
            TypeDescriptor raw = descriptorOf(pt.getRawType());
            List<TypeDescriptor> args = new ArrayList<>();
            for (Type arg : pt.getActualTypeArguments()) args.add(descriptorOf(arg));
            return new TypeDescriptor(raw.shortName, raw.ownerPath, args);
        }
        if (type instanceof GenericArrayType) {
            return arrayOf(descriptorOf(((GenericArrayType) type).getGenericComponentType()));
        }
        if (type instanceof TypeVariable) {
            return TypeDescriptor.unscoped(((TypeVariable<?>) type).getName());
        }
        if (type instanceof WildcardType) {
            WildcardType wt = (WildcardType) type;
            if (wt.getLowerBounds().length > 0) return OBJECT;
            Type[] upper = wt.getUpperBounds();
            return upper.length == 0 ? OBJECT : descriptorOf(upper[0]);
        }
        throw new IllegalArgumentException("Unsupported type: " + type.getTypeName());
    }

    /** Overrides declared on the raw class of {@code type}; none for type variables, wildcards and arrays. */
    public OverrideSet overridesOf(Type type) {
        Class<?> raw = rawClass(type);
        if (raw == null || raw.isArray() || raw.isPrimitive()) return OverrideSet.none();

        RecordName name = raw.getAnnotation(RecordName.class);
        RecordNamespace namespace = raw.getAnnotation(RecordNamespace.class);
        return new OverrideSet(
                name == null ? null : name.value(),
                namespace == null ? null : namespace.value(),
                raw.isAnnotationPresent(ErasedName.class)
        );
    }

    public ResolvedName resolve(Type type) {
        return resolver.resolve(descriptorOf(type), overridesOf(type));
    }

    /**
     * Resolved names of the parameterized types used by the instance fields of {@code owner},
     * keyed and sorted by field name. Record components are included.
     */
    public SortedMap<String, ResolvedName> genericUsagesOf(Class<?> owner) {
        Objects.requireNonNull(owner, "owner");
        SortedMap<String, ResolvedName> out = new TreeMap<>();
        for (Field f : owner.getDeclaredFields()) {
            if (Modifier.isStatic(f.getModifiers()) || f.isSynthetic()) continue;
            if (f.getGenericType() instanceof ParameterizedType) {
                out.put(f.getName(), resolve(f.getGenericType()));
            }
        }
        return out;
    }

    private static TypeDescriptor describeClass(Class<?> c) {
        if (c.isAnonymousClass() || c.isHidden()) {
            throw new IllegalArgumentException("Anonymous and hidden classes have no record name: " + c.getName());
        }
        for (Class<?> e = c.getEnclosingClass(); e != null; e = e.getEnclosingClass()) {
            if (e.isAnonymousClass() || e.isHidden()) {
                throw new IllegalArgumentException(c.getName() + " is declared inside anonymous or hidden class " + e.getName());
            }
        }
        if (c.isPrimitive()) {
            return TypeDescriptor.unscoped(c.getName());
        }
        List<TypeDescriptor> args = new ArrayList<>();
        for (TypeVariable<?> tv : c.getTypeParameters()) args.add(TypeDescriptor.unscoped(tv.getName()));
        return new TypeDescriptor(c.getSimpleName(), ownerPath(c), args);
    }

    private static String ownerPath(Class<?> c) {
        if (c.isLocalClass()) {
            return qualifiedName(c.getEnclosingClass()) + "." + OwnerPathNormalizer.localScopeMarker(enclosingMember(c));
        }
        Class<?> enclosing = c.getEnclosingClass();
        if (enclosing != null) return qualifiedName(enclosing);
        return c.getPackageName();
    }

    private static String qualifiedName(Class<?> c) {
        String owner = ownerPath(c);
        return owner.isEmpty() ? c.getSimpleName() : owner + "." + c.getSimpleName();
    }

    private static String enclosingMember(Class<?> local) {
        if (local.getEnclosingConstructor() != null) return CONSTRUCTOR_SCOPE;
        Method m = local.getEnclosingMethod();
        if (m == null) return INITIALIZER_SCOPE;
        return memberOfLambda(m.getName());
    }

    /**
     * Maps a lambda body back to the member holding the lambda: {@code lambda$run$0} gives {@code run}.
     *
     * <p>The compiler names lambdas in constructors, instance initializer blocks and instance field
     * initializers {@code lambda$new$n}; these all give {@code new}. Lambdas in static initializers and
     * static field initializers are {@code lambda$static$n} and give {@code init}. The source front end
     * uses the same scopes for local classes inside lambdas, so only a local class declared directly
     * in an instance initializer block is {@code init} rather than {@code new}.</p>
     */
    static String memberOfLambda(String methodName) {
        if (!methodName.startsWith(LAMBDA_PREFIX)) return methodName;
        int end = methodName.indexOf('$', LAMBDA_PREFIX.length());
        if (end < 0) return methodName;
        String member = methodName.substring(LAMBDA_PREFIX.length(), end);
        log.debug("Attributing lambda body {} to {}", methodName, member);
        if (member.equals("static")) return INITIALIZER_SCOPE;
        return member;
    }

    private static TypeDescriptor arrayOf(TypeDescriptor component) {
        return new TypeDescriptor(ARRAY_NAME, "", List.of(component));
    }

    private static Class<?> rawClass(Type type) {
        if (type instanceof Class) return (Class<?>) type;
        if (type instanceof ParameterizedType) return rawClass(((ParameterizedType) type).getRawType());
        return null;
    }
}
