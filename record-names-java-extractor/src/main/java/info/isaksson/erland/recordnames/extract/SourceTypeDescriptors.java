package info.isaksson.erland.recordnames.extract;

import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.nodeTypes.NodeWithTypeParameters;
import com.github.javaparser.ast.type.ArrayType;
import com.github.javaparser.ast.type.ClassOrInterfaceType;
import com.github.javaparser.ast.type.PrimitiveType;
import com.github.javaparser.ast.type.Type;
import com.github.javaparser.ast.type.TypeParameter;
import com.github.javaparser.ast.type.WildcardType;
import info.isaksson.erland.recordnames.model.TypeDescriptor;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Builds {@link TypeDescriptor}s from JavaParser AST nodes.
 *
 * <p>Shapes match the reflection front end: arrays become {@code Array} with the component
 * as the single argument, wildcards become their upper bound ({@code java.lang.Object}
 * when unbounded or super-bounded), type variables and primitives have no scope.</p>
 */
public final class SourceTypeDescriptors {

    public static final String ARRAY_NAME = "Array";

    private static final TypeDescriptor OBJECT = TypeDescriptor.of("java.lang", "Object");

    private SourceTypeDescriptors() {}

    /**
     * Descriptor of a declaration; its type arguments are the declared type parameters.
     *
     * @param ownerPath raw owner path (package, enclosing types, {@code <local m>} markers)
     */
    public static TypeDescriptor fromDeclaration(String ownerPath, TypeDeclaration<?> declaration) {
        Objects.requireNonNull(declaration, "declaration");
        List<TypeDescriptor> args = new ArrayList<>();
        if (declaration instanceof NodeWithTypeParameters) {
            for (TypeParameter tp : ((NodeWithTypeParameters<?>) declaration).getTypeParameters()) {
                args.add(TypeDescriptor.unscoped(tp.getNameAsString()));
            }
        }
        return new TypeDescriptor(declaration.getNameAsString(), ownerPath, args);
    }

    /** Descriptor of a type usage with names taken as written. */
    public static TypeDescriptor fromUsage(Type type) {
        return fromUsage(type, TypeNameQualifier.literal());
    }

    /** Descriptor of a type usage such as {@code Pair<Integer, String>}, arguments included. */
    public static TypeDescriptor fromUsage(Type type, TypeNameQualifier qualifier) {
        Objects.requireNonNull(type, "type");
        if (type instanceof PrimitiveType) {
            return TypeDescriptor.unscoped(type.asString());
        }
        if (type instanceof ArrayType) {
            return new TypeDescriptor(ARRAY_NAME, "", List.of(fromUsage(((ArrayType) type).getComponentType(), qualifier)));
        }
        if (type instanceof WildcardType) {
            WildcardType wt = (WildcardType) type;
            return wt.getExtendedType().map(t -> fromUsage(t, qualifier)).orElse(OBJECT);
        }
        if (type instanceof ClassOrInterfaceType) {
            return fromClassType((ClassOrInterfaceType) type, qualifier);
        }
        return TypeDescriptor.unscoped(type.asString());
    }

    private static TypeDescriptor fromClassType(ClassOrInterfaceType type, TypeNameQualifier qualifier) {
        String written = type.getNameWithScope();
        String qualified = qualifier.qualify(written);
        if (qualified == null) {
            return TypeDescriptor.unscoped(type.getNameAsString());
        }

        List<TypeDescriptor> args = new ArrayList<>();
        NodeList<Type> typeArgs = type.getTypeArguments().orElse(null);
        if (typeArgs != null) {
            for (Type arg : typeArgs) args.add(fromUsage(arg, qualifier));
        }

        int dot = qualified.lastIndexOf('.');
        String owner = dot < 0 ? "" : qualified.substring(0, dot);
        String shortName = dot < 0 ? qualified : qualified.substring(dot + 1);
        return new TypeDescriptor(shortName, owner, args);
    }

    /** Dotted qualified name of a descriptor (owner path + short name), without type arguments. */
    public static String qualifiedName(TypeDescriptor descriptor) {
        return descriptor.ownerPath.isEmpty() ? descriptor.shortName : descriptor.ownerPath + "." + descriptor.shortName;
    }
}
