package info.isaksson.erland.recordnames.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Language-agnostic description of a type, as seen by the name resolver.
 *
 * <p>Front ends (Java source, runtime reflection, or hand-written JSON) produce this shape.
 * Only {@link #shortName} of each type argument is used for the generic name encoding;
 * arguments of arguments are carried but never expanded.</p>
 */
@JsonPropertyOrder({"shortName","ownerPath","typeArguments"})
public final class TypeDescriptor {

    /** Bare name with no qualifiers and no type arguments, e.g. {@code List} for {@code List<Integer>}. */
    public final String shortName;

    /** Dotted path of the enclosing scope (package and/or outer types). May be empty. */
    public final String ownerPath;

    /** Type arguments in declaration order. */
    public final List<TypeDescriptor> typeArguments;

    @JsonCreator
    public TypeDescriptor(
            @JsonProperty("shortName") String shortName,
            @JsonProperty("ownerPath") String ownerPath,
            @JsonProperty("typeArguments") List<TypeDescriptor> typeArguments
    ) {
        if (shortName == null || shortName.isEmpty()) {
            throw new IllegalArgumentException("shortName must not be empty (ownerPath=" + ownerPath + ")");
        }
        this.shortName = shortName;
        this.ownerPath = ownerPath == null ? "" : ownerPath;
        this.typeArguments = typeArguments == null ? List.of() : List.copyOf(typeArguments);
    }

    public static TypeDescriptor of(String ownerPath, String shortName) {
        return new TypeDescriptor(shortName, ownerPath, null);
    }

    public static TypeDescriptor generic(String ownerPath, String shortName, TypeDescriptor... typeArguments) {
        return new TypeDescriptor(shortName, ownerPath, Arrays.asList(typeArguments));
    }

    /** A descriptor with no scope, e.g. a type variable {@code T} or a primitive. */
    public static TypeDescriptor unscoped(String shortName) {
        return new TypeDescriptor(shortName, "", null);
    }

    @JsonIgnore
    public boolean isGeneric() {
        return !typeArguments.isEmpty();
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TypeDescriptor)) return false;
        TypeDescriptor that = (TypeDescriptor) o;
        return shortName.equals(that.shortName) &&
                ownerPath.equals(that.ownerPath) &&
                typeArguments.equals(that.typeArguments);
    }

    @Override public int hashCode() {
        return Objects.hash(shortName, ownerPath, typeArguments);
    }

    @Override public String toString() {
        String base = ownerPath.isEmpty() ? shortName : ownerPath + "." + shortName;
        return typeArguments.isEmpty() ? base : base + "<" + typeArguments + ">";
    }
}
