package info.isaksson.erland.recordnames.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;
import java.util.Optional;

/**
 * User-supplied overrides for a single type, already extracted from whatever annotation
 * mechanism the front end has access to.
 *
 * <p>All fields are independent; any combination is legal.</p>
 */
@JsonPropertyOrder({"name","namespace","erased"})
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class OverrideSet {

    private static final OverrideSet NONE = new OverrideSet(null, null, false);

    /** Replaces the derived name outright. {@code null} when absent. */
    public final String name;

    /** Replaces the derived namespace outright, verbatim. {@code null} when absent. */
    public final String namespace;

    /** When true the default name ignores type arguments. */
    public final boolean erased;

    @JsonCreator
    public OverrideSet(
            @JsonProperty("name") String name,
            @JsonProperty("namespace") String namespace,
            @JsonProperty("erased") boolean erased
    ) {
        this.name = name;
        this.namespace = namespace;
        this.erased = erased;
    }

    public static OverrideSet none() {
        return NONE;
    }

    public static OverrideSet named(String name) {
        return new OverrideSet(name, null, false);
    }

    public static OverrideSet inNamespace(String namespace) {
        return new OverrideSet(null, namespace, false);
    }

    public static OverrideSet erasedName() {
        return new OverrideSet(null, null, true);
    }

    public Optional<String> nameOverride() {
        return Optional.ofNullable(name);
    }

    public Optional<String> namespaceOverride() {
        return Optional.ofNullable(namespace);
    }

    public OverrideSet withName(String newName) {
        return new OverrideSet(newName, namespace, erased);
    }

    public OverrideSet withNamespace(String newNamespace) {
        return new OverrideSet(name, newNamespace, erased);
    }

    public OverrideSet withErased(boolean newErased) {
        return new OverrideSet(name, namespace, newErased);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof OverrideSet)) return false;
        OverrideSet that = (OverrideSet) o;
        return erased == that.erased &&
                Objects.equals(name, that.name) &&
                Objects.equals(namespace, that.namespace);
    }

    @Override public int hashCode() {
        return Objects.hash(name, namespace, erased);
    }

    @Override public String toString() {
        return "OverrideSet{name=" + name + ", namespace=" + namespace + ", erased=" + erased + "}";
    }
}
