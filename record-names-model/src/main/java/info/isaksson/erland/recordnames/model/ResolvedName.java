package info.isaksson.erland.recordnames.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * Record identifier as embedded in a generated schema.
 *
 * <p>{@link #fullName} is derived from the other two fields and never stored independently.</p>
 */
@JsonPropertyOrder({"namespace","name","fullName"})
@JsonIgnoreProperties(value = {"fullName"}, allowGetters = true)
public final class ResolvedName {
    public final String namespace;
    public final String name;
    public final String fullName;

    @JsonCreator
    public ResolvedName(
            @JsonProperty("namespace") String namespace,
            @JsonProperty("name") String name
    ) {
        this.namespace = namespace == null ? "" : namespace;
        this.name = Objects.requireNonNull(name, "name");
        this.fullName = this.namespace.trim().isEmpty() ? name : this.namespace + "." + name;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ResolvedName)) return false;
        ResolvedName that = (ResolvedName) o;
        return namespace.equals(that.namespace) && name.equals(that.name);
    }

    @Override public int hashCode() {
        return Objects.hash(namespace, name);
    }

    @Override public String toString() {
        return fullName;
    }
}
