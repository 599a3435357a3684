package info.isaksson.erland.recordnames.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/** One resolution input in a JSON batch: a descriptor plus its (optional) overrides. */
@JsonPropertyOrder({"descriptor","overrides"})
public final class NameRequest {
    public final TypeDescriptor descriptor;
    public final OverrideSet overrides;

    @JsonCreator
    public NameRequest(
            @JsonProperty("descriptor") TypeDescriptor descriptor,
            @JsonProperty("overrides") OverrideSet overrides
    ) {
        if (descriptor == null) throw new IllegalArgumentException("descriptor is required");
        this.descriptor = descriptor;
        this.overrides = overrides == null ? OverrideSet.none() : overrides;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NameRequest)) return false;
        NameRequest that = (NameRequest) o;
        return descriptor.equals(that.descriptor) && overrides.equals(that.overrides);
    }

    @Override public int hashCode() {
        return Objects.hash(descriptor, overrides);
    }
}
