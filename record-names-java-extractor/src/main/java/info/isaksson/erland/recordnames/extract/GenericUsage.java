package info.isaksson.erland.recordnames.extract;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import info.isaksson.erland.recordnames.model.OverrideSet;
import info.isaksson.erland.recordnames.model.ResolvedName;
import info.isaksson.erland.recordnames.model.TypeDescriptor;

/**
 * A parameterized type used by a field or record component, e.g. {@code Pair<Integer, String> pair}.
 *
 * <p>Overrides come from the used type's declaration when it is part of the scanned sources.</p>
 */
@JsonPropertyOrder({"declaringType","member","descriptor","overrides","resolved"})
public final class GenericUsage {
    public final String declaringType;
    public final String member;
    public final TypeDescriptor descriptor;
    public final OverrideSet overrides;
    public final ResolvedName resolved;

    public GenericUsage(String declaringType,
                        String member,
                        TypeDescriptor descriptor,
                        OverrideSet overrides,
                        ResolvedName resolved) {
        this.declaringType = declaringType;
        this.member = member;
        this.descriptor = descriptor;
        this.overrides = overrides;
        this.resolved = resolved;
    }
}
