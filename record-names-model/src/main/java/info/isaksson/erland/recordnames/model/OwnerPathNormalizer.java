package info.isaksson.erland.recordnames.model;

import java.util.regex.Pattern;

/**
 * Cleans up a front end's owner path before it becomes a default namespace.
 *
 * <p>Only a front end knows how its type system renders block-local scopes, so the marker
 * syntax lives here rather than in {@link NameResolver}. Never applied to namespace overrides.</p>
 */
@FunctionalInterface
public interface OwnerPathNormalizer {

    String normalize(String ownerPath);

    /** Returns the owner path unchanged. */
    static OwnerPathNormalizer identity() {
        return ownerPath -> ownerPath == null ? "" : ownerPath;
    }

    /**
     * Removes every {@code .<local name>} scope segment, then a trailing {@code .package} segment.
     *
     * <p>Example: {@code com.example.<local run>.inner.package} becomes {@code com.example.inner}.</p>
     */
    static OwnerPathNormalizer standard() {
        return LocalScopes.INSTANCE;
    }

    /** Marker used by both Java front ends for a type declared inside a method body. */
    static String localScopeMarker(String enclosingMember) {
        return "<local " + enclosingMember + ">";
    }

    final class LocalScopes implements OwnerPathNormalizer {
        static final LocalScopes INSTANCE = new LocalScopes();

        private static final Pattern LOCAL_SCOPE = Pattern.compile("\\.<local .*?>");
        private static final String PACKAGE_SUFFIX = ".package";

        private LocalScopes() {}

        @Override
        public String normalize(String ownerPath) {
            if (ownerPath == null || ownerPath.isEmpty()) return "";
            String s = LOCAL_SCOPE.matcher(ownerPath).replaceAll("");
            if (s.endsWith(PACKAGE_SUFFIX)) s = s.substring(0, s.length() - PACKAGE_SUFFIX.length());
            return s;
        }

        @Override
        public String toString() {
            return "OwnerPathNormalizer.standard()";
        }
    }
}
