package info.isaksson.erland.recordnames.extract;

/**
 * Maps a type name as written in source ({@code Foo}, {@code Outer.Inner}, {@code java.util.List})
 * to its dotted qualified name.
 */
@FunctionalInterface
public interface TypeNameQualifier {

    /**
     * @return the qualified name, or {@code null} if {@code typeName} is a type variable in scope
     */
    String qualify(String typeName);

    /** Takes names as written: dotted names are already qualified, simple names have no scope. */
    static TypeNameQualifier literal() {
        return typeName -> typeName;
    }
}
