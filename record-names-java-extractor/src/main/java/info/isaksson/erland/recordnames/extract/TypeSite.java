package info.isaksson.erland.recordnames.extract;

import com.github.javaparser.ast.body.TypeDeclaration;

import java.util.List;
import java.util.Set;

/**
 * Package-private carrier for a discovered type declaration.
 *
 * @param ownerPath     raw owner path, including {@code <local m>} markers
 * @param scopeChain    qualified names searched (innermost last) when resolving simple type names in the body
 * @param typeVariables type variable names visible in the body
 */
record TypeSite(
        ParsedUnit unit,
        TypeDeclaration<?> declaration,
        String ownerPath,
        boolean local,
        List<String> scopeChain,
        Set<String> typeVariables
) {
    String qualifiedName() {
        String name = declaration.getNameAsString();
        return ownerPath.isEmpty() ? name : ownerPath + "." + name;
    }
}
