package info.isaksson.erland.recordnames.extract;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.ImportDeclaration;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Import context and best-effort qualification of type names without symbol solving.
 *
 * <p>Project types are known by their raw qualified names (local types include their
 * {@code <local m>} segment).</p>
 */
final class ImportContext {

    // Common java.lang types; other unqualified, unimported names fall back to wildcard imports
    // and then to the current package.
    private static final Set<String> JAVA_LANG_TYPES = Set.of(
            "Object", "String", "CharSequence", "Number", "Boolean", "Byte", "Short", "Integer",
            "Long", "Float", "Double", "Character", "Void", "Enum", "Record", "Class", "Iterable",
            "Comparable", "Runnable", "Thread", "Throwable", "Exception", "RuntimeException", "Error",
            "StringBuilder", "Math", "System"
    );

    final String currentPackage;
    final Set<String> projectTypes;
    final Map<String, String> explicitImportsBySimple = new HashMap<>();
    final List<String> wildcardImports = new ArrayList<>();
    final Map<String, String> staticImportsBySimple = new HashMap<>();
    final List<String> staticWildcardTypes = new ArrayList<>();

    private ImportContext(String currentPackage, Set<String> projectTypes) {
        this.currentPackage = currentPackage == null ? "" : currentPackage;
        this.projectTypes = projectTypes;
    }

    static ImportContext from(CompilationUnit cu, Set<String> projectTypes) {
        String pkg = cu.getPackageDeclaration().map(p -> p.getNameAsString()).orElse("");
        ImportContext ctx = new ImportContext(pkg, projectTypes);
        for (ImportDeclaration id : cu.getImports()) {
            String qn = id.getNameAsString();
            if (id.isStatic()) {
                if (id.isAsterisk()) {
                    ctx.staticWildcardTypes.add(qn);
                } else {
                    ctx.staticImportsBySimple.put(qn.substring(qn.lastIndexOf('.') + 1), qn);
                }
            } else if (id.isAsterisk()) {
                ctx.wildcardImports.add(qn);
            } else {
                ctx.explicitImportsBySimple.put(qn.substring(qn.lastIndexOf('.') + 1), qn);
            }
        }
        return ctx;
    }

    /** A qualifier for names written inside a declaration with the given scopes and type variables. */
    TypeNameQualifier qualifierFor(List<String> scopeChain, Set<String> typeVariables) {
        return typeName -> {
            if (typeVariables.contains(typeName)) return null;
            return qualify(typeName, scopeChain);
        };
    }

    /** Qualified member names a simple name may refer to through static imports, explicit import first. */
    List<String> staticMemberCandidates(String name) {
        List<String> out = new ArrayList<>();
        String exp = staticImportsBySimple.get(name);
        if (exp != null) out.add(exp);
        for (String type : staticWildcardTypes) out.add(type + "." + name);
        return out;
    }

    String qualify(String typeName, List<String> scopeChain) {
        String tn = typeName.indexOf('$') >= 0 ? typeName.replace('$', '.') : typeName;

        // Member and local types visible from enclosing scopes, innermost first.
        for (int i = scopeChain.size() - 1; i >= 0; i--) {
            String cand = scopeChain.get(i) + "." + tn;
            if (projectTypes.contains(cand)) return cand;
        }

        String project = resolveProject(tn);
        if (project != null) return project;

        int dot = tn.indexOf('.');
        if (dot > 0) {
            // Outer.Inner with Outer imported, otherwise take the dotted name as fully qualified.
            String head = tn.substring(0, dot);
            String exp = explicitImportsBySimple.get(head);
            if (exp != null) return exp + "." + tn.substring(dot + 1);
            if (JAVA_LANG_TYPES.contains(head)) return "java.lang." + tn;
            return tn;
        }
        return qualifyExternal(tn);
    }

    private String resolveProject(String tn) {
        if (tn.contains(".") && projectTypes.contains(tn)) return tn;

        String samePackage = currentPackage.isEmpty() ? tn : currentPackage + "." + tn;
        if (projectTypes.contains(samePackage)) return samePackage;

        String exp = explicitImportsBySimple.get(tn);
        if (exp != null && projectTypes.contains(exp)) return exp;

        for (String wi : wildcardImports) {
            String w = wi + "." + tn;
            if (projectTypes.contains(w)) return w;
        }
        return null;
    }

    private String qualifyExternal(String simpleName) {
        String exp = explicitImportsBySimple.get(simpleName);
        if (exp != null) return exp;
        if (JAVA_LANG_TYPES.contains(simpleName)) return "java.lang." + simpleName;
        if (!wildcardImports.isEmpty()) return wildcardImports.get(0) + "." + simpleName;
        return currentPackage.isEmpty() ? simpleName : currentPackage + "." + simpleName;
    }
}
