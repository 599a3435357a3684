package info.isaksson.erland.recordnames.extract;

import com.github.javaparser.ast.body.AnnotationDeclaration;
import com.github.javaparser.ast.body.ClassOrInterfaceDeclaration;
import com.github.javaparser.ast.body.FieldDeclaration;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.expr.BinaryExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.FieldAccessExpr;
import com.github.javaparser.ast.type.Type;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Evaluates constant expressions used as annotation values, the subset that can be computed without
 * symbol solving: string, text block, char, integer and boolean literals, string concatenation, and
 * references to {@code static final} fields declared in the scanned sources (by simple name from an
 * enclosing type, as {@code Type.FIELD}, or through a static import).
 *
 * <p>Inherited constants, local variables and constants of types outside the scanned sources are
 * not evaluated.</p>
 */
final class StringConstants {

    private static final Logger log = LoggerFactory.getLogger(StringConstants.class);

    private static final Set<String> CONSTANT_TYPES = Set.of(
            "String", "java.lang.String", "char", "byte", "short", "int", "long", "boolean");

    private final Map<String, Declared> declared = new HashMap<>();
    private final Map<String, Optional<Constant>> evaluated = new HashMap<>();
    private final Set<String> evaluating = new HashSet<>();
    private final Function<ParsedUnit, ImportContext> contexts;

    /** A constant field initializer and the declaration it is written in. */
    private record Declared(TypeSite site, Expression initializer) {}

    /** {@code string} tells concatenation from arithmetic. */
    private record Constant(String text, boolean string) {}

    StringConstants(List<TypeSite> sites, Function<ParsedUnit, ImportContext> contexts) {
        this.contexts = contexts;
        for (TypeSite site : sites) {
            for (FieldDeclaration fd : site.declaration().getFields()) {
                if (!isConstantField(site.declaration(), fd)) continue;
                for (VariableDeclarator v : fd.getVariables()) {
                    if (!isConstantType(v.getType())) continue;
                    v.getInitializer().ifPresent(init ->
                            declared.put(site.qualifiedName() + "." + v.getNameAsString(), new Declared(site, init)));
                }
            }
        }
    }

    /**
     * Value of an annotation argument written on the declaration of {@code site}.
     * Names resolve from the scope enclosing the declaration, not from its own body.
     */
    Optional<String> annotationValue(Expression expr, TypeSite site) {
        List<String> chain = site.scopeChain().subList(0, site.scopeChain().size() - 1);
        return evaluate(expr, site.unit(), chain)
                .filter(Constant::string)
                .map(Constant::text);
    }

    private Optional<Constant> evaluate(Expression e, ParsedUnit unit, List<String> chain) {
        if (e.isStringLiteralExpr()) return Optional.of(new Constant(e.asStringLiteralExpr().asString(), true));
        if (e.isTextBlockLiteralExpr()) return Optional.of(new Constant(e.asTextBlockLiteralExpr().asString(), true));
        if (e.isCharLiteralExpr()) return Optional.of(new Constant(String.valueOf(e.asCharLiteralExpr().asChar()), false));
        if (e.isIntegerLiteralExpr()) return Optional.of(new Constant(e.asIntegerLiteralExpr().asNumber().toString(), false));
        if (e.isLongLiteralExpr()) return Optional.of(new Constant(e.asLongLiteralExpr().asNumber().toString(), false));
        if (e.isBooleanLiteralExpr()) return Optional.of(new Constant(String.valueOf(e.asBooleanLiteralExpr().getValue()), false));
        if (e.isEnclosedExpr()) return evaluate(e.asEnclosedExpr().getInner(), unit, chain);

        if (e.isBinaryExpr() && e.asBinaryExpr().getOperator() == BinaryExpr.Operator.PLUS) {
            Optional<Constant> left = evaluate(e.asBinaryExpr().getLeft(), unit, chain);
            Optional<Constant> right = evaluate(e.asBinaryExpr().getRight(), unit, chain);
            if (left.isEmpty() || right.isEmpty()) return Optional.empty();
            if (!left.get().string() && !right.get().string()) return Optional.empty();
            return Optional.of(new Constant(left.get().text() + right.get().text(), true));
        }

        if (e.isNameExpr()) {
            String name = e.asNameExpr().getNameAsString();
            for (int i = chain.size() - 1; i >= 0; i--) {
                String key = chain.get(i) + "." + name;
                if (declared.containsKey(key)) return constant(key);
            }
            for (String key : contexts.apply(unit).staticMemberCandidates(name)) {
                if (declared.containsKey(key)) return constant(key);
            }
            return Optional.empty();
        }

        if (e.isFieldAccessExpr()) {
            FieldAccessExpr fa = e.asFieldAccessExpr();
            String type = contexts.apply(unit).qualify(fa.getScope().toString(), chain);
            String key = type + "." + fa.getNameAsString();
            if (declared.containsKey(key)) return constant(key);
        }
        return Optional.empty();
    }

    private Optional<Constant> constant(String key) {
        Optional<Constant> known = evaluated.get(key);
        if (known != null) return known;
        if (!evaluating.add(key)) {
            log.debug("Circular constant reference through {}", key);
            return Optional.empty();
        }
        Declared d = declared.get(key);
        Optional<Constant> value = evaluate(d.initializer(), d.site().unit(), d.site().scopeChain());
        evaluating.remove(key);
        evaluated.put(key, value);
        return value;
    }

    private static boolean isConstantField(TypeDeclaration<?> owner, FieldDeclaration fd) {
        if (owner instanceof AnnotationDeclaration) return true;
        if (owner instanceof ClassOrInterfaceDeclaration && ((ClassOrInterfaceDeclaration) owner).isInterface()) return true;
        return fd.isStatic() && fd.isFinal();
    }

    private static boolean isConstantType(Type type) {
        return CONSTANT_TYPES.contains(type.asString());
    }
}
