package info.isaksson.erland.recordnames.extract;

import com.github.javaparser.ast.expr.AnnotationExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.MemberValuePair;
import com.github.javaparser.ast.expr.NormalAnnotationExpr;
import com.github.javaparser.ast.expr.SingleMemberAnnotationExpr;
import info.isaksson.erland.recordnames.model.OverrideSet;
import info.isaksson.erland.recordnames.model.annotations.ErasedName;
import info.isaksson.erland.recordnames.model.annotations.RecordName;
import info.isaksson.erland.recordnames.model.annotations.RecordNamespace;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.function.Consumer;

/**
 * Reads {@link RecordName}, {@link RecordNamespace} and {@link ErasedName} off a declaration,
 * matching by simple or qualified name.
 *
 * <p>A value that cannot be evaluated is reported and the override is treated as absent.</p>
 */
final class AnnotationOverrides {

    private static final Logger log = LoggerFactory.getLogger(AnnotationOverrides.class);

    private AnnotationOverrides() {}

    /**
     * @param problems receives one message per override value that could not be evaluated
     */
    static OverrideSet from(TypeSite site, StringConstants constants, Consumer<String> problems) {
        String name = null;
        String namespace = null;
        boolean erased = false;
        for (AnnotationExpr ae : site.declaration().getAnnotations()) {
            String raw = ae.getNameAsString();
            if (is(raw, RecordName.class)) {
                name = value(ae, site, constants, problems);
            } else if (is(raw, RecordNamespace.class)) {
                namespace = value(ae, site, constants, problems);
            } else if (is(raw, ErasedName.class)) {
                erased = true;
            }
        }
        return new OverrideSet(name, namespace, erased);
    }

    private static boolean is(String rawName, Class<?> annotation) {
        return rawName.equals(annotation.getSimpleName()) || rawName.equals(annotation.getName());
    }

    private static String value(AnnotationExpr ae, TypeSite site, StringConstants constants, Consumer<String> problems) {
        Expression expr = null;
        if (ae instanceof SingleMemberAnnotationExpr) {
            expr = ((SingleMemberAnnotationExpr) ae).getMemberValue();
        } else if (ae instanceof NormalAnnotationExpr) {
            for (MemberValuePair p : ((NormalAnnotationExpr) ae).getPairs()) {
                if ("value".equals(p.getNameAsString())) expr = p.getValue();
            }
        }
        if (expr == null) {
            log.warn("@{} without a value on {} is ignored", ae.getNameAsString(), site.qualifiedName());
            return null;
        }

        Optional<String> value = constants.annotationValue(expr, site);
        if (value.isEmpty()) {
            String message = site.unit().sourcePath() + ": @" + ae.getNameAsString() + " value " + expr
                    + " on " + site.qualifiedName() + " is not an evaluable constant; override ignored";
            log.warn("{}", message);
            problems.accept(message);
            return null;
        }
        return value.get();
    }
}
