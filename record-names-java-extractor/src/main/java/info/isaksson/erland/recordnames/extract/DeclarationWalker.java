package info.isaksson.erland.recordnames.extract;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.BodyDeclaration;
import com.github.javaparser.ast.body.AnnotationDeclaration;
import com.github.javaparser.ast.body.ClassOrInterfaceDeclaration;
import com.github.javaparser.ast.body.CompactConstructorDeclaration;
import com.github.javaparser.ast.body.ConstructorDeclaration;
import com.github.javaparser.ast.body.FieldDeclaration;
import com.github.javaparser.ast.body.InitializerDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.expr.LambdaExpr;
import com.github.javaparser.ast.expr.ObjectCreationExpr;
import com.github.javaparser.ast.nodeTypes.NodeWithName;
import com.github.javaparser.ast.nodeTypes.NodeWithTypeParameters;
import com.github.javaparser.ast.stmt.LocalClassDeclarationStmt;
import com.github.javaparser.ast.stmt.LocalRecordDeclarationStmt;
import com.github.javaparser.ast.type.TypeParameter;
import info.isaksson.erland.recordnames.model.OwnerPathNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Finds every named type declaration in a compilation unit: top-level, member and local types.
 *
 * <p>Owner paths follow the package, then enclosing type names; a type declared in a body gets a
 * {@code <local m>} segment after its enclosing type, where {@code m} is the method name,
 * {@code new} for constructors and {@code init} for initializer blocks. Anonymous class bodies
 * are skipped.</p>
 *
 * <p>Inside a lambda body the scope follows the compiler's lambda method names: lambdas in
 * constructors, instance initializer blocks and instance field initializers belong to {@code new},
 * lambdas in static initializers and static field initializers to {@code init}. Field initializers
 * are only reachable through lambdas, since a local class cannot be declared in an expression.</p>
 */
final class DeclarationWalker {

    static final String CONSTRUCTOR_SCOPE = "new";
    static final String INITIALIZER_SCOPE = "init";

    private static final Logger log = LoggerFactory.getLogger(DeclarationWalker.class);

    private DeclarationWalker() {}

    static List<TypeSite> walk(ParsedUnit unit) {
        String pkg = unit.cu().getPackageDeclaration().map(NodeWithName::getNameAsString).orElse("");
        List<TypeSite> out = new ArrayList<>();
        for (TypeDeclaration<?> td : unit.cu().getTypes()) {
            visitType(unit, td, pkg, false, List.of(), Set.of(), out);
        }
        return out;
    }

    private static void visitType(ParsedUnit unit,
                                  TypeDeclaration<?> td,
                                  String ownerPath,
                                  boolean local,
                                  List<String> outerScopes,
                                  Set<String> outerTypeVariables,
                                  List<TypeSite> out) {
        String self = ownerPath.isEmpty() ? td.getNameAsString() : ownerPath + "." + td.getNameAsString();
        List<String> scopes = append(outerScopes, self);
        Set<String> typeVariables = new LinkedHashSet<>(outerTypeVariables);
        typeVariables.addAll(typeParameterNames(td));

        out.add(new TypeSite(unit, td, ownerPath, local, scopes, Set.copyOf(typeVariables)));

        for (BodyDeclaration<?> member : td.getMembers()) {
            if (member instanceof TypeDeclaration) {
                visitType(unit, (TypeDeclaration<?>) member, self, local, scopes, typeVariables, out);
            } else if (member instanceof MethodDeclaration) {
                MethodDeclaration md = (MethodDeclaration) member;
                Set<String> vars = new LinkedHashSet<>(typeVariables);
                vars.addAll(typeParameterNames(md));
                String owner = localOwner(self, md.getNameAsString());
                md.getBody().ifPresent(b -> visitBody(unit, b, owner, owner, scopes, vars, out));
            } else if (member instanceof ConstructorDeclaration) {
                ConstructorDeclaration cd = (ConstructorDeclaration) member;
                Set<String> vars = new LinkedHashSet<>(typeVariables);
                vars.addAll(typeParameterNames(cd));
                String owner = localOwner(self, CONSTRUCTOR_SCOPE);
                visitBody(unit, cd.getBody(), owner, owner, scopes, vars, out);
            } else if (member instanceof CompactConstructorDeclaration) {
                CompactConstructorDeclaration cd = (CompactConstructorDeclaration) member;
                String owner = localOwner(self, CONSTRUCTOR_SCOPE);
                visitBody(unit, cd.getBody(), owner, owner, scopes, typeVariables, out);
            } else if (member instanceof InitializerDeclaration) {
                InitializerDeclaration id = (InitializerDeclaration) member;
                String lambdaOwner = localOwner(self, id.isStatic() ? INITIALIZER_SCOPE : CONSTRUCTOR_SCOPE);
                visitBody(unit, id.getBody(), localOwner(self, INITIALIZER_SCOPE), lambdaOwner, scopes, typeVariables, out);
            } else if (member instanceof FieldDeclaration) {
                FieldDeclaration fd = (FieldDeclaration) member;
                String owner = localOwner(self, isStaticField(td, fd) ? INITIALIZER_SCOPE : CONSTRUCTOR_SCOPE);
                for (VariableDeclarator v : fd.getVariables()) {
                    v.getInitializer().ifPresent(init -> visitBody(unit, init, owner, owner, scopes, typeVariables, out));
                }
            }
        }
    }

    private static void visitBody(ParsedUnit unit,
                                  Node node,
                                  String localOwner,
                                  String lambdaOwner,
                                  List<String> scopes,
                                  Set<String> typeVariables,
                                  List<TypeSite> out) {
        List<String> bodyScopes = scopes.contains(localOwner) ? scopes : append(scopes, localOwner);
        for (Node child : node.getChildNodes()) {
            if (child instanceof LocalClassDeclarationStmt) {
                TypeDeclaration<?> td = ((LocalClassDeclarationStmt) child).getClassDeclaration();
                visitType(unit, td, localOwner, true, bodyScopes, typeVariables, out);
            } else if (child instanceof LocalRecordDeclarationStmt) {
                TypeDeclaration<?> td = ((LocalRecordDeclarationStmt) child).getRecordDeclaration();
                visitType(unit, td, localOwner, true, bodyScopes, typeVariables, out);
            } else if (child instanceof LambdaExpr) {
                visitBody(unit, child, lambdaOwner, lambdaOwner, bodyScopes, typeVariables, out);
            } else if (!(child instanceof BodyDeclaration)) {
                // BodyDeclarations reached here belong to anonymous class bodies and are not descended into.
                if (child instanceof ObjectCreationExpr && ((ObjectCreationExpr) child).getAnonymousClassBody().isPresent()) {
                    log.debug("{}: not naming types inside anonymous {} in {}",
                            unit.sourcePath(), ((ObjectCreationExpr) child).getType().getNameAsString(), localOwner);
                }
                visitBody(unit, child, localOwner, lambdaOwner, bodyScopes, typeVariables, out);
            }
        }
    }

    private static boolean isStaticField(TypeDeclaration<?> owner, FieldDeclaration fd) {
        if (fd.isStatic() || owner instanceof AnnotationDeclaration) return true;
        return owner instanceof ClassOrInterfaceDeclaration && ((ClassOrInterfaceDeclaration) owner).isInterface();
    }

    private static String localOwner(String enclosingType, String member) {
        return enclosingType + "." + OwnerPathNormalizer.localScopeMarker(member);
    }

    private static Set<String> typeParameterNames(Object declaration) {
        if (!(declaration instanceof NodeWithTypeParameters)) return Set.of();
        Set<String> out = new LinkedHashSet<>();
        for (TypeParameter tp : ((NodeWithTypeParameters<?>) declaration).getTypeParameters()) {
            out.add(tp.getNameAsString());
        }
        return out;
    }

    private static List<String> append(List<String> list, String value) {
        List<String> out = new ArrayList<>(list);
        out.add(value);
        return List.copyOf(out);
    }
}
