package org.javalua.symbol;

import java.util.Optional;
import java.util.function.Supplier;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.ConstructorDeclaration;
import com.github.javaparser.ast.body.FieldDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.expr.AnnotationExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.FieldAccessExpr;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.expr.ObjectCreationExpr;
import com.github.javaparser.ast.expr.TypePatternExpr;
import com.github.javaparser.ast.type.Type;
import com.github.javaparser.resolution.TypeSolver;
import com.github.javaparser.resolution.UnsolvedSymbolException;
import com.github.javaparser.resolution.declarations.ResolvedConstructorDeclaration;
import com.github.javaparser.resolution.declarations.ResolvedDeclaration;
import com.github.javaparser.resolution.declarations.ResolvedFieldDeclaration;
import com.github.javaparser.resolution.declarations.ResolvedMethodDeclaration;
import com.github.javaparser.resolution.declarations.ResolvedValueDeclaration;
import com.github.javaparser.resolution.types.ResolvedPrimitiveType;
import com.github.javaparser.resolution.types.ResolvedType;
import com.github.javaparser.symbolsolver.JavaSymbolSolver;
import com.github.javaparser.symbolsolver.javaparsermodel.declarations.JavaParserFieldDeclaration;
import com.github.javaparser.symbolsolver.resolution.typesolvers.CombinedTypeSolver;
import com.github.javaparser.symbolsolver.resolution.typesolvers.ReflectionTypeSolver;
import org.javalua.SymbolResolutionException;
import org.javalua.lowering.literal.ConstantValue;
import org.javalua.lowering.literal.JavaLiterals;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link SymbolOracle} backed by the JavaParser symbol solver.
 * <p>
 * Nodes handed to this oracle must belong to a compilation unit parsed with a symbol resolver, for
 * example by {@link #newParser()}.
 */
public class JavaParserSymbolOracle implements SymbolOracle {

    private static final Logger logger = LoggerFactory.getLogger(JavaParserSymbolOracle.class);

    private final TypeSolver typeSolver;

    public JavaParserSymbolOracle(TypeSolver typeSolver) {
        this.typeSolver = typeSolver;
    }

    /**
     * Oracle resolving JDK and class path types by reflection.
     */
    public static JavaParserSymbolOracle reflective() {
        CombinedTypeSolver typeSolver = new CombinedTypeSolver();
        typeSolver.add(new ReflectionTypeSolver(false));
        return new JavaParserSymbolOracle(typeSolver);
    }

    public TypeSolver getTypeSolver() {
        return typeSolver;
    }

    public ParserConfiguration parserConfiguration() {
        return new ParserConfiguration()
                .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17)
                .setSymbolResolver(new JavaSymbolSolver(typeSolver));
    }

    public JavaParser newParser() {
        return new JavaParser(parserConfiguration());
    }

    @Override
    public DeclarationSymbol declaredSymbol(Node declarationSite) {
        if (declarationSite instanceof Parameter
            || declarationSite instanceof VariableDeclarator
            || declarationSite instanceof TypePatternExpr) {
            return DeclarationSymbol.of(declarationSite);
        }
        throw new IllegalArgumentException("Not a declaration site: " + declarationSite.getClass().getSimpleName());
    }

    @Override
    public DeclarationSymbol referencedSymbol(NameExpr name) {
        ResolvedValueDeclaration declaration = resolving(name.getNameAsString(), name::resolve);
        Node node = astOf(declaration, Node.class)
                .orElseThrow(() -> new SymbolResolutionException(name.getNameAsString(),
                        new IllegalStateException("'" + name + "' is not declared in source")));
        if (node instanceof FieldDeclaration) {
            node = ((FieldDeclaration) node).getVariables().stream()
                    .filter(variable -> variable.getNameAsString().equals(name.getNameAsString()))
                    .findFirst()
                    .orElseThrow(() -> new SymbolResolutionException(name.getNameAsString(),
                            new IllegalStateException("No declarator named '" + name + "'")));
        }
        return DeclarationSymbol.of(node);
    }

    @Override
    public ResolvedType typeOf(Expression expression) {
        return resolving(expression.toString(), expression::calculateResolvedType);
    }

    @Override
    public ResolvedType resolve(Type type) {
        return resolving(type.asString(), type::resolve);
    }

    @Override
    public String displayName(ResolvedType type) {
        if (type.isReferenceType()) {
            return type.asReferenceType().getQualifiedName();
        }
        if (type.isArray()) {
            return displayName(type.asArrayType().getComponentType()) + "[]";
        }
        if (type.isTypeVariable()) {
            return type.asTypeParameter().getName();
        }
        return type.describe();
    }

    @Override
    public String typeDisplayName(Expression expression) {
        try {
            return displayName(typeOf(expression));
        } catch (SymbolResolutionException e) {
            // a receiver such as Math in Math.abs(x) names a type rather than a value
            if (expression instanceof NameExpr || expression instanceof FieldAccessExpr) {
                logger.debug("Using written name for type receiver '{}': {}", expression, e.getCause().getMessage());
                return expression.toString();
            }
            throw e;
        }
    }

    @Override
    public Optional<ConstructorDeclaration> constructorOf(Expression creation) {
        if (!(creation instanceof ObjectCreationExpr)) {
            throw new IllegalArgumentException("Not an object creation: " + creation);
        }
        ObjectCreationExpr objectCreation = (ObjectCreationExpr) creation;
        ResolvedConstructorDeclaration constructor = resolving(objectCreation.getTypeAsString(), objectCreation::resolve);
        return astOf(constructor, ConstructorDeclaration.class);
    }

    @Override
    public Optional<MethodDeclaration> methodOf(MethodCallExpr call) {
        ResolvedMethodDeclaration method = resolving(call.getNameAsString(), call::resolve);
        return astOf(method, MethodDeclaration.class);
    }

    @Override
    public String annotationTypeName(AnnotationExpr annotation) {
        try {
            return annotation.resolve().getQualifiedName();
        } catch (UnsolvedSymbolException e) {
            logger.debug("Annotation '{}' is not resolvable, using its written name", annotation.getNameAsString());
            return annotation.getNameAsString();
        } catch (UnsupportedOperationException | IllegalStateException e) {
            throw new SymbolResolutionException(annotation.getNameAsString(), e);
        }
    }

    @Override
    public Optional<ConstantField> constantFieldOf(Expression expression) {
        if (!(expression instanceof NameExpr) && !(expression instanceof FieldAccessExpr)) {
            return Optional.empty();
        }
        ResolvedValueDeclaration value = resolving(expression.toString(), () -> expression.isNameExpr()
                ? expression.asNameExpr().resolve()
                : expression.asFieldAccessExpr().resolve());
        if (!value.isField()) {
            return Optional.empty();
        }
        ResolvedFieldDeclaration field = value.asField();
        if (!(field instanceof JavaParserFieldDeclaration)) {
            return Optional.empty();
        }
        JavaParserFieldDeclaration sourceField = (JavaParserFieldDeclaration) field;
        FieldDeclaration declaration = sourceField.getWrappedNode();
        if (!isConstantDeclaration(declaration)) {
            return Optional.empty();
        }
        ResolvedType type = field.getType();
        boolean characterTyped = type.isPrimitive() && type.asPrimitive() == ResolvedPrimitiveType.CHAR;
        return sourceField.getVariableDeclarator().getInitializer()
                .flatMap(JavaLiterals::constantOf)
                .map(constant -> new ConstantField(field.declaringType().getName(), field.getName(),
                        type.isPrimitive() ? coerce(constant, type.asPrimitive()) : constant, characterTyped));
    }

    private static boolean isConstantDeclaration(FieldDeclaration declaration) {
        if (declaration.isStatic() && declaration.isFinal()) {
            return true;
        }
        return declaration.findAncestor(TypeDeclaration.class)
                .map(type -> type.isClassOrInterfaceDeclaration()
                             && type.asClassOrInterfaceDeclaration().isInterface())
                .orElse(false);
    }

    // the initializer may be narrower than the field, e.g. static final double SCALE = 2 or char BELL = 7
    private static ConstantValue coerce(ConstantValue constant, ResolvedPrimitiveType type) {
        if (!(constant instanceof ConstantValue.PrimitiveConstant)
            || !(((ConstantValue.PrimitiveConstant) constant).value() instanceof Number)) {
            return constant;
        }
        Number number = (Number) ((ConstantValue.PrimitiveConstant) constant).value();
        switch (type) {
            case CHAR:
                return ConstantValue.of((char) number.intValue());
            case DOUBLE:
                return ConstantValue.of(number.doubleValue());
            case FLOAT:
                return ConstantValue.of(number.floatValue());
            case LONG:
                return ConstantValue.of(number.longValue());
            default:
                return constant;
        }
    }

    // declarations loaded by reflection have no syntax tree
    private static <N extends Node> Optional<N> astOf(ResolvedDeclaration declaration, Class<N> nodeType) {
        try {
            return declaration.toAst(nodeType);
        } catch (UnsupportedOperationException e) {
            return Optional.empty();
        }
    }

    private static <T> T resolving(String description, Supplier<T> resolution) {
        try {
            return resolution.get();
        } catch (UnsolvedSymbolException | UnsupportedOperationException | IllegalStateException e) {
            throw new SymbolResolutionException(description, e);
        }
    }
}
