package com.jml.weaver.analysis;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.Problem;
import com.github.javaparser.ast.body.BodyDeclaration;
import com.github.javaparser.ast.body.CallableDeclaration;
import com.github.javaparser.ast.body.FieldDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.expr.*;
import com.jml.weaver.MalformedContractException;
import com.jml.weaver.model.ContractDeclaration;
import com.jml.weaver.model.ContractExpression;
import com.jml.weaver.runtime.ExpressionKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.lang.model.SourceVersion;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Turns the contract annotations of a declaration into a {@link ContractDeclaration}.
 *
 * Recognised annotations, by simple or fully qualified name as matched by {@link AnnotationNames}:
 * {@code @Requires}, {@code @Ensures} (both repeatable, each with one or more expression
 * strings) and at most one {@code @ReturnAlias}. The annotated declaration must be a
 * method with a body. Parsing never modifies the declaration.
 */
public class ContractParser {

    private static final Logger logger = LoggerFactory.getLogger(ContractParser.class);

    static final String REQUIRES = "Requires";
    static final String ENSURES = "Ensures";
    static final String RETURN_ALIAS = "ReturnAlias";
    private static final String CONTAINER = "List";

    private final JavaParser javaParser;

    public ContractParser() {
        this(new JavaParser(new ParserConfiguration().setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17)));
    }

    public ContractParser(JavaParser javaParser) {
        this.javaParser = javaParser;
    }

    /**
     * Checks whether a declaration carries any contract annotation.
     *
     * @param declaration The declaration to inspect
     * @return true if {@code @Requires}, {@code @Ensures} or {@code @ReturnAlias} is present
     */
    public boolean hasContract(BodyDeclaration<?> declaration) {
        return declaration.getAnnotations().stream().anyMatch(this::isContractAnnotation);
    }

    /**
     * Parses the contract block of a declaration.
     *
     * @param declaration The annotated declaration; must be a method with a body
     * @return The normalized contract
     * @throws MalformedContractException If the block cannot form a contract
     */
    public ContractDeclaration parse(BodyDeclaration<?> declaration) {
        String name = describe(declaration);

        if (!(declaration instanceof MethodDeclaration)) {
            throw new MalformedContractException(name, "contract annotations must be attached to a method definition");
        }
        MethodDeclaration methodDecl = (MethodDeclaration) declaration;
        if (methodDecl.getBody().isEmpty()) {
            throw new MalformedContractException(name, "method has no body to guard");
        }

        ContractDeclaration contract = new ContractDeclaration(
                methodDecl.getNameAsString(), methodDecl.getType(), methodDecl.getBody().get());

        int aliasCount = 0;
        for (AnnotationExpr annotation : methodDecl.getAnnotations()) {
            Optional<String> repeatedName = containerOf(annotation);
            if (repeatedName.isPresent()) {
                for (AnnotationExpr repeated : containedAnnotations(name, annotation)) {
                    addExpressions(contract, name, repeatedName.get(), repeated);
                }
            } else if (AnnotationNames.refersTo(annotation, REQUIRES)) {
                addExpressions(contract, name, REQUIRES, annotation);
            } else if (AnnotationNames.refersTo(annotation, ENSURES)) {
                addExpressions(contract, name, ENSURES, annotation);
            } else if (AnnotationNames.refersTo(annotation, RETURN_ALIAS)) {
                aliasCount++;
                if (aliasCount > 1) {
                    throw new MalformedContractException(name, "@ReturnAlias may appear only once");
                }
                contract.setReturnAlias(parseAlias(name, annotation));
            }
        }

        logger.debug("Parsed contract for {}: {} requirements, {} ensures, alias '{}'",
                name, contract.getRequirements().size(), contract.getEnsures().size(), contract.getReturnAlias());
        return contract;
    }

    /**
     * Parses a single checked expression, keeping its text for reporting.
     *
     * @param declarationName Name used in error messages
     * @param kind The role of the expression
     * @param sourceText Java source of a boolean expression
     * @return The parsed expression
     * @throws MalformedContractException If the text is blank or not an expression
     */
    public ContractExpression parseExpression(String declarationName, ExpressionKind kind, String sourceText) {
        if (sourceText == null || sourceText.isBlank()) {
            throw new MalformedContractException(declarationName,
                    "empty " + kind.getDisplayName().toLowerCase() + " expression");
        }

        ParseResult<Expression> result = javaParser.parseExpression(sourceText);
        if (!result.isSuccessful() || result.getResult().isEmpty()) {
            String problems = result.getProblems().stream()
                    .map(Problem::getVerboseMessage)
                    .collect(Collectors.joining("; "));
            throw new MalformedContractException(declarationName,
                    "cannot parse " + kind.getDisplayName().toLowerCase() + " expression '" + sourceText + "': " + problems);
        }
        return new ContractExpression(kind, sourceText, result.getResult().get());
    }

    private void addExpressions(ContractDeclaration contract, String name, String annotationName, AnnotationExpr annotation) {
        ExpressionKind kind = annotationName.equals(REQUIRES) ? ExpressionKind.REQUIREMENT : ExpressionKind.ENSURE;
        List<String> texts = expressionTexts(name, annotation);
        if (texts.isEmpty()) {
            throw new MalformedContractException(name, "@" + annotationName + " declares no expression");
        }

        for (String text : texts) {
            ContractExpression expression = parseExpression(name, kind, text);
            if (kind == ExpressionKind.REQUIREMENT) {
                contract.addRequirement(expression);
            } else {
                contract.addEnsure(expression);
            }
        }
    }

    private String parseAlias(String name, AnnotationExpr annotation) {
        List<String> texts = expressionTexts(name, annotation);
        if (texts.size() != 1) {
            throw new MalformedContractException(name, "@ReturnAlias takes exactly one identifier");
        }
        String alias = texts.get(0).trim();
        if (!SourceVersion.isIdentifier(alias) || SourceVersion.isKeyword(alias)) {
            throw new MalformedContractException(name, "'" + alias + "' is not a valid return alias");
        }
        return alias;
    }

    /**
     * Reads the string values of an annotation: {@code "a"}, {@code {"a", "b"}} or {@code value = ...}.
     */
    private List<String> expressionTexts(String name, AnnotationExpr annotation) {
        Expression value = memberValue(annotation).orElse(null);
        if (value == null) {
            return List.of();
        }

        List<Expression> values = new ArrayList<>();
        if (value instanceof ArrayInitializerExpr) {
            values.addAll(((ArrayInitializerExpr) value).getValues());
        } else {
            values.add(value);
        }

        List<String> texts = new ArrayList<>();
        for (Expression element : values) {
            if (!(element instanceof StringLiteralExpr)) {
                throw new MalformedContractException(name,
                        "@" + annotation.getName().getIdentifier() + " values must be string literals, found " + element);
            }
            texts.add(((StringLiteralExpr) element).asString());
        }
        return texts;
    }

    private Optional<Expression> memberValue(AnnotationExpr annotation) {
        if (annotation instanceof SingleMemberAnnotationExpr) {
            return Optional.of(((SingleMemberAnnotationExpr) annotation).getMemberValue());
        }
        if (annotation instanceof NormalAnnotationExpr) {
            return ((NormalAnnotationExpr) annotation).getPairs().stream()
                    .filter(pair -> pair.getNameAsString().equals("value"))
                    .map(MemberValuePair::getValue)
                    .findFirst();
        }
        return Optional.empty();
    }

    private List<AnnotationExpr> containedAnnotations(String name, AnnotationExpr container) {
        List<AnnotationExpr> annotations = new ArrayList<>();
        Expression value = memberValue(container).orElse(null);
        if (value instanceof ArrayInitializerExpr) {
            for (Expression element : ((ArrayInitializerExpr) value).getValues()) {
                if (element instanceof AnnotationExpr) {
                    annotations.add((AnnotationExpr) element);
                }
            }
        } else if (value instanceof AnnotationExpr) {
            annotations.add((AnnotationExpr) value);
        }
        if (annotations.isEmpty()) {
            throw new MalformedContractException(name, "empty @" + container.getNameAsString());
        }
        return annotations;
    }

    /**
     * @return {@code Requires} or {@code Ensures} when the annotation is their repeatable container
     */
    private Optional<String> containerOf(AnnotationExpr annotation) {
        if (AnnotationNames.refersTo(annotation, REQUIRES + "." + CONTAINER)) {
            return Optional.of(REQUIRES);
        }
        if (AnnotationNames.refersTo(annotation, ENSURES + "." + CONTAINER)) {
            return Optional.of(ENSURES);
        }
        return Optional.empty();
    }

    private boolean isContractAnnotation(AnnotationExpr annotation) {
        return containerOf(annotation).isPresent()
                || AnnotationNames.refersTo(annotation, REQUIRES)
                || AnnotationNames.refersTo(annotation, ENSURES)
                || AnnotationNames.refersTo(annotation, RETURN_ALIAS);
    }

    private String describe(BodyDeclaration<?> declaration) {
        if (declaration instanceof CallableDeclaration) {
            return ((CallableDeclaration<?>) declaration).getNameAsString();
        }
        if (declaration instanceof FieldDeclaration) {
            return ((FieldDeclaration) declaration).getVariables().stream()
                    .map(variable -> variable.getNameAsString())
                    .collect(Collectors.joining(", "));
        }
        if (declaration instanceof TypeDeclaration) {
            return ((TypeDeclaration<?>) declaration).getNameAsString();
        }
        return declaration.getClass().getSimpleName();
    }
}
