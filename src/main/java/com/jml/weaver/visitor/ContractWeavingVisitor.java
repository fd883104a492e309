package com.jml.weaver.visitor;

import com.github.javaparser.StaticJavaParser;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.body.BodyDeclaration;
import com.github.javaparser.ast.body.CallableDeclaration;
import com.github.javaparser.ast.body.ClassOrInterfaceDeclaration;
import com.github.javaparser.ast.body.ConstructorDeclaration;
import com.github.javaparser.ast.body.FieldDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.expr.*;
import com.github.javaparser.ast.visitor.VoidVisitorAdapter;
import com.jml.weaver.analysis.AnnotationNames;
import com.jml.weaver.analysis.ContractParser;
import com.jml.weaver.analysis.LoopInvariantParser;
import com.jml.weaver.evaluation.WeavingMetrics;
import com.jml.weaver.model.ContractDeclaration;
import com.jml.weaver.model.WeavingResult;
import com.jml.weaver.weaving.ContractWeaver;
import com.jml.weaver.weaving.InstrumentationToggle;
import com.jml.weaver.weaving.LoopInvariantInjector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * AST Visitor that weaves contracts and loop invariants into every method of a compilation unit.
 *
 * For each method carrying {@code @Requires}, {@code @Ensures} or {@code @ReturnAlias}, the
 * contract is parsed, the instrumentation toggle is read once, and the woven body replaces
 * the original one. Loop invariant comments are then expanded in methods and constructors.
 * Instrumented declarations are marked {@code @Woven} and skipped on later passes.
 */
public class ContractWeavingVisitor extends VoidVisitorAdapter<Void> {

    private static final Logger logger = LoggerFactory.getLogger(ContractWeavingVisitor.class);

    static final String WOVEN_ANNOTATION = AnnotationNames.PACKAGE + ".Woven";
    private static final String WOVEN = "Woven";
    private static final String SKIP_WEAVING = "SkipWeaving";

    private final ContractParser contractParser;
    private final ContractWeaver contractWeaver;
    private final LoopInvariantInjector loopInvariantInjector;
    private final WeavingMetrics metrics;
    private boolean hasModifications = false;

    public ContractWeavingVisitor() {
        this(new ContractParser(), null);
    }

    public ContractWeavingVisitor(ContractParser contractParser, WeavingMetrics metrics) {
        this.contractParser = contractParser;
        this.contractWeaver = new ContractWeaver();
        this.loopInvariantInjector = new LoopInvariantInjector(new LoopInvariantParser(contractParser));
        this.metrics = metrics;
    }

    @Override
    public void visit(ClassOrInterfaceDeclaration classDecl, Void arg) {
        if (isSkipped(classDecl)) {
            logger.debug("Skipping class {} marked @SkipWeaving", classDecl.getNameAsString());
            return;
        }
        if (metrics != null) {
            metrics.recordClass();
        }
        super.visit(classDecl, arg);
    }

    @Override
    public void visit(MethodDeclaration methodDecl, Void arg) {
        // nested local and anonymous classes are woven first, their loops stay theirs
        super.visit(methodDecl, arg);

        if (!shouldProcess(methodDecl)) {
            return;
        }
        if (metrics != null) {
            metrics.recordMethod();
        }

        boolean contracted = contractParser.hasContract(methodDecl);
        boolean contractsEmitted = false;
        if (contracted) {
            ContractDeclaration contract = contractParser.parse(methodDecl);
            boolean enabled = InstrumentationToggle.isInstrumentationEnabled();
            WeavingResult result = contractWeaver.weave(contract, enabled);
            methodDecl.setBody(result.getBody());
            contractsEmitted = result.isInstrumented();
            if (metrics != null) {
                metrics.recordContract(result);
            }
            logger.info("Wove contract into method: {} ({} requirement checks, {} ensure checks)",
                    methodDecl.getNameAsString(), result.getRequirementChecks(), result.getEnsureChecks());
        }

        int invariantChecks = loopInvariantInjector.inject(methodDecl);
        if (invariantChecks > 0 && metrics != null) {
            metrics.recordLoopInvariantChecks(invariantChecks);
        }

        if (contracted || invariantChecks > 0) {
            markWoven(methodDecl, contractsEmitted);
        }
    }

    @Override
    public void visit(ConstructorDeclaration constructorDecl, Void arg) {
        super.visit(constructorDecl, arg);

        if (isSkipped(constructorDecl) || isWoven(constructorDecl)) {
            return;
        }
        if (contractParser.hasContract(constructorDecl)) {
            // always throws: a constructor is not a function with a result
            contractParser.parse(constructorDecl);
        }

        int invariantChecks = loopInvariantInjector.inject(constructorDecl);
        if (invariantChecks > 0) {
            if (metrics != null) {
                metrics.recordLoopInvariantChecks(invariantChecks);
            }
            markWoven(constructorDecl, false);
        }
    }

    @Override
    public void visit(FieldDeclaration fieldDecl, Void arg) {
        if (contractParser.hasContract(fieldDecl)) {
            contractParser.parse(fieldDecl);
        }
        super.visit(fieldDecl, arg);
    }

    /**
     * Determines if a method should be woven.
     *
     * @param methodDecl The method declaration
     * @return true if the method has a body, is not already woven and is not skipped
     */
    private boolean shouldProcess(MethodDeclaration methodDecl) {
        if (isWoven(methodDecl)) {
            logger.debug("Method {} already woven, skipping", methodDecl.getNameAsString());
            return false;
        }
        if (isSkipped(methodDecl)) {
            logger.debug("Method {} marked @SkipWeaving, skipping", methodDecl.getNameAsString());
            return false;
        }
        if (methodDecl.getBody().isEmpty()) {
            // contract annotations on a bodiless method are reported by the parser
            if (contractParser.hasContract(methodDecl)) {
                contractParser.parse(methodDecl);
            }
            return false;
        }
        return true;
    }

    private boolean isWoven(BodyDeclaration<?> declaration) {
        return hasAnnotation(declaration, WOVEN);
    }

    private boolean isSkipped(BodyDeclaration<?> declaration) {
        Node node = declaration;
        while (node != null) {
            if (node instanceof BodyDeclaration && hasAnnotation((BodyDeclaration<?>) node, SKIP_WEAVING)) {
                return true;
            }
            node = node.getParentNode().orElse(null);
        }
        return false;
    }

    private boolean hasAnnotation(BodyDeclaration<?> declaration, String simpleName) {
        return declaration.getAnnotations().stream()
                .anyMatch(annotation -> AnnotationNames.refersTo(annotation, simpleName));
    }

    private void markWoven(CallableDeclaration<?> callable, boolean contracts) {
        NodeList<MemberValuePair> pairs = new NodeList<>();
        pairs.add(new MemberValuePair("contracts", new BooleanLiteralExpr(contracts)));
        callable.addAnnotation(new NormalAnnotationExpr(StaticJavaParser.parseName(WOVEN_ANNOTATION), pairs));
        hasModifications = true;
    }

    public boolean hasModifications() {
        return hasModifications;
    }
}
