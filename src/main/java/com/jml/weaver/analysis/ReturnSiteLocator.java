package com.jml.weaver.analysis;

import com.github.javaparser.ast.body.ConstructorDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.expr.LambdaExpr;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.stmt.LocalClassDeclarationStmt;
import com.github.javaparser.ast.stmt.LocalRecordDeclarationStmt;
import com.github.javaparser.ast.stmt.ReturnStmt;
import com.github.javaparser.ast.visitor.VoidVisitorAdapter;
import com.jml.weaver.model.ExitPoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Finds every place where control leaves a function body.
 *
 * Every return statement reachable through blocks, conditionals, loops, switch, try and
 * labeled statements is an exit point, in depth-first, left-to-right order. Returns that
 * belong to a nested function (lambda, local or anonymous class) are not. Reachability
 * is not considered: a return after an infinite loop still counts.
 *
 * When the body can complete normally, falling off its end is reported last as the
 * implicit exit point.
 */
public class ReturnSiteLocator {

    private static final Logger logger = LoggerFactory.getLogger(ReturnSiteLocator.class);

    private final CompletionAnalyzer completionAnalyzer;

    public ReturnSiteLocator() {
        this(new CompletionAnalyzer());
    }

    public ReturnSiteLocator(CompletionAnalyzer completionAnalyzer) {
        this.completionAnalyzer = completionAnalyzer;
    }

    /**
     * Locates the exit points of a function body.
     *
     * @param body The top-level block of the function
     * @return Exit points in traversal order, implicit exit last
     */
    public List<ExitPoint> locate(BlockStmt body) {
        List<ExitPoint> exitPoints = new ArrayList<>();
        body.accept(new ExitPointVisitor(), exitPoints);

        if (completionAnalyzer.canCompleteNormally(body)) {
            exitPoints.add(ExitPoint.implicit());
        }

        logger.debug("Located {} exit points", exitPoints.size());
        return exitPoints;
    }

    private static class ExitPointVisitor extends VoidVisitorAdapter<List<ExitPoint>> {

        @Override
        public void visit(ReturnStmt returnStmt, List<ExitPoint> exitPoints) {
            exitPoints.add(ExitPoint.explicit(returnStmt));
        }

        @Override
        public void visit(LambdaExpr lambdaExpr, List<ExitPoint> exitPoints) {
            // returns inside belong to the lambda
        }

        @Override
        public void visit(MethodDeclaration methodDecl, List<ExitPoint> exitPoints) {
            // anonymous and local class members
        }

        @Override
        public void visit(ConstructorDeclaration constructorDecl, List<ExitPoint> exitPoints) {
        }

        @Override
        public void visit(LocalClassDeclarationStmt localClass, List<ExitPoint> exitPoints) {
        }

        @Override
        public void visit(LocalRecordDeclarationStmt localRecord, List<ExitPoint> exitPoints) {
        }
    }
}
