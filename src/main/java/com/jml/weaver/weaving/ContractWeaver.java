package com.jml.weaver.weaving;

import com.github.javaparser.ast.Modifier;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.expr.VariableDeclarationExpr;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.stmt.ExpressionStmt;
import com.github.javaparser.ast.stmt.ReturnStmt;
import com.jml.weaver.analysis.ReturnSiteLocator;
import com.jml.weaver.model.ContractDeclaration;
import com.jml.weaver.model.ContractExpression;
import com.jml.weaver.model.ExitPoint;
import com.jml.weaver.model.WeavingResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Builds the instrumented body of a contracted method.
 *
 * Requirement checks are prepended in declared order. Every exit point of the original
 * body is rewritten so the returned value is first bound to the return alias, the ensure
 * checks run against that binding, and only then the value is returned:
 * <pre>
 * return a + b;   becomes   { final int result = a + b; if (!(result > 0)) { ...raise... } return result; }
 * </pre>
 * The binding lives in its own block, invisible to requirements and to the original body.
 */
public class ContractWeaver {

    private static final Logger logger = LoggerFactory.getLogger(ContractWeaver.class);

    private final ReturnSiteLocator returnSiteLocator;
    private final CheckFactory checkFactory;

    public ContractWeaver() {
        this(new ReturnSiteLocator(), new CheckFactory());
    }

    public ContractWeaver(ReturnSiteLocator returnSiteLocator, CheckFactory checkFactory) {
        this.returnSiteLocator = returnSiteLocator;
        this.checkFactory = checkFactory;
    }

    /**
     * Weaves a contract into a copy of its body. The declaration's own body is left intact.
     *
     * @param contract The parsed contract
     * @param instrumentationEnabled The toggle value, read once by the caller when the method is woven
     * @return The woven body and check counts
     */
    public WeavingResult weave(ContractDeclaration contract, boolean instrumentationEnabled) {
        BlockStmt body = contract.getBody().clone();

        if (!instrumentationEnabled) {
            logger.debug("Instrumentation disabled, {} emitted unchanged", contract.getFunctionName());
            return new WeavingResult(body, false, 0, 0, 0);
        }

        int ensureChecks = 0;
        int exitCount = 0;
        if (!contract.getEnsures().isEmpty()) {
            // Exit points come from the copy before any check is inserted
            List<ExitPoint> exitPoints = returnSiteLocator.locate(body);
            for (ExitPoint exitPoint : exitPoints) {
                if (weaveExit(contract, body, exitPoint)) {
                    exitCount++;
                    ensureChecks += contract.getEnsures().size();
                }
            }
        }

        List<ContractExpression> requirements = contract.getRequirements();
        for (int i = 0; i < requirements.size(); i++) {
            body.getStatements().add(i, checkFactory.createCheck(requirements.get(i), contract.getFunctionName()));
        }

        logger.debug("Wove {}: {} requirement checks, {} ensure checks over {} exit points",
                contract.getFunctionName(), requirements.size(), ensureChecks, exitCount);
        return new WeavingResult(body, true, requirements.size(), ensureChecks, exitCount);
    }

    private boolean weaveExit(ContractDeclaration contract, BlockStmt body, ExitPoint exitPoint) {
        if (exitPoint.isImplicit()) {
            if (contract.returnsValue()) {
                // a value-returning method cannot fall off its end
                logger.debug("Ignoring implicit exit of value-returning method {}", contract.getFunctionName());
                return false;
            }
            addEnsureChecks(contract, body);
            return true;
        }

        ReturnStmt returnStmt = exitPoint.getReturnStmt().get();
        BlockStmt replacement = new BlockStmt();

        if (exitPoint.getReturnedExpression().isPresent()) {
            Expression returned = exitPoint.getReturnedExpression().get().clone();
            VariableDeclarator binding = new VariableDeclarator(
                    contract.getReturnType().clone(), contract.getReturnAlias(), returned);
            replacement.addStatement(new ExpressionStmt(new VariableDeclarationExpr(binding, Modifier.finalModifier())));
            addEnsureChecks(contract, replacement);
            replacement.addStatement(new ReturnStmt(new NameExpr(contract.getReturnAlias())));
        } else {
            addEnsureChecks(contract, replacement);
            replacement.addStatement(new ReturnStmt());
        }

        returnStmt.replace(replacement);
        return true;
    }

    private void addEnsureChecks(ContractDeclaration contract, BlockStmt block) {
        for (ContractExpression ensure : contract.getEnsures()) {
            block.addStatement(checkFactory.createCheck(ensure, contract.getFunctionName()));
        }
    }
}
