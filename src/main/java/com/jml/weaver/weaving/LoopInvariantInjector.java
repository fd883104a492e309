package com.jml.weaver.weaving;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.body.CallableDeclaration;
import com.github.javaparser.ast.comments.Comment;
import com.github.javaparser.ast.nodeTypes.NodeWithBody;
import com.github.javaparser.ast.stmt.*;
import com.jml.weaver.MalformedContractException;
import com.jml.weaver.analysis.CompletionAnalyzer;
import com.jml.weaver.analysis.LoopInvariantParser;
import com.jml.weaver.model.ContractExpression;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Injects loop invariant checks around the top-level statements of annotated loops.
 *
 * For a loop whose body holds statements s1..sn, the invariant is checked once before the
 * loop, then before and after every si. The check after si and the one before si+1 are
 * both kept. Statements nested in blocks, conditionals or inner loops of the body are not
 * instrumented, so a loop of n top-level statements costs 2n + 1 checks per pass.
 *
 * A check after a statement that cannot complete normally ({@code break}, {@code return},
 * ...) would be unreachable and is left out.
 *
 * Invariant checks are emitted whatever the state of {@link InstrumentationToggle}.
 */
public class LoopInvariantInjector {

    private static final Logger logger = LoggerFactory.getLogger(LoopInvariantInjector.class);

    private final LoopInvariantParser invariantParser;
    private final CompletionAnalyzer completionAnalyzer;
    private final CheckFactory checkFactory;

    public LoopInvariantInjector(LoopInvariantParser invariantParser) {
        this(invariantParser, new CompletionAnalyzer(), new CheckFactory());
    }

    public LoopInvariantInjector(LoopInvariantParser invariantParser, CompletionAnalyzer completionAnalyzer,
                                 CheckFactory checkFactory) {
        this.invariantParser = invariantParser;
        this.completionAnalyzer = completionAnalyzer;
        this.checkFactory = checkFactory;
    }

    /**
     * Instruments every loop of a method or constructor that carries a loop invariant comment.
     * Loops of nested local or anonymous classes are left to their own declaration.
     *
     * @param callable The method or constructor, modified in place
     * @return The number of checks injected
     * @throws MalformedContractException If an invariant comment is not attached to a loop
     *         or its expression does not parse
     */
    public int inject(CallableDeclaration<?> callable) {
        String functionName = callable.getNameAsString();

        List<Statement> anchors = new ArrayList<>();
        List<ContractExpression> invariants = new ArrayList<>();
        for (Comment comment : callable.getAllContainedComments()) {
            if (!invariantParser.isLoopInvariant(comment) || !belongsTo(comment, callable)) {
                continue;
            }

            Node commented = comment.getCommentedNode().orElse(null);
            if (!(commented instanceof Statement) || loopOf((Statement) commented) == null) {
                throw new MalformedContractException(functionName,
                        "loop invariant '" + comment.getContent().trim() + "' is not attached to a loop");
            }
            anchors.add((Statement) commented);
            invariants.add(invariantParser.parse(functionName, comment).get());
        }

        int checks = 0;
        for (int i = 0; i < anchors.size(); i++) {
            checks += instrument(anchors.get(i), invariants.get(i), functionName);
        }
        if (checks > 0) {
            logger.debug("Injected {} loop invariant checks into {}", checks, functionName);
        }
        return checks;
    }

    /**
     * Instruments one loop with one invariant.
     *
     * @param anchor The loop, or the labeled statement wrapping it
     * @param invariant The invariant to check
     * @param functionName The function named in violations
     * @return The number of checks injected
     */
    public int instrument(Statement anchor, ContractExpression invariant, String functionName) {
        Statement loop = loopOf(anchor);
        if (loop == null) {
            throw new MalformedContractException(functionName, "loop invariant target is not a loop: " + anchor);
        }

        insertBefore(anchor, checkFactory.createCheck(invariant, functionName));
        int checks = 1;

        BlockStmt body = blockBodyOf(loop);
        List<Statement> original = new ArrayList<>(body.getStatements());
        NodeList<Statement> instrumented = new NodeList<>();
        for (Statement statement : original) {
            instrumented.add(checkFactory.createCheck(invariant, functionName));
            checks++;
            instrumented.add(statement);
            if (completionAnalyzer.canCompleteNormally(statement)) {
                instrumented.add(checkFactory.createCheck(invariant, functionName));
                checks++;
            }
        }
        body.setStatements(instrumented);
        return checks;
    }

    private boolean belongsTo(Comment comment, CallableDeclaration<?> callable) {
        Node node = comment.getCommentedNode().orElse(comment.getParentNode().orElse(null));
        while (node != null) {
            if (node instanceof CallableDeclaration) {
                return node == callable;
            }
            node = node.getParentNode().orElse(null);
        }
        return false;
    }

    private Statement loopOf(Statement anchor) {
        Statement statement = anchor;
        while (statement instanceof LabeledStmt) {
            statement = ((LabeledStmt) statement).getStatement();
        }
        if (statement instanceof WhileStmt || statement instanceof DoStmt
                || statement instanceof ForStmt || statement instanceof ForEachStmt) {
            return statement;
        }
        return null;
    }

    /**
     * Returns the body of a loop as a block, turning a single-statement body into one.
     */
    private BlockStmt blockBodyOf(Statement loop) {
        Statement body = ((NodeWithBody<?>) loop).getBody();
        if (body instanceof BlockStmt) {
            return (BlockStmt) body;
        }
        BlockStmt block = new BlockStmt();
        ((NodeWithBody<?>) loop).setBody(block);
        block.addStatement(body);
        return block;
    }

    private void insertBefore(Statement anchor, Statement check) {
        Node parent = anchor.getParentNode().orElse(null);
        NodeList<Statement> siblings = null;
        if (parent instanceof BlockStmt) {
            siblings = ((BlockStmt) parent).getStatements();
        } else if (parent instanceof SwitchEntry) {
            siblings = ((SwitchEntry) parent).getStatements();
        }

        if (siblings != null) {
            siblings.add(indexOf(siblings, anchor), check);
            return;
        }

        // Loop used as a single statement, e.g. the branch of an if
        BlockStmt wrapper = new BlockStmt();
        anchor.replace(wrapper);
        wrapper.addStatement(check);
        wrapper.addStatement(anchor);
    }

    private int indexOf(NodeList<Statement> statements, Statement target) {
        // NodeList.indexOf compares structurally; two equal loops must not be confused
        for (int i = 0; i < statements.size(); i++) {
            if (statements.get(i) == target) {
                return i;
            }
        }
        throw new IllegalStateException("Statement not found in its parent: " + target);
    }
}
