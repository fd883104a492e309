package com.jml.weaver.analysis;

import com.github.javaparser.ast.comments.BlockComment;
import com.github.javaparser.ast.comments.Comment;
import com.github.javaparser.ast.comments.LineComment;
import com.jml.weaver.model.ContractExpression;
import com.jml.weaver.runtime.ExpressionKind;

import java.util.Optional;

/**
 * Reads JML loop invariant annotations written as comments:
 * <pre>
 * //@ loop_invariant 0 <= i &amp;&amp; i <= values.length;
 * /*@ maintaining total >= 0; @*&#47;
 * </pre>
 * One expression per comment. Comments that are not JML annotations are ignored.
 */
public class LoopInvariantParser {

    private static final String[] KEYWORDS = {"loop_invariant", "maintaining"};

    private final ContractParser contractParser;

    public LoopInvariantParser(ContractParser contractParser) {
        this.contractParser = contractParser;
    }

    /**
     * Checks whether a comment is a loop invariant annotation, without parsing its expression.
     */
    public boolean isLoopInvariant(Comment comment) {
        return invariantText(comment).isPresent();
    }

    /**
     * Parses the invariant expression of a comment.
     *
     * @param functionName Enclosing function, used in error messages
     * @param comment The comment attached to a loop
     * @return The invariant, or empty if the comment is not a loop invariant annotation
     */
    public Optional<ContractExpression> parse(String functionName, Comment comment) {
        return invariantText(comment)
                .map(text -> contractParser.parseExpression(functionName, ExpressionKind.INVARIANT, text));
    }

    private Optional<String> invariantText(Comment comment) {
        if (!(comment instanceof LineComment) && !(comment instanceof BlockComment)) {
            return Optional.empty();
        }

        String content = comment.getContent().trim();
        if (!content.startsWith("@")) {
            return Optional.empty();
        }
        content = stripAtSigns(content);

        for (String keyword : KEYWORDS) {
            if (content.startsWith(keyword)
                    && (content.length() == keyword.length() || !Character.isJavaIdentifierPart(content.charAt(keyword.length())))) {
                String text = content.substring(keyword.length()).trim();
                while (text.endsWith(";")) {
                    text = text.substring(0, text.length() - 1).trim();
                }
                return Optional.of(text);
            }
        }
        return Optional.empty();
    }

    private String stripAtSigns(String content) {
        int start = 0;
        while (start < content.length() && content.charAt(start) == '@') {
            start++;
        }
        int end = content.length();
        while (end > start && content.charAt(end - 1) == '@') {
            end--;
        }
        return content.substring(start, end).trim();
    }
}
