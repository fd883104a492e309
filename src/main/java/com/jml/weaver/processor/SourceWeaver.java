package com.jml.weaver.processor;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.Problem;
import com.github.javaparser.ast.CompilationUnit;
import com.jml.weaver.SourceParseException;
import com.jml.weaver.analysis.ContractParser;
import com.jml.weaver.evaluation.WeavingMetrics;
import com.jml.weaver.visitor.ContractWeavingVisitor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Parses Java source and weaves its contracts and loop invariants.
 */
public class SourceWeaver {

    private static final Logger logger = LoggerFactory.getLogger(SourceWeaver.class);

    private final JavaParser javaParser;
    private final ContractParser contractParser;
    private final WeavingMetrics metrics;

    public SourceWeaver() {
        this(null);
    }

    /**
     * @param metrics Collector to record into, or null to skip metrics
     */
    public SourceWeaver(WeavingMetrics metrics) {
        ParserConfiguration parserConfig = new ParserConfiguration();
        parserConfig.setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17);
        this.javaParser = new JavaParser(parserConfig);
        this.contractParser = new ContractParser(javaParser);
        this.metrics = metrics;
    }

    /**
     * Parses source text and weaves it.
     *
     * @param source Java source of one compilation unit
     * @return The woven compilation unit
     * @throws SourceParseException If the source does not parse
     * @throws com.jml.weaver.MalformedContractException If a contract is malformed
     */
    public CompilationUnit weave(String source) {
        return weave(parse(source));
    }

    /**
     * Weaves a parsed compilation unit in place.
     *
     * @param compilationUnit The unit to weave
     * @return The same unit, woven
     */
    public CompilationUnit weave(CompilationUnit compilationUnit) {
        ContractWeavingVisitor visitor = new ContractWeavingVisitor(contractParser, metrics);
        visitor.visit(compilationUnit, null);

        if (visitor.hasModifications()) {
            logger.debug("Woven unit: {}", compilationUnit.getPrimaryTypeName().orElse("<unnamed>"));
        }
        return compilationUnit;
    }

    /**
     * Parses source text without weaving it.
     */
    public CompilationUnit parse(String source) {
        ParseResult<CompilationUnit> result = javaParser.parse(source);
        if (!result.isSuccessful() || result.getResult().isEmpty()) {
            throw new SourceParseException("Failed to parse source", describe(result.getProblems()));
        }
        return result.getResult().get();
    }

    private List<String> describe(List<Problem> problems) {
        return problems.stream().map(Problem::getVerboseMessage).collect(Collectors.toList());
    }
}
