package com.jml.weaver.model;

import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.type.Type;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The normalized contract of one method: its requirements and ensures in declared order,
 * the name under which ensures see the returned value, and the body they guard.
 */
public class ContractDeclaration {

    public static final String DEFAULT_RETURN_ALIAS = "result";

    private final String functionName;
    private final List<ContractExpression> requirements;
    private final List<ContractExpression> ensures;
    private final Type returnType;
    private final BlockStmt body;
    private String returnAlias = DEFAULT_RETURN_ALIAS;

    public ContractDeclaration(String functionName, Type returnType, BlockStmt body) {
        this.functionName = functionName;
        this.returnType = returnType;
        this.body = body;
        this.requirements = new ArrayList<>();
        this.ensures = new ArrayList<>();
    }

    public void addRequirement(ContractExpression requirement) {
        this.requirements.add(requirement);
    }

    public void addEnsure(ContractExpression ensure) {
        this.ensures.add(ensure);
    }

    public String getFunctionName() {
        return functionName;
    }

    public List<ContractExpression> getRequirements() {
        return Collections.unmodifiableList(requirements);
    }

    public List<ContractExpression> getEnsures() {
        return Collections.unmodifiableList(ensures);
    }

    public String getReturnAlias() {
        return returnAlias;
    }

    public void setReturnAlias(String returnAlias) {
        this.returnAlias = returnAlias;
    }

    public Type getReturnType() {
        return returnType;
    }

    public boolean returnsValue() {
        return !returnType.isVoidType();
    }

    /**
     * The original, pre-instrumented body. Never modified by weaving.
     */
    public BlockStmt getBody() {
        return body;
    }
}
