package com.jml.weaver;

/**
 * Raised at transformation time when a contract annotation block, or a loop invariant
 * comment, cannot be turned into a contract. The affected method is never woven.
 */
public class MalformedContractException extends ContractWeaverException {

    private final String declarationName;
    private final String detail;

    public MalformedContractException(String declarationName, String detail) {
        super("Malformed contract on '" + declarationName + "': " + detail);
        this.declarationName = declarationName;
        this.detail = detail;
    }

    public String getDeclarationName() {
        return declarationName;
    }

    public String getDetail() {
        return detail;
    }
}
