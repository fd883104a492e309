package com.jml.weaver;

public class WeavingCompileException extends ContractWeaverException {

    private final String generatedSource;
    private final String diagnostics;

    public WeavingCompileException(String message, String generatedSource, String diagnostics) {
        super(message);
        this.generatedSource = generatedSource;
        this.diagnostics = diagnostics;
    }

    public WeavingCompileException(String message, String generatedSource, String diagnostics, Throwable cause) {
        super(message, cause);
        this.generatedSource = generatedSource;
        this.diagnostics = diagnostics;
    }

    public String getGeneratedSource() {
        return generatedSource;
    }

    public String getDiagnostics() {
        return diagnostics;
    }
}
