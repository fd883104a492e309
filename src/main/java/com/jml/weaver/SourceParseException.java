package com.jml.weaver;

import java.util.List;

public class SourceParseException extends ContractWeaverException {

    private final List<String> problems;

    public SourceParseException(String message, List<String> problems) {
        super(message + ": " + String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }

    public List<String> getProblems() {
        return problems;
    }
}
