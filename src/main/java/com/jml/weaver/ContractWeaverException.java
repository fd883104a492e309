package com.jml.weaver;

/**
 * Base class of every failure raised by the weaver while parsing, transforming or compiling sources.
 * Contract violations raised by woven code at run time are not part of this hierarchy,
 * see {@link com.jml.weaver.runtime.ContractViolation}.
 */
public class ContractWeaverException extends RuntimeException {

    public ContractWeaverException(String message) {
        super(message);
    }

    public ContractWeaverException(String message, Throwable cause) {
        super(message, cause);
    }
}
