package com.ethnicthv.btl.core.suite;

/**
 * Thrown when a subject type's suite is missing, declared twice, or cannot be built.
 */
public class SuiteDeclarationException extends RuntimeException {
    public SuiteDeclarationException(String message) {
        super(message);
    }
    public SuiteDeclarationException(String message, Throwable cause) {
        super(message, cause);
    }
}
