package com.docvalidator.cli;

/**
 * Process exit codes shared by all commands.
 */
public final class ExitCodes {

    public static final int SUCCESS = 0;
    public static final int VALIDATION_FAILED = 1;
    public static final int INVOCATION_ERROR = 2;

    private ExitCodes() {
        throw new AssertionError("Utility class should not be instantiated");
    }
}
